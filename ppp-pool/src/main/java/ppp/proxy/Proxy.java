/*
 * Copyright (c) 2025-2026 The ppp-pool Authors, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ppp.proxy;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import org.jspecify.annotations.Nullable;
import reactor.core.Disposable;
import reactor.util.Logger;
import reactor.util.Loggers;

import ppp.pool.InvalidConfigurationException;
import ppp.pool.Pool;
import ppp.pool.PoolAcquireTimeoutException;
import ppp.pool.PoolBuilder;
import ppp.pool.PoolCreationException;
import ppp.pool.PoolableFactory;

/**
 * A forwarding handle to an object that is either shared by everyone, or lazily borrowed from a {@link Pool}
 * and bound to the current execution context (a thread, or a task identified by a context key) until
 * {@link #release() released}.
 * <p>
 * A {@link Proxy} is configured once, through {@link #set(Object)}, {@link #setPool(Pool)} or
 * {@link #setFactory(PoolableFactory)}, and resolves its binding on first use. Any attempt at rebinding it
 * afterwards fails with an {@link InvalidConfigurationException}.
 * <p>
 * Subclasses typically implement the interface of the wrapped object by forwarding each call to
 * {@link #delegate()}:
 * <pre>
 * class ConnectionProxy extends Proxy&lt;Connection&gt; implements Connection {
 *     public void send(byte[] payload) {
 *         delegate().send(payload);
 *     }
 * }
 * </pre>
 *
 * @param <T> the type of the wrapped object
 */
public class Proxy<T> implements Disposable {

	static final Logger log = Loggers.getLogger(Proxy.class);

	/**
	 * Create a {@link ProxyScope#SHARED} proxy to a single thread-safe object.
	 */
	public static <T> Proxy<T> shared(T object) {
		return new Proxy<T>(ProxyScope.SHARED).set(object);
	}

	/**
	 * Create a {@link ProxyScope#THREAD} proxy that lends objects from the given {@link Pool}.
	 * The pool is not disposed along with the proxy.
	 */
	public static <T> Proxy<T> perThread(Pool<T> pool) {
		return new Proxy<T>(ProxyScope.THREAD).setPool(pool);
	}

	/**
	 * Create a {@link ProxyScope#TASK} proxy that lends objects from the given {@link Pool}, one per
	 * distinct value returned by {@code contextKey}. The pool is not disposed along with the proxy.
	 */
	public static <T> Proxy<T> perTask(Pool<T> pool, Supplier<?> contextKey) {
		return new Proxy<T>(ProxyScope.TASK).contextKey(contextKey).setPool(pool);
	}

	/**
	 * Create a {@link ProxyScope#THREAD} proxy backed by a pool of its own, built from the
	 * {@code factory} on first use and disposed along with the proxy.
	 */
	public static <T> Proxy<T> ofFactory(PoolableFactory<? extends T> factory) {
		return new Proxy<T>().setFactory(factory);
	}

	final @Nullable ProxyScope requestedScope;

	//configuration, guarded by this
	@Nullable T                             object;
	@Nullable Pool<T>                       pool;
	@Nullable PoolableFactory<? extends T>  factory;
	@Nullable Supplier<?>                   contextKey;
	UnaryOperator<PoolBuilder<T>>           poolOptions = UnaryOperator.identity();

	volatile @Nullable Binding<T> binding;
	volatile boolean              disposed;

	/**
	 * Create a proxy whose scope is inferred from its binding: {@link ProxyScope#SHARED} for an object,
	 * {@link ProxyScope#TASK} for a pool or factory with a {@link #contextKey(Supplier) context key},
	 * {@link ProxyScope#THREAD} otherwise.
	 */
	public Proxy() {
		this.requestedScope = null;
	}

	public Proxy(ProxyScope scope) {
		this.requestedScope = Objects.requireNonNull(scope, "scope");
	}

	// == configuration ==

	/**
	 * Bind a single shared object.
	 *
	 * @param object the object every context forwards to
	 * @return this proxy
	 * @throws InvalidConfigurationException if a pool or factory is already bound, if the scope is not
	 * {@link ProxyScope#SHARED} or if the proxy was already used
	 */
	public synchronized Proxy<T> set(T object) {
		Objects.requireNonNull(object, "object");
		checkNotResolved();
		if (pool != null || factory != null) {
			throw new InvalidConfigurationException("Proxy cannot be bound to both an object and a pool");
		}
		if (requestedScope != null && requestedScope != ProxyScope.SHARED) {
			throw new InvalidConfigurationException("Proxy with " + requestedScope + " scope cannot be bound to a single object");
		}
		this.object = object;
		return this;
	}

	/**
	 * Bind an external {@link Pool}, which the proxy borrows from but doesn't dispose.
	 *
	 * @param pool the pool to borrow objects from
	 * @return this proxy
	 * @throws InvalidConfigurationException if an object or factory is already bound, if the scope is
	 * {@link ProxyScope#SHARED} or if the proxy was already used
	 */
	public synchronized Proxy<T> setPool(Pool<T> pool) {
		Objects.requireNonNull(pool, "pool");
		checkPooledBinding();
		if (factory != null) {
			throw new InvalidConfigurationException("Proxy cannot be bound to both a pool and a factory");
		}
		this.pool = pool;
		return this;
	}

	/**
	 * Bind a factory from which the proxy builds a pool of its own on first use. That pool can be
	 * tuned through {@link #poolOptions(UnaryOperator)} and is disposed along with the proxy.
	 *
	 * @param factory the factory of the owned pool
	 * @return this proxy
	 * @throws InvalidConfigurationException if an object or pool is already bound, if the scope is
	 * {@link ProxyScope#SHARED} or if the proxy was already used
	 */
	public synchronized Proxy<T> setFactory(PoolableFactory<? extends T> factory) {
		Objects.requireNonNull(factory, "factory");
		checkPooledBinding();
		if (pool != null) {
			throw new InvalidConfigurationException("Proxy cannot be bound to both a pool and a factory");
		}
		this.factory = factory;
		return this;
	}

	/**
	 * Customize the pool built from the {@link #setFactory(PoolableFactory) factory}.
	 *
	 * @param poolOptions a function applying options to the {@link PoolBuilder}
	 * @return this proxy
	 */
	public synchronized Proxy<T> poolOptions(UnaryOperator<PoolBuilder<T>> poolOptions) {
		checkNotResolved();
		this.poolOptions = Objects.requireNonNull(poolOptions, "poolOptions");
		return this;
	}

	/**
	 * Set the supplier of the current execution context key for {@link ProxyScope#TASK} proxies.
	 *
	 * @param contextKey supplier of a non-null key identifying the current task
	 * @return this proxy
	 */
	public synchronized Proxy<T> contextKey(Supplier<?> contextKey) {
		checkNotResolved();
		if (requestedScope != null && requestedScope != ProxyScope.TASK) {
			throw new InvalidConfigurationException("A context key only applies to TASK scope, not " + requestedScope);
		}
		this.contextKey = Objects.requireNonNull(contextKey, "contextKey");
		return this;
	}

	private void checkPooledBinding() {
		checkNotResolved();
		if (object != null) {
			throw new InvalidConfigurationException("Proxy cannot be bound to both an object and a pool");
		}
		if (requestedScope == ProxyScope.SHARED) {
			throw new InvalidConfigurationException("Proxy with SHARED scope must be bound to a single object");
		}
	}

	private void checkNotResolved() {
		if (binding != null) {
			throw new InvalidConfigurationException("Proxy cannot be rebound once it has been used");
		}
		if (disposed) {
			throw new InvalidConfigurationException("Proxy has been disposed");
		}
	}

	// == forwarding ==

	/**
	 * Return the object bound to the current context, borrowing one from the pool if there is none yet.
	 *
	 * @return the bound object
	 * @throws InvalidConfigurationException if nothing was bound to this proxy
	 * @throws PoolAcquireTimeoutException if the pool had no capacity left in time
	 * @throws PoolCreationException if the pool failed to create a new object
	 */
	public T get() {
		return get(null);
	}

	/**
	 * Return the object bound to the current context, borrowing one from the pool if there is none yet,
	 * waiting at most {@code timeout} for the pool to have capacity.
	 * <p>
	 * The bound object is returned as is: if the pool reclaimed it because it stayed borrowed past the
	 * pool's {@code maxBorrowKill}, it has already been destroyed and stays bound until {@link #release()}
	 * clears the context. The next call after that borrows a fresh object.
	 *
	 * @param timeout the maximum time to wait for the pool, {@link Duration#ZERO} for no limit
	 * @return the bound object
	 * @throws InvalidConfigurationException if nothing was bound to this proxy
	 * @throws PoolAcquireTimeoutException if the pool had no capacity left in time
	 * @throws PoolCreationException if the pool failed to create a new object
	 */
	public T get(@Nullable Duration timeout) {
		Binding<T> b = resolve();
		if (b.shared != null) {
			return b.shared;
		}
		ContextSlot<T> slot = Objects.requireNonNull(b.slot, "slot");
		Pool<T> p = Objects.requireNonNull(b.pool, "pool");
		T current = slot.get();
		if (current != null) {
			return current;
		}
		T acquired = timeout == null ? p.acquire() : p.acquire(timeout);
		slot.set(acquired);
		return acquired;
	}

	/**
	 * The object to forward calls to, for the benefit of subclasses implementing the wrapped interface.
	 * Subject to the same caveat as {@link #get(Duration)} when the pool forcibly reclaims a long borrowed
	 * object.
	 *
	 * @return the object bound to the current context
	 */
	protected T delegate() {
		return get();
	}

	/**
	 * Give the object bound to the current context back to the pool, if any. This is a no-op for
	 * {@link ProxyScope#SHARED} proxies and for contexts that have nothing bound.
	 *
	 * @throws InvalidConfigurationException if nothing was ever bound to this proxy
	 */
	public void release() {
		Binding<T> b = this.binding;
		if (b == null) {
			synchronized (this) {
				if (object == null && pool == null && factory == null) {
					throw new InvalidConfigurationException("Proxy cannot be released as it was never bound");
				}
			}
			return;
		}
		if (b.slot == null || b.pool == null) {
			return;
		}
		T bound = b.slot.clear();
		if (bound != null) {
			b.pool.release(bound);
		}
	}

	/**
	 * Apply the {@code scopeFunction} to the object bound to the current context. If this call is the one
	 * that bound it, the object is {@link #release() released} once the function returns or throws;
	 * otherwise it stays bound for the enclosing scope.
	 *
	 * @param scopeFunction the work to perform with the object
	 * @param <V> the type of the result
	 * @return the result of the {@code scopeFunction}
	 */
	public <V> V withObject(Function<? super T, V> scopeFunction) {
		boolean alreadyBound = isBound();
		T target = get();
		try {
			return scopeFunction.apply(target);
		}
		finally {
			if (!alreadyBound) {
				release();
			}
		}
	}

	// == introspection ==

	/**
	 * @return true if an object is currently bound to the calling context
	 */
	public boolean isBound() {
		Binding<T> b = this.binding;
		if (b == null) {
			synchronized (this) {
				return object != null;
			}
		}
		return b.shared != null || (b.slot != null && b.slot.get() != null);
	}

	/**
	 * @return the effective scope of this proxy, inferred from its configuration if not explicitly set
	 */
	public ProxyScope scope() {
		Binding<T> b = this.binding;
		if (b != null) {
			return b.scope;
		}
		synchronized (this) {
			return effectiveScope();
		}
	}

	/**
	 * @return the pool this proxy borrows from, if it is pooled and the pool is known yet
	 */
	public Optional<Pool<T>> pool() {
		Binding<T> b = this.binding;
		if (b != null) {
			return Optional.ofNullable(b.pool);
		}
		synchronized (this) {
			return Optional.ofNullable(pool);
		}
	}

	/**
	 * Release the object bound to the calling context, and dispose the pool if it was built by
	 * this proxy from a {@link #setFactory(PoolableFactory) factory}.
	 */
	@Override
	public void dispose() {
		Binding<T> b;
		synchronized (this) {
			if (disposed) {
				return;
			}
			disposed = true;
			b = this.binding;
		}
		if (b == null) {
			return;
		}
		if (b.slot != null && b.pool != null && !b.pool.isDisposed()) {
			T bound = b.slot.clear();
			if (bound != null) {
				b.pool.release(bound);
			}
		}
		if (b.ownsPool && b.pool != null) {
			b.pool.dispose();
			log.debug("Disposed pool owned by {}", this);
		}
	}

	@Override
	public boolean isDisposed() {
		return disposed;
	}

	@Override
	public String toString() {
		return "Proxy{scope=" + scope() + ", resolved=" + (binding != null) + '}';
	}

	// == resolution ==

	Binding<T> resolve() {
		Binding<T> b = this.binding;
		if (b != null) {
			return b;
		}
		synchronized (this) {
			b = this.binding;
			if (b != null) {
				return b;
			}
			if (disposed) {
				throw new InvalidConfigurationException("Proxy has been disposed");
			}
			ProxyScope scope = effectiveScope();
			if (object != null) {
				b = new Binding<>(scope, object, null, null, false);
			}
			else if (pool != null || factory != null) {
				ContextSlot<T> slot;
				if (scope == ProxyScope.TASK) {
					if (contextKey == null) {
						throw new InvalidConfigurationException("TASK scoped proxy requires a context key");
					}
					slot = ContextSlot.perTask(contextKey);
				}
				else {
					slot = ContextSlot.perThread();
				}
				boolean owned = pool == null;
				Pool<T> p = owned ? buildPool(Objects.requireNonNull(factory, "factory")) : pool;
				b = new Binding<>(scope, null, p, slot, owned);
			}
			else {
				throw new InvalidConfigurationException("Proxy has neither an object nor a pool bound");
			}
			this.binding = b;
			log.debug("Resolved {} binding with {}", scope, b.pool == null ? "a shared object" : b.pool);
			return b;
		}
	}

	private Pool<T> buildPool(PoolableFactory<? extends T> factory) {
		PoolBuilder<T> builder = Objects.requireNonNull(poolOptions.apply(PoolBuilder.from(factory)),
				"poolOptions returned null");
		return builder.buildPool();
	}

	//guarded by this
	private ProxyScope effectiveScope() {
		if (requestedScope != null) {
			return requestedScope;
		}
		if (object != null) {
			return ProxyScope.SHARED;
		}
		return contextKey != null ? ProxyScope.TASK : ProxyScope.THREAD;
	}

	static final class Binding<T> {

		final ProxyScope               scope;
		final @Nullable T              shared;
		final @Nullable Pool<T>        pool;
		final @Nullable ContextSlot<T> slot;
		final boolean                  ownsPool;

		Binding(ProxyScope scope, @Nullable T shared, @Nullable Pool<T> pool, @Nullable ContextSlot<T> slot, boolean ownsPool) {
			this.scope = scope;
			this.shared = shared;
			this.pool = pool;
			this.slot = slot;
			this.ownsPool = ownsPool;
		}
	}
}
