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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import reactor.core.Disposable;
import reactor.test.scheduler.VirtualTimeScheduler;

import ppp.pool.InstrumentedPool;
import ppp.pool.InvalidConfigurationException;
import ppp.pool.Pool;
import ppp.pool.PoolAcquireTimeoutException;
import ppp.pool.PoolBuilder;
import ppp.pool.TestUtils.VirtualClock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;
import static org.assertj.core.api.Assertions.assertThatNoException;

class ProxyTest {

	InstrumentedPool<Counter> pool;

	@BeforeEach
	void init() {
		pool = PoolBuilder.from(Counter::new)
		                  .name("proxied")
		                  .sizeBetween(0, 2)
		                  .housekeepingDisabled()
		                  .buildPool();
	}

	@AfterEach
	void cleanup() {
		pool.dispose();
	}

	@Test
	void sharedProxyForwardsSameObjectEverywhere() throws Exception {
		Counter counter = new Counter(0);
		Proxy<Counter> proxy = Proxy.shared(counter);

		Counter fromOtherThread = CompletableFuture.supplyAsync(proxy::get).get(5, TimeUnit.SECONDS);

		assertThat(proxy.get()).isSameAs(counter);
		assertThat(fromOtherThread).isSameAs(counter);
		assertThat(proxy.scope()).isEqualTo(ProxyScope.SHARED);
		assertThat(proxy.isBound()).isTrue();
		assertThat(proxy.pool()).isEmpty();

		proxy.release();
		assertThat(proxy.get()).as("release is a no-op for shared proxies").isSameAs(counter);
	}

	@Test
	void threadProxyBindsOneObjectPerThread() throws Exception {
		Proxy<Counter> proxy = Proxy.perThread(pool);
		ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			Counter mine = proxy.get();
			assertThat(proxy.get()).as("stable within a thread").isSameAs(mine);

			Counter theirs = executor.submit(() -> proxy.get()).get(5, TimeUnit.SECONDS);

			assertThat(theirs).isNotSameAs(mine);
			assertThat(pool.metrics().acquiredSize()).isEqualTo(2);

			proxy.release();
			assertThat(proxy.isBound()).isFalse();
			assertThat(pool.metrics().acquiredSize()).isOne();

			executor.submit(proxy::release).get(5, TimeUnit.SECONDS);
			assertThat(pool.metrics().acquiredSize()).isZero();
			assertThat(pool.metrics().idleSize()).isEqualTo(2);
		}
		finally {
			executor.shutdownNow();
		}
	}

	@Test
	void taskProxyBindsOneObjectPerContextKey() {
		AtomicReference<String> currentTask = new AtomicReference<>("a");
		Proxy<Counter> proxy = Proxy.perTask(pool, currentTask::get);

		Counter forA = proxy.get();
		currentTask.set("b");
		Counter forB = proxy.get();
		currentTask.set("a");

		assertThat(forB).isNotSameAs(forA);
		assertThat(proxy.get()).isSameAs(forA);
		assertThat(proxy.scope()).isEqualTo(ProxyScope.TASK);

		proxy.release();
		assertThat(pool.metrics().acquiredSize()).isOne();
		currentTask.set("b");
		assertThat(proxy.isBound()).isTrue();
	}

	@Test
	void taskProxyOutsideOfTaskFails() {
		Proxy<Counter> proxy = Proxy.perTask(pool, () -> null);

		assertThatExceptionOfType(InvalidConfigurationException.class)
				.isThrownBy(proxy::get)
				.withMessageContaining("context key is null");
	}

	@Test
	void taskScopeRequiresContextKey() {
		Proxy<Counter> proxy = new Proxy<Counter>(ProxyScope.TASK).setPool(pool);

		assertThatExceptionOfType(InvalidConfigurationException.class)
				.isThrownBy(proxy::get)
				.withMessage("TASK scoped proxy requires a context key");
	}

	@Test
	void scopeIsInferredFromBinding() {
		assertThat(new Proxy<Counter>().set(new Counter(0)).scope()).isEqualTo(ProxyScope.SHARED);
		assertThat(new Proxy<Counter>().setPool(pool).scope()).isEqualTo(ProxyScope.THREAD);
		assertThat(new Proxy<Counter>().contextKey(() -> "k").setPool(pool).scope()).isEqualTo(ProxyScope.TASK);
	}

	@Test
	void objectAndPoolAreMutuallyExclusive() {
		assertThatExceptionOfType(InvalidConfigurationException.class)
				.isThrownBy(() -> new Proxy<Counter>().set(new Counter(0)).setPool(pool))
				.withMessage("Proxy cannot be bound to both an object and a pool");
		assertThatExceptionOfType(InvalidConfigurationException.class)
				.isThrownBy(() -> new Proxy<Counter>().setPool(pool).set(new Counter(0)))
				.withMessage("Proxy cannot be bound to both an object and a pool");
		assertThatExceptionOfType(InvalidConfigurationException.class)
				.isThrownBy(() -> new Proxy<Counter>(ProxyScope.SHARED).setPool(pool));
		assertThatExceptionOfType(InvalidConfigurationException.class)
				.isThrownBy(() -> new Proxy<Counter>(ProxyScope.THREAD).set(new Counter(0)));
	}

	@Test
	void cannotRebindOnceUsed() {
		Proxy<Counter> proxy = Proxy.perThread(pool);
		proxy.get();

		assertThatExceptionOfType(InvalidConfigurationException.class)
				.isThrownBy(() -> proxy.setPool(pool))
				.withMessage("Proxy cannot be rebound once it has been used");
		proxy.release();
	}

	@Test
	void unboundProxyCannotBeUsed() {
		Proxy<Counter> proxy = new Proxy<>();

		assertThatExceptionOfType(InvalidConfigurationException.class)
				.isThrownBy(proxy::get)
				.withMessage("Proxy has neither an object nor a pool bound");
		assertThatExceptionOfType(InvalidConfigurationException.class)
				.isThrownBy(proxy::release)
				.withMessage("Proxy cannot be released as it was never bound");
	}

	@Test
	void releaseWithoutBoundObjectIsNoOp() {
		Proxy<Counter> proxy = Proxy.perThread(pool);

		assertThatNoException().isThrownBy(proxy::release);
		proxy.get();
		proxy.release();
		assertThatNoException().isThrownBy(proxy::release);
		assertThat(pool.stats().getReturns()).isOne();
	}

	@Test
	void withObjectReleasesOnlyWhatItBound() {
		Proxy<Counter> proxy = Proxy.perThread(pool);

		int value = proxy.withObject(c -> c.increment());
		assertThat(value).isOne();
		assertThat(proxy.isBound()).isFalse();
		assertThat(pool.metrics().acquiredSize()).isZero();

		Counter outer = proxy.get();
		proxy.withObject(inner -> {
			assertThat(inner).isSameAs(outer);
			return inner.increment();
		});
		assertThat(proxy.isBound()).as("outer binding kept").isTrue();
		assertThat(pool.metrics().acquiredSize()).isOne();
		proxy.release();
	}

	@Test
	void withObjectReleasesOnFailure() {
		Proxy<Counter> proxy = Proxy.perThread(pool);

		assertThatIllegalStateException().isThrownBy(() -> proxy.withObject(c -> {
			throw new IllegalStateException("boom");
		}));
		assertThat(proxy.isBound()).isFalse();
		assertThat(pool.metrics().acquiredSize()).isZero();
	}

	@Test
	void acquireTimeoutPropagates() {
		Proxy<Counter> proxy = Proxy.perThread(pool);
		pool.acquire();
		pool.acquire();

		assertThatExceptionOfType(PoolAcquireTimeoutException.class)
				.isThrownBy(() -> proxy.get(Duration.ofMillis(20)));
		assertThat(proxy.isBound()).isFalse();
	}

	@Test
	void factoryProxyOwnsItsPool() {
		Proxy<Counter> proxy = Proxy.<Counter>ofFactory(Counter::new)
		                            .poolOptions(builder -> builder.name("owned").sizeBetween(0, 1));
		assertThat(proxy.pool()).as("pool is built lazily").isEmpty();

		Counter counter = proxy.get();
		Pool<Counter> owned = proxy.pool().orElseThrow(IllegalStateException::new);
		assertThat(owned.config().name()).isEqualTo("owned");
		assertThat(owned.config().maxSize()).isOne();

		proxy.dispose();

		assertThat(proxy.isDisposed()).isTrue();
		assertThat(owned.isDisposed()).isTrue();
		assertThat(owned.stats().getReturns()).as("bound object released before disposal").isOne();
		assertThat(counter.disposed).isTrue();
		assertThatExceptionOfType(InvalidConfigurationException.class)
				.isThrownBy(() -> proxy.setFactory(Counter::new));
	}

	@Test
	void externalPoolIsNotDisposedWithProxy() {
		Proxy<Counter> proxy = Proxy.perThread(pool);
		proxy.get();

		proxy.dispose();

		assertThat(pool.isDisposed()).isFalse();
		assertThat(pool.metrics().acquiredSize()).isZero();
	}

	@Test
	void disposedProxyCannotBeResolved() {
		Proxy<Counter> proxy = Proxy.perThread(pool);
		proxy.dispose();

		assertThatExceptionOfType(InvalidConfigurationException.class)
				.isThrownBy(proxy::get)
				.withMessage("Proxy has been disposed");
	}

	@Test
	void subclassForwardsToDelegate() {
		GreeterProxy greeter = new GreeterProxy();
		greeter.setPool(PoolBuilder.<Greeter>from(seq -> name -> "hello " + name + " from #" + seq)
		                           .sizeBetween(0, 1)
		                           .housekeepingDisabled()
		                           .buildPool());

		assertThat(greeter.greet("bob")).isEqualTo("hello bob from #1");
		assertThat(greeter.greet("alice")).as("same object while bound").isEqualTo("hello alice from #1");

		greeter.release();
		greeter.pool().ifPresent(Pool::dispose);
	}

	interface Greeter {

		String greet(String name);
	}

	static final class GreeterProxy extends Proxy<Greeter> implements Greeter {

		@Override
		public String greet(String name) {
			return delegate().greet(name);
		}
	}

	@Test
	void reclaimedObjectStaysBoundUntilReleased() {
		VirtualClock clock = new VirtualClock();
		VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
		InstrumentedPool<Counter> reclaiming = PoolBuilder.from(Counter::new)
		                                                  .name("reclaiming")
		                                                  .sizeBetween(0, 1)
		                                                  .clock(clock)
		                                                  .housekeeping(Duration.ofSeconds(1), scheduler)
		                                                  .maxBorrowKill(Duration.ofSeconds(10))
		                                                  .buildPool();
		try {
			Proxy<Counter> proxy = Proxy.perThread(reclaiming);
			Counter first = proxy.get();

			clock.advanceTimeBy(Duration.ofSeconds(11));
			scheduler.advanceTimeBy(Duration.ofSeconds(1));

			assertThat(reclaiming.stats().getKilled()).isOne();
			assertThat(first.isDisposed()).isTrue();
			assertThat(proxy.get()).as("still bound").isSameAs(first);

			proxy.release();
			Counter second = proxy.get();

			assertThat(second).isNotSameAs(first);
			assertThat(second.isDisposed()).isFalse();
			proxy.release();
		}
		finally {
			reclaiming.dispose();
			scheduler.dispose();
		}
	}

	static final class Counter implements Disposable {

		final long          sequence;
		final AtomicInteger count = new AtomicInteger();
		volatile boolean    disposed;

		Counter(long sequence) {
			this.sequence = sequence;
		}

		int increment() {
			return count.incrementAndGet();
		}

		@Override
		public void dispose() {
			disposed = true;
		}

		@Override
		public boolean isDisposed() {
			return disposed;
		}
	}
}
