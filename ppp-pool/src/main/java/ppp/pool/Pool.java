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

package ppp.pool;

import java.time.Duration;
import java.util.function.Function;

import reactor.core.Disposable;

/**
 * A thread-safe, blocking pool of expensive objects that are created on demand, recycled between borrowers
 * and periodically reaped by a background housekeeping cycle.
 *
 * @param <POOLABLE> the type of pooled resources
 */
public interface Pool<POOLABLE> extends Disposable {

	/**
	 * Create extra resources until the {@link PoolBuilder#sizeBetween(int, int) minimum size} is reached.
	 * Creation failures are logged and tolerated: the pool tries to be resilient to transient failures
	 * of whatever it is creating resources from.
	 * <p>
	 * The pool calls this once when it is built and after each housekeeping round, but there is no restriction
	 * on the way this method is called by users.
	 *
	 * @return the number of resources created by this call
	 */
	int warmup();

	/**
	 * Acquire a {@code POOLABLE} from the pool, using the configured {@link PoolConfig#acquireTimeout() acquire timeout}.
	 *
	 * @return the acquired resource, which MUST later be passed to {@link #release(Object)}
	 * @throws PoolAcquireTimeoutException if the pool is bounded and no capacity was freed in time
	 * @throws PoolCreationException if a new resource was needed and the factory failed
	 * @throws PoolShutdownException if the pool has been shut down
	 * @see #acquire(Duration)
	 */
	POOLABLE acquire();

	/**
	 * Acquire a {@code POOLABLE} from the pool and become responsible for its {@link #release(Object) release}.
	 * <p>
	 * If the pool is bounded, the calling thread first waits up to {@code timeout} for a capacity permit
	 * ({@link Duration#ZERO} waits indefinitely). Then an idle resource is handed out or, if none is available,
	 * a new one is created on the calling thread.
	 * <p>
	 * The borrower has the sole use of the resource until it releases it, unless it keeps it for longer than
	 * {@link PoolConfig#maxBorrowKill()}: past that point the pool forcibly reclaims and destroys it, and the
	 * borrower's handle must be considered invalid.
	 *
	 * @param timeout the maximum time to wait for capacity, {@link Duration#ZERO} for no limit
	 * @return the acquired resource, which MUST later be passed to {@link #release(Object)}
	 * @throws PoolAcquireTimeoutException if the pool is bounded and no capacity was freed in time
	 * @throws PoolCreationException if a new resource was needed and the factory failed
	 * @throws PoolShutdownException if the pool has been shut down
	 */
	POOLABLE acquire(Duration timeout);

	/**
	 * Return a previously {@link #acquire() acquired} resource to the pool. Depending on its usage count
	 * the resource is either made available again or retired and destroyed.
	 * <p>
	 * Releasing a resource that is not currently borrowed (double release, resource forcibly reclaimed by
	 * housekeeping, or resource foreign to this pool) is a no-op.
	 *
	 * @param poolable the resource to return
	 */
	void release(POOLABLE poolable);

	/**
	 * Acquire a {@code POOLABLE}, apply the {@code scopeFunction} to it and release it once the function
	 * returns or throws.
	 *
	 * @param scopeFunction the work to perform with the resource
	 * @param <V> the type of the result
	 * @return the result of the {@code scopeFunction}
	 */
	default <V> V withPoolable(Function<? super POOLABLE, V> scopeFunction) {
		POOLABLE poolable = acquire();
		try {
			return scopeFunction.apply(poolable);
		}
		finally {
			release(poolable);
		}
	}

	/**
	 * Return the pool's {@link PoolConfig configuration}.
	 *
	 * @return the {@link PoolConfig}
	 */
	PoolConfig<POOLABLE> config();

	/**
	 * Take a point-in-time snapshot of the pool state, configuration and counters,
	 * suitable for monitoring collectors.
	 *
	 * @return a new {@link PoolStats}
	 */
	PoolStats stats();

	/**
	 * Shutdown the pool by:
	 * <ul>
	 *     <li>stopping the background housekeeping</li>
	 *     <li>destroying every pooled resource, including the ones still borrowed (which is logged as unsafe)</li>
	 *     <li>failing every subsequent or still waiting acquisition with a {@link PoolShutdownException}</li>
	 * </ul>
	 * Subsequent calls are no-op.
	 */
	@Override
	void dispose();
}
