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

/**
 * An {@link InstrumentedPool} is a {@link Pool} that exposes a few additional methods
 * around metrics.
 */
public interface InstrumentedPool<POOLABLE> extends Pool<POOLABLE> {

	/**
	 * @return a {@link PoolMetrics} object to be used to get live gauges about the {@link Pool}
	 */
	PoolMetrics metrics();

	/**
	 * Estimates if the pool can currently hand out a resource without waiting.
	 * @return true if some capacity is left, false if an {@link Pool#acquire()} would currently block
	 */
	default boolean hasAvailableResources() {
		return config().allocationStrategy().estimatePermitCount() > 0;
	}

	/**
	 * An object that can be used to get live information about a {@link Pool}, suitable
	 * for gauge metrics.
	 * <p>
	 * getXxx methods are configuration accessors, ie values that won't change over time,
	 * whereas other methods can be used as gauges to introspect the current state of the
	 * pool.
	 */
	interface PoolMetrics {

		/**
		 * Measure the current number of resources that have been {@link Pool#acquire() acquired}
		 * and not yet released, including the ones transiently borrowed by a health check.
		 *
		 * @return the number of acquired resources
		 */
		int acquiredSize();

		/**
		 * Measure the current number of live resources in the {@link Pool}, acquired or idle.
		 * Resources waiting for destruction are not counted.
		 *
		 * @return the total number of live resources managed by the {@link Pool}
		 */
		int allocatedSize();

		/**
		 * Measure the current number of idle resources in the {@link Pool}.
		 *
		 * @return the number of idle resources
		 */
		int idleSize();

		/**
		 * Measure the current number of resources that were retired, evicted or reclaimed
		 * but not yet destroyed.
		 *
		 * @return the number of resources pending destruction
		 */
		int pendingDestroySize();

		/**
		 * Measure the duration in seconds since the pool was last interacted with in a meaningful way
		 * (acquisition, release, eviction, shutdown). The duration is truncated to the second.
		 *
		 * @return a number of seconds indicative of the time elapsed since last pool interaction
		 * @see #isInactiveForMoreThan(Duration)
		 */
		long secondsSinceLastInteraction();

		/**
		 * A convenience way to check the pool is inactive, in the sense that {@link #acquiredSize()},
		 * {@link #idleSize()} and {@link #allocatedSize()} are all at zero and that the last recorded
		 * interaction with the pool was more than or exactly {@code duration} ago.
		 *
		 * @return true if the pool can be considered inactive (see above), false otherwise
		 */
		default boolean isInactiveForMoreThan(Duration duration) {
			return acquiredSize() == 0 && idleSize() == 0 && allocatedSize() == 0
					&& !Duration.ofSeconds(secondsSinceLastInteraction()).minus(duration).isNegative();
		}

		/**
		 * Get the maximum number of resources this {@link Pool} will allow to be borrowed or created at once.
		 * <p>
		 * A {@link Pool} might be unbounded, in which case this method returns {@link Integer#MAX_VALUE}.
		 *
		 * @return the maximum number of live resources that can be allocated by this {@link Pool}
		 */
		int getMaxAllocatedSize();

		/**
		 * Get the number of resources the {@link Pool} tries to keep alive at all times.
		 *
		 * @return the minimum number of live resources
		 */
		int getMinAllocatedSize();
	}
}
