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
 * The capacity gate of a {@link Pool}: a strategy guiding the pool on whether or not it is possible to hand out
 * or create one more resource. A permit is held for as long as a resource is borrowed or being created, and
 * must be given back through {@link #returnPermit()} exactly once.
 * <p>
 * See {@link PoolBuilder#sizeBetween(int, int)} and {@link PoolBuilder#sizeUnbounded()} for pre-made strategies.
 */
public interface AllocationStrategy {

	/**
	 * Best-effort peek at the state of the strategy which indicates roughly how many more permits can currently be
	 * granted. Should be paired with {@link #getPermit(Duration)} or {@link #tryGetPermit()} for an atomic permission.
	 *
	 * @return an ESTIMATED count of how many more permits can currently be granted
	 */
	int estimatePermitCount();

	/**
	 * Get one permit, waiting up to {@code timeout} for one to be returned if none is currently free.
	 * No ordering is guaranteed between threads waiting concurrently.
	 *
	 * @param timeout the maximum time to wait, {@link Duration#ZERO} to wait indefinitely
	 * @return true if a permit was granted, false if the timeout elapsed first (in which case no permit is held)
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	boolean getPermit(Duration timeout) throws InterruptedException;

	/**
	 * Get one permit only if one is free at the time of invocation.
	 *
	 * @return true if a permit was granted
	 */
	boolean tryGetPermit();

	/**
	 * Update the strategy to indicate that one permit is not used anymore. Users MUST ensure that this method
	 * isn't called more times than permits were granted.
	 *
	 * @throws IllegalStateException if it can be determined that more permits were returned than granted
	 */
	void returnPermit();

	/**
	 * @return a best estimate of the number of permits currently granted, between 0 and {@link Integer#MAX_VALUE}
	 */
	int permitGranted();

	/**
	 * Return the minimum number of live resources the pool tries to maintain,
	 * or {@code 0} for scale-to-zero.
	 *
	 * @return the minimum number of live resources
	 */
	int permitMinimum();

	/**
	 * @return the maximum number of permits this strategy can grant in total, or {@link Integer#MAX_VALUE} for unbounded
	 */
	int permitMaximum();
}
