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

/**
 * An interface representing ways for {@link Pool} to collect instrumentation data.
 * <p>
 * Note this doesn't include the concepts of measuring timings, which should be the
 * responsibility of a {@link java.time.Clock}.
 */
public interface PoolMetricsRecorder {

	/**
	 * Record a latency for successful allocation. Implies incrementing an allocation success counter as well.
	 * @param latencyMs the latency in milliseconds
	 */
	void recordAllocationSuccessAndLatency(long latencyMs);

	/**
	 * Record a latency for failed allocation. Implies incrementing an allocation failure counter as well.
	 * @param latencyMs the latency in milliseconds
	 */
	void recordAllocationFailureAndLatency(long latencyMs);

	/**
	 * Record a latency for destroying a resource. Implies incrementing a counter as well.
	 * @param latencyMs the latency in milliseconds
	 */
	void recordDestroyLatency(long latencyMs);

	/**
	 * Record the fact that a released resource was put back into the pool for reuse.
	 */
	void recordRecycled();

	/**
	 * Record the number of milliseconds a pooled object has been live (ie time between allocation and destruction).
	 * @param millisecondsSinceAllocation the number of milliseconds since the object was allocated, at the time it is destroyed
	 */
	void recordLifetimeDuration(long millisecondsSinceAllocation);

	/**
	 * Record the number of milliseconds an object had been idle when it gets pulled from the pool and passed to a borrower.
	 * @param millisecondsIdle the number of milliseconds an object that was just acquired had previously been idle
	 */
	void recordIdleTime(long millisecondsIdle);

	/**
	 * Record the number of milliseconds an object was held by a borrower, when it is released or forcibly reclaimed.
	 * @param millisecondsBorrowed the number of milliseconds since the object was acquired
	 */
	void recordBorrowTime(long millisecondsBorrowed);

	/**
	 * Record the fact that a resource left the live set to be destroyed, along with the reason why.
	 * @param reason the {@link EvictionReason}
	 */
	void recordEviction(EvictionReason reason);

	/**
	 * Record a latency for an acquire that obtained a capacity permit, ie the time it waited for capacity.
	 * Implies incrementing a pending acquire success counter as well.
	 * @param latencyMs the latency in milliseconds
	 */
	default void recordPendingSuccessAndLatency(long latencyMs) {
		// noop
	}

	/**
	 * Record a latency for an acquire that failed with {@link PoolAcquireTimeoutException}.
	 * Implies incrementing a pending acquire failure counter as well.
	 * @param latencyMs the latency in milliseconds
	 */
	default void recordPendingFailureAndLatency(long latencyMs) {
		// noop
	}

	/**
	 * Record the duration of a background housekeeping round.
	 * @param latencyMs the latency in milliseconds
	 */
	default void recordHousekeepingLatency(long latencyMs) {
		// noop
	}

	/**
	 * The reasons for which a live resource gets moved out of a {@link Pool} to be destroyed.
	 */
	enum EvictionReason {
		/** the resource reached {@link PoolConfig#maxUse()} acquisitions */
		WORN_OUT,
		/** the resource stayed idle for longer than {@link PoolConfig#maxIdleTime()} */
		IDLE,
		/** the health check reported the resource as unhealthy, or failed */
		UNHEALTHY,
		/** the resource was borrowed for longer than {@link PoolConfig#maxBorrowKill()} */
		RECLAIMED,
		/** the pool was shut down */
		SHUTDOWN
	}
}
