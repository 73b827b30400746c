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

import java.time.Clock;
import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

import org.jspecify.annotations.Nullable;
import reactor.core.scheduler.Scheduler;

/**
 * A representation of the common configuration options of a {@link Pool}.
 * For a default implementation that is open for extension, see {@link DefaultPoolConfig}.
 * <p>
 * Durations of {@link Duration#ZERO} disable the corresponding feature.
 */
public interface PoolConfig<POOLABLE> {

	/**
	 * A name for the pool, used in log messages, thread names and metric tags.
	 */
	String name();

	/**
	 * The blocking factory that produces new resources.
	 */
	PoolableFactory<POOLABLE> factory();

	/**
	 * {@link AllocationStrategy} defines the capacity gate, ie. how many resources can be borrowed or
	 * in creation at the same time, and the minimum number of live resources to maintain.
	 */
	AllocationStrategy allocationStrategy();

	/**
	 * The minimum number of live resources the pool tries to keep around.
	 */
	default int minSize() {
		return allocationStrategy().permitMinimum();
	}

	/**
	 * The maximum number of resources that can be borrowed or in creation at the same time,
	 * {@link Integer#MAX_VALUE} if unbounded.
	 */
	default int maxSize() {
		return allocationStrategy().permitMaximum();
	}

	/**
	 * The number of acquisitions after which a resource is destroyed on its next release, or 0 for no limit.
	 */
	int maxUse();

	/**
	 * The {@link Duration} after which an available resource is considered too idle and destroyed
	 * by housekeeping, as long as doing so doesn't bring the number of available resources under
	 * {@link #minSize()}.
	 */
	Duration maxIdleTime();

	/**
	 * The {@link Duration} after which a borrowed resource triggers a warning log during housekeeping.
	 */
	Duration maxBorrowWarn();

	/**
	 * The {@link Duration} after which a borrowed resource is forcibly reclaimed by housekeeping and destroyed.
	 * Subsequent release of such a resource by its borrower is a no-op.
	 */
	Duration maxBorrowKill();

	/**
	 * The health check applied to available resources during housekeeping, or {@code null} if none.
	 * A predicate that returns {@code false} or throws marks the resource as unhealthy.
	 */
	@Nullable
	Predicate<POOLABLE> healthCheck();

	/**
	 * Run the {@link #healthCheck()} every N housekeeping rounds.
	 */
	int healthCheckEvery();

	/**
	 * The interval between two housekeeping rounds, or {@link Duration#ZERO} if housekeeping is disabled.
	 */
	Duration housekeepingInterval();

	/**
	 * The {@link Scheduler} on which housekeeping rounds and release-triggered maintenance run, or
	 * {@code null} if the pool should create (and own) a dedicated single-threaded one.
	 * Ignored when {@link #housekeepingInterval()} is {@link Duration#ZERO}.
	 */
	@Nullable
	Scheduler housekeepingScheduler();

	/**
	 * The default maximum time an {@link Pool#acquire()} waits for capacity, or {@link Duration#ZERO}
	 * to wait indefinitely.
	 */
	Duration acquireTimeout();

	/**
	 * Invoked once with each newly created resource, before it is registered with the pool.
	 */
	Consumer<POOLABLE> onCreate();

	/**
	 * Invoked each time a resource is handed to a borrower, outside of the pool lock.
	 */
	Consumer<POOLABLE> onAcquire();

	/**
	 * Invoked each time a borrower gives a resource back, before it is returned to the available set.
	 */
	Consumer<POOLABLE> onRelease();

	/**
	 * Defines a mechanism of resource destruction, cleaning up state and OS resources it could maintain (eg. off-heap
	 * objects, file handles, socket connections, etc...). When {@code null}, {@link reactor.core.Disposable} and
	 * {@link java.io.Closeable} resources are disposed or closed.
	 */
	@Nullable
	Consumer<POOLABLE> onDestroy();

	/**
	 * Turns a resource into a JSON-friendly descriptor for {@link Pool#stats()}, or {@code null} to use
	 * {@link Object#toString()}.
	 */
	@Nullable
	Function<POOLABLE, ?> describe();

	/**
	 * The {@link PoolMetricsRecorder} to use to collect instrumentation data of the {@link Pool}
	 * implementations.
	 */
	PoolMetricsRecorder metricsRecorder();

	/**
	 * The {@link java.time.Clock} to use to timestamp pool lifecycle events like allocation,
	 * acquisition and release, which drive idle and borrow-time housekeeping.
	 */
	Clock clock();

	/**
	 * The order in which available resources should be used when a new {@link Pool#acquire()} is
	 * performed. Returns {@code true} if LRU (Least-Recently Used, the resource that was released
	 * first is handed out) or {@code false} for MRU (Most-Recently Used, the resource that was
	 * released last is handed out).
	 *
	 * @return {@code true} for LRU, {@code false} for MRU
	 */
	boolean reuseIdleResourcesInLruOrder();
}
