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
 * A default {@link PoolConfig} that can be extended to bear more configuration options
 * with access to a copy constructor for the basic options.
 */
public class DefaultPoolConfig<POOLABLE> implements PoolConfig<POOLABLE> {

	protected final String                          name;
	protected final PoolableFactory<POOLABLE>       factory;
	protected final AllocationStrategy              allocationStrategy;
	protected final int                             maxUse;
	protected final Duration                        maxIdleTime;
	protected final Duration                        maxBorrowWarn;
	protected final Duration                        maxBorrowKill;
	protected final @Nullable Predicate<POOLABLE>   healthCheck;
	protected final int                             healthCheckEvery;
	protected final Duration                        housekeepingInterval;
	protected final @Nullable Scheduler             housekeepingScheduler;
	protected final Duration                        acquireTimeout;
	protected final Consumer<POOLABLE>              onCreate;
	protected final Consumer<POOLABLE>              onAcquire;
	protected final Consumer<POOLABLE>              onRelease;
	protected final @Nullable Consumer<POOLABLE>    onDestroy;
	protected final @Nullable Function<POOLABLE, ?> describe;
	protected final PoolMetricsRecorder             metricsRecorder;
	protected final Clock                           clock;
	protected final boolean                         isIdleLRU;

	public DefaultPoolConfig(String name,
			PoolableFactory<POOLABLE> factory,
			AllocationStrategy allocationStrategy,
			int maxUse,
			Duration maxIdleTime,
			Duration maxBorrowWarn,
			Duration maxBorrowKill,
			@Nullable Predicate<POOLABLE> healthCheck,
			int healthCheckEvery,
			Duration housekeepingInterval,
			@Nullable Scheduler housekeepingScheduler,
			Duration acquireTimeout,
			Consumer<POOLABLE> onCreate,
			Consumer<POOLABLE> onAcquire,
			Consumer<POOLABLE> onRelease,
			@Nullable Consumer<POOLABLE> onDestroy,
			@Nullable Function<POOLABLE, ?> describe,
			PoolMetricsRecorder metricsRecorder,
			Clock clock,
			boolean isIdleLRU) {
		this.name = name;
		this.factory = factory;
		this.allocationStrategy = allocationStrategy;
		this.maxUse = maxUse;
		this.maxIdleTime = maxIdleTime;
		this.maxBorrowWarn = maxBorrowWarn;
		this.maxBorrowKill = maxBorrowKill;
		this.healthCheck = healthCheck;
		this.healthCheckEvery = healthCheckEvery;
		this.housekeepingInterval = housekeepingInterval;
		this.housekeepingScheduler = housekeepingScheduler;
		this.acquireTimeout = acquireTimeout;
		this.onCreate = onCreate;
		this.onAcquire = onAcquire;
		this.onRelease = onRelease;
		this.onDestroy = onDestroy;
		this.describe = describe;
		this.metricsRecorder = metricsRecorder;
		this.clock = clock;
		this.isIdleLRU = isIdleLRU;
	}

	/**
	 * Copy constructor for the benefit of specializations of {@link PoolConfig}.
	 *
	 * @param toCopy the original {@link PoolConfig} to copy (only standard {@link PoolConfig}
	 * options are copied)
	 */
	protected DefaultPoolConfig(PoolConfig<POOLABLE> toCopy) {
		this(toCopy.name(),
				toCopy.factory(),
				toCopy.allocationStrategy(),
				toCopy.maxUse(),
				toCopy.maxIdleTime(),
				toCopy.maxBorrowWarn(),
				toCopy.maxBorrowKill(),
				toCopy.healthCheck(),
				toCopy.healthCheckEvery(),
				toCopy.housekeepingInterval(),
				toCopy.housekeepingScheduler(),
				toCopy.acquireTimeout(),
				toCopy.onCreate(),
				toCopy.onAcquire(),
				toCopy.onRelease(),
				toCopy.onDestroy(),
				toCopy.describe(),
				toCopy.metricsRecorder(),
				toCopy.clock(),
				toCopy.reuseIdleResourcesInLruOrder());
	}

	@Override
	public String name() {
		return this.name;
	}

	@Override
	public PoolableFactory<POOLABLE> factory() {
		return this.factory;
	}

	@Override
	public AllocationStrategy allocationStrategy() {
		return this.allocationStrategy;
	}

	@Override
	public int maxUse() {
		return this.maxUse;
	}

	@Override
	public Duration maxIdleTime() {
		return this.maxIdleTime;
	}

	@Override
	public Duration maxBorrowWarn() {
		return this.maxBorrowWarn;
	}

	@Override
	public Duration maxBorrowKill() {
		return this.maxBorrowKill;
	}

	@Override
	public @Nullable Predicate<POOLABLE> healthCheck() {
		return this.healthCheck;
	}

	@Override
	public int healthCheckEvery() {
		return this.healthCheckEvery;
	}

	@Override
	public Duration housekeepingInterval() {
		return this.housekeepingInterval;
	}

	@Override
	public @Nullable Scheduler housekeepingScheduler() {
		return this.housekeepingScheduler;
	}

	@Override
	public Duration acquireTimeout() {
		return this.acquireTimeout;
	}

	@Override
	public Consumer<POOLABLE> onCreate() {
		return this.onCreate;
	}

	@Override
	public Consumer<POOLABLE> onAcquire() {
		return this.onAcquire;
	}

	@Override
	public Consumer<POOLABLE> onRelease() {
		return this.onRelease;
	}

	@Override
	public @Nullable Consumer<POOLABLE> onDestroy() {
		return this.onDestroy;
	}

	@Override
	public @Nullable Function<POOLABLE, ?> describe() {
		return this.describe;
	}

	@Override
	public PoolMetricsRecorder metricsRecorder() {
		return this.metricsRecorder;
	}

	@Override
	public Clock clock() {
		return this.clock;
	}

	@Override
	public boolean reuseIdleResourcesInLruOrder() {
		return this.isIdleLRU;
	}

	@Override
	public String toString() {
		return "PoolConfig{" +
				"name='" + name + '\'' +
				", allocationStrategy=" + allocationStrategy +
				", maxUse=" + maxUse +
				", maxIdleTime=" + maxIdleTime +
				", maxBorrowWarn=" + maxBorrowWarn +
				", maxBorrowKill=" + maxBorrowKill +
				", healthCheck=" + (healthCheck != null) +
				", healthCheckEvery=" + healthCheckEvery +
				", housekeepingInterval=" + housekeepingInterval +
				", acquireTimeout=" + acquireTimeout +
				", lru=" + isIdleLRU +
				'}';
	}
}
