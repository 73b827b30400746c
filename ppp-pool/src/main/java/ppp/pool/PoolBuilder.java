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
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

import org.jspecify.annotations.Nullable;
import reactor.core.scheduler.Scheduler;

/**
 * A builder for {@link Pool} implementations, which tuning methods map
 * to a {@link PoolConfig}.
 *
 * @param <T> the type of elements in the produced {@link Pool}
 */
public class PoolBuilder<T> {

	/**
	 * Start building a {@link Pool} by describing how new objects are to be created.
	 * The factory is invoked on whichever thread needs a new resource: an {@link Pool#acquire() acquiring}
	 * thread, or the housekeeping thread when replenishing the pool up to its minimum size.
	 *
	 * @param factory the blocking creator of poolable resources, invoked each time a new
	 * resource needs to be created.
	 * @param <T> the type of resource created and recycled by the {@link Pool}
	 * @return a builder of {@link Pool}
	 */
	public static <T> PoolBuilder<T> from(PoolableFactory<? extends T> factory) {
		Objects.requireNonNull(factory, "factory");
		return new PoolBuilder<>(factory::create);
	}

	final PoolableFactory<T>             factory;
	String                               name                  = "pool-" + POOL_COUNTER.incrementAndGet();
	@Nullable AllocationStrategy         allocationStrategy    = null;
	int                                  maxUse                = 0;
	Duration                             maxIdleTime           = Duration.ZERO;
	@Nullable Duration                   maxBorrowWarn         = null;
	Duration                             maxBorrowKill         = Duration.ZERO;
	@Nullable Predicate<T>               healthCheck           = null;
	int                                  healthCheckEvery      = 1;
	@Nullable Duration                   housekeepingInterval  = null;
	@Nullable Scheduler                  housekeepingScheduler = null;
	Duration                             acquireTimeout        = Duration.ZERO;
	Consumer<T>                          onCreate              = noopHook();
	Consumer<T>                          onAcquire             = noopHook();
	Consumer<T>                          onRelease             = noopHook();
	@Nullable Consumer<T>                onDestroy             = null;
	@Nullable Function<T, ?>             describe              = null;
	Clock                                clock                 = Clock.systemUTC();
	PoolMetricsRecorder                  metricsRecorder       = NoOpPoolMetricsRecorder.INSTANCE;
	boolean                              idleLruOrder          = true;

	PoolBuilder(PoolableFactory<T> factory) {
		this.factory = factory;
	}

	/**
	 * Set the name of the pool, which appears in logs, in the name of the housekeeping thread and in metric tags.
	 * <p>
	 * Defaults to a generated {@code pool-N} name.
	 *
	 * @param name the name of the pool
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> name(String name) {
		this.name = Objects.requireNonNull(name, "name");
		return this;
	}

	/**
	 * Limits in how many resources can be borrowed or created at the same time are driven by the
	 * provided {@link AllocationStrategy}. This is a customization escape hatch that replaces the last
	 * configured strategy, but most cases should be covered by the {@link #sizeBetween(int, int)} or {@link #sizeUnbounded()}
	 * pre-made strategies.
	 * <p>
	 * Without a call to any of these 3 methods, the builder defaults to an {@link #sizeUnbounded() unbounded creation of resources},
	 * although it is not a recommended one.
	 *
	 * @param allocationStrategy the {@link AllocationStrategy} to use
	 * @return this {@link Pool} builder
	 * @see #sizeBetween(int, int)
	 * @see #sizeUnbounded()
	 */
	public PoolBuilder<T> allocationStrategy(AllocationStrategy allocationStrategy) {
		this.allocationStrategy = Objects.requireNonNull(allocationStrategy, "allocationStrategy");
		return this;
	}

	/**
	 * Replace the {@link AllocationStrategy} with one that lets at most {@code max} resources be borrowed or
	 * in creation at the same time, while housekeeping strives to keep {@code min} live resources around.
	 * Further {@link Pool#acquire() acquisitions} block until some resources have been {@link Pool#release(Object) released}.
	 *
	 * @param min the minimum number of live resources to keep in the pool (best effort)
	 * @param max the maximum number of resources in use at the same time. use {@link Integer#MAX_VALUE} or 0 when you only need a
	 * minimum and no upper bound
	 * @return this {@link Pool} builder
	 * @see #sizeUnbounded()
	 * @see #allocationStrategy(AllocationStrategy)
	 */
	public PoolBuilder<T> sizeBetween(int min, int max) {
		if (max == 0 || max == Integer.MAX_VALUE) {
			return allocationStrategy(new AllocationStrategies.UnboundedAllocationStrategy(min));
		}
		return allocationStrategy(new AllocationStrategies.SizeBasedAllocationStrategy(min, max));
	}

	/**
	 * Replace the {@link AllocationStrategy} with one that lets the {@link Pool} create new resources
	 * when no idle resource is available, without limit.
	 * <p>
	 * Note this is the default, if no previous call to {@link #allocationStrategy(AllocationStrategy)}
	 * or {@link #sizeBetween(int, int)} has been made on this {@link PoolBuilder}.
	 *
	 * @return this {@link Pool} builder
	 * @see #sizeBetween(int, int)
	 * @see #allocationStrategy(AllocationStrategy)
	 */
	public PoolBuilder<T> sizeUnbounded() {
		return allocationStrategy(new AllocationStrategies.UnboundedAllocationStrategy(0));
	}

	/**
	 * Retire resources once they have been acquired {@code maxUse} times: they are destroyed instead of being
	 * put back into the pool on their next release.
	 * <p>
	 * Defaults to 0, ie. unlimited reuse.
	 *
	 * @param maxUse the maximum number of acquisitions per resource, or 0 for unlimited
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> maxUse(int maxUse) {
		if (maxUse < 0) {
			throw new IllegalArgumentException("maxUse must be positive or zero");
		}
		this.maxUse = maxUse;
		return this;
	}

	/**
	 * Let housekeeping destroy resources that have been idle (ie released and available in the {@link Pool}) for
	 * more than the {@code maxIdleTime} {@link Duration} (inclusive), never leaving fewer available resources
	 * than the configured minimum size.
	 *
	 * @param maxIdleTime the {@link Duration} after which an idle object is destroyed (resolution: ms), ZERO to disable
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> maxIdleTime(Duration maxIdleTime) {
		this.maxIdleTime = checkDuration(maxIdleTime, "maxIdleTime");
		return this;
	}

	/**
	 * Let housekeeping log a warning about resources that have been borrowed for more than {@code maxBorrowWarn}.
	 * <p>
	 * Defaults to the {@link #maxBorrowKill(Duration) kill threshold}.
	 *
	 * @param maxBorrowWarn the borrow duration past which a warning is logged (resolution: ms), ZERO to disable
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> maxBorrowWarn(Duration maxBorrowWarn) {
		this.maxBorrowWarn = checkDuration(maxBorrowWarn, "maxBorrowWarn");
		return this;
	}

	/**
	 * Let housekeeping forcibly reclaim and destroy resources that have been borrowed for more than
	 * {@code maxBorrowKill}. The borrower's eventual {@link Pool#release(Object) release} becomes a no-op.
	 *
	 * @param maxBorrowKill the borrow duration past which a resource is reclaimed (resolution: ms), ZERO to disable
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> maxBorrowKill(Duration maxBorrowKill) {
		this.maxBorrowKill = checkDuration(maxBorrowKill, "maxBorrowKill");
		return this;
	}

	/**
	 * Provide a health check that housekeeping applies to available resources. Resources for which the
	 * {@link Predicate} returns {@code false}, or throws, are destroyed.
	 * <p>
	 * Setting a health check without explicitly configuring housekeeping enables it with a 60 seconds interval.
	 *
	 * @param healthCheck the {@link Predicate} returning {@code true} for healthy resources
	 * @return this {@link Pool} builder
	 * @see #healthCheckEvery(int)
	 */
	public PoolBuilder<T> healthCheck(Predicate<T> healthCheck) {
		this.healthCheck = Objects.requireNonNull(healthCheck, "healthCheck");
		return this;
	}

	/**
	 * Only run the {@link #healthCheck(Predicate) health check} every {@code rounds} housekeeping rounds.
	 * <p>
	 * Defaults to 1, ie. every round.
	 *
	 * @param rounds the number of housekeeping rounds between two health sweeps
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> healthCheckEvery(int rounds) {
		if (rounds < 1) {
			throw new IllegalArgumentException("healthCheckEvery must be strictly positive");
		}
		this.healthCheckEvery = rounds;
		return this;
	}

	/**
	 * Disable background housekeeping entirely: no idle, borrow-time or health sweeps happen, and the
	 * maintenance that follows a release runs on the releasing thread.
	 *
	 * @return this {@link Pool} builder
	 * @see #housekeeping(Duration)
	 */
	public PoolBuilder<T> housekeepingDisabled() {
		return housekeeping(Duration.ZERO);
	}

	/**
	 * Enable background housekeeping every {@code interval}, on a dedicated single-threaded
	 * {@link Scheduler} that the pool creates and disposes along with itself.
	 * <p>
	 * Providing an {@code interval} of {@link Duration#ZERO zero} is similar to {@link #housekeepingDisabled() disabling}
	 * housekeeping. When not configured at all, the interval is derived from the other options: half of the smallest
	 * of {@link #maxIdleTime(Duration)} and {@link #maxBorrowWarn(Duration)}, or 60 seconds if only a
	 * {@link #healthCheck(Predicate)} is set, else disabled.
	 *
	 * @param interval the fixed delay between the end of a housekeeping round and the start of the next one
	 * @return this {@link Pool} builder
	 * @see #housekeeping(Duration, Scheduler)
	 */
	public PoolBuilder<T> housekeeping(Duration interval) {
		this.housekeepingInterval = checkDuration(interval, "interval");
		this.housekeepingScheduler = null;
		return this;
	}

	/**
	 * Enable background housekeeping every {@code interval}, on the provided {@link Scheduler}. The scheduler
	 * is not disposed when the pool is.
	 *
	 * @param interval the fixed delay between the end of a housekeeping round and the start of the next one
	 * @param housekeepingScheduler the {@link Scheduler} to run housekeeping on
	 * @return this {@link Pool} builder
	 * @see #housekeeping(Duration)
	 */
	public PoolBuilder<T> housekeeping(Duration interval, Scheduler housekeepingScheduler) {
		this.housekeepingInterval = checkDuration(interval, "interval");
		this.housekeepingScheduler = Objects.requireNonNull(housekeepingScheduler, "housekeepingScheduler");
		return this;
	}

	/**
	 * Set the default maximum time an {@link Pool#acquire()} waits for capacity before failing with a
	 * {@link PoolAcquireTimeoutException}.
	 * <p>
	 * Defaults to {@link Duration#ZERO}, ie. waiting indefinitely.
	 *
	 * @param acquireTimeout the maximum wait, ZERO for no timeout
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> acquireTimeout(Duration acquireTimeout) {
		this.acquireTimeout = checkDuration(acquireTimeout, "acquireTimeout");
		return this;
	}

	/**
	 * Provide a hook invoked with each newly created resource. Failures are logged and ignored.
	 *
	 * @param onCreate the {@link Consumer} to invoke
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> onCreate(Consumer<T> onCreate) {
		this.onCreate = Objects.requireNonNull(onCreate, "onCreate");
		return this;
	}

	/**
	 * Provide a hook invoked each time a resource is handed to a borrower. Failures are logged and ignored.
	 *
	 * @param onAcquire the {@link Consumer} to invoke
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> onAcquire(Consumer<T> onAcquire) {
		this.onAcquire = Objects.requireNonNull(onAcquire, "onAcquire");
		return this;
	}

	/**
	 * Provide a hook invoked each time a borrower releases a resource, which can be used to reset lingering
	 * state of the resource. Failures are logged and ignored.
	 *
	 * @param onRelease the {@link Consumer} to invoke
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> onRelease(Consumer<T> onRelease) {
		this.onRelease = Objects.requireNonNull(onRelease, "onRelease");
		return this;
	}

	/**
	 * Provide a hook invoked whenever a resource isn't fit for usage anymore (either through eviction or
	 * because the pool is shut down). Failures are logged and ignored.
	 * <p>
	 * Defaults to recognizing {@link reactor.core.Disposable} and {@link java.io.Closeable} elements and
	 * disposing them.
	 *
	 * @param onDestroy the {@link Consumer} to invoke
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> onDestroy(Consumer<T> onDestroy) {
		this.onDestroy = Objects.requireNonNull(onDestroy, "onDestroy");
		return this;
	}

	/**
	 * Provide a {@link Function} turning a resource into a JSON-friendly descriptor, used by {@link Pool#stats()}.
	 * <p>
	 * Defaults to {@link Object#toString()}.
	 *
	 * @param describe the descriptor {@link Function}
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> describe(Function<T, ?> describe) {
		this.describe = Objects.requireNonNull(describe, "describe");
		return this;
	}

	/**
	 * Set the {@link Clock} to use for timestamps, notably marking the times at which a resource is
	 * allocated, released and acquired. The {@link Clock#millis()} method is used for this purpose,
	 * which produces timestamps and durations in milliseconds for eg. idle and borrow-time sweeps.
	 *
	 * @param clock the {@link Clock} to use to measure timestamps and durations
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> clock(Clock clock) {
		this.clock = Objects.requireNonNull(clock, "clock");
		return this;
	}

	/**
	 * Set up the optional {@link PoolMetricsRecorder} for {@link Pool} to use for instrumentation purposes.
	 *
	 * @param recorder the {@link PoolMetricsRecorder}
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> metricsRecorder(PoolMetricsRecorder recorder) {
		this.metricsRecorder = Objects.requireNonNull(recorder, "recorder");
		return this;
	}

	/**
	 * Configure the pool so that if there are idle resources (ie pool is under-utilized),
	 * the next {@link Pool#acquire()} will get the <b>Least Recently Used</b> resource
	 * (LRU, ie. the resource that was released first among the current idle resources).
	 *
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> idleResourceReuseLruOrder() {
		return idleResourceReuseOrder(true);
	}

	/**
	 * Configure the pool so that if there are idle resources (ie pool is under-utilized),
	 * the next {@link Pool#acquire()} will get the <b>Most Recently Used</b> resource
	 * (MRU, ie. the resource that was released last among the current idle resources).
	 *
	 * @return this {@link Pool} builder
	 */
	public PoolBuilder<T> idleResourceReuseMruOrder() {
		return idleResourceReuseOrder(false);
	}

	/**
	 * Configure the order in which idle resources are used when the next {@link Pool#acquire()}
	 * is performed (while the pool is under-utilized).
	 *
	 * @param isLru {@code true} for LRU (the default) or {@code false} for MRU
	 * @return this {@link Pool} builder
	 * @see #idleResourceReuseLruOrder()
	 * @see #idleResourceReuseMruOrder()
	 */
	public PoolBuilder<T> idleResourceReuseOrder(boolean isLru) {
		this.idleLruOrder = isLru;
		return this;
	}

	/**
	 * Construct a default pool with the builder's configuration. The pool is warmed up to its minimum
	 * size and its housekeeping is started before this method returns.
	 *
	 * @return an {@link InstrumentedPool}
	 * @throws InvalidConfigurationException if the options are inconsistent
	 */
	public InstrumentedPool<T> buildPool() {
		return new SimpleDequePool<>(this.buildConfig());
	}

	/**
	 * Build a custom flavor of {@link Pool}, given a Pool factory {@link Function} that
	 * is provided with a {@link PoolConfig} copy of this builder's configuration.
	 *
	 * @param poolFactory the factory of pool implementation
	 * @return the {@link Pool}
	 */
	public <POOL extends Pool<T>> POOL build(Function<? super PoolConfig<T>, POOL> poolFactory) {
		return poolFactory.apply(buildConfig());
	}

	//kept package-private for the benefit of tests
	PoolConfig<T> buildConfig() {
		Duration effectiveWarn = maxBorrowWarn == null ? maxBorrowKill : maxBorrowWarn;
		Duration interval = housekeepingInterval;
		if (interval == null) {
			interval = defaultHousekeepingInterval(maxIdleTime, effectiveWarn, healthCheck != null);
		}
		else if (interval.isZero() && healthCheck != null) {
			throw new InvalidConfigurationException("A health check requires housekeeping to be enabled in pool '" + name + "'");
		}

		return new DefaultPoolConfig<>(name,
				factory,
				allocationStrategy == null ?
						new AllocationStrategies.UnboundedAllocationStrategy(0) :
						allocationStrategy,
				maxUse,
				maxIdleTime,
				effectiveWarn,
				maxBorrowKill,
				healthCheck,
				healthCheckEvery,
				interval,
				housekeepingScheduler,
				acquireTimeout,
				onCreate,
				onAcquire,
				onRelease,
				onDestroy,
				describe,
				metricsRecorder,
				clock,
				idleLruOrder);
	}

	static Duration defaultHousekeepingInterval(Duration maxIdleTime, Duration maxBorrowWarn, boolean hasHealthCheck) {
		Duration smallest = null;
		if (!maxIdleTime.isZero()) {
			smallest = maxIdleTime;
		}
		if (!maxBorrowWarn.isZero() && (smallest == null || maxBorrowWarn.compareTo(smallest) < 0)) {
			smallest = maxBorrowWarn;
		}
		if (smallest != null) {
			return smallest.dividedBy(2);
		}
		return hasHealthCheck ? DEFAULT_HEALTH_CHECK_INTERVAL : Duration.ZERO;
	}

	static Duration checkDuration(Duration duration, String name) {
		Objects.requireNonNull(duration, name);
		if (duration.isNegative()) {
			throw new IllegalArgumentException(name + " must be positive or zero");
		}
		return duration;
	}

	@SuppressWarnings("unchecked")
	static <T> Consumer<T> noopHook() {
		return (Consumer<T>) NOOP_HOOK;
	}

	static final Consumer<?>   NOOP_HOOK                     = it -> { };
	static final Duration      DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(60);
	static final AtomicInteger POOL_COUNTER                  = new AtomicInteger();
}
