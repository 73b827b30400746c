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
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

import org.jspecify.annotations.Nullable;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.Loggers;

import static ppp.pool.AbstractPool.PooledSlot.STATE_ACQUIRED;
import static ppp.pool.AbstractPool.PooledSlot.STATE_CHECKING;
import static ppp.pool.AbstractPool.PooledSlot.STATE_CONDEMNED;
import static ppp.pool.AbstractPool.PooledSlot.STATE_IDLE;

/**
 * The {@link SimpleDequePool} is based on a {@link Deque} of idle resources, an identity map of borrowed
 * resources and a list of resources waiting to be destroyed, all guarded by a single {@link ReentrantLock}.
 * Capacity is enforced by the {@link AllocationStrategy}: a permit is held by each borrowed resource and
 * by each resource being created, but not by idle ones.
 * <p>
 * The lock is never held while invoking the factory or one of the hooks.
 *
 * @param <POOLABLE> the type of pooled resources
 */
public class SimpleDequePool<POOLABLE> extends AbstractPool<POOLABLE> {

	final boolean idleResourceLeastRecentlyUsed;

	final ReentrantLock lock = new ReentrantLock();

	//guarded by lock
	final Deque<PooledSlot<POOLABLE>>                 available      = new ArrayDeque<>();
	final Map<POOLABLE, PooledSlot<POOLABLE>>         inUse          = new IdentityHashMap<>();
	final List<PooledSlot<POOLABLE>>                  pendingDestroy = new ArrayList<>();
	final Counters                                    counters       = new Counters();

	//written under lock, read by gauges
	volatile int availableSize;
	volatile int inUseSize;
	volatile int pendingDestroySize;

	volatile boolean shutdown;

	final AtomicBoolean refilling = new AtomicBoolean();

	final long startedAt;
	long sequence;

	final Duration            housekeepingInterval;
	final Scheduler           housekeepingScheduler;
	final @Nullable Scheduler ownedScheduler;
	volatile Disposable       housekeepingTask;

	SimpleDequePool(PoolConfig<POOLABLE> poolConfig) {
		super(poolConfig, Loggers.getLogger(SimpleDequePool.class));
		this.idleResourceLeastRecentlyUsed = poolConfig.reuseIdleResourcesInLruOrder();
		this.startedAt = clock.millis();

		Duration warn = poolConfig.maxBorrowWarn();
		Duration kill = poolConfig.maxBorrowKill();
		if (!warn.isZero() && !kill.isZero() && warn.compareTo(kill) > 0) {
			logger.warn("Pool '{}': maxBorrowWarn ({}ms) is greater than maxBorrowKill ({}ms), borrowed resources will be reclaimed without warning",
					poolConfig.name(), warn.toMillis(), kill.toMillis());
		}

		this.housekeepingInterval = poolConfig.housekeepingInterval();
		if (housekeepingInterval.isZero()) {
			this.ownedScheduler = null;
			this.housekeepingScheduler = Schedulers.immediate();
		}
		else if (poolConfig.housekeepingScheduler() == null) {
			this.ownedScheduler = Schedulers.newSingle("ppp-housekeeper-" + poolConfig.name(), true);
			this.housekeepingScheduler = ownedScheduler;
		}
		else {
			this.ownedScheduler = null;
			this.housekeepingScheduler = poolConfig.housekeepingScheduler();
		}
		this.housekeepingTask = Disposables.disposed();

		recordInteractionTimestamp();
		int warmedUp = warmup();
		if (logger.isDebugEnabled()) {
			logger.debug("Pool '{}' started with {} resources, config {}", poolConfig.name(), warmedUp, poolConfig);
		}
		scheduleHousekeeping();
	}

	// == acquire / release ==

	@Override
	public POOLABLE acquire() {
		return acquire(poolConfig.acquireTimeout());
	}

	@Override
	public POOLABLE acquire(Duration timeout) {
		PoolBuilder.checkDuration(timeout, "timeout");
		if (shutdown) {
			throw new PoolShutdownException(poolConfig.name());
		}
		AllocationStrategy strategy = poolConfig.allocationStrategy();

		long pendingStart = clock.millis();
		boolean permitted;
		try {
			permitted = strategy.getPermit(timeout);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new PoolException("Interrupted while acquiring from pool '" + poolConfig.name() + "'", e);
		}
		if (!permitted) {
			metricsRecorder.recordPendingFailureAndLatency(clock.millis() - pendingStart);
			throw new PoolAcquireTimeoutException(timeout);
		}
		metricsRecorder.recordPendingSuccessAndLatency(clock.millis() - pendingStart);

		PooledSlot<POOLABLE> slot;
		long idleMs = -1L;
		lock.lock();
		try {
			if (shutdown) {
				strategy.returnPermit();
				throw new PoolShutdownException(poolConfig.name());
			}
			slot = idleResourceLeastRecentlyUsed ? available.pollFirst() : available.pollLast();
			if (slot != null) {
				idleMs = slot.idleTime();
				markAcquired(slot);
			}
		}
		finally {
			lock.unlock();
		}

		if (slot != null) {
			metricsRecorder.recordIdleTime(idleMs);
		}
		else {
			//the permit goes back unless the new slot ends up in use, whatever the factory throws
			boolean registered = false;
			try {
				slot = allocate();
				lock.lock();
				try {
					registered = !shutdown;
					if (registered) {
						markAcquired(slot);
					}
				}
				finally {
					lock.unlock();
				}
			}
			finally {
				if (!registered) {
					strategy.returnPermit();
				}
			}
			if (!registered) {
				destroyPoolable(slot);
				countDestroyed(1);
				throw new PoolShutdownException(poolConfig.name());
			}
		}

		runHook("onAcquire", poolConfig.onAcquire(), slot.poolable);
		recordInteractionTimestamp();
		return slot.poolable;
	}

	//must be called under lock
	private void markAcquired(PooledSlot<POOLABLE> slot) {
		slot.markAcquired(clock.millis());
		inUse.put(slot.poolable, slot);
		counters.uses++;
		counters.borrows++;
		updateSizes();
	}

	@Override
	public void release(POOLABLE poolable) {
		Objects.requireNonNull(poolable, "poolable");
		runHook("onRelease", poolConfig.onRelease(), poolable);

		long borrowedMs;
		boolean wornOut;
		boolean needsMaintenance;
		lock.lock();
		try {
			PooledSlot<POOLABLE> slot = inUse.get(poolable);
			if (slot == null || slot.state != STATE_ACQUIRED) {
				if (logger.isDebugEnabled()) {
					logger.debug("Pool '{}': ignoring release of a resource that is not borrowed: {}", poolConfig.name(), poolable);
				}
				return;
			}
			inUse.remove(poolable);
			counters.returns++;
			long now = clock.millis();
			borrowedMs = now - slot.acquireTimestamp;
			int maxUse = poolConfig.maxUse();
			wornOut = maxUse > 0 && slot.acquireCount >= maxUse;
			if (wornOut) {
				condemn(slot);
				counters.wornOut++;
			}
			else {
				slot.markReleased(now);
				available.addLast(slot);
			}
			updateSizes();
			needsMaintenance = needsMaintenance();
		}
		finally {
			lock.unlock();
		}

		poolConfig.allocationStrategy().returnPermit();
		metricsRecorder.recordBorrowTime(borrowedMs);
		if (wornOut) {
			metricsRecorder.recordEviction(PoolMetricsRecorder.EvictionReason.WORN_OUT);
		}
		else {
			metricsRecorder.recordRecycled();
		}
		recordInteractionTimestamp();
		if (needsMaintenance) {
			scheduleMaintenance();
		}
	}

	// == creation ==

	/**
	 * Create a new resource. The caller is expected to hold a permit on its behalf.
	 */
	PooledSlot<POOLABLE> allocate() {
		long seq;
		lock.lock();
		try {
			seq = ++sequence;
			counters.creationAttempts++;
		}
		finally {
			lock.unlock();
		}

		long start = clock.millis();
		POOLABLE poolable;
		try {
			poolable = poolConfig.factory().create(seq);
		}
		catch (Exception factoryError) {
			if (factoryError instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			metricsRecorder.recordAllocationFailureAndLatency(clock.millis() - start);
			throw new PoolCreationException(seq, factoryError);
		}
		if (poolable == null) {
			metricsRecorder.recordAllocationFailureAndLatency(clock.millis() - start);
			throw new PoolCreationException(seq, new NullPointerException("factory returned null"));
		}
		metricsRecorder.recordAllocationSuccessAndLatency(clock.millis() - start);
		runHook("onCreate", poolConfig.onCreate(), poolable);

		lock.lock();
		try {
			counters.created++;
		}
		finally {
			lock.unlock();
		}
		return new PooledSlot<>(poolable, seq, clock);
	}

	@Override
	public int warmup() {
		if (shutdown || !refilling.compareAndSet(false, true)) {
			return 0;
		}
		try {
			int missing;
			lock.lock();
			try {
				missing = effectiveMinSize() - live();
			}
			finally {
				lock.unlock();
			}

			AllocationStrategy strategy = poolConfig.allocationStrategy();
			int created = 0;
			for (int i = 0; i < missing && !shutdown; i++) {
				if (!strategy.tryGetPermit()) {
					logger.debug("Pool '{}': no capacity left to warm up extra resources", poolConfig.name());
					break;
				}
				try {
					PooledSlot<POOLABLE> slot;
					try {
						slot = allocate();
					}
					catch (PoolCreationException creationError) {
						logger.warn("Pool '" + poolConfig.name() + "': failed to warm up resource", creationError);
						continue;
					}
					boolean kept;
					lock.lock();
					try {
						kept = !shutdown && live() < effectiveMinSize();
						if (kept) {
							available.addLast(slot);
							updateSizes();
						}
					}
					finally {
						lock.unlock();
					}
					if (kept) {
						created++;
						logger.debug("Pool '{}': warmed up resource #{}", poolConfig.name(), slot.sequence);
					}
					else {
						destroyPoolable(slot);
						countDestroyed(1);
					}
				}
				finally {
					strategy.returnPermit();
				}
			}
			return created;
		}
		finally {
			refilling.set(false);
		}
	}

	// == housekeeping ==

	void scheduleHousekeeping() {
		if (!housekeepingInterval.isZero() && !shutdown) {
			try {
				this.housekeepingTask = housekeepingScheduler.schedule(this::housekeepingInBackground,
						housekeepingInterval.toNanos(), TimeUnit.NANOSECONDS);
			}
			catch (RejectedExecutionException rejected) {
				if (!shutdown) {
					logger.warn("Pool '" + poolConfig.name() + "': housekeeping could not be scheduled", rejected);
				}
			}
		}
		else {
			this.housekeepingTask = Disposables.disposed();
		}
	}

	void housekeepingInBackground() {
		if (shutdown) {
			//no need to schedule the task again, pool has been disposed
			return;
		}
		try {
			housekeeping();
		}
		catch (Throwable unexpected) {
			logger.error("Pool '" + poolConfig.name() + "': housekeeping round failed", unexpected);
		}
		//schedule the next iteration
		scheduleHousekeeping();
	}

	/**
	 * Run one housekeeping round: reclaim long borrowed resources, evict idle ones, check the health of the
	 * available ones if it is time to, destroy everything that was condemned and replenish the pool.
	 * Each step is isolated from the failures of the others.
	 */
	void housekeeping() {
		long start = clock.millis();
		long round;
		lock.lock();
		try {
			round = ++counters.housekeepingRounds;
			counters.lastHousekeeping = start;
		}
		finally {
			lock.unlock();
		}

		int errors = 0;
		try {
			sweepBorrowed(start);
		}
		catch (RuntimeException e) {
			errors++;
			logger.error("Pool '" + poolConfig.name() + "': borrowed resources sweep failed", e);
		}
		try {
			sweepIdle(start);
		}
		catch (RuntimeException e) {
			errors++;
			logger.error("Pool '" + poolConfig.name() + "': idle resources sweep failed", e);
		}
		if (poolConfig.healthCheck() != null && round % poolConfig.healthCheckEvery() == 0) {
			try {
				sweepHealth();
			}
			catch (RuntimeException e) {
				errors++;
				logger.error("Pool '" + poolConfig.name() + "': health check sweep failed", e);
			}
		}
		try {
			drainPendingDestroy();
		}
		catch (RuntimeException e) {
			errors++;
			logger.error("Pool '" + poolConfig.name() + "': destroying condemned resources failed", e);
		}
		try {
			warmup();
		}
		catch (RuntimeException e) {
			errors++;
			logger.error("Pool '" + poolConfig.name() + "': replenishing resources failed", e);
		}

		long took = clock.millis() - start;
		lock.lock();
		try {
			counters.housekeepingErrors += errors;
			counters.housekeepingTotalMs += took;
		}
		finally {
			lock.unlock();
		}
		metricsRecorder.recordHousekeepingLatency(took);
	}

	void sweepBorrowed(long now) {
		long warnMs = poolConfig.maxBorrowWarn().toMillis();
		long killMs = poolConfig.maxBorrowKill().toMillis();
		if (warnMs <= 0 && killMs <= 0) {
			return;
		}
		int warned = 0;
		long warnedTotalMs = 0L;
		List<Long> killedBorrowTimes = new ArrayList<>();
		lock.lock();
		try {
			Iterator<PooledSlot<POOLABLE>> iterator = inUse.values().iterator();
			while (iterator.hasNext()) {
				PooledSlot<POOLABLE> slot = iterator.next();
				if (slot.state != STATE_ACQUIRED) {
					continue;
				}
				long borrowedMs = now - slot.acquireTimestamp;
				if (warnMs > 0 && borrowedMs >= warnMs) {
					warned++;
					warnedTotalMs += borrowedMs;
				}
				if (killMs > 0 && borrowedMs >= killMs) {
					iterator.remove();
					condemn(slot);
					counters.killed++;
					killedBorrowTimes.add(borrowedMs);
				}
			}
			updateSizes();
		}
		finally {
			lock.unlock();
		}

		if (warned > 0) {
			logger.warn("Pool '{}': {} resources borrowed for more than {}ms (average {}ms)",
					poolConfig.name(), warned, warnMs, warnedTotalMs / warned);
		}
		if (!killedBorrowTimes.isEmpty()) {
			logger.warn("Pool '{}': reclaimed {} resources borrowed for more than {}ms",
					poolConfig.name(), killedBorrowTimes.size(), killMs);
			AllocationStrategy strategy = poolConfig.allocationStrategy();
			for (Long borrowedMs : killedBorrowTimes) {
				strategy.returnPermit();
				metricsRecorder.recordBorrowTime(borrowedMs);
				metricsRecorder.recordEviction(PoolMetricsRecorder.EvictionReason.RECLAIMED);
			}
			recordInteractionTimestamp();
		}
	}

	void sweepIdle(long now) {
		long maxIdleMs = poolConfig.maxIdleTime().toMillis();
		if (maxIdleMs <= 0) {
			return;
		}
		int evicted = 0;
		lock.lock();
		try {
			int floor = effectiveMinSize();
			Iterator<PooledSlot<POOLABLE>> iterator = available.iterator();
			while (iterator.hasNext() && available.size() > floor) {
				PooledSlot<POOLABLE> slot = iterator.next();
				if (now - slot.releaseTimestamp >= maxIdleMs) {
					iterator.remove();
					condemn(slot);
					counters.recycled++;
					evicted++;
				}
			}
			updateSizes();
		}
		finally {
			lock.unlock();
		}

		if (evicted > 0) {
			logger.debug("Pool '{}': evicted {} resources idle for more than {}ms", poolConfig.name(), evicted, maxIdleMs);
			for (int i = 0; i < evicted; i++) {
				metricsRecorder.recordEviction(PoolMetricsRecorder.EvictionReason.IDLE);
			}
			recordInteractionTimestamp();
		}
	}

	void sweepHealth() {
		Predicate<POOLABLE> healthCheck = poolConfig.healthCheck();
		if (healthCheck == null) {
			return;
		}
		List<PooledSlot<POOLABLE>> candidates;
		lock.lock();
		try {
			counters.healthCheckRounds++;
			candidates = new ArrayList<>(available);
		}
		finally {
			lock.unlock();
		}

		AllocationStrategy strategy = poolConfig.allocationStrategy();
		int unhealthy = 0;
		for (PooledSlot<POOLABLE> slot : candidates) {
			if (shutdown) {
				break;
			}
			if (!strategy.tryGetPermit()) {
				logger.debug("Pool '{}': no capacity left to check the health of available resources", poolConfig.name());
				break;
			}
			boolean borrowed;
			lock.lock();
			try {
				borrowed = slot.state == STATE_IDLE && available.remove(slot);
				if (borrowed) {
					slot.state = STATE_CHECKING;
					inUse.put(slot.poolable, slot);
					counters.borrows++;
					updateSizes();
				}
			}
			finally {
				lock.unlock();
			}
			if (!borrowed) {
				strategy.returnPermit();
				continue;
			}

			boolean healthy;
			boolean failed = false;
			try {
				healthy = healthCheck.test(slot.poolable);
			}
			catch (RuntimeException checkError) {
				healthy = false;
				failed = true;
				logger.error("Pool '" + poolConfig.name() + "': health check failed for " + slot.poolable, checkError);
			}

			boolean stillChecking;
			lock.lock();
			try {
				counters.healthChecks++;
				if (failed) {
					counters.healthCheckErrors++;
				}
				stillChecking = slot.state == STATE_CHECKING && inUse.get(slot.poolable) == slot;
				if (stillChecking) {
					inUse.remove(slot.poolable);
					counters.returns++;
					if (healthy) {
						slot.state = STATE_IDLE;
						available.addLast(slot);
					}
					else {
						condemn(slot);
						counters.badHealth++;
						unhealthy++;
					}
					updateSizes();
				}
			}
			finally {
				lock.unlock();
			}
			if (stillChecking) {
				strategy.returnPermit();
				if (!healthy) {
					metricsRecorder.recordEviction(PoolMetricsRecorder.EvictionReason.UNHEALTHY);
				}
			}
		}
		if (unhealthy > 0) {
			logger.info("Pool '{}': {} unhealthy resources evicted", poolConfig.name(), unhealthy);
			recordInteractionTimestamp();
		}
	}

	/**
	 * Destroy all the resources that are pending destruction.
	 *
	 * @return the number of destroyed resources
	 */
	int drainPendingDestroy() {
		List<PooledSlot<POOLABLE>> toDestroy;
		lock.lock();
		try {
			if (pendingDestroy.isEmpty()) {
				return 0;
			}
			toDestroy = new ArrayList<>(pendingDestroy);
			pendingDestroy.clear();
			updateSizes();
		}
		finally {
			lock.unlock();
		}
		for (PooledSlot<POOLABLE> slot : toDestroy) {
			destroyPoolable(slot);
		}
		countDestroyed(toDestroy.size());
		return toDestroy.size();
	}

	void maintenance() {
		try {
			drainPendingDestroy();
			warmup();
		}
		catch (RuntimeException e) {
			logger.error("Pool '" + poolConfig.name() + "': maintenance after release failed", e);
		}
	}

	void scheduleMaintenance() {
		if (housekeepingInterval.isZero()) {
			maintenance();
			return;
		}
		try {
			housekeepingScheduler.schedule(this::maintenance);
		}
		catch (RejectedExecutionException rejected) {
			if (!shutdown) {
				logger.warn("Pool '" + poolConfig.name() + "': maintenance could not be scheduled, running it inline", rejected);
				maintenance();
			}
		}
	}

	// == shutdown ==

	@Override
	public void dispose() {
		List<PooledSlot<POOLABLE>> toDestroy;
		int borrowed;
		lock.lock();
		try {
			if (shutdown) {
				return;
			}
			shutdown = true;
			borrowed = inUse.size();
			toDestroy = new ArrayList<>(pendingDestroy.size() + available.size() + borrowed);
			toDestroy.addAll(pendingDestroy);
			toDestroy.addAll(available);
			toDestroy.addAll(inUse.values());
			for (PooledSlot<POOLABLE> slot : available) {
				slot.state = STATE_CONDEMNED;
			}
			for (PooledSlot<POOLABLE> slot : inUse.values()) {
				slot.state = STATE_CONDEMNED;
			}
			pendingDestroy.clear();
			available.clear();
			inUse.clear();
			updateSizes();
		}
		finally {
			lock.unlock();
		}

		//stop housekeeping thread
		this.housekeepingTask.dispose();
		if (ownedScheduler != null) {
			ownedScheduler.dispose();
		}

		if (borrowed > 0) {
			logger.warn("Pool '{}': destroying {} resources still in use", poolConfig.name(), borrowed);
		}
		AllocationStrategy strategy = poolConfig.allocationStrategy();
		for (int i = 0; i < borrowed; i++) {
			strategy.returnPermit();
		}
		for (PooledSlot<POOLABLE> slot : toDestroy) {
			metricsRecorder.recordEviction(PoolMetricsRecorder.EvictionReason.SHUTDOWN);
			destroyPoolable(slot);
		}
		countDestroyed(toDestroy.size());
		recordInteractionTimestamp();
		logger.debug("Pool '{}' shut down, {} resources destroyed", poolConfig.name(), toDestroy.size());
	}

	@Override
	public boolean isDisposed() {
		return shutdown;
	}

	// == introspection ==

	@Override
	public int acquiredSize() {
		return inUseSize;
	}

	@Override
	public int idleSize() {
		return availableSize;
	}

	@Override
	public int allocatedSize() {
		return availableSize + inUseSize;
	}

	@Override
	public int pendingDestroySize() {
		return pendingDestroySize;
	}

	@Override
	public PoolStats stats() {
		PoolStats stats = new PoolStats();
		List<PooledSlot<POOLABLE>> availableSlots;
		List<PooledSlot<POOLABLE>> inUseSlots;
		long[][] availableTimes;
		long[][] inUseTimes;
		long now = clock.millis();
		lock.lock();
		try {
			stats.shutdown = shutdown;
			stats.live = live();
			stats.availableCount = available.size();
			stats.inUseCount = inUse.size();
			stats.pendingDestroyCount = pendingDestroy.size();
			counters.copyTo(stats, now);
			availableSlots = new ArrayList<>(available);
			inUseSlots = new ArrayList<>(inUse.values());
			availableTimes = snapshotTimes(availableSlots);
			inUseTimes = snapshotTimes(inUseSlots);
		}
		finally {
			lock.unlock();
		}

		AllocationStrategy strategy = poolConfig.allocationStrategy();
		stats.name = poolConfig.name();
		stats.started = Instant.ofEpochMilli(startedAt).toString();
		stats.now = Instant.ofEpochMilli(now).toString();
		stats.runningMs = now - startedAt;
		stats.config = describeConfig();
		stats.permitsAvailable = strategy.estimatePermitCount();
		stats.permitsGranted = strategy.permitGranted();
		stats.permitsMaximum = strategy.permitMaximum();
		//describe hooks are invoked outside of the lock
		stats.available = resourceStats(availableSlots, availableTimes, now);
		stats.inUse = resourceStats(inUseSlots, inUseTimes, now);
		return stats;
	}

	private static long[][] snapshotTimes(List<? extends PooledSlot<?>> slots) {
		long[][] times = new long[slots.size()][];
		for (int i = 0; i < times.length; i++) {
			PooledSlot<?> slot = slots.get(i);
			times[i] = new long[] { slot.acquireCount, slot.acquireTimestamp, slot.releaseTimestamp };
		}
		return times;
	}

	private List<PoolStats.ResourceStats> resourceStats(List<PooledSlot<POOLABLE>> slots, long[][] times, long now) {
		List<PoolStats.ResourceStats> result = new ArrayList<>(slots.size());
		for (int i = 0; i < slots.size(); i++) {
			PooledSlot<POOLABLE> slot = slots.get(i);
			long[] t = times[i];
			result.add(new PoolStats.ResourceStats(describe(slot.poolable), slot.sequence, (int) t[0],
					now - slot.allocationTimestamp, now - t[1], now - t[2]));
		}
		return result;
	}

	private Map<String, Object> describeConfig() {
		Map<String, Object> config = new LinkedHashMap<>();
		int maxSize = poolConfig.maxSize();
		config.put("minSize", poolConfig.minSize());
		config.put("maxSize", maxSize == Integer.MAX_VALUE ? 0 : maxSize);
		config.put("maxUse", poolConfig.maxUse());
		config.put("maxIdleTimeMs", poolConfig.maxIdleTime().toMillis());
		config.put("maxBorrowWarnMs", poolConfig.maxBorrowWarn().toMillis());
		config.put("maxBorrowKillMs", poolConfig.maxBorrowKill().toMillis());
		config.put("healthCheck", poolConfig.healthCheck() != null);
		config.put("healthCheckEvery", poolConfig.healthCheckEvery());
		config.put("housekeepingIntervalMs", housekeepingInterval.toMillis());
		config.put("acquireTimeoutMs", poolConfig.acquireTimeout().toMillis());
		config.put("idleResourceReuseOrder", idleResourceLeastRecentlyUsed ? "LRU" : "MRU");
		return config;
	}

	// == helpers, must be called under lock unless stated otherwise ==

	private void condemn(PooledSlot<POOLABLE> slot) {
		slot.state = STATE_CONDEMNED;
		pendingDestroy.add(slot);
	}

	private int live() {
		return available.size() + inUse.size();
	}

	private int effectiveMinSize() {
		return shutdown ? 0 : poolConfig.minSize();
	}

	private boolean needsMaintenance() {
		return !pendingDestroy.isEmpty() || live() < effectiveMinSize();
	}

	private void updateSizes() {
		this.availableSize = available.size();
		this.inUseSize = inUse.size();
		this.pendingDestroySize = pendingDestroy.size();
	}

	//acquires the lock
	private void countDestroyed(int count) {
		lock.lock();
		try {
			counters.destroyed += count;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Cumulative counters, guarded by the pool lock.
	 */
	static final class Counters {

		long created;
		long creationAttempts;
		long uses;
		long borrows;
		long returns;
		long killed;
		long recycled;
		long wornOut;
		long destroyed;
		long healthChecks;
		long badHealth;
		long housekeepingRounds;
		long housekeepingErrors;
		long housekeepingTotalMs;
		long healthCheckRounds;
		long healthCheckErrors;
		long lastHousekeeping = -1L;

		void copyTo(PoolStats stats, long now) {
			stats.created = created;
			stats.creationAttempts = creationAttempts;
			stats.uses = uses;
			stats.borrows = borrows;
			stats.returns = returns;
			stats.killed = killed;
			stats.recycled = recycled;
			stats.wornOut = wornOut;
			stats.destroyed = destroyed;
			stats.healthChecks = healthChecks;
			stats.badHealth = badHealth;
			stats.housekeepingRounds = housekeepingRounds;
			stats.housekeepingErrors = housekeepingErrors;
			stats.healthCheckRounds = healthCheckRounds;
			stats.healthCheckErrors = healthCheckErrors;
			stats.averageHousekeepingMs = housekeepingRounds == 0 ? 0d : (double) housekeepingTotalMs / housekeepingRounds;
			stats.msSinceLastHousekeeping = lastHousekeeping < 0 ? null : now - lastHousekeeping;
		}
	}
}
