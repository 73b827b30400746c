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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

import org.HdrHistogram.Histogram;
import org.HdrHistogram.ShortCountsHistogram;
import org.junit.jupiter.params.ParameterizedTest;

import reactor.core.Disposable;

public class TestUtils {

	public static final class PoolableTest implements Disposable {

		private static final AtomicInteger defaultId = new AtomicInteger();

		public volatile int usedUp;
		public volatile int discarded;
		public final int id;

		public PoolableTest() {
			this(defaultId.incrementAndGet());
		}

		public PoolableTest(int id) {
			this.id = id;
			this.usedUp = 0;
		}

		public void use() {
			this.usedUp++;
		}

		@Override
		public void dispose() {
			discarded++;
		}

		@Override
		public boolean isDisposed() {
			return discarded > 0;
		}

		@Override
		public String toString() {
			return "PoolableTest{id=" + id + ", used=" + usedUp + "}";
		}
	}

	/**
	 * A simple in memory {@link PoolMetricsRecorder} based on HdrHistograms than can also be used to get the metrics.
	 */
	public static class InMemoryPoolMetrics implements PoolMetricsRecorder {

		private final ShortCountsHistogram allocationSuccessHistogram;
		private final ShortCountsHistogram allocationErrorHistogram;
		private final ShortCountsHistogram destroyHistogram;
		private final ShortCountsHistogram pendingSuccessHistogram;
		private final ShortCountsHistogram pendingErrorHistogram;
		private final ShortCountsHistogram housekeepingHistogram;
		private final LongAdder recycledCounter;
		private final Map<EvictionReason, LongAdder> evictionCounters;
		private final Histogram lifetimeHistogram;
		private final Histogram idleTimeHistogram;
		private final Histogram borrowTimeHistogram;

		public InMemoryPoolMetrics() {
			long maxLatency = TimeUnit.HOURS.toMillis(1);
			int precision = 3; //precision 3 = 1/1000 of each time unit
			allocationSuccessHistogram = new ShortCountsHistogram(1L, maxLatency, precision);
			allocationErrorHistogram = new ShortCountsHistogram(1L, maxLatency, precision);
			destroyHistogram = new ShortCountsHistogram(1L, maxLatency, precision);
			pendingSuccessHistogram = new ShortCountsHistogram(1L, maxLatency, precision);
			pendingErrorHistogram = new ShortCountsHistogram(1L, maxLatency, precision);
			housekeepingHistogram = new ShortCountsHistogram(1L, maxLatency, precision);
			lifetimeHistogram = new Histogram(precision);
			idleTimeHistogram = new Histogram(precision);
			borrowTimeHistogram = new Histogram(precision);
			recycledCounter = new LongAdder();
			evictionCounters = new EnumMap<>(EvictionReason.class);
			for (EvictionReason reason : EvictionReason.values()) {
				evictionCounters.put(reason, new LongAdder());
			}
		}

		@Override
		public synchronized void recordAllocationSuccessAndLatency(long latencyMs) {
			allocationSuccessHistogram.recordValue(latencyMs);
		}

		@Override
		public synchronized void recordAllocationFailureAndLatency(long latencyMs) {
			allocationErrorHistogram.recordValue(latencyMs);
		}

		@Override
		public synchronized void recordDestroyLatency(long latencyMs) {
			destroyHistogram.recordValue(latencyMs);
		}

		@Override
		public synchronized void recordRecycled() {
			recycledCounter.increment();
		}

		@Override
		public synchronized void recordLifetimeDuration(long millisecondsSinceAllocation) {
			this.lifetimeHistogram.recordValue(millisecondsSinceAllocation);
		}

		@Override
		public synchronized void recordIdleTime(long millisecondsIdle) {
			this.idleTimeHistogram.recordValue(millisecondsIdle);
		}

		@Override
		public synchronized void recordBorrowTime(long millisecondsBorrowed) {
			this.borrowTimeHistogram.recordValue(millisecondsBorrowed);
		}

		@Override
		public synchronized void recordEviction(EvictionReason reason) {
			evictionCounters.get(reason).increment();
		}

		@Override
		public synchronized void recordPendingSuccessAndLatency(long latencyMs) {
			pendingSuccessHistogram.recordValue(latencyMs);
		}

		@Override
		public synchronized void recordPendingFailureAndLatency(long latencyMs) {
			pendingErrorHistogram.recordValue(latencyMs);
		}

		@Override
		public synchronized void recordHousekeepingLatency(long latencyMs) {
			housekeepingHistogram.recordValue(latencyMs);
		}

		public synchronized long getAllocationTotalCount() {
			return allocationSuccessHistogram.getTotalCount() + allocationErrorHistogram.getTotalCount();
		}

		public synchronized long getAllocationSuccessCount() {
			return allocationSuccessHistogram.getTotalCount();
		}

		public synchronized long getAllocationErrorCount() {
			return allocationErrorHistogram.getTotalCount();
		}

		public synchronized long getDestroyCount() {
			return destroyHistogram.getTotalCount();
		}

		public synchronized long getRecycledCount() {
			return recycledCounter.sum();
		}

		public synchronized long getEvictionCount(EvictionReason reason) {
			return evictionCounters.get(reason).sum();
		}

		public synchronized long getPendingSuccessCount() {
			return pendingSuccessHistogram.getTotalCount();
		}

		public synchronized long getPendingErrorCount() {
			return pendingErrorHistogram.getTotalCount();
		}

		public synchronized long getHousekeepingCount() {
			return housekeepingHistogram.getTotalCount();
		}

		public synchronized Histogram getLifetimeHistogram() {
			return lifetimeHistogram;
		}

		public synchronized Histogram getIdleTimeHistogram() {
			return idleTimeHistogram;
		}

		public synchronized Histogram getBorrowTimeHistogram() {
			return borrowTimeHistogram;
		}
	}

	/**
	 * A simple virtual {@link Clock} that can be moved backward and forward. Starts at time 0.
	 */
	public static class VirtualClock extends Clock {

		private volatile Instant now;

		public VirtualClock() {
			this(Instant.EPOCH);
		}

		public VirtualClock(Instant startTime) {
			now = startTime;
		}

		@Override
		public ZoneId getZone() {
			return ZoneId.systemDefault();
		}

		@Override
		public Clock withZone(ZoneId zone) {
			return this;
		}

		@Override
		public Instant instant() {
			return now;
		}

		/**
		 * Advance this {@link Clock} by the given (positive or negative) {@link Duration}.
		 *
		 * @param duration the {@link Duration} to advance by
		 */
		public void advanceTimeBy(Duration duration) {
			now = now.plus(duration);
		}
	}

	/**
	 * Meta-annotation that provides a better default for {@link ParameterizedTest} name.
	 */
	@ParameterizedTest(name="{displayName} [{index}]{arguments}")
	@Target({ ElementType.ANNOTATION_TYPE, ElementType.METHOD })
	@Retention(RetentionPolicy.RUNTIME)
	public @interface ParameterizedTestWithName {

	}
}
