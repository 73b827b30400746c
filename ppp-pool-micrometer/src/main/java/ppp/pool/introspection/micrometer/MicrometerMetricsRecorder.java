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

package ppp.pool.introspection.micrometer;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import ppp.pool.PoolMetricsRecorder;

import static ppp.pool.introspection.micrometer.DocumentedPoolMeters.*;
import static ppp.pool.introspection.micrometer.DocumentedPoolMeters.AllocationTags.OUTCOME_FAILURE;
import static ppp.pool.introspection.micrometer.DocumentedPoolMeters.AllocationTags.OUTCOME_SUCCESS;
import static ppp.pool.introspection.micrometer.DocumentedPoolMeters.CommonTags.POOL_NAME;

final class MicrometerMetricsRecorder implements PoolMetricsRecorder {

	private final String        poolName;
	private final MeterRegistry meterRegistry;

	private final Timer                         allocationFailureTimer;
	private final Timer                         allocationSuccessTimer;
	private final Timer                         destroyedMeter;
	private final Counter                       recycledCounter;
	private final Map<EvictionReason, Counter>  evictionCounters;
	private final Timer                         resourceSummaryIdleness;
	private final Timer                         resourceSummaryLifetime;
	private final Timer                         resourceSummaryBorrow;
	private final Timer                         pendingSuccessTimer;
	private final Timer                         pendingFailureTimer;
	private final Timer                         housekeepingTimer;

	MicrometerMetricsRecorder(String poolName, MeterRegistry registry) {
		this.poolName = poolName;
		this.meterRegistry = registry;

		final Tags nameTag = Tags.of(POOL_NAME.asString(), this.poolName);

		allocationSuccessTimer = this.meterRegistry.timer(ALLOCATION.getName(),
			nameTag.and(OUTCOME_SUCCESS));
		allocationFailureTimer = this.meterRegistry.timer(ALLOCATION.getName(),
			nameTag.and(OUTCOME_FAILURE));

		destroyedMeter = this.meterRegistry.timer(DESTROYED.getName(), nameTag);
		recycledCounter = this.meterRegistry.counter(RECYCLED.getName(), nameTag);

		evictionCounters = new EnumMap<>(EvictionReason.class);
		for (EvictionReason reason : EvictionReason.values()) {
			evictionCounters.put(reason, this.meterRegistry.counter(EVICTED.getName(),
				nameTag.and(EvictionTags.reason(reason))));
		}

		resourceSummaryLifetime = this.meterRegistry.timer(SUMMARY_LIFETIME.getName(), nameTag);
		resourceSummaryIdleness = this.meterRegistry.timer(SUMMARY_IDLENESS.getName(), nameTag);
		resourceSummaryBorrow = this.meterRegistry.timer(SUMMARY_BORROW.getName(), nameTag);

		pendingSuccessTimer = this.meterRegistry.timer(PENDING.getName(),
				nameTag.and(PendingTags.OUTCOME_SUCCESS));
		pendingFailureTimer = this.meterRegistry.timer(PENDING.getName(),
				nameTag.and(PendingTags.OUTCOME_FAILURE));

		housekeepingTimer = this.meterRegistry.timer(HOUSEKEEPING.getName(), nameTag);
	}

	@Override
	public void recordAllocationSuccessAndLatency(long latencyMs) {
		allocationSuccessTimer.record(latencyMs, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordAllocationFailureAndLatency(long latencyMs) {
		allocationFailureTimer.record(latencyMs, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordDestroyLatency(long latencyMs) {
		destroyedMeter.record(latencyMs, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordRecycled() {
		recycledCounter.increment();
	}

	@Override
	public void recordLifetimeDuration(long millisecondsSinceAllocation) {
		resourceSummaryLifetime.record(millisecondsSinceAllocation, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordIdleTime(long millisecondsIdle) {
		resourceSummaryIdleness.record(millisecondsIdle, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordBorrowTime(long millisecondsBorrowed) {
		resourceSummaryBorrow.record(millisecondsBorrowed, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordEviction(EvictionReason reason) {
		evictionCounters.get(reason).increment();
	}

	@Override
	public void recordPendingSuccessAndLatency(long latencyMs) {
		pendingSuccessTimer.record(latencyMs, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordPendingFailureAndLatency(long latencyMs) {
		pendingFailureTimer.record(latencyMs, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordHousekeepingLatency(long latencyMs) {
		housekeepingTimer.record(latencyMs, TimeUnit.MILLISECONDS);
	}
}
