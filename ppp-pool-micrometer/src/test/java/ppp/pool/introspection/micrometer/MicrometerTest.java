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

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ppp.pool.InstrumentedPool;
import ppp.pool.PoolBuilder;
import ppp.pool.PoolCreationException;
import ppp.pool.PoolMetricsRecorder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class MicrometerTest {

	MeterRegistry registry;

	@BeforeEach
	void init() {
		registry = new SimpleMeterRegistry();
	}

	@AfterEach
	void cleanup() {
		registry.close();
	}

	@Test
	void recorderRegistersAllMetersUpfront() {
		Micrometer.recorder("upfront", registry);

		assertThat(registry.getMeters())
				.extracting(meter -> meter.getId().getName())
				.contains(
						"ppp.pool.allocation",
						"ppp.pool.destroyed",
						"ppp.pool.evicted",
						"ppp.pool.housekeeping",
						"ppp.pool.pending",
						"ppp.pool.recycled",
						"ppp.pool.resources.summary.borrow",
						"ppp.pool.resources.summary.idleness",
						"ppp.pool.resources.summary.lifetime");
		assertThat(registry.find("ppp.pool.evicted").tag("pool.name", "upfront").counters())
				.as("one counter per eviction reason")
				.hasSize(PoolMetricsRecorder.EvictionReason.values().length);
	}

	@Test
	void instrumentedPoolRecordsAllocationAndGauges() {
		InstrumentedPool<AtomicInteger> pool = Micrometer.instrumentedPool(
				PoolBuilder.from(seq -> new AtomicInteger((int) seq))
				           .sizeBetween(1, 3)
				           .housekeepingDisabled(),
				"gauged", registry);
		try {
			AtomicInteger first = pool.acquire();
			pool.acquire();

			Timer allocations = registry.get("ppp.pool.allocation")
			                            .tag("pool.name", "gauged")
			                            .tag("pool.allocation.outcome", "success")
			                            .timer();
			assertThat(allocations.count()).isEqualTo(2);
			assertThat(gauge("ppp.pool.resources.acquired", "gauged").value()).isEqualTo(2d);
			assertThat(gauge("ppp.pool.resources.allocated", "gauged").value()).isEqualTo(2d);
			assertThat(gauge("ppp.pool.resources.idle", "gauged").value()).isZero();

			pool.release(first);

			assertThat(gauge("ppp.pool.resources.idle", "gauged").value()).isEqualTo(1d);
			assertThat(registry.get("ppp.pool.recycled").tag("pool.name", "gauged").counter().count()).isEqualTo(1d);
			assertThat(registry.get("ppp.pool.resources.summary.borrow").tag("pool.name", "gauged").timer().count()).isOne();
			assertThat(pool.config().name()).isEqualTo("gauged");
		}
		finally {
			pool.dispose();
		}

		assertThat(registry.get("ppp.pool.evicted")
		                   .tag("pool.name", "gauged")
		                   .tag("pool.eviction.reason", "shutdown")
		                   .counter()
		                   .count()).isEqualTo(2d);
		assertThat(registry.get("ppp.pool.destroyed").tag("pool.name", "gauged").timer().count()).isEqualTo(2);
	}

	@Test
	void failedAllocationIsTaggedAsFailure() {
		InstrumentedPool<AtomicInteger> pool = Micrometer.instrumentedPool(
				PoolBuilder.<AtomicInteger>from(seq -> {
					throw new IllegalStateException("boom");
				}).housekeepingDisabled(),
				"failing", registry);
		try {
			assertThatExceptionOfType(PoolCreationException.class).isThrownBy(pool::acquire);

			assertThat(registry.get("ppp.pool.allocation")
			                   .tag("pool.name", "failing")
			                   .tag("pool.allocation.outcome", "failure")
			                   .timer()
			                   .count()).isOne();
		}
		finally {
			pool.dispose();
		}
	}

	@Test
	void evictionReasonsAreTagged() {
		PoolMetricsRecorder recorder = Micrometer.recorder("reasons", registry);

		recorder.recordEviction(PoolMetricsRecorder.EvictionReason.WORN_OUT);
		recorder.recordEviction(PoolMetricsRecorder.EvictionReason.IDLE);
		recorder.recordEviction(PoolMetricsRecorder.EvictionReason.IDLE);
		recorder.recordHousekeepingLatency(12L);

		assertThat(registry.get("ppp.pool.evicted").tags("pool.name", "reasons", "pool.eviction.reason", "worn_out")
		                   .counter().count()).isEqualTo(1d);
		assertThat(registry.get("ppp.pool.evicted").tags("pool.name", "reasons", "pool.eviction.reason", "idle")
		                   .counter().count()).isEqualTo(2d);
		assertThat(registry.get("ppp.pool.evicted").tags("pool.name", "reasons", "pool.eviction.reason", "unhealthy")
		                   .counter().count()).isZero();
		assertThat(registry.get("ppp.pool.housekeeping").tag("pool.name", "reasons").timer()
		                   .totalTime(TimeUnit.MILLISECONDS)).isEqualTo(12d);
	}

	@Test
	void pendingOutcomesAreTagged() {
		PoolMetricsRecorder recorder = Micrometer.recorder("pending", registry);

		recorder.recordPendingSuccessAndLatency(1L);
		recorder.recordPendingFailureAndLatency(100L);

		assertThat(registry.get("ppp.pool.pending").tags("pool.name", "pending", "pool.pending.outcome", "success")
		                   .timer().count()).isOne();
		assertThat(registry.get("ppp.pool.pending").tags("pool.name", "pending", "pool.pending.outcome", "failure")
		                   .timer().count()).isOne();
	}

	private Gauge gauge(String name, String poolName) {
		return registry.get(name).tag("pool.name", poolName).gauge();
	}
}
