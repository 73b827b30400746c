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

import org.junit.jupiter.api.Test;

import ppp.pool.PoolMetricsRecorder.EvictionReason;
import ppp.pool.TestUtils.InMemoryPoolMetrics;
import ppp.pool.TestUtils.PoolableTest;
import ppp.pool.TestUtils.VirtualClock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class PoolMetricsRecorderTest {

	@Test
	void recordsLifecycle() {
		VirtualClock clock = new VirtualClock();
		InMemoryPoolMetrics recorder = new InMemoryPoolMetrics();
		InstrumentedPool<PoolableTest> pool = PoolBuilder.from(seq -> new PoolableTest((int) seq))
		                                                 .sizeBetween(0, 2)
		                                                 .maxUse(2)
		                                                 .housekeepingDisabled()
		                                                 .clock(clock)
		                                                 .metricsRecorder(recorder)
		                                                 .buildPool();

		PoolableTest first = pool.acquire();
		assertThat(recorder.getAllocationSuccessCount()).isOne();
		assertThat(recorder.getPendingSuccessCount()).isOne();

		clock.advanceTimeBy(Duration.ofSeconds(3));
		pool.release(first);
		assertThat(recorder.getRecycledCount()).isOne();
		assertThat(recorder.getBorrowTimeHistogram().getTotalCount()).isOne();
		assertThat(recorder.getBorrowTimeHistogram().getMaxValue()).isGreaterThanOrEqualTo(3000L);

		clock.advanceTimeBy(Duration.ofSeconds(1));
		pool.release(pool.acquire());
		assertThat(recorder.getIdleTimeHistogram().getTotalCount()).isOne();
		assertThat(recorder.getEvictionCount(EvictionReason.WORN_OUT)).isOne();
		assertThat(recorder.getDestroyCount()).isOne();
		assertThat(recorder.getLifetimeHistogram().getMaxValue()).isGreaterThanOrEqualTo(4000L);

		pool.acquire();
		pool.dispose();
		assertThat(recorder.getAllocationTotalCount()).isEqualTo(2);
		assertThat(recorder.getEvictionCount(EvictionReason.SHUTDOWN)).isOne();
		assertThat(recorder.getDestroyCount()).isEqualTo(2);
	}

	@Test
	void recordsFailures() {
		InMemoryPoolMetrics recorder = new InMemoryPoolMetrics();
		InstrumentedPool<PoolableTest> pool = PoolBuilder.<PoolableTest>from(seq -> {
			throw new IllegalStateException("boom");
		}).sizeBetween(0, 1).housekeepingDisabled().metricsRecorder(recorder).buildPool();
		try {
			assertThatExceptionOfType(PoolCreationException.class).isThrownBy(pool::acquire);

			assertThat(recorder.getAllocationErrorCount()).isOne();
			assertThat(recorder.getAllocationSuccessCount()).isZero();
		}
		finally {
			pool.dispose();
		}
	}

	@Test
	void recordsPendingTimeout() {
		InMemoryPoolMetrics recorder = new InMemoryPoolMetrics();
		InstrumentedPool<PoolableTest> pool = PoolBuilder.from(seq -> new PoolableTest((int) seq))
		                                                 .sizeBetween(0, 1)
		                                                 .housekeepingDisabled()
		                                                 .metricsRecorder(recorder)
		                                                 .buildPool();
		try {
			pool.acquire();
			assertThatExceptionOfType(PoolAcquireTimeoutException.class)
					.isThrownBy(() -> pool.acquire(Duration.ofMillis(10)));

			assertThat(recorder.getPendingSuccessCount()).isOne();
			assertThat(recorder.getPendingErrorCount()).isOne();
		}
		finally {
			pool.dispose();
		}
	}

	@Test
	void recordsEvictionReasonsAndHousekeeping() {
		VirtualClock clock = new VirtualClock();
		InMemoryPoolMetrics recorder = new InMemoryPoolMetrics();
		SimpleDequePool<PoolableTest> pool = (SimpleDequePool<PoolableTest>) PoolBuilder
				.from(seq -> new PoolableTest((int) seq))
				.sizeBetween(0, 3)
				.maxIdleTime(Duration.ofSeconds(10))
				.maxBorrowKill(Duration.ofSeconds(10))
				.healthCheck(p -> p.id != 2)
				.housekeeping(Duration.ofHours(1))
				.clock(clock)
				.metricsRecorder(recorder)
				.buildPool();
		try {
			PoolableTest idle = pool.acquire();
			PoolableTest unhealthy = pool.acquire();
			pool.acquire();
			pool.release(idle);
			clock.advanceTimeBy(Duration.ofSeconds(5));
			pool.release(unhealthy);
			clock.advanceTimeBy(Duration.ofSeconds(6));

			pool.housekeeping();

			assertThat(recorder.getEvictionCount(EvictionReason.IDLE)).as("idle").isOne();
			assertThat(recorder.getEvictionCount(EvictionReason.RECLAIMED)).as("reclaimed").isOne();
			assertThat(recorder.getEvictionCount(EvictionReason.UNHEALTHY)).as("unhealthy").isOne();
			assertThat(recorder.getDestroyCount()).isEqualTo(3);
			assertThat(recorder.getHousekeepingCount()).isOne();
		}
		finally {
			pool.dispose();
		}
	}
}
