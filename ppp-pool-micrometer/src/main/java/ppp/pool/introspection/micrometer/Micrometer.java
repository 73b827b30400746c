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

import io.micrometer.core.instrument.MeterRegistry;

import ppp.pool.InstrumentedPool;
import ppp.pool.PoolBuilder;
import ppp.pool.PoolMetricsRecorder;

/**
 * Micrometer supporting utilities for instrumentation of ppp-pool.
 */
public final class Micrometer {

	private Micrometer() {
	}

	/**
	 * Create an {@link InstrumentedPool} starting from the provided {@link PoolBuilder}. The pool publishes metrics to
	 * a Micrometer {@link MeterRegistry}. The {@code poolName} becomes the {@link PoolBuilder#name(String) name} of
	 * the pool and is set on all meters as the value for the {@code pool.name} tag.
	 * <p>
	 * The steps involved are as follows:
	 * <ol>
	 *     <li> create a {@link PoolMetricsRecorder} similar to {@link #recorder(String, MeterRegistry)} </li>
	 *     <li> mutate the builder to use that recorder by calling {@link PoolBuilder#metricsRecorder(PoolMetricsRecorder)} </li>
	 *     <li> create an {@link InstrumentedPool} via {@link PoolBuilder#buildPool()} </li>
	 *     <li> instrument the {@link InstrumentedPool.PoolMetrics} via {@link #gaugesOf(InstrumentedPool.PoolMetrics, String, MeterRegistry)} </li>
	 *     <li> return that {@link InstrumentedPool} instance </li>
	 * </ol>
	 *
	 * @param poolBuilder a pre-configured {@link PoolBuilder} on which to configure a {@link PoolMetricsRecorder}
	 * @param poolName the name of the pool, also used as tag value on the gauges and the recorder's meters
	 * @param meterRegistry the registry to use for the gauges and the recorder's meters
	 * @param <POOLABLE> the type of resources in the pool
	 * @return a new {@link InstrumentedPool} with a Micrometer recorder and with gauges attached
	 */
	public static <POOLABLE> InstrumentedPool<POOLABLE> instrumentedPool(PoolBuilder<POOLABLE> poolBuilder, String poolName, MeterRegistry meterRegistry) {
		PoolMetricsRecorder recorder = recorder(poolName, meterRegistry);
		InstrumentedPool<POOLABLE> pool = poolBuilder.name(poolName)
				.metricsRecorder(recorder)
				.buildPool();
		gaugesOf(pool.metrics(), poolName, meterRegistry);
		return pool;
	}

	/**
	 * Register Micrometer gauges around the {@link InstrumentedPool}'s {@link InstrumentedPool.PoolMetrics},
	 * publishing to the provided {@link MeterRegistry}.
	 *
	 * @param poolMetrics the {@link InstrumentedPool.PoolMetrics} to turn into gauges
	 * @param poolName the tag value to use on the gauges to differentiate between pools
	 * @param meterRegistry the registry to use for the gauges
	 * @see PoolGaugesBinder
	 */
	public static void gaugesOf(InstrumentedPool.PoolMetrics poolMetrics, String poolName, MeterRegistry meterRegistry) {
		new PoolGaugesBinder(poolMetrics, poolName).bindTo(meterRegistry);
	}

	/**
	 * Create a {@link PoolMetricsRecorder} publishing timers and counters to a provided {@link MeterRegistry}.
	 * One can differentiate between pools thanks to the provided {@code poolName}, which will be set on all meters
	 * as the value for the {@code pool.name} tag.
	 *
	 * @param poolName the tag value to use on the recorder's meters to differentiate between pools
	 * @param meterRegistry the registry to use for the recorder's meters
	 * @return a Micrometer {@link PoolMetricsRecorder}
	 * @see #instrumentedPool(PoolBuilder, String, MeterRegistry)
	 */
	public static PoolMetricsRecorder recorder(String poolName, MeterRegistry meterRegistry) {
		return new MicrometerMetricsRecorder(poolName, meterRegistry);
	}
}
