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

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.util.function.Consumer;
import java.util.function.Function;

import reactor.core.Disposable;
import reactor.util.Logger;

/**
 * An abstract base version of a {@link Pool}, mutualizing small amounts of code and allowing to build common
 * related classes like {@link PooledSlot}.
 */
abstract class AbstractPool<POOLABLE> implements InstrumentedPool<POOLABLE>, InstrumentedPool.PoolMetrics {

	//A pool should be rare enough that having instance loggers should be ok
	//This helps with testability of some methods that for now mainly log
	final Logger logger;

	final PoolConfig<POOLABLE> poolConfig;

	final PoolMetricsRecorder metricsRecorder;
	final Clock clock;

	volatile long lastInteractionTimestamp;

	AbstractPool(PoolConfig<POOLABLE> poolConfig, Logger logger) {
		this.poolConfig = poolConfig;
		this.logger = logger;
		this.metricsRecorder = poolConfig.metricsRecorder();
		this.clock = poolConfig.clock();
		this.lastInteractionTimestamp = clock.millis();
	}

	// == pool introspection methods ==

	@Override
	public PoolConfig<POOLABLE> config() {
		return this.poolConfig;
	}

	@Override
	public PoolMetrics metrics() {
		return this;
	}

	@Override
	public int getMaxAllocatedSize() {
		return poolConfig.allocationStrategy().permitMaximum();
	}

	@Override
	public int getMinAllocatedSize() {
		return poolConfig.allocationStrategy().permitMinimum();
	}

	void recordInteractionTimestamp() {
		this.lastInteractionTimestamp = clock.millis();
	}

	@Override
	public long secondsSinceLastInteraction() {
		long sinceMs = clock.millis() - this.lastInteractionTimestamp;
		return sinceMs / 1000;
	}

	// == hooks ==

	/**
	 * Invoke a user-provided hook, logging and suppressing any failure. MUST NOT be called
	 * while holding the pool lock.
	 */
	void runHook(String hookName, Consumer<POOLABLE> hook, POOLABLE poolable) {
		try {
			hook.accept(poolable);
		}
		catch (RuntimeException hookError) {
			logger.warn("Pool '" + poolConfig.name() + "': " + hookName + " hook failed for " + poolable, hookError);
		}
	}

	Object describe(POOLABLE poolable) {
		Function<POOLABLE, ?> describe = poolConfig.describe();
		if (describe != null) {
			try {
				Object description = describe.apply(poolable);
				if (description != null) {
					return description;
				}
			}
			catch (RuntimeException describeError) {
				logger.warn("Pool '" + poolConfig.name() + "': describe hook failed for " + poolable, describeError);
			}
		}
		return String.valueOf(poolable);
	}

	private void defaultDestroy(POOLABLE poolable) {
		if (poolable instanceof Disposable) {
			((Disposable) poolable).dispose();
		}
		else if (poolable instanceof Closeable) {
			try {
				((Closeable) poolable).close();
			}
			catch (IOException e) {
				logger.warn("Failure while discarding a Poolable that is Closeable, could not close", e);
			}
		}
	}

	/**
	 * Apply the configured destroy hook, or the default destroy procedure if none, and record the
	 * relevant metrics. This doesn't touch the capacity gate: the slot is expected to hold no permit anymore.
	 * MUST NOT be called while holding the pool lock.
	 *
	 * @param slot the {@link PooledSlot} that is not part of the live set anymore
	 */
	void destroyPoolable(PooledSlot<POOLABLE> slot) {
		if (slot.state == PooledSlot.STATE_DESTROYED) {
			throw new IllegalStateException("destroying already destroyed slot " + slot);
		}
		slot.state = PooledSlot.STATE_DESTROYED;
		long start = clock.millis();
		metricsRecorder.recordLifetimeDuration(slot.lifeTime());
		Consumer<POOLABLE> onDestroy = poolConfig.onDestroy();
		if (onDestroy == null) {
			try {
				defaultDestroy(slot.poolable);
			}
			catch (RuntimeException disposeError) {
				logger.warn("Pool '" + poolConfig.name() + "': failed to dispose " + slot.poolable, disposeError);
			}
		}
		else {
			runHook("onDestroy", onDestroy, slot.poolable);
		}
		metricsRecorder.recordDestroyLatency(clock.millis() - start);
	}

	/**
	 * The bookkeeping a pool keeps about each of its resources. Mutable fields are guarded by the pool lock.
	 */
	static final class PooledSlot<T> implements PooledRefMetadata {

		static final int STATE_IDLE      = 0;
		static final int STATE_ACQUIRED  = 1;
		static final int STATE_CHECKING  = 2;
		static final int STATE_CONDEMNED = 3;
		static final int STATE_DESTROYED = 4;

		final T     poolable;
		final long  sequence;
		final Clock clock;
		final long  allocationTimestamp;

		volatile int state;
		int          acquireCount;
		long         acquireTimestamp;
		long         releaseTimestamp;

		PooledSlot(T poolable, long sequence, Clock clock) {
			this.poolable = poolable;
			this.sequence = sequence;
			this.clock = clock;
			this.allocationTimestamp = clock.millis();
			this.acquireTimestamp = allocationTimestamp;
			this.releaseTimestamp = allocationTimestamp;
			this.state = STATE_IDLE;
		}

		void markAcquired(long now) {
			this.state = STATE_ACQUIRED;
			this.acquireCount++;
			this.acquireTimestamp = now;
		}

		void markReleased(long now) {
			this.state = STATE_IDLE;
			this.releaseTimestamp = now;
		}

		@Override
		public long sequence() {
			return sequence;
		}

		@Override
		public int acquireCount() {
			return acquireCount;
		}

		@Override
		public long allocationTimestamp() {
			return allocationTimestamp;
		}

		@Override
		public long acquireTimestamp() {
			return acquireTimestamp;
		}

		@Override
		public long releaseTimestamp() {
			return releaseTimestamp;
		}

		@Override
		public long lifeTime() {
			return clock.millis() - allocationTimestamp;
		}

		@Override
		public long idleTime() {
			if (state == STATE_ACQUIRED) {
				return 0L;
			}
			return clock.millis() - releaseTimestamp;
		}

		@Override
		public long borrowTime() {
			if (state != STATE_ACQUIRED) {
				return 0L;
			}
			return clock.millis() - acquireTimestamp;
		}

		@Override
		public String toString() {
			return "PooledSlot{" +
					"poolable=" + poolable +
					", sequence=" + sequence +
					", acquireCount=" + acquireCount +
					", state=" + state +
					'}';
		}
	}
}
