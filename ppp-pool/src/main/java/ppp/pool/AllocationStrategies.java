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
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Various pre-made {@link AllocationStrategy} for internal use.
 */
final class AllocationStrategies {

	static final class UnboundedAllocationStrategy extends AtomicInteger implements AllocationStrategy {

		final int min;

		UnboundedAllocationStrategy(int min) {
			if (min < 0) throw new IllegalArgumentException("min must be positive or zero");
			this.min = min;
		}

		@Override
		public boolean getPermit(Duration timeout) {
			return tryGetPermit();
		}

		@Override
		public boolean tryGetPermit() {
			int overflowCheck = incrementAndGet();
			if (overflowCheck < 0) {
				compareAndSet(overflowCheck, Integer.MAX_VALUE);
			}
			return true;
		}

		@Override
		public int estimatePermitCount() {
			return Integer.MAX_VALUE;
		}

		@Override
		public void returnPermit() {
			int updated = decrementAndGet();
			if (updated < 0) {
				compareAndSet(updated, 0);
			}
		}

		@Override
		public int permitMinimum() {
			return min;
		}

		@Override
		public int permitMaximum() {
			return Integer.MAX_VALUE;
		}

		@Override
		public int permitGranted() {
			return get();
		}

		@Override
		public String toString() {
			return "UnboundedAllocationStrategy{min=" + min + ", granted=" + get() + "}";
		}
	}

	static final class SizeBasedAllocationStrategy implements AllocationStrategy {

		final int       min;
		final int       max;
		final Semaphore permits;

		SizeBasedAllocationStrategy(int min, int max) {
			if (min < 0) throw new IllegalArgumentException("min must be positive or zero");
			if (max < 1) throw new IllegalArgumentException("max must be strictly positive");
			if (min > max) throw new IllegalArgumentException("min must be less than or equal to max");
			this.min = min;
			this.max = max;
			//no fairness: a released permit goes to whichever waiter wins
			this.permits = new Semaphore(max, false);
		}

		@Override
		public boolean getPermit(Duration timeout) throws InterruptedException {
			if (timeout.isZero()) {
				permits.acquire();
				return true;
			}
			return permits.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS);
		}

		@Override
		public boolean tryGetPermit() {
			return permits.tryAcquire();
		}

		@Override
		public int estimatePermitCount() {
			return permits.availablePermits();
		}

		@Override
		public int permitMinimum() {
			return min;
		}

		@Override
		public int permitMaximum() {
			return max;
		}

		@Override
		public int permitGranted() {
			return max - permits.availablePermits();
		}

		@Override
		public void returnPermit() {
			int p = permits.availablePermits();
			if (p + 1 > max) {
				throw new IllegalStateException("Too many permits returned: would bring to " + (p + 1) + "/" + max);
			}
			permits.release();
		}

		@Override
		public String toString() {
			return "SizeBasedAllocationStrategy{min=" + min + ", max=" + max + ", available=" + permits.availablePermits() + "}";
		}
	}
}
