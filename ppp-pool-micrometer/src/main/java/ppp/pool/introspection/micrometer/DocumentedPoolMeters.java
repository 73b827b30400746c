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

import java.util.Locale;

import io.micrometer.common.docs.KeyName;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.docs.MeterDocumentation;

import ppp.pool.PoolMetricsRecorder;

/**
 * Meters used by {@link Micrometer} utility.
 */
enum DocumentedPoolMeters implements MeterDocumentation {

	/**
	 * Gauge of the number of borrowed resources.
	 */
	ACQUIRED {
		@Override
		public String getName() {
			return "ppp.pool.resources.acquired";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}
	},

	/**
	 * Gauge of the number of live resources, borrowed or idle.
	 */
	ALLOCATED {
		@Override
		public String getName() {
			return "ppp.pool.resources.allocated";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}
	},

	/**
	 * Gauge of the number of idle resources.
	 */
	IDLE {
		@Override
		public String getName() {
			return "ppp.pool.resources.idle";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}
	},

	/**
	 * Gauge of the number of resources waiting to be destroyed.
	 */
	PENDING_DESTROY {
		@Override
		public String getName() {
			return "ppp.pool.resources.pendingDestroy";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}
	},

	/**
	 * Timer of resource creations, tagged with their outcome.
	 */
	ALLOCATION {
		@Override
		public String getName() {
			return "ppp.pool.allocation";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return AllocationTags.values();
		}
	},

	DESTROYED {
		@Override
		public String getName() {
			return "ppp.pool.destroyed";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}
	},

	/**
	 * Counter of resources that left the live set, tagged with the reason why.
	 */
	EVICTED {
		@Override
		public String getName() {
			return "ppp.pool.evicted";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.COUNTER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return EvictionTags.values();
		}
	},

	/**
	 * Timer of background housekeeping rounds.
	 */
	HOUSEKEEPING {
		@Override
		public String getName() {
			return "ppp.pool.housekeeping";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}
	},

	/**
	 * Timer of the wait for capacity of acquisitions, tagged with their outcome.
	 */
	PENDING {
		@Override
		public String getName() {
			return "ppp.pool.pending";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return PendingTags.values();
		}
	},

	/**
	 * Counter of resources put back into the pool after a release.
	 */
	RECYCLED {
		@Override
		public String getName() {
			return "ppp.pool.recycled";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.COUNTER;
		}
	},

	SUMMARY_BORROW {
		@Override
		public String getName() {
			return "ppp.pool.resources.summary.borrow";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}
	},

	SUMMARY_IDLENESS {
		@Override
		public String getName() {
			return "ppp.pool.resources.summary.idleness";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}
	},

	SUMMARY_LIFETIME {
		@Override
		public String getName() {
			return "ppp.pool.resources.summary.lifetime";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}
	};

	public enum CommonTags implements KeyName {

		/**
		 * The name of the pool, set on every meter.
		 */
		POOL_NAME {
			@Override
			public String asString() {
				return "pool.name";
			}
		}
	}

	public enum AllocationTags implements KeyName {

		/**
		 * Indicates whether the allocation timed was a {@code success} or {@code failure}.
		 */
		OUTCOME {
			@Override
			public String asString() {
				return "pool.allocation.outcome";
			}
		};

		public static final Tag OUTCOME_SUCCESS = Tag.of(OUTCOME.asString(), "success");
		public static final Tag OUTCOME_FAILURE = Tag.of(OUTCOME.asString(), "failure");
	}

	public enum PendingTags implements KeyName {

		/**
		 * Indicates whether the wait for capacity ended with a {@code success} or a {@code failure} (timeout).
		 */
		OUTCOME {
			@Override
			public String asString() {
				return "pool.pending.outcome";
			}
		};

		public static final Tag OUTCOME_SUCCESS = Tag.of(OUTCOME.asString(), "success");
		public static final Tag OUTCOME_FAILURE = Tag.of(OUTCOME.asString(), "failure");
	}

	public enum EvictionTags implements KeyName {

		/**
		 * The {@link PoolMetricsRecorder.EvictionReason} in lower case.
		 */
		REASON {
			@Override
			public String asString() {
				return "pool.eviction.reason";
			}
		};

		static Tag reason(PoolMetricsRecorder.EvictionReason reason) {
			return Tag.of(REASON.asString(), reason.name().toLowerCase(Locale.ROOT));
		}
	}
}
