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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * A point-in-time snapshot of a {@link Pool}, as returned by {@link Pool#stats()}.
 * <p>
 * Instances are immutable JavaBeans made of strings, numbers, lists and maps, so they can be handed
 * as-is to a JSON serializer. Counters are cumulative since the pool was built, durations are in
 * milliseconds and instants are ISO-8601 strings.
 */
public final class PoolStats {

	String              name                   = "";
	String              started                = "";
	String              now                    = "";
	long                runningMs;
	boolean             shutdown;
	Map<String, Object> config                 = Collections.emptyMap();

	int                 permitsAvailable;
	int                 permitsGranted;
	int                 permitsMaximum;

	int                 live;
	int                 availableCount;
	int                 inUseCount;
	int                 pendingDestroyCount;

	@Nullable Long      msSinceLastHousekeeping;
	double              averageHousekeepingMs;

	long                created;
	long                creationAttempts;
	long                uses;
	long                borrows;
	long                returns;
	long                killed;
	long                recycled;
	long                wornOut;
	long                destroyed;
	long                healthChecks;
	long                badHealth;
	long                housekeepingRounds;
	long                housekeepingErrors;
	long                healthCheckRounds;
	long                healthCheckErrors;

	List<ResourceStats> available              = Collections.emptyList();
	List<ResourceStats> inUse                  = Collections.emptyList();

	PoolStats() {
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the instant the pool was built
	 */
	public String getStarted() {
		return started;
	}

	/**
	 * @return the instant this snapshot was taken
	 */
	public String getNow() {
		return now;
	}

	public long getRunningMs() {
		return runningMs;
	}

	public boolean isShutdown() {
		return shutdown;
	}

	/**
	 * @return the effective configuration of the pool, durations in milliseconds
	 */
	public Map<String, Object> getConfig() {
		return config;
	}

	public int getPermitsAvailable() {
		return permitsAvailable;
	}

	public int getPermitsGranted() {
		return permitsGranted;
	}

	public int getPermitsMaximum() {
		return permitsMaximum;
	}

	/**
	 * @return the number of live resources, ie. available plus in use
	 */
	public int getLive() {
		return live;
	}

	public int getAvailableCount() {
		return availableCount;
	}

	public int getInUseCount() {
		return inUseCount;
	}

	public int getPendingDestroyCount() {
		return pendingDestroyCount;
	}

	/**
	 * @return milliseconds since the last housekeeping round started, or {@code null} if none ran yet
	 */
	public @Nullable Long getMsSinceLastHousekeeping() {
		return msSinceLastHousekeeping;
	}

	public double getAverageHousekeepingMs() {
		return averageHousekeepingMs;
	}

	public long getCreated() {
		return created;
	}

	/**
	 * @return the number of factory invocations, including the failed ones
	 */
	public long getCreationAttempts() {
		return creationAttempts;
	}

	/**
	 * @return the total number of acquisitions, summed over live and destroyed resources
	 */
	public long getUses() {
		return uses;
	}

	public long getBorrows() {
		return borrows;
	}

	public long getReturns() {
		return returns;
	}

	/**
	 * @return the number of resources forcibly reclaimed from their borrower
	 */
	public long getKilled() {
		return killed;
	}

	/**
	 * @return the number of resources destroyed for being idle for too long
	 */
	public long getRecycled() {
		return recycled;
	}

	public long getWornOut() {
		return wornOut;
	}

	public long getDestroyed() {
		return destroyed;
	}

	public long getHealthChecks() {
		return healthChecks;
	}

	public long getBadHealth() {
		return badHealth;
	}

	public long getHousekeepingRounds() {
		return housekeepingRounds;
	}

	public long getHousekeepingErrors() {
		return housekeepingErrors;
	}

	public long getHealthCheckRounds() {
		return healthCheckRounds;
	}

	public long getHealthCheckErrors() {
		return healthCheckErrors;
	}

	public List<ResourceStats> getAvailable() {
		return available;
	}

	public List<ResourceStats> getInUse() {
		return inUse;
	}

	@Override
	public String toString() {
		return "PoolStats{" +
				"name='" + name + '\'' +
				", live=" + live +
				", available=" + availableCount +
				", inUse=" + inUseCount +
				", pendingDestroy=" + pendingDestroyCount +
				", permitsAvailable=" + permitsAvailable +
				", created=" + created +
				", destroyed=" + destroyed +
				", shutdown=" + shutdown +
				'}';
	}

	/**
	 * Per-resource part of a {@link PoolStats} snapshot.
	 */
	public static final class ResourceStats {

		final Object description;
		final long   sequence;
		final int    uses;
		final long   msSinceCreation;
		final long   msSinceAcquire;
		final long   msSinceRelease;

		ResourceStats(Object description, long sequence, int uses, long msSinceCreation, long msSinceAcquire, long msSinceRelease) {
			this.description = description;
			this.sequence = sequence;
			this.uses = uses;
			this.msSinceCreation = msSinceCreation;
			this.msSinceAcquire = msSinceAcquire;
			this.msSinceRelease = msSinceRelease;
		}

		/**
		 * @return the result of the describe hook, or the {@link Object#toString()} of the resource
		 */
		public Object getDescription() {
			return description;
		}

		public long getSequence() {
			return sequence;
		}

		public int getUses() {
			return uses;
		}

		public long getMsSinceCreation() {
			return msSinceCreation;
		}

		public long getMsSinceAcquire() {
			return msSinceAcquire;
		}

		public long getMsSinceRelease() {
			return msSinceRelease;
		}

		@Override
		public String toString() {
			return "ResourceStats{" + description + ", uses=" + uses + '}';
		}
	}
}
