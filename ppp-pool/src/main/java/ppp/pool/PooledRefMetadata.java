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

/**
 * Metadata the {@link Pool} tracks alongside each pooled resource, which includes monotonic metrics like
 * its age ({@link #lifeTime()}) and number of times it was acquired ({@link #acquireCount()}), as well
 * as contextually changing metrics like the duration for which it has been idle ({@link #idleTime()})
 * or borrowed ({@link #borrowTime()}).
 * <p>
 * All timestamps and durations are in milliseconds, as measured by the {@link PoolConfig#clock()}.
 */
public interface PooledRefMetadata {

	/**
	 * @return the creation sequence number of the resource within its pool
	 */
	long sequence();

	/**
	 * Return the number of times the underlying pooled object has been acquired by consumers of the {@link Pool}.
	 * Transient borrows made by health checks are not counted.
	 *
	 * @return the number of times this object has been used by consumers of the pool
	 */
	int acquireCount();

	/**
	 * @return the timestamp at which the resource was created
	 */
	long allocationTimestamp();

	/**
	 * @return the timestamp at which the resource was last acquired, or its allocation timestamp if never acquired
	 */
	long acquireTimestamp();

	/**
	 * @return the timestamp at which the resource was last released, or its allocation timestamp if never released
	 */
	long releaseTimestamp();

	/**
	 * @return the wall-clock age (time since allocation) of the underlying object
	 */
	long lifeTime();

	/**
	 * Returns the time since the reference was last released (or allocated, if it was never released).
	 * A resource that is currently acquired returns {@literal 0L}.
	 *
	 * @return the time since the reference was last released
	 */
	long idleTime();

	/**
	 * Returns the time since the resource was last acquired. A resource that is currently idle
	 * returns {@literal 0L}.
	 *
	 * @return the time since the reference was last acquired
	 */
	long borrowTime();
}
