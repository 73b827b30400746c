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

/**
 * A specialized {@link PoolException} that denotes that a {@link Pool#acquire(Duration)} could not obtain
 * a capacity permit within the given {@link Duration}, which can be obtained via {@link #getAcquireTimeout()}.
 * No permit is held by the caller when this is thrown, so the acquisition can simply be retried.
 */
public class PoolAcquireTimeoutException extends PoolException {

	private final Duration acquireTimeout;

	public PoolAcquireTimeoutException(Duration acquireTimeout) {
		super("Pool#acquire(Duration) has been pending for more than the configured timeout of " + acquireTimeout.toMillis() + "ms");
		this.acquireTimeout = acquireTimeout;
	}

	/**
	 * @return the acquire timeout that was just overshot
	 */
	public Duration getAcquireTimeout() {
		return acquireTimeout;
	}
}
