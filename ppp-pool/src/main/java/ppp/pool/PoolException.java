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
 * Base class of all the errors a {@link Pool} or a {@link ppp.proxy.Proxy} can surface to its callers.
 *
 * @see PoolAcquireTimeoutException
 * @see PoolCreationException
 * @see PoolShutdownException
 * @see InvalidConfigurationException
 */
public class PoolException extends RuntimeException {

	public PoolException(String message) {
		super(message);
	}

	public PoolException(String message, Throwable cause) {
		super(message, cause);
	}
}
