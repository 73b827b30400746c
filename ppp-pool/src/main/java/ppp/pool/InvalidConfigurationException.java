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
 * Denotes conflicting or missing setup, like a {@link PoolBuilder} asking for health checks while background
 * housekeeping is disabled, or a {@link ppp.proxy.Proxy} bound to both a shared object and a pool.
 * This is a programming error and retrying will not help.
 */
public class InvalidConfigurationException extends PoolException {

	public InvalidConfigurationException(String message) {
		super(message);
	}
}
