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
 * Thrown when an acquisition is attempted on (or was still waiting on) a {@link Pool} that has been
 * {@link Pool#dispose() shut down}.
 */
public class PoolShutdownException extends PoolException {

	public PoolShutdownException(String poolName) {
		super("Pool '" + poolName + "' has been shut down");
	}
}
