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

package ppp.proxy;

/**
 * How a {@link Proxy} maps execution contexts to bound objects.
 */
public enum ProxyScope {

	/**
	 * A single fixed object is shared by every context. The object must be thread-safe.
	 */
	SHARED,

	/**
	 * Each thread lazily acquires its own object from the pool and keeps it until it releases it.
	 */
	THREAD,

	/**
	 * Each logical task, as identified by a caller-supplied context key (a request id for instance),
	 * lazily acquires its own object from the pool and keeps it until it releases it. Useful when a
	 * task hops threads.
	 */
	TASK
}
