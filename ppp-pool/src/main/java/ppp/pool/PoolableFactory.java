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
 * The blocking creator of poolable resources, invoked each time a {@link Pool} needs a new one.
 * <p>
 * Creation is performed outside of the pool's bookkeeping lock, so it is acceptable for implementations
 * to block for as long as the underlying resource takes to open (eg. a browser session or a network connection).
 *
 * @param <POOLABLE> the type of resource created
 */
@FunctionalInterface
public interface PoolableFactory<POOLABLE> {

	/**
	 * Create a new resource.
	 *
	 * @param sequence the number of resources successfully created by the pool so far
	 * @return the new resource, never {@code null}
	 * @throws Exception if the resource could not be created
	 */
	POOLABLE create(long sequence) throws Exception;
}
