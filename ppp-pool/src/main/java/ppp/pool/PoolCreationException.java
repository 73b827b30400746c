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
 * Thrown to the caller of {@link Pool#acquire()} when the {@link PoolableFactory} failed to create
 * the resource that would have served the acquisition. The factory failure is available as the {@link #getCause() cause}.
 */
public class PoolCreationException extends PoolException {

	private final long sequence;

	public PoolCreationException(long sequence, Throwable cause) {
		super("Pool resource #" + sequence + " could not be created: " + cause, cause);
		this.sequence = sequence;
	}

	/**
	 * @return the creation sequence number that was passed to the failing factory
	 */
	public long getSequence() {
		return sequence;
	}
}
