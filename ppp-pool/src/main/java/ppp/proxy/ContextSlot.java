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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

import ppp.pool.InvalidConfigurationException;

/**
 * Holds at most one bound object per execution context.
 */
interface ContextSlot<T> {

	@Nullable
	T get();

	void set(T object);

	/**
	 * Unbind the object of the current context, if any.
	 *
	 * @return the previously bound object, or {@code null}
	 */
	@Nullable
	T clear();

	static <T> ContextSlot<T> perThread() {
		return new ThreadLocalSlot<>();
	}

	static <T> ContextSlot<T> perTask(Supplier<?> contextKey) {
		return new KeyedSlot<>(contextKey);
	}

	final class ThreadLocalSlot<T> implements ContextSlot<T> {

		final ThreadLocal<T> local = new ThreadLocal<>();

		@Override
		public @Nullable T get() {
			return local.get();
		}

		@Override
		public void set(T object) {
			local.set(object);
		}

		@Override
		public @Nullable T clear() {
			T previous = local.get();
			local.remove();
			return previous;
		}

		@Override
		public String toString() {
			return "ThreadLocalSlot";
		}
	}

	final class KeyedSlot<T> implements ContextSlot<T> {

		final Supplier<?>    contextKey;
		final Map<Object, T> bound = new ConcurrentHashMap<>();

		KeyedSlot(Supplier<?> contextKey) {
			this.contextKey = contextKey;
		}

		Object currentKey() {
			Object key = contextKey.get();
			if (key == null) {
				throw new InvalidConfigurationException("TASK scoped proxy used outside of a task: context key is null");
			}
			return key;
		}

		@Override
		public @Nullable T get() {
			return bound.get(currentKey());
		}

		@Override
		public void set(T object) {
			bound.put(currentKey(), object);
		}

		@Override
		public @Nullable T clear() {
			return bound.remove(currentKey());
		}

		@Override
		public String toString() {
			return "KeyedSlot{bound=" + bound.size() + "}";
		}
	}
}
