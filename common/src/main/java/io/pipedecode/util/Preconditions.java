/*
 * Copyright (C) 2015-2018 SoftIndex LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.pipedecode.util;

import java.util.Collection;

public final class Preconditions {
	private Preconditions() {
	}

	public static <T> T checkNotNull(T reference) {
		if (reference != null) {
			return reference;
		}
		throw new NullPointerException();
	}

	public static <T> T checkNotNull(T reference, Object message) {
		if (reference != null) {
			return reference;
		}
		throw new NullPointerException(String.valueOf(message));
	}

	public static <T> T checkNotNull(T reference, String template, Object... args) {
		if (reference != null) {
			return reference;
		}
		throw new NullPointerException(String.format(template, args));
	}

	/**
	 * Checks that neither the collection nor any of its elements is {@code null}.
	 */
	public static <C extends Collection<?>> C checkNoNulls(C collection, Object message) {
		checkNotNull(collection, message);
		for (Object element : collection) {
			if (element == null) {
				throw new NullPointerException(String.valueOf(message));
			}
		}
		return collection;
	}

	public static void checkState(boolean expression, Object message) {
		if (!expression) {
			throw new IllegalStateException(String.valueOf(message));
		}
	}

	public static void checkArgument(boolean expression, Object message) {
		if (!expression) {
			throw new IllegalArgumentException(String.valueOf(message));
		}
	}

	public static void checkArgument(boolean expression, String template, Object... args) {
		if (!expression) {
			throw new IllegalArgumentException(String.format(template, args));
		}
	}
}
