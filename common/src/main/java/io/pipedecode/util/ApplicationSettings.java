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

import org.jetbrains.annotations.Nullable;

import java.util.function.Function;

/**
 * Reads tunables from JVM system properties.
 * <p>
 * A setting {@code name} of class {@code type} is looked up first as
 * {@code <fully qualified class name>.<name>}, then as {@code <simple class name>.<name>}.
 */
public final class ApplicationSettings {
	private ApplicationSettings() {
		throw new AssertionError();
	}

	@Nullable
	public static String getString(Class<?> type, String name, @Nullable String defValue) {
		String property;
		property = System.getProperty(type.getName() + "." + name);
		if (property != null) return property;
		property = System.getProperty(type.getSimpleName() + "." + name);
		if (property != null) return property;
		return defValue;
	}

	public static <T> T get(Function<String, T> parser, Class<?> type, String name, T defValue) {
		String property = getString(type, name, null);
		if (property != null) {
			return parser.apply(property.trim());
		}
		return defValue;
	}

	public static int getInt(Class<?> type, String name, int defValue) {
		return get(Integer::parseInt, type, name, defValue);
	}

	public static boolean getBoolean(Class<?> type, String name, boolean defValue) {
		return get(Boolean::parseBoolean, type, name, defValue);
	}
}
