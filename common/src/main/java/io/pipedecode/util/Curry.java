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

import java.util.function.BiFunction;
import java.util.function.Function;

import static io.pipedecode.util.Preconditions.checkNotNull;

/**
 * Turns N-argument constructors into chains of one-argument functions,
 * so that each argument can be supplied separately, in declaration order.
 * <pre>
 * Function&lt;Integer, Function&lt;String, User&gt;&gt; ctor = Curry.curry(User::new);
 * User user = ctor.apply(1).apply("sarah");
 * </pre>
 */
public final class Curry {
	private Curry() {
	}

	public static <T1, T2, R> Function<T1, Function<T2, R>> curry(BiFunction<T1, T2, R> constructor) {
		checkNotNull(constructor);
		return value1 -> value2 -> constructor.apply(value1, value2);
	}

	public static <T1, T2, T3, R> Function<T1, Function<T2, Function<T3, R>>> curry(
			Constructor3<T1, T2, T3, R> constructor) {
		checkNotNull(constructor);
		return value1 -> value2 -> value3 -> constructor.create(value1, value2, value3);
	}

	public static <T1, T2, T3, T4, R> Function<T1, Function<T2, Function<T3, Function<T4, R>>>> curry(
			Constructor4<T1, T2, T3, T4, R> constructor) {
		checkNotNull(constructor);
		return value1 -> value2 -> value3 -> value4 ->
				constructor.create(value1, value2, value3, value4);
	}

	public static <T1, T2, T3, T4, T5, R> Function<T1, Function<T2, Function<T3, Function<T4, Function<T5, R>>>>> curry(
			Constructor5<T1, T2, T3, T4, T5, R> constructor) {
		checkNotNull(constructor);
		return value1 -> value2 -> value3 -> value4 -> value5 ->
				constructor.create(value1, value2, value3, value4, value5);
	}

	public static <T1, T2, T3, T4, T5, T6, R> Function<T1, Function<T2, Function<T3, Function<T4, Function<T5, Function<T6, R>>>>>> curry(
			Constructor6<T1, T2, T3, T4, T5, T6, R> constructor) {
		checkNotNull(constructor);
		return value1 -> value2 -> value3 -> value4 -> value5 -> value6 ->
				constructor.create(value1, value2, value3, value4, value5, value6);
	}
}
