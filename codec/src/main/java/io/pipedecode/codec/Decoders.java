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

package io.pipedecode.codec;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import io.pipedecode.functional.Either;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.*;
import java.util.function.BiFunction;

import static io.pipedecode.util.Preconditions.*;
import static java.util.Arrays.asList;
import static java.util.Collections.singletonList;

/**
 * Primitive decoders over Gson trees, and the basic ways of combining them.
 */
public final class Decoders {
	private Decoders() {
	}

	public static final Decoder<String> STRING = input -> JsonKind.of(input) == JsonKind.STRING ?
			Either.right(input.getAsString()) :
			Either.left(DecodeError.typeMismatch("a string", input));

	public static final Decoder<Boolean> BOOLEAN = input -> JsonKind.of(input) == JsonKind.BOOLEAN ?
			Either.right(input.getAsBoolean()) :
			Either.left(DecodeError.typeMismatch("a boolean", input));

	public static final Decoder<Integer> INT = input -> {
		if (JsonKind.of(input) != JsonKind.NUMBER) {
			return Either.left(DecodeError.typeMismatch("an int", input));
		}
		try {
			return Either.right(input.getAsBigDecimal().intValueExact());
		} catch (ArithmeticException | NumberFormatException e) {
			return Either.left(DecodeError.typeMismatch("an int", input));
		}
	};

	public static final Decoder<Long> LONG = input -> {
		if (JsonKind.of(input) != JsonKind.NUMBER) {
			return Either.left(DecodeError.typeMismatch("a long", input));
		}
		try {
			return Either.right(input.getAsBigDecimal().longValueExact());
		} catch (ArithmeticException | NumberFormatException e) {
			return Either.left(DecodeError.typeMismatch("a long", input));
		}
	};

	public static final Decoder<Double> DOUBLE = input -> JsonKind.of(input) == JsonKind.NUMBER ?
			Either.right(input.getAsDouble()) :
			Either.left(DecodeError.typeMismatch("a double", input));

	public static final Decoder<BigDecimal> BIG_DECIMAL = input -> {
		if (JsonKind.of(input) != JsonKind.NUMBER) {
			return Either.left(DecodeError.typeMismatch("a decimal number", input));
		}
		try {
			return Either.right(input.getAsBigDecimal());
		} catch (NumberFormatException e) {
			// lenient input may carry NaN or Infinity
			return Either.left(DecodeError.typeMismatch("a decimal number", input));
		}
	};

	/**
	 * Succeeds with {@code value} on a {@code null} node and fails on anything else.
	 */
	public static <T> Decoder<T> nullValue(@Nullable T value) {
		return input -> JsonKind.of(input) == JsonKind.NULL ?
				Either.right(value) :
				Either.left(DecodeError.typeMismatch("null", input));
	}

	/**
	 * Succeeds with Java {@code null} on a {@code null} node, delegates everything else.
	 */
	public static <T> Decoder<T> nullable(Decoder<T> decoder) {
		checkNotNull(decoder);
		return input -> JsonKind.of(input) == JsonKind.NULL ?
				Either.right(null) :
				decoder.decode(input);
	}

	/**
	 * Captures the node itself, as a copy detached from the input tree.
	 */
	public static Decoder<JsonElement> value() {
		return input -> Either.right(input != null ? input.deepCopy() : JsonNull.INSTANCE);
	}

	public static <T> Decoder<T> succeed(@Nullable T value) {
		return input -> Either.right(value);
	}

	public static <T> Decoder<T> fail(String message) {
		DecodeError error = DecodeError.failure(message);
		return input -> Either.left(error);
	}

	/**
	 * Runs {@code decoder} on the value of key {@code key} of an object node.
	 */
	public static <T> Decoder<T> field(String key, Decoder<T> decoder) {
		return at(singletonList(checkNotNull(key, "Key must not be null")), decoder);
	}

	/**
	 * Runs {@code decoder} on the value found by following the keys of {@code path}.
	 * Every node along the way, {@code null} included, must be an object that has the next key.
	 */
	public static <T> Decoder<T> at(List<String> path, Decoder<T> decoder) {
		List<String> keys = Collections.unmodifiableList(new ArrayList<>(checkNoNulls(path, "Path must not contain nulls")));
		checkNotNull(decoder);
		return input -> {
			PathLookup lookup = PathLookup.find(input, keys, false);
			if (lookup.getOutcome() != PathLookup.Outcome.FOUND) {
				return Either.left(lookup.toError());
			}
			return decoder.decode(lookup.getValue()).mapLeft(e -> e.prependPath(keys));
		};
	}

	public static <T> Decoder<T> at(Decoder<T> decoder, String... path) {
		return at(asList(path), decoder);
	}

	/**
	 * Runs {@code decoder} on the element at {@code index} of an array node.
	 */
	public static <T> Decoder<T> index(int index, Decoder<T> decoder) {
		checkArgument(index >= 0, "Index must not be negative: %d", index);
		checkNotNull(decoder);
		return input -> {
			if (JsonKind.of(input) != JsonKind.ARRAY) {
				return Either.left(DecodeError.notAContainer(JsonKind.ARRAY.getDescription(), input));
			}
			JsonArray array = input.getAsJsonArray();
			if (index >= array.size()) {
				return Either.left(DecodeError.fieldMissing(index));
			}
			return decoder.decode(array.get(index)).mapLeft(e -> e.prependIndex(index));
		};
	}

	public static <T> Decoder<List<T>> listOf(Decoder<T> decoder) {
		checkNotNull(decoder);
		return input -> {
			if (JsonKind.of(input) != JsonKind.ARRAY) {
				return Either.left(DecodeError.typeMismatch(JsonKind.ARRAY.getDescription(), input));
			}
			JsonArray array = input.getAsJsonArray();
			List<T> list = new ArrayList<>(array.size());
			for (int i = 0; i < array.size(); i++) {
				Either<DecodeError, T> item = decoder.decode(array.get(i));
				if (item.isLeft()) {
					return Either.left(item.getLeft().prependIndex(i));
				}
				list.add(item.getRight());
			}
			return Either.right(Collections.unmodifiableList(list));
		};
	}

	/**
	 * Decodes every value of an object node, keeping the order of its keys.
	 */
	public static <T> Decoder<Map<String, T>> mapOf(Decoder<T> decoder) {
		checkNotNull(decoder);
		return input -> {
			if (JsonKind.of(input) != JsonKind.OBJECT) {
				return Either.left(DecodeError.typeMismatch(JsonKind.OBJECT.getDescription(), input));
			}
			Map<String, T> map = new LinkedHashMap<>();
			for (Map.Entry<String, JsonElement> entry : input.getAsJsonObject().entrySet()) {
				Either<DecodeError, T> value = decoder.decode(entry.getValue());
				if (value.isLeft()) {
					return Either.left(value.getLeft().prependKey(entry.getKey()));
				}
				map.put(entry.getKey(), value.getRight());
			}
			return Either.right(Collections.unmodifiableMap(map));
		};
	}

	/**
	 * Runs both decoders on the same input, first to second, and combines their values.
	 * The first failure is returned as is.
	 */
	public static <T1, T2, R> Decoder<R> map2(Decoder<T1> decoder1, Decoder<T2> decoder2,
			BiFunction<? super T1, ? super T2, ? extends R> fn) {
		checkNotNull(decoder1);
		checkNotNull(decoder2);
		checkNotNull(fn);
		return input -> decoder1.decode(input)
				.flatMapRight(value1 -> decoder2.decode(input)
						.mapRight(value2 -> fn.apply(value1, value2)));
	}

	/**
	 * Tries the decoders in order and returns the first success.
	 * If all of them fail, the failure of the last one is returned.
	 */
	@SafeVarargs
	public static <T> Decoder<T> oneOf(Decoder<? extends T>... decoders) {
		return oneOf(asList(decoders));
	}

	@SuppressWarnings("unchecked")
	public static <T> Decoder<T> oneOf(List<Decoder<? extends T>> decoders) {
		List<Decoder<? extends T>> list = new ArrayList<>(checkNoNulls(decoders, "Decoders must not be null"));
		checkArgument(!list.isEmpty(), "At least one decoder is required");
		return input -> {
			Either<DecodeError, ? extends T> result = null;
			for (Decoder<? extends T> decoder : list) {
				result = decoder.decode(input);
				if (result.isRight()) {
					break;
				}
			}
			return (Either<DecodeError, T>) result;
		};
	}
}
