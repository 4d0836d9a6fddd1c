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

import com.google.gson.JsonElement;
import io.pipedecode.functional.Either;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import static io.pipedecode.util.Preconditions.checkNoNulls;
import static io.pipedecode.util.Preconditions.checkNotNull;
import static java.util.Collections.singletonList;

/**
 * Builds record decoders field by field.
 * <p>
 * A pipeline starts from {@link #decode(Object)} with a curried constructor, and each step
 * supplies the next constructor argument:
 * <pre>
 * Decoder&lt;User&gt; userDecoder = Pipeline.decode(Curry.curry(User::new))
 *     .pipe(required("id", Decoders.INT))
 *     .pipe(requiredAt(asList("profile", "email"), Decoders.STRING))
 *     .pipe(optional("name", Decoders.STRING, "anonymous"))
 *     .pipe(hardcoded(Role.GUEST));
 * </pre>
 * Steps are applied in the order they are written, which is also the order
 * of the constructor arguments. Every step returns a new decoder.
 */
public final class Pipeline {
	private static final Logger logger = LoggerFactory.getLogger(Pipeline.class);

	private Pipeline() {
	}

	/**
	 * Starts a pipeline from a constructor, which is usually a curried function.
	 * The resulting decoder ignores its input and always succeeds.
	 */
	public static <T> Decoder<T> decode(T constructor) {
		return Decoders.succeed(checkNotNull(constructor, "Constructor must not be null"));
	}

	/**
	 * Runs {@code pipeline} and then {@code argDecoder} on the same input, and applies
	 * the function obtained from the first to the value obtained from the second.
	 * <p>
	 * A failure of the pipeline is returned as is, without running {@code argDecoder};
	 * a failure of {@code argDecoder} is returned as is as well.
	 */
	public static <A, B> Decoder<B> apply(Decoder<Function<A, B>> pipeline, Decoder<A> argDecoder) {
		checkNotNull(pipeline);
		checkNotNull(argDecoder);
		return input -> pipeline.decode(input)
				.flatMapRight(fn -> argDecoder.decode(input).mapRight(fn));
	}

	/**
	 * Supplies the next constructor argument from an arbitrary decoder run on the whole input.
	 */
	public static <A, B> Function<Decoder<Function<A, B>>, Decoder<B>> custom(Decoder<A> argDecoder) {
		checkNotNull(argDecoder);
		return pipeline -> apply(pipeline, argDecoder);
	}

	/**
	 * Supplies the next argument from the value of key {@code key}, which must be present.
	 * A {@code null} value is passed to {@code valueDecoder} like any other value.
	 */
	public static <A, B> Function<Decoder<Function<A, B>>, Decoder<B>> required(String key, Decoder<A> valueDecoder) {
		return custom(Decoders.field(key, valueDecoder));
	}

	/**
	 * Supplies the next argument from the value at the end of {@code path}, which must be present.
	 */
	public static <A, B> Function<Decoder<Function<A, B>>, Decoder<B>> requiredAt(List<String> path, Decoder<A> valueDecoder) {
		return custom(Decoders.at(path, valueDecoder));
	}

	/**
	 * Supplies the next argument from the value of key {@code key}, or {@code fallback}
	 * if the key is absent.
	 *
	 * @see #optionalAt(List, Decoder, Object)
	 */
	public static <A, B> Function<Decoder<Function<A, B>>, Decoder<B>> optional(String key, Decoder<A> valueDecoder,
			@Nullable A fallback) {
		return custom(optionalField(singletonList(checkNotNull(key, "Key must not be null")), valueDecoder, fallback));
	}

	/**
	 * Supplies the next argument from the value at the end of {@code path}, or {@code fallback}
	 * if nothing is there.
	 * <ul>
	 * <li>the key is absent, or a container along the path is absent or {@code null}: {@code fallback}</li>
	 * <li>the value is not {@code null}: whatever {@code valueDecoder} returns, failure included</li>
	 * <li>the value is {@code null}: the value of {@code valueDecoder} if it accepts {@code null},
	 * otherwise {@code fallback}</li>
	 * <li>the input, or a non-null node along the path, is not an object: failure</li>
	 * </ul>
	 */
	public static <A, B> Function<Decoder<Function<A, B>>, Decoder<B>> optionalAt(List<String> path, Decoder<A> valueDecoder,
			@Nullable A fallback) {
		return custom(optionalField(path, valueDecoder, fallback));
	}

	/**
	 * Supplies the next argument as a constant, without looking at the input.
	 */
	public static <A, B> Function<Decoder<Function<A, B>>, Decoder<B>> hardcoded(@Nullable A value) {
		return custom(Decoders.succeed(value));
	}

	/**
	 * Flattens a decoder that produces a decoder. The produced decoder is run against
	 * the same input, and only if the outer decoder succeeded.
	 * <p>
	 * An explicit failure of the produced decoder, see {@link Decoders#fail(String)}, is reported
	 * as {@link DecodeError.Reason#RESOLVED_FAILURE}. Its structural failures are returned as is.
	 */
	public static <T> Decoder<T> resolve(Decoder<Decoder<T>> decoder) {
		checkNotNull(decoder);
		return decoder.andThen(inner -> {
			checkNotNull(inner, "Resolved decoder must not be null");
			return input -> inner.decode(input).mapLeft(Pipeline::toResolvedFailure);
		});
	}

	/**
	 * Turns a decoded {@code Either} into the outcome of decoding: a left message becomes a
	 * {@link DecodeError.Reason#RESOLVED_FAILURE} error, a right value becomes the decoded value.
	 */
	public static <T> Decoder<T> resolveResult(Decoder<Either<String, T>> decoder) {
		checkNotNull(decoder);
		return input -> decoder.decode(input)
				.flatMapRight(result -> {
					checkNotNull(result, "Resolved result must not be null");
					if (result.isRight()) {
						return Either.right(result.getRight());
					}
					String message = String.valueOf(result.getLeft());
					logger.trace("Resolved to failure: {}", message);
					return Either.left(DecodeError.resolvedFailure(message));
				});
	}

	private static DecodeError toResolvedFailure(DecodeError error) {
		if (error.getReason() != DecodeError.Reason.FAILURE) {
			return error;
		}
		logger.trace("Resolved to failure: {}", error.getDescription());
		return DecodeError.resolvedFailure(error.getDescription()).prependPath(error.getPath());
	}

	static <T> Decoder<T> optionalField(List<String> path, Decoder<T> valueDecoder, @Nullable T fallback) {
		List<String> keys = Collections.unmodifiableList(new ArrayList<>(checkNoNulls(path, "Path must not contain nulls")));
		checkNotNull(valueDecoder);
		return input -> {
			PathLookup lookup = PathLookup.find(input, keys, true);
			switch (lookup.getOutcome()) {
				case ABSENT:
					return Either.right(fallback);
				case NOT_A_CONTAINER:
					return Either.left(lookup.toError());
				case FOUND:
				default:
					JsonElement raw = lookup.getValue();
					Either<DecodeError, T> result = valueDecoder.decode(raw);
					if (result.isRight()) {
						return result;
					}
					if (JsonKind.of(raw) == JsonKind.NULL) {
						return Either.right(fallback);
					}
					return result.mapLeft(e -> e.prependPath(keys));
			}
		};
	}
}
