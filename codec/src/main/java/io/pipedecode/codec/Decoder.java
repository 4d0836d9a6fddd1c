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
import io.pipedecode.exception.DecodeException;
import io.pipedecode.functional.Either;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Function;

import static io.pipedecode.util.Preconditions.checkNotNull;

/**
 * An immutable description of how to turn a tree node into a {@code T}.
 * <p>
 * Decoding never throws for bad input: the outcome is either a {@link DecodeError}
 * on the left or the decoded value on the right. Decoders hold no mutable state,
 * so a single instance may be shared by any number of threads.
 * <p>
 * A {@code null} input is treated the same as {@link com.google.gson.JsonNull}.
 *
 * @param <T> type of the decoded value
 */
@FunctionalInterface
public interface Decoder<T> {
	Either<DecodeError, T> decode(@Nullable JsonElement input);

	/**
	 * Decodes the input, throwing the failure instead of returning it.
	 */
	default T decodeOrThrow(@Nullable JsonElement input) throws DecodeException {
		Either<DecodeError, T> result = decode(input);
		if (result.isLeft()) {
			throw new DecodeException(result.getLeft());
		}
		return result.getRight();
	}

	default <R> Decoder<R> map(Function<? super T, ? extends R> fn) {
		checkNotNull(fn);
		return input -> decode(input).mapRight(fn);
	}

	/**
	 * Runs this decoder and, if it succeeds, the decoder chosen by {@code fn},
	 * against the same input. {@code fn} is not called if this decoder fails.
	 */
	default <R> Decoder<R> andThen(Function<? super T, ? extends Decoder<R>> fn) {
		checkNotNull(fn);
		return input -> decode(input).flatMapRight(value -> fn.apply(value).decode(input));
	}

	/**
	 * Applies a pipeline step to this decoder, so that pipelines read left to right:
	 * <pre>
	 * Pipeline.decode(curry(User::new))
	 *     .pipe(required("id", INT))
	 *     .pipe(optional("name", STRING, "anonymous"));
	 * </pre>
	 */
	default <R> Decoder<R> pipe(Function<Decoder<T>, Decoder<R>> step) {
		return checkNotNull(step).apply(this);
	}

	default Decoder<T> nullable() {
		return Decoders.nullable(this);
	}

	default Decoder<List<T>> ofList() {
		return Decoders.listOf(this);
	}
}
