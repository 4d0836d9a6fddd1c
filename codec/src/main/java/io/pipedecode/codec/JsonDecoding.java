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
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;
import com.google.gson.internal.Streams;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import io.pipedecode.exception.DecodeException;
import io.pipedecode.functional.Either;
import io.pipedecode.util.ApplicationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;

import static io.pipedecode.util.Preconditions.checkArgument;
import static io.pipedecode.util.Preconditions.checkNotNull;

/**
 * Parses JSON text with Gson and runs decoders on the result.
 * <p>
 * Settings, read once from system properties:
 * <ul>
 * <li>{@code JsonDecoding.lenient} - accept Gson's lenient syntax, {@code false} by default</li>
 * <li>{@code JsonDecoding.maxNestingDepth} - deepest array/object nesting accepted, {@code 255} by default</li>
 * </ul>
 */
public final class JsonDecoding {
	private static final Logger logger = LoggerFactory.getLogger(JsonDecoding.class);

	public static final boolean LENIENT = ApplicationSettings.getBoolean(JsonDecoding.class, "lenient", false);
	public static final int MAX_NESTING_DEPTH = ApplicationSettings.getInt(JsonDecoding.class, "maxNestingDepth", 255);

	static {
		logger.trace("Settings: lenient={}, maxNestingDepth={}", LENIENT, MAX_NESTING_DEPTH);
	}

	private JsonDecoding() {
	}

	public static Either<DecodeError, JsonElement> parse(String json) {
		return parse(json, LENIENT, MAX_NESTING_DEPTH);
	}

	public static Either<DecodeError, JsonElement> parse(String json, boolean lenient, int maxNestingDepth) {
		checkNotNull(json);
		checkArgument(maxNestingDepth >= 0, "Nesting depth must not be negative: %d", maxNestingDepth);
		if (json.trim().isEmpty()) {
			return malformed("Empty input");
		}
		JsonReader reader = new JsonReader(new StringReader(json));
		reader.setStrictness(lenient ? Strictness.LENIENT : Strictness.LEGACY_STRICT);
		reader.setNestingLimit(maxNestingDepth);
		try {
			JsonElement element = Streams.parse(reader);
			if (reader.peek() != JsonToken.END_DOCUMENT) {
				return malformed("Trailing data after JSON value");
			}
			return Either.right(element);
		} catch (JsonParseException | IOException e) {
			return malformed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
		}
	}

	/**
	 * Parses {@code json} and decodes it. Malformed text is reported as
	 * {@link DecodeError.Reason#MALFORMED_JSON}.
	 */
	public static <T> Either<DecodeError, T> decodeString(Decoder<T> decoder, String json) {
		checkNotNull(decoder);
		return parse(json).flatMapRight(decoder::decode);
	}

	public static <T> T fromJson(Decoder<T> decoder, String json) throws DecodeException {
		Either<DecodeError, T> result = decodeString(decoder, json);
		if (result.isLeft()) {
			throw new DecodeException(result.getLeft());
		}
		return result.getRight();
	}

	private static <T> Either<DecodeError, T> malformed(String message) {
		logger.debug("Malformed JSON: {}", message);
		return Either.left(DecodeError.malformedJson(message));
	}
}
