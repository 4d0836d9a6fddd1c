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
import com.google.gson.JsonNull;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static io.pipedecode.util.Preconditions.checkNotNull;
import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;

/**
 * Describes why a decoder rejected its input and where.
 * <p>
 * The path leads from the node the outermost decoder was run against to the node
 * that was rejected. Its elements are {@link String} object keys and {@link Integer}
 * array indices. Paths are built up while lookups unwind, see {@link #prependPath(List)}.
 * <p>
 * Errors are plain values: they are returned inside {@code Either.left}, never thrown.
 */
public final class DecodeError {
	public enum Reason {
		/**
		 * A required key is absent, or an array index is out of range.
		 */
		FIELD_MISSING,
		/**
		 * A value is present but has the wrong kind or shape.
		 */
		TYPE_MISMATCH,
		/**
		 * A key lookup was attempted on a node that is not an object.
		 */
		NOT_A_CONTAINER,
		/**
		 * A resolve step rejected an already decoded value.
		 */
		RESOLVED_FAILURE,
		/**
		 * An explicit failure, see {@link Decoders#fail(String)}.
		 */
		FAILURE,
		/**
		 * The input text could not be parsed into a tree.
		 */
		MALFORMED_JSON
	}

	private final Reason reason;
	private final List<Object> path;
	@Nullable
	private final String expected;
	@Nullable
	private final JsonElement actual;
	@Nullable
	private final String description;

	private DecodeError(Reason reason, List<Object> path, @Nullable String expected,
			@Nullable JsonElement actual, @Nullable String description) {
		this.reason = reason;
		this.path = path;
		this.expected = expected;
		this.actual = actual;
		this.description = description;
	}

	public static DecodeError fieldMissing(@NotNull Object key) {
		checkNotNull(key);
		return new DecodeError(Reason.FIELD_MISSING, singletonList(key), null, null,
				key instanceof Integer ? "index is out of range" : "field is missing");
	}

	/**
	 * The offending value is copied, so later changes to the input tree do not affect this error.
	 */
	public static DecodeError typeMismatch(@NotNull String expected, @Nullable JsonElement actual) {
		return new DecodeError(Reason.TYPE_MISMATCH, emptyList(), checkNotNull(expected), detach(actual), null);
	}

	public static DecodeError notAContainer(@NotNull String expected, @Nullable JsonElement actual) {
		return new DecodeError(Reason.NOT_A_CONTAINER, emptyList(), checkNotNull(expected), detach(actual), null);
	}

	private static JsonElement detach(@Nullable JsonElement actual) {
		return actual != null ? actual.deepCopy() : JsonNull.INSTANCE;
	}

	public static DecodeError resolvedFailure(@NotNull String message) {
		return new DecodeError(Reason.RESOLVED_FAILURE, emptyList(), null, null, checkNotNull(message));
	}

	public static DecodeError failure(@NotNull String message) {
		return new DecodeError(Reason.FAILURE, emptyList(), null, null, checkNotNull(message));
	}

	public static DecodeError malformedJson(@NotNull String message) {
		return new DecodeError(Reason.MALFORMED_JSON, emptyList(), null, null, checkNotNull(message));
	}

	/**
	 * Returns a copy of this error whose path starts with the given segments.
	 */
	public DecodeError prependPath(List<?> prefix) {
		if (prefix.isEmpty()) {
			return this;
		}
		List<Object> newPath = new ArrayList<>(prefix.size() + path.size());
		newPath.addAll(prefix);
		newPath.addAll(path);
		return new DecodeError(reason, Collections.unmodifiableList(newPath), expected, actual, description);
	}

	public DecodeError prependKey(String key) {
		return prependPath(singletonList(key));
	}

	public DecodeError prependIndex(int index) {
		return prependPath(singletonList(index));
	}

	public Reason getReason() {
		return reason;
	}

	public List<Object> getPath() {
		return path;
	}

	@Nullable
	public String getExpected() {
		return expected;
	}

	@Nullable
	public JsonElement getActual() {
		return actual;
	}

	/**
	 * The cause of this error, without the path.
	 */
	public String getDescription() {
		if (description != null) {
			return description;
		}
		// mismatch descriptions are rendered on demand
		return reason == Reason.NOT_A_CONTAINER ?
				"expected " + expected + " to look into, got " + actual :
				"expected " + expected + ", got " + actual;
	}

	public String getMessage() {
		return path.isEmpty() ? getDescription() : "at " + renderPath() + ": " + getDescription();
	}

	/**
	 * Renders the path as {@code `profile.tags[2].name`}.
	 */
	public String renderPath() {
		StringBuilder sb = new StringBuilder("`");
		for (int i = 0; i < path.size(); i++) {
			Object segment = path.get(i);
			if (segment instanceof Integer) {
				sb.append('[').append(segment).append(']');
			} else {
				if (i != 0) sb.append('.');
				sb.append(segment);
			}
		}
		return sb.append('`').toString();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DecodeError that = (DecodeError) o;
		return reason == that.reason &&
				path.equals(that.path) &&
				Objects.equals(expected, that.expected) &&
				Objects.equals(actual, that.actual) &&
				Objects.equals(description, that.description);
	}

	@Override
	public int hashCode() {
		return Objects.hash(reason, path, expected, actual, description);
	}

	@Override
	public String toString() {
		return "DecodeError{" + reason + ", " + getMessage() + '}';
	}
}
