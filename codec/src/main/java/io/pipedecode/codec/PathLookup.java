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
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static io.pipedecode.util.Preconditions.checkState;

/**
 * Outcome of walking a key path down from some node.
 */
final class PathLookup {
	enum Outcome {
		FOUND,
		ABSENT,
		NOT_A_CONTAINER
	}

	private final Outcome outcome;
	private final List<String> path;
	private final int depth;
	private final JsonElement node;

	private PathLookup(Outcome outcome, List<String> path, int depth, JsonElement node) {
		this.outcome = outcome;
		this.path = path;
		this.depth = depth;
		this.node = node;
	}

	/**
	 * Walks {@code path} down from {@code root}.
	 *
	 * @param nullIsAbsent whether a {@code null} met below the root ends the walk as {@link Outcome#ABSENT}
	 *                     rather than {@link Outcome#NOT_A_CONTAINER}
	 */
	static PathLookup find(@Nullable JsonElement root, List<String> path, boolean nullIsAbsent) {
		JsonElement node = root != null ? root : JsonNull.INSTANCE;
		for (int i = 0; i < path.size(); i++) {
			switch (JsonKind.of(node)) {
				case OBJECT:
					JsonElement child = node.getAsJsonObject().get(path.get(i));
					if (child == null) {
						return new PathLookup(Outcome.ABSENT, path, i, node);
					}
					node = child;
					break;
				case NULL:
					if (nullIsAbsent && i != 0) {
						return new PathLookup(Outcome.ABSENT, path, i, node);
					}
					return new PathLookup(Outcome.NOT_A_CONTAINER, path, i, node);
				case ARRAY:
				case STRING:
				case NUMBER:
				case BOOLEAN:
				default:
					return new PathLookup(Outcome.NOT_A_CONTAINER, path, i, node);
			}
		}
		return new PathLookup(Outcome.FOUND, path, path.size(), node);
	}

	Outcome getOutcome() {
		return outcome;
	}

	/**
	 * The value found at the end of the path, which may be {@link JsonNull}.
	 */
	JsonElement getValue() {
		checkState(outcome == Outcome.FOUND, "Nothing was found at the end of the path");
		return node;
	}

	DecodeError toError() {
		switch (outcome) {
			case ABSENT:
				return DecodeError.fieldMissing(path.get(depth))
						.prependPath(path.subList(0, depth));
			case NOT_A_CONTAINER:
				return DecodeError.notAContainer(JsonKind.OBJECT.getDescription(), node)
						.prependPath(path.subList(0, depth));
			case FOUND:
			default:
				throw new IllegalStateException("Path lookup succeeded");
		}
	}
}
