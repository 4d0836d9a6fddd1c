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
import com.google.gson.JsonPrimitive;
import org.jetbrains.annotations.Nullable;

/**
 * The structural kind of a tree node.
 */
public enum JsonKind {
	OBJECT("an object"),
	ARRAY("an array"),
	STRING("a string"),
	NUMBER("a number"),
	BOOLEAN("a boolean"),
	NULL("null");

	private final String description;

	JsonKind(String description) {
		this.description = description;
	}

	/**
	 * Classifies a node. A Java {@code null} is classified as {@link #NULL}.
	 */
	public static JsonKind of(@Nullable JsonElement element) {
		if (element == null || element.isJsonNull()) return NULL;
		if (element.isJsonObject()) return OBJECT;
		if (element.isJsonArray()) return ARRAY;
		JsonPrimitive primitive = element.getAsJsonPrimitive();
		if (primitive.isBoolean()) return BOOLEAN;
		if (primitive.isNumber()) return NUMBER;
		return STRING;
	}

	public String getDescription() {
		return description;
	}
}
