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

package io.pipedecode.exception;

import io.pipedecode.codec.DecodeError;
import org.jetbrains.annotations.NotNull;

import static io.pipedecode.util.Preconditions.checkNotNull;

/**
 * Thrown at the edges of the library, where a failed decode result
 * has to leave the {@code Either} world.
 */
public class DecodeException extends Exception {
	private final DecodeError error;

	public DecodeException(@NotNull DecodeError error) {
		super(checkNotNull(error).getMessage());
		this.error = error;
	}

	public DecodeError getError() {
		return error;
	}
}
