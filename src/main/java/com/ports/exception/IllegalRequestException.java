/*
 * Copyright 2022-2026 Revetware LLC.
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

package com.ports.exception;

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Exception thrown when a request cannot be understood: a missing request line or target, an undecodable header block,
 * or an invalid percent-escape in the request path.
 */
@NotThreadSafe
public class IllegalRequestException extends BadRequestException {
	public IllegalRequestException(@Nullable String message) {
		super(message);
	}

	public IllegalRequestException(@Nullable String message,
																 @Nullable Throwable cause) {
		super(message, cause);
	}
}
