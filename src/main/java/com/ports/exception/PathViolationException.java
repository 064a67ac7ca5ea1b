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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when a request path resolves to a location outside of a server's root directory.
 * <p>
 * Results in an HTTP 403 (Forbidden) response.
 */
@NotThreadSafe
public class PathViolationException extends RuntimeException {
	@NonNull
	private final String requestPath;

	public PathViolationException(@Nullable String message,
																@NonNull String requestPath) {
		super(message);
		this.requestPath = requireNonNull(requestPath);
	}

	public PathViolationException(@Nullable String message,
																@Nullable Throwable cause,
																@NonNull String requestPath) {
		super(message, cause);
		this.requestPath = requireNonNull(requestPath);
	}

	@NonNull
	public String getRequestPath() {
		return this.requestPath;
	}
}
