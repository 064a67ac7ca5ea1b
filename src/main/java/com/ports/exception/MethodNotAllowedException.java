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
import java.util.Optional;

/**
 * Exception thrown when a request uses an HTTP method other than {@code GET}, or its request line is malformed.
 * <p>
 * Results in an HTTP 405 (Method Not Allowed) response.
 */
@NotThreadSafe
public class MethodNotAllowedException extends RuntimeException {
	@Nullable
	private final String method;

	public MethodNotAllowedException(@Nullable String message,
																	 @Nullable String method) {
		super(message);
		this.method = method;
	}

	@NonNull
	public Optional<String> getMethod() {
		return Optional.ofNullable(this.method);
	}
}
