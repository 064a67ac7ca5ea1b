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
 * Exception thrown when a request header block grows past the configured maximum size before it is complete.
 * <p>
 * Results in an HTTP 413 (Content Too Large) response.
 */
@NotThreadSafe
public class ContentTooLargeException extends RuntimeException {
	@NonNull
	private final Integer maximumSizeInBytes;

	public ContentTooLargeException(@Nullable String message,
																	@NonNull Integer maximumSizeInBytes) {
		super(message);
		this.maximumSizeInBytes = requireNonNull(maximumSizeInBytes);
	}

	@NonNull
	public Integer getMaximumSizeInBytes() {
		return this.maximumSizeInBytes;
	}
}
