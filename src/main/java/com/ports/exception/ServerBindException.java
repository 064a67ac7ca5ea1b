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

import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;

import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when a server cannot bind its port: already in use, privileged, or outside {@code 0..65535}.
 * <p>
 * No partial server state is retained when this is thrown.
 */
@NotThreadSafe
public class ServerBindException extends UncheckedIOException {
	@NonNull
	private final Integer port;

	public ServerBindException(@NonNull String message,
														 @NonNull IOException cause,
														 @NonNull Integer port) {
		super(requireNonNull(message), requireNonNull(cause));
		this.port = requireNonNull(port);
	}

	@NonNull
	public Integer getPort() {
		return this.port;
	}
}
