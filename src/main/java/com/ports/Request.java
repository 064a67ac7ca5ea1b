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

package com.ports;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A parsed HTTP request line.
 * <p>
 * Only the request line is meaningful to the static file engine; header lines are framed but not interpreted.
 */
@ThreadSafe
public final class Request {
	@NonNull
	private final String method;
	@NonNull
	private final String rawTarget;
	@NonNull
	private final String path;
	@Nullable
	private final String httpVersion;

	Request(@NonNull String method,
					@NonNull String rawTarget,
					@NonNull String path,
					@Nullable String httpVersion) {
		requireNonNull(method);
		requireNonNull(rawTarget);
		requireNonNull(path);

		this.method = method;
		this.rawTarget = rawTarget;
		this.path = path;
		this.httpVersion = httpVersion;
	}

	/**
	 * @return the request method, always {@code GET} for a successfully parsed request
	 */
	@NonNull
	public String getMethod() {
		return this.method;
	}

	/**
	 * @return the request target exactly as it appeared on the wire, including any query or fragment
	 */
	@NonNull
	public String getRawTarget() {
		return this.rawTarget;
	}

	/**
	 * @return the percent-decoded path component of the target, never empty
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	@NonNull
	public Optional<String> getHttpVersion() {
		return Optional.ofNullable(this.httpVersion);
	}

	@Override
	public String toString() {
		return format("%s{method=%s, rawTarget=%s, path=%s, httpVersion=%s}", getClass().getSimpleName(),
				getMethod(), getRawTarget(), getPath(), getHttpVersion().orElse("(none)"));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Request request))
			return false;

		return Objects.equals(getMethod(), request.getMethod())
				&& Objects.equals(getRawTarget(), request.getRawTarget())
				&& Objects.equals(getPath(), request.getPath())
				&& Objects.equals(getHttpVersion(), request.getHttpVersion());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getMethod(), getRawTarget(), getPath(), getHttpVersion());
	}
}
