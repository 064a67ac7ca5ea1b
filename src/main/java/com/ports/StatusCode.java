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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The HTTP status codes a {@link StaticFileServer} can produce.
 * <p>
 * See <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status">https://developer.mozilla.org/en-US/docs/Web/HTTP/Status</a> for details.
 */
public enum StatusCode {
	/**
	 * The request succeeded and the file or directory listing is transmitted in the message body.
	 */
	HTTP_200(200, "OK"),
	/**
	 * The URL of the requested resource has been changed permanently.
	 * <p>
	 * Sent for directory requests that lack a trailing {@code /}; the new URL is given in the {@code Location} header.
	 */
	HTTP_301(301, "Moved Permanently"),
	/**
	 * The server cannot process the request due to something perceived to be a client error, for example a missing
	 * request target or a header block that is not valid UTF-8.
	 */
	HTTP_400(400, "Bad Request"),
	/**
	 * The request path resolves outside of the server's root directory.
	 */
	HTTP_403(403, "Forbidden"),
	/**
	 * The requested file or directory does not exist.
	 */
	HTTP_404(404, "Not Found"),
	/**
	 * The request method is not {@code GET}, or the request line is malformed.
	 */
	HTTP_405(405, "Method Not Allowed"),
	/**
	 * The request header block is larger than limits defined by the server.
	 */
	HTTP_413(413, "Content Too Large"),
	/**
	 * The server encountered a situation it does not know how to handle, for example a file that vanished between its
	 * existence check and its read.
	 */
	HTTP_500(500, "Internal Server Error"),
	/**
	 * The server already holds its maximum number of concurrent connections.
	 */
	HTTP_503(503, "Service Unavailable");

	@NonNull
	private static final Map<@NonNull Integer, @NonNull StatusCode> STATUS_CODES_BY_NUMBER;

	static {
		Map<Integer, StatusCode> statusCodesByNumber = new HashMap<>();

		for (StatusCode statusCode : StatusCode.values())
			statusCodesByNumber.put(statusCode.getStatusCode(), statusCode);

		STATUS_CODES_BY_NUMBER = Collections.unmodifiableMap(statusCodesByNumber);
	}

	@NonNull
	private final Integer statusCode;
	@NonNull
	private final String reasonPhrase;

	StatusCode(@NonNull Integer statusCode,
						 @NonNull String reasonPhrase) {
		requireNonNull(statusCode);
		requireNonNull(reasonPhrase);

		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
	}

	/**
	 * Given an HTTP status code, return the corresponding enum value.
	 *
	 * @param statusCode the HTTP status code
	 * @return the enum value that corresponds to the provided HTTP status code, or {@link Optional#empty()} if none exists
	 */
	@NonNull
	public static Optional<StatusCode> fromStatusCode(@NonNull Integer statusCode) {
		return Optional.ofNullable(STATUS_CODES_BY_NUMBER.get(statusCode));
	}

	@Override
	public String toString() {
		return format("%s.%s{statusCode=%s, reasonPhrase=%s}", getClass().getSimpleName(), name(), getStatusCode(), getReasonPhrase());
	}

	/**
	 * The HTTP status code that corresponds to this enum value.
	 *
	 * @return the HTTP status code
	 */
	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	/**
	 * An English-language description for this HTTP status code.
	 * <p>
	 * For example, {@link StatusCode#HTTP_404} has reason phrase {@code Not Found}.
	 *
	 * @return English description for this HTTP status code
	 */
	@NonNull
	public String getReasonPhrase() {
		return this.reasonPhrase;
	}
}
