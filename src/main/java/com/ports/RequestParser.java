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

import com.ports.exception.IllegalRequestException;
import com.ports.exception.MethodNotAllowedException;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;

import static com.ports.Utilities.percentDecode;
import static com.ports.Utilities.printableString;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Turns a framed header block into a {@link Request}.
 * <p>
 * The request line is everything before the first {@code CRLF}, split on single spaces into
 * {@code METHOD TARGET [VERSION]}. Only {@code GET} is accepted.
 */
@ThreadSafe
final class RequestParser {
	@NonNull
	private static final RequestParser DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new RequestParser();
	}

	@NonNull
	static RequestParser defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private RequestParser() {
		// Stateless
	}

	/**
	 * Parses the request line of a decoded header block.
	 *
	 * @param headerBlock the header block text, without the terminating blank line
	 * @return the parsed request
	 * @throws IllegalRequestException    if the request line is empty, has no target or the path has a bad escape
	 * @throws MethodNotAllowedException if the method is not {@code GET} or the request line has extra parts
	 */
	@NonNull
	Request parse(@NonNull String headerBlock) {
		requireNonNull(headerBlock);

		int lineEnd = headerBlock.indexOf("\r\n");
		String requestLine = lineEnd < 0 ? headerBlock : headerBlock.substring(0, lineEnd);

		if (requestLine.isEmpty())
			throw new IllegalRequestException("Empty request line");

		String[] parts = requestLine.split(" ", -1);

		if (parts.length < 2 || parts[1].isEmpty())
			throw new IllegalRequestException(format("Request line has no target: '%s'", printableString(requestLine)));

		String method = parts[0];

		if (!"GET".equals(method))
			throw new MethodNotAllowedException(format("Method '%s' is not allowed", printableString(method)), method);

		if (parts.length > 3)
			throw new MethodNotAllowedException(format("Malformed request line: '%s'", printableString(requestLine)), method);

		String rawTarget = parts[1];
		String httpVersion = parts.length == 3 && !parts[2].isEmpty() ? parts[2] : null;

		return new Request(method, rawTarget, extractPath(rawTarget), httpVersion);
	}

	@NonNull
	private String extractPath(@NonNull String rawTarget) {
		requireNonNull(rawTarget);

		String rawPath = rawTarget;
		int queryIndex = rawPath.indexOf('?');

		if (queryIndex >= 0)
			rawPath = rawPath.substring(0, queryIndex);

		int fragmentIndex = rawPath.indexOf('#');

		if (fragmentIndex >= 0)
			rawPath = rawPath.substring(0, fragmentIndex);

		String path = percentDecode(rawPath);

		if (path.isEmpty())
			return "/";

		// Origin-form targets always start with a slash; anything else is treated as relative to the root
		return path.startsWith("/") ? path : "/" + path;
	}
}
