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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A finalized HTTP/1.1 response, ready to be written to a socket.
 * <p>
 * Header order is preserved exactly as added to the builder. {@code Content-Length} is never supplied by callers;
 * it is computed from the body and emitted directly after {@code Content-Type} (or first, if there is no
 * {@code Content-Type}).
 * <p>
 * Instances can be acquired via the {@link #withStatusCode(StatusCode)} builder factory method.
 */
@ThreadSafe
public final class MarshaledResponse {
	@NonNull
	private final StatusCode statusCode;
	@NonNull
	private final Map<String, String> headers;
	@NonNull
	private final byte[] body;

	/**
	 * Acquires a builder for {@link MarshaledResponse} instances.
	 *
	 * @param statusCode the HTTP status code for this response
	 * @return the builder
	 */
	@NonNull
	public static Builder withStatusCode(@NonNull StatusCode statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode);
	}

	private MarshaledResponse(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statusCode = builder.statusCode;
		this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
		this.body = builder.body == null ? Utilities.emptyByteArray() : builder.body.clone();
	}

	/**
	 * Serializes this response: status line, headers in order, a blank line, then the body.
	 *
	 * @return the exact bytes to send over the wire
	 */
	@NonNull
	public byte[] toWireBytes() {
		StringBuilder head = new StringBuilder(256);

		head.append(format("HTTP/1.1 %d %s\r\n", getStatusCode().getStatusCode(), getStatusCode().getReasonPhrase()));

		boolean hasContentType = getHeaders().containsKey("Content-Type");

		if (!hasContentType)
			head.append("Content-Length: ").append(this.body.length).append("\r\n");

		for (Entry<String, String> header : getHeaders().entrySet()) {
			head.append(header.getKey()).append(": ").append(header.getValue()).append("\r\n");

			if (header.getKey().equals("Content-Type"))
				head.append("Content-Length: ").append(this.body.length).append("\r\n");
		}

		head.append("\r\n");

		byte[] headBytes = head.toString().getBytes(StandardCharsets.UTF_8);
		ByteArrayOutputStream out = new ByteArrayOutputStream(headBytes.length + this.body.length);
		out.writeBytes(headBytes);
		out.writeBytes(this.body);

		return out.toByteArray();
	}

	@Override
	public String toString() {
		return format("%s{statusCode=%s, headers=%s, body=%d bytes}", getClass().getSimpleName(),
				getStatusCode(), getHeaders(), this.body.length);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof MarshaledResponse marshaledResponse))
			return false;

		return Objects.equals(getStatusCode(), marshaledResponse.getStatusCode())
				&& Objects.equals(getHeaders(), marshaledResponse.getHeaders())
				&& Arrays.equals(this.body, marshaledResponse.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatusCode(), getHeaders(), Arrays.hashCode(this.body));
	}

	@NonNull
	public StatusCode getStatusCode() {
		return this.statusCode;
	}

	/**
	 * The response headers in emission order.
	 *
	 * @return an unmodifiable, ordered view of the headers
	 */
	@NonNull
	public Map<String, String> getHeaders() {
		return this.headers;
	}

	@NonNull
	public byte[] getBody() {
		return this.body.clone();
	}

	@NonNull
	public Integer getContentLength() {
		return this.body.length;
	}

	/**
	 * Builder used to construct instances of {@link MarshaledResponse} via {@link MarshaledResponse#withStatusCode(StatusCode)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final StatusCode statusCode;
		@NonNull
		private final Map<String, String> headers;
		@Nullable
		private byte[] body;

		private Builder(@NonNull StatusCode statusCode) {
			requireNonNull(statusCode);

			this.statusCode = statusCode;
			this.headers = new LinkedHashMap<>();
		}

		/**
		 * Appends a header.
		 *
		 * @throws IllegalArgumentException if the name is illegal or {@code Content-Length}, or the value contains a line break or NUL
		 */
		@NonNull
		public Builder header(@NonNull String name,
													@NonNull String value) {
			requireNonNull(name);
			requireNonNull(value);

			validateHeaderNameAndValue(name, value);
			this.headers.put(name, value);
			return this;
		}

		@NonNull
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		@NonNull
		public MarshaledResponse build() {
			return new MarshaledResponse(this);
		}
	}

	private static void validateHeaderNameAndValue(@NonNull String name,
																								 @NonNull String value) {
		if (name.isEmpty())
			throw new IllegalArgumentException("Header name is blank");

		if (name.equalsIgnoreCase("Content-Length"))
			throw new IllegalArgumentException("Content-Length is computed from the body and cannot be set");

		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);

			if (c <= 0x20 || c >= 0x7F || c == ':')
				throw new IllegalArgumentException(format("Illegal header name '%s'", Utilities.printableString(name)));
		}

		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);

			if (c == '\r' || c == '\n' || c == '\0')
				throw new IllegalArgumentException(format("Illegal value for header '%s': '%s'", name, Utilities.printableString(value)));
		}
	}
}
