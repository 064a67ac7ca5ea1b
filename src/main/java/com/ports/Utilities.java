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
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * A non-instantiable collection of utility methods for the HTTP engine: percent-encoding, HTML escaping and
 * header value scrubbing.
 */
@ThreadSafe
public final class Utilities {
	@NonNull
	private static final byte[] EMPTY_BYTE_ARRAY;
	@NonNull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern TAIL_WHITESPACE_PATTERN;
	@NonNull
	private static final char[] HEX_DIGITS;

	static {
		EMPTY_BYTE_ARRAY = new byte[0];

		// See https://www.regular-expressions.info/unicode.html
		// \p{Z} or \p{Separator}: any kind of whitespace or invisible separator.
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z}|\\s)+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z}|\\s)+$");

		HEX_DIGITS = "0123456789ABCDEF".toCharArray();
	}

	private Utilities() {
		// Non-instantiable
	}

	@NonNull
	static byte[] emptyByteArray() {
		return EMPTY_BYTE_ARRAY;
	}

	/**
	 * Percent-decodes a URL path as UTF-8.
	 * <p>
	 * One pass only: {@code %252e} decodes to {@code %2e}, not {@code .}. A {@code '+'} is <strong>not</strong> treated
	 * as a space. Invalid {@code %xy} sequences trigger an {@link IllegalRequestException}.
	 *
	 * @param path the raw path, e.g. {@code /docs/my%20file.txt}
	 * @return the decoded path, e.g. {@code /docs/my file.txt}
	 * @throws IllegalRequestException if the path contains a truncated or non-hexadecimal escape, or escapes bytes that
	 *                                 are not valid UTF-8
	 */
	@NonNull
	public static String percentDecode(@NonNull String path) {
		requireNonNull(path);

		if (path.isEmpty())
			return "";

		StringBuilder sb = new StringBuilder(path.length());
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();

		for (int i = 0; i < path.length(); ) {
			char c = path.charAt(i);

			if (c == '%') {
				// Consecutive %xx triplets are gathered so multibyte UTF-8 sequences decode together
				bytes.reset();
				int j = i;

				while (j < path.length() && path.charAt(j) == '%') {
					if (j + 2 >= path.length())
						throw new IllegalRequestException("Invalid percent-encoding in URL path");

					int hi = hex(path.charAt(j + 1));
					int lo = hex(path.charAt(j + 2));

					if (hi < 0 || lo < 0)
						throw new IllegalRequestException("Invalid percent-encoding in URL path");

					bytes.write((hi << 4) | lo);
					j += 3;
				}

				sb.append(decodeUtf8(bytes.toByteArray()));
				i = j;
				continue;
			}

			sb.append(c);
			i++;
		}

		return sb.toString();
	}

	@NonNull
	private static String decodeUtf8(@NonNull byte[] bytes) {
		CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);

		try {
			return decoder.decode(ByteBuffer.wrap(bytes)).toString();
		} catch (CharacterCodingException e) {
			throw new IllegalRequestException("Percent-encoded URL path is not valid UTF-8", e);
		}
	}

	private static int hex(char c) {
		if (c >= '0' && c <= '9') return c - '0';
		if (c >= 'A' && c <= 'F') return c - 'A' + 10;
		if (c >= 'a' && c <= 'f') return c - 'a' + 10;
		return -1;
	}

	/**
	 * Percent-encodes a decoded URL path per RFC 3986, preserving {@code /} separators.
	 * <p>
	 * Unreserved characters, sub-delimiters, {@code ':'} and {@code '@'} are left as-is. Everything else is encoded
	 * byte-by-byte as UTF-8, so spaces become {@code %20}, never {@code +}.
	 *
	 * @param path the decoded path, e.g. {@code /my dir/<b>.html}
	 * @return the encoded path, e.g. {@code /my%20dir/%3Cb%3E.html}
	 */
	@NonNull
	public static String encodePath(@NonNull String path) {
		requireNonNull(path);

		StringBuilder sb = new StringBuilder(path.length() + 16);

		for (byte b : path.getBytes(StandardCharsets.UTF_8)) {
			int octet = b & 0xFF;

			if (octet == '/' || isPathCharacter(octet)) {
				sb.append((char) octet);
			} else {
				sb.append('%');
				sb.append(HEX_DIGITS[octet >> 4]);
				sb.append(HEX_DIGITS[octet & 0x0F]);
			}
		}

		return sb.toString();
	}

	private static boolean isPathCharacter(int octet) {
		if ((octet >= 'a' && octet <= 'z') || (octet >= 'A' && octet <= 'Z') || (octet >= '0' && octet <= '9'))
			return true;

		// unreserved, sub-delims, ":" and "@"
		return octet < 0x80 && "-._~!$&'()*+,;=:@".indexOf(octet) >= 0;
	}

	/**
	 * Escapes text for inclusion in HTML element content and quoted attribute values.
	 *
	 * @param text the text to escape
	 * @return the escaped text
	 */
	@NonNull
	public static String htmlEscape(@NonNull String text) {
		requireNonNull(text);

		StringBuilder sb = new StringBuilder(text.length() + 16);

		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);

			switch (c) {
				case '&' -> sb.append("&amp;");
				case '<' -> sb.append("&lt;");
				case '>' -> sb.append("&gt;");
				case '"' -> sb.append("&quot;");
				case '\'' -> sb.append("&#39;");
				default -> sb.append(c);
			}
		}

		return sb.toString();
	}

	/**
	 * Removes carriage returns, line feeds and NUL characters from a header value.
	 *
	 * @param value the header value
	 * @return the scrubbed value
	 */
	@NonNull
	public static String sanitizeHeaderValue(@NonNull String value) {
		requireNonNull(value);

		StringBuilder sb = new StringBuilder(value.length());

		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);

			if (c != '\r' && c != '\n' && c != '\0')
				sb.append(c);
		}

		return sb.toString();
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator.
	 *
	 * @param string the string to trim
	 * @return the trimmed string, or {@code null} if the input string is {@code null}
	 */
	@Nullable
	public static String trimAggressively(@Nullable String string) {
		if (string == null)
			return null;

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return string;

		return TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");
	}

	/**
	 * Aggressively trims whitespace from the given string and returns {@code null} if the result is empty.
	 *
	 * @param string the input string; may be {@code null}
	 * @return a trimmed, non-empty string; or {@code null} if input was {@code null} or trimmed to empty
	 */
	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = trimAggressively(string);
		return string.length() == 0 ? null : string;
	}

	@NonNull
	static String printableString(@NonNull String input) {
		requireNonNull(input);

		StringBuilder out = new StringBuilder(input.length() + 16);

		for (int i = 0; i < input.length(); i++) {
			char c = input.charAt(i);

			if (c == '\r') out.append("\\r");
			else if (c == '\n') out.append("\\n");
			else if (c == '\t') out.append("\\t");
			else if (c == 0) out.append("\\0");
			else if (c < 0x20 || c == 0x7F) out.append(String.format("\\u%04X", (int) c));
			else out.append(c);
		}

		return out.toString();
	}
}
