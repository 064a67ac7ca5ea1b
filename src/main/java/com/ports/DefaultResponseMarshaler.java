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

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.ports.Utilities.encodePath;
import static com.ports.Utilities.htmlEscape;
import static com.ports.Utilities.sanitizeHeaderValue;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

@ThreadSafe
final class DefaultResponseMarshaler implements ResponseMarshaler {
	@NonNull
	private static final DefaultResponseMarshaler DEFAULT_INSTANCE;
	@NonNull
	private static final Map<String, String> CONTENT_TYPES_BY_EXTENSION;
	@NonNull
	private static final String DEFAULT_CONTENT_TYPE;
	@NonNull
	private static final String HTML_CONTENT_TYPE;

	static {
		HTML_CONTENT_TYPE = "text/html; charset=utf-8";
		DEFAULT_CONTENT_TYPE = "application/octet-stream";

		CONTENT_TYPES_BY_EXTENSION = Map.ofEntries(
				Map.entry("html", HTML_CONTENT_TYPE),
				Map.entry("htm", HTML_CONTENT_TYPE),
				Map.entry("css", "text/css"),
				Map.entry("js", "application/javascript"),
				Map.entry("json", "application/json"),
				Map.entry("png", "image/png"),
				Map.entry("jpg", "image/jpeg"),
				Map.entry("jpeg", "image/jpeg"),
				Map.entry("gif", "image/gif"),
				Map.entry("svg", "image/svg+xml"),
				Map.entry("pdf", "application/pdf"),
				Map.entry("txt", "text/plain; charset=utf-8"),
				Map.entry("md", "text/markdown; charset=utf-8")
		);

		DEFAULT_INSTANCE = new DefaultResponseMarshaler();
	}

	@NonNull
	public static DefaultResponseMarshaler defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private DefaultResponseMarshaler() {
		// Stateless
	}

	@NonNull
	@Override
	public MarshaledResponse forFile(@NonNull Path file,
																	 @NonNull byte[] contents) {
		requireNonNull(file);
		requireNonNull(contents);

		String contentType = contentTypeFor(file);
		MarshaledResponse.Builder builder = MarshaledResponse.withStatusCode(StatusCode.HTTP_200)
				.header("Content-Type", contentType)
				.header("Connection", "close");

		if (contentType.equals(HTML_CONTENT_TYPE))
			builder.header("X-Content-Type-Options", "nosniff");

		return builder.body(contents).build();
	}

	@NonNull
	@Override
	public MarshaledResponse forDirectoryListing(@NonNull String requestPath,
																							 @NonNull List<ListingEntry> entries) {
		requireNonNull(requestPath);
		requireNonNull(entries);

		List<ListingEntry> sortedEntries = new ArrayList<>(entries);
		sortedEntries.sort((first, second) -> compareByCodePoint(first.getName(), second.getName()));

		String basePath = requestPath.endsWith("/") ? requestPath : requestPath + "/";
		String escapedRequestPath = htmlEscape(requestPath);

		StringBuilder html = new StringBuilder(512 + sortedEntries.size() * 96);
		html.append("<!DOCTYPE html>\n");
		html.append("<html>\n");
		html.append("<head>\n");
		html.append("<meta charset=\"utf-8\">\n");
		html.append("<title>Index of ").append(escapedRequestPath).append("</title>\n");
		html.append("<style>\n");
		html.append("body { font-family: -apple-system, sans-serif; padding: 20px; }\n");
		html.append("a { text-decoration: none; color: #007aff; }\n");
		html.append("a:hover { text-decoration: underline; }\n");
		html.append("li { padding: 4px 0; }\n");
		html.append("</style>\n");
		html.append("</head>\n");
		html.append("<body>\n");
		html.append("<h1>Index of ").append(escapedRequestPath).append("</h1>\n");
		html.append("<ul>\n");

		if (!basePath.equals("/"))
			html.append(listItem(parentPathOf(basePath), "../"));

		for (ListingEntry entry : sortedEntries) {
			String displayName = entry.isDirectory() ? entry.getName() + "/" : entry.getName();
			html.append(listItem(basePath + displayName, displayName));
		}

		html.append("</ul>\n");
		html.append("</body>\n");
		html.append("</html>\n");

		return MarshaledResponse.withStatusCode(StatusCode.HTTP_200)
				.header("Content-Type", HTML_CONTENT_TYPE)
				.header("Connection", "close")
				.header("X-Content-Type-Options", "nosniff")
				.header("X-Frame-Options", "DENY")
				.body(html.toString().getBytes(StandardCharsets.UTF_8))
				.build();
	}

	@NonNull
	@Override
	public MarshaledResponse forRedirect(@NonNull String decodedTargetPath) {
		requireNonNull(decodedTargetPath);

		String location = sanitizeHeaderValue(encodePath(decodedTargetPath));
		String body = format("<html><body><a href=\"%s\">%s</a></body></html>", htmlEscape(location),
				htmlEscape(StatusCode.HTTP_301.getReasonPhrase()));

		return MarshaledResponse.withStatusCode(StatusCode.HTTP_301)
				.header("Content-Type", HTML_CONTENT_TYPE)
				.header("Connection", "close")
				.header("X-Content-Type-Options", "nosniff")
				.header("Location", location)
				.body(body.getBytes(StandardCharsets.UTF_8))
				.build();
	}

	@NonNull
	@Override
	public MarshaledResponse forError(@NonNull StatusCode statusCode) {
		requireNonNull(statusCode);

		String body = format("<html><body><h1>%d %s</h1></body></html>", statusCode.getStatusCode(),
				htmlEscape(statusCode.getReasonPhrase()));

		return MarshaledResponse.withStatusCode(statusCode)
				.header("Content-Type", HTML_CONTENT_TYPE)
				.header("Connection", "close")
				.header("X-Content-Type-Options", "nosniff")
				.header("X-Frame-Options", "DENY")
				.body(body.getBytes(StandardCharsets.UTF_8))
				.build();
	}

	@NonNull
	String contentTypeFor(@NonNull Path file) {
		requireNonNull(file);

		Path fileName = file.getFileName();

		if (fileName == null)
			return DEFAULT_CONTENT_TYPE;

		String name = fileName.toString();
		int dotIndex = name.lastIndexOf('.');

		if (dotIndex < 0 || dotIndex == name.length() - 1)
			return DEFAULT_CONTENT_TYPE;

		String extension = name.substring(dotIndex + 1).toLowerCase(Locale.ROOT);
		return CONTENT_TYPES_BY_EXTENSION.getOrDefault(extension, DEFAULT_CONTENT_TYPE);
	}

	@NonNull
	private String listItem(@NonNull String decodedHref,
													@NonNull String displayName) {
		return format("<li><a href=\"%s\">%s</a></li>\n", htmlEscape(encodePath(decodedHref)), htmlEscape(displayName));
	}

	// "/a/b/" -> "/a/"
	@NonNull
	private String parentPathOf(@NonNull String directoryPath) {
		String trimmed = directoryPath.substring(0, directoryPath.length() - 1);
		int slashIndex = trimmed.lastIndexOf('/');
		return slashIndex <= 0 ? "/" : trimmed.substring(0, slashIndex + 1);
	}

	// Code point order, same as comparing UTF-8 bytes
	static int compareByCodePoint(@NonNull String first,
																@NonNull String second) {
		requireNonNull(first);
		requireNonNull(second);

		int i = 0;
		int j = 0;

		while (i < first.length() && j < second.length()) {
			int firstCodePoint = first.codePointAt(i);
			int secondCodePoint = second.codePointAt(j);

			if (firstCodePoint != secondCodePoint)
				return Integer.compare(firstCodePoint, secondCodePoint);

			i += Character.charCount(firstCodePoint);
			j += Character.charCount(secondCodePoint);
		}

		return Integer.compare(first.length() - i, second.length() - j);
	}
}
