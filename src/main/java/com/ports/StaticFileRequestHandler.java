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

import com.ports.ResponseMarshaler.ListingEntry;
import com.ports.exception.PathViolationException;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps a parsed {@link Request} onto the sandboxed filesystem and renders the matching response.
 * <p>
 * Routing, applied after the sandbox check:
 * <ul>
 *   <li>missing target: {@code 404}</li>
 *   <li>directory requested without a trailing slash: {@code 301} to the same path plus {@code /}</li>
 *   <li>directory with a trailing slash: {@code index.html}, then {@code index.htm}, else a listing</li>
 *   <li>regular file: its bytes</li>
 *   <li>anything else (sockets, devices): {@code 404}</li>
 * </ul>
 */
@ThreadSafe
final class StaticFileRequestHandler {
	@NonNull
	private static final List<String> INDEX_FILE_NAMES;

	static {
		INDEX_FILE_NAMES = List.of("index.html", "index.htm");
	}

	@NonNull
	private final PathSandbox pathSandbox;
	@NonNull
	private final ResponseMarshaler responseMarshaler;
	@NonNull
	private final LifecycleObserver lifecycleObserver;

	StaticFileRequestHandler(@NonNull PathSandbox pathSandbox,
													 @NonNull ResponseMarshaler responseMarshaler,
													 @NonNull LifecycleObserver lifecycleObserver) {
		requireNonNull(pathSandbox);
		requireNonNull(responseMarshaler);
		requireNonNull(lifecycleObserver);

		this.pathSandbox = pathSandbox;
		this.responseMarshaler = responseMarshaler;
		this.lifecycleObserver = lifecycleObserver;
	}

	@NonNull
	MarshaledResponse handleRequest(@NonNull Request request) {
		requireNonNull(request);

		String requestPath = request.getPath();
		Path resolvedPath;

		try {
			resolvedPath = getPathSandbox().resolve(requestPath);
		} catch (PathViolationException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_PATH_VIOLATION, e.getMessage())
					.throwable(e)
					.request(request)
					.build());

			return getResponseMarshaler().forError(StatusCode.HTTP_403);
		}

		if (!Files.exists(resolvedPath))
			return getResponseMarshaler().forError(StatusCode.HTTP_404);

		if (Files.isDirectory(resolvedPath)) {
			if (!requestPath.endsWith("/"))
				return getResponseMarshaler().forRedirect(requestPath + "/");

			for (String indexFileName : INDEX_FILE_NAMES) {
				Path indexFile;

				try {
					// Index files go through the sandbox too, since one could be a link pointing elsewhere
					indexFile = getPathSandbox().resolve(requestPath + indexFileName);
				} catch (PathViolationException e) {
					safelyLog(LogEvent.with(LogEventType.SERVER_PATH_VIOLATION, e.getMessage())
							.throwable(e)
							.request(request)
							.build());

					return getResponseMarshaler().forError(StatusCode.HTTP_403);
				}

				if (Files.isRegularFile(indexFile))
					return serveFile(request, indexFile);
			}

			return serveDirectoryListing(request, resolvedPath);
		}

		if (Files.isRegularFile(resolvedPath))
			return serveFile(request, resolvedPath);

		return getResponseMarshaler().forError(StatusCode.HTTP_404);
	}

	@NonNull
	private MarshaledResponse serveFile(@NonNull Request request,
																			@NonNull Path file) {
		byte[] contents;

		try {
			contents = Files.readAllBytes(file);
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_FILE_READ_FAILED, format("Unable to read file %s", file))
					.throwable(e)
					.request(request)
					.path(file)
					.build());

			return getResponseMarshaler().forError(StatusCode.HTTP_500);
		}

		return getResponseMarshaler().forFile(file, contents);
	}

	@NonNull
	private MarshaledResponse serveDirectoryListing(@NonNull Request request,
																									@NonNull Path directory) {
		List<ListingEntry> entries = new ArrayList<>();

		try (DirectoryStream<Path> directoryStream = Files.newDirectoryStream(directory)) {
			for (Path entry : directoryStream)
				entries.add(new ListingEntry(entry.getFileName().toString(), Files.isDirectory(entry)));
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_FILE_READ_FAILED, format("Unable to list directory %s", directory))
					.throwable(e)
					.request(request)
					.path(directory)
					.build());

			return getResponseMarshaler().forError(StatusCode.HTTP_500);
		}

		return getResponseMarshaler().forDirectoryListing(request.getPath(), entries);
	}

	private void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The LifecycleObserver implementation errored out, but we can't let that affect us - swallow its exception.
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	@NonNull
	PathSandbox getPathSandbox() {
		return this.pathSandbox;
	}

	@NonNull
	ResponseMarshaler getResponseMarshaler() {
		return this.responseMarshaler;
	}

	@NonNull
	LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{pathSandbox=%s}", getClass().getSimpleName(), getPathSandbox());
	}
}
