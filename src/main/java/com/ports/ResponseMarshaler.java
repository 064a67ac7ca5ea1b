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
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Renders the four kinds of response the static file engine produces into {@link MarshaledResponse} instances:
 * file contents, directory listings, redirects and errors.
 * <p>
 * Every rendered response closes the connection.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method.
 */
public interface ResponseMarshaler {
	/**
	 * Renders a {@code 200} response carrying a file's bytes, typed by the file's extension.
	 *
	 * @param file     the file that was read, used to determine its content type
	 * @param contents the file's bytes
	 * @return the response
	 */
	@NonNull
	MarshaledResponse forFile(@NonNull Path file,
														@NonNull byte[] contents);

	/**
	 * Renders a {@code 200} HTML listing of a directory.
	 *
	 * @param requestPath the decoded request path of the directory, ending in {@code /}
	 * @param entries     the directory's entries, in any order
	 * @return the response
	 */
	@NonNull
	MarshaledResponse forDirectoryListing(@NonNull String requestPath,
																				@NonNull List<ListingEntry> entries);

	/**
	 * Renders a {@code 301} response.
	 *
	 * @param decodedTargetPath the decoded path to redirect to; it is percent-encoded and scrubbed before emission
	 * @return the response
	 */
	@NonNull
	MarshaledResponse forRedirect(@NonNull String decodedTargetPath);

	/**
	 * Renders an error response with a short HTML body.
	 *
	 * @param statusCode the error status
	 * @return the response
	 */
	@NonNull
	MarshaledResponse forError(@NonNull StatusCode statusCode);

	/**
	 * Acquires a threadsafe {@link ResponseMarshaler} with default settings.
	 *
	 * @return a {@code ResponseMarshaler} instance
	 */
	@NonNull
	static ResponseMarshaler defaultInstance() {
		return DefaultResponseMarshaler.defaultInstance();
	}

	/**
	 * One entry of a directory listing.
	 */
	@ThreadSafe
	final class ListingEntry {
		@NonNull
		private final String name;
		@NonNull
		private final Boolean directory;

		public ListingEntry(@NonNull String name,
												@NonNull Boolean directory) {
			this.name = requireNonNull(name);
			this.directory = requireNonNull(directory);
		}

		@NonNull
		public String getName() {
			return this.name;
		}

		@NonNull
		public Boolean isDirectory() {
			return this.directory;
		}

		@Override
		public String toString() {
			return format("%s{name=%s, directory=%s}", getClass().getSimpleName(), getName(), isDirectory());
		}

		@Override
		public boolean equals(@Nullable Object object) {
			if (this == object)
				return true;

			if (!(object instanceof ListingEntry listingEntry))
				return false;

			return Objects.equals(getName(), listingEntry.getName())
					&& Objects.equals(isDirectory(), listingEntry.isDirectory());
		}

		@Override
		public int hashCode() {
			return Objects.hash(getName(), isDirectory());
		}
	}
}
