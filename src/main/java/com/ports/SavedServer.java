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
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A persisted description of a server to bring back on the next launch.
 * <p>
 * The directory is stored as given and is not required to exist; {@link ServerManager#restoreServers(java.util.List)}
 * skips entries whose directory has since disappeared.
 */
@ThreadSafe
public final class SavedServer {
	@NonNull
	private final Integer port;
	@NonNull
	private final Path directoryPath;
	@NonNull
	private final Boolean exposeToLan;

	public SavedServer(@NonNull Integer port,
										 @NonNull Path directoryPath) {
		this(port, directoryPath, null);
	}

	public SavedServer(@NonNull Integer port,
										 @NonNull Path directoryPath,
										 @Nullable Boolean exposeToLan) {
		requireNonNull(port);
		requireNonNull(directoryPath);

		if (port < 0 || port > 65_535)
			throw new IllegalArgumentException(format("Illegal port value %d", port));

		this.port = port;
		this.directoryPath = directoryPath;
		this.exposeToLan = exposeToLan == null ? false : exposeToLan;
	}

	@NonNull
	public Integer getPort() {
		return this.port;
	}

	@NonNull
	public Path getDirectoryPath() {
		return this.directoryPath;
	}

	@NonNull
	public Boolean isExposeToLan() {
		return this.exposeToLan;
	}

	@Override
	public String toString() {
		return format("%s{port=%d, directoryPath=%s, exposeToLan=%s}", getClass().getSimpleName(),
				getPort(), getDirectoryPath(), isExposeToLan());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof SavedServer savedServer))
			return false;

		return Objects.equals(getPort(), savedServer.getPort())
				&& Objects.equals(getDirectoryPath(), savedServer.getDirectoryPath())
				&& Objects.equals(isExposeToLan(), savedServer.isExposeToLan());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getPort(), getDirectoryPath(), isExposeToLan());
	}
}
