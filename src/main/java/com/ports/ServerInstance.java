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
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A running {@link StaticFileServer} owned by a {@link ServerManager}.
 */
@ThreadSafe
public final class ServerInstance {
	@NonNull
	private final UUID id;
	@NonNull
	private final Integer port;
	@NonNull
	private final Path rootDirectory;
	@NonNull
	private final Boolean exposeToLan;
	@NonNull
	private final StaticFileServer staticFileServer;

	ServerInstance(@NonNull UUID id,
								 @NonNull Integer port,
								 @NonNull Path rootDirectory,
								 @NonNull Boolean exposeToLan,
								 @NonNull StaticFileServer staticFileServer) {
		this.id = requireNonNull(id);
		this.port = requireNonNull(port);
		this.rootDirectory = requireNonNull(rootDirectory);
		this.exposeToLan = requireNonNull(exposeToLan);
		this.staticFileServer = requireNonNull(staticFileServer);
	}

	@NonNull
	public UUID getId() {
		return this.id;
	}

	/**
	 * The port actually bound, which differs from the requested one when {@code 0} was requested.
	 */
	@NonNull
	public Integer getPort() {
		return this.port;
	}

	/**
	 * The canonical absolute root directory.
	 */
	@NonNull
	public Path getRootDirectory() {
		return this.rootDirectory;
	}

	@NonNull
	public Boolean isExposeToLan() {
		return this.exposeToLan;
	}

	@NonNull
	public StaticFileServer getStaticFileServer() {
		return this.staticFileServer;
	}

	@NonNull
	SavedServer toSavedServer() {
		return new SavedServer(getPort(), getRootDirectory(), isExposeToLan());
	}

	@Override
	public String toString() {
		return format("%s{id=%s, port=%d, rootDirectory=%s, exposeToLan=%s}", getClass().getSimpleName(),
				getId(), getPort(), getRootDirectory(), isExposeToLan());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ServerInstance serverInstance))
			return false;

		return Objects.equals(getId(), serverInstance.getId());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getId());
	}
}
