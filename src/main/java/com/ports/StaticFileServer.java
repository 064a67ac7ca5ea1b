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

import com.ports.exception.ServerBindException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.nio.file.Path;
import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * An embedded HTTP/1.1 server that exposes one directory tree as static files.
 * <p>
 * Each connection carries exactly one {@code GET} request and one response, after which it is closed.
 * <p>
 * For example:
 * <pre>{@code  try (StaticFileServer server = StaticFileServer.withRootDirectory(Path.of("site"))
 *     .port(8080)
 *     .build()) {
 *   server.start();
 *   System.out.println("Serving on port " + server.getPort());
 * }}</pre>
 */
public interface StaticFileServer extends AutoCloseable {
	/**
	 * Binds the port and begins accepting connections.
	 * <p>
	 * If the server is already started, no action is taken.
	 *
	 * @throws ServerBindException      if the port is in use, privileged or out of range; no partial state is retained
	 * @throws IllegalArgumentException if the root directory does not exist
	 */
	void start();

	/**
	 * Closes every active connection without waiting for in-flight writes, then releases the port.
	 * <p>
	 * If the server is already stopped, no action is taken.
	 */
	void stop();

	@NonNull
	Boolean isStarted();

	/**
	 * The port this server listens on.
	 * <p>
	 * While started, this is the actually-bound port, which differs from the configured one when the server was
	 * configured with port {@code 0}.
	 *
	 * @return the port
	 */
	@NonNull
	Integer getPort();

	@NonNull
	Path getRootDirectory();

	/**
	 * Whether this server binds the wildcard address ({@code 0.0.0.0}) rather than loopback ({@code 127.0.0.1}).
	 */
	@NonNull
	Boolean isExposeToLan();

	/**
	 * {@link AutoCloseable}-enabled synonym for {@link #stop()}.
	 */
	@Override
	default void close() {
		stop();
	}

	@NonNull
	static Builder withRootDirectory(@NonNull Path rootDirectory) {
		requireNonNull(rootDirectory);
		return new Builder(rootDirectory);
	}

	/**
	 * Builder used to construct a standard implementation of {@link StaticFileServer}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	final class Builder {
		@NonNull
		Path rootDirectory;
		@Nullable
		Integer port;
		@Nullable
		Boolean exposeToLan;
		@Nullable
		Integer maximumConnections;
		@Nullable
		Duration requestTimeout;
		@Nullable
		Integer maximumRequestSizeInBytes;
		@Nullable
		Integer requestReadBufferSizeInBytes;
		@Nullable
		LifecycleObserver lifecycleObserver;
		@Nullable
		ResponseMarshaler responseMarshaler;
		@Nullable
		ServerFailureListener failureListener;

		private Builder(@NonNull Path rootDirectory) {
			requireNonNull(rootDirectory);
			this.rootDirectory = rootDirectory;
		}

		@NonNull
		public Builder rootDirectory(@NonNull Path rootDirectory) {
			requireNonNull(rootDirectory);
			this.rootDirectory = rootDirectory;
			return this;
		}

		@NonNull
		public Builder port(@Nullable Integer port) {
			this.port = port;
			return this;
		}

		@NonNull
		public Builder exposeToLan(@Nullable Boolean exposeToLan) {
			this.exposeToLan = exposeToLan;
			return this;
		}

		@NonNull
		public Builder maximumConnections(@Nullable Integer maximumConnections) {
			this.maximumConnections = maximumConnections;
			return this;
		}

		@NonNull
		public Builder requestTimeout(@Nullable Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		@NonNull
		public Builder maximumRequestSizeInBytes(@Nullable Integer maximumRequestSizeInBytes) {
			this.maximumRequestSizeInBytes = maximumRequestSizeInBytes;
			return this;
		}

		@NonNull
		public Builder requestReadBufferSizeInBytes(@Nullable Integer requestReadBufferSizeInBytes) {
			this.requestReadBufferSizeInBytes = requestReadBufferSizeInBytes;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public Builder responseMarshaler(@Nullable ResponseMarshaler responseMarshaler) {
			this.responseMarshaler = responseMarshaler;
			return this;
		}

		@NonNull
		public Builder failureListener(@Nullable ServerFailureListener failureListener) {
			this.failureListener = failureListener;
			return this;
		}

		/**
		 * Applies the server-related values of the given configuration: connection cap, request timeout and
		 * request size limits.
		 */
		@NonNull
		public Builder config(@NonNull PortsConfig portsConfig) {
			requireNonNull(portsConfig);

			this.maximumConnections = portsConfig.getMaximumConnections();
			this.requestTimeout = portsConfig.getRequestTimeout();
			this.maximumRequestSizeInBytes = portsConfig.getMaximumRequestSizeInBytes();
			this.requestReadBufferSizeInBytes = portsConfig.getRequestReadBufferSizeInBytes();
			return this;
		}

		@NonNull
		public StaticFileServer build() {
			return new DefaultStaticFileServer(this);
		}
	}
}
