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

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Read-only hooks for examining server and scanner lifecycle events.
 * <p>
 * Implementations should be fast and must not throw: exceptions thrown by an observer are caught and written to
 * {@code stderr}, and never affect request handling.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method. It forwards
 * log events to {@code java.util.logging}, which the command-line front end bridges to SLF4J.
 */
public interface LifecycleObserver {
	/**
	 * Called before a {@link StaticFileServer} binds its port.
	 */
	default void willStartServer(@NonNull StaticFileServer server) {
		// No-op by default
	}

	/**
	 * Called after a {@link StaticFileServer} has bound its port and is accepting connections.
	 */
	default void didStartServer(@NonNull StaticFileServer server) {
		// No-op by default
	}

	/**
	 * Called after a {@link StaticFileServer} was asked to start, but failed due to an exception.
	 */
	default void didFailToStartServer(@NonNull StaticFileServer server,
																		@NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called before a {@link StaticFileServer} stops.
	 */
	default void willStopServer(@NonNull StaticFileServer server) {
		// No-op by default
	}

	/**
	 * Called after a {@link StaticFileServer} has released its port.
	 */
	default void didStopServer(@NonNull StaticFileServer server) {
		// No-op by default
	}

	/**
	 * Called when a connection was turned away with a {@code 503} because the server already holds its maximum number
	 * of concurrent connections.
	 *
	 * @param server        the server that rejected the connection
	 * @param remoteAddress the client's address, if known
	 */
	default void didRejectConnection(@NonNull StaticFileServer server,
																	 @Nullable InetSocketAddress remoteAddress) {
		// No-op by default
	}

	/**
	 * Called after a response has been fully written to a client.
	 *
	 * @param server            the server that wrote the response
	 * @param request           the parsed request, or {@code null} if the request could not be parsed
	 * @param marshaledResponse the response that was written
	 * @param duration          elapsed time from connection acceptance until the write completed
	 */
	default void didWriteResponse(@NonNull StaticFileServer server,
																@Nullable Request request,
																@NonNull MarshaledResponse marshaledResponse,
																@NonNull Duration duration) {
		// No-op by default
	}

	/**
	 * Called when an event suitable for logging occurs during processing.
	 * <p>
	 * The default implementation forwards to the {@code com.ports} {@link Logger}.
	 *
	 * @param logEvent the event that occurred
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		Logger logger = Logger.getLogger("com.ports");
		Level level = levelForLogEventType(logEvent.getLogEventType());

		if (!logger.isLoggable(level))
			return;

		String message = format("[%s] %s", logEvent.getLogEventType().name(), logEvent.getMessage());
		Throwable throwable = logEvent.getThrowable().orElse(null);

		if (throwable == null)
			logger.log(level, message);
		else
			logger.log(level, message, throwable);
	}

	@NonNull
	private static Level levelForLogEventType(@NonNull LogEventType logEventType) {
		requireNonNull(logEventType);

		return switch (logEventType) {
			case SERVER_INTERNAL_ERROR, SERVER_ACCEPT_FAILED, SERVER_FILE_READ_FAILED, SAVED_SERVER_WRITE_FAILED -> Level.SEVERE;
			case PORT_SCAN_FAILED, PORT_SCAN_WARNING, SERVER_PATH_VIOLATION, SAVED_SERVER_DECODE_FAILED, SAVED_SERVER_RESTORE_FAILED -> Level.WARNING;
			case SERVER_UNPARSEABLE_REQUEST, SERVER_REQUEST_TIMEOUT -> Level.FINE;
		};
	}

	/**
	 * Acquires a threadsafe {@link LifecycleObserver} instance with sensible defaults.
	 *
	 * @return a {@code LifecycleObserver} with default settings
	 */
	@NonNull
	static LifecycleObserver defaultInstance() {
		return DefaultLifecycleObserver.defaultInstance();
	}
}
