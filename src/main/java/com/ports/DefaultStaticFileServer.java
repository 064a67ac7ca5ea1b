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

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.OutputStream;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

@ThreadSafe
final class DefaultStaticFileServer implements StaticFileServer {
	@NonNull
	private static final String LOOPBACK_HOST;
	@NonNull
	private static final String WILDCARD_HOST;
	@NonNull
	private static final Integer DEFAULT_PORT;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_CONNECTIONS;
	@NonNull
	private static final Duration DEFAULT_REQUEST_TIMEOUT;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
	@NonNull
	private static final Integer DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
	@NonNull
	private static final Integer SOCKET_PENDING_CONNECTION_LIMIT;

	static {
		LOOPBACK_HOST = "127.0.0.1";
		WILDCARD_HOST = "0.0.0.0";
		DEFAULT_PORT = 8080;
		DEFAULT_MAXIMUM_CONNECTIONS = 50;
		DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
		DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES = 1_024 * 64;
		DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES = 1_024 * 8;
		SOCKET_PENDING_CONNECTION_LIMIT = 128;
	}

	@NonNull
	private final Integer port;
	@NonNull
	private final Path rootDirectory;
	@NonNull
	private final Boolean exposeToLan;
	@NonNull
	private final Integer maximumConnections;
	@NonNull
	private final Duration requestTimeout;
	@NonNull
	private final Integer maximumRequestSizeInBytes;
	@NonNull
	private final Integer requestReadBufferSizeInBytes;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final ResponseMarshaler responseMarshaler;
	@Nullable
	private final ServerFailureListener failureListener;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final Map<Long, ConnectionSession> sessionsById;
	@NonNull
	private final AtomicLong sessionIdGenerator;
	@Nullable
	private volatile ServerSocket serverSocket;
	@Nullable
	private volatile StaticFileRequestHandler requestHandler;
	@Nullable
	private volatile ExecutorService sessionExecutorService;
	@Nullable
	private volatile ScheduledExecutorService deadlineExecutorService;

	DefaultStaticFileServer(@NonNull Builder builder) {
		requireNonNull(builder);

		this.lock = new ReentrantLock();
		this.sessionsById = new HashMap<>();
		this.sessionIdGenerator = new AtomicLong(0);

		this.rootDirectory = builder.rootDirectory;
		this.port = builder.port != null ? builder.port : DEFAULT_PORT;
		this.exposeToLan = builder.exposeToLan != null ? builder.exposeToLan : false;
		this.maximumConnections = builder.maximumConnections != null ? builder.maximumConnections : DEFAULT_MAXIMUM_CONNECTIONS;
		this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : DEFAULT_REQUEST_TIMEOUT;
		this.maximumRequestSizeInBytes = builder.maximumRequestSizeInBytes != null ? builder.maximumRequestSizeInBytes : DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
		this.requestReadBufferSizeInBytes = builder.requestReadBufferSizeInBytes != null ? builder.requestReadBufferSizeInBytes : DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.responseMarshaler = builder.responseMarshaler != null ? builder.responseMarshaler : ResponseMarshaler.defaultInstance();
		this.failureListener = builder.failureListener;

		if (this.maximumConnections < 1)
			throw new IllegalArgumentException("Maximum connections must be > 0");

		if (this.requestTimeout.isNegative() || this.requestTimeout.isZero())
			throw new IllegalArgumentException("Request timeout must be > 0");

		if (this.maximumRequestSizeInBytes < 4)
			throw new IllegalArgumentException("Maximum request size must be at least 4 bytes");

		if (this.requestReadBufferSizeInBytes < 1)
			throw new IllegalArgumentException("Request read buffer size must be > 0");
	}

	@Override
	public void start() {
		getLock().lock();

		try {
			if (isStarted())
				return;

			safelyNotify(lifecycleObserver -> lifecycleObserver.willStartServer(this));

			ServerSocket serverSocket = null;

			try {
				if (this.port < 0 || this.port > 65_535)
					throw new BindException(format("Port %d is outside of the valid range 0-65535", this.port));

				this.requestHandler = new StaticFileRequestHandler(PathSandbox.forRootDirectory(getRootDirectory()),
						getResponseMarshaler(), getLifecycleObserver());

				serverSocket = new ServerSocket();
				serverSocket.setReuseAddress(true);
				serverSocket.bind(new InetSocketAddress(getHost(), this.port), SOCKET_PENDING_CONNECTION_LIMIT);

				this.sessionExecutorService = Executors.newFixedThreadPool(getMaximumConnections(),
						new DaemonThreadFactory(format("ports-%d-session", serverSocket.getLocalPort())));
				this.deadlineExecutorService = Executors.newSingleThreadScheduledExecutor(
						new DaemonThreadFactory(format("ports-%d-deadline", serverSocket.getLocalPort())));

				ServerSocket acceptingServerSocket = serverSocket;
				Thread acceptThread = new DaemonThreadFactory(format("ports-%d-accept", serverSocket.getLocalPort()))
						.newThread(() -> acceptLoop(acceptingServerSocket));

				this.serverSocket = serverSocket;
				acceptThread.start();
			} catch (IOException e) {
				cleanupFailedStart(serverSocket);

				ServerBindException serverBindException = new ServerBindException(
						format("Unable to bind %s:%d: %s", getHost(), this.port, e.getMessage()), e, this.port);

				safelyNotify(lifecycleObserver -> lifecycleObserver.didFailToStartServer(this, serverBindException));
				throw serverBindException;
			} catch (RuntimeException e) {
				cleanupFailedStart(serverSocket);
				safelyNotify(lifecycleObserver -> lifecycleObserver.didFailToStartServer(this, e));
				throw e;
			}

			safelyNotify(lifecycleObserver -> lifecycleObserver.didStartServer(this));
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void stop() {
		getLock().lock();

		try {
			if (!isStarted())
				return;

			safelyNotify(lifecycleObserver -> lifecycleObserver.willStopServer(this));

			ServerSocket serverSocket = this.serverSocket;

			try {
				if (serverSocket != null)
					serverSocket.close();
			} catch (IOException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to close server socket")
						.throwable(e)
						.port(this.port)
						.build());
			}

			// Snapshot first, since closing a session deregisters it from the map
			List<ConnectionSession> sessions = new ArrayList<>(getSessionsById().values());

			for (ConnectionSession session : sessions)
				session.close();

			getSessionsById().clear();

			ExecutorService sessionExecutorService = this.sessionExecutorService;

			if (sessionExecutorService != null)
				sessionExecutorService.shutdownNow();

			ScheduledExecutorService deadlineExecutorService = this.deadlineExecutorService;

			if (deadlineExecutorService != null)
				deadlineExecutorService.shutdownNow();
		} finally {
			this.serverSocket = null;
			this.requestHandler = null;
			this.sessionExecutorService = null;
			this.deadlineExecutorService = null;

			getLock().unlock();
		}

		safelyNotify(lifecycleObserver -> lifecycleObserver.didStopServer(this));
	}

	@NonNull
	@Override
	public Boolean isStarted() {
		return this.serverSocket != null;
	}

	@NonNull
	@Override
	public Integer getPort() {
		ServerSocket serverSocket = this.serverSocket;
		return serverSocket == null ? this.port : serverSocket.getLocalPort();
	}

	@NonNull
	@Override
	public Path getRootDirectory() {
		return this.rootDirectory;
	}

	@NonNull
	@Override
	public Boolean isExposeToLan() {
		return this.exposeToLan;
	}

	/**
	 * How many connections are currently registered, i.e. accepted and not yet closed.
	 */
	@NonNull
	Integer getActiveConnectionCount() {
		getLock().lock();

		try {
			return getSessionsById().size();
		} finally {
			getLock().unlock();
		}
	}

	private void acceptLoop(@NonNull ServerSocket serverSocket) {
		requireNonNull(serverSocket);

		while (!serverSocket.isClosed()) {
			Socket socket;

			try {
				socket = serverSocket.accept();
			} catch (IOException e) {
				// A closed socket means stop() was called
				if (serverSocket.isClosed())
					return;

				handleAcceptFailure(e);
				return;
			}

			try {
				handleAcceptedSocket(socket);
			} catch (RuntimeException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to hand off accepted connection")
						.throwable(e)
						.port(getPort())
						.build());
				closeQuietly(socket);
			}
		}
	}

	private void handleAcceptedSocket(@NonNull Socket socket) {
		requireNonNull(socket);

		ConnectionSession session = null;

		getLock().lock();

		try {
			StaticFileRequestHandler requestHandler = this.requestHandler;
			ExecutorService sessionExecutorService = this.sessionExecutorService;
			ScheduledExecutorService deadlineExecutorService = this.deadlineExecutorService;

			if (requestHandler == null || sessionExecutorService == null || deadlineExecutorService == null) {
				// Raced with stop()
				closeQuietly(socket);
				return;
			}

			if (getSessionsById().size() < getMaximumConnections()) {
				long sessionId = getSessionIdGenerator().incrementAndGet();
				session = new ConnectionSession(sessionId, socket, this, requestHandler);

				getSessionsById().put(sessionId, session);
				session.armDeadline(deadlineExecutorService, getRequestTimeout());

				try {
					sessionExecutorService.execute(session);
				} catch (RejectedExecutionException e) {
					session.close();
				}

				return;
			}
		} finally {
			getLock().unlock();
		}

		rejectConnection(socket);
	}

	// Over capacity: write a 503 synchronously and close without ever registering
	private void rejectConnection(@NonNull Socket socket) {
		requireNonNull(socket);

		SocketAddress remoteAddress = socket.getRemoteSocketAddress();
		MarshaledResponse marshaledResponse = getResponseMarshaler().forError(StatusCode.HTTP_503);

		try (socket) {
			OutputStream outputStream = socket.getOutputStream();
			outputStream.write(marshaledResponse.toWireBytes());
			outputStream.flush();
			socket.shutdownOutput();
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to write 503 response to rejected connection")
					.throwable(e)
					.port(getPort())
					.build());
		}

		InetSocketAddress inetSocketAddress = remoteAddress instanceof InetSocketAddress address ? address : null;
		safelyNotify(lifecycleObserver -> lifecycleObserver.didRejectConnection(this, inetSocketAddress));
	}

	private void handleAcceptFailure(@NonNull IOException e) {
		requireNonNull(e);

		safelyLog(LogEvent.with(LogEventType.SERVER_ACCEPT_FAILED, "Accept loop failed unexpectedly; stopping server")
				.throwable(e)
				.port(getPort())
				.build());

		stop();

		ServerFailureListener failureListener = getFailureListener().orElse(null);

		if (failureListener == null)
			return;

		try {
			failureListener.didFail(this, e);
		} catch (Throwable throwable) {
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	void deregisterSession(@NonNull Long sessionId) {
		requireNonNull(sessionId);

		getLock().lock();

		try {
			getSessionsById().remove(sessionId);
		} finally {
			getLock().unlock();
		}
	}

	void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The LifecycleObserver implementation errored out, but we can't let that affect us - swallow its exception.
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	void safelyNotify(@NonNull LifecycleNotification lifecycleNotification) {
		requireNonNull(lifecycleNotification);

		try {
			lifecycleNotification.notify(getLifecycleObserver());
		} catch (Throwable throwable) {
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	private void closeQuietly(@NonNull Socket socket) {
		try {
			socket.close();
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to close socket")
					.throwable(e)
					.port(getPort())
					.build());
		}
	}

	private void cleanupFailedStart(@Nullable ServerSocket serverSocket) {
		if (serverSocket != null) {
			try {
				serverSocket.close();
			} catch (IOException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to close server socket after failed start")
						.throwable(e)
						.port(this.port)
						.build());
			}
		}

		ExecutorService sessionExecutorService = this.sessionExecutorService;

		if (sessionExecutorService != null)
			sessionExecutorService.shutdownNow();

		ScheduledExecutorService deadlineExecutorService = this.deadlineExecutorService;

		if (deadlineExecutorService != null)
			deadlineExecutorService.shutdownNow();

		this.serverSocket = null;
		this.requestHandler = null;
		this.sessionExecutorService = null;
		this.deadlineExecutorService = null;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{host=%s, port=%d, rootDirectory=%s, started=%s}", getClass().getSimpleName(),
				getHost(), getPort(), getRootDirectory(), isStarted());
	}

	@NonNull
	String getHost() {
		return isExposeToLan() ? WILDCARD_HOST : LOOPBACK_HOST;
	}

	@NonNull
	Integer getMaximumConnections() {
		return this.maximumConnections;
	}

	@NonNull
	Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	@NonNull
	Integer getMaximumRequestSizeInBytes() {
		return this.maximumRequestSizeInBytes;
	}

	@NonNull
	Integer getRequestReadBufferSizeInBytes() {
		return this.requestReadBufferSizeInBytes;
	}

	@NonNull
	LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	ResponseMarshaler getResponseMarshaler() {
		return this.responseMarshaler;
	}

	@NonNull
	Optional<ServerFailureListener> getFailureListener() {
		return Optional.ofNullable(this.failureListener);
	}

	@NonNull
	ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	private Map<Long, ConnectionSession> getSessionsById() {
		return this.sessionsById;
	}

	@NonNull
	private AtomicLong getSessionIdGenerator() {
		return this.sessionIdGenerator;
	}

	@FunctionalInterface
	interface LifecycleNotification {
		void notify(@NonNull LifecycleObserver lifecycleObserver);
	}

	@ThreadSafe
	static class DaemonThreadFactory implements ThreadFactory {
		@NonNull
		private final String namePrefix;
		@NonNull
		private final AtomicInteger idGenerator;

		DaemonThreadFactory(@NonNull String namePrefix) {
			requireNonNull(namePrefix);

			this.namePrefix = namePrefix;
			this.idGenerator = new AtomicInteger(0);
		}

		@Override
		@NonNull
		public Thread newThread(@NonNull Runnable runnable) {
			Thread thread = new Thread(runnable, format("%s-%d", this.namePrefix, this.idGenerator.incrementAndGet()));
			thread.setDaemon(true);
			return thread;
		}
	}
}
