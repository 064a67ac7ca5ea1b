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

import com.ports.exception.BadRequestException;
import com.ports.exception.ContentTooLargeException;
import com.ports.exception.IllegalRequestException;
import com.ports.exception.MethodNotAllowedException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Owns one accepted socket from acceptance until close.
 * <p>
 * Frames the header block, parses and handles the request, writes exactly one response and closes. A deadline armed
 * at acceptance closes the connection without a response if framing has not finished in time.
 */
@ThreadSafe
final class ConnectionSession implements Runnable {
	@NonNull
	private static final Duration LINGER_TIMEOUT;
	@NonNull
	private static final Integer LINGER_MAXIMUM_BYTES;

	static {
		LINGER_TIMEOUT = Duration.ofMillis(500);
		LINGER_MAXIMUM_BYTES = 1_024 * 64;
	}

	@NonNull
	private final Long sessionId;
	@NonNull
	private final Socket socket;
	@NonNull
	private final DefaultStaticFileServer server;
	@NonNull
	private final StaticFileRequestHandler requestHandler;
	@NonNull
	private final Instant acceptedAt;
	// Set exactly once, by whichever of framing completion or deadline expiry happens first
	@NonNull
	private final AtomicBoolean framingFinished;
	@NonNull
	private final AtomicBoolean closed;
	@Nullable
	private volatile ScheduledFuture<?> deadlineFuture;

	ConnectionSession(@NonNull Long sessionId,
										@NonNull Socket socket,
										@NonNull DefaultStaticFileServer server,
										@NonNull StaticFileRequestHandler requestHandler) {
		requireNonNull(sessionId);
		requireNonNull(socket);
		requireNonNull(server);
		requireNonNull(requestHandler);

		this.sessionId = sessionId;
		this.socket = socket;
		this.server = server;
		this.requestHandler = requestHandler;
		this.acceptedAt = Instant.now();
		this.framingFinished = new AtomicBoolean(false);
		this.closed = new AtomicBoolean(false);
	}

	/**
	 * Schedules the framing deadline. Called by the server under its lock at registration time.
	 */
	void armDeadline(@NonNull ScheduledExecutorService deadlineExecutorService,
									 @NonNull Duration timeout) {
		requireNonNull(deadlineExecutorService);
		requireNonNull(timeout);

		this.deadlineFuture = deadlineExecutorService.schedule(this::onDeadline, timeout.toMillis(), TimeUnit.MILLISECONDS);
	}

	@Override
	public void run() {
		Request request = null;
		MarshaledResponse marshaledResponse;

		try {
			try {
				String headerBlock = readHeaderBlock();
				request = RequestParser.defaultInstance().parse(headerBlock);
				marshaledResponse = getRequestHandler().handleRequest(request);
			} catch (ContentTooLargeException e) {
				finishFraming();
				logUnparseableRequest(e);
				marshaledResponse = getServer().getResponseMarshaler().forError(StatusCode.HTTP_413);
			} catch (BadRequestException e) {
				finishFraming();
				logUnparseableRequest(e);
				marshaledResponse = getServer().getResponseMarshaler().forError(StatusCode.HTTP_400);
			} catch (MethodNotAllowedException e) {
				logUnparseableRequest(e);
				marshaledResponse = getServer().getResponseMarshaler().forError(StatusCode.HTTP_405);
			}

			if (isClosed())
				return;

			writeResponse(marshaledResponse);

			Request writtenRequest = request;
			MarshaledResponse writtenResponse = marshaledResponse;
			Duration duration = Duration.between(getAcceptedAt(), Instant.now());

			getServer().safelyNotify(lifecycleObserver ->
					lifecycleObserver.didWriteResponse(getServer(), writtenRequest, writtenResponse, duration));

			lingeringClose();
		} catch (IOException e) {
			// Expected when the deadline or stop() closed the socket underneath us
			if (!isClosed())
				getServer().safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "I/O failure while serving connection")
						.throwable(e)
						.request(request)
						.port(getServer().getPort())
						.build());
		} catch (Throwable t) {
			getServer().safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "An unexpected error occurred during request handling")
					.throwable(t)
					.request(request)
					.port(getServer().getPort())
					.build());

			writeFailsafeResponse();
		} finally {
			close();
		}
	}

	@NonNull
	private String readHeaderBlock() throws IOException {
		HeaderBlockBuffer headerBlockBuffer = new HeaderBlockBuffer(getServer().getMaximumRequestSizeInBytes());
		byte[] readBuffer = new byte[getServer().getRequestReadBufferSizeInBytes()];
		InputStream inputStream = getSocket().getInputStream();

		while (true) {
			int bytesRead = inputStream.read(readBuffer);

			if (bytesRead < 0)
				throw new IllegalRequestException(format("Connection closed after %d bytes, before a complete request header block was received",
						headerBlockBuffer.size()));

			headerBlockBuffer.add(readBuffer, bytesRead);

			if (headerBlockBuffer.isComplete()) {
				finishFraming();
				return requireNonNull(headerBlockBuffer.takeHeaderBlock());
			}
		}
	}

	private void writeResponse(@NonNull MarshaledResponse marshaledResponse) throws IOException {
		requireNonNull(marshaledResponse);

		OutputStream outputStream = getSocket().getOutputStream();
		outputStream.write(marshaledResponse.toWireBytes());
		outputStream.flush();
	}

	private void writeFailsafeResponse() {
		if (isClosed())
			return;

		try {
			writeResponse(getServer().getResponseMarshaler().forError(StatusCode.HTTP_500));
		} catch (IOException | RuntimeException e) {
			getServer().safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "An error occurred while writing a failsafe response")
					.throwable(e)
					.port(getServer().getPort())
					.build());
		}
	}

	// Half-close, then drain briefly so unread request bytes do not turn our close into a reset that eats the response
	private void lingeringClose() throws IOException {
		Socket socket = getSocket();
		socket.shutdownOutput();
		socket.setSoTimeout((int) LINGER_TIMEOUT.toMillis());

		InputStream inputStream = socket.getInputStream();
		byte[] drainBuffer = new byte[1_024 * 4];
		int drained = 0;

		try {
			while (drained < LINGER_MAXIMUM_BYTES) {
				int bytesRead = inputStream.read(drainBuffer);

				if (bytesRead < 0)
					break;

				drained += bytesRead;
			}
		} catch (SocketTimeoutException e) {
			// Client kept the connection open; the response is already out, so close regardless
			getServer().safelyLog(LogEvent.with(LogEventType.SERVER_REQUEST_TIMEOUT, "Client did not close its side of the connection after the response")
					.throwable(e)
					.port(getServer().getPort())
					.build());
		}
	}

	private void onDeadline() {
		if (!getFramingFinished().compareAndSet(false, true))
			return;

		getServer().safelyLog(LogEvent.with(LogEventType.SERVER_REQUEST_TIMEOUT,
						format("No complete request received within %d ms; closing connection", getServer().getRequestTimeout().toMillis()))
				.port(getServer().getPort())
				.build());

		close();
	}

	private void finishFraming() {
		if (!getFramingFinished().compareAndSet(false, true))
			return;

		cancelDeadline();
	}

	private void cancelDeadline() {
		getServer().getLock().lock();

		try {
			ScheduledFuture<?> deadlineFuture = this.deadlineFuture;

			if (deadlineFuture != null)
				deadlineFuture.cancel(false);
		} finally {
			getServer().getLock().unlock();
		}
	}

	/**
	 * Closes the socket and deregisters from the server. Safe to call any number of times from any thread.
	 */
	void close() {
		if (!getClosed().compareAndSet(false, true))
			return;

		cancelDeadline();

		try {
			getSocket().close();
		} catch (IOException e) {
			getServer().safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to close connection socket")
					.throwable(e)
					.port(getServer().getPort())
					.build());
		}

		getServer().deregisterSession(getSessionId());
	}

	@NonNull
	Boolean isClosed() {
		return getClosed().get();
	}

	private void logUnparseableRequest(@NonNull Throwable throwable) {
		getServer().safelyLog(LogEvent.with(LogEventType.SERVER_UNPARSEABLE_REQUEST, String.valueOf(throwable.getMessage()))
				.throwable(throwable)
				.port(getServer().getPort())
				.build());
	}

	@NonNull
	Long getSessionId() {
		return this.sessionId;
	}

	@NonNull
	private Socket getSocket() {
		return this.socket;
	}

	@NonNull
	private DefaultStaticFileServer getServer() {
		return this.server;
	}

	@NonNull
	private StaticFileRequestHandler getRequestHandler() {
		return this.requestHandler;
	}

	@NonNull
	private Instant getAcceptedAt() {
		return this.acceptedAt;
	}

	@NonNull
	private AtomicBoolean getFramingFinished() {
		return this.framingFinished;
	}

	@NonNull
	private AtomicBoolean getClosed() {
		return this.closed;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{sessionId=%d, remoteAddress=%s, closed=%s}", getClass().getSimpleName(), getSessionId(),
				getSocket().getRemoteSocketAddress(), isClosed());
	}
}
