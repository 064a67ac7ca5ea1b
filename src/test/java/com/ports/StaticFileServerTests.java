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

import com.ports.TestSupport.QuietLifecycleObserver;
import com.ports.exception.ServerBindException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.ports.TestSupport.body;
import static com.ports.TestSupport.connect;
import static com.ports.TestSupport.findFreePort;
import static com.ports.TestSupport.get;
import static com.ports.TestSupport.header;
import static com.ports.TestSupport.rawRequest;
import static com.ports.TestSupport.readAll;
import static com.ports.TestSupport.statusLine;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class StaticFileServerTests {
	@TempDir
	Path temporaryDirectory;

	private Path rootDirectory;
	private StaticFileServer server;

	@BeforeEach
	public void setUp() throws IOException {
		rootDirectory = Files.createDirectory(temporaryDirectory.resolve("Greendale"));
		Files.createDirectory(rootDirectory.resolve("study room"));
		Files.writeString(rootDirectory.resolve("study room").resolve("notes.txt"), "Spanish 101");
		Files.createDirectory(rootDirectory.resolve("site"));
		Files.writeString(rootDirectory.resolve("site").resolve("index.html"), "<h1>Welcome</h1>");
		Files.writeString(temporaryDirectory.resolve("secret.txt"), "Dean's plans");
	}

	@AfterEach
	public void tearDown() {
		if (server != null)
			server.stop();
	}

	private StaticFileServer startServer(StaticFileServer.Builder builder) {
		server = builder.port(0).lifecycleObserver(new QuietLifecycleObserver()).build();
		server.start();
		return server;
	}

	private StaticFileServer startServer() {
		return startServer(StaticFileServer.withRootDirectory(rootDirectory));
	}

	@Test
	@Timeout(10)
	public void servesFileWithExactContentLength() throws IOException {
		int port = startServer().getPort();
		byte[] expected = Files.readAllBytes(rootDirectory.resolve("study room").resolve("notes.txt"));

		String response = get(port, "/study%20room/notes.txt");

		assertEquals("HTTP/1.1 200 OK", statusLine(response));
		assertEquals("text/plain; charset=utf-8", header(response, "Content-Type"));
		assertEquals(String.valueOf(expected.length), header(response, "Content-Length"));
		assertEquals("close", header(response, "Connection"));
		assertEquals("Spanish 101", body(response));

		// Repeated requests are served identically
		assertEquals(response, get(port, "/study%20room/notes.txt"));
	}

	@Test
	@Timeout(10)
	public void servesBinaryFileByteForByte() throws IOException {
		byte[] contents = new byte[70_000];

		for (int i = 0; i < contents.length; i++)
			contents[i] = (byte) (i % 251);

		Files.write(rootDirectory.resolve("blob.bin"), contents);
		int port = startServer().getPort();

		try (Socket socket = connect(port)) {
			socket.getOutputStream().write("GET /blob.bin HTTP/1.1\r\n\r\n".getBytes(StandardCharsets.UTF_8));
			byte[] response = readAll(socket.getInputStream());

			String head = new String(response, 0, Math.min(response.length, 512), StandardCharsets.ISO_8859_1);
			int bodyStart = head.indexOf("\r\n\r\n") + 4;

			assertTrue(head.startsWith("HTTP/1.1 200 OK\r\n"));
			assertTrue(head.contains("Content-Type: application/octet-stream\r\nContent-Length: 70000\r\n"));
			assertEquals(contents.length, response.length - bodyStart);

			for (int i = 0; i < contents.length; i++)
				assertEquals(contents[i], response[bodyStart + i]);
		}
	}

	@Test
	@Timeout(10)
	public void directoryWithoutTrailingSlashRedirects() throws IOException {
		int port = startServer().getPort();

		String response = get(port, "/study%20room?x=1");

		assertEquals("HTTP/1.1 301 Moved Permanently", statusLine(response));
		assertEquals("/study%20room/", header(response, "Location"));
	}

	@Test
	@Timeout(10)
	public void directoryServesIndexOrListing() throws IOException {
		int port = startServer().getPort();

		String indexResponse = get(port, "/site/");
		assertEquals("HTTP/1.1 200 OK", statusLine(indexResponse));
		assertEquals("<h1>Welcome</h1>", body(indexResponse));

		String listingResponse = get(port, "/");
		assertEquals("HTTP/1.1 200 OK", statusLine(listingResponse));
		assertEquals("DENY", header(listingResponse, "X-Frame-Options"));
		assertTrue(body(listingResponse).contains("<a href=\"/study%20room/\">study room/</a>"));
		assertTrue(body(listingResponse).contains("<a href=\"/site/\">site/</a>"));
	}

	@Test
	@Timeout(10)
	public void traversalIsForbidden() throws IOException {
		int port = startServer().getPort();

		assertEquals("HTTP/1.1 403 Forbidden", statusLine(get(port, "/../secret.txt")));
		assertEquals("HTTP/1.1 403 Forbidden", statusLine(get(port, "/%2e%2e/secret.txt")));
		assertEquals("HTTP/1.1 403 Forbidden", statusLine(get(port, "/study%20room/%2E%2E/%2e%2e/secret.txt")));

		String response = get(port, "/%2e%2e/secret.txt");
		assertFalse(response.contains("Dean's plans"));
		assertEquals("<html><body><h1>403 Forbidden</h1></body></html>", body(response));
	}

	@Test
	@Timeout(10)
	public void missingFileIsNotFound() throws IOException {
		int port = startServer().getPort();
		assertEquals("HTTP/1.1 404 Not Found", statusLine(get(port, "/chang.txt")));
	}

	@Test
	@Timeout(10)
	public void malformedRequests() throws IOException {
		int port = startServer().getPort();

		assertEquals("HTTP/1.1 400 Bad Request", statusLine(rawRequest(port, "\r\n\r\n")));
		assertEquals("HTTP/1.1 400 Bad Request", statusLine(rawRequest(port, "GET\r\n\r\n")));
		assertEquals("HTTP/1.1 400 Bad Request", statusLine(rawRequest(port, "GET /%zz HTTP/1.1\r\n\r\n")));
		assertEquals("HTTP/1.1 400 Bad Request", statusLine(rawRequest(port, "GET /%ff HTTP/1.1\r\n\r\n")));
		assertEquals("HTTP/1.1 405 Method Not Allowed", statusLine(rawRequest(port, "POST / HTTP/1.1\r\n\r\n")));
		assertEquals("HTTP/1.1 405 Method Not Allowed", statusLine(rawRequest(port, "DELETE /notes.txt HTTP/1.1\r\n\r\n")));
	}

	@Test
	@Timeout(10)
	public void requestClosedBeforeTerminatorIsBadRequest() throws IOException {
		int port = startServer().getPort();

		try (Socket socket = connect(port)) {
			socket.getOutputStream().write("GET / HTTP/1.1\r\n".getBytes(StandardCharsets.UTF_8));
			socket.shutdownOutput();

			assertEquals("HTTP/1.1 400 Bad Request", statusLine(new String(readAll(socket.getInputStream()), StandardCharsets.UTF_8)));
		}
	}

	@Test
	@Timeout(10)
	public void oversizedRequestIsContentTooLarge() throws IOException {
		int port = startServer().getPort();

		try (Socket socket = connect(port)) {
			OutputStream outputStream = socket.getOutputStream();
			outputStream.write(("GET /" + "a".repeat(70_000)).getBytes(StandardCharsets.UTF_8));
			outputStream.flush();

			String response = new String(readAll(socket.getInputStream()), StandardCharsets.UTF_8);
			assertEquals("HTTP/1.1 413 Content Too Large", statusLine(response));
		}
	}

	@Test
	@Timeout(10)
	public void oversizedHeaderBlockWithTerminatorIsContentTooLarge() throws IOException {
		int port = startServer().getPort();
		String request = "GET /notes.txt HTTP/1.1\r\nX-Padding: " + "p".repeat(70_000) + "\r\n\r\n";

		assertEquals("HTTP/1.1 413 Content Too Large", statusLine(rawRequest(port, request)));
	}

	@Test
	@Timeout(20)
	public void connectionsBeyondCapAreRejected() throws Exception {
		DefaultStaticFileServer defaultServer = (DefaultStaticFileServer) startServer();
		int port = defaultServer.getPort();
		List<Socket> idleSockets = new ArrayList<>();

		try {
			for (int i = 0; i < 50; i++)
				idleSockets.add(connect(port));

			while (defaultServer.getActiveConnectionCount() < 50)
				Thread.sleep(10);

			try (Socket rejectedSocket = connect(port)) {
				String response = new String(readAll(rejectedSocket.getInputStream()), StandardCharsets.UTF_8);
				assertEquals("HTTP/1.1 503 Service Unavailable", statusLine(response));
			}

			assertEquals(50, defaultServer.getActiveConnectionCount());

			// The admitted connections are still served
			for (Socket socket : idleSockets) {
				socket.getOutputStream().write("GET /study%20room/notes.txt HTTP/1.1\r\n\r\n".getBytes(StandardCharsets.UTF_8));
				assertEquals("HTTP/1.1 200 OK", statusLine(new String(readAll(socket.getInputStream()), StandardCharsets.UTF_8)));
			}
		} finally {
			for (Socket socket : idleSockets)
				socket.close();
		}
	}

	@Test
	@Timeout(10)
	public void idleConnectionIsClosedAtDeadline() throws Exception {
		DefaultStaticFileServer defaultServer = (DefaultStaticFileServer) startServer(StaticFileServer.withRootDirectory(rootDirectory)
				.requestTimeout(Duration.ofMillis(300)));

		try (Socket socket = connect(defaultServer.getPort())) {
			socket.getOutputStream().write("GET /study".getBytes(StandardCharsets.UTF_8));

			byte[] response;

			try {
				response = readAll(socket.getInputStream());
			} catch (SocketException e) {
				// Reset is an acceptable way to close too
				response = new byte[0];
			}

			assertEquals(0, response.length, "No response should be written when the deadline fires");
		}

		while (defaultServer.getActiveConnectionCount() > 0)
			Thread.sleep(10);
	}

	@Test
	@Timeout(10)
	public void bindFailureLeavesNoState() throws IOException {
		try (ServerSocket occupied = new ServerSocket()) {
			occupied.bind(new InetSocketAddress("127.0.0.1", 0));
			int port = occupied.getLocalPort();

			StaticFileServer staticFileServer = StaticFileServer.withRootDirectory(rootDirectory)
					.port(port)
					.lifecycleObserver(new QuietLifecycleObserver())
					.build();

			ServerBindException exception = assertThrows(ServerBindException.class, staticFileServer::start);

			assertEquals(port, exception.getPort());
			assertFalse(staticFileServer.isStarted());
		}
	}

	@Test
	public void invalidPortFailsToBind() {
		StaticFileServer staticFileServer = StaticFileServer.withRootDirectory(rootDirectory)
				.port(70_000)
				.lifecycleObserver(new QuietLifecycleObserver())
				.build();

		assertThrows(ServerBindException.class, staticFileServer::start);
		assertFalse(staticFileServer.isStarted());
	}

	@Test
	public void missingRootFailsToStart() {
		StaticFileServer staticFileServer = StaticFileServer.withRootDirectory(temporaryDirectory.resolve("missing"))
				.port(0)
				.lifecycleObserver(new QuietLifecycleObserver())
				.build();

		assertThrows(IllegalArgumentException.class, staticFileServer::start);
		assertFalse(staticFileServer.isStarted());
	}

	@Test
	@Timeout(10)
	public void stopReleasesPortAndIsIdempotent() throws IOException {
		int port = findFreePort();
		List<String> events = new CopyOnWriteArrayList<>();

		StaticFileServer staticFileServer = StaticFileServer.withRootDirectory(rootDirectory)
				.port(port)
				.lifecycleObserver(new QuietLifecycleObserver() {
					@Override
					public void didStartServer(@NonNull StaticFileServer server) {
						events.add("started");
					}

					@Override
					public void didStopServer(@NonNull StaticFileServer server) {
						events.add("stopped");
					}

					@Override
					public void didWriteResponse(@NonNull StaticFileServer server,
																			 @Nullable Request request,
																			 @NonNull MarshaledResponse marshaledResponse,
																			 @NonNull Duration processingDuration) {
						events.add("wrote " + marshaledResponse.getStatusCode().getStatusCode());
					}
				})
				.build();

		staticFileServer.start();
		staticFileServer.start();
		assertTrue(staticFileServer.isStarted());
		assertEquals(port, staticFileServer.getPort());
		assertEquals("HTTP/1.1 404 Not Found", statusLine(get(port, "/nope")));

		staticFileServer.stop();
		staticFileServer.stop();
		assertFalse(staticFileServer.isStarted());

		// Port is free again
		try (ServerSocket serverSocket = new ServerSocket()) {
			serverSocket.setReuseAddress(true);
			serverSocket.bind(new InetSocketAddress("127.0.0.1", port));
		}

		assertEquals(List.of("started", "wrote 404", "stopped"), events);
	}
}
