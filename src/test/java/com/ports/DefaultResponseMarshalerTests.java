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
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class DefaultResponseMarshalerTests {
	private final DefaultResponseMarshaler responseMarshaler = DefaultResponseMarshaler.defaultInstance();

	@Test
	public void errorResponseWireFormat() {
		String body = "<html><body><h1>404 Not Found</h1></body></html>";
		String expected = "HTTP/1.1 404 Not Found\r\n"
				+ "Content-Type: text/html; charset=utf-8\r\n"
				+ "Content-Length: " + body.length() + "\r\n"
				+ "Connection: close\r\n"
				+ "X-Content-Type-Options: nosniff\r\n"
				+ "X-Frame-Options: DENY\r\n"
				+ "\r\n"
				+ body;

		assertEquals(expected, new String(responseMarshaler.forError(StatusCode.HTTP_404).toWireBytes(), StandardCharsets.UTF_8));
	}

	@Test
	public void fileResponse() {
		byte[] contents = "body { color: red; }".getBytes(StandardCharsets.UTF_8);
		MarshaledResponse marshaledResponse = responseMarshaler.forFile(Path.of("site", "style.CSS"), contents);

		assertEquals(StatusCode.HTTP_200, marshaledResponse.getStatusCode());
		assertEquals("text/css", marshaledResponse.getHeaders().get("Content-Type"));
		assertEquals(contents.length, marshaledResponse.getContentLength());
		assertFalse(marshaledResponse.getHeaders().containsKey("X-Content-Type-Options"), "Only HTML files get nosniff");

		MarshaledResponse htmlResponse = responseMarshaler.forFile(Path.of("index.html"), new byte[0]);
		assertEquals("nosniff", htmlResponse.getHeaders().get("X-Content-Type-Options"));
		assertEquals(0, htmlResponse.getContentLength());
	}

	@Test
	public void contentTypes() {
		assertEquals("text/html; charset=utf-8", responseMarshaler.contentTypeFor(Path.of("a.htm")));
		assertEquals("image/jpeg", responseMarshaler.contentTypeFor(Path.of("troy.JPEG")));
		assertEquals("application/octet-stream", responseMarshaler.contentTypeFor(Path.of("Makefile")));
		assertEquals("application/octet-stream", responseMarshaler.contentTypeFor(Path.of("archive.")));
		assertEquals("application/octet-stream", responseMarshaler.contentTypeFor(Path.of("paintball.exe")));
	}

	@Test
	public void redirectEncodesLocation() {
		MarshaledResponse marshaledResponse = responseMarshaler.forRedirect("/Greendale Community College/");

		assertEquals(StatusCode.HTTP_301, marshaledResponse.getStatusCode());
		assertEquals("/Greendale%20Community%20College/", marshaledResponse.getHeaders().get("Location"));
		assertTrue(new String(marshaledResponse.getBody(), StandardCharsets.UTF_8)
				.contains("<a href=\"/Greendale%20Community%20College/\">Moved Permanently</a>"));
	}

	@Test
	public void directoryListingEscapesNames() {
		MarshaledResponse marshaledResponse = responseMarshaler.forDirectoryListing("/study <room>/", List.of(
				new ListingEntry("zeta.txt", false),
				new ListingEntry("<script>.html", false),
				new ListingEntry("Annie's notes", true)
		));

		String html = new String(marshaledResponse.getBody(), StandardCharsets.UTF_8);

		assertEquals("DENY", marshaledResponse.getHeaders().get("X-Frame-Options"));
		assertTrue(html.contains("<title>Index of /study &lt;room&gt;/</title>"));
		assertTrue(html.contains("<h1>Index of /study &lt;room&gt;/</h1>"));
		assertTrue(html.contains("<li><a href=\"/\">../</a></li>"), "Parent link should point at the parent directory");
		assertTrue(html.contains("<li><a href=\"/study%20%3Croom%3E/%3Cscript%3E.html\">&lt;script&gt;.html</a></li>"));
		assertTrue(html.contains("<li><a href=\"/study%20%3Croom%3E/Annie&#39;s%20notes/\">Annie&#39;s notes/</a></li>"));
		assertFalse(html.contains("<script>"), "Raw markup must never reach the page");

		// Sorted by name
		assertTrue(html.indexOf("%3Cscript%3E.html") < html.indexOf("Annie&#39;s") && html.indexOf("Annie&#39;s") < html.indexOf("zeta.txt"));
	}

	@Test
	public void listingSortsByCodePoint() {
		// U+1F600 is a surrogate pair that sorts before U+E000 by UTF-16 code unit
		String emoji = "\uD83D\uDE00.txt";
		String privateUse = "\uE000.txt";

		String html = new String(responseMarshaler.forDirectoryListing("/", List.of(
				new ListingEntry(emoji, false),
				new ListingEntry(privateUse, false),
				new ListingEntry("abed.txt", false)
		)).getBody(), StandardCharsets.UTF_8);

		int abedIndex = html.indexOf(">abed.txt<");
		int privateUseIndex = html.indexOf(">" + privateUse + "<");
		int emojiIndex = html.indexOf(">" + emoji + "<");

		assertTrue(abedIndex >= 0 && privateUseIndex >= 0 && emojiIndex >= 0);
		assertTrue(abedIndex < privateUseIndex && privateUseIndex < emojiIndex);

		assertTrue(DefaultResponseMarshaler.compareByCodePoint(privateUse, emoji) < 0);
		assertTrue(DefaultResponseMarshaler.compareByCodePoint("abed", "abed.txt") < 0);
		assertEquals(0, DefaultResponseMarshaler.compareByCodePoint(emoji, emoji));
	}

	@Test
	public void rootListingHasNoParentLink() {
		String html = new String(responseMarshaler.forDirectoryListing("/", List.of()).getBody(), StandardCharsets.UTF_8);
		assertFalse(html.contains("../"));
	}

	@Test
	public void headersRejectInjection() {
		assertThrows(IllegalArgumentException.class, () -> MarshaledResponse.withStatusCode(StatusCode.HTTP_200)
				.header("Location", "/\r\nSet-Cookie: x=y"));
		assertThrows(IllegalArgumentException.class, () -> MarshaledResponse.withStatusCode(StatusCode.HTTP_200)
				.header("Content-Length", "5"));
		assertThrows(IllegalArgumentException.class, () -> MarshaledResponse.withStatusCode(StatusCode.HTTP_200)
				.header("Bad Name", "x"));
	}
}
