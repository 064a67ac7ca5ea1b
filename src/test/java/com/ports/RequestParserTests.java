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

import com.ports.exception.IllegalRequestException;
import com.ports.exception.MethodNotAllowedException;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

@ThreadSafe
public class RequestParserTests {
	private final RequestParser requestParser = RequestParser.defaultInstance();

	@Test
	public void parsesRequestLine() {
		Request request = requestParser.parse("GET /Greendale%20Community%20College/index.html HTTP/1.1\r\nHost: localhost");

		assertEquals("GET", request.getMethod());
		assertEquals("/Greendale%20Community%20College/index.html", request.getRawTarget());
		assertEquals("/Greendale Community College/index.html", request.getPath());
		assertEquals("HTTP/1.1", request.getHttpVersion().orElse(null));
	}

	@Test
	public void stripsQueryAndFragment() {
		assertEquals("/study-room", requestParser.parse("GET /study-room?group=7#table HTTP/1.1").getPath());
		assertEquals("/study-room", requestParser.parse("GET /study-room#a?b HTTP/1.1").getPath());
		assertEquals("/", requestParser.parse("GET ?q=1 HTTP/1.1").getPath(), "Empty path should become root");
	}

	@Test
	public void versionIsOptional() {
		Request request = requestParser.parse("GET /");

		assertEquals("/", request.getPath());
		assertFalse(request.getHttpVersion().isPresent());
	}

	@Test
	public void relativeTargetIsRootedAtSlash() {
		assertEquals("/dean.txt", requestParser.parse("GET dean.txt HTTP/1.1").getPath());
	}

	@Test
	public void malformedRequestLines() {
		assertThrows(IllegalRequestException.class, () -> requestParser.parse(""));
		assertThrows(IllegalRequestException.class, () -> requestParser.parse("\r\nHost: x"));
		assertThrows(IllegalRequestException.class, () -> requestParser.parse("GET"));
		assertThrows(IllegalRequestException.class, () -> requestParser.parse("GET  HTTP/1.1"));
		assertThrows(IllegalRequestException.class, () -> requestParser.parse("GET /%zz HTTP/1.1"));
	}

	@Test
	public void onlyGetIsAllowed() {
		MethodNotAllowedException exception = assertThrows(MethodNotAllowedException.class,
				() -> requestParser.parse("POST /upload HTTP/1.1"));

		assertEquals("POST", exception.getMethod().orElse(null));
		assertThrows(MethodNotAllowedException.class, () -> requestParser.parse("get / HTTP/1.1"), "Methods are case-sensitive");
		assertThrows(MethodNotAllowedException.class, () -> requestParser.parse("GET / HTTP/1.1 extra"));
	}
}
