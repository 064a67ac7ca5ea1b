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

import com.ports.exception.ContentTooLargeException;
import com.ports.exception.IllegalRequestException;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class HeaderBlockBufferTests {
	@Test
	public void terminatorSplitAcrossChunks() {
		HeaderBlockBuffer headerBlockBuffer = new HeaderBlockBuffer(1_024);

		add(headerBlockBuffer, "GET / HTTP/1.1\r\nHost: localhost\r");
		assertFalse(headerBlockBuffer.isComplete());
		assertNull(headerBlockBuffer.takeHeaderBlock());

		add(headerBlockBuffer, "\n\r");
		assertFalse(headerBlockBuffer.isComplete());

		add(headerBlockBuffer, "\n");
		assertTrue(headerBlockBuffer.isComplete());
		assertEquals("GET / HTTP/1.1\r\nHost: localhost", headerBlockBuffer.takeHeaderBlock());
	}

	@Test
	public void oneByteAtATime() {
		HeaderBlockBuffer headerBlockBuffer = new HeaderBlockBuffer(1_024);
		byte[] bytes = "GET /pierce HTTP/1.1\r\n\r\n".getBytes(StandardCharsets.UTF_8);

		for (byte b : bytes)
			headerBlockBuffer.add(new byte[]{b}, 1);

		assertEquals("GET /pierce HTTP/1.1", headerBlockBuffer.takeHeaderBlock());
	}

	@Test
	public void oversizedBlockWithoutTerminator() {
		HeaderBlockBuffer headerBlockBuffer = new HeaderBlockBuffer(16);

		add(headerBlockBuffer, "GET /abcdefghij");
		ContentTooLargeException exception = assertThrows(ContentTooLargeException.class,
				() -> add(headerBlockBuffer, "klmnop"));

		assertEquals(16, exception.getMaximumSizeInBytes());
	}

	@Test
	public void oversizedBlockWithTerminatorInSameChunk() {
		HeaderBlockBuffer headerBlockBuffer = new HeaderBlockBuffer(16);

		ContentTooLargeException exception = assertThrows(ContentTooLargeException.class,
				() -> add(headerBlockBuffer, "GET /abcdefghijk\r\n\r\n"));

		assertEquals(16, exception.getMaximumSizeInBytes());
	}

	@Test
	public void blockExactlyAtMaximumIsAccepted() {
		HeaderBlockBuffer headerBlockBuffer = new HeaderBlockBuffer(16);

		add(headerBlockBuffer, "GET /abcdefg\r\n\r\n");

		assertEquals("GET /abcdefg", headerBlockBuffer.takeHeaderBlock());
	}

	@Test
	public void invalidUtf8IsRejected() {
		HeaderBlockBuffer headerBlockBuffer = new HeaderBlockBuffer(1_024);
		byte[] bytes = new byte[]{'G', 'E', 'T', ' ', '/', (byte) 0xC3, (byte) 0x28, '\r', '\n', '\r', '\n'};

		headerBlockBuffer.add(bytes, bytes.length);

		assertTrue(headerBlockBuffer.isComplete());
		assertThrows(IllegalRequestException.class, headerBlockBuffer::takeHeaderBlock);
	}

	private static void add(HeaderBlockBuffer headerBlockBuffer, String text) {
		byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
		headerBlockBuffer.add(bytes, bytes.length);
	}
}
