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
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Expandable byte accumulator that frames an HTTP header block.
 * <p>
 * Bytes are appended at the tail as they arrive from the socket; once the {@code CRLF CRLF} terminator is present
 * the block (excluding the terminator) can be taken and decoded as strict UTF-8.
 */
@NotThreadSafe
final class HeaderBlockBuffer {
	@NonNull
	private static final byte[] TERMINATOR;

	static {
		TERMINATOR = new byte[]{'\r', '\n', '\r', '\n'};
	}

	@NonNull
	private final Integer maximumSizeInBytes;
	@NonNull
	private byte[] array;
	private int size;
	// Where the next terminator search starts, so repeated scans stay linear
	private int searchFrom;

	HeaderBlockBuffer(@NonNull Integer maximumSizeInBytes) {
		requireNonNull(maximumSizeInBytes);

		if (maximumSizeInBytes < TERMINATOR.length)
			throw new IllegalArgumentException(format("Maximum size must be at least %d bytes", TERMINATOR.length));

		this.maximumSizeInBytes = maximumSizeInBytes;
		this.array = new byte[Math.min(maximumSizeInBytes, 1_024)];
	}

	/**
	 * Appends bytes read from the socket.
	 *
	 * @throws ContentTooLargeException if the header block, terminator included, exceeds the maximum
	 */
	void add(@NonNull byte[] bytes,
					 int length) {
		requireNonNull(bytes);

		if (length < 0 || length > bytes.length)
			throw new IllegalArgumentException(format("Illegal length %d", length));

		if (array.length - size < length)
			array = Arrays.copyOf(array, Math.max(size + length, array.length * 2));

		System.arraycopy(bytes, 0, array, size, length);
		size += length;

		int terminatorIndex = indexOfTerminator();
		int blockSize = terminatorIndex < 0 ? size : terminatorIndex + TERMINATOR.length;

		if (blockSize > maximumSizeInBytes)
			throw new ContentTooLargeException(format("Request header block exceeds %d bytes", maximumSizeInBytes),
					maximumSizeInBytes);
	}

	boolean isComplete() {
		return indexOfTerminator() >= 0;
	}

	int size() {
		return size;
	}

	/**
	 * Decodes everything before the terminator.
	 *
	 * @return the header block text, or {@code null} if no terminator has been received yet
	 * @throws IllegalRequestException if the block is not valid UTF-8
	 */
	@Nullable
	String takeHeaderBlock() {
		int index = indexOfTerminator();

		if (index < 0)
			return null;

		CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);

		try {
			return decoder.decode(ByteBuffer.wrap(array, 0, index)).toString();
		} catch (CharacterCodingException e) {
			throw new IllegalRequestException("Request header block is not valid UTF-8", e);
		}
	}

	private int indexOfTerminator() {
		for (int i = searchFrom; i <= size - TERMINATOR.length; i++) {
			if (Arrays.equals(TERMINATOR, 0, TERMINATOR.length, array, i, i + TERMINATOR.length))
				return i;
		}

		// A terminator may straddle the next chunk, so back up by its length minus one
		searchFrom = Math.max(0, size - TERMINATOR.length + 1);
		return -1;
	}
}
