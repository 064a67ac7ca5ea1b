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

/**
 * Kinds of {@link LogEvent} instances that the server engine, scanner and server manager can produce.
 */
public enum LogEventType {
	/**
	 * Indicates that the {@link StaticFileServer} received a request it could not parse or frame, such as a malformed
	 * request line, an unsupported method or an oversized header block.
	 */
	SERVER_UNPARSEABLE_REQUEST,
	/**
	 * Indicates that a request path attempted to escape the server's root directory.
	 */
	SERVER_PATH_VIOLATION,
	/**
	 * Indicates that a file or directory could not be read after it passed its existence check.
	 */
	SERVER_FILE_READ_FAILED,
	/**
	 * Indicates that a connection's deadline fired before a complete request arrived.
	 */
	SERVER_REQUEST_TIMEOUT,
	/**
	 * Indicates that the server's accept loop failed unexpectedly and the server stopped.
	 */
	SERVER_ACCEPT_FAILED,
	/**
	 * Indicates an internal {@link StaticFileServer} error occurred.
	 */
	SERVER_INTERNAL_ERROR,
	/**
	 * Indicates that the port enumeration command could not be started or exited unsuccessfully without output.
	 */
	PORT_SCAN_FAILED,
	/**
	 * Indicates that the port enumeration command exited unsuccessfully but still produced output, which was parsed.
	 */
	PORT_SCAN_WARNING,
	/**
	 * Indicates that a persisted server entry could not be decoded and was skipped.
	 */
	SAVED_SERVER_DECODE_FAILED,
	/**
	 * Indicates that a persisted server could not be restored.
	 */
	SAVED_SERVER_RESTORE_FAILED,
	/**
	 * Indicates that the saved server list could not be written.
	 */
	SAVED_SERVER_WRITE_FAILED
}
