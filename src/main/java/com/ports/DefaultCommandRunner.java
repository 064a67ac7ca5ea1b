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

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link ProcessBuilder}-backed {@link CommandRunner}.
 * <p>
 * Both output streams are redirected to temporary files so neither can fill a pipe and stall the child; a command
 * that outlives the timeout is forcibly destroyed.
 */
@ThreadSafe
final class DefaultCommandRunner implements CommandRunner {
	@NonNull
	private static final DefaultCommandRunner DEFAULT_INSTANCE;
	@NonNull
	private static final Duration DEFAULT_TIMEOUT;

	static {
		DEFAULT_TIMEOUT = Duration.ofSeconds(10);
		DEFAULT_INSTANCE = new DefaultCommandRunner(DEFAULT_TIMEOUT);
	}

	@NonNull
	public static DefaultCommandRunner defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	@NonNull
	private final Duration timeout;

	DefaultCommandRunner(@NonNull Duration timeout) {
		requireNonNull(timeout);

		if (timeout.isNegative() || timeout.isZero())
			throw new IllegalArgumentException("Timeout must be > 0");

		this.timeout = timeout;
	}

	@NonNull
	@Override
	public CommandResult run(@NonNull List<String> command) throws IOException {
		requireNonNull(command);

		if (command.isEmpty())
			throw new IllegalArgumentException("Command must not be empty");

		String commandDescription = String.join(" ", command);
		Path standardOutputFile = Files.createTempFile("ports-command-", ".out");
		Path standardErrorFile = Files.createTempFile("ports-command-", ".err");

		try {
			ProcessBuilder processBuilder = new ProcessBuilder(command)
					.redirectOutput(standardOutputFile.toFile())
					.redirectError(standardErrorFile.toFile());

			Process process = processBuilder.start();

			try {
				if (!process.waitFor(getTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
					process.destroyForcibly();
					throw new IOException(format("Process timed out after %d ms, forcibly terminated: %s",
							getTimeout().toMillis(), commandDescription));
				}
			} catch (InterruptedException e) {
				process.destroyForcibly();
				Thread.currentThread().interrupt();
				throw new InterruptedIOException(format("Interrupted while waiting for process: %s", commandDescription));
			}

			// Lenient decoding: process names are not guaranteed to be valid UTF-8
			return new CommandResult(process.exitValue(),
					new String(Files.readAllBytes(standardOutputFile), StandardCharsets.UTF_8),
					new String(Files.readAllBytes(standardErrorFile), StandardCharsets.UTF_8));
		} finally {
			Files.deleteIfExists(standardOutputFile);
			Files.deleteIfExists(standardErrorFile);
		}
	}

	@NonNull
	Duration getTimeout() {
		return this.timeout;
	}
}
