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

import java.io.IOException;
import java.util.List;

/**
 * Runs an external command to completion and captures its output.
 * <p>
 * A standard implementation backed by {@link ProcessBuilder} can be acquired via {@link #defaultInstance()}.
 */
@FunctionalInterface
public interface CommandRunner {
	/**
	 * Runs the command, blocking until it exits.
	 *
	 * @param command the executable followed by its arguments
	 * @return the exit code and captured output streams
	 * @throws IOException if the command could not be spawned or did not finish in time
	 */
	@NonNull
	CommandResult run(@NonNull List<String> command) throws IOException;

	@NonNull
	static CommandRunner defaultInstance() {
		return DefaultCommandRunner.defaultInstance();
	}
}
