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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Captured outcome of an external command that ran to completion.
 */
@ThreadSafe
public final class CommandResult {
	@NonNull
	private final Integer exitCode;
	@NonNull
	private final String standardOutput;
	@NonNull
	private final String standardError;

	public CommandResult(@NonNull Integer exitCode,
											 @NonNull String standardOutput,
											 @NonNull String standardError) {
		requireNonNull(exitCode);
		requireNonNull(standardOutput);
		requireNonNull(standardError);

		this.exitCode = exitCode;
		this.standardOutput = standardOutput;
		this.standardError = standardError;
	}

	@NonNull
	public Integer getExitCode() {
		return this.exitCode;
	}

	@NonNull
	public String getStandardOutput() {
		return this.standardOutput;
	}

	@NonNull
	public String getStandardError() {
		return this.standardError;
	}

	@Override
	public String toString() {
		return format("%s{exitCode=%d, standardOutput=%d chars, standardError=%s}", getClass().getSimpleName(),
				getExitCode(), getStandardOutput().length(), getStandardError());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof CommandResult commandResult))
			return false;

		return Objects.equals(getExitCode(), commandResult.getExitCode())
				&& Objects.equals(getStandardOutput(), commandResult.getStandardOutput())
				&& Objects.equals(getStandardError(), commandResult.getStandardError());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getExitCode(), getStandardOutput(), getStandardError());
	}
}
