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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static com.ports.Utilities.trimAggressively;
import static com.ports.Utilities.trimAggressivelyToNull;
import static java.util.Objects.requireNonNull;

/**
 * Parses the output of {@code lsof -iTCP -sTCP:LISTEN -n -P -Fpcn} into {@link ListeningPort} records.
 * <p>
 * The primary input is lsof's field-prefixed form, where each line starts with a one-character tag:
 * <ul>
 *   <li>{@code p<pid>} starts a new process and forgets the previous command name</li>
 *   <li>{@code c<command>} names the current process</li>
 *   <li>{@code n<address:port>} yields a record for the current process</li>
 * </ul>
 * Other tags are ignored. The address is split from the port on the <em>last</em> colon so IPv6 addresses such as
 * {@code [::1]:9090} work. A name line with no process in scope or an unparseable port is dropped.
 * <p>
 * Lsof's default tabular form is also understood: a line of at least 9 columns whose last two read
 * {@code address:port (LISTEN)} yields a record from its first two columns (command and pid).
 * <p>
 * Only the first record for any given port is kept; output order is otherwise preserved.
 */
@ThreadSafe
public final class ListeningPortParser {
	@NonNull
	private static final ListeningPortParser DEFAULT_INSTANCE;
	@NonNull
	private static final Pattern WHITESPACE_PATTERN;
	@NonNull
	private static final Integer MINIMUM_TABULAR_COLUMN_COUNT;
	@NonNull
	private static final String UNKNOWN_PROCESS_NAME;

	static {
		WHITESPACE_PATTERN = Pattern.compile("\\s+");
		MINIMUM_TABULAR_COLUMN_COUNT = 9;
		UNKNOWN_PROCESS_NAME = "unknown";
		DEFAULT_INSTANCE = new ListeningPortParser();
	}

	@NonNull
	public static ListeningPortParser defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private ListeningPortParser() {
		// Stateless
	}

	/**
	 * Parses captured command output.
	 *
	 * @param output the command's standard output
	 * @return records in output order, at most one per port
	 */
	@NonNull
	public List<ListeningPort> parse(@NonNull String output) {
		requireNonNull(output);

		List<ListeningPort> listeningPorts = new ArrayList<>();
		Set<Integer> seenPorts = new HashSet<>();

		Integer currentPid = null;
		String currentCommand = null;

		for (String rawLine : output.split("\n")) {
			String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;

			if (line.isEmpty())
				continue;

			ListeningPort tabularListeningPort = parseTabularLine(line);

			if (tabularListeningPort != null) {
				addIfUnseen(tabularListeningPort, listeningPorts, seenPorts);
				continue;
			}

			char field = line.charAt(0);
			String value = line.substring(1);

			switch (field) {
				case 'p' -> {
					currentPid = parseIntegerOrNull(trimAggressively(value));
					currentCommand = null;
				}
				case 'c' -> currentCommand = value;
				case 'n' -> {
					// A name with no process in scope is dropped
					ListeningPort listeningPort = currentPid == null ? null : parseNameField(value, currentPid, currentCommand);

					if (listeningPort != null)
						addIfUnseen(listeningPort, listeningPorts, seenPorts);
				}
				default -> {
					// Unused field tag
				}
			}
		}

		return listeningPorts;
	}

	@Nullable
	ListeningPort parseNameField(@NonNull String nameField,
															 @NonNull Integer pid,
															 @Nullable String processName) {
		requireNonNull(nameField);
		requireNonNull(pid);

		String trimmed = trimAggressively(nameField);
		int lastColonIndex = trimmed.lastIndexOf(':');

		if (lastColonIndex < 0)
			return null;

		Integer port = parsePortOrNull(trimAggressively(trimmed.substring(lastColonIndex + 1)));

		if (port == null)
			return null;

		String address = trimAggressively(trimmed.substring(0, lastColonIndex));
		String normalizedProcessName = trimAggressivelyToNull(processName);

		return new ListeningPort(port, pid, normalizedProcessName == null ? UNKNOWN_PROCESS_NAME : normalizedProcessName, address);
	}

	// e.g. "node  4242 dev   23u  IPv4 0x1234  0t0  TCP 127.0.0.1:3000 (LISTEN)"
	@Nullable
	private ListeningPort parseTabularLine(@NonNull String line) {
		String trimmed = trimAggressively(line);

		if (!trimmed.endsWith("(LISTEN)"))
			return null;

		String[] columns = WHITESPACE_PATTERN.split(trimmed);

		if (columns.length < MINIMUM_TABULAR_COLUMN_COUNT)
			return null;

		Integer pid = parseIntegerOrNull(columns[1]);

		if (pid == null)
			return null;

		return parseNameField(columns[columns.length - 2], pid, columns[0]);
	}

	private void addIfUnseen(@NonNull ListeningPort listeningPort,
													 @NonNull List<ListeningPort> listeningPorts,
													 @NonNull Set<Integer> seenPorts) {
		if (seenPorts.add(listeningPort.getPort()))
			listeningPorts.add(listeningPort);
	}

	@Nullable
	private Integer parsePortOrNull(@NonNull String value) {
		Integer port = parseIntegerOrNull(value);
		return port == null || port > 65_535 ? null : port;
	}

	// Digits only: no sign, no whitespace
	@Nullable
	private Integer parseIntegerOrNull(@NonNull String value) {
		if (value.isEmpty() || value.length() > 10)
			return null;

		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);

			if (c < '0' || c > '9')
				return null;
		}

		long parsed = Long.parseLong(value);
		return parsed > Integer.MAX_VALUE ? null : (int) parsed;
	}
}
