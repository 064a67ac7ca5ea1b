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
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import static com.ports.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

@ThreadSafe
final class DefaultPortScanner implements PortScanner {
	@NonNull
	private final List<String> command;
	@NonNull
	private final Duration cacheTimeToLive;
	@NonNull
	private final CommandRunner commandRunner;
	@NonNull
	private final Clock clock;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final ListeningPortParser listeningPortParser;
	// Guards the cache and serializes captures; shared by scan() and forceScan()
	@NonNull
	private final ReentrantLock lock;
	@Nullable
	private CacheEntry cacheEntry;

	DefaultPortScanner(@NonNull Builder builder) {
		requireNonNull(builder);

		this.command = List.copyOf(Arrays.asList(builder.portsConfig.getLsofCommand().trim().split("\\s+")));
		this.cacheTimeToLive = builder.portsConfig.getScanCacheTtl();
		this.commandRunner = builder.commandRunner != null ? builder.commandRunner : CommandRunner.defaultInstance();
		this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.listeningPortParser = ListeningPortParser.defaultInstance();
		this.lock = new ReentrantLock();
	}

	@NonNull
	@Override
	public List<ListeningPort> scan() {
		getLock().lock();

		try {
			CacheEntry cacheEntry = this.cacheEntry;

			if (cacheEntry != null && cacheEntry.isFresh(getClock().instant(), getCacheTimeToLive()))
				return cacheEntry.getListeningPorts();

			return capture();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	@Override
	public List<ListeningPort> forceScan() {
		getLock().lock();

		try {
			return capture();
		} finally {
			getLock().unlock();
		}
	}

	// Caller must hold the lock
	@NonNull
	private List<ListeningPort> capture() {
		List<ListeningPort> listeningPorts = List.copyOf(listeningPortsFromCommand());
		this.cacheEntry = new CacheEntry(listeningPorts, getClock().instant());
		return listeningPorts;
	}

	@NonNull
	private List<ListeningPort> listeningPortsFromCommand() {
		CommandResult commandResult;

		try {
			commandResult = getCommandRunner().run(getCommand());
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.PORT_SCAN_FAILED, format("Unable to run %s", String.join(" ", getCommand())))
					.throwable(e)
					.build());
			return List.of();
		}

		boolean outputEmpty = trimAggressivelyToNull(commandResult.getStandardOutput()) == null;

		if (commandResult.getExitCode() != 0 && outputEmpty) {
			safelyLog(LogEvent.with(LogEventType.PORT_SCAN_FAILED, format("%s exited with status %d: %s",
							getCommand().get(0), commandResult.getExitCode(), describeStandardError(commandResult)))
					.build());
			return List.of();
		}

		if (commandResult.getExitCode() != 0)
			safelyLog(LogEvent.with(LogEventType.PORT_SCAN_WARNING, format("%s exited with status %d: %s",
							getCommand().get(0), commandResult.getExitCode(), describeStandardError(commandResult)))
					.build());

		return getListeningPortParser().parse(commandResult.getStandardOutput());
	}

	@NonNull
	private String describeStandardError(@NonNull CommandResult commandResult) {
		String standardError = trimAggressivelyToNull(commandResult.getStandardError());
		return standardError == null ? "(no error output)" : standardError;
	}

	private void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	@NonNull
	List<String> getCommand() {
		return this.command;
	}

	@NonNull
	Duration getCacheTimeToLive() {
		return this.cacheTimeToLive;
	}

	@NonNull
	CommandRunner getCommandRunner() {
		return this.commandRunner;
	}

	@NonNull
	Clock getClock() {
		return this.clock;
	}

	@NonNull
	LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	ListeningPortParser getListeningPortParser() {
		return this.listeningPortParser;
	}

	@NonNull
	ReentrantLock getLock() {
		return this.lock;
	}

	@ThreadSafe
	private static final class CacheEntry {
		@NonNull
		private final List<ListeningPort> listeningPorts;
		@NonNull
		private final Instant capturedAt;

		CacheEntry(@NonNull List<ListeningPort> listeningPorts,
							 @NonNull Instant capturedAt) {
			this.listeningPorts = requireNonNull(listeningPorts);
			this.capturedAt = requireNonNull(capturedAt);
		}

		@NonNull
		Boolean isFresh(@NonNull Instant now,
										@NonNull Duration timeToLive) {
			return Duration.between(this.capturedAt, now).compareTo(timeToLive) < 0;
		}

		@NonNull
		List<ListeningPort> getListeningPorts() {
			return this.listeningPorts;
		}
	}
}
