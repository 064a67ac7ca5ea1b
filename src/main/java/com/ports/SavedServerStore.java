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
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.ports.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Persists the set of running servers to a properties file so they can be restored on the next launch.
 * <p>
 * Each server occupies three keys sharing an index, for example:
 * <pre>{@code server.0.port=8080
 * server.0.directory=/Users/abed/films
 * server.0.exposeToLan=true}</pre>
 * Entries are read back in index order. An entry with a missing or invalid port, a missing directory or an
 * unrecognized {@code exposeToLan} value is skipped and reported as {@link LogEventType#SAVED_SERVER_DECODE_FAILED}.
 * An absent or unreadable file reads as an empty list.
 */
@ThreadSafe
public final class SavedServerStore {
	@NonNull
	private static final Pattern KEY_PATTERN;

	static {
		KEY_PATTERN = Pattern.compile("^server\\.(\\d{1,9})\\.[A-Za-z]+$");
	}

	@NonNull
	private final Path storeFile;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final ReentrantLock lock;

	public SavedServerStore(@NonNull Path storeFile) {
		this(storeFile, null);
	}

	public SavedServerStore(@NonNull Path storeFile,
													@Nullable LifecycleObserver lifecycleObserver) {
		requireNonNull(storeFile);

		this.storeFile = storeFile;
		this.lifecycleObserver = lifecycleObserver != null ? lifecycleObserver : LifecycleObserver.defaultInstance();
		this.lock = new ReentrantLock();
	}

	/**
	 * Reads all decodable entries.
	 *
	 * @return saved servers in index order, never {@code null}
	 */
	@NonNull
	public List<SavedServer> load() {
		getLock().lock();

		try {
			if (!Files.exists(getStoreFile()))
				return List.of();

			Properties properties = new Properties();

			try (InputStream inputStream = Files.newInputStream(getStoreFile())) {
				properties.load(inputStream);
			} catch (IOException | IllegalArgumentException e) {
				safelyLog(LogEvent.with(LogEventType.SAVED_SERVER_DECODE_FAILED,
								format("Unable to read saved servers from %s", getStoreFile().toAbsolutePath()))
						.throwable(e)
						.path(getStoreFile())
						.build());
				return List.of();
			}

			SortedSet<Integer> indices = new TreeSet<>();

			for (String key : properties.stringPropertyNames()) {
				Matcher matcher = KEY_PATTERN.matcher(key);

				if (matcher.matches())
					indices.add(Integer.valueOf(matcher.group(1)));
			}

			List<SavedServer> savedServers = new ArrayList<>(indices.size());

			for (Integer index : indices) {
				SavedServer savedServer = decodeEntry(properties, index);

				if (savedServer != null)
					savedServers.add(savedServer);
			}

			return List.copyOf(savedServers);
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Replaces the file's contents with the given servers.
	 * <p>
	 * Failures are reported as {@link LogEventType#SAVED_SERVER_WRITE_FAILED} and otherwise ignored; the running
	 * servers are unaffected.
	 */
	public void save(@NonNull List<SavedServer> savedServers) {
		requireNonNull(savedServers);

		Properties properties = new Properties();

		for (int i = 0; i < savedServers.size(); i++) {
			SavedServer savedServer = savedServers.get(i);
			properties.setProperty(format("server.%d.port", i), String.valueOf(savedServer.getPort()));
			properties.setProperty(format("server.%d.directory", i), savedServer.getDirectoryPath().toString());
			properties.setProperty(format("server.%d.exposeToLan", i), String.valueOf(savedServer.isExposeToLan()));
		}

		getLock().lock();

		try {
			writeAtomically(properties);
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.SAVED_SERVER_WRITE_FAILED,
							format("Unable to write saved servers to %s", getStoreFile().toAbsolutePath()))
					.throwable(e)
					.path(getStoreFile())
					.build());
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Removes the file, if present.
	 */
	public void clear() {
		getLock().lock();

		try {
			Files.deleteIfExists(getStoreFile());
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.SAVED_SERVER_WRITE_FAILED,
							format("Unable to delete saved servers at %s", getStoreFile().toAbsolutePath()))
					.throwable(e)
					.path(getStoreFile())
					.build());
		} finally {
			getLock().unlock();
		}
	}

	@Nullable
	private SavedServer decodeEntry(@NonNull Properties properties,
																	@NonNull Integer index) {
		requireNonNull(properties);
		requireNonNull(index);

		String portValue = trimAggressivelyToNull(properties.getProperty(format("server.%d.port", index)));
		String directoryValue = trimAggressivelyToNull(properties.getProperty(format("server.%d.directory", index)));
		String exposeToLanValue = trimAggressivelyToNull(properties.getProperty(format("server.%d.exposeToLan", index)));

		if (portValue == null || directoryValue == null) {
			logDecodeFailure(index, "port and directory are both required", null);
			return null;
		}

		Boolean exposeToLan = null;

		if (exposeToLanValue != null) {
			if ("true".equalsIgnoreCase(exposeToLanValue))
				exposeToLan = true;
			else if ("false".equalsIgnoreCase(exposeToLanValue))
				exposeToLan = false;
			else {
				logDecodeFailure(index, format("exposeToLan value '%s' is not a boolean", exposeToLanValue), null);
				return null;
			}
		}

		try {
			return new SavedServer(Integer.valueOf(portValue), Path.of(directoryValue), exposeToLan);
		} catch (IllegalArgumentException e) {
			// NumberFormatException and InvalidPathException are both IllegalArgumentExceptions
			logDecodeFailure(index, format("port '%s' or directory '%s' is invalid", portValue, directoryValue), e);
			return null;
		}
	}

	private void logDecodeFailure(@NonNull Integer index,
																@NonNull String reason,
																@Nullable Throwable throwable) {
		safelyLog(LogEvent.with(LogEventType.SAVED_SERVER_DECODE_FAILED,
						format("Skipping saved server entry %d in %s: %s", index, getStoreFile().toAbsolutePath(), reason))
				.throwable(throwable)
				.path(getStoreFile())
				.build());
	}

	private void writeAtomically(@NonNull Properties properties) throws IOException {
		requireNonNull(properties);

		Path absoluteStoreFile = getStoreFile().toAbsolutePath();
		Path parentDirectory = absoluteStoreFile.getParent();

		if (parentDirectory != null)
			Files.createDirectories(parentDirectory);

		Path temporaryFile = Files.createTempFile(parentDirectory, absoluteStoreFile.getFileName().toString(), ".tmp");

		try {
			try (OutputStream outputStream = Files.newOutputStream(temporaryFile)) {
				properties.store(outputStream, "Saved servers");
			}

			try {
				Files.move(temporaryFile, absoluteStoreFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			} catch (AtomicMoveNotSupportedException e) {
				Files.move(temporaryFile, absoluteStoreFile, StandardCopyOption.REPLACE_EXISTING);
			}
		} finally {
			Files.deleteIfExists(temporaryFile);
		}
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
	public Path getStoreFile() {
		return this.storeFile;
	}

	@NonNull
	LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	ReentrantLock getLock() {
		return this.lock;
	}
}
