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

import com.ports.exception.ServerBindException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Owns the set of running {@link StaticFileServer} instances: starts and stops them, chooses free ports, restores
 * previously-saved servers and keeps the {@link SavedServerStore} in sync with what is running.
 * <p>
 * A server whose accept loop fails is removed from the active set automatically and the optional
 * {@link ServerFailureListener} supplied at construction is notified.
 */
@ThreadSafe
public final class ServerManager {
	@NonNull
	private static final Integer PORT_PROBE_WINDOW;
	@NonNull
	private static final Integer FALLBACK_PORT_RANGE_START;
	@NonNull
	private static final Integer FALLBACK_PORT_RANGE_END;
	@NonNull
	private static final Integer MAXIMUM_PORT;

	static {
		PORT_PROBE_WINDOW = 100;
		FALLBACK_PORT_RANGE_START = 8200;
		FALLBACK_PORT_RANGE_END = 9000;
		MAXIMUM_PORT = 65_535;
	}

	@NonNull
	private final PortsConfig portsConfig;
	@NonNull
	private final PortScanner portScanner;
	@Nullable
	private final SavedServerStore savedServerStore;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final Random random;
	@Nullable
	private final ServerFailureListener failureListener;
	// Guards serverInstancesById and serializes persistence
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final Map<UUID, ServerInstance> serverInstancesById;

	@NonNull
	public static Builder withConfig(@NonNull PortsConfig portsConfig) {
		requireNonNull(portsConfig);
		return new Builder(portsConfig);
	}

	private ServerManager(@NonNull Builder builder) {
		requireNonNull(builder);

		this.portsConfig = builder.portsConfig;
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.portScanner = builder.portScanner != null ? builder.portScanner
				: PortScanner.withConfig(builder.portsConfig).lifecycleObserver(this.lifecycleObserver).build();
		this.savedServerStore = builder.savedServerStore;
		this.random = builder.random != null ? builder.random : new Random();
		this.failureListener = builder.failureListener;
		this.lock = new ReentrantLock();
		this.serverInstancesById = new LinkedHashMap<>();
	}

	/**
	 * Starts a server for the given directory and adds it to the active set.
	 *
	 * @param port          the port to bind, or {@code 0} for any free port
	 * @param rootDirectory the directory to expose
	 * @param exposeToLan   whether to bind all interfaces instead of loopback only
	 * @return the running instance
	 * @throws IllegalArgumentException if the directory does not exist or is not a directory
	 * @throws ServerBindException      if the port cannot be bound
	 */
	@NonNull
	public ServerInstance startServer(@NonNull Integer port,
																		@NonNull Path rootDirectory,
																		@NonNull Boolean exposeToLan) {
		requireNonNull(port);
		requireNonNull(rootDirectory);
		requireNonNull(exposeToLan);

		Path canonicalRootDirectory = canonicalDirectory(rootDirectory);
		UUID id = UUID.randomUUID();

		StaticFileServer staticFileServer = StaticFileServer.withRootDirectory(canonicalRootDirectory)
				.config(getPortsConfig())
				.port(port)
				.exposeToLan(exposeToLan)
				.lifecycleObserver(getLifecycleObserver())
				.failureListener((failedServer, throwable) -> handleServerFailure(id, failedServer, throwable))
				.build();

		staticFileServer.start();

		ServerInstance serverInstance = new ServerInstance(id, staticFileServer.getPort(), canonicalRootDirectory,
				exposeToLan, staticFileServer);

		getLock().lock();

		try {
			getServerInstancesById().put(id, serverInstance);
			persist();
		} finally {
			getLock().unlock();
		}

		return serverInstance;
	}

	/**
	 * Stops the server with the given id, if it is active.
	 *
	 * @return {@code true} if a server was stopped
	 */
	@NonNull
	public Boolean stopServer(@NonNull UUID id) {
		requireNonNull(id);

		ServerInstance serverInstance;

		getLock().lock();

		try {
			serverInstance = getServerInstancesById().remove(id);

			if (serverInstance == null)
				return false;

			persist();
		} finally {
			getLock().unlock();
		}

		serverInstance.getStaticFileServer().stop();
		return true;
	}

	public void stopAllServers() {
		List<ServerInstance> serverInstances;

		getLock().lock();

		try {
			serverInstances = new ArrayList<>(getServerInstancesById().values());
			getServerInstancesById().clear();
			persist();
		} finally {
			getLock().unlock();
		}

		for (ServerInstance serverInstance : serverInstances)
			serverInstance.getStaticFileServer().stop();
	}

	/**
	 * Stops every server without touching the {@link SavedServerStore}, so the same set is restored next launch.
	 */
	public void shutdown() {
		List<ServerInstance> serverInstances;

		getLock().lock();

		try {
			serverInstances = new ArrayList<>(getServerInstancesById().values());
			getServerInstancesById().clear();
		} finally {
			getLock().unlock();
		}

		for (ServerInstance serverInstance : serverInstances)
			serverInstance.getStaticFileServer().stop();
	}

	/**
	 * A snapshot of the active servers, in start order.
	 */
	@NonNull
	public List<ServerInstance> getServers() {
		getLock().lock();

		try {
			return List.copyOf(getServerInstancesById().values());
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Optional<ServerInstance> findServer(@NonNull UUID id) {
		requireNonNull(id);

		getLock().lock();

		try {
			return Optional.ofNullable(getServerInstancesById().get(id));
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Whether the port is taken by one of our servers or, failing that, by any listener the scanner reports.
	 */
	@NonNull
	public Boolean isPortInUse(@NonNull Integer port) {
		requireNonNull(port);

		if (activePorts().contains(port))
			return true;

		return getPortScanner().scan().stream()
				.anyMatch(listeningPort -> listeningPort.getPort().equals(port));
	}

	/**
	 * Probes {@code startingFrom} and up to 100 ports above it, returning the first one not in use. If all are taken,
	 * returns a random port in {@code 8200..9000} without checking it.
	 */
	@NonNull
	public Integer findAvailablePort(@NonNull Integer startingFrom) {
		requireNonNull(startingFrom);

		if (startingFrom < 0 || startingFrom > MAXIMUM_PORT)
			throw new IllegalArgumentException(format("Illegal port value %d", startingFrom));

		int endPort = Math.min(startingFrom + PORT_PROBE_WINDOW, MAXIMUM_PORT);

		for (int port = startingFrom; port <= endPort; port++)
			if (!isPortInUse(port))
				return port;

		return FALLBACK_PORT_RANGE_START + getRandom().nextInt(FALLBACK_PORT_RANGE_END - FALLBACK_PORT_RANGE_START + 1);
	}

	/**
	 * Loads and restores the servers recorded in the {@link SavedServerStore}, if there is one.
	 */
	@NonNull
	public List<ServerInstance> restoreSavedServers() {
		SavedServerStore savedServerStore = getSavedServerStore().orElse(null);

		if (savedServerStore == null)
			return List.of();

		return restoreServers(savedServerStore.load());
	}

	/**
	 * Starts a server for each saved entry whose directory still exists.
	 * <p>
	 * An entry whose port is already taken, whether by another process, an active server or an earlier entry in
	 * {@code savedServers}, is moved to the lowest port in the configured restore range that is not taken, or to a
	 * random port above the range if the whole range is taken. Entries that still fail to start are logged and skipped.
	 *
	 * @param savedServers the entries to restore, in order
	 * @return the instances that started
	 */
	@NonNull
	public List<ServerInstance> restoreServers(@NonNull List<SavedServer> savedServers) {
		requireNonNull(savedServers);

		if (savedServers.isEmpty())
			return List.of();

		Set<Integer> scannedPorts = getPortScanner().scan().stream()
				.map(ListeningPort::getPort)
				.collect(Collectors.toSet());

		Set<Integer> reservedPorts = new HashSet<>();
		List<ServerInstance> restoredServerInstances = new ArrayList<>(savedServers.size());

		for (SavedServer savedServer : savedServers) {
			if (!Files.isDirectory(savedServer.getDirectoryPath()))
				continue;

			Set<Integer> takenPorts = new HashSet<>(reservedPorts);
			takenPorts.addAll(scannedPorts);
			takenPorts.addAll(activePorts());

			Integer port = savedServer.getPort();

			if (takenPorts.contains(port))
				port = findRestorePortExcluding(takenPorts);

			reservedPorts.add(port);

			try {
				restoredServerInstances.add(startServer(port, savedServer.getDirectoryPath(), savedServer.isExposeToLan()));
			} catch (RuntimeException e) {
				safelyLog(LogEvent.with(LogEventType.SAVED_SERVER_RESTORE_FAILED,
								format("Unable to restore server for %s on port %d", savedServer.getDirectoryPath(), port))
						.throwable(e)
						.path(savedServer.getDirectoryPath())
						.port(port)
						.build());
			}
		}

		return List.copyOf(restoredServerInstances);
	}

	@NonNull
	Integer findRestorePortExcluding(@NonNull Set<Integer> excludedPorts) {
		requireNonNull(excludedPorts);

		int rangeStart = getPortsConfig().getRestorePortRangeStart();
		int rangeEnd = getPortsConfig().getRestorePortRangeEnd();

		for (int port = rangeStart; port <= rangeEnd; port++)
			if (!excludedPorts.contains(port))
				return port;

		// Nothing exists above the top of the port space, so let the OS pick
		if (rangeEnd >= MAXIMUM_PORT)
			return 0;

		return rangeEnd + 1 + getRandom().nextInt(MAXIMUM_PORT - rangeEnd);
	}

	void handleServerFailure(@NonNull UUID id,
																		 @NonNull StaticFileServer staticFileServer,
																		 @NonNull Throwable throwable) {
		requireNonNull(id);
		requireNonNull(staticFileServer);
		requireNonNull(throwable);

		getLock().lock();

		try {
			if (getServerInstancesById().remove(id) != null)
				persist();
		} finally {
			getLock().unlock();
		}

		ServerFailureListener failureListener = getFailureListener().orElse(null);

		if (failureListener == null)
			return;

		try {
			failureListener.didFail(staticFileServer, throwable);
		} catch (Throwable t) {
			// Not much else we can do here but dump to stderr
			t.printStackTrace(System.err);
		}
	}

	// Caller must hold the lock
	private void persist() {
		SavedServerStore savedServerStore = getSavedServerStore().orElse(null);

		if (savedServerStore == null)
			return;

		if (!getPortsConfig().getPersistServers()) {
			savedServerStore.clear();
			return;
		}

		savedServerStore.save(getServerInstancesById().values().stream()
				.map(ServerInstance::toSavedServer)
				.collect(Collectors.toList()));
	}

	@NonNull
	private Set<Integer> activePorts() {
		return getServers().stream()
				.map(ServerInstance::getPort)
				.collect(Collectors.toSet());
	}

	@NonNull
	private static Path canonicalDirectory(@NonNull Path directory) {
		requireNonNull(directory);

		if (!Files.isDirectory(directory))
			throw new IllegalArgumentException(format("Directory %s does not exist", directory.toAbsolutePath()));

		try {
			return directory.toRealPath();
		} catch (IOException e) {
			throw new IllegalArgumentException(format("Unable to resolve directory %s", directory.toAbsolutePath()), e);
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
	public PortsConfig getPortsConfig() {
		return this.portsConfig;
	}

	@NonNull
	public PortScanner getPortScanner() {
		return this.portScanner;
	}

	@NonNull
	public Optional<SavedServerStore> getSavedServerStore() {
		return Optional.ofNullable(this.savedServerStore);
	}

	@NonNull
	LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	Random getRandom() {
		return this.random;
	}

	@NonNull
	Optional<ServerFailureListener> getFailureListener() {
		return Optional.ofNullable(this.failureListener);
	}

	@NonNull
	ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	Map<UUID, ServerInstance> getServerInstancesById() {
		return this.serverInstancesById;
	}

	/**
	 * Builder used to construct instances of {@link ServerManager}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final PortsConfig portsConfig;
		@Nullable
		private PortScanner portScanner;
		@Nullable
		private SavedServerStore savedServerStore;
		@Nullable
		private LifecycleObserver lifecycleObserver;
		@Nullable
		private Random random;
		@Nullable
		private ServerFailureListener failureListener;

		private Builder(@NonNull PortsConfig portsConfig) {
			this.portsConfig = requireNonNull(portsConfig);
		}

		@NonNull
		public Builder portScanner(@Nullable PortScanner portScanner) {
			this.portScanner = portScanner;
			return this;
		}

		@NonNull
		public Builder savedServerStore(@Nullable SavedServerStore savedServerStore) {
			this.savedServerStore = savedServerStore;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public Builder random(@Nullable Random random) {
			this.random = random;
			return this;
		}

		@NonNull
		public Builder failureListener(@Nullable ServerFailureListener failureListener) {
			this.failureListener = failureListener;
			return this;
		}

		@NonNull
		public ServerManager build() {
			return new ServerManager(this);
		}
	}
}
