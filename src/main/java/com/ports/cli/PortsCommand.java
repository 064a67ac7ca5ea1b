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

package com.ports.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.ports.ListeningPort;
import com.ports.PortScanner;
import com.ports.PortsConfig;
import com.ports.SavedServerStore;
import com.ports.ServerInstance;
import com.ports.ServerManager;
import com.ports.exception.ServerBindException;
import com.ports.util.LoggingUtils;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Command-line entry point.
 * <pre>{@code ports list [--force]
 * ports serve <directory> [--port N] [--lan]
 * ports restore}</pre>
 * Global options {@code --config}, {@code --logback} and {@code --store} precede the command.
 * <p>
 * {@code serve} and {@code restore} keep running until Enter is pressed or the JVM is asked to shut down.
 */
@NotThreadSafe
public final class PortsCommand {
	@NonNull
	static final Integer EXIT_SUCCESS;
	@NonNull
	static final Integer EXIT_FAILURE;
	@NonNull
	static final Integer EXIT_USAGE;

	@NonNull
	private static final String LIST_COMMAND;
	@NonNull
	private static final String SERVE_COMMAND;
	@NonNull
	private static final String RESTORE_COMMAND;

	static {
		EXIT_SUCCESS = 0;
		EXIT_FAILURE = 1;
		EXIT_USAGE = 2;

		LIST_COMMAND = "list";
		SERVE_COMMAND = "serve";
		RESTORE_COMMAND = "restore";
	}

	@NonNull
	private final PrintStream out;
	@NonNull
	private final PrintStream err;
	@NonNull
	private final InputStream in;
	@NonNull
	private final CountDownLatch shutdownLatch;

	public static void main(@Nullable String[] args) {
		int exitCode = new PortsCommand(System.out, System.err, System.in).run(args == null ? new String[0] : args);

		// Servers run on daemon threads, so a normal return after shutdown is enough
		if (exitCode != EXIT_SUCCESS)
			System.exit(exitCode);
	}

	PortsCommand(@NonNull PrintStream out,
							 @NonNull PrintStream err,
							 @NonNull InputStream in) {
		this.out = requireNonNull(out);
		this.err = requireNonNull(err);
		this.in = requireNonNull(in);
		this.shutdownLatch = new CountDownLatch(1);
	}

	@NonNull
	Integer run(@NonNull String... args) {
		requireNonNull(args);

		GlobalOptions globalOptions = new GlobalOptions();
		ListOptions listOptions = new ListOptions();
		ServeOptions serveOptions = new ServeOptions();
		RestoreOptions restoreOptions = new RestoreOptions();

		JCommander jCommander = JCommander.newBuilder()
				.programName("ports")
				.addObject(globalOptions)
				.addCommand(LIST_COMMAND, listOptions)
				.addCommand(SERVE_COMMAND, serveOptions)
				.addCommand(RESTORE_COMMAND, restoreOptions)
				.build();

		try {
			jCommander.parse(args);
		} catch (ParameterException e) {
			getErr().println(e.getMessage());
			printUsage(jCommander);
			return EXIT_USAGE;
		}

		String command = jCommander.getParsedCommand();

		if (globalOptions.help || command == null) {
			printUsage(jCommander);
			return globalOptions.help ? EXIT_SUCCESS : EXIT_USAGE;
		}

		PortsConfig portsConfig;

		try {
			portsConfig = globalOptions.configFile == null ? PortsConfig.defaults() : PortsConfig.fromPropertiesFile(globalOptions.configFile);

			if (globalOptions.logbackConfigurationFile == null)
				LoggingUtils.installJulBridge();
			else
				LoggingUtils.initializeLogback(globalOptions.logbackConfigurationFile);
		} catch (IllegalArgumentException | IllegalStateException e) {
			getErr().println(e.getMessage());
			return EXIT_USAGE;
		}

		if (LIST_COMMAND.equals(command))
			return list(portsConfig, listOptions);

		if (SERVE_COMMAND.equals(command))
			return serve(createServerManager(portsConfig, globalOptions), serveOptions);

		if (RESTORE_COMMAND.equals(command))
			return restore(createServerManager(portsConfig, globalOptions));

		printUsage(jCommander);
		return EXIT_USAGE;
	}

	@NonNull
	Integer list(@NonNull PortsConfig portsConfig,
							 @NonNull ListOptions listOptions) {
		requireNonNull(portsConfig);
		requireNonNull(listOptions);

		PortScanner portScanner = PortScanner.withConfig(portsConfig).build();
		List<ListeningPort> listeningPorts = listOptions.force ? portScanner.forceScan() : portScanner.scan();

		getOut().println(formatListeningPorts(listeningPorts));
		return EXIT_SUCCESS;
	}

	@NonNull
	Integer serve(@NonNull ServerManager serverManager,
								@NonNull ServeOptions serveOptions) {
		requireNonNull(serverManager);
		requireNonNull(serveOptions);

		if (serveOptions.directories.size() != 1) {
			getErr().println("Exactly one directory is required");
			return EXIT_USAGE;
		}

		Path directory = Path.of(serveOptions.directories.get(0));
		Integer port = serveOptions.port != null ? serveOptions.port
				: serverManager.findAvailablePort(serverManager.getPortsConfig().getDefaultPort());

		ServerInstance serverInstance;

		try {
			serverInstance = serverManager.startServer(port, directory, serveOptions.lan);
		} catch (IllegalArgumentException e) {
			getErr().println(e.getMessage());
			return EXIT_USAGE;
		} catch (ServerBindException e) {
			getErr().println(format("Unable to start server on port %d: %s", e.getPort(), e.getCause().getMessage()));
			return EXIT_FAILURE;
		}

		printServerInstance(serverInstance);
		awaitShutdown(serverManager);
		return EXIT_SUCCESS;
	}

	@NonNull
	Integer restore(@NonNull ServerManager serverManager) {
		requireNonNull(serverManager);

		List<ServerInstance> serverInstances = serverManager.restoreSavedServers();

		if (serverInstances.isEmpty()) {
			getOut().println("No saved servers to restore");
			return EXIT_SUCCESS;
		}

		for (ServerInstance serverInstance : serverInstances)
			printServerInstance(serverInstance);

		awaitShutdown(serverManager);
		return EXIT_SUCCESS;
	}

	@NonNull
	static String formatListeningPorts(@NonNull List<ListeningPort> listeningPorts) {
		requireNonNull(listeningPorts);

		List<ListeningPort> sortedListeningPorts = new ArrayList<>(listeningPorts);
		sortedListeningPorts.sort((first, second) -> first.getPort().compareTo(second.getPort()));

		StringBuilder stringBuilder = new StringBuilder(format("%-7s %-8s %-24s %s", "PORT", "PID", "PROCESS", "ADDRESS"));

		for (ListeningPort listeningPort : sortedListeningPorts)
			stringBuilder.append('\n').append(format("%-7d %-8d %-24s %s", listeningPort.getPort(), listeningPort.getPid(),
					listeningPort.getProcessName(), listeningPort.getAddress()));

		return stringBuilder.toString();
	}

	@NonNull
	private ServerManager createServerManager(@NonNull PortsConfig portsConfig,
																						@NonNull GlobalOptions globalOptions) {
		requireNonNull(portsConfig);
		requireNonNull(globalOptions);

		Path storeFile = globalOptions.storeFile != null ? globalOptions.storeFile
				: Path.of(System.getProperty("user.home"), ".ports", "servers.properties");

		return ServerManager.withConfig(portsConfig)
				.savedServerStore(new SavedServerStore(storeFile))
				.failureListener((staticFileServer, throwable) -> {
					getErr().println(format("Server on port %d failed: %s", staticFileServer.getPort(), throwable.getMessage()));
				})
				.build();
	}

	private void printServerInstance(@NonNull ServerInstance serverInstance) {
		requireNonNull(serverInstance);

		getOut().println(format("Serving %s at http://localhost:%d/", serverInstance.getRootDirectory(), serverInstance.getPort()));

		if (serverInstance.isExposeToLan()) {
			String lanAddress = lanAddress();

			if (lanAddress == null)
				getOut().println("  LAN URL unavailable");
			else
				getOut().println(format("  LAN: http://%s:%d/", lanAddress, serverInstance.getPort()));
		}
	}

	// First non-loopback IPv4 address on an interface that is up
	@Nullable
	private String lanAddress() {
		try {
			for (NetworkInterface networkInterface : Collections.list(NetworkInterface.getNetworkInterfaces())) {
				if (!networkInterface.isUp() || networkInterface.isLoopback())
					continue;

				for (InetAddress inetAddress : Collections.list(networkInterface.getInetAddresses()))
					if (inetAddress instanceof Inet4Address && !inetAddress.isLoopbackAddress())
						return inetAddress.getHostAddress();
			}
		} catch (SocketException e) {
			getErr().println(format("Unable to determine LAN address: %s", e.getMessage()));
		}

		return null;
	}

	private void awaitShutdown(@NonNull ServerManager serverManager) {
		requireNonNull(serverManager);

		getOut().println("Press Enter to stop");

		Thread shutdownHook = new Thread(() -> {
			serverManager.shutdown();
			getShutdownLatch().countDown();
		}, "ports-shutdown-hook");

		Runtime.getRuntime().addShutdownHook(shutdownHook);

		// EOF on stdin (e.g. /dev/null) leaves the servers running until the JVM is stopped
		Thread keypressThread = new Thread(() -> {
			try {
				BufferedReader bufferedReader = new BufferedReader(new InputStreamReader(getIn(), StandardCharsets.UTF_8));

				if (bufferedReader.readLine() != null)
					getShutdownLatch().countDown();
			} catch (IOException e) {
				getErr().println(format("Stopped listening for Enter: %s", e.getMessage()));
			}
		}, "ports-keypress-shutdown-listener");

		keypressThread.setDaemon(true);
		keypressThread.start();

		try {
			getShutdownLatch().await();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		} finally {
			try {
				Runtime.getRuntime().removeShutdownHook(shutdownHook);
			} catch (IllegalStateException e) {
				// JVM is already shutting down and the hook is doing the work
				return;
			}

			serverManager.shutdown();
		}
	}

	private void printUsage(@NonNull JCommander jCommander) {
		requireNonNull(jCommander);

		StringBuilder usage = new StringBuilder();
		jCommander.getUsageFormatter().usage(usage);
		getErr().print(usage);
	}

	@NonNull
	PrintStream getOut() {
		return this.out;
	}

	@NonNull
	PrintStream getErr() {
		return this.err;
	}

	@NonNull
	InputStream getIn() {
		return this.in;
	}

	@NonNull
	CountDownLatch getShutdownLatch() {
		return this.shutdownLatch;
	}

	static final class GlobalOptions {
		@Parameter(names = "--config", description = "Properties file overriding the default settings")
		@Nullable
		Path configFile;

		@Parameter(names = "--logback", description = "Logback XML configuration file")
		@Nullable
		Path logbackConfigurationFile;

		@Parameter(names = "--store", description = "Properties file recording servers to restore (default ~/.ports/servers.properties)")
		@Nullable
		Path storeFile;

		@Parameter(names = {"--help", "-h"}, help = true, description = "Show usage")
		boolean help;
	}

	@Parameters(commandDescription = "List TCP ports in the LISTEN state")
	static final class ListOptions {
		@Parameter(names = "--force", description = "Bypass the scan cache")
		boolean force;
	}

	@Parameters(commandDescription = "Serve a directory over HTTP")
	static final class ServeOptions {
		@Parameter(description = "<directory>", required = true)
		@NonNull
		List<String> directories = new ArrayList<>();

		@Parameter(names = "--port", description = "Port to bind (default: first available from the configured default port)")
		@Nullable
		Integer port;

		@Parameter(names = "--lan", description = "Accept connections from other devices on the network")
		boolean lan;
	}

	@Parameters(commandDescription = "Restore previously-saved servers")
	static final class RestoreOptions {
		// No options
	}
}
