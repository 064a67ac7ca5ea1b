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

package com.ports.util;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import org.jspecify.annotations.NonNull;
import org.slf4j.bridge.SLF4JBridgeHandler;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getILoggerFactory;

/**
 * Wires {@code java.util.logging}, which the server engine and scanner log through, into SLF4J and Logback.
 */
@ThreadSafe
public final class LoggingUtils {
	@NonNull
	private static final Object LOCK;

	static {
		LOCK = new Object();
	}

	private LoggingUtils() {
		// Non-instantiable
	}

	/**
	 * Routes {@code java.util.logging} to SLF4J using whatever Logback configuration is already in effect
	 * (normally the bundled {@code logback.xml}).
	 */
	public static void installJulBridge() {
		synchronized (LOCK) {
			Logger rootLogger = LogManager.getLogManager().getLogger("");

			for (Handler handler : rootLogger.getHandlers())
				rootLogger.removeHandler(handler);

			if (!SLF4JBridgeHandler.isInstalled())
				SLF4JBridgeHandler.install();

			// Let Logback decide what to drop
			rootLogger.setLevel(Level.ALL);
		}
	}

	/**
	 * Reconfigures Logback from the given file, then bridges {@code java.util.logging} into it.
	 *
	 * @param logbackConfigurationFile a Logback XML configuration file
	 * @throws IllegalArgumentException if the file is missing or not a regular file
	 * @throws IllegalStateException    if Logback rejects the configuration
	 */
	public static void initializeLogback(@NonNull Path logbackConfigurationFile) {
		requireNonNull(logbackConfigurationFile);

		synchronized (LOCK) {
			if (!Files.exists(logbackConfigurationFile))
				throw new IllegalArgumentException(format(
						"Unable to initialize Logback logging. Could not find a configuration file at %s",
						logbackConfigurationFile.toAbsolutePath()));

			if (!Files.isRegularFile(logbackConfigurationFile))
				throw new IllegalArgumentException(format(
						"Unable to initialize Logback logging. The configuration path %s does not appear to be a regular file",
						logbackConfigurationFile.toAbsolutePath()));

			uninstallJulBridge();

			LoggerContext loggerContext = (LoggerContext) getILoggerFactory();

			try {
				JoranConfigurator configurator = new JoranConfigurator();
				configurator.setContext(loggerContext);
				loggerContext.reset();
				configurator.doConfigure(logbackConfigurationFile.toFile().getAbsolutePath());
			} catch (JoranException e) {
				throw new IllegalStateException("Unable to configure Logback logging", e);
			}

			StatusPrinter.printInCaseOfErrorsOrWarnings(loggerContext);
			installJulBridge();
		}
	}

	public static void uninstallJulBridge() {
		synchronized (LOCK) {
			if (SLF4JBridgeHandler.isInstalled())
				SLF4JBridgeHandler.uninstall();
		}
	}
}
