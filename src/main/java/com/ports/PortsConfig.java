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

import com.ports.util.PropertiesFileReader;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Process-wide settings, constructed once at startup and passed explicitly to {@link ServerManager},
 * {@link PortScanner} and each {@link StaticFileServer}.
 * <p>
 * Instances can be acquired via {@link #defaults()}, the {@link #builder()} factory method or loaded from a
 * properties file via {@link #fromPropertiesFile(Path)}.
 */
@ThreadSafe
public final class PortsConfig {
	@NonNull
	public static final String DEFAULT_PORT_PROPERTY;
	@NonNull
	public static final String PERSIST_SERVERS_PROPERTY;
	@NonNull
	public static final String SCAN_CACHE_TTL_MILLIS_PROPERTY;
	@NonNull
	public static final String MAXIMUM_CONNECTIONS_PROPERTY;
	@NonNull
	public static final String REQUEST_TIMEOUT_MILLIS_PROPERTY;
	@NonNull
	public static final String MAXIMUM_REQUEST_SIZE_IN_BYTES_PROPERTY;
	@NonNull
	public static final String RESTORE_PORT_RANGE_START_PROPERTY;
	@NonNull
	public static final String RESTORE_PORT_RANGE_END_PROPERTY;
	@NonNull
	public static final String LSOF_COMMAND_PROPERTY;

	@NonNull
	private static final Integer DEFAULT_DEFAULT_PORT;
	@NonNull
	private static final Boolean DEFAULT_PERSIST_SERVERS;
	@NonNull
	private static final Duration DEFAULT_SCAN_CACHE_TTL;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_CONNECTIONS;
	@NonNull
	private static final Duration DEFAULT_REQUEST_TIMEOUT;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
	@NonNull
	private static final Integer DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
	@NonNull
	private static final Integer DEFAULT_RESTORE_PORT_RANGE_START;
	@NonNull
	private static final Integer DEFAULT_RESTORE_PORT_RANGE_END;
	@NonNull
	private static final String DEFAULT_LSOF_COMMAND;
	@NonNull
	private static final PortsConfig DEFAULT_INSTANCE;

	static {
		DEFAULT_PORT_PROPERTY = "ports.defaultPort";
		PERSIST_SERVERS_PROPERTY = "ports.persistServers";
		SCAN_CACHE_TTL_MILLIS_PROPERTY = "ports.scanCacheTtlMillis";
		MAXIMUM_CONNECTIONS_PROPERTY = "ports.maximumConnections";
		REQUEST_TIMEOUT_MILLIS_PROPERTY = "ports.requestTimeoutMillis";
		MAXIMUM_REQUEST_SIZE_IN_BYTES_PROPERTY = "ports.maximumRequestSizeInBytes";
		RESTORE_PORT_RANGE_START_PROPERTY = "ports.restorePortRangeStart";
		RESTORE_PORT_RANGE_END_PROPERTY = "ports.restorePortRangeEnd";
		LSOF_COMMAND_PROPERTY = "ports.lsofCommand";

		DEFAULT_DEFAULT_PORT = 8080;
		DEFAULT_PERSIST_SERVERS = true;
		DEFAULT_SCAN_CACHE_TTL = Duration.ofSeconds(2);
		DEFAULT_MAXIMUM_CONNECTIONS = 50;
		DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
		DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES = 1_024 * 64;
		DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES = 1_024 * 8;
		DEFAULT_RESTORE_PORT_RANGE_START = 8080;
		DEFAULT_RESTORE_PORT_RANGE_END = 9000;
		DEFAULT_LSOF_COMMAND = "lsof -iTCP -sTCP:LISTEN -n -P -Fpcn";

		DEFAULT_INSTANCE = new Builder().build();
	}

	@NonNull
	private final Integer defaultPort;
	@NonNull
	private final Boolean persistServers;
	@NonNull
	private final Duration scanCacheTtl;
	@NonNull
	private final Integer maximumConnections;
	@NonNull
	private final Duration requestTimeout;
	@NonNull
	private final Integer maximumRequestSizeInBytes;
	@NonNull
	private final Integer requestReadBufferSizeInBytes;
	@NonNull
	private final Integer restorePortRangeStart;
	@NonNull
	private final Integer restorePortRangeEnd;
	@NonNull
	private final String lsofCommand;

	@NonNull
	public static PortsConfig defaults() {
		return DEFAULT_INSTANCE;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Loads configuration from a properties file. Keys that are absent fall back to their defaults.
	 *
	 * @param propertiesFile the file to read
	 * @return the configuration
	 * @throws IllegalArgumentException if the file is missing or not a regular file, or a value is malformed or out of range
	 */
	@NonNull
	public static PortsConfig fromPropertiesFile(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);

		PropertiesFileReader reader = new PropertiesFileReader(propertiesFile);
		Builder builder = builder();

		reader.optionalInteger(DEFAULT_PORT_PROPERTY).ifPresent(builder::defaultPort);
		reader.optionalBoolean(PERSIST_SERVERS_PROPERTY).ifPresent(builder::persistServers);
		reader.optionalLong(SCAN_CACHE_TTL_MILLIS_PROPERTY).ifPresent(millis -> builder.scanCacheTtl(Duration.ofMillis(millis)));
		reader.optionalInteger(MAXIMUM_CONNECTIONS_PROPERTY).ifPresent(builder::maximumConnections);
		reader.optionalLong(REQUEST_TIMEOUT_MILLIS_PROPERTY).ifPresent(millis -> builder.requestTimeout(Duration.ofMillis(millis)));
		reader.optionalInteger(MAXIMUM_REQUEST_SIZE_IN_BYTES_PROPERTY).ifPresent(builder::maximumRequestSizeInBytes);
		reader.optionalInteger(RESTORE_PORT_RANGE_START_PROPERTY).ifPresent(builder::restorePortRangeStart);
		reader.optionalInteger(RESTORE_PORT_RANGE_END_PROPERTY).ifPresent(builder::restorePortRangeEnd);
		reader.optionalString(LSOF_COMMAND_PROPERTY).ifPresent(builder::lsofCommand);

		return builder.build();
	}

	private PortsConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		this.defaultPort = builder.defaultPort != null ? builder.defaultPort : DEFAULT_DEFAULT_PORT;
		this.persistServers = builder.persistServers != null ? builder.persistServers : DEFAULT_PERSIST_SERVERS;
		this.scanCacheTtl = builder.scanCacheTtl != null ? builder.scanCacheTtl : DEFAULT_SCAN_CACHE_TTL;
		this.maximumConnections = builder.maximumConnections != null ? builder.maximumConnections : DEFAULT_MAXIMUM_CONNECTIONS;
		this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : DEFAULT_REQUEST_TIMEOUT;
		this.maximumRequestSizeInBytes = builder.maximumRequestSizeInBytes != null ? builder.maximumRequestSizeInBytes : DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
		this.requestReadBufferSizeInBytes = builder.requestReadBufferSizeInBytes != null ? builder.requestReadBufferSizeInBytes : DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
		this.restorePortRangeStart = builder.restorePortRangeStart != null ? builder.restorePortRangeStart : DEFAULT_RESTORE_PORT_RANGE_START;
		this.restorePortRangeEnd = builder.restorePortRangeEnd != null ? builder.restorePortRangeEnd : DEFAULT_RESTORE_PORT_RANGE_END;
		this.lsofCommand = builder.lsofCommand != null ? builder.lsofCommand : DEFAULT_LSOF_COMMAND;

		if (!isValidPort(this.defaultPort))
			throw new IllegalArgumentException(format("Default port %d is outside of the valid range 0-65535", this.defaultPort));

		if (this.scanCacheTtl.isNegative())
			throw new IllegalArgumentException("Scan cache time-to-live must be >= 0");

		if (this.maximumConnections < 1)
			throw new IllegalArgumentException("Maximum connections must be > 0");

		if (this.requestTimeout.isNegative() || this.requestTimeout.isZero())
			throw new IllegalArgumentException("Request timeout must be > 0");

		if (this.maximumRequestSizeInBytes < 4)
			throw new IllegalArgumentException("Maximum request size must be at least 4 bytes");

		if (this.requestReadBufferSizeInBytes < 1)
			throw new IllegalArgumentException("Request read buffer size must be > 0");

		if (!isValidPort(this.restorePortRangeStart) || !isValidPort(this.restorePortRangeEnd)
				|| this.restorePortRangeStart > this.restorePortRangeEnd)
			throw new IllegalArgumentException(format("Illegal restore port range %d-%d", this.restorePortRangeStart, this.restorePortRangeEnd));

		if (this.lsofCommand.isBlank())
			throw new IllegalArgumentException("Port enumeration command must not be blank");
	}

	private static boolean isValidPort(int port) {
		return port >= 0 && port <= 65_535;
	}

	@NonNull
	public Integer getDefaultPort() {
		return this.defaultPort;
	}

	/**
	 * Whether changes to the set of running servers are written to the saved-server store.
	 */
	@NonNull
	public Boolean getPersistServers() {
		return this.persistServers;
	}

	@NonNull
	public Duration getScanCacheTtl() {
		return this.scanCacheTtl;
	}

	@NonNull
	public Integer getMaximumConnections() {
		return this.maximumConnections;
	}

	@NonNull
	public Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	@NonNull
	public Integer getMaximumRequestSizeInBytes() {
		return this.maximumRequestSizeInBytes;
	}

	@NonNull
	public Integer getRequestReadBufferSizeInBytes() {
		return this.requestReadBufferSizeInBytes;
	}

	@NonNull
	public Integer getRestorePortRangeStart() {
		return this.restorePortRangeStart;
	}

	@NonNull
	public Integer getRestorePortRangeEnd() {
		return this.restorePortRangeEnd;
	}

	@NonNull
	public String getLsofCommand() {
		return this.lsofCommand;
	}

	@Override
	public String toString() {
		return format("%s{defaultPort=%d, persistServers=%s, scanCacheTtl=%s, maximumConnections=%d, requestTimeout=%s, "
						+ "maximumRequestSizeInBytes=%d, requestReadBufferSizeInBytes=%d, restorePortRange=%d-%d, lsofCommand=%s}",
				getClass().getSimpleName(), getDefaultPort(), getPersistServers(), getScanCacheTtl(), getMaximumConnections(),
				getRequestTimeout(), getMaximumRequestSizeInBytes(), getRequestReadBufferSizeInBytes(),
				getRestorePortRangeStart(), getRestorePortRangeEnd(), getLsofCommand());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof PortsConfig portsConfig))
			return false;

		return Objects.equals(getDefaultPort(), portsConfig.getDefaultPort())
				&& Objects.equals(getPersistServers(), portsConfig.getPersistServers())
				&& Objects.equals(getScanCacheTtl(), portsConfig.getScanCacheTtl())
				&& Objects.equals(getMaximumConnections(), portsConfig.getMaximumConnections())
				&& Objects.equals(getRequestTimeout(), portsConfig.getRequestTimeout())
				&& Objects.equals(getMaximumRequestSizeInBytes(), portsConfig.getMaximumRequestSizeInBytes())
				&& Objects.equals(getRequestReadBufferSizeInBytes(), portsConfig.getRequestReadBufferSizeInBytes())
				&& Objects.equals(getRestorePortRangeStart(), portsConfig.getRestorePortRangeStart())
				&& Objects.equals(getRestorePortRangeEnd(), portsConfig.getRestorePortRangeEnd())
				&& Objects.equals(getLsofCommand(), portsConfig.getLsofCommand());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getDefaultPort(), getPersistServers(), getScanCacheTtl(), getMaximumConnections(),
				getRequestTimeout(), getMaximumRequestSizeInBytes(), getRequestReadBufferSizeInBytes(),
				getRestorePortRangeStart(), getRestorePortRangeEnd(), getLsofCommand());
	}

	/**
	 * Builder used to construct instances of {@link PortsConfig}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private Integer defaultPort;
		@Nullable
		private Boolean persistServers;
		@Nullable
		private Duration scanCacheTtl;
		@Nullable
		private Integer maximumConnections;
		@Nullable
		private Duration requestTimeout;
		@Nullable
		private Integer maximumRequestSizeInBytes;
		@Nullable
		private Integer requestReadBufferSizeInBytes;
		@Nullable
		private Integer restorePortRangeStart;
		@Nullable
		private Integer restorePortRangeEnd;
		@Nullable
		private String lsofCommand;

		private Builder() {
			// Only vended by PortsConfig
		}

		@NonNull
		public Builder defaultPort(@Nullable Integer defaultPort) {
			this.defaultPort = defaultPort;
			return this;
		}

		@NonNull
		public Builder persistServers(@Nullable Boolean persistServers) {
			this.persistServers = persistServers;
			return this;
		}

		@NonNull
		public Builder scanCacheTtl(@Nullable Duration scanCacheTtl) {
			this.scanCacheTtl = scanCacheTtl;
			return this;
		}

		@NonNull
		public Builder maximumConnections(@Nullable Integer maximumConnections) {
			this.maximumConnections = maximumConnections;
			return this;
		}

		@NonNull
		public Builder requestTimeout(@Nullable Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		@NonNull
		public Builder maximumRequestSizeInBytes(@Nullable Integer maximumRequestSizeInBytes) {
			this.maximumRequestSizeInBytes = maximumRequestSizeInBytes;
			return this;
		}

		@NonNull
		public Builder requestReadBufferSizeInBytes(@Nullable Integer requestReadBufferSizeInBytes) {
			this.requestReadBufferSizeInBytes = requestReadBufferSizeInBytes;
			return this;
		}

		@NonNull
		public Builder restorePortRangeStart(@Nullable Integer restorePortRangeStart) {
			this.restorePortRangeStart = restorePortRangeStart;
			return this;
		}

		@NonNull
		public Builder restorePortRangeEnd(@Nullable Integer restorePortRangeEnd) {
			this.restorePortRangeEnd = restorePortRangeEnd;
			return this;
		}

		@NonNull
		public Builder lsofCommand(@Nullable String lsofCommand) {
			this.lsofCommand = lsofCommand;
			return this;
		}

		@NonNull
		public PortsConfig build() {
			return new PortsConfig(this);
		}
	}
}
