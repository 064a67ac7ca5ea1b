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

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reads a properties file from disk and converts its values to simple Java types.
 * <p>
 * Blank values are treated as absent.
 */
@ThreadSafe
public final class PropertiesFileReader {
	@NonNull
	private final Path propertiesFile;
	@NonNull
	private final Map<String, String> properties;

	/**
	 * Loads the given file.
	 *
	 * @param propertiesFile the file to read
	 * @throws IllegalArgumentException if the file is missing, not a regular file or not in properties format
	 */
	public PropertiesFileReader(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);

		this.propertiesFile = propertiesFile;
		this.properties = Collections.unmodifiableMap(loadPropertiesForPath(propertiesFile));
	}

	@NonNull
	public Optional<String> optionalString(@NonNull String key) {
		requireNonNull(key);

		String value = getProperties().get(key);

		if (value == null || value.isBlank())
			return Optional.empty();

		return Optional.of(value.trim());
	}

	/**
	 * @throws IllegalArgumentException if a value is present but is not an integer
	 */
	@NonNull
	public Optional<Integer> optionalInteger(@NonNull String key) {
		requireNonNull(key);

		return optionalString(key).map(value -> {
			try {
				return Integer.valueOf(value);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException(format("Properties file value '%s' for key '%s' in %s is not an integer",
						value, key, getPropertiesFile().toAbsolutePath()), e);
			}
		});
	}

	/**
	 * @throws IllegalArgumentException if a value is present but is not an integer
	 */
	@NonNull
	public Optional<Long> optionalLong(@NonNull String key) {
		requireNonNull(key);

		return optionalString(key).map(value -> {
			try {
				return Long.valueOf(value);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException(format("Properties file value '%s' for key '%s' in %s is not an integer",
						value, key, getPropertiesFile().toAbsolutePath()), e);
			}
		});
	}

	/**
	 * @throws IllegalArgumentException if a value is present but is neither {@code true} nor {@code false}
	 */
	@NonNull
	public Optional<Boolean> optionalBoolean(@NonNull String key) {
		requireNonNull(key);

		return optionalString(key).map(value -> {
			if ("true".equalsIgnoreCase(value))
				return true;

			if ("false".equalsIgnoreCase(value))
				return false;

			throw new IllegalArgumentException(format("Properties file value '%s' for key '%s' in %s is not a boolean",
					value, key, getPropertiesFile().toAbsolutePath()));
		});
	}

	@NonNull
	private static Map<String, String> loadPropertiesForPath(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);

		if (!Files.exists(propertiesFile))
			throw new IllegalArgumentException(format("Unable to find properties file at %s", propertiesFile.toAbsolutePath()));

		if (!Files.isRegularFile(propertiesFile))
			throw new IllegalArgumentException(format("Properties file at %s is not a regular file", propertiesFile.toAbsolutePath()));

		Properties properties = new Properties();

		try (InputStream inputStream = Files.newInputStream(propertiesFile)) {
			properties.load(inputStream);
		} catch (IOException | IllegalArgumentException e) {
			throw new IllegalArgumentException(format("Invalid format for properties file at %s", propertiesFile.toAbsolutePath()), e);
		}

		Map<String, String> propertiesMap = new HashMap<>();

		for (String key : properties.stringPropertyNames())
			propertiesMap.put(key, properties.getProperty(key));

		return propertiesMap;
	}

	@NonNull
	public Path getPropertiesFile() {
		return this.propertiesFile;
	}

	@NonNull
	public Map<String, String> getProperties() {
		return this.properties;
	}
}
