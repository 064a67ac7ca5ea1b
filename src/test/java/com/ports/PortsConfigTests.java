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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class PortsConfigTests {
	@TempDir
	Path temporaryDirectory;

	@Test
	public void defaults() {
		PortsConfig portsConfig = PortsConfig.defaults();

		assertEquals(8080, portsConfig.getDefaultPort());
		assertTrue(portsConfig.getPersistServers());
		assertEquals(Duration.ofSeconds(2), portsConfig.getScanCacheTtl());
		assertEquals(50, portsConfig.getMaximumConnections());
		assertEquals(Duration.ofSeconds(30), portsConfig.getRequestTimeout());
		assertEquals(65_536, portsConfig.getMaximumRequestSizeInBytes());
		assertEquals(8_192, portsConfig.getRequestReadBufferSizeInBytes());
		assertEquals(8080, portsConfig.getRestorePortRangeStart());
		assertEquals(9000, portsConfig.getRestorePortRangeEnd());
		assertEquals("lsof -iTCP -sTCP:LISTEN -n -P -Fpcn", portsConfig.getLsofCommand());
		assertEquals(PortsConfig.builder().build(), portsConfig);
	}

	@Test
	public void loadsPropertiesFile() throws IOException {
		Path propertiesFile = temporaryDirectory.resolve("ports.properties");
		Files.writeString(propertiesFile, String.join("\n",
				"ports.defaultPort=3000",
				"ports.persistServers=false",
				"ports.scanCacheTtlMillis=500",
				"ports.requestTimeoutMillis=1500",
				"ports.restorePortRangeStart=10000",
				"ports.restorePortRangeEnd=10100",
				"ports.lsofCommand=  /usr/sbin/lsof -iTCP -sTCP:LISTEN -n -P -Fpcn  ",
				"ports.maximumConnections=",
				""));

		PortsConfig portsConfig = PortsConfig.fromPropertiesFile(propertiesFile);

		assertEquals(3000, portsConfig.getDefaultPort());
		assertFalse(portsConfig.getPersistServers());
		assertEquals(Duration.ofMillis(500), portsConfig.getScanCacheTtl());
		assertEquals(Duration.ofMillis(1500), portsConfig.getRequestTimeout());
		assertEquals(10_000, portsConfig.getRestorePortRangeStart());
		assertEquals(10_100, portsConfig.getRestorePortRangeEnd());
		assertEquals("/usr/sbin/lsof -iTCP -sTCP:LISTEN -n -P -Fpcn", portsConfig.getLsofCommand());
		assertEquals(50, portsConfig.getMaximumConnections(), "Blank values fall back to defaults");
	}

	@Test
	public void rejectsInvalidValues() throws IOException {
		Path propertiesFile = temporaryDirectory.resolve("ports.properties");
		Files.writeString(propertiesFile, "ports.defaultPort=eighty\n");

		assertThrows(IllegalArgumentException.class, () -> PortsConfig.fromPropertiesFile(propertiesFile));
		assertThrows(IllegalArgumentException.class, () -> PortsConfig.fromPropertiesFile(temporaryDirectory.resolve("missing.properties")));
		assertThrows(IllegalArgumentException.class, () -> PortsConfig.fromPropertiesFile(temporaryDirectory));
		assertThrows(IllegalArgumentException.class, () -> PortsConfig.builder().defaultPort(65_536).build());
		assertThrows(IllegalArgumentException.class, () -> PortsConfig.builder().restorePortRangeStart(9_000).restorePortRangeEnd(8_000).build());
		assertThrows(IllegalArgumentException.class, () -> PortsConfig.builder().maximumConnections(0).build());
		assertThrows(IllegalArgumentException.class, () -> PortsConfig.builder().requestTimeout(Duration.ZERO).build());
		assertThrows(IllegalArgumentException.class, () -> PortsConfig.builder().lsofCommand(" ").build());
	}
}
