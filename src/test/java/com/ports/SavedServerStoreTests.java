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

import com.ports.TestSupport.QuietLifecycleObserver;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class SavedServerStoreTests {
	@TempDir
	Path temporaryDirectory;

	@Test
	public void roundTripsServers() {
		SavedServerStore savedServerStore = new SavedServerStore(temporaryDirectory.resolve("nested").resolve("servers.properties"),
				new QuietLifecycleObserver());

		List<SavedServer> savedServers = List.of(
				new SavedServer(9090, Path.of("/tmp/Troy Barnes"), true),
				new SavedServer(8080, Path.of("/tmp/Greendale Community College"))
		);

		savedServerStore.save(savedServers);

		assertEquals(savedServers, savedServerStore.load());
	}

	@Test
	public void missingFileIsEmpty() {
		assertTrue(new SavedServerStore(temporaryDirectory.resolve("absent.properties")).load().isEmpty());
	}

	@Test
	public void absentLanFlagDefaultsToFalse() throws IOException {
		Path storeFile = temporaryDirectory.resolve("servers.properties");
		Files.writeString(storeFile, "server.0.port=8080\nserver.0.directory=/tmp/Greendale Community College\n");

		List<SavedServer> savedServers = new SavedServerStore(storeFile).load();

		assertEquals(1, savedServers.size());
		assertEquals(8080, savedServers.get(0).getPort());
		assertEquals(Path.of("/tmp/Greendale Community College"), savedServers.get(0).getDirectoryPath());
		assertFalse(savedServers.get(0).isExposeToLan());
	}

	@Test
	public void malformedEntriesAreSkippedInIndexOrder() throws IOException {
		Path storeFile = temporaryDirectory.resolve("servers.properties");
		Files.writeString(storeFile, String.join("\n",
				"server.10.port=9010",
				"server.10.directory=/tmp/ten",
				"server.2.port=not-a-port",
				"server.2.directory=/tmp/two",
				"server.3.directory=/tmp/three",
				"server.4.port=70000",
				"server.4.directory=/tmp/four",
				"server.5.port=9005",
				"server.5.directory=/tmp/five",
				"server.5.exposeToLan=sometimes",
				"server.6.port=9006",
				"server.6.directory=/tmp/six\\u0000",
				"server.1.port=9001",
				"server.1.directory=/tmp/one",
				"server.1.exposeToLan=TRUE",
				"unrelated=value",
				""));

		List<LogEvent> logEvents = new CopyOnWriteArrayList<>();
		SavedServerStore savedServerStore = new SavedServerStore(storeFile, new QuietLifecycleObserver() {
			@Override
			public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
				logEvents.add(logEvent);
			}
		});

		assertEquals(List.of(
				new SavedServer(9001, Path.of("/tmp/one"), true),
				new SavedServer(9010, Path.of("/tmp/ten"), false)
		), savedServerStore.load());

		assertEquals(5, logEvents.size());
		assertTrue(logEvents.stream().allMatch(logEvent -> logEvent.getLogEventType() == LogEventType.SAVED_SERVER_DECODE_FAILED));
	}

	@Test
	public void unreadableFileIsEmpty() throws IOException {
		Path storeFile = temporaryDirectory.resolve("servers.properties");
		// Malformed \\u escape makes Properties.load fail
		Files.writeString(storeFile, "server.0.port=\\u00zz\n");

		assertTrue(new SavedServerStore(storeFile, new QuietLifecycleObserver()).load().isEmpty());
	}

	@Test
	public void clearRemovesFile() {
		Path storeFile = temporaryDirectory.resolve("servers.properties");
		SavedServerStore savedServerStore = new SavedServerStore(storeFile);

		savedServerStore.save(List.of(new SavedServer(8080, Path.of("/tmp"))));
		assertTrue(Files.exists(storeFile));

		savedServerStore.clear();
		assertFalse(Files.exists(storeFile));
		assertTrue(savedServerStore.load().isEmpty());
	}
}
