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

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class ListeningPortParserTests {
	private final ListeningPortParser listeningPortParser = ListeningPortParser.defaultInstance();

	@Test
	public void parsesFieldOutput() {
		List<ListeningPort> listeningPorts = listeningPortParser.parse("p100\nclistener\nn127.0.0.1:8080\np200\ncother\nn[::1]:9090\n");

		assertEquals(List.of(
				new ListeningPort(8080, 100, "listener", "127.0.0.1"),
				new ListeningPort(9090, 200, "other", "[::1]")
		), listeningPorts);
	}

	@Test
	public void firstRecordPerPortWins() {
		String output = String.join("\n",
				"p100", "cnode", "f10", "n*:3000", "f11", "n[::]:3000",
				"p200", "cpython3", "n127.0.0.1:3000", "n127.0.0.1:5000");

		assertEquals(List.of(
				new ListeningPort(3000, 100, "node", "*"),
				new ListeningPort(5000, 200, "python3", "127.0.0.1")
		), listeningPortParser.parse(output));
	}

	@Test
	public void pidLineResetsCommand() {
		List<ListeningPort> listeningPorts = listeningPortParser.parse("p100\ncfirst\np200\nn*:4000\r\n");

		assertEquals(List.of(new ListeningPort(4000, 200, "unknown", "*")), listeningPorts);
	}

	@Test
	public void dropsUnusableLines() {
		String output = String.join("\n",
				"n127.0.0.1:1111",      // no process in scope
				"pabc", "cbroken", "n127.0.0.1:2222", // invalid pid
				"p300", "cok",
				"n127.0.0.1:notaport",
				"n127.0.0.1:70000",
				"nno-colon-here",
				"n127.0.0.1:-1",
				"n 127.0.0.1:3333 ",
				"");

		assertEquals(List.of(new ListeningPort(3333, 300, "ok", "127.0.0.1")), listeningPortParser.parse(output));
	}

	@Test
	public void emptyOutput() {
		assertTrue(listeningPortParser.parse("").isEmpty());
		assertTrue(listeningPortParser.parse("\n\n").isEmpty());
	}

	@Test
	public void parsesTabularOutput() {
		String output = String.join("\n",
				"COMMAND   PID USER   FD   TYPE             DEVICE SIZE/OFF NODE NAME",
				"node     4242 abed   23u  IPv4 0x1234567890abcdef      0t0  TCP 127.0.0.1:3000 (LISTEN)",
				"postgres  512 abed    7u  IPv6 0xfedcba0987654321      0t0  TCP [::1]:5432 (LISTEN)");

		assertEquals(List.of(
				new ListeningPort(3000, 4242, "node", "127.0.0.1"),
				new ListeningPort(5432, 512, "postgres", "[::1]")
		), listeningPortParser.parse(output));
	}

	@Test
	public void nameFieldSplitsOnLastColon() {
		assertEquals(new ListeningPort(8443, 1, "unknown", "fe80::1%lo0"),
				listeningPortParser.parseNameField("fe80::1%lo0:8443", 1, "  "));
		assertNull(listeningPortParser.parseNameField("127.0.0.1:", 1, "x"));
	}
}
