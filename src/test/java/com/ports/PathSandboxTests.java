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

import com.ports.exception.PathViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class PathSandboxTests {
	@TempDir
	Path temporaryDirectory;

	private Path rootDirectory;
	private Path outsideDirectory;
	private PathSandbox pathSandbox;

	@BeforeEach
	public void setUp() throws IOException {
		rootDirectory = Files.createDirectory(temporaryDirectory.resolve("root"));
		outsideDirectory = Files.createDirectory(temporaryDirectory.resolve("outside"));

		Files.createDirectory(rootDirectory.resolve("study room"));
		Files.writeString(rootDirectory.resolve("study room").resolve("notes.txt"), "Spanish 101");
		Files.writeString(outsideDirectory.resolve("secret.txt"), "Dean's plans");

		pathSandbox = PathSandbox.forRootDirectory(rootDirectory);
	}

	@Test
	public void resolvesPathsBeneathRoot() throws IOException {
		Path canonicalRoot = rootDirectory.toRealPath();

		assertEquals(canonicalRoot, pathSandbox.resolve("/"));
		assertEquals(canonicalRoot, pathSandbox.resolve(""));
		assertEquals(canonicalRoot.resolve("study room").resolve("notes.txt"), pathSandbox.resolve("/study room/notes.txt"));
		assertEquals(canonicalRoot.resolve("study room").resolve("notes.txt"), pathSandbox.resolve("//study room/./notes.txt"));
		assertEquals(canonicalRoot.resolve("missing.txt"), pathSandbox.resolve("/missing.txt"), "Missing files still resolve");
		assertEquals(canonicalRoot.resolve("study room"), pathSandbox.resolve("/study room/../study room"));
	}

	@Test
	public void rejectsTraversal() {
		assertThrows(PathViolationException.class, () -> pathSandbox.resolve("/../outside/secret.txt"));
		assertThrows(PathViolationException.class, () -> pathSandbox.resolve("/study room/../../outside/secret.txt"));
		assertThrows(PathViolationException.class, () -> pathSandbox.resolve("/nonexistent/../../outside/missing.txt"));
		assertThrows(PathViolationException.class, () -> pathSandbox.resolve("/.."));
		// What the request parser yields for %2e%2e
		assertThrows(PathViolationException.class, () -> pathSandbox.resolve(Utilities.percentDecode("/%2e%2e/outside/secret.txt")));
	}

	@Test
	public void rejectsSiblingWithCommonPrefix() throws IOException {
		Files.createDirectory(temporaryDirectory.resolve("root-evil"));

		PathViolationException exception = assertThrows(PathViolationException.class, () -> pathSandbox.resolve("/../root-evil"));
		assertEquals("/../root-evil", exception.getRequestPath());
	}

	@Test
	public void rejectsSymlinkEscapingRoot() throws IOException {
		Files.createSymbolicLink(rootDirectory.resolve("escape"), outsideDirectory);
		Files.createSymbolicLink(rootDirectory.resolve("inside"), rootDirectory.resolve("study room"));

		assertThrows(PathViolationException.class, () -> pathSandbox.resolve("/escape/secret.txt"));
		assertThrows(PathViolationException.class, () -> pathSandbox.resolve("/escape"));
		assertTrue(pathSandbox.resolve("/inside/notes.txt").endsWith(Path.of("study room", "notes.txt")),
				"Symlinks that stay within the root are followed");
	}

	@Test
	public void rejectsNulInPath() {
		assertThrows(PathViolationException.class, () -> pathSandbox.resolve("/notes\0.txt"));
	}

	@Test
	public void rootMustExist() {
		assertThrows(IllegalArgumentException.class, () -> PathSandbox.forRootDirectory(temporaryDirectory.resolve("missing")));
	}
}
