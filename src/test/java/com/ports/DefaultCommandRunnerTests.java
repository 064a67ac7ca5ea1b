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
import org.junit.jupiter.api.Timeout;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@ThreadSafe
public class DefaultCommandRunnerTests {
	@Test
	@Timeout(10)
	public void capturesExitCodeAndBothStreams() throws IOException {
		CommandResult commandResult = DefaultCommandRunner.defaultInstance()
				.run(List.of("sh", "-c", "echo 'p42'; echo 'lsof: warning' 1>&2; exit 3"));

		assertEquals(3, commandResult.getExitCode());
		assertEquals("p42\n", commandResult.getStandardOutput());
		assertEquals("lsof: warning\n", commandResult.getStandardError());
	}

	@Test
	@Timeout(10)
	public void missingExecutableFails() {
		assertThrows(IOException.class, () -> DefaultCommandRunner.defaultInstance()
				.run(List.of("ports-no-such-command-for-tests")));
	}

	@Test
	@Timeout(10)
	public void slowCommandIsKilled() {
		DefaultCommandRunner commandRunner = new DefaultCommandRunner(Duration.ofMillis(200));
		assertThrows(IOException.class, () -> commandRunner.run(List.of("sleep", "5")));
	}
}
