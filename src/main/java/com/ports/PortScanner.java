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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.time.Clock;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Enumerates TCP sockets in the {@code LISTEN} state on this host.
 * <p>
 * Results are cached for a short time-to-live so bursts of callers share one invocation of the external command.
 * Both operations block while a capture is in progress; call them off latency-sensitive threads.
 */
public interface PortScanner {
	/**
	 * Returns the cached records if they are younger than the time-to-live, otherwise captures fresh ones.
	 *
	 * @return listening ports, at most one record per port; empty if the command could not be run
	 */
	@NonNull
	List<ListeningPort> scan();

	/**
	 * Always captures fresh records, refreshing the cache.
	 *
	 * @return listening ports, at most one record per port; empty if the command could not be run
	 */
	@NonNull
	List<ListeningPort> forceScan();

	@NonNull
	static Builder withConfig(@NonNull PortsConfig portsConfig) {
		requireNonNull(portsConfig);
		return new Builder(portsConfig);
	}

	/**
	 * Builder used to construct a standard implementation of {@link PortScanner}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	final class Builder {
		@NonNull
		PortsConfig portsConfig;
		@Nullable
		CommandRunner commandRunner;
		@Nullable
		Clock clock;
		@Nullable
		LifecycleObserver lifecycleObserver;

		private Builder(@NonNull PortsConfig portsConfig) {
			requireNonNull(portsConfig);
			this.portsConfig = portsConfig;
		}

		@NonNull
		public Builder commandRunner(@Nullable CommandRunner commandRunner) {
			this.commandRunner = commandRunner;
			return this;
		}

		@NonNull
		public Builder clock(@Nullable Clock clock) {
			this.clock = clock;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public PortScanner build() {
			return new DefaultPortScanner(this);
		}
	}
}
