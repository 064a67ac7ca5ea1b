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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One TCP socket in the {@code LISTEN} state, as reported by the port enumeration command.
 */
@ThreadSafe
public final class ListeningPort {
	@NonNull
	private final Integer port;
	@NonNull
	private final Integer pid;
	@NonNull
	private final String processName;
	@NonNull
	private final String address;

	public ListeningPort(@NonNull Integer port,
											 @NonNull Integer pid,
											 @NonNull String processName,
											 @NonNull String address) {
		requireNonNull(port);
		requireNonNull(pid);
		requireNonNull(processName);
		requireNonNull(address);

		if (port < 0 || port > 65_535)
			throw new IllegalArgumentException(format("Illegal port value %d", port));

		this.port = port;
		this.pid = pid;
		this.processName = processName;
		this.address = address;
	}

	@NonNull
	public Integer getPort() {
		return this.port;
	}

	@NonNull
	public Integer getPid() {
		return this.pid;
	}

	@NonNull
	public String getProcessName() {
		return this.processName;
	}

	/**
	 * The local address the socket is bound to, e.g. {@code 127.0.0.1}, {@code *} or {@code [::1]}.
	 */
	@NonNull
	public String getAddress() {
		return this.address;
	}

	@Override
	public String toString() {
		return format("%s{port=%d, pid=%d, processName=%s, address=%s}", getClass().getSimpleName(),
				getPort(), getPid(), getProcessName(), getAddress());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ListeningPort listeningPort))
			return false;

		return Objects.equals(getPort(), listeningPort.getPort())
				&& Objects.equals(getPid(), listeningPort.getPid())
				&& Objects.equals(getProcessName(), listeningPort.getProcessName())
				&& Objects.equals(getAddress(), listeningPort.getAddress());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getPort(), getPid(), getProcessName(), getAddress());
	}
}
