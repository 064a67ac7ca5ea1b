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

/**
 * Callback supplied to a {@link StaticFileServer} at construction, invoked when the server stops itself because its
 * accept loop failed unexpectedly.
 * <p>
 * It is not invoked for failures during {@link StaticFileServer#start()} (those are thrown to the caller) or for
 * explicit calls to {@link StaticFileServer#stop()}.
 */
@FunctionalInterface
public interface ServerFailureListener {
	/**
	 * Called on the failing server's accept thread, after the server has already stopped.
	 *
	 * @param server    the server that failed
	 * @param throwable the cause
	 */
	void didFail(@NonNull StaticFileServer server,
							 @NonNull Throwable throwable);
}
