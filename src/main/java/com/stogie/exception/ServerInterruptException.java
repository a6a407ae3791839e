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

package com.stogie.exception;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Exception which requests that the whole server shut down.
 * <p>
 * A {@link com.stogie.Gateway} (or anything else running on a worker thread) may throw this to stop the server.
 * The worker drops its connection, the server stops, and {@link com.stogie.Server#serve()} re-throws this exception on the thread that called it.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class ServerInterruptException extends RuntimeException {
	@NonNull
	private final Reason reason;

	public ServerInterruptException(@NonNull Reason reason,
																	@Nullable String message) {
		super(message);
		this.reason = requireNonNull(reason);
	}

	public ServerInterruptException(@NonNull Reason reason,
																	@Nullable String message,
																	@Nullable Throwable cause) {
		super(message, cause);
		this.reason = requireNonNull(reason);
	}

	@NonNull
	public Reason getReason() {
		return this.reason;
	}

	/**
	 * Why the server is being interrupted.
	 */
	public enum Reason {
		/**
		 * Process-level signal, e.g. a JVM shutdown hook or an operator pressing Ctrl-C.
		 */
		SIGNAL,
		/**
		 * Application code asked for the server to exit.
		 */
		SHUTDOWN_REQUESTED,
		/**
		 * A worker hit an error the JVM cannot recover from.
		 */
		FATAL_ERROR
	}
}
