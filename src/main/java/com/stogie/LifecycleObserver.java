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

package com.stogie;

import com.stogie.LogEventType.Severity;
import org.jspecify.annotations.NonNull;

import java.time.Duration;

/**
 * Read-only hook methods for observing server and connection lifecycle events.
 * <p>
 * Exceptions thrown by these methods never affect request processing: Stogie catches them and surfaces them separately via {@link #didReceiveLogEvent(LogEvent)}
 * (or, if that method itself fails, dumps them to {@code stderr}).
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface LifecycleObserver {
	/**
	 * Called before the server binds its listening socket.
	 */
	default void willStartServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after the server has bound its listening socket and started its worker pool.
	 */
	default void didStartServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after a {@link Server} instance was asked to start, but failed due to an exception.
	 */
	default void didFailToStartServer(@NonNull Server server,
																		@NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called before the server stops.
	 */
	default void willStopServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after the server stops.
	 */
	default void didStopServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called on the connection manager thread after a connection has been accepted.
	 */
	default void didAcceptConnection(@NonNull HttpConnection connection) {
		// No-op by default
	}

	/**
	 * Called after a connection's socket has been closed.
	 */
	default void didCloseConnection(@NonNull HttpConnection connection,
																	@NonNull Duration connectionDuration) {
		// No-op by default
	}

	/**
	 * Called when Stogie emits a log event.
	 * <p>
	 * The default implementation writes events of {@link Severity#INFO} and above to {@code stderr}.
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		DefaultLifecycleObserver.defaultInstance().didReceiveLogEvent(logEvent);
	}

	/**
	 * Acquires a threadsafe {@link LifecycleObserver} instance with sensible defaults.
	 *
	 * @return a {@code LifecycleObserver} with default settings
	 */
	@NonNull
	static LifecycleObserver defaultInstance() {
		return DefaultLifecycleObserver.defaultInstance();
	}

	/**
	 * Acquires a threadsafe {@link LifecycleObserver} that writes log events at or above {@code minimumSeverity} to {@code stderr}.
	 *
	 * @param minimumSeverity the least severe events to write
	 * @return a {@code LifecycleObserver} with the given threshold
	 */
	@NonNull
	static LifecycleObserver withMinimumSeverity(@NonNull Severity minimumSeverity) {
		return new DefaultLifecycleObserver(minimumSeverity, System.err);
	}
}
