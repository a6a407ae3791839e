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

import org.jspecify.annotations.NonNull;

import static java.util.Objects.requireNonNull;

/**
 * Kinds of {@link LogEvent} instances that Stogie can produce.
 * <p>
 * Each kind carries a default {@link Severity} so observers can filter without enumerating every type.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum LogEventType {
	/**
	 * Indicates that a configuration option was requested but couldn't be honored in the current environment, e.g. UNIX socket permissions could not be changed.
	 */
	CONFIGURATION_UNSUPPORTED(Severity.WARNING),
	/**
	 * Indicates that the server received a request with an illegal structure and answered it with a plain-text error response.
	 */
	SERVER_UNPARSEABLE_REQUEST(Severity.DEBUG),
	/**
	 * Indicates an internal {@link Server} error occurred, e.g. an unexpected exception escaped one iteration of the serve loop.
	 */
	SERVER_INTERNAL_ERROR(Severity.ERROR),
	/**
	 * Indicates that the server is shutting down because of an interrupt.
	 */
	SERVER_INTERRUPTED(Severity.INFO),
	/**
	 * Indicates that accepting a connection failed in a way that is expected to be transient.
	 */
	CONNECTION_ACCEPT_FAILED(Severity.DEBUG),
	/**
	 * Indicates that a TLS handshake failed or the client sent a fatal TLS alert.  The connection is dropped without a response.
	 */
	CONNECTION_TLS_FAILED(Severity.DEBUG),
	/**
	 * Indicates an unexpected socket error while serving a connection.
	 */
	CONNECTION_SOCKET_ERROR(Severity.WARNING),
	/**
	 * Indicates that closing a connection's socket failed.
	 */
	CONNECTION_CLOSE_FAILED(Severity.DEBUG),
	/**
	 * Indicates that the connection manager's selector failed and broken connections were evicted.
	 */
	CONNECTION_MANAGER_SELECT_FAILED(Severity.WARNING),
	/**
	 * Indicates that an exception was thrown during request processing, e.g. by a {@link Gateway}.
	 */
	REQUEST_PROCESSING_FAILED(Severity.ERROR),
	/**
	 * Indicates that the worker queue stayed full for too long and an accepted connection was dropped.
	 */
	WORKER_QUEUE_FULL(Severity.WARNING),
	/**
	 * Indicates that a worker thread hit an unexpected failure outside of request processing.
	 */
	WORKER_THREAD_FAILED(Severity.ERROR),
	/**
	 * Indicates a {@link LifecycleObserver} hook threw an exception.
	 */
	LIFECYCLE_OBSERVER_FAILED(Severity.ERROR);

	@NonNull
	private final Severity severity;

	LogEventType(@NonNull Severity severity) {
		this.severity = requireNonNull(severity);
	}

	@NonNull
	public Severity getSeverity() {
		return this.severity;
	}

	/**
	 * How serious a {@link LogEvent} is.
	 */
	public enum Severity {
		DEBUG,
		INFO,
		WARNING,
		ERROR
	}
}
