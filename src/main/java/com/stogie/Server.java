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

import com.stogie.exception.ServerInterruptException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.time.Duration;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A pooled HTTP/1.x server.
 * <p>
 * Requests are read and answered by a pool of worker threads.  Kept-alive connections wait between requests in a selector-driven connection manager,
 * so an idle client never ties up a worker.
 * <p>
 * For example:
 * <pre>{@code Server server = Server.withPort(8080)
 *   .gateway((request) -> {
 *     request.addHeader("Content-Type", "text/plain");
 *     request.write("Hello".getBytes(StandardCharsets.UTF_8));
 *   })
 *   .build();
 *
 * // Blocks until stop() is called from another thread
 * server.start();}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Server extends AutoCloseable {
	/**
	 * Binds the listening socket and starts the worker pool, but does not accept connections yet.
	 * <p>
	 * If the server is already prepared, no action is taken.
	 *
	 * @throws java.io.UncheckedIOException if the listening socket cannot be bound
	 * @throws IllegalStateException        if no {@link Gateway} was configured
	 */
	void prepare();

	/**
	 * Accepts and serves connections on the calling thread until the server is stopped.
	 *
	 * @throws IllegalStateException     if the server has not been prepared
	 * @throws ServerInterruptException if the server stopped because it was interrupted
	 */
	void serve();

	/**
	 * Equivalent to {@link #prepare()} followed by {@link #serve()}.
	 */
	default void start() {
		prepare();
		serve();
	}

	/**
	 * Like {@link #start()}, but an interrupt is treated as a normal way to stop rather than an error.
	 * <p>
	 * The server is always stopped when this method returns.
	 * While it runs, a JVM shutdown hook stops the server with a {@link com.stogie.exception.ServerInterruptException.Reason#SIGNAL} interrupt.
	 */
	void safeStart();

	/**
	 * Stops accepting connections, closes idle connections and waits (up to the shutdown timeout) for workers to finish.
	 * <p>
	 * If the server is already stopped, no action is taken.
	 */
	void stop();

	/**
	 * Stops the server and makes {@link #serve()} re-throw {@code interrupt} on the thread that called it.
	 *
	 * @param interrupt why the server is stopping
	 */
	void interrupt(@NonNull ServerInterruptException interrupt);

	/**
	 * The interrupt that stopped the server, if any.
	 *
	 * @return the interrupt
	 */
	@NonNull
	Optional<ServerInterruptException> getInterrupt();

	/**
	 * Is this server prepared and not yet stopped?
	 *
	 * @return {@code true} if the server is ready to serve, {@code false} otherwise
	 */
	@NonNull
	Boolean isReady();

	/**
	 * The address this server listens on.  Once prepared, an ephemeral port is replaced with the port actually bound.
	 *
	 * @return the bind address
	 */
	@NonNull
	BindAddress getBindAddress();

	/**
	 * Takes a snapshot of this server's counters.
	 *
	 * @return current statistics
	 */
	@NonNull
	ServerStatistics getStatistics();

	/**
	 * Zeroes this server's counters.
	 */
	void resetStatistics();

	/**
	 * Starts more worker threads on a running server, never going above the configured maximum.
	 * <p>
	 * A pool with a maximum also grows by itself, one worker at a time, when a connection arrives and no worker is free.
	 * Does nothing if the server is not prepared.
	 *
	 * @param amount how many workers to add
	 */
	void growWorkers(int amount);

	/**
	 * Asks idle worker threads on a running server to exit, never going below the configured minimum.
	 * Does nothing if the server is not prepared.
	 *
	 * @param amount how many workers to remove
	 */
	void shrinkWorkers(int amount);

	/**
	 * {@link AutoCloseable}-enabled synonym for {@link #stop()}.
	 */
	@Override
	default void close() {
		stop();
	}

	/**
	 * Acquires a builder for a server listening on all interfaces at the given TCP port.
	 *
	 * @param port the port to listen on, or {@code 0} for an ephemeral port
	 * @return the builder
	 */
	@NonNull
	static Builder withPort(@NonNull Integer port) {
		requireNonNull(port);
		return new Builder(BindAddress.withHostAndPort("0.0.0.0", port));
	}

	/**
	 * Acquires a builder for a server listening at the given address.
	 *
	 * @param bindAddress where to listen
	 * @return the builder
	 */
	@NonNull
	static Builder withBindAddress(@NonNull BindAddress bindAddress) {
		requireNonNull(bindAddress);
		return new Builder(bindAddress);
	}

	/**
	 * Builder used to construct a standard implementation of {@link Server}.
	 * <p>
	 * Every option left unset falls back to a default, listed on {@link DefaultServer}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	final class Builder {
		@NonNull
		BindAddress bindAddress;
		@Nullable
		Gateway gateway;
		@Nullable
		Integer minimumThreads;
		@Nullable
		Integer maximumThreads;
		@Nullable
		Integer acceptedQueueSize;
		@Nullable
		Duration acceptedQueueTimeout;
		@Nullable
		Integer socketPendingConnectionLimit;
		@Nullable
		Duration connectionTimeout;
		@Nullable
		Duration expirationInterval;
		@Nullable
		Duration shutdownTimeout;
		@Nullable
		Long maximumRequestHeaderSizeInBytes;
		@Nullable
		Long maximumRequestBodySizeInBytes;
		@Nullable
		Integer requestReadBufferSizeInBytes;
		@Nullable
		Integer keepAliveConnectionLimit;
		@Nullable
		String protocol;
		@Nullable
		String serverName;
		@Nullable
		Boolean tcpNoDelay;
		@Nullable
		Boolean reusePort;
		@Nullable
		Boolean peerCredentialsEnabled;
		@Nullable
		Boolean proxyMode;
		@Nullable
		Boolean strictMode;
		@Nullable
		HeaderPolicy headerPolicy;
		@Nullable
		TlsAdapter tlsAdapter;
		@Nullable
		LifecycleObserver lifecycleObserver;
		@Nullable
		StatisticsRegistry statisticsRegistry;

		@NonNull
		private Builder(@NonNull BindAddress bindAddress) {
			requireNonNull(bindAddress);
			this.bindAddress = bindAddress;
		}

		@NonNull
		public Builder bindAddress(@NonNull BindAddress bindAddress) {
			requireNonNull(bindAddress);
			this.bindAddress = bindAddress;
			return this;
		}

		@NonNull
		public Builder gateway(@Nullable Gateway gateway) {
			this.gateway = gateway;
			return this;
		}

		@NonNull
		public Builder minimumThreads(@Nullable Integer minimumThreads) {
			this.minimumThreads = minimumThreads;
			return this;
		}

		/**
		 * Upper bound for the worker pool; {@code 0} or less leaves it unbounded.
		 */
		@NonNull
		public Builder maximumThreads(@Nullable Integer maximumThreads) {
			this.maximumThreads = maximumThreads;
			return this;
		}

		/**
		 * Capacity of the queue of connections waiting for a worker; {@code 0} or less makes it unbounded.
		 */
		@NonNull
		public Builder acceptedQueueSize(@Nullable Integer acceptedQueueSize) {
			this.acceptedQueueSize = acceptedQueueSize;
			return this;
		}

		@NonNull
		public Builder acceptedQueueTimeout(@Nullable Duration acceptedQueueTimeout) {
			this.acceptedQueueTimeout = acceptedQueueTimeout;
			return this;
		}

		@NonNull
		public Builder socketPendingConnectionLimit(@Nullable Integer socketPendingConnectionLimit) {
			this.socketPendingConnectionLimit = socketPendingConnectionLimit;
			return this;
		}

		/**
		 * How long a read or write may stall, and how long a kept-alive connection may sit idle, before it is given up on.
		 */
		@NonNull
		public Builder connectionTimeout(@Nullable Duration connectionTimeout) {
			this.connectionTimeout = connectionTimeout;
			return this;
		}

		@NonNull
		public Builder expirationInterval(@Nullable Duration expirationInterval) {
			this.expirationInterval = expirationInterval;
			return this;
		}

		@NonNull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		/**
		 * Ceiling on the request line plus headers; {@code 0} disables it.
		 */
		@NonNull
		public Builder maximumRequestHeaderSizeInBytes(@Nullable Long maximumRequestHeaderSizeInBytes) {
			this.maximumRequestHeaderSizeInBytes = maximumRequestHeaderSizeInBytes;
			return this;
		}

		/**
		 * Ceiling on the request body; {@code 0} disables it.
		 */
		@NonNull
		public Builder maximumRequestBodySizeInBytes(@Nullable Long maximumRequestBodySizeInBytes) {
			this.maximumRequestBodySizeInBytes = maximumRequestBodySizeInBytes;
			return this;
		}

		@NonNull
		public Builder requestReadBufferSizeInBytes(@Nullable Integer requestReadBufferSizeInBytes) {
			this.requestReadBufferSizeInBytes = requestReadBufferSizeInBytes;
			return this;
		}

		/**
		 * How many idle kept-alive connections may wait for their next request at once; {@code 0} or less removes the limit.
		 */
		@NonNull
		public Builder keepAliveConnectionLimit(@Nullable Integer keepAliveConnectionLimit) {
			this.keepAliveConnectionLimit = keepAliveConnectionLimit;
			return this;
		}

		@NonNull
		public Builder protocol(@Nullable String protocol) {
			this.protocol = protocol;
			return this;
		}

		@NonNull
		public Builder serverName(@Nullable String serverName) {
			this.serverName = serverName;
			return this;
		}

		@NonNull
		public Builder tcpNoDelay(@Nullable Boolean tcpNoDelay) {
			this.tcpNoDelay = tcpNoDelay;
			return this;
		}

		@NonNull
		public Builder reusePort(@Nullable Boolean reusePort) {
			this.reusePort = reusePort;
			return this;
		}

		@NonNull
		public Builder peerCredentialsEnabled(@Nullable Boolean peerCredentialsEnabled) {
			this.peerCredentialsEnabled = peerCredentialsEnabled;
			return this;
		}

		/**
		 * Accept absolute-form targets and {@code CONNECT} as a forward proxy would.
		 */
		@NonNull
		public Builder proxyMode(@Nullable Boolean proxyMode) {
			this.proxyMode = proxyMode;
			return this;
		}

		/**
		 * Reject lowercase method names and request-targets that are not in origin-form.
		 */
		@NonNull
		public Builder strictMode(@Nullable Boolean strictMode) {
			this.strictMode = strictMode;
			return this;
		}

		@NonNull
		public Builder headerPolicy(@Nullable HeaderPolicy headerPolicy) {
			this.headerPolicy = headerPolicy;
			return this;
		}

		@NonNull
		public Builder tlsAdapter(@Nullable TlsAdapter tlsAdapter) {
			this.tlsAdapter = tlsAdapter;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public Builder statisticsRegistry(@Nullable StatisticsRegistry statisticsRegistry) {
			this.statisticsRegistry = statisticsRegistry;
			return this;
		}

		@NonNull
		public Server build() {
			return new DefaultServer(this);
		}
	}
}
