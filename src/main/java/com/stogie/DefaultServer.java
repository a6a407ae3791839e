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
import com.stogie.exception.ServerInterruptException.Reason;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.newsclub.net.unix.AFUNIXServerSocketChannel;
import org.newsclub.net.unix.AFUNIXSocketAddress;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.BindException;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardProtocolFamily;
import java.net.StandardSocketOptions;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channel;
import java.nio.channels.ServerSocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Standard {@link Server} implementation.
 * <p>
 * Defaults for options left unset on the {@link Server.Builder}:
 * <ul>
 *   <li>10 minimum worker threads, no maximum</li>
 *   <li>unbounded accepted-connection queue, 10 second accepted-queue timeout</li>
 *   <li>{@code HTTP/1.1}, listen backlog of 5</li>
 *   <li>10 second connection timeout, 500 millisecond expiration interval, 5 second shutdown timeout</li>
 *   <li>no request header or body size ceiling</li>
 *   <li>at most 10 idle kept-alive connections</li>
 *   <li>{@code TCP_NODELAY} on, {@code SO_REUSEPORT} off, peer credentials off</li>
 *   <li>strict mode on, proxy mode off</li>
 * </ul>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultServer implements Server {
	@NonNull
	private static final Integer DEFAULT_MINIMUM_THREADS;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_THREADS;
	@NonNull
	private static final Integer DEFAULT_ACCEPTED_QUEUE_SIZE;
	@NonNull
	private static final Duration DEFAULT_ACCEPTED_QUEUE_TIMEOUT;
	@NonNull
	private static final Integer DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
	@NonNull
	private static final Duration DEFAULT_CONNECTION_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_EXPIRATION_INTERVAL;
	@NonNull
	private static final Duration DEFAULT_SHUTDOWN_TIMEOUT;
	@NonNull
	private static final Long DEFAULT_MAXIMUM_REQUEST_HEADER_SIZE_IN_BYTES;
	@NonNull
	private static final Long DEFAULT_MAXIMUM_REQUEST_BODY_SIZE_IN_BYTES;
	@NonNull
	private static final Integer DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
	@NonNull
	private static final Integer DEFAULT_KEEP_ALIVE_CONNECTION_LIMIT;
	@NonNull
	private static final String DEFAULT_PROTOCOL;
	@NonNull
	private static final String DEFAULT_SERVER_NAME;
	@NonNull
	private static final Boolean DEFAULT_TCP_NO_DELAY;
	@NonNull
	private static final Boolean DEFAULT_REUSE_PORT;
	@NonNull
	private static final Boolean DEFAULT_PEER_CREDENTIALS_ENABLED;
	@NonNull
	private static final Boolean DEFAULT_PROXY_MODE;
	@NonNull
	private static final Boolean DEFAULT_STRICT_MODE;
	@NonNull
	private static final Pattern PROTOCOL_PATTERN;
	@NonNull
	private static final Duration INTERRUPT_POLL_INTERVAL;

	static {
		DEFAULT_MINIMUM_THREADS = 10;
		DEFAULT_MAXIMUM_THREADS = 0;
		DEFAULT_ACCEPTED_QUEUE_SIZE = 0;
		DEFAULT_ACCEPTED_QUEUE_TIMEOUT = Duration.ofSeconds(10);
		DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT = 5;
		DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(10);
		DEFAULT_EXPIRATION_INTERVAL = Duration.ofMillis(500);
		DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
		DEFAULT_MAXIMUM_REQUEST_HEADER_SIZE_IN_BYTES = 0L;
		DEFAULT_MAXIMUM_REQUEST_BODY_SIZE_IN_BYTES = 0L;
		DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES = 1_024 * 8;
		DEFAULT_KEEP_ALIVE_CONNECTION_LIMIT = 10;
		DEFAULT_PROTOCOL = "HTTP/1.1";
		DEFAULT_SERVER_NAME = format("Stogie/%s", Optional.ofNullable(DefaultServer.class.getPackage().getImplementationVersion()).orElse("1.0.0-SNAPSHOT"));
		DEFAULT_TCP_NO_DELAY = true;
		DEFAULT_REUSE_PORT = false;
		DEFAULT_PEER_CREDENTIALS_ENABLED = false;
		DEFAULT_PROXY_MODE = false;
		DEFAULT_STRICT_MODE = true;
		PROTOCOL_PATTERN = Pattern.compile("HTTP/1\\.[01]");
		INTERRUPT_POLL_INTERVAL = Duration.ofMillis(100);
	}

	@NonNull
	private final BindAddress configuredBindAddress;
	@Nullable
	private final Gateway gateway;
	@NonNull
	private final Integer minimumThreads;
	@Nullable
	private final Integer maximumThreads;
	@NonNull
	private final Integer acceptedQueueSize;
	@NonNull
	private final Duration acceptedQueueTimeout;
	@NonNull
	private final Integer socketPendingConnectionLimit;
	@NonNull
	private final Duration connectionTimeout;
	@NonNull
	private final Duration expirationInterval;
	@NonNull
	private final Duration shutdownTimeout;
	@NonNull
	private final Long maximumRequestHeaderSizeInBytes;
	@NonNull
	private final Long maximumRequestBodySizeInBytes;
	@NonNull
	private final Integer requestReadBufferSizeInBytes;
	@NonNull
	private final Integer keepAliveConnectionLimit;
	@NonNull
	private final String protocol;
	@NonNull
	private final int[] protocolVersion;
	@NonNull
	private final String serverName;
	@NonNull
	private final Boolean tcpNoDelay;
	@NonNull
	private final Boolean reusePort;
	@NonNull
	private final Boolean peerCredentialsEnabled;
	@NonNull
	private final Boolean proxyMode;
	@NonNull
	private final Boolean strictMode;
	@NonNull
	private final HeaderPolicy headerPolicy;
	@Nullable
	private final TlsAdapter tlsAdapter;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@Nullable
	private final StatisticsRegistry statisticsRegistry;
	@NonNull
	private final String statisticsName;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final AtomicReference<ServerInterruptException> interrupt;
	@NonNull
	private final AtomicLong accepts;
	@NonNull
	private final AtomicLong socketErrors;
	@NonNull
	private volatile BindAddress bindAddress;
	@Nullable
	private volatile ServerSocketChannel serverSocketChannel;
	@Nullable
	private volatile ConnectionManager connectionManager;
	@Nullable
	private volatile WorkerPool workerPool;
	private volatile boolean ready;
	private volatile boolean stoppingForInterrupt;
	private volatile long runStartedNanos;
	private volatile long accumulatedRunTimeNanos;

	protected DefaultServer(@NonNull Builder builder) {
		requireNonNull(builder);

		this.lock = new ReentrantLock();
		this.interrupt = new AtomicReference<>();
		this.accepts = new AtomicLong();
		this.socketErrors = new AtomicLong();

		this.configuredBindAddress = builder.bindAddress;
		this.bindAddress = builder.bindAddress;
		this.gateway = builder.gateway;
		this.minimumThreads = builder.minimumThreads != null ? builder.minimumThreads : DEFAULT_MINIMUM_THREADS;

		Integer maximumThreads = builder.maximumThreads != null ? builder.maximumThreads : DEFAULT_MAXIMUM_THREADS;
		this.maximumThreads = maximumThreads > 0 ? maximumThreads : null;

		this.acceptedQueueSize = builder.acceptedQueueSize != null ? builder.acceptedQueueSize : DEFAULT_ACCEPTED_QUEUE_SIZE;
		this.acceptedQueueTimeout = builder.acceptedQueueTimeout != null ? builder.acceptedQueueTimeout : DEFAULT_ACCEPTED_QUEUE_TIMEOUT;
		this.socketPendingConnectionLimit = builder.socketPendingConnectionLimit != null ? builder.socketPendingConnectionLimit : DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
		this.connectionTimeout = builder.connectionTimeout != null ? builder.connectionTimeout : DEFAULT_CONNECTION_TIMEOUT;
		this.expirationInterval = builder.expirationInterval != null ? builder.expirationInterval : DEFAULT_EXPIRATION_INTERVAL;
		this.shutdownTimeout = builder.shutdownTimeout != null ? builder.shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;
		this.maximumRequestHeaderSizeInBytes = builder.maximumRequestHeaderSizeInBytes != null ? builder.maximumRequestHeaderSizeInBytes : DEFAULT_MAXIMUM_REQUEST_HEADER_SIZE_IN_BYTES;
		this.maximumRequestBodySizeInBytes = builder.maximumRequestBodySizeInBytes != null ? builder.maximumRequestBodySizeInBytes : DEFAULT_MAXIMUM_REQUEST_BODY_SIZE_IN_BYTES;
		this.requestReadBufferSizeInBytes = builder.requestReadBufferSizeInBytes != null ? builder.requestReadBufferSizeInBytes : DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
		this.keepAliveConnectionLimit = builder.keepAliveConnectionLimit != null ? builder.keepAliveConnectionLimit : DEFAULT_KEEP_ALIVE_CONNECTION_LIMIT;
		this.protocol = builder.protocol != null ? builder.protocol : DEFAULT_PROTOCOL;
		this.serverName = builder.serverName != null ? builder.serverName : DEFAULT_SERVER_NAME;
		this.tcpNoDelay = builder.tcpNoDelay != null ? builder.tcpNoDelay : DEFAULT_TCP_NO_DELAY;
		this.reusePort = builder.reusePort != null ? builder.reusePort : DEFAULT_REUSE_PORT;
		this.peerCredentialsEnabled = builder.peerCredentialsEnabled != null ? builder.peerCredentialsEnabled : DEFAULT_PEER_CREDENTIALS_ENABLED;
		this.proxyMode = builder.proxyMode != null ? builder.proxyMode : DEFAULT_PROXY_MODE;
		this.strictMode = builder.strictMode != null ? builder.strictMode : DEFAULT_STRICT_MODE;
		this.headerPolicy = builder.headerPolicy != null ? builder.headerPolicy : HeaderPolicy.defaultInstance();
		this.tlsAdapter = builder.tlsAdapter;
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.statisticsRegistry = builder.statisticsRegistry;
		this.statisticsName = format("%s@%s", this.serverName, Integer.toHexString(System.identityHashCode(this)));

		if (!PROTOCOL_PATTERN.matcher(this.protocol).matches())
			throw new IllegalArgumentException(format("Unsupported protocol '%s', must be HTTP/1.0 or HTTP/1.1", this.protocol));

		this.protocolVersion = new int[]{this.protocol.charAt(5) - '0', this.protocol.charAt(7) - '0'};

		if (this.minimumThreads < 1)
			throw new IllegalArgumentException(format("Minimum thread count must be > 0, was %d", this.minimumThreads));

		if (this.maximumThreads != null && this.maximumThreads < this.minimumThreads)
			throw new IllegalArgumentException(format("Maximum thread count %d must be >= minimum thread count %d", this.maximumThreads, this.minimumThreads));

		requirePositive("Connection timeout", this.connectionTimeout);
		requirePositive("Expiration interval", this.expirationInterval);
		requireNonNegative("Accepted queue timeout", this.acceptedQueueTimeout);
		requireNonNegative("Shutdown timeout", this.shutdownTimeout);

		if (this.maximumRequestHeaderSizeInBytes < 0 || this.maximumRequestBodySizeInBytes < 0)
			throw new IllegalArgumentException("Request size ceilings must be >= 0");

		if (this.requestReadBufferSizeInBytes < 1)
			throw new IllegalArgumentException(format("Request read buffer size must be > 0, was %d", this.requestReadBufferSizeInBytes));
	}

	private static void requirePositive(@NonNull String name,
																			@NonNull Duration duration) {
		if (duration.isZero() || duration.isNegative())
			throw new IllegalArgumentException(format("%s must be > 0, was %s", name, duration));
	}

	private static void requireNonNegative(@NonNull String name,
																				 @NonNull Duration duration) {
		if (duration.isNegative())
			throw new IllegalArgumentException(format("%s must be >= 0, was %s", name, duration));
	}

	@Override
	public void prepare() {
		getLock().lock();

		try {
			if (isReady())
				return;

			if (getGateway().isEmpty())
				throw new IllegalStateException(format("No %s was configured", Gateway.class.getSimpleName()));

			this.interrupt.set(null);
			this.stoppingForInterrupt = false;

			safelyNotify("willStartServer", null, (lifecycleObserver) -> lifecycleObserver.willStartServer(this));

			ServerSocketChannel serverSocketChannel = null;
			ConnectionManager connectionManager = null;

			try {
				serverSocketChannel = bindServerSocketChannel();

				if (this.tlsAdapter != null)
					serverSocketChannel = this.tlsAdapter.bind(serverSocketChannel);

				serverSocketChannel.configureBlocking(false);
				this.serverSocketChannel = serverSocketChannel;
				this.bindAddress = resolveBoundAddress(serverSocketChannel);

				connectionManager = new ConnectionManager(this, serverSocketChannel);
				WorkerPool workerPool = new WorkerPool(this, this.minimumThreads, this.maximumThreads, this.acceptedQueueSize, this.acceptedQueueTimeout);

				this.connectionManager = connectionManager;
				this.workerPool = workerPool;

				workerPool.start();
			} catch (BindException e) {
				cleanupFailedPrepare(serverSocketChannel, connectionManager);
				UncheckedIOException exception = new UncheckedIOException(format("Stogie was unable to start the HTTP server - %s is already in use.", this.configuredBindAddress), e);
				safelyNotify("didFailToStartServer", null, (lifecycleObserver) -> lifecycleObserver.didFailToStartServer(this, exception));
				throw exception;
			} catch (IOException e) {
				cleanupFailedPrepare(serverSocketChannel, connectionManager);
				UncheckedIOException exception = new UncheckedIOException(e);
				safelyNotify("didFailToStartServer", null, (lifecycleObserver) -> lifecycleObserver.didFailToStartServer(this, exception));
				throw exception;
			} catch (RuntimeException e) {
				cleanupFailedPrepare(serverSocketChannel, connectionManager);
				safelyNotify("didFailToStartServer", null, (lifecycleObserver) -> lifecycleObserver.didFailToStartServer(this, e));
				throw e;
			}

			this.runStartedNanos = System.nanoTime();
			this.ready = true;

			if (this.statisticsRegistry != null)
				this.statisticsRegistry.register(getStatisticsName(), this::getStatistics);

			safelyNotify("didStartServer", null, (lifecycleObserver) -> lifecycleObserver.didStartServer(this));
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void serve() {
		if (!isReady())
			throw new IllegalStateException("Server is not prepared, call prepare() first");

		while (isReady() && !this.stoppingForInterrupt && this.interrupt.get() == null) {
			ConnectionManager connectionManager = this.connectionManager;

			if (connectionManager == null)
				break;

			try {
				connectionManager.run(getExpirationInterval());
			} catch (ServerInterruptException e) {
				interrupt(e);
			} catch (IOException | RuntimeException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Error in serve loop")
						.throwable(e)
						.build());
			}
		}

		if (this.stoppingForInterrupt || this.interrupt.get() != null) {
			// Let the interrupting thread finish stopping before re-throwing on this one
			while (this.stoppingForInterrupt) {
				try {
					Thread.sleep(INTERRUPT_POLL_INTERVAL.toMillis());
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					break;
				}
			}

			ServerInterruptException interrupt = this.interrupt.get();

			if (interrupt != null)
				throw interrupt;
		}
	}

	@Override
	public void safeStart() {
		Thread shutdownHook = createShutdownHook();
		Runtime.getRuntime().addShutdownHook(shutdownHook);

		try {
			start();
		} catch (ServerInterruptException e) {
			if (e.getReason() == Reason.FATAL_ERROR)
				throw e;

			safelyLog(LogEvent.with(LogEventType.SERVER_INTERRUPTED, format("Server stopped: %s", e.getMessage()))
					.throwable(e)
					.build());
		} finally {
			stop();
			removeShutdownHook(shutdownHook);
		}
	}

	/**
	 * Ctrl-C, SIGTERM and {@link System#exit(int)} all reach the server as a JVM shutdown, which this hook turns into a {@link Reason#SIGNAL} interrupt.
	 */
	@NonNull
	Thread createShutdownHook() {
		return new Thread(() -> interrupt(new ServerInterruptException(Reason.SIGNAL, "JVM is shutting down")),
				"stogie-shutdown-hook");
	}

	private void removeShutdownHook(@NonNull Thread shutdownHook) {
		requireNonNull(shutdownHook);

		try {
			Runtime.getRuntime().removeShutdownHook(shutdownHook);
		} catch (IllegalStateException e) {
			// The hook is already running, or has already stopped this server
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERRUPTED, "JVM is shutting down, leaving shutdown hook in place")
					.throwable(e)
					.build());
		}
	}

	@Override
	public void stop() {
		ServerSocketChannel serverSocketChannel;
		ConnectionManager connectionManager;
		WorkerPool workerPool;

		// Tear down outside the lock so a worker thread that calls interrupt() while we wait for it can't deadlock us
		getLock().lock();

		try {
			if (!isReady())
				return;

			safelyNotify("willStopServer", null, (lifecycleObserver) -> lifecycleObserver.willStopServer(this));

			this.ready = false;
			this.accumulatedRunTimeNanos += System.nanoTime() - this.runStartedNanos;
			this.runStartedNanos = 0;

			serverSocketChannel = this.serverSocketChannel;
			connectionManager = this.connectionManager;
			workerPool = this.workerPool;
		} finally {
			getLock().unlock();
		}

		if (connectionManager != null)
			connectionManager.stop();

		if (serverSocketChannel != null) {
			try {
				serverSocketChannel.close();
			} catch (IOException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to close listening socket")
						.throwable(e)
						.build());
			}
		}

		if (connectionManager != null)
			connectionManager.close();

		if (workerPool != null)
			workerPool.stop(getShutdownTimeout());

		if (this.statisticsRegistry != null)
			this.statisticsRegistry.unregister(getStatisticsName());

		safelyNotify("didStopServer", null, (lifecycleObserver) -> lifecycleObserver.didStopServer(this));
	}

	@Override
	public void interrupt(@NonNull ServerInterruptException interrupt) {
		requireNonNull(interrupt);

		this.stoppingForInterrupt = true;

		try {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERRUPTED, format("%s: shutting down", describe(interrupt.getReason())))
					.throwable(interrupt)
					.build());

			stop();
			this.interrupt.set(interrupt);
		} finally {
			this.stoppingForInterrupt = false;
		}
	}

	@NonNull
	private String describe(@NonNull Reason reason) {
		if (reason == Reason.SIGNAL)
			return "Received shutdown signal";
		if (reason == Reason.SHUTDOWN_REQUESTED)
			return "Shutdown requested";

		return "Fatal error on worker thread";
	}

	@NonNull
	protected ServerSocketChannel bindServerSocketChannel() throws IOException {
		BindAddress bindAddress = this.configuredBindAddress;

		if (bindAddress.getType() == BindAddress.Type.INHERITED || isSocketActivated())
			return inheritedServerSocketChannel();

		if (bindAddress.getType() == BindAddress.Type.UNIX && bindAddress.isAbstractNamespace())
			return bindAbstractUnixServerSocketChannel(bindAddress.getAbstractName().orElseThrow());

		if (bindAddress.getType() == BindAddress.Type.UNIX)
			return bindUnixServerSocketChannel(bindAddress.getPath().orElseThrow());

		return bindTcpServerSocketChannel(bindAddress.getHost().orElseThrow(), bindAddress.getPort().orElseThrow(), bindAddress.isEphemeral());
	}

	protected boolean isSocketActivated() {
		String listenPid = System.getenv("LISTEN_PID");
		return listenPid != null && listenPid.trim().equals(String.valueOf(ProcessHandle.current().pid()));
	}

	@NonNull
	protected ServerSocketChannel inheritedServerSocketChannel() throws IOException {
		Channel channel = System.inheritedChannel();

		if (!(channel instanceof ServerSocketChannel))
			throw new IOException(format("No inherited listening socket is available (inherited channel is %s)", channel));

		return (ServerSocketChannel) channel;
	}

	@NonNull
	protected ServerSocketChannel bindUnixServerSocketChannel(@NonNull Path path) throws IOException {
		requireNonNull(path);

		// A stale socket file from a previous run would make bind fail
		Files.deleteIfExists(path);

		ServerSocketChannel serverSocketChannel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);

		try {
			serverSocketChannel.bind(UnixDomainSocketAddress.of(path), this.socketPendingConnectionLimit);
		} catch (IOException | RuntimeException e) {
			closeAfterFailedBind(serverSocketChannel);
			throw e;
		}

		// Let any local user connect
		try {
			Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rwxrwxrwx"));
		} catch (IOException | UnsupportedOperationException e) {
			safelyLog(LogEvent.with(LogEventType.CONFIGURATION_UNSUPPORTED, format("Unable to open up permissions on UNIX socket %s", path))
					.throwable(e)
					.build());
		}

		return serverSocketChannel;
	}

	/**
	 * Binds a Linux abstract-namespace socket.  The JDK cannot address these, so the channel comes from junixsocket and
	 * carries its own {@link java.nio.channels.spi.SelectorProvider}.
	 */
	@NonNull
	protected ServerSocketChannel bindAbstractUnixServerSocketChannel(@NonNull String abstractName) throws IOException {
		requireNonNull(abstractName);

		AFUNIXServerSocketChannel serverSocketChannel = AFUNIXServerSocketChannel.open();

		try {
			serverSocketChannel.bind(AFUNIXSocketAddress.inAbstractNamespace(abstractName), this.socketPendingConnectionLimit);
		} catch (IOException | RuntimeException e) {
			closeAfterFailedBind(serverSocketChannel);
			throw e;
		}

		return serverSocketChannel;
	}

	@NonNull
	protected ServerSocketChannel bindTcpServerSocketChannel(@NonNull String host,
																													 @NonNull Integer port,
																													 @NonNull Boolean ephemeral) throws IOException {
		requireNonNull(host);
		requireNonNull(port);
		requireNonNull(ephemeral);

		IOException lastFailure = null;

		// Try each resolved address in turn, e.g. IPv6 then IPv4 for "localhost"
		for (InetAddress address : InetAddress.getAllByName(host)) {
			ServerSocketChannel serverSocketChannel = ServerSocketChannel.open(address instanceof Inet6Address ? StandardProtocolFamily.INET6 : StandardProtocolFamily.INET);

			try {
				if (!ephemeral)
					serverSocketChannel.setOption(StandardSocketOptions.SO_REUSEADDR, true);

				if (this.reusePort) {
					if (!serverSocketChannel.supportedOptions().contains(StandardSocketOptions.SO_REUSEPORT))
						throw new IllegalArgumentException("SO_REUSEPORT is not supported on this platform");

					serverSocketChannel.setOption(StandardSocketOptions.SO_REUSEPORT, true);
				}

				serverSocketChannel.bind(new InetSocketAddress(address, port), this.socketPendingConnectionLimit);
				return serverSocketChannel;
			} catch (IOException e) {
				closeAfterFailedBind(serverSocketChannel);
				lastFailure = e;
			} catch (RuntimeException e) {
				closeAfterFailedBind(serverSocketChannel);
				throw e;
			}
		}

		throw lastFailure != null ? lastFailure : new IOException(format("Host '%s' did not resolve to any address", host));
	}

	@NonNull
	protected BindAddress resolveBoundAddress(@NonNull ServerSocketChannel serverSocketChannel) throws IOException {
		requireNonNull(serverSocketChannel);

		SocketAddress localAddress = serverSocketChannel.getLocalAddress();

		if (this.configuredBindAddress.getType() == BindAddress.Type.TCP && !this.configuredBindAddress.isEphemeral() && !isSocketActivated())
			return this.configuredBindAddress;

		// junixsocket addresses are InetSocketAddress subclasses
		if (localAddress instanceof AFUNIXSocketAddress)
			return this.configuredBindAddress;

		if (localAddress instanceof InetSocketAddress inetSocketAddress)
			return BindAddress.withHostAndPort(inetSocketAddress.getAddress().getHostAddress(), inetSocketAddress.getPort());

		if (localAddress instanceof UnixDomainSocketAddress unixDomainSocketAddress && unixDomainSocketAddress.getPath().toString().length() > 0)
			return BindAddress.withPath(unixDomainSocketAddress.getPath());

		return this.configuredBindAddress;
	}

	private void closeAfterFailedBind(@NonNull ServerSocketChannel serverSocketChannel) {
		try {
			serverSocketChannel.close();
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to close listening socket after failed bind")
					.throwable(e)
					.build());
		}
	}

	private void cleanupFailedPrepare(@Nullable ServerSocketChannel serverSocketChannel,
																		@Nullable ConnectionManager connectionManager) {
		WorkerPool workerPool = this.workerPool;

		if (workerPool != null)
			workerPool.stop(Duration.ofMillis(100));

		if (connectionManager != null)
			connectionManager.close();

		if (serverSocketChannel != null)
			closeAfterFailedBind(serverSocketChannel);

		this.serverSocketChannel = null;
		this.connectionManager = null;
		this.workerPool = null;
		this.bindAddress = this.configuredBindAddress;
	}

	/**
	 * Hands a connection with a request waiting on it to the worker pool, dropping it if the pool's queue stays full.
	 */
	void processConnection(@NonNull HttpConnection connection) {
		requireNonNull(connection);

		WorkerPool workerPool = this.workerPool;

		if (workerPool != null && workerPool.put(connection))
			return;

		if (workerPool != null)
			safelyLog(LogEvent.with(LogEventType.WORKER_QUEUE_FULL, format("Worker queue full, dropping connection %s", connection))
					.connection(connection)
					.build());

		connection.close();
	}

	/**
	 * Takes back a kept-alive connection from a worker, or closes it if the server is stopping.
	 */
	void putConnection(@NonNull HttpConnection connection) {
		requireNonNull(connection);

		ConnectionManager connectionManager = this.connectionManager;

		if (isReady() && connectionManager != null)
			connectionManager.put(connection);
		else
			connection.close();
	}

	/**
	 * Is there room for one more idle kept-alive connection?
	 */
	@NonNull
	Boolean canAddKeepAliveConnection() {
		if (this.keepAliveConnectionLimit <= 0)
			return true;

		ConnectionManager connectionManager = this.connectionManager;
		return connectionManager != null && connectionManager.getIdleConnectionCount() < this.keepAliveConnectionLimit;
	}

	void incrementAccepts() {
		this.accepts.incrementAndGet();
	}

	void incrementSocketErrors() {
		this.socketErrors.incrementAndGet();
	}

	void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The LifecycleObserver implementation errored out, but we can't let that affect us - swallow its exception.
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	void safelyNotify(@NonNull String methodName,
										@Nullable HttpConnection connection,
										@NonNull Consumer<LifecycleObserver> invocation) {
		requireNonNull(methodName);
		requireNonNull(invocation);

		try {
			invocation.accept(getLifecycleObserver());
		} catch (Throwable throwable) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED,
							format("An exception occurred while invoking %s::%s", LifecycleObserver.class.getSimpleName(), methodName))
					.throwable(throwable)
					.connection(connection)
					.build());
		}
	}

	@Override
	@NonNull
	public ServerStatistics getStatistics() {
		WorkerPool workerPool = this.workerPool;

		return new ServerStatistics(
				getBindAddress(),
				isReady(),
				getRunTime(),
				this.accepts.get(),
				this.socketErrors.get(),
				workerPool == null ? 0 : workerPool.getQueueSize(),
				workerPool == null ? 0 : workerPool.getThreadCount(),
				workerPool == null ? 0 : workerPool.getIdle(),
				workerPool == null ? List.of() : workerPool.getWorkerStatistics());
	}

	@Override
	public void growWorkers(int amount) {
		if (amount < 0)
			throw new IllegalArgumentException(format("Amount must be >= 0, was %d", amount));

		getWorkerPool().ifPresent(workerPool -> workerPool.grow(amount));
	}

	@Override
	public void shrinkWorkers(int amount) {
		if (amount < 0)
			throw new IllegalArgumentException(format("Amount must be >= 0, was %d", amount));

		getWorkerPool().ifPresent(workerPool -> workerPool.shrink(amount));
	}

	@Override
	public void resetStatistics() {
		this.accepts.set(0);
		this.socketErrors.set(0);
		this.accumulatedRunTimeNanos = 0;

		if (this.runStartedNanos != 0)
			this.runStartedNanos = System.nanoTime();

		WorkerPool workerPool = this.workerPool;

		if (workerPool != null)
			workerPool.resetStatistics();
	}

	@NonNull
	protected Duration getRunTime() {
		long runStartedNanos = this.runStartedNanos;
		long runTimeNanos = this.accumulatedRunTimeNanos;

		if (runStartedNanos != 0)
			runTimeNanos += System.nanoTime() - runStartedNanos;

		return Duration.ofNanos(runTimeNanos);
	}

	@Override
	@NonNull
	public Boolean isReady() {
		return this.ready;
	}

	@Override
	@NonNull
	public Optional<ServerInterruptException> getInterrupt() {
		return Optional.ofNullable(this.interrupt.get());
	}

	@Override
	@NonNull
	public BindAddress getBindAddress() {
		return this.bindAddress;
	}

	@NonNull
	String getStatisticsName() {
		return this.statisticsName;
	}

	@NonNull
	Optional<WorkerPool> getWorkerPool() {
		return Optional.ofNullable(this.workerPool);
	}

	@NonNull
	Optional<ConnectionManager> getConnectionManager() {
		return Optional.ofNullable(this.connectionManager);
	}

	@NonNull
	Optional<Gateway> getGateway() {
		return Optional.ofNullable(this.gateway);
	}

	@NonNull
	Duration getConnectionTimeout() {
		return this.connectionTimeout;
	}

	@NonNull
	Duration getExpirationInterval() {
		return this.expirationInterval;
	}

	@NonNull
	Duration getShutdownTimeout() {
		return this.shutdownTimeout;
	}

	@NonNull
	Long getMaximumRequestHeaderSizeInBytes() {
		return this.maximumRequestHeaderSizeInBytes;
	}

	@NonNull
	Long getMaximumRequestBodySizeInBytes() {
		return this.maximumRequestBodySizeInBytes;
	}

	@NonNull
	Integer getRequestReadBufferSizeInBytes() {
		return this.requestReadBufferSizeInBytes;
	}

	@NonNull
	String getProtocol() {
		return this.protocol;
	}

	@NonNull
	int[] getProtocolVersion() {
		return this.protocolVersion.clone();
	}

	@NonNull
	String getServerName() {
		return this.serverName;
	}

	@NonNull
	Boolean getTcpNoDelay() {
		return this.tcpNoDelay;
	}

	@NonNull
	Boolean getPeerCredentialsEnabled() {
		return this.peerCredentialsEnabled;
	}

	@NonNull
	Boolean getProxyMode() {
		return this.proxyMode;
	}

	@NonNull
	Boolean getStrictMode() {
		return this.strictMode;
	}

	@NonNull
	HeaderPolicy getHeaderPolicy() {
		return this.headerPolicy;
	}

	@NonNull
	Optional<TlsAdapter> getTlsAdapter() {
		return Optional.ofNullable(this.tlsAdapter);
	}

	@NonNull
	LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}
}
