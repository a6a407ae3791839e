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

import com.stogie.exception.FatalTlsAlertException;
import com.stogie.exception.NoTlsException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.StandardSocketOptions;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Watches the listening socket and all idle kept-alive connections with a single {@link Selector}.
 * <p>
 * New connections are accepted and handed straight to the worker pool.  When a worker is done with a kept-alive connection it comes back here via {@link #put(HttpConnection)}
 * and waits for its next request; once readable it is dispatched to the pool again, and if it stays silent past the server's timeout it is closed.
 * <p>
 * A connection's selection key stays registered for its whole life.  Its interest set is {@link SelectionKey#OP_READ} while it is idle here
 * and empty while a worker owns it, so the selector never reports a connection a worker is using.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class ConnectionManager {
	@NonNull
	private static final Duration STOP_POLL_INTERVAL;

	static {
		STOP_POLL_INTERVAL = Duration.ofMillis(10);
	}

	@NonNull
	private final DefaultServer server;
	@NonNull
	private final ServerSocketChannel serverSocketChannel;
	@NonNull
	private final Selector selector;
	@NonNull
	private final SelectionKey serverSelectionKey;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final Set<HttpConnection> idleConnections;
	@NonNull
	private final AtomicBoolean stopRequested;
	private volatile boolean running;
	@Nullable
	private volatile Thread runThread;
	private boolean closed;

	ConnectionManager(@NonNull DefaultServer server,
										@NonNull ServerSocketChannel serverSocketChannel) throws IOException {
		requireNonNull(server);
		requireNonNull(serverSocketChannel);

		this.server = server;
		this.serverSocketChannel = serverSocketChannel;
		// Accepted channels share the listening channel's provider, which is not the JDK's for abstract UNIX sockets
		this.selector = serverSocketChannel.provider().openSelector();
		this.lock = new ReentrantLock();
		this.idleConnections = new LinkedHashSet<>();
		this.stopRequested = new AtomicBoolean(false);

		try {
			serverSocketChannel.configureBlocking(false);
			this.serverSelectionKey = serverSocketChannel.register(this.selector, SelectionKey.OP_ACCEPT);
		} catch (IOException | RuntimeException e) {
			this.selector.close();
			throw e;
		}
	}

	/**
	 * Takes back a kept-alive connection from a worker.
	 * <p>
	 * If the next request's bytes are already buffered the connection goes straight back to the worker pool, since the socket itself may never become readable again.
	 *
	 * @param connection the connection to watch
	 */
	void put(@NonNull HttpConnection connection) {
		requireNonNull(connection);

		if (connection.getReader().hasData()) {
			getServer().processConnection(connection);
			return;
		}

		boolean rejected = false;

		getLock().lock();

		try {
			if (this.closed) {
				rejected = true;
			} else {
				connection.setLastUsedNanos(System.nanoTime());

				SocketChannel socketChannel = connection.getSocketChannel();
				SelectionKey selectionKey = socketChannel.keyFor(getSelector());

				if (selectionKey == null)
					socketChannel.register(getSelector(), SelectionKey.OP_READ, connection);
				else
					selectionKey.interestOps(SelectionKey.OP_READ);

				this.idleConnections.add(connection);
			}
		} catch (ClosedChannelException | CancelledKeyException | ClosedSelectorException e) {
			rejected = true;
		} finally {
			getLock().unlock();
		}

		if (rejected)
			connection.close();
		else
			getSelector().wakeup();
	}

	/**
	 * Runs the accept/dispatch/expire loop on the calling thread until {@link #stop()} is called.
	 *
	 * @param expirationInterval how often to look for idle connections that have timed out; also the selector poll timeout
	 * @throws IOException if accepting fails in a way that isn't a normal part of socket life
	 */
	void run(@NonNull Duration expirationInterval) throws IOException {
		requireNonNull(expirationInterval);

		this.running = true;
		this.runThread = Thread.currentThread();

		try {
			long pollMillis = Math.max(1L, expirationInterval.toMillis());
			long lastExpirationCheckNanos = System.nanoTime();

			while (!this.stopRequested.get()) {
				try {
					getSelector().select(pollMillis);
				} catch (ClosedSelectorException e) {
					return;
				} catch (IOException e) {
					getServer().safelyLog(LogEvent.with(LogEventType.CONNECTION_MANAGER_SELECT_FAILED, "Selector failed, evicting broken connections")
							.throwable(e)
							.build());
					removeInvalidConnections();
					continue;
				}

				Iterator<SelectionKey> iterator = getSelector().selectedKeys().iterator();

				while (iterator.hasNext()) {
					SelectionKey selectionKey = iterator.next();
					iterator.remove();

					if (!selectionKey.isValid())
						continue;

					if (selectionKey == this.serverSelectionKey) {
						HttpConnection connection = acceptConnection();

						if (connection != null)
							getServer().processConnection(connection);
					} else if (selectionKey.attachment() instanceof HttpConnection connection) {
						dispatch(selectionKey, connection);
					}
				}

				long nowNanos = System.nanoTime();

				if (nowNanos - lastExpirationCheckNanos >= expirationInterval.toNanos()) {
					expire(nowNanos);
					lastExpirationCheckNanos = nowNanos;
				}
			}
		} finally {
			this.running = false;
			this.runThread = null;
		}
	}

	protected void dispatch(@NonNull SelectionKey selectionKey,
													@NonNull HttpConnection connection) {
		requireNonNull(selectionKey);
		requireNonNull(connection);

		boolean owned;
		boolean cancelled = false;

		getLock().lock();

		try {
			owned = this.idleConnections.remove(connection);

			if (owned)
				selectionKey.interestOps(0);
		} catch (CancelledKeyException e) {
			// Closed underneath us
			owned = false;
			cancelled = true;
		} finally {
			getLock().unlock();
		}

		if (cancelled)
			connection.close();
		else if (owned)
			getServer().processConnection(connection);
	}

	@Nullable
	protected HttpConnection acceptConnection() throws IOException {
		SocketChannel socketChannel;

		try {
			socketChannel = getServerSocketChannel().accept();
		} catch (IOException e) {
			getServer().incrementSocketErrors();

			if (TransportErrors.classify(e) == TransportErrorKind.UNEXPECTED)
				throw e;

			getServer().safelyLog(LogEvent.with(LogEventType.CONNECTION_ACCEPT_FAILED, "Unable to accept connection")
					.throwable(e)
					.build());
			return null;
		}

		// Another accept already took it
		if (socketChannel == null)
			return null;

		getServer().incrementAccepts();

		try {
			socketChannel.configureBlocking(false);

			if (getServer().getTcpNoDelay() && socketChannel.supportedOptions().contains(StandardSocketOptions.TCP_NODELAY))
				socketChannel.setOption(StandardSocketOptions.TCP_NODELAY, true);

			TlsAdapter tlsAdapter = getServer().getTlsAdapter().orElse(null);
			TlsWrapResult tlsWrapResult = null;

			if (tlsAdapter != null) {
				try {
					tlsWrapResult = tlsAdapter.wrap(socketChannel);
				} catch (NoTlsException e) {
					rejectPlaintextConnection(socketChannel);
					return null;
				}

				if (tlsWrapResult.channel() == null) {
					closeChannel(socketChannel);
					return null;
				}
			}

			HttpConnection connection = new HttpConnection(getServer(), socketChannel, tlsWrapResult);
			getServer().safelyNotify("didAcceptConnection", connection, (lifecycleObserver) -> lifecycleObserver.didAcceptConnection(connection));
			return connection;
		} catch (IOException e) {
			getServer().incrementSocketErrors();

			LogEventType logEventType = LogEventType.CONNECTION_SOCKET_ERROR;

			if (e instanceof FatalTlsAlertException || e instanceof SSLException)
				logEventType = LogEventType.CONNECTION_TLS_FAILED;
			else if (TransportErrors.isIgnorable(e))
				logEventType = LogEventType.CONNECTION_ACCEPT_FAILED;

			getServer().safelyLog(LogEvent.with(logEventType, "Unable to set up accepted connection")
					.throwable(e)
					.build());

			closeChannel(socketChannel);
			return null;
		}
	}

	protected void rejectPlaintextConnection(@NonNull SocketChannel socketChannel) throws IOException {
		requireNonNull(socketChannel);

		HttpConnection connection = new HttpConnection(getServer(), socketChannel, null);
		connection.handleNoTls(new HttpRequest(connection));
		connection.close();
	}

	protected void expire(long nowNanos) {
		long timeoutNanos = getServer().getConnectionTimeout().toNanos();
		List<HttpConnection> expiredConnections = new ArrayList<>();

		getLock().lock();

		try {
			Iterator<HttpConnection> iterator = this.idleConnections.iterator();

			while (iterator.hasNext()) {
				HttpConnection connection = iterator.next();

				if (nowNanos - connection.getLastUsedNanos() > timeoutNanos) {
					iterator.remove();
					expiredConnections.add(connection);
				}
			}
		} finally {
			getLock().unlock();
		}

		// Closing the channel cancels its key
		for (HttpConnection connection : expiredConnections)
			connection.close();
	}

	protected void removeInvalidConnections() {
		List<HttpConnection> invalidConnections = new ArrayList<>();

		getLock().lock();

		try {
			Iterator<HttpConnection> iterator = this.idleConnections.iterator();

			while (iterator.hasNext()) {
				HttpConnection connection = iterator.next();
				SelectionKey selectionKey = connection.getSocketChannel().keyFor(getSelector());

				if (!connection.getSocketChannel().isOpen() || selectionKey == null || !selectionKey.isValid()) {
					iterator.remove();
					invalidConnections.add(connection);
				}
			}
		} finally {
			getLock().unlock();
		}

		for (HttpConnection connection : invalidConnections)
			connection.close();
	}

	/**
	 * Asks the loop in {@link #run(Duration)} to exit and waits until it has.
	 */
	void stop() {
		this.stopRequested.set(true);
		getSelector().wakeup();

		// Called from inside run(), which exits as soon as it returns here
		if (Thread.currentThread() == this.runThread)
			return;

		while (this.running) {
			try {
				Thread.sleep(STOP_POLL_INTERVAL.toMillis());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				break;
			}
		}
	}

	/**
	 * Closes every idle connection and the selector.  Connections currently owned by workers are left to them.
	 */
	void close() {
		List<HttpConnection> connections;

		getLock().lock();

		try {
			this.closed = true;
			connections = new ArrayList<>(this.idleConnections);
			this.idleConnections.clear();
		} finally {
			getLock().unlock();
		}

		for (HttpConnection connection : connections)
			connection.close();

		try {
			getSelector().close();
		} catch (IOException e) {
			getServer().safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to close connection manager selector")
					.throwable(e)
					.build());
		}
	}

	@NonNull
	Integer getIdleConnectionCount() {
		getLock().lock();

		try {
			return this.idleConnections.size();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	Boolean isRunning() {
		return this.running;
	}

	private void closeChannel(@NonNull SocketChannel socketChannel) {
		try {
			socketChannel.close();
		} catch (IOException e) {
			getServer().safelyLog(LogEvent.with(LogEventType.CONNECTION_CLOSE_FAILED, format("Unable to close socket %s", socketChannel))
					.throwable(e)
					.build());
		}
	}

	@NonNull
	private DefaultServer getServer() {
		return this.server;
	}

	@NonNull
	private ServerSocketChannel getServerSocketChannel() {
		return this.serverSocketChannel;
	}

	@NonNull
	private Selector getSelector() {
		return this.selector;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}
}
