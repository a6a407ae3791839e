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
import com.stogie.exception.MalformedRequestException;
import com.stogie.exception.MaxSizeExceededException;
import com.stogie.exception.NoTlsException;
import com.stogie.exception.ServerInterruptException;
import com.stogie.io.SocketReader;
import com.stogie.io.SocketWriter;
import jdk.net.ExtendedSocketOptions;
import jdk.net.UnixDomainPrincipal;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ByteChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One accepted client socket plus its buffered reader and writer.
 * <p>
 * A connection is owned by exactly one party at a time: the connection manager while it sits idle between requests,
 * or a worker thread while {@link #communicate()} runs.  Ownership passes through the worker queue and the manager's registration table, which publish the connection safely.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class HttpConnection {
	private static final int LINGER_DRAIN_BUFFER_SIZE_IN_BYTES = 8_192;

	@NonNull
	private final DefaultServer server;
	@NonNull
	private final SocketChannel socketChannel;
	@NonNull
	private final ByteChannel channel;
	@NonNull
	private final SocketReader reader;
	@NonNull
	private final Map<String, String> tlsAttributes;
	@NonNull
	private final String scheme;
	@NonNull
	private final Instant createdAt;
	@Nullable
	private final SocketAddress remoteAddress;
	@Nullable
	private final SocketAddress localAddress;
	@Nullable
	private final UnixDomainPrincipal peerPrincipal;
	@NonNull
	private final AtomicBoolean closed;
	@NonNull
	private volatile SocketWriter writer;
	private volatile long lastUsedNanos;
	private volatile long requestsSeen;
	private volatile boolean linger;

	HttpConnection(@NonNull DefaultServer server,
								 @NonNull SocketChannel socketChannel,
								 @Nullable TlsWrapResult tlsWrapResult) throws IOException {
		requireNonNull(server);
		requireNonNull(socketChannel);

		Duration timeout = server.getConnectionTimeout();
		int bufferSize = server.getRequestReadBufferSizeInBytes();
		TlsAdapter tlsAdapter = server.getTlsAdapter().orElse(null);

		this.server = server;
		this.socketChannel = socketChannel;

		if (tlsAdapter != null && tlsWrapResult != null && tlsWrapResult.channel() != null) {
			this.channel = tlsWrapResult.channel();
			this.reader = tlsAdapter.makeReader(socketChannel, this.channel, timeout, bufferSize);
			this.writer = tlsAdapter.makeWriter(socketChannel, this.channel, timeout);
			this.tlsAttributes = tlsWrapResult.attributes();
			this.scheme = "https";
		} else {
			this.channel = socketChannel;
			this.reader = new SocketReader(socketChannel, socketChannel, timeout, bufferSize);
			this.writer = new SocketWriter(socketChannel, socketChannel, timeout);
			this.tlsAttributes = Map.of();
			this.scheme = tlsAdapter == null ? "http" : "https";
		}

		this.remoteAddress = socketChannel.getRemoteAddress();
		this.localAddress = socketChannel.getLocalAddress();
		this.peerPrincipal = server.getPeerCredentialsEnabled() && this.localAddress instanceof UnixDomainSocketAddress
				? resolvePeerPrincipal() : null;
		this.createdAt = Instant.now();
		this.lastUsedNanos = System.nanoTime();
		this.closed = new AtomicBoolean(false);
	}

	/**
	 * Reads one request from the socket and responds to it.
	 * <p>
	 * Every failure is handled here: timeouts get a 408 when a request was under way, malformed input a 400, unexpected failures are logged and get a best-effort 500.
	 * Only {@link ServerInterruptException} escapes.
	 *
	 * @return {@code true} if the connection should be kept open for another request, {@code false} if it should be closed
	 */
	@NonNull
	public Boolean communicate() {
		HttpRequest request = null;
		long requestsSeenBefore = this.requestsSeen;

		try {
			request = new HttpRequest(this);
			request.parseRequest();

			this.requestsSeen = requestsSeenBefore + 1;

			// Parse failures have already been answered
			if (!request.isReady())
				return false;

			request.respond();

			if (!request.getCloseConnection())
				return true;
		} catch (SocketTimeoutException e) {
			handleTimeout(request, requestsSeenBefore);
		} catch (FatalTlsAlertException e) {
			getServer().safelyLog(LogEvent.with(LogEventType.CONNECTION_TLS_FAILED, "Dropping connection after a fatal TLS alert")
					.throwable(e)
					.connection(this)
					.build());
		} catch (NoTlsException e) {
			handleNoTls(request);
		} catch (MaxSizeExceededException e) {
			conditionalError(request, StatusCode.HTTP_413.getStatusCode(), "The entity sent with the request exceeds the maximum allowed bytes.");
		} catch (IOException e) {
			TransportErrorKind transportErrorKind = TransportErrors.classify(e);

			if (transportErrorKind == TransportErrorKind.TIMEOUT) {
				handleTimeout(request, requestsSeenBefore);
			} else if (transportErrorKind == TransportErrorKind.UNEXPECTED) {
				getServer().safelyLog(LogEvent.with(LogEventType.CONNECTION_SOCKET_ERROR, format("Socket error while serving %s", describe()))
						.throwable(e)
						.connection(this)
						.request(request)
						.build());

				conditionalError(request, StatusCode.HTTP_500.getStatusCode(), "");
			}
		} catch (MalformedRequestException e) {
			conditionalError(request, StatusCode.HTTP_400.getStatusCode(), e.getMessage() == null ? "" : e.getMessage());
		} catch (ServerInterruptException e) {
			throw e;
		} catch (RuntimeException e) {
			getServer().safelyLog(LogEvent.with(LogEventType.REQUEST_PROCESSING_FAILED, format("An unexpected error occurred while processing a request from %s", describe()))
					.throwable(e)
					.connection(this)
					.request(request)
					.build());

			conditionalError(request, StatusCode.HTTP_500.getStatusCode(), "");
		}

		return false;
	}

	protected void handleTimeout(@Nullable HttpRequest request,
															 long requestsSeenBefore) {
		// Timing out between kept-alive requests is normal; only complain if the client owed us something
		if (requestsSeenBefore == 0 || (request != null && request.isStartedRequest()))
			conditionalError(request, StatusCode.HTTP_408.getStatusCode(), "");
	}

	/**
	 * Writes an error response unless the response has already started.
	 */
	protected void conditionalError(@Nullable HttpRequest request,
																	@NonNull Integer statusCode,
																	@NonNull String message) {
		requireNonNull(statusCode);
		requireNonNull(message);

		if (request == null || request.isSentHeaders())
			return;

		try {
			request.simpleResponse(statusCode, message);
		} catch (FatalTlsAlertException e) {
			getServer().safelyLog(LogEvent.with(LogEventType.CONNECTION_TLS_FAILED, "Fatal TLS alert while writing an error response")
					.throwable(e)
					.connection(this)
					.build());
		} catch (NoTlsException e) {
			handleNoTls(request);
		} catch (IOException e) {
			if (!TransportErrors.isIgnorable(e))
				getServer().safelyLog(LogEvent.with(LogEventType.CONNECTION_SOCKET_ERROR, format("Unable to write %d response to %s", statusCode, describe()))
						.throwable(e)
						.connection(this)
						.request(request)
						.build());
		}
	}

	/**
	 * Answers a plaintext client on a TLS port in plaintext, bypassing the TLS layer, and lingers so the client can read the answer.
	 */
	protected void handleNoTls(@Nullable HttpRequest request) {
		if (request == null || request.isSentHeaders())
			return;

		this.writer = new SocketWriter(getSocketChannel(), getSocketChannel(), getServer().getConnectionTimeout());

		try {
			request.noTlsResponse();
		} catch (IOException e) {
			if (!TransportErrors.isIgnorable(e))
				getServer().safelyLog(LogEvent.with(LogEventType.CONNECTION_SOCKET_ERROR, format("Unable to tell %s that this port requires TLS", describe()))
						.throwable(e)
						.connection(this)
						.build());
		}

		this.linger = true;
	}

	/**
	 * Closes the socket.  Safe to call more than once and from any thread; only the first call has an effect.
	 */
	public void close() {
		if (!this.closed.compareAndSet(false, true))
			return;

		getReader().close();
		getWriter().close();

		if (this.linger) {
			drainPendingInput();
		} else {
			try {
				getSocketChannel().shutdownOutput();
				getSocketChannel().shutdownInput();
			} catch (IOException e) {
				if (!TransportErrors.isAcceptableShutdownError(e))
					logCloseFailure(e);
			}
		}

		try {
			if (getChannel() != getSocketChannel())
				getChannel().close();
		} catch (IOException e) {
			logCloseFailure(e);
		}

		try {
			getSocketChannel().close();
		} catch (IOException e) {
			logCloseFailure(e);
		}

		getServer().safelyNotify("didCloseConnection", this,
				(lifecycleObserver) -> lifecycleObserver.didCloseConnection(this, Duration.between(getCreatedAt(), Instant.now())));
	}

	/**
	 * Shuts down the read side so a worker blocked reading from this connection wakes up.  Used when the server stops.
	 */
	void forceShutdownInput() {
		if (this.closed.get() || getReader().isClosed())
			return;

		try {
			getSocketChannel().shutdownInput();
		} catch (IOException e) {
			if (!TransportErrors.isAcceptableShutdownError(e))
				logCloseFailure(e);
		}
	}

	// Consume whatever the client already sent so closing doesn't provoke a reset that could destroy our response in flight
	private void drainPendingInput() {
		ByteBuffer buffer = ByteBuffer.allocate(LINGER_DRAIN_BUFFER_SIZE_IN_BYTES);

		try {
			while (getSocketChannel().read(buffer) > 0)
				buffer.clear();
		} catch (IOException e) {
			if (!TransportErrors.isIgnorable(e))
				logCloseFailure(e);
		}
	}

	private void logCloseFailure(@NonNull IOException e) {
		getServer().safelyLog(LogEvent.with(LogEventType.CONNECTION_CLOSE_FAILED, format("Unable to cleanly close %s", describe()))
				.throwable(e)
				.connection(this)
				.build());
	}

	@Nullable
	private UnixDomainPrincipal resolvePeerPrincipal() {
		try {
			return getSocketChannel().getOption(ExtendedSocketOptions.SO_PEERCRED);
		} catch (IOException | UnsupportedOperationException e) {
			getServer().safelyLog(LogEvent.with(LogEventType.CONFIGURATION_UNSUPPORTED, "Peer credentials are not available for this socket")
					.throwable(e)
					.build());
			return null;
		}
	}

	@NonNull
	private String describe() {
		return this.remoteAddress == null ? "client" : this.remoteAddress.toString();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{remoteAddress=%s, localAddress=%s, scheme=%s, requestsSeen=%d}", getClass().getSimpleName(),
				this.remoteAddress, this.localAddress, this.scheme, this.requestsSeen);
	}

	@NonNull
	protected DefaultServer getServer() {
		return this.server;
	}

	@NonNull
	public SocketChannel getSocketChannel() {
		return this.socketChannel;
	}

	@NonNull
	protected ByteChannel getChannel() {
		return this.channel;
	}

	@NonNull
	public SocketReader getReader() {
		return this.reader;
	}

	@NonNull
	public SocketWriter getWriter() {
		return this.writer;
	}

	/**
	 * TLS session attributes supplied by the {@link TlsAdapter}, empty for plaintext connections.
	 *
	 * @return the TLS attributes
	 */
	@NonNull
	public Map<String, String> getTlsAttributes() {
		return this.tlsAttributes;
	}

	@NonNull
	public String getScheme() {
		return this.scheme;
	}

	@NonNull
	public Optional<SocketAddress> getRemoteAddress() {
		return Optional.ofNullable(this.remoteAddress);
	}

	@NonNull
	public Optional<SocketAddress> getLocalAddress() {
		return Optional.ofNullable(this.localAddress);
	}

	/**
	 * The user and group of the process on the other end of a UNIX domain socket.
	 * <p>
	 * Only resolved when peer credential lookup is enabled on the server.
	 *
	 * @return the peer's credentials, if known
	 */
	@NonNull
	public Optional<UnixDomainPrincipal> getPeerPrincipal() {
		return Optional.ofNullable(this.peerPrincipal);
	}

	@NonNull
	public Instant getCreatedAt() {
		return this.createdAt;
	}

	@NonNull
	public Long getRequestsSeen() {
		return this.requestsSeen;
	}

	@NonNull
	public Boolean isClosed() {
		return this.closed.get();
	}

	@NonNull
	public Boolean isLingering() {
		return this.linger;
	}

	long getLastUsedNanos() {
		return this.lastUsedNanos;
	}

	void setLastUsedNanos(long lastUsedNanos) {
		this.lastUsedNanos = lastUsedNanos;
	}
}
