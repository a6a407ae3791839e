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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.EOFException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.NotYetConnectedException;
import java.util.List;
import java.util.Locale;

/**
 * Maps transport failures onto {@link TransportErrorKind}.
 * <p>
 * The JDK reports most socket errors as plain {@link java.io.IOException}s whose messages are the platform's {@code strerror} text,
 * so this class matches on exception type first and on message fragments second.  Every platform-specific string Stogie knows about lives here.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class TransportErrors {
	@NonNull
	private static final List<String> TIMEOUT_MESSAGE_FRAGMENTS;
	@NonNull
	private static final List<String> INTERRUPTED_MESSAGE_FRAGMENTS;
	@NonNull
	private static final List<String> WOULD_BLOCK_MESSAGE_FRAGMENTS;
	@NonNull
	private static final List<String> DISCONNECT_MESSAGE_FRAGMENTS;
	@NonNull
	private static final List<String> ACCEPTABLE_SHUTDOWN_MESSAGE_FRAGMENTS;

	static {
		TIMEOUT_MESSAGE_FRAGMENTS = List.of(
				"timed out",
				"connection timed out" // ETIMEDOUT
		);

		INTERRUPTED_MESSAGE_FRAGMENTS = List.of(
				"interrupted system call", // EINTR
				"interrupted function call" // WSAEINTR
		);

		WOULD_BLOCK_MESSAGE_FRAGMENTS = List.of(
				"resource temporarily unavailable", // EAGAIN/EWOULDBLOCK on Linux
				"operation would block", // EWOULDBLOCK on BSD/macOS
				"non-blocking socket operation could not be completed" // WSAEWOULDBLOCK
		);

		DISCONNECT_MESSAGE_FRAGMENTS = List.of(
				"broken pipe", // EPIPE
				"bad file descriptor", // EBADF
				"socket operation on non-socket", // ENOTSOCK
				"connection refused", // ECONNREFUSED
				"connection reset", // ECONNRESET
				"connection aborted", // ECONNABORTED
				"network dropped connection on reset", // ENETRESET
				"host is down", // EHOSTDOWN
				"no route to host", // EHOSTUNREACH
				"protocol wrong type for socket", // EPROTOTYPE, macOS writes racing a peer close
				"socket closed",
				"socket is closed",
				"stream closed",
				"an existing connection was forcibly closed", // WSAECONNRESET
				"an established connection was aborted" // WSAECONNABORTED
		);

		ACCEPTABLE_SHUTDOWN_MESSAGE_FRAGMENTS = List.of(
				"not connected", // ENOTCONN, "Socket is not connected" / "Transport endpoint is not connected"
				"bad file descriptor", // EBADF
				"invalid argument", // EINVAL, macOS shutdown() after the peer closed
				"connection reset", // ECONNRESET
				"socket closed",
				"socket is closed"
		);
	}

	private TransportErrors() {
		// Non-instantiable
	}

	/**
	 * Classifies a transport failure.
	 *
	 * @param throwable the failure, may be {@code null}
	 * @return the kind of failure
	 */
	@NonNull
	public static TransportErrorKind classify(@Nullable Throwable throwable) {
		if (throwable == null)
			return TransportErrorKind.UNEXPECTED;

		if (throwable instanceof SocketTimeoutException)
			return TransportErrorKind.TIMEOUT;

		if (throwable instanceof ClosedByInterruptException)
			return TransportErrorKind.INTERRUPTED;

		if (throwable instanceof ClosedChannelException
				|| throwable instanceof NotYetConnectedException
				|| throwable instanceof EOFException
				|| throwable instanceof ConnectException
				|| throwable instanceof NoRouteToHostException)
			return TransportErrorKind.EXPECTED_DISCONNECT;

		String message = lowercaseMessage(throwable);

		if (message != null) {
			if (containsAny(message, TIMEOUT_MESSAGE_FRAGMENTS))
				return TransportErrorKind.TIMEOUT;

			if (containsAny(message, INTERRUPTED_MESSAGE_FRAGMENTS))
				return TransportErrorKind.INTERRUPTED;

			if (containsAny(message, WOULD_BLOCK_MESSAGE_FRAGMENTS))
				return TransportErrorKind.WOULD_BLOCK;

			if (containsAny(message, DISCONNECT_MESSAGE_FRAGMENTS))
				return TransportErrorKind.EXPECTED_DISCONNECT;
		}

		if (throwable instanceof InterruptedIOException)
			return TransportErrorKind.INTERRUPTED;

		Throwable cause = throwable.getCause();

		if (cause != null && cause != throwable)
			return classify(cause);

		return TransportErrorKind.UNEXPECTED;
	}

	/**
	 * Should this failure be dropped without logging?  True for everything except {@link TransportErrorKind#UNEXPECTED}.
	 *
	 * @param throwable the failure, may be {@code null}
	 * @return {@code true} if the failure is an expected part of socket life
	 */
	@NonNull
	public static Boolean isIgnorable(@Nullable Throwable throwable) {
		return classify(throwable) != TransportErrorKind.UNEXPECTED;
	}

	/**
	 * Is this failure, thrown by a socket shutdown call, just a sign that the peer (or another thread) got there first?
	 *
	 * @param throwable the failure, may be {@code null}
	 * @return {@code true} if the shutdown failure can be ignored
	 */
	@NonNull
	public static Boolean isAcceptableShutdownError(@Nullable Throwable throwable) {
		if (throwable == null)
			return false;

		if (throwable instanceof ClosedChannelException || throwable instanceof NotYetConnectedException)
			return true;

		String message = lowercaseMessage(throwable);
		return message != null && containsAny(message, ACCEPTABLE_SHUTDOWN_MESSAGE_FRAGMENTS);
	}

	@Nullable
	private static String lowercaseMessage(@NonNull Throwable throwable) {
		String message = throwable.getMessage();
		return message == null ? null : message.toLowerCase(Locale.ROOT);
	}

	private static boolean containsAny(@NonNull String message,
																		 @NonNull List<String> fragments) {
		for (String fragment : fragments)
			if (message.contains(fragment))
				return true;

		return false;
	}
}
