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

import com.stogie.io.SocketReader;
import com.stogie.io.SocketWriter;
import org.jspecify.annotations.NonNull;

import java.io.IOException;
import java.nio.channels.ByteChannel;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;

/**
 * Contract between Stogie and a TLS implementation.
 * <p>
 * Stogie never touches certificates or handshakes itself: it hands each accepted socket to {@link #wrap(SocketChannel)} and performs all further I/O
 * through the channel that comes back.
 * <p>
 * The wrapped channel must behave like a non-blocking channel: reads and writes may return {@code 0}, in which case Stogie waits for readiness on the raw socket and retries.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface TlsAdapter {
	/**
	 * Hook invoked once the listening socket is bound, before it starts accepting.
	 *
	 * @param serverSocketChannel the bound listening socket
	 * @return the listening socket to accept from, normally the same instance
	 * @throws IOException if the adapter cannot prepare the socket
	 */
	@NonNull
	default ServerSocketChannel bind(@NonNull ServerSocketChannel serverSocketChannel) throws IOException {
		return serverSocketChannel;
	}

	/**
	 * Performs (or prepares) the TLS handshake for a freshly accepted socket.
	 *
	 * @param socketChannel the raw, non-blocking socket
	 * @return the channel to perform HTTP I/O through plus TLS attributes, or a result with no channel to drop the connection silently
	 * @throws com.stogie.exception.NoTlsException         if the client sent plaintext HTTP
	 * @throws com.stogie.exception.FatalTlsAlertException if the handshake failed with a fatal alert
	 * @throws IOException                                  if the handshake failed otherwise
	 */
	@NonNull
	TlsWrapResult wrap(@NonNull SocketChannel socketChannel) throws IOException;

	/**
	 * Builds the read side of a wrapped connection.
	 */
	@NonNull
	default SocketReader makeReader(@NonNull SocketChannel socketChannel,
																	@NonNull ByteChannel wrappedChannel,
																	@NonNull Duration timeout,
																	int bufferSize) {
		return new SocketReader(wrappedChannel, socketChannel, timeout, bufferSize);
	}

	/**
	 * Builds the write side of a wrapped connection.
	 */
	@NonNull
	default SocketWriter makeWriter(@NonNull SocketChannel socketChannel,
																	@NonNull ByteChannel wrappedChannel,
																	@NonNull Duration timeout) {
		return new SocketWriter(wrappedChannel, socketChannel, timeout);
	}
}
