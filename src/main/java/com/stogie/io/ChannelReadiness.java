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

package com.stogie.io;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SelectableChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.spi.SelectorProvider;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Blocks the calling thread until a non-blocking channel is ready, or a timeout elapses.
 * <p>
 * Channels owned by a connection stay in non-blocking mode for their whole life so they can be handed back and forth to the connection manager's selector.
 * Worker threads get blocking-with-timeout semantics by registering the channel with a private, per-thread selector for the duration of one wait.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ChannelReadiness {
	@NonNull
	private static final ThreadLocal<Map<SelectorProvider, Selector>> SELECTORS;

	static {
		SELECTORS = ThreadLocal.withInitial(HashMap::new);
	}

	private ChannelReadiness() {
		// Non-instantiable
	}

	/**
	 * Waits until {@code channel} is readable.
	 *
	 * @param channel the channel to wait on
	 * @param timeout how long to wait, {@link Duration#ZERO} meaning forever
	 * @throws SocketTimeoutException if the channel did not become readable in time
	 * @throws IOException            if the channel was closed or the selector failed
	 */
	public static void awaitReadable(@NonNull SelectableChannel channel,
																	 @NonNull Duration timeout) throws IOException {
		await(channel, SelectionKey.OP_READ, timeout);
	}

	/**
	 * Waits until {@code channel} is writable.
	 *
	 * @param channel the channel to wait on
	 * @param timeout how long to wait, {@link Duration#ZERO} meaning forever
	 * @throws SocketTimeoutException if the channel did not become writable in time
	 * @throws IOException            if the channel was closed or the selector failed
	 */
	public static void awaitWritable(@NonNull SelectableChannel channel,
																	 @NonNull Duration timeout) throws IOException {
		await(channel, SelectionKey.OP_WRITE, timeout);
	}

	private static void await(@NonNull SelectableChannel channel,
														int interestOps,
														@NonNull Duration timeout) throws IOException {
		requireNonNull(channel);
		requireNonNull(timeout);

		Selector selector = acquireSelector(channel.provider());
		SelectionKey selectionKey = channel.register(selector, interestOps);

		try {
			long timeoutMillis = timeout.toMillis();
			long deadlineNanos = System.nanoTime() + timeout.toNanos();

			while (true) {
				int readyCount;

				if (timeoutMillis <= 0) {
					readyCount = selector.select();
				} else {
					long remainingMillis = Math.max(1L, (deadlineNanos - System.nanoTime()) / 1_000_000L);
					readyCount = selector.select(remainingMillis);
				}

				if (readyCount > 0)
					return;

				if (Thread.currentThread().isInterrupted())
					throw new InterruptedIOException("Interrupted while waiting for channel readiness");

				if (!channel.isOpen())
					throw new ClosedChannelException();

				if (timeoutMillis > 0 && System.nanoTime() - deadlineNanos >= 0)
					throw new SocketTimeoutException("timed out");
			}
		} finally {
			selectionKey.cancel();
			// Flush the cancelled key so the channel can be registered again by the next wait
			selector.selectNow();
			selector.selectedKeys().clear();
		}
	}

	// A channel only registers with selectors from its own provider, e.g. junixsocket's for abstract UNIX sockets
	@NonNull
	private static Selector acquireSelector(@NonNull SelectorProvider selectorProvider) throws IOException {
		Map<SelectorProvider, Selector> selectors = SELECTORS.get();
		Selector selector = selectors.get(selectorProvider);

		if (selector == null || !selector.isOpen()) {
			selector = selectorProvider.openSelector();
			selectors.put(selectorProvider, selector);
		}

		return selector;
	}
}
