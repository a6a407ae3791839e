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

import javax.annotation.concurrent.NotThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ByteChannel;
import java.nio.channels.SelectableChannel;
import java.time.Duration;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Buffered read side of a connection's socket.
 * <p>
 * Reads go through {@code channel} (which may be a TLS-decrypting wrapper) and readiness waits go through {@code selectableChannel} (always the raw socket).
 * A read that finds no data waits up to the configured timeout and then fails with {@link java.net.SocketTimeoutException}.
 * <p>
 * Only the thread that currently owns the connection may read; {@link #getBytesRead()} may be sampled from any thread.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class SocketReader implements BodyReader {
	@NonNull
	private final ByteChannel channel;
	@NonNull
	private final SelectableChannel selectableChannel;
	@NonNull
	private final Duration timeout;
	@NonNull
	private final ByteBuffer buffer;
	private volatile long bytesRead;
	private boolean endOfStream;
	private boolean closed;

	public SocketReader(@NonNull ByteChannel channel,
											@NonNull SelectableChannel selectableChannel,
											@NonNull Duration timeout,
											int bufferSize) {
		requireNonNull(channel);
		requireNonNull(selectableChannel);
		requireNonNull(timeout);

		if (bufferSize <= 0)
			throw new IllegalArgumentException(format("Buffer size must be > 0, was %d", bufferSize));

		this.channel = channel;
		this.selectableChannel = selectableChannel;
		this.timeout = timeout;
		this.buffer = ByteBuffer.allocate(bufferSize);
		this.buffer.flip();
	}

	@Override
	@NonNull
	public byte[] read(int size) throws IOException {
		if (size == 0)
			return new byte[0];

		ByteArrayOutputStream outputStream = new ByteArrayOutputStream(size > 0 ? Math.min(size, getBuffer().capacity()) : getBuffer().capacity());

		while (size < 0 || outputStream.size() < size) {
			if (!getBuffer().hasRemaining() && !fill())
				break;

			int count = getBuffer().remaining();

			if (size > 0)
				count = Math.min(count, size - outputStream.size());

			outputStream.write(getBuffer().array(), getBuffer().position(), count);
			getBuffer().position(getBuffer().position() + count);
		}

		return outputStream.toByteArray();
	}

	@Override
	@NonNull
	public byte[] readLine(int size) throws IOException {
		if (size == 0)
			return new byte[0];

		ByteArrayOutputStream outputStream = new ByteArrayOutputStream(128);

		while (size < 0 || outputStream.size() < size) {
			if (!getBuffer().hasRemaining() && !fill())
				break;

			int start = getBuffer().position();
			int end = getBuffer().limit();

			if (size > 0)
				end = Math.min(end, start + size - outputStream.size());

			boolean foundLineFeed = false;
			int index = start;

			while (index < end) {
				if (getBuffer().get(index++) == '\n') {
					foundLineFeed = true;
					break;
				}
			}

			outputStream.write(getBuffer().array(), start, index - start);
			getBuffer().position(index);

			if (foundLineFeed)
				break;
		}

		return outputStream.toByteArray();
	}

	/**
	 * Does the read buffer hold bytes that have not been consumed yet?
	 *
	 * @return {@code true} if a read can be satisfied without touching the socket
	 */
	@NonNull
	public Boolean hasData() {
		return getBuffer().hasRemaining();
	}

	@NonNull
	public Long getBytesRead() {
		return this.bytesRead;
	}

	@NonNull
	public Boolean isClosed() {
		return this.closed;
	}

	@Override
	public void close() {
		this.closed = true;
		getBuffer().clear().flip();
	}

	// Returns false at EOF
	private boolean fill() throws IOException {
		if (this.closed || this.endOfStream)
			return false;

		ByteBuffer buffer = getBuffer();
		buffer.clear();

		try {
			while (true) {
				int count = getChannel().read(buffer);

				if (count > 0) {
					this.bytesRead += count;
					return true;
				}

				if (count < 0) {
					this.endOfStream = true;
					return false;
				}

				ChannelReadiness.awaitReadable(getSelectableChannel(), getTimeout());
			}
		} finally {
			buffer.flip();
		}
	}

	@NonNull
	protected ByteChannel getChannel() {
		return this.channel;
	}

	@NonNull
	protected SelectableChannel getSelectableChannel() {
		return this.selectableChannel;
	}

	@NonNull
	protected Duration getTimeout() {
		return this.timeout;
	}

	@NonNull
	protected ByteBuffer getBuffer() {
		return this.buffer;
	}
}
