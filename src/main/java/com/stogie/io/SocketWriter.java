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
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ByteChannel;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SelectableChannel;
import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Write side of a connection's socket.
 * <p>
 * Writes are unbuffered and complete: partial writes are retried, and a write that would block waits for the socket to drain (up to the configured timeout) before retrying the remainder.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class SocketWriter implements Closeable {
	@NonNull
	private final ByteChannel channel;
	@NonNull
	private final SelectableChannel selectableChannel;
	@NonNull
	private final Duration timeout;
	private volatile long bytesWritten;
	private boolean closed;

	public SocketWriter(@NonNull ByteChannel channel,
											@NonNull SelectableChannel selectableChannel,
											@NonNull Duration timeout) {
		requireNonNull(channel);
		requireNonNull(selectableChannel);
		requireNonNull(timeout);

		this.channel = channel;
		this.selectableChannel = selectableChannel;
		this.timeout = timeout;
	}

	public void write(@NonNull byte[] data) throws IOException {
		requireNonNull(data);
		write(data, 0, data.length);
	}

	public void write(@NonNull byte[] data,
										int offset,
										int length) throws IOException {
		requireNonNull(data);

		if (this.closed)
			throw new ClosedChannelException();

		ByteBuffer buffer = ByteBuffer.wrap(data, offset, length);

		while (buffer.hasRemaining()) {
			int count = getChannel().write(buffer);

			if (count > 0)
				this.bytesWritten += count;
			else
				ChannelReadiness.awaitWritable(getSelectableChannel(), getTimeout());
		}
	}

	@NonNull
	public Long getBytesWritten() {
		return this.bytesWritten;
	}

	@Override
	public void close() {
		this.closed = true;
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
}
