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
import java.io.IOException;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reader for a body framed by {@code Content-Length}.
 * <p>
 * Never reads past the declared length, so the next request on a kept-alive connection starts exactly where this body ends.
 * Once the remainder reaches zero every read returns an empty array without touching the socket.
 * <p>
 * Closing this reader only detaches it from the connection; the connection's own input stays open.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class KnownLengthReader implements BodyReader {
	private static final int DRAIN_PIECE_SIZE_IN_BYTES = 64 * 1_024;

	@NonNull
	private final BodyReader bodyReader;
	private long remaining;
	private boolean closed;

	public KnownLengthReader(@NonNull BodyReader bodyReader,
													 long contentLength) {
		requireNonNull(bodyReader);

		if (contentLength < 0)
			throw new IllegalArgumentException(format("Content length must be >= 0, was %d", contentLength));

		this.bodyReader = bodyReader;
		this.remaining = contentLength;
	}

	@Override
	@NonNull
	public byte[] read(int size) throws IOException {
		if (this.closed || this.remaining == 0)
			return new byte[0];

		byte[] data = getBodyReader().read(bound(size));
		this.remaining -= data.length;
		return data;
	}

	@Override
	@NonNull
	public byte[] readLine(int size) throws IOException {
		if (this.closed || this.remaining == 0)
			return new byte[0];

		byte[] data = getBodyReader().readLine(bound(size));
		this.remaining -= data.length;
		return data;
	}

	/**
	 * How many body bytes have not been consumed yet.
	 *
	 * @return the unread byte count
	 */
	public long getRemaining() {
		return this.remaining;
	}

	/**
	 * Consumes and discards whatever is left of the body, even if this reader was closed.
	 *
	 * @throws IOException if the underlying source fails
	 */
	public void drain() throws IOException {
		while (this.remaining > 0) {
			byte[] data = getBodyReader().read((int) Math.min(this.remaining, DRAIN_PIECE_SIZE_IN_BYTES));

			if (data.length == 0)
				break;

			this.remaining -= data.length;
		}
	}

	@Override
	public void close() {
		this.closed = true;
	}

	private int bound(int size) {
		int remaining = (int) Math.min(this.remaining, Integer.MAX_VALUE);
		return size < 0 ? remaining : Math.min(size, remaining);
	}

	@NonNull
	protected BodyReader getBodyReader() {
		return this.bodyReader;
	}
}
