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

import com.stogie.exception.MaxSizeExceededException;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static java.util.Objects.requireNonNull;

/**
 * Passthrough reader that fails once more than {@code maximumSizeInBytes} bytes have been read through it.
 * <p>
 * Used for the request line and headers.  Unbounded line reads are performed in small pieces so an enormous line trips the ceiling before it is fully buffered.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class SizeCheckedReader implements BodyReader {
	private static final int LINE_PIECE_SIZE_IN_BYTES = 256;

	@NonNull
	private final BodyReader bodyReader;
	private final long maximumSizeInBytes;
	private long bytesRead;

	/**
	 * @param bodyReader         the reader to wrap
	 * @param maximumSizeInBytes the ceiling, or {@code 0} for none
	 */
	public SizeCheckedReader(@NonNull BodyReader bodyReader,
													 long maximumSizeInBytes) {
		requireNonNull(bodyReader);

		this.bodyReader = bodyReader;
		this.maximumSizeInBytes = maximumSizeInBytes;
	}

	@Override
	@NonNull
	public byte[] read(int size) throws IOException {
		byte[] data = getBodyReader().read(size);
		recordBytesRead(data.length);
		return data;
	}

	@Override
	@NonNull
	public byte[] readLine(int size) throws IOException {
		if (size >= 0) {
			byte[] data = getBodyReader().readLine(size);
			recordBytesRead(data.length);
			return data;
		}

		ByteArrayOutputStream outputStream = new ByteArrayOutputStream(LINE_PIECE_SIZE_IN_BYTES);

		while (true) {
			byte[] piece = getBodyReader().readLine(LINE_PIECE_SIZE_IN_BYTES);
			recordBytesRead(piece.length);
			outputStream.write(piece);

			if (piece.length == 0 || piece[piece.length - 1] == '\n')
				return outputStream.toByteArray();
		}
	}

	@Override
	public void close() throws IOException {
		getBodyReader().close();
	}

	public long getBytesRead() {
		return this.bytesRead;
	}

	private void recordBytesRead(int count) throws MaxSizeExceededException {
		this.bytesRead += count;

		if (this.maximumSizeInBytes > 0 && this.bytesRead > this.maximumSizeInBytes)
			throw new MaxSizeExceededException(this.maximumSizeInBytes, this.bytesRead);
	}

	@NonNull
	protected BodyReader getBodyReader() {
		return this.bodyReader;
	}
}
