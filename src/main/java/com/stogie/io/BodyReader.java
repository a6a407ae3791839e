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

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Uniform read contract shared by the connection's buffered input and every request body decoder.
 * <p>
 * All reads are bounded and EOF-terminated: once the underlying source is exhausted, reads return an empty array rather than blocking or throwing.
 * A negative {@code size} means "no bound".
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface BodyReader extends Closeable {
	/**
	 * Size value meaning "read until EOF" (or, for lines, "read until LF or EOF").
	 */
	int UNBOUNDED = -1;

	/**
	 * Reads up to {@code size} bytes, looping over short reads from the underlying source.
	 *
	 * @param size maximum number of bytes to return, or a negative value to read until EOF
	 * @return the bytes read, empty at EOF
	 * @throws IOException if the underlying source fails
	 */
	@NonNull
	byte[] read(int size) throws IOException;

	/**
	 * Reads one line including its terminating LF, returning at most {@code size} bytes.
	 *
	 * @param size maximum number of bytes to return, or a negative value for no bound
	 * @return the line, empty at EOF
	 * @throws IOException if the underlying source fails
	 */
	@NonNull
	byte[] readLine(int size) throws IOException;

	@NonNull
	default byte[] read() throws IOException {
		return read(UNBOUNDED);
	}

	@NonNull
	default byte[] readLine() throws IOException {
		return readLine(UNBOUNDED);
	}

	/**
	 * Reads lines until EOF, or until at least {@code sizeHint} bytes have been returned when {@code sizeHint > 0}.
	 *
	 * @param sizeHint approximate number of bytes to stop after, or {@code 0} for no limit
	 * @return the lines read
	 * @throws IOException if the underlying source fails
	 */
	@NonNull
	default List<byte[]> readLines(int sizeHint) throws IOException {
		List<byte[]> lines = new ArrayList<>();
		long total = 0;

		while (true) {
			byte[] line = readLine();

			if (line.length == 0)
				break;

			lines.add(line);
			total += line.length;

			if (sizeHint > 0 && total >= sizeHint)
				break;
		}

		return lines;
	}

	/**
	 * Exposes this reader as an {@link InputStream}, for gateways that prefer stream-based APIs.
	 * <p>
	 * Closing the returned stream closes this reader.
	 *
	 * @return a stream view over this reader
	 */
	@NonNull
	default InputStream asInputStream() {
		BodyReader bodyReader = this;

		return new InputStream() {
			@Override
			public int read() throws IOException {
				byte[] data = bodyReader.read(1);
				return data.length == 0 ? -1 : data[0] & 0xFF;
			}

			@Override
			public int read(byte[] buffer, int offset, int length) throws IOException {
				if (length == 0)
					return 0;

				byte[] data = bodyReader.read(length);

				if (data.length == 0)
					return -1;

				System.arraycopy(data, 0, buffer, offset, data.length);
				return data.length;
			}

			@Override
			public byte[] readAllBytes() throws IOException {
				ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
				outputStream.write(bodyReader.read());
				return outputStream.toByteArray();
			}

			@Override
			public void close() throws IOException {
				bodyReader.close();
			}
		};
	}
}
