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

import com.stogie.exception.MalformedRequestException;
import com.stogie.exception.MaxSizeExceededException;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Decoder for a body sent with {@code Transfer-Encoding: chunked}.
 * <p>
 * Chunks are fetched one at a time into an internal buffer.  Chunk extensions (anything after {@code ;} on the size line) are parsed off and ignored.
 * A zero-size chunk ends the body; the trailer block that follows can then be read with {@link #readTrailerLines()}.
 * <p>
 * The optional size ceiling is applied to every byte fetched from the connection, framing included.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class ChunkedReader implements BodyReader {
	@NonNull
	private static final Pattern CHUNK_SIZE_PATTERN;
	@NonNull
	private static final byte[] CRLF;

	static {
		CHUNK_SIZE_PATTERN = Pattern.compile("[0-9a-fA-F]{1,15}");
		CRLF = new byte[]{'\r', '\n'};
	}

	@NonNull
	private final BodyReader bodyReader;
	private final long maximumSizeInBytes;
	private long bytesRead;
	@NonNull
	private byte[] buffer;
	private int bufferPosition;
	private boolean bodyComplete;
	private boolean trailersRead;
	private boolean closed;

	/**
	 * @param bodyReader         the connection's input
	 * @param maximumSizeInBytes the ceiling, or {@code 0} for none
	 */
	public ChunkedReader(@NonNull BodyReader bodyReader,
											 long maximumSizeInBytes) {
		requireNonNull(bodyReader);

		this.bodyReader = bodyReader;
		this.maximumSizeInBytes = maximumSizeInBytes;
		this.buffer = new byte[0];
	}

	@Override
	@NonNull
	public byte[] read(int size) throws IOException {
		if (size == 0)
			return new byte[0];

		ByteArrayOutputStream outputStream = new ByteArrayOutputStream();

		while (size < 0 || outputStream.size() < size) {
			if (!bufferHasData()) {
				fetch();

				if (!bufferHasData())
					break;
			}

			int count = this.buffer.length - this.bufferPosition;

			if (size > 0)
				count = Math.min(count, size - outputStream.size());

			outputStream.write(this.buffer, this.bufferPosition, count);
			this.bufferPosition += count;
		}

		return outputStream.toByteArray();
	}

	@Override
	@NonNull
	public byte[] readLine(int size) throws IOException {
		if (size == 0)
			return new byte[0];

		ByteArrayOutputStream outputStream = new ByteArrayOutputStream();

		while (size < 0 || outputStream.size() < size) {
			if (!bufferHasData()) {
				fetch();

				if (!bufferHasData())
					break;
			}

			int end = this.buffer.length;

			if (size > 0)
				end = Math.min(end, this.bufferPosition + size - outputStream.size());

			int index = this.bufferPosition;
			boolean foundLineFeed = false;

			while (index < end) {
				if (this.buffer[index++] == '\n') {
					foundLineFeed = true;
					break;
				}
			}

			outputStream.write(this.buffer, this.bufferPosition, index - this.bufferPosition);
			this.bufferPosition = index;

			if (foundLineFeed)
				break;
		}

		return outputStream.toByteArray();
	}

	/**
	 * Reads the trailer block that follows the terminating zero-size chunk.
	 * <p>
	 * The returned lines keep their CRLF terminators; the blank line ending the block is consumed but not returned.
	 *
	 * @return the raw trailer lines, possibly empty
	 * @throws IllegalStateException     if the body has not been read to its end yet
	 * @throws MalformedRequestException if the trailer block is not properly terminated
	 * @throws IOException               if the underlying source fails or the size ceiling is exceeded
	 */
	@NonNull
	public List<byte[]> readTrailerLines() throws IOException {
		if (!this.bodyComplete)
			throw new IllegalStateException("Cannot read trailers until the request body has been read.");

		List<byte[]> lines = new ArrayList<>();

		if (this.trailersRead || this.closed)
			return lines;

		while (true) {
			byte[] line = getBodyReader().readLine();

			if (line.length == 0)
				throw new MalformedRequestException("Illegal end of headers.");

			recordBytesRead(line.length);

			if (Arrays.equals(line, CRLF))
				break;

			if (!endsWithCrlf(line))
				throw new MalformedRequestException("HTTP requires CRLF terminators");

			lines.add(line);
		}

		this.trailersRead = true;
		return lines;
	}

	/**
	 * Has the terminating zero-size chunk been seen?
	 *
	 * @return {@code true} if no more body bytes will be fetched
	 */
	public boolean isBodyComplete() {
		return this.bodyComplete;
	}

	public long getBytesRead() {
		return this.bytesRead;
	}

	@Override
	public void close() {
		this.closed = true;
		this.buffer = new byte[0];
		this.bufferPosition = 0;
	}

	private void fetch() throws IOException {
		if (this.closed || this.bodyComplete)
			return;

		byte[] line = getBodyReader().readLine();
		recordBytesRead(line.length);

		String sizeLine = new String(line, StandardCharsets.ISO_8859_1).trim();
		int extensionIndex = sizeLine.indexOf(';');
		String sizeToken = (extensionIndex >= 0 ? sizeLine.substring(0, extensionIndex) : sizeLine).trim();

		if (!CHUNK_SIZE_PATTERN.matcher(sizeToken).matches())
			throw new MalformedRequestException(format("Bad chunked transfer size: '%s'", sizeToken));

		long chunkSize = Long.parseLong(sizeToken, 16);

		if (chunkSize == 0) {
			this.bodyComplete = true;
			return;
		}

		if (this.maximumSizeInBytes > 0 && this.bytesRead + chunkSize > this.maximumSizeInBytes)
			throw new MaxSizeExceededException(this.maximumSizeInBytes, this.bytesRead + chunkSize);

		if (chunkSize > Integer.MAX_VALUE - 8)
			throw new MalformedRequestException(format("Chunk size %d is too large", chunkSize));

		byte[] chunk = getBodyReader().read((int) chunkSize);
		recordBytesRead(chunk.length);

		byte[] terminator = getBodyReader().read(2);
		recordBytesRead(terminator.length);

		if (chunk.length != chunkSize || !Arrays.equals(terminator, CRLF))
			throw new MalformedRequestException("Bad chunked transfer coding (expected '\\r\\n' after chunk data)");

		this.buffer = chunk;
		this.bufferPosition = 0;
	}

	private boolean bufferHasData() {
		return this.bufferPosition < this.buffer.length;
	}

	private void recordBytesRead(int count) throws MaxSizeExceededException {
		this.bytesRead += count;

		if (this.maximumSizeInBytes > 0 && this.bytesRead > this.maximumSizeInBytes)
			throw new MaxSizeExceededException(this.maximumSizeInBytes, this.bytesRead);
	}

	private static boolean endsWithCrlf(@NonNull byte[] line) {
		return line.length >= 2 && line[line.length - 2] == '\r' && line[line.length - 1] == '\n';
	}

	@NonNull
	protected BodyReader getBodyReader() {
		return this.bodyReader;
	}
}
