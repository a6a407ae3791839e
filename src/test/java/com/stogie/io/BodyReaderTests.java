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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class BodyReaderTests {
	@Test
	public void knownLengthReaderNeverReadsPastBody() throws Exception {
		ByteArrayBodyReader source = ByteArrayBodyReader.of("hello worldGET / HTTP/1.1\r\n");
		KnownLengthReader reader = new KnownLengthReader(source, 11);

		Assertions.assertEquals("hello", new String(reader.read(5), StandardCharsets.ISO_8859_1));
		Assertions.assertEquals(6L, reader.getRemaining());
		Assertions.assertEquals(" world", new String(reader.read(100), StandardCharsets.ISO_8859_1));
		Assertions.assertEquals(0, reader.read().length);
		Assertions.assertEquals("GET / HTTP/1.1\r\n", source.remaining());
	}

	@Test
	public void knownLengthReaderDrainsRemainderEvenWhenClosed() throws Exception {
		ByteArrayBodyReader source = ByteArrayBodyReader.of("0123456789NEXT");
		KnownLengthReader reader = new KnownLengthReader(source, 10);

		reader.read(3);
		reader.close();

		Assertions.assertEquals(0, reader.read().length);
		reader.drain();
		Assertions.assertEquals(0L, reader.getRemaining());
		Assertions.assertEquals("NEXT", source.remaining());
		Assertions.assertFalse(source.isClosed(), "Closing a body reader must not close the connection's input");
	}

	@Test
	public void knownLengthReaderBoundsLines() throws Exception {
		KnownLengthReader reader = new KnownLengthReader(ByteArrayBodyReader.of("ab\ncd\nef"), 5);

		Assertions.assertEquals("ab\n", new String(reader.readLine(), StandardCharsets.ISO_8859_1));
		Assertions.assertEquals("cd", new String(reader.readLine(), StandardCharsets.ISO_8859_1));
		Assertions.assertEquals(0, reader.readLine().length);
	}

	@Test
	public void knownLengthReaderRejectsNegativeLength() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new KnownLengthReader(ByteArrayBodyReader.of(""), -1));
	}

	@Test
	public void sizeCheckedReaderAllowsExactlyTheCeiling() throws Exception {
		SizeCheckedReader reader = new SizeCheckedReader(ByteArrayBodyReader.of("12345"), 5);

		Assertions.assertEquals(5, reader.read().length);
		Assertions.assertEquals(5L, reader.getBytesRead());
	}

	@Test
	public void sizeCheckedReaderFailsOnceCeilingIsPassed() {
		SizeCheckedReader reader = new SizeCheckedReader(ByteArrayBodyReader.of("a very long request line\r\n"), 8);

		MaxSizeExceededException exception = Assertions.assertThrows(MaxSizeExceededException.class, reader::readLine);
		Assertions.assertEquals(8L, exception.getMaximumSizeInBytes());
		Assertions.assertTrue(exception.getActualSizeInBytes() > 8L);
	}

	@Test
	public void sizeCheckedReaderWithZeroCeilingIsUnlimited() throws Exception {
		String line = "x".repeat(10_000) + "\r\n";
		SizeCheckedReader reader = new SizeCheckedReader(ByteArrayBodyReader.of(line), 0);

		Assertions.assertEquals(line.length(), reader.readLine().length);
	}

	@Test
	public void readLinesHonorsSizeHint() throws Exception {
		BodyReader reader = ByteArrayBodyReader.of("aa\nbb\ncc\ndd\n");

		Assertions.assertEquals(2, reader.readLines(5).size());
		Assertions.assertEquals(2, reader.readLines(0).size());
	}

	@Test
	public void inputStreamViewReadsUntilEof() throws Exception {
		KnownLengthReader reader = new KnownLengthReader(ByteArrayBodyReader.of("payload-and-more"), 7);

		try (InputStream inputStream = reader.asInputStream()) {
			Assertions.assertEquals("payload", new String(inputStream.readAllBytes(), StandardCharsets.ISO_8859_1));
			Assertions.assertEquals(-1, inputStream.read());
		}
	}
}
