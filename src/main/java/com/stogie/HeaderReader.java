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

import com.stogie.exception.MalformedRequestException;
import com.stogie.io.BodyReader;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Reads an HTTP header block (or a chunked-body trailer block) into a name-to-value map.
 * <p>
 * Repeated occurrences of list-valued headers are folded into one comma-joined value; for any other header the last occurrence wins.
 * Obsolete line folding is supported: a line starting with SP or HT continues the previous header's value.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class HeaderReader {
	@NonNull
	private static final Set<String> COMMA_SEPARATED_HEADER_NAMES;

	static {
		// Lowercase for case-insensitive comparison
		COMMA_SEPARATED_HEADER_NAMES = Set.of(
				"accept", "accept-charset", "accept-encoding", "accept-language", "accept-ranges", "allow",
				"cache-control", "connection", "content-encoding", "content-language", "expect",
				"if-match", "if-none-match", "pragma", "proxy-authenticate", "te", "trailer",
				"transfer-encoding", "upgrade", "vary", "via", "warning", "www-authenticate"
		);
	}

	@NonNull
	private final HeaderPolicy headerPolicy;

	HeaderReader(@NonNull HeaderPolicy headerPolicy) {
		requireNonNull(headerPolicy);
		this.headerPolicy = headerPolicy;
	}

	/**
	 * Reads header lines up to and including the blank line which ends the block.
	 *
	 * @param bodyReader source of header lines
	 * @param headers    map to store headers into
	 * @throws MalformedRequestException if a line is not CRLF-terminated, is not a valid header line, or the stream ends early
	 * @throws IOException               if reading fails, including when a size ceiling is exceeded
	 */
	void readHeaders(@NonNull BodyReader bodyReader,
									 @NonNull Map<String, String> headers) throws IOException {
		requireNonNull(bodyReader);
		requireNonNull(headers);

		List<byte[]> lines = new ArrayList<>();

		while (true) {
			byte[] line = bodyReader.readLine();

			if (line.length == 0)
				throw new MalformedRequestException("Illegal end of headers.");

			if (line.length == 2 && line[0] == '\r' && line[1] == '\n')
				break;

			if (!endsWithCrlf(line))
				throw new MalformedRequestException("HTTP requires CRLF terminators");

			lines.add(line);
		}

		parseHeaderLines(lines, headers);
	}

	/**
	 * Parses CRLF-terminated header lines, e.g. those returned by {@link com.stogie.io.ChunkedReader#readTrailerLines()}.
	 *
	 * @param lines   raw header lines
	 * @param headers map to store headers into
	 * @throws MalformedRequestException if a line is not a valid header line
	 */
	void parseHeaderLines(@NonNull List<byte[]> lines,
												@NonNull Map<String, String> headers) {
		requireNonNull(lines);
		requireNonNull(headers);

		String previousName = null;
		boolean previousDropped = false;

		for (byte[] line : lines) {
			String text = new String(line, 0, endsWithCrlf(line) ? line.length - 2 : line.length, StandardCharsets.ISO_8859_1);

			if (text.startsWith(" ") || text.startsWith("\t")) {
				if (previousDropped)
					continue;

				if (previousName == null)
					throw new MalformedRequestException("Illegal continuation line.");

				String continuation = text.trim();
				String existing = headers.get(previousName);

				if (continuation.length() > 0)
					headers.put(previousName, existing == null || existing.isEmpty() ? continuation : existing + " " + continuation);

				continue;
			}

			int colonIndex = text.indexOf(':');

			if (colonIndex <= 0)
				throw new MalformedRequestException("Illegal header line.");

			String name = getHeaderPolicy().transformKey(text.substring(0, colonIndex).trim());
			String value = text.substring(colonIndex + 1).trim();

			if (name.isEmpty())
				throw new MalformedRequestException("Illegal header line.");

			if (!getHeaderPolicy().allowHeader(name)) {
				previousName = null;
				previousDropped = true;
				continue;
			}

			String existing = headers.get(name);

			if (existing != null && isCommaSeparated(name))
				value = existing + ", " + value;

			headers.put(name, value);
			previousName = name;
			previousDropped = false;
		}
	}

	@NonNull
	static Boolean isCommaSeparated(@Nullable String name) {
		return name != null && COMMA_SEPARATED_HEADER_NAMES.contains(name.toLowerCase(Locale.ROOT));
	}

	private static boolean endsWithCrlf(@NonNull byte[] line) {
		return line.length >= 2 && line[line.length - 2] == '\r' && line[line.length - 1] == '\n';
	}

	@NonNull
	HeaderPolicy getHeaderPolicy() {
		return this.headerPolicy;
	}
}
