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
import com.stogie.exception.MaxSizeExceededException;
import com.stogie.io.BodyReader;
import com.stogie.io.ChunkedReader;
import com.stogie.io.KnownLengthReader;
import com.stogie.io.SizeCheckedReader;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One HTTP request/response exchange on a connection.
 * <p>
 * A request moves through {@link RequestState} in order: the request line and headers are parsed by {@link #parseRequest()},
 * then {@link #respond()} sets up the body reader and hands the request to the server's {@link Gateway}.
 * Any parse failure is answered immediately with a plain-text error response and leaves {@link #isReady()} {@code false}.
 * <p>
 * Gateways read the body via {@link #getBody()}, describe the response via {@link #setStatus(Integer)} and {@link #addHeader(String, String)}, and stream body bytes via {@link #write(byte[])}.
 * <p>
 * Instances are confined to the worker thread which owns the connection.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class HttpRequest {
	@NonNull
	private static final byte[] CRLF;
	@NonNull
	private static final Pattern QUOTED_SLASH_PATTERN;
	@NonNull
	private static final Pattern VERSION_NUMBER_PATTERN;
	@NonNull
	private static final Pattern CONTENT_LENGTH_PATTERN;
	@NonNull
	private static final DateTimeFormatter HTTP_DATE_FORMATTER;
	@NonNull
	private static final String DEFAULT_RESPONSE_PROTOCOL;
	@NonNull
	private static final String NO_TLS_MESSAGE;

	static {
		CRLF = new byte[]{'\r', '\n'};
		QUOTED_SLASH_PATTERN = Pattern.compile("(?i)%2F");
		VERSION_NUMBER_PATTERN = Pattern.compile("\\d+");
		CONTENT_LENGTH_PATTERN = Pattern.compile("\\d{1,18}");
		HTTP_DATE_FORMATTER = DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US).withZone(ZoneOffset.UTC);
		DEFAULT_RESPONSE_PROTOCOL = "HTTP/1.0";
		NO_TLS_MESSAGE = "The client sent a plain HTTP request, but this server only speaks HTTPS on this port.";
	}

	@NonNull
	private final HttpConnection connection;
	@NonNull
	private final DefaultServer server;
	@NonNull
	private final HeaderReader headerReader;
	@NonNull
	private final Map<String, String> headers;
	@NonNull
	private final List<Header> outboundHeaders;
	@NonNull
	private RequestState state;
	@NonNull
	private String scheme;
	@NonNull
	private String responseProtocol;
	@NonNull
	private Integer statusCode;
	@NonNull
	private String reasonPhrase;
	@Nullable
	private BodyReader inputReader;
	@Nullable
	private BodyReader body;
	@Nullable
	private Map<String, String> trailers;
	@Nullable
	private String method;
	@Nullable
	private String uri;
	@Nullable
	private String authority;
	@Nullable
	private String path;
	@Nullable
	private String queryString;
	@Nullable
	private String requestProtocol;
	@Nullable
	private Long contentLength;
	private boolean ready;
	private boolean closeConnection;
	private boolean chunkedRead;
	private boolean chunkedWrite;
	private boolean sentHeaders;
	private boolean startedRequest;

	HttpRequest(@NonNull HttpConnection connection) {
		requireNonNull(connection);

		this.connection = connection;
		this.server = connection.getServer();
		this.headerReader = new HeaderReader(this.server.getHeaderPolicy());
		this.headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		this.outboundHeaders = new ArrayList<>();
		this.state = RequestState.NEW;
		this.scheme = connection.getScheme();
		this.responseProtocol = DEFAULT_RESPONSE_PROTOCOL;
		this.statusCode = StatusCode.HTTP_200.getStatusCode();
		this.reasonPhrase = StatusCode.HTTP_200.getReasonPhrase();
	}

	/**
	 * Reads and validates the request line and headers.
	 * <p>
	 * On success {@link #isReady()} becomes {@code true}.  On failure an error response has usually been written already and the connection should be closed.
	 *
	 * @throws IOException if reading from or writing to the socket fails
	 */
	public void parseRequest() throws IOException {
		this.inputReader = new SizeCheckedReader(getConnection().getReader(), getServer().getMaximumRequestHeaderSizeInBytes());

		boolean success;

		try {
			success = readRequestLine();
		} catch (MaxSizeExceededException e) {
			simpleResponse(StatusCode.HTTP_414.getStatusCode(), "The Request-URI sent with the request exceeds the maximum allowed bytes.");
			return;
		}

		if (!success) {
			fail();
			return;
		}

		this.state = RequestState.LINE_PARSED;

		try {
			success = readRequestHeaders();
		} catch (MaxSizeExceededException e) {
			simpleResponse(StatusCode.HTTP_413.getStatusCode(), "The headers sent with the request exceed the maximum allowed bytes.");
			return;
		}

		if (!success) {
			fail();
			return;
		}

		this.state = RequestState.READY;
		this.ready = true;
	}

	protected boolean readRequestLine() throws IOException {
		BodyReader inputReader = requireNonNull(this.inputReader);
		byte[] requestLine = inputReader.readLine();

		this.startedRequest = true;

		if (requestLine.length == 0)
			return false;

		// Tolerate one stray CRLF between pipelined requests
		if (isCrlf(requestLine)) {
			requestLine = inputReader.readLine();

			if (requestLine.length == 0)
				return false;
		}

		if (!endsWithCrlf(requestLine)) {
			simpleResponse(StatusCode.HTTP_400.getStatusCode(), "HTTP requires CRLF terminators");
			return false;
		}

		String[] tokens = new String(requestLine, StandardCharsets.ISO_8859_1).trim().split(" ", 3);

		if (tokens.length != 3) {
			simpleResponse(StatusCode.HTTP_400.getStatusCode(), "Malformed Request-Line");
			return false;
		}

		String method = tokens[0];
		String uri = tokens[1];
		String requestProtocol = tokens[2];

		if (!requestProtocol.startsWith("HTTP/")) {
			simpleResponse(StatusCode.HTTP_400.getStatusCode(), "Malformed Request-Line: bad protocol");
			return false;
		}

		String version = requestProtocol.substring("HTTP/".length());
		int separatorIndex = version.indexOf('.');

		if (separatorIndex < 0) {
			simpleResponse(StatusCode.HTTP_400.getStatusCode(), "Malformed Request-Line: bad version");
			return false;
		}

		String majorText = version.substring(0, separatorIndex);
		String minorText = version.substring(separatorIndex + 1);

		if (!VERSION_NUMBER_PATTERN.matcher(majorText).matches() || !VERSION_NUMBER_PATTERN.matcher(minorText).matches()) {
			simpleResponse(StatusCode.HTTP_400.getStatusCode(), "Malformed Request-Line");
			return false;
		}

		int requestMajor;
		int requestMinor;

		try {
			requestMajor = Integer.parseInt(majorText);
			requestMinor = Integer.parseInt(minorText);
		} catch (NumberFormatException e) {
			// All digits, so too large to represent: certainly newer than anything we speak
			simpleResponse(StatusCode.HTTP_505.getStatusCode(), "Cannot fulfill request");
			return false;
		}

		if (compareVersions(requestMajor, requestMinor, 1, 1) > 0) {
			simpleResponse(StatusCode.HTTP_505.getStatusCode(), "Cannot fulfill request");
			return false;
		}

		this.uri = uri;
		this.method = method.toUpperCase(Locale.ROOT);

		if (getServer().getStrictMode() && !method.equals(this.method)) {
			simpleResponse(StatusCode.HTTP_400.getStatusCode(), "Malformed method name: According to RFC 2616 (section 5.1.1) and its successors "
					+ "RFC 7230 (section 3.1.1) and RFC 7231 (section 4.1) method names are case-sensitive and uppercase.");
			return false;
		}

		RequestTarget target = RequestTarget.parse(uri);
		boolean proxyMode = getServer().getProxyMode();
		boolean strictMode = getServer().getStrictMode();
		String scheme = target.scheme();
		String authority = target.authority();
		String path;
		String queryString = target.query();

		if ("OPTIONS".equals(this.method)) {
			path = proxyMode && target.isAbsoluteForm() ? uri : target.path();
		} else if ("CONNECT".equals(this.method)) {
			if (!proxyMode) {
				simpleResponse(StatusCode.HTTP_405.getStatusCode(), "");
				return false;
			}

			RequestTarget authorityTarget = RequestTarget.parse("//" + uri);
			boolean invalidPath = !authorityTarget.authority().equals(uri)
					|| authorityTarget.port().orElse(0) == 0
					|| !authorityTarget.scheme().isEmpty()
					|| !authorityTarget.path().isEmpty()
					|| !authorityTarget.query().isEmpty()
					|| !authorityTarget.fragment().isEmpty();

			if (invalidPath) {
				simpleResponse(StatusCode.HTTP_400.getStatusCode(), "Invalid path in Request-URI: request-target must match authority-form.");
				return false;
			}

			authority = authorityTarget.authority();
			path = authorityTarget.authority();
			scheme = "";
			queryString = "";
		} else {
			if (strictMode && !proxyMode && target.isAbsoluteForm()) {
				simpleResponse(StatusCode.HTTP_400.getStatusCode(), "Absolute URI not allowed if server is not a proxy.");
				return false;
			}

			if (strictMode && !uri.startsWith("/") && !target.isAbsoluteForm()) {
				simpleResponse(StatusCode.HTTP_400.getStatusCode(), "Invalid path in Request-URI: request-target must contain origin-form "
						+ "which starts with absolute-path (URI starting with a slash \"/\").");
				return false;
			}

			if (!target.fragment().isEmpty()) {
				simpleResponse(StatusCode.HTTP_400.getStatusCode(), "Illegal #fragment in Request-URI.");
				return false;
			}

			path = decodePath(target.path());
		}

		if (!path.startsWith("/"))
			path = "/" + path;

		if (!scheme.isEmpty())
			this.scheme = scheme;

		this.authority = authority;
		this.path = path;
		this.queryString = queryString;

		int[] serverVersion = getServer().getProtocolVersion();

		if (serverVersion[0] != requestMajor) {
			simpleResponse(StatusCode.HTTP_505.getStatusCode(), "");
			return false;
		}

		this.requestProtocol = requestProtocol;

		if (compareVersions(requestMajor, requestMinor, serverVersion[0], serverVersion[1]) < 0)
			this.responseProtocol = format("HTTP/%d.%d", requestMajor, requestMinor);
		else
			this.responseProtocol = format("HTTP/%d.%d", serverVersion[0], serverVersion[1]);

		return true;
	}

	protected boolean readRequestHeaders() throws IOException {
		try {
			this.headerReader.readHeaders(requireNonNull(this.inputReader), this.headers);
		} catch (MalformedRequestException e) {
			simpleResponse(StatusCode.HTTP_400.getStatusCode(), e.getMessage() == null ? "" : e.getMessage());
			return false;
		}

		this.state = RequestState.HEADERS_PARSED;

		String contentLengthHeader = this.headers.get("Content-Length");
		long contentLength = 0;

		if (contentLengthHeader != null) {
			if (!CONTENT_LENGTH_PATTERN.matcher(contentLengthHeader).matches()) {
				simpleResponse(StatusCode.HTTP_400.getStatusCode(), "Malformed Content-Length Header.");
				return false;
			}

			contentLength = Long.parseLong(contentLengthHeader);
		}

		this.contentLength = contentLength;

		if (exceedsMaximumBodySize(contentLength)) {
			simpleResponse(StatusCode.HTTP_413.getStatusCode(), "The entity sent with the request exceeds the maximum allowed bytes.");
			return false;
		}

		String connectionHeader = this.headers.get("Connection");

		// Persistent connections are the default for 1.1 and opt-in for 1.0
		if ("HTTP/1.1".equals(getResponseProtocol())) {
			if (hasHeaderToken(connectionHeader, "close"))
				this.closeConnection = true;
		} else if (!hasHeaderToken(connectionHeader, "keep-alive")) {
			this.closeConnection = true;
		}

		this.chunkedRead = false;

		if ("HTTP/1.1".equals(getResponseProtocol())) {
			String transferEncoding = this.headers.get("Transfer-Encoding");

			if (transferEncoding != null) {
				for (String coding : transferEncoding.split(",")) {
					coding = coding.trim().toLowerCase(Locale.ROOT);

					if (coding.isEmpty())
						continue;

					if (!"chunked".equals(coding)) {
						simpleResponse(StatusCode.HTTP_501.getStatusCode(), "");
						this.closeConnection = true;
						return false;
					}

					this.chunkedRead = true;
				}
			}
		}

		if ("100-continue".equalsIgnoreCase(this.headers.getOrDefault("Expect", ""))) {
			byte[] interimResponse = format("%s 100 Continue\r\n\r\n", getServer().getProtocol()).getBytes(StandardCharsets.ISO_8859_1);

			try {
				getConnection().getWriter().write(interimResponse);
			} catch (IOException e) {
				if (!TransportErrors.isIgnorable(e))
					throw e;
			}
		}

		return true;
	}

	/**
	 * Sets up the body reader, runs the gateway and finishes the response.
	 *
	 * @throws IOException if reading from or writing to the socket fails
	 */
	public void respond() throws IOException {
		if (!isReady())
			throw new IllegalStateException(format("Cannot respond to a request in state %s", getState().name()));

		this.state = RequestState.RESPONDING;

		if (this.chunkedRead) {
			this.body = new ChunkedReader(getConnection().getReader(), getServer().getMaximumRequestBodySizeInBytes());
		} else {
			long contentLength = getContentLength().orElse(0L);

			if (exceedsMaximumBodySize(contentLength)) {
				if (!this.sentHeaders)
					simpleResponse(StatusCode.HTTP_413.getStatusCode(), "The entity sent with the request exceeds the maximum allowed bytes.");

				fail();
				return;
			}

			this.body = new KnownLengthReader(getConnection().getReader(), contentLength);
		}

		Gateway gateway = getServer().getGateway().orElseThrow(() -> new IllegalStateException("No gateway is configured"));
		gateway.respond(this);

		if (this.ready)
			ensureHeadersSent();

		if (this.chunkedWrite)
			getConnection().getWriter().write("0\r\n\r\n".getBytes(StandardCharsets.ISO_8859_1));

		if (this.state == RequestState.RESPONDING)
			this.state = RequestState.DONE;
	}

	/**
	 * Writes a complete plain-text response, bypassing the gateway.
	 * <p>
	 * 413 and 414 responses always close the connection, since the rest of the oversized request is still unread.
	 * Once the request line has shown an HTTP/1.0 client they are sent as 400 instead.
	 *
	 * @param statusCode the HTTP status code
	 * @param message    the plain-text body, may be empty
	 * @throws IOException if writing fails for a reason other than the client having gone away
	 */
	public void simpleResponse(@NonNull Integer statusCode,
														 @NonNull String message) throws IOException {
		requireNonNull(statusCode);
		requireNonNull(message);

		boolean oversized = statusCode == 413 || statusCode == 414;

		// 413 and 414 are HTTP/1.1 codes; a client known to speak HTTP/1.0 gets a plain 400
		if (oversized && this.requestProtocol != null && !"HTTP/1.1".equals(getResponseProtocol()))
			statusCode = StatusCode.HTTP_400.getStatusCode();

		if (statusCode >= 400)
			getServer().safelyLog(LogEvent.with(LogEventType.SERVER_UNPARSEABLE_REQUEST,
							format("Responding with %d %s: %s", statusCode, StatusCode.reasonPhraseFor(statusCode), message))
					.connection(getConnection())
					.request(this)
					.build());

		byte[] body = message.getBytes(StandardCharsets.ISO_8859_1);
		StringBuilder response = new StringBuilder();

		response.append(format("%s %d %s\r\n", getServer().getProtocol(), statusCode, StatusCode.reasonPhraseFor(statusCode)));
		response.append(format("Content-Length: %d\r\n", body.length));
		response.append("Content-Type: text/plain\r\n");

		if (oversized) {
			this.closeConnection = true;

			if ("HTTP/1.1".equals(getResponseProtocol()))
				response.append("Connection: close\r\n");
		}

		response.append("\r\n");

		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		buffer.writeBytes(response.toString().getBytes(StandardCharsets.ISO_8859_1));
		buffer.writeBytes(body);

		this.sentHeaders = true;

		try {
			getConnection().getWriter().write(buffer.toByteArray());
		} catch (IOException e) {
			if (!TransportErrors.isIgnorable(e))
				throw e;
		}

		if (statusCode >= 400)
			fail();
	}

	/**
	 * Answers a plaintext client on a TLS-only port.
	 *
	 * @throws IOException if writing fails for a reason other than the client having gone away
	 */
	void noTlsResponse() throws IOException {
		simpleResponse(StatusCode.HTTP_400.getStatusCode(), NO_TLS_MESSAGE);
	}

	/**
	 * Sends the status line and headers if that hasn't happened yet.
	 *
	 * @throws IOException if writing fails
	 */
	public void ensureHeadersSent() throws IOException {
		if (!this.sentHeaders) {
			this.sentHeaders = true;
			sendHeaders();
		}
	}

	/**
	 * Writes a piece of the response body, sending headers first if needed.
	 * <p>
	 * With chunked transfer-coding each non-empty piece becomes one chunk; an empty piece is ignored since it would terminate the body.
	 *
	 * @param chunk body bytes to send
	 * @throws IOException if writing fails
	 */
	public void write(@NonNull byte[] chunk) throws IOException {
		requireNonNull(chunk);

		ensureHeadersSent();

		if (this.chunkedWrite) {
			if (chunk.length == 0)
				return;

			ByteArrayOutputStream buffer = new ByteArrayOutputStream(chunk.length + 12);
			buffer.writeBytes(Integer.toHexString(chunk.length).getBytes(StandardCharsets.ISO_8859_1));
			buffer.writeBytes(CRLF);
			buffer.writeBytes(chunk);
			buffer.writeBytes(CRLF);
			getConnection().getWriter().write(buffer.toByteArray());
		} else {
			getConnection().getWriter().write(chunk);
		}
	}

	protected void sendHeaders() throws IOException {
		int statusCode = getStatusCode();

		if (statusCode == 413) {
			// The unread body is garbage we can't skip
			this.closeConnection = true;
		} else if (!hasOutboundHeader("Content-Length")) {
			boolean bodyless = statusCode < 200 || statusCode == 204 || statusCode == 205 || statusCode == 304;

			if (!bodyless) {
				if ("HTTP/1.1".equals(getResponseProtocol()) && !"HEAD".equals(this.method)) {
					this.chunkedWrite = true;
					this.outboundHeaders.add(new Header("Transfer-Encoding", "chunked"));
				} else {
					// Only the closing of the connection can delimit the body
					this.closeConnection = true;
				}
			}
		}

		// An unread chunked body leaves the stream position unknown
		if (!this.closeConnection && this.chunkedRead && this.body instanceof ChunkedReader chunkedReader && !chunkedReader.isBodyComplete())
			this.closeConnection = true;

		if (!this.closeConnection && !getServer().canAddKeepAliveConnection())
			this.closeConnection = true;

		if (!hasOutboundHeader("Connection")) {
			if ("HTTP/1.1".equals(getResponseProtocol())) {
				if (this.closeConnection)
					this.outboundHeaders.add(new Header("Connection", "close"));
			} else if (!this.closeConnection) {
				this.outboundHeaders.add(new Header("Connection", "Keep-Alive"));
			}
		}

		if (!hasOutboundHeader("Keep-Alive") && hasOutboundHeaderToken("Connection", "keep-alive"))
			this.outboundHeaders.add(new Header("Keep-Alive", format("timeout=%d", getServer().getConnectionTimeout().toSeconds())));

		// Skip whatever the gateway left unread so the next request starts at the right place
		if (!this.closeConnection && !this.chunkedRead && this.body instanceof KnownLengthReader knownLengthReader)
			knownLengthReader.drain();

		// Trailers the gateway never asked for still sit between this body and the next request
		if (!this.closeConnection && this.body instanceof ChunkedReader chunkedReader && chunkedReader.isBodyComplete())
			readTrailers();

		if (!hasOutboundHeader("Date"))
			this.outboundHeaders.add(new Header("Date", HTTP_DATE_FORMATTER.format(Instant.now())));

		if (!hasOutboundHeader("Server"))
			this.outboundHeaders.add(new Header("Server", getServer().getServerName()));

		StringBuilder head = new StringBuilder();
		head.append(format("%s %d %s\r\n", getServer().getProtocol(), statusCode, getReasonPhrase()));

		for (Header header : this.outboundHeaders)
			head.append(header.name()).append(": ").append(header.value()).append("\r\n");

		head.append("\r\n");

		getConnection().getWriter().write(head.toString().getBytes(StandardCharsets.ISO_8859_1));
	}

	/**
	 * Reads the trailer section of a chunked request body.
	 * <p>
	 * Only meaningful once the whole body has been read; requests without a chunked body have no trailers.
	 *
	 * @return trailer fields keyed case-insensitively
	 * @throws IOException if reading fails or the trailer block is malformed
	 */
	@NonNull
	public Map<String, String> readTrailers() throws IOException {
		if (this.trailers != null)
			return this.trailers;

		Map<String, String> trailers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		if (this.chunkedRead && this.body instanceof ChunkedReader chunkedReader)
			this.headerReader.parseHeaderLines(chunkedReader.readTrailerLines(), trailers);

		this.trailers = Collections.unmodifiableMap(trailers);
		return this.trailers;
	}

	public void setStatus(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		setStatus(statusCode, StatusCode.reasonPhraseFor(statusCode));
	}

	public void setStatus(@NonNull Integer statusCode,
												@NonNull String reasonPhrase) {
		requireNonNull(statusCode);
		requireNonNull(reasonPhrase);

		if (statusCode < 100 || statusCode > 999)
			throw new IllegalArgumentException(format("Illegal status code %d", statusCode));

		if (reasonPhrase.indexOf('\r') >= 0 || reasonPhrase.indexOf('\n') >= 0)
			throw new IllegalArgumentException("Reason phrases may not contain CR or LF");

		if (this.sentHeaders)
			throw new IllegalStateException("Cannot change the status after headers have been sent");

		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
	}

	public void addHeader(@NonNull String name,
												@NonNull String value) {
		requireNonNull(name);
		requireNonNull(value);

		if (this.sentHeaders)
			throw new IllegalStateException("Cannot add headers after headers have been sent");

		this.outboundHeaders.add(new Header(name, value));
	}

	protected void fail() {
		this.ready = false;
		this.state = RequestState.ERROR;
	}

	protected boolean exceedsMaximumBodySize(long contentLength) {
		long maximumBodySize = getServer().getMaximumRequestBodySizeInBytes();
		return maximumBodySize > 0 && contentLength > maximumBodySize;
	}

	protected boolean hasOutboundHeader(@NonNull String name) {
		requireNonNull(name);

		for (Header header : this.outboundHeaders)
			if (header.name().equalsIgnoreCase(name))
				return true;

		return false;
	}

	protected boolean hasOutboundHeaderToken(@NonNull String name,
																					 @NonNull String token) {
		requireNonNull(name);
		requireNonNull(token);

		for (Header header : this.outboundHeaders)
			if (header.name().equalsIgnoreCase(name) && hasHeaderToken(header.value(), token))
				return true;

		return false;
	}

	static boolean hasHeaderToken(@Nullable String headerValue,
																@NonNull String token) {
		requireNonNull(token);

		if (headerValue == null)
			return false;

		for (String part : headerValue.split(","))
			if (part.trim().equalsIgnoreCase(token))
				return true;

		return false;
	}

	/**
	 * Percent-decodes a path while keeping encoded slashes encoded, so {@code /a%2Fb} stays distinguishable from {@code /a/b}.
	 * Malformed escapes are left as they are.  The result holds one char per decoded byte.
	 */
	@NonNull
	static String decodePath(@NonNull String path) {
		requireNonNull(path);

		String[] atoms = QUOTED_SLASH_PATTERN.split(path, -1);
		List<String> decodedAtoms = new ArrayList<>(atoms.length);

		for (String atom : atoms)
			decodedAtoms.add(percentDecode(atom));

		return String.join("%2F", decodedAtoms);
	}

	@NonNull
	private static String percentDecode(@NonNull String text) {
		if (text.indexOf('%') < 0)
			return text;

		ByteArrayOutputStream decoded = new ByteArrayOutputStream(text.length());
		byte[] bytes = text.getBytes(StandardCharsets.ISO_8859_1);

		for (int i = 0; i < bytes.length; i++) {
			if (bytes[i] == '%' && i + 2 < bytes.length) {
				int high = Character.digit(bytes[i + 1], 16);
				int low = Character.digit(bytes[i + 2], 16);

				if (high >= 0 && low >= 0) {
					decoded.write((high << 4) | low);
					i += 2;
					continue;
				}
			}

			decoded.write(bytes[i]);
		}

		return decoded.toString(StandardCharsets.ISO_8859_1);
	}

	private static int compareVersions(int major,
																		 int minor,
																		 int otherMajor,
																		 int otherMinor) {
		if (major != otherMajor)
			return Integer.compare(major, otherMajor);

		return Integer.compare(minor, otherMinor);
	}

	private static boolean isCrlf(@NonNull byte[] line) {
		return line.length == 2 && line[0] == '\r' && line[1] == '\n';
	}

	private static boolean endsWithCrlf(@NonNull byte[] line) {
		return line.length >= 2 && line[line.length - 2] == '\r' && line[line.length - 1] == '\n';
	}

	@NonNull
	public HttpConnection getConnection() {
		return this.connection;
	}

	@NonNull
	protected DefaultServer getServer() {
		return this.server;
	}

	@NonNull
	public RequestState getState() {
		return this.state;
	}

	@NonNull
	public Optional<String> getMethod() {
		return Optional.ofNullable(this.method);
	}

	@NonNull
	public Optional<String> getUri() {
		return Optional.ofNullable(this.uri);
	}

	@NonNull
	public String getScheme() {
		return this.scheme;
	}

	@NonNull
	public Optional<String> getAuthority() {
		return Optional.ofNullable(this.authority);
	}

	/**
	 * The percent-decoded request path.  Encoded slashes ({@code %2F}) are kept encoded.
	 *
	 * @return the path, always starting with {@code /} once the request line is parsed
	 */
	@NonNull
	public Optional<String> getPath() {
		return Optional.ofNullable(this.path);
	}

	/**
	 * The raw, undecoded query string without the leading {@code ?}.
	 *
	 * @return the query string, empty if the target had none
	 */
	@NonNull
	public Optional<String> getQueryString() {
		return Optional.ofNullable(this.queryString);
	}

	@NonNull
	public Optional<String> getRequestProtocol() {
		return Optional.ofNullable(this.requestProtocol);
	}

	/**
	 * The protocol version the response body conventions follow: the lower of the client's and the server's.
	 *
	 * @return the response protocol, {@code HTTP/1.0} until the request line is parsed
	 */
	@NonNull
	public String getResponseProtocol() {
		return this.responseProtocol;
	}

	/**
	 * Request headers, keyed case-insensitively.
	 *
	 * @return an unmodifiable view of the request headers
	 */
	@NonNull
	public Map<String, String> getHeaders() {
		return Collections.unmodifiableMap(this.headers);
	}

	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(this.headers.get(name));
	}

	@NonNull
	public Optional<Long> getContentLength() {
		return Optional.ofNullable(this.contentLength);
	}

	/**
	 * The request body, framed by {@code Content-Length} or chunked transfer-coding.
	 *
	 * @return the body reader
	 * @throws IllegalStateException if called before {@link #respond()} has set the body up
	 */
	@NonNull
	public BodyReader getBody() {
		if (this.body == null)
			throw new IllegalStateException("The request body is only available while responding");

		return this.body;
	}

	@NonNull
	public List<Header> getOutboundHeaders() {
		return Collections.unmodifiableList(this.outboundHeaders);
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	public String getReasonPhrase() {
		return this.reasonPhrase;
	}

	@NonNull
	public Boolean isReady() {
		return this.ready;
	}

	@NonNull
	public Boolean getCloseConnection() {
		return this.closeConnection;
	}

	/**
	 * Forces the connection to close once this response is done.
	 */
	public void setCloseConnection(@NonNull Boolean closeConnection) {
		requireNonNull(closeConnection);
		this.closeConnection = closeConnection;
	}

	@NonNull
	public Boolean isChunkedRead() {
		return this.chunkedRead;
	}

	@NonNull
	public Boolean isChunkedWrite() {
		return this.chunkedWrite;
	}

	@NonNull
	public Boolean isSentHeaders() {
		return this.sentHeaders;
	}

	@NonNull
	public Boolean isStartedRequest() {
		return this.startedRequest;
	}

	/**
	 * Where a request is in its lifecycle.
	 */
	public enum RequestState {
		NEW,
		LINE_PARSED,
		HEADERS_PARSED,
		READY,
		RESPONDING,
		DONE,
		ERROR
	}
}
