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

import com.stogie.TestSupport.RawResponse;
import com.stogie.TestSupport.RecordingLifecycleObserver;
import com.stogie.TestSupport.ServingThread;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static com.stogie.TestSupport.connect;
import static com.stogie.TestSupport.readResponse;
import static com.stogie.TestSupport.send;
import static com.stogie.TestSupport.serve;

/**
 * Malformed and unsupported requests, each answered without reaching the gateway.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RequestParsingTests {
	private final AtomicReference<HttpRequest> lastRequest = new AtomicReference<>();
	private ServingThread servingThread;
	private RecordingLifecycleObserver observer;

	@AfterEach
	public void stopServer() throws InterruptedException {
		if (servingThread != null)
			servingThread.stopAndJoin();
	}

	private Server start(Server.Builder builder) {
		return start(builder, (request) -> {
			lastRequest.set(request);
			byte[] payload = request.getPath().orElse("").getBytes(StandardCharsets.ISO_8859_1);
			request.addHeader("Content-Length", String.valueOf(payload.length));
			request.write(payload);
		});
	}

	private Server start(Server.Builder builder, Gateway gateway) {
		observer = new RecordingLifecycleObserver();
		Server server = builder
				.gateway(gateway)
				.minimumThreads(1)
				.connectionTimeout(Duration.ofSeconds(2))
				.lifecycleObserver(observer)
				.build();

		servingThread = serve(server);
		return server;
	}

	private Server start() {
		return start(Server.withBindAddress(BindAddress.withHostAndPort("127.0.0.1", 0)));
	}

	private static RawResponse exchange(Server server, String rawRequest) throws IOException, InterruptedException {
		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());
			send(socket, rawRequest);
			return readResponse(in);
		}
	}

	@Test
	public void bareLineFeedsAreRejected() throws Exception {
		RawResponse response = exchange(start(), "GET / HTTP/1.1\n\n");

		Assertions.assertEquals(400, response.statusCode());
		Assertions.assertEquals("HTTP requires CRLF terminators", response.body());
		Assertions.assertTrue(observer.hasLogged(LogEventType.SERVER_UNPARSEABLE_REQUEST));
	}

	@Test
	public void wrongTokenCountIsRejected() throws Exception {
		RawResponse response = exchange(start(), "GET /\r\n\r\n");

		Assertions.assertEquals(400, response.statusCode());
		Assertions.assertEquals("Malformed Request-Line", response.body());
	}

	@Test
	public void nonHttpProtocolIsRejected() throws Exception {
		RawResponse response = exchange(start(), "GET / FTP/1.1\r\n\r\n");

		Assertions.assertEquals(400, response.statusCode());
		Assertions.assertEquals("Malformed Request-Line: bad protocol", response.body());
	}

	@Test
	public void versionWithoutDotIsRejected() throws Exception {
		RawResponse response = exchange(start(), "GET / HTTP/11\r\n\r\n");
		Assertions.assertEquals("Malformed Request-Line: bad version", response.body());
	}

	@Test
	public void newerProtocolGets505() throws Exception {
		RawResponse response = exchange(start(), "GET / HTTP/2.0\r\n\r\n");

		Assertions.assertEquals(505, response.statusCode());
		Assertions.assertEquals("Cannot fulfill request", response.body());
	}

	@Test
	public void hugeVersionNumberGets505() throws Exception {
		RawResponse response = exchange(start(), "GET / HTTP/1.99999999999999999999\r\n\r\n");
		Assertions.assertEquals(505, response.statusCode());
	}

	@Test
	public void differentMajorVersionGets505() throws Exception {
		RawResponse response = exchange(start(), "GET / HTTP/0.9\r\n\r\n");

		Assertions.assertEquals(505, response.statusCode());
		Assertions.assertEquals("", response.body());
	}

	@Test
	public void lowercaseMethodIsRejectedInStrictMode() throws Exception {
		RawResponse response = exchange(start(), "get / HTTP/1.1\r\nHost: x\r\n\r\n");

		Assertions.assertEquals(400, response.statusCode());
		Assertions.assertTrue(response.body().startsWith("Malformed method name"));
	}

	@Test
	public void lowercaseMethodIsUppercasedOutsideStrictMode() throws Exception {
		Server server = start(Server.withBindAddress(BindAddress.withHostAndPort("127.0.0.1", 0)).strictMode(false));
		RawResponse response = exchange(server, "get /lenient HTTP/1.1\r\nHost: x\r\nConnection: close\r\n\r\n");

		Assertions.assertEquals(200, response.statusCode());
		Assertions.assertEquals("GET", lastRequest.get().getMethod().orElseThrow());
	}

	@Test
	public void absoluteUriIsRejectedWhenNotAProxy() throws Exception {
		RawResponse response = exchange(start(), "GET http://example.com/x HTTP/1.1\r\nHost: x\r\n\r\n");

		Assertions.assertEquals(400, response.statusCode());
		Assertions.assertEquals("Absolute URI not allowed if server is not a proxy.", response.body());
	}

	@Test
	public void absoluteUriIsAcceptedInProxyMode() throws Exception {
		Server server = start(Server.withBindAddress(BindAddress.withHostAndPort("127.0.0.1", 0)).proxyMode(true));
		RawResponse response = exchange(server, "GET https://example.com:8443/x?y=1 HTTP/1.1\r\nHost: x\r\nConnection: close\r\n\r\n");

		Assertions.assertEquals(200, response.statusCode());

		HttpRequest request = lastRequest.get();
		Assertions.assertEquals("https", request.getScheme());
		Assertions.assertEquals("example.com:8443", request.getAuthority().orElseThrow());
		Assertions.assertEquals("/x", request.getPath().orElseThrow());
		Assertions.assertEquals("y=1", request.getQueryString().orElseThrow());
	}

	@Test
	public void relativePathIsRejectedInStrictMode() throws Exception {
		RawResponse response = exchange(start(), "GET relative HTTP/1.1\r\nHost: x\r\n\r\n");

		Assertions.assertEquals(400, response.statusCode());
		Assertions.assertTrue(response.body().startsWith("Invalid path in Request-URI"));
	}

	@Test
	public void fragmentIsRejected() throws Exception {
		RawResponse response = exchange(start(), "GET /page#section HTTP/1.1\r\nHost: x\r\n\r\n");
		Assertions.assertEquals("Illegal #fragment in Request-URI.", response.body());
	}

	@Test
	public void percentEncodedPathIsDecoded() throws Exception {
		RawResponse response = exchange(start(), "GET /a%20b/c%2Fd HTTP/1.1\r\nHost: x\r\nConnection: close\r\n\r\n");
		Assertions.assertEquals("/a b/c%2Fd", response.body());
	}

	@Test
	public void asteriskOptionsIsAccepted() throws Exception {
		RawResponse response = exchange(start(), "OPTIONS * HTTP/1.1\r\nHost: x\r\nConnection: close\r\n\r\n");

		Assertions.assertEquals(200, response.statusCode());
		Assertions.assertEquals("/*", response.body());
	}

	@Test
	public void connectIsNotAllowedWithoutProxyMode() throws Exception {
		RawResponse response = exchange(start(), "CONNECT example.com:443 HTTP/1.1\r\nHost: x\r\n\r\n");
		Assertions.assertEquals(405, response.statusCode());
	}

	@Test
	public void connectRequiresAuthorityFormInProxyMode() throws Exception {
		Server server = start(Server.withBindAddress(BindAddress.withHostAndPort("127.0.0.1", 0)).proxyMode(true));

		Assertions.assertEquals(400, exchange(server, "CONNECT /path HTTP/1.1\r\nHost: x\r\n\r\n").statusCode());
		Assertions.assertEquals(400, exchange(server, "CONNECT example.com HTTP/1.1\r\nHost: x\r\n\r\n").statusCode());

		RawResponse accepted = exchange(server, "CONNECT example.com:443 HTTP/1.1\r\nHost: x\r\nConnection: close\r\n\r\n");
		Assertions.assertEquals(200, accepted.statusCode());
		Assertions.assertEquals("/example.com:443", accepted.body());
	}

	@Test
	public void malformedContentLengthIsRejected() throws Exception {
		RawResponse response = exchange(start(), "POST / HTTP/1.1\r\nHost: x\r\nContent-Length: abc\r\n\r\n");

		Assertions.assertEquals(400, response.statusCode());
		Assertions.assertEquals("Malformed Content-Length Header.", response.body());
	}

	@Test
	public void unsupportedTransferCodingGets501() throws Exception {
		RawResponse response = exchange(start(), "POST / HTTP/1.1\r\nHost: x\r\nTransfer-Encoding: gzip, chunked\r\n\r\n");
		Assertions.assertEquals(501, response.statusCode());
	}

	@Test
	public void malformedHeaderLineIsRejected() throws Exception {
		RawResponse response = exchange(start(), "GET / HTTP/1.1\r\nHost x\r\n\r\n");

		Assertions.assertEquals(400, response.statusCode());
		Assertions.assertEquals("Illegal header line.", response.body());
	}

	@Test
	public void oversizedRequestLineGets414() throws Exception {
		Server server = start(Server.withBindAddress(BindAddress.withHostAndPort("127.0.0.1", 0)).maximumRequestHeaderSizeInBytes(64L));
		RawResponse response = exchange(server, "GET /" + "a".repeat(200) + " HTTP/1.1\r\nHost: x\r\n\r\n");

		Assertions.assertEquals(414, response.statusCode());
		Assertions.assertEquals("The Request-URI sent with the request exceeds the maximum allowed bytes.", response.body());
	}

	@Test
	public void requestWithinHeaderCeilingSucceeds() throws Exception {
		String rawRequest = "GET /fits HTTP/1.1\r\nHost: x\r\nConnection: close\r\n\r\n";
		Server server = start(Server.withBindAddress(BindAddress.withHostAndPort("127.0.0.1", 0)).maximumRequestHeaderSizeInBytes((long) rawRequest.length()));
		RawResponse response = exchange(server, rawRequest);

		Assertions.assertEquals(200, response.statusCode());
		Assertions.assertEquals("/fits", response.body());
	}

	@Test
	public void parsedRequestExposesLineAndProtocol() throws Exception {
		RawResponse response = exchange(start(), "GET /hello HTTP/1.0\r\nHost: x\r\n\r\n");

		Assertions.assertEquals(200, response.statusCode());

		HttpRequest request = lastRequest.get();
		Assertions.assertEquals("GET", request.getMethod().orElseThrow());
		Assertions.assertEquals("/hello", request.getPath().orElseThrow());
		Assertions.assertEquals("HTTP/1.0", request.getRequestProtocol().orElseThrow());
		Assertions.assertEquals("HTTP/1.0", request.getResponseProtocol());
		Assertions.assertEquals("http", request.getScheme());
		Assertions.assertEquals("x", request.getHeader("host").orElseThrow());
		Assertions.assertEquals(0L, request.getContentLength().orElseThrow());
		Assertions.assertTrue(request.getCloseConnection());
	}

	@Test
	public void oversizedHeadersGet413() throws Exception {
		Server server = start(Server.withBindAddress(BindAddress.withHostAndPort("127.0.0.1", 0)).maximumRequestHeaderSizeInBytes(64L));
		RawResponse response = exchange(server, "GET / HTTP/1.1\r\nHost: x\r\nX-Padding: " + "p".repeat(200) + "\r\n\r\n");

		Assertions.assertEquals(413, response.statusCode());
		Assertions.assertEquals("The headers sent with the request exceed the maximum allowed bytes.", response.body());
	}

	@Test
	public void oversizedDeclaredBodyGets413() throws Exception {
		Server server = start(Server.withBindAddress(BindAddress.withHostAndPort("127.0.0.1", 0)).maximumRequestBodySizeInBytes(10L));
		RawResponse response = exchange(server, "POST / HTTP/1.1\r\nHost: x\r\nContent-Length: 11\r\n\r\n");

		Assertions.assertEquals(413, response.statusCode());
		Assertions.assertEquals("close", response.header("Connection"));
	}

	@Test
	public void oversizedHeadersFromHttp10ClientGet400() throws Exception {
		Server server = start(Server.withBindAddress(BindAddress.withHostAndPort("127.0.0.1", 0)).maximumRequestHeaderSizeInBytes(100L));
		RawResponse response = exchange(server, "GET / HTTP/1.0\r\nHost: x\r\nX-Padding: " + "p".repeat(200) + "\r\n\r\n");

		Assertions.assertEquals(400, response.statusCode());
		Assertions.assertEquals("The headers sent with the request exceed the maximum allowed bytes.", response.body());
		Assertions.assertNull(response.header("Connection"));
	}

	@Test
	public void oversizedDeclaredBodyFromHttp10ClientGets400() throws Exception {
		Server server = start(Server.withBindAddress(BindAddress.withHostAndPort("127.0.0.1", 0)).maximumRequestBodySizeInBytes(10L));
		RawResponse response = exchange(server, "POST / HTTP/1.0\r\nHost: x\r\nContent-Length: 11\r\n\r\n");

		Assertions.assertEquals(400, response.statusCode());
	}

	@Test
	public void oversizedRequestLineFromHttp10ClientStillGets414() throws Exception {
		Server server = start(Server.withBindAddress(BindAddress.withHostAndPort("127.0.0.1", 0)).maximumRequestHeaderSizeInBytes(64L));
		RawResponse response = exchange(server, "GET /" + "a".repeat(200) + " HTTP/1.0\r\nHost: x\r\n\r\n");

		Assertions.assertEquals(414, response.statusCode());
	}

	@Test
	public void oversizedChunkedBodyGets413WhenRead() throws Exception {
		Gateway bodyReadingGateway = (request) -> {
			request.getBody().read();
			request.addHeader("Content-Length", "0");
		};

		Server server = start(Server.withBindAddress(BindAddress.withHostAndPort("127.0.0.1", 0)).maximumRequestBodySizeInBytes(8L), bodyReadingGateway);
		RawResponse response = exchange(server, "POST / HTTP/1.1\r\nHost: x\r\nTransfer-Encoding: chunked\r\n\r\n10\r\n0123456789abcdef\r\n0\r\n\r\n");

		Assertions.assertEquals(413, response.statusCode());
		Assertions.assertEquals("close", response.header("Connection"));
	}

	@Test
	public void strayCrlfBeforeRequestIsTolerated() throws Exception {
		RawResponse response = exchange(start(), "\r\nGET /ok HTTP/1.1\r\nHost: x\r\nConnection: close\r\n\r\n");

		Assertions.assertEquals(200, response.statusCode());
		Assertions.assertEquals("/ok", response.body());
	}
}
