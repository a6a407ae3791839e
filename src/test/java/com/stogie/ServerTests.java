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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.BufferedInputStream;
import java.io.InputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.stogie.TestSupport.connect;
import static com.stogie.TestSupport.readAll;
import static com.stogie.TestSupport.readLine;
import static com.stogie.TestSupport.readResponse;
import static com.stogie.TestSupport.send;
import static com.stogie.TestSupport.serve;
import static com.stogie.TestSupport.waitFor;

/**
 * End-to-end tests over loopback sockets.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ServerTests {
	private static Gateway echoGateway() {
		return (request) -> {
			String body = new String(request.getBody().read(), StandardCharsets.ISO_8859_1);
			byte[] payload = format(request, body).getBytes(StandardCharsets.ISO_8859_1);

			request.addHeader("Content-Type", "text/plain");
			request.addHeader("Content-Length", String.valueOf(payload.length));
			request.write(payload);
		};
	}

	private static String format(HttpRequest request, String body) {
		return request.getMethod().orElse("?") + " " + request.getPath().orElse("?")
				+ request.getQueryString().map(queryString -> queryString.isEmpty() ? "" : "?" + queryString).orElse("")
				+ (body.isEmpty() ? "" : " " + body);
	}

	private static Server.Builder builder(Gateway gateway, RecordingLifecycleObserver observer) {
		return Server.withBindAddress(BindAddress.withHostAndPort("127.0.0.1", 0))
				.gateway(gateway)
				.minimumThreads(2)
				.connectionTimeout(Duration.ofSeconds(2))
				.expirationInterval(Duration.ofMillis(100))
				.shutdownTimeout(Duration.ofSeconds(1))
				.lifecycleObserver(observer);
	}

	@Test
	public void keepAlive_serves_sequential_requests_on_one_connection() throws Exception {
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		Server server = builder(echoGateway(), observer).build();
		ServingThread servingThread = serve(server);

		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());

			send(socket, "GET /first?a=1 HTTP/1.1\r\nHost: localhost\r\n\r\n");
			RawResponse first = readResponse(in);

			Assertions.assertEquals("HTTP/1.1 200 OK", first.statusLine());
			Assertions.assertEquals("GET /first?a=1", first.body());
			Assertions.assertFalse(first.closes());
			Assertions.assertNotNull(first.header("Date"));
			Assertions.assertTrue(first.header("Server").startsWith("Stogie/"));

			send(socket, "POST /second HTTP/1.1\r\nHost: localhost\r\nContent-Length: 5\r\n\r\nhello");
			RawResponse second = readResponse(in);

			Assertions.assertEquals(200, second.statusCode());
			Assertions.assertEquals("POST /second hello", second.body());
		} finally {
			servingThread.stopAndJoin();
		}

		Assertions.assertEquals(1, observer.calls.stream().filter("didAcceptConnection"::equals).count(), "Both requests should share one connection");
	}

	@Test
	public void pipelined_requests_are_answered_in_order() throws Exception {
		Server server = builder(echoGateway(), new RecordingLifecycleObserver()).build();
		ServingThread servingThread = serve(server);

		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());

			send(socket, "GET /one HTTP/1.1\r\nHost: x\r\n\r\nGET /two HTTP/1.1\r\nHost: x\r\n\r\nGET /three HTTP/1.1\r\nHost: x\r\nConnection: close\r\n\r\n");

			Assertions.assertEquals("GET /one", readResponse(in).body());
			Assertions.assertEquals("GET /two", readResponse(in).body());

			RawResponse third = readResponse(in);
			Assertions.assertEquals("GET /three", third.body());
			Assertions.assertTrue(third.closes());
			Assertions.assertEquals(-1, in.read());
		} finally {
			servingThread.stopAndJoin();
		}
	}

	@Test
	public void connection_close_header_closes_after_response() throws Exception {
		Server server = builder(echoGateway(), new RecordingLifecycleObserver()).build();
		ServingThread servingThread = serve(server);

		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());

			send(socket, "GET / HTTP/1.1\r\nHost: x\r\nConnection: close\r\n\r\n");
			RawResponse response = readResponse(in);

			Assertions.assertEquals(200, response.statusCode());
			Assertions.assertEquals("close", response.header("Connection"));
			Assertions.assertEquals(-1, in.read());
		} finally {
			servingThread.stopAndJoin();
		}
	}

	@Test
	public void buffered_request_after_connection_close_is_never_served() throws Exception {
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		Server server = builder(echoGateway(), observer).build();
		ServingThread servingThread = serve(server);

		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());

			send(socket, "GET /first HTTP/1.1\r\nHost: x\r\nConnection: close\r\n\r\nGET /second HTTP/1.1\r\nHost: x\r\n\r\n");

			Assertions.assertEquals("GET /first", readResponse(in).body());
			Assertions.assertEquals(0, readAll(in).length);
			Assertions.assertTrue(waitFor(Duration.ofSeconds(2), () -> server.getStatistics().requests() == 1));
			Assertions.assertEquals(0, ((DefaultServer) server).getConnectionManager().orElseThrow().getIdleConnectionCount());
		} finally {
			servingThread.stopAndJoin();
		}
	}

	@Test
	public void http10_closes_unless_keep_alive_requested() throws Exception {
		Server server = builder(echoGateway(), new RecordingLifecycleObserver()).build();
		ServingThread servingThread = serve(server);

		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());

			send(socket, "GET /ka HTTP/1.0\r\nConnection: keep-alive\r\n\r\n");
			RawResponse keptAlive = readResponse(in);

			Assertions.assertEquals("HTTP/1.1 200 OK", keptAlive.statusLine(), "Status line always carries the server's protocol");
			Assertions.assertEquals("Keep-Alive", keptAlive.header("Connection"));
			Assertions.assertEquals("timeout=2", keptAlive.header("Keep-Alive"));

			send(socket, "GET /bye HTTP/1.0\r\n\r\n");
			RawResponse closing = readResponse(in);

			Assertions.assertEquals("GET /bye", closing.body());
			Assertions.assertNull(closing.header("Connection"));
			Assertions.assertEquals(-1, in.read());
		} finally {
			servingThread.stopAndJoin();
		}
	}

	@Test
	public void response_without_length_is_chunked_on_http11() throws Exception {
		Gateway gateway = (request) -> {
			request.addHeader("Content-Type", "text/plain");
			request.write("hello ".getBytes(StandardCharsets.ISO_8859_1));
			request.write(new byte[0]);
			request.write("world".getBytes(StandardCharsets.ISO_8859_1));
		};

		Server server = builder(gateway, new RecordingLifecycleObserver()).build();
		ServingThread servingThread = serve(server);

		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());

			send(socket, "GET / HTTP/1.1\r\nHost: x\r\n\r\n");
			RawResponse response = readResponse(in);

			Assertions.assertEquals("chunked", response.header("Transfer-Encoding"));
			Assertions.assertEquals("hello world", response.body());

			// Connection stays usable after the terminating chunk
			send(socket, "GET / HTTP/1.1\r\nHost: x\r\n\r\n");
			Assertions.assertEquals("hello world", readResponse(in).body());
		} finally {
			servingThread.stopAndJoin();
		}
	}

	@Test
	public void response_without_length_closes_on_http10() throws Exception {
		Gateway gateway = (request) -> request.write("streamed".getBytes(StandardCharsets.ISO_8859_1));

		Server server = builder(gateway, new RecordingLifecycleObserver()).build();
		ServingThread servingThread = serve(server);

		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());

			send(socket, "GET / HTTP/1.0\r\nConnection: keep-alive\r\n\r\n");
			RawResponse response = readResponse(in);

			Assertions.assertNull(response.header("Transfer-Encoding"));
			Assertions.assertEquals("streamed", response.body());
		} finally {
			servingThread.stopAndJoin();
		}
	}

	@Test
	public void chunked_request_body_and_trailers_are_decoded() throws Exception {
		Gateway gateway = (request) -> {
			String body = new String(request.getBody().read(), StandardCharsets.ISO_8859_1);
			Map<String, String> trailers = request.readTrailers();
			byte[] payload = (body + "|" + trailers.get("x-checksum")).getBytes(StandardCharsets.ISO_8859_1);

			request.addHeader("Content-Length", String.valueOf(payload.length));
			request.write(payload);
		};

		Server server = builder(gateway, new RecordingLifecycleObserver()).build();
		ServingThread servingThread = serve(server);

		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());

			send(socket, "POST /upload HTTP/1.1\r\nHost: x\r\nTransfer-Encoding: chunked\r\n\r\n"
					+ "4\r\nWiki\r\n5\r\npedia\r\n0\r\nX-Checksum: abc123\r\n\r\n");
			RawResponse response = readResponse(in);

			Assertions.assertEquals(200, response.statusCode());
			Assertions.assertEquals("Wikipedia|abc123", response.body());
			Assertions.assertFalse(response.closes());

			send(socket, "GET /after HTTP/1.1\r\nHost: x\r\n\r\n");
			Assertions.assertEquals(200, readResponse(in).statusCode());
		} finally {
			servingThread.stopAndJoin();
		}
	}

	@Test
	public void unread_body_is_skipped_before_next_request() throws Exception {
		Gateway gateway = (request) -> {
			request.addHeader("Content-Length", "2");
			request.write("ok".getBytes(StandardCharsets.ISO_8859_1));
		};

		Server server = builder(gateway, new RecordingLifecycleObserver()).build();
		ServingThread servingThread = serve(server);

		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());

			send(socket, "POST / HTTP/1.1\r\nHost: x\r\nContent-Length: 10\r\n\r\n0123456789GET /next HTTP/1.1\r\nHost: x\r\n\r\n");

			Assertions.assertEquals("ok", readResponse(in).body());
			RawResponse next = readResponse(in);
			Assertions.assertEquals(200, next.statusCode());
			Assertions.assertEquals("ok", next.body());
		} finally {
			servingThread.stopAndJoin();
		}
	}

	@Test
	public void expect_continue_gets_interim_response() throws Exception {
		Server server = builder(echoGateway(), new RecordingLifecycleObserver()).build();
		ServingThread servingThread = serve(server);

		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());

			send(socket, "PUT /big HTTP/1.1\r\nHost: x\r\nContent-Length: 4\r\nExpect: 100-continue\r\n\r\n");

			Assertions.assertEquals("HTTP/1.1 100 Continue\r\n", readLine(in));
			Assertions.assertEquals("\r\n", readLine(in));

			send(socket, "data");
			RawResponse response = readResponse(in);

			Assertions.assertEquals("PUT /big data", response.body());
		} finally {
			servingThread.stopAndJoin();
		}
	}

	@Test
	public void head_response_has_no_body_and_keeps_connection() throws Exception {
		Gateway gateway = (request) -> request.addHeader("Content-Length", "42");

		Server server = builder(gateway, new RecordingLifecycleObserver()).build();
		ServingThread servingThread = serve(server);

		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());

			send(socket, "HEAD / HTTP/1.1\r\nHost: x\r\n\r\n");
			RawResponse response = readResponse(in, true);

			Assertions.assertEquals("42", response.header("Content-Length"));

			send(socket, "HEAD / HTTP/1.1\r\nHost: x\r\n\r\n");
			Assertions.assertEquals(200, readResponse(in, true).statusCode());
		} finally {
			servingThread.stopAndJoin();
		}
	}

	@Test
	public void custom_status_and_no_content() throws Exception {
		Gateway gateway = (request) -> {
			if (request.getPath().orElse("").equals("/teapot")) {
				request.setStatus(418, "I'm a teapot");
				request.addHeader("Content-Length", "0");
			} else {
				request.setStatus(204);
			}
		};

		Server server = builder(gateway, new RecordingLifecycleObserver()).build();
		ServingThread servingThread = serve(server);

		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());

			send(socket, "GET /teapot HTTP/1.1\r\nHost: x\r\n\r\n");
			Assertions.assertEquals("HTTP/1.1 418 I'm a teapot", readResponse(in).statusLine());

			send(socket, "GET /empty HTTP/1.1\r\nHost: x\r\n\r\n");
			RawResponse noContent = readResponse(in);
			Assertions.assertEquals(204, noContent.statusCode());
			Assertions.assertNull(noContent.header("Transfer-Encoding"));
			Assertions.assertFalse(noContent.closes());
		} finally {
			servingThread.stopAndJoin();
		}
	}

	@Test
	public void gateway_failure_answers_500_and_closes() throws Exception {
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		Gateway gateway = (request) -> {
			throw new IllegalStateException("boom");
		};

		Server server = builder(gateway, observer).build();
		ServingThread servingThread = serve(server);

		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());

			send(socket, "GET / HTTP/1.1\r\nHost: x\r\n\r\n");
			RawResponse response = readResponse(in);

			Assertions.assertEquals(500, response.statusCode());
			Assertions.assertEquals(-1, in.read());
			Assertions.assertTrue(observer.hasLogged(LogEventType.REQUEST_PROCESSING_FAILED));
		} finally {
			servingThread.stopAndJoin();
		}

		Assertions.assertFalse(server.isReady());
	}

	@Test
	public void idle_keep_alive_connection_expires() throws Exception {
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		Server server = builder(echoGateway(), observer)
				.connectionTimeout(Duration.ofMillis(500))
				.build();
		ServingThread servingThread = serve(server);

		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());

			send(socket, "GET / HTTP/1.1\r\nHost: x\r\n\r\n");
			Assertions.assertEquals(200, readResponse(in).statusCode());

			long startedAt = System.nanoTime();
			Assertions.assertEquals(-1, in.read(), "Idle connection should be closed by the server");
			Assertions.assertTrue(Duration.ofNanos(System.nanoTime() - startedAt).toMillis() >= 300);
			Assertions.assertTrue(waitFor(Duration.ofSeconds(2), () -> observer.calls.contains("didCloseConnection")));
		} finally {
			servingThread.stopAndJoin();
		}
	}

	@Test
	public void keep_alive_limit_closes_extra_connections() throws Exception {
		Server server = builder(echoGateway(), new RecordingLifecycleObserver())
				.keepAliveConnectionLimit(1)
				.connectionTimeout(Duration.ofSeconds(5))
				.build();
		ServingThread servingThread = serve(server);

		try (Socket first = connect(server); Socket second = connect(server)) {
			InputStream firstIn = new BufferedInputStream(first.getInputStream());
			InputStream secondIn = new BufferedInputStream(second.getInputStream());

			send(first, "GET /a HTTP/1.1\r\nHost: x\r\n\r\n");
			Assertions.assertFalse(readResponse(firstIn).closes());

			DefaultServer defaultServer = (DefaultServer) server;
			Assertions.assertTrue(waitFor(Duration.ofSeconds(2),
					() -> defaultServer.getConnectionManager().map(connectionManager -> connectionManager.getIdleConnectionCount() == 1).orElse(false)));

			send(second, "GET /b HTTP/1.1\r\nHost: x\r\n\r\n");
			RawResponse response = readResponse(secondIn);

			Assertions.assertEquals(200, response.statusCode());
			Assertions.assertTrue(response.closes());
			Assertions.assertEquals(-1, secondIn.read());
		} finally {
			servingThread.stopAndJoin();
		}
	}

	@Test
	public void partial_request_times_out_with_408() throws Exception {
		Server server = builder(echoGateway(), new RecordingLifecycleObserver())
				.connectionTimeout(Duration.ofMillis(500))
				.build();
		ServingThread servingThread = serve(server);

		try (Socket socket = connect(server)) {
			InputStream in = new BufferedInputStream(socket.getInputStream());

			send(socket, "GET / HTTP/1.1\r\nHost: x\r\n");
			RawResponse response = readResponse(in);

			Assertions.assertEquals(408, response.statusCode());
			Assertions.assertEquals(-1, in.read());
		} finally {
			servingThread.stopAndJoin();
		}
	}

	@Test
	public void client_that_closes_immediately_is_dropped_quietly() throws Exception {
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		Server server = builder(echoGateway(), observer).build();
		ServingThread servingThread = serve(server);

		try {
			try (Socket socket = connect(server)) {
				socket.shutdownOutput();
				Assertions.assertEquals(0, readAll(socket.getInputStream()).length);
			}

			Assertions.assertTrue(waitFor(Duration.ofSeconds(2), () -> observer.calls.contains("didCloseConnection")));
			Assertions.assertFalse(observer.hasLogged(LogEventType.CONNECTION_SOCKET_ERROR));
			Assertions.assertFalse(observer.hasLogged(LogEventType.REQUEST_PROCESSING_FAILED));
		} finally {
			servingThread.stopAndJoin();
		}
	}

	@Test
	public void busy_pool_grows_to_its_maximum_and_shrinks_on_request() throws Exception {
		CountDownLatch entered = new CountDownLatch(3);
		CountDownLatch release = new CountDownLatch(1);
		Gateway blockingGateway = (request) -> {
			entered.countDown();

			try {
				release.await(10, TimeUnit.SECONDS);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}

			request.addHeader("Content-Length", "2");
			request.write("ok".getBytes(StandardCharsets.ISO_8859_1));
		};

		Server server = builder(blockingGateway, new RecordingLifecycleObserver())
				.minimumThreads(1)
				.maximumThreads(3)
				.build();
		ServingThread servingThread = serve(server);
		List<Socket> sockets = new ArrayList<>();

		try {
			for (int i = 0; i < 3; i++) {
				Socket socket = connect(server);
				sockets.add(socket);
				send(socket, "GET / HTTP/1.1\r\nHost: x\r\n\r\n");
			}

			Assertions.assertTrue(entered.await(5, TimeUnit.SECONDS), "All three requests should be in the gateway at once");
			Assertions.assertEquals(3, server.getStatistics().threadCount());

			// At the maximum, the next connection waits in the queue
			Socket extra = connect(server);
			sockets.add(extra);
			send(extra, "GET / HTTP/1.1\r\nHost: x\r\n\r\n");

			Assertions.assertTrue(waitFor(Duration.ofSeconds(5), () -> server.getStatistics().queueSize() == 1));
			Assertions.assertEquals(3, server.getStatistics().threadCount());

			release.countDown();

			for (Socket socket : sockets)
				Assertions.assertEquals(200, readResponse(new BufferedInputStream(socket.getInputStream())).statusCode());

			server.shrinkWorkers(10);
			Assertions.assertTrue(waitFor(Duration.ofSeconds(5), () -> server.getStatistics().threadCount() == 1), "Pool should shrink back to its minimum");

			server.growWorkers(1);
			Assertions.assertEquals(2, server.getStatistics().threadCount());
		} finally {
			release.countDown();

			for (Socket socket : sockets)
				socket.close();

			servingThread.stopAndJoin();
		}
	}
}
