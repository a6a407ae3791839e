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

import org.jspecify.annotations.NonNull;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
final class TestSupport {
	private TestSupport() {}

	static int findFreePort() throws IOException {
		try (ServerSocket ss = new ServerSocket(0)) {
			ss.setReuseAddress(true);
			return ss.getLocalPort();
		}
	}

	static byte[] readAll(InputStream in) throws IOException {
		if (in == null) return new byte[0];
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		byte[] buf = new byte[8192];
		int n;
		while ((n = in.read(buf)) != -1) {
			bos.write(buf, 0, n);
		}
		return bos.toByteArray();
	}

	static Socket connectWithRetry(String host, int port, int timeoutMs) throws IOException, InterruptedException {
		long deadline = System.currentTimeMillis() + timeoutMs;
		IOException last = null;
		while (System.currentTimeMillis() < deadline) {
			try {
				Socket s = new Socket();
				s.connect(new InetSocketAddress(host, port), Math.max(250, timeoutMs / 2));
				s.setSoTimeout(5_000);
				return s;
			} catch (IOException e) {
				last = e;
				Thread.sleep(30);
			}
		}
		throw (last != null ? last : new IOException("Unable to connect to " + host + ":" + port));
	}

	static Socket connect(Server server) throws IOException, InterruptedException {
		return connectWithRetry("127.0.0.1", server.getBindAddress().getPort().orElseThrow(), 2_000);
	}

	static void send(Socket socket, String data) throws IOException {
		socket.getOutputStream().write(data.getBytes(StandardCharsets.ISO_8859_1));
		socket.getOutputStream().flush();
	}

	static String readLine(InputStream in) throws IOException {
		ByteArrayOutputStream line = new ByteArrayOutputStream();
		int b;
		while ((b = in.read()) != -1) {
			line.write(b);
			if (b == '\n') break;
		}
		return line.toString(StandardCharsets.ISO_8859_1);
	}

	static byte[] readExactly(InputStream in, int length) throws IOException {
		byte[] data = in.readNBytes(length);
		if (data.length != length)
			throw new IOException("Stream ended after " + data.length + " of " + length + " bytes");
		return data;
	}

	/**
	 * Reads one response off a (possibly kept-alive) connection, framing the body the way a client would.
	 */
	static RawResponse readResponse(InputStream in, boolean headRequest) throws IOException {
		String statusLine = readLine(in);
		if (statusLine.isEmpty())
			throw new IOException("Connection closed before a response was received");

		String[] statusParts = statusLine.trim().split(" ", 3);
		int statusCode = Integer.parseInt(statusParts[1]);
		Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		while (true) {
			String line = readLine(in);
			if (line.equals("\r\n") || line.isEmpty()) break;
			int colon = line.indexOf(':');
			headers.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
		}

		byte[] body;
		boolean bodyless = headRequest || statusCode < 200 || statusCode == 204 || statusCode == 304;

		if (bodyless) {
			body = new byte[0];
		} else if ("chunked".equalsIgnoreCase(headers.get("Transfer-Encoding"))) {
			ByteArrayOutputStream decoded = new ByteArrayOutputStream();
			while (true) {
				int size = Integer.parseInt(readLine(in).trim(), 16);
				if (size == 0) {
					readLine(in);
					break;
				}
				decoded.write(readExactly(in, size));
				readLine(in);
			}
			body = decoded.toByteArray();
		} else if (headers.containsKey("Content-Length")) {
			body = readExactly(in, Integer.parseInt(headers.get("Content-Length")));
		} else {
			body = readAll(in);
		}

		return new RawResponse(statusLine.trim(), statusCode, headers, new String(body, StandardCharsets.ISO_8859_1));
	}

	static RawResponse readResponse(InputStream in) throws IOException {
		return readResponse(in, false);
	}

	/**
	 * Prepares the server and runs its serve loop on a background thread.
	 */
	static ServingThread serve(Server server) {
		server.prepare();
		ServingThread servingThread = new ServingThread(server);
		servingThread.start();
		return servingThread;
	}

	static boolean waitFor(Duration timeout, BooleanSupplier condition) throws InterruptedException {
		long deadline = System.nanoTime() + timeout.toNanos();
		while (System.nanoTime() < deadline) {
			if (condition.getAsBoolean()) return true;
			Thread.sleep(20);
		}
		return condition.getAsBoolean();
	}

	record RawResponse(String statusLine, int statusCode, Map<String, String> headers, String body) {
		String header(String name) {
			return headers.get(name);
		}

		boolean closes() {
			String connection = headers.get("Connection");
			return connection != null && connection.toLowerCase(Locale.ROOT).contains("close");
		}
	}

	static final class ServingThread extends Thread {
		private final Server server;
		private final AtomicReference<Throwable> failure = new AtomicReference<>();

		ServingThread(Server server) {
			super("test-serve");
			setDaemon(true);
			this.server = server;
		}

		@Override
		public void run() {
			try {
				server.serve();
			} catch (Throwable t) {
				failure.set(t);
			}
		}

		Throwable getFailure() {
			return failure.get();
		}

		void stopAndJoin() throws InterruptedException {
			server.stop();
			join(10_000);
		}
	}

	/**
	 * Keeps test output quiet while remembering what was logged.
	 */
	static final class RecordingLifecycleObserver implements LifecycleObserver {
		final List<LogEvent> logEvents = new CopyOnWriteArrayList<>();
		final List<String> calls = new CopyOnWriteArrayList<>();

		@Override
		public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
			logEvents.add(logEvent);
		}

		@Override
		public void didStartServer(@NonNull Server server) {
			calls.add("didStartServer");
		}

		@Override
		public void didStopServer(@NonNull Server server) {
			calls.add("didStopServer");
		}

		@Override
		public void didAcceptConnection(@NonNull HttpConnection connection) {
			calls.add("didAcceptConnection");
		}

		@Override
		public void didCloseConnection(@NonNull HttpConnection connection, @NonNull Duration duration) {
			calls.add("didCloseConnection");
		}

		boolean hasLogged(LogEventType logEventType) {
			for (LogEvent logEvent : logEvents)
				if (logEvent.getLogEventType() == logEventType) return true;
			return false;
		}
	}
}
