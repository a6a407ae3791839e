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
import org.jspecify.annotations.Nullable;

import java.nio.channels.ByteChannel;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of {@link TlsAdapter#wrap(java.nio.channels.SocketChannel)}.
 * <p>
 * An empty {@code channel} means the connection wasn't a real TLS client (a load balancer health check, say) and should be dropped without a response.
 *
 * @param channel    the channel to perform HTTP I/O through, or {@code null}
 * @param attributes TLS session attributes (protocol, cipher, client certificate details and so on) exposed on each request
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record TlsWrapResult(@Nullable ByteChannel channel,
														@NonNull Map<String, String> attributes) {
	public TlsWrapResult {
		requireNonNull(attributes);
		attributes = Map.copyOf(attributes);
	}

	@NonNull
	public static TlsWrapResult withChannel(@NonNull ByteChannel channel,
																					@NonNull Map<String, String> attributes) {
		requireNonNull(channel);
		return new TlsWrapResult(channel, attributes);
	}

	@NonNull
	public static TlsWrapResult dropConnection() {
		return new TlsWrapResult(null, Map.of());
	}

	@NonNull
	public Optional<ByteChannel> getChannel() {
		return Optional.ofNullable(channel());
	}
}
