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

import java.io.IOException;

/**
 * Application-facing contract: produces the response for one fully parsed request.
 * <p>
 * A gateway sets a status and headers on the request, reads the body via {@link HttpRequest#getBody()} if it cares to,
 * and writes zero or more chunks of body bytes via {@link HttpRequest#write(byte[])}.
 * Headers are sent lazily on the first write, or after {@link #respond(HttpRequest)} returns if nothing was written.
 * <p>
 * For example:
 * <pre>{@code Gateway gateway = (request) -> {
 *   byte[] body = "Hello".getBytes(StandardCharsets.UTF_8);
 *   request.setStatus(200);
 *   request.addHeader("Content-Type", "text/plain; charset=UTF-8");
 *   request.addHeader("Content-Length", String.valueOf(body.length));
 *   request.write(body);
 * };}</pre>
 * <p>
 * Throwing {@link com.stogie.exception.ServerInterruptException} shuts the whole server down.
 * Any other exception is logged and answered with a 500 if the response has not started yet.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface Gateway {
	/**
	 * Writes the response for {@code request}.
	 *
	 * @param request the request to respond to
	 * @throws IOException if writing to the client fails
	 */
	void respond(@NonNull HttpRequest request) throws IOException;
}
