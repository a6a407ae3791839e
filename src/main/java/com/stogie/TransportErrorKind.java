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

/**
 * How Stogie treats a failure that happened while moving bytes over a socket.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum TransportErrorKind {
	/**
	 * A read, write or accept did not complete within its timeout.
	 */
	TIMEOUT,
	/**
	 * The peer went away (reset, broken pipe, already-closed socket and so on).  Dropped silently.
	 */
	EXPECTED_DISCONNECT,
	/**
	 * The blocking call was interrupted and may simply be retried.
	 */
	INTERRUPTED,
	/**
	 * A non-blocking call had nothing to do and may simply be retried.
	 */
	WOULD_BLOCK,
	/**
	 * Anything else.  Logged, and answered with a best-effort 500 if possible.
	 */
	UNEXPECTED
}
