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

package com.stogie.exception;

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;

/**
 * Exception thrown by a {@link com.stogie.TlsAdapter} when the TLS session was torn down by a fatal alert.
 * <p>
 * Nothing can be written back to such a client, so the connection is dropped without a response.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class FatalTlsAlertException extends IOException {
	public FatalTlsAlertException(@Nullable String message) {
		super(message);
	}

	public FatalTlsAlertException(@Nullable String message,
																@Nullable Throwable cause) {
		super(message, cause);
	}
}
