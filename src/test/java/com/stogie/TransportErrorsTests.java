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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.EOFException;
import java.io.IOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedChannelException;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class TransportErrorsTests {
	@Test
	public void transportErrorsAreClassified() {
		Assertions.assertEquals(TransportErrorKind.TIMEOUT, TransportErrors.classify(new SocketTimeoutException("Read timed out")));
		Assertions.assertEquals(TransportErrorKind.EXPECTED_DISCONNECT, TransportErrors.classify(new SocketException("Connection reset by peer")));
		Assertions.assertEquals(TransportErrorKind.EXPECTED_DISCONNECT, TransportErrors.classify(new IOException("Broken pipe")));
		Assertions.assertEquals(TransportErrorKind.EXPECTED_DISCONNECT, TransportErrors.classify(new ClosedChannelException()));
		Assertions.assertEquals(TransportErrorKind.EXPECTED_DISCONNECT, TransportErrors.classify(new EOFException()));
		Assertions.assertEquals(TransportErrorKind.WOULD_BLOCK, TransportErrors.classify(new IOException("Resource temporarily unavailable")));
		Assertions.assertEquals(TransportErrorKind.UNEXPECTED, TransportErrors.classify(new IOException("Disk on fire")));
		Assertions.assertEquals(TransportErrorKind.UNEXPECTED, TransportErrors.classify(null));
	}

	@Test
	public void transportErrorCauseIsConsulted() {
		IOException wrapped = new IOException("wrapper", new SocketException("Connection reset"));

		Assertions.assertEquals(TransportErrorKind.EXPECTED_DISCONNECT, TransportErrors.classify(wrapped));
		Assertions.assertTrue(TransportErrors.isIgnorable(wrapped));
		Assertions.assertFalse(TransportErrors.isIgnorable(new IOException("Disk on fire")));
	}

	@Test
	public void acceptableShutdownErrors() {
		Assertions.assertTrue(TransportErrors.isAcceptableShutdownError(new SocketException("Socket is not connected")));
		Assertions.assertTrue(TransportErrors.isAcceptableShutdownError(new ClosedChannelException()));
		Assertions.assertFalse(TransportErrors.isAcceptableShutdownError(new IOException("Disk on fire")));
		Assertions.assertFalse(TransportErrors.isAcceptableShutdownError(null));
	}
}
