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
import java.util.Optional;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RequestTargetTests {
	@Test
	public void originFormHasOnlyPathAndQuery() {
		RequestTarget target = RequestTarget.parse("/search?q=cigars#top");

		Assertions.assertEquals("", target.scheme());
		Assertions.assertEquals("", target.authority());
		Assertions.assertEquals("/search", target.path());
		Assertions.assertEquals("q=cigars", target.query());
		Assertions.assertEquals("top", target.fragment());
		Assertions.assertFalse(target.isAbsoluteForm());
	}

	@Test
	public void absoluteFormSplitsSchemeAndAuthority() {
		RequestTarget target = RequestTarget.parse("HTTP://user@example.com:8080/a/b?x=1");

		Assertions.assertEquals("http", target.scheme());
		Assertions.assertEquals("user@example.com:8080", target.authority());
		Assertions.assertEquals("/a/b", target.path());
		Assertions.assertEquals("x=1", target.query());
		Assertions.assertTrue(target.isAbsoluteForm());
		Assertions.assertEquals(Optional.of(8080), target.port());
	}

	@Test
	public void authorityFormWithLeadingSlashes() {
		RequestTarget target = RequestTarget.parse("//example.com:443");

		Assertions.assertEquals("example.com:443", target.authority());
		Assertions.assertEquals("", target.path());
		Assertions.assertEquals(Optional.of(443), target.port());
	}

	@Test
	public void bracketedIpv6Port() {
		Assertions.assertEquals(Optional.of(8443), RequestTarget.parse("//[::1]:8443").port());
		Assertions.assertEquals(Optional.empty(), RequestTarget.parse("//[::1]").port());
	}

	@Test
	public void invalidPortsAreEmpty() {
		Assertions.assertEquals(Optional.empty(), RequestTarget.parse("//example.com:99999").port());
		Assertions.assertEquals(Optional.empty(), RequestTarget.parse("//example.com:http").port());
		Assertions.assertEquals(Optional.empty(), RequestTarget.parse("//example.com:").port());
	}

	@Test
	public void colonInPathIsNotAScheme() {
		RequestTarget target = RequestTarget.parse("/a:b");

		Assertions.assertEquals("", target.scheme());
		Assertions.assertEquals("/a:b", target.path());
	}

	@Test
	public void decodePathKeepsEncodedSlashes() {
		Assertions.assertEquals("/a b/c", HttpRequest.decodePath("/a%20b/c"));
		Assertions.assertEquals("/a%2Fb", HttpRequest.decodePath("/a%2fb"));
		Assertions.assertEquals("/x%2Fy%2Fz z", HttpRequest.decodePath("/x%2Fy%2fz%20z"));
	}

	@Test
	public void decodePathLeavesMalformedEscapes() {
		Assertions.assertEquals("/100%", HttpRequest.decodePath("/100%"));
		Assertions.assertEquals("/%zz", HttpRequest.decodePath("/%zz"));
	}

	@Test
	public void headerTokensAreMatchedCaseInsensitively() {
		Assertions.assertTrue(HttpRequest.hasHeaderToken("keep-alive, Upgrade", "upgrade"));
		Assertions.assertTrue(HttpRequest.hasHeaderToken("Close", "close"));
		Assertions.assertFalse(HttpRequest.hasHeaderToken("closed", "close"));
		Assertions.assertFalse(HttpRequest.hasHeaderToken(null, "close"));
	}
}
