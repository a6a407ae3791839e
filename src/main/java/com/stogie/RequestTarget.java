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

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A request-target split into its URI components.
 * <p>
 * Splitting is purely syntactic and never fails: a scheme is only recognized when the text before the first {@code :} is a legal scheme name,
 * and an authority only when what follows starts with {@code //}.  Absent components are empty strings.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
record RequestTarget(@NonNull String scheme,
										 @NonNull String authority,
										 @NonNull String path,
										 @NonNull String query,
										 @NonNull String fragment) {
	RequestTarget {
		requireNonNull(scheme);
		requireNonNull(authority);
		requireNonNull(path);
		requireNonNull(query);
		requireNonNull(fragment);
	}

	@NonNull
	static RequestTarget parse(@NonNull String target) {
		requireNonNull(target);

		String remainder = target;
		String scheme = "";
		String authority = "";
		String query = "";
		String fragment = "";

		int colonIndex = remainder.indexOf(':');

		if (colonIndex > 0 && isSchemeName(remainder.substring(0, colonIndex))) {
			scheme = remainder.substring(0, colonIndex).toLowerCase();
			remainder = remainder.substring(colonIndex + 1);
		}

		if (remainder.startsWith("//")) {
			int authorityEnd = remainder.length();

			for (int i = 2; i < remainder.length(); i++) {
				char c = remainder.charAt(i);

				if (c == '/' || c == '?' || c == '#') {
					authorityEnd = i;
					break;
				}
			}

			authority = remainder.substring(2, authorityEnd);
			remainder = remainder.substring(authorityEnd);
		}

		int fragmentIndex = remainder.indexOf('#');

		if (fragmentIndex >= 0) {
			fragment = remainder.substring(fragmentIndex + 1);
			remainder = remainder.substring(0, fragmentIndex);
		}

		int queryIndex = remainder.indexOf('?');

		if (queryIndex >= 0) {
			query = remainder.substring(queryIndex + 1);
			remainder = remainder.substring(0, queryIndex);
		}

		return new RequestTarget(scheme, authority, remainder, query, fragment);
	}

	@NonNull
	Boolean isAbsoluteForm() {
		return !scheme().isEmpty() || !authority().isEmpty();
	}

	/**
	 * The port of the authority component.
	 *
	 * @return the port, or {@link Optional#empty()} if there is none or it is not a valid port number
	 */
	@NonNull
	Optional<Integer> port() {
		String hostAndPort = authority();
		int userInfoEnd = hostAndPort.lastIndexOf('@');

		if (userInfoEnd >= 0)
			hostAndPort = hostAndPort.substring(userInfoEnd + 1);

		String port = null;

		if (hostAndPort.startsWith("[")) {
			int bracketEnd = hostAndPort.indexOf(']');

			if (bracketEnd >= 0 && hostAndPort.startsWith(":", bracketEnd + 1))
				port = hostAndPort.substring(bracketEnd + 2);
		} else {
			int portSeparator = hostAndPort.indexOf(':');

			if (portSeparator >= 0)
				port = hostAndPort.substring(portSeparator + 1);
		}

		return parsePort(port);
	}

	@NonNull
	private static Optional<Integer> parsePort(@Nullable String port) {
		if (port == null || port.isEmpty() || port.length() > 5)
			return Optional.empty();

		for (int i = 0; i < port.length(); i++)
			if (port.charAt(i) < '0' || port.charAt(i) > '9')
				return Optional.empty();

		int value = Integer.parseInt(port);
		return value <= 65_535 ? Optional.of(value) : Optional.empty();
	}

	private static boolean isSchemeName(@NonNull String candidate) {
		char first = candidate.charAt(0);

		if (!((first >= 'a' && first <= 'z') || (first >= 'A' && first <= 'Z')))
			return false;

		for (int i = 1; i < candidate.length(); i++) {
			char c = candidate.charAt(i);
			boolean legal = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '+' || c == '-' || c == '.';

			if (!legal)
				return false;
		}

		return true;
	}
}
