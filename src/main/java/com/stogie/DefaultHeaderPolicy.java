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

import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultHeaderPolicy implements HeaderPolicy {
	@NonNull
	private static final DefaultHeaderPolicy DEFAULT_INSTANCE;
	@NonNull
	private static final DefaultHeaderPolicy DROP_UNDERSCORE_INSTANCE;

	static {
		DEFAULT_INSTANCE = new DefaultHeaderPolicy(false);
		DROP_UNDERSCORE_INSTANCE = new DefaultHeaderPolicy(true);
	}

	private final boolean dropUnderscoreHeaders;

	@NonNull
	public static DefaultHeaderPolicy defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	@NonNull
	public static DefaultHeaderPolicy dropUnderscoreInstance() {
		return DROP_UNDERSCORE_INSTANCE;
	}

	private DefaultHeaderPolicy(boolean dropUnderscoreHeaders) {
		this.dropUnderscoreHeaders = dropUnderscoreHeaders;
	}

	@Override
	@NonNull
	public Boolean allowHeader(@NonNull String name) {
		requireNonNull(name);
		return !this.dropUnderscoreHeaders || name.indexOf('_') < 0;
	}

	@Override
	@NonNull
	public String transformKey(@NonNull String name) {
		requireNonNull(name);

		StringBuilder titleCased = new StringBuilder(name.length());
		boolean previousWasLetter = false;

		// Uppercase the first letter of each run of letters, lowercase the rest
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			boolean letter = Character.isLetter(c);

			if (letter)
				titleCased.append(previousWasLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
			else
				titleCased.append(c);

			previousWasLetter = letter;
		}

		return titleCased.toString();
	}
}
