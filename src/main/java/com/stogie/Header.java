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

import static java.util.Objects.requireNonNull;

/**
 * A single outbound response header.  Responses keep headers in insertion order and allow duplicates.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record Header(@NonNull String name,
										 @NonNull String value) {
	public Header {
		requireNonNull(name);
		requireNonNull(value);

		if (name.indexOf('\r') >= 0 || name.indexOf('\n') >= 0 || value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0)
			throw new IllegalArgumentException("Header names and values may not contain CR or LF");
	}
}
