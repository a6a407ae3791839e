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

/**
 * Strategy for deciding which inbound request headers are stored, and under what name.
 * <p>
 * Standard threadsafe implementations can be acquired via {@link #defaultInstance()} and {@link #dropUnderscoreInstance()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface HeaderPolicy {
	/**
	 * Should a header with this (already transformed) name be kept?
	 *
	 * @param name the header name
	 * @return {@code true} to store the header, {@code false} to drop it silently
	 */
	@NonNull
	Boolean allowHeader(@NonNull String name);

	/**
	 * Normalizes a raw header name before it is checked and stored.
	 *
	 * @param name the header name as it appeared on the wire, trimmed
	 * @return the normalized name
	 */
	@NonNull
	String transformKey(@NonNull String name);

	/**
	 * Acquires a policy that keeps every header and title-cases names, e.g. {@code content-length} becomes {@code Content-Length}.
	 *
	 * @return the default policy
	 */
	@NonNull
	static HeaderPolicy defaultInstance() {
		return DefaultHeaderPolicy.defaultInstance();
	}

	/**
	 * Acquires a policy like {@link #defaultInstance()} that also drops any header whose name contains an underscore.
	 * <p>
	 * Gateways that map header names to variables often turn {@code -} into {@code _}, so {@code X_Forwarded_For} would otherwise be able to masquerade as {@code X-Forwarded-For}.
	 *
	 * @return the underscore-dropping policy
	 */
	@NonNull
	static HeaderPolicy dropUnderscoreInstance() {
		return DefaultHeaderPolicy.dropUnderscoreInstance();
	}
}
