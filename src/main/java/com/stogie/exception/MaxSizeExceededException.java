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

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when a size-capped reader has consumed more bytes than its configured ceiling allows.
 * <p>
 * While reading a request line this surfaces as HTTP 414, while reading headers or a body it surfaces as HTTP 413.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class MaxSizeExceededException extends IOException {
	@NonNull
	private final Long maximumSizeInBytes;
	@NonNull
	private final Long actualSizeInBytes;

	public MaxSizeExceededException(@NonNull Long maximumSizeInBytes,
																	@NonNull Long actualSizeInBytes) {
		super(format("Read %d bytes, which exceeds the maximum of %d bytes", requireNonNull(actualSizeInBytes), requireNonNull(maximumSizeInBytes)));
		this.maximumSizeInBytes = maximumSizeInBytes;
		this.actualSizeInBytes = actualSizeInBytes;
	}

	@NonNull
	public Long getMaximumSizeInBytes() {
		return this.maximumSizeInBytes;
	}

	@NonNull
	public Long getActualSizeInBytes() {
		return this.actualSizeInBytes;
	}
}
