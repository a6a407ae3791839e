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

import com.stogie.LogEventType.Severity;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;

import static java.util.Objects.requireNonNull;

/**
 * Writes log events at or above a severity threshold to a print stream, {@code stderr} unless told otherwise.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultLifecycleObserver implements LifecycleObserver {
	@NonNull
	private static final DefaultLifecycleObserver DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new DefaultLifecycleObserver(Severity.INFO, System.err);
	}

	@NonNull
	private final Severity minimumSeverity;
	@NonNull
	private final PrintStream printStream;

	@NonNull
	public static DefaultLifecycleObserver defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	DefaultLifecycleObserver(@NonNull Severity minimumSeverity,
													 @NonNull PrintStream printStream) {
		requireNonNull(minimumSeverity);
		requireNonNull(printStream);

		this.minimumSeverity = minimumSeverity;
		this.printStream = printStream;
	}

	@Override
	public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		if (logEvent.getLogEventType().getSeverity().compareTo(getMinimumSeverity()) < 0)
			return;

		String message = logEvent.getMessage();
		Throwable throwable = logEvent.getThrowable().orElse(null);

		if (throwable == null) {
			getPrintStream().printf("%s::didReceiveLogEvent [%s]: %s\n", LifecycleObserver.class.getSimpleName(), logEvent.getLogEventType().name(), message);
		} else {
			StringWriter stringWriter = new StringWriter();
			PrintWriter printWriter = new PrintWriter(stringWriter);
			throwable.printStackTrace(printWriter);
			String throwableWithStackTrace = stringWriter.toString();

			getPrintStream().printf("%s::didReceiveLogEvent [%s]: %s\n%s\n", LifecycleObserver.class.getSimpleName(), logEvent.getLogEventType().name(), message, throwableWithStackTrace);
		}
	}

	@NonNull
	Severity getMinimumSeverity() {
		return this.minimumSeverity;
	}

	@NonNull
	private PrintStream getPrintStream() {
		return this.printStream;
	}
}
