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
import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Immutable snapshot of one worker thread's counters.
 * <p>
 * Work time only covers time spent serving connections, so throughput figures describe how fast this worker moves bytes while busy.
 *
 * @param threadName   name of the worker thread
 * @param requests     requests parsed by this worker
 * @param bytesRead    bytes read from clients
 * @param bytesWritten bytes written to clients
 * @param workTime     total time spent serving connections
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public record WorkerStatistics(@NonNull String threadName,
															 long requests,
															 long bytesRead,
															 long bytesWritten,
															 @NonNull Duration workTime) {
	public WorkerStatistics {
		requireNonNull(threadName);
		requireNonNull(workTime);
	}

	/**
	 * Bytes read per second of work time.
	 *
	 * @return read throughput, or {@code 0} if this worker has not done any work
	 */
	public double readThroughput() {
		return perSecond(bytesRead(), workTime());
	}

	/**
	 * Bytes written per second of work time.
	 *
	 * @return write throughput, or {@code 0} if this worker has not done any work
	 */
	public double writeThroughput() {
		return perSecond(bytesWritten(), workTime());
	}

	static double perSecond(long count,
													@NonNull Duration duration) {
		requireNonNull(duration);

		long nanos = duration.toNanos();
		return nanos <= 0 ? 0 : count / (nanos / 1_000_000_000D);
	}
}
