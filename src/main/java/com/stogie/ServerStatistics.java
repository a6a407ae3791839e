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
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Immutable snapshot of a server's counters, as returned by {@link Server#getStatistics()}.
 * <p>
 * Request and byte totals are summed over the worker threads that are alive when the snapshot is taken.
 *
 * @param bindAddress     the address the server is bound to
 * @param ready           whether the server was accepting connections
 * @param runTime         total time spent serving, across restarts
 * @param accepts         connections accepted
 * @param socketErrors    failures while accepting or setting up connections
 * @param queueSize       connections waiting for a worker
 * @param threadCount     live worker threads
 * @param idleThreadCount worker threads waiting for work
 * @param workers         per-worker counters
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public record ServerStatistics(@NonNull BindAddress bindAddress,
															 boolean ready,
															 @NonNull Duration runTime,
															 long accepts,
															 long socketErrors,
															 int queueSize,
															 int threadCount,
															 int idleThreadCount,
															 @NonNull List<WorkerStatistics> workers) {
	public ServerStatistics {
		requireNonNull(bindAddress);
		requireNonNull(runTime);
		requireNonNull(workers);

		workers = List.copyOf(workers);
	}

	public long requests() {
		long requests = 0;

		for (WorkerStatistics worker : workers())
			requests += worker.requests();

		return requests;
	}

	public long bytesRead() {
		long bytesRead = 0;

		for (WorkerStatistics worker : workers())
			bytesRead += worker.bytesRead();

		return bytesRead;
	}

	public long bytesWritten() {
		long bytesWritten = 0;

		for (WorkerStatistics worker : workers())
			bytesWritten += worker.bytesWritten();

		return bytesWritten;
	}

	@NonNull
	public Duration workTime() {
		Duration workTime = Duration.ZERO;

		for (WorkerStatistics worker : workers())
			workTime = workTime.plus(worker.workTime());

		return workTime;
	}

	public double acceptsPerSecond() {
		return WorkerStatistics.perSecond(accepts(), runTime());
	}

	public double readThroughput() {
		return WorkerStatistics.perSecond(bytesRead(), workTime());
	}

	public double writeThroughput() {
		return WorkerStatistics.perSecond(bytesWritten(), workTime());
	}
}
