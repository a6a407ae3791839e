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

import com.stogie.exception.ServerInterruptException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thread which repeatedly takes a connection off the work queue, serves one request on it, and hands it back to the server.
 * <p>
 * Failures are handled in tiers: request-level failures never get this far (see {@link HttpConnection#communicate()}),
 * a {@link ServerInterruptException} shuts the whole server down and ends this thread,
 * and anything else is logged before this thread moves on to the next connection.
 * <p>
 * Counters are written only by this thread and may be read from any thread.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class WorkerThread extends Thread {
	@NonNull
	private final WorkerPool workerPool;
	@NonNull
	private final DefaultServer server;
	@NonNull
	private final BlockingQueue<WorkItem> queue;
	@Nullable
	private volatile HttpConnection currentConnection;
	private volatile boolean ready;
	private volatile boolean idle;
	private volatile long requestsSeen;
	private volatile long bytesRead;
	private volatile long bytesWritten;
	private volatile long workTimeNanos;
	private volatile long workStartedNanos;

	WorkerThread(@NonNull WorkerPool workerPool,
							 @NonNull DefaultServer server,
							 @NonNull BlockingQueue<WorkItem> queue,
							 @NonNull String name) {
		super(requireNonNull(name));
		requireNonNull(workerPool);
		requireNonNull(server);
		requireNonNull(queue);

		this.workerPool = workerPool;
		this.server = server;
		this.queue = queue;

		setDaemon(true);
	}

	@Override
	public void run() {
		this.ready = true;

		try {
			while (true) {
				this.idle = true;
				WorkItem workItem = this.queue.take();
				this.idle = false;

				if (workItem instanceof WorkItem.Shutdown)
					return;

				if (!serve(((WorkItem.Work) workItem).connection()))
					return;
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		} finally {
			this.idle = false;
			this.workerPool.workerExited(this);
		}
	}

	/**
	 * Serves one request on {@code connection}.
	 *
	 * @return {@code false} if this thread should exit
	 */
	private boolean serve(@NonNull HttpConnection connection) {
		requireNonNull(connection);

		this.currentConnection = connection;
		this.workStartedNanos = System.nanoTime();

		long requestsSeenBefore = connection.getRequestsSeen();
		long bytesReadBefore = connection.getReader().getBytesRead();
		long bytesWrittenBefore = connection.getWriter().getBytesWritten();
		boolean keepOpen = false;

		try {
			keepOpen = connection.communicate();
			return true;
		} catch (ServerInterruptException e) {
			this.server.interrupt(e);
			return false;
		} catch (VirtualMachineError e) {
			this.server.interrupt(new ServerInterruptException(ServerInterruptException.Reason.FATAL_ERROR,
					format("Fatal error on worker thread %s", getName()), e));
			throw e;
		} catch (Throwable t) {
			this.server.safelyLog(LogEvent.with(LogEventType.WORKER_THREAD_FAILED, format("Unexpected failure on worker thread %s", getName()))
					.throwable(t)
					.connection(connection)
					.build());
			return true;
		} finally {
			this.requestsSeen += connection.getRequestsSeen() - requestsSeenBefore;
			this.bytesRead += connection.getReader().getBytesRead() - bytesReadBefore;
			this.bytesWritten += connection.getWriter().getBytesWritten() - bytesWrittenBefore;
			this.workTimeNanos += System.nanoTime() - this.workStartedNanos;
			this.workStartedNanos = 0;
			this.currentConnection = null;

			if (keepOpen)
				this.server.putConnection(connection);
			else
				connection.close();
		}
	}

	/**
	 * Wakes this thread up if it is blocked reading from a client, so it can notice the server is stopping.
	 */
	void forceShutdownInput() {
		HttpConnection connection = this.currentConnection;

		if (connection != null)
			connection.forceShutdownInput();
	}

	@NonNull
	WorkerStatistics getStatistics() {
		long workTimeNanos = this.workTimeNanos;
		long workStartedNanos = this.workStartedNanos;

		// Include the time spent on the request in progress
		if (workStartedNanos != 0)
			workTimeNanos += System.nanoTime() - workStartedNanos;

		return new WorkerStatistics(getName(), this.requestsSeen, this.bytesRead, this.bytesWritten, Duration.ofNanos(workTimeNanos));
	}

	void resetStatistics() {
		this.requestsSeen = 0;
		this.bytesRead = 0;
		this.bytesWritten = 0;
		this.workTimeNanos = 0;
	}

	/**
	 * Has this thread started running?  Stays {@code true} after it exits.
	 */
	@NonNull
	Boolean isReady() {
		return this.ready;
	}

	@NonNull
	Boolean isIdle() {
		return this.idle;
	}
}
