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

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Fixed-floor, optionally capped pool of {@link WorkerThread}s fed from one work queue.
 * <p>
 * The pool can be grown and shrunk at runtime.  Shrinking never interrupts a busy worker: it queues shutdown requests,
 * and each worker that picks one up exits once it is done with whatever it was doing.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class WorkerPool {
	@NonNull
	private static final String THREAD_NAME_PREFIX;
	@NonNull
	private static final Duration READY_POLL_INTERVAL;

	static {
		THREAD_NAME_PREFIX = "stogie-worker";
		READY_POLL_INTERVAL = Duration.ofMillis(10);
	}

	@NonNull
	private final DefaultServer server;
	@NonNull
	private final Integer minimumThreads;
	@Nullable
	private final Integer maximumThreads;
	@NonNull
	private final Duration acceptedQueueTimeout;
	@NonNull
	private final BlockingQueue<WorkItem> queue;
	@NonNull
	private final List<WorkerThread> workers;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final AtomicInteger idGenerator;
	private int pendingShutdowns;

	/**
	 * @param minimumThreads       threads to start with and never shrink below, at least 1
	 * @param maximumThreads       upper bound for growing, or {@code null} for no bound
	 * @param queueSize            work queue capacity, or {@code 0} or less for an unbounded queue
	 * @param acceptedQueueTimeout how long {@link #put(HttpConnection)} waits for queue space
	 */
	WorkerPool(@NonNull DefaultServer server,
						 @NonNull Integer minimumThreads,
						 @Nullable Integer maximumThreads,
						 @NonNull Integer queueSize,
						 @NonNull Duration acceptedQueueTimeout) {
		requireNonNull(server);
		requireNonNull(minimumThreads);
		requireNonNull(queueSize);
		requireNonNull(acceptedQueueTimeout);

		if (minimumThreads < 1)
			throw new IllegalArgumentException(format("Minimum thread count must be > 0, was %d", minimumThreads));

		if (maximumThreads != null) {
			if (maximumThreads < 1)
				throw new IllegalArgumentException(format("Maximum thread count must be > 0, was %d", maximumThreads));

			if (maximumThreads < minimumThreads)
				throw new IllegalArgumentException(format("Maximum thread count %d must be >= minimum thread count %d", maximumThreads, minimumThreads));
		}

		this.server = server;
		this.minimumThreads = minimumThreads;
		this.maximumThreads = maximumThreads;
		this.acceptedQueueTimeout = acceptedQueueTimeout;
		this.queue = queueSize > 0 ? new LinkedBlockingQueue<>(queueSize) : new LinkedBlockingQueue<>();
		this.workers = new ArrayList<>();
		this.lock = new ReentrantLock();
		this.idGenerator = new AtomicInteger(0);
	}

	/**
	 * Starts the minimum number of workers and waits until they are all running.
	 */
	void start() {
		List<WorkerThread> started = new ArrayList<>(this.minimumThreads);

		getLock().lock();

		try {
			for (int i = 0; i < this.minimumThreads; i++)
				started.add(startWorker());
		} finally {
			getLock().unlock();
		}

		awaitReady(started);
	}

	/**
	 * Queues a connection for the next free worker.
	 *
	 * @param connection the connection to serve
	 * @return {@code false} if the queue stayed full for the accepted-queue timeout, in which case the caller must drop the connection
	 */
	@NonNull
	Boolean put(@NonNull HttpConnection connection) {
		requireNonNull(connection);

		growIfSaturated();

		try {
			return this.queue.offer(new WorkItem.Work(connection), this.acceptedQueueTimeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	/**
	 * Starts up to {@code amount} more workers, never going above the maximum.
	 *
	 * @param amount how many workers to add
	 */
	void grow(int amount) {
		if (amount < 0)
			throw new IllegalArgumentException(format("Amount must be >= 0, was %d", amount));

		List<WorkerThread> started = new ArrayList<>();

		getLock().lock();

		try {
			int budget = this.maximumThreads == null ? amount : Math.max(0, this.maximumThreads - this.workers.size());
			int count = Math.min(amount, budget);

			for (int i = 0; i < count; i++)
				started.add(startWorker());
		} finally {
			getLock().unlock();
		}

		awaitReady(started);
	}

	/**
	 * Starts one more worker when every worker is busy or already spoken for by queued work.
	 * Only a bounded pool grows on its own; an unbounded one grows through {@link #grow(int)} alone.
	 */
	private void growIfSaturated() {
		getLock().lock();

		try {
			if (this.maximumThreads == null || this.workers.size() - this.pendingShutdowns >= this.maximumThreads)
				return;

			if (getIdle() > this.queue.size())
				return;

			// Not waiting for it to come up, the caller is the connection manager's thread
			startWorker();
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Asks up to {@code amount} workers to exit, never going below the minimum.
	 * Workers that already asked to exit are counted as gone.
	 *
	 * @param amount how many workers to remove
	 */
	void shrink(int amount) {
		if (amount < 0)
			throw new IllegalArgumentException(format("Amount must be >= 0, was %d", amount));

		int count;

		getLock().lock();

		try {
			this.workers.removeIf(worker -> !worker.isAlive() && worker.isReady());

			int extra = Math.max(0, this.workers.size() - this.pendingShutdowns - this.minimumThreads);
			count = Math.min(amount, extra);
			this.pendingShutdowns += count;
		} finally {
			getLock().unlock();
		}

		try {
			for (int i = 0; i < count; i++)
				this.queue.put(WorkItem.SHUTDOWN);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	/**
	 * Asks every worker to exit and waits for them.
	 * <p>
	 * Workers still busy once {@code timeout} has elapsed have their client's input shut down and are interrupted, then waited for without a time limit.
	 *
	 * @param timeout how long to let workers finish gracefully; zero or negative waits indefinitely
	 */
	void stop(@NonNull Duration timeout) {
		requireNonNull(timeout);

		List<WorkerThread> workers;

		getLock().lock();

		try {
			workers = new ArrayList<>(this.workers);
		} finally {
			getLock().unlock();
		}

		long deadlineNanos = System.nanoTime() + timeout.toNanos();
		boolean interrupted = false;

		try {
			for (int i = 0; i < workers.size(); i++)
				if (!this.queue.offer(WorkItem.SHUTDOWN, remainingMillis(deadlineNanos, timeout), TimeUnit.MILLISECONDS))
					break;

			for (WorkerThread worker : workers) {
				// A worker may be stopping the server itself
				if (worker == Thread.currentThread())
					continue;

				if (timeout.isZero() || timeout.isNegative()) {
					worker.join();
					continue;
				}

				long remainingMillis = remainingMillis(deadlineNanos, timeout);

				if (remainingMillis > 0)
					worker.join(remainingMillis);

				if (worker.isAlive()) {
					worker.forceShutdownInput();
					worker.interrupt();
					worker.join();
				}
			}
		} catch (InterruptedException e) {
			interrupted = true;
		} finally {
			if (interrupted)
				Thread.currentThread().interrupt();
		}
	}

	private long remainingMillis(long deadlineNanos,
															 @NonNull Duration timeout) {
		if (timeout.isZero() || timeout.isNegative())
			return Long.MAX_VALUE;

		return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
	}

	void workerExited(@NonNull WorkerThread worker) {
		requireNonNull(worker);

		getLock().lock();

		try {
			if (this.workers.remove(worker) && this.pendingShutdowns > 0)
				this.pendingShutdowns--;
		} finally {
			getLock().unlock();
		}
	}

	// Caller must hold the lock
	@NonNull
	private WorkerThread startWorker() {
		WorkerThread worker = new WorkerThread(this, getServer(), this.queue,
				format("%s-%d", THREAD_NAME_PREFIX, this.idGenerator.incrementAndGet()));

		this.workers.add(worker);
		worker.start();

		return worker;
	}

	private void awaitReady(@NonNull List<WorkerThread> workers) {
		requireNonNull(workers);

		for (WorkerThread worker : workers) {
			while (!worker.isReady() && worker.isAlive()) {
				try {
					Thread.sleep(READY_POLL_INTERVAL.toMillis());
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					return;
				}
			}
		}
	}

	/**
	 * How many workers are waiting for work, not counting those that are about to exit.
	 *
	 * @return the idle worker count
	 */
	@NonNull
	Integer getIdle() {
		getLock().lock();

		try {
			int idle = 0;

			for (WorkerThread worker : this.workers)
				if (worker.isIdle())
					idle++;

			return Math.max(0, idle - this.pendingShutdowns);
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	Integer getQueueSize() {
		return this.queue.size();
	}

	@NonNull
	Integer getThreadCount() {
		getLock().lock();

		try {
			return this.workers.size();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	Integer getMinimumThreads() {
		return this.minimumThreads;
	}

	@NonNull
	Optional<Integer> getMaximumThreads() {
		return Optional.ofNullable(this.maximumThreads);
	}

	@NonNull
	List<WorkerStatistics> getWorkerStatistics() {
		getLock().lock();

		try {
			List<WorkerStatistics> workerStatistics = new ArrayList<>(this.workers.size());

			for (WorkerThread worker : this.workers)
				workerStatistics.add(worker.getStatistics());

			return workerStatistics;
		} finally {
			getLock().unlock();
		}
	}

	void resetStatistics() {
		getLock().lock();

		try {
			for (WorkerThread worker : this.workers)
				worker.resetStatistics();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	private DefaultServer getServer() {
		return this.server;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}
}
