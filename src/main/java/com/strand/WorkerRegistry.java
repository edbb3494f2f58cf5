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

package com.strand;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The set of workers currently servicing connections, plus a way to block until that set is empty.
 * <p>
 * A worker is registered by the accept loop before its thread is started and deregisters itself as the very last
 * thing it does, so an empty registry means no worker is doing anything.
 * <p>
 * Workers are tracked by identity; no ordering among them is implied.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class WorkerRegistry {
	@NonNull
	private final Set<Runnable> workers;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final Condition emptyCondition;

	public WorkerRegistry() {
		this.workers = Collections.newSetFromMap(new IdentityHashMap<>());
		this.lock = new ReentrantLock();
		this.emptyCondition = this.lock.newCondition();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{size=%d}", getClass().getSimpleName(), size());
	}

	/**
	 * Adds a worker to the registry.
	 *
	 * @param worker the worker to add
	 * @throws IllegalStateException if the worker is already registered
	 */
	public void register(@NonNull Runnable worker) {
		requireNonNull(worker);

		getLock().lock();

		try {
			if (!getWorkers().add(worker))
				throw new IllegalStateException(format("Worker %s is already registered", worker));
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Removes a worker from the registry, waking up all threads blocked in {@link #awaitEmpty()} if the registry is now
	 * empty.
	 *
	 * @param worker the worker to remove
	 * @return {@code true} if the worker was registered, {@code false} otherwise
	 */
	@NonNull
	public Boolean deregister(@NonNull Runnable worker) {
		requireNonNull(worker);

		getLock().lock();

		try {
			boolean removed = getWorkers().remove(worker);

			if (removed && getWorkers().isEmpty())
				getEmptyCondition().signalAll();

			return removed;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Blocks until the registry is empty.  Returns immediately if it already is.
	 *
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	public void awaitEmpty() throws InterruptedException {
		getLock().lock();

		try {
			// Loop to guard against spurious wakeups and workers registered between signal and wakeup
			while (!getWorkers().isEmpty())
				getEmptyCondition().await();
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Blocks until the registry is empty or the timeout elapses, whichever comes first.
	 *
	 * @param timeout the maximum time to wait
	 * @return {@code true} if the registry became empty, {@code false} if the timeout elapsed first
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	@NonNull
	public Boolean awaitEmpty(@NonNull Duration timeout) throws InterruptedException {
		requireNonNull(timeout);

		long remainingNanos = timeout.toNanos();

		getLock().lock();

		try {
			while (!getWorkers().isEmpty()) {
				if (remainingNanos <= 0L)
					return false;

				remainingNanos = getEmptyCondition().awaitNanos(remainingNanos);
			}

			return true;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Boolean isEmpty() {
		getLock().lock();

		try {
			return getWorkers().isEmpty();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Integer size() {
		getLock().lock();

		try {
			return getWorkers().size();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Boolean contains(@NonNull Runnable worker) {
		requireNonNull(worker);

		getLock().lock();

		try {
			return getWorkers().contains(worker);
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	private Set<Runnable> getWorkers() {
		return this.workers;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	private Condition getEmptyCondition() {
		return this.emptyCondition;
	}
}
