/*
 * Copyright 2024 Spring AI Community
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.postgresmcp.codemode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.postgresmcp.codemode.api.ApiBindings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded pool of {@link Sandbox} instances of a single implementation.
 *
 * <p>
 * The pool grows lazily up to {@link PoolOptions#maxInstances()} and is trimmed back to
 * {@link PoolOptions#minInstances()} by a cleanup pass that runs every
 * {@link PoolOptions#idleTimeout()}. {@link #acquire()} never waits: when every slot is
 * taken it throws {@link PoolExhaustedException} so callers get immediate backpressure.
 * </p>
 *
 * <p>
 * Every sandbox known to the pool is either available or in use; sandboxes being created
 * count against the cap before they are handed out, so available + in-use + creating
 * never exceeds the maximum. All bookkeeping happens under one lock; sandbox creation
 * and disposal happen outside it.
 * </p>
 *
 * <pre>{@code
 * SandboxPool pool = new SandboxPool("vm", () -> new InProcessSandbox(engine, options), PoolOptions.defaults());
 * pool.initialize();
 * SandboxResult result = pool.execute("return 1 + 1", ApiBindings.empty());
 * pool.dispose();
 * }</pre>
 */
public class SandboxPool implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(SandboxPool.class);

	private final String name;

	private final Supplier<? extends Sandbox> sandboxSupplier;

	private final PoolOptions options;

	private final ReentrantLock lock = new ReentrantLock();

	private final Deque<Sandbox> available = new ArrayDeque<>();

	private final Set<Sandbox> inUse = Collections.newSetFromMap(new IdentityHashMap<>());

	private int creating;

	private boolean initialized;

	private boolean disposed;

	private ScheduledExecutorService cleanupScheduler;

	/**
	 * Creates an empty pool. Call {@link #initialize()} to warm it up and start the
	 * cleanup timer.
	 * @param name label used in log messages, usually the isolation mode
	 * @param sandboxSupplier creates new sandboxes; may throw {@link SandboxException}
	 * @param options sizing policy
	 */
	public SandboxPool(String name, Supplier<? extends Sandbox> sandboxSupplier, PoolOptions options) {
		this.name = Objects.requireNonNull(name, "name cannot be null");
		this.sandboxSupplier = Objects.requireNonNull(sandboxSupplier, "sandboxSupplier cannot be null");
		this.options = Objects.requireNonNull(options, "options cannot be null");
	}

	/**
	 * Eagerly creates {@code minInstances} sandboxes and starts the periodic cleanup.
	 * Calling it again on a live pool has no effect.
	 * @throws SandboxException if the pool was disposed or a sandbox cannot be created
	 */
	public void initialize() {
		lock.lock();
		try {
			if (disposed) {
				throw new SandboxException("Sandbox pool has been disposed");
			}
			if (initialized) {
				return;
			}
			initialized = true;
		}
		finally {
			lock.unlock();
		}

		logger.info("Initializing {} sandbox pool with {} instances (max: {})", name, options.minInstances(),
				options.maxInstances());
		for (int i = 0; i < options.minInstances(); i++) {
			if (!reserveWarmSlot()) {
				break;
			}
			Sandbox sandbox;
			try {
				sandbox = sandboxSupplier.get();
			}
			catch (RuntimeException e) {
				lock.lock();
				try {
					creating--;
				}
				finally {
					lock.unlock();
				}
				throw e;
			}
			lock.lock();
			try {
				creating--;
				if (!disposed) {
					available.addLast(sandbox);
					sandbox = null;
				}
			}
			finally {
				lock.unlock();
			}
			if (sandbox != null) {
				sandbox.dispose();
			}
		}

		ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, "sandbox-pool-cleanup-" + name);
			thread.setDaemon(true);
			return thread;
		});
		long interval = options.idleTimeout().toMillis();
		scheduler.scheduleAtFixedRate(this::cleanupQuietly, interval, interval, TimeUnit.MILLISECONDS);

		lock.lock();
		try {
			if (disposed) {
				scheduler.shutdownNow();
			}
			else {
				cleanupScheduler = scheduler;
			}
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Counts a warm-up sandbox against the cap, like {@link #acquire()} does for the
	 * sandboxes it creates, so callers acquiring during warm-up never push the pool past
	 * {@code maxInstances}.
	 * @return false if the pool is disposed or already at its cap
	 */
	private boolean reserveWarmSlot() {
		lock.lock();
		try {
			if (disposed || available.size() + inUse.size() + creating >= options.maxInstances()) {
				return false;
			}
			creating++;
			return true;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Takes a healthy sandbox from the pool, creating one if the pool is below its cap.
	 * Unhealthy idle sandboxes met along the way are disposed.
	 * @return a sandbox exclusively owned by the caller until {@link #release}
	 * @throws PoolExhaustedException if the cap is reached
	 * @throws SandboxException if the pool was disposed or creation failed
	 */
	public Sandbox acquire() {
		List<Sandbox> unhealthy = new ArrayList<>();
		try {
			lock.lock();
			try {
				if (disposed) {
					throw new SandboxException("Sandbox pool has been disposed");
				}
				while (!available.isEmpty()) {
					Sandbox sandbox = available.pollLast();
					if (sandbox.isHealthy()) {
						inUse.add(sandbox);
						return sandbox;
					}
					unhealthy.add(sandbox);
				}
				if (inUse.size() + creating >= options.maxInstances()) {
					throw new PoolExhaustedException(options.maxInstances());
				}
				creating++;
			}
			finally {
				lock.unlock();
			}
		}
		finally {
			disposeAll(unhealthy);
		}

		Sandbox created;
		try {
			created = sandboxSupplier.get();
		}
		catch (RuntimeException e) {
			lock.lock();
			try {
				creating--;
			}
			finally {
				lock.unlock();
			}
			throw e;
		}

		lock.lock();
		try {
			creating--;
			if (!disposed) {
				inUse.add(created);
				logger.debug("Created sandbox for {} pool (inUse={})", name, inUse.size());
				return created;
			}
		}
		finally {
			lock.unlock();
		}
		created.dispose();
		throw new SandboxException("Sandbox pool has been disposed");
	}

	/**
	 * Returns a sandbox to the pool. Unknown or already released sandboxes are ignored.
	 * Unhealthy sandboxes, and every sandbox released after the pool was disposed, are
	 * disposed instead of recycled.
	 * @param sandbox the sandbox obtained from {@link #acquire()}
	 */
	public void release(Sandbox sandbox) {
		if (sandbox == null) {
			return;
		}
		lock.lock();
		try {
			if (!inUse.remove(sandbox)) {
				return;
			}
			if (!disposed && sandbox.isHealthy() && available.size() < options.maxInstances()) {
				sandbox.clearConsoleOutput();
				available.addLast(sandbox);
				return;
			}
		}
		finally {
			lock.unlock();
		}
		disposeQuietly(sandbox);
	}

	/**
	 * Acquires a sandbox, runs the script and always releases the sandbox again.
	 * @param code the script body
	 * @param bindings the capability table
	 * @return the execution result
	 * @throws PoolExhaustedException if no sandbox is available
	 */
	public SandboxResult execute(String code, ApiBindings bindings) {
		Sandbox sandbox = acquire();
		try {
			return sandbox.execute(code, bindings);
		}
		finally {
			release(sandbox);
		}
	}

	/**
	 * Disposes unhealthy idle sandboxes and trims the idle set down to
	 * {@code minInstances}, least recently used first. Runs periodically once the pool is
	 * initialized.
	 */
	public void cleanup() {
		List<Sandbox> removed = new ArrayList<>();
		lock.lock();
		try {
			if (disposed) {
				return;
			}
			Iterator<Sandbox> iterator = available.iterator();
			while (iterator.hasNext()) {
				Sandbox sandbox = iterator.next();
				if (!sandbox.isHealthy()) {
					iterator.remove();
					removed.add(sandbox);
				}
			}
			while (available.size() > options.minInstances()) {
				removed.add(available.pollFirst());
			}
		}
		finally {
			lock.unlock();
		}
		if (!removed.isEmpty()) {
			logger.debug("Cleanup of {} pool disposed {} idle sandboxes", name, removed.size());
		}
		disposeAll(removed);
	}

	private void cleanupQuietly() {
		try {
			cleanup();
		}
		catch (RuntimeException e) {
			logger.warn("Cleanup of {} sandbox pool failed", name, e);
		}
	}

	public PoolStats getStats() {
		lock.lock();
		try {
			return new PoolStats(available.size(), inUse.size(), options.maxInstances());
		}
		finally {
			lock.unlock();
		}
	}

	public PoolOptions getOptions() {
		return options;
	}

	public boolean isDisposed() {
		lock.lock();
		try {
			return disposed;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Stops the cleanup timer and disposes every available and in-use sandbox. Later
	 * {@link #acquire()} calls fail. Idempotent.
	 */
	public void dispose() {
		List<Sandbox> all = new ArrayList<>();
		ScheduledExecutorService scheduler;
		lock.lock();
		try {
			if (disposed) {
				return;
			}
			disposed = true;
			all.addAll(available);
			all.addAll(inUse);
			available.clear();
			inUse.clear();
			scheduler = cleanupScheduler;
			cleanupScheduler = null;
		}
		finally {
			lock.unlock();
		}
		if (scheduler != null) {
			scheduler.shutdownNow();
		}
		disposeAll(all);
		logger.info("{} sandbox pool disposed ({} sandboxes)", name, all.size());
	}

	@Override
	public void close() {
		dispose();
	}

	private void disposeAll(List<Sandbox> sandboxes) {
		for (Sandbox sandbox : sandboxes) {
			disposeQuietly(sandbox);
		}
	}

	private void disposeQuietly(Sandbox sandbox) {
		try {
			sandbox.dispose();
		}
		catch (RuntimeException e) {
			logger.warn("Failed to dispose sandbox from {} pool", name, e);
		}
	}

	@Override
	public String toString() {
		PoolStats stats = getStats();
		return String.format("SandboxPool{name=%s, available=%d, inUse=%d, max=%d, disposed=%s}", name,
				stats.available(), stats.inUse(), stats.max(), isDisposed());
	}

}
