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
package org.postgresmcp.codemode.js;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresmcp.codemode.ConsoleBuffer;
import org.postgresmcp.codemode.ExecutionMetrics;
import org.postgresmcp.codemode.Sandbox;
import org.postgresmcp.codemode.SandboxException;
import org.postgresmcp.codemode.SandboxOptions;
import org.postgresmcp.codemode.SandboxResult;
import org.postgresmcp.codemode.api.ApiBindings;
import org.postgresmcp.codemode.js.worker.WorkerMain;
import org.postgresmcp.codemode.js.worker.WorkerMessage;
import org.postgresmcp.codemode.js.worker.WorkerProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sandbox running scripts in a dedicated child JVM.
 *
 * <p>
 * The worker is started when the sandbox is created and serves executions one at a time
 * over newline-delimited JSON (see {@link WorkerMessage}). Its heap is capped at the
 * configured memory limit on top of a fixed baseline for the script engine, so a script
 * that exhausts memory takes down the worker, not the host. Bound-API calls are
 * forwarded to the host and answered from the {@link ApiBindings} given to
 * {@link #execute}.
 * </p>
 *
 * <p>
 * The worker enforces the timeout itself. If it does not answer within the timeout plus
 * a one second grace period it is killed. Either kind of timeout, and any worker exit,
 * leaves the sandbox unhealthy so a pool replaces it.
 * </p>
 */
public class IsolatedProcessSandbox implements Sandbox {

	private static final Logger logger = LoggerFactory.getLogger(IsolatedProcessSandbox.class);

	private static final ObjectMapper objectMapper = new ObjectMapper();

	/**
	 * Heap reserved for the worker's own runtime and script engine.
	 */
	public static final int RUNTIME_HEAP_BASELINE_MB = 256;

	static final Duration STARTUP_TIMEOUT = Duration.ofSeconds(60);

	static final Duration DEADLINE_GRACE = Duration.ofSeconds(1);

	private static final Duration SHUTDOWN_WAIT = Duration.ofMillis(500);

	private static final AtomicLong workerThreads = new AtomicLong();

	private final SandboxOptions options;

	private final ConsoleBuffer console = new ConsoleBuffer();

	private final BlockingQueue<WorkerMessage> inbox = new LinkedBlockingQueue<>();

	private final AtomicLong executionIds = new AtomicLong();

	private final Process process;

	private final Writer toWorker;

	private volatile boolean healthy = true;

	private volatile boolean disposed;

	/**
	 * Starts the worker JVM and waits until it reports ready.
	 * @param options limits for every execution
	 * @throws SandboxException if the worker cannot be started
	 */
	public IsolatedProcessSandbox(SandboxOptions options) {
		this.options = Objects.requireNonNull(options, "options cannot be null");
		List<String> command = workerCommand(options);
		try {
			ProcessBuilder pb = new ProcessBuilder(command);
			logger.debug("Starting worker process: {}", command.get(0));
			this.process = pb.start();
		}
		catch (IOException e) {
			throw new SandboxException("Failed to start worker process", e);
		}
		this.toWorker = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
		startDaemon("code-mode-worker-stdout-", this::readMessages);
		startDaemon("code-mode-worker-stderr-", this::drainErrors);
		awaitReady();
		logger.debug("Worker process {} ready with {}", process.pid(), options);
	}

	static List<String> workerCommand(SandboxOptions options) {
		List<String> command = new ArrayList<>();
		command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
		command.add("-Xmx" + (RUNTIME_HEAP_BASELINE_MB + options.memoryLimitMb()) + "m");
		command.add("-XX:+UseSerialGC");
		command.add("-XX:TieredStopAtLevel=1");
		command.add("-cp");
		command.add(System.getProperty("java.class.path"));
		command.add(WorkerMain.class.getName());
		return command;
	}

	private void awaitReady() {
		try {
			WorkerMessage first = inbox.poll(STARTUP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
			if (first != null && first.is(WorkerMessage.READY)) {
				return;
			}
			process.destroyForcibly();
			throw new SandboxException(first == null
					? "Worker process did not become ready within " + STARTUP_TIMEOUT.toSeconds() + "s"
					: "Worker process failed to start (" + first.type() + ")");
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			process.destroyForcibly();
			throw new SandboxException("Interrupted while starting worker process", e);
		}
	}

	@Override
	public synchronized SandboxResult execute(String code, ApiBindings bindings) {
		if (disposed) {
			return SandboxResult.disposed();
		}
		long start = System.nanoTime();
		if (!isHealthy()) {
			return SandboxResult.failure("Worker process is not running", null, ExecutionMetrics.zero());
		}
		long id = executionIds.incrementAndGet();
		HostCallHandler handler = new BindingsCallHandler(bindings, objectMapper);
		Duration timeout = options.timeout();
		try {
			WorkerProtocol.write(toWorker, WorkerMessage.execute(id, code, timeout.toMillis(), bindings.shape()));
		}
		catch (IOException e) {
			healthy = false;
			return SandboxResult.failure("Worker process communication failed: " + e.getMessage(), null,
					wallOnly(start));
		}

		long deadline = start + timeout.toNanos() + DEADLINE_GRACE.toNanos();
		try {
			while (true) {
				long remaining = deadline - System.nanoTime();
				WorkerMessage message = remaining > 0 ? inbox.poll(remaining, TimeUnit.NANOSECONDS) : null;
				if (message == null) {
					kill("missed its deadline");
					return SandboxResult.timeout(timeout, wallOnly(start));
				}
				if (message.is(WorkerMessage.END_OF_STREAM)) {
					healthy = false;
					if (disposed) {
						return SandboxResult.disposed();
					}
					return SandboxResult.failure("Worker exited with code " + exitCode(), null, wallOnly(start));
				}
				if (message.id() == null || message.id() != id) {
					logger.debug("Dropping stale {} message for execution {}", message.type(), message.id());
					continue;
				}
				if (message.is(WorkerMessage.CALL)) {
					forward(handler, message);
				}
				else if (message.is(WorkerMessage.RESULT)) {
					if (message.console() != null) {
						message.console().forEach(console::append);
					}
					if (Boolean.TRUE.equals(message.timedOut())) {
						healthy = false;
					}
					return message.toResult(timeout, wallOnly(start).wallTimeMs());
				}
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			kill("was interrupted");
			return SandboxResult.failure("Execution interrupted", null, wallOnly(start));
		}
	}

	private void forward(HostCallHandler handler, WorkerMessage call) {
		long id = call.id();
		long callId = call.callId();
		handler.call(call.group(), call.method(), call.payload()).whenComplete((json, error) -> {
			WorkerMessage reply = error == null ? WorkerMessage.callResult(id, callId, json)
					: WorkerMessage.callFailed(id, callId, ScriptRealm.messageOf(error));
			try {
				WorkerProtocol.write(toWorker, reply);
			}
			catch (IOException e) {
				logger.debug("Could not deliver result of call {} to worker", callId, e);
			}
		});
	}

	private static ExecutionMetrics wallOnly(long startNanos) {
		long wallMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
		return new ExecutionMetrics(wallMs, wallMs, 0);
	}

	private String exitCode() {
		try {
			if (process.waitFor(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
				return String.valueOf(process.exitValue());
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
		return "unknown";
	}

	private void kill(String reason) {
		healthy = false;
		logger.warn("Worker process {} {}; killing it", process.pid(), reason);
		process.destroyForcibly();
	}

	private void readMessages() {
		try (BufferedReader reader = new BufferedReader(
				new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				try {
					inbox.offer(WorkerProtocol.read(line));
				}
				catch (JsonProcessingException e) {
					logger.warn("Ignoring malformed worker message: {}", e.getOriginalMessage());
				}
			}
		}
		catch (IOException e) {
			logger.debug("Worker output closed", e);
		}
		finally {
			inbox.offer(WorkerMessage.signal(WorkerMessage.END_OF_STREAM));
		}
	}

	private void drainErrors() {
		try (BufferedReader reader = new BufferedReader(
				new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				logger.debug("[worker {}] {}", process.pid(), line);
			}
		}
		catch (IOException e) {
			logger.debug("Worker error stream closed", e);
		}
	}

	private void startDaemon(String namePrefix, Runnable task) {
		Thread thread = new Thread(task, namePrefix + workerThreads.incrementAndGet());
		thread.setDaemon(true);
		thread.start();
	}

	@Override
	public boolean isHealthy() {
		return healthy && !disposed && process.isAlive();
	}

	@Override
	public boolean isDisposed() {
		return disposed;
	}

	@Override
	public List<String> getConsoleOutput() {
		return console.lines();
	}

	@Override
	public void clearConsoleOutput() {
		console.clear();
	}

	/**
	 * Operating system id of the worker process.
	 * @return the pid
	 */
	public long pid() {
		return process.pid();
	}

	@Override
	public void dispose() {
		if (disposed) {
			return;
		}
		disposed = true;
		healthy = false;
		try {
			WorkerProtocol.write(toWorker, WorkerMessage.signal(WorkerMessage.SHUTDOWN));
			toWorker.close();
		}
		catch (IOException e) {
			logger.debug("Worker process {} already gone", process.pid(), e);
		}
		try {
			if (!process.waitFor(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
				process.destroyForcibly();
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			process.destroyForcibly();
		}
		console.clear();
		logger.debug("Worker process {} disposed", process.pid());
	}

	@Override
	public String toString() {
		return String.format("IsolatedProcessSandbox{pid=%d, options=%s, healthy=%s, disposed=%s}", process.pid(),
				options, isHealthy(), disposed);
	}

}
