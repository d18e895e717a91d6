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
package org.postgresmcp.codemode.js.worker;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.graalvm.polyglot.Engine;
import org.postgresmcp.codemode.ConsoleBuffer;
import org.postgresmcp.codemode.ExecutionMetrics;
import org.postgresmcp.codemode.SandboxException;
import org.postgresmcp.codemode.SandboxResult;
import org.postgresmcp.codemode.js.HostCallHandler;
import org.postgresmcp.codemode.js.ScriptRealm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the worker JVM behind an isolated-process sandbox.
 *
 * <p>
 * Stdout carries protocol lines only; anything else the JVM prints is sent to stderr,
 * which the host drains into its log. Every execution gets a fresh {@link ScriptRealm} on
 * one engine, so no script state survives between executions. Bound-API calls are
 * forwarded to the host as {@code call} messages and resumed when the matching
 * {@code callResult} arrives.
 * </p>
 */
public final class WorkerMain {

	private static final Logger logger = LoggerFactory.getLogger(WorkerMain.class);

	private final BufferedReader in;

	private final Writer out;

	private final BlockingQueue<WorkerMessage> executions = new LinkedBlockingQueue<>();

	private final Map<Long, CompletableFuture<String>> pendingCalls = new ConcurrentHashMap<>();

	private final AtomicLong callIds = new AtomicLong();

	WorkerMain(BufferedReader in, Writer out) {
		this.in = in;
		this.out = out;
	}

	public static void main(String[] args) {
		PrintStream protocol = System.out;
		System.setOut(System.err);
		BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
		Writer out = new BufferedWriter(new OutputStreamWriter(protocol, StandardCharsets.UTF_8));
		int status;
		try {
			status = new WorkerMain(in, out).serve();
		}
		catch (RuntimeException e) {
			logger.error("Worker failed", e);
			status = 1;
		}
		System.exit(status);
	}

	/**
	 * Serves executions until {@code shutdown} or the end of stdin.
	 * @return the process exit status
	 */
	int serve() {
		try (Engine engine = ScriptRealm.newEngine()) {
			WorkerProtocol.write(out, WorkerMessage.signal(WorkerMessage.READY));
			Thread reader = new Thread(this::readMessages, "code-mode-worker-reader");
			reader.setDaemon(true);
			reader.start();
			while (true) {
				WorkerMessage message = executions.take();
				if (!message.is(WorkerMessage.EXECUTE)) {
					logger.debug("Worker shutting down on {}", message.type());
					return 0;
				}
				execute(engine, message);
			}
		}
		catch (IOException e) {
			logger.warn("Host connection lost", e);
			return 2;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return 3;
		}
	}

	private void execute(Engine engine, WorkerMessage message) throws IOException {
		long id = message.id();
		ConsoleBuffer console = new ConsoleBuffer();
		SandboxResult result;
		try (ScriptRealm realm = new ScriptRealm(engine, console)) {
			result = realm.run(message.code(), message.api() != null ? message.api() : Map.of(), callHandler(id),
					Duration.ofMillis(message.timeoutMs()));
		}
		catch (RuntimeException e) {
			logger.warn("Execution {} failed outside the script", id, e);
			result = SandboxResult.failure("Worker could not run script: " + e.getMessage(), null,
					ExecutionMetrics.zero());
		}
		finally {
			pendingCalls.values().forEach(call -> call.cancel(false));
			pendingCalls.clear();
		}
		console.flush();
		WorkerProtocol.write(out, WorkerMessage.result(id, result, console.lines()));
	}

	private HostCallHandler callHandler(long executionId) {
		return (group, method, paramsJson) -> {
			long callId = callIds.incrementAndGet();
			CompletableFuture<String> call = new CompletableFuture<>();
			pendingCalls.put(callId, call);
			try {
				WorkerProtocol.write(out, WorkerMessage.call(executionId, callId, group, method, paramsJson));
			}
			catch (IOException e) {
				pendingCalls.remove(callId);
				return CompletableFuture.failedFuture(new SandboxException("Host connection lost", e));
			}
			return call;
		};
	}

	private void readMessages() {
		try {
			String line;
			while ((line = in.readLine()) != null) {
				dispatch(line);
			}
		}
		catch (IOException e) {
			logger.debug("Host input closed", e);
		}
		finally {
			executions.offer(WorkerMessage.signal(WorkerMessage.END_OF_STREAM));
		}
	}

	private void dispatch(String line) {
		WorkerMessage message;
		try {
			message = WorkerProtocol.read(line);
		}
		catch (JsonProcessingException e) {
			logger.warn("Ignoring malformed host message: {}", e.getOriginalMessage());
			return;
		}
		if (message.is(WorkerMessage.CALL_RESULT)) {
			complete(message);
		}
		else {
			executions.offer(message);
		}
	}

	private void complete(WorkerMessage message) {
		CompletableFuture<String> call = pendingCalls.remove(message.callId());
		if (call == null) {
			logger.debug("Dropping result of unknown call {}", message.callId());
			return;
		}
		if (Boolean.TRUE.equals(message.ok())) {
			call.complete(message.payload());
		}
		else {
			String error = message.error() != null ? message.error() : "API call failed";
			call.completeExceptionally(new SandboxException(error));
		}
	}

}
