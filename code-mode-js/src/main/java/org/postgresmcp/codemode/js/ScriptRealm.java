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

import java.io.InputStream;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.ThreadMXBean;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.io.IOAccess;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.postgresmcp.codemode.ConsoleBuffer;
import org.postgresmcp.codemode.ExecutionMetrics;
import org.postgresmcp.codemode.SandboxResult;
import org.postgresmcp.codemode.security.ResultStandIns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single GraalJS context locked down for running untrusted script bodies.
 *
 * <p>
 * The context has no host access, no IO, no threads, no processes and no environment.
 * Host-flavoured globals ({@code print}, {@code load}, {@code Java}, {@code Polyglot}, ...)
 * are removed and {@code console} is replaced by a frozen object writing to a
 * {@link ConsoleBuffer}. Each {@link #run} wraps the body in an async function whose only
 * parameter is the frozen {@code pg} namespace, so {@code await} and {@code return} work
 * at the top level of the body.
 * </p>
 *
 * <p>
 * Bound-API calls return promises that are settled on the calling thread: completions
 * from the host are queued and drained by a small event loop until the script's promise
 * settles. A watchdog cancels the context when the timeout elapses; a cancelled realm is
 * no longer {@link #isUsable() usable}.
 * </p>
 *
 * <p>
 * Not thread safe. One execution at a time.
 * </p>
 */
public final class ScriptRealm implements AutoCloseable {

	public static final String LANGUAGE = "js";

	/**
	 * Name under which the bound API is visible to scripts.
	 */
	public static final String NAMESPACE = "pg";

	private static final String SCRIPT_NAME = "codemode-script.js";

	private static final Logger logger = LoggerFactory.getLogger(ScriptRealm.class);

	private static final ObjectMapper objectMapper = new ObjectMapper();

	private static final Runnable WAKE_UP = () -> {
	};

	private static final long DRAIN_GRACE_MILLIS = 250;

	/**
	 * Error reported when a script throws a value that cannot be converted to text.
	 */
	static final String UNKNOWN_THROWN = "Uncaught non-Error value";

	private static final AtomicInteger watchdogThreads = new AtomicInteger();

	private static final ScheduledExecutorService watchdog = Executors.newScheduledThreadPool(1, runnable -> {
		Thread thread = new Thread(runnable, "code-mode-watchdog-" + watchdogThreads.incrementAndGet());
		thread.setDaemon(true);
		return thread;
	});

	// @formatter:off
	private static final String PRELUDE = String.join("\n",
			"(function (sink) {",
			"  for (const name of ['print', 'printErr', 'load', 'loadWithNewGlobal', 'quit', 'exit',",
			"      'read', 'readbuffer', 'readline', 'Graal', 'Polyglot', 'Java', 'Packages']) {",
			"    delete globalThis[name];",
			"  }",
			"  const stringify = JSON.stringify;",
			"  const parse = JSON.parse;",
			"  const freeze = Object.freeze;",
			"  const keys = Object.keys;",
			"  const PromiseCtor = Promise;",
			"  const ErrorCtor = Error;",
			"  const map = Array.prototype.map;",
			"  const apply = Reflect.apply;",
			"  const objectToString = Object.prototype.toString;",
			"  const UNKNOWN_THROWN = '" + UNKNOWN_THROWN + "';",
			"  const text = (v) => { try { return String(v); } catch (ignored) { return null; } };",
			"  const format = (args) => map.call(args,",
			"      (a) => typeof a === 'object' && a !== null ? stringify(a) : String(a)).join(' ');",
			"  const console = freeze({",
			"    log: function () { sink(format(arguments)); },",
			"    info: function () { sink('[INFO] ' + format(arguments)); },",
			"    warn: function () { sink('[WARN] ' + format(arguments)); },",
			"    error: function () { sink('[ERROR] ' + format(arguments)); },",
			"    debug: function () { sink('[DEBUG] ' + format(arguments)); }",
			"  });",
			"  Object.defineProperty(globalThis, 'console',",
			"      { value: console, writable: false, configurable: false, enumerable: false });",
			"  return freeze({",
			"    namespace: function (shapeJson, invoke) {",
			"      const shape = parse(shapeJson);",
			"      const api = {};",
			"      for (const group of keys(shape)) {",
			"        const methods = {};",
			"        for (const method of shape[group]) {",
			"          methods[method] = function (params) {",
			"            return new PromiseCtor(function (resolve, reject) {",
			"              invoke(group, method, params === undefined ? null : stringify(params), resolve, reject);",
			"            });",
			"          };",
			"        }",
			"        api[group] = freeze(methods);",
			"      }",
			"      return freeze(api);",
			"    },",
			"    encode: function (value) {",
			"      if (value === undefined) { return null; }",
			"      const json = stringify(value);",
			"      return json === undefined ? null : json;",
			"    },",
			"    decode: function (json) { return parse(json); },",
			"    describe: function (e) {",
			"      try {",
			"        if (e instanceof ErrorCtor) {",
			"          const message = text(e.message);",
			"          return [message === null ? UNKNOWN_THROWN : message, e.stack === undefined ? null : text(e.stack)];",
			"        }",
			"      } catch (ignored) {",
			"        // fall through to the plain conversions",
			"      }",
			"      const plain = text(e);",
			"      if (plain !== null) { return [plain, null]; }",
			"      try {",
			"        return [apply(objectToString, e, []), null];",
			"      } catch (ignored) {",
			"        return [UNKNOWN_THROWN, null];",
			"      }",
			"    },",
			"    error: function (message) { return new ErrorCtor(message); },",
			"    typeOf: function (value) { return typeof value; }",
			"  });",
			"})");
	// @formatter:on

	private final Context context;

	private final Value prelude;

	private volatile boolean usable = true;

	private volatile boolean closed;

	/**
	 * Creates a realm on a shared engine.
	 * @param engine the engine; shared across realms, owned by the caller
	 * @param console receives everything the script prints
	 */
	public ScriptRealm(Engine engine, ConsoleBuffer console) {
		Objects.requireNonNull(engine, "engine cannot be null");
		Objects.requireNonNull(console, "console cannot be null");
		this.context = Context.newBuilder(LANGUAGE)
			.engine(engine)
			.allowHostAccess(HostAccess.NONE)
			.allowHostClassLookup(className -> false)
			.allowIO(IOAccess.NONE)
			.allowCreateThread(false)
			.allowCreateProcess(false)
			.allowNativeAccess(false)
			.allowEnvironmentAccess(EnvironmentAccess.NONE)
			.allowPolyglotAccess(PolyglotAccess.NONE)
			.in(InputStream.nullInputStream())
			.out(console.asOutputStream())
			.err(console.asOutputStream())
			.build();
		try {
			ProxyExecutable sink = arguments -> {
				console.append(arguments.length > 0 ? arguments[0].asString() : "");
				return null;
			};
			this.prelude = context.eval(Source.newBuilder(LANGUAGE, PRELUDE, "codemode-prelude.js").buildLiteral())
				.execute(sink);
		}
		catch (RuntimeException e) {
			context.close(true);
			throw e;
		}
	}

	/**
	 * Creates the engine realms share. Compilation stays on the default runtime; the
	 * interpreter-only warning is silenced because plain JDKs run without a Graal JIT.
	 * @return a new engine; close it after every realm using it
	 */
	public static Engine newEngine() {
		return Engine.newBuilder(LANGUAGE).option("engine.WarnInterpreterOnly", "false").build();
	}

	/**
	 * Runs a script body to completion.
	 * @param code the script body
	 * @param api the bound API shape, group → method names
	 * @param handler receives the script's API calls
	 * @param timeout wall-clock budget
	 * @return the outcome; never throws for script problems
	 */
	public SandboxResult run(String code, Map<String, List<String>> api, HostCallHandler handler, Duration timeout) {
		if (closed || !usable) {
			return SandboxResult.failure("Script realm is no longer usable", null, ExecutionMetrics.zero());
		}
		Execution execution = new Execution(handler);
		Meter meter = Meter.start();
		ScheduledFuture<?> timer = watchdog.schedule(execution::expire, timeout.toMillis(), TimeUnit.MILLISECONDS);
		try {
			Value function = context
				.eval(Source.newBuilder(LANGUAGE, "(async function (" + NAMESPACE + ") {\n" + code + "\n})", SCRIPT_NAME)
					.buildLiteral());
			Value namespace = prelude.invokeMember("namespace", objectMapper.writeValueAsString(api),
					(ProxyExecutable) arguments -> invoke(execution, arguments));
			Value promise = function.execute(namespace);
			promise.invokeMember("then", (ProxyExecutable) arguments -> {
				execution.fulfill(arguments.length > 0 ? arguments[0] : null);
				return null;
			}, (ProxyExecutable) arguments -> {
				execution.reject(arguments.length > 0 ? arguments[0] : null);
				return null;
			});
			drain(execution, meter.startNanos + timeout.toNanos());
			if (!execution.finish()) {
				return SandboxResult.timeout(timeout, meter.stop());
			}
			return execution.result(meter.stop());
		}
		catch (PolyglotException e) {
			if (!execution.finish()) {
				return SandboxResult.timeout(timeout, meter.stop());
			}
			if (e.isCancelled()) {
				// closed by close() rather than the watchdog
				usable = false;
				return SandboxResult.failure(SandboxResult.DISPOSED_MESSAGE, null, meter.stop());
			}
			if (e.isInternalError()) {
				usable = false;
				logger.warn("Script engine failed internally", e);
			}
			return SandboxResult.failure(e.getMessage(), guestStack(e), meter.stop());
		}
		catch (IllegalStateException e) {
			// context closed underneath us by the watchdog
			if (!execution.finish()) {
				return SandboxResult.timeout(timeout, meter.stop());
			}
			throw e;
		}
		catch (JsonProcessingException e) {
			execution.finish();
			return SandboxResult.failure("API shape could not be encoded: " + e.getOriginalMessage(), null,
					meter.stop());
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			execution.finish();
			return SandboxResult.failure("Execution interrupted", null, meter.stop());
		}
		finally {
			timer.cancel(false);
		}
	}

	private void drain(Execution execution, long deadlineNanos) throws InterruptedException {
		while (!execution.settled && !execution.expired()) {
			long remaining = deadlineNanos - System.nanoTime();
			long wait = Math.max(remaining, 0) + TimeUnit.MILLISECONDS.toNanos(DRAIN_GRACE_MILLIS);
			Runnable task = execution.tasks.poll(wait, TimeUnit.NANOSECONDS);
			if (task != null) {
				task.run();
			}
			else if (System.nanoTime() - deadlineNanos >= 0) {
				execution.expire();
			}
		}
	}

	private Object invoke(Execution execution, Value... arguments) {
		String group = arguments[0].asString();
		String method = arguments[1].asString();
		String params = arguments[2].isNull() ? null : arguments[2].asString();
		Value resolve = arguments[3];
		Value reject = arguments[4];
		CompletionStage<String> call;
		try {
			call = execution.handler.call(group, method, params);
		}
		catch (RuntimeException e) {
			call = CompletableFuture.failedFuture(e);
		}
		call.whenComplete((json, error) -> execution.tasks.offer(() -> {
			if (error != null) {
				reject.executeVoid(prelude.invokeMember("error", messageOf(error)));
			}
			else if (json == null) {
				resolve.executeVoid();
			}
			else {
				resolve.executeVoid(prelude.invokeMember("decode", json));
			}
		}));
		return null;
	}

	private String guestStack(PolyglotException e) {
		if (!e.isGuestException() || e.isSyntaxError()) {
			return null;
		}
		Value guest = e.getGuestObject();
		if (guest == null || guest.isNull()) {
			return null;
		}
		try {
			Value described = prelude.invokeMember("describe", guest);
			Value stack = described.getArrayElement(1);
			return stack.isNull() ? null : stack.asString();
		}
		catch (PolyglotException | IllegalStateException ex) {
			logger.debug("Could not read guest stack", ex);
			return null;
		}
	}

	static String messageOf(Throwable error) {
		Throwable cause = error;
		while ((cause instanceof CompletionException || cause instanceof ExecutionException)
				&& cause.getCause() != null) {
			cause = cause.getCause();
		}
		return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
	}

	/**
	 * Whether the realm can run another script. False once closed or cancelled.
	 * @return true if usable
	 */
	public boolean isUsable() {
		return usable && !closed;
	}

	/**
	 * Closes the context, cancelling a running script. Idempotent.
	 */
	@Override
	public void close() {
		if (closed) {
			return;
		}
		closed = true;
		try {
			context.close(true);
		}
		catch (PolyglotException | IllegalStateException e) {
			logger.debug("Script context close reported a problem", e);
		}
	}

	/**
	 * Per-run state shared between the calling thread, the watchdog and host completions.
	 */
	private final class Execution {

		private static final int RUNNING = 0;

		private static final int DONE = 1;

		private static final int EXPIRED = 2;

		private final AtomicInteger state = new AtomicInteger(RUNNING);

		private final BlockingQueue<Runnable> tasks = new LinkedBlockingQueue<>();

		private final HostCallHandler handler;

		private volatile boolean settled;

		private boolean fulfilled;

		private String json;

		private String unserializableType;

		private String error;

		private String stack;

		Execution(HostCallHandler handler) {
			this.handler = Objects.requireNonNull(handler, "handler cannot be null");
		}

		void fulfill(Value value) {
			fulfilled = true;
			try {
				Value encoded = prelude.invokeMember("encode", value);
				json = encoded.isNull() ? null : encoded.asString();
			}
			catch (PolyglotException e) {
				if (e.isCancelled()) {
					throw e;
				}
				unserializableType = prelude.invokeMember("typeOf", value).asString();
			}
			settled = true;
		}

		void reject(Value reason) {
			try {
				Value described = prelude.invokeMember("describe", reason);
				error = described.getArrayElement(0).asString();
				Value stackValue = described.getArrayElement(1);
				stack = stackValue.isNull() ? null : stackValue.asString();
			}
			catch (PolyglotException e) {
				if (e.isCancelled()) {
					throw e;
				}
				logger.debug("Could not describe thrown value", e);
				error = UNKNOWN_THROWN;
				stack = null;
			}
			settled = true;
		}

		boolean expired() {
			return state.get() == EXPIRED;
		}

		boolean finish() {
			return state.compareAndSet(RUNNING, DONE) || state.get() == DONE;
		}

		void expire() {
			if (state.compareAndSet(RUNNING, EXPIRED)) {
				usable = false;
				tasks.offer(WAKE_UP);
				logger.debug("Script exceeded its time budget, cancelling context");
				try {
					context.close(true);
				}
				catch (PolyglotException | IllegalStateException e) {
					logger.debug("Cancelling script context reported a problem", e);
				}
			}
		}

		SandboxResult result(ExecutionMetrics metrics) {
			if (!fulfilled) {
				return SandboxResult.failure(error, stack, metrics);
			}
			if (unserializableType != null) {
				return SandboxResult.success(ResultStandIns.unserializable(unserializableType), metrics);
			}
			if (json == null) {
				return SandboxResult.success(null, metrics);
			}
			try {
				return SandboxResult.success(objectMapper.readValue(json, Object.class), metrics);
			}
			catch (JsonProcessingException e) {
				return SandboxResult.success(ResultStandIns.unserializable("object"), metrics);
			}
		}

	}

	/**
	 * Wall, CPU and heap readings taken around one run.
	 */
	private static final class Meter {

		private static final ThreadMXBean threads = ManagementFactory.getThreadMXBean();

		private static final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();

		private final long startNanos;

		private final long startCpuNanos;

		private final long startHeapBytes;

		private Meter(long startNanos, long startCpuNanos, long startHeapBytes) {
			this.startNanos = startNanos;
			this.startCpuNanos = startCpuNanos;
			this.startHeapBytes = startHeapBytes;
		}

		static Meter start() {
			return new Meter(System.nanoTime(), cpuNanos(), memory.getHeapMemoryUsage().getUsed());
		}

		ExecutionMetrics stop() {
			long wall = System.nanoTime() - startNanos;
			long cpuEnd = cpuNanos();
			long cpu = startCpuNanos < 0 || cpuEnd < 0 ? -1 : cpuEnd - startCpuNanos;
			long heapDelta = Math.max(0, memory.getHeapMemoryUsage().getUsed() - startHeapBytes);
			return ExecutionMetrics.of(wall, cpu, heapDelta);
		}

		private static long cpuNanos() {
			if (threads.isCurrentThreadCpuTimeSupported() && threads.isThreadCpuTimeEnabled()) {
				return threads.getCurrentThreadCpuTime();
			}
			return -1;
		}

	}

}
