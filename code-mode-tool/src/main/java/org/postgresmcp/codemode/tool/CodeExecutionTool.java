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
package org.postgresmcp.codemode.tool;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.postgresmcp.codemode.PoolExhaustedException;
import org.postgresmcp.codemode.PoolOptions;
import org.postgresmcp.codemode.PoolStats;
import org.postgresmcp.codemode.SandboxException;
import org.postgresmcp.codemode.SandboxOptions;
import org.postgresmcp.codemode.SandboxPool;
import org.postgresmcp.codemode.SandboxResult;
import org.postgresmcp.codemode.api.ApiBindings;
import org.postgresmcp.codemode.js.SandboxFactory;
import org.postgresmcp.codemode.js.SandboxMode;
import org.postgresmcp.codemode.security.ExecutionRecord;
import org.postgresmcp.codemode.security.SandboxSecurityManager;
import org.postgresmcp.codemode.security.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@value #NAME} tool: runs caller-supplied JavaScript in a pooled sandbox with the
 * bound API exposed as {@code pg.<group>.<method>(params)}.
 *
 * <p>
 * Every request is validated and rate limited before a sandbox is touched. Successful
 * values are sanitized, and every execution that reached a sandbox gets an audit record.
 * The pool is created on {@link #initialize()} or the first request and disposed by
 * {@link #cleanup()}, after which the tool can be initialized again.
 * </p>
 *
 * <pre>{@code
 * try (CodeExecutionTool tool = new CodeExecutionTool(registry::bindings)) {
 *     ExecuteCodeResponse response = tool.execute(ExecuteCodeRequest.of(
 *             "const tables = await pg.core.listTables(); return tables.length;"));
 * }
 * }</pre>
 */
public class CodeExecutionTool implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(CodeExecutionTool.class);

	public static final String NAME = "pg_execute_code";

	public static final String GROUP = "codemode";

	public static final List<String> TAGS = List.of("code", "execute", "sandbox", "script", "batch");

	/**
	 * Name of the bound API object inside scripts.
	 */
	public static final String NAMESPACE = "pg";

	/**
	 * Caller identity used when a request carries none.
	 */
	public static final String DEFAULT_CALLER = "default";

	public static final String DESCRIPTION = "Execute JavaScript in a sandboxed environment with access to the "
			+ "PostgreSQL tools via the pg.* API.\n"
			+ "Call tools as pg.{group}.{method}(params); every call returns a Promise. The code runs as the body "
			+ "of an async function, so it may use await and must return its result.\n\n"
			+ "Example:\n"
			+ "const tables = await pg.core.listTables();\n"
			+ "const results = [];\n"
			+ "for (const t of tables) {\n"
			+ "    const stats = await pg.performance.tableStats({ table: t.name });\n"
			+ "    results.push({ table: t.name, rows: stats.row_count });\n"
			+ "}\n"
			+ "return results;";

	static final String VALIDATION_HINT = "Use only the pg.* API; require, import, eval, process and prototype "
			+ "access are blocked.";

	static final String POOL_EXHAUSTED_HINT = "All sandboxes are busy. Retry shortly or batch work into fewer "
			+ "executions.";

	static final String SANDBOX_UNAVAILABLE_HINT = "The sandbox could not be started. Retry the request.";

	private final SandboxFactory factory;

	private final boolean ownsFactory;

	private final SandboxSecurityManager securityManager;

	private final ApiBindingProvider bindingProvider;

	private final SandboxMode mode;

	private final PoolOptions poolOptions;

	private final SandboxOptions sandboxOptions;

	private SandboxPool pool;

	private ScheduledExecutorService rateLimitReaper;

	/**
	 * Creates a tool with its own factory, default security settings and the isolation
	 * mode from the environment.
	 * @param bindingProvider supplies the bound API
	 */
	public CodeExecutionTool(ApiBindingProvider bindingProvider) {
		this(new SandboxFactory(), true, new SandboxSecurityManager(), bindingProvider, null, null, null);
	}

	/**
	 * Creates a tool on a caller-owned factory.
	 * @param factory creates the pool; not closed by this tool
	 * @param securityManager validates, rate limits and audits
	 * @param bindingProvider supplies the bound API
	 * @param mode the isolation mode, or null for the factory's default
	 * @param poolOptions pool sizing, or null for the defaults
	 * @param sandboxOptions sandbox limits, or null for the factory's defaults
	 */
	public CodeExecutionTool(SandboxFactory factory, SandboxSecurityManager securityManager,
			ApiBindingProvider bindingProvider, SandboxMode mode, PoolOptions poolOptions,
			SandboxOptions sandboxOptions) {
		this(factory, false, securityManager, bindingProvider, mode, poolOptions, sandboxOptions);
	}

	private CodeExecutionTool(SandboxFactory factory, boolean ownsFactory, SandboxSecurityManager securityManager,
			ApiBindingProvider bindingProvider, SandboxMode mode, PoolOptions poolOptions,
			SandboxOptions sandboxOptions) {
		this.factory = Objects.requireNonNull(factory, "factory cannot be null");
		this.ownsFactory = ownsFactory;
		this.securityManager = Objects.requireNonNull(securityManager, "securityManager cannot be null");
		this.bindingProvider = Objects.requireNonNull(bindingProvider, "bindingProvider cannot be null");
		this.mode = mode;
		this.poolOptions = poolOptions;
		this.sandboxOptions = sandboxOptions;
	}

	/**
	 * Creates and warms the sandbox pool and starts reaping expired rate-limit entries.
	 * Has no effect when already initialized.
	 * @throws SandboxException if the pool cannot be created
	 */
	public synchronized void initialize() {
		if (pool != null) {
			return;
		}
		SandboxPool created = factory.createSandboxPool(mode, poolOptions, sandboxOptions);
		try {
			created.initialize();
		}
		catch (RuntimeException e) {
			created.dispose();
			throw e;
		}
		pool = created;
		rateLimitReaper = Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, "code-mode-rate-limit-reaper");
			thread.setDaemon(true);
			return thread;
		});
		long interval = SandboxSecurityManager.RATE_WINDOW.toMillis();
		rateLimitReaper.scheduleAtFixedRate(this::reapRateLimits, interval, interval, TimeUnit.MILLISECONDS);
		logger.info("Code execution tool initialized ({} mode)", mode != null ? mode.value()
				: factory.getDefaultMode().value());
	}

	private void reapRateLimits() {
		try {
			securityManager.cleanupRateLimits();
		}
		catch (RuntimeException e) {
			logger.warn("Rate limit cleanup failed", e);
		}
	}

	private synchronized SandboxPool pool() {
		initialize();
		return pool;
	}

	public ExecuteCodeResponse execute(ExecuteCodeRequest request) {
		return execute(request, DEFAULT_CALLER);
	}

	/**
	 * Runs one request.
	 * @param request the request
	 * @param callerId the identity rate limits and audit records are keyed by, or null
	 * for {@value #DEFAULT_CALLER}
	 * @return the response; failures are reported in it, never thrown
	 * @throws IllegalStateException if the binding provider supplies no methods
	 */
	public ExecuteCodeResponse execute(ExecuteCodeRequest request, String callerId) {
		Objects.requireNonNull(request, "request cannot be null");
		String caller = callerId != null ? callerId : DEFAULT_CALLER;

		ValidationResult validation = securityManager.validateCode(request.code());
		if (!validation.valid()) {
			logger.debug("Rejected code from {}: {}", caller, validation.summary());
			return ExecuteCodeResponse.rejected("Code validation failed: " + validation.summary(), VALIDATION_HINT);
		}
		if (!securityManager.checkRateLimit(caller)) {
			return ExecuteCodeResponse.rejected("Rate limit exceeded. Please wait before executing more code.",
					"At most " + securityManager.getConfig().maxExecutionsPerMinute()
							+ " executions are allowed per caller per minute.");
		}

		ApiBindings bindings = bindingProvider.bindings();
		if (bindings == null || bindings.isEmpty()) {
			throw new IllegalStateException("No API methods are bound to the " + NAMESPACE + " namespace");
		}
		if (request.timeout() != null) {
			logger.debug("Requested timeout of {}ms is advisory; the sandbox limit applies", request.timeout());
		}

		SandboxResult result;
		try {
			result = pool().execute(request.code(), bindings);
		}
		catch (PoolExhaustedException e) {
			logger.warn("Rejected execution for {}: {}", caller, e.getMessage());
			return ExecuteCodeResponse.rejected(e.getMessage(), POOL_EXHAUSTED_HINT);
		}
		catch (SandboxException e) {
			logger.warn("No sandbox available for {}", caller, e);
			return ExecuteCodeResponse.rejected("Sandbox unavailable: " + e.getMessage(), SANDBOX_UNAVAILABLE_HINT);
		}

		if (result.success()) {
			SandboxResult.Success success = (SandboxResult.Success) result;
			if (success.value() != null) {
				result = success.withValue(securityManager.sanitizeResult(success.value()));
			}
		}
		ExecutionRecord record = securityManager.createExecutionRecord(request.code(), result, request.readonly(),
				caller);
		securityManager.auditLog(record);
		return ExecuteCodeResponse.from(result, hintFor(result));
	}

	private String hintFor(SandboxResult result) {
		if (!result.success() && ((SandboxResult.Failure) result).timedOut()) {
			return "The script ran out of time. Do less work per execution or split it across several calls.";
		}
		return null;
	}

	/**
	 * Lists the bound groups with their method counts, for tool descriptions.
	 * @return one line per group, like {@code "pg.core (13 methods)"}
	 */
	public String describeApi() {
		StringBuilder description = new StringBuilder("Available API groups:");
		ApiBindings bindings = bindingProvider.bindings();
		for (Map.Entry<String, List<String>> group : bindings.shape().entrySet()) {
			description.append(System.lineSeparator())
				.append("- ")
				.append(NAMESPACE)
				.append('.')
				.append(group.getKey())
				.append(" (")
				.append(group.getValue().size())
				.append(" methods)");
		}
		return description.toString();
	}

	public SandboxSecurityManager getSecurityManager() {
		return securityManager;
	}

	/**
	 * Statistics of the current pool.
	 * @return the stats, or empty when the tool is not initialized
	 */
	public synchronized Optional<PoolStats> getPoolStats() {
		return Optional.ofNullable(pool).map(SandboxPool::getStats);
	}

	public synchronized boolean isInitialized() {
		return pool != null;
	}

	/**
	 * Disposes the pool and stops the rate-limit reaper. A later request or
	 * {@link #initialize()} creates a fresh pool. Idempotent.
	 */
	public synchronized void cleanup() {
		if (rateLimitReaper != null) {
			rateLimitReaper.shutdownNow();
			rateLimitReaper = null;
		}
		if (pool != null) {
			pool.dispose();
			pool = null;
			logger.info("Code execution tool cleaned up");
		}
	}

	@Override
	public synchronized void close() {
		cleanup();
		if (ownsFactory) {
			factory.close();
		}
	}

}
