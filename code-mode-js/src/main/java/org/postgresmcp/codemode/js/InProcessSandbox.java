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

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.graalvm.polyglot.Engine;
import org.postgresmcp.codemode.ConsoleBuffer;
import org.postgresmcp.codemode.Sandbox;
import org.postgresmcp.codemode.SandboxOptions;
import org.postgresmcp.codemode.SandboxResult;
import org.postgresmcp.codemode.api.ApiBindings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sandbox running scripts in a GraalJS context inside the host JVM.
 *
 * <p>
 * The context is created once and reused for every execution until a timeout cancels it,
 * which makes the sandbox unhealthy. Bound-API calls run directly on the host's
 * {@link org.postgresmcp.codemode.api.BoundMethod}s. The memory limit is advisory here:
 * scripts share the host heap.
 * </p>
 *
 * <pre>{@code
 * try (Engine engine = ScriptRealm.newEngine();
 *         Sandbox sandbox = new InProcessSandbox(engine, SandboxOptions.defaults())) {
 *     SandboxResult result = sandbox.execute("return 1 + 1", ApiBindings.empty());
 * }
 * }</pre>
 */
public class InProcessSandbox implements Sandbox {

	private static final Logger logger = LoggerFactory.getLogger(InProcessSandbox.class);

	private static final ObjectMapper objectMapper = new ObjectMapper();

	private final SandboxOptions options;

	private final ConsoleBuffer console = new ConsoleBuffer();

	private final ScriptRealm realm;

	private volatile boolean disposed;

	/**
	 * Creates a sandbox with its own context on the given engine.
	 * @param engine the shared engine
	 * @param options limits for every execution
	 */
	public InProcessSandbox(Engine engine, SandboxOptions options) {
		this.options = Objects.requireNonNull(options, "options cannot be null");
		this.realm = new ScriptRealm(engine, console);
		logger.debug("Created in-process sandbox with {}", options);
	}

	@Override
	public synchronized SandboxResult execute(String code, ApiBindings bindings) {
		if (disposed) {
			return SandboxResult.disposed();
		}
		SandboxResult result = realm.run(code, bindings.shape(), new BindingsCallHandler(bindings, objectMapper),
				options.timeout());
		console.flush();
		if (!result.success()) {
			logger.debug("In-process execution failed: {}", ((SandboxResult.Failure) result).error());
		}
		return result;
	}

	@Override
	public boolean isHealthy() {
		return !disposed && realm.isUsable();
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

	public SandboxOptions getOptions() {
		return options;
	}

	@Override
	public void dispose() {
		if (disposed) {
			return;
		}
		disposed = true;
		realm.close();
		console.clear();
		logger.debug("In-process sandbox disposed");
	}

	@Override
	public String toString() {
		return String.format("InProcessSandbox{options=%s, healthy=%s, disposed=%s}", options, isHealthy(), disposed);
	}

}
