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

import java.util.List;

import org.postgresmcp.codemode.api.ApiBindings;

/**
 * Sandbox interface for running caller-supplied scripts in an isolated execution
 * context.
 *
 * <p>
 * A sandbox owns one isolation context and runs exactly one script at a time. The script
 * sees no host filesystem, process, network or environment primitives; its only
 * capabilities are the {@link ApiBindings} passed to {@link #execute}. Implementations
 * never throw for script problems: timeouts, uncaught script errors and use after
 * disposal are all reported as a failed {@link SandboxResult}.
 * </p>
 *
 * <pre>{@code
 * try (Sandbox sandbox = factory.createSandbox()) {
 *     SandboxResult result = sandbox.execute("return 1 + 1", ApiBindings.empty());
 * }  // disposed on close
 * }</pre>
 *
 * @see SandboxPool
 */
public interface Sandbox extends AutoCloseable {

	/**
	 * Run a script body to completion. The body may use {@code await} and
	 * {@code return}; the returned value becomes the result.
	 * @param code the script body
	 * @param bindings the capability table exposed to the script
	 * @return the execution result, never null
	 */
	SandboxResult execute(String code, ApiBindings bindings);

	/**
	 * Whether this sandbox can be reused. A disposed sandbox, or one whose isolation
	 * context was torn down by a timeout or crash, is unhealthy.
	 * @return true if the sandbox may execute again
	 */
	boolean isHealthy();

	/**
	 * Check if this sandbox has been disposed.
	 * @return true if disposed
	 */
	boolean isDisposed();

	/**
	 * Lines the script printed through its console, oldest first.
	 * @return a snapshot of the captured output
	 */
	List<String> getConsoleOutput();

	/**
	 * Discard captured console output, done before a sandbox is reused.
	 */
	void clearConsoleOutput();

	/**
	 * Release the isolation context. Idempotent.
	 */
	void dispose();

	@Override
	default void close() {
		dispose();
	}

}
