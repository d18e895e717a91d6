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

import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.PolyglotException;
import org.postgresmcp.codemode.PoolOptions;
import org.postgresmcp.codemode.Sandbox;
import org.postgresmcp.codemode.SandboxException;
import org.postgresmcp.codemode.SandboxOptions;
import org.postgresmcp.codemode.SandboxPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates sandboxes and sandbox pools for a chosen {@link SandboxMode}.
 *
 * <p>
 * The mode is taken from the explicit argument, else from the default set with
 * {@link #setDefaultMode}, else from {@value SandboxMode#ENVIRONMENT_VARIABLE}. Every
 * {@code createSandbox} call returns a new, independent sandbox. In-process sandboxes
 * share one engine owned by the factory; close the factory after the sandboxes and pools
 * it created.
 * </p>
 */
public class SandboxFactory implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(SandboxFactory.class);

	private final SandboxOptions defaultOptions;

	private volatile SandboxMode defaultMode;

	private Engine engine;

	private boolean closed;

	public SandboxFactory() {
		this(SandboxOptions.defaults());
	}

	/**
	 * Creates a factory applying the given options when a caller passes none.
	 * @param defaultOptions the fallback sandbox options
	 */
	public SandboxFactory(SandboxOptions defaultOptions) {
		this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions cannot be null");
	}

	/**
	 * The mode used when a caller passes none.
	 * @return the stored default, or the environment-configured mode if none was set
	 */
	public SandboxMode getDefaultMode() {
		SandboxMode mode = defaultMode;
		return mode != null ? mode : SandboxMode.fromEnvironment();
	}

	public void setDefaultMode(SandboxMode mode) {
		this.defaultMode = Objects.requireNonNull(mode, "mode cannot be null");
		logger.info("Sandbox default mode set to: {}", mode.value());
	}

	public List<SandboxMode> getAvailableModes() {
		return List.of(SandboxMode.values());
	}

	public SandboxOptions getDefaultOptions() {
		return defaultOptions;
	}

	public Sandbox createSandbox() {
		return createSandbox(null, null);
	}

	/**
	 * Creates a sandbox.
	 * @param mode the isolation mode, or null for the default
	 * @param options the sandbox options, or null for the factory's defaults
	 * @return a new sandbox owned by the caller
	 * @throws SandboxException if the sandbox cannot be created or the factory is closed
	 */
	public Sandbox createSandbox(SandboxMode mode, SandboxOptions options) {
		SandboxMode selected = mode != null ? mode : getDefaultMode();
		SandboxOptions selectedOptions = options != null ? options : defaultOptions;
		switch (selected) {
			case ISOLATED_PROCESS:
				return new IsolatedProcessSandbox(selectedOptions);
			case IN_PROCESS:
			default:
				return new InProcessSandbox(engine(), selectedOptions);
		}
	}

	/**
	 * Creates an uninitialized pool whose sandboxes all use one mode.
	 * @param mode the isolation mode, or null for the default
	 * @param poolOptions the pool sizing, or null for {@link PoolOptions#defaults()}
	 * @param sandboxOptions the sandbox options, or null for the factory's defaults
	 * @return a new pool; call {@link SandboxPool#initialize()} before use
	 */
	public SandboxPool createSandboxPool(SandboxMode mode, PoolOptions poolOptions, SandboxOptions sandboxOptions) {
		SandboxMode selected = mode != null ? mode : getDefaultMode();
		SandboxOptions selectedOptions = sandboxOptions != null ? sandboxOptions : defaultOptions;
		return new SandboxPool(selected.value(), () -> createSandbox(selected, selectedOptions),
				poolOptions != null ? poolOptions : PoolOptions.defaults());
	}

	private synchronized Engine engine() {
		if (closed) {
			throw new SandboxException("Sandbox factory has been closed");
		}
		if (engine == null) {
			engine = ScriptRealm.newEngine();
			logger.debug("Created shared script engine {}", engine.getVersion());
		}
		return engine;
	}

	/**
	 * Closes the shared engine. In-process sandboxes still open are cancelled.
	 */
	@Override
	public synchronized void close() {
		if (closed) {
			return;
		}
		closed = true;
		if (engine != null) {
			try {
				engine.close(true);
			}
			catch (PolyglotException | IllegalStateException e) {
				logger.warn("Failed to close script engine", e);
			}
			engine = null;
		}
	}

	@Override
	public String toString() {
		return String.format("SandboxFactory{defaultMode=%s, defaultOptions=%s}", getDefaultMode().value(),
				defaultOptions);
	}

}
