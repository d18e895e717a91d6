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

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Isolation strategy for sandboxes created by {@link SandboxFactory}.
 */
public enum SandboxMode {

	/**
	 * A GraalJS context inside the host JVM. Cheap to reuse.
	 */
	IN_PROCESS("vm", new SandboxModeInfo("VM Context", "Separate script context within the host JVM",
			"Low overhead (reusable contexts)", "Standard - no host access, blocked globals")),

	/**
	 * A dedicated worker JVM per sandbox.
	 */
	ISOLATED_PROCESS("worker", new SandboxModeInfo("Worker Process", "Separate JVM and heap per sandbox",
			"Higher overhead (process start per sandbox, message passing per API call)",
			"Enhanced - isolated memory, hard timeouts"));

	/**
	 * Environment variable selecting the fallback mode, {@code vm} or {@code worker}.
	 */
	public static final String ENVIRONMENT_VARIABLE = "CODEMODE_ISOLATION";

	private static final Logger logger = LoggerFactory.getLogger(SandboxMode.class);

	private final String value;

	private final SandboxModeInfo info;

	SandboxMode(String value, SandboxModeInfo info) {
		this.value = value;
		this.info = info;
	}

	/**
	 * Configuration value of this mode.
	 * @return {@code vm} or {@code worker}
	 */
	public String value() {
		return value;
	}

	public SandboxModeInfo info() {
		return info;
	}

	/**
	 * Parses a configuration value, ignoring case and surrounding blanks.
	 * @param value {@code vm} or {@code worker}
	 * @return the mode
	 * @throws IllegalArgumentException for any other value
	 */
	public static SandboxMode fromValue(String value) {
		if (value != null) {
			String normalized = value.trim().toLowerCase(Locale.ROOT);
			for (SandboxMode mode : values()) {
				if (mode.value.equals(normalized)) {
					return mode;
				}
			}
		}
		throw new IllegalArgumentException("Unknown sandbox mode: " + value);
	}

	/**
	 * Lenient variant of {@link #fromValue}: absent or unknown values select
	 * {@link #IN_PROCESS}.
	 * @param value the configured value, may be null
	 * @return the mode
	 */
	public static SandboxMode resolve(String value) {
		if (value == null || value.isBlank()) {
			return IN_PROCESS;
		}
		try {
			return fromValue(value);
		}
		catch (IllegalArgumentException e) {
			logger.warn("Unknown sandbox mode '{}', falling back to {}", value, IN_PROCESS.value);
			return IN_PROCESS;
		}
	}

	/**
	 * Mode configured through {@value #ENVIRONMENT_VARIABLE}.
	 * @return the configured mode, {@link #IN_PROCESS} when unset
	 */
	public static SandboxMode fromEnvironment() {
		return resolve(System.getenv(ENVIRONMENT_VARIABLE));
	}

}
