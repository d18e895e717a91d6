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

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of running one script in a {@link Sandbox}.
 *
 * <p>
 * Either a {@link Success} carrying the script's return value or a {@link Failure}
 * carrying an error message and optional stack. Both always carry
 * {@link ExecutionMetrics}. Sandboxes return failures rather than throwing, so every
 * execution produces exactly one result.
 * </p>
 */
public sealed interface SandboxResult permits SandboxResult.Success, SandboxResult.Failure {

	/**
	 * Message prefix shared by every timeout failure.
	 */
	String TIMEOUT_PREFIX = "Execution timeout";

	/**
	 * Error text reported when executing on a disposed sandbox.
	 */
	String DISPOSED_MESSAGE = "Sandbox has been disposed";

	ExecutionMetrics metrics();

	boolean success();

	/**
	 * Creates a successful result.
	 * @param value the script's return value, converted to plain Java types; may be null
	 * @param metrics execution metrics
	 * @return the result
	 */
	static SandboxResult success(Object value, ExecutionMetrics metrics) {
		return new Success(value, metrics);
	}

	/**
	 * Creates a failed result for an uncaught script error.
	 * @param error the error message
	 * @param stack the script stack, or null
	 * @param metrics execution metrics
	 * @return the result
	 */
	static SandboxResult failure(String error, String stack, ExecutionMetrics metrics) {
		return new Failure(error, stack, false, metrics);
	}

	/**
	 * Creates a failed result for an execution that exceeded its time budget.
	 * @param limit the configured limit
	 * @param metrics execution metrics
	 * @return the result
	 */
	static SandboxResult timeout(Duration limit, ExecutionMetrics metrics) {
		return new Failure(TIMEOUT_PREFIX + ": exceeded " + limit.toMillis() + "ms limit", null, true, metrics);
	}

	/**
	 * Creates the immediate failure returned by a disposed sandbox.
	 * @return the result, with zeroed metrics
	 */
	static SandboxResult disposed() {
		return new Failure(DISPOSED_MESSAGE, null, false, ExecutionMetrics.zero());
	}

	/**
	 * Successful execution.
	 *
	 * @param value the return value, one of {@code Map}, {@code List}, {@code String},
	 * {@code Number}, {@code Boolean} or null
	 * @param metrics execution metrics
	 */
	record Success(Object value, ExecutionMetrics metrics) implements SandboxResult {

		public Success {
			Objects.requireNonNull(metrics, "metrics cannot be null");
		}

		@Override
		public boolean success() {
			return true;
		}

		/**
		 * Returns a copy carrying a different value, used when results are sanitized.
		 * @param newValue the replacement value
		 * @return a success with the same metrics
		 */
		public Success withValue(Object newValue) {
			return new Success(newValue, metrics);
		}

	}

	/**
	 * Failed execution.
	 *
	 * @param error the error message
	 * @param stack the stack trace, or null
	 * @param timedOut whether the failure was caused by the time budget
	 * @param metrics execution metrics
	 */
	record Failure(String error, String stack, boolean timedOut, ExecutionMetrics metrics) implements SandboxResult {

		public Failure {
			Objects.requireNonNull(error, "error cannot be null");
			Objects.requireNonNull(metrics, "metrics cannot be null");
		}

		@Override
		public boolean success() {
			return false;
		}

	}

}
