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

import com.fasterxml.jackson.annotation.JsonInclude;
import org.postgresmcp.codemode.ExecutionMetrics;
import org.postgresmcp.codemode.SandboxResult;

/**
 * Output of the code execution tool. Serializes to
 * {@code {success, result?, error?, stack?, metrics, hint?}}.
 *
 * @param success whether the script completed
 * @param result the sanitized return value, only on success
 * @param error the error message, only on failure
 * @param stack the script stack trace, when the failure has one
 * @param metrics execution metrics; zero when no sandbox ran
 * @param hint a remediation hint for the caller, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecuteCodeResponse(boolean success, Object result, String error, String stack,
		ExecutionMetrics metrics, String hint) {

	/**
	 * Response for a request that never reached a sandbox.
	 * @param error what went wrong
	 * @param hint how to fix it
	 * @return a failed response with zero metrics
	 */
	static ExecuteCodeResponse rejected(String error, String hint) {
		return new ExecuteCodeResponse(false, null, error, null, ExecutionMetrics.zero(), hint);
	}

	static ExecuteCodeResponse from(SandboxResult result, String hint) {
		if (result.success()) {
			SandboxResult.Success success = (SandboxResult.Success) result;
			return new ExecuteCodeResponse(true, success.value(), null, null, success.metrics(), null);
		}
		SandboxResult.Failure failure = (SandboxResult.Failure) result;
		return new ExecuteCodeResponse(false, null, failure.error(), failure.stack(), failure.metrics(), hint);
	}

}
