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
package org.postgresmcp.codemode.security;

import java.util.List;

/**
 * Outcome of {@link SandboxSecurityManager#validateCode(String)}.
 *
 * @param valid whether the code may be executed
 * @param errors every violation found, empty when valid
 */
public record ValidationResult(boolean valid, List<String> errors) {

	public ValidationResult {
		errors = List.copyOf(errors);
	}

	public static ValidationResult of(List<String> errors) {
		return new ValidationResult(errors.isEmpty(), errors);
	}

	/**
	 * Joins the errors for display.
	 * @return the errors separated by {@code "; "}
	 */
	public String summary() {
		return String.join("; ", errors);
	}

}
