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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Input of the code execution tool.
 *
 * @param code the script body; may use {@code await} and {@code return}
 * @param timeout requested timeout in milliseconds, or null. Advisory only: the
 * sandbox's configured limit always applies.
 * @param readonly recorded in the audit record; does not restrict the bound API
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecuteCodeRequest(String code, Long timeout, boolean readonly) {

	public static ExecuteCodeRequest of(String code) {
		return new ExecuteCodeRequest(code, null, false);
	}

}
