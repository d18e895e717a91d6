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

import java.time.Instant;
import java.util.Objects;

import org.postgresmcp.codemode.SandboxResult;

/**
 * Immutable audit entry for one execution. Written once to the audit log and never read
 * back.
 *
 * @param id unique execution id
 * @param callerId the caller, or null when anonymous
 * @param timestamp when the record was created
 * @param codePreview the submitted code, truncated
 * @param result the execution outcome
 * @param readonly the caller's readonly flag, recorded as given
 */
public record ExecutionRecord(String id, String callerId, Instant timestamp, String codePreview, SandboxResult result,
		boolean readonly) {

	public static final String ANONYMOUS = "anonymous";

	public ExecutionRecord {
		Objects.requireNonNull(id, "id cannot be null");
		Objects.requireNonNull(timestamp, "timestamp cannot be null");
		Objects.requireNonNull(codePreview, "codePreview cannot be null");
		Objects.requireNonNull(result, "result cannot be null");
	}

	public String callerOrAnonymous() {
		return callerId != null ? callerId : ANONYMOUS;
	}

}
