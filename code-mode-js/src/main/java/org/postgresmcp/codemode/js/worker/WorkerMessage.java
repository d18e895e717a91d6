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
package org.postgresmcp.codemode.js.worker;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.postgresmcp.codemode.ExecutionMetrics;
import org.postgresmcp.codemode.SandboxResult;

/**
 * One line of the worker protocol. Host and worker exchange these as newline-delimited
 * JSON over the worker's stdin and stdout; unused fields are omitted.
 *
 * <pre>
 * worker → host   ready
 * host → worker   execute      id, code, timeoutMs, api
 * worker → host   call         id, callId, group, method, payload
 * host → worker   callResult   id, callId, ok, payload | error
 * worker → host   result       id, ok, value | error, stack, timedOut, cpuTimeMs, memoryUsedMb, console
 * host → worker   shutdown
 * </pre>
 *
 * @param type the message type
 * @param id the execution the message belongs to
 * @param code the script body
 * @param timeoutMs the execution budget
 * @param api the bound API shape, group → method names
 * @param callId correlates a call with its result
 * @param group the called API group
 * @param method the called method
 * @param payload JSON text of call parameters or call results
 * @param ok whether a call or execution succeeded
 * @param value the script's return value
 * @param error the error message of a failed call or execution
 * @param stack the script stack of a failed execution
 * @param timedOut whether the execution hit its budget
 * @param cpuTimeMs CPU time measured in the worker
 * @param memoryUsedMb heap delta measured in the worker
 * @param console lines the script printed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkerMessage(String type, Long id, String code, Long timeoutMs, Map<String, List<String>> api,
		Long callId, String group, String method, String payload, Boolean ok, Object value, String error,
		String stack, Boolean timedOut, Long cpuTimeMs, Double memoryUsedMb, List<String> console) {

	public static final String READY = "ready";

	public static final String EXECUTE = "execute";

	public static final String CALL = "call";

	public static final String CALL_RESULT = "callResult";

	public static final String RESULT = "result";

	public static final String SHUTDOWN = "shutdown";

	/**
	 * Local marker for a closed stream; never written.
	 */
	public static final String END_OF_STREAM = "eof";

	public static WorkerMessage signal(String type) {
		return new WorkerMessage(type, null, null, null, null, null, null, null, null, null, null, null, null, null,
				null, null, null);
	}

	public static WorkerMessage execute(long id, String code, long timeoutMs, Map<String, List<String>> api) {
		return new WorkerMessage(EXECUTE, id, code, timeoutMs, api, null, null, null, null, null, null, null, null,
				null, null, null, null);
	}

	public static WorkerMessage call(long id, long callId, String group, String method, String payload) {
		return new WorkerMessage(CALL, id, null, null, null, callId, group, method, payload, null, null, null, null,
				null, null, null, null);
	}

	public static WorkerMessage callResult(long id, long callId, String payload) {
		return new WorkerMessage(CALL_RESULT, id, null, null, null, callId, null, null, payload, true, null, null,
				null, null, null, null, null);
	}

	public static WorkerMessage callFailed(long id, long callId, String error) {
		return new WorkerMessage(CALL_RESULT, id, null, null, null, callId, null, null, null, false, null, error,
				null, null, null, null, null);
	}

	/**
	 * Encodes a finished execution.
	 * @param id the execution id
	 * @param result the worker-side result
	 * @param console the captured console lines
	 * @return the result message
	 */
	public static WorkerMessage result(long id, SandboxResult result, List<String> console) {
		ExecutionMetrics metrics = result.metrics();
		if (!result.success()) {
			SandboxResult.Failure failure = (SandboxResult.Failure) result;
			return new WorkerMessage(RESULT, id, null, null, null, null, null, null, null, false, null,
					failure.error(), failure.stack(), failure.timedOut(), metrics.cpuTimeMs(), metrics.memoryUsedMb(),
					console);
		}
		return new WorkerMessage(RESULT, id, null, null, null, null, null, null, null, true,
				((SandboxResult.Success) result).value(), null, null, false, metrics.cpuTimeMs(),
				metrics.memoryUsedMb(), console);
	}

	public boolean is(String expectedType) {
		return expectedType.equals(type);
	}

	/**
	 * Rebuilds the result on the host, combining the host's wall time with the worker's
	 * CPU and heap readings.
	 * @param timeout the configured budget, used for the timeout message
	 * @param wallTimeMs wall time observed by the host
	 * @return the sandbox result
	 */
	public SandboxResult toResult(Duration timeout, long wallTimeMs) {
		ExecutionMetrics metrics = new ExecutionMetrics(wallTimeMs, cpuTimeMs != null ? cpuTimeMs : wallTimeMs,
				memoryUsedMb != null ? memoryUsedMb : 0);
		if (Boolean.TRUE.equals(timedOut)) {
			return SandboxResult.timeout(timeout, metrics);
		}
		if (Boolean.TRUE.equals(ok)) {
			return SandboxResult.success(value, metrics);
		}
		return SandboxResult.failure(error != null ? error : "Unknown worker error", stack, metrics);
	}

}
