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

/**
 * Resource usage observed around a single sandbox execution.
 *
 * <p>
 * {@code cpuTimeMs} is the CPU time of the thread that ran the script when the JVM
 * exposes thread CPU accounting, and falls back to wall time otherwise.
 * {@code memoryUsedMb} is the heap delta observed around the call; it is approximate for
 * the in-process variant (other threads share the heap) and may be negative when a
 * collection ran during execution.
 * </p>
 *
 * @param wallTimeMs elapsed wall-clock time in milliseconds
 * @param cpuTimeMs CPU time consumed in milliseconds
 * @param memoryUsedMb heap delta in megabytes, rounded to two decimals
 */
public record ExecutionMetrics(long wallTimeMs, long cpuTimeMs, double memoryUsedMb) {

	private static final ExecutionMetrics ZERO = new ExecutionMetrics(0, 0, 0);

	/**
	 * Metrics reported when an execution was rejected before it started.
	 * @return all-zero metrics
	 */
	public static ExecutionMetrics zero() {
		return ZERO;
	}

	/**
	 * Builds metrics from raw nanosecond and byte readings.
	 * @param wallNanos elapsed wall-clock nanoseconds
	 * @param cpuNanos consumed CPU nanoseconds, or a negative value when unavailable
	 * @param heapDeltaBytes heap usage difference in bytes
	 * @return the rounded metrics
	 */
	public static ExecutionMetrics of(long wallNanos, long cpuNanos, long heapDeltaBytes) {
		long wallMs = Math.round(wallNanos / 1_000_000.0);
		long cpuMs = cpuNanos < 0 ? wallMs : Math.round(cpuNanos / 1_000_000.0);
		double memoryMb = Math.round(heapDeltaBytes / (1024.0 * 1024.0) * 100) / 100.0;
		return new ExecutionMetrics(wallMs, cpuMs, memoryMb);
	}

}
