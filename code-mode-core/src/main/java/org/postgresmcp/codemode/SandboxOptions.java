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

/**
 * Immutable per-sandbox resource limits.
 *
 * <p>
 * Unset builder fields fall back to the defaults of the builder's base, which is
 * {@link #defaults()} unless the builder was created with {@link #builder(SandboxOptions)}.
 * This is how caller overrides are merged over factory defaults at creation time.
 * </p>
 *
 * <pre>{@code
 * SandboxOptions options = SandboxOptions.builder()
 *     .timeout(Duration.ofSeconds(5))
 *     .build(); // memory and CPU limits keep their defaults
 * }</pre>
 */
public final class SandboxOptions {

	private static final int DEFAULT_MEMORY_LIMIT_MB = 128;

	private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

	private static final Duration DEFAULT_CPU_LIMIT = Duration.ofSeconds(10);

	private static final SandboxOptions DEFAULTS = new SandboxOptions(DEFAULT_MEMORY_LIMIT_MB, DEFAULT_TIMEOUT,
			DEFAULT_CPU_LIMIT);

	private final int memoryLimitMb;

	private final Duration timeout;

	private final Duration cpuLimit;

	private SandboxOptions(int memoryLimitMb, Duration timeout, Duration cpuLimit) {
		if (memoryLimitMb <= 0) {
			throw new IllegalArgumentException("memoryLimitMb must be positive: " + memoryLimitMb);
		}
		if (timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeout must be positive: " + timeout);
		}
		if (cpuLimit.isNegative() || cpuLimit.isZero()) {
			throw new IllegalArgumentException("cpuLimit must be positive: " + cpuLimit);
		}
		this.memoryLimitMb = memoryLimitMb;
		this.timeout = timeout;
		this.cpuLimit = cpuLimit;
	}

	public static SandboxOptions defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder(DEFAULTS);
	}

	/**
	 * Creates a builder whose unset fields are taken from {@code base}.
	 * @param base the options to override
	 * @return a new builder
	 */
	public static Builder builder(SandboxOptions base) {
		return new Builder(base);
	}

	public int memoryLimitMb() {
		return memoryLimitMb;
	}

	/**
	 * Wall-clock budget for one execution.
	 * @return the timeout
	 */
	public Duration timeout() {
		return timeout;
	}

	/**
	 * Advisory CPU budget. Carried for callers and workers that can enforce it; the
	 * wall-clock {@link #timeout()} is the hard limit.
	 * @return the CPU limit
	 */
	public Duration cpuLimit() {
		return cpuLimit;
	}

	@Override
	public String toString() {
		return String.format("SandboxOptions{memoryLimitMb=%d, timeoutMs=%d, cpuLimitMs=%d}", memoryLimitMb,
				timeout.toMillis(), cpuLimit.toMillis());
	}

	public static class Builder {

		private final SandboxOptions base;

		private Integer memoryLimitMb;

		private Duration timeout;

		private Duration cpuLimit;

		private Builder(SandboxOptions base) {
			this.base = base;
		}

		public Builder memoryLimitMb(int memoryLimitMb) {
			this.memoryLimitMb = memoryLimitMb;
			return this;
		}

		public Builder timeout(Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		public Builder timeoutMs(long timeoutMs) {
			return timeout(Duration.ofMillis(timeoutMs));
		}

		public Builder cpuLimit(Duration cpuLimit) {
			this.cpuLimit = cpuLimit;
			return this;
		}

		public SandboxOptions build() {
			return new SandboxOptions(memoryLimitMb != null ? memoryLimitMb : base.memoryLimitMb,
					timeout != null ? timeout : base.timeout, cpuLimit != null ? cpuLimit : base.cpuLimit);
		}

	}

}
