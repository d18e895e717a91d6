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

import java.util.ArrayList;
import java.util.List;

/**
 * Process-wide limits applied by {@link SandboxSecurityManager}.
 *
 * <p>
 * Loaded once and read-only afterwards. Unset builder fields take the defaults: 50 KiB
 * of code, 60 executions per caller per minute, 10 MiB of serialized result and the
 * {@link #defaultBlockedPatterns() canonical denylist}.
 * </p>
 */
public final class SecurityConfig {

	private static final int DEFAULT_MAX_CODE_LENGTH = 50 * 1024;

	private static final int DEFAULT_MAX_EXECUTIONS_PER_MINUTE = 60;

	private static final int DEFAULT_MAX_RESULT_SIZE = 10 * 1024 * 1024;

	private static final List<BlockedPattern> DEFAULT_BLOCKED_PATTERNS = List.of(
			BlockedPattern.of("\\brequire\\s*\\(", "require() module loading"),
			BlockedPattern.of("\\bimport\\s*\\(", "dynamic import()"),
			BlockedPattern.of("\\bprocess\\.", "process access"),
			BlockedPattern.of("\\bglobal\\.", "global object access"),
			BlockedPattern.of("\\bglobalThis\\.", "globalThis access"),
			BlockedPattern.of("\\beval\\s*\\(", "eval()"),
			BlockedPattern.of("\\bFunction\\s*\\(", "Function constructor"),
			BlockedPattern.of("\\b__proto__\\b", "prototype tampering via __proto__"),
			BlockedPattern.of("\\bconstructor\\.constructor", "constructor chaining"),
			BlockedPattern.of("\\bchild_process", "child processes"),
			BlockedPattern.of("\\bfs\\.", "filesystem access"),
			BlockedPattern.of("\\bnet\\.", "network access"),
			BlockedPattern.of("\\bhttp\\.", "HTTP access"),
			BlockedPattern.of("\\bhttps\\.", "HTTPS access"));

	private static final SecurityConfig DEFAULTS = builder().build();

	private final int maxCodeLength;

	private final int maxExecutionsPerMinute;

	private final int maxResultSize;

	private final List<BlockedPattern> blockedPatterns;

	private SecurityConfig(Builder builder) {
		this.maxCodeLength = builder.maxCodeLength != null ? builder.maxCodeLength : DEFAULT_MAX_CODE_LENGTH;
		this.maxExecutionsPerMinute = builder.maxExecutionsPerMinute != null ? builder.maxExecutionsPerMinute
				: DEFAULT_MAX_EXECUTIONS_PER_MINUTE;
		this.maxResultSize = builder.maxResultSize != null ? builder.maxResultSize : DEFAULT_MAX_RESULT_SIZE;
		this.blockedPatterns = builder.blockedPatterns != null ? List.copyOf(builder.blockedPatterns)
				: DEFAULT_BLOCKED_PATTERNS;
		if (maxCodeLength <= 0 || maxExecutionsPerMinute <= 0 || maxResultSize <= 0) {
			throw new IllegalArgumentException("Security limits must be positive: " + this);
		}
	}

	public static SecurityConfig defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static List<BlockedPattern> defaultBlockedPatterns() {
		return DEFAULT_BLOCKED_PATTERNS;
	}

	public int maxCodeLength() {
		return maxCodeLength;
	}

	public int maxExecutionsPerMinute() {
		return maxExecutionsPerMinute;
	}

	/**
	 * Maximum length of a serialized result, in characters of its JSON form.
	 * @return the limit
	 */
	public int maxResultSize() {
		return maxResultSize;
	}

	public List<BlockedPattern> blockedPatterns() {
		return blockedPatterns;
	}

	@Override
	public String toString() {
		return String.format(
				"SecurityConfig{maxCodeLength=%d, maxExecutionsPerMinute=%d, maxResultSize=%d, blockedPatterns=%d}",
				maxCodeLength, maxExecutionsPerMinute, maxResultSize, blockedPatterns.size());
	}

	public static class Builder {

		private Integer maxCodeLength;

		private Integer maxExecutionsPerMinute;

		private Integer maxResultSize;

		private List<BlockedPattern> blockedPatterns;

		public Builder maxCodeLength(int maxCodeLength) {
			this.maxCodeLength = maxCodeLength;
			return this;
		}

		public Builder maxExecutionsPerMinute(int maxExecutionsPerMinute) {
			this.maxExecutionsPerMinute = maxExecutionsPerMinute;
			return this;
		}

		public Builder maxResultSize(int maxResultSize) {
			this.maxResultSize = maxResultSize;
			return this;
		}

		/**
		 * Replaces the denylist.
		 * @param blockedPatterns the patterns to use instead of the defaults
		 * @return this builder
		 */
		public Builder blockedPatterns(List<BlockedPattern> blockedPatterns) {
			this.blockedPatterns = new ArrayList<>(blockedPatterns);
			return this;
		}

		/**
		 * Adds a pattern on top of the current denylist (the defaults unless replaced).
		 * @param pattern the extra pattern
		 * @return this builder
		 */
		public Builder blockedPattern(BlockedPattern pattern) {
			if (this.blockedPatterns == null) {
				this.blockedPatterns = new ArrayList<>(DEFAULT_BLOCKED_PATTERNS);
			}
			this.blockedPatterns.add(pattern);
			return this;
		}

		public SecurityConfig build() {
			return new SecurityConfig(this);
		}

	}

}
