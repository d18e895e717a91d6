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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresmcp.codemode.SandboxResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Gatekeeper and audit sink for code executions.
 *
 * <p>
 * Validates submitted code against a length limit and a denylist, enforces a per-caller
 * fixed window rate limit, bounds the size of results handed back to callers, and writes
 * one audit line per execution. It holds no reference to sandboxes or pools.
 * </p>
 *
 * <p>
 * Rate-limit state lives in a concurrent map; each update is an atomic
 * {@link ConcurrentHashMap#compute compute} on the caller's entry, so concurrent calls
 * for the same caller never lose increments. Entries whose window has elapsed are removed
 * by {@link #cleanupRateLimits()}.
 * </p>
 */
public class SandboxSecurityManager {

	/**
	 * Name of the logger receiving audit records.
	 */
	public static final String AUDIT_LOGGER_NAME = "org.postgresmcp.codemode.audit";

	public static final Duration RATE_WINDOW = Duration.ofSeconds(60);

	static final int CODE_PREVIEW_LENGTH = 200;

	private static final int LOG_PREVIEW_LENGTH = 50;

	private static final Logger logger = LoggerFactory.getLogger(SandboxSecurityManager.class);

	private static final Logger auditLogger = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

	private final SecurityConfig config;

	private final Clock clock;

	private final ObjectMapper objectMapper = new ObjectMapper();

	private final ConcurrentHashMap<String, RateLimitEntry> rateLimits = new ConcurrentHashMap<>();

	public SandboxSecurityManager() {
		this(SecurityConfig.defaults());
	}

	public SandboxSecurityManager(SecurityConfig config) {
		this(config, Clock.systemUTC());
	}

	public SandboxSecurityManager(SecurityConfig config, Clock clock) {
		this.config = Objects.requireNonNull(config, "config cannot be null");
		this.clock = Objects.requireNonNull(clock, "clock cannot be null");
	}

	public SecurityConfig getConfig() {
		return config;
	}

	/**
	 * Checks code before it reaches a sandbox. Every denylist match is reported, not just
	 * the first.
	 * @param code the submitted code
	 * @return the validation outcome
	 */
	public ValidationResult validateCode(String code) {
		List<String> errors = new ArrayList<>();
		if (code == null || code.isEmpty()) {
			errors.add("Code must be a non-empty string");
			return ValidationResult.of(errors);
		}
		if (code.length() > config.maxCodeLength()) {
			errors.add("Code exceeds maximum length of " + config.maxCodeLength() + " characters");
			return ValidationResult.of(errors);
		}
		for (BlockedPattern blocked : config.blockedPatterns()) {
			if (blocked.matches(code)) {
				errors.add("Blocked pattern detected: " + blocked.capability() + " (" + blocked.pattern().pattern()
						+ ")");
			}
		}
		return ValidationResult.of(errors);
	}

	/**
	 * Counts an execution against the caller's current window.
	 * @param callerId the caller identity
	 * @return true if the execution is allowed, false if the caller is rate limited
	 */
	public boolean checkRateLimit(String callerId) {
		Objects.requireNonNull(callerId, "callerId cannot be null");
		boolean[] allowed = new boolean[1];
		rateLimits.compute(callerId, (key, entry) -> {
			Instant now = clock.instant();
			if (entry == null || entry.isExpired(now)) {
				allowed[0] = true;
				return new RateLimitEntry(1, now.plus(RATE_WINDOW));
			}
			if (entry.count() >= config.maxExecutionsPerMinute()) {
				allowed[0] = false;
				return entry;
			}
			allowed[0] = true;
			return entry.increment();
		});
		if (!allowed[0]) {
			logger.debug("Rate limit reached for caller {}", callerId);
		}
		return allowed[0];
	}

	/**
	 * Executions the caller may still start in its current window.
	 * @param callerId the caller identity
	 * @return the remaining quota; the full quota for unknown or expired callers
	 */
	public int getRateLimitRemaining(String callerId) {
		RateLimitEntry entry = rateLimits.get(callerId);
		if (entry == null || entry.isExpired(clock.instant())) {
			return config.maxExecutionsPerMinute();
		}
		return Math.max(0, config.maxExecutionsPerMinute() - entry.count());
	}

	/**
	 * Removes rate-limit entries whose window has elapsed.
	 * @return the number of entries removed
	 */
	public int cleanupRateLimits() {
		Instant now = clock.instant();
		int removed = 0;
		for (String callerId : rateLimits.keySet()) {
			// re-checked atomically so a window opened concurrently is kept
			if (rateLimits.computeIfPresent(callerId, (key, entry) -> entry.isExpired(now) ? null : entry) == null) {
				removed++;
			}
		}
		if (removed > 0) {
			logger.debug("Reaped {} expired rate limit entries", removed);
		}
		return removed;
	}

	int trackedCallers() {
		return rateLimits.size();
	}

	/**
	 * Bounds a result before it is returned to the caller. Values without a JSON form are
	 * replaced by an error stand-in; values whose JSON form exceeds
	 * {@link SecurityConfig#maxResultSize()} are replaced by a truncation stand-in with a
	 * short preview.
	 * @param value the result value
	 * @return the value itself or a stand-in
	 */
	public Object sanitizeResult(Object value) {
		String serialized;
		try {
			serialized = objectMapper.writeValueAsString(value);
		}
		catch (JsonProcessingException e) {
			logger.debug("Result of type {} is not serializable: {}", typeName(value), e.getOriginalMessage());
			return ResultStandIns.unserializable(typeName(value));
		}
		if (serialized.length() > config.maxResultSize()) {
			logger.debug("Truncating result of {} characters (max {})", serialized.length(), config.maxResultSize());
			return ResultStandIns.truncated(serialized, config.maxResultSize());
		}
		return value;
	}

	/**
	 * Builds the audit record for an execution. The result is recorded as given.
	 * @param code the executed code
	 * @param result the outcome
	 * @param readonly the caller's readonly flag
	 * @param callerId the caller, or null
	 * @return a new record with a fresh id
	 */
	public ExecutionRecord createExecutionRecord(String code, SandboxResult result, boolean readonly,
			String callerId) {
		String source = code != null ? code : "";
		String preview = source.length() > CODE_PREVIEW_LENGTH ? source.substring(0, CODE_PREVIEW_LENGTH) + "..."
				: source;
		return new ExecutionRecord(UUID.randomUUID().toString(), callerId, clock.instant(), preview, result,
				readonly);
	}

	/**
	 * Writes an audit line for the record. Never throws.
	 * @param record the record to log
	 */
	public void auditLog(ExecutionRecord record) {
		try {
			writeAudit(record);
		}
		catch (RuntimeException e) {
			logger.warn("Failed to write audit record {}", record != null ? record.id() : null, e);
		}
	}

	private void writeAudit(ExecutionRecord record) {
		SandboxResult result = record.result();
		try (MDC.MDCCloseable executionId = MDC.putCloseable("executionId", record.id());
				MDC.MDCCloseable caller = MDC.putCloseable("callerId", record.callerOrAnonymous())) {
			String preview = record.codePreview().length() > LOG_PREVIEW_LENGTH
					? record.codePreview().substring(0, LOG_PREVIEW_LENGTH) + "..." : record.codePreview();
			if (!result.success()) {
				SandboxResult.Failure failure = (SandboxResult.Failure) result;
				auditLogger.warn(
						"Code execution failed: {} [id={}, caller={}, readonly={}, wallTimeMs={}, cpuTimeMs={}, memoryUsedMb={}, code={}]{}",
						failure.error(), record.id(), record.callerOrAnonymous(), record.readonly(),
						failure.metrics().wallTimeMs(), failure.metrics().cpuTimeMs(),
						failure.metrics().memoryUsedMb(), preview,
						failure.stack() != null ? System.lineSeparator() + failure.stack() : "");
			}
			else {
				auditLogger.info(
						"Code execution completed [id={}, caller={}, readonly={}, wallTimeMs={}, cpuTimeMs={}, memoryUsedMb={}, code={}]",
						record.id(), record.callerOrAnonymous(), record.readonly(), result.metrics().wallTimeMs(),
						result.metrics().cpuTimeMs(), result.metrics().memoryUsedMb(), preview);
			}
		}
	}

	private static String typeName(Object value) {
		return value == null ? "null" : value.getClass().getSimpleName();
	}

	/**
	 * Per-caller window state.
	 *
	 * @param count executions counted in the window
	 * @param windowResetAt when the window ends
	 */
	record RateLimitEntry(int count, Instant windowResetAt) {

		boolean isExpired(Instant now) {
			return !now.isBefore(windowResetAt);
		}

		RateLimitEntry increment() {
			return new RateLimitEntry(count + 1, windowResetAt);
		}

	}

}
