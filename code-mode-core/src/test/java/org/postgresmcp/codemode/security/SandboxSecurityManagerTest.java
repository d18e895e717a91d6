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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresmcp.codemode.ExecutionMetrics;
import org.postgresmcp.codemode.SandboxResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SandboxSecurityManagerTest {

	private MutableClock clock;

	private SandboxSecurityManager security;

	@BeforeEach
	void setUp() {
		clock = new MutableClock(Instant.parse("2024-06-01T10:00:00Z"));
		security = new SandboxSecurityManager(SecurityConfig.builder().maxExecutionsPerMinute(3).build(), clock);
	}

	@Test
	void validCodePasses() {
		ValidationResult result = security.validateCode("const x = await pg.core.listTables(); return x.length;");

		assertThat(result.valid()).isTrue();
		assertThat(result.errors()).isEmpty();
	}

	@Test
	void emptyAndNullCodeAreRejected() {
		assertThat(security.validateCode("").valid()).isFalse();
		assertThat(security.validateCode(null).errors()).containsExactly("Code must be a non-empty string");
	}

	@Test
	void oversizedCodeIsRejectedWithLengthError() {
		SandboxSecurityManager strict = new SandboxSecurityManager(SecurityConfig.builder().maxCodeLength(10).build());

		ValidationResult result = strict.validateCode("return 12345678;");

		assertThat(result.valid()).isFalse();
		assertThat(result.errors()).singleElement().asString().contains("maximum length of 10");
	}

	@Test
	void requireIsBlockedAndNamed() {
		ValidationResult result = security.validateCode("require('fs')");

		assertThat(result.valid()).isFalse();
		assertThat(result.errors()).singleElement().asString().contains("require()");
	}

	@Test
	void violationsAccumulate() {
		ValidationResult result = security
			.validateCode("eval('1'); process.exit(1); obj.__proto__ = {}; new Function('return 1')");

		assertThat(result.valid()).isFalse();
		assertThat(result.errors()).hasSize(4);
		assertThat(result.summary()).contains("eval()", "process access", "__proto__", "Function constructor");
	}

	@Test
	void hostPrimitivesAreBlocked() {
		List<String> samples = List.of("import('x')", "global.foo", "globalThis.bar", "x.constructor.constructor('')",
				"child_process", "fs.readFileSync('a')", "net.connect()", "http.get()", "https.get()");

		for (String sample : samples) {
			assertThat(security.validateCode(sample).valid()).as(sample).isFalse();
		}
	}

	@Test
	void identifiersContainingBlockedWordsAreAllowed() {
		assertThat(security.validateCode("const processed = rows.map(r => r.evaluation); return processed;").valid())
			.isTrue();
	}

	@Test
	void extraPatternsExtendTheDefaults() {
		SandboxSecurityManager custom = new SandboxSecurityManager(SecurityConfig.builder()
			.blockedPattern(BlockedPattern.of("\\bDROP\\s+TABLE\\b", "destructive DDL"))
			.build());

		assertThat(custom.validateCode("await pg.core.writeQuery({sql: 'DROP TABLE users'})").errors())
			.singleElement()
			.asString()
			.contains("destructive DDL");
		assertThat(custom.validateCode("require('x')").valid()).isFalse();
	}

	@Test
	void rateLimitAllowsQuotaThenRejects() {
		assertThat(security.checkRateLimit("alice")).isTrue();
		assertThat(security.checkRateLimit("alice")).isTrue();
		assertThat(security.checkRateLimit("alice")).isTrue();
		assertThat(security.checkRateLimit("alice")).isFalse();
		assertThat(security.getRateLimitRemaining("alice")).isZero();
	}

	@Test
	void rateLimitWindowResets() {
		for (int i = 0; i < 3; i++) {
			security.checkRateLimit("alice");
		}
		assertThat(security.checkRateLimit("alice")).isFalse();

		clock.advance(Duration.ofSeconds(60));

		assertThat(security.checkRateLimit("alice")).isTrue();
		assertThat(security.getRateLimitRemaining("alice")).isEqualTo(2);
	}

	@Test
	void callersAreTrackedIndependently() {
		for (int i = 0; i < 4; i++) {
			security.checkRateLimit("alice");
		}

		assertThat(security.checkRateLimit("alice")).isFalse();
		assertThat(security.checkRateLimit("bob")).isTrue();
		assertThat(security.getRateLimitRemaining("bob")).isEqualTo(2);
		assertThat(security.getRateLimitRemaining("carol")).isEqualTo(3);
	}

	@Test
	void concurrentCallsNeverExceedTheQuota() throws Exception {
		SandboxSecurityManager shared = new SandboxSecurityManager(
				SecurityConfig.builder().maxExecutionsPerMinute(50).build(), clock);
		ExecutorService executor = Executors.newFixedThreadPool(8);
		try {
			List<Callable<Boolean>> calls = new ArrayList<>();
			for (int i = 0; i < 200; i++) {
				calls.add(() -> shared.checkRateLimit("burst"));
			}
			long allowed = 0;
			for (Future<Boolean> future : executor.invokeAll(calls)) {
				if (future.get()) {
					allowed++;
				}
			}
			assertThat(allowed).isEqualTo(50);
		}
		finally {
			executor.shutdownNow();
		}
	}

	@Test
	void cleanupReapsOnlyExpiredEntries() {
		security.checkRateLimit("alice");
		clock.advance(Duration.ofSeconds(30));
		security.checkRateLimit("bob");
		clock.advance(Duration.ofSeconds(31));

		assertThat(security.cleanupRateLimits()).isEqualTo(1);
		assertThat(security.trackedCallers()).isEqualTo(1);
		assertThat(security.getRateLimitRemaining("bob")).isEqualTo(2);
	}

	@Test
	void smallResultsPassThroughUnchanged() {
		Map<String, Object> value = Map.of("rows", List.of(1, 2, 3));

		assertThat(security.sanitizeResult(value)).isSameAs(value);
		assertThat(security.sanitizeResult(null)).isNull();
	}

	@Test
	void oversizedResultsAreTruncatedWithPreview() {
		SandboxSecurityManager small = new SandboxSecurityManager(SecurityConfig.builder().maxResultSize(2000).build());
		String big = "x".repeat(5000);

		Object sanitized = small.sanitizeResult(big);

		assertThat(sanitized).isInstanceOf(Map.class);
		Map<?, ?> standIn = (Map<?, ?>) sanitized;
		assertThat(standIn.get("_truncated")).isEqualTo(true);
		assertThat(standIn.get("_originalSize")).isEqualTo(5002);
		assertThat(standIn.get("_maxSize")).isEqualTo(2000);
		assertThat((String) standIn.get("preview")).hasSize(ResultStandIns.PREVIEW_LENGTH + 3).endsWith("...");
	}

	@Test
	void unserializableResultsAreReplaced() {
		Object sanitized = security.sanitizeResult(new Object());

		assertThat(sanitized).isEqualTo(Map.of("_error", ResultStandIns.UNSERIALIZABLE_MESSAGE, "_type", "Object"));
	}

	@Test
	void executionRecordTruncatesCodePreview() {
		String code = "return 1;".repeat(40);
		SandboxResult result = SandboxResult.success(1, ExecutionMetrics.zero());

		ExecutionRecord record = security.createExecutionRecord(code, result, true, null);

		assertThat(record.codePreview()).hasSize(SandboxSecurityManager.CODE_PREVIEW_LENGTH + 3).endsWith("...");
		assertThat(record.timestamp()).isEqualTo(clock.instant());
		assertThat(record.callerOrAnonymous()).isEqualTo(ExecutionRecord.ANONYMOUS);
		assertThat(record.readonly()).isTrue();
		assertThat(record.result()).isSameAs(result);
		assertThat(security.createExecutionRecord(code, result, true, null).id()).isNotEqualTo(record.id());
	}

	@Test
	void auditLogNeverThrows() {
		SandboxResult failure = SandboxResult.failure("boom", "Error: boom\n    at <js>", new ExecutionMetrics(5, 5, 0.1));
		ExecutionRecord record = security.createExecutionRecord("throw new Error('boom')", failure, false, "alice");

		assertThatCode(() -> security.auditLog(record)).doesNotThrowAnyException();
		assertThatCode(() -> security.auditLog(null)).doesNotThrowAnyException();
	}

}
