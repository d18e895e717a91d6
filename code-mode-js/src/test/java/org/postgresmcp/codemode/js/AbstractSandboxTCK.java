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

package org.postgresmcp.codemode.js;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresmcp.codemode.Sandbox;
import org.postgresmcp.codemode.SandboxOptions;
import org.postgresmcp.codemode.SandboxResult;
import org.postgresmcp.codemode.api.ApiBindings;
import org.postgresmcp.codemode.security.ResultStandIns;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Test Compatibility Kit (TCK) for testing any Sandbox implementation.
 *
 * <p>
 * This abstract test class defines the standard test suite that all Sandbox
 * implementations must pass. Concrete test classes provide the implementation through
 * {@link #createSandbox(SandboxOptions)}.
 * </p>
 *
 * <p>
 * The TCK covers return values, awaiting bound API calls, error reporting, timeouts,
 * disposal, console capture and the absence of host primitives.
 * </p>
 */
public abstract class AbstractSandboxTCK {

	protected static final SandboxOptions TEST_OPTIONS = SandboxOptions.builder().timeoutMs(10_000).build();

	/**
	 * The sandbox implementation under test, created before each test.
	 */
	protected Sandbox sandbox;

	protected final AtomicReference<Object> lastParams = new AtomicReference<>();

	protected abstract Sandbox createSandbox(SandboxOptions options);

	@BeforeEach
	void setUp() {
		sandbox = createSandbox(TEST_OPTIONS);
	}

	/**
	 * Cleanup after each test to ensure resource isolation.
	 */
	@AfterEach
	protected void tearDown() {
		if (sandbox != null) {
			sandbox.dispose();
		}
	}

	protected ApiBindings bindings() {
		return ApiBindings.builder()
			.method("core", "echo", params -> {
				lastParams.set(params);
				return CompletableFuture.completedFuture(params);
			})
			.method("core", "delayed", params -> CompletableFuture.<Object>supplyAsync(() -> "late",
					CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS)))
			.method("core", "fail",
					params -> CompletableFuture.failedFuture(new IllegalStateException("relation \"missing\" does not exist")))
			.method("core", "never", params -> new CompletableFuture<>())
			.method("jsonb", "keys", params -> CompletableFuture.completedFuture(List.of("a", "b")))
			.build();
	}

	/**
	 * Test that a returned expression becomes the result value.
	 */
	@Test
	void testReturnsValue() {
		// Act
		SandboxResult result = sandbox.execute("return 1 + 1", ApiBindings.empty());

		// Assert
		assertThat(result).isInstanceOf(SandboxResult.Success.class);
		assertThat(((SandboxResult.Success) result).value()).isEqualTo(2);
		assertThat(result.metrics().wallTimeMs()).isGreaterThanOrEqualTo(0);
	}

	/**
	 * Test that structured results survive the trip out of the script.
	 */
	@Test
	void testStructuredResult() {
		// Arrange
		Map<String, Object> expected = new LinkedHashMap<>();
		expected.put("rows", Arrays.asList(1, "a", true, null));
		expected.put("nested", Map.of("x", 1.5));

		// Act
		SandboxResult result = sandbox.execute("return { rows: [1, 'a', true, null], nested: { x: 1.5 } };",
				ApiBindings.empty());

		// Assert
		assertThat(result.success()).isTrue();
		assertThat(((SandboxResult.Success) result).value()).isEqualTo(expected);
	}

	@Test
	void testNoReturnYieldsNull() {
		SandboxResult result = sandbox.execute("const x = 1;", ApiBindings.empty());

		assertThat(result.success()).isTrue();
		assertThat(((SandboxResult.Success) result).value()).isNull();
	}

	/**
	 * Test that bound API calls can be awaited and receive decoded parameters.
	 */
	@Test
	void testAwaitsBoundApi() {
		// Act
		SandboxResult result = sandbox.execute(
				"const r = await pg.core.echo({ sql: 'SELECT 1', limit: 5 }); return r.limit + 1;", bindings());

		// Assert
		assertThat(result.success()).isTrue();
		assertThat(((SandboxResult.Success) result).value()).isEqualTo(6);
		assertThat(lastParams.get()).isEqualTo(Map.of("sql", "SELECT 1", "limit", 5));
	}

	@Test
	void testAwaitsLateCompletionAndSeveralGroups() {
		SandboxResult result = sandbox.execute(
				"const [late, keys] = await Promise.all([pg.core.delayed(), pg.jsonb.keys()]); return late + ':' + keys.join(',');",
				bindings());

		assertThat(result.success()).isTrue();
		assertThat(((SandboxResult.Success) result).value()).isEqualTo("late:a,b");
	}

	/**
	 * Test that a failing bound call surfaces as a script error carrying its message.
	 */
	@Test
	void testRejectedBindingBecomesError() {
		// Act
		SandboxResult result = sandbox.execute("await pg.core.fail({}); return 'unreachable';", bindings());

		// Assert
		assertThat(result).isInstanceOf(SandboxResult.Failure.class);
		SandboxResult.Failure failure = (SandboxResult.Failure) result;
		assertThat(failure.error()).contains("does not exist");
		assertThat(failure.timedOut()).isFalse();
		assertThat(sandbox.isHealthy()).isTrue();
	}

	@Test
	void testScriptCanCatchRejection() {
		SandboxResult result = sandbox.execute(
				"try { await pg.core.fail(); } catch (e) { return 'caught: ' + e.message; }", bindings());

		assertThat(result.success()).isTrue();
		assertThat(((SandboxResult.Success) result).value()).isEqualTo("caught: relation \"missing\" does not exist");
	}

	/**
	 * Test that uncaught errors keep their message and stack.
	 */
	@Test
	void testThrownErrorKeepsMessageAndStack() {
		// Act
		SandboxResult result = sandbox.execute("throw new Error('boom');", ApiBindings.empty());

		// Assert
		SandboxResult.Failure failure = (SandboxResult.Failure) result;
		assertThat(failure.error()).isEqualTo("boom");
		assertThat(failure.stack()).isNotNull().contains("boom");
		assertThat(failure.timedOut()).isFalse();
	}

	@Test
	void testThrownNonErrorValue() {
		SandboxResult result = sandbox.execute("throw 'plain';", ApiBindings.empty());

		SandboxResult.Failure failure = (SandboxResult.Failure) result;
		assertThat(failure.error()).isEqualTo("plain");
		assertThat(failure.stack()).isNull();
	}

	/**
	 * Test that thrown values whose text conversion fails are reported as ordinary
	 * script errors, not timeouts.
	 */
	@Test
	void testThrownValueWithoutTextForm() {
		SandboxResult bare = sandbox.execute("throw Object.create(null);", ApiBindings.empty());
		SandboxResult hostile = sandbox.execute(
				"throw { toString() { throw 1; }, get [Symbol.toStringTag]() { throw 2; } };", ApiBindings.empty());
		SandboxResult badMessage = sandbox.execute("const e = new Error('x');"
				+ " Object.defineProperty(e, 'message', { get() { throw 1; } }); throw e;", ApiBindings.empty());

		assertThat(((SandboxResult.Failure) bare).error()).isEqualTo("[object Object]");
		assertThat(((SandboxResult.Failure) hostile).error()).isEqualTo(ScriptRealm.UNKNOWN_THROWN);
		for (SandboxResult result : List.of(bare, hostile, badMessage)) {
			SandboxResult.Failure failure = (SandboxResult.Failure) result;
			assertThat(failure.timedOut()).isFalse();
			assertThat(Duration.ofMillis(failure.metrics().wallTimeMs())).isLessThan(TEST_OPTIONS.timeout());
		}
		assertThat(sandbox.isHealthy()).isTrue();
	}

	@Test
	void testSyntaxErrorIsReported() {
		SandboxResult result = sandbox.execute("return (;", ApiBindings.empty());

		assertThat(result.success()).isFalse();
		assertThat(((SandboxResult.Failure) result).error()).isNotBlank();
		assertThat(((SandboxResult.Failure) result).timedOut()).isFalse();
	}

	/**
	 * Test that a busy loop is stopped at the configured timeout and leaves the sandbox
	 * unhealthy.
	 */
	@Test
	void testTimeoutHandling() {
		// Arrange
		sandbox.dispose();
		sandbox = createSandbox(SandboxOptions.builder().timeoutMs(1000).build());

		// Act
		SandboxResult result = sandbox.execute("while (true) {}", ApiBindings.empty());

		// Assert
		SandboxResult.Failure failure = (SandboxResult.Failure) result;
		assertThat(failure.timedOut()).isTrue();
		assertThat(failure.error()).startsWith(SandboxResult.TIMEOUT_PREFIX).contains("1000ms");
		assertThat(failure.metrics().wallTimeMs()).isGreaterThanOrEqualTo(1000);
		assertThat(sandbox.isHealthy()).isFalse();
	}

	@Test
	void testPendingBindingTimesOut() {
		sandbox.dispose();
		sandbox = createSandbox(SandboxOptions.builder().timeoutMs(1000).build());

		SandboxResult result = sandbox.execute("await pg.core.never(); return 1;", bindings());

		assertThat(((SandboxResult.Failure) result).timedOut()).isTrue();
		assertThat(sandbox.isHealthy()).isFalse();
	}

	/**
	 * Test that a disposed sandbox fails immediately with zeroed metrics.
	 */
	@Test
	void testDisposedSandboxRefusesExecution() {
		// Act
		sandbox.dispose();
		SandboxResult result = sandbox.execute("return 1", ApiBindings.empty());

		// Assert
		assertThat(result.success()).isFalse();
		assertThat(((SandboxResult.Failure) result).error()).isEqualTo(SandboxResult.DISPOSED_MESSAGE);
		assertThat(result.metrics().wallTimeMs()).isZero();
		assertThat(result.metrics().cpuTimeMs()).isZero();
		assertThat(result.metrics().memoryUsedMb()).isZero();
		assertThat(sandbox.isDisposed()).isTrue();
		assertThat(sandbox.isHealthy()).isFalse();
	}

	@Test
	void testDisposeIsIdempotent() {
		sandbox.dispose();

		assertThatCode(() -> sandbox.dispose()).doesNotThrowAnyException();
		assertThatCode(() -> sandbox.close()).doesNotThrowAnyException();
	}

	/**
	 * Test that console output is captured rather than printed.
	 */
	@Test
	void testConsoleCapture() {
		// Act
		SandboxResult result = sandbox.execute(
				"console.log('hello', { a: 1 }); console.info('fyi'); console.warn('careful'); console.error('bad'); return true;",
				ApiBindings.empty());

		// Assert
		assertThat(result.success()).isTrue();
		assertThat(sandbox.getConsoleOutput()).containsExactly("hello {\"a\":1}", "[INFO] fyi", "[WARN] careful",
				"[ERROR] bad");

		sandbox.clearConsoleOutput();
		assertThat(sandbox.getConsoleOutput()).isEmpty();
	}

	/**
	 * Test that no host-level primitives are reachable from scripts.
	 */
	@Test
	void testHostPrimitivesAreUnavailable() {
		// Act
		SandboxResult result = sandbox.execute(
				"return [typeof require, typeof process, typeof Java, typeof Polyglot, typeof print, typeof load, typeof setTimeout];",
				ApiBindings.empty());

		// Assert
		assertThat(result.success()).isTrue();
		assertThat(((SandboxResult.Success) result).value()).asInstanceOf(InstanceOfAssertFactories.LIST)
			.containsOnly("undefined");
	}

	@Test
	void testNamespaceIsReadOnly() {
		SandboxResult result = sandbox.execute(
				"pg.core.echo = 1; pg.extra = 2; return [typeof pg.core.echo, typeof pg.extra];", bindings());

		assertThat(result.success()).isTrue();
		assertThat(((SandboxResult.Success) result).value()).isEqualTo(List.of("function", "undefined"));
	}

	@Test
	void testUnserializableResultIsReplaced() {
		SandboxResult result = sandbox.execute("const a = {}; a.self = a; return a;", ApiBindings.empty());

		assertThat(result.success()).isTrue();
		assertThat(((SandboxResult.Success) result).value())
			.isEqualTo(Map.of("_error", ResultStandIns.UNSERIALIZABLE_MESSAGE, "_type", "object"));
	}

	@Test
	void testSandboxIsReusable() {
		assertThat(sandbox.execute("return 'first'", ApiBindings.empty()).success()).isTrue();
		assertThat(sandbox.execute("throw new Error('second')", ApiBindings.empty()).success()).isFalse();

		SandboxResult third = sandbox.execute("return 'third'", ApiBindings.empty());

		assertThat(((SandboxResult.Success) third).value()).isEqualTo("third");
		assertThat(sandbox.isHealthy()).isTrue();
	}

	@Test
	void testMetricsAreRecorded() {
		SandboxResult result = sandbox.execute("let s = 0; for (let i = 0; i < 100000; i++) { s += i; } return s;",
				ApiBindings.empty());

		assertThat(result.success()).isTrue();
		assertThat(result.metrics().cpuTimeMs()).isGreaterThanOrEqualTo(0);
		assertThat(result.metrics().memoryUsedMb()).isGreaterThanOrEqualTo(0);
		assertThat(Duration.ofMillis(result.metrics().wallTimeMs())).isLessThan(TEST_OPTIONS.timeout());
	}

}
