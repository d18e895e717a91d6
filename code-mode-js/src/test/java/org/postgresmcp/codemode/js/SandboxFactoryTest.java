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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.postgresmcp.codemode.PoolOptions;
import org.postgresmcp.codemode.PoolStats;
import org.postgresmcp.codemode.Sandbox;
import org.postgresmcp.codemode.SandboxException;
import org.postgresmcp.codemode.SandboxOptions;
import org.postgresmcp.codemode.SandboxPool;
import org.postgresmcp.codemode.SandboxResult;
import org.postgresmcp.codemode.api.ApiBindings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SandboxFactoryTest {

	private final SandboxFactory factory = new SandboxFactory();

	@AfterEach
	void tearDown() {
		factory.close();
	}

	@Test
	void explicitModeWins() {
		factory.setDefaultMode(SandboxMode.ISOLATED_PROCESS);

		try (Sandbox sandbox = factory.createSandbox(SandboxMode.IN_PROCESS, null)) {
			assertThat(sandbox).isInstanceOf(InProcessSandbox.class);
		}
	}

	@Test
	void storedDefaultIsUsedWhenNoModeIsGiven() {
		factory.setDefaultMode(SandboxMode.IN_PROCESS);

		assertThat(factory.getDefaultMode()).isEqualTo(SandboxMode.IN_PROCESS);
		try (Sandbox sandbox = factory.createSandbox()) {
			assertThat(sandbox).isInstanceOf(InProcessSandbox.class);
		}
	}

	@Test
	void environmentProvidesTheFallback() {
		assertThat(factory.getDefaultMode()).isEqualTo(SandboxMode.fromEnvironment());
	}

	@Test
	void eachCallYieldsAnIndependentSandbox() {
		try (Sandbox first = factory.createSandbox(SandboxMode.IN_PROCESS, null);
				Sandbox second = factory.createSandbox(SandboxMode.IN_PROCESS, null)) {
			assertThat(first).isNotSameAs(second);
			first.dispose();
			assertThat(second.execute("return 'alive'", ApiBindings.empty()).success()).isTrue();
		}
	}

	@Test
	void callerOptionsOverrideFactoryDefaults() {
		SandboxOptions options = SandboxOptions.builder().timeoutMs(1234).build();

		try (Sandbox sandbox = factory.createSandbox(SandboxMode.IN_PROCESS, options)) {
			assertThat(((InProcessSandbox) sandbox).getOptions()).isSameAs(options);
		}
		assertThat(factory.getDefaultOptions()).isSameAs(SandboxOptions.defaults());
	}

	@Test
	void listsBothModes() {
		assertThat(factory.getAvailableModes()).containsExactly(SandboxMode.IN_PROCESS, SandboxMode.ISOLATED_PROCESS);
	}

	@Test
	void createsWorkingInProcessPool() {
		try (SandboxPool pool = factory.createSandboxPool(SandboxMode.IN_PROCESS, PoolOptions.of(1, 2), null)) {
			pool.initialize();

			SandboxResult result = pool.execute("return [1, 2, 3].map((n) => n * 2);", ApiBindings.empty());

			assertThat(result.success()).isTrue();
			assertThat(((SandboxResult.Success) result).value()).isEqualTo(java.util.List.of(2, 4, 6));
			assertThat(pool.getStats()).isEqualTo(new PoolStats(1, 0, 2));
		}
	}

	@Test
	void timedOutSandboxIsReplacedByThePool() {
		SandboxOptions quick = SandboxOptions.builder().timeoutMs(500).build();
		try (SandboxPool pool = factory.createSandboxPool(SandboxMode.IN_PROCESS, PoolOptions.of(1, 1), quick)) {
			pool.initialize();

			SandboxResult timedOut = pool.execute("while (true) {}", ApiBindings.empty());
			SandboxResult next = pool.execute("return 'fresh'", ApiBindings.empty());

			assertThat(((SandboxResult.Failure) timedOut).timedOut()).isTrue();
			assertThat(((SandboxResult.Success) next).value()).isEqualTo("fresh");
		}
	}

	@Test
	void closedFactoryRefusesInProcessSandboxes() {
		factory.close();

		assertThatThrownBy(() -> factory.createSandbox(SandboxMode.IN_PROCESS, null))
			.isInstanceOf(SandboxException.class)
			.hasMessageContaining("closed");
	}

}
