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

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.postgresmcp.codemode.api.ApiBindings;

/**
 * Scriptless sandbox for pool tests: echoes the code back and counts lifecycle calls.
 */
class StubSandbox implements Sandbox {

	private final ConsoleBuffer console = new ConsoleBuffer();

	final AtomicInteger executions = new AtomicInteger();

	final AtomicInteger disposals = new AtomicInteger();

	volatile boolean healthy = true;

	volatile boolean failNextExecution;

	private volatile boolean disposed;

	@Override
	public SandboxResult execute(String code, ApiBindings bindings) {
		if (disposed) {
			return SandboxResult.disposed();
		}
		executions.incrementAndGet();
		console.append("ran " + code);
		if (failNextExecution) {
			failNextExecution = false;
			throw new IllegalStateException("stub failure");
		}
		return SandboxResult.success(code, new ExecutionMetrics(1, 1, 0));
	}

	@Override
	public boolean isHealthy() {
		return healthy && !disposed;
	}

	@Override
	public boolean isDisposed() {
		return disposed;
	}

	@Override
	public List<String> getConsoleOutput() {
		return console.lines();
	}

	@Override
	public void clearConsoleOutput() {
		console.clear();
	}

	@Override
	public void dispose() {
		if (!disposed) {
			disposed = true;
			disposals.incrementAndGet();
		}
	}

}
