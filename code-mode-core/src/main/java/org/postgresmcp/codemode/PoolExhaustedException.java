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
 * Thrown by {@link SandboxPool#acquire()} when every slot is taken. The pool never
 * queues callers, so this is the backpressure signal.
 */
public class PoolExhaustedException extends SandboxException {

	private final int maxInstances;

	public PoolExhaustedException(int maxInstances) {
		super("Sandbox pool exhausted (max: " + maxInstances + ")");
		this.maxInstances = maxInstances;
	}

	public int getMaxInstances() {
		return maxInstances;
	}

}
