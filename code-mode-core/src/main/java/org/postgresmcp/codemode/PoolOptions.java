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
 * Sizing policy for a {@link SandboxPool}.
 *
 * @param minInstances sandboxes created eagerly and kept warm by cleanup
 * @param maxInstances hard cap on available plus in-use sandboxes
 * @param idleTimeout interval of the periodic cleanup pass
 */
public record PoolOptions(int minInstances, int maxInstances, Duration idleTimeout) {

	private static final PoolOptions DEFAULTS = new PoolOptions(2, 10, Duration.ofSeconds(60));

	public PoolOptions {
		if (minInstances < 0) {
			throw new IllegalArgumentException("minInstances must be >= 0: " + minInstances);
		}
		if (maxInstances < 0) {
			throw new IllegalArgumentException("maxInstances must be >= 0: " + maxInstances);
		}
		if (minInstances > maxInstances) {
			throw new IllegalArgumentException(
					"minInstances (" + minInstances + ") must not exceed maxInstances (" + maxInstances + ")");
		}
		if (idleTimeout == null || idleTimeout.isNegative() || idleTimeout.isZero()) {
			throw new IllegalArgumentException("idleTimeout must be positive: " + idleTimeout);
		}
	}

	public static PoolOptions defaults() {
		return DEFAULTS;
	}

	public static PoolOptions of(int minInstances, int maxInstances) {
		return new PoolOptions(minInstances, maxInstances, DEFAULTS.idleTimeout());
	}

}
