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
package org.postgresmcp.codemode.api;

import java.util.concurrent.CompletionStage;

/**
 * A host operation callable from inside a sandbox as {@code pg.<group>.<method>(params)}.
 *
 * <p>
 * Parameters arrive as plain Java values decoded from the script's JSON-compatible
 * argument ({@code Map}, {@code List}, {@code String}, {@code Number}, {@code Boolean}
 * or null). The returned value must be serializable by Jackson; a failed stage becomes a
 * rejected promise inside the script.
 * </p>
 */
@FunctionalInterface
public interface BoundMethod {

	CompletionStage<Object> invoke(Object params);

}
