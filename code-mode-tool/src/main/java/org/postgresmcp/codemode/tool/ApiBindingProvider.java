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
package org.postgresmcp.codemode.tool;

import org.postgresmcp.codemode.api.ApiBindings;

/**
 * Supplies the bound API for one execution. Called once per request, after validation
 * and rate limiting.
 *
 * <pre>{@code
 * ToolRegistryBindings registry = ToolRegistryBindings.fromTools("pg_", tools);
 * ApiBindingProvider provider = registry::bindings;
 * }</pre>
 */
@FunctionalInterface
public interface ApiBindingProvider {

	ApiBindings bindings();

}
