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

import java.util.Objects;

/**
 * One entry of the server's flat tool registry, as seen by the binding layer.
 *
 * @param name the registered tool name, e.g. {@code pg_read_query}
 * @param group the tool group, e.g. {@code core}
 * @param handler the callable behind the tool
 */
public record ToolDefinition(String name, String group, BoundMethod handler) {

	public ToolDefinition {
		Objects.requireNonNull(name, "name cannot be null");
		Objects.requireNonNull(group, "group cannot be null");
		Objects.requireNonNull(handler, "handler cannot be null");
	}

}
