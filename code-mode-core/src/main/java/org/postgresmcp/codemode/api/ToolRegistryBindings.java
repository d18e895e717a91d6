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

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link ApiBindings} from a flat tool registry.
 *
 * <p>
 * Tools are grouped by {@link ToolDefinition#group()} and exposed under a camelCase
 * method name derived from the tool name: the registry prefix is stripped, then the group
 * prefix, then snake_case becomes camelCase.
 * </p>
 *
 * <pre>{@code
 * pg_read_query    (core)   -> pg.core.readQuery
 * pg_jsonb_extract (jsonb)  -> pg.jsonb.extract
 * pg_vector_search (vector) -> pg.vector.search
 * }</pre>
 */
public final class ToolRegistryBindings {

	private static final Logger logger = LoggerFactory.getLogger(ToolRegistryBindings.class);

	private final ApiBindings bindings;

	private ToolRegistryBindings(ApiBindings bindings) {
		this.bindings = bindings;
	}

	/**
	 * Groups the given tools into bindings.
	 * @param toolPrefix prefix shared by registry tool names, e.g. {@code pg_}; may be
	 * empty
	 * @param tools the registry entries
	 * @return the grouped bindings
	 */
	public static ToolRegistryBindings fromTools(String toolPrefix, Collection<ToolDefinition> tools) {
		ApiBindings.Builder builder = ApiBindings.builder();
		Set<String> seen = new HashSet<>();
		for (ToolDefinition tool : tools) {
			String methodName = toMethodName(tool.name(), tool.group(), toolPrefix);
			if (!seen.add(tool.group() + "." + methodName)) {
				logger.warn("Tool {} maps to already bound method {}.{}; keeping the latest", tool.name(),
						tool.group(), methodName);
			}
			builder.method(tool.group(), methodName, tool.handler());
		}
		ApiBindings bindings = builder.build();
		logger.debug("Bound {} tools into {} groups", bindings.methodCount(), bindings.groups().size());
		return new ToolRegistryBindings(bindings);
	}

	/**
	 * Converts a registry tool name into the method name used inside scripts.
	 * @param toolName the tool name
	 * @param group the tool group; dashes are treated as underscores
	 * @param toolPrefix the registry prefix to strip
	 * @return the camelCase method name
	 */
	public static String toMethodName(String toolName, String group, String toolPrefix) {
		String name = toolName;
		if (toolPrefix != null && !toolPrefix.isEmpty() && name.startsWith(toolPrefix)) {
			name = name.substring(toolPrefix.length());
		}
		String groupPrefix = group.replace('-', '_') + "_";
		if (name.startsWith(groupPrefix)) {
			name = name.substring(groupPrefix.length());
		}
		StringBuilder camel = new StringBuilder(name.length());
		boolean upperNext = false;
		for (char c : name.toCharArray()) {
			if (c == '_') {
				upperNext = true;
			}
			else if (upperNext && Character.isLowerCase(c)) {
				camel.append(Character.toUpperCase(c));
				upperNext = false;
			}
			else {
				if (upperNext) {
					camel.append('_');
				}
				camel.append(c);
				upperNext = false;
			}
		}
		if (upperNext) {
			camel.append('_');
		}
		return camel.toString();
	}

	public ApiBindings bindings() {
		return bindings;
	}

	/**
	 * Method counts per group.
	 * @return group → number of bound methods
	 */
	public Map<String, Integer> availableGroups() {
		Map<String, Integer> counts = new LinkedHashMap<>();
		for (String group : bindings.groups()) {
			counts.put(group, bindings.methods(group).size());
		}
		return Collections.unmodifiableMap(counts);
	}

	public List<String> groupMethods(String group) {
		return bindings.methods(group);
	}

}
