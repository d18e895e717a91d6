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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable table of {@link BoundMethod}s keyed by group and method name.
 *
 * <p>
 * This is the only capability surface a sandboxed script receives. The table is handed
 * to the sandbox explicitly for each execution; scripts see it as the {@code pg}
 * namespace.
 * </p>
 */
public final class ApiBindings {

	private static final ApiBindings EMPTY = new ApiBindings(Map.of());

	private final Map<String, Map<String, BoundMethod>> groups;

	private ApiBindings(Map<String, Map<String, BoundMethod>> groups) {
		this.groups = groups;
	}

	public static ApiBindings empty() {
		return EMPTY;
	}

	/**
	 * Copies a group → method → callable table.
	 * @param groups the table to copy
	 * @return the bindings
	 */
	public static ApiBindings of(Map<String, ? extends Map<String, ? extends BoundMethod>> groups) {
		Builder builder = builder();
		groups.forEach((group, methods) -> methods.forEach((name, method) -> builder.method(group, name, method)));
		return builder.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<String> groups() {
		return List.copyOf(groups.keySet());
	}

	/**
	 * Lists the method names bound in a group.
	 * @param group the group name
	 * @return the method names in registration order, empty for an unknown group
	 */
	public List<String> methods(String group) {
		Map<String, BoundMethod> methods = groups.get(group);
		return methods == null ? List.of() : List.copyOf(methods.keySet());
	}

	public Optional<BoundMethod> find(String group, String method) {
		Map<String, BoundMethod> methods = groups.get(group);
		return methods == null ? Optional.empty() : Optional.ofNullable(methods.get(method));
	}

	/**
	 * Total number of bound methods across all groups.
	 * @return the method count
	 */
	public int methodCount() {
		return groups.values().stream().mapToInt(Map::size).sum();
	}

	public boolean isEmpty() {
		return methodCount() == 0;
	}

	/**
	 * Names-only view of the table, used to describe the namespace to a worker process
	 * that cannot receive the callables themselves.
	 * @return group → method names
	 */
	public Map<String, List<String>> shape() {
		Map<String, List<String>> shape = new LinkedHashMap<>();
		groups.forEach((group, methods) -> shape.put(group, List.copyOf(methods.keySet())));
		return Collections.unmodifiableMap(shape);
	}

	@Override
	public String toString() {
		return String.format("ApiBindings{groups=%d, methods=%d}", groups.size(), methodCount());
	}

	public static class Builder {

		private final Map<String, Map<String, BoundMethod>> groups = new LinkedHashMap<>();

		public Builder method(String group, String name, BoundMethod method) {
			Objects.requireNonNull(group, "group cannot be null");
			Objects.requireNonNull(name, "name cannot be null");
			Objects.requireNonNull(method, "method cannot be null");
			groups.computeIfAbsent(group, g -> new LinkedHashMap<>()).put(name, method);
			return this;
		}

		/**
		 * Registers a group, even if it ends up without methods.
		 * @param group the group name
		 * @return this builder
		 */
		public Builder group(String group) {
			groups.computeIfAbsent(group, g -> new LinkedHashMap<>());
			return this;
		}

		public ApiBindings build() {
			Map<String, Map<String, BoundMethod>> copy = new LinkedHashMap<>();
			groups.forEach((group, methods) -> copy.put(group, Collections.unmodifiableMap(new LinkedHashMap<>(methods))));
			return new ApiBindings(Collections.unmodifiableMap(copy));
		}

	}

}
