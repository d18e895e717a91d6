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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryBindingsTest {

	private static final BoundMethod ECHO = params -> CompletableFuture.completedFuture(params);

	@Test
	void stripsPrefixAndGroupAndCamelCases() {
		assertThat(ToolRegistryBindings.toMethodName("pg_read_query", "core", "pg_")).isEqualTo("readQuery");
		assertThat(ToolRegistryBindings.toMethodName("pg_core_list_tables", "core", "pg_")).isEqualTo("listTables");
		assertThat(ToolRegistryBindings.toMethodName("pg_jsonb_extract", "jsonb", "pg_")).isEqualTo("extract");
	}

	@Test
	void dashedGroupsMatchUnderscoredToolNames() {
		assertThat(ToolRegistryBindings.toMethodName("pg_text_search_fuzzy_match", "text-search", "pg_"))
			.isEqualTo("fuzzyMatch");
	}

	@Test
	void namesWithoutPrefixAreKept() {
		assertThat(ToolRegistryBindings.toMethodName("vacuum_analyze", "maintenance", "pg_")).isEqualTo("vacuumAnalyze");
		assertThat(ToolRegistryBindings.toMethodName("explain", "performance", "")).isEqualTo("explain");
	}

	@Test
	void underscoresBeforeNonLettersSurvive() {
		assertThat(ToolRegistryBindings.toMethodName("pg_stat_2pc", "stats", "pg_")).isEqualTo("stat_2pc");
		assertThat(ToolRegistryBindings.toMethodName("pg_trailing_", "core", "pg_")).isEqualTo("trailing_");
	}

	@Test
	void groupsToolsInRegistrationOrder() {
		ToolRegistryBindings registry = ToolRegistryBindings.fromTools("pg_",
				List.of(new ToolDefinition("pg_read_query", "core", ECHO),
						new ToolDefinition("pg_list_tables", "core", ECHO),
						new ToolDefinition("pg_jsonb_extract", "jsonb", ECHO)));

		assertThat(registry.bindings().groups()).containsExactly("core", "jsonb");
		assertThat(registry.groupMethods("core")).containsExactly("readQuery", "listTables");
		assertThat(registry.availableGroups()).containsExactly(Map.entry("core", 2), Map.entry("jsonb", 1));
		assertThat(registry.bindings().methodCount()).isEqualTo(3);
		assertThat(registry.bindings().find("jsonb", "extract")).containsSame(ECHO);
		assertThat(registry.groupMethods("missing")).isEmpty();
	}

	@Test
	void collidingNamesKeepTheLatestTool() {
		BoundMethod later = params -> CompletableFuture.completedFuture("later");

		ToolRegistryBindings registry = ToolRegistryBindings.fromTools("pg_",
				List.of(new ToolDefinition("pg_core_read_query", "core", ECHO),
						new ToolDefinition("pg_read_query", "core", later)));

		assertThat(registry.groupMethods("core")).containsExactly("readQuery");
		assertThat(registry.bindings().find("core", "readQuery")).containsSame(later);
	}

	@Test
	void bindingsShapeIsReadOnly() {
		ApiBindings bindings = ApiBindings.builder().method("core", "ping", ECHO).group("empty").build();

		assertThat(bindings.shape()).containsExactly(Map.entry("core", List.of("ping")), Map.entry("empty", List.of()));
		assertThat(bindings.isEmpty()).isFalse();
		assertThat(ApiBindings.empty().isEmpty()).isTrue();
		assertThatThrownBy(() -> bindings.shape().put("x", List.of())).isInstanceOf(UnsupportedOperationException.class);
	}

}
