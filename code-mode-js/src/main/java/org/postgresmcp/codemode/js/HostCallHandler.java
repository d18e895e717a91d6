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

import java.util.concurrent.CompletionStage;

/**
 * Receives the bound-API calls a script makes. Parameters and results travel as JSON
 * text so the same handler shape works in-process and across the worker boundary.
 */
@FunctionalInterface
public interface HostCallHandler {

	/**
	 * Invoke {@code pg.<group>.<method>(params)} on behalf of a script.
	 * @param group the API group
	 * @param method the method name within the group
	 * @param paramsJson the JSON-encoded argument, or null when the script passed none
	 * @return a stage completing with the JSON-encoded result, or null for no value
	 */
	CompletionStage<String> call(String group, String method, String paramsJson);

}
