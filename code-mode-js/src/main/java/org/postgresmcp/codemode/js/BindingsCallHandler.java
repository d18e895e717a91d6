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

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresmcp.codemode.SandboxException;
import org.postgresmcp.codemode.api.ApiBindings;
import org.postgresmcp.codemode.api.BoundMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches script calls to the {@link BoundMethod}s of an {@link ApiBindings} table,
 * decoding parameters and encoding results with Jackson.
 */
public class BindingsCallHandler implements HostCallHandler {

	private static final Logger logger = LoggerFactory.getLogger(BindingsCallHandler.class);

	private final ApiBindings bindings;

	private final ObjectMapper objectMapper;

	public BindingsCallHandler(ApiBindings bindings, ObjectMapper objectMapper) {
		this.bindings = Objects.requireNonNull(bindings, "bindings cannot be null");
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
	}

	@Override
	public CompletionStage<String> call(String group, String method, String paramsJson) {
		Optional<BoundMethod> target = bindings.find(group, method);
		if (target.isEmpty()) {
			return CompletableFuture.failedFuture(
					new SandboxException("Unknown API method: " + ScriptRealm.NAMESPACE + "." + group + "." + method));
		}
		Object params;
		try {
			params = paramsJson == null ? null : objectMapper.readValue(paramsJson, Object.class);
		}
		catch (JsonProcessingException e) {
			return CompletableFuture.failedFuture(new SandboxException("Invalid API call parameters", e));
		}
		logger.debug("Script called {}.{}.{}", ScriptRealm.NAMESPACE, group, method);
		CompletionStage<Object> result;
		try {
			result = target.get().invoke(params);
		}
		catch (RuntimeException e) {
			return CompletableFuture.failedFuture(e);
		}
		return result.thenApply(this::encode);
	}

	private String encode(Object value) {
		if (value == null) {
			return null;
		}
		try {
			return objectMapper.writeValueAsString(value);
		}
		catch (JsonProcessingException e) {
			throw new SandboxException("API result of type " + value.getClass().getSimpleName()
					+ " could not be serialized", e);
		}
	}

}
