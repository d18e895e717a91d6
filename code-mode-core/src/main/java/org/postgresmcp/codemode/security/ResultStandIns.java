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
package org.postgresmcp.codemode.security;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tagged values returned in place of results that cannot be handed back as-is.
 */
public final class ResultStandIns {

	public static final String UNSERIALIZABLE_MESSAGE = "Result could not be serialized";

	public static final int PREVIEW_LENGTH = 1000;

	private ResultStandIns() {
	}

	/**
	 * Stand-in for a value that has no JSON form.
	 * @param type description of the value's type
	 * @return {@code {_error, _type}}
	 */
	public static Map<String, Object> unserializable(String type) {
		Map<String, Object> standIn = new LinkedHashMap<>();
		standIn.put("_error", UNSERIALIZABLE_MESSAGE);
		standIn.put("_type", type);
		return standIn;
	}

	/**
	 * Stand-in for a value whose JSON form exceeds the configured size.
	 * @param serialized the full serialized form
	 * @param maxSize the configured maximum
	 * @return {@code {_truncated, _originalSize, _maxSize, preview}}
	 */
	public static Map<String, Object> truncated(String serialized, int maxSize) {
		Map<String, Object> standIn = new LinkedHashMap<>();
		standIn.put("_truncated", true);
		standIn.put("_originalSize", serialized.length());
		standIn.put("_maxSize", maxSize);
		standIn.put("preview", serialized.substring(0, Math.min(PREVIEW_LENGTH, serialized.length())) + "...");
		return standIn;
	}

}
