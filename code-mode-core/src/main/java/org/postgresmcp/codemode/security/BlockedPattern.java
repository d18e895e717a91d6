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

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A denylisted construct in submitted code.
 *
 * @param pattern the regular expression searched for anywhere in the code
 * @param capability short name of what the construct would give the script, reported in
 * validation errors
 */
public record BlockedPattern(Pattern pattern, String capability) {

	public BlockedPattern {
		Objects.requireNonNull(pattern, "pattern cannot be null");
		Objects.requireNonNull(capability, "capability cannot be null");
	}

	public static BlockedPattern of(String regex, String capability) {
		return new BlockedPattern(Pattern.compile(regex), capability);
	}

	public boolean matches(String code) {
		return pattern.matcher(code).find();
	}

}
