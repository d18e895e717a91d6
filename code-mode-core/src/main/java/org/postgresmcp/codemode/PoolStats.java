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
package org.postgresmcp.codemode;

/**
 * Point-in-time snapshot of a {@link SandboxPool}.
 *
 * @param available idle sandboxes ready to be acquired
 * @param inUse sandboxes currently held by callers
 * @param max the configured cap
 */
public record PoolStats(int available, int inUse, int max) {

}
