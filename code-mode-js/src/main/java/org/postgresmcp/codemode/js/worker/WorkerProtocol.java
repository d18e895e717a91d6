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
package org.postgresmcp.codemode.js.worker;

import java.io.IOException;
import java.io.Writer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads and writes {@link WorkerMessage} lines.
 */
public final class WorkerProtocol {

	private static final ObjectMapper objectMapper = new ObjectMapper();

	private WorkerProtocol() {
	}

	/**
	 * Writes one message as a single line and flushes. Safe for concurrent writers.
	 * @param writer the peer's input
	 * @param message the message
	 * @throws IOException if the peer is gone
	 */
	public static void write(Writer writer, WorkerMessage message) throws IOException {
		String line = objectMapper.writeValueAsString(message);
		synchronized (writer) {
			writer.write(line);
			writer.write('\n');
			writer.flush();
		}
	}

	public static WorkerMessage read(String line) throws JsonProcessingException {
		return objectMapper.readValue(line, WorkerMessage.class);
	}

}
