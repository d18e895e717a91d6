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

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleBufferTest {

	@Test
	void splitsStreamOnNewlines() throws IOException {
		ConsoleBuffer buffer = new ConsoleBuffer();
		OutputStream out = buffer.asOutputStream();

		out.write("first\nsecond\r\nthird".getBytes(StandardCharsets.UTF_8));

		assertThat(buffer.lines()).containsExactly("first", "second", "third");
		buffer.flush();
		assertThat(buffer.lines()).containsExactly("first", "second", "third");
	}

	@Test
	void decodesMultiByteCharacters() throws IOException {
		ConsoleBuffer buffer = new ConsoleBuffer();

		buffer.asOutputStream().write("zürich ✓\n".getBytes(StandardCharsets.UTF_8));

		assertThat(buffer.lines()).containsExactly("zürich ✓");
	}

	@Test
	void dropsOldestLinesWhenFull() {
		ConsoleBuffer buffer = new ConsoleBuffer(2, 100);

		buffer.append("a");
		buffer.append("b");
		buffer.append("c");

		assertThat(buffer.lines()).containsExactly("b", "c");
		assertThat(buffer.droppedLines()).isEqualTo(1);
	}

	@Test
	void truncatesLongLines() {
		ConsoleBuffer buffer = new ConsoleBuffer(10, 5);

		buffer.append("abcdefgh");

		assertThat(buffer.lines()).containsExactly("abcde...");
	}

	@Test
	void clearResetsEverything() throws IOException {
		ConsoleBuffer buffer = new ConsoleBuffer(1, 100);
		buffer.append("a");
		buffer.append("b");
		buffer.asOutputStream().write("partial".getBytes(StandardCharsets.UTF_8));

		buffer.clear();

		assertThat(buffer.lines()).isEmpty();
		assertThat(buffer.droppedLines()).isZero();
	}

}
