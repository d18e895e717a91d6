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

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, line-oriented capture of a sandbox's console output.
 *
 * <p>
 * Scripts never reach the host's standard streams; whatever they print is split into
 * lines and kept here. Once {@code maxLines} lines are held the oldest line is dropped
 * for each new one, and single lines are cut at {@code maxLineLength} characters.
 * </p>
 */
public final class ConsoleBuffer {

	public static final int DEFAULT_MAX_LINES = 1000;

	public static final int DEFAULT_MAX_LINE_LENGTH = 4096;

	private final int maxLines;

	private final int maxLineLength;

	private final Deque<String> lines = new ArrayDeque<>();

	private final ByteArrayOutputStream partial = new ByteArrayOutputStream();

	private long dropped;

	public ConsoleBuffer() {
		this(DEFAULT_MAX_LINES, DEFAULT_MAX_LINE_LENGTH);
	}

	public ConsoleBuffer(int maxLines, int maxLineLength) {
		if (maxLines <= 0 || maxLineLength <= 0) {
			throw new IllegalArgumentException("Console buffer limits must be positive");
		}
		this.maxLines = maxLines;
		this.maxLineLength = maxLineLength;
	}

	/**
	 * Appends one complete line.
	 * @param line the line, without terminator
	 */
	public synchronized void append(String line) {
		String bounded = line.length() > maxLineLength ? line.substring(0, maxLineLength) + "..." : line;
		if (lines.size() == maxLines) {
			lines.removeFirst();
			dropped++;
		}
		lines.addLast(bounded);
	}

	/**
	 * Returns a snapshot of the captured lines, including any unterminated trailing text.
	 * @return the lines, oldest first
	 */
	public synchronized List<String> lines() {
		List<String> snapshot = new ArrayList<>(lines);
		if (partial.size() > 0) {
			snapshot.add(partial.toString(StandardCharsets.UTF_8));
		}
		return snapshot;
	}

	/**
	 * Number of lines discarded because the buffer was full.
	 * @return the dropped line count since the last {@link #clear()}
	 */
	public synchronized long droppedLines() {
		return dropped;
	}

	public synchronized void clear() {
		lines.clear();
		partial.reset();
		dropped = 0;
	}

	/**
	 * Moves any unterminated text into the line list.
	 */
	public synchronized void flush() {
		if (partial.size() > 0) {
			append(partial.toString(StandardCharsets.UTF_8));
			partial.reset();
		}
	}

	/**
	 * Adapts the buffer to an {@link OutputStream} that engines can write to. Bytes are
	 * decoded as UTF-8 and split on {@code '\n'}.
	 * @return a stream feeding this buffer
	 */
	public OutputStream asOutputStream() {
		return new OutputStream() {

			@Override
			public void write(int b) {
				writeByte(b);
			}

			@Override
			public void write(byte[] b, int off, int len) {
				for (int i = off; i < off + len; i++) {
					writeByte(b[i]);
				}
			}

		};
	}

	private synchronized void writeByte(int b) {
		if (b == '\n') {
			String line = partial.toString(StandardCharsets.UTF_8);
			partial.reset();
			append(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
		}
		else if (partial.size() <= maxLineLength * 4) {
			partial.write(b);
		}
	}

}
