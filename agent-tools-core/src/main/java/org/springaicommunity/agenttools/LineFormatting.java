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
package org.springaicommunity.agenttools;

import java.util.ArrayList;
import java.util.List;

/**
 * Line rendering helpers shared by the read and edit tools.
 */
final class LineFormatting {

	private static final int MIN_NUMBER_WIDTH = 6;

	private static final char ARROW = '→';

	private LineFormatting() {
	}

	/**
	 * Renders lines in the style of {@code cat -n}: a right-aligned line number, an arrow,
	 * then the line cut to {@code maxLineLength} characters.
	 */
	static String catN(List<String> lines, int startLine, int maxLineLength) {
		if (lines.isEmpty()) {
			return "";
		}
		int width = Math.max(MIN_NUMBER_WIDTH, String.valueOf(startLine + lines.size()).length());
		String format = "%" + width + "d" + ARROW + "%s";
		List<String> rendered = new ArrayList<>(lines.size());
		for (int i = 0; i < lines.size(); i++) {
			rendered.add(String.format(format, startLine + i, truncate(lines.get(i), maxLineLength)));
		}
		return String.join("\n", rendered);
	}

	private static String truncate(String line, int maxLength) {
		if (line.length() <= maxLength) {
			return line;
		}
		int end = maxLength;
		if (Character.isHighSurrogate(line.charAt(end - 1))) {
			end--;
		}
		return line.substring(0, end);
	}

	/**
	 * Finds the changed region between two versions of a file, widened by {@code context}
	 * lines on each side.
	 * @return 1-based inclusive {@code [start, end]} in the coordinates of
	 * {@code newLines}; {@code end < start} when the new version has no line to show
	 */
	static int[] modifiedLines(List<String> oldLines, List<String> newLines, int context) {
		int delta = Math.max(0, context);
		int prefix = 0;
		while (prefix < oldLines.size() && prefix < newLines.size()
				&& oldLines.get(prefix).equals(newLines.get(prefix))) {
			prefix++;
		}
		int suffix = 0;
		while (oldLines.size() - 1 - suffix >= prefix && newLines.size() - 1 - suffix >= prefix
				&& oldLines.get(oldLines.size() - 1 - suffix).equals(newLines.get(newLines.size() - 1 - suffix))) {
			suffix++;
		}
		int start = Math.max(1, prefix + 1 - delta);
		int end = Math.min(newLines.size(), newLines.size() - suffix + delta);
		return new int[] { start, end };
	}

	/**
	 * Splits content into lines; a trailing newline does not start another line.
	 */
	static List<String> splitLines(String content) {
		if (content.isEmpty()) {
			return List.of();
		}
		String body = content.endsWith("\n") ? content.substring(0, content.length() - 1) : content;
		return List.of(body.split("\n", -1));
	}

}
