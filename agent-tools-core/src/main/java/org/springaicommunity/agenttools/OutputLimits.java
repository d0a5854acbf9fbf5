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

import java.util.Objects;

/**
 * Size caps applied to tool results before they are handed back to a caller.
 *
 * <p>
 * Output size is reported in tokens, estimated at four characters per token.
 * </p>
 *
 * @since 0.1.0
 */
public final class OutputLimits {

	private static final int CHARS_PER_TOKEN = 4;

	private final long maxFileSize;

	private final int maxOutputChars;

	private final int maxResultLines;

	public OutputLimits(ToolsConfig config) {
		Objects.requireNonNull(config, "config cannot be null");
		this.maxFileSize = config.maxFileSize();
		this.maxOutputChars = config.maxOutputChars();
		this.maxResultLines = config.maxResultLines();
	}

	/**
	 * Rejects files larger than the configured maximum.
	 * @param size file size in bytes
	 * @throws ToolException of kind {@code LIMIT_EXCEEDED} when the file is too large
	 */
	public void checkFileSize(long size) {
		if (size > maxFileSize) {
			throw new ToolException(ToolException.ErrorKind.LIMIT_EXCEEDED, String.format(
					"File content (%d bytes) exceeds maximum allowed size (%d bytes). Please use offset and limit parameters to read specific portions of the file, or use the Grep tool to search for specific content.",
					size, maxFileSize));
		}
	}

	/**
	 * Rejects output longer than the configured maximum.
	 * @param output the tool output
	 * @param tool the producing tool, selects the remediation hint
	 * @return the output, unchanged
	 * @throws ToolException of kind {@code LIMIT_EXCEEDED} when the output is too large
	 */
	public String capOutputSize(String output, ToolKind tool) {
		if (exceedsOutputSize(output)) {
			throw new ToolException(ToolException.ErrorKind.LIMIT_EXCEEDED,
					String.format("Output (%d tokens) exceeds maximum allowed size (%d tokens). %s",
							output.length() / CHARS_PER_TOKEN, maxOutputChars / CHARS_PER_TOKEN,
							tool.suggestion()));
		}
		return output;
	}

	public boolean exceedsOutputSize(String output) {
		return output != null && output.length() > maxOutputChars;
	}

	/**
	 * Truncates text after the configured number of newlines, keeping whole lines only.
	 * @param text the text to truncate
	 * @return the text up to and including the last allowed newline
	 */
	public String capLineCount(String text) {
		if (text == null || text.isEmpty()) {
			return text;
		}
		int count = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n' && ++count >= maxResultLines) {
				return text.substring(0, i + 1);
			}
		}
		return text;
	}

	/**
	 * Tools that produce capped output, each with its remediation hint.
	 */
	public enum ToolKind {

		READ("Use the offset and limit parameters to read specific portions of the file, or use the Grep tool to search for specific content."),

		WRITE("Consider breaking the file into smaller chunks."),

		EDIT("Consider editing smaller sections of the file."),

		GREP("Consider using the head_limit parameter to restrict results, adding more specific patterns, or using glob/type filters to narrow the search."),

		GLOB("Consider using more specific glob patterns to narrow the search scope."),

		BASH("Consider using background execution with BashOutput to stream results, or redirect output to a file and read specific portions."),

		OTHER("Consider breaking down the operation into smaller parts or using more specific parameters to limit output.");

		private final String suggestion;

		ToolKind(String suggestion) {
			this.suggestion = suggestion;
		}

		public String suggestion() {
			return suggestion;
		}

	}

}
