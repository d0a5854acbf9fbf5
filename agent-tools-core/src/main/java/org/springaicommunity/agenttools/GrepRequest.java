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

/**
 * Parameters of a {@link GrepSearch}.
 *
 * @param pattern regular expression searched for, in ripgrep syntax
 * @param path absolute file or directory to search, {@code null} for the working directory
 * @param glob file name filter, e.g. {@code *.java}
 * @param type ripgrep file type, e.g. {@code java}
 * @param outputMode {@code files_with_matches} (default), {@code content} or {@code count}
 * @param linesAfter context lines after each match, content mode only
 * @param linesBefore context lines before each match, content mode only
 * @param linesAround context lines around each match, content mode only
 * @param lineNumbers prefix matches with line numbers, content mode only
 * @param ignoreCase case-insensitive matching
 * @param multiline let patterns span lines
 * @param headLimit keep only the first N lines of output, 0 for all
 */
public record GrepRequest(String pattern, String path, String glob, String type, String outputMode, int linesAfter,
		int linesBefore, int linesAround, boolean lineNumbers, boolean ignoreCase, boolean multiline, int headLimit) {

	public static final String FILES_WITH_MATCHES = "files_with_matches";

	public static final String CONTENT = "content";

	public static final String COUNT = "count";

	public static GrepRequest of(String pattern) {
		return builder().pattern(pattern).build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private String pattern;

		private String path;

		private String glob;

		private String type;

		private String outputMode;

		private int linesAfter;

		private int linesBefore;

		private int linesAround;

		private boolean lineNumbers;

		private boolean ignoreCase;

		private boolean multiline;

		private int headLimit;

		public Builder pattern(String pattern) {
			this.pattern = pattern;
			return this;
		}

		public Builder path(String path) {
			this.path = path;
			return this;
		}

		public Builder glob(String glob) {
			this.glob = glob;
			return this;
		}

		public Builder type(String type) {
			this.type = type;
			return this;
		}

		public Builder outputMode(String outputMode) {
			this.outputMode = outputMode;
			return this;
		}

		public Builder linesAfter(int linesAfter) {
			this.linesAfter = linesAfter;
			return this;
		}

		public Builder linesBefore(int linesBefore) {
			this.linesBefore = linesBefore;
			return this;
		}

		public Builder linesAround(int linesAround) {
			this.linesAround = linesAround;
			return this;
		}

		public Builder lineNumbers(boolean lineNumbers) {
			this.lineNumbers = lineNumbers;
			return this;
		}

		public Builder ignoreCase(boolean ignoreCase) {
			this.ignoreCase = ignoreCase;
			return this;
		}

		public Builder multiline(boolean multiline) {
			this.multiline = multiline;
			return this;
		}

		public Builder headLimit(int headLimit) {
			this.headLimit = headLimit;
			return this;
		}

		public GrepRequest build() {
			return new GrepRequest(pattern, path, glob, type, outputMode, linesAfter, linesBefore, linesAround,
					lineNumbers, ignoreCase, multiline, headLimit);
		}

	}

}
