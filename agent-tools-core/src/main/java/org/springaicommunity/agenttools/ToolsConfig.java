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

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration shared by all tools of a {@link ToolContext}.
 *
 * <p>
 * Every value has a default; use {@link #defaults()} or override selectively through
 * {@link #builder()}.
 * </p>
 *
 * @since 0.1.0
 */
public final class ToolsConfig {

	private static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(120_000);

	private static final Duration DEFAULT_MAX_TIMEOUT = Duration.ofMillis(600_000);

	private static final Duration DEFAULT_KILL_GRACE = Duration.ofMillis(100);

	private static final long DEFAULT_MAX_FILE_SIZE = 10L * 1024 * 1024;

	// ~25k tokens at 4 characters per token
	private static final int DEFAULT_MAX_OUTPUT_CHARS = 25_000 * 4;

	private static final int DEFAULT_MAX_RESULT_LINES = 1000;

	private static final int DEFAULT_READ_LINES = 2000;

	private static final int DEFAULT_MAX_LINE_LENGTH = 2000;

	private static final String DEFAULT_RIPGREP = "rg";

	private final Path workingDirectory;

	private final Duration defaultTimeout;

	private final Duration maxTimeout;

	private final Duration killGracePeriod;

	private final long maxFileSize;

	private final int maxOutputChars;

	private final int maxResultLines;

	private final int defaultReadLines;

	private final int maxLineLength;

	private final String ripgrepBinary;

	private ToolsConfig(Builder builder) {
		this.workingDirectory = (builder.workingDirectory != null ? builder.workingDirectory
				: Path.of(System.getProperty("user.dir")))
			.toAbsolutePath()
			.normalize();
		this.defaultTimeout = builder.defaultTimeout != null ? builder.defaultTimeout : DEFAULT_TIMEOUT;
		this.maxTimeout = builder.maxTimeout != null ? builder.maxTimeout : DEFAULT_MAX_TIMEOUT;
		this.killGracePeriod = builder.killGracePeriod != null ? builder.killGracePeriod : DEFAULT_KILL_GRACE;
		this.maxFileSize = builder.maxFileSize > 0 ? builder.maxFileSize : DEFAULT_MAX_FILE_SIZE;
		this.maxOutputChars = builder.maxOutputChars > 0 ? builder.maxOutputChars : DEFAULT_MAX_OUTPUT_CHARS;
		this.maxResultLines = builder.maxResultLines > 0 ? builder.maxResultLines : DEFAULT_MAX_RESULT_LINES;
		this.defaultReadLines = builder.defaultReadLines > 0 ? builder.defaultReadLines : DEFAULT_READ_LINES;
		this.maxLineLength = builder.maxLineLength > 0 ? builder.maxLineLength : DEFAULT_MAX_LINE_LENGTH;
		this.ripgrepBinary = builder.ripgrepBinary != null && !builder.ripgrepBinary.isBlank() ? builder.ripgrepBinary
				: DEFAULT_RIPGREP;
		if (defaultTimeout.compareTo(maxTimeout) > 0) {
			throw new IllegalArgumentException(
					"Default timeout " + defaultTimeout + " cannot exceed maximum timeout " + maxTimeout);
		}
	}

	public Path workingDirectory() {
		return workingDirectory;
	}

	public Duration defaultTimeout() {
		return defaultTimeout;
	}

	public Duration maxTimeout() {
		return maxTimeout;
	}

	public Duration killGracePeriod() {
		return killGracePeriod;
	}

	public long maxFileSize() {
		return maxFileSize;
	}

	public int maxOutputChars() {
		return maxOutputChars;
	}

	public int maxResultLines() {
		return maxResultLines;
	}

	public int defaultReadLines() {
		return defaultReadLines;
	}

	public int maxLineLength() {
		return maxLineLength;
	}

	public String ripgrepBinary() {
		return ripgrepBinary;
	}

	/**
	 * Creates a configuration with every default applied and the JVM working directory.
	 * @return the default configuration
	 */
	public static ToolsConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String toString() {
		return String.format("ToolsConfig{workDir=%s, defaultTimeout=%s, maxTimeout=%s, killGrace=%s, rg=%s}",
				workingDirectory, defaultTimeout, maxTimeout, killGracePeriod, ripgrepBinary);
	}

	public static class Builder {

		private Path workingDirectory;

		private Duration defaultTimeout;

		private Duration maxTimeout;

		private Duration killGracePeriod;

		private long maxFileSize;

		private int maxOutputChars;

		private int maxResultLines;

		private int defaultReadLines;

		private int maxLineLength;

		private String ripgrepBinary;

		public Builder workingDirectory(Path workingDirectory) {
			this.workingDirectory = workingDirectory;
			return this;
		}

		public Builder defaultTimeout(Duration defaultTimeout) {
			this.defaultTimeout = defaultTimeout;
			return this;
		}

		public Builder maxTimeout(Duration maxTimeout) {
			this.maxTimeout = maxTimeout;
			return this;
		}

		public Builder killGracePeriod(Duration killGracePeriod) {
			this.killGracePeriod = killGracePeriod;
			return this;
		}

		public Builder maxFileSize(long maxFileSize) {
			this.maxFileSize = maxFileSize;
			return this;
		}

		public Builder maxOutputChars(int maxOutputChars) {
			this.maxOutputChars = maxOutputChars;
			return this;
		}

		public Builder maxResultLines(int maxResultLines) {
			this.maxResultLines = maxResultLines;
			return this;
		}

		public Builder defaultReadLines(int defaultReadLines) {
			this.defaultReadLines = defaultReadLines;
			return this;
		}

		public Builder maxLineLength(int maxLineLength) {
			this.maxLineLength = maxLineLength;
			return this;
		}

		public Builder ripgrepBinary(String ripgrepBinary) {
			this.ripgrepBinary = ripgrepBinary;
			return this;
		}

		public ToolsConfig build() {
			return new ToolsConfig(this);
		}

	}

}
