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

import java.time.Duration;
import java.util.Objects;

/**
 * Request to run a shell command, in the foreground or in the background.
 *
 * <pre>{@code
 * ExecSpec spec = ExecSpec.builder()
 *     .command("mvn -q test")
 *     .description("Run unit tests")
 *     .timeout(Duration.ofMinutes(5))
 *     .build();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class ExecSpec {

	private final String command;

	private final String description;

	private final Duration timeout;

	private final boolean runInBackground;

	private ExecSpec(Builder builder) {
		this.command = Objects.requireNonNull(builder.command, "command cannot be null");
		this.description = builder.description;
		this.timeout = builder.timeout;
		this.runInBackground = builder.runInBackground;
	}

	public static ExecSpec of(String command) {
		return builder().command(command).build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public String command() {
		return command;
	}

	public String description() {
		return description;
	}

	/**
	 * Gets the requested timeout.
	 * @return the timeout, or {@code null} to use the configured default
	 */
	public Duration timeout() {
		return timeout;
	}

	public boolean runInBackground() {
		return runInBackground;
	}

	@Override
	public String toString() {
		return String.format("ExecSpec{command='%s', timeout=%s, background=%s}", command, timeout, runInBackground);
	}

	public static class Builder {

		private String command;

		private String description;

		private Duration timeout;

		private boolean runInBackground;

		public Builder command(String command) {
			this.command = command;
			return this;
		}

		public Builder description(String description) {
			this.description = description;
			return this;
		}

		/**
		 * Sets the foreground deadline. Zero or negative values select the configured
		 * default. Ignored for background commands.
		 * @param timeout the timeout
		 * @return this builder
		 */
		public Builder timeout(Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		public Builder runInBackground(boolean runInBackground) {
			this.runInBackground = runInBackground;
			return this;
		}

		public ExecSpec build() {
			return new ExecSpec(this);
		}

	}

}
