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
 * Result of a foreground command run by {@link ForegroundExecutor}.
 *
 * @param exitCode the process exit code (0 indicates success)
 * @param output standard output and standard error, merged in arrival order
 * @param duration the wall-clock time taken to execute the command
 */
public record ExecResult(int exitCode, String output, Duration duration) {

	public ExecResult {
		Objects.requireNonNull(output, "output cannot be null");
		Objects.requireNonNull(duration, "duration cannot be null");
	}

	/**
	 * Indicates whether the command executed successfully.
	 * @return true if exit code is 0, false otherwise
	 */
	public boolean success() {
		return exitCode == 0;
	}

	public boolean failed() {
		return !success();
	}

	public boolean hasOutput() {
		return !output.isEmpty();
	}

	/**
	 * Creates a summary string suitable for logging. Does not include the output.
	 * @return concise summary of the execution result
	 */
	public String summary() {
		return String.format("ExecResult{exitCode=%d, success=%s, duration=%s, outputLen=%d}", exitCode, success(),
				duration, output.length());
	}

}
