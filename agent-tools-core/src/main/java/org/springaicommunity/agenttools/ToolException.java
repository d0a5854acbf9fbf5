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
 * Unchecked exception raised by every tool operation.
 *
 * <p>
 * The {@link ErrorKind} tells the caller which class of failure occurred so it can decide
 * the next action (fix the input, read the file again, choose another identifier...)
 * without inspecting internal state. The message always names the path, identifier or
 * limit involved.
 * </p>
 *
 * @since 0.1.0
 */
public class ToolException extends RuntimeException {

	private final ErrorKind kind;

	public ToolException(ErrorKind kind, String message) {
		super(message);
		this.kind = Objects.requireNonNull(kind, "kind cannot be null");
	}

	public ToolException(ErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = Objects.requireNonNull(kind, "kind cannot be null");
	}

	/**
	 * Gets the failure class.
	 * @return the error kind
	 */
	public ErrorKind kind() {
		return kind;
	}

	static ToolException invalidInput(String message) {
		return new ToolException(ErrorKind.INVALID_INPUT, message);
	}

	static ToolException notFound(String message) {
		return new ToolException(ErrorKind.NOT_FOUND, message);
	}

	static ToolException conflict(String message) {
		return new ToolException(ErrorKind.STATE_CONFLICT, message);
	}

	static ToolException osFailure(String message, Throwable cause) {
		return new ToolException(ErrorKind.OS_FAILURE, message, cause);
	}

	/**
	 * Failure classes surfaced to tool callers.
	 */
	public enum ErrorKind {

		/**
		 * The request was rejected before any state was touched.
		 */
		INVALID_INPUT,

		/**
		 * Unknown background identifier or missing file.
		 */
		NOT_FOUND,

		/**
		 * The request conflicts with current state (already completed, not read yet,
		 * modified since read, ambiguous edit).
		 */
		STATE_CONFLICT,

		/**
		 * An output or file-size cap was exceeded.
		 */
		LIMIT_EXCEEDED,

		/**
		 * A foreground command ran past its deadline.
		 */
		TIMEOUT,

		/**
		 * A foreground command exited with a nonzero code.
		 */
		COMMAND_FAILED,

		/**
		 * The operating system refused a spawn, kill, stat, read or write.
		 */
		OS_FAILURE

	}

}
