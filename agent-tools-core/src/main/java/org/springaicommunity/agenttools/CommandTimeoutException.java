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

/**
 * Cause attached to a {@link ToolException} of kind
 * {@link ToolException.ErrorKind#TIMEOUT} when a foreground command exceeds its deadline.
 */
public class CommandTimeoutException extends Exception {

	private final Duration timeout;

	public CommandTimeoutException(String message, Duration timeout) {
		super(message);
		this.timeout = timeout;
	}

	/**
	 * Gets the deadline that was exceeded.
	 * @return the timeout
	 */
	public Duration getTimeout() {
		return timeout;
	}

}
