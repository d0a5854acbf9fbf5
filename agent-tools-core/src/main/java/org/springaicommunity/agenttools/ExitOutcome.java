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
 * Terminal outcome of a background process, written once by its monitoring task.
 *
 * @param exitCode the process exit code, or {@code -1} when the process could not be
 * waited for
 * @param error the failure raised while waiting for the process, distinct from a nonzero
 * exit code, or {@code null}
 */
public record ExitOutcome(int exitCode, Throwable error) {

	static final int UNKNOWN_EXIT_CODE = -1;

	public static ExitOutcome exited(int exitCode) {
		return new ExitOutcome(exitCode, null);
	}

	public static ExitOutcome failedWith(int exitCode, Throwable error) {
		return new ExitOutcome(exitCode, error);
	}

	/**
	 * Indicates whether the process exited normally with code 0.
	 * @return true on success
	 */
	public boolean succeeded() {
		return exitCode == 0 && error == null;
	}

	public boolean failed() {
		return !succeeded();
	}

}
