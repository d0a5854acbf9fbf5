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
 * Result of {@link ProcessRegistry#terminate(String)}.
 *
 * @param outcome what happened
 * @param id the requested identifier
 * @param command the command of the execution, {@code null} when not found
 * @param failure the kill failure, only set for {@link Outcome#KILL_FAILED}
 */
public record TerminationResult(Outcome outcome, String id, String command, Throwable failure) {

	static TerminationResult terminated(BackgroundExecution execution) {
		return new TerminationResult(Outcome.TERMINATED, execution.id(), execution.command(), null);
	}

	static TerminationResult alreadyCompleted(BackgroundExecution execution) {
		return new TerminationResult(Outcome.ALREADY_COMPLETED, execution.id(), execution.command(), null);
	}

	static TerminationResult notFound(String id) {
		return new TerminationResult(Outcome.NOT_FOUND, id, null, null);
	}

	static TerminationResult killFailed(BackgroundExecution execution, Throwable failure) {
		return new TerminationResult(Outcome.KILL_FAILED, execution.id(), execution.command(), failure);
	}

	public boolean terminated() {
		return outcome == Outcome.TERMINATED;
	}

	/**
	 * Describes the outcome for a tool caller.
	 * @return a user-facing message
	 */
	public String message() {
		return switch (outcome) {
			case TERMINATED -> "Successfully killed shell: " + id + " (" + command + ")";
			case ALREADY_COMPLETED -> "Shell " + id + " has already completed. Cannot kill a finished process.";
			case NOT_FOUND -> "Background shell with ID '" + id + "' not found.";
			case KILL_FAILED -> "Failed to kill shell " + id + ": " + (failure != null ? failure.getMessage() : "unknown error");
		};
	}

	public enum Outcome {

		TERMINATED, ALREADY_COMPLETED, NOT_FOUND, KILL_FAILED

	}

}
