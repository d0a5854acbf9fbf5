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
 * Observable state of a {@link BackgroundExecution}.
 */
public enum ExecutionStatus {

	RUNNING("running"),

	COMPLETED("completed"),

	FAILED("failed");

	private final String label;

	ExecutionStatus(String label) {
		this.label = label;
	}

	/**
	 * Gets the lower-case name reported to tool callers.
	 * @return the label
	 */
	public String label() {
		return label;
	}

	static ExecutionStatus of(ExitOutcome outcome) {
		if (outcome == null) {
			return RUNNING;
		}
		return outcome.failed() ? FAILED : COMPLETED;
	}

}
