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

import java.time.Instant;

/**
 * Output delivered by one {@link ProcessRegistry#pollOutput(String, String)} call.
 *
 * @param status status observed at the start of the poll
 * @param exitCode exit code, {@code null} while the process is running
 * @param stdout standard output not delivered to any earlier poll (after filtering)
 * @param stderr standard error not delivered to any earlier poll (after filtering)
 * @param timestamp when the poll was served
 */
public record OutputSnapshot(ExecutionStatus status, Integer exitCode, String stdout, String stderr,
		Instant timestamp) {

	public boolean isRunning() {
		return status == ExecutionStatus.RUNNING;
	}

}
