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
package org.springaicommunity.agenttools.mcp;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springaicommunity.agenttools.ExecutionInfo;

/**
 * JSON body of a non-empty {@code list_shells} result.
 */
record ShellListResponse(@JsonProperty("shells") List<Shell> shells, @JsonProperty("count") int count) {

	static ShellListResponse from(List<ExecutionInfo> executions) {
		List<Shell> shells = executions.stream()
			.map(info -> new Shell(info.id(), info.description(), info.status().label()))
			.toList();
		return new ShellListResponse(shells, shells.size());
	}

	record Shell(@JsonProperty("id") String id, @JsonProperty("description") String description,
			@JsonProperty("status") String status) {
	}

}
