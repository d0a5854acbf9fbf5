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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springaicommunity.agenttools.OutputSnapshot;

/**
 * JSON body of a {@code bash_output} result. Empty output streams and the exit code of a
 * running command are left out.
 *
 * @param status running, completed or failed
 * @param exitCode exit code once the command has finished
 * @param stdout new standard output since the previous poll
 * @param stderr new standard error since the previous poll
 * @param timestamp ISO-8601 instant of the poll
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
record BashOutputResponse(@JsonProperty("status") String status, @JsonProperty("exit_code") Integer exitCode,
		@JsonProperty("stdout") String stdout, @JsonProperty("stderr") String stderr,
		@JsonProperty("timestamp") String timestamp) {

	static BashOutputResponse from(OutputSnapshot snapshot) {
		return new BashOutputResponse(snapshot.status().label(), snapshot.exitCode(), snapshot.stdout(),
				snapshot.stderr(), snapshot.timestamp().toString());
	}

}
