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

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import org.springaicommunity.agenttools.ToolException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ToolArguments}.
 */
class ToolArgumentsTest {

	@Test
	void absentValuesShouldFallBackToDefaults() {
		ToolArguments args = new ToolArguments(null);

		assertThat(args.string("path")).isNull();
		assertThat(args.number("timeout")).isNull();
		assertThat(args.optionalInteger("offset")).isNull();
		assertThat(args.integer("-A", 3)).isEqualTo(3);
		assertThat(args.bool("replace_all")).isFalse();
	}

	@Test
	void nullValuesShouldCountAsAbsent() {
		Map<String, Object> values = new HashMap<>();
		values.put("filter", null);

		assertThat(new ToolArguments(values).string("filter")).isNull();
	}

	@Test
	void integralNumbersShouldBeAcceptedInAnyJsonRepresentation() {
		ToolArguments args = new ToolArguments(Map.of("a", 5, "b", 6L, "c", 7.0));

		assertThat(args.integer("a", 0)).isEqualTo(5);
		assertThat(args.number("b")).isEqualTo(6L);
		assertThat(args.optionalInteger("c")).isEqualTo(7);
	}

	@Test
	void mistypedValuesShouldBeRejectedAsInvalidInput() {
		ToolArguments args = new ToolArguments(
				Map.of("command", 1, "limit", "ten", "offset", 2.5, "big", 1L << 40, "-n", "true"));

		assertThatThrownBy(() -> args.string("command")).hasMessage("Parameter 'command' must be a string.");
		assertThatThrownBy(() -> args.number("limit")).hasMessage("Parameter 'limit' must be an integer.");
		assertThatThrownBy(() -> args.number("offset")).hasMessage("Parameter 'offset' must be an integer.");
		assertThatThrownBy(() -> args.integer("big", 0)).hasMessage("Parameter 'big' must be a 32-bit integer.");
		assertThatThrownBy(() -> args.bool("-n")).isInstanceOfSatisfying(ToolException.class,
				e -> assertThat(e.kind()).isEqualTo(ToolException.ErrorKind.INVALID_INPUT));
	}

	@Test
	void requiredStringShouldNameTheMissingParameter() {
		assertThatThrownBy(() -> new ToolArguments(Map.of()).requiredString("file_path"))
			.hasMessage("file_path is required.");
	}

}
