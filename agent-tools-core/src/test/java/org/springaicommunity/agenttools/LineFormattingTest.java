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

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LineFormatting}.
 */
class LineFormattingTest {

	@Test
	void catNShouldWidenTheNumberColumnForLargeLineNumbers() {
		String rendered = LineFormatting.catN(List.of("x"), 1_234_567, 2000);

		assertThat(rendered).isEqualTo("1234567→x");
	}

	@Test
	void catNShouldRenderNothingForNoLines() {
		assertThat(LineFormatting.catN(Collections.emptyList(), 1, 2000)).isEmpty();
	}

	@Test
	void splitLinesShouldIgnoreTheSegmentAfterAFinalNewline() {
		assertThat(LineFormatting.splitLines("a\nb\n")).containsExactly("a", "b");
		assertThat(LineFormatting.splitLines("a\nb")).containsExactly("a", "b");
		assertThat(LineFormatting.splitLines("\n")).containsExactly("");
		assertThat(LineFormatting.splitLines("")).isEmpty();
	}

	@Test
	void modifiedLinesShouldClampContextToTheFile() {
		int[] range = LineFormatting.modifiedLines(List.of("a", "b"), List.of("a", "c"), 2);

		assertThat(range).containsExactly(1, 2);
	}

	@Test
	void modifiedLinesShouldCoverAnInsertion() {
		int[] range = LineFormatting.modifiedLines(List.of("1", "2", "3", "4", "5", "6", "7", "8"),
				List.of("1", "2", "3", "4", "new", "5", "6", "7", "8"), 1);

		assertThat(range).containsExactly(4, 6);
	}

}
