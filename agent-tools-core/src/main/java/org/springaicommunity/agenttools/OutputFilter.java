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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Full-line regular-expression filter applied to output slices handed to pollers.
 *
 * @since 0.1.0
 */
public final class OutputFilter {

	private OutputFilter() {
	}

	/**
	 * Compiles a filter expression.
	 * @param regex the expression, may be null or empty
	 * @return the compiled pattern, or null when no filtering is requested
	 * @throws ToolException of kind {@code INVALID_INPUT} if the expression does not
	 * compile
	 */
	public static Pattern compile(String regex) {
		if (regex == null || regex.isEmpty()) {
			return null;
		}
		try {
			return Pattern.compile(regex);
		}
		catch (PatternSyntaxException e) {
			throw new ToolException(ToolException.ErrorKind.INVALID_INPUT, "Invalid filter regex: " + e.getMessage(),
					e);
		}
	}

	/**
	 * Keeps the lines of {@code text} that the pattern matches in full.
	 *
	 * <p>
	 * The empty segment after a trailing newline is not a line, and the trailing newline is
	 * restored only when at least one line survives. A null pattern returns the text
	 * unchanged.
	 * </p>
	 * @param text the text to filter
	 * @param pattern the compiled filter, or null
	 * @return the filtered text
	 */
	public static String apply(String text, Pattern pattern) {
		if (pattern == null || text == null || text.isEmpty()) {
			return text;
		}
		boolean trailingNewline = text.endsWith("\n");
		String body = trailingNewline ? text.substring(0, text.length() - 1) : text;
		List<String> kept = new ArrayList<>();
		for (String line : body.split("\n", -1)) {
			if (pattern.matcher(line).matches()) {
				kept.add(line);
			}
		}
		if (kept.isEmpty()) {
			return "";
		}
		String joined = String.join("\n", kept);
		return trailingNewline ? joined + "\n" : joined;
	}

}
