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

import java.util.Collections;
import java.util.Map;

import org.springaicommunity.agenttools.ToolException;

/**
 * Typed view over the JSON arguments of one tool call.
 *
 * <p>
 * Values arrive as Jackson-decoded objects. A present value of the wrong JSON type is
 * rejected with {@link ToolException.ErrorKind#INVALID_INPUT}; an absent or null value
 * yields the supplied default.
 * </p>
 */
final class ToolArguments {

	private final Map<String, Object> values;

	ToolArguments(Map<String, Object> values) {
		this.values = values != null ? values : Collections.emptyMap();
	}

	String string(String name) {
		Object value = values.get(name);
		if (value == null) {
			return null;
		}
		if (value instanceof String text) {
			return text;
		}
		throw invalid(name, "a string");
	}

	String requiredString(String name) {
		String value = string(name);
		if (value == null) {
			throw new ToolException(ToolException.ErrorKind.INVALID_INPUT, name + " is required.");
		}
		return value;
	}

	Long number(String name) {
		Object value = values.get(name);
		if (value == null) {
			return null;
		}
		if (value instanceof Number number) {
			double asDouble = number.doubleValue();
			if (asDouble != Math.rint(asDouble) || Double.isInfinite(asDouble)) {
				throw invalid(name, "an integer");
			}
			return number.longValue();
		}
		throw invalid(name, "an integer");
	}

	int integer(String name, int defaultValue) {
		Long value = number(name);
		if (value == null) {
			return defaultValue;
		}
		if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
			throw invalid(name, "a 32-bit integer");
		}
		return value.intValue();
	}

	Integer optionalInteger(String name) {
		Long value = number(name);
		return value == null ? null : integer(name, 0);
	}

	boolean bool(String name) {
		Object value = values.get(name);
		if (value == null) {
			return false;
		}
		if (value instanceof Boolean flag) {
			return flag;
		}
		throw invalid(name, "a boolean");
	}

	private static ToolException invalid(String name, String expected) {
		return new ToolException(ToolException.ErrorKind.INVALID_INPUT,
				"Parameter '" + name + "' must be " + expected + ".");
	}

}
