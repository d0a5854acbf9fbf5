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

import java.util.List;
import java.util.Locale;

/**
 * Builds the argument vector that runs a command line through the platform shell.
 */
final class ShellCommands {

	private ShellCommands() {
	}

	static List<String> shell(String commandLine) {
		if (isWindows()) {
			return List.of("cmd", "/c", commandLine);
		}
		return List.of("bash", "-c", commandLine);
	}

	static boolean isWindows() {
		return System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("windows");
	}

}
