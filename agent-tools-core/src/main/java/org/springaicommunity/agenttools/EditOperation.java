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

import java.util.Objects;

/**
 * One exact-string replacement applied by {@link FileTools#edit(String, java.util.List)}.
 *
 * @param oldString the text to replace
 * @param newString the replacement, must differ from {@code oldString}
 * @param replaceAll replace every occurrence instead of exactly one
 */
public record EditOperation(String oldString, String newString, boolean replaceAll) {

	public EditOperation {
		Objects.requireNonNull(oldString, "oldString cannot be null");
		Objects.requireNonNull(newString, "newString cannot be null");
	}

	public static EditOperation of(String oldString, String newString) {
		return new EditOperation(oldString, newString, false);
	}

}
