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

/**
 * Line-oriented file operations exposed to tool callers.
 *
 * <p>
 * All paths must be absolute. Existing files can only be overwritten or edited after
 * they have been read, and only while they have not been modified by anyone else since
 * (see {@link FileMutationGuard}).
 * </p>
 *
 * <pre>{@code
 * FileTools files = context.files();
 * String numbered = files.read("/work/src/Main.java", null, null);
 * files.edit("/work/src/Main.java", "int x = 1;", "int x = 2;", false);
 * }</pre>
 *
 * @since 0.1.0
 */
public interface FileTools {

	/**
	 * Read a file and render its lines with line numbers.
	 * @param filePath absolute path of the file
	 * @param offset 1-based first line, or {@code null}
	 * @param limit number of lines, or {@code null}
	 * @return the rendered lines, or a notice for empty, binary or too short files
	 * @throws ToolException if the path is invalid, missing, a directory or too large
	 */
	String read(String filePath, Integer offset, Integer limit);

	/**
	 * Create or overwrite a file. Parent directories are created as needed.
	 * @param filePath absolute path of the file
	 * @param content the new content, written as UTF-8
	 * @return a confirmation naming the path
	 * @throws ToolException if an existing file was not read first or changed since
	 */
	String write(String filePath, String content);

	/**
	 * Replace an exact string in a file.
	 * @param filePath absolute path of the file
	 * @param oldString the text to replace
	 * @param newString the replacement
	 * @param replaceAll replace every occurrence instead of exactly one
	 * @return a confirmation, with a numbered snippet of the changed region for a single
	 * replacement
	 * @throws ToolException if the edit is ambiguous, does not match or changes nothing
	 */
	String edit(String filePath, String oldString, String newString, boolean replaceAll);

	/**
	 * Apply several replacements in order, writing the file once.
	 * @param filePath absolute path of the file
	 * @param edits the replacements, applied sequentially
	 * @return a confirmation with a numbered snippet of the changed region
	 * @throws ToolException if any edit fails, in which case the file is left unchanged
	 */
	String edit(String filePath, List<EditOperation> edits);

}
