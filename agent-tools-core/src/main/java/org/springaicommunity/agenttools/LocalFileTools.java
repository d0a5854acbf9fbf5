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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local filesystem implementation of {@link FileTools}.
 *
 * <p>
 * Every successful read records the modification time observed before the content was
 * loaded, and every successful mutation records the modification time after the write,
 * so a chain of edits does not need a read in between.
 * </p>
 *
 * @since 0.1.0
 */
class LocalFileTools implements FileTools {

	private static final Logger logger = LoggerFactory.getLogger(LocalFileTools.class);

	static final String EMPTY_FILE_NOTICE = "<system-reminder>Warning: the file exists but the contents are empty.</system-reminder>";

	private static final int SNIPPET_CONTEXT_LINES = 2;

	private final FileMutationGuard guard;

	private final OutputLimits limits;

	private final int defaultReadLines;

	private final int maxLineLength;

	LocalFileTools(FileMutationGuard guard, ToolsConfig config) {
		this.guard = guard;
		this.limits = new OutputLimits(config);
		this.defaultReadLines = config.defaultReadLines();
		this.maxLineLength = config.maxLineLength();
	}

	@Override
	public String read(String filePath, Integer offset, Integer limit) {
		Path path = FileMutationGuard.canonicalize(filePath);
		requireRegularFile(path);

		byte[] content;
		Instant modificationTime;
		try {
			limits.checkFileSize(Files.size(path));
			modificationTime = FileMutationGuard.modificationTime(path);
			content = Files.readAllBytes(path);
		}
		catch (IOException e) {
			throw ToolException.osFailure("Cannot read file: " + e.getMessage(), e);
		}
		guard.recordRead(path, modificationTime);
		logger.debug("Read {} bytes from {}", content.length, path);

		if (content.length == 0) {
			return EMPTY_FILE_NOTICE;
		}
		String binaryType = binaryContentType(path, content);
		if (binaryType != null) {
			return String.format("[Binary file: %s (%s), %d bytes]", path, binaryType, content.length);
		}

		List<String> lines = LineFormatting.splitLines(new String(content, StandardCharsets.UTF_8));
		int requestedOffset = offset != null ? offset : 0;
		int requestedLimit = limit != null ? limit : 0;
		int totalLines = lines.size();

		int startLine = requestedOffset > 0 ? requestedOffset : 1;
		if (requestedOffset > 0 && startLine > totalLines) {
			return String.format(
					"<system-reminder>Warning: the file exists but is shorter than the provided offset (%d). The file has %d lines.</system-reminder>",
					startLine, totalLines);
		}
		int endLine = totalLines;
		if (requestedLimit > 0) {
			endLine = Math.min(startLine + requestedLimit - 1, totalLines);
		}
		else if (requestedOffset <= 0) {
			endLine = Math.min(defaultReadLines, totalLines);
		}

		String rendered = LineFormatting.catN(lines.subList(startLine - 1, endLine), startLine, maxLineLength);
		return limits.capOutputSize(rendered, OutputLimits.ToolKind.READ);
	}

	@Override
	public String write(String filePath, String content) {
		Path path = FileMutationGuard.canonicalize(filePath);
		if (Files.isDirectory(path)) {
			throw ToolException.invalidInput("Path is a directory, not a file: " + path);
		}
		switch (guard.checkMutation(path)) {
			case NOT_READ -> throw ToolException.conflict("file exists, you must read it first before writing");
			case MODIFIED_SINCE_READ -> throw ToolException
				.conflict("file has been modified since last read, please read again before writing");
			case OK -> {
			}
		}

		boolean existed = Files.exists(path);
		try {
			Path parent = path.getParent();
			if (parent != null && !Files.exists(parent)) {
				Files.createDirectories(parent);
			}
			Files.writeString(path, content != null ? content : "", StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw ToolException.osFailure("Cannot write file: " + e.getMessage(), e);
		}
		guard.recordCurrent(path);
		logger.debug("Wrote {} ({})", path, existed ? "updated" : "created");

		return (existed ? "File updated successfully at: " : "File created successfully at: ") + path;
	}

	@Override
	public String edit(String filePath, String oldString, String newString, boolean replaceAll) {
		EditOperation operation = new EditOperation(oldString, newString, replaceAll);
		EditedFile edited = applyEdits(filePath, List.of(operation));
		if (replaceAll) {
			return String.format(
					"The file %s has been updated. All occurrences of '%s' were successfully replaced with '%s'.",
					edited.path(), oldString, newString);
		}
		return limits.capOutputSize(snippetMessage(edited, "The file %s has been updated."), OutputLimits.ToolKind.EDIT);
	}

	@Override
	public String edit(String filePath, List<EditOperation> edits) {
		EditedFile edited = applyEdits(filePath, edits);
		return limits.capOutputSize(
				snippetMessage(edited, "The file %s has been updated with " + edits.size() + " edits."),
				OutputLimits.ToolKind.EDIT);
	}

	private EditedFile applyEdits(String filePath, List<EditOperation> edits) {
		if (edits == null || edits.isEmpty()) {
			throw ToolException.invalidInput("at least one edit is required");
		}
		for (EditOperation edit : edits) {
			if (edit.oldString().isEmpty()) {
				throw ToolException.invalidInput("old_string cannot be empty");
			}
			if (edit.oldString().equals(edit.newString())) {
				throw ToolException.invalidInput("old_string and new_string are the same - no changes to make");
			}
		}

		Path path = FileMutationGuard.canonicalize(filePath);
		requireRegularFile(path);
		switch (guard.checkMutation(path)) {
			case NOT_READ -> throw ToolException
				.conflict("file has not been read yet - please read the file before editing");
			case MODIFIED_SINCE_READ -> throw ToolException
				.conflict("file has been modified since it was last read - please read the file again before editing");
			case OK -> {
			}
		}

		String oldContent;
		try {
			oldContent = Files.readString(path, StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw ToolException.osFailure("Cannot read file: " + e.getMessage(), e);
		}

		String newContent = oldContent;
		List<String> previousReplacements = new ArrayList<>();
		for (EditOperation edit : edits) {
			newContent = applyEdit(newContent, edit, previousReplacements);
			previousReplacements.add(edit.newString());
		}
		if (newContent.equals(oldContent)) {
			throw ToolException.conflict("the original content matches the edited content - no changes to make");
		}

		try {
			Files.writeString(path, newContent, StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw ToolException.osFailure("Cannot write file: " + e.getMessage(), e);
		}
		guard.recordCurrent(path);
		logger.debug("Applied {} edit(s) to {}", edits.size(), path);
		return new EditedFile(path, oldContent, newContent);
	}

	private static String applyEdit(String content, EditOperation edit, List<String> previousReplacements) {
		String oldString = edit.oldString();
		for (String previous : previousReplacements) {
			if (previous.contains(oldString)) {
				throw ToolException
					.conflict("edit conflict detected: the string to replace is part of a previous edit's replacement");
			}
		}

		int count = countOccurrences(content, oldString);
		if (count == 0) {
			throw ToolException.conflict("String to replace not found in file.\nString: " + oldString);
		}
		if (edit.replaceAll()) {
			return content.replace(oldString, edit.newString());
		}
		if (count > 1) {
			throw ToolException.conflict(String.format(
					"Found %d matches of the string to replace, but replace_all is false. To replace all occurrences, set replace_all to true. To replace only one occurrence, provide more context to uniquely identify the instance.\nString: %s",
					count, oldString));
		}
		int index = content.indexOf(oldString);
		return content.substring(0, index) + edit.newString() + content.substring(index + oldString.length());
	}

	static int countOccurrences(String content, String search) {
		int count = 0;
		int from = 0;
		while ((from = content.indexOf(search, from)) >= 0) {
			count++;
			from += search.length();
		}
		return count;
	}

	private String snippetMessage(EditedFile edited, String headlineFormat) {
		List<String> oldLines = LineFormatting.splitLines(edited.oldContent());
		List<String> newLines = LineFormatting.splitLines(edited.newContent());
		int[] range = LineFormatting.modifiedLines(oldLines, newLines, SNIPPET_CONTEXT_LINES);
		int start = range[0];
		int end = Math.max(range[1], start - 1);
		String snippet = LineFormatting.catN(newLines.subList(start - 1, end), start, maxLineLength);
		return String.format(headlineFormat, edited.path())
				+ " Here's the result of running `cat -n` on a snippet of the edited file:\n" + snippet;
	}

	private static void requireRegularFile(Path path) {
		if (!Files.exists(path)) {
			throw ToolException.notFound("file does not exist: " + path);
		}
		if (Files.isDirectory(path)) {
			throw ToolException.invalidInput("Path is a directory, not a file: " + path);
		}
	}

	/**
	 * Detects content that should not be rendered as text.
	 * @return the content type to report, or {@code null} for text
	 */
	private static String binaryContentType(Path path, byte[] content) {
		String probed = null;
		try {
			probed = Files.probeContentType(path);
		}
		catch (IOException e) {
			logger.debug("Cannot probe content type of {}", path, e);
		}
		if (probed != null && (probed.startsWith("image/") || probed.startsWith("audio/")
				|| probed.startsWith("video/"))) {
			return probed;
		}
		if (!isUtf8Text(content)) {
			return probed != null && !probed.startsWith("text/") ? probed : "application/octet-stream";
		}
		return null;
	}

	private static boolean isUtf8Text(byte[] content) {
		for (byte b : content) {
			if (b == 0) {
				return false;
			}
		}
		try {
			StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT)
				.decode(ByteBuffer.wrap(content));
			return true;
		}
		catch (CharacterCodingException e) {
			return false;
		}
	}

	private record EditedFile(Path path, String oldContent, String newContent) {
	}

}
