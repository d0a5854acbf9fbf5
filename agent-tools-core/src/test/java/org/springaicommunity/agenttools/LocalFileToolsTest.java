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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileTools} and {@link LocalFileTools}.
 */
class LocalFileToolsTest {

	@TempDir
	Path dir;

	private FileMutationGuard guard;

	private LocalFileTools files;

	@BeforeEach
	void setUp() {
		guard = new FileMutationGuard();
		files = new LocalFileTools(guard, ToolsConfig.builder().workingDirectory(dir).build());
	}

	@Test
	void readShouldRenderNumberedLines() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "alpha\nbeta\n");

		assertThat(files.read(file.toString(), null, null)).isEqualTo("     1→alpha\n     2→beta");
	}

	@Test
	void readShouldHonourOffsetAndLimit() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "1\n2\n3\n4\n5\n");

		assertThat(files.read(file.toString(), 2, 2)).isEqualTo("     2→2\n     3→3");
		assertThat(files.read(file.toString(), 4, null)).isEqualTo("     4→4\n     5→5");
		assertThat(files.read(file.toString(), null, 1)).isEqualTo("     1→1");
	}

	@Test
	void readShouldWarnWhenOffsetIsPastTheEnd() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "1\n2\n");

		assertThat(files.read(file.toString(), 10, null)).isEqualTo(
				"<system-reminder>Warning: the file exists but is shorter than the provided offset (10). The file has 2 lines.</system-reminder>");
	}

	@Test
	void readShouldCapLinesAndLineLength() throws Exception {
		LocalFileTools small = new LocalFileTools(guard,
				ToolsConfig.builder().workingDirectory(dir).defaultReadLines(2).maxLineLength(3).build());
		Path file = Files.writeString(dir.resolve("a.txt"), "abcdef\nghijkl\nmnopqr\n");

		assertThat(small.read(file.toString(), null, null)).isEqualTo("     1→abc\n     2→ghi");
	}

	@Test
	void readShouldWarnForEmptyFiles() throws Exception {
		Path file = Files.writeString(dir.resolve("empty.txt"), "");

		assertThat(files.read(file.toString(), null, null)).isEqualTo(LocalFileTools.EMPTY_FILE_NOTICE);
		assertThat(guard.lastObserved(file)).isPresent();
	}

	@Test
	void readShouldDescribeBinaryFiles() throws Exception {
		Path file = Files.write(dir.resolve("data.bin"), new byte[] { 0, 1, 2, (byte) 0xFF });

		assertThat(files.read(file.toString(), null, null)).startsWith("[Binary file: " + file + " (")
			.endsWith("), 4 bytes]");
	}

	@Test
	void readShouldRejectMissingFilesAndDirectories() {
		assertThatThrownBy(() -> files.read(dir.resolve("missing.txt").toString(), null, null))
			.isInstanceOfSatisfying(ToolException.class,
					e -> assertThat(e.kind()).isEqualTo(ToolException.ErrorKind.NOT_FOUND));
		assertThatThrownBy(() -> files.read(dir.toString(), null, null)).isInstanceOfSatisfying(ToolException.class,
				e -> assertThat(e.kind()).isEqualTo(ToolException.ErrorKind.INVALID_INPUT));
		assertThatThrownBy(() -> files.read("relative.txt", null, null))
			.hasMessage("file path must be absolute, not relative");
	}

	@Test
	void readShouldRejectOversizedFiles() throws Exception {
		LocalFileTools small = new LocalFileTools(guard,
				ToolsConfig.builder().workingDirectory(dir).maxFileSize(4).build());
		Path file = Files.writeString(dir.resolve("big.txt"), "too large");

		assertThatThrownBy(() -> small.read(file.toString(), null, null))
			.hasMessageStartingWith("File content (9 bytes) exceeds maximum allowed size (4 bytes).")
			.isInstanceOfSatisfying(ToolException.class,
					e -> assertThat(e.kind()).isEqualTo(ToolException.ErrorKind.LIMIT_EXCEEDED));
	}

	@Test
	void writeShouldCreateNewFilesAndParents() {
		Path file = dir.resolve("nested/dir/new.txt");

		String message = files.write(file.toString(), "content");

		assertThat(message).isEqualTo("File created successfully at: " + file);
		assertThat(file).hasContent("content");
	}

	@Test
	void writeShouldRequireAReadBeforeOverwriting() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "original");

		assertThatThrownBy(() -> files.write(file.toString(), "new"))
			.hasMessage("file exists, you must read it first before writing")
			.isInstanceOfSatisfying(ToolException.class,
					e -> assertThat(e.kind()).isEqualTo(ToolException.ErrorKind.STATE_CONFLICT));

		files.read(file.toString(), null, null);
		assertThat(files.write(file.toString(), "new")).isEqualTo("File updated successfully at: " + file);
		assertThat(file).hasContent("new");
	}

	@Test
	void writeShouldRejectFilesModifiedSinceRead() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "original");
		files.read(file.toString(), null, null);
		touchLater(file);

		assertThatThrownBy(() -> files.write(file.toString(), "new"))
			.hasMessage("file has been modified since last read, please read again before writing");
		assertThat(file).hasContent("original");
	}

	@Test
	void writeShouldAllowConsecutiveWritesWithoutRead() {
		Path file = dir.resolve("a.txt");

		files.write(file.toString(), "one");
		files.write(file.toString(), "two");

		assertThat(file).hasContent("two");
	}

	@Test
	void editShouldReplaceAUniqueStringAndShowASnippet() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "l1\nl2\nl3\nl4\nl5\nl6\nl7\n");
		files.read(file.toString(), null, null);

		String message = files.edit(file.toString(), "l4", "four", false);

		assertThat(file).hasContent("l1\nl2\nl3\nfour\nl5\nl6\nl7\n");
		assertThat(message).isEqualTo("The file " + file
				+ " has been updated. Here's the result of running `cat -n` on a snippet of the edited file:\n"
				+ "     2→l2\n     3→l3\n     4→four\n     5→l5\n     6→l6");
	}

	@Test
	void editSnippetShouldFollowTheNewLineNumbers() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "a\nb\nc\n");
		files.read(file.toString(), null, null);

		String message = files.edit(file.toString(), "b\n", "b1\nb2\nb3\n", false);

		assertThat(message).endsWith("     1→a\n     2→b1\n     3→b2\n     4→b3\n     5→c");
	}

	@Test
	void editShouldReplaceAllOccurrences() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "foo bar foo");
		files.read(file.toString(), null, null);

		String message = files.edit(file.toString(), "foo", "baz", true);

		assertThat(file).hasContent("baz bar baz");
		assertThat(message).isEqualTo("The file " + file
				+ " has been updated. All occurrences of 'foo' were successfully replaced with 'baz'.");
	}

	@Test
	void editShouldRejectAmbiguousMatches() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "foo bar foo");
		files.read(file.toString(), null, null);

		assertThatThrownBy(() -> files.edit(file.toString(), "foo", "baz", false))
			.hasMessageStartingWith("Found 2 matches of the string to replace, but replace_all is false.")
			.hasMessageEndingWith("\nString: foo");
		assertThat(file).hasContent("foo bar foo");
	}

	@Test
	void editShouldRejectMissingStrings() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "foo");
		files.read(file.toString(), null, null);

		assertThatThrownBy(() -> files.edit(file.toString(), "nope", "x", false))
			.hasMessage("String to replace not found in file.\nString: nope");
	}

	@Test
	void editShouldRejectIdenticalStrings() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "foo");

		assertThatThrownBy(() -> files.edit(file.toString(), "foo", "foo", false))
			.hasMessage("old_string and new_string are the same - no changes to make")
			.isInstanceOfSatisfying(ToolException.class,
					e -> assertThat(e.kind()).isEqualTo(ToolException.ErrorKind.INVALID_INPUT));
	}

	@Test
	void editShouldRequireARead() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "foo");

		assertThatThrownBy(() -> files.edit(file.toString(), "foo", "bar", false))
			.hasMessage("file has not been read yet - please read the file before editing");
	}

	@Test
	void editShouldRejectFilesModifiedSinceRead() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "foo");
		files.read(file.toString(), null, null);
		touchLater(file);

		assertThatThrownBy(() -> files.edit(file.toString(), "foo", "bar", false))
			.hasMessage("file has been modified since it was last read - please read the file again before editing");
	}

	@Test
	void chainedEditsShouldNotNeedAnotherRead() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "one two");
		files.read(file.toString(), null, null);

		files.edit(file.toString(), "one", "1", false);
		files.edit(file.toString(), "two", "2", false);

		assertThat(file).hasContent("1 2");
	}

	@Test
	void multiEditShouldApplyInOrder() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "alpha\nbeta\ngamma\n");
		files.read(file.toString(), null, null);

		String message = files.edit(file.toString(),
				List.of(EditOperation.of("alpha", "ALPHA"), EditOperation.of("gamma", "GAMMA")));

		assertThat(file).hasContent("ALPHA\nbeta\nGAMMA\n");
		assertThat(message).contains("has been updated with 2 edits.");
	}

	@Test
	void multiEditShouldRejectEditsOfEarlierReplacements() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "foo");
		files.read(file.toString(), null, null);

		assertThatThrownBy(() -> files.edit(file.toString(),
				List.of(EditOperation.of("foo", "foobar"), EditOperation.of("bar", "baz"))))
			.hasMessage("edit conflict detected: the string to replace is part of a previous edit's replacement");
		assertThat(file).hasContent("foo");
	}

	@Test
	void multiEditShouldRejectEditsThatCancelOut() throws Exception {
		Path file = Files.writeString(dir.resolve("a.txt"), "foo");
		files.read(file.toString(), null, null);

		assertThatThrownBy(() -> files.edit(file.toString(),
				List.of(EditOperation.of("foo", "x"), EditOperation.of("x", "foo"))))
			.isInstanceOf(ToolException.class);
		assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo("foo");
	}

	@Test
	void countOccurrencesShouldNotOverlap() {
		assertThat(LocalFileTools.countOccurrences("aaaa", "aa")).isEqualTo(2);
		assertThat(LocalFileTools.countOccurrences("abc", "d")).isZero();
	}

	private static void touchLater(Path file) throws Exception {
		FileTime current = Files.getLastModifiedTime(file);
		Files.setLastModifiedTime(file, FileTime.fromMillis(current.toMillis() + 5_000));
	}

}
