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
import java.nio.file.FileSystem;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds files whose path, relative to a base directory, matches a glob pattern.
 *
 * <p>
 * Patterns use {@link FileSystem#getPathMatcher(String) glob syntax}. A {@code **}
 * segment followed by a separator also matches zero directories, so {@code **}{@code /*.java}
 * finds Java files at the base too. Only regular files are returned, most recently
 * modified first.
 * </p>
 *
 * @since 0.1.0
 */
public class GlobSearch {

	private static final Logger logger = LoggerFactory.getLogger(GlobSearch.class);

	static final String NO_FILES_FOUND = "No files found";

	private static final String ANY_DIRECTORIES = "**/";

	private static final int MAX_EXPANDED_SEGMENTS = 8;

	private final Path workingDirectory;

	private final OutputLimits limits;

	public GlobSearch(ToolsConfig config) {
		this.workingDirectory = config.workingDirectory();
		this.limits = new OutputLimits(config);
	}

	/**
	 * Searches for matching files.
	 * @param pattern the glob pattern
	 * @param path absolute base directory, or {@code null} for the working directory
	 * @return newline-separated relative paths, newest first, or {@value #NO_FILES_FOUND}
	 * @throws ToolException of kind {@code INVALID_INPUT} for a malformed pattern or a
	 * relative base path
	 */
	public String search(String pattern, String path) {
		if (pattern == null || pattern.isEmpty() || pattern.indexOf('\0') >= 0) {
			throw ToolException.invalidInput("Invalid glob pattern.");
		}
		Path base = (path == null || path.isEmpty()) ? workingDirectory : FileMutationGuard.canonicalize(path);
		if (!Files.exists(base)) {
			return NO_FILES_FOUND;
		}

		List<PathMatcher> matchers = compile(base.getFileSystem(), pattern);
		List<Match> matches = new ArrayList<>();
		try {
			Files.walkFileTree(base, new SimpleFileVisitor<>() {

				@Override
				public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
					if (attrs.isDirectory()) {
						return FileVisitResult.CONTINUE;
					}
					Path relative = base.relativize(file);
					for (PathMatcher matcher : matchers) {
						if (matcher.matches(relative)) {
							matches.add(new Match(relative.toString(), attrs.lastModifiedTime()));
							break;
						}
					}
					return FileVisitResult.CONTINUE;
				}

				@Override
				public FileVisitResult visitFileFailed(Path file, IOException e) {
					logger.debug("Skipping unreadable path {}: {}", file, e.getMessage());
					return FileVisitResult.CONTINUE;
				}

			});
		}
		catch (IOException e) {
			throw ToolException.osFailure("Failed to walk " + base + ": " + e.getMessage(), e);
		}

		if (matches.isEmpty()) {
			return NO_FILES_FOUND;
		}
		String result = matches.stream()
			.sorted(Comparator.comparing(Match::modified).reversed().thenComparing(Match::path))
			.map(Match::path)
			.collect(Collectors.joining("\n"));
		logger.debug("Glob {} under {} matched {} file(s)", pattern, base, matches.size());
		return limits.capOutputSize(limits.capLineCount(result), OutputLimits.ToolKind.GLOB);
	}

	private static List<PathMatcher> compile(FileSystem fileSystem, String pattern) {
		List<PathMatcher> matchers = new ArrayList<>();
		try {
			for (String variant : expandDoubleStar(pattern)) {
				matchers.add(fileSystem.getPathMatcher("glob:" + variant));
			}
		}
		catch (IllegalArgumentException e) {
			throw new ToolException(ToolException.ErrorKind.INVALID_INPUT, "Invalid glob pattern: " + e.getMessage(),
					e);
		}
		return matchers;
	}

	/**
	 * Expands every {@code **}{@code /} segment into "present" and "absent" variants.
	 */
	static Set<String> expandDoubleStar(String pattern) {
		Set<String> variants = new LinkedHashSet<>();
		variants.add(pattern);
		int expanded = 0;
		int index = pattern.indexOf(ANY_DIRECTORIES);
		while (index >= 0 && expanded < MAX_EXPANDED_SEGMENTS) {
			Set<String> next = new LinkedHashSet<>(variants);
			for (String variant : variants) {
				int at = variant.indexOf(ANY_DIRECTORIES);
				while (at >= 0) {
					next.add(variant.substring(0, at) + variant.substring(at + ANY_DIRECTORIES.length()));
					at = variant.indexOf(ANY_DIRECTORIES, at + 1);
				}
			}
			variants = next;
			expanded++;
			index = pattern.indexOf(ANY_DIRECTORIES, index + 1);
		}
		return variants;
	}

	private record Match(String path, FileTime modified) {
	}

}
