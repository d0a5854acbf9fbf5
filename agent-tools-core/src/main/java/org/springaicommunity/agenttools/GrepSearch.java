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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeroturnaround.exec.ProcessExecutor;
import org.zeroturnaround.exec.ProcessResult;

/**
 * Content search backed by the ripgrep ({@code rg}) binary.
 *
 * <p>
 * A search path is always passed to {@code rg}: when the request names none, the
 * configured working directory is searched.
 * </p>
 *
 * @since 0.1.0
 */
public class GrepSearch {

	private static final Logger logger = LoggerFactory.getLogger(GrepSearch.class);

	static final String NO_MATCHES_FOUND = "No matches found";

	private static final int EXIT_NO_MATCHES = 1;

	private static final int EXIT_ERROR = 2;

	private final Path workingDirectory;

	private final String ripgrepBinary;

	private final Duration timeout;

	private final OutputLimits limits;

	public GrepSearch(ToolsConfig config) {
		this.workingDirectory = config.workingDirectory();
		this.ripgrepBinary = config.ripgrepBinary();
		this.timeout = config.maxTimeout();
		this.limits = new OutputLimits(config);
	}

	/**
	 * Runs the search.
	 * @param request the search parameters
	 * @return the ripgrep output after head and size limits, or {@value #NO_MATCHES_FOUND}
	 * @throws ToolException {@code INVALID_INPUT} for a missing pattern, a relative path or
	 * an unknown output mode, {@code COMMAND_FAILED} when ripgrep reports an error,
	 * {@code OS_FAILURE} when it cannot be run
	 */
	public String search(GrepRequest request) {
		if (request.pattern() == null || request.pattern().isEmpty()) {
			throw ToolException.invalidInput("pattern is required.");
		}
		List<String> command = new ArrayList<>();
		command.add(ripgrepBinary);
		command.addAll(buildArguments(request));
		command.add("--");
		command.add(request.pattern());
		Path searchPath = (request.path() == null || request.path().isEmpty()) ? workingDirectory
				: FileMutationGuard.canonicalize(request.path());
		command.add(searchPath.toString());

		String output = applyHeadLimit(execute(command), request.headLimit()).strip();
		if (output.isEmpty()) {
			return NO_MATCHES_FOUND;
		}
		return limits.capOutputSize(limits.capLineCount(output), OutputLimits.ToolKind.GREP);
	}

	private String execute(List<String> command) {
		ByteArrayOutputStream stderr = new ByteArrayOutputStream();
		logger.debug("Running ripgrep: {}", command);
		try {
			ProcessResult result = new ProcessExecutor().command(command)
				.directory(workingDirectory.toFile())
				.readOutput(true)
				.redirectError(stderr)
				.exitValueAny()
				.destroyOnExit()
				.timeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
				.execute();

			int exitCode = result.getExitValue();
			if (exitCode == 0) {
				return result.outputUTF8();
			}
			if (exitCode == EXIT_NO_MATCHES) {
				return "";
			}
			if (exitCode == EXIT_ERROR) {
				logger.debug("ripgrep exited with code 2: {}", stderr.toString(StandardCharsets.UTF_8));
				throw new ToolException(ToolException.ErrorKind.COMMAND_FAILED,
						"No files were searched. This usually means ripgrep applied a filter that excluded all files.");
			}
			throw new ToolException(ToolException.ErrorKind.COMMAND_FAILED, String.format("rg exited with code %d:\n%s",
					exitCode, result.outputUTF8() + stderr.toString(StandardCharsets.UTF_8)));
		}
		catch (java.util.concurrent.TimeoutException e) {
			throw new ToolException(ToolException.ErrorKind.TIMEOUT, "rg timed out after " + timeout,
					new CommandTimeoutException("rg timed out after " + timeout, timeout));
		}
		catch (IOException e) {
			throw ToolException.osFailure("Failed to execute rg: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw ToolException.osFailure("Failed to execute rg: interrupted", e);
		}
	}

	/**
	 * Translates the request options into ripgrep flags, excluding pattern and path.
	 * @throws ToolException of kind {@code INVALID_INPUT} for an unknown output mode
	 */
	static List<String> buildArguments(GrepRequest request) {
		List<String> args = new ArrayList<>();
		String outputMode = request.outputMode() == null || request.outputMode().isEmpty()
				? GrepRequest.FILES_WITH_MATCHES : request.outputMode();
		switch (outputMode) {
			case GrepRequest.FILES_WITH_MATCHES -> args.add("--files-with-matches");
			case GrepRequest.COUNT -> args.add("--count");
			case GrepRequest.CONTENT -> {
				if (request.linesAfter() > 0) {
					args.add("-A" + request.linesAfter());
				}
				if (request.linesBefore() > 0) {
					args.add("-B" + request.linesBefore());
				}
				if (request.linesAround() > 0) {
					args.add("-C" + request.linesAround());
				}
				if (request.lineNumbers()) {
					args.add("--line-number");
				}
			}
			default -> throw ToolException.invalidInput(String
				.format("Invalid output_mode: %s. Must be one of: content, files_with_matches, count.", outputMode));
		}
		if (request.ignoreCase()) {
			args.add("--ignore-case");
		}
		if (request.multiline()) {
			args.addAll(Arrays.asList("--multiline", "--multiline-dotall"));
		}
		if (request.type() != null && !request.type().isEmpty()) {
			args.addAll(Arrays.asList("--type", request.type()));
		}
		if (request.glob() != null && !request.glob().isEmpty()) {
			args.addAll(Arrays.asList("--glob", request.glob()));
		}
		return args;
	}

	static String applyHeadLimit(String output, int limit) {
		if (limit <= 0) {
			return output;
		}
		String[] lines = output.strip().split("\n", -1);
		if (lines.length <= limit) {
			return String.join("\n", lines);
		}
		return String.join("\n", Arrays.asList(lines).subList(0, limit));
	}

}
