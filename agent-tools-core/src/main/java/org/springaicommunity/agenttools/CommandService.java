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

import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates command requests and dispatches them to the {@link ForegroundExecutor} or the
 * {@link ProcessRegistry}.
 *
 * @since 0.1.0
 */
public class CommandService {

	private static final Logger logger = LoggerFactory.getLogger(CommandService.class);

	private final ToolsConfig config;

	private final ProcessRegistry registry;

	private final ForegroundExecutor foregroundExecutor;

	private final OutputLimits limits;

	public CommandService(ToolsConfig config, ProcessRegistry registry) {
		this(config, registry, new ForegroundExecutor(config.workingDirectory()));
	}

	CommandService(ToolsConfig config, ProcessRegistry registry, ForegroundExecutor foregroundExecutor) {
		this.config = Objects.requireNonNull(config, "config cannot be null");
		this.registry = Objects.requireNonNull(registry, "registry cannot be null");
		this.foregroundExecutor = Objects.requireNonNull(foregroundExecutor, "foregroundExecutor cannot be null");
		this.limits = new OutputLimits(config);
	}

	/**
	 * Runs a command and describes the result as text.
	 * @param spec the request
	 * @return the command output, or the background identifier message
	 * @throws ToolException on invalid input, timeout, nonzero exit or spawn failure
	 */
	public String execute(ExecSpec spec) {
		Objects.requireNonNull(spec, "spec cannot be null");
		if (spec.runInBackground()) {
			BackgroundExecution execution = startBackground(spec.command(), spec.description());
			return "Command running in background with ID: " + execution.id();
		}
		return runForeground(spec.command(), spec.timeout());
	}

	/**
	 * Runs a command in the foreground.
	 * @param command the command line
	 * @param requestedTimeout the deadline, or {@code null}/non-positive for the default
	 * @return the merged output
	 * @throws ToolException {@code COMMAND_FAILED} when the command exits nonzero,
	 * {@code LIMIT_EXCEEDED} when the output is too large
	 */
	public String runForeground(String command, Duration requestedTimeout) {
		validateCommand(command);
		Duration timeout = resolveTimeout(requestedTimeout);
		ExecResult result = foregroundExecutor.execute(command, timeout);
		if (result.failed()) {
			logger.debug("Foreground command failed: {}", result.summary());
			throw new ToolException(ToolException.ErrorKind.COMMAND_FAILED, String
				.format("Command exited with code %d:\n%s\n\nCommand: %s", result.exitCode(), result.output(), command));
		}
		return limits.capOutputSize(result.output(), OutputLimits.ToolKind.BASH);
	}

	/**
	 * Starts a command in the background in the configured working directory.
	 * @param command the command line
	 * @param description optional description
	 * @return the registered execution
	 */
	public BackgroundExecution startBackground(String command, String description) {
		validateCommand(command);
		return registry.start(command, description, config.workingDirectory());
	}

	/**
	 * Applies the default and maximum timeout rules.
	 * @param requested the requested timeout, may be null
	 * @return the effective timeout
	 * @throws ToolException of kind {@code INVALID_INPUT} above the maximum
	 */
	public Duration resolveTimeout(Duration requested) {
		if (requested == null || requested.isZero() || requested.isNegative()) {
			return config.defaultTimeout();
		}
		if (requested.compareTo(config.maxTimeout()) > 0) {
			throw ToolException
				.invalidInput(String.format("Timeout cannot exceed %d milliseconds.", config.maxTimeout().toMillis()));
		}
		return requested;
	}

	private static void validateCommand(String command) {
		if (command == null || command.isEmpty()) {
			throw ToolException.invalidInput("Command cannot be empty.");
		}
	}

	public ProcessRegistry registry() {
		return registry;
	}

}
