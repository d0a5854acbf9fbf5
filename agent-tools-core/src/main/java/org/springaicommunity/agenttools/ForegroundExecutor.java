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
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeroturnaround.exec.ProcessExecutor;
import org.zeroturnaround.exec.ProcessResult;

/**
 * Runs a shell command synchronously under a deadline.
 *
 * <p>
 * Standard error is merged into standard output. A command still running at the deadline
 * is destroyed and reported as a {@link ToolException.ErrorKind#TIMEOUT}; so is a command
 * that ends with a kill-signal exit code (137 or 143) at or after the deadline.
 * </p>
 *
 * @since 0.1.0
 */
public class ForegroundExecutor {

	private static final Logger logger = LoggerFactory.getLogger(ForegroundExecutor.class);

	static final String TIMEOUT_MESSAGE = "Command timed out. Consider increasing the timeout parameter or running in background.";

	private static final int SIGKILL_EXIT = 128 + 9;

	private static final int SIGTERM_EXIT = 128 + 15;

	private final Path workingDirectory;

	public ForegroundExecutor(Path workingDirectory) {
		this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory cannot be null");
	}

	/**
	 * Runs the command and waits for it.
	 * @param command the command line
	 * @param timeout the deadline, must be positive
	 * @return the exit code and merged output, whatever the exit code
	 * @throws ToolException {@code TIMEOUT} past the deadline, {@code OS_FAILURE} when
	 * the process cannot be spawned or waited for
	 */
	public ExecResult execute(String command, Duration timeout) {
		Objects.requireNonNull(command, "command cannot be null");
		Objects.requireNonNull(timeout, "timeout cannot be null");

		List<String> finalCommand = ShellCommands.shell(command);
		Instant startTime = Instant.now();
		Instant deadline = startTime.plus(timeout);

		logger.debug("Executing command in directory {} with timeout {}: {}", workingDirectory, timeout,
				finalCommand);
		try {
			ProcessResult result = new ProcessExecutor().command(finalCommand)
				.directory(workingDirectory.toFile())
				.redirectErrorStream(true)
				.readOutput(true)
				.exitValueAny()
				.destroyOnExit()
				.timeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
				.execute();

			int exitCode = result.getExitValue();
			if ((exitCode == SIGKILL_EXIT || exitCode == SIGTERM_EXIT) && !Instant.now().isBefore(deadline)) {
				throw timedOut(timeout);
			}
			Duration duration = Duration.between(startTime, Instant.now());
			logger.debug("Command completed with exit code {} in {}", exitCode, duration);
			return new ExecResult(exitCode, result.outputUTF8(), duration);
		}
		catch (java.util.concurrent.TimeoutException e) {
			throw timedOut(timeout);
		}
		catch (IOException e) {
			throw ToolException.osFailure(failedToExecute(e.getMessage(), command), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw ToolException.osFailure(failedToExecute("interrupted", command), e);
		}
	}

	private static ToolException timedOut(Duration timeout) {
		logger.debug("Command exceeded its timeout of {}", timeout);
		return new ToolException(ToolException.ErrorKind.TIMEOUT, TIMEOUT_MESSAGE,
				new CommandTimeoutException("Command timed out after " + timeout, timeout));
	}

	private static String failedToExecute(String reason, String command) {
		return String.format("Failed to execute command: %s\n\nCommand: %s", reason, command);
	}

	public Path workingDirectory() {
		return workingDirectory;
	}

}
