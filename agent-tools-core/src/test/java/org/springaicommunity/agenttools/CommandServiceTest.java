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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link CommandService} and {@link ForegroundExecutor}.
 */
@DisabledOnOs(OS.WINDOWS)
class CommandServiceTest {

	@TempDir
	Path workDir;

	private ToolsConfig config;

	private ProcessRegistry registry;

	private CommandService commands;

	@BeforeEach
	void setUp() {
		config = ToolsConfig.builder()
			.workingDirectory(workDir)
			.defaultTimeout(Duration.ofSeconds(30))
			.maxTimeout(Duration.ofSeconds(60))
			.build();
		registry = new ProcessRegistry(config);
		commands = new CommandService(config, registry);
	}

	@AfterEach
	void tearDown() {
		registry.close();
	}

	@Test
	void foregroundShouldReturnMergedOutput() {
		String output = commands.execute(ExecSpec.of("echo out; echo err >&2"));

		assertThat(output).contains("out").contains("err");
	}

	@Test
	void foregroundShouldRunInTheWorkingDirectory() throws Exception {
		Files.writeString(workDir.resolve("marker.txt"), "present");

		assertThat(commands.execute(ExecSpec.of("cat marker.txt"))).isEqualTo("present");
	}

	@Test
	void nonzeroExitShouldReportCodeOutputAndCommand() {
		assertThatThrownBy(() -> commands.execute(ExecSpec.of("echo failing; exit 7")))
			.hasMessage("Command exited with code 7:\nfailing\n\n\nCommand: echo failing; exit 7")
			.isInstanceOfSatisfying(ToolException.class,
					e -> assertThat(e.kind()).isEqualTo(ToolException.ErrorKind.COMMAND_FAILED));
	}

	@Test
	void exceedingTheDeadlineShouldBeATimeout() {
		ExecSpec spec = ExecSpec.builder().command("sleep 10").timeout(Duration.ofMillis(300)).build();

		assertThatThrownBy(() -> commands.execute(spec)).hasMessage(ForegroundExecutor.TIMEOUT_MESSAGE)
			.isInstanceOfSatisfying(ToolException.class, e -> {
				assertThat(e.kind()).isEqualTo(ToolException.ErrorKind.TIMEOUT);
				assertThat(e.getCause()).isInstanceOfSatisfying(CommandTimeoutException.class,
						cause -> assertThat(cause.getTimeout()).isEqualTo(Duration.ofMillis(300)));
			});
	}

	@Test
	void timeoutAboveTheMaximumShouldBeRejected() {
		ExecSpec spec = ExecSpec.builder().command("true").timeout(Duration.ofSeconds(61)).build();

		assertThatThrownBy(() -> commands.execute(spec)).hasMessage("Timeout cannot exceed 60000 milliseconds.")
			.isInstanceOfSatisfying(ToolException.class,
					e -> assertThat(e.kind()).isEqualTo(ToolException.ErrorKind.INVALID_INPUT));
	}

	@Test
	void nonPositiveTimeoutShouldSelectTheDefault() {
		assertThat(commands.resolveTimeout(null)).isEqualTo(Duration.ofSeconds(30));
		assertThat(commands.resolveTimeout(Duration.ZERO)).isEqualTo(Duration.ofSeconds(30));
		assertThat(commands.resolveTimeout(Duration.ofMillis(-5))).isEqualTo(Duration.ofSeconds(30));
		assertThat(commands.resolveTimeout(Duration.ofSeconds(60))).isEqualTo(Duration.ofSeconds(60));
	}

	@Test
	void emptyCommandShouldBeRejected() {
		assertThatThrownBy(() -> commands.execute(ExecSpec.of(""))).hasMessage("Command cannot be empty.");
		assertThatThrownBy(
				() -> commands.execute(ExecSpec.builder().command("").runInBackground(true).build()))
			.hasMessage("Command cannot be empty.");
		assertThat(registry.size()).isZero();
	}

	@Test
	void oversizedOutputShouldBeRejectedWithTheBashHint() {
		CommandService small = new CommandService(
				ToolsConfig.builder().workingDirectory(workDir).maxOutputChars(40).build(), registry);

		assertThatThrownBy(() -> small.execute(ExecSpec.of("seq 1 100"))).hasMessageContaining("tokens")
			.hasMessageContaining(OutputLimits.ToolKind.BASH.suggestion())
			.isInstanceOfSatisfying(ToolException.class,
					e -> assertThat(e.kind()).isEqualTo(ToolException.ErrorKind.LIMIT_EXCEEDED));
	}

	@Test
	void backgroundShouldReturnTheIdentifier() {
		String message = commands
			.execute(ExecSpec.builder().command("echo bg").description("background echo").runInBackground(true).build());

		assertThat(message).isEqualTo("Command running in background with ID: shell_1");
		BackgroundExecution execution = registry.lookup("shell_1").orElseThrow();
		assertThat(execution.description()).isEqualTo("background echo");
		await().atMost(Duration.ofSeconds(10)).until(execution::isCompleted);
		assertThat(registry.pollOutput("shell_1", null).stdout()).isEqualTo("bg\n");
	}

	@Test
	void executorSpawnFailureShouldBeAnOsFailure() {
		ForegroundExecutor executor = new ForegroundExecutor(workDir.resolve("missing"));

		assertThatThrownBy(() -> executor.execute("true", Duration.ofSeconds(10)))
			.isInstanceOfSatisfying(ToolException.class,
					e -> assertThat(e.kind()).isEqualTo(ToolException.ErrorKind.OS_FAILURE))
			.hasMessageStartingWith("Failed to execute command: ")
			.hasMessageEndingWith("\n\nCommand: true");
	}

	@Test
	void executorShouldReportExitCodeAndDuration() {
		ForegroundExecutor executor = new ForegroundExecutor(workDir);

		ExecResult result = executor.execute("exit 4", Duration.ofSeconds(10));

		assertThat(result.failed()).isTrue();
		assertThat(result.exitCode()).isEqualTo(4);
		assertThat(result.hasOutput()).isFalse();
		assertThat(result.duration()).isPositive();
	}

}
