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
package org.springaicommunity.agenttools.mcp;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.agenttools.ToolContext;
import org.springaicommunity.agenttools.ToolsConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Command-line entry point serving the agent tools over MCP stdio.
 *
 * <p>
 * Standard output carries protocol frames only; logs go to standard error. The process
 * runs until the client closes standard input or the JVM receives a shutdown signal, and
 * kills the background commands still running before it exits.
 * </p>
 */
@Command(name = "agent-tools", mixinStandardHelpOptions = true,
		version = AgentToolsServer.SERVER_NAME + " " + AgentToolsServer.SERVER_VERSION,
		description = "Serves shell, file and search tools to an MCP client over stdio.")
public class AgentToolsCommand implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(AgentToolsCommand.class);

	@Spec
	CommandSpec spec;

	@Option(names = "--workdir", paramLabel = "DIR",
			description = "Working directory for commands and relative searches (default: current directory).")
	Path workingDirectory;

	@Option(names = "--default-timeout", paramLabel = "MILLIS",
			description = "Timeout of foreground commands that request none (default: 120000).")
	Long defaultTimeoutMillis;

	@Option(names = "--max-timeout", paramLabel = "MILLIS",
			description = "Largest timeout a foreground command may request (default: 600000).")
	Long maxTimeoutMillis;

	@Option(names = "--kill-grace", paramLabel = "MILLIS",
			description = "Pause after killing a background command before its entry is dropped (default: 100).")
	Long killGraceMillis;

	@Option(names = "--rg", paramLabel = "PATH", description = "ripgrep executable used by the grep tool (default: rg).")
	String ripgrepBinary;

	@Override
	public Integer call() throws Exception {
		ToolsConfig config = toConfig();
		ObjectMapper objectMapper = new ObjectMapper();
		CountDownLatch stopped = new CountDownLatch(1);

		ToolContext context = new ToolContext(config);
		InputStream input = new EndOfInputSignal(System.in, stopped);
		AgentToolsServer server = new AgentToolsServer(context,
				new StdioServerTransportProvider(objectMapper, input, System.out), objectMapper);

		Runtime.getRuntime().addShutdownHook(new Thread(() -> {
			shutdown(server, context);
			stopped.countDown();
		}, "agent-tools-shutdown"));

		logger.info("Starting {} with {}", AgentToolsServer.SERVER_NAME, config);
		server.start();
		stopped.await();
		shutdown(server, context);
		return 0;
	}

	/**
	 * Builds the tool configuration from the parsed options.
	 * @return the configuration
	 * @throws CommandLine.ParameterException if an option value is invalid
	 */
	ToolsConfig toConfig() {
		if (workingDirectory != null && !Files.isDirectory(workingDirectory)) {
			throw new CommandLine.ParameterException(spec.commandLine(),
					"--workdir is not a directory: " + workingDirectory);
		}
		try {
			return ToolsConfig.builder()
				.workingDirectory(workingDirectory)
				.defaultTimeout(toDuration("--default-timeout", defaultTimeoutMillis))
				.maxTimeout(toDuration("--max-timeout", maxTimeoutMillis))
				.killGracePeriod(toDuration("--kill-grace", killGraceMillis))
				.ripgrepBinary(ripgrepBinary)
				.build();
		}
		catch (IllegalArgumentException e) {
			throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
		}
	}

	private Duration toDuration(String option, Long millis) {
		if (millis == null) {
			return null;
		}
		if (millis < 0) {
			throw new CommandLine.ParameterException(spec.commandLine(), option + " cannot be negative: " + millis);
		}
		return Duration.ofMillis(millis);
	}

	private static void shutdown(AgentToolsServer server, ToolContext context) {
		server.close();
		context.close();
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new AgentToolsCommand()).execute(args);
		System.exit(exitCode);
	}

	/**
	 * Counts down a latch when the wrapped stream reaches end of input.
	 */
	static final class EndOfInputSignal extends FilterInputStream {

		private final CountDownLatch latch;

		EndOfInputSignal(InputStream in, CountDownLatch latch) {
			super(in);
			this.latch = latch;
		}

		@Override
		public int read() throws IOException {
			return signalOnEnd(super.read());
		}

		@Override
		public int read(byte[] b, int off, int len) throws IOException {
			return signalOnEnd(super.read(b, off, len));
		}

		private int signalOnEnd(int result) {
			if (result < 0) {
				logger.debug("Standard input closed");
				latch.countDown();
			}
			return result;
		}

	}

}
