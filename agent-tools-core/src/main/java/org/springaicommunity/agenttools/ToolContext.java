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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the shared state of one tool server: a {@link ProcessRegistry}, a
 * {@link FileMutationGuard} and the tools built on them.
 *
 * <p>
 * Tests and embedders create their own contexts; {@link #defaultContext()} provides one
 * lazily created instance per JVM for convenience.
 * </p>
 *
 * <pre>{@code
 * try (ToolContext context = new ToolContext(ToolsConfig.builder()
 *         .workingDirectory(Path.of("/work"))
 *         .build())) {
 *     context.commands().execute(ExecSpec.of("ls"));
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public class ToolContext implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ToolContext.class);

	private final ToolsConfig config;

	private final ProcessRegistry registry;

	private final FileMutationGuard guard;

	private final CommandService commands;

	private final FileTools files;

	private final GlobSearch glob;

	private final GrepSearch grep;

	public ToolContext(ToolsConfig config) {
		this.config = Objects.requireNonNull(config, "config cannot be null");
		this.registry = new ProcessRegistry(config);
		this.guard = new FileMutationGuard();
		this.commands = new CommandService(config, registry);
		this.files = new LocalFileTools(guard, config);
		this.glob = new GlobSearch(config);
		this.grep = new GrepSearch(config);
		logger.warn("ToolContext created for {} - NO ISOLATION PROVIDED. Commands execute directly on host system.",
				config.workingDirectory());
	}

	/**
	 * Gets the JVM-wide context, created with {@link ToolsConfig#defaults()} on first use.
	 * @return the default context
	 */
	public static ToolContext defaultContext() {
		return DefaultHolder.INSTANCE;
	}

	public ToolsConfig config() {
		return config;
	}

	public ProcessRegistry registry() {
		return registry;
	}

	public FileMutationGuard guard() {
		return guard;
	}

	public CommandService commands() {
		return commands;
	}

	public FileTools files() {
		return files;
	}

	public GlobSearch glob() {
		return glob;
	}

	public GrepSearch grep() {
		return grep;
	}

	/**
	 * Kills every running background execution.
	 */
	@Override
	public void close() {
		registry.close();
	}

	@Override
	public String toString() {
		return String.format("ToolContext{config=%s, registry=%s}", config, registry);
	}

	private static final class DefaultHolder {

		private static final ToolContext INSTANCE = new ToolContext(ToolsConfig.defaults());

	}

}
