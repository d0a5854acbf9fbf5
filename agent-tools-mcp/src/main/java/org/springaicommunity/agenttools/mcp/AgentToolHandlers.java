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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.agenttools.ExecSpec;
import org.springaicommunity.agenttools.ExecutionInfo;
import org.springaicommunity.agenttools.GrepRequest;
import org.springaicommunity.agenttools.OutputSnapshot;
import org.springaicommunity.agenttools.TerminationResult;
import org.springaicommunity.agenttools.ToolContext;
import org.springaicommunity.agenttools.ToolException;

/**
 * Translates MCP tool calls into operations of a {@link ToolContext}.
 *
 * <p>
 * Every call yields a {@link McpSchema.CallToolResult} with a single text content. A
 * {@link ToolException} becomes an error result carrying its message; nothing is thrown
 * back to the transport.
 * </p>
 *
 * @since 0.1.0
 */
public class AgentToolHandlers {

	private static final Logger logger = LoggerFactory.getLogger(AgentToolHandlers.class);

	static final String NO_SHELLS_RUNNING = "No background shells are currently running.";

	private final ToolContext context;

	private final ObjectMapper objectMapper;

	private final Map<String, ToolHandler> handlers = new LinkedHashMap<>();

	public AgentToolHandlers(ToolContext context, ObjectMapper objectMapper) {
		this.context = Objects.requireNonNull(context, "context cannot be null");
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
		handlers.put("bash", this::bash);
		handlers.put("bash_output", this::bashOutput);
		handlers.put("list_shells", args -> listShells());
		handlers.put("kill_shell", this::killShell);
		handlers.put("read", this::read);
		handlers.put("write", this::write);
		handlers.put("edit", this::edit);
		handlers.put("glob", this::glob);
		handlers.put("grep", this::grep);
	}

	public Set<String> toolNames() {
		return Collections.unmodifiableSet(handlers.keySet());
	}

	/**
	 * Runs one tool call.
	 * @param toolName the tool name
	 * @param arguments the decoded JSON arguments, may be null
	 * @return the text result, flagged as an error when the call failed
	 */
	public McpSchema.CallToolResult call(String toolName, Map<String, Object> arguments) {
		ToolHandler handler = handlers.get(toolName);
		if (handler == null) {
			return error("Unknown tool: " + toolName);
		}
		logger.debug("Calling tool {} with arguments {}", toolName,
				arguments != null ? arguments.keySet() : Collections.emptySet());
		try {
			return success(handler.handle(new ToolArguments(arguments)));
		}
		catch (ToolException e) {
			logger.debug("Tool {} failed with {}: {}", toolName, e.kind(), e.getMessage());
			return error(e.getMessage());
		}
		catch (RuntimeException e) {
			logger.warn("Tool {} failed unexpectedly", toolName, e);
			return error("Tool " + toolName + " failed: " + e.getMessage());
		}
	}

	String bash(ToolArguments args) {
		String command = args.string("command");
		Long timeoutMillis = args.number("timeout");
		ExecSpec spec = ExecSpec.builder()
			.command(command != null ? command : "")
			.description(args.string("description"))
			.timeout(timeoutMillis != null ? Duration.ofMillis(timeoutMillis) : null)
			.runInBackground(args.bool("run_in_background"))
			.build();
		return context.commands().execute(spec);
	}

	String bashOutput(ToolArguments args) {
		OutputSnapshot snapshot = context.registry().pollOutput(args.string("shell_id"), args.string("filter"));
		return toJson(BashOutputResponse.from(snapshot));
	}

	String listShells() {
		List<ExecutionInfo> executions = context.registry().list();
		if (executions.isEmpty()) {
			return NO_SHELLS_RUNNING;
		}
		return toJson(ShellListResponse.from(executions));
	}

	String killShell(ToolArguments args) {
		TerminationResult result = context.registry().terminate(args.string("shell_id"));
		if (result.terminated()) {
			return result.message();
		}
		ToolException.ErrorKind kind = switch (result.outcome()) {
			case NOT_FOUND -> ToolException.ErrorKind.NOT_FOUND;
			case ALREADY_COMPLETED -> ToolException.ErrorKind.STATE_CONFLICT;
			default -> ToolException.ErrorKind.OS_FAILURE;
		};
		throw new ToolException(kind, result.message(), result.failure());
	}

	String read(ToolArguments args) {
		return context.files()
			.read(args.requiredString("file_path"), args.optionalInteger("offset"), args.optionalInteger("limit"));
	}

	String write(ToolArguments args) {
		return context.files().write(args.requiredString("file_path"), args.requiredString("content"));
	}

	String edit(ToolArguments args) {
		return context.files()
			.edit(args.requiredString("file_path"), args.requiredString("old_string"),
					args.requiredString("new_string"), args.bool("replace_all"));
	}

	String glob(ToolArguments args) {
		return context.glob().search(args.requiredString("pattern"), args.string("path"));
	}

	String grep(ToolArguments args) {
		GrepRequest request = GrepRequest.builder()
			.pattern(args.requiredString("pattern"))
			.path(args.string("path"))
			.glob(args.string("glob"))
			.type(args.string("type"))
			.outputMode(args.string("output_mode"))
			.linesAfter(args.integer("-A", 0))
			.linesBefore(args.integer("-B", 0))
			.linesAround(args.integer("-C", 0))
			.lineNumbers(args.bool("-n"))
			.ignoreCase(args.bool("-i"))
			.multiline(args.bool("multiline"))
			.headLimit(args.integer("head_limit", 0))
			.build();
		return context.grep().search(request);
	}

	private String toJson(Object value) {
		try {
			return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
		}
		catch (JsonProcessingException e) {
			throw new ToolException(ToolException.ErrorKind.OS_FAILURE, "Failed to encode result: " + e.getMessage(),
					e);
		}
	}

	private static McpSchema.CallToolResult success(String text) {
		return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(text)), false);
	}

	private static McpSchema.CallToolResult error(String text) {
		return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(text)), true);
	}

	@FunctionalInterface
	private interface ToolHandler {

		String handle(ToolArguments args);

	}

}
