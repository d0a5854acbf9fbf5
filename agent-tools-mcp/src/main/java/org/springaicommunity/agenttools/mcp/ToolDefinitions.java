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

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Loads the MCP tool definitions shipped under {@code tool-schemas/} on the classpath.
 *
 * <p>
 * Each resource holds the tool name, the description shown to the model and the JSON
 * schema of the tool arguments.
 * </p>
 *
 * @since 0.1.0
 */
public class ToolDefinitions {

	/**
	 * Names of every exposed tool, in registration order.
	 */
	public static final List<String> TOOL_NAMES = List.of("bash", "bash_output", "list_shells", "kill_shell", "read",
			"write", "edit", "glob", "grep");

	private static final String RESOURCE_LOCATION = "tool-schemas/%s.json";

	private final ObjectMapper objectMapper;

	public ToolDefinitions(ObjectMapper objectMapper) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
	}

	/**
	 * Loads one tool definition.
	 * @param name the tool name
	 * @return the MCP tool
	 * @throws IllegalStateException if the resource is missing or malformed
	 */
	public McpSchema.Tool load(String name) {
		String resource = String.format(RESOURCE_LOCATION, name);
		JsonNode definition = readResource(resource);
		String declaredName = definition.path("name").asText();
		if (!name.equals(declaredName)) {
			throw new IllegalStateException(
					"Tool definition " + resource + " declares name '" + declaredName + "', expected '" + name + "'");
		}
		JsonNode inputSchema = definition.get("inputSchema");
		if (inputSchema == null || !inputSchema.isObject()) {
			throw new IllegalStateException("Tool definition " + resource + " has no inputSchema object");
		}
		try {
			return new McpSchema.Tool(name, definition.path("description").asText(),
					objectMapper.writeValueAsString(inputSchema));
		}
		catch (IOException e) {
			throw new IllegalStateException("Cannot serialize input schema of " + name, e);
		}
	}

	public List<McpSchema.Tool> loadAll() {
		List<McpSchema.Tool> tools = new ArrayList<>(TOOL_NAMES.size());
		for (String name : TOOL_NAMES) {
			tools.add(load(name));
		}
		return tools;
	}

	private JsonNode readResource(String resource) {
		try (InputStream in = ToolDefinitions.class.getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				throw new IllegalStateException("Tool definition not found on classpath: " + resource);
			}
			return objectMapper.readTree(in);
		}
		catch (IOException e) {
			throw new IllegalStateException("Cannot read tool definition " + resource, e);
		}
	}

}
