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

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.agenttools.ToolContext;

/**
 * MCP server exposing the tools of one {@link ToolContext}.
 *
 * <p>
 * The server is bound to a transport provider, typically the stdio provider, when
 * {@link #start()} is called. Closing the server does not close the context; the owner of
 * the context decides when running background commands are killed.
 * </p>
 *
 * @since 0.1.0
 */
public class AgentToolsServer implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(AgentToolsServer.class);

	public static final String SERVER_NAME = "agent-tools";

	public static final String SERVER_VERSION = "0.1.0";

	private final McpServerTransportProvider transportProvider;

	private final List<McpServerFeatures.SyncToolSpecification> toolSpecifications;

	private McpSyncServer server;

	public AgentToolsServer(ToolContext context, McpServerTransportProvider transportProvider,
			ObjectMapper objectMapper) {
		Objects.requireNonNull(context, "context cannot be null");
		this.transportProvider = Objects.requireNonNull(transportProvider, "transportProvider cannot be null");
		AgentToolHandlers handlers = new AgentToolHandlers(context, objectMapper);
		this.toolSpecifications = new ToolDefinitions(objectMapper).loadAll()
			.stream()
			.map(tool -> new McpServerFeatures.SyncToolSpecification(tool,
					(exchange, arguments) -> handlers.call(tool.name(), arguments)))
			.toList();
	}

	/**
	 * Gets the tool registrations handed to the MCP server.
	 * @return one specification per tool
	 */
	public List<McpServerFeatures.SyncToolSpecification> toolSpecifications() {
		return toolSpecifications;
	}

	/**
	 * Builds the MCP server on the transport provider. The provider starts accepting
	 * messages as soon as the server is built.
	 * @throws IllegalStateException if the server was already started
	 */
	public synchronized void start() {
		if (server != null) {
			throw new IllegalStateException("Server already started");
		}
		server = McpServer.sync(transportProvider)
			.serverInfo(SERVER_NAME, SERVER_VERSION)
			.capabilities(McpSchema.ServerCapabilities.builder().tools(false).build())
			.tools(toolSpecifications)
			.build();
		logger.info("MCP server {} {} started with {} tools", SERVER_NAME, SERVER_VERSION, toolSpecifications.size());
	}

	public synchronized boolean isRunning() {
		return server != null;
	}

	@Override
	public synchronized void close() {
		if (server == null) {
			return;
		}
		try {
			server.closeGracefully();
			logger.info("MCP server {} stopped", SERVER_NAME);
		}
		catch (RuntimeException e) {
			logger.warn("Failed to close MCP server gracefully", e);
		}
		finally {
			server = null;
		}
	}

}
