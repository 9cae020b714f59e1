/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.gateway.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.ToolExecutionPeerPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Tool-execution peer backed by one MCP server.
 *
 * <p>
 * The server is started once at application startup when
 * {@code gateway.mcp.enabled} is on. A server that fails to start leaves the
 * peer disconnected; the gateway keeps serving with local tools only.
 */
@Component
@Slf4j
public class McpToolPeer implements ToolExecutionPeerPort {

    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;

    private volatile McpClient client;

    public McpToolPeer(GatewayProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void connect() {
        GatewayProperties.McpProperties mcp = properties.getMcp();
        if (!mcp.isEnabled()) {
            log.info("[MCP:{}] Disabled", mcp.getName());
            return;
        }
        McpClient candidate = createClient(mcp);
        try {
            candidate.start();
            client = candidate;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[MCP:{}] Startup interrupted, peer stays disconnected", mcp.getName());
        } catch (IOException | ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("[MCP:{}] Failed to start, peer stays disconnected: {}", mcp.getName(), e.getMessage());
        }
    }

    McpClient createClient(GatewayProperties.McpProperties mcp) {
        return new McpClient(mcp.getName(), mcp, objectMapper);
    }

    @Override
    public boolean isConnected() {
        McpClient current = client;
        return current != null && current.isRunning();
    }

    @Override
    public List<ToolDefinition> listTools() {
        return isConnected() ? client.getCachedTools() : List.of();
    }

    @Override
    public CompletableFuture<ToolResult> callTool(String name, Map<String, Object> input) {
        McpClient current = client;
        if (current == null || !current.isRunning()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("MCP server " + properties.getMcp().getName() + " is not connected"));
        }
        return current.callTool(name, input);
    }

    @PreDestroy
    public void shutdown() {
        McpClient current = client;
        client = null;
        if (current != null) {
            current.close();
        }
    }
}
