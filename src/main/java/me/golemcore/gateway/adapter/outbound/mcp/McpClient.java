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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.infrastructure.config.GatewayProperties.McpProperties;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client for one MCP server running as a child process.
 *
 * <p>
 * Requests are written as single lines to the process stdin; a reader thread
 * matches response lines on stdout to pending requests by id. Stderr is drained
 * to the DEBUG log. MCP protocol version: 2024-11-05.
 *
 * <p>
 * Not a Spring bean; owned by {@link McpToolPeer}.
 */
@Slf4j
public class McpClient implements Closeable {

    private static final String JSONRPC_VERSION = "2.0";
    static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final String name;
    private final McpProperties config;
    private final ObjectMapper objectMapper;

    private Process process;
    private BufferedWriter writer;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

    private volatile boolean running;
    private volatile List<ToolDefinition> cachedTools = List.of();

    public McpClient(String name, McpProperties config, ObjectMapper objectMapper) {
        this.name = name;
        this.config = config;
        this.objectMapper = objectMapper;
    }

    /**
     * Starts the server, performs the initialize handshake and fetches the tool
     * list. The process is cleaned up when any step fails.
     */
    public List<ToolDefinition> start() throws IOException, InterruptedException, ExecutionException,
            TimeoutException {
        List<String> command = new ArrayList<>();
        command.add(config.getCommand());
        command.addAll(config.getArgs());
        log.info("[MCP:{}] Starting server: {}", name, String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectErrorStream(false);
        builder.environment().putAll(config.getEnv());
        process = builder.start();
        running = true;
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        Thread reader = new Thread(this::readLoop, "mcp-reader-" + name);
        reader.setDaemon(true);
        reader.start();
        Thread stderr = new Thread(this::stderrDrain, "mcp-stderr-" + name);
        stderr.setDaemon(true);
        stderr.start();

        try {
            int timeoutSeconds = config.getStartupTimeoutSeconds();
            JsonNode initResult = sendRequest("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of("name", "golemcore-gateway", "version", "1.0.0")))
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            log.info("[MCP:{}] Initialized: {}", name, initResult);

            sendNotification("notifications/initialized", Map.of());

            JsonNode toolsResult = sendRequest("tools/list", Map.of()).get(timeoutSeconds, TimeUnit.SECONDS);
            cachedTools = parseToolDefinitions(toolsResult);
            log.info("[MCP:{}] Available tools: {}", name, cachedTools.stream().map(ToolDefinition::getName).toList());
            return cachedTools;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[MCP:{}] Initialization interrupted, cleaning up", name);
            close();
            throw e;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", name, e.getMessage());
            close();
            throw e;
        }
    }

    /**
     * Calls a tool. Errors reported by the server arrive as a failed
     * {@link ToolResult}; transport errors complete the future exceptionally.
     */
    public CompletableFuture<ToolResult> callTool(String toolName, Map<String, Object> arguments) {
        return sendRequest("tools/call", Map.of(
                "name", toolName,
                "arguments", arguments != null ? arguments : Map.of()))
                .thenApply(result -> parseToolCallResult(toolName, result));
    }

    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pendingRequests.put(id, future);
        future.orTimeout(config.getRequestTimeoutSeconds(), TimeUnit.SECONDS)
                .whenComplete((result, ex) -> pendingRequests.remove(id));

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        try {
            writeLine(objectMapper.writeValueAsString(request));
        } catch (IOException e) {
            pendingRequests.remove(id);
            future.completeExceptionally(e);
        }
        return future;
    }

    void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }
        try {
            writeLine(objectMapper.writeValueAsString(notification));
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to send notification {}: {}", name, method, e.getMessage());
        }
    }

    private void writeLine(String json) throws IOException {
        if (writer == null) {
            throw new IOException("MCP server " + name + " is not running");
        }
        log.debug("[MCP:{}] -> {}", name, json);
        synchronized (writer) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    private void readLoop() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                handleLine(line.trim());
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP:{}] Reader thread error: {}", name, e.getMessage());
            }
        } finally {
            failPending("MCP process closed");
        }
    }

    void handleLine(String line) {
        if (line.isEmpty()) {
            return;
        }
        log.debug("[MCP:{}] <- {}", name, line);
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Ignoring unparseable line: {}", name, e.getMessage());
            return;
        }

        JsonNode idNode = message.get("id");
        if (idNode == null || !idNode.canConvertToInt()) {
            log.debug("[MCP:{}] Server notification: {}", name, message.path("method").asText("unknown"));
            return;
        }
        CompletableFuture<JsonNode> pending = pendingRequests.remove(idNode.asInt());
        if (pending == null) {
            log.warn("[MCP:{}] Response for unknown id {}", name, idNode.asInt());
            return;
        }
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            pending.completeExceptionally(new McpException(error.path("code").asInt(-1),
                    error.path("message").asText("Unknown MCP error")));
        } else {
            pending.complete(message.get("result"));
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", name, line);
            }
        } catch (IOException e) {
            if (running) {
                log.debug("[MCP:{}] Stderr drain ended: {}", name, e.getMessage());
            }
        }
    }

    List<ToolDefinition> parseToolDefinitions(JsonNode result) {
        if (result == null || !result.path("tools").isArray()) {
            return List.of();
        }
        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : result.get("tools")) {
            String toolName = toolNode.path("name").asText(null);
            if (toolName == null) {
                continue;
            }
            Map<String, Object> inputSchema = ToolDefinition.emptySchema();
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("[MCP:{}] Bad inputSchema for tool '{}': {}", name, toolName, e.getMessage());
                }
            }
            tools.add(ToolDefinition.builder()
                    .name(toolName)
                    .description(toolNode.path("description").asText(""))
                    .inputSchema(inputSchema)
                    .build());
        }
        return List.copyOf(tools);
    }

    ToolResult parseToolCallResult(String toolName, JsonNode result) {
        if (result == null || result.isNull()) {
            return ToolResult.failure("No result from MCP tool: " + toolName);
        }
        boolean isError = result.path("isError").asBoolean(false);

        StringBuilder output = new StringBuilder();
        for (JsonNode item : result.path("content")) {
            if ("text".equals(item.path("type").asText("text")) && item.has("text")) {
                if (!output.isEmpty()) {
                    output.append('\n');
                }
                output.append(item.get("text").asText());
            }
        }

        if (isError) {
            return ToolResult.failure(output.isEmpty() ? "MCP tool error" : output.toString());
        }
        return ToolResult.success(output.isEmpty() ? "(no output)" : output.toString());
    }

    public List<ToolDefinition> getCachedTools() {
        return cachedTools;
    }

    public boolean isRunning() {
        return running && process != null && process.isAlive();
    }

    public String getName() {
        return name;
    }

    private void failPending(String reason) {
        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(new IOException(reason));
        }
        pendingRequests.clear();
    }

    @Override
    public void close() {
        log.info("[MCP:{}] Closing client", name);
        running = false;
        failPending("MCP client closing");

        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[MCP:{}] Error closing writer: {}", name, e.getMessage());
            }
        }
        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    /**
     * JSON-RPC error returned by the server.
     */
    public static class McpException extends Exception {
        private static final long serialVersionUID = 1L;
        private final int code;

        public McpException(int code, String message) {
            super(message);
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }
}
