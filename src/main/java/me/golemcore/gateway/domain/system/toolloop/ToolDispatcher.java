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

package me.golemcore.gateway.domain.system.toolloop;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.component.ToolComponent;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.port.outbound.ToolExecutionPeerPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Resolves tool names to a {@link ToolSource} and runs them.
 *
 * <p>
 * Resolution order: local tool, then the tool-execution peer, then unknown.
 * Execution never throws: failures of a local tool, failures reported or
 * raised by the peer, and unknown names all become error results the backend
 * gets to see.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolDispatcher {

    private static final String LOG_PREFIX = "[AgentLoop]";

    private final LocalToolRegistry localTools;
    private final ToolExecutionPeerPort peer;

    public ToolSource resolve(String toolName) {
        Optional<ToolComponent> local = localTools.find(toolName);
        if (local.isPresent()) {
            return ToolSource.local(local.get());
        }
        if (toolName != null && peer.hasTool(toolName)) {
            return ToolSource.peer(toolName);
        }
        return ToolSource.unknown(toolName);
    }

    public ToolExecutionOutcome execute(Message.ToolCall toolCall) {
        return execute(toolCall, resolve(toolCall.getName()));
    }

    public ToolExecutionOutcome execute(Message.ToolCall toolCall, ToolSource source) {
        Map<String, Object> input = toolCall.getInput() != null ? toolCall.getInput() : Map.of();
        long started = System.currentTimeMillis();
        ToolResult result = switch (source.kind()) {
        case LOCAL -> runLocal(source.local(), toolCall.getName(), input);
        case PEER -> runPeer(toolCall.getName(), input);
        case UNKNOWN -> unknownTool(toolCall.getName());
        };
        log.info("{} Tool {} ({}) finished in {}ms, error={}", LOG_PREFIX, toolCall.getName(), source.kind(),
                System.currentTimeMillis() - started, result.isError());
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, source.kind(), false);
    }

    /**
     * Definitions advertised to the backend: local tools first, then peer tools
     * whose names are not shadowed by a local one.
     */
    public List<ToolDefinition> availableDefinitions() {
        List<ToolDefinition> definitions = new ArrayList<>(localTools.definitions());
        Set<String> seen = new LinkedHashSet<>(localTools.names());
        if (peer.isConnected()) {
            for (ToolDefinition definition : peer.listTools()) {
                if (seen.add(definition.getName())) {
                    definitions.add(definition);
                }
            }
        }
        return definitions;
    }

    public List<String> availableToolNames() {
        return availableDefinitions().stream().map(ToolDefinition::getName).toList();
    }

    public boolean hasPeerTools() {
        return peer.isConnected() && !peer.listTools().isEmpty();
    }

    private ToolResult runLocal(ToolComponent tool, String name, Map<String, Object> input) {
        try {
            ToolResult result = tool.execute(input).join();
            return result != null ? result : ToolResult.success("");
        } catch (RuntimeException e) {
            Throwable cause = unwrap(e);
            log.warn("{} Local tool {} failed: {}", LOG_PREFIX, name, cause.getMessage());
            return ToolResult.failure("Error executing " + name + ": " + cause.getMessage());
        }
    }

    private ToolResult runPeer(String name, Map<String, Object> input) {
        try {
            ToolResult result = peer.callTool(name, input).join();
            if (result == null) {
                return ToolResult.failure("MCP tool error: no result from " + name);
            }
            return result;
        } catch (RuntimeException e) {
            Throwable cause = unwrap(e);
            log.warn("{} Peer tool {} failed: {}", LOG_PREFIX, name, cause.getMessage());
            return ToolResult.failure("MCP tool error: " + cause.getMessage());
        }
    }

    private ToolResult unknownTool(String name) {
        List<String> available = availableToolNames();
        log.warn("{} Unknown tool requested: {}", LOG_PREFIX, name);
        return ToolResult.failure("Unknown tool: " + name + ". Available tools: "
                + (available.isEmpty() ? "none" : String.join(", ", available)));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
