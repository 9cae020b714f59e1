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

package me.golemcore.gateway.port.outbound;

import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * External process that owns a set of callable tools.
 */
public interface ToolExecutionPeerPort {

    boolean isConnected();

    /**
     * Tools the peer currently exposes; empty when disconnected.
     */
    List<ToolDefinition> listTools();

    /**
     * Runs a tool. Peer-side failures are reported through
     * {@link ToolResult#isError()}, transport failures complete the future
     * exceptionally.
     */
    CompletableFuture<ToolResult> callTool(String name, Map<String, Object> input);

    default boolean hasTool(String name) {
        return isConnected() && listTools().stream().anyMatch(tool -> tool.getName().equals(name));
    }
}
