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

package me.golemcore.gateway.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Normalized backend response.
 */
@Data
@Builder(toBuilder = true)
public class LlmResponse {

    private String id;

    @Builder.Default
    private String content = "";

    @Builder.Default
    private StopReason stopReason = StopReason.END_TURN;

    private List<Message.ToolCall> toolCalls;
    private LlmUsage usage;
    private String model;
    private String provider;
    private Long latencyMs;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * True when the backend asked for at least one tool to be run before it can
     * continue.
     */
    public boolean requestsTools() {
        return stopReason == StopReason.TOOL_USE && hasToolCalls();
    }
}
