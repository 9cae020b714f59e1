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

import java.util.ArrayList;
import java.util.List;

/**
 * Provider-neutral completion request. Messages may include one system message,
 * assistant messages with tool calls and tool results; each adapter maps them
 * into its vendor shape.
 */
@Data
@Builder(toBuilder = true)
public class LlmRequest {

    private String provider;
    private String model;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private List<ToolDefinition> tools;

    @Builder.Default
    private int maxTokens = 4096;

    @Builder.Default
    private double temperature = 0.7;

    private String userId;
    private String projectId;
    private String sessionId;

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }
}
