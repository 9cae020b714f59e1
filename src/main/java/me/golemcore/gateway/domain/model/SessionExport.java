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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Downloadable copy of a session with its full message log.
 */
@Data
@Builder
public class SessionExport {

    private String id;
    private String title;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    private ModelPreference model;
    private Statistics statistics;
    private List<Message> messages;

    @Data
    @Builder
    public static class Statistics {
        @JsonProperty("message_count")
        private int messageCount;
        @JsonProperty("tool_call_count")
        private int toolCallCount;
        @JsonProperty("total_tokens")
        private LlmUsage totalTokens;
        @JsonProperty("total_cost_usd")
        private double totalCostUsd;
    }
}
