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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A conversation of one user inside one project.
 *
 * <p>
 * The JSON form holds the counters and lifecycle fields only. Messages live in
 * a separate append-only log and are attached to the in-memory instance by the
 * store.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatSession {

    private String id;

    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("user_id")
    private String userId;

    private String title;

    @Builder.Default
    private SessionStatus status = SessionStatus.ACTIVE;

    @JsonProperty("model_preference")
    private ModelPreference modelPreference;

    @JsonProperty("message_count")
    private int messageCount;

    @JsonProperty("tool_call_count")
    private int toolCallCount;

    @JsonProperty("total_tokens")
    @Builder.Default
    private LlmUsage totalTokens = LlmUsage.empty();

    @JsonProperty("total_cost_usd")
    private double totalCostUsd;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    @JsonIgnore
    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @JsonIgnore
    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public boolean belongsTo(String user) {
        return userId != null && userId.equals(user);
    }
}
