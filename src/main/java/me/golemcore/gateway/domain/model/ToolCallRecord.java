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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * A tool call of a session joined with its result, if one was recorded.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolCallRecord {

    private String id;
    private String name;
    private Map<String, Object> input;

    @JsonProperty("called_at")
    private Instant calledAt;

    @JsonProperty("message_id")
    private String messageId;

    private Outcome result;

    @Data
    @Builder
    public static class Outcome {
        private String result;
        @JsonProperty("is_error")
        private boolean error;
        private Instant timestamp;
    }
}
