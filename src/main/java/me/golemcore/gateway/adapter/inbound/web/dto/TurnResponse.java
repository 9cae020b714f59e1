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

package me.golemcore.gateway.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import me.golemcore.gateway.domain.model.LlmUsage;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.TurnResult;

import java.util.List;

/**
 * Reply of the message and tool-results endpoints.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TurnResponse {

    private String sessionId;
    private Message message;
    private LlmUsage usage;

    @JsonProperty("tool_results")
    private List<ToolResultsRequest.ToolResultDto> toolResults;

    @JsonProperty("requires_tool_results")
    private Boolean requiresToolResults;

    @JsonProperty("tool_calls")
    private List<Message.ToolCall> toolCalls;

    public static TurnResponse from(TurnResult result) {
        List<ToolResultsRequest.ToolResultDto> executed = result.getToolResults() == null
                || result.getToolResults().isEmpty()
                        ? null
                        : result.getToolResults().stream()
                                .map(outcome -> new ToolResultsRequest.ToolResultDto(outcome.toolCallId(),
                                        outcome.toolName(), outcome.content(), outcome.isError()))
                                .toList();
        return TurnResponse.builder()
                .sessionId(result.getSessionId())
                .message(result.getMessage())
                .usage(result.getUsage())
                .toolResults(executed)
                .requiresToolResults(result.isRequiresToolResults() ? Boolean.TRUE : null)
                .toolCalls(result.isRequiresToolResults() ? result.getToolCalls() : null)
                .build();
    }
}
