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
import me.golemcore.gateway.domain.system.toolloop.ToolExecutionOutcome;

import java.util.List;

@Data
@Builder
public class TurnResult {

    private String sessionId;
    private Message message;
    private LlmUsage usage;
    private List<ToolExecutionOutcome> toolResults;
    private boolean requiresToolResults;
    private List<Message.ToolCall> toolCalls;
    private int iterations;
    private boolean iterationLimitReached;
}
