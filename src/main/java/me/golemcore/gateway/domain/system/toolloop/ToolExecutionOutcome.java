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

import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.ToolResult;

/**
 * Result of one tool call as persisted into the conversation. Synthetic
 * outcomes close a call that was never run (loop ceiling, cancellation).
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult result, ToolSource.Kind source,
        boolean synthetic) {

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, String reason) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), ToolResult.failure(reason),
                ToolSource.Kind.UNKNOWN, true);
    }

    public String content() {
        return result.getContent() != null ? result.getContent() : "";
    }

    public boolean isError() {
        return result.isError();
    }
}
