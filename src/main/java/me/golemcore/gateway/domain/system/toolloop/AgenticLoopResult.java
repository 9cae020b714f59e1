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

import me.golemcore.gateway.domain.model.LlmResponse;
import me.golemcore.gateway.domain.model.LlmUsage;
import me.golemcore.gateway.domain.model.Message;

import java.util.List;

/**
 * Outcome of one user turn through the loop.
 *
 * @param finalResponse
 *            the last backend response
 * @param finalMessage
 *            the assistant message persisted for it
 * @param iterations
 *            tool rounds executed
 * @param executedTools
 *            outcomes of every tool that ran, in execution order
 * @param pendingToolCalls
 *            calls deferred to the client, empty unless deferral was requested
 * @param usage
 *            token usage summed over all backend calls of the turn
 */
public record AgenticLoopResult(LlmResponse finalResponse, Message finalMessage, int iterations,
        List<ToolExecutionOutcome> executedTools, List<Message.ToolCall> pendingToolCalls, LlmUsage usage,
        boolean iterationLimitReached, boolean cancelled) {

    public boolean requiresToolResults() {
        return !pendingToolCalls.isEmpty();
    }
}
