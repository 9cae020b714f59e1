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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.LlmResponse;
import me.golemcore.gateway.domain.model.LlmUsage;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.service.CompletionGateway;
import me.golemcore.gateway.port.outbound.ConversationPort;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the backend -> tools -> backend cycle of a single user turn.
 *
 * <p>
 * Every assistant response and every tool result is persisted before the next
 * step, and each round's request is rebuilt from the session, so round
 * {@code n + 1} always sees all results of round {@code n}. Tool calls of one
 * round run sequentially in the order the backend listed them.
 *
 * <p>
 * Reaching the iteration ceiling ends the turn with the last response; calls
 * it left unanswered receive error results so the session stays consistent.
 * This is logged, never thrown.
 */
@Slf4j
public class AgenticLoopController {

    private static final String LOG_PREFIX = "[AgentLoop]";

    private final CompletionGateway gateway;
    private final ConversationPort conversations;
    private final ToolDispatcher dispatcher;
    private final int defaultMaxIterations;

    public AgenticLoopController(CompletionGateway gateway, ConversationPort conversations,
            ToolDispatcher dispatcher, int defaultMaxIterations) {
        this.gateway = gateway;
        this.conversations = conversations;
        this.dispatcher = dispatcher;
        this.defaultMaxIterations = defaultMaxIterations;
    }

    public AgenticLoopResult run(AgenticLoopRequest request) {
        String sessionId = request.getSessionId();
        ToolLoopObserver observer = request.getObserver();
        int maxIterations = Math.max(0,
                request.getMaxIterations() != null ? request.getMaxIterations() : defaultMaxIterations);

        List<ToolExecutionOutcome> executed = new ArrayList<>();
        int inputTokens = 0;
        int outputTokens = 0;
        int iteration = 0;

        LlmResponse response = gateway.complete(request.getRequests().get());
        Message persisted = conversations.addAssistantMessage(sessionId, response);
        observer.onAssistantResponse(response, persisted);
        if (response.getUsage() != null) {
            inputTokens += response.getUsage().getInputTokens();
            outputTokens += response.getUsage().getOutputTokens();
        }

        while (response.requestsTools()) {
            if (iteration >= maxIterations) {
                log.warn("{} Session {} reached the iteration limit of {}, ending turn", LOG_PREFIX, sessionId,
                        maxIterations);
                closeUnanswered(sessionId, response, "Tool not executed: iteration limit of "
                        + maxIterations + " reached");
                return result(response, persisted, iteration, executed, List.of(), inputTokens, outputTokens,
                        true, false);
            }
            if (request.getCancelled().getAsBoolean()) {
                log.info("{} Session {} cancelled after {} rounds", LOG_PREFIX, sessionId, iteration);
                closeUnanswered(sessionId, response, "Tool not executed: request cancelled");
                return result(response, persisted, iteration, executed, List.of(), inputTokens, outputTokens,
                        false, true);
            }

            List<Message.ToolCall> deferred = new ArrayList<>();
            for (Message.ToolCall toolCall : response.getToolCalls()) {
                ToolSource source = dispatcher.resolve(toolCall.getName());
                if (!source.isResolved() && toolCall.getName() != null
                        && request.getClientToolNames().contains(toolCall.getName())) {
                    deferred.add(toolCall);
                    continue;
                }
                observer.onToolStarted(toolCall);
                ToolExecutionOutcome outcome = dispatcher.execute(toolCall, source);
                conversations.addToolResultMessage(sessionId, outcome.toolCallId(), outcome.toolName(),
                        outcome.content(), outcome.isError());
                executed.add(outcome);
                observer.onToolFinished(toolCall, outcome);
            }
            if (!deferred.isEmpty()) {
                log.info("{} Session {} waits for {} client tool result(s)", LOG_PREFIX, sessionId,
                        deferred.size());
                return result(response, persisted, iteration, executed, deferred, inputTokens, outputTokens,
                        false, false);
            }

            iteration++;
            log.debug("{} Session {} round {} done, calling backend again", LOG_PREFIX, sessionId, iteration);
            response = gateway.complete(request.getRequests().get());
            persisted = conversations.addAssistantMessage(sessionId, response);
            observer.onAssistantResponse(response, persisted);
            if (response.getUsage() != null) {
                inputTokens += response.getUsage().getInputTokens();
                outputTokens += response.getUsage().getOutputTokens();
            }
        }

        log.info("{} Session {} finished after {} rounds, {} tool(s) executed", LOG_PREFIX, sessionId, iteration,
                executed.size());
        return result(response, persisted, iteration, executed, List.of(), inputTokens, outputTokens, false,
                false);
    }

    private void closeUnanswered(String sessionId, LlmResponse response, String reason) {
        for (Message.ToolCall toolCall : response.getToolCalls()) {
            ToolExecutionOutcome outcome = ToolExecutionOutcome.synthetic(toolCall, reason);
            conversations.addToolResultMessage(sessionId, outcome.toolCallId(), outcome.toolName(),
                    outcome.content(), true);
        }
    }

    private static AgenticLoopResult result(LlmResponse response, Message persisted, int iterations,
            List<ToolExecutionOutcome> executed, List<Message.ToolCall> pending, int inputTokens,
            int outputTokens, boolean limitReached, boolean cancelled) {
        return new AgenticLoopResult(response, persisted, iterations, List.copyOf(executed), List.copyOf(pending),
                LlmUsage.of(inputTokens, outputTokens), limitReached, cancelled);
    }
}
