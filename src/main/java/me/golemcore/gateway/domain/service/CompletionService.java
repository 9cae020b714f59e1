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

package me.golemcore.gateway.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.MessageValidationException;
import me.golemcore.gateway.domain.exception.SessionNotFoundException;
import me.golemcore.gateway.domain.exception.UsageLimitExceededException;
import me.golemcore.gateway.domain.model.ChatSession;
import me.golemcore.gateway.domain.model.DocumentContext;
import me.golemcore.gateway.domain.model.LimitCheck;
import me.golemcore.gateway.domain.model.LlmChunk;
import me.golemcore.gateway.domain.model.LlmRequest;
import me.golemcore.gateway.domain.model.LlmResponse;
import me.golemcore.gateway.domain.model.LlmUsage;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.MessageHistory;
import me.golemcore.gateway.domain.model.ModelPreference;
import me.golemcore.gateway.domain.model.QuickEditResult;
import me.golemcore.gateway.domain.model.StopReason;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolResultSubmission;
import me.golemcore.gateway.domain.model.TurnEvent;
import me.golemcore.gateway.domain.model.TurnRequest;
import me.golemcore.gateway.domain.model.TurnResult;
import me.golemcore.gateway.domain.system.toolloop.AgenticLoopController;
import me.golemcore.gateway.domain.system.toolloop.AgenticLoopRequest;
import me.golemcore.gateway.domain.system.toolloop.AgenticLoopResult;
import me.golemcore.gateway.domain.system.toolloop.ToolDispatcher;
import me.golemcore.gateway.domain.system.toolloop.ToolExecutionOutcome;
import me.golemcore.gateway.domain.system.toolloop.ToolLoopObserver;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.ConversationPort;
import me.golemcore.gateway.port.outbound.CostTrackingPort;
import me.golemcore.gateway.port.outbound.ToolExecutionPeerPort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Handles user turns: persists the user message, runs the backend (through
 * the agentic loop or as a single stream) and persists what comes back.
 *
 * <p>
 * The provider is resolved before anything is written, so a turn naming an
 * unknown provider leaves the session untouched. Streaming methods report
 * failures in-band as an {@code error} event and then complete.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompletionService {

    private static final String LOG_PREFIX = "[Turn]";
    private static final String DEFAULT_TIER = "free";

    private final CompletionGateway gateway;
    private final ConversationPort conversations;
    private final AgenticLoopController loop;
    private final ToolDispatcher dispatcher;
    private final ToolExecutionPeerPort peer;
    private final PromptComposer prompts;
    private final CostTrackingPort costTracker;
    private final GatewayProperties properties;
    private final Clock clock;

    // ==================== MESSAGE ====================

    public TurnResult sendMessage(TurnRequest request) {
        requireText(request.getMessage(), "message is required");
        enforceLimits(request.getUserId(), request.getTier());

        ChatSession session = conversations.getOrCreateSession(request.getProjectId(), request.getUserId(),
                request.getSessionId());
        LlmRequest target = resolveTarget(session, request.getProvider(), request.getModel());
        boolean firstMessage = session.getMessageCount() == 0;
        requireNoPendingToolCalls(session.getId());

        log.info("{} Message for session {} via {}/{} ({} chars)", LOG_PREFIX, session.getId(),
                target.getProvider(), target.getModel(), request.getMessage().length());
        conversations.addUserMessage(session.getId(), request.getMessage(), request.getContext());
        if (firstMessage) {
            conversations.autoGenerateTitle(session.getId(), request.getMessage());
        }

        AgenticLoopResult result = loop.run(loopRequest(session, target, request.getContext(),
                request.getClientTools(), ToolLoopObserver.NOOP, () -> false));
        return toTurnResult(session.getId(), result);
    }

    /**
     * Persists client-side tool results and, once no call of the session is
     * left unanswered, continues the conversation.
     */
    public TurnResult submitToolResults(ToolResultSubmission submission) {
        if (submission.getResults() == null || submission.getResults().isEmpty()) {
            throw new MessageValidationException("results are required");
        }
        enforceLimits(submission.getUserId(), submission.getTier());

        ChatSession session = conversations.getSession(submission.getSessionId(), submission.getUserId())
                .orElseThrow(() -> new SessionNotFoundException(submission.getSessionId()));
        LlmRequest target = resolveTarget(session, submission.getProvider(), submission.getModel());

        for (ToolResultSubmission.Result result : submission.getResults()) {
            conversations.addToolResultMessage(session.getId(), result.toolCallId(), result.toolName(),
                    result.content() != null ? result.content() : "", result.error());
        }

        List<Message> messages = conversations.getMessages(session.getId());
        List<String> stillPending = MessageHistory.pendingToolCallIds(messages);
        if (!stillPending.isEmpty()) {
            log.info("{} Session {} still waits for {} tool result(s)", LOG_PREFIX, session.getId(),
                    stillPending.size());
            return TurnResult.builder()
                    .sessionId(session.getId())
                    .message(lastAssistant(messages))
                    .usage(LlmUsage.empty())
                    .toolResults(List.of())
                    .requiresToolResults(true)
                    .toolCalls(findToolCalls(messages, stillPending))
                    .build();
        }

        AgenticLoopResult result = loop.run(loopRequest(session, target, submission.getContext(),
                submission.getClientTools(), ToolLoopObserver.NOOP, () -> false));
        return toTurnResult(session.getId(), result);
    }

    // ==================== STREAMING ====================

    /**
     * Single backend pass streamed as {@code token}, {@code tool_use} and
     * {@code done} events. Requested tools are reported, not executed. The
     * assistant message is persisted when the stream ends; a stream that is
     * cancelled or fails persists its partial content flagged as interrupted.
     */
    public Flux<TurnEvent> streamTurn(TurnRequest request) {
        return Flux.defer(() -> {
            StreamState state = new StreamState();
            return Flux.defer(() -> openStream(request, state))
                    .doOnCancel(() -> state.interrupt("cancelled"))
                    .onErrorResume(error -> {
                        log.warn("{} Stream failed: {}", LOG_PREFIX, error.getMessage());
                        state.interrupt(error.getMessage());
                        return Flux.just(TurnEvent.error("Stream failed", error.getMessage()));
                    });
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private Flux<TurnEvent> openStream(TurnRequest request, StreamState state) {
        requireText(request.getMessage(), "message is required");
        enforceLimits(request.getUserId(), request.getTier());

        ChatSession session = conversations.getOrCreateSession(request.getProjectId(), request.getUserId(),
                request.getSessionId());
        LlmRequest target = resolveTarget(session, request.getProvider(), request.getModel());
        boolean firstMessage = session.getMessageCount() == 0;
        requireNoPendingToolCalls(session.getId());

        conversations.addUserMessage(session.getId(), request.getMessage(), request.getContext());
        if (firstMessage) {
            conversations.autoGenerateTitle(session.getId(), request.getMessage());
        }
        state.begin(session.getId(), target.getProvider(), target.getModel(), clock.millis());

        String systemPrompt = prompts.systemPrompt(request.getContext(), peer.listTools());
        LlmRequest streamRequest = prompts.turnRequest(conversations.getMessages(session.getId()), systemPrompt,
                target.getProvider(), target.getModel(), dispatcher.availableDefinitions())
                .toBuilder()
                .userId(request.getUserId())
                .projectId(request.getProjectId())
                .sessionId(session.getId())
                .build();

        return gateway.stream(streamRequest).concatMap(chunk -> Flux.fromIterable(state.accept(chunk)));
    }

    /**
     * Runs the agentic loop and reports its progress as {@code token},
     * {@code tool_start}, {@code tool_end} and a final {@code done} event.
     * Cancelling stops the loop before its next round.
     */
    public Flux<TurnEvent> streamAgentic(TurnRequest request) {
        return Flux.<TurnEvent>create(sink -> {
            AtomicBoolean cancelled = new AtomicBoolean();
            sink.onCancel(() -> cancelled.set(true));
            try {
                runAgentic(request, sink, cancelled);
            } catch (RuntimeException e) {
                log.warn("{} Agentic stream failed: {}", LOG_PREFIX, e.getMessage());
                sink.next(TurnEvent.error("Agentic stream failed", e.getMessage()));
            }
            sink.complete();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private void runAgentic(TurnRequest request, FluxSink<TurnEvent> sink, AtomicBoolean cancelled) {
        requireText(request.getMessage(), "message is required");
        enforceLimits(request.getUserId(), request.getTier());

        ChatSession session = conversations.getOrCreateSession(request.getProjectId(), request.getUserId(),
                request.getSessionId());
        LlmRequest target = resolveTarget(session, request.getProvider(), request.getModel());
        boolean firstMessage = session.getMessageCount() == 0;
        requireNoPendingToolCalls(session.getId());

        conversations.addUserMessage(session.getId(), request.getMessage(), request.getContext());
        if (firstMessage) {
            conversations.autoGenerateTitle(session.getId(), request.getMessage());
        }

        long started = clock.millis();
        ToolLoopObserver observer = new ToolLoopObserver() {
            @Override
            public void onAssistantResponse(LlmResponse response, Message persisted) {
                if (response.getContent() != null && !response.getContent().isEmpty()) {
                    sink.next(TurnEvent.token(response.getContent()));
                }
            }

            @Override
            public void onToolStarted(Message.ToolCall toolCall) {
                sink.next(TurnEvent.toolStart(toolCall));
            }

            @Override
            public void onToolFinished(Message.ToolCall toolCall, ToolExecutionOutcome outcome) {
                sink.next(TurnEvent.toolEnd(outcome.toolCallId(), outcome.toolName(), outcome.content(),
                        outcome.isError()));
            }
        };

        AgenticLoopResult result = loop.run(loopRequest(session, target, request.getContext(), null, observer,
                cancelled::get));

        Map<String, Object> done = new LinkedHashMap<>();
        done.put("tokens_used", result.usage());
        done.put("session_id", session.getId());
        done.put("stop_reason", result.finalResponse().getStopReason().getWireName());
        done.put("iterations", result.iterations());
        done.put("latency_ms", clock.millis() - started);
        sink.next(TurnEvent.done(done));
    }

    // ==================== QUICK EDIT ====================

    public QuickEditResult quickEdit(String projectId, String userId, String instruction, String selectedText,
            String tier) {
        requireText(instruction, "prompt is required");
        enforceLimits(userId, tier);

        long started = clock.millis();
        LlmRequest request = prompts.quickEditRequest(instruction, selectedText).toBuilder()
                .userId(userId)
                .projectId(projectId)
                .build();
        LlmResponse response = gateway.complete(request);
        long latencyMs = clock.millis() - started;
        log.info("{} Quick edit for project {} done in {}ms ({} chars)", LOG_PREFIX, projectId, latencyMs,
                response.getContent() != null ? response.getContent().length() : 0);
        return new QuickEditResult(response.getContent(), response.getUsage(), latencyMs);
    }

    // ==================== INTERNALS ====================

    /**
     * Provider and model for a turn: explicit values first, then the session
     * preference. Fails with
     * {@link me.golemcore.gateway.domain.exception.ProviderUnavailableException}
     * before anything is persisted.
     */
    private LlmRequest resolveTarget(ChatSession session, String provider, String model) {
        ModelPreference preference = session.getModelPreference();
        String chosenProvider = provider;
        String chosenModel = model;
        if (isBlank(chosenProvider) && preference != null) {
            chosenProvider = preference.getProvider();
        }
        if (isBlank(chosenModel) && preference != null && preference.getProvider() != null
                && preference.getProvider().equals(chosenProvider)) {
            chosenModel = preference.getModel();
        }
        return gateway.resolve(LlmRequest.builder()
                .provider(isBlank(chosenProvider) ? null : chosenProvider)
                .model(isBlank(chosenModel) ? null : chosenModel)
                .build());
    }

    private AgenticLoopRequest loopRequest(ChatSession session, LlmRequest target, DocumentContext context,
            List<ToolDefinition> clientTools, ToolLoopObserver observer, BooleanSupplier cancelled) {
        List<ToolDefinition> tools = new ArrayList<>(dispatcher.availableDefinitions());
        Set<String> known = new LinkedHashSet<>();
        tools.forEach(tool -> known.add(tool.getName()));
        Set<String> clientToolNames = new LinkedHashSet<>();
        if (clientTools != null) {
            for (ToolDefinition tool : clientTools) {
                if (tool.getName() != null && known.add(tool.getName())) {
                    tools.add(tool);
                    clientToolNames.add(tool.getName());
                }
            }
        }

        String systemPrompt = prompts.systemPrompt(context, peer.listTools());
        String sessionId = session.getId();
        Supplier<LlmRequest> requests = () -> prompts.turnRequest(conversations.getMessages(sessionId),
                systemPrompt, target.getProvider(), target.getModel(), tools)
                .toBuilder()
                .userId(session.getUserId())
                .projectId(session.getProjectId())
                .sessionId(sessionId)
                .build();

        return AgenticLoopRequest.builder()
                .sessionId(sessionId)
                .requests(requests)
                .observer(observer)
                .clientToolNames(clientToolNames)
                .cancelled(cancelled)
                .build();
    }

    private TurnResult toTurnResult(String sessionId, AgenticLoopResult result) {
        return TurnResult.builder()
                .sessionId(sessionId)
                .message(result.finalMessage())
                .usage(result.usage())
                .toolResults(result.executedTools())
                .requiresToolResults(result.requiresToolResults())
                .toolCalls(result.requiresToolResults() ? result.pendingToolCalls() : null)
                .iterations(result.iterations())
                .iterationLimitReached(result.iterationLimitReached())
                .build();
    }

    private void enforceLimits(String userId, String tier) {
        if (!properties.getLimits().isEnforce()) {
            return;
        }
        LimitCheck check = costTracker.checkLimits(userId, isBlank(tier) ? DEFAULT_TIER : tier);
        if (!check.isWithinLimits()) {
            log.warn("{} User {} is over the {} tier limits", LOG_PREFIX, userId, check.getTier());
            throw new UsageLimitExceededException(check);
        }
    }

    /**
     * A new user turn cannot follow tool calls that are still unanswered; the
     * results have to be submitted first.
     */
    private void requireNoPendingToolCalls(String sessionId) {
        List<String> pending = MessageHistory.pendingToolCallIds(conversations.getMessages(sessionId));
        if (!pending.isEmpty()) {
            log.info("{} Session {} rejected a new message while {} tool call(s) are unanswered", LOG_PREFIX,
                    sessionId, pending.size());
            throw new MessageValidationException("Session has unanswered tool calls: " + pending);
        }
    }

    private static Message lastAssistant(List<Message> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).isAssistantMessage()) {
                return messages.get(i);
            }
        }
        return null;
    }

    private static List<Message.ToolCall> findToolCalls(List<Message> messages, List<String> ids) {
        Map<String, Message.ToolCall> byId = new LinkedHashMap<>();
        for (Message message : messages) {
            if (message.hasToolCalls()) {
                message.getToolCalls().forEach(call -> byId.put(call.getId(), call));
            }
        }
        return ids.stream().map(byId::get).filter(Objects::nonNull).toList();
    }

    private static void requireText(String value, String error) {
        if (isBlank(value)) {
            throw new MessageValidationException(error);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Accumulates one single-pass stream and persists its assistant message
     * exactly once: complete on the terminal chunk, interrupted otherwise.
     */
    private final class StreamState {

        private final StringBuilder content = new StringBuilder();
        private final AtomicBoolean persisted = new AtomicBoolean();
        private String sessionId;
        private String provider;
        private String model;
        private long startedAt;

        void begin(String sessionId, String provider, String model, long startedAt) {
            this.sessionId = sessionId;
            this.provider = provider;
            this.model = model;
            this.startedAt = startedAt;
        }

        List<TurnEvent> accept(LlmChunk chunk) {
            List<TurnEvent> events = new ArrayList<>();
            if (chunk.hasContent()) {
                content.append(chunk.getContent());
                events.add(TurnEvent.token(chunk.getContent()));
            }
            if (!chunk.isDone()) {
                return events;
            }

            StopReason stopReason = chunk.getStopReason() != null ? chunk.getStopReason() : StopReason.END_TURN;
            LlmUsage usage = chunk.getUsage() != null ? chunk.getUsage() : LlmUsage.empty();
            if (chunk.hasToolCalls()) {
                events.add(TurnEvent.toolUse(chunk.getToolCalls()));
            }
            if (persisted.compareAndSet(false, true)) {
                conversations.addAssistantMessage(sessionId, LlmResponse.builder()
                        .content(content.toString())
                        .stopReason(stopReason)
                        .toolCalls(chunk.hasToolCalls() ? chunk.getToolCalls() : null)
                        .usage(usage)
                        .provider(provider)
                        .model(model)
                        .latencyMs(clock.millis() - startedAt)
                        .build());
            }

            Map<String, Object> done = new LinkedHashMap<>();
            done.put("tokens_used", usage);
            done.put("session_id", sessionId);
            done.put("stop_reason", stopReason.getWireName());
            done.put("has_tool_calls", chunk.hasToolCalls());
            events.add(TurnEvent.done(done));
            return events;
        }

        void interrupt(String reason) {
            if (sessionId == null || !persisted.compareAndSet(false, true)) {
                return;
            }
            log.info("{} Stream of session {} interrupted ({}), keeping {} chars", LOG_PREFIX, sessionId, reason,
                    content.length());
            try {
                conversations.addInterruptedAssistantMessage(sessionId, LlmResponse.builder()
                        .content(content.toString())
                        .provider(provider)
                        .model(model)
                        .latencyMs(clock.millis() - startedAt)
                        .build());
            } catch (RuntimeException e) {
                log.error("{} Failed to persist interrupted message of session {}", LOG_PREFIX, sessionId, e);
            }
        }
    }
}
