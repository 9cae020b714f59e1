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

import me.golemcore.gateway.domain.exception.MessageValidationException;
import me.golemcore.gateway.domain.exception.SessionNotFoundException;
import me.golemcore.gateway.domain.model.ChatSession;
import me.golemcore.gateway.domain.model.DocumentContext;
import me.golemcore.gateway.domain.model.LlmResponse;
import me.golemcore.gateway.domain.model.LlmUsage;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.MessageHistory;
import me.golemcore.gateway.domain.model.MessageMetadata;
import me.golemcore.gateway.domain.model.ModelPreference;
import me.golemcore.gateway.domain.model.SessionExport;
import me.golemcore.gateway.domain.model.SessionStatus;
import me.golemcore.gateway.domain.model.StopReason;
import me.golemcore.gateway.domain.model.ToolCallRecord;
import me.golemcore.gateway.domain.model.UserStats;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.ConversationPort;
import me.golemcore.gateway.port.outbound.CostTrackingPort;
import me.golemcore.gateway.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * File-backed conversation log.
 *
 * <p>
 * Each session is stored as two files under the sessions directory:
 * {@code <id>.json} with the counters and lifecycle fields (rewritten
 * atomically) and {@code <id>.messages.jsonl} with one message per line
 * (append only). Sessions are cached in memory and loaded at startup.
 *
 * <p>
 * Appends to one session are serialized on the session instance. A message is
 * written to storage before it becomes visible in memory; a storage failure
 * propagates and nothing is appended.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationStore implements ConversationPort {

    private static final String LOG_PREFIX = "[Store]";
    private static final String META_EXTENSION = ".json";
    private static final String MESSAGES_EXTENSION = ".messages.jsonl";
    private static final String NEWLINE = "\n";
    private static final String ELLIPSIS = "...";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;
    private final CostTrackingPort costTracker;
    private final Clock clock;

    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();
    private final Object creationLock = new Object();

    @PostConstruct
    public void loadSessions() {
        String dir = sessionsDir();
        storagePort.ensureDirectory(dir).join();
        List<String> files = storagePort.listObjects(dir, "").join();
        int loaded = 0;
        for (String file : files) {
            if (!file.endsWith(META_EXTENSION)) {
                continue;
            }
            String sessionId = file.substring(0, file.length() - META_EXTENSION.length());
            try {
                ChatSession session = readSession(sessionId);
                if (session != null) {
                    sessions.put(session.getId(), session);
                    loaded++;
                }
            } catch (RuntimeException e) {
                log.warn("{} Skipping unreadable session {}: {}", LOG_PREFIX, sessionId, e.getMessage());
            }
        }
        log.info("{} Loaded {} sessions from storage", LOG_PREFIX, loaded);
    }

    // ==================== sessions ====================

    @Override
    public ChatSession getOrCreateSession(String projectId, String userId, String sessionId) {
        if (sessionId != null && !sessionId.isBlank()) {
            ChatSession requested = sessions.get(sessionId);
            if (requested != null && requested.belongsTo(userId) && projectId.equals(requested.getProjectId())) {
                return requested;
            }
        }
        synchronized (creationLock) {
            Optional<ChatSession> active = sessions.values().stream()
                    .filter(s -> projectId.equals(s.getProjectId()) && s.belongsTo(userId) && s.isActive())
                    .max(Comparator.comparing(ChatSession::getUpdatedAt));
            if (active.isPresent()) {
                return active.get();
            }
            return createSession(projectId, userId, null, null);
        }
    }

    @Override
    public ChatSession createSession(String projectId, String userId, String title, ModelPreference preference) {
        Instant now = clock.instant();
        ChatSession session = ChatSession.builder()
                .id(UUID.randomUUID().toString())
                .projectId(projectId)
                .userId(userId)
                .title(title != null && !title.isBlank() ? title : properties.getSessions().getDefaultTitle())
                .status(SessionStatus.ACTIVE)
                .modelPreference(preference != null ? preference : defaultPreference())
                .totalTokens(LlmUsage.empty())
                .createdAt(now)
                .updatedAt(now)
                .build();
        writeMeta(session);
        sessions.put(session.getId(), session);
        log.info("{} Created session {} for project={} user={}", LOG_PREFIX, session.getId(), projectId, userId);
        return session;
    }

    @Override
    public Optional<ChatSession> getSession(String sessionId, String userId) {
        ChatSession session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null || !session.belongsTo(userId)) {
            return Optional.empty();
        }
        return Optional.of(snapshot(session, null));
    }

    @Override
    public Optional<ChatSession> getSessionWithHistory(String sessionId, String userId, int messageLimit,
            boolean includeToolMessages) {
        ChatSession session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null || !session.belongsTo(userId)) {
            return Optional.empty();
        }
        synchronized (session) {
            List<Message> messages = MessageHistory.recent(session.getMessages(), messageLimit);
            if (!includeToolMessages) {
                messages.removeIf(Message::isToolMessage);
            }
            return Optional.of(snapshot(session, messages));
        }
    }

    @Override
    public List<ChatSession> listSessions(String projectId, String userId, int limit, int skip,
            boolean includeArchived) {
        return sessions.values().stream()
                .filter(s -> projectId.equals(s.getProjectId()) && s.belongsTo(userId))
                .filter(s -> includeArchived || s.isActive())
                .sorted(Comparator.comparing(ChatSession::getUpdatedAt).reversed())
                .skip(Math.max(0, skip))
                .limit(Math.max(0, limit))
                .map(s -> snapshot(s, null))
                .toList();
    }

    @Override
    public boolean archiveSession(String sessionId, String userId) {
        ChatSession session = sessions.get(sessionId);
        if (session == null || !session.belongsTo(userId)) {
            return false;
        }
        synchronized (session) {
            session.setStatus(SessionStatus.ARCHIVED);
            session.setUpdatedAt(clock.instant());
            writeMeta(session);
        }
        log.info("{} Archived session {}", LOG_PREFIX, sessionId);
        return true;
    }

    @Override
    public void autoGenerateTitle(String sessionId, String firstMessage) {
        if (firstMessage == null || firstMessage.isBlank()) {
            return;
        }
        ChatSession session = requireSession(sessionId);
        int max = properties.getSessions().getTitleMaxLength();
        String text = firstMessage.strip();
        String title = text.length() > max ? text.substring(0, max - ELLIPSIS.length()) + ELLIPSIS : text;
        synchronized (session) {
            session.setTitle(title);
            session.setUpdatedAt(clock.instant());
            writeMeta(session);
        }
    }

    @Override
    public ChatSession updateModelPreference(String sessionId, String userId, ModelPreference preference) {
        ChatSession session = sessions.get(sessionId);
        if (session == null || !session.belongsTo(userId)) {
            throw new SessionNotFoundException(sessionId);
        }
        synchronized (session) {
            session.setModelPreference(preference);
            session.setUpdatedAt(clock.instant());
            writeMeta(session);
            return snapshot(session, null);
        }
    }

    // ==================== messages ====================

    @Override
    public Message addUserMessage(String sessionId, String content, DocumentContext context) {
        if (content == null) {
            throw new MessageValidationException("Non-tool messages must have content");
        }
        Instant now = clock.instant();
        Message message = Message.builder()
                .id(Message.newId(now))
                .role(Message.ROLE_USER)
                .content(content)
                .timestamp(now)
                .metadata(context != null ? MessageMetadata.builder().documentContext(context).build() : null)
                .build();
        return append(sessionId, message, session -> {
        });
    }

    @Override
    public Message addAssistantMessage(String sessionId, LlmResponse response) {
        Instant now = clock.instant();
        List<Message.ToolCall> toolCalls = response.hasToolCalls() ? withUniqueIds(response.getToolCalls(), now)
                : null;
        LlmUsage usage = response.getUsage() != null ? response.getUsage() : LlmUsage.empty();
        Message message = Message.builder()
                .id(Message.newId(now))
                .role(Message.ROLE_ASSISTANT)
                .content(response.getContent() != null ? response.getContent() : "")
                .timestamp(now)
                .stopReason(response.getStopReason() != null ? response.getStopReason() : StopReason.END_TURN)
                .toolCalls(toolCalls)
                .metadata(MessageMetadata.builder()
                        .model(response.getModel())
                        .provider(response.getProvider())
                        .tokensUsed(usage)
                        .latencyMs(response.getLatencyMs())
                        .build())
                .build();
        double cost = costTracker.calculateCost(response.getProvider(), response.getModel(), usage).total();
        int callCount = toolCalls != null ? toolCalls.size() : 0;
        return append(sessionId, message, session -> {
            session.setToolCallCount(session.getToolCallCount() + callCount);
            LlmUsage totals = session.getTotalTokens() != null ? session.getTotalTokens() : LlmUsage.empty();
            session.setTotalTokens(LlmUsage.of(totals.getInputTokens() + usage.getInputTokens(),
                    totals.getOutputTokens() + usage.getOutputTokens()));
            session.setTotalCostUsd(session.getTotalCostUsd() + cost);
        });
    }

    /**
     * Persists the text a stream produced before it was cut off. Tool calls of
     * an unfinished response are not kept.
     */
    @Override
    public Message addInterruptedAssistantMessage(String sessionId, LlmResponse partial) {
        Instant now = clock.instant();
        Message message = Message.builder()
                .id(Message.newId(now))
                .role(Message.ROLE_ASSISTANT)
                .content(partial.getContent() != null ? partial.getContent() : "")
                .timestamp(now)
                .stopReason(StopReason.END_TURN)
                .metadata(MessageMetadata.builder()
                        .model(partial.getModel())
                        .provider(partial.getProvider())
                        .interrupted(true)
                        .build())
                .build();
        log.info("{} Persisting interrupted response in session {} ({} chars)", LOG_PREFIX, sessionId,
                message.getContent().length());
        return append(sessionId, message, session -> {
        });
    }

    @Override
    public Message addToolResultMessage(String sessionId, String toolCallId, String toolName, String content,
            boolean error) {
        if (toolCallId == null || toolCallId.isBlank()) {
            throw new MessageValidationException("Tool messages must have tool_call_id");
        }
        Instant now = clock.instant();
        Message message = Message.builder()
                .id(Message.newId(now))
                .role(Message.ROLE_TOOL)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .content(content != null ? content : "")
                .error(error)
                .timestamp(now)
                .build();
        return append(sessionId, message, session -> {
        });
    }

    @Override
    public List<Message> getMessages(String sessionId) {
        ChatSession session = requireSession(sessionId);
        synchronized (session) {
            return new ArrayList<>(session.getMessages());
        }
    }

    @Override
    public List<ToolCallRecord> getToolCalls(String sessionId, String userId) {
        List<Message> messages = ownedMessages(sessionId, userId);
        Map<String, ToolCallRecord.Outcome> results = new HashMap<>();
        for (Message message : messages) {
            if (message.isToolMessage()) {
                results.put(message.getToolCallId(), ToolCallRecord.Outcome.builder()
                        .result(message.getContent())
                        .error(message.isErrorResult())
                        .timestamp(message.getTimestamp())
                        .build());
            }
        }
        List<ToolCallRecord> records = new ArrayList<>();
        for (Message message : messages) {
            if (!message.isAssistantMessage() || !message.hasToolCalls()) {
                continue;
            }
            for (Message.ToolCall call : message.getToolCalls()) {
                records.add(ToolCallRecord.builder()
                        .id(call.getId())
                        .name(call.getName())
                        .input(call.getInput())
                        .calledAt(message.getTimestamp())
                        .messageId(message.getId())
                        .result(results.get(call.getId()))
                        .build());
            }
        }
        return records;
    }

    @Override
    public UserStats getUserStats(String userId) {
        int count = 0;
        long input = 0;
        long output = 0;
        double cost = 0;
        long messages = 0;
        long toolCalls = 0;
        for (ChatSession session : sessions.values()) {
            if (!session.belongsTo(userId)) {
                continue;
            }
            count++;
            if (session.getTotalTokens() != null) {
                input += session.getTotalTokens().getInputTokens();
                output += session.getTotalTokens().getOutputTokens();
            }
            cost += session.getTotalCostUsd();
            messages += session.getMessageCount();
            toolCalls += session.getToolCallCount();
        }
        return UserStats.builder()
                .totalSessions(count)
                .totalTokensInput(input)
                .totalTokensOutput(output)
                .totalCost(cost)
                .totalMessages(messages)
                .totalToolCalls(toolCalls)
                .build();
    }

    @Override
    public Optional<SessionExport> exportSession(String sessionId, String userId) {
        return getSessionWithHistory(sessionId, userId, properties.getSessions().getExportLimit(), true)
                .map(session -> SessionExport.builder()
                        .id(session.getId())
                        .title(session.getTitle())
                        .createdAt(session.getCreatedAt())
                        .updatedAt(session.getUpdatedAt())
                        .model(session.getModelPreference())
                        .statistics(SessionExport.Statistics.builder()
                                .messageCount(session.getMessageCount())
                                .toolCallCount(session.getToolCallCount())
                                .totalTokens(session.getTotalTokens())
                                .totalCostUsd(session.getTotalCostUsd())
                                .build())
                        .messages(session.getMessages().stream()
                                .map(m -> m.toBuilder().metadata(null).build())
                                .toList())
                        .build());
    }

    @Override
    public List<Message> searchMessages(String sessionId, String userId, String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String needle = query.toLowerCase(Locale.ROOT);
        return ownedMessages(sessionId, userId).stream()
                .filter(m -> contains(m.getContent(), needle) || contains(m.getToolName(), needle))
                .toList();
    }

    // ==================== internals ====================

    private Message append(String sessionId, Message message, Consumer<ChatSession> counters) {
        ChatSession session = requireSession(sessionId);
        synchronized (session) {
            validate(session, message);
            storagePort.appendText(sessionsDir(), sessionId + MESSAGES_EXTENSION, toJson(message) + NEWLINE)
                    .join();
            session.getMessages().add(message);
            session.setMessageCount(session.getMessageCount() + 1);
            counters.accept(session);
            session.setUpdatedAt(message.getTimestamp());
            writeMeta(session);
        }
        log.debug("{} Appended {} message {} to session {}", LOG_PREFIX, message.getRole(), message.getId(),
                sessionId);
        return message;
    }

    private void validate(ChatSession session, Message message) {
        List<String> errors = new ArrayList<>();
        if (message.getId() == null) {
            errors.add("Message must have an id");
        }
        if (message.isToolMessage()) {
            List<String> pending = MessageHistory.pendingToolCallIds(session.getMessages());
            if (!pending.contains(message.getToolCallId())) {
                errors.add("No pending tool call with id " + message.getToolCallId());
            }
        }
        if (!errors.isEmpty()) {
            log.warn("{} Rejected message for session {}: {}", LOG_PREFIX, session.getId(), errors);
            throw new MessageValidationException(errors);
        }
    }

    private List<Message.ToolCall> withUniqueIds(List<Message.ToolCall> calls, Instant now) {
        Set<String> seen = new HashSet<>();
        List<Message.ToolCall> result = new ArrayList<>(calls.size());
        for (Message.ToolCall call : calls) {
            String id = call.getId();
            if (id == null || id.isBlank() || !seen.add(id)) {
                id = Message.newToolCallId(now);
                seen.add(id);
            }
            result.add(Message.ToolCall.builder()
                    .id(id)
                    .name(call.getName())
                    .input(call.getInput() != null ? call.getInput() : Map.of())
                    .build());
        }
        return result;
    }

    private ChatSession requireSession(String sessionId) {
        ChatSession session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    private List<Message> ownedMessages(String sessionId, String userId) {
        ChatSession session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null || !session.belongsTo(userId)) {
            return List.of();
        }
        synchronized (session) {
            return new ArrayList<>(session.getMessages());
        }
    }

    private ChatSession snapshot(ChatSession session, List<Message> messages) {
        synchronized (session) {
            return session.toBuilder()
                    .messages(messages != null ? messages : new ArrayList<>())
                    .build();
        }
    }

    private ModelPreference defaultPreference() {
        GatewayProperties.SessionsProperties config = properties.getSessions();
        String provider = config.getDefaultProvider() != null ? config.getDefaultProvider()
                : properties.getDefaultProvider();
        String model = config.getDefaultModel() != null ? config.getDefaultModel() : properties.getDefaultModel();
        return new ModelPreference(provider, model);
    }

    private static boolean contains(String text, String needle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(needle);
    }

    private void writeMeta(ChatSession session) {
        storagePort.putTextAtomic(sessionsDir(), session.getId() + META_EXTENSION, toJson(session), false).join();
    }

    private ChatSession readSession(String sessionId) {
        String meta = storagePort.getText(sessionsDir(), sessionId + META_EXTENSION).join();
        if (meta == null || meta.isBlank()) {
            return null;
        }
        ChatSession session = fromJson(meta, ChatSession.class);
        List<Message> messages = new ArrayList<>();
        String lines = storagePort.getText(sessionsDir(), sessionId + MESSAGES_EXTENSION).join();
        if (lines != null) {
            for (String line : lines.split(NEWLINE)) {
                if (!line.isBlank()) {
                    messages.add(fromJson(line, Message.class));
                }
            }
        }
        session.setMessages(messages);
        return session;
    }

    private String sessionsDir() {
        return properties.getStorage().getSessionsDirectory();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
