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

package me.golemcore.gateway.port.outbound;

import me.golemcore.gateway.domain.model.ChatSession;
import me.golemcore.gateway.domain.model.DocumentContext;
import me.golemcore.gateway.domain.model.LlmResponse;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.ModelPreference;
import me.golemcore.gateway.domain.model.SessionExport;
import me.golemcore.gateway.domain.model.ToolCallRecord;
import me.golemcore.gateway.domain.model.UserStats;

import java.util.List;
import java.util.Optional;

/**
 * Append-only conversation log keyed by (project, user).
 */
public interface ConversationPort {

    ChatSession getOrCreateSession(String projectId, String userId, String sessionId);

    ChatSession createSession(String projectId, String userId, String title, ModelPreference preference);

    Optional<ChatSession> getSession(String sessionId, String userId);

    /**
     * Session snapshot whose message list is cut to {@code messageLimit} with
     * tool-call/result pairs kept intact.
     */
    Optional<ChatSession> getSessionWithHistory(String sessionId, String userId, int messageLimit,
            boolean includeToolMessages);

    List<ChatSession> listSessions(String projectId, String userId, int limit, int skip, boolean includeArchived);

    boolean archiveSession(String sessionId, String userId);

    void autoGenerateTitle(String sessionId, String firstMessage);

    ChatSession updateModelPreference(String sessionId, String userId, ModelPreference preference);

    Message addUserMessage(String sessionId, String content, DocumentContext context);

    Message addAssistantMessage(String sessionId, LlmResponse response);

    /**
     * Persists the partial content of a stream that ended early, flagged as
     * interrupted.
     */
    Message addInterruptedAssistantMessage(String sessionId, LlmResponse partial);

    /**
     * @throws me.golemcore.gateway.domain.exception.MessageValidationException
     *             if the call id does not answer a pending tool call of this
     *             session
     */
    Message addToolResultMessage(String sessionId, String toolCallId, String toolName, String content,
            boolean error);

    List<Message> getMessages(String sessionId);

    List<ToolCallRecord> getToolCalls(String sessionId, String userId);

    UserStats getUserStats(String userId);

    Optional<SessionExport> exportSession(String sessionId, String userId);

    List<Message> searchMessages(String sessionId, String userId, String query);
}
