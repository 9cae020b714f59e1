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

package me.golemcore.gateway.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.adapter.inbound.web.dto.CreateSessionRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.SessionDetailDto;
import me.golemcore.gateway.domain.exception.SessionNotFoundException;
import me.golemcore.gateway.domain.model.ChatSession;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.ModelPreference;
import me.golemcore.gateway.domain.model.SessionExport;
import me.golemcore.gateway.domain.model.ToolCallRecord;
import me.golemcore.gateway.port.outbound.ConversationPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Conversation browser and management endpoints.
 */
@RestController
@RequestMapping("/api/projects/{projectId}/sessions")
@RequiredArgsConstructor
public class SessionsController {

    private static final int MAX_LIST_LIMIT = 100;

    private final ConversationPort conversations;

    @GetMapping
    public Mono<ResponseEntity<List<ChatSession>>> listSessions(
            @PathVariable String projectId,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "false") boolean includeArchived,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId) {
        int normalizedLimit = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        List<ChatSession> sessions = conversations.listSessions(projectId, userId, normalizedLimit,
                Math.max(0, skip), includeArchived);
        return Mono.just(ResponseEntity.ok(sessions));
    }

    @PostMapping
    public Mono<ResponseEntity<ChatSession>> createSession(
            @PathVariable String projectId,
            @RequestBody(required = false) CreateSessionRequest request,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId) {
        CreateSessionRequest body = request != null ? request : new CreateSessionRequest();
        ModelPreference preference = body.getProvider() != null
                ? new ModelPreference(body.getProvider(), body.getModel())
                : null;
        ChatSession session = conversations.createSession(projectId, userId, body.getTitle(), preference);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(session));
    }

    @GetMapping("/{sessionId}")
    public Mono<ResponseEntity<SessionDetailDto>> getSession(
            @PathVariable String projectId,
            @PathVariable String sessionId,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "true") boolean includeToolMessages,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId) {
        ChatSession session = conversations.getSessionWithHistory(sessionId, userId, limit, includeToolMessages)
                .filter(found -> projectId.equals(found.getProjectId()))
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        SessionDetailDto dto = SessionDetailDto.builder()
                .session(session)
                .messages(session.getMessages())
                .build();
        return Mono.just(ResponseEntity.ok(dto));
    }

    @DeleteMapping("/{sessionId}")
    public Mono<ResponseEntity<Map<String, Object>>> archiveSession(
            @PathVariable String projectId,
            @PathVariable String sessionId,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId) {
        if (!conversations.archiveSession(sessionId, userId)) {
            throw new SessionNotFoundException(sessionId);
        }
        return Mono.just(ResponseEntity.ok(Map.of("archived", true, "sessionId", sessionId)));
    }

    @GetMapping("/{sessionId}/export")
    public Mono<ResponseEntity<SessionExport>> exportSession(
            @PathVariable String projectId,
            @PathVariable String sessionId,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId) {
        SessionExport export = conversations.exportSession(sessionId, userId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        return Mono.just(ResponseEntity.ok(export));
    }

    @GetMapping("/{sessionId}/tool-calls")
    public Mono<ResponseEntity<List<ToolCallRecord>>> getToolCalls(
            @PathVariable String projectId,
            @PathVariable String sessionId,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId) {
        return Mono.just(ResponseEntity.ok(conversations.getToolCalls(sessionId, userId)));
    }

    @GetMapping("/{sessionId}/search")
    public Mono<ResponseEntity<List<Message>>> search(
            @PathVariable String projectId,
            @PathVariable String sessionId,
            @RequestParam(name = "q", required = false) String query,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId) {
        if (query == null || query.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "q is required");
        }
        return Mono.just(ResponseEntity.ok(conversations.searchMessages(sessionId, userId, query)));
    }

    @PutMapping("/{sessionId}/model")
    public Mono<ResponseEntity<ChatSession>> updateModel(
            @PathVariable String projectId,
            @PathVariable String sessionId,
            @RequestBody ModelPreference preference,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId) {
        if (preference == null || preference.getProvider() == null || preference.getProvider().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "provider is required");
        }
        return Mono.just(ResponseEntity.ok(conversations.updateModelPreference(sessionId, userId, preference)));
    }
}
