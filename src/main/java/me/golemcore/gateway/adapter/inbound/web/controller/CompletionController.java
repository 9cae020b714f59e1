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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.web.dto.MessageRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.QuickEditRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.ToolResultsRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.TurnResponse;
import me.golemcore.gateway.domain.model.DocumentContext;
import me.golemcore.gateway.domain.model.QuickEditResult;
import me.golemcore.gateway.domain.model.ToolResultSubmission;
import me.golemcore.gateway.domain.model.TurnEvent;
import me.golemcore.gateway.domain.model.TurnRequest;
import me.golemcore.gateway.domain.service.CompletionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversation turns: request/response, client tool results, the two SSE
 * streams and quick edits.
 */
@RestController
@RequestMapping("/api/projects/{projectId}/agent")
@RequiredArgsConstructor
@Slf4j
public class CompletionController {

    private final CompletionService completionService;
    private final ObjectMapper objectMapper;

    @PostMapping("/message")
    public Mono<ResponseEntity<TurnResponse>> sendMessage(
            @PathVariable String projectId,
            @RequestBody MessageRequest body,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId,
            @RequestHeader(value = RequestHeaders.USER_TIER, defaultValue = RequestHeaders.DEFAULT_TIER) String tier) {
        TurnRequest request = TurnRequest.builder()
                .projectId(projectId)
                .userId(userId)
                .sessionId(body.getSessionId())
                .message(body.getMessage())
                .provider(body.getProvider())
                .model(body.getModel())
                .context(body.getContext())
                .clientTools(body.getTools())
                .tier(tier)
                .build();
        return Mono.fromCallable(() -> completionService.sendMessage(request))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(TurnResponse.from(result)));
    }

    @PostMapping("/tool-results")
    public Mono<ResponseEntity<TurnResponse>> submitToolResults(
            @PathVariable String projectId,
            @RequestBody ToolResultsRequest body,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId,
            @RequestHeader(value = RequestHeaders.USER_TIER, defaultValue = RequestHeaders.DEFAULT_TIER) String tier) {
        if (body.getSessionId() == null || body.getSessionId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "sessionId is required");
        }
        ToolResultSubmission submission = ToolResultSubmission.builder()
                .projectId(projectId)
                .userId(userId)
                .sessionId(body.getSessionId())
                .provider(body.getProvider())
                .model(body.getModel())
                .context(body.getContext())
                .clientTools(body.getTools())
                .tier(tier)
                .results(body.getResults() == null ? null
                        : body.getResults().stream()
                                .map(result -> new ToolResultSubmission.Result(result.getToolCallId(),
                                        result.getToolName(), result.getContent(), result.isError()))
                                .toList())
                .build();
        return Mono.fromCallable(() -> completionService.submitToolResults(submission))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(TurnResponse.from(result)));
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Map<String, Object>>> stream(
            @PathVariable String projectId,
            @RequestParam(required = false) String message,
            @RequestParam(required = false) String sessionId,
            @RequestParam(required = false) String provider,
            @RequestParam(required = false) String model,
            @RequestParam(required = false) String context,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId,
            @RequestHeader(value = RequestHeaders.USER_TIER, defaultValue = RequestHeaders.DEFAULT_TIER) String tier) {
        return streamRequest(projectId, message, sessionId, provider, model, context, userId, tier)
                .flatMapMany(completionService::streamTurn)
                .onErrorResume(error -> Flux.just(TurnEvent.error("Stream failed", error.getMessage())))
                .map(CompletionController::toSse);
    }

    @GetMapping(value = "/stream-agentic", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Map<String, Object>>> streamAgentic(
            @PathVariable String projectId,
            @RequestParam(required = false) String message,
            @RequestParam(required = false) String sessionId,
            @RequestParam(required = false) String provider,
            @RequestParam(required = false) String model,
            @RequestParam(required = false) String context,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId,
            @RequestHeader(value = RequestHeaders.USER_TIER, defaultValue = RequestHeaders.DEFAULT_TIER) String tier) {
        return streamRequest(projectId, message, sessionId, provider, model, context, userId, tier)
                .flatMapMany(completionService::streamAgentic)
                .onErrorResume(error -> Flux.just(TurnEvent.error("Agentic stream failed", error.getMessage())))
                .map(CompletionController::toSse);
    }

    @PostMapping("/quick-edit")
    public Mono<ResponseEntity<Map<String, Object>>> quickEdit(
            @PathVariable String projectId,
            @RequestBody QuickEditRequest body,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId,
            @RequestHeader(value = RequestHeaders.USER_TIER, defaultValue = RequestHeaders.DEFAULT_TIER) String tier) {
        return Mono.fromCallable(() -> completionService.quickEdit(projectId, userId, body.getPrompt(),
                body.getSelectedText(), tier))
                .subscribeOn(Schedulers.boundedElastic())
                .map(CompletionController::toQuickEditBody)
                .map(ResponseEntity::ok);
    }

    private Mono<TurnRequest> streamRequest(String projectId, String message, String sessionId, String provider,
            String model, String context, String userId, String tier) {
        return Mono.fromCallable(() -> TurnRequest.builder()
                .projectId(projectId)
                .userId(userId)
                .sessionId(sessionId)
                .message(message)
                .provider(provider)
                .model(model)
                .context(parseContext(context))
                .tier(tier)
                .build());
    }

    private DocumentContext parseContext(String context) {
        if (context == null || context.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(context, DocumentContext.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("context is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static ServerSentEvent<Map<String, Object>> toSse(TurnEvent event) {
        return ServerSentEvent.<Map<String, Object>>builder()
                .event(event.type())
                .data(event.data())
                .build();
    }

    private static Map<String, Object> toQuickEditBody(QuickEditResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", result.content());
        body.put("usage", result.usage());
        body.put("latency_ms", result.latencyMs());
        return body;
    }
}
