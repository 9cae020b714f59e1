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
import me.golemcore.gateway.domain.exception.SessionNotFoundException;
import me.golemcore.gateway.domain.model.LimitCheck;
import me.golemcore.gateway.domain.model.UsageSummary;
import me.golemcore.gateway.domain.model.UsageTotals;
import me.golemcore.gateway.domain.model.UserStats;
import me.golemcore.gateway.port.outbound.ConversationPort;
import me.golemcore.gateway.port.outbound.CostTrackingPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cost and usage endpoints for the calling user.
 */
@RestController
@RequestMapping("/api/usage")
@RequiredArgsConstructor
public class UsageController {

    private final CostTrackingPort costTracker;
    private final ConversationPort conversations;
    private final Clock clock;

    @GetMapping("/summary")
    public Mono<ResponseEntity<UsageSummary>> getSummary(
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId) {
        return Mono.just(ResponseEntity.ok(costTracker.getSummary(userId)));
    }

    @GetMapping("/daily")
    public Mono<ResponseEntity<Map<String, Object>>> getDaily(
            @RequestParam(required = false) String date,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId) {
        LocalDate day = parseDate(date);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("date", day.toString());
        body.put("usage", costTracker.getDailyUsage(userId, day));
        return Mono.just(ResponseEntity.ok(body));
    }

    @GetMapping("/limits")
    public Mono<ResponseEntity<LimitCheck>> getLimits(
            @RequestParam(required = false) String tier,
            @RequestHeader(value = RequestHeaders.USER_TIER, defaultValue = RequestHeaders.DEFAULT_TIER) String headerTier,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId) {
        String effectiveTier = tier != null && !tier.isBlank() ? tier : headerTier;
        return Mono.just(ResponseEntity.ok(costTracker.checkLimits(userId, effectiveTier)));
    }

    /**
     * Live totals of a session next to the totals recomputed from its
     * persisted messages.
     */
    @GetMapping("/sessions/{sessionId}")
    public Mono<ResponseEntity<Map<String, UsageTotals>>> getSessionUsage(
            @PathVariable String sessionId,
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId) {
        if (conversations.getSession(sessionId, userId).isEmpty()) {
            throw new SessionNotFoundException(sessionId);
        }
        Map<String, UsageTotals> body = new LinkedHashMap<>();
        body.put("live", costTracker.getSessionTotals(sessionId));
        body.put("recomputed", costTracker.recompute(conversations.getMessages(sessionId)));
        return Mono.just(ResponseEntity.ok(body));
    }

    @GetMapping("/users/me")
    public Mono<ResponseEntity<UserStats>> getUserStats(
            @RequestHeader(value = RequestHeaders.USER_ID, defaultValue = RequestHeaders.ANONYMOUS) String userId) {
        return Mono.just(ResponseEntity.ok(conversations.getUserStats(userId)));
    }

    private LocalDate parseDate(String date) {
        if (date == null || date.isBlank()) {
            return LocalDate.now(clock);
        }
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "date must be ISO formatted (yyyy-MM-dd)");
        }
    }
}
