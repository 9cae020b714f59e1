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
import me.golemcore.gateway.domain.model.ModelInfo;
import me.golemcore.gateway.domain.model.ModelRecommendation;
import me.golemcore.gateway.domain.service.CompletionGateway;
import me.golemcore.gateway.routing.ModelRouter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider and model catalogue.
 */
@RestController
@RequestMapping("/api/agent")
@RequiredArgsConstructor
public class ProvidersController {

    private final CompletionGateway gateway;
    private final ModelRouter modelRouter;

    @GetMapping("/providers")
    public Mono<ResponseEntity<Map<String, Object>>> getProviders() {
        List<Map<String, Object>> providers = gateway.getAvailableProviders().stream()
                .map(id -> {
                    Map<String, Object> provider = new LinkedHashMap<>();
                    provider.put("id", id);
                    provider.put("models", gateway.getModels(id));
                    return provider;
                })
                .toList();
        return Mono.just(ResponseEntity.ok(Map.of("providers", providers)));
    }

    @GetMapping("/models")
    public Mono<ResponseEntity<Map<String, Object>>> getModels(@RequestParam(required = false) String provider) {
        if (provider == null || provider.isBlank()) {
            List<ModelInfo> models = gateway.getAllModels();
            return Mono.just(ResponseEntity.ok(Map.of("models", models)));
        }
        return Mono.just(ResponseEntity.ok(Map.of("provider", provider, "models", gateway.getModels(provider))));
    }

    /**
     * Recommends a model for a task type, or for the task detected in
     * {@code text} when no task is given.
     */
    @GetMapping("/models/recommend")
    public Mono<ResponseEntity<Map<String, Object>>> recommend(
            @RequestParam(required = false) String task,
            @RequestParam(defaultValue = RequestHeaders.DEFAULT_TIER) String tier,
            @RequestParam(required = false) String text) {
        String taskType = task;
        if (taskType == null || taskType.isBlank()) {
            if (text == null || text.isBlank()) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "task or text is required");
            }
            taskType = modelRouter.detectTaskType(text);
        }
        ModelRecommendation recommendation = gateway.recommendModel(taskType, tier);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("task", taskType);
        body.put("tier", tier);
        body.put("recommendation", recommendation);
        return Mono.just(ResponseEntity.ok(body));
    }
}
