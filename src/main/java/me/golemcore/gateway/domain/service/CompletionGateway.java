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

import me.golemcore.gateway.domain.exception.ProviderUnavailableException;
import me.golemcore.gateway.domain.model.LlmChunk;
import me.golemcore.gateway.domain.model.LlmRequest;
import me.golemcore.gateway.domain.model.LlmResponse;
import me.golemcore.gateway.domain.model.LlmUsage;
import me.golemcore.gateway.domain.model.ModelInfo;
import me.golemcore.gateway.domain.model.ModelRecommendation;
import me.golemcore.gateway.domain.model.ProviderHealth;
import me.golemcore.gateway.domain.model.UsageSummary;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.CostTrackingPort;
import me.golemcore.gateway.port.outbound.LlmProviderPort;
import me.golemcore.gateway.port.outbound.ProviderRegistryPort;
import me.golemcore.gateway.routing.ModelRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Single entry point for synchronous and streaming completions.
 *
 * <p>
 * Resolves the adapter (falling back to the configured default provider),
 * runs the request through the adapter's normalize/call/normalize pipeline
 * and records usage with the cost tracker. Never retries; a failed call is
 * reported to the caller as it happened.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompletionGateway {

    private static final String LOG_PREFIX = "[Gateway]";

    private final ProviderRegistryPort providerRegistry;
    private final CostTrackingPort costTracker;
    private final ModelRouter modelRouter;
    private final GatewayProperties properties;
    private final Clock clock;

    public LlmResponse complete(LlmRequest request) {
        LlmProviderPort<?, ?, ?> adapter = resolveAdapter(request);
        LlmRequest effective = withDefaults(request, adapter);

        long start = clock.millis();
        LlmResponse response = completeWith(adapter, effective);
        long latency = clock.millis() - start;

        // Vendors may echo a dated snapshot id; pricing and history use the catalogue name.
        if (response.getModel() != null && !response.getModel().equals(effective.getModel())) {
            log.debug("{} {} answered as {} for {}", LOG_PREFIX, adapter.getProviderId(), response.getModel(),
                    effective.getModel());
        }
        response.setProvider(adapter.getProviderId());
        response.setModel(effective.getModel());
        response.setLatencyMs(latency);
        if (response.getUsage() == null) {
            response.setUsage(LlmUsage.empty());
        }

        costTracker.track(usageEvent(adapter.getProviderId(), effective, response.getUsage()));
        log.info("{} {}/{} completed in {}ms, tokens {}/{}, stop={}", LOG_PREFIX, adapter.getProviderId(),
                effective.getModel(), latency, response.getUsage().getInputTokens(),
                response.getUsage().getOutputTokens(), response.getStopReason());
        return response;
    }

    /**
     * Streams normalized chunks. Resolution happens eagerly, so an unknown
     * provider fails before anything is subscribed. Usage is tracked once,
     * from the terminal chunk.
     */
    public Flux<LlmChunk> stream(LlmRequest request) {
        LlmProviderPort<?, ?, ?> adapter = resolveAdapter(request);
        LlmRequest effective = withDefaults(request, adapter);

        return streamWith(adapter, effective)
                .filter(chunk -> chunk.isDone() || chunk.hasContent() || chunk.getToolCallStarted() != null)
                .doOnNext(chunk -> {
                    if (chunk.isDone()) {
                        LlmUsage usage = chunk.getUsage() != null ? chunk.getUsage() : LlmUsage.empty();
                        costTracker.track(usageEvent(adapter.getProviderId(), effective, usage));
                        log.info("{} {}/{} stream finished, tokens {}/{}, stop={}", LOG_PREFIX,
                                adapter.getProviderId(), effective.getModel(), usage.getInputTokens(),
                                usage.getOutputTokens(), chunk.getStopReason());
                    }
                });
    }

    /**
     * Provider id and model that a request will actually use.
     */
    public LlmRequest resolve(LlmRequest request) {
        LlmProviderPort<?, ?, ?> adapter = resolveAdapter(request);
        return withDefaults(request, adapter).toBuilder().provider(adapter.getProviderId()).build();
    }

    // ==================== catalogue ====================

    public List<String> getAvailableProviders() {
        return providerRegistry.list();
    }

    public List<ModelInfo> getModels(String provider) {
        return providerRegistry.get(provider)
                .map(LlmProviderPort::getModels)
                .orElseThrow(() -> new ProviderUnavailableException(provider));
    }

    public List<ModelInfo> getAllModels() {
        List<ModelInfo> models = new ArrayList<>();
        for (String provider : providerRegistry.list()) {
            providerRegistry.get(provider).ifPresent(adapter -> models.addAll(adapter.getModels()));
        }
        return models;
    }

    public ModelRecommendation recommendModel(String taskType, String tier) {
        return modelRouter.recommend(taskType, tier);
    }

    public UsageSummary getCostSummary(String userId) {
        return costTracker.getSummary(userId);
    }

    public Map<String, ProviderHealth> getHealthStatus() {
        return providerRegistry.getHealthStatus();
    }

    // ==================== internals ====================

    private LlmProviderPort<?, ?, ?> resolveAdapter(LlmRequest request) {
        String provider = request.getProvider() != null && !request.getProvider().isBlank()
                ? request.getProvider()
                : properties.getDefaultProvider();
        return providerRegistry.get(provider)
                .orElseThrow(() -> {
                    log.warn("{} Provider not available: {} (registered: {})", LOG_PREFIX, provider,
                            providerRegistry.list());
                    return new ProviderUnavailableException(provider);
                });
    }

    private LlmRequest withDefaults(LlmRequest request, LlmProviderPort<?, ?, ?> adapter) {
        if (request.getModel() != null && !request.getModel().isBlank()) {
            return request;
        }
        boolean usingDefaultProvider = adapter.getProviderId().equals(properties.getDefaultProvider());
        String model = usingDefaultProvider && properties.getDefaultModel() != null
                ? properties.getDefaultModel()
                : adapter.getDefaultModel();
        return request.toBuilder().model(model).build();
    }

    private static <Q, R, C> LlmResponse completeWith(LlmProviderPort<Q, R, C> adapter, LlmRequest request) {
        Q vendorRequest = adapter.normalizeRequest(request);
        R vendorResponse = adapter.complete(vendorRequest);
        return adapter.normalizeResponse(vendorResponse);
    }

    private static <Q, R, C> Flux<LlmChunk> streamWith(LlmProviderPort<Q, R, C> adapter, LlmRequest request) {
        Q vendorRequest = adapter.normalizeRequest(request);
        return adapter.stream(vendorRequest).map(adapter::normalizeChunk);
    }

    private static CostTrackingPort.UsageEvent usageEvent(String provider, LlmRequest request, LlmUsage usage) {
        return new CostTrackingPort.UsageEvent(provider, request.getModel(), usage, request.getUserId(),
                request.getProjectId(), request.getSessionId());
    }
}
