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

package me.golemcore.gateway.adapter.outbound.llm;

import me.golemcore.gateway.domain.exception.ProviderConfigurationException;
import me.golemcore.gateway.domain.model.ProviderHealth;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.http.FeignClientFactory;
import me.golemcore.gateway.port.outbound.LlmProviderPort;
import me.golemcore.gateway.port.outbound.ProviderRegistryPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the provider adapters that initialized successfully.
 *
 * <p>
 * Candidates are built from configuration in {@link #init()}. A candidate
 * whose credentials are missing throws {@link ProviderConfigurationException}
 * from {@code initialize()} and is left out. Startup fails when no provider is
 * usable at all.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProviderRegistry implements ProviderRegistryPort {

    private final GatewayProperties properties;
    private final FeignClientFactory feignClientFactory;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    private final Map<String, LlmProviderPort<?, ?, ?>> adapters = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (LlmProviderPort<?, ?, ?> candidate : createCandidates()) {
            try {
                register(candidate);
            } catch (ProviderConfigurationException e) {
                log.info("[Registry] Skipping {}: {}", candidate.getProviderId(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("[Registry] Failed to initialize {}: {}", candidate.getProviderId(), e.getMessage());
            }
        }

        if (adapters.isEmpty()) {
            throw new IllegalStateException(
                    "No LLM providers configured. Set an API key for anthropic or deepseek, or enable ollama.");
        }
        log.info("[Registry] Available providers: {}", list());

        if (properties.getProviders().isCheckHealthOnStartup()) {
            getHealthStatus().forEach((provider, health) -> {
                if (health.isHealthy()) {
                    log.info("[Registry] {} healthy, {} models", provider, health.getModelsAvailable());
                } else {
                    log.warn("[Registry] {} unhealthy: {}", provider, health.getError());
                }
            });
        }
    }

    List<LlmProviderPort<?, ?, ?>> createCandidates() {
        GatewayProperties.ProvidersProperties providers = properties.getProviders();
        List<LlmProviderPort<?, ?, ?>> candidates = new ArrayList<>();
        candidates.add(new AnthropicAdapter(providers.getAnthropic(), feignClientFactory, okHttpClient,
                objectMapper));
        candidates.add(new DeepSeekAdapter(providers.getDeepseek(), feignClientFactory, okHttpClient,
                objectMapper));
        candidates.add(new OllamaAdapter(providers.getOllama(), feignClientFactory, okHttpClient, objectMapper));
        return candidates;
    }

    @Override
    public Optional<LlmProviderPort<?, ?, ?>> get(String provider) {
        if (provider == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(adapters.get(provider));
    }

    @Override
    public List<String> list() {
        return adapters.keySet().stream().sorted().toList();
    }

    @Override
    public boolean hasProvider(String provider) {
        return provider != null && adapters.containsKey(provider);
    }

    /**
     * Initializes the adapter and makes it available. Replaces any adapter
     * with the same id.
     */
    @Override
    public void register(LlmProviderPort<?, ?, ?> adapter) {
        adapter.initialize();
        LlmProviderPort<?, ?, ?> previous = adapters.put(adapter.getProviderId(), adapter);
        if (previous != null) {
            log.info("[Registry] Replaced provider: {}", adapter.getProviderId());
        } else {
            log.info("[Registry] Registered provider: {}", adapter.getProviderId());
        }
    }

    @Override
    public boolean remove(String provider) {
        return provider != null && adapters.remove(provider) != null;
    }

    @Override
    public Map<String, ProviderHealth> getHealthStatus() {
        Map<String, ProviderHealth> status = new LinkedHashMap<>();
        for (String provider : list()) {
            LlmProviderPort<?, ?, ?> adapter = adapters.get(provider);
            try {
                status.put(provider, adapter.healthCheck());
            } catch (RuntimeException e) {
                status.put(provider, ProviderHealth.unhealthy(e.getMessage()));
            }
        }
        return status;
    }
}
