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
import me.golemcore.gateway.adapter.inbound.web.dto.HealthResponse;
import me.golemcore.gateway.domain.model.ProviderHealth;
import me.golemcore.gateway.domain.service.CompletionGateway;
import me.golemcore.gateway.port.outbound.ToolExecutionPeerPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

    private final CompletionGateway gateway;
    private final ToolExecutionPeerPort peer;

    /**
     * Reports {@code ok} when at least one provider answers its health check,
     * {@code degraded} otherwise.
     */
    @GetMapping
    public Mono<ResponseEntity<HealthResponse>> health() {
        return Mono.fromCallable(() -> {
            Map<String, ProviderHealth> providers = gateway.getHealthStatus();
            boolean anyHealthy = providers.values().stream().anyMatch(ProviderHealth::isHealthy);
            return HealthResponse.builder()
                    .status(anyHealthy ? "ok" : "degraded")
                    .providers(providers)
                    .mcpConnected(peer.isConnected())
                    .mcpTools(peer.listTools().size())
                    .build();
        }).subscribeOn(Schedulers.boundedElastic()).map(ResponseEntity::ok);
    }
}
