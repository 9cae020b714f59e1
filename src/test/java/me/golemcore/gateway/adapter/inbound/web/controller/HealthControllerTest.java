package me.golemcore.gateway.adapter.inbound.web.controller;

import me.golemcore.gateway.adapter.inbound.web.dto.HealthResponse;
import me.golemcore.gateway.domain.model.ProviderHealth;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.service.CompletionGateway;
import me.golemcore.gateway.port.outbound.ToolExecutionPeerPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthControllerTest {

    private CompletionGateway gateway;
    private ToolExecutionPeerPort peer;
    private HealthController controller;

    @BeforeEach
    void setUp() {
        gateway = mock(CompletionGateway.class);
        peer = mock(ToolExecutionPeerPort.class);
        controller = new HealthController(gateway, peer);
    }

    @Test
    void shouldReportOkWhenAnyProviderIsHealthy() {
        when(gateway.getHealthStatus()).thenReturn(Map.of(
                "deepseek", ProviderHealth.healthy(2),
                "ollama", ProviderHealth.unhealthy("connection refused")));
        when(peer.isConnected()).thenReturn(true);
        when(peer.listTools()).thenReturn(List.of(ToolDefinition.builder().name("read_skill").build()));

        StepVerifier.create(controller.health())
                .assertNext(response -> {
                    HealthResponse health = response.getBody();
                    assertEquals("ok", health.getStatus());
                    assertTrue(health.isMcpConnected());
                    assertEquals(1, health.getMcpTools());
                })
                .verifyComplete();
    }

    @Test
    void shouldReportDegradedWhenNoProviderAnswers() {
        when(gateway.getHealthStatus()).thenReturn(Map.of("deepseek", ProviderHealth.unhealthy("401")));
        when(peer.listTools()).thenReturn(List.of());

        StepVerifier.create(controller.health())
                .assertNext(response -> {
                    assertEquals("degraded", response.getBody().getStatus());
                    assertFalse(response.getBody().isMcpConnected());
                })
                .verifyComplete();
    }
}
