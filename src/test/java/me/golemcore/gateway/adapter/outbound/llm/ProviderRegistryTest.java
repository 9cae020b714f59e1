package me.golemcore.gateway.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.domain.exception.ProviderConfigurationException;
import me.golemcore.gateway.domain.model.ProviderHealth;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.http.FeignClientFactory;
import me.golemcore.gateway.port.outbound.LlmProviderPort;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProviderRegistryTest {

    private GatewayProperties properties;
    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getProviders().setCheckHealthOnStartup(false);
        OkHttpClient http = new OkHttpClient();
        ObjectMapper objectMapper = new ObjectMapper();
        registry = new ProviderRegistry(properties, new FeignClientFactory(http, objectMapper), http, objectMapper);
    }

    @SuppressWarnings("unchecked")
    private static LlmProviderPort<Object, Object, Object> adapter(String id) {
        LlmProviderPort<Object, Object, Object> adapter = mock(LlmProviderPort.class);
        when(adapter.getProviderId()).thenReturn(id);
        return adapter;
    }

    // ===== init =====

    @Test
    void shouldRegisterOnlyConfiguredProviders() {
        properties.getProviders().getDeepseek().setApiKey("sk-test");

        registry.init();

        assertEquals(List.of("deepseek"), registry.list());
        assertTrue(registry.hasProvider("deepseek"));
        assertFalse(registry.hasProvider("anthropic"));
        assertFalse(registry.hasProvider("ollama"));
    }

    @Test
    void shouldFailStartupWhenNothingIsConfigured() {
        IllegalStateException error = assertThrows(IllegalStateException.class, registry::init);
        assertTrue(error.getMessage().startsWith("No LLM providers configured"));
    }

    @Test
    void shouldListProvidersSorted() {
        properties.getProviders().getDeepseek().setApiKey("sk-test");
        properties.getProviders().getAnthropic().setApiKey("sk-ant");

        registry.init();

        assertEquals(List.of("anthropic", "deepseek"), registry.list());
    }

    // ===== register / get / remove =====

    @Test
    void shouldInitializeAdapterOnRegister() {
        LlmProviderPort<Object, Object, Object> custom = adapter("custom");

        registry.register(custom);

        verify(custom).initialize();
        assertSame(custom, registry.get("custom").orElseThrow());
    }

    @Test
    void shouldNotRegisterAdapterThatFailsToInitialize() {
        LlmProviderPort<Object, Object, Object> broken = adapter("broken");
        doThrow(new ProviderConfigurationException("missing key")).when(broken).initialize();

        assertThrows(ProviderConfigurationException.class, () -> registry.register(broken));
        assertTrue(registry.get("broken").isEmpty());
    }

    @Test
    void shouldReplaceAdapterWithSameId() {
        LlmProviderPort<Object, Object, Object> first = adapter("custom");
        LlmProviderPort<Object, Object, Object> second = adapter("custom");

        registry.register(first);
        registry.register(second);

        assertSame(second, registry.get("custom").orElseThrow());
        assertEquals(1, registry.list().size());
    }

    @Test
    void shouldHandleNullAndUnknownLookups() {
        assertTrue(registry.get(null).isEmpty());
        assertTrue(registry.get("nope").isEmpty());
        assertFalse(registry.hasProvider(null));
        assertFalse(registry.remove(null));
        assertFalse(registry.remove("nope"));
    }

    @Test
    void shouldRemoveRegisteredAdapter() {
        registry.register(adapter("custom"));

        assertTrue(registry.remove("custom"));
        assertFalse(registry.hasProvider("custom"));
    }

    // ===== health =====

    @Test
    void shouldReportHealthPerProviderAndContainFailures() {
        LlmProviderPort<Object, Object, Object> healthy = adapter("alpha");
        when(healthy.healthCheck()).thenReturn(ProviderHealth.healthy(3));
        LlmProviderPort<Object, Object, Object> failing = adapter("beta");
        when(failing.healthCheck()).thenThrow(new IllegalStateException("socket closed"));
        registry.register(healthy);
        registry.register(failing);

        Map<String, ProviderHealth> status = registry.getHealthStatus();

        assertTrue(status.get("alpha").isHealthy());
        assertEquals(3, status.get("alpha").getModelsAvailable());
        assertFalse(status.get("beta").isHealthy());
        assertEquals("socket closed", status.get("beta").getError());
    }
}
