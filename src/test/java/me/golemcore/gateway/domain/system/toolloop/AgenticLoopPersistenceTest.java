package me.golemcore.gateway.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.gateway.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.gateway.domain.component.ToolComponent;
import me.golemcore.gateway.domain.model.ChatSession;
import me.golemcore.gateway.domain.model.LlmRequest;
import me.golemcore.gateway.domain.model.LlmResponse;
import me.golemcore.gateway.domain.model.LlmUsage;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.StopReason;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.domain.model.UsageTotals;
import me.golemcore.gateway.domain.service.CompletionGateway;
import me.golemcore.gateway.domain.service.ConversationStore;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.LlmProviderPort;
import me.golemcore.gateway.port.outbound.ProviderRegistryPort;
import me.golemcore.gateway.port.outbound.ToolExecutionPeerPort;
import me.golemcore.gateway.routing.ModelRouter;
import me.golemcore.gateway.usage.CostTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tool round trip against a real conversation store on disk.
 */
class AgenticLoopPersistenceTest {

    private static final String USER = "user-1";
    private static final String PROVIDER = "anthropic";
    private static final String MODEL = "claude-sonnet-4";

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private GatewayProperties properties;
    private LocalStorageAdapter storage;
    private CostTracker costTracker;
    private ConversationStore store;
    private LlmProviderPort<Object, Object, Object> backend;
    private AgenticLoopController controller;
    private final AtomicInteger searches = new AtomicInteger();

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new GatewayProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        costTracker = new CostTracker(properties, clock);
        store = new ConversationStore(storage, objectMapper, properties, costTracker, clock);
        store.loadSessions();

        backend = mock(LlmProviderPort.class);
        when(backend.getProviderId()).thenReturn(PROVIDER);
        when(backend.normalizeRequest(any())).thenAnswer(inv -> inv.getArgument(0));
        when(backend.normalizeResponse(any())).thenAnswer(inv -> inv.getArgument(0));
        ProviderRegistryPort registry = mock(ProviderRegistryPort.class);
        when(registry.get(PROVIDER)).thenReturn(Optional.of(backend));
        CompletionGateway gateway = new CompletionGateway(registry, costTracker, new ModelRouter(), properties,
                clock);

        ToolExecutionPeerPort peer = mock(ToolExecutionPeerPort.class);
        when(peer.listTools()).thenReturn(List.of());
        LocalToolRegistry tools = new LocalToolRegistry(List.of(new SearchTool()), properties);
        controller = new AgenticLoopController(gateway, store, new ToolDispatcher(tools, peer), 10);
    }

    private AgenticLoopRequest loopRequest(String sessionId) {
        return AgenticLoopRequest.builder()
                .sessionId(sessionId)
                .requests(() -> LlmRequest.builder()
                        .provider(PROVIDER)
                        .model(MODEL)
                        .messages(store.getMessages(sessionId))
                        .userId(USER)
                        .sessionId(sessionId)
                        .build())
                .build();
    }

    // ===== tool round trip =====

    @Test
    void shouldPersistFullToolExchangeAndKeepCostsReproducible() {
        when(backend.complete(any())).thenReturn(
                LlmResponse.builder()
                        .content("")
                        .model("claude-sonnet-4-20250514")
                        .stopReason(StopReason.TOOL_USE)
                        .toolCalls(List.of(new Message.ToolCall("toolu_1", "search", Map.of("query", "bert"))))
                        .usage(LlmUsage.of(1200, 40))
                        .build(),
                LlmResponse.builder()
                        .content("I found 3 results.")
                        .model("claude-sonnet-4-20250514")
                        .stopReason(StopReason.END_TURN)
                        .usage(LlmUsage.of(1300, 25))
                        .build());
        ChatSession session = store.getOrCreateSession("proj-1", USER, null);
        store.addUserMessage(session.getId(), "find papers on bert", null);

        AgenticLoopResult result = controller.run(loopRequest(session.getId()));

        assertEquals("I found 3 results.", result.finalResponse().getContent());
        assertFalse(result.requiresToolResults());
        assertEquals(1, searches.get());

        List<Message> messages = store.getMessages(session.getId());
        assertEquals(4, messages.size());
        assertEquals(Message.ROLE_USER, messages.get(0).getRole());
        assertEquals("toolu_1", messages.get(1).getToolCalls().get(0).getId());
        assertEquals("3 results", messages.get(2).getContent());
        assertEquals("I found 3 results.", messages.get(3).getContent());
        assertEquals(MODEL, messages.get(3).getMetadata().getModel());

        ChatSession stored = store.getSession(session.getId(), USER).orElseThrow();
        assertEquals(4, stored.getMessageCount());
        assertEquals(1, stored.getToolCallCount());

        UsageTotals live = costTracker.getSessionTotals(session.getId());
        UsageTotals recomputed = costTracker.recompute(messages);
        assertEquals(2, live.getRequestCount());
        assertEquals(live.getRequestCount(), recomputed.getRequestCount());
        assertEquals(live.getTokensInput(), recomputed.getTokensInput());
        assertEquals(live.getTokensOutput(), recomputed.getTokensOutput());
        assertEquals(live.getCostUsd(), recomputed.getCostUsd(), 1e-9);
        assertEquals(live.getCostUsd(), stored.getTotalCostUsd(), 1e-9);
    }

    @Test
    void shouldRecomputeSameCostAfterReloadingFromDisk() {
        when(backend.complete(any())).thenReturn(
                LlmResponse.builder()
                        .content("")
                        .stopReason(StopReason.TOOL_USE)
                        .toolCalls(List.of(new Message.ToolCall("toolu_1", "search", Map.of("query", "bert"))))
                        .usage(LlmUsage.of(500, 50))
                        .build(),
                LlmResponse.builder().content("done").usage(LlmUsage.of(600, 60)).build());
        ChatSession session = store.getOrCreateSession("proj-1", USER, null);
        store.addUserMessage(session.getId(), "find papers on bert", null);
        controller.run(loopRequest(session.getId()));
        double liveCost = costTracker.getSessionTotals(session.getId()).getCostUsd();

        ConversationStore reloaded = new ConversationStore(storage, objectMapper, properties,
                new CostTracker(properties, clock), clock);
        reloaded.loadSessions();

        assertEquals(liveCost, costTracker.recompute(reloaded.getMessages(session.getId())).getCostUsd(), 1e-9);
        assertEquals(liveCost, reloaded.getSession(session.getId(), USER).orElseThrow().getTotalCostUsd(), 1e-9);
    }

    private final class SearchTool implements ToolComponent {

        @Override
        public ToolDefinition getDefinition() {
            return ToolDefinition.builder().name("search").description("Searches papers")
                    .inputSchema(ToolDefinition.emptySchema()).build();
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
            searches.incrementAndGet();
            return CompletableFuture.completedFuture(ToolResult.success("3 results"));
        }
    }
}
