package me.golemcore.gateway.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class McpToolPeerTest {

    private static final ToolDefinition READ_SKILL = ToolDefinition.builder()
            .name("read_skill")
            .description("Read a skill")
            .inputSchema(ToolDefinition.emptySchema())
            .build();

    private GatewayProperties properties;
    private McpClient client;
    private McpToolPeer peer;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        client = mock(McpClient.class);
        peer = new McpToolPeer(properties, new ObjectMapper()) {
            @Override
            McpClient createClient(GatewayProperties.McpProperties mcp) {
                return client;
            }
        };
    }

    @Test
    void shouldStayDisconnectedWhenDisabled() throws Exception {
        peer.connect();

        assertFalse(peer.isConnected());
        assertTrue(peer.listTools().isEmpty());
        verify(client, never()).start();

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> peer.callTool("read_skill", Map.of()).get());
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void shouldExposeToolsOnceStarted() throws Exception {
        properties.getMcp().setEnabled(true);
        when(client.start()).thenReturn(List.of(READ_SKILL));
        when(client.isRunning()).thenReturn(true);
        when(client.getCachedTools()).thenReturn(List.of(READ_SKILL));

        peer.connect();

        assertTrue(peer.isConnected());
        assertTrue(peer.hasTool("read_skill"));
        assertFalse(peer.hasTool("write_skill"));
        assertEquals(List.of(READ_SKILL), peer.listTools());
    }

    @Test
    void shouldDelegateToolCalls() throws Exception {
        properties.getMcp().setEnabled(true);
        when(client.isRunning()).thenReturn(true);
        when(client.callTool("read_skill", Map.of("name", "latex")))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("# LaTeX skill")));

        peer.connect();

        assertEquals("# LaTeX skill", peer.callTool("read_skill", Map.of("name", "latex")).get().getContent());
    }

    @Test
    void shouldStayDisconnectedWhenStartFails() throws Exception {
        properties.getMcp().setEnabled(true);
        when(client.start()).thenThrow(new IOException("uvx not found"));

        peer.connect();

        assertFalse(peer.isConnected());
        assertTrue(peer.listTools().isEmpty());
    }

    @Test
    void shouldReportDisconnectedWhenProcessDies() throws Exception {
        properties.getMcp().setEnabled(true);
        when(client.isRunning()).thenReturn(false);

        peer.connect();

        assertFalse(peer.isConnected());
    }

    @Test
    void shouldCloseClientOnShutdown() throws Exception {
        properties.getMcp().setEnabled(true);
        when(client.isRunning()).thenReturn(true);
        peer.connect();

        peer.shutdown();

        verify(client).close();
        assertFalse(peer.isConnected());
    }
}
