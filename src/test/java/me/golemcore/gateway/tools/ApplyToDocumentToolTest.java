package me.golemcore.gateway.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApplyToDocumentToolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ApplyToDocumentTool tool = new ApplyToDocumentTool(objectMapper);

    @Test
    void shouldDescribeContentAsRequired() {
        assertEquals("apply_to_document", tool.getToolName());
        assertEquals(List.of("content"), tool.getDefinition().getInputSchema().get("required"));
    }

    @Test
    void shouldQueueReplaceByDefault() throws Exception {
        ToolResult result = tool.execute(Map.of("content", "\\section{Intro}")).join();

        assertFalse(result.isError());
        JsonNode action = objectMapper.readTree(result.getContent());
        assertEquals("apply", action.get("action").asText());
        assertEquals("replace", action.get("mode").asText());
        assertEquals("\\section{Intro}", action.get("content").asText());
        assertTrue(action.get("queued").asBoolean());
    }

    @Test
    void shouldHonorAppendMode() throws Exception {
        ToolResult result = tool.execute(Map.of("content", "x", "mode", "append")).join();

        assertEquals("append", objectMapper.readTree(result.getContent()).get("mode").asText());
    }

    @Test
    void shouldFailWithoutContent() {
        ToolResult result = tool.execute(Map.of("mode", "insert")).join();

        assertTrue(result.isError());
        assertEquals("Missing required parameter: content", result.getContent());
    }

    @Test
    void shouldRejectUnknownMode() {
        ToolResult result = tool.execute(Map.of("content", "x", "mode", "overwrite")).join();

        assertTrue(result.isError());
        assertEquals("Unsupported mode: overwrite", result.getContent());
    }
}
