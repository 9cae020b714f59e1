package me.golemcore.gateway.tools;

import me.golemcore.gateway.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class GetDocumentSelectionToolTest {

    private final GetDocumentSelectionTool tool = new GetDocumentSelectionTool();

    @Test
    void shouldPointModelToDocumentContext() {
        ToolResult result = tool.execute(Map.of()).join();

        assertFalse(result.isError());
        assertEquals(GetDocumentSelectionTool.ANSWER, result.getContent());
        assertEquals("get_document_selection", tool.getDefinition().getName());
    }
}
