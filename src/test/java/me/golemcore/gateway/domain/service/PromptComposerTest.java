package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.DocumentContext;
import me.golemcore.gateway.domain.model.LlmRequest;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromptComposerTest {

    private GatewayProperties properties;
    private PromptComposer composer;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getAgent().setSystemPrompt("You help with LaTeX.");
        composer = new PromptComposer(properties);
    }

    private static Message user(String content) {
        return Message.builder().role(Message.ROLE_USER).content(content).build();
    }

    // ===== system prompt =====

    @Test
    void shouldReturnBasePromptWithoutContext() {
        assertEquals("You help with LaTeX.", composer.systemPrompt(null, List.of()));
    }

    @Test
    void shouldAppendSkillsPromptAndPeerTools() {
        properties.getAgent().setSkillsPrompt("  Skills are available.  ");
        List<ToolDefinition> tools = List.of(
                ToolDefinition.builder().name("search_skills").description("Search skills\nLong details").build(),
                ToolDefinition.builder().name("list_skills").build());

        String prompt = composer.systemPrompt(null, tools);

        assertTrue(prompt.startsWith("You help with LaTeX.\n\nSkills are available.\n\n## Available Tools"));
        assertTrue(prompt.contains("- search_skills: Search skills\n"));
        assertFalse(prompt.contains("Long details"));
        assertTrue(prompt.contains("- list_skills\n"));
    }

    @Test
    void shouldDescribeSelection() {
        DocumentContext context = DocumentContext.builder()
                .selection(DocumentContext.Selection.builder().startLine(3).endLine(5).text("\\section{Intro}").build())
                .build();

        String prompt = composer.systemPrompt(context, null);

        assertTrue(prompt.contains("**File:** Unknown"));
        assertTrue(prompt.contains("**Selected text (lines 3-5):**\n```latex\n\\section{Intro}\n```"));
    }

    @Test
    void shouldTruncateDocumentContent() {
        properties.getAgent().setDocumentContextMaxChars(10);
        DocumentContext context = DocumentContext.builder()
                .docName("main.tex")
                .docContent("0123456789abcdef")
                .build();

        String prompt = composer.systemPrompt(context, null);

        assertTrue(prompt.contains("```latex\n0123456789\n... (truncated)\n```"));
        assertFalse(prompt.contains("abcdef"));
    }

    @Test
    void shouldKeepShortDocumentsWhole() {
        assertEquals("short", PromptComposer.truncate("short", 10));
        assertEquals("anything", PromptComposer.truncate("anything", 0));
    }

    // ===== turn request =====

    @Test
    void shouldPrependSystemPromptToRecentHistory() {
        properties.getAgent().setHistoryLimit(2);
        properties.getAgent().setMaxTokens(1000);
        List<Message> history = new ArrayList<>(List.of(user("one"), user("two"), user("three")));

        LlmRequest request = composer.turnRequest(history, "SYS", "deepseek", "deepseek-chat", List.of());

        assertEquals(3, request.getMessages().size());
        assertEquals(Message.ROLE_SYSTEM, request.getMessages().get(0).getRole());
        assertEquals("SYS", request.getMessages().get(0).getContent());
        assertEquals("two", request.getMessages().get(1).getContent());
        assertEquals("three", request.getMessages().get(2).getContent());
        assertEquals("deepseek", request.getProvider());
        assertEquals(1000, request.getMaxTokens());
        assertNull(request.getTools());
    }

    @Test
    void shouldPassToolsThrough() {
        List<ToolDefinition> tools = List.of(ToolDefinition.builder().name("apply_to_document").build());

        LlmRequest request = composer.turnRequest(List.of(), "SYS", "anthropic", "claude-3-5-haiku", tools);

        assertEquals(tools, request.getTools());
    }

    // ===== quick edit =====

    @Test
    void shouldBuildQuickEditRequestFromConfig() {
        properties.getAgent().getQuickEdit().setModel("deepseek-coder");

        LlmRequest request = composer.quickEditRequest("Make it formal", "it's fine");

        assertEquals("deepseek", request.getProvider());
        assertEquals("deepseek-coder", request.getModel());
        assertEquals(0.3, request.getTemperature());
        assertEquals(2048, request.getMaxTokens());
        assertTrue(request.getMessages().get(0).getContent().contains("---\nit's fine\n---"));
        assertEquals("Make it formal", request.getMessages().get(1).getContent());
    }

    @Test
    void shouldAskForNewContentWithoutSelection() {
        LlmRequest request = composer.quickEditRequest("Write an abstract", "");

        assertTrue(request.getMessages().get(0).getContent()
                .endsWith("No text was selected. Generate new content based on the prompt."));
    }
}
