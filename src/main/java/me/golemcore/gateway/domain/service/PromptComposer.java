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

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.domain.model.DocumentContext;
import me.golemcore.gateway.domain.model.LlmRequest;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.MessageHistory;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds backend requests for conversation turns and quick edits.
 *
 * <p>
 * The system prompt is assembled from, in order: the configured base prompt,
 * the skills prompt, usage instructions for peer tools, the selected text and
 * the document content cut to {@code gateway.agent.document-context-max-chars}.
 */
@Component
@RequiredArgsConstructor
public class PromptComposer {

    static final String TRUNCATION_MARKER = "\n... (truncated)";

    static final String QUICK_EDIT_PROMPT = """
            You are a LaTeX editing assistant specialized in scientific writing.

            IMPORTANT RULES:
            1. Return ONLY the modified text - no explanations, no markdown code blocks
            2. Preserve the original formatting and style unless asked to change it
            3. Keep the same level of technical detail
            4. Maintain any LaTeX commands and environments
            5. Be concise and direct in your modifications
            """;

    private final GatewayProperties properties;

    public String systemPrompt(DocumentContext context, List<ToolDefinition> peerTools) {
        GatewayProperties.AgentProperties agent = properties.getAgent();
        StringBuilder prompt = new StringBuilder(agent.getSystemPrompt() != null ? agent.getSystemPrompt() : "");

        if (agent.getSkillsPrompt() != null && !agent.getSkillsPrompt().isBlank()) {
            prompt.append("\n\n").append(agent.getSkillsPrompt().strip());
        }

        if (peerTools != null && !peerTools.isEmpty()) {
            prompt.append("\n\n## Available Tools\n\nYou can call these tools; prefer them over answering from memory "
                    + "when a task needs domain-specific knowledge:\n");
            for (ToolDefinition tool : peerTools) {
                prompt.append("- ").append(tool.getName());
                if (tool.getDescription() != null && !tool.getDescription().isBlank()) {
                    prompt.append(": ").append(firstLine(tool.getDescription()));
                }
                prompt.append('\n');
            }
        }

        if (context != null && context.getSelection() != null && context.getSelection().getText() != null) {
            DocumentContext.Selection selection = context.getSelection();
            prompt.append("\n\n## Current Document Context\n\n")
                    .append("**File:** ").append(context.getDocName() != null ? context.getDocName() : "Unknown")
                    .append("\n**Selected text (lines ").append(selection.getStartLine()).append('-')
                    .append(selection.getEndLine()).append("):**\n```latex\n")
                    .append(selection.getText())
                    .append("\n```\n\nWhen editing this selection, provide the improved LaTeX code directly.");
        }

        if (context != null && context.getDocContent() != null && !context.getDocContent().isEmpty()) {
            prompt.append("\n\n## Full Document Content (truncated)\n\n```latex\n")
                    .append(truncate(context.getDocContent(), agent.getDocumentContextMaxChars()))
                    .append("\n```");
        }
        return prompt.toString();
    }

    /**
     * Request for the next backend call of a turn: system prompt followed by
     * the recent history of the session.
     */
    public LlmRequest turnRequest(List<Message> sessionMessages, String systemPrompt, String provider,
            String model, List<ToolDefinition> tools) {
        GatewayProperties.AgentProperties agent = properties.getAgent();
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(systemPrompt));
        messages.addAll(MessageHistory.recent(sessionMessages, agent.getHistoryLimit()));
        return LlmRequest.builder()
                .provider(provider)
                .model(model)
                .messages(messages)
                .tools(tools != null && !tools.isEmpty() ? tools : null)
                .maxTokens(agent.getMaxTokens())
                .temperature(agent.getTemperature())
                .build();
    }

    public LlmRequest quickEditRequest(String instruction, String selectedText) {
        GatewayProperties.QuickEditProperties quickEdit = properties.getAgent().getQuickEdit();
        String system = QUICK_EDIT_PROMPT + "\n" + (selectedText != null && !selectedText.isEmpty()
                ? "The user has selected the following text to modify:\n---\n" + selectedText + "\n---"
                : "No text was selected. Generate new content based on the prompt.");
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(system));
        messages.add(Message.builder().role(Message.ROLE_USER).content(instruction).build());
        return LlmRequest.builder()
                .provider(quickEdit.getProvider())
                .model(quickEdit.getModel())
                .messages(messages)
                .maxTokens(quickEdit.getMaxTokens())
                .temperature(quickEdit.getTemperature())
                .build();
    }

    static String truncate(String text, int maxChars) {
        if (maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + TRUNCATION_MARKER;
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline < 0 ? text.strip() : text.substring(0, newline).strip();
    }
}
