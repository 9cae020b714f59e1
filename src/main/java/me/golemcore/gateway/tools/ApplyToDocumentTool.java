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

package me.golemcore.gateway.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.domain.component.ToolComponent;
import me.golemcore.gateway.domain.exception.ToolExecutionException;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Queues an edit for the editor client.
 *
 * <p>
 * The gateway has no access to the document itself, so the tool only echoes
 * the requested change back as JSON; the client applies it when it renders the
 * tool result. Modes: {@code replace} (default), {@code insert},
 * {@code append}.
 */
@Component
@RequiredArgsConstructor
public class ApplyToDocumentTool implements ToolComponent {

    static final String NAME = "apply_to_document";
    private static final String DEFAULT_MODE = "replace";
    private static final Set<String> MODES = Set.of("replace", "insert", "append");

    private final ObjectMapper objectMapper;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Apply generated LaTeX content to the current document. "
                        + "Use this when the user asks to insert, replace or append text.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "content", Map.of(
                                        "type", "string",
                                        "description", "The LaTeX content to apply"),
                                "mode", Map.of(
                                        "type", "string",
                                        "enum", List.of("replace", "insert", "append"),
                                        "description", "How to apply the content. Default is replace.")),
                        "required", List.of("content")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object content = parameters.get("content");
            if (!(content instanceof String text)) {
                return ToolResult.failure("Missing required parameter: content");
            }
            Object requestedMode = parameters.get("mode");
            String mode = requestedMode instanceof String value && !value.isBlank() ? value : DEFAULT_MODE;
            if (!MODES.contains(mode)) {
                return ToolResult.failure("Unsupported mode: " + mode);
            }

            Map<String, Object> action = new LinkedHashMap<>();
            action.put("action", "apply");
            action.put("content", text);
            action.put("mode", mode);
            action.put("queued", true);
            try {
                return ToolResult.success(objectMapper.writeValueAsString(action));
            } catch (JsonProcessingException e) {
                throw new ToolExecutionException("Failed to encode document action", e);
            }
        });
    }
}
