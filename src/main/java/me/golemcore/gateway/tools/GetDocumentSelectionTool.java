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

import me.golemcore.gateway.domain.component.ToolComponent;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Answers selection requests with a pointer to the prompt: the selection the
 * client sent with the turn is already part of the system prompt.
 */
@Component
public class GetDocumentSelectionTool implements ToolComponent {

    static final String NAME = "get_document_selection";
    static final String ANSWER = "The current selection is included in the document context of the system prompt. "
            + "Use that context directly.";

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the currently selected text in the document.")
                .inputSchema(ToolDefinition.emptySchema())
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.completedFuture(ToolResult.success(ANSWER));
    }
}
