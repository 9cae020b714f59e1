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

package me.golemcore.gateway.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * One normalized streaming event. A stream carries any number of text and
 * tool-start chunks followed by exactly one chunk with {@code done=true}, which
 * holds the final usage, stop reason and every tool call assembled during the
 * stream.
 */
@Data
@Builder
public class LlmChunk {

    private String content;
    private boolean done;
    private LlmUsage usage;
    private Message.ToolCall toolCallStarted;
    private List<Message.ToolCall> toolCalls;
    private StopReason stopReason;

    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static LlmChunk text(String content) {
        return LlmChunk.builder().content(content).build();
    }
}
