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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Progress event of a streamed turn; {@code type} becomes the SSE event name.
 */
public record TurnEvent(String type, Map<String, Object> data) {

    public static final String TOKEN = "token";
    public static final String TOOL_USE = "tool_use";
    public static final String TOOL_START = "tool_start";
    public static final String TOOL_END = "tool_end";
    public static final String DONE = "done";
    public static final String ERROR = "error";

    public static TurnEvent token(String content) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("content", content);
        data.put("done", false);
        return new TurnEvent(TOKEN, data);
    }

    public static TurnEvent toolUse(List<Message.ToolCall> toolCalls) {
        return new TurnEvent(TOOL_USE, Map.of("tool_calls", toolCalls));
    }

    public static TurnEvent toolStart(Message.ToolCall toolCall) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tool_call_id", toolCall.getId());
        data.put("tool_name", toolCall.getName());
        data.put("input", toolCall.getInput() != null ? toolCall.getInput() : Map.of());
        return new TurnEvent(TOOL_START, data);
    }

    public static TurnEvent toolEnd(String toolCallId, String toolName, String content, boolean error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tool_call_id", toolCallId);
        data.put("tool_name", toolName);
        data.put("content", content);
        data.put("is_error", error);
        return new TurnEvent(TOOL_END, data);
    }

    public static TurnEvent done(Map<String, Object> data) {
        return new TurnEvent(DONE, data);
    }

    public static TurnEvent error(String error, String details) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", error);
        data.put("details", details != null ? details : "");
        return new TurnEvent(ERROR, data);
    }
}
