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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Context-window helpers over an ordered message log.
 */
public final class MessageHistory {

    private MessageHistory() {
    }

    /**
     * Returns roughly the last {@code limit} messages without splitting a
     * tool exchange. When the cut would land on tool results, it moves back to
     * the assistant message that requested them, so the window may be a few
     * messages longer than {@code limit}. An assistant message whose tool calls
     * are still unanswered is always kept, together with everything after it.
     * Tool results whose call is not in the window are dropped.
     */
    public static List<Message> recent(List<Message> messages, int limit) {
        if (messages == null || messages.isEmpty() || limit <= 0) {
            return new ArrayList<>();
        }
        if (messages.size() <= limit) {
            return new ArrayList<>(messages);
        }

        int start = messages.size() - limit;
        while (start > 0 && messages.get(start).isToolMessage()) {
            start--;
        }
        start = Math.min(start, earliestPendingRequest(messages));

        List<Message> window = new ArrayList<>(messages.size() - start);
        Set<String> knownCalls = new HashSet<>();
        for (Message message : messages.subList(start, messages.size())) {
            if (message.hasToolCalls()) {
                for (Message.ToolCall call : message.getToolCalls()) {
                    knownCalls.add(call.getId());
                }
            }
            if (message.isToolMessage() && !knownCalls.contains(message.getToolCallId())) {
                continue;
            }
            window.add(message);
        }
        return window;
    }

    private static int earliestPendingRequest(List<Message> messages) {
        Set<String> pending = new HashSet<>(pendingToolCallIds(messages));
        if (pending.isEmpty()) {
            return messages.size();
        }
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (message.hasToolCalls()
                    && message.getToolCalls().stream().anyMatch(call -> pending.contains(call.getId()))) {
                return i;
            }
        }
        return messages.size();
    }

    /**
     * Ids of tool calls that have no result yet, in request order.
     */
    public static List<String> pendingToolCallIds(List<Message> messages) {
        List<String> pending = new ArrayList<>();
        for (Message message : messages) {
            if (message.hasToolCalls()) {
                for (Message.ToolCall call : message.getToolCalls()) {
                    pending.add(call.getId());
                }
            } else if (message.isToolMessage()) {
                pending.remove(message.getToolCallId());
            }
        }
        return pending;
    }
}
