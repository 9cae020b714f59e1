package me.golemcore.gateway.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageHistoryTest {

    private static Message user(String content) {
        return Message.builder().role(Message.ROLE_USER).content(content).build();
    }

    private static Message assistantWithCalls(String... callIds) {
        List<Message.ToolCall> calls = new ArrayList<>();
        for (String id : callIds) {
            calls.add(new Message.ToolCall(id, "search", Map.of()));
        }
        return Message.builder().role(Message.ROLE_ASSISTANT).content("").toolCalls(calls).build();
    }

    private static Message toolResult(String callId) {
        return Message.builder().role(Message.ROLE_TOOL).toolCallId(callId).toolName("search").content("r")
                .build();
    }

    // ===== recent =====

    @Test
    void shouldReturnEverythingWhenUnderLimit() {
        List<Message> messages = List.of(user("a"), user("b"));

        assertEquals(messages, MessageHistory.recent(messages, 5));
    }

    @Test
    void shouldReturnEmptyForNonPositiveLimitOrNoMessages() {
        assertTrue(MessageHistory.recent(List.of(user("a")), 0).isEmpty());
        assertTrue(MessageHistory.recent(null, 3).isEmpty());
    }

    @Test
    void shouldExtendWindowBackToRequestingAssistant() {
        Message assistant = assistantWithCalls("c1", "c2");
        List<Message> messages = List.of(user("q1"), user("q2"), assistant, toolResult("c1"), toolResult("c2"));

        List<Message> window = MessageHistory.recent(messages, 2);

        assertEquals(3, window.size());
        assertEquals(assistant, window.get(0));
    }

    @Test
    void shouldKeepPlainCutWhenNotSplittingToolExchange() {
        List<Message> messages = List.of(user("1"), user("2"), user("3"), user("4"));

        List<Message> window = MessageHistory.recent(messages, 2);

        assertEquals(List.of(user("3"), user("4")), window);
    }

    @Test
    void shouldDropToolResultsWhoseCallIsOutsideWindow() {
        List<Message> messages = List.of(user("x"), toolResult("orphan"), user("a"));

        List<Message> window = MessageHistory.recent(messages, 2);

        assertEquals(List.of(user("x"), user("a")), window);
    }

    @Test
    void shouldKeepAssistantWithUnansweredCallsInWindow() {
        Message pendingAssistant = assistantWithCalls("c1");
        Message laterAssistant = Message.builder().role(Message.ROLE_ASSISTANT).content("a2").build();
        List<Message> messages = List.of(user("u1"), pendingAssistant, user("u2"), laterAssistant, user("u3"));

        List<Message> window = MessageHistory.recent(messages, 2);

        assertEquals(List.of(pendingAssistant, messages.get(2), laterAssistant, messages.get(4)), window);
    }

    @Test
    void shouldNotExtendWindowForAnsweredCalls() {
        List<Message> messages = List.of(user("u1"), assistantWithCalls("c1"), toolResult("c1"), user("u2"),
                user("u3"));

        assertEquals(List.of(messages.get(3), messages.get(4)), MessageHistory.recent(messages, 2));
    }

    // ===== pendingToolCallIds =====

    @Test
    void shouldListUnansweredCallsInOrder() {
        List<Message> messages = List.of(user("q"), assistantWithCalls("c1", "c2", "c3"), toolResult("c2"));

        assertEquals(List.of("c1", "c3"), MessageHistory.pendingToolCallIds(messages));
    }

    @Test
    void shouldReportNothingPendingWhenAllAnswered() {
        List<Message> messages = List.of(assistantWithCalls("c1"), toolResult("c1"));

        assertTrue(MessageHistory.pendingToolCallIds(messages).isEmpty());
    }
}
