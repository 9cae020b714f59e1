package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.exception.MessageValidationException;
import me.golemcore.gateway.domain.exception.ProviderUnavailableException;
import me.golemcore.gateway.domain.exception.SessionNotFoundException;
import me.golemcore.gateway.domain.exception.UsageLimitExceededException;
import me.golemcore.gateway.domain.model.ChatSession;
import me.golemcore.gateway.domain.model.LimitCheck;
import me.golemcore.gateway.domain.model.LlmChunk;
import me.golemcore.gateway.domain.model.LlmRequest;
import me.golemcore.gateway.domain.model.LlmResponse;
import me.golemcore.gateway.domain.model.LlmUsage;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.ModelPreference;
import me.golemcore.gateway.domain.model.QuickEditResult;
import me.golemcore.gateway.domain.model.StopReason;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.domain.model.ToolResultSubmission;
import me.golemcore.gateway.domain.model.TurnEvent;
import me.golemcore.gateway.domain.model.TurnRequest;
import me.golemcore.gateway.domain.model.TurnResult;
import me.golemcore.gateway.domain.system.toolloop.AgenticLoopController;
import me.golemcore.gateway.domain.system.toolloop.AgenticLoopRequest;
import me.golemcore.gateway.domain.system.toolloop.AgenticLoopResult;
import me.golemcore.gateway.domain.system.toolloop.ToolDispatcher;
import me.golemcore.gateway.domain.system.toolloop.ToolExecutionOutcome;
import me.golemcore.gateway.domain.system.toolloop.ToolSource;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.ConversationPort;
import me.golemcore.gateway.port.outbound.CostTrackingPort;
import me.golemcore.gateway.port.outbound.ToolExecutionPeerPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CompletionServiceTest {

    private static final String PROJECT_ID = "proj-1";
    private static final String USER_ID = "user-1";
    private static final String SESSION_ID = "sess-1";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private CompletionGateway gateway;
    private ConversationPort conversations;
    private AgenticLoopController loop;
    private ToolDispatcher dispatcher;
    private ToolExecutionPeerPort peer;
    private CostTrackingPort costTracker;
    private GatewayProperties properties;
    private CompletionService service;
    private ChatSession session;

    @BeforeEach
    void setUp() {
        gateway = mock(CompletionGateway.class);
        conversations = mock(ConversationPort.class);
        loop = mock(AgenticLoopController.class);
        dispatcher = mock(ToolDispatcher.class);
        peer = mock(ToolExecutionPeerPort.class);
        costTracker = mock(CostTrackingPort.class);
        properties = new GatewayProperties();
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

        service = new CompletionService(gateway, conversations, loop, dispatcher, peer,
                new PromptComposer(properties), costTracker, properties, clock);

        session = ChatSession.builder().id(SESSION_ID).projectId(PROJECT_ID).userId(USER_ID).build();
        when(conversations.getOrCreateSession(eq(PROJECT_ID), eq(USER_ID), any())).thenReturn(session);
        when(conversations.getSession(SESSION_ID, USER_ID)).thenReturn(Optional.of(session));
        when(dispatcher.availableDefinitions()).thenReturn(List.of());
        when(peer.listTools()).thenReturn(List.of());
        when(gateway.resolve(any())).thenReturn(LlmRequest.builder()
                .provider("deepseek").model("deepseek-chat").build());
    }

    private static TurnRequest turn(String message) {
        return TurnRequest.builder()
                .projectId(PROJECT_ID)
                .userId(USER_ID)
                .message(message)
                .build();
    }

    private static AgenticLoopResult finished(String content, int iterations) {
        LlmResponse response = LlmResponse.builder().content(content).usage(LlmUsage.of(30, 10)).build();
        Message message = Message.builder().role(Message.ROLE_ASSISTANT).content(content).build();
        return new AgenticLoopResult(response, message, iterations, List.of(), List.of(), LlmUsage.of(30, 10),
                false, false);
    }

    private void stubUnansweredToolCall() {
        Message assistant = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content("")
                .toolCalls(List.of(new Message.ToolCall("call_1", "search", Map.of("query", "bert"))))
                .build();
        when(conversations.getMessages(SESSION_ID)).thenReturn(List.of(
                Message.builder().role(Message.ROLE_USER).content("find bert").build(), assistant));
    }

    // ===== sendMessage =====

    @Test
    void shouldPersistUserMessageAndRunLoop() {
        when(loop.run(any())).thenReturn(finished("Here is the table.", 1));

        TurnResult result = service.sendMessage(turn("Make a table"));

        verify(conversations).addUserMessage(SESSION_ID, "Make a table", null);
        verify(conversations).autoGenerateTitle(SESSION_ID, "Make a table");
        assertEquals(SESSION_ID, result.getSessionId());
        assertEquals("Here is the table.", result.getMessage().getContent());
        assertEquals(40, result.getUsage().getTotalTokens());
        assertFalse(result.isRequiresToolResults());
    }

    @Test
    void shouldNotRetitleOngoingSession() {
        session.setMessageCount(4);
        when(loop.run(any())).thenReturn(finished("ok", 1));

        service.sendMessage(turn("again"));

        verify(conversations, never()).autoGenerateTitle(anyString(), anyString());
    }

    @Test
    void shouldLeaveSessionUntouchedForUnknownProvider() {
        when(gateway.resolve(any())).thenThrow(new ProviderUnavailableException("ghost"));
        TurnRequest request = TurnRequest.builder()
                .projectId(PROJECT_ID).userId(USER_ID).message("hi").provider("ghost").build();

        ProviderUnavailableException error = assertThrows(ProviderUnavailableException.class,
                () -> service.sendMessage(request));

        assertEquals("Provider not available: ghost", error.getMessage());
        verify(conversations, never()).addUserMessage(anyString(), anyString(), any());
        verify(loop, never()).run(any());
    }

    @Test
    void shouldRejectBlankMessage() {
        assertThrows(MessageValidationException.class, () -> service.sendMessage(turn("   ")));
        verify(conversations, never()).getOrCreateSession(any(), any(), any());
    }

    @Test
    void shouldUseSessionPreferenceWhenTurnNamesNothing() {
        session.setModelPreference(new ModelPreference("anthropic", "claude-3-5-haiku"));
        when(loop.run(any())).thenReturn(finished("ok", 1));

        service.sendMessage(turn("hi"));

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(gateway).resolve(captor.capture());
        assertEquals("anthropic", captor.getValue().getProvider());
        assertEquals("claude-3-5-haiku", captor.getValue().getModel());
    }

    @Test
    void shouldIgnorePreferredModelOfAnotherProvider() {
        session.setModelPreference(new ModelPreference("anthropic", "claude-3-5-haiku"));
        when(loop.run(any())).thenReturn(finished("ok", 1));
        TurnRequest request = TurnRequest.builder()
                .projectId(PROJECT_ID).userId(USER_ID).message("hi").provider("deepseek").build();

        service.sendMessage(request);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(gateway).resolve(captor.capture());
        assertEquals("deepseek", captor.getValue().getProvider());
        assertNull(captor.getValue().getModel());
    }

    @Test
    void shouldBuildLoopRequestsFromStoredHistory() {
        when(conversations.getMessages(SESSION_ID)).thenReturn(List.of(
                Message.builder().role(Message.ROLE_USER).content("hi").build()));
        when(loop.run(any())).thenReturn(finished("ok", 1));

        service.sendMessage(turn("hi"));

        ArgumentCaptor<AgenticLoopRequest> captor = ArgumentCaptor.forClass(AgenticLoopRequest.class);
        verify(loop).run(captor.capture());
        LlmRequest next = captor.getValue().getRequests().get();
        assertEquals("deepseek", next.getProvider());
        assertEquals(SESSION_ID, next.getSessionId());
        assertEquals(USER_ID, next.getUserId());
        assertEquals(2, next.getMessages().size());
        assertEquals(Message.ROLE_SYSTEM, next.getMessages().get(0).getRole());
    }

    @Test
    void shouldRejectNewMessageWhileToolCallsAreUnanswered() {
        stubUnansweredToolCall();

        MessageValidationException error = assertThrows(MessageValidationException.class,
                () -> service.sendMessage(turn("never mind, something else")));

        assertEquals("Session has unanswered tool calls: [call_1]", error.getMessage());
        verify(conversations, never()).addUserMessage(anyString(), anyString(), any());
        verify(loop, never()).run(any());
    }

    @Test
    void shouldEnforceTierLimitsWhenEnabled() {
        properties.getLimits().setEnforce(true);
        when(costTracker.checkLimits(USER_ID, "free"))
                .thenReturn(LimitCheck.builder().withinLimits(false).tier("free").build());

        UsageLimitExceededException error = assertThrows(UsageLimitExceededException.class,
                () -> service.sendMessage(turn("hi")));

        assertEquals("free", error.getLimitCheck().getTier());
        verify(conversations, never()).addUserMessage(anyString(), anyString(), any());
    }

    // ===== tool results =====

    @Test
    void shouldRequireToolResults() {
        ToolResultSubmission submission = ToolResultSubmission.builder()
                .userId(USER_ID).sessionId(SESSION_ID).results(List.of()).build();

        assertThrows(MessageValidationException.class, () -> service.submitToolResults(submission));
    }

    @Test
    void shouldFailForUnknownSession() {
        when(conversations.getSession("missing", USER_ID)).thenReturn(Optional.empty());
        ToolResultSubmission submission = ToolResultSubmission.builder()
                .userId(USER_ID).sessionId("missing")
                .results(List.of(new ToolResultSubmission.Result("call_1", "apply_to_document", "ok", false)))
                .build();

        assertThrows(SessionNotFoundException.class, () -> service.submitToolResults(submission));
    }

    @Test
    void shouldWaitWhileCallsRemainUnanswered() {
        Message.ToolCall first = new Message.ToolCall("call_1", "apply_to_document", Map.of());
        Message.ToolCall second = new Message.ToolCall("call_2", "get_document_selection", Map.of());
        Message assistant = Message.builder().role(Message.ROLE_ASSISTANT).toolCalls(List.of(first, second)).build();
        Message answered = Message.builder().role(Message.ROLE_TOOL).toolCallId("call_1").content("ok").build();
        when(conversations.getMessages(SESSION_ID)).thenReturn(List.of(assistant, answered));

        TurnResult result = service.submitToolResults(ToolResultSubmission.builder()
                .userId(USER_ID).sessionId(SESSION_ID)
                .results(List.of(new ToolResultSubmission.Result("call_1", "apply_to_document", null, false)))
                .build());

        verify(conversations).addToolResultMessage(SESSION_ID, "call_1", "apply_to_document", "", false);
        verify(loop, never()).run(any());
        assertTrue(result.isRequiresToolResults());
        assertEquals(List.of(second), result.getToolCalls());
        assertSame(assistant, result.getMessage());
    }

    @Test
    void shouldContinueOnceAllCallsAnswered() {
        when(loop.run(any())).thenReturn(finished("Applied.", 2));

        TurnResult result = service.submitToolResults(ToolResultSubmission.builder()
                .userId(USER_ID).sessionId(SESSION_ID)
                .results(List.of(new ToolResultSubmission.Result("call_1", "apply_to_document", "done", false)))
                .build());

        assertEquals("Applied.", result.getMessage().getContent());
        assertEquals(2, result.getIterations());
    }

    // ===== streamTurn =====

    @Test
    void shouldStreamTokensAndPersistOnDone() {
        when(gateway.stream(any())).thenReturn(Flux.just(
                LlmChunk.text("Hel"),
                LlmChunk.text("lo"),
                LlmChunk.builder().done(true).usage(LlmUsage.of(7, 2)).stopReason(StopReason.END_TURN).build()));

        StepVerifier.create(service.streamTurn(turn("hi")))
                .assertNext(event -> assertEquals("Hel", event.data().get("content")))
                .assertNext(event -> assertEquals("lo", event.data().get("content")))
                .assertNext(event -> {
                    assertEquals(TurnEvent.DONE, event.type());
                    assertEquals("end_turn", event.data().get("stop_reason"));
                    assertEquals(SESSION_ID, event.data().get("session_id"));
                    assertEquals(false, event.data().get("has_tool_calls"));
                })
                .expectComplete()
                .verify(TIMEOUT);

        ArgumentCaptor<LlmResponse> captor = ArgumentCaptor.forClass(LlmResponse.class);
        verify(conversations).addAssistantMessage(eq(SESSION_ID), captor.capture());
        assertEquals("Hello", captor.getValue().getContent());
        assertEquals(9, captor.getValue().getUsage().getTotalTokens());
        verify(conversations, never()).addInterruptedAssistantMessage(anyString(), any());
    }

    @Test
    void shouldReportRequestedToolsWithoutRunningThem() {
        Message.ToolCall call = new Message.ToolCall("call_9", "apply_to_document", Map.of("content", "x"));
        when(gateway.stream(any())).thenReturn(Flux.just(LlmChunk.builder()
                .done(true).stopReason(StopReason.TOOL_USE).toolCalls(List.of(call)).build()));

        StepVerifier.create(service.streamTurn(turn("apply it")))
                .assertNext(event -> {
                    assertEquals(TurnEvent.TOOL_USE, event.type());
                    assertEquals(List.of(call), event.data().get("tool_calls"));
                })
                .assertNext(event -> assertEquals(true, event.data().get("has_tool_calls")))
                .expectComplete()
                .verify(TIMEOUT);

        verify(dispatcher, never()).execute(any());
    }

    @Test
    void shouldPersistPartialContentWhenStreamFails() {
        when(gateway.stream(any())).thenReturn(Flux.concat(
                Flux.just(LlmChunk.text("Partial")),
                Flux.error(new IllegalStateException("connection reset"))));

        StepVerifier.create(service.streamTurn(turn("hi")))
                .assertNext(event -> assertEquals(TurnEvent.TOKEN, event.type()))
                .assertNext(event -> {
                    assertEquals(TurnEvent.ERROR, event.type());
                    assertEquals("connection reset", event.data().get("details"));
                })
                .expectComplete()
                .verify(TIMEOUT);

        ArgumentCaptor<LlmResponse> captor = ArgumentCaptor.forClass(LlmResponse.class);
        verify(conversations).addInterruptedAssistantMessage(eq(SESSION_ID), captor.capture());
        assertEquals("Partial", captor.getValue().getContent());
        verify(conversations, never()).addAssistantMessage(anyString(), any());
    }

    @Test
    void shouldReportUnknownProviderInBand() {
        when(gateway.resolve(any())).thenThrow(new ProviderUnavailableException("ghost"));

        StepVerifier.create(service.streamTurn(turn("hi")))
                .assertNext(event -> {
                    assertEquals(TurnEvent.ERROR, event.type());
                    assertEquals("Provider not available: ghost", event.data().get("details"));
                })
                .expectComplete()
                .verify(TIMEOUT);

        verify(conversations, never()).addUserMessage(anyString(), anyString(), any());
        verify(conversations, never()).addInterruptedAssistantMessage(anyString(), any());
    }

    @Test
    void shouldReportUnansweredToolCallsInBandWhenStreaming() {
        stubUnansweredToolCall();

        StepVerifier.create(service.streamTurn(turn("next question")))
                .assertNext(event -> {
                    assertEquals(TurnEvent.ERROR, event.type());
                    assertEquals("Session has unanswered tool calls: [call_1]", event.data().get("details"));
                })
                .expectComplete()
                .verify(TIMEOUT);

        verify(conversations, never()).addUserMessage(anyString(), anyString(), any());
        verify(gateway, never()).stream(any());
    }

    // ===== streamAgentic =====

    @Test
    void shouldStreamLoopProgress() {
        Message.ToolCall call = new Message.ToolCall("call_1", "search_skills", Map.of("query", "tikz"));
        when(loop.run(any())).thenAnswer(invocation -> {
            AgenticLoopRequest request = invocation.getArgument(0);
            request.getObserver().onAssistantResponse(
                    LlmResponse.builder().content("Let me look.").build(), null);
            request.getObserver().onToolStarted(call);
            request.getObserver().onToolFinished(call, new ToolExecutionOutcome("call_1", "search_skills",
                    ToolResult.success("found 2 skills"), ToolSource.Kind.PEER, false));
            return finished("Done.", 2);
        });

        StepVerifier.create(service.streamAgentic(turn("draw a graph")))
                .assertNext(event -> assertEquals("Let me look.", event.data().get("content")))
                .assertNext(event -> {
                    assertEquals(TurnEvent.TOOL_START, event.type());
                    assertEquals("search_skills", event.data().get("tool_name"));
                })
                .assertNext(event -> {
                    assertEquals(TurnEvent.TOOL_END, event.type());
                    assertEquals("found 2 skills", event.data().get("content"));
                    assertEquals(false, event.data().get("is_error"));
                })
                .assertNext(event -> {
                    assertEquals(TurnEvent.DONE, event.type());
                    assertEquals(2, event.data().get("iterations"));
                    assertEquals(0L, event.data().get("latency_ms"));
                })
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    void shouldNotStartAgenticLoopWhileToolCallsAreUnanswered() {
        stubUnansweredToolCall();

        StepVerifier.create(service.streamAgentic(turn("next question")))
                .assertNext(event -> assertEquals(TurnEvent.ERROR, event.type()))
                .expectComplete()
                .verify(TIMEOUT);

        verify(conversations, never()).addUserMessage(anyString(), anyString(), any());
        verify(loop, never()).run(any());
    }

    @Test
    void shouldEndAgenticStreamWithErrorEvent() {
        StepVerifier.create(service.streamAgentic(turn("")))
                .assertNext(event -> {
                    assertEquals(TurnEvent.ERROR, event.type());
                    assertEquals("message is required", event.data().get("details"));
                })
                .expectComplete()
                .verify(TIMEOUT);
    }

    // ===== quickEdit =====

    @Test
    void shouldReturnEditedText() {
        when(gateway.complete(any())).thenReturn(LlmResponse.builder()
                .content("It is adequate.").usage(LlmUsage.of(50, 5)).build());

        QuickEditResult result = service.quickEdit(PROJECT_ID, USER_ID, "Make it formal", "it's fine", null);

        assertEquals("It is adequate.", result.content());
        assertEquals(0L, result.latencyMs());
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(gateway).complete(captor.capture());
        assertEquals(USER_ID, captor.getValue().getUserId());
        assertEquals(PROJECT_ID, captor.getValue().getProjectId());
        verify(conversations, never()).addUserMessage(anyString(), anyString(), any());
    }

    @Test
    void shouldRejectBlankInstruction() {
        assertThrows(MessageValidationException.class,
                () -> service.quickEdit(PROJECT_ID, USER_ID, " ", "text", null));
        verify(gateway, never()).complete(any());
    }
}
