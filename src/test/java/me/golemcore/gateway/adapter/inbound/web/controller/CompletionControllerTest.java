package me.golemcore.gateway.adapter.inbound.web.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.adapter.inbound.web.dto.MessageRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.QuickEditRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.ToolResultsRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.TurnResponse;
import me.golemcore.gateway.domain.model.LlmUsage;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.QuickEditResult;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.domain.model.ToolResultSubmission;
import me.golemcore.gateway.domain.model.TurnEvent;
import me.golemcore.gateway.domain.model.TurnRequest;
import me.golemcore.gateway.domain.model.TurnResult;
import me.golemcore.gateway.domain.service.CompletionService;
import me.golemcore.gateway.domain.system.toolloop.ToolExecutionOutcome;
import me.golemcore.gateway.domain.system.toolloop.ToolSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CompletionControllerTest {

    private CompletionService completionService;
    private CompletionController controller;

    @BeforeEach
    void setUp() {
        completionService = mock(CompletionService.class);
        controller = new CompletionController(completionService, new ObjectMapper());
    }

    // ===== message =====

    @Test
    void shouldSendMessage() {
        Message reply = Message.builder().role(Message.ROLE_ASSISTANT).content("Done.").build();
        when(completionService.sendMessage(any())).thenReturn(TurnResult.builder()
                .sessionId("s1")
                .message(reply)
                .usage(LlmUsage.of(10, 2))
                .toolResults(List.of(new ToolExecutionOutcome("call_1", "search_skills",
                        ToolResult.success("2 skills"), ToolSource.Kind.PEER, false)))
                .build());
        MessageRequest body = MessageRequest.builder().message("Fix my table").provider("deepseek").build();

        StepVerifier.create(controller.sendMessage("proj-1", body, "user-1", "pro"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    TurnResponse turn = response.getBody();
                    assertNotNull(turn);
                    assertEquals("s1", turn.getSessionId());
                    assertEquals("Done.", turn.getMessage().getContent());
                    assertEquals("2 skills", turn.getToolResults().get(0).getContent());
                    assertNull(turn.getRequiresToolResults());
                })
                .verifyComplete();

        ArgumentCaptor<TurnRequest> captor = ArgumentCaptor.forClass(TurnRequest.class);
        verify(completionService).sendMessage(captor.capture());
        assertEquals("proj-1", captor.getValue().getProjectId());
        assertEquals("user-1", captor.getValue().getUserId());
        assertEquals("pro", captor.getValue().getTier());
        assertEquals("deepseek", captor.getValue().getProvider());
    }

    @Test
    void shouldReportPendingClientTools() {
        Message.ToolCall call = new Message.ToolCall("call_7", "apply_to_document", Map.of("content", "x"));
        when(completionService.sendMessage(any())).thenReturn(TurnResult.builder()
                .sessionId("s1")
                .requiresToolResults(true)
                .toolCalls(List.of(call))
                .toolResults(List.of())
                .build());

        StepVerifier.create(controller.sendMessage("proj-1", MessageRequest.builder().message("go").build(),
                "user-1", "free"))
                .assertNext(response -> {
                    TurnResponse turn = response.getBody();
                    assertEquals(Boolean.TRUE, turn.getRequiresToolResults());
                    assertEquals(List.of(call), turn.getToolCalls());
                    assertNull(turn.getToolResults());
                })
                .verifyComplete();
    }

    // ===== tool results =====

    @Test
    void shouldRequireSessionIdForToolResults() {
        ToolResultsRequest body = ToolResultsRequest.builder().results(List.of()).build();

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.submitToolResults("proj-1", body, "user-1", "free"));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(completionService, never()).submitToolResults(any());
    }

    @Test
    void shouldForwardToolResults() {
        when(completionService.submitToolResults(any())).thenReturn(TurnResult.builder().sessionId("s1").build());
        ToolResultsRequest body = ToolResultsRequest.builder()
                .sessionId("s1")
                .results(List.of(new ToolResultsRequest.ToolResultDto("call_7", "apply_to_document", "applied",
                        false)))
                .build();

        StepVerifier.create(controller.submitToolResults("proj-1", body, "user-1", "free"))
                .assertNext(response -> assertEquals(HttpStatus.OK, response.getStatusCode()))
                .verifyComplete();

        ArgumentCaptor<ToolResultSubmission> captor = ArgumentCaptor.forClass(ToolResultSubmission.class);
        verify(completionService).submitToolResults(captor.capture());
        assertEquals(new ToolResultSubmission.Result("call_7", "apply_to_document", "applied", false),
                captor.getValue().getResults().get(0));
    }

    // ===== streams =====

    @Test
    void shouldMapTurnEventsToServerSentEvents() {
        when(completionService.streamTurn(any())).thenReturn(Flux.just(
                TurnEvent.token("Hi"),
                TurnEvent.done(Map.of("session_id", "s1"))));

        StepVerifier.create(controller.stream("proj-1", "hello", null, null, null, null, "user-1", "free"))
                .assertNext(sse -> {
                    assertEquals("token", sse.event());
                    assertEquals("Hi", sse.data().get("content"));
                })
                .assertNext(sse -> assertEquals("done", sse.event()))
                .verifyComplete();
    }

    @Test
    void shouldParseContextParameter() {
        when(completionService.streamAgentic(any())).thenReturn(Flux.empty());

        StepVerifier.create(controller.streamAgentic("proj-1", "hello", "s1", null, null,
                "{\"doc_name\":\"main.tex\",\"doc_content\":\"\\\\begin{document}\"}", "user-1", "free"))
                .verifyComplete();

        ArgumentCaptor<TurnRequest> captor = ArgumentCaptor.forClass(TurnRequest.class);
        verify(completionService).streamAgentic(captor.capture());
        assertEquals("main.tex", captor.getValue().getContext().getDocName());
        assertEquals("s1", captor.getValue().getSessionId());
    }

    @Test
    void shouldReportMalformedContextInBand() {
        StepVerifier.create(controller.stream("proj-1", "hello", null, null, null, "{not json", "user-1", "free"))
                .assertNext(sse -> {
                    assertEquals("error", sse.event());
                    assertTrue(((String) sse.data().get("details")).startsWith("context is not valid JSON"));
                })
                .verifyComplete();

        verify(completionService, never()).streamTurn(any());
    }

    // ===== quick edit =====

    @Test
    void shouldReturnQuickEditBody() {
        when(completionService.quickEdit("proj-1", "user-1", "Shorten", "A long sentence.", "free"))
                .thenReturn(new QuickEditResult("Short.", LlmUsage.of(20, 3), 120));
        QuickEditRequest body = QuickEditRequest.builder().prompt("Shorten").selectedText("A long sentence.").build();

        StepVerifier.create(controller.quickEdit("proj-1", body, "user-1", "free"))
                .assertNext(response -> {
                    Map<String, Object> quickEdit = response.getBody();
                    assertNotNull(quickEdit);
                    assertEquals("Short.", quickEdit.get("content"));
                    assertEquals(120L, quickEdit.get("latency_ms"));
                })
                .verifyComplete();
    }
}
