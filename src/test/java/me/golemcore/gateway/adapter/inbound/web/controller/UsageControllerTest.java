package me.golemcore.gateway.adapter.inbound.web.controller;

import me.golemcore.gateway.domain.exception.SessionNotFoundException;
import me.golemcore.gateway.domain.model.ChatSession;
import me.golemcore.gateway.domain.model.LimitCheck;
import me.golemcore.gateway.domain.model.UsageTotals;
import me.golemcore.gateway.port.outbound.ConversationPort;
import me.golemcore.gateway.port.outbound.CostTrackingPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UsageControllerTest {

    private CostTrackingPort costTracker;
    private ConversationPort conversations;
    private UsageController controller;

    @BeforeEach
    void setUp() {
        costTracker = mock(CostTrackingPort.class);
        conversations = mock(ConversationPort.class);
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        controller = new UsageController(costTracker, conversations, clock);
    }

    @Test
    void shouldDefaultDailyUsageToToday() {
        LocalDate today = LocalDate.of(2026, 3, 1);
        when(costTracker.getDailyUsage("user-1", today)).thenReturn(new UsageTotals(3, 100, 50, 0.01));

        StepVerifier.create(controller.getDaily(null, "user-1"))
                .assertNext(response -> {
                    assertEquals("2026-03-01", response.getBody().get("date"));
                    assertEquals(150L, ((UsageTotals) response.getBody().get("usage")).getTotalTokens());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectMalformedDate() {
        assertThrows(ResponseStatusException.class, () -> controller.getDaily("03/01/2026", "user-1"));
    }

    @Test
    void shouldPreferTierParameterOverHeader() {
        when(costTracker.checkLimits("user-1", "pro"))
                .thenReturn(LimitCheck.builder().withinLimits(true).tier("pro").build());

        StepVerifier.create(controller.getLimits("pro", "free", "user-1"))
                .assertNext(response -> assertEquals("pro", response.getBody().getTier()))
                .verifyComplete();

        verify(costTracker).checkLimits("user-1", "pro");
    }

    @Test
    void shouldCompareLiveAndRecomputedSessionTotals() {
        when(conversations.getSession("s1", "user-1")).thenReturn(Optional.of(ChatSession.builder().id("s1").build()));
        when(conversations.getMessages("s1")).thenReturn(List.of());
        when(costTracker.getSessionTotals("s1")).thenReturn(new UsageTotals(1, 10, 5, 0));
        when(costTracker.recompute(List.of())).thenReturn(new UsageTotals(1, 10, 5, 0));

        StepVerifier.create(controller.getSessionUsage("s1", "user-1"))
                .assertNext(response -> assertEquals(response.getBody().get("live"),
                        response.getBody().get("recomputed")))
                .verifyComplete();
    }

    @Test
    void shouldFailForSessionOfAnotherUser() {
        when(conversations.getSession("s1", "user-2")).thenReturn(Optional.empty());

        assertThrows(SessionNotFoundException.class, () -> controller.getSessionUsage("s1", "user-2"));
    }
}
