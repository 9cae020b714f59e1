package me.golemcore.gateway.adapter.outbound.llm;

import me.golemcore.gateway.domain.exception.VendorCallException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmHttpSupportTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final OkHttpClient client = new OkHttpClient();
    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private Request request() {
        return new Request.Builder().url(server.url("/stream")).build();
    }

    // ===== streamLines =====

    @Test
    void shouldEmitLinesOnlyAsRequested() {
        server.enqueue(new MockResponse().setBody("one\ntwo\nthree\n"));

        StepVerifier.create(LlmHttpSupport.streamLines(client, request(), "test"), 0)
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(100))
                .thenRequest(1)
                .expectNext("one")
                .expectNoEvent(Duration.ofMillis(100))
                .thenRequest(3)
                .expectNext("two", "three")
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    void shouldNotWaitForRestOfBodyAfterCancel() {
        server.enqueue(new MockResponse()
                .setBody("first\n" + "data: x\n".repeat(1000))
                .throttleBody(8, 100, TimeUnit.MILLISECONDS));

        StepVerifier.create(LlmHttpSupport.streamLines(client, request(), "test").take(1))
                .expectNext("first")
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    void shouldTranslateHttpErrorWithStatus() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\":\"rate limited\"}"));

        StepVerifier.create(LlmHttpSupport.streamLines(client, request(), "test"))
                .expectErrorSatisfies(error -> {
                    VendorCallException vendorError = assertInstanceOf(VendorCallException.class, error);
                    assertEquals(429, vendorError.getStatusCode());
                    assertTrue(vendorError.getMessage().contains("rate limited"));
                })
                .verify(TIMEOUT);
    }

    @Test
    void shouldCompleteOnEmptyBody() {
        server.enqueue(new MockResponse().setBody(""));

        StepVerifier.create(LlmHttpSupport.streamLines(client, request(), "test"))
                .expectComplete()
                .verify(TIMEOUT);
    }
}
