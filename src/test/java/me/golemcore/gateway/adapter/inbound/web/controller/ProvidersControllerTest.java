package me.golemcore.gateway.adapter.inbound.web.controller;

import me.golemcore.gateway.domain.model.ModelInfo;
import me.golemcore.gateway.domain.model.ModelRecommendation;
import me.golemcore.gateway.domain.service.CompletionGateway;
import me.golemcore.gateway.routing.ModelRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProvidersControllerTest {

    private CompletionGateway gateway;
    private ModelRouter modelRouter;
    private ProvidersController controller;

    @BeforeEach
    void setUp() {
        gateway = mock(CompletionGateway.class);
        modelRouter = mock(ModelRouter.class);
        controller = new ProvidersController(gateway, modelRouter);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldListProvidersWithModels() {
        ModelInfo chat = ModelInfo.builder().id("deepseek-chat").provider("deepseek").build();
        when(gateway.getAvailableProviders()).thenReturn(List.of("deepseek"));
        when(gateway.getModels("deepseek")).thenReturn(List.of(chat));

        StepVerifier.create(controller.getProviders())
                .assertNext(response -> {
                    List<Map<String, Object>> providers =
                            (List<Map<String, Object>>) response.getBody().get("providers");
                    assertEquals("deepseek", providers.get(0).get("id"));
                    assertEquals(List.of(chat), providers.get(0).get("models"));
                })
                .verifyComplete();
    }

    @Test
    void shouldListAllModelsWithoutProvider() {
        when(gateway.getAllModels()).thenReturn(List.of());

        StepVerifier.create(controller.getModels(null))
                .assertNext(response -> assertEquals(List.of(), response.getBody().get("models")))
                .verifyComplete();
    }

    @Test
    void shouldDetectTaskFromText() {
        when(modelRouter.detectTaskType("please fix this bug")).thenReturn("coding");
        when(gateway.recommendModel("coding", "free"))
                .thenReturn(new ModelRecommendation("deepseek", "deepseek-coder", "Best for code"));

        StepVerifier.create(controller.recommend(null, "free", "please fix this bug"))
                .assertNext(response -> {
                    assertEquals("coding", response.getBody().get("task"));
                    assertEquals("deepseek-coder",
                            ((ModelRecommendation) response.getBody().get("recommendation")).getModel());
                })
                .verifyComplete();
    }

    @Test
    void shouldRequireTaskOrText() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.recommend(null, "free", null));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }
}
