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

package me.golemcore.gateway.adapter.outbound.llm;

import me.golemcore.gateway.domain.exception.ProviderConfigurationException;
import me.golemcore.gateway.domain.model.LlmChunk;
import me.golemcore.gateway.domain.model.LlmRequest;
import me.golemcore.gateway.domain.model.LlmResponse;
import me.golemcore.gateway.domain.model.LlmUsage;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.ModelInfo;
import me.golemcore.gateway.domain.model.ProviderHealth;
import me.golemcore.gateway.domain.model.StopReason;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.http.FeignClientFactory;
import me.golemcore.gateway.port.outbound.LlmProviderPort;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Headers;
import feign.RequestLine;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter for a local Ollama server. Models are free; the installed set is
 * discovered from {@code /api/tags} at initialization.
 *
 * <p>
 * Streaming uses newline-delimited JSON rather than SSE. The final line has
 * {@code done: true} and carries the token counts.
 */
@Slf4j
public class OllamaAdapter implements
        LlmProviderPort<OllamaAdapter.ChatRequest, OllamaAdapter.ChatResponse, OllamaAdapter.ChatResponse> {

    public static final String PROVIDER_ID = "ollama";

    private static final List<String[]> DEFAULT_MODELS = List.of(
            new String[] { "llama3.2", "Llama 3.2" },
            new String[] { "llama3.2:1b", "Llama 3.2 1B" },
            new String[] { "mistral", "Mistral 7B" },
            new String[] { "qwen2.5", "Qwen 2.5" },
            new String[] { "deepseek-coder", "DeepSeek Coder" },
            new String[] { "codellama", "Code Llama" });

    private final GatewayProperties.OllamaProperties settings;
    private final FeignClientFactory feignClientFactory;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    private final Map<String, ModelInfo> models = new LinkedHashMap<>();
    private OllamaApi client;
    private volatile boolean initialized;

    public OllamaAdapter(GatewayProperties.OllamaProperties settings, FeignClientFactory feignClientFactory,
            OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        this.settings = settings;
        this.feignClientFactory = feignClientFactory;
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        for (String[] model : DEFAULT_MODELS) {
            models.put(model[0], freeModel(model[0], model[1]));
        }
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        if (!settings.isEnabled()) {
            throw new ProviderConfigurationException("Ollama is disabled");
        }
        this.client = feignClientFactory.create(OllamaApi.class, settings.getBaseUrl());
        initialized = true;
        try {
            TagsResponse tags = client.listTags();
            if (tags != null && tags.getModels() != null) {
                for (TagModel tag : tags.getModels()) {
                    models.putIfAbsent(tag.getName(), freeModel(tag.getName(), tag.getName()));
                }
                log.info("[Ollama] Discovered {} installed models", tags.getModels().size());
            }
        } catch (RuntimeException e) {
            log.warn("[Ollama] Model discovery failed, keeping defaults: {}", e.getMessage());
        }
        log.info("[Ollama] Adapter initialized with URL: {}", settings.getBaseUrl());
    }

    @Override
    public String getDefaultModel() {
        return settings.getDefaultModel();
    }

    @Override
    public synchronized List<ModelInfo> getModels() {
        return List.copyOf(models.values());
    }

    /**
     * Asks the server to download a model. Returns once the pull has been
     * accepted.
     */
    public void pullModel(String modelName) {
        initialize();
        try {
            client.pull(new PullRequest(modelName, false));
            log.info("[Ollama] Model pull started: {}", modelName);
        } catch (RuntimeException e) {
            log.error("[Ollama] Failed to pull model {}: {}", modelName, e.getMessage());
            throw LlmHttpSupport.toVendorException(PROVIDER_ID, e);
        }
    }

    @Override
    public ChatRequest normalizeRequest(LlmRequest request) {
        ChatRequest apiRequest = new ChatRequest();
        apiRequest.setModel(request.getModel() != null ? request.getModel() : getDefaultModel());
        apiRequest.setOptions(new Options(request.getTemperature(), request.getMaxTokens()));

        List<ApiMessage> messages = new ArrayList<>();
        for (Message msg : request.getMessages()) {
            ApiMessage apiMsg = new ApiMessage();
            apiMsg.setRole(msg.getRole());
            apiMsg.setContent(msg.getContent() != null ? msg.getContent() : "");
            if (msg.hasToolCalls()) {
                apiMsg.setToolCalls(msg.getToolCalls().stream()
                        .map(tc -> new ApiToolCall(new ApiFunction(tc.getName(),
                                tc.getInput() != null ? tc.getInput() : Map.of())))
                        .toList());
            }
            messages.add(apiMsg);
        }
        apiRequest.setMessages(messages);

        if (request.hasTools()) {
            apiRequest.setTools(request.getTools().stream()
                    .map(tool -> Map.<String, Object>of(
                            "type", "function",
                            "function", Map.of(
                                    "name", tool.getName(),
                                    "description", tool.getDescription() != null ? tool.getDescription() : "",
                                    "parameters", tool.getInputSchema() != null ? tool.getInputSchema()
                                            : Map.of("type", "object", "properties", Map.of()))))
                    .toList());
        }
        return apiRequest;
    }

    @Override
    public ChatResponse complete(ChatRequest vendorRequest) {
        initialize();
        vendorRequest.setStream(false);
        try {
            return client.chat(vendorRequest);
        } catch (RuntimeException e) {
            log.error("[Ollama] Completion failed: {}", e.getMessage());
            throw LlmHttpSupport.toVendorException(PROVIDER_ID, e);
        }
    }

    @Override
    public LlmResponse normalizeResponse(ChatResponse response) {
        List<Message.ToolCall> toolCalls = toToolCalls(response.getMessage());
        return LlmResponse.builder()
                .content(response.getMessage() != null && response.getMessage().getContent() != null
                        ? response.getMessage().getContent()
                        : "")
                .toolCalls(toolCalls.isEmpty() ? null : toolCalls)
                .stopReason(mapDoneReason(response.getDoneReason(), !toolCalls.isEmpty()))
                .usage(LlmUsage.of(response.getPromptEvalCount(), response.getEvalCount()))
                .model(response.getModel())
                .provider(PROVIDER_ID)
                .build();
    }

    private List<Message.ToolCall> toToolCalls(ApiMessage message) {
        List<Message.ToolCall> toolCalls = new ArrayList<>();
        if (message == null || message.getToolCalls() == null) {
            return toolCalls;
        }
        int index = 0;
        for (ApiToolCall tc : message.getToolCalls()) {
            ApiFunction function = tc.getFunction();
            toolCalls.add(Message.ToolCall.builder()
                    .id(LlmHttpSupport.fallbackToolCallId(index))
                    .name(function != null ? function.getName() : null)
                    .input(function != null && function.getArguments() != null ? function.getArguments() : Map.of())
                    .build());
            index++;
        }
        return toolCalls;
    }

    static StopReason mapDoneReason(String doneReason, boolean hasToolCalls) {
        if (hasToolCalls) {
            return StopReason.TOOL_USE;
        }
        return "length".equals(doneReason) ? StopReason.MAX_TOKENS : StopReason.END_TURN;
    }

    @Override
    public Flux<ChatResponse> stream(ChatRequest vendorRequest) {
        initialize();
        vendorRequest.setStream(true);
        Request request = new Request.Builder()
                .url(stripSlash(settings.getBaseUrl()) + "/api/chat")
                .post(LlmHttpSupport.jsonBody(objectMapper, vendorRequest, PROVIDER_ID))
                .build();

        return Flux.defer(() -> {
            List<Message.ToolCall> collected = new ArrayList<>();
            boolean[] finished = new boolean[1];
            return LlmHttpSupport.streamLines(okHttpClient, request, PROVIDER_ID)
                    .filter(line -> !line.isBlank())
                    .concatMapIterable(line -> {
                        ChatResponse chunk = parseLine(line);
                        if (chunk == null) {
                            return List.<ChatResponse>of();
                        }
                        collected.addAll(toToolCalls(chunk.getMessage()));
                        if (chunk.isDone()) {
                            finished[0] = true;
                            chunk.setCollectedToolCalls(List.copyOf(collected));
                        }
                        return List.of(chunk);
                    })
                    .concatWith(Flux.defer(() -> finished[0] ? Flux.<ChatResponse>empty()
                            : Flux.just(syntheticDone(collected))))
                    .takeUntil(ChatResponse::isDone);
        });
    }

    private ChatResponse parseLine(String line) {
        try {
            return objectMapper.readValue(line, ChatResponse.class);
        } catch (JsonProcessingException e) {
            log.warn("[Ollama] Skipping malformed stream line: {}", e.getMessage());
            return null;
        }
    }

    private static ChatResponse syntheticDone(List<Message.ToolCall> collected) {
        ChatResponse done = new ChatResponse();
        done.setDone(true);
        done.setCollectedToolCalls(List.copyOf(collected));
        return done;
    }

    @Override
    public LlmChunk normalizeChunk(ChatResponse chunk) {
        if (chunk.isDone()) {
            List<Message.ToolCall> toolCalls = chunk.getCollectedToolCalls() != null
                    ? chunk.getCollectedToolCalls()
                    : List.of();
            String trailing = chunk.getMessage() != null ? chunk.getMessage().getContent() : null;
            return LlmChunk.builder()
                    .content(trailing != null && !trailing.isEmpty() ? trailing : null)
                    .done(true)
                    .usage(LlmUsage.of(chunk.getPromptEvalCount(), chunk.getEvalCount()))
                    .toolCalls(toolCalls.isEmpty() ? null : toolCalls)
                    .stopReason(mapDoneReason(chunk.getDoneReason(), !toolCalls.isEmpty()))
                    .build();
        }
        String content = chunk.getMessage() != null ? chunk.getMessage().getContent() : null;
        return LlmChunk.text(content != null ? content : "");
    }

    @Override
    public ProviderHealth healthCheck() {
        try {
            initialize();
            client.listTags();
            return ProviderHealth.healthy(getModels().size());
        } catch (RuntimeException e) {
            log.warn("[Ollama] Health check failed: {}", e.getMessage());
            return ProviderHealth.unhealthy(e.getMessage());
        }
    }

    private static ModelInfo freeModel(String id, String name) {
        return ModelInfo.builder().id(id).name(name).provider(PROVIDER_ID).build();
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // Feign API interface
    public interface OllamaApi {
        @RequestLine("POST /api/chat")
        @Headers("Content-Type: application/json")
        ChatResponse chat(ChatRequest request);

        @RequestLine("GET /api/tags")
        TagsResponse listTags();

        @RequestLine("POST /api/pull")
        @Headers("Content-Type: application/json")
        void pull(PullRequest request);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatRequest {
        private String model;
        private List<ApiMessage> messages;
        private List<Map<String, Object>> tools;
        private Options options;
        private Boolean stream;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Options {
        private double temperature;
        @JsonProperty("num_predict")
        private int numPredict;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiMessage {
        private String role;
        private String content;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiToolCall {
        private ApiFunction function;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiFunction {
        private String name;
        private Map<String, Object> arguments;
    }

    /**
     * Response of {@code /api/chat}; in streaming mode every NDJSON line has
     * this shape.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatResponse {
        private String model;
        private ApiMessage message;
        private boolean done;
        @JsonProperty("done_reason")
        private String doneReason;
        @JsonProperty("prompt_eval_count")
        private int promptEvalCount;
        @JsonProperty("eval_count")
        private int evalCount;
        @JsonIgnore
        private List<Message.ToolCall> collectedToolCalls;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TagsResponse {
        private List<TagModel> models;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TagModel {
        private String name;
        private JsonNode details;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PullRequest {
        private String name;
        private boolean stream;
    }
}
