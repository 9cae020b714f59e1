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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Adapter for DeepSeek's OpenAI-compatible chat completions API using Feign +
 * OkHttp.
 *
 * <p>
 * Tool calls use the OpenAI {@code function} shape with arguments as a JSON
 * string. In streaming mode each tool call arrives as a sequence of deltas
 * keyed by {@code index}; the argument fragments are concatenated and parsed
 * once the stream finishes.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code gateway.providers.deepseek.api-key} - API key (required)
 * <li>{@code gateway.providers.deepseek.base-url} - Base URL of the API
 * </ul>
 *
 * <p>
 * Provider ID: {@code "deepseek"}
 */
@Slf4j
public class DeepSeekAdapter implements
        LlmProviderPort<DeepSeekAdapter.ChatCompletionRequest, DeepSeekAdapter.ChatCompletionResponse, DeepSeekAdapter.StreamEvent> {

    public static final String PROVIDER_ID = "deepseek";

    private static final String DONE_MARKER = "[DONE]";

    private static final List<ModelInfo> MODELS = List.of(
            ModelInfo.builder().id("deepseek-chat").name("DeepSeek Chat (V3)").provider(PROVIDER_ID)
                    .inputPricePerMillion(0.27).outputPricePerMillion(1.10).build(),
            ModelInfo.builder().id("deepseek-reasoner").name("DeepSeek Reasoner (R1)").provider(PROVIDER_ID)
                    .inputPricePerMillion(0.55).outputPricePerMillion(2.19).build());

    private final GatewayProperties.DeepSeekProperties settings;
    private final FeignClientFactory feignClientFactory;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    private DeepSeekApi client;
    private volatile boolean initialized;

    public DeepSeekAdapter(GatewayProperties.DeepSeekProperties settings, FeignClientFactory feignClientFactory,
            OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        this.settings = settings;
        this.feignClientFactory = feignClientFactory;
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
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
        if (LlmHttpSupport.isBlank(settings.getApiKey())) {
            throw new ProviderConfigurationException("DeepSeek API key not configured");
        }
        this.client = feignClientFactory.create(DeepSeekApi.class, settings.getBaseUrl());
        initialized = true;
        log.info("[DeepSeek] Adapter initialized with URL: {}", settings.getBaseUrl());
    }

    @Override
    public String getDefaultModel() {
        return settings.getDefaultModel();
    }

    @Override
    public List<ModelInfo> getModels() {
        return MODELS;
    }

    @Override
    public ChatCompletionRequest normalizeRequest(LlmRequest request) {
        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setModel(request.getModel() != null ? request.getModel() : getDefaultModel());
        apiRequest.setMaxTokens(request.getMaxTokens());
        apiRequest.setTemperature(request.getTemperature());

        List<String> systemParts = new ArrayList<>();
        List<ApiMessage> messages = new ArrayList<>();
        for (Message msg : request.getMessages()) {
            if (msg.isSystemMessage()) {
                if (!LlmHttpSupport.isBlank(msg.getContent())) {
                    systemParts.add(msg.getContent());
                }
                continue;
            }
            ApiMessage apiMsg = new ApiMessage();
            apiMsg.setRole(msg.getRole());
            apiMsg.setContent(msg.getContent() != null ? msg.getContent() : "");

            if (msg.hasToolCalls()) {
                apiMsg.setToolCalls(msg.getToolCalls().stream()
                        .map(this::toApiToolCall)
                        .toList());
            }
            if (msg.isToolMessage()) {
                apiMsg.setToolCallId(msg.getToolCallId());
            }
            messages.add(apiMsg);
        }
        if (!systemParts.isEmpty()) {
            ApiMessage sysMsg = new ApiMessage();
            sysMsg.setRole(Message.ROLE_SYSTEM);
            sysMsg.setContent(String.join("\n\n", systemParts));
            messages.add(0, sysMsg);
        }
        apiRequest.setMessages(messages);

        if (request.hasTools()) {
            apiRequest.setTools(request.getTools().stream()
                    .map(tool -> {
                        ApiToolFunction func = new ApiToolFunction();
                        func.setName(tool.getName());
                        func.setDescription(tool.getDescription());
                        func.setParameters(tool.getInputSchema());
                        ApiTool apiTool = new ApiTool();
                        apiTool.setType("function");
                        apiTool.setFunction(func);
                        return apiTool;
                    })
                    .toList());
        }
        return apiRequest;
    }

    private ApiToolCall toApiToolCall(Message.ToolCall tc) {
        ApiFunction func = new ApiFunction();
        func.setName(tc.getName());
        func.setArguments(LlmHttpSupport.toJson(objectMapper, tc.getInput()));
        ApiToolCall atc = new ApiToolCall();
        atc.setId(tc.getId());
        atc.setType("function");
        atc.setFunction(func);
        return atc;
    }

    @Override
    public ChatCompletionResponse complete(ChatCompletionRequest vendorRequest) {
        initialize();
        vendorRequest.setStream(null);
        vendorRequest.setStreamOptions(null);
        try {
            return client.chatCompletion(settings.getApiKey(), vendorRequest);
        } catch (RuntimeException e) {
            log.error("[DeepSeek] Completion failed: {}", e.getMessage());
            throw LlmHttpSupport.toVendorException(PROVIDER_ID, e);
        }
    }

    @Override
    public LlmResponse normalizeResponse(ChatCompletionResponse apiResponse) {
        LlmUsage usage = apiResponse.getUsage() != null
                ? LlmUsage.of(apiResponse.getUsage().getPromptTokens(), apiResponse.getUsage().getCompletionTokens())
                : LlmUsage.empty();

        if (apiResponse.getChoices() == null || apiResponse.getChoices().isEmpty()) {
            return LlmResponse.builder()
                    .id(apiResponse.getId())
                    .usage(usage)
                    .model(apiResponse.getModel())
                    .provider(PROVIDER_ID)
                    .build();
        }

        ChatChoice choice = apiResponse.getChoices().get(0);
        ApiMessage message = choice.getMessage();

        List<Message.ToolCall> toolCalls = new ArrayList<>();
        if (message != null && message.getToolCalls() != null) {
            int index = 0;
            for (ApiToolCall tc : message.getToolCalls()) {
                toolCalls.add(Message.ToolCall.builder()
                        .id(tc.getId() != null ? tc.getId() : LlmHttpSupport.fallbackToolCallId(index))
                        .name(tc.getFunction() != null ? tc.getFunction().getName() : null)
                        .input(LlmHttpSupport.parseArguments(objectMapper,
                                tc.getFunction() != null ? tc.getFunction().getArguments() : null, PROVIDER_ID))
                        .build());
                index++;
            }
        }

        return LlmResponse.builder()
                .id(apiResponse.getId())
                .content(message != null && message.getContent() != null ? message.getContent() : "")
                .toolCalls(toolCalls.isEmpty() ? null : toolCalls)
                .stopReason(mapFinishReason(choice.getFinishReason(), !toolCalls.isEmpty()))
                .usage(usage)
                .model(apiResponse.getModel())
                .provider(PROVIDER_ID)
                .build();
    }

    static StopReason mapFinishReason(String finishReason, boolean hasToolCalls) {
        if (hasToolCalls) {
            return StopReason.TOOL_USE;
        }
        if (finishReason == null) {
            return StopReason.END_TURN;
        }
        return switch (finishReason) {
        case "tool_calls", "function_call", "tool-calls" -> StopReason.TOOL_USE;
        case "length" -> StopReason.MAX_TOKENS;
        default -> StopReason.END_TURN;
        };
    }

    @Override
    public Flux<StreamEvent> stream(ChatCompletionRequest vendorRequest) {
        initialize();
        vendorRequest.setStream(true);
        vendorRequest.setStreamOptions(Map.of("include_usage", true));
        Request request = new Request.Builder()
                .url(stripSlash(settings.getBaseUrl()) + "/v1/chat/completions")
                .header("Authorization", "Bearer " + settings.getApiKey())
                .header("Accept", "text/event-stream")
                .post(LlmHttpSupport.jsonBody(objectMapper, vendorRequest, PROVIDER_ID))
                .build();

        return Flux.defer(() -> {
            StreamAssembler assembler = new StreamAssembler();
            return LlmHttpSupport.streamLines(okHttpClient, request, PROVIDER_ID)
                    .concatMapIterable(assembler::accept)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(assembler.finish())))
                    .takeUntil(StreamEvent::isTerminal);
        });
    }

    @Override
    public LlmChunk normalizeChunk(StreamEvent event) {
        if (event.isTerminal()) {
            List<Message.ToolCall> toolCalls = event.getToolCalls() != null ? event.getToolCalls() : List.of();
            return LlmChunk.builder()
                    .done(true)
                    .usage(LlmUsage.of(event.getInputTokens(), event.getOutputTokens()))
                    .toolCalls(toolCalls.isEmpty() ? null : toolCalls)
                    .stopReason(mapFinishReason(event.getFinishReason(), !toolCalls.isEmpty()))
                    .build();
        }
        if (event.getToolCallId() != null) {
            return LlmChunk.builder()
                    .toolCallStarted(Message.ToolCall.builder()
                            .id(event.getToolCallId())
                            .name(event.getToolName())
                            .build())
                    .build();
        }
        return LlmChunk.text(event.getText());
    }

    /**
     * Folds OpenAI-style SSE deltas into text, tool-start and terminal events.
     */
    final class StreamAssembler {

        private final Map<Integer, ToolCallBuffer> toolCalls = new TreeMap<>();
        private int inputTokens;
        private int outputTokens;
        private String finishReason;
        private boolean terminated;

        List<StreamEvent> accept(String line) {
            if (terminated || !line.startsWith("data:")) {
                return List.of();
            }
            String data = line.substring(5).trim();
            if (data.isEmpty()) {
                return List.of();
            }
            if (DONE_MARKER.equals(data)) {
                return finish();
            }
            JsonNode chunk;
            try {
                chunk = objectMapper.readTree(data);
            } catch (JsonProcessingException e) {
                log.warn("[DeepSeek] Skipping malformed stream chunk: {}", e.getMessage());
                return List.of();
            }

            JsonNode usage = chunk.path("usage");
            if (usage.isObject()) {
                inputTokens = usage.path("prompt_tokens").asInt(inputTokens);
                outputTokens = usage.path("completion_tokens").asInt(outputTokens);
            }

            JsonNode choice = chunk.path("choices").path(0);
            if (choice.isMissingNode()) {
                return List.of();
            }
            if (choice.hasNonNull("finish_reason")) {
                finishReason = choice.get("finish_reason").asText();
            }

            List<StreamEvent> events = new ArrayList<>();
            JsonNode delta = choice.path("delta");
            String content = delta.path("content").asText("");
            if (!content.isEmpty()) {
                events.add(StreamEvent.builder().text(content).build());
            }
            for (JsonNode tc : delta.path("tool_calls")) {
                int index = tc.path("index").asInt(toolCalls.size());
                ToolCallBuffer buffer = toolCalls.get(index);
                if (buffer == null) {
                    String id = tc.hasNonNull("id") ? tc.get("id").asText()
                            : LlmHttpSupport.fallbackToolCallId(index);
                    buffer = new ToolCallBuffer(id, tc.path("function").path("name").asText(""));
                    toolCalls.put(index, buffer);
                    events.add(StreamEvent.builder().toolCallId(buffer.id).toolName(buffer.name).build());
                } else if (buffer.name.isEmpty() && tc.path("function").hasNonNull("name")) {
                    buffer.name = tc.path("function").get("name").asText();
                }
                buffer.arguments.append(tc.path("function").path("arguments").asText(""));
            }
            return events;
        }

        List<StreamEvent> finish() {
            if (terminated) {
                return List.of();
            }
            terminated = true;
            List<Message.ToolCall> assembled = toolCalls.values().stream()
                    .map(buffer -> Message.ToolCall.builder()
                            .id(buffer.id)
                            .name(buffer.name)
                            .input(LlmHttpSupport.parseArguments(objectMapper, buffer.arguments.toString(),
                                    PROVIDER_ID))
                            .build())
                    .toList();
            return List.of(StreamEvent.builder()
                    .terminal(true)
                    .finishReason(finishReason)
                    .inputTokens(inputTokens)
                    .outputTokens(outputTokens)
                    .toolCalls(assembled)
                    .build());
        }
    }

    private static final class ToolCallBuffer {
        private final String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();

        private ToolCallBuffer(String id, String name) {
            this.id = id;
            this.name = name;
        }
    }

    @Override
    public ProviderHealth healthCheck() {
        try {
            initialize();
            ModelsResponse models = client.listModels(settings.getApiKey());
            int count = models != null && models.getData() != null ? models.getData().size() : 0;
            return ProviderHealth.healthy(count);
        } catch (RuntimeException e) {
            log.warn("[DeepSeek] Health check failed: {}", e.getMessage());
            return ProviderHealth.unhealthy(e.getMessage());
        }
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // Feign API interface
    public interface DeepSeekApi {
        @RequestLine("POST /v1/chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        ChatCompletionResponse chatCompletion(@Param("apiKey") String apiKey, ChatCompletionRequest request);

        @RequestLine("GET /v1/models")
        @Headers("Authorization: Bearer {apiKey}")
        ModelsResponse listModels(@Param("apiKey") String apiKey);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private List<ApiTool> tools;
        private Double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
        private Boolean stream;
        @JsonProperty("stream_options")
        private Map<String, Object> streamOptions;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
        private ApiUsage usage;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiMessage {
        private String role;
        private String content;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
        @JsonProperty("tool_call_id")
        private String toolCallId;
    }

    @Data
    public static class ApiTool {
        private String type;
        private ApiToolFunction function;
    }

    @Data
    public static class ApiToolFunction {
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiToolCall {
        private String id;
        private String type;
        private ApiFunction function;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiFunction {
        private String name;
        private String arguments;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiUsage {
        @JsonProperty("prompt_tokens")
        private int promptTokens;
        @JsonProperty("completion_tokens")
        private int completionTokens;
        @JsonProperty("total_tokens")
        private int totalTokens;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelsResponse {
        private List<Map<String, Object>> data;
    }

    @Data
    @Builder
    public static class StreamEvent {
        private String text;
        private String toolCallId;
        private String toolName;
        private boolean terminal;
        private String finishReason;
        private int inputTokens;
        private int outputTokens;
        private List<Message.ToolCall> toolCalls;
    }
}
