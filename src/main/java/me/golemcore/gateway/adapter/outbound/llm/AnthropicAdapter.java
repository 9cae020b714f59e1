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
import me.golemcore.gateway.domain.exception.VendorCallException;
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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Adapter for the Anthropic Messages API.
 *
 * <p>
 * Anthropic keeps the system prompt outside the message list and encodes tool
 * calls as typed content blocks: {@code tool_use} blocks on assistant messages
 * and {@code tool_result} blocks on the following user message. While
 * streaming, tool arguments arrive as {@code input_json_delta} fragments that
 * are concatenated per content block and parsed on {@code content_block_stop}.
 *
 * <p>
 * Provider ID: {@code "anthropic"}. Requires {@code gateway.providers.anthropic.api-key}.
 */
@Slf4j
public class AnthropicAdapter implements
        LlmProviderPort<AnthropicAdapter.MessagesRequest, AnthropicAdapter.MessagesResponse, AnthropicAdapter.StreamEvent> {

    public static final String PROVIDER_ID = "anthropic";

    private static final Map<String, String> API_MODEL_IDS = Map.of(
            "claude-opus-4", "claude-opus-4-20250514",
            "claude-sonnet-4", "claude-sonnet-4-20250514",
            "claude-3-5-sonnet", "claude-3-5-sonnet-20241022",
            "claude-3-5-haiku", "claude-3-5-haiku-20241022");

    private static final List<ModelInfo> MODELS = List.of(
            model("claude-opus-4", "Claude Opus 4", 15.0, 75.0),
            model("claude-sonnet-4", "Claude Sonnet 4", 3.0, 15.0),
            model("claude-3-5-sonnet", "Claude 3.5 Sonnet", 3.0, 15.0),
            model("claude-3-5-haiku", "Claude 3.5 Haiku", 0.8, 4.0));

    private final GatewayProperties.AnthropicProperties settings;
    private final FeignClientFactory feignClientFactory;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    private AnthropicApi client;
    private volatile boolean initialized;

    public AnthropicAdapter(GatewayProperties.AnthropicProperties settings, FeignClientFactory feignClientFactory,
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
            throw new ProviderConfigurationException("Anthropic API key not configured");
        }
        this.client = feignClientFactory.create(AnthropicApi.class, settings.getBaseUrl());
        initialized = true;
        log.info("[Anthropic] Adapter initialized with URL: {}", settings.getBaseUrl());
    }

    @Override
    public String getDefaultModel() {
        return settings.getDefaultModel();
    }

    @Override
    public List<ModelInfo> getModels() {
        return MODELS;
    }

    /**
     * Short catalogue names map to dated API ids; anything else passes through.
     */
    public static String mapModelName(String model) {
        return API_MODEL_IDS.getOrDefault(model, model);
    }

    // ==================== request ====================

    @Override
    public MessagesRequest normalizeRequest(LlmRequest request) {
        MessagesRequest apiRequest = new MessagesRequest();
        apiRequest.setModel(mapModelName(request.getModel() != null ? request.getModel() : getDefaultModel()));
        apiRequest.setMaxTokens(request.getMaxTokens());
        apiRequest.setTemperature(request.getTemperature());

        List<String> systemParts = new ArrayList<>();
        List<ApiMessage> messages = new ArrayList<>();
        List<ContentBlock> pendingToolResults = new ArrayList<>();

        for (Message msg : request.getMessages()) {
            if (!msg.isToolMessage() && !pendingToolResults.isEmpty()) {
                messages.add(new ApiMessage(Message.ROLE_USER, List.copyOf(pendingToolResults)));
                pendingToolResults.clear();
            }
            if (msg.isSystemMessage()) {
                if (!LlmHttpSupport.isBlank(msg.getContent())) {
                    systemParts.add(msg.getContent());
                }
            } else if (msg.isToolMessage()) {
                pendingToolResults.add(ContentBlock.builder()
                        .type("tool_result")
                        .toolUseId(msg.getToolCallId())
                        .content(msg.getContent())
                        .isError(msg.isErrorResult())
                        .build());
            } else if (msg.isAssistantMessage()) {
                ApiMessage converted = convertAssistant(msg);
                if (converted != null) {
                    messages.add(converted);
                }
            } else {
                messages.add(new ApiMessage(Message.ROLE_USER, msg.getContent() != null ? msg.getContent() : ""));
            }
        }
        if (!pendingToolResults.isEmpty()) {
            messages.add(new ApiMessage(Message.ROLE_USER, List.copyOf(pendingToolResults)));
        }

        apiRequest.setSystem(systemParts.isEmpty() ? null : String.join("\n\n", systemParts));
        apiRequest.setMessages(messages);

        if (request.hasTools()) {
            apiRequest.setTools(request.getTools().stream()
                    .map(tool -> new ApiTool(tool.getName(), tool.getDescription(), tool.getInputSchema()))
                    .toList());
        }
        return apiRequest;
    }

    private ApiMessage convertAssistant(Message msg) {
        List<ContentBlock> blocks = new ArrayList<>();
        if (!LlmHttpSupport.isBlank(msg.getContent())) {
            blocks.add(ContentBlock.builder().type("text").text(msg.getContent()).build());
        }
        if (msg.hasToolCalls()) {
            for (Message.ToolCall tc : msg.getToolCalls()) {
                blocks.add(ContentBlock.builder()
                        .type("tool_use")
                        .id(tc.getId())
                        .name(tc.getName())
                        .input(tc.getInput() != null ? tc.getInput() : Map.of())
                        .build());
            }
        }
        if (blocks.isEmpty()) {
            return null;
        }
        if (blocks.size() == 1 && "text".equals(blocks.get(0).getType())) {
            return new ApiMessage(Message.ROLE_ASSISTANT, blocks.get(0).getText());
        }
        return new ApiMessage(Message.ROLE_ASSISTANT, blocks);
    }

    // ==================== complete ====================

    @Override
    public MessagesResponse complete(MessagesRequest vendorRequest) {
        initialize();
        vendorRequest.setStream(null);
        try {
            return client.createMessage(settings.getApiKey(), settings.getApiVersion(), vendorRequest);
        } catch (RuntimeException e) {
            log.error("[Anthropic] Completion failed: {}", e.getMessage());
            throw LlmHttpSupport.toVendorException(PROVIDER_ID, e);
        }
    }

    @Override
    public LlmResponse normalizeResponse(MessagesResponse vendorResponse) {
        StringBuilder text = new StringBuilder();
        List<Message.ToolCall> toolCalls = new ArrayList<>();
        if (vendorResponse.getContent() != null) {
            for (ContentBlock block : vendorResponse.getContent()) {
                if ("text".equals(block.getType()) && block.getText() != null) {
                    text.append(block.getText());
                } else if ("tool_use".equals(block.getType())) {
                    toolCalls.add(Message.ToolCall.builder()
                            .id(block.getId())
                            .name(block.getName())
                            .input(block.getInput() != null ? block.getInput() : Map.of())
                            .build());
                }
            }
        }

        LlmUsage usage = vendorResponse.getUsage() != null
                ? LlmUsage.of(vendorResponse.getUsage().getInputTokens(), vendorResponse.getUsage().getOutputTokens())
                : LlmUsage.empty();

        return LlmResponse.builder()
                .id(vendorResponse.getId())
                .content(text.toString())
                .toolCalls(toolCalls.isEmpty() ? null : toolCalls)
                .stopReason(mapStopReason(vendorResponse.getStopReason(), !toolCalls.isEmpty()))
                .usage(usage)
                .model(vendorResponse.getModel())
                .provider(PROVIDER_ID)
                .build();
    }

    static StopReason mapStopReason(String stopReason, boolean hasToolCalls) {
        if (stopReason == null) {
            return hasToolCalls ? StopReason.TOOL_USE : StopReason.END_TURN;
        }
        return switch (stopReason) {
        case "tool_use" -> StopReason.TOOL_USE;
        case "max_tokens" -> StopReason.MAX_TOKENS;
        case "stop_sequence" -> StopReason.STOP_SEQUENCE;
        default -> StopReason.END_TURN;
        };
    }

    // ==================== stream ====================

    @Override
    public Flux<StreamEvent> stream(MessagesRequest vendorRequest) {
        initialize();
        vendorRequest.setStream(true);
        Request request = new Request.Builder()
                .url(stripSlash(settings.getBaseUrl()) + "/v1/messages")
                .header("x-api-key", settings.getApiKey())
                .header("anthropic-version", settings.getApiVersion())
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
                    .stopReason(mapStopReason(event.getStopReason(), !toolCalls.isEmpty()))
                    .build();
        }
        if (event.getToolUseId() != null) {
            return LlmChunk.builder()
                    .toolCallStarted(Message.ToolCall.builder()
                            .id(event.getToolUseId())
                            .name(event.getToolName())
                            .build())
                    .build();
        }
        return LlmChunk.text(event.getText());
    }

    /**
     * Folds Anthropic SSE events into text, tool-start and terminal events.
     * Stateful; one instance per stream.
     */
    final class StreamAssembler {

        private final Map<Integer, ToolAccumulator> toolBlocks = new TreeMap<>();
        private final List<Message.ToolCall> finishedTools = new ArrayList<>();
        private int inputTokens;
        private int outputTokens;
        private String stopReason;
        private boolean terminated;

        List<StreamEvent> accept(String line) {
            if (terminated || !line.startsWith("data:")) {
                return List.of();
            }
            String data = line.substring(5).trim();
            if (data.isEmpty()) {
                return List.of();
            }
            JsonNode event;
            try {
                event = objectMapper.readTree(data);
            } catch (JsonProcessingException e) {
                log.warn("[Anthropic] Skipping malformed stream event: {}", e.getMessage());
                return List.of();
            }

            String type = event.path("type").asText();
            switch (type) {
            case "message_start" -> {
                JsonNode usage = event.path("message").path("usage");
                inputTokens = usage.path("input_tokens").asInt(inputTokens);
                outputTokens = usage.path("output_tokens").asInt(outputTokens);
            }
            case "content_block_start" -> {
                JsonNode block = event.path("content_block");
                if ("tool_use".equals(block.path("type").asText())) {
                    int index = event.path("index").asInt();
                    String id = block.path("id").asText();
                    String name = block.path("name").asText();
                    toolBlocks.put(index, new ToolAccumulator(id, name));
                    return List.of(StreamEvent.builder().toolUseId(id).toolName(name).build());
                }
                String initialText = block.path("text").asText("");
                if (!initialText.isEmpty()) {
                    return List.of(StreamEvent.builder().text(initialText).build());
                }
            }
            case "content_block_delta" -> {
                JsonNode delta = event.path("delta");
                String deltaType = delta.path("type").asText();
                if ("text_delta".equals(deltaType)) {
                    return List.of(StreamEvent.builder().text(delta.path("text").asText("")).build());
                }
                if ("input_json_delta".equals(deltaType)) {
                    ToolAccumulator accumulator = toolBlocks.get(event.path("index").asInt());
                    if (accumulator != null) {
                        accumulator.json.append(delta.path("partial_json").asText(""));
                    }
                }
            }
            case "content_block_stop" -> {
                ToolAccumulator accumulator = toolBlocks.remove(event.path("index").asInt());
                if (accumulator != null) {
                    finishedTools.add(accumulator.toToolCall());
                }
            }
            case "message_delta" -> {
                JsonNode delta = event.path("delta");
                if (delta.hasNonNull("stop_reason")) {
                    stopReason = delta.get("stop_reason").asText();
                }
                JsonNode usage = event.path("usage");
                if (usage.has("output_tokens")) {
                    outputTokens = usage.get("output_tokens").asInt();
                }
                if (usage.has("input_tokens")) {
                    inputTokens = usage.get("input_tokens").asInt();
                }
            }
            case "message_stop" -> {
                return finish();
            }
            case "error" -> throw new VendorCallException(PROVIDER_ID,
                    "Anthropic stream error: " + event.path("error").path("message").asText("unknown"));
            default -> log.trace("[Anthropic] Ignoring stream event {}", type);
            }
            return List.of();
        }

        List<StreamEvent> finish() {
            if (terminated) {
                return List.of();
            }
            terminated = true;
            for (ToolAccumulator accumulator : toolBlocks.values()) {
                finishedTools.add(accumulator.toToolCall());
            }
            toolBlocks.clear();
            return List.of(StreamEvent.builder()
                    .terminal(true)
                    .stopReason(stopReason)
                    .inputTokens(inputTokens)
                    .outputTokens(outputTokens)
                    .toolCalls(List.copyOf(finishedTools))
                    .build());
        }
    }

    private final class ToolAccumulator {
        private final String id;
        private final String name;
        private final StringBuilder json = new StringBuilder();

        private ToolAccumulator(String id, String name) {
            this.id = id;
            this.name = name;
        }

        private Message.ToolCall toToolCall() {
            return Message.ToolCall.builder()
                    .id(id)
                    .name(name)
                    .input(LlmHttpSupport.parseArguments(objectMapper, json.toString(), PROVIDER_ID))
                    .build();
        }
    }

    // ==================== health ====================

    @Override
    public ProviderHealth healthCheck() {
        if (!initialized) {
            return ProviderHealth.unhealthy("not initialized");
        }
        return ProviderHealth.healthy(MODELS.size());
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static ModelInfo model(String id, String name, double input, double output) {
        return ModelInfo.builder()
                .id(id)
                .name(name)
                .provider(PROVIDER_ID)
                .inputPricePerMillion(input)
                .outputPricePerMillion(output)
                .build();
    }

    // Feign API interface
    public interface AnthropicApi {
        @RequestLine("POST /v1/messages")
        @Headers({
                "Content-Type: application/json",
                "x-api-key: {apiKey}",
                "anthropic-version: {version}"
        })
        MessagesResponse createMessage(@Param("apiKey") String apiKey, @Param("version") String version,
                MessagesRequest request);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class MessagesRequest {
        private String model;
        private String system;
        private List<ApiMessage> messages;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
        private Double temperature;
        private List<ApiTool> tools;
        private Boolean stream;
    }

    /**
     * {@code content} is either a plain string or a list of content blocks.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ApiMessage {
        private String role;
        private Object content;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContentBlock {
        private String type;
        private String text;
        private String id;
        private String name;
        private Map<String, Object> input;
        @JsonProperty("tool_use_id")
        private String toolUseId;
        private String content;
        @JsonProperty("is_error")
        private Boolean isError;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApiTool {
        private String name;
        private String description;
        @JsonProperty("input_schema")
        private Map<String, Object> inputSchema;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessagesResponse {
        private String id;
        private String type;
        private String role;
        private String model;
        private List<ContentBlock> content;
        @JsonProperty("stop_reason")
        private String stopReason;
        private ApiUsage usage;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiUsage {
        @JsonProperty("input_tokens")
        private int inputTokens;
        @JsonProperty("output_tokens")
        private int outputTokens;
    }

    /**
     * Decoded Anthropic stream event: a text delta, the start of a tool_use
     * block, or the terminal event with usage and assembled tool calls.
     */
    @Data
    @Builder
    public static class StreamEvent {
        private String text;
        private String toolUseId;
        private String toolName;
        private boolean terminal;
        private String stopReason;
        private int inputTokens;
        private int outputTokens;
        private List<Message.ToolCall> toolCalls;
    }
}
