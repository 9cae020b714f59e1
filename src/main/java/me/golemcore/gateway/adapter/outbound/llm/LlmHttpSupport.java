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

import me.golemcore.gateway.domain.exception.VendorCallException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SynchronousSink;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;

/**
 * Wire helpers shared by the provider adapters: line-oriented streaming over
 * OkHttp, JSON argument parsing and error translation.
 */
@Slf4j
final class LlmHttpSupport {

    static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final int MAX_ERROR_BODY = 500;

    private LlmHttpSupport() {
    }

    /**
     * Streams the response body line by line. The HTTP call starts on
     * subscription, a line is read only when the subscriber asks for one, and
     * the call is cancelled when the subscriber cancels.
     */
    static Flux<String> streamLines(OkHttpClient client, Request request, String providerId) {
        return Flux.defer(() -> {
            Call call = client.newCall(request);
            return Flux.using(
                    () -> open(call, providerId),
                    response -> Flux.<String, BufferedSource>generate(() -> response.body().source(),
                            (source, sink) -> {
                                readLine(call, source, sink, providerId);
                                return source;
                            }),
                    Response::close)
                    .doOnCancel(call::cancel);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static Response open(Call call, String providerId) {
        Response response = execute(call, providerId);
        ResponseBody body = response.body();
        if (!response.isSuccessful()) {
            try (response) {
                String errorBody = body != null ? body.string() : "";
                throw new VendorCallException(providerId, response.code(),
                        providerId + " stream failed with HTTP " + response.code() + ": " + abbreviate(errorBody),
                        null);
            } catch (IOException e) {
                throw new VendorCallException(providerId, response.code(),
                        providerId + " stream failed with HTTP " + response.code(), e);
            }
        }
        if (body == null) {
            response.close();
            throw new VendorCallException(providerId, "Empty stream body");
        }
        return response;
    }

    private static Response execute(Call call, String providerId) {
        try {
            return call.execute();
        } catch (IOException e) {
            throw new VendorCallException(providerId, providerId + " stream failed: " + e.getMessage(), e);
        }
    }

    private static void readLine(Call call, BufferedSource source, SynchronousSink<String> sink,
            String providerId) {
        try {
            String line = source.readUtf8Line();
            if (line != null) {
                sink.next(line);
            } else {
                sink.complete();
            }
        } catch (IOException e) {
            if (call.isCanceled()) {
                log.debug("[{}] Stream cancelled: {}", providerId, e.getMessage());
                sink.complete();
            } else {
                sink.error(new VendorCallException(providerId, providerId + " stream failed: " + e.getMessage(),
                        e));
            }
        }
    }

    static RequestBody jsonBody(ObjectMapper objectMapper, Object payload, String providerId) {
        try {
            return RequestBody.create(objectMapper.writeValueAsString(payload), JSON);
        } catch (JsonProcessingException e) {
            throw new VendorCallException(providerId, "Failed to encode request: " + e.getMessage(), e);
        }
    }

    static VendorCallException toVendorException(String providerId, RuntimeException e) {
        if (e instanceof VendorCallException vendorCallException) {
            return vendorCallException;
        }
        if (e instanceof FeignException feignException) {
            String body = feignException.contentUTF8();
            return new VendorCallException(providerId, feignException.status(),
                    providerId + " call failed with HTTP " + feignException.status() + ": "
                            + abbreviate(body != null && !body.isBlank() ? body : feignException.getMessage()),
                    e);
        }
        return new VendorCallException(providerId, providerId + " call failed: " + e.getMessage(), e);
    }

    /**
     * Parses a complete JSON object of tool arguments. Blank input is an empty
     * object; malformed input is kept under {@code _raw} so nothing is lost.
     */
    static Map<String, Object> parseArguments(ObjectMapper objectMapper, String json, String providerId) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, MAP_TYPE);
            return parsed != null ? parsed : Collections.emptyMap();
        } catch (JsonProcessingException e) {
            log.warn("[{}] Unparseable tool arguments: {}", providerId, abbreviate(json));
            return Map.of("_raw", json);
        }
    }

    static String toJson(ObjectMapper objectMapper, Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool arguments are not serializable", e);
        }
    }

    static String fallbackToolCallId(int index) {
        return "call_" + index + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_ERROR_BODY ? text.substring(0, MAX_ERROR_BODY) + "..." : text;
    }
}
