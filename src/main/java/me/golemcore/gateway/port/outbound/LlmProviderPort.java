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

package me.golemcore.gateway.port.outbound;

import me.golemcore.gateway.domain.model.LlmChunk;
import me.golemcore.gateway.domain.model.LlmRequest;
import me.golemcore.gateway.domain.model.LlmResponse;
import me.golemcore.gateway.domain.model.ModelInfo;
import me.golemcore.gateway.domain.model.ProviderHealth;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Contract every vendor backend implements. The type parameters are the
 * vendor's own request, response and stream-event shapes; callers only ever
 * see the normalized {@link LlmResponse} and {@link LlmChunk}.
 *
 * <p>
 * Tool-call fragments (partial JSON arguments, index-keyed deltas) are
 * reassembled inside the adapter. A stream event that carries tool calls always
 * carries them complete.
 *
 * @param <Q>
 *            vendor request
 * @param <R>
 *            vendor response
 * @param <C>
 *            vendor stream event
 */
public interface LlmProviderPort<Q, R, C> {

    String getProviderId();

    /**
     * Prepares the adapter.
     *
     * @throws me.golemcore.gateway.domain.exception.ProviderConfigurationException
     *             when required credentials are missing
     */
    void initialize();

    /**
     * Maps a generic request into the vendor shape. Pure: no I/O, no state.
     */
    Q normalizeRequest(LlmRequest request);

    /**
     * One blocking request/response call.
     *
     * @throws me.golemcore.gateway.domain.exception.VendorCallException
     *             on any transport or vendor error
     */
    R complete(Q vendorRequest);

    /**
     * Lazy, finite stream of vendor events. The last event is the terminal one
     * and carries the final usage and every assembled tool call. Cancelling the
     * subscription cancels the underlying HTTP call.
     */
    Flux<C> stream(Q vendorRequest);

    LlmResponse normalizeResponse(R vendorResponse);

    LlmChunk normalizeChunk(C vendorChunk);

    ProviderHealth healthCheck();

    List<ModelInfo> getModels();

    String getDefaultModel();
}
