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

package me.golemcore.gateway.domain.system.toolloop;

import lombok.Builder;
import lombok.Getter;
import me.golemcore.gateway.domain.model.LlmRequest;

import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * One invocation of the agentic loop. {@code requests} is asked for a fresh
 * backend request before every call, so each round sees the tool results the
 * previous round persisted.
 */
@Getter
@Builder
public class AgenticLoopRequest {

    private final String sessionId;
    private final Supplier<LlmRequest> requests;

    @Builder.Default
    private final ToolLoopObserver observer = ToolLoopObserver.NOOP;

    /**
     * Tools the client executes itself. Calls to them that no local tool or
     * peer tool answers are left pending and end the turn.
     */
    @Builder.Default
    private final Set<String> clientToolNames = Set.of();

    @Builder.Default
    private final BooleanSupplier cancelled = () -> false;

    /**
     * Overrides {@code gateway.agent.max-iterations} when not null.
     */
    private final Integer maxIterations;
}
