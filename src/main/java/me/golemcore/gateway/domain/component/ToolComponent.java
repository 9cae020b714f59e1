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

package me.golemcore.gateway.domain.component;

import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A tool executed inside the gateway process. Local tools take precedence over
 * tools of the same name exposed by the tool-execution peer.
 */
public interface ToolComponent {

    /**
     * Returns the definition advertised to the backend: name, description and
     * JSON Schema of the input object.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Runs the tool. A failure the model should see is reported as
     * {@link ToolResult#failure(String)}; throwing
     * {@link me.golemcore.gateway.domain.exception.ToolExecutionException} has
     * the same effect once the dispatcher converts it.
     *
     * @param parameters
     *            the parsed tool input, never {@code null}
     * @return a future with the tool result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    default String getToolName() {
        return getDefinition().getName();
    }
}
