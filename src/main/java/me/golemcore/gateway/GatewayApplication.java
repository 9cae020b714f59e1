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

package me.golemcore.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Multi-provider completion gateway for the LaTeX editor's AI assistant.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Provider adapters</b> - Anthropic, DeepSeek and a local Ollama server
 * behind one request/response and streaming model</li>
 * <li><b>Agentic loop</b> - bounded backend/tool rounds per user turn, with
 * in-process tools and an MCP tool server</li>
 * <li><b>Conversations</b> - file-based sessions with append-only message
 * logs</li>
 * <li><b>Cost tracking</b> - per user, project, provider and day, with tier
 * limits</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → REST and SSE controllers
 * Domain Layer       → CompletionService, AgenticLoopController, CompletionGateway
 * Infrastructure     → provider adapters, MCP client, local storage
 * </pre>
 *
 * <p>
 * All configuration lives under the {@code gateway.*} prefix of
 * {@code application.yml}.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }

}
