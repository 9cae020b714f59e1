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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.component.ToolComponent;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-process tools keyed by name. Populated once from the Spring context;
 * empty when {@code gateway.agent.builtin-tools-enabled} is off.
 */
@Component
@Slf4j
public class LocalToolRegistry {

    private final Map<String, ToolComponent> tools;

    public LocalToolRegistry(List<ToolComponent> components, GatewayProperties properties) {
        Map<String, ToolComponent> byName = new LinkedHashMap<>();
        if (properties.getAgent().isBuiltinToolsEnabled()) {
            for (ToolComponent component : components) {
                ToolComponent previous = byName.putIfAbsent(component.getToolName(), component);
                if (previous != null) {
                    log.warn("[AgentLoop] Duplicate local tool '{}', keeping {}", component.getToolName(),
                            previous.getClass().getSimpleName());
                }
            }
        }
        this.tools = Collections.unmodifiableMap(byName);
        log.info("[AgentLoop] Local tools: {}", tools.keySet());
    }

    public Optional<ToolComponent> find(String name) {
        return Optional.ofNullable(name).map(tools::get);
    }

    public List<ToolDefinition> definitions() {
        return tools.values().stream().map(ToolComponent::getDefinition).toList();
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }
}
