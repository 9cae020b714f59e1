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

package me.golemcore.gateway.infrastructure.config;

import me.golemcore.gateway.domain.model.TierLimits;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the gateway, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code gateway.*} prefix:
 * <ul>
 * <li>{@link ProvidersProperties} - vendor credentials and endpoints</li>
 * <li>{@link AgentProperties} - agentic loop and prompt settings</li>
 * <li>{@link SessionsProperties} - conversation log defaults</li>
 * <li>{@link LimitsProperties} - per-tier daily limits</li>
 * <li>{@link McpProperties} - the tool-execution peer process</li>
 * <li>{@link StorageProperties} and {@link HttpProperties}</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    private String defaultProvider = "deepseek";
    private String defaultModel = "deepseek-chat";

    private ProvidersProperties providers = new ProvidersProperties();
    private AgentProperties agent = new AgentProperties();
    private SessionsProperties sessions = new SessionsProperties();
    private LimitsProperties limits = new LimitsProperties();
    private McpProperties mcp = new McpProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== PROVIDERS ====================

    @Data
    public static class ProvidersProperties {
        private boolean checkHealthOnStartup = true;
        private AnthropicProperties anthropic = new AnthropicProperties();
        private DeepSeekProperties deepseek = new DeepSeekProperties();
        private OllamaProperties ollama = new OllamaProperties();
    }

    @Data
    public static class AnthropicProperties {
        private String apiKey;
        private String baseUrl = "https://api.anthropic.com";
        private String apiVersion = "2023-06-01";
        private String defaultModel = "claude-3-5-haiku";
    }

    @Data
    public static class DeepSeekProperties {
        private String apiKey;
        private String baseUrl = "https://api.deepseek.com";
        private String defaultModel = "deepseek-chat";
    }

    @Data
    public static class OllamaProperties {
        private boolean enabled = false;
        private String baseUrl = "http://ollama:11434";
        private String defaultModel = "llama3.2";
    }

    // ==================== AGENT ====================

    @Data
    public static class AgentProperties {
        private int maxIterations = 10;
        private int historyLimit = 20;
        private int maxTokens = 4096;
        private double temperature = 0.7;
        private String systemPrompt = "You are a helpful AI writing assistant for scientific documents written in LaTeX.";
        private String skillsPrompt = "";
        private int documentContextMaxChars = 3000;
        private boolean builtinToolsEnabled = true;
        private QuickEditProperties quickEdit = new QuickEditProperties();
    }

    @Data
    public static class QuickEditProperties {
        private String provider = "deepseek";
        private String model = "deepseek-chat";
        private int maxTokens = 2048;
        private double temperature = 0.3;
    }

    // ==================== SESSIONS ====================

    @Data
    public static class SessionsProperties {
        private int historyLimit = 100;
        private int exportLimit = 10000;
        private String defaultTitle = "New Conversation";
        private int titleMaxLength = 50;
        private String defaultProvider;
        private String defaultModel;
    }

    // ==================== LIMITS ====================

    @Data
    public static class LimitsProperties {
        private boolean enforce = false;
        private String defaultTier = "free";
        private Map<String, TierLimits> tiers = defaultTiers();

        private static Map<String, TierLimits> defaultTiers() {
            Map<String, TierLimits> tiers = new LinkedHashMap<>();
            tiers.put("free", new TierLimits(50, 50_000, 0.50));
            tiers.put("pro", new TierLimits(500, 500_000, 5.00));
            tiers.put("team", new TierLimits(1000, 1_000_000, 10.00));
            tiers.put("enterprise", TierLimits.unlimited());
            return tiers;
        }
    }

    // ==================== MCP ====================

    @Data
    public static class McpProperties {
        private boolean enabled = false;
        private String name = "skills";
        private String command = "uvx";
        private List<String> args = new ArrayList<>(List.of("claude-skills-mcp"));
        private Map<String, String> env = new HashMap<>();
        private int startupTimeoutSeconds = 300;
        private int requestTimeoutSeconds = 60;
    }

    // ==================== STORAGE / HTTP ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/gateway";
        private String sessionsDirectory = "sessions";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
