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

package me.golemcore.gateway.routing;

import me.golemcore.gateway.domain.model.ModelRecommendation;
import me.golemcore.gateway.routing.ModelCapabilities.CostTier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static task-type and tier based model selection.
 *
 * <p>
 * {@link #detectTaskType(String)} classifies free text by keywords; the first
 * matching group wins, in this order: peer review, LaTeX, literature search,
 * analysis, translation, code, edit.
 */
@Component
public class ModelRouter {

    public static final String PEER_REVIEW = "peer-review";
    public static final String LATEX_GENERATION = "latex-generation";
    public static final String LITERATURE_SEARCH = "literature-search";
    public static final String SCIENTIFIC_ANALYSIS = "scientific-analysis";
    public static final String TRANSLATION = "translation";
    public static final String CODE_GENERATION = "code-generation";
    public static final String SIMPLE_EDIT = "simple-edit";

    private static final String TIER_FREE = "free";
    private static final String ANTHROPIC = "anthropic";
    private static final String OLLAMA = "ollama";

    private static final List<Map.Entry<String, List<String>>> KEYWORDS = List.of(
            Map.entry(PEER_REVIEW, List.of("review", "critique", "feedback")),
            Map.entry(LATEX_GENERATION, List.of("latex", "equation", "table", "figure")),
            Map.entry(LITERATURE_SEARCH, List.of("research", "literature", "citation", "reference")),
            Map.entry(SCIENTIFIC_ANALYSIS, List.of("analyze", "analysis", "interpret")),
            Map.entry(TRANSLATION, List.of("translate", "translation")),
            Map.entry(CODE_GENERATION, List.of("code", "script", "algorithm")),
            Map.entry(SIMPLE_EDIT, List.of("improve", "rewrite", "edit")));

    private static final Map<String, String[]> DEFAULT_ROW = tierRow(
            ANTHROPIC, "claude-3-5-haiku",
            ANTHROPIC, "claude-3-5-sonnet",
            ANTHROPIC, "claude-sonnet-4",
            ANTHROPIC, "claude-opus-4");

    private static final Map<String, Map<String, String[]>> RECOMMENDATIONS = buildRecommendations();

    private static final Map<String, ModelCapabilities> CAPABILITIES = buildCapabilities();

    /**
     * Recommended provider and model for a task type and tier. Unknown task
     * types use the default row; unknown tiers use the free column.
     */
    public ModelRecommendation recommend(String taskType, String userTier) {
        Map<String, String[]> row = taskType != null ? RECOMMENDATIONS.get(taskType) : null;
        String effectiveTask = row != null ? taskType : "default";
        if (row == null) {
            row = DEFAULT_ROW;
        }
        String tier = userTier != null && row.containsKey(userTier) ? userTier : TIER_FREE;
        String[] choice = row.get(tier);
        return ModelRecommendation.builder()
                .provider(choice[0])
                .model(choice[1])
                .reason("Recommended for " + effectiveTask + " on the " + tier + " tier")
                .build();
    }

    public String detectTaskType(String text) {
        if (text == null || text.isBlank()) {
            return SIMPLE_EDIT;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> group : KEYWORDS) {
            for (String keyword : group.getValue()) {
                if (lower.contains(keyword)) {
                    return group.getKey();
                }
            }
        }
        return SIMPLE_EDIT;
    }

    public List<String> getTaskTypes() {
        return List.copyOf(RECOMMENDATIONS.keySet());
    }

    public Optional<ModelCapabilities> getCapabilities(String model) {
        return Optional.ofNullable(model != null ? CAPABILITIES.get(model) : null);
    }

    /**
     * Models with at least {@code minTokens} of context and no pricier than
     * {@code maxCostTier}, ordered by the number of requested strengths they
     * have.
     */
    public List<ModelCapabilities> findBestModels(int minTokens, CostTier maxCostTier, List<String> strengths) {
        CostTier ceiling = maxCostTier != null ? maxCostTier : CostTier.PREMIUM;
        List<String> wanted = strengths != null ? strengths : List.of();

        List<ModelCapabilities> suitable = new ArrayList<>();
        for (ModelCapabilities caps : CAPABILITIES.values()) {
            if (minTokens > 0 && caps.maxTokens() < minTokens) {
                continue;
            }
            if (caps.costTier().compareTo(ceiling) > 0) {
                continue;
            }
            suitable.add(caps);
        }
        suitable.sort(Comparator.comparingLong((ModelCapabilities caps) -> score(caps, wanted)).reversed());
        return suitable;
    }

    private static long score(ModelCapabilities caps, List<String> wanted) {
        return wanted.stream().filter(caps.strengths()::contains).count();
    }

    private static Map<String, Map<String, String[]>> buildRecommendations() {
        Map<String, Map<String, String[]>> table = new LinkedHashMap<>();
        table.put(SIMPLE_EDIT, tierRow(
                ANTHROPIC, "claude-3-5-haiku", ANTHROPIC, "claude-3-5-sonnet",
                ANTHROPIC, "claude-3-5-sonnet", ANTHROPIC, "claude-sonnet-4"));
        table.put(SCIENTIFIC_ANALYSIS, tierRow(
                ANTHROPIC, "claude-3-5-haiku", ANTHROPIC, "claude-sonnet-4",
                ANTHROPIC, "claude-sonnet-4", ANTHROPIC, "claude-opus-4"));
        table.put("complex-reasoning", tierRow(
                OLLAMA, "llama3.2", ANTHROPIC, "claude-sonnet-4",
                ANTHROPIC, "claude-opus-4", ANTHROPIC, "claude-opus-4"));
        table.put(LATEX_GENERATION, tierRow(
                ANTHROPIC, "claude-3-5-haiku", ANTHROPIC, "claude-3-5-sonnet",
                ANTHROPIC, "claude-sonnet-4", ANTHROPIC, "claude-sonnet-4"));
        table.put("fast-local", tierRow(
                OLLAMA, "llama3.2", OLLAMA, "llama3.2", OLLAMA, "llama3.2", OLLAMA, "llama3.2"));
        table.put("cost-optimized", tierRow(
                OLLAMA, "llama3.2", "groq", "llama-3.3-70b", "groq", "llama-3.3-70b", "groq", "llama-3.3-70b"));
        table.put(LITERATURE_SEARCH, tierRow(
                ANTHROPIC, "claude-3-5-haiku", ANTHROPIC, "claude-3-5-sonnet",
                ANTHROPIC, "claude-sonnet-4", ANTHROPIC, "claude-opus-4"));
        table.put(PEER_REVIEW, tierRow(
                OLLAMA, "llama3.2", ANTHROPIC, "claude-sonnet-4",
                ANTHROPIC, "claude-opus-4", ANTHROPIC, "claude-opus-4"));
        table.put(CODE_GENERATION, tierRow(
                ANTHROPIC, "claude-3-5-haiku", ANTHROPIC, "claude-3-5-sonnet",
                ANTHROPIC, "claude-sonnet-4", ANTHROPIC, "claude-sonnet-4"));
        table.put(TRANSLATION, tierRow(
                ANTHROPIC, "claude-3-5-haiku", ANTHROPIC, "claude-3-5-sonnet",
                ANTHROPIC, "claude-3-5-sonnet", ANTHROPIC, "claude-sonnet-4"));
        return table;
    }

    // free, pro, team, enterprise
    private static Map<String, String[]> tierRow(String... pairs) {
        Map<String, String[]> row = new LinkedHashMap<>();
        String[] tiers = { TIER_FREE, "pro", "team", "enterprise" };
        for (int i = 0; i < tiers.length; i++) {
            row.put(tiers[i], new String[] { pairs[i * 2], pairs[i * 2 + 1] });
        }
        return row;
    }

    private static Map<String, ModelCapabilities> buildCapabilities() {
        Map<String, ModelCapabilities> caps = new LinkedHashMap<>();
        add(caps, "claude-opus-4", 200_000, CostTier.PREMIUM,
                "complex-reasoning", "scientific-analysis", "long-context", "creativity");
        add(caps, "claude-sonnet-4", 200_000, CostTier.STANDARD, "balanced", "scientific-writing", "code", "analysis");
        add(caps, "claude-3-5-sonnet", 200_000, CostTier.STANDARD, "balanced", "writing", "code");
        add(caps, "claude-3-5-haiku", 200_000, CostTier.ECONOMY, "fast", "simple-tasks", "cost-effective");
        add(caps, "llama3.2", 128_000, CostTier.FREE, "local", "privacy", "free");
        add(caps, "llama-3.3-70b", 128_000, CostTier.ECONOMY, "fast", "cost-effective", "general");
        return caps;
    }

    private static void add(Map<String, ModelCapabilities> caps, String model, int maxTokens, CostTier tier,
            String... strengths) {
        caps.put(model, new ModelCapabilities(model, maxTokens, List.of(strengths), tier));
    }
}
