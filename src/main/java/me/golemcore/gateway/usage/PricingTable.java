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

package me.golemcore.gateway.usage;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Static per-provider, per-model prices in USD per million tokens.
 *
 * <p>
 * Providers listed with a {@code default} entry price every model the same
 * way. Dated snapshot ids such as {@code claude-sonnet-4-20250514} price as
 * their catalogue name. Anything not listed costs nothing.
 */
public final class PricingTable {

    private static final String DEFAULT_ENTRY = "default";
    private static final Pattern DATED_SNAPSHOT = Pattern.compile("-\\d{8}$");

    private static final Price FREE = new Price(0, 0);

    private static final Map<String, Map<String, Price>> PRICES = Map.of(
            "anthropic", Map.of(
                    "claude-opus-4", new Price(15.00, 75.00),
                    "claude-sonnet-4", new Price(3.00, 15.00),
                    "claude-3-5-haiku", new Price(0.80, 4.00),
                    "claude-3-5-sonnet", new Price(3.00, 15.00)),
            "deepseek", Map.of(
                    "deepseek-chat", new Price(0.27, 1.10),
                    "deepseek-reasoner", new Price(0.55, 2.19)),
            "openai", Map.of(
                    "gpt-4o", new Price(5.00, 15.00),
                    "gpt-4o-mini", new Price(0.15, 0.60),
                    "o1", new Price(15.00, 60.00),
                    "o3-mini", new Price(1.10, 4.40)),
            "google", Map.of(
                    "gemini-2.0-pro", new Price(1.25, 5.00),
                    "gemini-2.0-flash", new Price(0.075, 0.30)),
            "groq", Map.of(
                    "llama-3.3-70b", new Price(0.59, 0.79),
                    "mixtral-8x7b", new Price(0.24, 0.24)),
            "together", Map.of(
                    "llama-3.3-70b", new Price(0.88, 0.88),
                    "mixtral-8x22b", new Price(1.20, 1.20)),
            "ollama", Map.of(DEFAULT_ENTRY, FREE),
            "openrouter", Map.of(DEFAULT_ENTRY, FREE));

    private PricingTable() {
    }

    public static Price priceOf(String provider, String model) {
        if (provider == null) {
            return FREE;
        }
        Map<String, Price> providerPrices = PRICES.get(provider);
        if (providerPrices == null) {
            return FREE;
        }
        Price price = model != null ? providerPrices.get(model) : null;
        if (price == null && model != null && DATED_SNAPSHOT.matcher(model).find()) {
            price = providerPrices.get(DATED_SNAPSHOT.matcher(model).replaceFirst(""));
        }
        if (price == null) {
            price = providerPrices.getOrDefault(DEFAULT_ENTRY, FREE);
        }
        return price;
    }

    public static Map<String, Map<String, Price>> all() {
        return PRICES;
    }

    public record Price(double inputPerMillion, double outputPerMillion) {
    }
}
