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

import java.util.List;
import java.util.Locale;

/**
 * Context window, strengths and relative price class of a model.
 */
public record ModelCapabilities(String model, int maxTokens, List<String> strengths, CostTier costTier) {

    public enum CostTier {
        FREE, ECONOMY, STANDARD, PREMIUM;

        public static CostTier fromName(String name) {
            if (name == null || name.isBlank()) {
                return PREMIUM;
            }
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        }
    }
}
