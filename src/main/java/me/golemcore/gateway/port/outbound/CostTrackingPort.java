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

import me.golemcore.gateway.domain.model.CostBreakdown;
import me.golemcore.gateway.domain.model.LimitCheck;
import me.golemcore.gateway.domain.model.LlmUsage;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.UsageSummary;
import me.golemcore.gateway.domain.model.UsageTotals;

import java.time.LocalDate;
import java.util.List;

/**
 * Usage accounting fed by the completion gateway.
 */
public interface CostTrackingPort {

    CostBreakdown track(UsageEvent event);

    CostBreakdown calculateCost(String provider, String model, LlmUsage usage);

    UsageSummary getSummary(String userId);

    UsageTotals getDailyUsage(String userId, LocalDate date);

    UsageTotals getSessionTotals(String sessionId);

    /**
     * Recomputes usage from a persisted message list, pricing every assistant
     * message by its recorded provider, model and tokens.
     */
    UsageTotals recompute(List<Message> messages);

    LimitCheck checkLimits(String userId, String tier);

    void resetDailyUsage(String userId);

    /**
     * One tracked backend call.
     */
    record UsageEvent(String provider, String model, LlmUsage usage, String userId, String projectId,
            String sessionId) {
    }
}
