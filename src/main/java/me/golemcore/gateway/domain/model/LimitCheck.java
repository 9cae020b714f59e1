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

package me.golemcore.gateway.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Result of comparing a user's usage today against a tier. Remaining headroom
 * never goes below zero; for unlimited tiers it is {@code -1}.
 */
@Data
@Builder
public class LimitCheck {

    private boolean withinLimits;
    private String tier;
    private UsageTotals usage;
    private TierLimits limits;
    private long remainingRequests;
    private long remainingTokens;
    private double remainingCost;
}
