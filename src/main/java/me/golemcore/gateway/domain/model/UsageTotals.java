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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregated usage: number of backend calls, token totals and cost.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageTotals {

    private long requestCount;
    private long tokensInput;
    private long tokensOutput;
    private double costUsd;

    public long getTotalTokens() {
        return tokensInput + tokensOutput;
    }

    public static UsageTotals empty() {
        return new UsageTotals(0, 0, 0, 0);
    }
}
