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
 * Daily ceilings of a subscription tier. A negative value leaves that
 * dimension unlimited.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TierLimits {

    private long requestsPerDay;
    private long tokensPerDay;
    private double maxCostPerDay;

    public boolean isUnlimited() {
        return requestsPerDay < 0 && tokensPerDay < 0 && maxCostPerDay < 0;
    }

    public boolean allowsRequests(long used) {
        return requestsPerDay < 0 || used < requestsPerDay;
    }

    public boolean allowsTokens(long used) {
        return tokensPerDay < 0 || used < tokensPerDay;
    }

    public boolean allowsCost(double used) {
        return maxCostPerDay < 0 || used < maxCostPerDay;
    }

    public static TierLimits unlimited() {
        return new TierLimits(-1, -1, -1);
    }
}
