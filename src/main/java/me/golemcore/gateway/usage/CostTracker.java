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

import me.golemcore.gateway.domain.model.CostBreakdown;
import me.golemcore.gateway.domain.model.LimitCheck;
import me.golemcore.gateway.domain.model.LlmUsage;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.MessageMetadata;
import me.golemcore.gateway.domain.model.TierLimits;
import me.golemcore.gateway.domain.model.UsageSummary;
import me.golemcore.gateway.domain.model.UsageTotals;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.CostTrackingPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory usage accounting.
 *
 * <p>
 * Every tracked call is added to four buckets: the user's lifetime totals
 * (split by provider and by project), the user's bucket for the current UTC
 * day and, when known, the session's bucket. Counters are additive and safe
 * for concurrent turns. The data is a cache: it can be rebuilt from persisted
 * assistant messages with {@link #recompute(List)}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CostTracker implements CostTrackingPort {

    private static final String LOG_PREFIX = "[Cost]";
    private static final String ANONYMOUS = "anonymous";
    private static final double TOKENS_PER_UNIT = 1_000_000.0;

    private final GatewayProperties properties;
    private final Clock clock;

    private final Map<String, Bucket> userTotals = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Bucket>> userByProvider = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Bucket>> userByProject = new ConcurrentHashMap<>();
    private final Map<String, Bucket> dailyBuckets = new ConcurrentHashMap<>();
    private final Map<String, Bucket> sessionBuckets = new ConcurrentHashMap<>();

    @Override
    public CostBreakdown track(UsageEvent event) {
        LlmUsage usage = event.usage() != null ? event.usage() : LlmUsage.empty();
        CostBreakdown cost = calculateCost(event.provider(), event.model(), usage);
        String user = userKey(event.userId());

        userTotals.computeIfAbsent(user, k -> new Bucket()).add(usage, cost);
        if (event.provider() != null) {
            userByProvider.computeIfAbsent(user, k -> new ConcurrentHashMap<>())
                    .computeIfAbsent(event.provider(), k -> new Bucket())
                    .add(usage, cost);
        }
        if (event.projectId() != null) {
            userByProject.computeIfAbsent(user, k -> new ConcurrentHashMap<>())
                    .computeIfAbsent(event.projectId(), k -> new Bucket())
                    .add(usage, cost);
        }
        dailyBuckets.computeIfAbsent(dailyKey(user, today()), k -> new Bucket()).add(usage, cost);
        if (event.sessionId() != null) {
            sessionBuckets.computeIfAbsent(event.sessionId(), k -> new Bucket()).add(usage, cost);
        }

        log.debug("{} Tracked user={} provider={} model={} tokens={}/{} cost=${}", LOG_PREFIX, user,
                event.provider(), event.model(), usage.getInputTokens(), usage.getOutputTokens(), cost.total());
        return cost;
    }

    @Override
    public CostBreakdown calculateCost(String provider, String model, LlmUsage usage) {
        if (usage == null) {
            return CostBreakdown.zero();
        }
        PricingTable.Price price = PricingTable.priceOf(provider, model);
        double inputCost = usage.getInputTokens() / TOKENS_PER_UNIT * price.inputPerMillion();
        double outputCost = usage.getOutputTokens() / TOKENS_PER_UNIT * price.outputPerMillion();
        return new CostBreakdown(inputCost, outputCost, inputCost + outputCost);
    }

    @Override
    public UsageSummary getSummary(String userId) {
        String user = userKey(userId);
        Bucket totals = userTotals.get(user);
        return UsageSummary.builder()
                .userId(user)
                .totals(totals != null ? totals.snapshot() : UsageTotals.empty())
                .byProvider(snapshot(userByProvider.get(user)))
                .byProject(snapshot(userByProject.get(user)))
                .today(getDailyUsage(user, today()))
                .build();
    }

    @Override
    public UsageTotals getDailyUsage(String userId, LocalDate date) {
        Bucket bucket = dailyBuckets.get(dailyKey(userKey(userId), date));
        return bucket != null ? bucket.snapshot() : UsageTotals.empty();
    }

    @Override
    public UsageTotals getSessionTotals(String sessionId) {
        Bucket bucket = sessionId != null ? sessionBuckets.get(sessionId) : null;
        return bucket != null ? bucket.snapshot() : UsageTotals.empty();
    }

    /**
     * Rebuilds totals from persisted messages. Each completed assistant
     * message stands for one tracked backend call.
     */
    @Override
    public UsageTotals recompute(List<Message> messages) {
        Bucket bucket = new Bucket();
        if (messages == null) {
            return bucket.snapshot();
        }
        for (Message message : messages) {
            if (!message.isAssistantMessage() || message.getMetadata() == null) {
                continue;
            }
            MessageMetadata metadata = message.getMetadata();
            if (metadata.getTokensUsed() == null || Boolean.TRUE.equals(metadata.getInterrupted())) {
                continue;
            }
            bucket.add(metadata.getTokensUsed(),
                    calculateCost(metadata.getProvider(), metadata.getModel(), metadata.getTokensUsed()));
        }
        return bucket.snapshot();
    }

    @Override
    public LimitCheck checkLimits(String userId, String tier) {
        Map<String, TierLimits> tiers = properties.getLimits().getTiers();
        String effectiveTier = tier != null && tiers.containsKey(tier) ? tier : properties.getLimits().getDefaultTier();
        TierLimits limits = tiers.getOrDefault(effectiveTier, TierLimits.unlimited());
        UsageTotals today = getDailyUsage(userId, today());

        if (limits.isUnlimited()) {
            return LimitCheck.builder()
                    .withinLimits(true)
                    .tier(effectiveTier)
                    .usage(today)
                    .limits(limits)
                    .remainingRequests(-1)
                    .remainingTokens(-1)
                    .remainingCost(-1)
                    .build();
        }

        boolean within = limits.allowsRequests(today.getRequestCount())
                && limits.allowsTokens(today.getTotalTokens())
                && limits.allowsCost(today.getCostUsd());

        return LimitCheck.builder()
                .withinLimits(within)
                .tier(effectiveTier)
                .usage(today)
                .limits(limits)
                .remainingRequests(remaining(limits.getRequestsPerDay(), today.getRequestCount()))
                .remainingTokens(remaining(limits.getTokensPerDay(), today.getTotalTokens()))
                .remainingCost(limits.getMaxCostPerDay() < 0 ? -1
                        : Math.max(0, limits.getMaxCostPerDay() - today.getCostUsd()))
                .build();
    }

    @Override
    public void resetDailyUsage(String userId) {
        dailyBuckets.remove(dailyKey(userKey(userId), today()));
        log.info("{} Daily usage reset for {}", LOG_PREFIX, userKey(userId));
    }

    private static long remaining(long limit, long used) {
        return limit < 0 ? -1 : Math.max(0, limit - used);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private static String dailyKey(String user, LocalDate date) {
        return user + ":" + date;
    }

    private static String userKey(String userId) {
        return userId != null && !userId.isBlank() ? userId : ANONYMOUS;
    }

    private static Map<String, UsageTotals> snapshot(Map<String, Bucket> buckets) {
        Map<String, UsageTotals> result = new TreeMap<>();
        if (buckets != null) {
            buckets.forEach((key, bucket) -> result.put(key, bucket.snapshot()));
        }
        return result;
    }

    private static final class Bucket {
        private final LongAdder requests = new LongAdder();
        private final LongAdder tokensInput = new LongAdder();
        private final LongAdder tokensOutput = new LongAdder();
        private final DoubleAdder cost = new DoubleAdder();

        void add(LlmUsage usage, CostBreakdown breakdown) {
            requests.increment();
            tokensInput.add(usage.getInputTokens());
            tokensOutput.add(usage.getOutputTokens());
            cost.add(breakdown.total());
        }

        UsageTotals snapshot() {
            return new UsageTotals(requests.sum(), tokensInput.sum(), tokensOutput.sum(), cost.sum());
        }
    }
}
