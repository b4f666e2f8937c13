package me.golemcore.interactions.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate view over a ledger partition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenUsageAnalysis {

    @Builder.Default
    private TokenUsage totalUsage = TokenUsage.empty();

    @Builder.Default
    private DifferentialUsage differentialUsage = new DifferentialUsage();

    @Builder.Default
    private CacheImpactSummary cacheImpact = new CacheImpactSummary();

    @Builder.Default
    private Map<String, RoleUsage> byRole = new LinkedHashMap<>();

    public static TokenUsageAnalysis empty() {
        return TokenUsageAnalysis.builder().build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CacheImpactSummary {
        private long potentialCost;
        private long actualCost;
        private long totalSavings;
        private double savingsPercentage;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RoleUsage {
        private int inputTokens;
        private int outputTokens;
        private int totalTokens;
        private int cacheCreationInputTokens;
        private int cacheReadInputTokens;
        private int thoughtTokens;
        private int totalAllTokens;
        private int records;
    }
}
