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

/**
 * Per-record cache economics: input cost without caching versus the cache
 * tokens actually billed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheImpact {

    private int potentialCost;
    private int actualCost;
    private int savings;

    public static CacheImpact of(TokenUsage usage) {
        int potential = usage.getInputTokens();
        int actual = usage.getCacheReadInputTokens() + usage.getCacheCreationInputTokens();
        return new CacheImpact(potential, actual, Math.max(0, potential - actual));
    }
}
