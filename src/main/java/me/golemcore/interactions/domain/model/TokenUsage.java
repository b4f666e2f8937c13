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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw token counts reported by a provider for one request, or accumulated over
 * several. {@code totalAllTokens} also counts cache and thought tokens.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TokenUsage {

    private int inputTokens;
    private int outputTokens;
    private int totalTokens;
    private int cacheCreationInputTokens;
    private int cacheReadInputTokens;
    private int thoughtTokens;
    private int totalAllTokens;

    public static TokenUsage empty() {
        return new TokenUsage();
    }

    public static TokenUsage of(int inputTokens, int outputTokens, int cacheCreationInputTokens,
            int cacheReadInputTokens) {
        TokenUsage usage = TokenUsage.builder()
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .totalTokens(inputTokens + outputTokens)
                .cacheCreationInputTokens(cacheCreationInputTokens)
                .cacheReadInputTokens(cacheReadInputTokens)
                .build();
        usage.setTotalAllTokens(usage.computeTotalAllTokens());
        return usage;
    }

    public int computeTotalAllTokens() {
        return totalTokens + cacheCreationInputTokens + cacheReadInputTokens + thoughtTokens;
    }

    @JsonIgnore
    public boolean hasAnyTokens() {
        return inputTokens > 0 || outputTokens > 0 || cacheCreationInputTokens > 0 || cacheReadInputTokens > 0
                || thoughtTokens > 0;
    }

    /**
     * Returns a new usage that is the field-wise sum of this and {@code other}.
     */
    public TokenUsage plus(TokenUsage other) {
        if (other == null) {
            return toBuilder().build();
        }
        return TokenUsage.builder()
                .inputTokens(inputTokens + other.inputTokens)
                .outputTokens(outputTokens + other.outputTokens)
                .totalTokens(totalTokens + other.totalTokens)
                .cacheCreationInputTokens(cacheCreationInputTokens + other.cacheCreationInputTokens)
                .cacheReadInputTokens(cacheReadInputTokens + other.cacheReadInputTokens)
                .thoughtTokens(thoughtTokens + other.thoughtTokens)
                .totalAllTokens(totalAllTokens + other.totalAllTokens)
                .build();
    }
}
