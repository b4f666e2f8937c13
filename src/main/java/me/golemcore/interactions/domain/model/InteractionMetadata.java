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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Content of an interaction's {@code metadata.json} at the current schema
 * version. Older versions are brought up to date by the migration chain before
 * this type is read.
 *
 * <p>
 * Version history:
 * <ul>
 * <li>1: no {@code version} field</li>
 * <li>2: explicit {@code version}</li>
 * <li>3: ledger records carry {@code totalAllTokens}</li>
 * <li>4: model parameters nested under {@code modelConfig}</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InteractionMetadata {

    public static final int CURRENT_VERSION = 4;

    private int version;
    private String id;
    private String projectId;
    private InteractionType interactionType;
    private String title;
    private String parentInteractionId;
    private String collaborationId;
    private String llmProviderName;
    private ModelConfig modelConfig;
    private InteractionStats interactionStats;
    private TokenUsageStats tokenUsageStats;

    @Builder.Default
    private Map<String, ToolUsageStats> toolStats = new LinkedHashMap<>();

    private int totalProviderRequests;
    private StatementState statementState;
    private Instant createdAt;
    private Instant updatedAt;
}
