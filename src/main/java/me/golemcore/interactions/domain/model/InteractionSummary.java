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

import java.time.Instant;

/**
 * Denormalized project-index entry for one interaction. Listing reads only
 * these, never the interaction directories.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionSummary {

    private String id;
    private String title;
    private InteractionType type;
    private String parentId;
    private String collaborationId;
    private String providerName;
    private String model;
    private InteractionStats stats;
    private TokenUsage tokenUsageInteraction;
    private int schemaVersion;
    private Instant createdAt;
    private Instant updatedAt;
}
