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

import java.util.ArrayList;
import java.util.List;

/**
 * Debug view of one in-memory interaction and its place in the hierarchy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionDebugSnapshot {

    private String id;
    private InteractionType type;
    private String parentId;
    private String collaborationId;

    @Builder.Default
    private List<String> childIds = new ArrayList<>();

    private int messageCount;
    private InteractionStats stats;
    private StatementState statementState;
    private TokenUsage tokenUsageInteraction;
}
