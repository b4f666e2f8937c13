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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A stateful, persisted conversation or chat with an LLM provider.
 *
 * <p>
 * Messages are strictly append-ordered. Resource metadata is keyed by the
 * revision key of (uri, revision). Counters and token usage are updated by the
 * interaction service after every provider response; the persistence service
 * snapshots the whole object after every turn.
 *
 * <p>
 * An interaction is driven by one statement at a time. Different interactions
 * are independent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Interaction {

    private String id;
    private String projectId;

    @Builder.Default
    private InteractionType type = InteractionType.CONVERSATION;

    private String parentId;
    private String collaborationId;
    private String title;
    private String providerName;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private ModelConfig modelConfig = new ModelConfig();

    @Builder.Default
    private InteractionStats stats = new InteractionStats();

    @Builder.Default
    private TokenUsageStats tokenUsageStats = new TokenUsageStats();

    @Builder.Default
    private Map<String, ResourceMetadata> resourceMetadata = new LinkedHashMap<>();

    @Builder.Default
    private Objectives objectives = new Objectives();

    @Builder.Default
    private ResourceAccess resourceAccess = new ResourceAccess();

    @Builder.Default
    private Map<String, ToolUsageStats> toolStats = new LinkedHashMap<>();

    private int totalProviderRequests;
    private Instant createdAt;
    private Instant updatedAt;

    // Not part of metadata.json; persisted separately or derived
    private String preparedSystemPrompt;

    @Builder.Default
    private List<ToolDescriptor> preparedTools = new ArrayList<>();

    @Builder.Default
    private StatementState statementState = StatementState.IDLE;

    private boolean saveIncomplete;

    public void addMessage(Message message) {
        messages.add(message);
    }

    public Optional<Message> getLastMessage() {
        if (messages.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(messages.get(messages.size() - 1));
    }

    public Optional<Message> findMessage(String messageId) {
        return messages.stream().filter(m -> messageId != null && messageId.equals(m.getId())).findFirst();
    }

    /**
     * Most recent assistant message, if any.
     */
    public Optional<Message> getPreviousAssistantMessage() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).isAssistantMessage()) {
                return Optional.of(messages.get(i));
            }
        }
        return Optional.empty();
    }

    public void setObjectives(String interactionObjective, String statementObjective, Instant now) {
        if (objectives == null) {
            objectives = new Objectives();
        }
        if (interactionObjective != null && !interactionObjective.isBlank()) {
            objectives.setInteraction(interactionObjective);
        }
        if (statementObjective != null && !statementObjective.isBlank()) {
            objectives.getStatement().add(statementObjective);
        }
        objectives.setTimestamp(now);
    }

    public void updateResourceAccess(String uri, boolean modified) {
        resourceAccess.getAccessed().add(uri);
        if (modified) {
            resourceAccess.getModified().add(uri);
        }
        resourceAccess.getActive().add(uri);
    }

    public boolean isConversation() {
        return type == InteractionType.CONVERSATION;
    }
}
