package me.golemcore.interactions.domain.service;

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

import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.InteractionDebugSnapshot;
import me.golemcore.interactions.domain.model.InteractionSummary;
import me.golemcore.interactions.domain.model.InteractionType;
import me.golemcore.interactions.domain.model.ModelConfig;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the in-memory interactions of the process and their parent/child links.
 * Interactions are cached by project and id, loaded through
 * {@link InteractionPersistenceService} on first access.
 *
 * <p>
 * A child shares its root's collaboration id. Removing or deleting an
 * interaction never touches its siblings or children.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InteractionHierarchyService {

    private static final String KEY_SEPARATOR = "/";

    private final InteractionPersistenceService persistenceService;
    private final ProjectIndexStore projectIndexStore;
    private final InteractionsProperties properties;
    private final Clock clock;

    private final Map<String, Interaction> interactionCache = new ConcurrentHashMap<>();

    public Interaction createInteraction(String projectId, InteractionType type, String parentId) {
        return createInteraction(projectId, UUID.randomUUID().toString(), type, parentId);
    }

    public Interaction createInteraction(String projectId, String interactionId, InteractionType type,
            String parentId) {
        Instant now = clock.instant();
        String collaborationId = interactionId;
        if (parentId != null) {
            Interaction parent = getInteraction(projectId, parentId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown parent interaction: " + parentId));
            collaborationId = parent.getCollaborationId() != null ? parent.getCollaborationId() : parent.getId();
        }
        Interaction interaction = Interaction.builder()
                .id(interactionId)
                .projectId(projectId)
                .type(type != null ? type : InteractionType.CONVERSATION)
                .parentId(parentId)
                .collaborationId(collaborationId)
                .providerName(properties.getLlm().getProvider())
                .modelConfig(ModelConfig.defaults(properties.getLlm().getModel()))
                .createdAt(now)
                .updatedAt(now)
                .build();
        interactionCache.put(cacheKey(projectId, interactionId), interaction);
        log.info("[Hierarchy] Created {} interaction {} (parent: {})", interaction.getType().getValue(),
                interactionId, parentId);
        return interaction;
    }

    /**
     * Returns the cached or stored interaction, creating a root conversation
     * when neither exists.
     */
    public Interaction getOrCreateInteraction(String projectId, String interactionId) {
        return getInteraction(projectId, interactionId)
                .orElseGet(() -> createInteraction(projectId, interactionId, InteractionType.CONVERSATION, null));
    }

    public Interaction createChildInteraction(String projectId, String parentId, InteractionType type) {
        return createInteraction(projectId, UUID.randomUUID().toString(), type, parentId);
    }

    public Optional<Interaction> getInteraction(String projectId, String interactionId) {
        Interaction cached = interactionCache.get(cacheKey(projectId, interactionId));
        if (cached != null) {
            return Optional.of(cached);
        }
        return loadInteraction(projectId, interactionId);
    }

    /**
     * Loads from storage and replaces any cached copy.
     */
    public Optional<Interaction> loadInteraction(String projectId, String interactionId) {
        Optional<Interaction> loaded = persistenceService.load(projectId, interactionId);
        loaded.ifPresent(interaction -> interactionCache.put(cacheKey(projectId, interactionId), interaction));
        return loaded;
    }

    public Optional<Interaction> getParent(String projectId, String interactionId) {
        return getInteraction(projectId, interactionId)
                .map(Interaction::getParentId)
                .flatMap(parentId -> getInteraction(projectId, parentId));
    }

    /**
     * Children known in memory or in the project index, oldest first.
     */
    public List<Interaction> getChildren(String projectId, String parentId) {
        Map<String, Interaction> children = new LinkedHashMap<>();
        for (Interaction interaction : interactionCache.values()) {
            if (projectId.equals(interaction.getProjectId()) && parentId.equals(interaction.getParentId())) {
                children.put(interaction.getId(), interaction);
            }
        }
        for (InteractionSummary summary : projectIndexStore.read(projectId)) {
            if (parentId.equals(summary.getParentId()) && !children.containsKey(summary.getId())) {
                getInteraction(projectId, summary.getId())
                        .ifPresent(child -> children.put(child.getId(), child));
            }
        }
        List<Interaction> result = new ArrayList<>(children.values());
        result.sort(Comparator.comparing(Interaction::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return result;
    }

    public void saveInteraction(Interaction interaction) {
        persistenceService.save(interaction);
    }

    /**
     * Drops the interaction from memory only; stored state and other
     * interactions are left as they are.
     */
    public boolean removeInteraction(String projectId, String interactionId) {
        boolean removed = interactionCache.remove(cacheKey(projectId, interactionId)) != null;
        if (removed) {
            log.debug("[Hierarchy] Detached interaction {}", interactionId);
        }
        return removed;
    }

    /**
     * Removes the interaction from memory and storage.
     */
    public void deleteInteraction(String projectId, String interactionId) {
        interactionCache.remove(cacheKey(projectId, interactionId));
        persistenceService.delete(projectId, interactionId);
    }

    public List<InteractionDebugSnapshot> dumpState() {
        List<InteractionDebugSnapshot> snapshots = new ArrayList<>();
        for (Interaction interaction : interactionCache.values()) {
            List<String> childIds = interactionCache.values().stream()
                    .filter(other -> interaction.getId().equals(other.getParentId())
                            && interaction.getProjectId().equals(other.getProjectId()))
                    .map(Interaction::getId)
                    .sorted()
                    .toList();
            snapshots.add(InteractionDebugSnapshot.builder()
                    .id(interaction.getId())
                    .type(interaction.getType())
                    .parentId(interaction.getParentId())
                    .collaborationId(interaction.getCollaborationId())
                    .childIds(new ArrayList<>(childIds))
                    .messageCount(interaction.getMessages().size())
                    .stats(interaction.getStats())
                    .statementState(interaction.getStatementState())
                    .tokenUsageInteraction(interaction.getTokenUsageStats().getTokenUsageInteraction())
                    .build());
        }
        snapshots.sort(Comparator.comparing(InteractionDebugSnapshot::getId));
        return snapshots;
    }

    private static String cacheKey(String projectId, String interactionId) {
        return projectId + KEY_SEPARATOR + interactionId;
    }
}
