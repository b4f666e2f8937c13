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

import me.golemcore.interactions.domain.exception.PersistenceException;
import me.golemcore.interactions.domain.migration.InteractionMigrationService;
import me.golemcore.interactions.domain.model.ChangeLogEntry;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.InteractionListQuery;
import me.golemcore.interactions.domain.model.InteractionMetadata;
import me.golemcore.interactions.domain.model.InteractionPage;
import me.golemcore.interactions.domain.model.InteractionStats;
import me.golemcore.interactions.domain.model.InteractionSummary;
import me.golemcore.interactions.domain.model.InteractionType;
import me.golemcore.interactions.domain.model.Message;
import me.golemcore.interactions.domain.model.MigrationResult;
import me.golemcore.interactions.domain.model.ModelConfig;
import me.golemcore.interactions.domain.model.Objectives;
import me.golemcore.interactions.domain.model.ResourceAccess;
import me.golemcore.interactions.domain.model.ResourceMetadata;
import me.golemcore.interactions.domain.model.StatementState;
import me.golemcore.interactions.domain.model.TokenUsageAnalysis;
import me.golemcore.interactions.domain.model.TokenUsageStats;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.util.concurrent.CompletionException;

/**
 * Durable storage of interactions under
 * {@code projects/<projectId>/interactions/<interactionId>/}.
 *
 * <p>
 * A save writes a {@code save.pending} marker first and removes it last; a
 * load that finds the marker flags the interaction as
 * {@link Interaction#isSaveIncomplete() incompletely saved}. Each file is
 * written through an atomic rename, metadata.json keeps a backup copy.
 *
 * <p>
 * Loading migrates stale metadata first, recomputes lifetime token usage from
 * the ledger and answers a trailing unresolved tool use with an interrupted
 * tool result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InteractionPersistenceService {

    private static final TypeReference<Map<String, ResourceMetadata>> RESOURCE_METADATA_TYPE =
            new TypeReference<>() {
            };
    private static final TypeReference<List<ToolDescriptor>> TOOL_LIST_TYPE = new TypeReference<>() {
    };
    private static final String NEWLINE = "\n";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final TokenUsageLedger tokenUsageLedger;
    private final ProjectIndexStore projectIndexStore;
    private final InteractionMigrationService migrationService;
    private final Clock clock;

    // ==================== SAVE ====================

    public void save(Interaction interaction) {
        String dir = StorageLayout.interactionDir(interaction.getProjectId(), interaction.getId());
        Instant now = clock.instant();
        if (interaction.getCreatedAt() == null) {
            interaction.setCreatedAt(now);
        }
        interaction.setUpdatedAt(now);

        writeText(dir, StorageLayout.SAVE_MARKER_FILE, now.toString(), false);

        writeJson(dir, StorageLayout.METADATA_FILE, toMetadata(interaction), true);
        writeText(dir, StorageLayout.MESSAGES_FILE, toJsonLines(interaction.getMessages()), false);
        if (interaction.isConversation()) {
            writeJson(dir, StorageLayout.RESOURCES_METADATA_FILE, interaction.getResourceMetadata(), false);
        }
        writeJson(dir, StorageLayout.OBJECTIVES_FILE, interaction.getObjectives(), false);
        writeJson(dir, StorageLayout.RESOURCE_ACCESS_FILE, interaction.getResourceAccess(), false);
        if (interaction.getPreparedSystemPrompt() != null) {
            writeJson(dir, StorageLayout.PREPARED_SYSTEM_FILE,
                    Map.of("systemPrompt", interaction.getPreparedSystemPrompt()), false);
        }
        if (interaction.getPreparedTools() != null && !interaction.getPreparedTools().isEmpty()) {
            writeJson(dir, StorageLayout.PREPARED_TOOLS_FILE, interaction.getPreparedTools(), false);
        }

        projectIndexStore.upsert(interaction.getProjectId(), toSummary(interaction));

        try {
            storagePort.deleteObject(dir, StorageLayout.SAVE_MARKER_FILE).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to clear save marker", dir + "/" + StorageLayout.SAVE_MARKER_FILE,
                    PersistenceException.Operation.DELETE, InteractionMetadata.CURRENT_VERSION, e.getCause());
        }
        interaction.setSaveIncomplete(false);
        log.debug("[Persistence] Saved interaction {} ({} messages)", interaction.getId(),
                interaction.getMessages().size());
    }

    // ==================== LOAD ====================

    /**
     * Loads an interaction, migrating it first when its metadata is older than
     * the current schema.
     *
     * @return the interaction, or empty when it has never been saved
     * @throws PersistenceException
     *             if the metadata cannot be read or migrated
     */
    public Optional<Interaction> load(String projectId, String interactionId) {
        String dir = StorageLayout.interactionDir(projectId, interactionId);
        JsonNode metadataNode = readJsonTree(dir, StorageLayout.METADATA_FILE);
        if (metadataNode == null) {
            return Optional.empty();
        }

        int version = InteractionMigrationService.readVersion(metadataNode);
        if (version < InteractionMetadata.CURRENT_VERSION) {
            MigrationResult migration = migrationService.migrateInteraction(projectId, interactionId, false);
            if (!migration.isSuccess() || migration.getToVersion() < InteractionMetadata.CURRENT_VERSION) {
                throw new PersistenceException("Interaction could not be migrated: " + migration.getErrors(),
                        dir + "/" + StorageLayout.METADATA_FILE, PersistenceException.Operation.VALIDATE,
                        migration.getToVersion(), null);
            }
            metadataNode = readJsonTree(dir, StorageLayout.METADATA_FILE);
        } else if (version > InteractionMetadata.CURRENT_VERSION) {
            throw new PersistenceException("Unsupported schema version", dir + "/" + StorageLayout.METADATA_FILE,
                    PersistenceException.Operation.VALIDATE, version, null);
        }

        InteractionMetadata metadata;
        try {
            metadata = objectMapper.treeToValue(metadataNode, InteractionMetadata.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PersistenceException("Malformed metadata", dir + "/" + StorageLayout.METADATA_FILE,
                    PersistenceException.Operation.READ, version, e);
        }

        Interaction interaction = fromMetadata(metadata, projectId, interactionId);
        interaction.setMessages(readMessages(dir));

        Map<String, ResourceMetadata> resources = readJson(dir, StorageLayout.RESOURCES_METADATA_FILE,
                RESOURCE_METADATA_TYPE);
        if (resources != null) {
            interaction.setResourceMetadata(new LinkedHashMap<>(resources));
        }
        Objectives objectives = readJson(dir, StorageLayout.OBJECTIVES_FILE, new TypeReference<Objectives>() {
        });
        if (objectives != null) {
            interaction.setObjectives(objectives);
        }
        ResourceAccess access = readJson(dir, StorageLayout.RESOURCE_ACCESS_FILE,
                new TypeReference<ResourceAccess>() {
                });
        if (access != null) {
            interaction.setResourceAccess(access);
        }
        interaction.setPreparedSystemPrompt(getPreparedSystemPrompt(projectId, interactionId).orElse(null));
        interaction.setPreparedTools(new ArrayList<>(getPreparedTools(projectId, interactionId)));

        TokenUsageAnalysis lifetime = tokenUsageLedger.analyzeAll(projectId, interactionId);
        interaction.getTokenUsageStats().setTokenUsageInteraction(lifetime.getTotalUsage());

        if (Boolean.TRUE.equals(storagePort.exists(dir, StorageLayout.SAVE_MARKER_FILE).join())) {
            log.warn("[Persistence] Interaction {} was not completely saved last time", interactionId);
            interaction.setSaveIncomplete(true);
        }
        if (ToolUseContinuity.repairInterruptedToolUse(interaction, clock.instant())) {
            interaction.setStatementState(StatementState.AWAITING_PROVIDER_RESPONSE);
        }

        log.debug("[Persistence] Loaded interaction {} ({} messages)", interactionId,
                interaction.getMessages().size());
        return Optional.of(interaction);
    }

    public boolean exists(String projectId, String interactionId) {
        return Boolean.TRUE.equals(storagePort.exists(StorageLayout.interactionDir(projectId, interactionId),
                StorageLayout.METADATA_FILE).join());
    }

    // ==================== DELETE / LIST ====================

    /**
     * Removes the interaction's directory and index entry. Child interactions
     * are not touched.
     */
    public void delete(String projectId, String interactionId) {
        String dir = StorageLayout.interactionDir(projectId, interactionId);
        projectIndexStore.remove(projectId, interactionId);
        try {
            storagePort.deleteDirectory(dir).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to delete interaction", dir, PersistenceException.Operation.DELETE,
                    e.getCause());
        }
        log.info("[Persistence] Deleted interaction {}", interactionId);
    }

    /**
     * Lists the project index, newest first.
     */
    public InteractionPage list(String projectId, InteractionListQuery query) {
        List<InteractionSummary> matching = projectIndexStore.read(projectId).stream()
                .filter(summary -> matches(summary, query))
                .sorted(Comparator.comparing(InteractionSummary::getUpdatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        long limit = Math.max(1, query.getLimit());
        long from = (Math.max(1L, query.getPage()) - 1) * limit;
        List<InteractionSummary> page = from >= matching.size()
                ? List.of()
                : matching.subList((int) from, (int) Math.min(matching.size(), from + limit));
        return InteractionPage.builder()
                .interactions(new ArrayList<>(page))
                .totalCount(matching.size())
                .build();
    }

    private static boolean matches(InteractionSummary summary, InteractionListQuery query) {
        Instant updated = summary.getUpdatedAt();
        if (query.getStartDate() != null && (updated == null || updated.isBefore(query.getStartDate()))) {
            return false;
        }
        if (query.getEndDate() != null && (updated == null || updated.isAfter(query.getEndDate()))) {
            return false;
        }
        if (query.getProviderName() != null && !query.getProviderName().equals(summary.getProviderName())) {
            return false;
        }
        return query.getCollaborationId() == null || query.getCollaborationId().equals(summary.getCollaborationId());
    }

    // ==================== CHANGE LOG ====================

    public void logChange(String projectId, String interactionId, String path, String change) {
        String dir = StorageLayout.interactionDir(projectId, interactionId);
        ChangeLogEntry entry = new ChangeLogEntry(clock.instant(), path, change);
        try {
            storagePort.appendText(dir, StorageLayout.CHANGES_FILE, objectMapper.writeValueAsString(entry) + NEWLINE)
                    .join();
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize change", dir + "/" + StorageLayout.CHANGES_FILE,
                    PersistenceException.Operation.APPEND, e);
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to append change", dir + "/" + StorageLayout.CHANGES_FILE,
                    PersistenceException.Operation.APPEND, e.getCause());
        }
    }

    public List<ChangeLogEntry> getChangeLog(String projectId, String interactionId) {
        String dir = StorageLayout.interactionDir(projectId, interactionId);
        String content = readText(dir, StorageLayout.CHANGES_FILE);
        List<ChangeLogEntry> entries = new ArrayList<>();
        if (content == null) {
            return entries;
        }
        for (String line : content.split(NEWLINE)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, ChangeLogEntry.class));
            } catch (JsonProcessingException e) {
                log.warn("[Persistence] Skipping malformed change log line of {}: {}", interactionId,
                        e.getOriginalMessage());
            }
        }
        return entries;
    }

    /**
     * Drops the most recent change log entry, for undo.
     */
    public Optional<ChangeLogEntry> removeLastChange(String projectId, String interactionId) {
        List<ChangeLogEntry> entries = getChangeLog(projectId, interactionId);
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        ChangeLogEntry removed = entries.remove(entries.size() - 1);
        String dir = StorageLayout.interactionDir(projectId, interactionId);
        writeText(dir, StorageLayout.CHANGES_FILE, toJsonLines(entries), false);
        return Optional.of(removed);
    }

    // ==================== PREPARED SNAPSHOTS ====================

    public Optional<String> getPreparedSystemPrompt(String projectId, String interactionId) {
        JsonNode node = readJsonTree(StorageLayout.interactionDir(projectId, interactionId),
                StorageLayout.PREPARED_SYSTEM_FILE);
        if (node == null || !node.hasNonNull("systemPrompt")) {
            return Optional.empty();
        }
        return Optional.of(node.get("systemPrompt").asText());
    }

    public List<ToolDescriptor> getPreparedTools(String projectId, String interactionId) {
        List<ToolDescriptor> tools = readJson(StorageLayout.interactionDir(projectId, interactionId),
                StorageLayout.PREPARED_TOOLS_FILE, TOOL_LIST_TYPE);
        return tools != null ? tools : List.of();
    }

    // ==================== MAPPING ====================

    private InteractionMetadata toMetadata(Interaction interaction) {
        return InteractionMetadata.builder()
                .version(InteractionMetadata.CURRENT_VERSION)
                .id(interaction.getId())
                .projectId(interaction.getProjectId())
                .interactionType(interaction.getType())
                .title(interaction.getTitle())
                .parentInteractionId(interaction.getParentId())
                .collaborationId(interaction.getCollaborationId())
                .llmProviderName(interaction.getProviderName())
                .modelConfig(interaction.getModelConfig())
                .interactionStats(interaction.getStats())
                .tokenUsageStats(interaction.getTokenUsageStats())
                .toolStats(interaction.getToolStats())
                .totalProviderRequests(interaction.getTotalProviderRequests())
                .statementState(interaction.getStatementState())
                .createdAt(interaction.getCreatedAt())
                .updatedAt(interaction.getUpdatedAt())
                .build();
    }

    private static Interaction fromMetadata(InteractionMetadata metadata, String projectId, String interactionId) {
        return Interaction.builder()
                .id(metadata.getId() != null ? metadata.getId() : interactionId)
                .projectId(projectId)
                .type(metadata.getInteractionType() != null ? metadata.getInteractionType()
                        : InteractionType.CONVERSATION)
                .title(metadata.getTitle())
                .parentId(metadata.getParentInteractionId())
                .collaborationId(metadata.getCollaborationId())
                .providerName(metadata.getLlmProviderName())
                .modelConfig(metadata.getModelConfig() != null ? metadata.getModelConfig() : new ModelConfig())
                .stats(metadata.getInteractionStats() != null ? metadata.getInteractionStats()
                        : new InteractionStats())
                .tokenUsageStats(metadata.getTokenUsageStats() != null ? metadata.getTokenUsageStats()
                        : new TokenUsageStats())
                .toolStats(metadata.getToolStats() != null ? new LinkedHashMap<>(metadata.getToolStats())
                        : new LinkedHashMap<>())
                .totalProviderRequests(metadata.getTotalProviderRequests())
                .statementState(metadata.getStatementState() != null ? metadata.getStatementState()
                        : StatementState.IDLE)
                .createdAt(metadata.getCreatedAt())
                .updatedAt(metadata.getUpdatedAt())
                .build();
    }

    private static InteractionSummary toSummary(Interaction interaction) {
        return InteractionSummary.builder()
                .id(interaction.getId())
                .title(interaction.getTitle())
                .type(interaction.getType())
                .parentId(interaction.getParentId())
                .collaborationId(interaction.getCollaborationId())
                .providerName(interaction.getProviderName())
                .model(interaction.getModelConfig() != null ? interaction.getModelConfig().getModel() : null)
                .stats(interaction.getStats())
                .tokenUsageInteraction(interaction.getTokenUsageStats().getTokenUsageInteraction())
                .schemaVersion(InteractionMetadata.CURRENT_VERSION)
                .createdAt(interaction.getCreatedAt())
                .updatedAt(interaction.getUpdatedAt())
                .build();
    }

    // ==================== IO ====================

    private List<Message> readMessages(String dir) {
        String content = readText(dir, StorageLayout.MESSAGES_FILE);
        List<Message> messages = new ArrayList<>();
        if (content == null) {
            return messages;
        }
        for (String line : content.split(NEWLINE)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                messages.add(objectMapper.readValue(line, Message.class));
            } catch (JsonProcessingException e) {
                log.warn("[Persistence] Skipping malformed message line in {}: {}", dir, e.getOriginalMessage());
            }
        }
        return messages;
    }

    private String toJsonLines(List<?> items) {
        StringBuilder sb = new StringBuilder();
        try {
            for (Object item : items) {
                sb.append(objectMapper.writeValueAsString(item)).append(NEWLINE);
            }
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize JSON lines", null, PersistenceException.Operation.WRITE,
                    InteractionMetadata.CURRENT_VERSION, e);
        }
        return sb.toString();
    }

    private void writeJson(String dir, String file, Object value, boolean backup) {
        try {
            writeText(dir, file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value), backup);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize " + file, dir + "/" + file,
                    PersistenceException.Operation.WRITE, InteractionMetadata.CURRENT_VERSION, e);
        }
    }

    private void writeText(String dir, String file, String content, boolean backup) {
        try {
            storagePort.putTextAtomic(dir, file, content, backup).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to write " + file, dir + "/" + file,
                    PersistenceException.Operation.WRITE, InteractionMetadata.CURRENT_VERSION, e.getCause());
        }
    }

    private String readText(String dir, String file) {
        try {
            return storagePort.getText(dir, file).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to read " + file, dir + "/" + file,
                    PersistenceException.Operation.READ, e.getCause());
        }
    }

    private JsonNode readJsonTree(String dir, String file) {
        String content = readText(dir, file);
        if (content == null || content.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Malformed " + file, dir + "/" + file, PersistenceException.Operation.READ,
                    e);
        }
    }

    private <T> T readJson(String dir, String file, TypeReference<T> type) {
        String content = readText(dir, file);
        if (content == null || content.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(content, type);
        } catch (JsonProcessingException e) {
            log.warn("[Persistence] Ignoring malformed {} in {}: {}", file, dir, e.getOriginalMessage());
            return null;
        }
    }
}
