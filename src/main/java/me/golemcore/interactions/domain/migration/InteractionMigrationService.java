package me.golemcore.interactions.domain.migration;

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
import me.golemcore.interactions.domain.model.InteractionMetadata;
import me.golemcore.interactions.domain.model.InteractionSummary;
import me.golemcore.interactions.domain.model.InteractionType;
import me.golemcore.interactions.domain.model.MigrationResult;
import me.golemcore.interactions.domain.model.ProjectMigrationReport;
import me.golemcore.interactions.domain.service.ProjectIndexStore;
import me.golemcore.interactions.domain.service.StorageLayout;
import me.golemcore.interactions.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Brings interaction metadata and ledgers forward to
 * {@link InteractionMetadata#CURRENT_VERSION}.
 *
 * <p>
 * Steps run in memory on an immutable snapshot; storage is written only after
 * the chain stops, ledgers first and metadata.json last, so an interrupted
 * write leaves the old version stamp and the whole migration is simply re-run.
 * If a step fails, the snapshot produced by the steps before it is written and
 * the result reports the version reached.
 */
@Service
@Slf4j
public class InteractionMigrationService {

    static final String LEGACY_MISSING_METADATA = "Legacy conversation: metadata.json not found";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ProjectIndexStore projectIndexStore;
    private final List<MigrationStep> steps;

    public InteractionMigrationService(StoragePort storagePort, ObjectMapper objectMapper,
            ProjectIndexStore projectIndexStore, List<MigrationStep> steps) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.projectIndexStore = projectIndexStore;
        this.steps = steps.stream()
                .sorted(Comparator.comparingInt(MigrationStep::getTargetVersion))
                .toList();
        log.debug("[Migration] Registered {} migration steps", this.steps.size());
    }

    /**
     * Schema version of a metadata document; documents without one are
     * version 1.
     */
    public static int readVersion(JsonNode metadata) {
        int version = metadata.path("version").asInt(1);
        return version < 1 ? 1 : version;
    }

    public MigrationResult migrateInteraction(String projectId, String interactionId, boolean dryRun) {
        String dir = StorageLayout.interactionDir(projectId, interactionId);
        MigrationResult result = MigrationResult.builder()
                .interactionId(interactionId)
                .dryRun(dryRun)
                .build();

        String metadataText = storagePort.getText(dir, StorageLayout.METADATA_FILE).join();
        if (metadataText == null) {
            log.debug("[Migration] {}: no metadata.json, skipping", interactionId);
            result.setSkipped(true);
            result.getErrors().add(LEGACY_MISSING_METADATA);
            return result;
        }

        ObjectNode metadata;
        try {
            JsonNode parsed = objectMapper.readTree(metadataText);
            if (!parsed.isObject()) {
                return fail(result, 0, "metadata.json is not a JSON object");
            }
            metadata = (ObjectNode) parsed;
        } catch (JsonProcessingException e) {
            return fail(result, 0, "Malformed metadata.json: " + e.getOriginalMessage());
        }

        int fromVersion = readVersion(metadata);
        result.setFromVersion(fromVersion);
        result.setToVersion(fromVersion);
        if (fromVersion > InteractionMetadata.CURRENT_VERSION) {
            return fail(result, fromVersion, "Schema version " + fromVersion + " is newer than supported version "
                    + InteractionMetadata.CURRENT_VERSION);
        }
        if (fromVersion == InteractionMetadata.CURRENT_VERSION) {
            result.setSuccess(true);
            return result;
        }

        MetadataSnapshot original = new MetadataSnapshot(fromVersion, metadata,
                readUsage(dir, InteractionType.CONVERSATION), readUsage(dir, InteractionType.CHAT));
        MetadataSnapshot current = original;
        String error = null;
        for (MigrationStep step : steps) {
            if (current.version() >= step.getTargetVersion()) {
                continue;
            }
            try {
                MigrationStep.Outcome outcome = step.apply(current);
                result.getChanges().addAll(outcome.changes());
                current = outcome.snapshot();
                log.debug("[Migration] {}: {} -> v{}", interactionId, step.getDescription(), current.version());
            } catch (RuntimeException e) {
                error = "Migration to version " + step.getTargetVersion() + " failed: " + e.getMessage();
                log.error("[Migration] {}: {}", interactionId, error, e);
                break;
            }
        }

        if (!dryRun && current.version() > fromVersion) {
            try {
                write(dir, original, current);
            } catch (PersistenceException e) {
                return fail(result, fromVersion, e.getMessage());
            }
        }

        result.setToVersion(current.version());
        if (error != null) {
            result.getErrors().add(error);
            result.setSuccess(false);
        } else {
            result.setSuccess(true);
        }
        log.info("[Migration] {}: v{} -> v{}{} ({} changes)", interactionId, fromVersion, current.version(),
                dryRun ? " (dry run)" : "", result.getChanges().size());
        return result;
    }

    /**
     * Migrates every interaction of a project: those with a directory and those
     * listed in the index.
     */
    public ProjectMigrationReport migrateProject(String projectId, boolean dryRun) {
        Set<String> ids = new LinkedHashSet<>(
                storagePort.listDirectories(StorageLayout.interactionsDir(projectId)).join());
        List<InteractionSummary> index = projectIndexStore.read(projectId);
        index.forEach(summary -> ids.add(summary.getId()));

        ProjectMigrationReport report = ProjectMigrationReport.builder()
                .projectId(projectId)
                .dryRun(dryRun)
                .build();
        Map<String, Integer> reachedVersions = new LinkedHashMap<>();

        for (String id : ids) {
            MigrationResult result;
            try {
                result = migrateInteraction(projectId, id, dryRun);
            } catch (RuntimeException e) {
                log.error("[Migration] {}: unexpected failure", id, e);
                result = MigrationResult.builder()
                        .interactionId(id)
                        .dryRun(dryRun)
                        .errors(new ArrayList<>(List.of(String.valueOf(e.getMessage()))))
                        .build();
            }
            report.getResults().add(result);
            report.setTotal(report.getTotal() + 1);
            if (result.isSkipped()) {
                report.setSkipped(report.getSkipped() + 1);
            } else if (!result.isSuccess()) {
                report.setFailed(report.getFailed() + 1);
            } else if (result.hasChanges()) {
                report.setMigrated(report.getMigrated() + 1);
                reachedVersions.put(id, result.getToVersion());
            }
        }

        if (!dryRun && report.getMigrated() > 0) {
            for (InteractionSummary summary : index) {
                Integer version = reachedVersions.get(summary.getId());
                if (version != null) {
                    summary.setSchemaVersion(version);
                }
            }
            projectIndexStore.write(projectId, index);
        }

        log.info("[Migration] Project {}: {} total, {} migrated, {} skipped, {} failed{}", projectId,
                report.getTotal(), report.getMigrated(), report.getSkipped(), report.getFailed(),
                dryRun ? " (dry run)" : "");
        return report;
    }

    // ==================== STORAGE ====================

    private List<JsonNode> readUsage(String dir, InteractionType type) {
        String content = storagePort.getText(dir, StorageLayout.tokenUsagePath(type.getLedgerFile())).join();
        List<JsonNode> nodes = new ArrayList<>();
        if (content == null) {
            return nodes;
        }
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                nodes.add(objectMapper.readTree(line));
            } catch (JsonProcessingException e) {
                log.warn("[Migration] Keeping unparseable ledger line as is in {}: {}", dir, e.getOriginalMessage());
                nodes.add(TextNode.valueOf(line));
            }
        }
        return nodes;
    }

    private void write(String dir, MetadataSnapshot original, MetadataSnapshot migrated) {
        writeUsageIfChanged(dir, InteractionType.CONVERSATION, original.conversationUsage(),
                migrated.conversationUsage());
        writeUsageIfChanged(dir, InteractionType.CHAT, original.chatUsage(), migrated.chatUsage());
        String path = dir + "/" + StorageLayout.METADATA_FILE;
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(migrated.metadata());
            storagePort.putTextAtomic(dir, StorageLayout.METADATA_FILE, json, true).join();
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize migrated metadata", path,
                    PersistenceException.Operation.WRITE, migrated.version(), e);
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to write migrated metadata", path,
                    PersistenceException.Operation.WRITE, migrated.version(), e.getCause());
        }
    }

    private void writeUsageIfChanged(String dir, InteractionType type, List<JsonNode> before,
            List<JsonNode> after) {
        if (before.equals(after)) {
            return;
        }
        String file = StorageLayout.tokenUsagePath(type.getLedgerFile());
        StringBuilder content = new StringBuilder();
        try {
            for (JsonNode node : after) {
                content.append(node.isTextual() ? node.asText() : objectMapper.writeValueAsString(node)).append('\n');
            }
            storagePort.putTextAtomic(dir, file, content.toString(), true).join();
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize migrated ledger", dir + "/" + file,
                    PersistenceException.Operation.WRITE, e);
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to write migrated ledger", dir + "/" + file,
                    PersistenceException.Operation.WRITE, e.getCause());
        }
    }

    private static MigrationResult fail(MigrationResult result, int version, String error) {
        log.error("[Migration] {}: {}", result.getInteractionId(), error);
        result.setSuccess(false);
        result.setToVersion(version);
        result.getErrors().add(error);
        return result;
    }
}
