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
import me.golemcore.interactions.domain.model.InteractionMetadata;
import me.golemcore.interactions.domain.model.InteractionSummary;
import me.golemcore.interactions.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Reads and writes a project's {@code interactions.json}, the denormalized list
 * of interaction summaries that listing is served from.
 *
 * <p>
 * The file is an envelope {@code {"version": N, "interactions": [...]}}; a bare
 * array from older releases is accepted on read and replaced on the next
 * write. Updates are serialized within the process.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProjectIndexStore {

    private static final TypeReference<List<InteractionSummary>> SUMMARY_LIST_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    public synchronized List<InteractionSummary> read(String projectId) {
        String dir = StorageLayout.projectDir(projectId);
        String content;
        try {
            content = storagePort.getText(dir, StorageLayout.INDEX_FILE).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to read project index", indexPath(projectId),
                    PersistenceException.Operation.READ, e.getCause());
        }
        if (content == null || content.isBlank()) {
            return new ArrayList<>();
        }
        try {
            JsonNode root = objectMapper.readTree(content);
            JsonNode entries = root.isArray() ? root : root.path("interactions");
            if (!entries.isArray()) {
                return new ArrayList<>();
            }
            return new ArrayList<>(objectMapper.convertValue(entries, SUMMARY_LIST_TYPE));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PersistenceException("Malformed project index", indexPath(projectId),
                    PersistenceException.Operation.READ, e);
        }
    }

    public synchronized void write(String projectId, List<InteractionSummary> summaries) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("version", InteractionMetadata.CURRENT_VERSION);
        envelope.set("interactions", objectMapper.valueToTree(summaries));
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(envelope);
            storagePort.putTextAtomic(StorageLayout.projectDir(projectId), StorageLayout.INDEX_FILE, json, true)
                    .join();
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize project index", indexPath(projectId),
                    PersistenceException.Operation.WRITE, InteractionMetadata.CURRENT_VERSION, e);
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to write project index", indexPath(projectId),
                    PersistenceException.Operation.WRITE, InteractionMetadata.CURRENT_VERSION, e.getCause());
        }
    }

    /**
     * Replaces the entry with the same id, or adds it.
     */
    public synchronized void upsert(String projectId, InteractionSummary summary) {
        List<InteractionSummary> summaries = read(projectId);
        summaries.removeIf(existing -> summary.getId().equals(existing.getId()));
        summaries.add(summary);
        write(projectId, summaries);
    }

    public synchronized boolean remove(String projectId, String interactionId) {
        List<InteractionSummary> summaries = read(projectId);
        boolean removed = summaries.removeIf(existing -> interactionId.equals(existing.getId()));
        if (removed) {
            write(projectId, summaries);
        }
        return removed;
    }

    private static String indexPath(String projectId) {
        return StorageLayout.projectDir(projectId) + "/" + StorageLayout.INDEX_FILE;
    }
}
