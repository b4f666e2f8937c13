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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Immutable view of everything a migration step may touch: the metadata
 * document and both ledger partitions. Ledger lines that could not be parsed
 * are carried as text nodes holding the raw line so they survive a rewrite.
 *
 * <p>
 * All nodes are deep-copied on the way in and out.
 */
public record MetadataSnapshot(int version, ObjectNode metadata, List<JsonNode> conversationUsage,
        List<JsonNode> chatUsage) {

    public MetadataSnapshot {
        metadata = metadata.deepCopy();
        conversationUsage = copy(conversationUsage);
        chatUsage = copy(chatUsage);
    }

    @Override
    public ObjectNode metadata() {
        return metadata.deepCopy();
    }

    @Override
    public List<JsonNode> conversationUsage() {
        return copy(conversationUsage);
    }

    @Override
    public List<JsonNode> chatUsage() {
        return copy(chatUsage);
    }

    public MetadataSnapshot withVersion(int newVersion, ObjectNode newMetadata) {
        ObjectNode stamped = newMetadata.deepCopy();
        stamped.put("version", newVersion);
        return new MetadataSnapshot(newVersion, stamped, conversationUsage, chatUsage);
    }

    public MetadataSnapshot withUsage(List<JsonNode> newConversationUsage, List<JsonNode> newChatUsage) {
        return new MetadataSnapshot(version, metadata, newConversationUsage, newChatUsage);
    }

    private static List<JsonNode> copy(List<JsonNode> nodes) {
        return nodes == null ? List.of() : nodes.stream().map(node -> (JsonNode) node.deepCopy()).toList();
    }
}
