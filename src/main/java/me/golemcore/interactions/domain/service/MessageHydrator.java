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

import me.golemcore.interactions.domain.exception.ResourceHandlingException;
import me.golemcore.interactions.domain.model.ContentPart;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.Message;
import me.golemcore.interactions.domain.model.ResourceMetadata;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expands "Resource added" markers in the stored message log into what the
 * provider should see.
 *
 * <p>
 * For every resource only the most recent {@code windowSize} references carry
 * full content. Older references are replaced by a short notice pointing at the
 * oldest reference that still has full content. The stored log is never
 * modified: the result is a fresh list, recomputed before every provider call,
 * and identical for an unchanged log.
 *
 * <p>
 * One forward pass over the messages, preceded by a scan that counts the
 * references per resource.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageHydrator {

    public static final String RESOURCE_ADDED_PREFIX = "Resource added: ";
    public static final String METADATA_MARKER = "---resource-metadata---";

    private static final Set<String> SUPPORTED_IMAGE_TYPES = Set.of(
            "image/jpeg", "image/png", "image/gif", "image/webp");

    private final ResourceRevisionStore revisionStore;
    private final ObjectMapper objectMapper;
    private final InteractionsProperties properties;

    public List<Message> prepareMessages(Interaction interaction) {
        return prepareMessages(interaction, interaction.getMessages());
    }

    public List<Message> prepareMessages(Interaction interaction, List<Message> messages) {
        int windowSize = properties.getHydration().getWindowSize();
        if (windowSize < 1) {
            throw new IllegalArgumentException("Hydration window size must be a positive integer, got " + windowSize);
        }

        HydrationWindow window = scanReferences(interaction, messages, windowSize);

        List<Message> hydrated = new ArrayList<>(messages.size());
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (!isHydratable(message)) {
                hydrated.add(copyOf(message));
                continue;
            }
            List<ContentPart> content = new ArrayList<>();
            for (ContentPart part : message.getContent()) {
                content.addAll(hydratePart(interaction, message, i, part, window));
            }
            hydrated.add(message.toBuilder().content(content).build());
        }
        return hydrated;
    }

    // ==================== SCAN ====================

    private HydrationWindow scanReferences(Interaction interaction, List<Message> messages, int windowSize) {
        Map<String, List<Reference>> referencesByUri = new LinkedHashMap<>();
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (!isHydratable(message)) {
                continue;
            }
            Set<String> seenInMessage = new HashSet<>();
            for (String uri : markerUris(message.getContent())) {
                ResourceMetadata metadata = lookup(interaction, uri, message.getId());
                if (metadata == null || metadata.hasError() || metadata.isInSystemPrompt()) {
                    continue;
                }
                if (seenInMessage.add(uri)) {
                    referencesByUri.computeIfAbsent(uri, k -> new ArrayList<>())
                            .add(new Reference(i, i + 1, message.getId()));
                }
            }
        }

        Set<String> fullContent = new HashSet<>();
        Map<String, Reference> anchors = new HashMap<>();
        referencesByUri.forEach((uri, references) -> {
            int firstFull = Math.max(0, references.size() - windowSize);
            anchors.put(uri, references.get(firstFull));
            for (int r = firstFull; r < references.size(); r++) {
                fullContent.add(referenceId(references.get(r).messageIndex(), uri));
            }
        });
        return new HydrationWindow(fullContent, anchors);
    }

    private List<String> markerUris(List<ContentPart> parts) {
        List<String> uris = new ArrayList<>();
        if (parts == null) {
            return uris;
        }
        for (ContentPart part : parts) {
            if (isMarker(part)) {
                uris.add(markerUri(part));
            } else if (part.isToolResult()) {
                uris.addAll(markerUris(part.getContent()));
            }
        }
        return uris;
    }

    // ==================== EXPANSION ====================

    private List<ContentPart> hydratePart(Interaction interaction, Message message, int messageIndex,
            ContentPart part, HydrationWindow window) {
        if (part.isToolResult() && part.getContent() != null) {
            List<ContentPart> nested = new ArrayList<>();
            for (ContentPart child : part.getContent()) {
                nested.addAll(hydratePart(interaction, message, messageIndex, child, window));
            }
            return List.of(part.toBuilder().content(nested).build());
        }
        if (!isMarker(part)) {
            return List.of(part);
        }

        String uri = markerUri(part);
        ResourceMetadata metadata = lookup(interaction, uri, message.getId());
        if (metadata == null) {
            log.warn("[Hydration] No metadata for resource {} at revision {}, leaving marker as is", uri,
                    message.getId());
            return List.of(part);
        }
        if (metadata.isInSystemPrompt()) {
            return List.of(part);
        }
        if (metadata.hasError()) {
            return loadFailure(metadata, metadata.getError());
        }
        if (window.isFullContent(messageIndex, uri)) {
            return fullContent(interaction, metadata);
        }

        Reference anchor = window.anchor(uri);
        ResourceMetadata anchorMetadata = lookup(interaction, uri, anchor.revision());
        String notice = String.format(
                "Note: Resource %s (revision: %s) content is up-to-date from turn %d (revision: %s).",
                uri, metadata.getRevision(), anchor.turn(), anchor.revision());
        return List.of(ContentPart.text(notice),
                ContentPart.text(metadataBlock(anchorMetadata != null ? anchorMetadata : metadata)));
    }

    private List<ContentPart> fullContent(Interaction interaction, ResourceMetadata metadata) {
        byte[] content;
        try {
            content = revisionStore.getRevision(interaction.getProjectId(), interaction.getId(), metadata.getUri(),
                    metadata.getRevision());
        } catch (ResourceHandlingException e) {
            log.warn("[Hydration] Could not read revision {} of {}: {}", metadata.getRevision(), metadata.getUri(),
                    e.getMessage());
            return loadFailure(metadata, e.getMessage());
        }

        if (metadata.isImage()) {
            String mimeType = metadata.getMimeType();
            if (mimeType == null || !SUPPORTED_IMAGE_TYPES.contains(mimeType)) {
                String warning = String.format("Note: Image resource %s is in unsupported format (%s). "
                        + "Only jpeg, png, gif, and webp formats are supported.", metadata.getUri(), mimeType);
                return List.of(ContentPart.text(warning), ContentPart.text(metadataBlock(metadata)));
            }
            return List.of(ContentPart.text(metadataBlock(metadata)),
                    ContentPart.image(mimeType, Base64.getEncoder().encodeToString(content)));
        }
        return List.of(ContentPart.text(metadataBlock(metadata)),
                ContentPart.text(new String(content, StandardCharsets.UTF_8)));
    }

    private List<ContentPart> loadFailure(ResourceMetadata metadata, String error) {
        String note = String.format("Note: Resource %s (revision: %s) could not be loaded: %s",
                metadata.getUri(), metadata.getRevision(), error);
        return List.of(ContentPart.text(note), ContentPart.text(metadataBlock(metadata)));
    }

    String metadataBlock(ResourceMetadata metadata) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("uri", metadata.getUri());
        block.put("type", metadata.getType());
        block.put("contentType", metadata.getContentType());
        block.put("size", metadata.getSize());
        block.put("last_modified", metadata.getLastModified() != null ? metadata.getLastModified().toString() : null);
        block.put("revision", metadata.getRevision());
        block.put("mime_type", metadata.getMimeType());
        try {
            return METADATA_MARKER + "\n" + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(block);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render resource metadata for " + metadata.getUri(), e);
        }
    }

    // ==================== HELPERS ====================

    private static boolean isHydratable(Message message) {
        return (message.isUserMessage() || message.isToolMessage()) && message.getContent() != null;
    }

    private static boolean isMarker(ContentPart part) {
        return part.isText() && part.getText() != null && part.getText().startsWith(RESOURCE_ADDED_PREFIX);
    }

    private static String markerUri(ContentPart part) {
        return part.getText().substring(RESOURCE_ADDED_PREFIX.length()).trim();
    }

    private static ResourceMetadata lookup(Interaction interaction, String uri, String revision) {
        return interaction.getResourceMetadata().get(ResourceRevisionStore.revisionKey(uri, revision));
    }

    private static Message copyOf(Message message) {
        return message.toBuilder()
                .content(message.getContent() != null ? new ArrayList<>(message.getContent()) : new ArrayList<>())
                .build();
    }

    private static String referenceId(int messageIndex, String uri) {
        return messageIndex + "|" + uri;
    }

    private record Reference(int messageIndex, int turn, String revision) {
    }

    /**
     * Which references of this pass get full content, and the oldest one of
     * them per resource. Derived on every pass, never persisted.
     */
    private record HydrationWindow(Set<String> fullContent, Map<String, Reference> anchors) {

        boolean isFullContent(int messageIndex, String uri) {
            return fullContent.contains(referenceId(messageIndex, uri));
        }

        Reference anchor(String uri) {
            return anchors.get(uri);
        }
    }
}
