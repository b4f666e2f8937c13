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

import me.golemcore.interactions.domain.exception.ResourceFailureKind;
import me.golemcore.interactions.domain.exception.ResourceHandlingException;
import me.golemcore.interactions.domain.exception.ResourceOperation;
import me.golemcore.interactions.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.concurrent.CompletionException;

/**
 * Append-only content store keyed by (resource uri, revision id), one store
 * per interaction.
 *
 * <p>
 * A key is written at most once. Writers racing on the same key are expected
 * to carry identical content; the second write is skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResourceRevisionStore {

    private static final String REVISION_SEPARATOR = "_rev_";
    private static final int PREFIX_LENGTH = 30;

    private final StoragePort storagePort;

    public void storeRevision(String projectId, String interactionId, String uri, String revision, byte[] content) {
        String dir = revisionsDir(projectId, interactionId);
        String key = revisionKey(uri, revision);
        try {
            if (Boolean.TRUE.equals(storagePort.exists(dir, key).join())) {
                log.debug("[Revisions] Revision already stored, skipping: {}", key);
                return;
            }
            storagePort.putObject(dir, key, content).join();
            log.debug("[Revisions] Stored revision {} ({} bytes)", key, content.length);
        } catch (CompletionException e) {
            throw new ResourceHandlingException(uri, ResourceOperation.WRITE, ResourceFailureKind.IO,
                    "Could not write resource revision " + dir + "/" + key, e.getCause());
        }
    }

    public byte[] getRevision(String projectId, String interactionId, String uri, String revision) {
        String dir = revisionsDir(projectId, interactionId);
        String key = revisionKey(uri, revision);
        byte[] content;
        try {
            content = storagePort.getObject(dir, key).join();
        } catch (CompletionException e) {
            throw new ResourceHandlingException(uri, ResourceOperation.READ, ResourceFailureKind.IO,
                    "Could not read resource revision " + dir + "/" + key, e.getCause());
        }
        if (content == null) {
            throw new ResourceHandlingException(uri, ResourceOperation.READ, ResourceFailureKind.NOT_FOUND,
                    "Could not read resource contents for resource revision " + dir + "/" + key);
        }
        return content;
    }

    public boolean hasRevision(String projectId, String interactionId, String uri, String revision) {
        return Boolean.TRUE.equals(
                storagePort.exists(revisionsDir(projectId, interactionId), revisionKey(uri, revision)).join());
    }

    /**
     * Filesystem-safe key: a readable prefix of the uri path, a SHA-256 of the
     * whole uri and the revision id.
     */
    public static String revisionKey(String uri, String revision) {
        return uriKey(uri) + REVISION_SEPARATOR + sanitize(revision);
    }

    public static String uriKey(String uri) {
        String path = extractPath(uri);
        String prefix = path.replaceAll("[^a-zA-Z0-9]", "_");
        if (prefix.length() > PREFIX_LENGTH) {
            prefix = prefix.substring(0, PREFIX_LENGTH);
        }
        return prefix + "_" + sha256(uri);
    }

    private static String revisionsDir(String projectId, String interactionId) {
        return StorageLayout.interactionDir(projectId, interactionId) + "/" + StorageLayout.REVISIONS_DIR;
    }

    private static String extractPath(String uri) {
        try {
            String path = URI.create(uri).getPath();
            if (path != null && !path.isEmpty()) {
                return path;
            }
        } catch (IllegalArgumentException e) {
            log.trace("[Revisions] Not a parseable URI, using raw value: {}", uri);
        }
        return uri;
    }

    private static String sanitize(String revision) {
        return revision == null ? "none" : revision.replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
