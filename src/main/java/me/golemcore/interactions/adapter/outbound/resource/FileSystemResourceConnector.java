package me.golemcore.interactions.adapter.outbound.resource;

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
import me.golemcore.interactions.domain.model.LoadedResource;
import me.golemcore.interactions.domain.model.ResourceMetadata;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import me.golemcore.interactions.port.outbound.ResourceConnectorPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Locale;
import java.util.Map;

/**
 * Resource connector over the local filesystem rooted at
 * {@code interactions.resources.root}.
 *
 * <p>
 * Accepts plain relative paths, {@code file:} URIs and data-source URIs of
 * the form {@code <access>+<provider>+<name>+file:./path}. Paths resolving
 * outside the root are rejected as PERMISSION_DENIED.
 */
@Component
@Slf4j
public class FileSystemResourceConnector implements ResourceConnectorPort {

    private static final String FILE_SCHEME = "file:";
    private static final Map<String, String> MIME_BY_EXTENSION = Map.ofEntries(
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("png", "image/png"),
            Map.entry("gif", "image/gif"),
            Map.entry("webp", "image/webp"),
            Map.entry("bmp", "image/bmp"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("tiff", "image/tiff"),
            Map.entry("md", "text/markdown"),
            Map.entry("txt", "text/plain"),
            Map.entry("json", "application/json"),
            Map.entry("java", "text/x-java"),
            Map.entry("ts", "text/typescript"),
            Map.entry("js", "text/javascript"),
            Map.entry("html", "text/html"),
            Map.entry("xml", "application/xml"),
            Map.entry("yaml", "application/yaml"),
            Map.entry("yml", "application/yaml"));

    private final Path root;

    public FileSystemResourceConnector(InteractionsProperties properties) {
        this.root = Paths.get(properties.getResources().getRoot()).toAbsolutePath().normalize();
        log.info("[Resources] Filesystem connector root: {}", root);
    }

    @Override
    public LoadedResource loadResource(String uri) {
        Path path = resolve(uri, ResourceOperation.READ);
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            if (attributes.isDirectory()) {
                throw new ResourceHandlingException(uri, ResourceOperation.READ, ResourceFailureKind.IO,
                        "Resource is a directory: " + uri);
            }
            byte[] content = Files.readAllBytes(path);
            String mimeType = detectMimeType(path);
            ResourceMetadata metadata = ResourceMetadata.builder()
                    .uri(uri)
                    .type("file")
                    .mimeType(mimeType)
                    .contentType(mimeType.startsWith("image/") ? ResourceMetadata.CONTENT_IMAGE
                            : ResourceMetadata.CONTENT_TEXT)
                    .size(attributes.size())
                    .lastModified(attributes.lastModifiedTime().toInstant())
                    .build();
            return LoadedResource.builder().content(content).metadata(metadata).build();
        } catch (NoSuchFileException e) {
            throw new ResourceHandlingException(uri, ResourceOperation.READ, ResourceFailureKind.NOT_FOUND,
                    "Resource not found: " + uri, e);
        } catch (AccessDeniedException e) {
            throw new ResourceHandlingException(uri, ResourceOperation.READ, ResourceFailureKind.PERMISSION_DENIED,
                    "Permission denied: " + uri, e);
        } catch (IOException e) {
            throw new ResourceHandlingException(uri, ResourceOperation.READ, ResourceFailureKind.IO,
                    "Failed to read resource " + uri + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean resourceExists(String uri) {
        return Files.isRegularFile(resolve(uri, ResourceOperation.STAT));
    }

    Path resolve(String uri, ResourceOperation operation) {
        if (uri == null || uri.isBlank()) {
            throw new ResourceHandlingException(uri, operation, ResourceFailureKind.NOT_FOUND, "Empty resource uri");
        }
        Path resolved = root.resolve(toRelativePath(uri)).normalize();
        if (!resolved.startsWith(root)) {
            throw new ResourceHandlingException(uri, operation, ResourceFailureKind.PERMISSION_DENIED,
                    "Resource is outside the resource root: " + uri);
        }
        return resolved;
    }

    static String toRelativePath(String uri) {
        String value = uri;
        int colon = value.indexOf(':');
        int plus = value.lastIndexOf('+', colon);
        if (colon > 0 && plus >= 0) {
            value = value.substring(plus + 1);
        }
        if (value.startsWith(FILE_SCHEME)) {
            value = value.substring(FILE_SCHEME.length());
            if (value.startsWith("//")) {
                value = value.substring(2);
            }
        }
        while (value.startsWith("/")) {
            value = value.substring(1);
        }
        return value;
    }

    private static String detectMimeType(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot >= 0) {
            String mime = MIME_BY_EXTENSION.get(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
            if (mime != null) {
                return mime;
            }
        }
        try {
            String probed = Files.probeContentType(path);
            return probed != null ? probed : "text/plain";
        } catch (IOException e) {
            log.debug("[Resources] Could not probe content type of {}: {}", path, e.getMessage());
            return "text/plain";
        }
    }
}
