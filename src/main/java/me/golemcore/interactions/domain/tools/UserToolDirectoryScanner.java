package me.golemcore.interactions.domain.tools;

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

import me.golemcore.interactions.domain.model.ToolCapabilities;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.model.ToolSource;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Finds user-supplied tools: every {@code <name>.tool} directory directly below
 * a configured tool directory that holds an {@code info.json}.
 *
 * <p>
 * info.json fields: {@code name}, {@code description}, {@code version},
 * {@code inputSchema}, {@code command}, {@code toolSets},
 * {@code enabled} and {@code capabilities}. A directory with a malformed
 * info.json is logged and skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UserToolDirectoryScanner {

    static final String TOOL_DIR_SUFFIX = ".tool";
    static final String INFO_FILE = "info.json";

    private static final TypeReference<Map<String, Object>> SCHEMA_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> TOOL_SETS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public List<ToolDescriptor> scan(List<String> directories) {
        List<ToolDescriptor> descriptors = new ArrayList<>();
        if (directories == null) {
            return descriptors;
        }
        for (String directory : directories) {
            Path root = Paths.get(directory.replace("${user.home}", System.getProperty("user.home")));
            if (!Files.isDirectory(root)) {
                log.debug("[Tools] User tool directory does not exist: {}", root);
                continue;
            }
            try (Stream<Path> children = Files.list(root)) {
                children.filter(Files::isDirectory)
                        .filter(dir -> dir.getFileName().toString().endsWith(TOOL_DIR_SUFFIX))
                        .sorted()
                        .forEach(dir -> readDescriptor(dir).ifPresent(descriptors::add));
            } catch (IOException e) {
                log.error("[Tools] Failed to list user tool directory {}", root, e);
            }
        }
        return descriptors;
    }

    private Optional<ToolDescriptor> readDescriptor(Path toolDir) {
        Path infoFile = toolDir.resolve(INFO_FILE);
        if (!Files.isRegularFile(infoFile)) {
            log.debug("[Tools] Skipping {}: no {}", toolDir, INFO_FILE);
            return Optional.empty();
        }
        try {
            JsonNode info = objectMapper.readTree(infoFile.toFile());
            String dirName = toolDir.getFileName().toString();
            String name = info.path("name").asText(dirName.substring(0, dirName.length() - TOOL_DIR_SUFFIX.length()));

            ToolDescriptor.ToolDescriptorBuilder builder = ToolDescriptor.builder()
                    .name(name)
                    .description(info.path("description").asText(""))
                    .version(info.path("version").asText("1.0.0"))
                    .source(ToolSource.USER)
                    .enabled(info.path("enabled").asBoolean(true))
                    .location(toolDir.toAbsolutePath().toString())
                    .command(info.path("command").asText(null));

            if (info.has("inputSchema")) {
                builder.inputSchema(objectMapper.convertValue(info.get("inputSchema"), SCHEMA_TYPE));
            }
            if (info.has("toolSets")) {
                builder.toolSets(new ArrayList<>(objectMapper.convertValue(info.get("toolSets"), TOOL_SETS_TYPE)));
            }
            if (info.has("capabilities")) {
                builder.capabilities(objectMapper.convertValue(info.get("capabilities"), ToolCapabilities.class));
            }
            ToolDescriptor descriptor = builder.build();
            log.debug("[Tools] Found user tool {} v{} in {}", name, descriptor.getVersion(), toolDir);
            return Optional.of(descriptor);
        } catch (IOException | IllegalArgumentException e) {
            log.error("[Tools] Failed to load tool metadata from {}: {}", infoFile, e.getMessage());
            return Optional.empty();
        }
    }
}
