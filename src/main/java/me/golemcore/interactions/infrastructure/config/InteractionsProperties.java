package me.golemcore.interactions.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code interactions.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - where interaction data lives</li>
 * <li>{@link HydrationProperties} - resource re-injection window</li>
 * <li>{@link ConversationProperties} - per-statement limits</li>
 * <li>{@link ProviderProperties} - retry and backoff for provider calls</li>
 * <li>{@link LlmProperties} - the langchain4j-backed provider</li>
 * <li>{@link ToolsProperties} - tool sets, user tool directories, MCP
 * servers</li>
 * <li>{@link ResourcesProperties} - filesystem resource connector</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "interactions")
@Data
public class InteractionsProperties {

    private StorageProperties storage = new StorageProperties();
    private HydrationProperties hydration = new HydrationProperties();
    private ConversationProperties conversation = new ConversationProperties();
    private ProviderProperties provider = new ProviderProperties();
    private LlmProperties llm = new LlmProperties();
    private ToolsProperties tools = new ToolsProperties();
    private ResourcesProperties resources = new ResourcesProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/interactions";
    }

    @Data
    public static class HydrationProperties {
        private int windowSize = 2;
    }

    @Data
    public static class ConversationProperties {
        private int maxAttachedResources = 20;
    }

    @Data
    public static class ProviderProperties {
        private int maxRetries = 5;
        private long initialBackoffMs = 5_000;
        private double backoffMultiplier = 2.0;
        private long maxBackoffMs = 120_000;
    }

    @Data
    public static class LlmProperties {
        private String provider = "anthropic";
        private String apiKey;
        private String baseUrl;
        private String model = "claude-sonnet-4-20250514";
        private long timeoutMs = 300_000;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private List<String> toolSets = new ArrayList<>(List.of("core"));
        private List<String> userToolDirectories = new ArrayList<>();
        private Map<String, RemoteServerProperties> remoteServers = new LinkedHashMap<>();
        private long executionTimeoutSeconds = 30;
    }

    @Data
    public static class RemoteServerProperties {
        private boolean enabled = true;
        private String command;
        private Map<String, String> env = new HashMap<>();
        private int startupTimeoutSeconds = 30;
    }

    @Data
    public static class ResourcesProperties {
        private String root = ".";
    }
}
