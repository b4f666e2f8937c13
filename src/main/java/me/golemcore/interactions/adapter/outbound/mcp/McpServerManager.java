package me.golemcore.interactions.adapter.outbound.mcp;

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

import me.golemcore.interactions.domain.model.RemoteToolCallResult;
import me.golemcore.interactions.domain.model.RemoteToolDefinition;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import me.golemcore.interactions.port.outbound.RemoteToolServerPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Pool of {@link McpClient}s keyed by the server ids configured under
 * {@code interactions.tools.remote-servers}. Servers start lazily on the first
 * tool listing or call and are stopped on shutdown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class McpServerManager implements RemoteToolServerPort {

    private final InteractionsProperties properties;
    private final ObjectMapper objectMapper;

    private final Map<String, McpClient> clients = new ConcurrentHashMap<>();

    @Override
    public List<String> getServerIds() {
        return properties.getTools().getRemoteServers().entrySet().stream()
                .filter(entry -> entry.getValue().isEnabled())
                .filter(entry -> entry.getValue().getCommand() != null && !entry.getValue().getCommand().isBlank())
                .map(Map.Entry::getKey)
                .toList();
    }

    @Override
    public List<RemoteToolDefinition> listTools(String serverId) {
        return getOrStartClient(serverId).getCachedTools();
    }

    @Override
    public CompletableFuture<RemoteToolCallResult> callTool(String serverId, String toolName,
            Map<String, Object> arguments) {
        try {
            return getOrStartClient(serverId).callTool(toolName, arguments);
        } catch (IllegalStateException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @SuppressWarnings("PMD.CloseResource")
    private McpClient getOrStartClient(String serverId) {
        McpClient existing = clients.get(serverId);
        if (existing != null && existing.isRunning()) {
            return existing;
        }

        synchronized (this) {
            existing = clients.get(serverId);
            if (existing != null && existing.isRunning()) {
                return existing;
            }
            if (existing != null) {
                existing.close();
                clients.remove(serverId);
            }

            InteractionsProperties.RemoteServerProperties config = properties.getTools().getRemoteServers()
                    .get(serverId);
            if (config == null || !config.isEnabled()) {
                throw new IllegalStateException("Remote tool server not configured: " + serverId);
            }

            McpClient client = new McpClient(serverId, config, objectMapper);
            try {
                List<RemoteToolDefinition> tools = client.start();
                clients.put(serverId, client);
                log.info("[MCP:{}] Started client, {} tools", serverId, tools.size());
                return client;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                client.close();
                throw new IllegalStateException("Interrupted while starting remote tool server " + serverId, e);
            } catch (IOException | ExecutionException | TimeoutException e) {
                client.close();
                throw new IllegalStateException("Failed to start remote tool server " + serverId + ": "
                        + e.getMessage(), e);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        if (clients.isEmpty()) {
            return;
        }
        log.info("[MCP] Shutting down {} remote tool servers", clients.size());
        for (Map.Entry<String, McpClient> entry : clients.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                log.warn("[MCP:{}] Error closing client: {}", entry.getKey(), e.getMessage());
            }
        }
        clients.clear();
    }
}
