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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client for a single MCP (Model Context Protocol) server over
 * stdio.
 *
 * <p>
 * Lifecycle: start the server process through the shell, send
 * {@code initialize}, fetch {@code tools/list}, serve {@code tools/call}
 * requests, close the process. Responses are matched to requests by JSON-RPC
 * id in a reader thread; stderr is drained to the DEBUG log.
 *
 * <p>
 * MCP protocol version: 2024-11-05
 *
 * <p>
 * Not a Spring bean, created per configured server by
 * {@link McpServerManager}.
 */
public class McpClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);
    private static final String JSONRPC_VERSION = "2.0";
    private static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final long REQUEST_TIMEOUT_SECONDS = 60;
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final String serverId;
    private final InteractionsProperties.RemoteServerProperties config;
    private final ObjectMapper objectMapper;

    private Process process;
    private BufferedWriter writer;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

    private volatile boolean running;
    private List<RemoteToolDefinition> cachedTools;

    public McpClient(String serverId, InteractionsProperties.RemoteServerProperties config,
            ObjectMapper objectMapper) {
        this.serverId = serverId;
        this.config = config;
        this.objectMapper = objectMapper;
    }

    /**
     * Start the server process, send initialize, and fetch available tools.
     */
    public List<RemoteToolDefinition> start()
            throws IOException, InterruptedException, ExecutionException, TimeoutException {
        log.info("[MCP:{}] Starting server: {}", serverId, config.getCommand());

        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", config.getCommand());
        pb.redirectErrorStream(false);
        if (config.getEnv() != null) {
            pb.environment().putAll(config.getEnv());
        }

        process = pb.start();
        running = true;
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        Thread readerThread = new Thread(this::readLoop, "mcp-reader-" + serverId);
        readerThread.setDaemon(true);
        readerThread.start();

        Thread stderrThread = new Thread(this::stderrDrain, "mcp-stderr-" + serverId);
        stderrThread.setDaemon(true);
        stderrThread.start();

        try {
            int timeoutSeconds = config.getStartupTimeoutSeconds();
            JsonNode initResult = sendRequest("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of(
                            "name", "golemcore-interactions",
                            "version", "1.0.0")))
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            log.info("[MCP:{}] Initialized: {}", serverId, initResult);

            sendNotification("notifications/initialized", Map.of());

            JsonNode toolsResult = sendRequest("tools/list", Map.of())
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            cachedTools = parseToolDefinitions(toolsResult);
            log.info("[MCP:{}] Available tools: {}", serverId,
                    cachedTools.stream().map(RemoteToolDefinition::getName).toList());
            return cachedTools;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", serverId, e.getMessage());
            close();
            throw e;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", serverId, e.getMessage());
            close();
            throw e;
        }
    }

    public CompletableFuture<RemoteToolCallResult> callTool(String name, Map<String, Object> arguments) {
        return sendRequest("tools/call", Map.of(
                "name", name,
                "arguments", arguments != null ? arguments : Map.of()))
                .thenApply(result -> parseToolCallResult(name, result))
                .exceptionally(ex -> RemoteToolCallResult.failure("MCP tool call failed: " + ex.getMessage()));
    }

    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<JsonNode>()
                .orTimeout(REQUEST_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .whenComplete((result, ex) -> pendingRequests.remove(id));
        pendingRequests.put(id, future);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        try {
            writeLine(objectMapper.writeValueAsString(request));
        } catch (IOException e) {
            pendingRequests.remove(id);
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Send a JSON-RPC notification (no id, no response expected).
     */
    void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }
        try {
            writeLine(objectMapper.writeValueAsString(notification));
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to send notification: {}", serverId, e.getMessage());
        }
    }

    private void writeLine(String json) throws IOException {
        log.debug("[MCP:{}] -> {}", serverId, json);
        synchronized (writer) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    private void readLoop() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty()) {
                    handleLine(line);
                }
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP:{}] Reader thread error: {}", serverId, e.getMessage());
            }
        } finally {
            for (CompletableFuture<JsonNode> pending : pendingRequests.values()) {
                pending.completeExceptionally(new IOException("MCP process closed"));
            }
            pendingRequests.clear();
        }
    }

    void handleLine(String line) {
        log.debug("[MCP:{}] <- {}", serverId, line);
        try {
            JsonNode message = objectMapper.readTree(line);
            JsonNode idNode = message.get("id");
            if (idNode == null || !idNode.isInt()) {
                String method = message.has("method") ? message.get("method").asText() : "unknown";
                log.debug("[MCP:{}] Server notification: {}", serverId, method);
                return;
            }
            CompletableFuture<JsonNode> pending = pendingRequests.remove(idNode.asInt());
            if (pending == null) {
                log.warn("[MCP:{}] Received response for unknown id: {}", serverId, idNode.asInt());
                return;
            }
            JsonNode error = message.get("error");
            if (error != null && !error.isNull()) {
                pending.completeExceptionally(new McpException(
                        error.has("code") ? error.get("code").asInt() : -1,
                        error.has("message") ? error.get("message").asText() : "Unknown MCP error"));
            } else {
                pending.complete(message.get("result"));
            }
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Failed to parse response: {}", serverId, e.getMessage());
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", serverId, line);
            }
        } catch (IOException e) {
            if (running) {
                log.debug("[MCP:{}] Stderr drain ended: {}", serverId, e.getMessage());
            }
        }
    }

    List<RemoteToolDefinition> parseToolDefinitions(JsonNode result) {
        if (result == null || !result.has("tools") || !result.get("tools").isArray()) {
            return List.of();
        }
        List<RemoteToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : result.get("tools")) {
            if (!toolNode.hasNonNull("name")) {
                continue;
            }
            String name = toolNode.get("name").asText();
            String description = toolNode.has("description") ? toolNode.get("description").asText() : "";

            Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("[MCP:{}] Failed to parse inputSchema for tool '{}': {}", serverId, name,
                            e.getMessage());
                }
            }
            tools.add(RemoteToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build());
        }
        return tools;
    }

    static RemoteToolCallResult parseToolCallResult(String toolName, JsonNode result) {
        if (result == null) {
            return RemoteToolCallResult.failure("No result from MCP tool: " + toolName);
        }
        boolean isError = result.has("isError") && result.get("isError").asBoolean(false);

        StringBuilder output = new StringBuilder();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.has("type") ? item.get("type").asText() : "text";
                if ("text".equals(type) && item.has("text")) {
                    if (!output.isEmpty()) {
                        output.append("\n");
                    }
                    output.append(item.get("text").asText());
                }
            }
        }

        if (isError) {
            return RemoteToolCallResult.failure(output.isEmpty() ? "MCP tool error" : output.toString());
        }
        return RemoteToolCallResult.success(output.isEmpty() ? "(no output)" : output.toString());
    }

    public List<RemoteToolDefinition> getCachedTools() {
        return cachedTools != null ? cachedTools : List.of();
    }

    public boolean isRunning() {
        return running && process != null && process.isAlive();
    }

    public String getServerId() {
        return serverId;
    }

    @Override
    public void close() {
        log.info("[MCP:{}] Closing client", serverId);
        running = false;

        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(new IOException("MCP client closing"));
        }
        pendingRequests.clear();

        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[MCP:{}] Error closing writer: {}", serverId, e.getMessage());
            }
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    /**
     * Exception for MCP JSON-RPC errors.
     */
    public static class McpException extends Exception {
        private static final long serialVersionUID = 1L;
        private final int code;

        public McpException(int code, String message) {
            super(message);
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }
}
