package me.golemcore.interactions.port.outbound;

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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for remote tool servers (MCP). Abstracts server process lifecycle from
 * the tool registry.
 */
public interface RemoteToolServerPort {

    /**
     * Ids of the configured, enabled servers.
     */
    List<String> getServerIds();

    /**
     * Start the server if needed and return the tools it exposes.
     */
    List<RemoteToolDefinition> listTools(String serverId);

    CompletableFuture<RemoteToolCallResult> callTool(String serverId, String toolName, Map<String, Object> arguments);
}
