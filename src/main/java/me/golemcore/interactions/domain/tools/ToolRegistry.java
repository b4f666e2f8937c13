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

import me.golemcore.interactions.domain.component.ToolHandler;
import me.golemcore.interactions.domain.component.ToolHandlerFactory;
import me.golemcore.interactions.domain.exception.ToolHandlingException;
import me.golemcore.interactions.domain.model.RemoteToolDefinition;
import me.golemcore.interactions.domain.model.ToolCapabilities;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.model.ToolSource;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import me.golemcore.interactions.port.outbound.RemoteToolServerPort;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name-to-tool registry with lazily built handlers.
 *
 * <p>
 * Discovery runs in a fixed order: built-in tools, then user tool directories,
 * then remote (MCP) servers. Only descriptors belonging to one of the active
 * tool sets are kept. When two descriptors share a name the newcomer wins only
 * if it is user-supplied; a user tool with a lower version than the one it
 * replaces is logged as a warning but still wins.
 *
 * <p>
 * Remote tools are registered as {@code mcp:<serverId>:<toolName>} and exposed
 * to the model as {@code <toolName>_<serverId>}.
 *
 * <p>
 * Handlers are created on first use by the {@link ToolHandlerFactory} for the
 * descriptor's source and cached. Disabled tools behave as unknown.
 */
@Service
@Slf4j
public class ToolRegistry {

    private static final String REMOTE_PREFIX = "mcp:";

    private final Map<ToolSource, ToolHandlerFactory> factories = new EnumMap<>(ToolSource.class);
    private final BuiltinToolHandlerFactory builtinTools;
    private final UserToolDirectoryScanner userToolScanner;
    private final RemoteToolServerPort remoteToolServerPort;
    private final InteractionsProperties properties;

    private final Map<String, ToolDescriptor> descriptors = new LinkedHashMap<>();
    private final Map<String, String> modelNameToInternal = new HashMap<>();
    private final Map<String, ToolHandler> handlers = new HashMap<>();

    public ToolRegistry(List<ToolHandlerFactory> handlerFactories, BuiltinToolHandlerFactory builtinTools,
            UserToolDirectoryScanner userToolScanner, RemoteToolServerPort remoteToolServerPort,
            InteractionsProperties properties) {
        for (ToolHandlerFactory factory : handlerFactories) {
            factories.put(factory.getSource(), factory);
        }
        this.builtinTools = builtinTools;
        this.userToolScanner = userToolScanner;
        this.remoteToolServerPort = remoteToolServerPort;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        discover(properties.getTools().getToolSets());
    }

    /**
     * Rebuilds the registry for the given tool sets (default: core).
     */
    public synchronized void discover(List<String> toolSets) {
        List<String> activeSets = toolSets == null || toolSets.isEmpty()
                ? List.of(ToolDescriptor.DEFAULT_TOOL_SET)
                : List.copyOf(toolSets);
        descriptors.clear();
        modelNameToInternal.clear();
        handlers.clear();

        for (ToolDescriptor descriptor : builtinTools.getDescriptors()) {
            registerIfActive(descriptor, activeSets);
        }
        for (ToolDescriptor descriptor : userToolScanner.scan(properties.getTools().getUserToolDirectories())) {
            registerIfActive(descriptor, activeSets);
        }
        discoverRemoteTools(activeSets);

        log.info("[Tools] Registered {} tools for tool sets {}: {}", descriptors.size(), activeSets,
                descriptors.keySet());
    }

    private void discoverRemoteTools(List<String> activeSets) {
        for (String serverId : remoteToolServerPort.getServerIds()) {
            List<RemoteToolDefinition> tools;
            try {
                tools = remoteToolServerPort.listTools(serverId);
            } catch (RuntimeException e) {
                log.error("[Tools] Failed to list tools of remote server {}: {}", serverId, e.getMessage());
                continue;
            }
            for (RemoteToolDefinition tool : tools) {
                register(ToolDescriptor.builder()
                        .name(remoteInternalName(serverId, tool.getName()))
                        .modelName(remoteModelName(serverId, tool.getName()))
                        .description(tool.getDescription())
                        .inputSchema(tool.getInputSchema())
                        .capabilities(ToolCapabilities.builder().network(true).idempotent(false).build())
                        .source(ToolSource.REMOTE)
                        .location(serverId)
                        .toolSets(new ArrayList<>(activeSets))
                        .remoteServerId(serverId)
                        .remoteToolName(tool.getName())
                        .build());
            }
            log.info("[Tools] Registered {} tools from remote server {}", tools.size(), serverId);
        }
    }

    private void registerIfActive(ToolDescriptor descriptor, List<String> activeSets) {
        List<String> sets = descriptor.getToolSets() == null || descriptor.getToolSets().isEmpty()
                ? List.of(ToolDescriptor.DEFAULT_TOOL_SET)
                : descriptor.getToolSets();
        if (sets.stream().noneMatch(activeSets::contains)) {
            log.debug("[Tools] Skipping {}: tool sets {} not active", descriptor.getName(), sets);
            return;
        }
        register(descriptor);
    }

    /**
     * Adds a descriptor, applying the collision rule.
     *
     * @return true if the descriptor is now the registered one for its name
     */
    public synchronized boolean register(ToolDescriptor descriptor) {
        ToolDescriptor existing = descriptors.get(descriptor.getName());
        if (existing != null) {
            if (descriptor.getSource() != ToolSource.USER) {
                log.warn("[Tools] Ignoring {} tool {}: already registered from {}", descriptor.getSource(),
                        descriptor.getName(), existing.getSource());
                return false;
            }
            if (SemanticVersion.compare(descriptor.getVersion(), existing.getVersion()) < 0) {
                log.warn("[Tools] User tool {} v{} replaces {} v{} although its version is lower",
                        descriptor.getName(), descriptor.getVersion(), existing.getSource(), existing.getVersion());
            } else {
                log.info("[Tools] User tool {} v{} replaces {} v{}", descriptor.getName(), descriptor.getVersion(),
                        existing.getSource(), existing.getVersion());
            }
            handlers.remove(descriptor.getName());
            if (existing.getModelName() != null) {
                modelNameToInternal.remove(existing.getModelName());
            }
        }
        descriptors.put(descriptor.getName(), descriptor);
        if (descriptor.getModelName() != null) {
            modelNameToInternal.put(descriptor.getModelName(), descriptor.getName());
        }
        return true;
    }

    /**
     * Maps a name as called by the model to the registry name.
     */
    public synchronized String resolveInternalName(String name) {
        return modelNameToInternal.getOrDefault(name, name);
    }

    public synchronized Optional<ToolDescriptor> getDescriptor(String name) {
        return Optional.ofNullable(descriptors.get(resolveInternalName(name)));
    }

    /**
     * Returns the handler for a tool, building it on first use. Unknown and
     * disabled tools yield an empty result.
     *
     * @throws ToolHandlingException
     *             if the handler cannot be built
     */
    public synchronized Optional<ToolHandler> getTool(String name) {
        String internalName = resolveInternalName(name);
        ToolDescriptor descriptor = descriptors.get(internalName);
        if (descriptor == null || !descriptor.isEnabled()) {
            return Optional.empty();
        }
        ToolHandler cached = handlers.get(internalName);
        if (cached != null) {
            return Optional.of(cached);
        }
        ToolHandlerFactory factory = factories.get(descriptor.getSource());
        if (factory == null) {
            throw new ToolHandlingException(internalName, ToolHandlingException.OP_LOAD,
                    "No handler factory for tool source " + descriptor.getSource());
        }
        ToolHandler handler;
        try {
            handler = factory.create(descriptor);
        } catch (ToolHandlingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ToolHandlingException(internalName, ToolHandlingException.OP_LOAD,
                    "Failed to load tool " + internalName + ": " + e.getMessage(), e);
        }
        handlers.put(internalName, handler);
        log.debug("[Tools] Loaded handler for {} ({})", internalName, descriptor.getSource());
        return Optional.of(handler);
    }

    /**
     * Enabled descriptors in registration order, as offered to the provider.
     */
    public synchronized List<ToolDescriptor> getExposedDescriptors() {
        return descriptors.values().stream().filter(ToolDescriptor::isEnabled).toList();
    }

    public synchronized List<ToolDescriptor> getAllDescriptors() {
        return List.copyOf(descriptors.values());
    }

    public static String remoteInternalName(String serverId, String toolName) {
        return REMOTE_PREFIX + serverId + ":" + toolName;
    }

    public static String remoteModelName(String serverId, String toolName) {
        return toolName + "_" + serverId;
    }
}
