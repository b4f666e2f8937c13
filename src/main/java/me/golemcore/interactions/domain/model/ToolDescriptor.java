package me.golemcore.interactions.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Everything the registry knows about a tool before its handler is built.
 *
 * <p>
 * {@code name} is the identity inside the registry. For remote tools it is the
 * namespaced id {@code mcp:<serverId>:<toolName>} and {@code modelName} is the
 * name exposed to the model. {@code location} is the tool directory for user
 * tools and the server id for remote tools.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ToolDescriptor {

    public static final String DEFAULT_TOOL_SET = "core";

    private String name;
    private String modelName;
    private String description;

    @Builder.Default
    private String version = "1.0.0";

    private Map<String, Object> inputSchema;

    @Builder.Default
    private ToolCapabilities capabilities = new ToolCapabilities();

    private ToolSource source;

    @Builder.Default
    private boolean enabled = true;

    private String location;

    @Builder.Default
    private List<String> toolSets = new ArrayList<>(List.of(DEFAULT_TOOL_SET));

    // user tools
    private String command;

    // remote tools
    private String remoteServerId;
    private String remoteToolName;

    /**
     * Name the model sees and calls the tool by.
     */
    public String getExposedName() {
        return modelName != null ? modelName : name;
    }
}
