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

import me.golemcore.interactions.domain.component.BuiltinTool;
import me.golemcore.interactions.domain.component.ToolHandler;
import me.golemcore.interactions.domain.component.ToolHandlerFactory;
import me.golemcore.interactions.domain.exception.ToolHandlingException;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.model.ToolSource;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves the built-in tools, which are Spring beans and need no construction.
 */
@Component
public class BuiltinToolHandlerFactory implements ToolHandlerFactory {

    private final Map<String, BuiltinTool> tools = new LinkedHashMap<>();

    public BuiltinToolHandlerFactory(List<BuiltinTool> builtinTools) {
        for (BuiltinTool tool : builtinTools) {
            tools.put(tool.getDescriptor().getName(), tool);
        }
    }

    @Override
    public ToolSource getSource() {
        return ToolSource.INTERNAL;
    }

    @Override
    public ToolHandler create(ToolDescriptor descriptor) {
        BuiltinTool tool = tools.get(descriptor.getName());
        if (tool == null) {
            throw new ToolHandlingException(descriptor.getName(), ToolHandlingException.OP_LOAD,
                    "No built-in tool named " + descriptor.getName());
        }
        return tool;
    }

    public List<ToolDescriptor> getDescriptors() {
        return tools.values().stream().map(BuiltinTool::getDescriptor).toList();
    }
}
