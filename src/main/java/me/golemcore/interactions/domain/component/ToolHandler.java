package me.golemcore.interactions.domain.component;

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

import me.golemcore.interactions.domain.model.EditorContext;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.model.ToolRunResult;
import me.golemcore.interactions.domain.model.ToolUseRequest;
import me.golemcore.interactions.domain.tools.ToolInputValidator;

import java.util.Map;

/**
 * Executable side of a tool. Handlers are built lazily by a
 * {@link ToolHandlerFactory} the first time the registry is asked for them.
 *
 * <p>
 * {@link #run} may throw; the dispatcher turns any failure into an error tool
 * result.
 */
public interface ToolHandler {

    ToolDescriptor getDescriptor();

    /**
     * Checks the input against the descriptor's input schema.
     *
     * @param input
     *            the tool input as sent by the model
     * @return true if the input satisfies the schema
     */
    default boolean validateInput(Map<String, Object> input) {
        return ToolInputValidator.validate(getDescriptor().getInputSchema(), input).isEmpty();
    }

    ToolRunResult run(Interaction interaction, ToolUseRequest request, EditorContext editorContext);
}
