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
import me.golemcore.interactions.domain.exception.ToolHandlingException;
import me.golemcore.interactions.domain.exception.ToolValidationException;
import me.golemcore.interactions.domain.model.ContentPart;
import me.golemcore.interactions.domain.model.EditorContext;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.Message;
import me.golemcore.interactions.domain.model.StatementState;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.model.ToolDispatchResult;
import me.golemcore.interactions.domain.model.ToolRunResult;
import me.golemcore.interactions.domain.model.ToolUseRequest;
import me.golemcore.interactions.domain.service.InteractionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one tool use requested by the model and records its result on the
 * interaction.
 *
 * <p>
 * Only registry-level failures (unknown tool, handler that cannot be built)
 * propagate. Invalid input and any failure while running are appended as an
 * error tool result and reported through {@link ToolDispatchResult#isError()}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolDispatcher {

    static final String FAILURE_SUMMARY = "The tool could not be run";

    private final ToolRegistry toolRegistry;
    private final InteractionService interactionService;

    public ToolDispatchResult dispatch(Interaction interaction, ToolUseRequest request, EditorContext editorContext) {
        String toolName = request.getToolName();
        ToolDescriptor descriptor = toolRegistry.getDescriptor(toolName)
                .filter(ToolDescriptor::isEnabled)
                .orElseThrow(() -> new ToolHandlingException(toolName, ToolHandlingException.OP_LOOKUP,
                        "Unknown tool: " + toolName));
        ToolHandler handler = toolRegistry.getTool(toolName)
                .orElseThrow(() -> new ToolHandlingException(toolName, ToolHandlingException.OP_LOOKUP,
                        "Unknown tool: " + toolName));

        interaction.setStatementState(StatementState.AWAITING_TOOL_RESULT);
        String statsName = descriptor.getName();
        try {
            if (!request.isValidated() && !handler.validateInput(request.getToolInput())) {
                List<String> errors = ToolInputValidator.validate(descriptor.getInputSchema(),
                        request.getToolInput());
                throw new ToolValidationException(toolName, String.join("; ", errors));
            }

            log.debug("[Tools] Running {} for tool use {}", statsName, request.getToolUseId());
            ToolRunResult result = handler.run(interaction, request, editorContext);
            List<ContentPart> toolResults = result.getToolResults() != null
                    ? result.getToolResults()
                    : new ArrayList<>();

            Message message = interactionService.addToolResult(interaction, request.getToolUseId(), toolResults,
                    false);
            if (result.getFinalizeCallback() != null) {
                result.getFinalizeCallback().accept(message.getId());
            }
            interactionService.updateToolStats(interaction, statsName, true);

            return ToolDispatchResult.builder()
                    .toolResults(toolResults)
                    .toolResponse(result.getToolResponse())
                    .bbResponse(result.getBbResponse())
                    .isError(false)
                    .messageId(message.getId())
                    .build();
        } catch (RuntimeException e) { // NOSONAR - every handler failure becomes an error result
            String errorText = "Error with " + toolName + ": " + safeCauseMessage(e);
            log.warn("[Tools] {} failed: {}", statsName, errorText);

            Message message = interactionService.addToolResult(interaction, request.getToolUseId(),
                    List.of(ContentPart.text(errorText)), true);
            interactionService.updateToolStats(interaction, statsName, false);

            return ToolDispatchResult.builder()
                    .toolResults(new ArrayList<>())
                    .toolResponse(errorText)
                    .bbResponse(FAILURE_SUMMARY)
                    .isError(true)
                    .messageId(message.getId())
                    .build();
        }
    }

    /**
     * Dispatches every tool use of a provider answer in order.
     */
    public List<ToolDispatchResult> dispatchAll(Interaction interaction, List<ToolUseRequest> requests,
            EditorContext editorContext) {
        List<ToolDispatchResult> results = new ArrayList<>();
        for (ToolUseRequest request : requests) {
            results.add(dispatch(interaction, request, editorContext));
        }
        return results;
    }

    private static String safeCauseMessage(Throwable e) {
        Throwable current = e;
        while (current.getCause() != null && current.getMessage() == null) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }
}
