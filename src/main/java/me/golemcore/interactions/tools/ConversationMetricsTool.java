package me.golemcore.interactions.tools;

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
import me.golemcore.interactions.domain.exception.ToolHandlingException;
import me.golemcore.interactions.domain.model.EditorContext;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.Message;
import me.golemcore.interactions.domain.model.TokenUsageAnalysis;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.model.ToolRunResult;
import me.golemcore.interactions.domain.model.ToolSource;
import me.golemcore.interactions.domain.model.ToolUseRequest;
import me.golemcore.interactions.domain.service.TokenUsageLedger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports counters, token usage and tool usage of the interaction the model is
 * talking in, so the model can reason about how long and costly the
 * conversation has become.
 */
@Component
@RequiredArgsConstructor
public class ConversationMetricsTool implements BuiltinTool {

    public static final String NAME = "conversation_metrics";

    private final TokenUsageLedger tokenUsageLedger;
    private final ObjectMapper objectMapper;

    @Override
    public ToolDescriptor getDescriptor() {
        return ToolDescriptor.builder()
                .name(NAME)
                .description("Report statement and turn counts, token usage, cache savings and tool usage "
                        + "of the current conversation.")
                .version("1.0.0")
                .source(ToolSource.INTERNAL)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "includeTools", Map.of(
                                        "type", "boolean",
                                        "description", "Include per-tool usage counters. Default is true.")),
                        "required", List.of()))
                .build();
    }

    @Override
    public ToolRunResult run(Interaction interaction, ToolUseRequest request, EditorContext editorContext) {
        boolean includeTools = request.getToolInput() == null
                || !Boolean.FALSE.equals(request.getToolInput().get("includeTools"));

        TokenUsageAnalysis analysis = tokenUsageLedger.analyzeAll(interaction.getProjectId(), interaction.getId());

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("interactionId", interaction.getId());
        metrics.put("statementCount", interaction.getStats().getStatementCount());
        metrics.put("statementTurnCount", interaction.getStats().getStatementTurnCount());
        metrics.put("interactionTurnCount", interaction.getStats().getInteractionTurnCount());
        metrics.put("messageCount", interaction.getMessages().size());
        metrics.put("messagesByRole", countByRole(interaction.getMessages()));
        metrics.put("totalProviderRequests", interaction.getTotalProviderRequests());
        metrics.put("tokenUsage", analysis.getTotalUsage());
        metrics.put("cacheImpact", analysis.getCacheImpact());
        if (includeTools) {
            metrics.put("toolStats", interaction.getToolStats());
        }

        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(metrics);
        } catch (JsonProcessingException e) {
            throw new ToolHandlingException(NAME, ToolHandlingException.OP_FORMAT,
                    "Failed to format metrics: " + e.getOriginalMessage(), e);
        }
        return ToolRunResult.text(json, json, "Conversation metrics: " + interaction.getStats().getStatementCount()
                + " statements, " + analysis.getTotalUsage().getTotalAllTokens() + " tokens");
    }

    private static Map<String, Integer> countByRole(List<Message> messages) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Message message : messages) {
            counts.merge(message.getRole(), 1, Integer::sum);
        }
        return counts;
    }
}
