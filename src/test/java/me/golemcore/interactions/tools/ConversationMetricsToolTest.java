package me.golemcore.interactions.tools;

import me.golemcore.interactions.domain.model.ContentPart;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.InteractionStats;
import me.golemcore.interactions.domain.model.Message;
import me.golemcore.interactions.domain.model.TokenUsage;
import me.golemcore.interactions.domain.model.TokenUsageAnalysis;
import me.golemcore.interactions.domain.model.ToolRunResult;
import me.golemcore.interactions.domain.model.ToolUsageStats;
import me.golemcore.interactions.domain.model.ToolUseRequest;
import me.golemcore.interactions.domain.service.TokenUsageLedger;
import me.golemcore.interactions.infrastructure.config.AutoConfiguration;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ConversationMetricsToolTest {

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private TokenUsageLedger ledger;
    private ConversationMetricsTool tool;
    private Interaction interaction;

    @BeforeEach
    void setUp() {
        ledger = mock(TokenUsageLedger.class);
        tool = new ConversationMetricsTool(ledger, objectMapper);
        interaction = Interaction.builder()
                .id("i1")
                .projectId("p1")
                .stats(new InteractionStats(2, 5, 7))
                .messages(new ArrayList<>(List.of(
                        message("m1", Message.ROLE_USER),
                        message("m2", Message.ROLE_ASSISTANT),
                        message("m3", Message.ROLE_TOOL),
                        message("m4", Message.ROLE_ASSISTANT))))
                .totalProviderRequests(3)
                .build();
        interaction.getToolStats().put("read_file", ToolUsageStats.builder().count(2).success(2).build());
        when(ledger.analyzeAll("p1", "i1")).thenReturn(TokenUsageAnalysis.builder()
                .totalUsage(TokenUsage.of(300, 75, 0, 0))
                .build());
    }

    @Test
    void shouldReportCountersAndUsage() throws Exception {
        ToolRunResult result = tool.run(interaction, request(Map.of()), null);

        JsonNode metrics = objectMapper.readTree(result.getToolResponse());
        assertEquals("i1", metrics.get("interactionId").asText());
        assertEquals(2, metrics.get("statementCount").asInt());
        assertEquals(5, metrics.get("statementTurnCount").asInt());
        assertEquals(7, metrics.get("interactionTurnCount").asInt());
        assertEquals(4, metrics.get("messageCount").asInt());
        assertEquals(2, metrics.get("messagesByRole").get("assistant").asInt());
        assertEquals(3, metrics.get("totalProviderRequests").asInt());
        assertEquals(375, metrics.get("tokenUsage").get("totalAllTokens").asInt());
        assertEquals(2, metrics.get("toolStats").get("read_file").get("count").asInt());
        assertEquals("Conversation metrics: 2 statements, 375 tokens", result.getBbResponse());
    }

    @Test
    void shouldOmitToolStatsWhenAsked() throws Exception {
        ToolRunResult result = tool.run(interaction, request(Map.of("includeTools", false)), null);

        assertFalse(objectMapper.readTree(result.getToolResponse()).has("toolStats"));
    }

    private static Message message(String id, String role) {
        return Message.builder().id(id).role(role).content(List.of(ContentPart.text(id))).build();
    }

    private static ToolUseRequest request(Map<String, Object> input) {
        return ToolUseRequest.builder().toolUseId("tu_1").toolName(ConversationMetricsTool.NAME).toolInput(input)
                .build();
    }
}
