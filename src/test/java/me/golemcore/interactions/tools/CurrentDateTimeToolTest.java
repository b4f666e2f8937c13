package me.golemcore.interactions.tools;

import me.golemcore.interactions.domain.exception.ToolHandlingException;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.ToolRunResult;
import me.golemcore.interactions.domain.model.ToolSource;
import me.golemcore.interactions.domain.model.ToolUseRequest;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CurrentDateTimeToolTest {

    private final CurrentDateTimeTool tool = new CurrentDateTimeTool(
            Clock.fixed(Instant.parse("2026-04-01T08:00:00Z"), ZoneOffset.UTC));

    @Test
    void shouldDescribeItselfAsInternalCoreTool() {
        assertEquals(CurrentDateTimeTool.NAME, tool.getDescriptor().getName());
        assertEquals(ToolSource.INTERNAL, tool.getDescriptor().getSource());
        assertTrue(tool.getDescriptor().getToolSets().contains("core"));
    }

    @Test
    void shouldUseClockZoneByDefault() {
        ToolRunResult result = tool.run(Interaction.builder().build(), request(Map.of()), null);

        assertEquals("2026-04-01 08:00:00 Z (WEDNESDAY)", result.getToolResponse());
        assertEquals(result.getToolResponse(), result.getToolResults().get(0).getText());
    }

    @Test
    void shouldConvertToRequestedTimezone() {
        ToolRunResult result = tool.run(Interaction.builder().build(), request(Map.of("timezone", "Asia/Tokyo")), null);

        assertTrue(result.getToolResponse().startsWith("2026-04-01 17:00:00"));
        assertTrue(result.getBbResponse().startsWith("Current time: "));
    }

    @Test
    void shouldRejectUnknownTimezone() {
        ToolHandlingException ex = assertThrows(ToolHandlingException.class,
                () -> tool.run(Interaction.builder().build(), request(Map.of("timezone", "Mars/Olympus")), null));

        assertEquals(ToolHandlingException.OP_EXECUTE, ex.getOperation());
        assertTrue(ex.getMessage().contains("Mars/Olympus"));
    }

    private static ToolUseRequest request(Map<String, Object> input) {
        return ToolUseRequest.builder().toolUseId("tu_1").toolName(CurrentDateTimeTool.NAME).toolInput(input).build();
    }
}
