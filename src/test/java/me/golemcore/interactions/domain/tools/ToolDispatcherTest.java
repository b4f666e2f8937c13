package me.golemcore.interactions.domain.tools;

import me.golemcore.interactions.domain.component.ToolHandler;
import me.golemcore.interactions.domain.exception.ToolHandlingException;
import me.golemcore.interactions.domain.model.ContentPart;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.Message;
import me.golemcore.interactions.domain.model.StatementState;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.model.ToolDispatchResult;
import me.golemcore.interactions.domain.model.ToolRunResult;
import me.golemcore.interactions.domain.model.ToolSource;
import me.golemcore.interactions.domain.model.ToolUseRequest;
import me.golemcore.interactions.domain.service.InteractionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ToolDispatcherTest {

    private static final String TOOL_NAME = "read_file";
    private static final Map<String, Object> SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of("path", Map.of("type", "string")),
            "required", List.of("path"));

    private ToolRegistry registry;
    private InteractionService interactionService;
    private ToolHandler handler;
    private ToolDispatcher dispatcher;
    private Interaction interaction;
    private Message toolMessage;

    @BeforeEach
    void setUp() {
        registry = mock(ToolRegistry.class);
        interactionService = mock(InteractionService.class);
        handler = mock(ToolHandler.class);
        dispatcher = new ToolDispatcher(registry, interactionService);
        interaction = Interaction.builder().id("i1").projectId("p1").build();
        toolMessage = Message.builder().id("tool-msg-1").role(Message.ROLE_TOOL).build();

        ToolDescriptor descriptor = ToolDescriptor.builder()
                .name(TOOL_NAME)
                .source(ToolSource.INTERNAL)
                .inputSchema(SCHEMA)
                .build();
        when(registry.getDescriptor(TOOL_NAME)).thenReturn(Optional.of(descriptor));
        when(registry.getTool(TOOL_NAME)).thenReturn(Optional.of(handler));
        when(handler.validateInput(any())).thenAnswer(inv -> ToolInputValidator.validate(SCHEMA,
                inv.getArgument(0)).isEmpty());
        when(interactionService.addToolResult(any(), anyString(), anyList(), anyBoolean())).thenReturn(toolMessage);
    }

    private static ToolUseRequest request(Map<String, Object> input) {
        return ToolUseRequest.builder().toolUseId("tu1").toolName(TOOL_NAME).toolInput(input).build();
    }

    // ==================== SUCCESS ====================

    @Test
    void shouldRunToolAndRecordResult() {
        when(handler.run(any(), any(), any())).thenReturn(ToolRunResult.text("file body", "relay", "Read a file"));

        ToolDispatchResult result = dispatcher.dispatch(interaction, request(Map.of("path", "a.txt")), null);

        assertFalse(result.isError());
        assertEquals("relay", result.getToolResponse());
        assertEquals("Read a file", result.getBbResponse());
        assertEquals("tool-msg-1", result.getMessageId());
        assertEquals("file body", result.getToolResults().get(0).getText());
        verify(interactionService).addToolResult(eq(interaction), eq("tu1"), anyList(), eq(false));
        verify(interactionService).updateToolStats(interaction, TOOL_NAME, true);
        assertEquals(StatementState.AWAITING_TOOL_RESULT, interaction.getStatementState());
    }

    @Test
    void shouldInvokeFinalizeCallbackWithMessageId() {
        AtomicReference<String> finalized = new AtomicReference<>();
        ToolRunResult runResult = ToolRunResult.builder()
                .toolResults(new ArrayList<>(List.of(ContentPart.text("done"))))
                .finalizeCallback(finalized::set)
                .build();
        when(handler.run(any(), any(), any())).thenReturn(runResult);

        dispatcher.dispatch(interaction, request(Map.of("path", "a.txt")), null);

        assertEquals("tool-msg-1", finalized.get());
    }

    @Test
    void shouldSkipValidationWhenAlreadyValidated() {
        when(handler.run(any(), any(), any())).thenReturn(ToolRunResult.text("ok", "ok", "ok"));
        ToolUseRequest request = request(Map.of());
        request.setValidated(true);

        ToolDispatchResult result = dispatcher.dispatch(interaction, request, null);

        assertFalse(result.isError());
        verify(handler, never()).validateInput(any());
    }

    // ==================== FAILURES ====================

    @Test
    void shouldReportInvalidInputAsErrorResult() {
        ToolDispatchResult result = dispatcher.dispatch(interaction, request(Map.of("path", 42)), null);

        assertTrue(result.isError());
        assertTrue(result.getToolResponse().startsWith("Error with read_file: Invalid input for tool read_file"));
        assertTrue(result.getToolResponse().contains("input.path must be of type string"));
        assertEquals(ToolDispatcher.FAILURE_SUMMARY, result.getBbResponse());
        verify(handler, never()).run(any(), any(), any());
        verify(interactionService).updateToolStats(interaction, TOOL_NAME, false);
    }

    @Test
    void shouldReportHandlerFailureAsErrorResult() {
        when(handler.run(any(), any(), any())).thenThrow(new IllegalStateException("disk on fire"));

        ToolDispatchResult result = dispatcher.dispatch(interaction, request(Map.of("path", "a.txt")), null);

        assertTrue(result.isError());
        assertEquals("Error with read_file: disk on fire", result.getToolResponse());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ContentPart>> content = ArgumentCaptor.forClass(List.class);
        verify(interactionService).addToolResult(eq(interaction), eq("tu1"), content.capture(), eq(true));
        assertEquals("Error with read_file: disk on fire", content.getValue().get(0).getText());
        verify(interactionService).updateToolStats(interaction, TOOL_NAME, false);
    }

    @Test
    void shouldUseCauseMessageWhenWrapperHasNone() {
        when(handler.run(any(), any(), any())).thenThrow(new RuntimeException((String) null,
                new IllegalArgumentException("root cause")));

        ToolDispatchResult result = dispatcher.dispatch(interaction, request(Map.of("path", "a.txt")), null);

        assertEquals("Error with read_file: root cause", result.getToolResponse());
    }

    @Test
    void shouldPropagateUnknownTool() {
        when(registry.getDescriptor("nope")).thenReturn(Optional.empty());
        ToolUseRequest request = ToolUseRequest.builder().toolUseId("tu1").toolName("nope").build();

        ToolHandlingException e = assertThrows(ToolHandlingException.class,
                () -> dispatcher.dispatch(interaction, request, null));

        assertEquals(ToolHandlingException.OP_LOOKUP, e.getOperation());
        verifyNoInteractions(interactionService);
    }

    @Test
    void shouldDispatchAllInOrder() {
        when(handler.run(any(), any(), any()))
                .thenReturn(ToolRunResult.text("first", "first", "1"))
                .thenThrow(new IllegalStateException("second failed"));

        List<ToolDispatchResult> results = dispatcher.dispatchAll(interaction,
                List.of(request(Map.of("path", "a")), request(Map.of("path", "b"))), null);

        assertEquals(2, results.size());
        assertFalse(results.get(0).isError());
        assertTrue(results.get(1).isError());
    }
}
