package me.golemcore.interactions.domain.tools;

import me.golemcore.interactions.domain.component.ToolHandler;
import me.golemcore.interactions.domain.exception.ToolHandlingException;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.RemoteToolCallResult;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.model.ToolRunResult;
import me.golemcore.interactions.domain.model.ToolSource;
import me.golemcore.interactions.domain.model.ToolUseRequest;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import me.golemcore.interactions.port.outbound.RemoteToolServerPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RemoteToolHandlerFactoryTest {

    private RemoteToolServerPort remotePort;
    private RemoteToolHandlerFactory factory;
    private ToolDescriptor descriptor;

    @BeforeEach
    void setUp() {
        remotePort = mock(RemoteToolServerPort.class);
        factory = new RemoteToolHandlerFactory(remotePort, new InteractionsProperties());
        descriptor = ToolDescriptor.builder()
                .name(ToolRegistry.remoteInternalName("github", "search"))
                .modelName(ToolRegistry.remoteModelName("github", "search"))
                .source(ToolSource.REMOTE)
                .remoteServerId("github")
                .remoteToolName("search")
                .build();
    }

    private static ToolUseRequest request() {
        return ToolUseRequest.builder().toolUseId("tu1").toolName("search_github")
                .toolInput(Map.of("query", "foo")).build();
    }

    @Test
    void shouldForwardCallWithOriginalToolName() {
        when(remotePort.callTool("github", "search", Map.of("query", "foo")))
                .thenReturn(CompletableFuture.completedFuture(RemoteToolCallResult.success("3 hits")));
        ToolHandler handler = factory.create(descriptor);

        ToolRunResult result = handler.run(Interaction.builder().id("i1").build(), request(), null);

        assertEquals("3 hits", result.getToolResponse());
        assertEquals("Remote tool search on github completed", result.getBbResponse());
    }

    @Test
    void shouldFailOnRemoteErrorResult() {
        when(remotePort.callTool("github", "search", Map.of("query", "foo")))
                .thenReturn(CompletableFuture.completedFuture(RemoteToolCallResult.failure("rate limited")));
        ToolHandler handler = factory.create(descriptor);

        ToolHandlingException e = assertThrows(ToolHandlingException.class,
                () -> handler.run(Interaction.builder().id("i1").build(), request(), null));

        assertEquals("rate limited", e.getMessage());
    }

    @Test
    void shouldUnwrapFailedFuture() {
        when(remotePort.callTool("github", "search", Map.of("query", "foo")))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("server down")));
        ToolHandler handler = factory.create(descriptor);

        ToolHandlingException e = assertThrows(ToolHandlingException.class,
                () -> handler.run(Interaction.builder().id("i1").build(), request(), null));

        assertEquals("Remote tool failed: server down", e.getMessage());
    }

    @Test
    void shouldRejectDescriptorWithoutServerBinding() {
        ToolDescriptor unbound = descriptor.toBuilder().remoteServerId(null).build();

        assertThrows(ToolHandlingException.class, () -> factory.create(unbound));
    }
}
