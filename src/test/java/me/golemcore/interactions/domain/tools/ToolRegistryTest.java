package me.golemcore.interactions.domain.tools;

import me.golemcore.interactions.domain.component.BuiltinTool;
import me.golemcore.interactions.domain.component.ToolHandler;
import me.golemcore.interactions.domain.component.ToolHandlerFactory;
import me.golemcore.interactions.domain.exception.ToolHandlingException;
import me.golemcore.interactions.domain.model.EditorContext;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.RemoteToolDefinition;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.model.ToolRunResult;
import me.golemcore.interactions.domain.model.ToolSource;
import me.golemcore.interactions.domain.model.ToolUseRequest;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import me.golemcore.interactions.port.outbound.RemoteToolServerPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ToolRegistryTest {

    private UserToolDirectoryScanner scanner;
    private RemoteToolServerPort remotePort;
    private ToolHandlerFactory userFactory;
    private InteractionsProperties properties;
    private List<BuiltinTool> builtinTools;

    @BeforeEach
    void setUp() {
        scanner = mock(UserToolDirectoryScanner.class);
        remotePort = mock(RemoteToolServerPort.class);
        userFactory = mock(ToolHandlerFactory.class);
        when(userFactory.getSource()).thenReturn(ToolSource.USER);
        when(scanner.scan(any())).thenReturn(List.of());
        when(remotePort.getServerIds()).thenReturn(List.of());
        properties = new InteractionsProperties();
        builtinTools = new ArrayList<>(List.of(new FakeBuiltinTool(descriptor("x", "1.0.0", ToolSource.INTERNAL))));
    }

    private ToolRegistry createRegistry() {
        BuiltinToolHandlerFactory builtinFactory = new BuiltinToolHandlerFactory(builtinTools);
        ToolRegistry registry = new ToolRegistry(List.of(builtinFactory, userFactory), builtinFactory, scanner,
                remotePort, properties);
        registry.init();
        return registry;
    }

    private static ToolDescriptor descriptor(String name, String version, ToolSource source) {
        return ToolDescriptor.builder()
                .name(name)
                .version(version)
                .description(name + " tool")
                .source(source)
                .build();
    }

    // ==================== DISCOVERY ====================

    @Test
    void shouldRegisterBuiltinTools() {
        ToolRegistry registry = createRegistry();

        assertTrue(registry.getDescriptor("x").isPresent());
        assertEquals(ToolSource.INTERNAL, registry.getDescriptor("x").get().getSource());
        assertInstanceOf(FakeBuiltinTool.class, registry.getTool("x").orElseThrow());
    }

    @Test
    void shouldLetUserToolReplaceBuiltinEvenWithLowerVersion() {
        ToolDescriptor user = descriptor("x", "0.9.0", ToolSource.USER);
        when(scanner.scan(any())).thenReturn(List.of(user));
        ToolHandler userHandler = mock(ToolHandler.class);
        when(userFactory.create(user)).thenReturn(userHandler);

        ToolRegistry registry = createRegistry();

        ToolDescriptor registered = registry.getDescriptor("x").orElseThrow();
        assertEquals(ToolSource.USER, registered.getSource());
        assertEquals("0.9.0", registered.getVersion());
        assertSame(userHandler, registry.getTool("x").orElseThrow());
    }

    @Test
    void shouldNotLetRemoteToolReplaceExistingName() {
        ToolRegistry registry = createRegistry();

        boolean replaced = registry.register(descriptor("x", "2.0.0", ToolSource.REMOTE));

        assertFalse(replaced);
        assertEquals(ToolSource.INTERNAL, registry.getDescriptor("x").get().getSource());
    }

    @Test
    void shouldSkipToolsOutsideActiveToolSets() {
        ToolDescriptor extra = descriptor("y", "1.0.0", ToolSource.USER).toBuilder()
                .toolSets(new ArrayList<>(List.of("extras")))
                .build();
        when(scanner.scan(any())).thenReturn(List.of(extra));

        ToolRegistry registry = createRegistry();
        assertTrue(registry.getDescriptor("y").isEmpty());

        registry.discover(List.of("core", "extras"));
        assertTrue(registry.getDescriptor("y").isPresent());
    }

    @Test
    void shouldNamespaceRemoteTools() {
        when(remotePort.getServerIds()).thenReturn(List.of("github"));
        when(remotePort.listTools("github")).thenReturn(List.of(
                RemoteToolDefinition.builder().name("search").description("Search code").build()));

        ToolRegistry registry = createRegistry();

        ToolDescriptor remote = registry.getDescriptor("search_github").orElseThrow();
        assertEquals("mcp:github:search", remote.getName());
        assertEquals("search_github", remote.getExposedName());
        assertEquals("search", remote.getRemoteToolName());
        assertEquals("mcp:github:search", registry.resolveInternalName("search_github"));
        assertTrue(registry.getDescriptor("mcp:github:search").isPresent());
    }

    @Test
    void shouldSurviveRemoteServerFailure() {
        when(remotePort.getServerIds()).thenReturn(List.of("broken"));
        when(remotePort.listTools("broken")).thenThrow(new IllegalStateException("cannot start"));

        ToolRegistry registry = createRegistry();

        assertEquals(1, registry.getAllDescriptors().size());
    }

    // ==================== HANDLERS ====================

    @Test
    void shouldTreatDisabledToolAsUnknown() {
        ToolRegistry registry = createRegistry();
        registry.register(descriptor("x", "1.0.0", ToolSource.USER).toBuilder().enabled(false).build());

        assertEquals(Optional.empty(), registry.getTool("x"));
        assertTrue(registry.getExposedDescriptors().isEmpty());
        assertEquals(1, registry.getAllDescriptors().size());
    }

    @Test
    void shouldBuildHandlerOnceAndCacheIt() {
        ToolDescriptor user = descriptor("z", "1.0.0", ToolSource.USER);
        when(scanner.scan(any())).thenReturn(List.of(user));
        when(userFactory.create(user)).thenReturn(mock(ToolHandler.class));
        ToolRegistry registry = createRegistry();

        ToolHandler first = registry.getTool("z").orElseThrow();
        ToolHandler second = registry.getTool("z").orElseThrow();

        assertSame(first, second);
        verify(userFactory, times(1)).create(user);
    }

    @Test
    void shouldWrapHandlerConstructionFailure() {
        ToolDescriptor user = descriptor("z", "1.0.0", ToolSource.USER);
        when(scanner.scan(any())).thenReturn(List.of(user));
        when(userFactory.create(user)).thenThrow(new IllegalStateException("boom"));
        ToolRegistry registry = createRegistry();

        ToolHandlingException e = assertThrows(ToolHandlingException.class, () -> registry.getTool("z"));

        assertEquals(ToolHandlingException.OP_LOAD, e.getOperation());
        assertTrue(e.getMessage().contains("boom"));
    }

    @Test
    void shouldFailWhenNoFactoryForSource() {
        when(remotePort.getServerIds()).thenReturn(List.of("srv"));
        when(remotePort.listTools("srv")).thenReturn(List.of(RemoteToolDefinition.builder().name("t").build()));
        ToolRegistry registry = createRegistry();

        ToolHandlingException e = assertThrows(ToolHandlingException.class, () -> registry.getTool("t_srv"));

        assertTrue(e.getMessage().contains("No handler factory"));
    }

    @Test
    void shouldReturnEmptyForUnknownTool() {
        ToolRegistry registry = createRegistry();

        assertTrue(registry.getTool("missing").isEmpty());
        assertTrue(registry.getDescriptor("missing").isEmpty());
    }

    private static final class FakeBuiltinTool implements BuiltinTool {

        private final ToolDescriptor descriptor;

        private FakeBuiltinTool(ToolDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        @Override
        public ToolDescriptor getDescriptor() {
            return descriptor;
        }

        @Override
        public ToolRunResult run(Interaction interaction, ToolUseRequest request, EditorContext editorContext) {
            return ToolRunResult.text("ok", "ok", "ok");
        }
    }
}
