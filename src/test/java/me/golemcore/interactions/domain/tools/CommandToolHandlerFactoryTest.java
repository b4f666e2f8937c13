package me.golemcore.interactions.domain.tools;

import me.golemcore.interactions.domain.component.ToolHandler;
import me.golemcore.interactions.domain.exception.ToolHandlingException;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.model.ToolRunResult;
import me.golemcore.interactions.domain.model.ToolSource;
import me.golemcore.interactions.domain.model.ToolUseRequest;
import me.golemcore.interactions.infrastructure.config.AutoConfiguration;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class CommandToolHandlerFactoryTest {

    @TempDir
    Path tempDir;

    private InteractionsProperties properties;
    private CommandToolHandlerFactory factory;
    private Interaction interaction;

    @BeforeEach
    void setUp() {
        properties = new InteractionsProperties();
        properties.getTools().setExecutionTimeoutSeconds(10);
        factory = new CommandToolHandlerFactory(AutoConfiguration.objectMapper(), properties);
        interaction = Interaction.builder().id("i1").projectId("p1").build();
    }

    @AfterEach
    void tearDown() {
        factory.destroy();
    }

    private ToolDescriptor descriptor(String command) {
        return ToolDescriptor.builder()
                .name("echo_tool")
                .source(ToolSource.USER)
                .command(command)
                .location(tempDir.toString())
                .build();
    }

    private static ToolUseRequest request() {
        return ToolUseRequest.builder().toolUseId("tu1").toolName("echo_tool").toolInput(Map.of("x", 1)).build();
    }

    @Test
    void shouldPassJsonRequestOnStdinAndReturnStdout() {
        ToolHandler handler = factory.create(descriptor("cat"));

        ToolRunResult result = handler.run(interaction, request(), null);

        String output = result.getToolResults().get(0).getText();
        assertTrue(output.contains("\"toolName\":\"echo_tool\""));
        assertTrue(output.contains("\"toolUseId\":\"tu1\""));
        assertTrue(output.contains("\"input\":{\"x\":1}"));
        assertTrue(output.contains("\"interactionId\":\"i1\""));
        assertEquals(output, result.getToolResponse());
        assertEquals("Tool echo_tool completed", result.getBbResponse());
    }

    @Test
    void shouldReportPlaceholderForEmptyOutput() {
        ToolRunResult result = factory.create(descriptor("cat > /dev/null")).run(interaction, request(), null);

        assertEquals("(no output)", result.getToolResults().get(0).getText());
    }

    @Test
    void shouldFailOnNonZeroExitWithStderr() {
        ToolHandler handler = factory.create(descriptor("cat > /dev/null; echo bad input >&2; exit 3"));

        ToolHandlingException e = assertThrows(ToolHandlingException.class,
                () -> handler.run(interaction, request(), null));

        assertEquals(ToolHandlingException.OP_EXECUTE, e.getOperation());
        assertEquals("Exit code 3: bad input", e.getMessage());
    }

    @Test
    void shouldFailOnTimeout() {
        properties.getTools().setExecutionTimeoutSeconds(1);
        ToolHandler handler = factory.create(descriptor("cat > /dev/null; sleep 5"));

        ToolHandlingException e = assertThrows(ToolHandlingException.class,
                () -> handler.run(interaction, request(), null));

        assertEquals("Tool timed out after 1 seconds", e.getMessage());
    }

    @Test
    void shouldEnforceTimeoutWhenCommandNeverReadsLargeInput() {
        properties.getTools().setExecutionTimeoutSeconds(1);
        ToolHandler handler = factory.create(descriptor("sleep 6"));
        ToolUseRequest request = ToolUseRequest.builder()
                .toolUseId("tu1")
                .toolName("echo_tool")
                .toolInput(Map.of("blob", "x".repeat(300_000)))
                .build();

        long started = System.nanoTime();
        ToolHandlingException e = assertThrows(ToolHandlingException.class,
                () -> handler.run(interaction, request, null));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals("Tool timed out after 1 seconds", e.getMessage());
        assertTrue(elapsedMillis < 3000, "run took " + elapsedMillis + " ms");
    }

    @Test
    void shouldKillProcessAfterTimeout() throws Exception {
        properties.getTools().setExecutionTimeoutSeconds(1);
        ToolHandler handler = factory.create(descriptor("echo $$ > pid.txt; cat > /dev/null; sleep 6"));

        assertThrows(ToolHandlingException.class, () -> handler.run(interaction, request(), null));

        long pid = Long.parseLong(Files.readString(tempDir.resolve("pid.txt")).trim());
        Optional<ProcessHandle> shell = ProcessHandle.of(pid);
        if (shell.isPresent()) {
            shell.get().onExit().get(2, TimeUnit.SECONDS);
            assertFalse(shell.get().isAlive());
        }
    }

    @Test
    void shouldRejectDescriptorWithoutCommand() {
        ToolHandlingException e = assertThrows(ToolHandlingException.class,
                () -> factory.create(descriptor(" ")));

        assertEquals(ToolHandlingException.OP_LOAD, e.getOperation());
    }

    @Test
    void shouldRejectMissingToolDirectory() {
        ToolDescriptor descriptor = descriptor("cat").toBuilder()
                .location(tempDir.resolve("missing").toString())
                .build();

        assertThrows(ToolHandlingException.class, () -> factory.create(descriptor));
    }
}
