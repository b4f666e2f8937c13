package me.golemcore.interactions.adapter.outbound.mcp;

import me.golemcore.interactions.domain.model.RemoteToolCallResult;
import me.golemcore.interactions.domain.model.RemoteToolDefinition;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class McpServerManagerTest {

    private static final String FAKE_SERVER = """
            read line
            echo '{"jsonrpc":"2.0","id":1,"result":{"protocolVersion":"2024-11-05"}}'
            read line
            read line
            echo '{"jsonrpc":"2.0","id":2,"result":{"tools":[{"name":"echo","description":"Echo back"}]}}'
            read line
            echo '{"jsonrpc":"2.0","id":3,"result":{"content":[{"type":"text","text":"pong"}]}}'
            cat > /dev/null
            """;

    @TempDir
    Path tempDir;

    private InteractionsProperties properties;
    private McpServerManager manager;

    @BeforeEach
    void setUp() {
        properties = new InteractionsProperties();
        manager = new McpServerManager(properties, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    void shouldListOnlyEnabledServersWithCommand() {
        properties.getTools().getRemoteServers().put("github", server("npx github-mcp", true));
        properties.getTools().getRemoteServers().put("off", server("npx off", false));
        properties.getTools().getRemoteServers().put("blank", server(" ", true));

        assertEquals(List.of("github"), manager.getServerIds());
    }

    @Test
    void shouldRejectUnknownServer() {
        assertThrows(IllegalStateException.class, () -> manager.listTools("missing"));

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> manager.callTool("missing", "echo", Map.of()).get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldStartServerListToolsAndCall() throws Exception {
        Path script = tempDir.resolve("server.sh");
        Files.writeString(script, FAKE_SERVER);
        InteractionsProperties.RemoteServerProperties config = server("sh " + script, true);
        config.setStartupTimeoutSeconds(10);
        properties.getTools().getRemoteServers().put("fake", config);

        List<RemoteToolDefinition> tools = manager.listTools("fake");
        RemoteToolCallResult result = manager.callTool("fake", "echo", Map.of("text", "ping"))
                .get(10, TimeUnit.SECONDS);

        assertEquals(1, tools.size());
        assertEquals("echo", tools.get(0).getName());
        assertFalse(result.isError());
        assertEquals("pong", result.getText());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldFailWhenServerExitsDuringStartup() throws IOException {
        Path script = tempDir.resolve("broken.sh");
        Files.writeString(script, "exit 1\n");
        InteractionsProperties.RemoteServerProperties config = server("sh " + script, true);
        config.setStartupTimeoutSeconds(5);
        properties.getTools().getRemoteServers().put("broken", config);

        assertThrows(IllegalStateException.class, () -> manager.listTools("broken"));
    }

    private static InteractionsProperties.RemoteServerProperties server(String command, boolean enabled) {
        InteractionsProperties.RemoteServerProperties config = new InteractionsProperties.RemoteServerProperties();
        config.setCommand(command);
        config.setEnabled(enabled);
        return config;
    }
}
