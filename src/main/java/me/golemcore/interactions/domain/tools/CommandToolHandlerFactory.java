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
import me.golemcore.interactions.domain.component.ToolHandlerFactory;
import me.golemcore.interactions.domain.exception.ToolHandlingException;
import me.golemcore.interactions.domain.model.EditorContext;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.model.ToolRunResult;
import me.golemcore.interactions.domain.model.ToolSource;
import me.golemcore.interactions.domain.model.ToolUseRequest;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds handlers for user-supplied tools. Such a tool declares a
 * {@code command} in its info.json; the handler runs it through the shell
 * inside the tool directory, writes a JSON request to stdin and returns stdout
 * as the tool result.
 *
 * <p>
 * The request carries {@code toolName}, {@code toolUseId}, {@code input},
 * {@code interactionId}, {@code projectId} and {@code projectRoot}. A non-zero
 * exit code or a timeout fails the run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandToolHandlerFactory implements ToolHandlerFactory {

    private static final int MAX_OUTPUT_LENGTH = 100_000;
    private static final long OUTPUT_DRAIN_SECONDS = 1;

    private final ObjectMapper objectMapper;
    private final InteractionsProperties properties;

    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "user-tool-io");
        t.setDaemon(true);
        return t;
    });

    @PreDestroy
    void destroy() {
        executor.shutdownNow();
    }

    @Override
    public ToolSource getSource() {
        return ToolSource.USER;
    }

    @Override
    public ToolHandler create(ToolDescriptor descriptor) {
        if (descriptor.getCommand() == null || descriptor.getCommand().isBlank()) {
            throw new ToolHandlingException(descriptor.getName(), ToolHandlingException.OP_LOAD,
                    "User tool " + descriptor.getName() + " declares no command");
        }
        Path workDir = Paths.get(descriptor.getLocation());
        if (!Files.isDirectory(workDir)) {
            throw new ToolHandlingException(descriptor.getName(), ToolHandlingException.OP_LOAD,
                    "Tool directory not found: " + workDir);
        }
        return new CommandToolHandler(descriptor, workDir);
    }

    private final class CommandToolHandler implements ToolHandler {

        private final ToolDescriptor descriptor;
        private final Path workDir;

        private CommandToolHandler(ToolDescriptor descriptor, Path workDir) {
            this.descriptor = descriptor;
            this.workDir = workDir;
        }

        @Override
        public ToolDescriptor getDescriptor() {
            return descriptor;
        }

        @Override
        public ToolRunResult run(Interaction interaction, ToolUseRequest request, EditorContext editorContext) {
            String payload = buildPayload(interaction, request, editorContext);
            long timeoutSeconds = properties.getTools().getExecutionTimeoutSeconds();

            ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", descriptor.getCommand());
            pb.directory(workDir.toFile());
            pb.redirectErrorStream(false);

            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                throw new ToolHandlingException(descriptor.getName(), ToolHandlingException.OP_EXECUTE,
                        "Failed to run " + descriptor.getCommand() + ": " + e.getMessage(), e);
            }

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
            try {
                Future<String> stdout = executor.submit(() -> readLimited(process.getInputStream()));
                Future<String> stderr = executor.submit(() -> readLimited(process.getErrorStream()));
                executor.submit(() -> writeStdin(process, payload));

                long remaining = deadline - System.nanoTime();
                if (remaining <= 0 || !process.waitFor(remaining, TimeUnit.NANOSECONDS)) {
                    throw new ToolHandlingException(descriptor.getName(), ToolHandlingException.OP_EXECUTE,
                            "Tool timed out after " + timeoutSeconds + " seconds");
                }

                String output = stdout.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS).trim();
                int exitCode = process.exitValue();
                if (exitCode != 0) {
                    String error = stderr.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS).trim();
                    throw new ToolHandlingException(descriptor.getName(), ToolHandlingException.OP_EXECUTE,
                            "Exit code " + exitCode + (error.isEmpty() ? "" : ": " + error));
                }
                log.debug("[Tools] User tool {} finished ({} chars)", descriptor.getName(), output.length());
                return ToolRunResult.text(output.isEmpty() ? "(no output)" : output, output,
                        "Tool " + descriptor.getName() + " completed");
            } catch (ExecutionException | TimeoutException e) {
                throw new ToolHandlingException(descriptor.getName(), ToolHandlingException.OP_EXECUTE,
                        "Failed to run " + descriptor.getCommand() + ": " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ToolHandlingException(descriptor.getName(), ToolHandlingException.OP_EXECUTE,
                        "Tool execution interrupted", e);
            } finally {
                if (process.isAlive()) {
                    process.descendants().forEach(ProcessHandle::destroyForcibly);
                    process.destroyForcibly();
                }
            }
        }

        private void writeStdin(Process process, String payload) {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(payload.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                // the command may exit or be killed before consuming its input
                log.debug("[Tools] Stdin of {} closed early: {}", descriptor.getName(), e.getMessage());
            }
        }

        private String buildPayload(Interaction interaction, ToolUseRequest request, EditorContext editorContext) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("toolName", descriptor.getName());
            payload.put("toolUseId", request.getToolUseId());
            payload.put("input", request.getToolInput() != null ? request.getToolInput() : Map.of());
            payload.put("interactionId", interaction.getId());
            payload.put("projectId", interaction.getProjectId());
            payload.put("projectRoot", editorContext != null ? editorContext.getProjectRoot() : null);
            try {
                return objectMapper.writeValueAsString(payload);
            } catch (JsonProcessingException e) {
                throw new ToolHandlingException(descriptor.getName(), ToolHandlingException.OP_FORMAT,
                        "Failed to serialize tool input", e);
            }
        }
    }

    private static String readLimited(InputStream stream) throws IOException {
        byte[] bytes = stream.readAllBytes();
        String text = new String(bytes, StandardCharsets.UTF_8);
        if (text.length() > MAX_OUTPUT_LENGTH) {
            return text.substring(0, MAX_OUTPUT_LENGTH) + "\n[Output truncated...]";
        }
        return text;
    }
}
