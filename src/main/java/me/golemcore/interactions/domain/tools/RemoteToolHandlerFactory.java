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
import me.golemcore.interactions.domain.model.RemoteToolCallResult;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.model.ToolRunResult;
import me.golemcore.interactions.domain.model.ToolSource;
import me.golemcore.interactions.domain.model.ToolUseRequest;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import me.golemcore.interactions.port.outbound.RemoteToolServerPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds handlers that forward calls to the remote server a tool came from,
 * using the tool's original (un-namespaced) name.
 */
@Component
@RequiredArgsConstructor
public class RemoteToolHandlerFactory implements ToolHandlerFactory {

    private final RemoteToolServerPort remoteToolServerPort;
    private final InteractionsProperties properties;

    @Override
    public ToolSource getSource() {
        return ToolSource.REMOTE;
    }

    @Override
    public ToolHandler create(ToolDescriptor descriptor) {
        if (descriptor.getRemoteServerId() == null || descriptor.getRemoteToolName() == null) {
            throw new ToolHandlingException(descriptor.getName(), ToolHandlingException.OP_LOAD,
                    "Remote tool " + descriptor.getName() + " has no server binding");
        }
        return new RemoteToolHandler(descriptor);
    }

    private final class RemoteToolHandler implements ToolHandler {

        private final ToolDescriptor descriptor;

        private RemoteToolHandler(ToolDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        @Override
        public ToolDescriptor getDescriptor() {
            return descriptor;
        }

        @Override
        public ToolRunResult run(Interaction interaction, ToolUseRequest request, EditorContext editorContext) {
            Map<String, Object> arguments = request.getToolInput() != null ? request.getToolInput() : Map.of();
            long timeoutSeconds = properties.getTools().getExecutionTimeoutSeconds();
            RemoteToolCallResult result;
            try {
                result = remoteToolServerPort
                        .callTool(descriptor.getRemoteServerId(), descriptor.getRemoteToolName(), arguments)
                        .get(timeoutSeconds, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                throw new ToolHandlingException(descriptor.getName(), ToolHandlingException.OP_EXECUTE,
                        "Remote tool timed out after " + timeoutSeconds + " seconds", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new ToolHandlingException(descriptor.getName(), ToolHandlingException.OP_EXECUTE,
                        "Remote tool failed: " + cause.getMessage(), cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ToolHandlingException(descriptor.getName(), ToolHandlingException.OP_EXECUTE,
                        "Remote tool call interrupted", e);
            }

            if (result.isError()) {
                throw new ToolHandlingException(descriptor.getName(), ToolHandlingException.OP_EXECUTE,
                        result.getText());
            }
            String text = result.getText() != null ? result.getText() : "";
            return ToolRunResult.text(text, text,
                    "Remote tool " + descriptor.getRemoteToolName() + " on " + descriptor.getRemoteServerId()
                            + " completed");
        }
    }
}
