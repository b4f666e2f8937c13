package me.golemcore.interactions.domain.service;

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

import me.golemcore.interactions.domain.exception.ProviderException;
import me.golemcore.interactions.domain.exception.ProviderRateLimitException;
import me.golemcore.interactions.domain.exception.ResourceFailureKind;
import me.golemcore.interactions.domain.exception.ResourceHandlingException;
import me.golemcore.interactions.domain.exception.ResourceOperation;
import me.golemcore.interactions.domain.model.AttachedResource;
import me.golemcore.interactions.domain.model.CacheImpact;
import me.golemcore.interactions.domain.model.ContentPart;
import me.golemcore.interactions.domain.model.DifferentialUsage;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.InteractionStats;
import me.golemcore.interactions.domain.model.LoadedResource;
import me.golemcore.interactions.domain.model.Message;
import me.golemcore.interactions.domain.model.MessageStats;
import me.golemcore.interactions.domain.model.ProviderRequest;
import me.golemcore.interactions.domain.model.ProviderResponse;
import me.golemcore.interactions.domain.model.ProviderResponseSummary;
import me.golemcore.interactions.domain.model.ResourceMetadata;
import me.golemcore.interactions.domain.model.StatementState;
import me.golemcore.interactions.domain.model.TokenUsage;
import me.golemcore.interactions.domain.model.TokenUsageRecord;
import me.golemcore.interactions.domain.model.TokenUsageStats;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.model.ToolUsageStats;
import me.golemcore.interactions.domain.system.ProviderErrorClassifier;
import me.golemcore.interactions.domain.tools.ToolRegistry;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import me.golemcore.interactions.port.outbound.ProviderPort;
import me.golemcore.interactions.port.outbound.ResourceConnectorPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Drives one interaction through its statements: appends user statements and
 * tool results, hydrates the history, calls the provider with retry and
 * records token usage.
 *
 * <p>
 * Counter rules:
 * <ul>
 * <li>{@code statementTurnCount} is reset when a statement starts and counts
 * provider responses within it</li>
 * <li>{@code statementCount} is incremented once, when the first response of a
 * statement arrives</li>
 * <li>{@code interactionTurnCount} counts every provider response</li>
 * </ul>
 *
 * <p>
 * A failed provider call leaves the user message committed and appends no
 * assistant message, so {@link #resumeStatement} can retry without duplicating
 * input.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InteractionService {

    public static final String STATEMENT_METADATA_MARKER = "---statement-metadata---";
    public static final String TOOL_RESULT_METADATA_MARKER = "---tool-result-metadata---";

    private final ProviderPort providerPort;
    private final MessageHydrator messageHydrator;
    private final TokenUsageLedger tokenUsageLedger;
    private final ResourceRevisionStore revisionStore;
    private final ResourceConnectorPort resourceConnector;
    private final ToolRegistry toolRegistry;
    private final InteractionsProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // ==================== STATEMENTS ====================

    /**
     * Starts a new statement with a user prompt.
     *
     * @throws ProviderException
     *             once retries are exhausted or the error is not retryable
     */
    public ProviderResponse converse(Interaction interaction, String prompt, String parentMessageId,
            Map<String, Object> metadata, List<AttachedResource> attachedResources) {
        Instant now = clock.instant();
        interaction.setStatementState(StatementState.AWAITING_PROVIDER_RESPONSE);
        ToolUseContinuity.repairInterruptedToolUse(interaction, now);

        List<AttachedResource> resources = limitResources(interaction, attachedResources);
        String messageId = UUID.randomUUID().toString();

        List<ContentPart> content = new ArrayList<>();
        if (metadata != null && !metadata.isEmpty()) {
            content.add(ContentPart.text(STATEMENT_METADATA_MARKER + "\n" + toJson(metadata)));
        }
        for (AttachedResource resource : resources) {
            content.add(ContentPart.text(MessageHydrator.RESOURCE_ADDED_PREFIX + resource.getUri()));
        }
        content.add(ContentPart.text(prompt));

        interaction.getStats().setStatementTurnCount(0);
        interaction.addMessage(Message.builder()
                .id(messageId)
                .role(Message.ROLE_USER)
                .content(content)
                .timestamp(now)
                .parentMessageId(parentMessageId)
                .stats(MessageStats.of(interaction.getStats()))
                .build());
        addResourcesForMessage(interaction, resources, messageId);

        log.debug("[Interaction] {}: statement {} started ({} resources)", interaction.getId(),
                interaction.getStats().getStatementCount() + 1, resources.size());
        return sendStatement(interaction);
    }

    /**
     * Appends the caller's tool output and asks the provider to continue. Text
     * goes into the trailing tool message when there is one.
     */
    public ProviderResponse relayToolResult(Interaction interaction, String resultText,
            Map<String, Object> metadata) {
        interaction.setStatementState(StatementState.AWAITING_PROVIDER_RESPONSE);
        List<ContentPart> parts = new ArrayList<>();
        if (metadata != null && !metadata.isEmpty()) {
            parts.add(ContentPart.text(TOOL_RESULT_METADATA_MARKER + "\n" + toJson(metadata)));
        }
        if (resultText != null && !resultText.isEmpty()) {
            parts.add(ContentPart.text(resultText));
        }

        Optional<Message> last = interaction.getLastMessage();
        if (last.isPresent() && last.get().isToolMessage()) {
            last.get().getContent().addAll(parts);
        } else {
            interaction.addMessage(Message.builder()
                    .id(UUID.randomUUID().toString())
                    .role(Message.ROLE_TOOL)
                    .content(parts)
                    .timestamp(clock.instant())
                    .stats(MessageStats.of(interaction.getStats()))
                    .build());
        }
        return sendStatement(interaction);
    }

    /**
     * Re-sends the current history after a failed provider call. Nothing is
     * appended before the call.
     */
    public ProviderResponse resumeStatement(Interaction interaction) {
        Optional<Message> last = interaction.getLastMessage();
        if (last.isEmpty() || last.get().isAssistantMessage()) {
            throw new IllegalStateException("Interaction " + interaction.getId()
                    + " has no pending statement to resume");
        }
        interaction.setStatementState(StatementState.AWAITING_PROVIDER_RESPONSE);
        return sendStatement(interaction);
    }

    /**
     * Appends a tool result for one tool use. Results answering the same
     * assistant turn share a single tool message.
     */
    public Message addToolResult(Interaction interaction, String toolUseId, List<ContentPart> content,
            boolean isError) {
        ContentPart result = ContentPart.toolResult(toolUseId, content, isError);
        Optional<Message> last = interaction.getLastMessage();
        if (last.isPresent() && last.get().isToolMessage()) {
            last.get().getContent().add(result);
            return last.get();
        }
        Message message = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_TOOL)
                .content(new ArrayList<>(List.of(result)))
                .timestamp(clock.instant())
                .stats(MessageStats.of(interaction.getStats()))
                .build();
        interaction.addMessage(message);
        return message;
    }

    /**
     * Hydrated view of the stored history; the stored messages are not touched.
     */
    public List<Message> prepareMessages(Interaction interaction) {
        return messageHydrator.prepareMessages(interaction);
    }

    // ==================== PROVIDER ====================

    private ProviderResponse sendStatement(Interaction interaction) {
        boolean firstTurn = interaction.getStats().getStatementTurnCount() == 0;
        ProviderRequest request = buildRequest(interaction);
        ProviderResponse response = sendWithRetry(interaction, request);

        if (firstTurn) {
            interaction.getStats().setStatementCount(interaction.getStats().getStatementCount() + 1);
        }
        updateTotals(interaction, response);

        Instant now = clock.instant();
        Message assistant = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(new ArrayList<>(response.getAnswerContent()))
                .timestamp(now)
                .stats(MessageStats.of(interaction.getStats()))
                .providerResponse(ProviderResponseSummary.builder()
                        .model(response.getModel())
                        .stopReason(response.getStopReason())
                        .usage(response.getUsage())
                        .build())
                .build();
        interaction.addMessage(assistant);
        response.setMessageId(assistant.getId());
        interaction.setStatementState(
                response.isToolUse() ? StatementState.TOOL_USE_REQUESTED : StatementState.RESOLVED);
        interaction.setUpdatedAt(now);
        return response;
    }

    private ProviderRequest buildRequest(Interaction interaction) {
        List<ToolDescriptor> tools = toolRegistry.getExposedDescriptors();
        interaction.setPreparedTools(new ArrayList<>(tools));
        return ProviderRequest.builder()
                .interactionId(interaction.getId())
                .systemPrompt(interaction.getPreparedSystemPrompt())
                .messages(messageHydrator.prepareMessages(interaction))
                .tools(tools)
                .modelConfig(interaction.getModelConfig())
                .build();
    }

    private ProviderResponse sendWithRetry(Interaction interaction, ProviderRequest request) {
        InteractionsProperties.ProviderProperties retry = properties.getProvider();
        int attempt = 0;
        while (true) {
            interaction.setTotalProviderRequests(interaction.getTotalProviderRequests() + 1);
            try {
                return providerPort.send(request).join();
            } catch (RuntimeException e) {
                ProviderException error = toProviderException(interaction, e);
                if (!error.isRetryable() || attempt >= retry.getMaxRetries()) {
                    log.error("[Interaction] {}: provider request failed after {} attempt(s) [{}]: {}",
                            interaction.getId(), attempt + 1, error.getCode(), error.getMessage());
                    throw error;
                }
                long backoffMs = backoffMs(error, attempt);
                log.warn("[Interaction] {}: provider error [{}], retry {}/{} after {}ms: {}", interaction.getId(),
                        error.getCode(), attempt + 1, retry.getMaxRetries(), backoffMs, error.getMessage());
                sleep(backoffMs, error);
                attempt++;
            }
        }
    }

    long backoffMs(ProviderException error, int attempt) {
        InteractionsProperties.ProviderProperties retry = properties.getProvider();
        long exponential = (long) (retry.getInitialBackoffMs() * Math.pow(retry.getBackoffMultiplier(), attempt));
        exponential = Math.min(exponential, retry.getMaxBackoffMs());
        if (error instanceof ProviderRateLimitException rateLimit && rateLimit.getResetSeconds() > 0) {
            return Math.max(rateLimit.getResetSeconds() * 1000 + 1000, exponential);
        }
        return exponential;
    }

    private ProviderException toProviderException(Interaction interaction, RuntimeException e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof ProviderException providerException) {
            return providerException;
        }
        String model = interaction.getModelConfig() != null ? interaction.getModelConfig().getModel() : null;
        return new ProviderException("Provider request failed: " + cause.getMessage(), providerPort.getProviderId(),
                model, interaction.getId(), ProviderErrorClassifier.UNKNOWN, false, cause);
    }

    private static void sleep(long backoffMs, ProviderException error) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Provider retry interrupted", error.getProvider(), error.getModel(),
                    error.getInteractionId(), ProviderErrorClassifier.REQUEST_ABORTED, false, error);
        }
    }

    // ==================== TOKEN ACCOUNTING ====================

    /**
     * Records a response's usage in the ledger and the running totals, then
     * advances the turn counters. The ledger record is attributed to the
     * message that prompted the response.
     */
    void updateTotals(Interaction interaction, ProviderResponse response) {
        TokenUsage usage = response.getUsage() != null ? response.getUsage() : TokenUsage.empty();
        if (usage.getTotalAllTokens() == 0) {
            usage.setTotalAllTokens(usage.computeTotalAllTokens());
        }
        InteractionStats stats = interaction.getStats();
        Optional<Message> prompting = interaction.getLastMessage();

        if (usage.hasAnyTokens() && prompting.isPresent()) {
            String role = prompting.get().getRole();
            TokenUsageRecord usageRecord = TokenUsageRecord.builder()
                    .messageId(prompting.get().getId())
                    .statementCount(stats.getStatementCount())
                    .statementTurnCount(stats.getStatementTurnCount())
                    .timestamp(clock.instant())
                    .model(response.getModel() != null ? response.getModel()
                            : interaction.getModelConfig().getModel())
                    .role(role)
                    .type(interaction.getType())
                    .rawUsage(usage.toBuilder().build())
                    .differentialUsage(differentialUsage(interaction, role, usage))
                    .cacheImpact(CacheImpact.of(usage))
                    .build();
            tokenUsageLedger.writeUsage(interaction.getProjectId(), interaction.getId(), usageRecord,
                    interaction.getType());
        }

        TokenUsageStats totals = interaction.getTokenUsageStats();
        if (stats.getInteractionTurnCount() == 0) {
            totals.setTokenUsageInteraction(TokenUsage.empty());
        }
        if (stats.getStatementTurnCount() == 0) {
            totals.setTokenUsageStatement(TokenUsage.empty());
        }
        totals.setTokenUsageTurn(usage.toBuilder().build());
        totals.setTokenUsageStatement(totals.getTokenUsageStatement().plus(usage));
        totals.setTokenUsageInteraction(totals.getTokenUsageInteraction().plus(usage));

        stats.setStatementTurnCount(stats.getStatementTurnCount() + 1);
        stats.setInteractionTurnCount(stats.getInteractionTurnCount() + 1);
    }

    private static DifferentialUsage differentialUsage(Interaction interaction, String role, TokenUsage usage) {
        if (Message.ROLE_ASSISTANT.equals(role)) {
            return new DifferentialUsage(0, usage.getOutputTokens(), usage.getOutputTokens());
        }
        int previousInput = interaction.getPreviousAssistantMessage()
                .map(Message::getProviderResponse)
                .map(ProviderResponseSummary::getUsage)
                .map(TokenUsage::getInputTokens)
                .orElse(0);
        int inputDiff = Math.max(0, usage.getInputTokens() - previousInput);
        return new DifferentialUsage(inputDiff, 0, inputDiff);
    }

    // ==================== RESOURCES ====================

    /**
     * Registers resources attached to a message. The message id becomes the
     * revision id; content that was not supplied is loaded through the resource
     * connector. A load failure is recorded on the metadata and does not fail
     * the statement.
     */
    public void addResourcesForMessage(Interaction interaction, List<AttachedResource> resources, String messageId) {
        for (AttachedResource resource : resources) {
            ResourceMetadata metadata = registerRevision(interaction, resource, messageId);
            metadata.setMessageId(messageId);
            metadata.setInSystemPrompt(false);
            interaction.getResourceMetadata().put(
                    ResourceRevisionStore.revisionKey(metadata.getUri(), metadata.getRevision()), metadata);
            interaction.updateResourceAccess(metadata.getUri(), false);
        }
    }

    /**
     * Registers a resource loaded once into the system prompt. Such resources
     * are never hydrated into messages.
     */
    public ResourceMetadata addResourceForSystemPrompt(Interaction interaction, AttachedResource resource) {
        String revision = UUID.randomUUID().toString();
        ResourceMetadata metadata = registerRevision(interaction, resource, revision);
        metadata.setInSystemPrompt(true);
        interaction.getResourceMetadata().put(
                ResourceRevisionStore.revisionKey(metadata.getUri(), metadata.getRevision()), metadata);
        interaction.updateResourceAccess(metadata.getUri(), false);
        return metadata;
    }

    /**
     * Forgets one revision of a resource. The owning message goes with it
     * unless the resource belongs to the system prompt.
     *
     * @return true if the revision was known
     */
    public boolean removeResource(Interaction interaction, String uri, String revision) {
        ResourceMetadata metadata = interaction.getResourceMetadata()
                .remove(ResourceRevisionStore.revisionKey(uri, revision));
        if (metadata == null) {
            return false;
        }
        if (!metadata.isInSystemPrompt() && metadata.getMessageId() != null) {
            Iterator<Message> it = interaction.getMessages().iterator();
            while (it.hasNext()) {
                if (metadata.getMessageId().equals(it.next().getId())) {
                    it.remove();
                    log.debug("[Interaction] {}: removed message {} with resource {}", interaction.getId(),
                            metadata.getMessageId(), uri);
                }
            }
        }
        interaction.getResourceAccess().getActive().remove(uri);
        return true;
    }

    private ResourceMetadata registerRevision(Interaction interaction, AttachedResource resource, String revision) {
        ResourceMetadata metadata = resource.getMetadata() != null
                ? resource.getMetadata().toBuilder().build()
                : ResourceMetadata.builder().uri(resource.getUri()).build();
        metadata.setUri(resource.getUri());
        metadata.setRevision(revision);

        try {
            byte[] content = resource.getContent();
            if (content == null) {
                LoadedResource loaded = resourceConnector.loadResource(resource.getUri());
                content = loaded != null ? loaded.getContent() : null;
                if (content == null) {
                    throw new ResourceHandlingException(resource.getUri(), ResourceOperation.READ,
                            ResourceFailureKind.NOT_FOUND, "Resource has no content: " + resource.getUri());
                }
                if (loaded.getMetadata() != null) {
                    mergeLoadedMetadata(metadata, loaded.getMetadata());
                }
            }
            if (metadata.getSize() == 0) {
                metadata.setSize(content.length);
            }
            if (metadata.getContentType() == null) {
                metadata.setContentType(ResourceMetadata.CONTENT_TEXT);
            }
            revisionStore.storeRevision(interaction.getProjectId(), interaction.getId(), resource.getUri(), revision,
                    content);
        } catch (ResourceHandlingException e) {
            log.warn("[Interaction] {}: could not load resource {}: {}", interaction.getId(), resource.getUri(),
                    e.getMessage());
            metadata.setError(e.getMessage());
        }
        return metadata;
    }

    private static void mergeLoadedMetadata(ResourceMetadata target, ResourceMetadata loaded) {
        if (target.getContentType() == null) {
            target.setContentType(loaded.getContentType());
        }
        if (target.getMimeType() == null) {
            target.setMimeType(loaded.getMimeType());
        }
        if (target.getSize() == 0) {
            target.setSize(loaded.getSize());
        }
        if (target.getLastModified() == null) {
            target.setLastModified(loaded.getLastModified());
        }
        if (loaded.getType() != null) {
            target.setType(loaded.getType());
        }
    }

    private List<AttachedResource> limitResources(Interaction interaction, List<AttachedResource> resources) {
        if (resources == null || resources.isEmpty()) {
            return List.of();
        }
        int max = properties.getConversation().getMaxAttachedResources();
        if (resources.size() > max) {
            log.warn("[Interaction] {}: {} resources attached, only the first {} are used", interaction.getId(),
                    resources.size(), max);
            return List.copyOf(resources.subList(0, max));
        }
        return List.copyOf(resources);
    }

    // ==================== TOOL STATS ====================

    public void updateToolStats(Interaction interaction, String toolName, boolean success) {
        ToolUsageStats stats = interaction.getToolStats().computeIfAbsent(toolName, k -> new ToolUsageStats());
        stats.setCount(stats.getCount() + 1);
        if (success) {
            stats.setSuccess(stats.getSuccess() + 1);
        } else {
            stats.setFailure(stats.getFailure() + 1);
        }
        stats.setLastSuccess(success);
        stats.setLastUse(clock.instant());
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable: " + e.getMessage(), e);
        }
    }
}
