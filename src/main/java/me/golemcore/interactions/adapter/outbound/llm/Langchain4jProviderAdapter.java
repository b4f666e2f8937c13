package me.golemcore.interactions.adapter.outbound.llm;

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
import me.golemcore.interactions.domain.model.ContentPart;
import me.golemcore.interactions.domain.model.Message;
import me.golemcore.interactions.domain.model.ModelConfig;
import me.golemcore.interactions.domain.model.ProviderRequest;
import me.golemcore.interactions.domain.model.ProviderResponse;
import me.golemcore.interactions.domain.model.RateLimitInfo;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.system.ProviderErrorClassifier;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import me.golemcore.interactions.port.outbound.ProviderPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicTokenUsage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ProviderPort} backed by langchain4j chat models.
 *
 * <p>
 * Supports Anthropic and any OpenAI-compatible endpoint, selected by
 * {@code interactions.llm.provider}. Models are built once per
 * (model, temperature, max tokens) and cached. langchain4j's own retries are
 * disabled; failures are classified into {@link ProviderException} or
 * {@link ProviderRateLimitException} and the interaction service decides
 * whether to retry.
 *
 * <p>
 * Message mapping: tool results become {@link ToolExecutionResultMessage}s
 * named after the matching earlier tool use; any other parts of a user or tool
 * message (text, images) follow as a {@link UserMessage}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jProviderAdapter implements ProviderPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final String SCHEMA_KEY_DESCRIPTION = "description";
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");
    // e.g. "on tokens per min (TPM): Limit 10000, Used 9500, Requested 800"
    private static final Pattern QUOTA_PATTERN = Pattern
            .compile("on (tokens|requests) per \\w+[^:]*:\\s*Limit (\\d{1,18}), Used (\\d{1,18})");
    private static final Pattern RETRY_AFTER_PATTERN = Pattern.compile("try again in (\\d+(?:\\.\\d+)?)s");
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final InteractionsProperties properties;
    private final ObjectMapper objectMapper;

    private final Map<String, ChatModel> modelCache = new ConcurrentHashMap<>();

    @Override
    public String getProviderId() {
        return properties.getLlm().getProvider();
    }

    @Override
    public CompletableFuture<ProviderResponse> send(ProviderRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ModelConfig config = request.getModelConfig() != null
                    ? request.getModelConfig()
                    : ModelConfig.defaults(properties.getLlm().getModel());
            String model = config.getModel() != null ? config.getModel() : properties.getLlm().getModel();
            try {
                ChatModel chatModel = getModel(model, config);
                List<ChatMessage> messages = convertMessages(request);
                List<ToolSpecification> tools = convertTools(request.getTools());

                ChatRequest.Builder chatRequest = ChatRequest.builder().messages(messages);
                if (!tools.isEmpty()) {
                    log.trace("[Provider] Calling {} with {} tools", model, tools.size());
                    chatRequest.toolSpecifications(tools);
                }
                ChatResponse response = chatModel.chat(chatRequest.build());
                return convertResponse(response, model);
            } catch (ProviderException e) {
                throw e;
            } catch (RuntimeException e) {
                throw classify(e, model, request.getInteractionId());
            }
        });
    }

    // ==================== ERRORS ====================

    private ProviderException classify(RuntimeException e, String model, String interactionId) {
        String code = ProviderErrorClassifier.classifyFromThrowable(e);
        String message = ProviderErrorClassifier.withCode(code, e.getMessage());
        String provider = getProviderId();
        if (ProviderErrorClassifier.isRateLimitCode(code)) {
            RateLimitInfo rateLimit = extractRateLimit(e);
            log.warn("[Provider] Rate limit from {}{}", provider,
                    rateLimit.getResetSeconds() != null ? " (server requested " + rateLimit.getResetSeconds() + "s)"
                            : "");
            return new ProviderRateLimitException(message, provider, model, interactionId, code, rateLimit, e);
        }
        boolean retryable = ProviderErrorClassifier.isTransientCode(code);
        log.warn("[Provider] Request failed with {} (retryable: {}): {}", code, retryable, e.getMessage());
        return new ProviderException(message, provider, model, interactionId, code, retryable, e);
    }

    /**
     * Reset time and remaining quota from a rate limit error body, as far as the
     * provider reports them.
     */
    static RateLimitInfo extractRateLimit(Throwable e) {
        long resetSeconds = extractResetSeconds(e);
        RateLimitInfo rateLimit = RateLimitInfo.builder()
                .resetSeconds(resetSeconds > 0 ? resetSeconds : null)
                .build();
        for (Throwable current = e; current != null; current = current.getCause()) {
            String msg = current.getMessage();
            Matcher matcher = msg != null ? QUOTA_PATTERN.matcher(msg) : null;
            if (matcher == null || !matcher.find()) {
                continue;
            }
            long left = Math.max(0, Long.parseLong(matcher.group(2)) - Long.parseLong(matcher.group(3)));
            int remaining = (int) Math.min(Integer.MAX_VALUE, left);
            if ("tokens".equals(matcher.group(1))) {
                rateLimit.setTokensRemaining(remaining);
            } else {
                rateLimit.setRequestsRemaining(remaining);
            }
            if (rateLimit.getResetSeconds() == null) {
                Matcher retry = RETRY_AFTER_PATTERN.matcher(msg);
                if (retry.find()) {
                    rateLimit.setResetSeconds((long) Math.ceil(Double.parseDouble(retry.group(1))));
                }
            }
            break;
        }
        return rateLimit;
    }

    /**
     * Extract reset_seconds from a rate limit error body. Returns -1 if not
     * found.
     */
    static long extractResetSeconds(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null && msg.contains("reset_seconds")) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(msg);
                if (matcher.find()) {
                    try {
                        return Long.parseLong(matcher.group(1));
                    } catch (NumberFormatException ex) {
                        log.debug("[Provider] Unreadable reset_seconds: {}", matcher.group(1));
                    }
                }
            }
            current = current.getCause();
        }
        return -1;
    }

    // ==================== MODELS ====================

    ChatModel getModel(String model, ModelConfig config) {
        return modelCache.computeIfAbsent(modelKey(model, config), k -> createModel(model, config));
    }

    static String modelKey(String model, ModelConfig config) {
        return model + "|" + config.getTemperature() + "|" + config.getMaxTokens() + "|"
                + config.isPromptCaching() + "|" + (isThinkingEnabled(config) ? config.getThinkingBudget() : 0);
    }

    static boolean isThinkingEnabled(ModelConfig config) {
        return config.getThinkingBudget() != null && config.getThinkingBudget() > 0;
    }

    private ChatModel createModel(String model, ModelConfig config) {
        InteractionsProperties.LlmProperties llm = properties.getLlm();
        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            throw new ProviderException("Provider not configured: set interactions.llm.api-key", llm.getProvider(),
                    model, null, ProviderErrorClassifier.AUTHENTICATION, false, null);
        }
        Duration timeout = Duration.ofMillis(llm.getTimeoutMs());
        log.debug("[Provider] Creating {} model {}", llm.getProvider(), model);

        if (PROVIDER_ANTHROPIC.equals(llm.getProvider())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(llm.getApiKey())
                    .modelName(model)
                    .maxRetries(0) // retries are handled by InteractionService
                    .maxTokens(config.getMaxTokens())
                    .temperature(config.getTemperature())
                    .cacheSystemMessages(config.isPromptCaching())
                    .cacheTools(config.isPromptCaching())
                    .timeout(timeout);
            if (isThinkingEnabled(config)) {
                // extended thinking only accepts the default temperature
                builder.thinkingType("enabled")
                        .thinkingBudgetTokens(config.getThinkingBudget())
                        .temperature(null);
            }
            if (llm.getBaseUrl() != null) {
                builder.baseUrl(llm.getBaseUrl());
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(model)
                .maxRetries(0) // retries are handled by InteractionService
                .maxTokens(config.getMaxTokens())
                .temperature(config.getTemperature())
                .timeout(timeout);
        if (isThinkingEnabled(config)) {
            log.debug("[Provider] Thinking budget is not supported by {}, ignoring", llm.getProvider());
        }
        if (llm.getBaseUrl() != null) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    // ==================== REQUEST ====================

    List<ChatMessage> convertMessages(ProviderRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        Map<String, String> toolNamesById = new HashMap<>();
        for (Message msg : request.getMessages()) {
            if (msg.isAssistantMessage()) {
                messages.add(convertAssistantMessage(msg, toolNamesById));
                continue;
            }
            if (!msg.isUserMessage() && !msg.isToolMessage()) {
                log.warn("[Provider] Unknown message role: {}, treating as user message", msg.getRole());
            }
            List<Content> contents = new ArrayList<>();
            for (ContentPart part : msg.getContent()) {
                if (part.isToolResult()) {
                    messages.add(ToolExecutionResultMessage.from(part.getToolUseId(),
                            toolNamesById.getOrDefault(part.getToolUseId(), "unknown"),
                            flattenToolResult(part)));
                    collectImages(part.getContent(), contents);
                } else {
                    addContent(part, contents);
                }
            }
            if (!contents.isEmpty()) {
                messages.add(UserMessage.from(contents));
            }
        }
        return messages;
    }

    private AiMessage convertAssistantMessage(Message msg, Map<String, String> toolNamesById) {
        String text = msg.getText();
        List<ToolExecutionRequest> toolRequests = new ArrayList<>();
        for (ContentPart part : msg.getToolUseParts()) {
            toolNamesById.put(part.getId(), part.getName());
            toolRequests.add(ToolExecutionRequest.builder()
                    .id(part.getId())
                    .name(part.getName())
                    .arguments(convertArgsToJson(part.getInput()))
                    .build());
        }
        if (toolRequests.isEmpty()) {
            return AiMessage.from(text);
        }
        return text.isBlank() ? AiMessage.from(toolRequests) : AiMessage.from(text, toolRequests);
    }

    private static String flattenToolResult(ContentPart toolResult) {
        StringBuilder sb = new StringBuilder();
        if (toolResult.getContent() != null) {
            for (ContentPart nested : toolResult.getContent()) {
                if (nested.isText() && nested.getText() != null) {
                    if (!sb.isEmpty()) {
                        sb.append('\n');
                    }
                    sb.append(nested.getText());
                }
            }
        }
        return sb.toString();
    }

    private static void collectImages(List<ContentPart> parts, List<Content> contents) {
        if (parts == null) {
            return;
        }
        for (ContentPart part : parts) {
            if (part.isImage()) {
                addContent(part, contents);
            }
        }
    }

    private static void addContent(ContentPart part, List<Content> contents) {
        if (part.isText() && part.getText() != null) {
            contents.add(TextContent.from(part.getText()));
        } else if (part.isImage() && part.getData() != null) {
            contents.add(ImageContent.from(part.getData(), part.getMediaType()));
        }
    }

    List<ToolSpecification> convertTools(List<ToolDescriptor> tools) {
        if (tools == null || tools.isEmpty()) {
            return Collections.emptyList();
        }
        return tools.stream().map(this::convertToolDescriptor).toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDescriptor(ToolDescriptor tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getExposedName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> props) {
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<?, ?> entry : props.entrySet()) {
                schemaBuilder.addProperty(String.valueOf(entry.getKey()),
                        toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
            if (schema.get("required") instanceof List<?> required && !required.isEmpty()) {
                schemaBuilder.required(required.stream().map(String::valueOf).toList());
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.getOrDefault("type", "string");
        String description = (String) paramSchema.get(SCHEMA_KEY_DESCRIPTION);

        if (paramSchema.get("enum") instanceof List<?> enumValues && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder()
                    .enumValues(enumValues.stream().map(String::valueOf).toList())
                    .description(description)
                    .build();
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    // ==================== RESPONSE ====================

    private ProviderResponse convertResponse(ChatResponse response, String model) {
        AiMessage aiMessage = response.aiMessage();
        List<ContentPart> answer = new ArrayList<>();
        if (aiMessage.text() != null && !aiMessage.text().isBlank()) {
            answer.add(ContentPart.text(aiMessage.text()));
        }
        if (aiMessage.hasToolExecutionRequests()) {
            for (ToolExecutionRequest ter : aiMessage.toolExecutionRequests()) {
                answer.add(ContentPart.toolUse(ter.id(), ter.name(), parseJsonArgs(ter.arguments())));
            }
            log.trace("[Provider] Parsed {} tool uses from response", aiMessage.toolExecutionRequests().size());
        }

        return ProviderResponse.builder()
                .model(model)
                .answerContent(answer)
                .usage(convertUsage(response.tokenUsage()))
                .stopReason(response.finishReason() != null ? response.finishReason().name() : "STOP")
                .build();
    }

    static me.golemcore.interactions.domain.model.TokenUsage convertUsage(TokenUsage tokenUsage) {
        if (tokenUsage == null) {
            return me.golemcore.interactions.domain.model.TokenUsage.empty();
        }
        int cacheCreation = 0;
        int cacheRead = 0;
        if (tokenUsage instanceof AnthropicTokenUsage anthropicUsage) {
            cacheCreation = valueOrZero(anthropicUsage.cacheCreationInputTokens());
            cacheRead = valueOrZero(anthropicUsage.cacheReadInputTokens());
        }
        return me.golemcore.interactions.domain.model.TokenUsage.of(valueOrZero(tokenUsage.inputTokenCount()),
                valueOrZero(tokenUsage.outputTokenCount()), cacheCreation, cacheRead);
    }

    private static int valueOrZero(Integer value) {
        return value != null ? value : 0;
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[Provider] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("[Provider] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
