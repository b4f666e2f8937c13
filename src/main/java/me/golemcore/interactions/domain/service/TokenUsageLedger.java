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

import me.golemcore.interactions.domain.exception.PersistenceException;
import me.golemcore.interactions.domain.exception.TokenUsageValidationException;
import me.golemcore.interactions.domain.model.CacheImpact;
import me.golemcore.interactions.domain.model.DifferentialUsage;
import me.golemcore.interactions.domain.model.InteractionType;
import me.golemcore.interactions.domain.model.TokenUsage;
import me.golemcore.interactions.domain.model.TokenUsageAnalysis;
import me.golemcore.interactions.domain.model.TokenUsageAnalysis.CacheImpactSummary;
import me.golemcore.interactions.domain.model.TokenUsageAnalysis.RoleUsage;
import me.golemcore.interactions.domain.model.TokenUsageRecord;
import me.golemcore.interactions.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Append-only per-interaction token usage ledger.
 *
 * <p>
 * Records are validated before they are appended, one JSON object per line, to
 * {@code tokenUsage/conversation.jsonl} or {@code tokenUsage/chats.jsonl}
 * depending on the interaction type. Reading is tolerant: a legacy JSON array
 * or a single object is accepted and malformed lines are skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenUsageLedger {

    private static final String LOG_PREFIX = "[Usage]";
    private static final String NEWLINE = "\n";
    private static final Set<String> VALID_ROLES = Set.of("user", "assistant", "tool", "system");
    private static final TypeReference<List<TokenUsageRecord>> RECORD_LIST_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    /**
     * Validates and appends a record. {@code totalAllTokens} is derived when the
     * provider did not report it.
     *
     * @throws TokenUsageValidationException
     *             if the record is incomplete or inconsistent
     */
    public void writeUsage(String projectId, String interactionId, TokenUsageRecord usageRecord,
            InteractionType type) {
        validate(usageRecord, type);

        TokenUsage raw = usageRecord.getRawUsage();
        if (raw.getTotalAllTokens() == 0) {
            raw.setTotalAllTokens(raw.computeTotalAllTokens());
        }
        CacheImpact impact = usageRecord.getCacheImpact();
        int billedCache = raw.getCacheCreationInputTokens() + raw.getCacheReadInputTokens();
        if (impact.getActualCost() != billedCache) {
            log.warn("{} Cache impact for message {} does not match raw cache tokens ({} vs {})",
                    LOG_PREFIX, usageRecord.getMessageId(), impact.getActualCost(), billedCache);
        }

        String dir = StorageLayout.interactionDir(projectId, interactionId);
        String path = StorageLayout.tokenUsagePath(type.getLedgerFile());
        try {
            String line = objectMapper.writeValueAsString(usageRecord);
            storagePort.appendText(dir, path, line + NEWLINE).join();
            log.debug("{} Recorded {} tokens for message {} ({})", LOG_PREFIX, raw.getTotalAllTokens(),
                    usageRecord.getMessageId(), usageRecord.getRole());
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize token usage record", dir + "/" + path,
                    PersistenceException.Operation.APPEND, e);
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to append token usage record", dir + "/" + path,
                    PersistenceException.Operation.APPEND, e.getCause());
        }
    }

    /**
     * All records of one ledger partition in append order; empty when the
     * ledger file does not exist yet.
     */
    public List<TokenUsageRecord> getUsage(String projectId, String interactionId, InteractionType type) {
        String dir = StorageLayout.interactionDir(projectId, interactionId);
        String path = StorageLayout.tokenUsagePath(type.getLedgerFile());
        String content;
        try {
            content = storagePort.getText(dir, path).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to read token usage ledger", dir + "/" + path,
                    PersistenceException.Operation.READ, e.getCause());
        }
        if (content == null) {
            return List.of();
        }
        return parseLedgerContent(path, content);
    }

    public TokenUsageAnalysis analyzeUsage(String projectId, String interactionId, InteractionType type) {
        return analyze(getUsage(projectId, interactionId, type));
    }

    /**
     * Conversation and chat partitions of one interaction, combined.
     */
    public TokenUsageAnalysis analyzeAll(String projectId, String interactionId) {
        return combine(analyzeUsage(projectId, interactionId, InteractionType.CONVERSATION),
                analyzeUsage(projectId, interactionId, InteractionType.CHAT));
    }

    public void validate(TokenUsageRecord usageRecord, InteractionType type) {
        if (usageRecord == null) {
            throw invalid("record", "required", "Token usage record is required");
        }
        if (usageRecord.getMessageId() == null || usageRecord.getMessageId().isBlank()) {
            throw invalid("messageId", "required", "messageId is required");
        }
        if (usageRecord.getTimestamp() == null) {
            throw invalid("timestamp", "required", "timestamp is required");
        }
        if (usageRecord.getRole() == null || !VALID_ROLES.contains(usageRecord.getRole())) {
            throw invalid("role", "enum", "role must be one of " + VALID_ROLES + ", got " + usageRecord.getRole());
        }
        if (usageRecord.getType() == null) {
            throw invalid("type", "required", "type is required");
        }
        if (type != null && usageRecord.getType() != type) {
            throw invalid("type", "match", "record type " + usageRecord.getType().getValue()
                    + " does not match ledger type " + type.getValue());
        }
        TokenUsage raw = usageRecord.getRawUsage();
        if (raw == null) {
            throw invalid("rawUsage", "required", "rawUsage is required");
        }
        if (usageRecord.getDifferentialUsage() == null) {
            throw invalid("differentialUsage", "required", "differentialUsage is required");
        }
        if (usageRecord.getCacheImpact() == null) {
            throw invalid("cacheImpact", "required", "cacheImpact is required");
        }
        requireNonNegative("rawUsage.inputTokens", raw.getInputTokens());
        requireNonNegative("rawUsage.outputTokens", raw.getOutputTokens());
        requireNonNegative("rawUsage.totalTokens", raw.getTotalTokens());
        requireNonNegative("rawUsage.cacheCreationInputTokens", raw.getCacheCreationInputTokens());
        requireNonNegative("rawUsage.cacheReadInputTokens", raw.getCacheReadInputTokens());
        requireNonNegative("rawUsage.thoughtTokens", raw.getThoughtTokens());
        requireNonNegative("rawUsage.totalAllTokens", raw.getTotalAllTokens());
        DifferentialUsage diff = usageRecord.getDifferentialUsage();
        requireNonNegative("differentialUsage.inputTokens", diff.getInputTokens());
        requireNonNegative("differentialUsage.outputTokens", diff.getOutputTokens());
        requireNonNegative("differentialUsage.totalTokens", diff.getTotalTokens());
    }

    // ==================== ANALYSIS ====================

    /**
     * Single pass over the records: raw and differential totals, cache
     * economics and a per-role breakdown.
     */
    public static TokenUsageAnalysis analyze(List<TokenUsageRecord> records) {
        TokenUsage total = TokenUsage.empty();
        DifferentialUsage differential = new DifferentialUsage();
        long potential = 0;
        long actual = 0;
        long savings = 0;
        Map<String, RoleUsage> byRole = new LinkedHashMap<>();

        for (TokenUsageRecord usageRecord : records) {
            TokenUsage raw = usageRecord.getRawUsage() != null ? usageRecord.getRawUsage() : TokenUsage.empty();
            int totalAll = raw.getTotalAllTokens() > 0 ? raw.getTotalAllTokens() : raw.computeTotalAllTokens();
            total = total.plus(raw.toBuilder().totalAllTokens(totalAll).build());

            DifferentialUsage diff = usageRecord.getDifferentialUsage();
            if (diff != null) {
                differential.setInputTokens(differential.getInputTokens() + diff.getInputTokens());
                differential.setOutputTokens(differential.getOutputTokens() + diff.getOutputTokens());
                differential.setTotalTokens(differential.getTotalTokens() + diff.getTotalTokens());
            }

            CacheImpact impact = usageRecord.getCacheImpact();
            if (impact != null) {
                potential += impact.getPotentialCost();
                actual += impact.getActualCost();
                savings += impact.getSavings();
            }

            String role = usageRecord.getRole() != null ? usageRecord.getRole() : "unknown";
            RoleUsage roleUsage = byRole.computeIfAbsent(role, k -> new RoleUsage());
            roleUsage.setInputTokens(roleUsage.getInputTokens() + raw.getInputTokens());
            roleUsage.setOutputTokens(roleUsage.getOutputTokens() + raw.getOutputTokens());
            roleUsage.setTotalTokens(roleUsage.getTotalTokens() + raw.getTotalTokens());
            roleUsage.setCacheCreationInputTokens(
                    roleUsage.getCacheCreationInputTokens() + raw.getCacheCreationInputTokens());
            roleUsage.setCacheReadInputTokens(roleUsage.getCacheReadInputTokens() + raw.getCacheReadInputTokens());
            roleUsage.setThoughtTokens(roleUsage.getThoughtTokens() + raw.getThoughtTokens());
            roleUsage.setTotalAllTokens(roleUsage.getTotalAllTokens() + totalAll);
            roleUsage.setRecords(roleUsage.getRecords() + 1);
        }

        double percentage = potential > 0 ? (double) savings / potential * 100.0 : 0.0;
        return TokenUsageAnalysis.builder()
                .totalUsage(total)
                .differentialUsage(differential)
                .cacheImpact(new CacheImpactSummary(potential, actual, savings, percentage))
                .byRole(byRole)
                .build();
    }

    /**
     * Field-wise sum of two analyses. The savings percentage is the mean of
     * both.
     */
    public static TokenUsageAnalysis combine(TokenUsageAnalysis first, TokenUsageAnalysis second) {
        DifferentialUsage d1 = first.getDifferentialUsage();
        DifferentialUsage d2 = second.getDifferentialUsage();
        CacheImpactSummary c1 = first.getCacheImpact();
        CacheImpactSummary c2 = second.getCacheImpact();

        Map<String, RoleUsage> byRole = new LinkedHashMap<>();
        first.getByRole().forEach((role, usage) -> byRole.put(role, copy(usage)));
        second.getByRole().forEach((role, usage) -> byRole.merge(role, copy(usage), TokenUsageLedger::sum));

        return TokenUsageAnalysis.builder()
                .totalUsage(first.getTotalUsage().plus(second.getTotalUsage()))
                .differentialUsage(new DifferentialUsage(
                        d1.getInputTokens() + d2.getInputTokens(),
                        d1.getOutputTokens() + d2.getOutputTokens(),
                        d1.getTotalTokens() + d2.getTotalTokens()))
                .cacheImpact(new CacheImpactSummary(
                        c1.getPotentialCost() + c2.getPotentialCost(),
                        c1.getActualCost() + c2.getActualCost(),
                        c1.getTotalSavings() + c2.getTotalSavings(),
                        (c1.getSavingsPercentage() + c2.getSavingsPercentage()) / 2))
                .byRole(byRole)
                .build();
    }

    private static RoleUsage copy(RoleUsage usage) {
        return RoleUsage.builder()
                .inputTokens(usage.getInputTokens())
                .outputTokens(usage.getOutputTokens())
                .totalTokens(usage.getTotalTokens())
                .cacheCreationInputTokens(usage.getCacheCreationInputTokens())
                .cacheReadInputTokens(usage.getCacheReadInputTokens())
                .thoughtTokens(usage.getThoughtTokens())
                .totalAllTokens(usage.getTotalAllTokens())
                .records(usage.getRecords())
                .build();
    }

    private static RoleUsage sum(RoleUsage a, RoleUsage b) {
        return RoleUsage.builder()
                .inputTokens(a.getInputTokens() + b.getInputTokens())
                .outputTokens(a.getOutputTokens() + b.getOutputTokens())
                .totalTokens(a.getTotalTokens() + b.getTotalTokens())
                .cacheCreationInputTokens(a.getCacheCreationInputTokens() + b.getCacheCreationInputTokens())
                .cacheReadInputTokens(a.getCacheReadInputTokens() + b.getCacheReadInputTokens())
                .thoughtTokens(a.getThoughtTokens() + b.getThoughtTokens())
                .totalAllTokens(a.getTotalAllTokens() + b.getTotalAllTokens())
                .records(a.getRecords() + b.getRecords())
                .build();
    }

    // ==================== PARSING ====================

    private List<TokenUsageRecord> parseLedgerContent(String file, String content) {
        String trimmed = content.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }

        if (trimmed.startsWith("[")) {
            try {
                return objectMapper.readValue(trimmed, RECORD_LIST_TYPE);
            } catch (JsonProcessingException e) {
                log.debug("{} Failed to parse JSON array in {}: {}", LOG_PREFIX, file, e.getMessage());
            }
        }

        if (trimmed.startsWith("{") && trimmed.endsWith("}") && !trimmed.contains(NEWLINE)) {
            try {
                ObjectMapper strictMapper = objectMapper.copy()
                        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
                return List.of(strictMapper.readValue(trimmed, TokenUsageRecord.class));
            } catch (JsonProcessingException e) { // NOSONAR - not a single JSON object, fall through to JSONL
                log.trace("{} {} is not a single JSON object", LOG_PREFIX, file);
            }
        }

        List<TokenUsageRecord> records = new ArrayList<>();
        for (String line : content.split(NEWLINE)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(objectMapper.readValue(line, TokenUsageRecord.class));
            } catch (JsonProcessingException e) {
                log.warn("{} Skipping malformed line in {}: {}", LOG_PREFIX, file, e.getMessage());
            }
        }
        return records;
    }

    private static void requireNonNegative(String field, int value) {
        if (value < 0) {
            throw invalid(field, "non-negative", field + " must be non-negative, got " + value);
        }
    }

    private static TokenUsageValidationException invalid(String field, String constraint, String message) {
        return new TokenUsageValidationException(field, constraint, message);
    }
}
