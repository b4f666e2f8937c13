package me.golemcore.interactions.domain.service;

import me.golemcore.interactions.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.interactions.domain.exception.TokenUsageValidationException;
import me.golemcore.interactions.domain.model.CacheImpact;
import me.golemcore.interactions.domain.model.DifferentialUsage;
import me.golemcore.interactions.domain.model.InteractionType;
import me.golemcore.interactions.domain.model.TokenUsage;
import me.golemcore.interactions.domain.model.TokenUsageAnalysis;
import me.golemcore.interactions.domain.model.TokenUsageRecord;
import me.golemcore.interactions.infrastructure.config.AutoConfiguration;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import me.golemcore.interactions.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenUsageLedgerTest {

    private static final String PROJECT = "p1";
    private static final String INTERACTION = "i1";
    private static final String DIR = "projects/p1/interactions/i1";

    @TempDir
    Path tempDir;

    private StoragePort storagePort;
    private TokenUsageLedger ledger;

    @BeforeEach
    void setUp() {
        InteractionsProperties properties = new InteractionsProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter adapter = new LocalStorageAdapter(properties);
        adapter.init();
        storagePort = adapter;
        ledger = new TokenUsageLedger(storagePort, AutoConfiguration.objectMapper());
    }

    private static TokenUsageRecord usageRecord(String messageId, String role, InteractionType type,
            TokenUsage usage) {
        return TokenUsageRecord.builder()
                .messageId(messageId)
                .role(role)
                .type(type)
                .timestamp(Instant.parse("2026-01-01T00:00:00Z"))
                .model("test-model")
                .rawUsage(usage)
                .differentialUsage(new DifferentialUsage(usage.getInputTokens(), usage.getOutputTokens(),
                        usage.getTotalTokens()))
                .cacheImpact(CacheImpact.of(usage))
                .build();
    }

    // ==================== WRITE ====================

    @Test
    void shouldAppendRecordAndDeriveTotalAllTokens() {
        TokenUsage usage = TokenUsage.builder()
                .inputTokens(200).outputTokens(100).totalTokens(300)
                .cacheCreationInputTokens(50).cacheReadInputTokens(25)
                .build();

        ledger.writeUsage(PROJECT, INTERACTION, usageRecord("m1", "assistant", InteractionType.CONVERSATION, usage),
                InteractionType.CONVERSATION);

        List<TokenUsageRecord> records = ledger.getUsage(PROJECT, INTERACTION, InteractionType.CONVERSATION);
        assertEquals(1, records.size());
        assertEquals(375, records.get(0).getRawUsage().getTotalAllTokens());
        assertEquals("m1", records.get(0).getMessageId());
    }

    @Test
    void shouldKeepConversationAndChatPartitionsSeparate() {
        ledger.writeUsage(PROJECT, INTERACTION,
                usageRecord("m1", "assistant", InteractionType.CONVERSATION, TokenUsage.of(10, 5, 0, 0)),
                InteractionType.CONVERSATION);
        ledger.writeUsage(PROJECT, INTERACTION,
                usageRecord("m2", "assistant", InteractionType.CHAT, TokenUsage.of(20, 10, 0, 0)),
                InteractionType.CHAT);

        assertEquals(1, ledger.getUsage(PROJECT, INTERACTION, InteractionType.CONVERSATION).size());
        assertEquals(1, ledger.getUsage(PROJECT, INTERACTION, InteractionType.CHAT).size());
        assertEquals(45, ledger.analyzeAll(PROJECT, INTERACTION).getTotalUsage().getTotalAllTokens());
    }

    @Test
    void shouldReturnEmptyListWhenLedgerMissing() {
        assertTrue(ledger.getUsage(PROJECT, INTERACTION, InteractionType.CONVERSATION).isEmpty());
    }

    // ==================== VALIDATION ====================

    @Test
    void shouldRejectMissingMessageId() {
        TokenUsageRecord usageRecord = usageRecord(null, "assistant", InteractionType.CONVERSATION,
                TokenUsage.of(1, 1, 0, 0));

        TokenUsageValidationException ex = assertThrows(TokenUsageValidationException.class,
                () -> ledger.writeUsage(PROJECT, INTERACTION, usageRecord, InteractionType.CONVERSATION));
        assertEquals("messageId", ex.getField());
        assertEquals("required", ex.getConstraint());
    }

    @Test
    void shouldRejectNegativeTokenCounts() {
        TokenUsage usage = TokenUsage.builder().inputTokens(-1).outputTokens(2).totalTokens(1).build();
        TokenUsageRecord usageRecord = usageRecord("m1", "assistant", InteractionType.CONVERSATION, usage);

        TokenUsageValidationException ex = assertThrows(TokenUsageValidationException.class,
                () -> ledger.validate(usageRecord, InteractionType.CONVERSATION));
        assertEquals("rawUsage.inputTokens", ex.getField());
        assertEquals("non-negative", ex.getConstraint());
    }

    @Test
    void shouldRejectUnknownRole() {
        TokenUsageRecord usageRecord = usageRecord("m1", "robot", InteractionType.CONVERSATION,
                TokenUsage.of(1, 1, 0, 0));

        TokenUsageValidationException ex = assertThrows(TokenUsageValidationException.class,
                () -> ledger.validate(usageRecord, InteractionType.CONVERSATION));
        assertEquals("role", ex.getField());
        assertEquals("enum", ex.getConstraint());
    }

    @Test
    void shouldRejectRecordOfOtherPartition() {
        TokenUsageRecord usageRecord = usageRecord("m1", "assistant", InteractionType.CHAT,
                TokenUsage.of(1, 1, 0, 0));

        TokenUsageValidationException ex = assertThrows(TokenUsageValidationException.class,
                () -> ledger.writeUsage(PROJECT, INTERACTION, usageRecord, InteractionType.CONVERSATION));
        assertEquals("match", ex.getConstraint());
        assertTrue(ledger.getUsage(PROJECT, INTERACTION, InteractionType.CONVERSATION).isEmpty());
    }

    // ==================== PARSING ====================

    @Test
    void shouldSkipMalformedLines() {
        storagePort.appendText(DIR, "tokenUsage/conversation.jsonl",
                "{\"messageId\":\"m1\",\"role\":\"assistant\",\"rawUsage\":{\"totalTokens\":3}}\n"
                        + "not json\n"
                        + "{\"messageId\":\"m2\",\"role\":\"user\",\"rawUsage\":{\"totalTokens\":4}}\n")
                .join();

        List<TokenUsageRecord> records = ledger.getUsage(PROJECT, INTERACTION, InteractionType.CONVERSATION);

        assertEquals(2, records.size());
        assertEquals("m2", records.get(1).getMessageId());
    }

    @Test
    void shouldReadLegacyJsonArray() {
        storagePort.putText(DIR, "tokenUsage/conversation.jsonl",
                "[{\"messageId\":\"a\"},{\"messageId\":\"b\"}]").join();

        assertEquals(2, ledger.getUsage(PROJECT, INTERACTION, InteractionType.CONVERSATION).size());
    }

    @Test
    void shouldReadSingleObject() {
        storagePort.putText(DIR, "tokenUsage/chats.jsonl", "{\"messageId\":\"only\"}").join();

        List<TokenUsageRecord> records = ledger.getUsage(PROJECT, INTERACTION, InteractionType.CHAT);

        assertEquals(1, records.size());
        assertEquals("only", records.get(0).getMessageId());
    }

    // ==================== ANALYSIS ====================

    @Test
    void shouldAnalyzeCacheImpactAndRoles() {
        TokenUsage cached = TokenUsage.of(1000, 100, 0, 800);
        TokenUsage uncached = TokenUsage.of(500, 50, 0, 0);

        TokenUsageAnalysis analysis = TokenUsageLedger.analyze(List.of(
                usageRecord("m1", "assistant", InteractionType.CONVERSATION, cached),
                usageRecord("m2", "user", InteractionType.CONVERSATION, uncached)));

        assertEquals(1500, analysis.getTotalUsage().getInputTokens());
        assertEquals(1500, analysis.getCacheImpact().getPotentialCost());
        assertEquals(800, analysis.getCacheImpact().getActualCost());
        assertEquals(700, analysis.getCacheImpact().getTotalSavings());
        assertEquals(700.0 / 1500 * 100, analysis.getCacheImpact().getSavingsPercentage(), 0.0001);
        assertEquals(1, analysis.getByRole().get("assistant").getRecords());
        assertEquals(550, analysis.getByRole().get("user").getTotalTokens());
    }

    @Test
    void shouldSumFieldsAndAverageSavingsPercentageWhenCombining() {
        TokenUsageAnalysis first = TokenUsageLedger.analyze(List.of(
                usageRecord("m1", "assistant", InteractionType.CONVERSATION, TokenUsage.of(100, 10, 0, 0))));
        TokenUsageAnalysis second = TokenUsageLedger.analyze(List.of(
                usageRecord("m2", "assistant", InteractionType.CHAT, TokenUsage.of(100, 10, 0, 50))));

        TokenUsageAnalysis combined = TokenUsageLedger.combine(first, second);

        assertEquals(200, combined.getTotalUsage().getInputTokens());
        assertEquals(2, combined.getByRole().get("assistant").getRecords());
        assertEquals(150, combined.getCacheImpact().getTotalSavings());
        assertEquals((100.0 + 50.0) / 2, combined.getCacheImpact().getSavingsPercentage(), 0.0001);
    }

    @Test
    void shouldAnalyzeEmptyLedgerAsZero() {
        TokenUsageAnalysis analysis = ledger.analyzeUsage(PROJECT, INTERACTION, InteractionType.CONVERSATION);

        assertEquals(0, analysis.getTotalUsage().getTotalAllTokens());
        assertEquals(0.0, analysis.getCacheImpact().getSavingsPercentage());
        assertTrue(analysis.getByRole().isEmpty());
    }
}
