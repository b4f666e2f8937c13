package me.golemcore.interactions.domain.service;

import me.golemcore.interactions.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.interactions.domain.exception.PersistenceException;
import me.golemcore.interactions.domain.migration.BackfillTotalAllTokensStep;
import me.golemcore.interactions.domain.migration.InteractionMigrationService;
import me.golemcore.interactions.domain.migration.NestModelConfigStep;
import me.golemcore.interactions.domain.migration.StampVersionStep;
import me.golemcore.interactions.domain.model.CacheImpact;
import me.golemcore.interactions.domain.model.ChangeLogEntry;
import me.golemcore.interactions.domain.model.ContentPart;
import me.golemcore.interactions.domain.model.DifferentialUsage;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.InteractionListQuery;
import me.golemcore.interactions.domain.model.InteractionPage;
import me.golemcore.interactions.domain.model.InteractionSummary;
import me.golemcore.interactions.domain.model.InteractionType;
import me.golemcore.interactions.domain.model.Message;
import me.golemcore.interactions.domain.model.ResourceMetadata;
import me.golemcore.interactions.domain.model.StatementState;
import me.golemcore.interactions.domain.model.TokenUsage;
import me.golemcore.interactions.domain.model.TokenUsageRecord;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.model.ToolUsageStats;
import me.golemcore.interactions.infrastructure.config.AutoConfiguration;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import me.golemcore.interactions.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class InteractionPersistenceServiceTest {

    private static final String PROJECT = "p1";
    private static final String DIR = "projects/p1/interactions/";
    private static final Instant T1 = Instant.parse("2026-02-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2026-02-02T10:00:00Z");
    private static final Instant T3 = Instant.parse("2026-02-03T10:00:00Z");

    @TempDir
    Path tempDir;

    private StoragePort storagePort;
    private ObjectMapper objectMapper;
    private TokenUsageLedger ledger;
    private ProjectIndexStore indexStore;
    private Clock clock;
    private InteractionPersistenceService service;

    @BeforeEach
    void setUp() {
        InteractionsProperties properties = new InteractionsProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter adapter = new LocalStorageAdapter(properties);
        adapter.init();
        storagePort = adapter;
        objectMapper = AutoConfiguration.objectMapper();
        ledger = new TokenUsageLedger(storagePort, objectMapper);
        indexStore = new ProjectIndexStore(storagePort, objectMapper);
        InteractionMigrationService migrationService = new InteractionMigrationService(storagePort, objectMapper,
                indexStore, List.of(new StampVersionStep(), new BackfillTotalAllTokensStep(objectMapper),
                        new NestModelConfigStep()));
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(T1);
        service = new InteractionPersistenceService(storagePort, objectMapper, ledger, indexStore, migrationService,
                clock);
    }

    private static Interaction sampleInteraction(String id) {
        Interaction interaction = Interaction.builder()
                .id(id)
                .projectId(PROJECT)
                .title("Refactor parser")
                .providerName("anthropic")
                .collaborationId(id)
                .build();
        interaction.getModelConfig().setModel("claude-test");
        interaction.addMessage(Message.builder().id("u1").role(Message.ROLE_USER)
                .content(new ArrayList<>(List.of(ContentPart.text("Hi")))).build());
        interaction.addMessage(Message.builder().id("a1").role(Message.ROLE_ASSISTANT)
                .content(new ArrayList<>(List.of(ContentPart.text("Hello")))).build());
        interaction.getStats().setStatementCount(1);
        interaction.getStats().setStatementTurnCount(1);
        interaction.getStats().setInteractionTurnCount(1);
        interaction.setTotalProviderRequests(2);
        return interaction;
    }

    private static TokenUsageRecord usageRecord(String messageId, TokenUsage usage) {
        return TokenUsageRecord.builder()
                .messageId(messageId)
                .role("user")
                .type(InteractionType.CONVERSATION)
                .timestamp(T1)
                .rawUsage(usage)
                .differentialUsage(new DifferentialUsage(usage.getInputTokens(), 0, usage.getInputTokens()))
                .cacheImpact(CacheImpact.of(usage))
                .build();
    }

    // ==================== SAVE / LOAD ====================

    @Test
    void shouldRoundTripInteraction() {
        Interaction interaction = sampleInteraction("i1");
        interaction.getResourceMetadata().put(ResourceRevisionStore.revisionKey("file:./a", "u1"),
                ResourceMetadata.builder().uri("file:./a").revision("u1").contentType("text").size(3).build());
        interaction.setObjectives("Ship the parser", "Fix the lexer", T1);
        interaction.updateResourceAccess("file:./a", true);
        interaction.setPreparedSystemPrompt("You are helpful.");
        interaction.setPreparedTools(new ArrayList<>(List.of(ToolDescriptor.builder().name("read_file").build())));
        interaction.getToolStats().put("read_file", ToolUsageStats.builder().count(3).success(2).failure(1).build());
        interaction.setStatementState(StatementState.RESOLVED);

        service.save(interaction);
        Interaction loaded = service.load(PROJECT, "i1").orElseThrow();

        assertEquals(interaction.getStats(), loaded.getStats());
        assertEquals(2, loaded.getTotalProviderRequests());
        assertEquals(interaction.getMessages(), loaded.getMessages());
        assertEquals("Refactor parser", loaded.getTitle());
        assertEquals("claude-test", loaded.getModelConfig().getModel());
        assertEquals(interaction.getResourceMetadata(), loaded.getResourceMetadata());
        assertEquals("Ship the parser", loaded.getObjectives().getInteraction());
        assertEquals(List.of("Fix the lexer"), loaded.getObjectives().getStatement());
        assertTrue(loaded.getResourceAccess().getModified().contains("file:./a"));
        assertEquals("You are helpful.", loaded.getPreparedSystemPrompt());
        assertEquals("read_file", loaded.getPreparedTools().get(0).getName());
        assertEquals(3, loaded.getToolStats().get("read_file").getCount());
        assertEquals(StatementState.RESOLVED, loaded.getStatementState());
        assertEquals(T1, loaded.getCreatedAt());
        assertFalse(loaded.isSaveIncomplete());
        assertFalse(storagePort.exists(DIR + "i1", StorageLayout.SAVE_MARKER_FILE).join());
    }

    @Test
    void shouldWriteIndexEntryOnSave() {
        service.save(sampleInteraction("i1"));

        List<InteractionSummary> index = indexStore.read(PROJECT);
        assertEquals(1, index.size());
        assertEquals("i1", index.get(0).getId());
        assertEquals(4, index.get(0).getSchemaVersion());
        assertEquals("claude-test", index.get(0).getModel());
        assertTrue(service.exists(PROJECT, "i1"));
    }

    @Test
    void shouldRecomputeLifetimeUsageFromLedger() {
        Interaction interaction = sampleInteraction("i1");
        interaction.getTokenUsageStats().setTokenUsageInteraction(TokenUsage.of(1, 1, 0, 0));
        service.save(interaction);
        ledger.writeUsage(PROJECT, "i1", usageRecord("u1", TokenUsage.of(200, 100, 50, 25)),
                InteractionType.CONVERSATION);

        Interaction loaded = service.load(PROJECT, "i1").orElseThrow();

        assertEquals(375, loaded.getTokenUsageStats().getTokenUsageInteraction().getTotalAllTokens());
    }

    @Test
    void shouldReturnEmptyForUnknownInteraction() {
        assertEquals(Optional.empty(), service.load(PROJECT, "missing"));
        assertFalse(service.exists(PROJECT, "missing"));
    }

    @Test
    void shouldFlagIncompleteSave() {
        service.save(sampleInteraction("i1"));
        storagePort.putText(DIR + "i1", StorageLayout.SAVE_MARKER_FILE, T1.toString()).join();

        Interaction loaded = service.load(PROJECT, "i1").orElseThrow();

        assertTrue(loaded.isSaveIncomplete());
    }

    @Test
    void shouldNotWriteResourceMetadataForChats() {
        Interaction chat = sampleInteraction("c1");
        chat.setType(InteractionType.CHAT);

        service.save(chat);

        assertFalse(storagePort.exists(DIR + "c1", StorageLayout.RESOURCES_METADATA_FILE).join());
        assertEquals(InteractionType.CHAT, service.load(PROJECT, "c1").orElseThrow().getType());
    }

    @Test
    void shouldRepairInterruptedToolUseOnLoad() {
        Interaction interaction = sampleInteraction("i1");
        interaction.addMessage(Message.builder().id("a2").role(Message.ROLE_ASSISTANT)
                .content(new ArrayList<>(List.of(ContentPart.toolUse("tu1", "read_file", Map.of())))).build());
        interaction.setStatementState(StatementState.TOOL_USE_REQUESTED);
        service.save(interaction);

        Interaction loaded = service.load(PROJECT, "i1").orElseThrow();

        assertEquals(4, loaded.getMessages().size());
        Message repair = loaded.getMessages().get(3);
        assertTrue(repair.isToolMessage());
        assertEquals(Boolean.TRUE, repair.getContent().get(0).getIsError());
        assertEquals(StatementState.AWAITING_PROVIDER_RESPONSE, loaded.getStatementState());
    }

    @Test
    void shouldSkipMalformedMessageLines() {
        service.save(sampleInteraction("i1"));
        String messages = storagePort.getText(DIR + "i1", StorageLayout.MESSAGES_FILE).join();
        storagePort.putText(DIR + "i1", StorageLayout.MESSAGES_FILE, messages + "{truncated\n").join();

        Interaction loaded = service.load(PROJECT, "i1").orElseThrow();

        assertEquals(2, loaded.getMessages().size());
    }

    @Test
    void shouldIgnoreMalformedAuxiliaryFiles() {
        service.save(sampleInteraction("i1"));
        storagePort.putText(DIR + "i1", StorageLayout.OBJECTIVES_FILE, "{oops").join();

        Interaction loaded = service.load(PROJECT, "i1").orElseThrow();

        assertNotNull(loaded.getObjectives());
        assertNull(loaded.getObjectives().getInteraction());
    }

    // ==================== VERSIONS ====================

    @Test
    void shouldMigrateOldMetadataOnLoad() {
        storagePort.putText(DIR + "old", StorageLayout.METADATA_FILE,
                "{\"id\": \"old\", \"model\": \"legacy-model\", \"maxTokens\": 2048}").join();

        Interaction loaded = service.load(PROJECT, "old").orElseThrow();

        assertEquals("legacy-model", loaded.getModelConfig().getModel());
        assertEquals(2048, loaded.getModelConfig().getMaxTokens());
        assertTrue(storagePort.getText(DIR + "old", StorageLayout.METADATA_FILE).join().contains("\"version\" : 4"));
    }

    @Test
    void shouldRejectNewerSchemaVersion() {
        storagePort.putText(DIR + "future", StorageLayout.METADATA_FILE, "{\"version\": 7}").join();

        PersistenceException e = assertThrows(PersistenceException.class, () -> service.load(PROJECT, "future"));

        assertEquals(PersistenceException.Operation.VALIDATE, e.getOperation());
        assertEquals(7, e.getVersion());
    }

    @Test
    void shouldFailOnMalformedMetadata() {
        storagePort.putText(DIR + "bad", StorageLayout.METADATA_FILE, "{nope").join();

        PersistenceException e = assertThrows(PersistenceException.class, () -> service.load(PROJECT, "bad"));

        assertEquals(PersistenceException.Operation.READ, e.getOperation());
    }

    // ==================== LIST / DELETE ====================

    @Test
    void shouldListNewestFirstWithPaging() {
        when(clock.instant()).thenReturn(T1);
        service.save(sampleInteraction("i1"));
        when(clock.instant()).thenReturn(T3);
        service.save(sampleInteraction("i3"));
        when(clock.instant()).thenReturn(T2);
        service.save(sampleInteraction("i2"));

        InteractionPage first = service.list(PROJECT, InteractionListQuery.builder().page(1).limit(2).build());
        InteractionPage second = service.list(PROJECT, InteractionListQuery.builder().page(2).limit(2).build());

        assertEquals(3, first.getTotalCount());
        assertEquals(List.of("i3", "i2"), first.getInteractions().stream().map(InteractionSummary::getId).toList());
        assertEquals(List.of("i1"), second.getInteractions().stream().map(InteractionSummary::getId).toList());
        assertTrue(service.list(PROJECT, InteractionListQuery.builder().page(5).limit(2).build())
                .getInteractions().isEmpty());
    }

    @Test
    void shouldReturnEmptyPageForPageBeyondIntRange() {
        service.save(sampleInteraction("i1"));

        InteractionPage page = service.list(PROJECT,
                InteractionListQuery.builder().page(Integer.MAX_VALUE).limit(Integer.MAX_VALUE).build());

        assertEquals(1, page.getTotalCount());
        assertTrue(page.getInteractions().isEmpty());
        assertEquals(List.of("i1"), ids(service.list(PROJECT,
                InteractionListQuery.builder().page(1).limit(Integer.MAX_VALUE).build())));
    }

    @Test
    void shouldFilterList() {
        when(clock.instant()).thenReturn(T1);
        Interaction openai = sampleInteraction("i1");
        openai.setProviderName("openai");
        service.save(openai);
        when(clock.instant()).thenReturn(T3);
        service.save(sampleInteraction("i2"));

        assertEquals(List.of("i1"), ids(service.list(PROJECT,
                InteractionListQuery.builder().providerName("openai").build())));
        assertEquals(List.of("i2"), ids(service.list(PROJECT,
                InteractionListQuery.builder().startDate(T2).build())));
        assertEquals(List.of("i1"), ids(service.list(PROJECT,
                InteractionListQuery.builder().endDate(T2).build())));
        assertEquals(List.of("i2"), ids(service.list(PROJECT,
                InteractionListQuery.builder().collaborationId("i2").build())));
    }

    @Test
    void shouldDeleteDirectoryAndIndexEntry() {
        service.save(sampleInteraction("i1"));
        service.save(sampleInteraction("i2"));

        service.delete(PROJECT, "i1");

        assertFalse(service.exists(PROJECT, "i1"));
        assertTrue(service.load(PROJECT, "i1").isEmpty());
        assertEquals(List.of("i2"), indexStore.read(PROJECT).stream().map(InteractionSummary::getId).toList());
    }

    // ==================== CHANGE LOG ====================

    @Test
    void shouldAppendAndUndoChanges() {
        service.logChange(PROJECT, "i1", "src/a.ts", "edit 1");
        service.logChange(PROJECT, "i1", "src/b.ts", "edit 2");

        List<ChangeLogEntry> entries = service.getChangeLog(PROJECT, "i1");
        assertEquals(2, entries.size());
        assertEquals("src/a.ts", entries.get(0).getPath());
        assertEquals(T1, entries.get(0).getTimestamp());

        ChangeLogEntry removed = service.removeLastChange(PROJECT, "i1").orElseThrow();

        assertEquals("edit 2", removed.getChange());
        assertEquals(1, service.getChangeLog(PROJECT, "i1").size());
    }

    @Test
    void shouldSkipMalformedChangeLines() {
        service.logChange(PROJECT, "i1", "src/a.ts", "edit 1");
        storagePort.appendText(DIR + "i1", StorageLayout.CHANGES_FILE, "not json\n").join();

        assertEquals(1, service.getChangeLog(PROJECT, "i1").size());
        assertTrue(service.removeLastChange(PROJECT, "i2").isEmpty());
    }

    private static List<String> ids(InteractionPage page) {
        return page.getInteractions().stream().map(InteractionSummary::getId).toList();
    }
}
