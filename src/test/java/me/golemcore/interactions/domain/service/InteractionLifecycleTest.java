package me.golemcore.interactions.domain.service;

import me.golemcore.interactions.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.interactions.domain.migration.BackfillTotalAllTokensStep;
import me.golemcore.interactions.domain.migration.InteractionMigrationService;
import me.golemcore.interactions.domain.migration.NestModelConfigStep;
import me.golemcore.interactions.domain.migration.StampVersionStep;
import me.golemcore.interactions.domain.model.ContentPart;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.Message;
import me.golemcore.interactions.domain.model.ProviderRequest;
import me.golemcore.interactions.domain.model.ProviderResponse;
import me.golemcore.interactions.domain.model.TokenUsage;
import me.golemcore.interactions.domain.tools.ToolRegistry;
import me.golemcore.interactions.infrastructure.config.AutoConfiguration;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import me.golemcore.interactions.port.outbound.ProviderPort;
import me.golemcore.interactions.port.outbound.ResourceConnectorPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Converses through the real storage stack, then reloads the interaction with
 * freshly built services as a new process would.
 */
class InteractionLifecycleTest {

    private static final String PROJECT = "p1";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-05-01T09:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void shouldSurviveReloadWithIdenticalCountersAndTotals() {
        ProviderPort providerPort = mock(ProviderPort.class);
        when(providerPort.getProviderId()).thenReturn("anthropic");
        when(providerPort.send(any()))
                .thenReturn(CompletableFuture.completedFuture(answer("4", TokenUsage.of(200, 100, 50, 25))))
                .thenReturn(CompletableFuture.completedFuture(answer("You asked 2+2.", TokenUsage.of(250, 20, 0, 0))));

        Services first = new Services();
        InteractionService interactionService = first.interactionService(providerPort);
        Interaction interaction = first.hierarchy.createInteraction(PROJECT, "i1", null, null);

        interactionService.converse(interaction, "2+2", null, null, null);
        assertEquals(1, interaction.getStats().getStatementCount());
        assertEquals(1, first.ledger.getUsage(PROJECT, "i1", interaction.getType()).size());

        interactionService.converse(interaction, "what did I just ask", null, null, null);

        ArgumentCaptor<ProviderRequest> requests = ArgumentCaptor.forClass(ProviderRequest.class);
        verify(providerPort, times(2)).send(requests.capture());
        List<Message> secondRequest = requests.getAllValues().get(1).getMessages();
        assertEquals(3, secondRequest.size());
        assertTrue(secondRequest.get(0).getText().contains("2+2"));
        assertEquals("4", secondRequest.get(1).getText());

        first.hierarchy.saveInteraction(interaction);

        Services second = new Services();
        Interaction reloaded = second.hierarchy.getInteraction(PROJECT, "i1").orElseThrow();

        assertNotSame(interaction, reloaded);
        assertEquals(interaction.getStats(), reloaded.getStats());
        assertEquals(interaction.getTotalProviderRequests(), reloaded.getTotalProviderRequests());
        assertEquals(interaction.getMessages().size(), reloaded.getMessages().size());
        assertEquals(interaction.getTokenUsageStats().getTokenUsageInteraction().getTotalAllTokens(),
                reloaded.getTokenUsageStats().getTokenUsageInteraction().getTotalAllTokens());
        assertEquals(645, reloaded.getTokenUsageStats().getTokenUsageInteraction().getTotalAllTokens());
        assertEquals(interaction.getModelConfig(), reloaded.getModelConfig());
        assertFalse(reloaded.isSaveIncomplete());
    }

    private static ProviderResponse answer(String text, TokenUsage usage) {
        return ProviderResponse.builder()
                .model("claude-test")
                .answerContent(new ArrayList<>(List.of(ContentPart.text(text))))
                .usage(usage)
                .stopReason("end_turn")
                .build();
    }

    private final class Services {

        private final InteractionsProperties properties = new InteractionsProperties();
        private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        private final LocalStorageAdapter storage;
        private final TokenUsageLedger ledger;
        private final InteractionHierarchyService hierarchy;

        private Services() {
            properties.getStorage().getLocal().setBasePath(tempDir.toString());
            properties.getLlm().setModel("claude-test");
            storage = new LocalStorageAdapter(properties);
            storage.init();
            ledger = new TokenUsageLedger(storage, objectMapper);
            ProjectIndexStore indexStore = new ProjectIndexStore(storage, objectMapper);
            InteractionPersistenceService persistence = new InteractionPersistenceService(storage, objectMapper,
                    ledger, indexStore, new InteractionMigrationService(storage, objectMapper, indexStore,
                            List.of(new StampVersionStep(), new BackfillTotalAllTokensStep(objectMapper),
                                    new NestModelConfigStep())),
                    CLOCK);
            hierarchy = new InteractionHierarchyService(persistence, indexStore, properties, CLOCK);
        }

        private InteractionService interactionService(ProviderPort providerPort) {
            ToolRegistry toolRegistry = mock(ToolRegistry.class);
            when(toolRegistry.getExposedDescriptors()).thenReturn(List.of());
            ResourceRevisionStore revisionStore = new ResourceRevisionStore(storage);
            MessageHydrator hydrator = new MessageHydrator(revisionStore, objectMapper, properties);
            return new InteractionService(providerPort, hydrator, ledger, revisionStore,
                    mock(ResourceConnectorPort.class), toolRegistry, properties, objectMapper, CLOCK);
        }
    }
}
