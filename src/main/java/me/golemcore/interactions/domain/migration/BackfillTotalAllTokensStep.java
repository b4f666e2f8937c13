package me.golemcore.interactions.domain.migration;

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

import me.golemcore.interactions.domain.model.InteractionType;
import me.golemcore.interactions.domain.model.MigrationResult;
import me.golemcore.interactions.domain.model.TokenUsageAnalysis;
import me.golemcore.interactions.domain.model.TokenUsageRecord;
import me.golemcore.interactions.domain.service.StorageLayout;
import me.golemcore.interactions.domain.service.TokenUsageLedger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 2 to 3: ledger records get {@code rawUsage.totalAllTokens} (total plus cache
 * creation, cache read and thought tokens) and the interaction's lifetime
 * usage in the metadata is recomputed from the ledger.
 */
@RequiredArgsConstructor
@Slf4j
@Component
public class BackfillTotalAllTokensStep implements MigrationStep {

    private static final String RAW_USAGE = "rawUsage";
    private static final String TOTAL_ALL_TOKENS = "totalAllTokens";

    private final ObjectMapper objectMapper;

    @Override
    public int getTargetVersion() {
        return 3;
    }

    @Override
    public String getDescription() {
        return "Backfill totalAllTokens in token usage records";
    }

    @Override
    public Outcome apply(MetadataSnapshot snapshot) {
        if (snapshot.version() >= getTargetVersion()) {
            return Outcome.unchanged(snapshot);
        }
        List<MigrationResult.Change> changes = new ArrayList<>();
        List<JsonNode> conversation = snapshot.conversationUsage();
        List<JsonNode> chat = snapshot.chatUsage();

        int conversationUpdated = backfill(conversation);
        if (conversationUpdated > 0) {
            changes.add(usageChange(InteractionType.CONVERSATION, conversationUpdated));
        }
        int chatUpdated = backfill(chat);
        if (chatUpdated > 0) {
            changes.add(usageChange(InteractionType.CHAT, chatUpdated));
        }

        ObjectNode metadata = snapshot.metadata();
        TokenUsageAnalysis analysis = TokenUsageLedger.combine(
                TokenUsageLedger.analyze(toRecords(conversation)),
                TokenUsageLedger.analyze(toRecords(chat)));
        JsonNode lifetime = objectMapper.valueToTree(analysis.getTotalUsage());
        JsonNode usageStats = metadata.path("tokenUsageStats");
        ObjectNode stats = usageStats.isObject() ? (ObjectNode) usageStats : metadata.putObject("tokenUsageStats");
        if (!lifetime.equals(stats.get("tokenUsageInteraction"))) {
            stats.set("tokenUsageInteraction", lifetime);
            changes.add(new MigrationResult.Change("tokenUsage", StorageLayout.METADATA_FILE,
                    "Recomputed lifetime token usage: " + analysis.getTotalUsage().getTotalAllTokens()
                            + " total tokens"));
        }

        MetadataSnapshot migrated = snapshot.withUsage(conversation, chat)
                .withVersion(getTargetVersion(), metadata);
        return new Outcome(migrated, changes);
    }

    private static int backfill(List<JsonNode> records) {
        int updated = 0;
        for (JsonNode node : records) {
            if (!node.isObject() || !node.path(RAW_USAGE).isObject()) {
                continue;
            }
            ObjectNode raw = (ObjectNode) node.get(RAW_USAGE);
            JsonNode existing = raw.get(TOTAL_ALL_TOKENS);
            if (existing != null && existing.isNumber()) {
                continue;
            }
            int total = raw.has("totalTokens")
                    ? raw.path("totalTokens").asInt(0)
                    : raw.path("inputTokens").asInt(0) + raw.path("outputTokens").asInt(0);
            raw.put(TOTAL_ALL_TOKENS, total
                    + raw.path("cacheCreationInputTokens").asInt(0)
                    + raw.path("cacheReadInputTokens").asInt(0)
                    + raw.path("thoughtTokens").asInt(0));
            updated++;
        }
        return updated;
    }

    private List<TokenUsageRecord> toRecords(List<JsonNode> nodes) {
        List<TokenUsageRecord> records = new ArrayList<>();
        for (JsonNode node : nodes) {
            if (!node.isObject()) {
                continue;
            }
            try {
                records.add(objectMapper.treeToValue(node, TokenUsageRecord.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.debug("[Migration] Ignoring unreadable usage record in lifetime total: {}", e.getMessage());
            }
        }
        return records;
    }

    private static MigrationResult.Change usageChange(InteractionType type, int count) {
        return new MigrationResult.Change("tokenUsage", StorageLayout.tokenUsagePath(type.getLedgerFile()),
                "Added totalAllTokens to " + count + " record(s)");
    }
}
