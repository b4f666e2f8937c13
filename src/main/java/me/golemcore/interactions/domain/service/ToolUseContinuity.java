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

import me.golemcore.interactions.domain.model.ContentPart;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.Message;
import me.golemcore.interactions.domain.model.MessageStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Keeps every assistant tool use answered by a tool result. Providers reject a
 * history in which a tool use is followed by anything but its result.
 */
@Slf4j
public final class ToolUseContinuity {

    public static final String INTERRUPTED_TEXT =
            "Tool use was interrupted, results could not be generated. You may try again now.";

    private ToolUseContinuity() {
    }

    /**
     * Appends an error tool result for every tool use of the latest assistant
     * message that the following messages leave unanswered. Does nothing when a
     * user message already followed.
     *
     * @return true if a repair message was appended
     */
    public static boolean repairInterruptedToolUse(Interaction interaction, Instant now) {
        Optional<Message> last = interaction.getLastMessage();
        if (last.isEmpty() || last.get().isUserMessage()) {
            return false;
        }
        Set<String> pending = pendingToolUseIds(interaction);
        if (pending.isEmpty()) {
            return false;
        }
        List<ContentPart> results = new ArrayList<>();
        for (String toolUseId : pending) {
            results.add(ContentPart.toolResult(toolUseId, List.of(ContentPart.text(INTERRUPTED_TEXT)), true));
        }
        interaction.addMessage(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_TOOL)
                .content(results)
                .timestamp(now)
                .stats(MessageStats.of(interaction.getStats()))
                .build());
        log.warn("[Interaction] {}: {} unresolved tool use(s) after message {}, appended interrupted results",
                interaction.getId(), results.size(), last.get().getId());
        return true;
    }

    /**
     * Tool use ids of the last assistant message that no later tool message
     * answers yet.
     */
    public static Set<String> pendingToolUseIds(Interaction interaction) {
        List<Message> messages = interaction.getMessages();
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.isAssistantMessage()) {
                Set<String> pending = new LinkedHashSet<>();
                message.getToolUseParts().forEach(part -> pending.add(part.getId()));
                for (int j = i + 1; j < messages.size(); j++) {
                    pending.removeAll(messages.get(j).getToolResultIds());
                }
                return pending;
            }
        }
        return Set.of();
    }
}
