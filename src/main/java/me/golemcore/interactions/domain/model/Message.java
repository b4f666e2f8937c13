package me.golemcore.interactions.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A single message of an interaction: a role plus ordered typed content parts.
 * Roles are user, assistant and tool.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String id;
    private String role;

    @Builder.Default
    private List<ContentPart> content = new ArrayList<>();

    private Instant timestamp;

    // message of another interaction this one answers to (side chats)
    private String parentMessageId;
    private MessageStats stats;
    private ProviderResponseSummary providerResponse;

    @JsonIgnore
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    @JsonIgnore
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    @JsonIgnore
    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message contains tool use parts.
     */
    public boolean hasToolUse() {
        return content != null && content.stream().anyMatch(ContentPart::isToolUse);
    }

    @JsonIgnore
    public List<ContentPart> getToolUseParts() {
        if (content == null) {
            return List.of();
        }
        return content.stream().filter(ContentPart::isToolUse).toList();
    }

    @JsonIgnore
    public Set<String> getToolResultIds() {
        if (content == null) {
            return Set.of();
        }
        return content.stream()
                .filter(ContentPart::isToolResult)
                .map(ContentPart::getToolUseId)
                .collect(Collectors.toSet());
    }

    /**
     * Concatenated text of all top-level text parts.
     */
    @JsonIgnore
    public String getText() {
        if (content == null) {
            return "";
        }
        return content.stream()
                .filter(ContentPart::isText)
                .map(ContentPart::getText)
                .collect(Collectors.joining("\n"));
    }
}
