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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured provider answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderResponse {

    private String id;
    private String model;

    @Builder.Default
    private List<ContentPart> answerContent = new ArrayList<>();

    @Builder.Default
    private TokenUsage usage = TokenUsage.empty();

    private String stopReason;

    // id of the assistant message recorded for this response
    private String messageId;

    /**
     * Checks if the provider asked for one or more tool runs.
     */
    public boolean isToolUse() {
        return answerContent != null && answerContent.stream().anyMatch(ContentPart::isToolUse);
    }

    public List<ToolUseRequest> getToolUseRequests() {
        if (answerContent == null) {
            return List.of();
        }
        return answerContent.stream()
                .filter(ContentPart::isToolUse)
                .map(ToolUseRequest::fromPart)
                .toList();
    }

    public String getAnswerText() {
        if (answerContent == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (ContentPart part : answerContent) {
            if (part.isText() && part.getText() != null) {
                if (!sb.isEmpty()) {
                    sb.append('\n');
                }
                sb.append(part.getText());
            }
        }
        return sb.toString();
    }
}
