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
import java.util.function.Consumer;

/**
 * Output of a tool handler run. {@code toolResults} goes into the tool-result
 * message, {@code toolResponse} is relayed to the model, {@code bbResponse} is
 * the summary shown to the user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolRunResult {

    @Builder.Default
    private List<ContentPart> toolResults = new ArrayList<>();

    private String toolResponse;
    private String bbResponse;

    // called with the id of the appended tool-result message
    private Consumer<String> finalizeCallback;

    public static ToolRunResult text(String toolResult, String toolResponse, String bbResponse) {
        return ToolRunResult.builder()
                .toolResults(new ArrayList<>(List.of(ContentPart.text(toolResult))))
                .toolResponse(toolResponse)
                .bbResponse(bbResponse)
                .build();
    }
}
