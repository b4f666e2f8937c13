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

import java.util.Map;

/**
 * A tool invocation requested by the model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolUseRequest {

    private String toolUseId;
    private String toolName;
    private Map<String, Object> toolInput;

    // set when the input was already checked against the schema upstream
    private boolean validated;
    private String validationResult;

    public static ToolUseRequest fromPart(ContentPart part) {
        return ToolUseRequest.builder()
                .toolUseId(part.getId())
                .toolName(part.getName())
                .toolInput(part.getInput())
                .build();
    }
}
