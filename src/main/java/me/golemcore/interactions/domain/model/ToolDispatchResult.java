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
 * Outcome of dispatching one tool use. A failed run is reported here with
 * {@code isError} set; it never escapes as an exception.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolDispatchResult {

    @Builder.Default
    private List<ContentPart> toolResults = new ArrayList<>();

    private String toolResponse;
    private String bbResponse;
    private boolean isError;
    private String messageId;
}
