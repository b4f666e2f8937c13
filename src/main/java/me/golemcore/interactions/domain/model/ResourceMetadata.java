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

/**
 * Metadata of one resource revision known to an interaction. The pair
 * (uri, revision) is the immutable key.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResourceMetadata {

    public static final String CONTENT_TEXT = "text";
    public static final String CONTENT_IMAGE = "image";

    private String uri;
    private String revision;

    @Builder.Default
    private String type = "file";

    private String contentType;
    private String mimeType;
    private long size;
    private Instant lastModified;
    private String messageId;
    private boolean inSystemPrompt;
    private String error;

    @JsonIgnore
    public boolean isImage() {
        return CONTENT_IMAGE.equals(contentType);
    }

    @JsonIgnore
    public boolean hasError() {
        return error != null && !error.isBlank();
    }
}
