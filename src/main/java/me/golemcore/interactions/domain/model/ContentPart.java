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
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One typed part of a message: text, image, tool use or tool result. Tool
 * results nest their own content parts.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentPart {

    public static final String TYPE_TEXT = "text";
    public static final String TYPE_IMAGE = "image";
    public static final String TYPE_TOOL_USE = "tool_use";
    public static final String TYPE_TOOL_RESULT = "tool_result";

    private String type;

    // text; explicit so the isText() type check does not hide the property
    @JsonProperty("text")
    private String text;

    // image
    private String mediaType;
    private String data; // base64

    // tool_use
    private String id;
    private String name;
    private Map<String, Object> input;

    // tool_result
    private String toolUseId;
    private List<ContentPart> content;
    private Boolean isError;

    public static ContentPart text(String text) {
        return ContentPart.builder().type(TYPE_TEXT).text(text).build();
    }

    public static ContentPart image(String mediaType, String base64Data) {
        return ContentPart.builder().type(TYPE_IMAGE).mediaType(mediaType).data(base64Data).build();
    }

    public static ContentPart toolUse(String id, String name, Map<String, Object> input) {
        return ContentPart.builder().type(TYPE_TOOL_USE).id(id).name(name).input(input).build();
    }

    public static ContentPart toolResult(String toolUseId, List<ContentPart> content, boolean isError) {
        return ContentPart.builder()
                .type(TYPE_TOOL_RESULT)
                .toolUseId(toolUseId)
                .content(content != null ? new ArrayList<>(content) : new ArrayList<>())
                .isError(isError)
                .build();
    }

    @JsonIgnore
    public boolean isText() {
        return TYPE_TEXT.equals(type);
    }

    @JsonIgnore
    public boolean isImage() {
        return TYPE_IMAGE.equals(type);
    }

    @JsonIgnore
    public boolean isToolUse() {
        return TYPE_TOOL_USE.equals(type);
    }

    @JsonIgnore
    public boolean isToolResult() {
        return TYPE_TOOL_RESULT.equals(type);
    }

    @JsonIgnore
    public boolean isErrorResult() {
        return Boolean.TRUE.equals(isError);
    }
}
