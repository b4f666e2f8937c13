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

/**
 * Directory and file names of the on-disk format. Everything is relative to
 * the storage base path.
 */
public final class StorageLayout {

    public static final String INDEX_FILE = "interactions.json";
    public static final String METADATA_FILE = "metadata.json";
    public static final String MESSAGES_FILE = "messages.jsonl";
    public static final String CHANGES_FILE = "changes.jsonl";
    public static final String PREPARED_SYSTEM_FILE = "prepared_system.json";
    public static final String PREPARED_TOOLS_FILE = "prepared_tools.json";
    public static final String RESOURCES_METADATA_FILE = "resources_metadata.json";
    public static final String OBJECTIVES_FILE = "objectives.json";
    public static final String RESOURCE_ACCESS_FILE = "resources.json";
    public static final String SAVE_MARKER_FILE = "save.pending";
    public static final String REVISIONS_DIR = "resource_revisions";
    public static final String TOKEN_USAGE_DIR = "tokenUsage";

    private StorageLayout() {
    }

    public static String projectDir(String projectId) {
        return "projects/" + requireSegment(projectId, "projectId");
    }

    public static String interactionsDir(String projectId) {
        return projectDir(projectId) + "/interactions";
    }

    public static String interactionDir(String projectId, String interactionId) {
        return interactionsDir(projectId) + "/" + requireSegment(interactionId, "interactionId");
    }

    public static String tokenUsagePath(String ledgerFile) {
        return TOKEN_USAGE_DIR + "/" + ledgerFile;
    }

    private static String requireSegment(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        if (value.contains("/") || value.contains("\\") || value.contains("..")) {
            throw new IllegalArgumentException(name + " contains illegal characters: " + value);
        }
        return value;
    }
}
