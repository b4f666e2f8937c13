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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of interaction. Primary conversations and side chats keep separate
 * usage ledgers.
 */
public enum InteractionType {

    CONVERSATION("conversation", "conversation.jsonl"),
    CHAT("chat", "chats.jsonl");

    private final String value;
    private final String ledgerFile;

    InteractionType(String value, String ledgerFile) {
        this.value = value;
        this.ledgerFile = ledgerFile;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getLedgerFile() {
        return ledgerFile;
    }

    @JsonCreator
    public static InteractionType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (InteractionType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown interaction type: " + value);
    }
}
