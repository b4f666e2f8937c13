package me.golemcore.interactions;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Interactions.
 *
 * <p>
 * GolemCore Interactions is the state and persistence engine behind a
 * multi-turn, tool-executing agent: it keeps interactions (conversations and
 * side chats) with an LLM provider, re-injects resource content into the
 * history it sends, accounts for every token including cache economics, and
 * stores everything in a versioned on-disk format that migrates forward on its
 * own.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Hydration</b> - windowed re-injection of resource revisions into
 * message history</li>
 * <li><b>Token Ledger</b> - append-only usage records with cache-impact
 * analysis</li>
 * <li><b>Tool Registry</b> - built-in, user-directory and MCP tools with
 * collision rules and a dispatcher that always closes a tool use</li>
 * <li><b>Versioned Persistence</b> - per-interaction files, project index and
 * a forward-only migration chain</li>
 * <li><b>Hierarchy</b> - parent/child interactions for sub-agents and side
 * chats</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Domain Layer       → InteractionService, MessageHydrator, ToolRegistry,
 *                      TokenUsageLedger, InteractionPersistenceService
 * Infrastructure     → Storage/LLM/MCP/Resource adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code interactions.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class InteractionsApplication {

    public static void main(String[] args) {
        SpringApplication.run(InteractionsApplication.class, args);
    }

}
