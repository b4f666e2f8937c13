package me.golemcore.interactions.domain.migration;

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

import me.golemcore.interactions.domain.model.MigrationResult;
import me.golemcore.interactions.domain.service.StorageLayout;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 3 to 4: top-level {@code model}, {@code temperature} and {@code maxTokens}
 * move under {@code modelConfig}. A value already present in modelConfig is
 * kept; the top-level copy is dropped either way.
 */
@Component
public class NestModelConfigStep implements MigrationStep {

    private static final List<String> FLAT_FIELDS = List.of("model", "temperature", "maxTokens");
    private static final String MODEL_CONFIG = "modelConfig";

    @Override
    public int getTargetVersion() {
        return 4;
    }

    @Override
    public String getDescription() {
        return "Nest model parameters under modelConfig";
    }

    @Override
    public Outcome apply(MetadataSnapshot snapshot) {
        if (snapshot.version() >= getTargetVersion()) {
            return Outcome.unchanged(snapshot);
        }
        ObjectNode metadata = snapshot.metadata();
        List<MigrationResult.Change> changes = new ArrayList<>();

        JsonNode existing = metadata.get(MODEL_CONFIG);
        ObjectNode modelConfig = existing != null && existing.isObject()
                ? (ObjectNode) existing
                : metadata.putObject(MODEL_CONFIG);

        for (String field : FLAT_FIELDS) {
            JsonNode value = metadata.remove(field);
            if (value == null) {
                continue;
            }
            if (!modelConfig.has(field)) {
                modelConfig.set(field, value);
                changes.add(new MigrationResult.Change("modelConfig", StorageLayout.METADATA_FILE,
                        "Moved " + field + " into modelConfig"));
            } else {
                changes.add(new MigrationResult.Change("modelConfig", StorageLayout.METADATA_FILE,
                        "Dropped top-level " + field + ", modelConfig already has it"));
            }
        }
        return new Outcome(snapshot.withVersion(getTargetVersion(), metadata), changes);
    }
}
