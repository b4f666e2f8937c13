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

import java.util.List;

/**
 * One forward step of the metadata schema. A step is a pure function of the
 * snapshot: it never touches storage, and applied to a snapshot already at or
 * past its target version it returns the snapshot unchanged with no changes.
 */
public interface MigrationStep {

    int getTargetVersion();

    String getDescription();

    Outcome apply(MetadataSnapshot snapshot);

    record Outcome(MetadataSnapshot snapshot, List<MigrationResult.Change> changes) {

        public static Outcome unchanged(MetadataSnapshot snapshot) {
            return new Outcome(snapshot, List.of());
        }
    }
}
