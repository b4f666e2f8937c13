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
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 1 to 2: version-less metadata gets an explicit version field.
 */
@Component
public class StampVersionStep implements MigrationStep {

    @Override
    public int getTargetVersion() {
        return 2;
    }

    @Override
    public String getDescription() {
        return "Add explicit schema version";
    }

    @Override
    public Outcome apply(MetadataSnapshot snapshot) {
        if (snapshot.version() >= getTargetVersion()) {
            return Outcome.unchanged(snapshot);
        }
        return new Outcome(snapshot.withVersion(getTargetVersion(), snapshot.metadata()),
                List.of(new MigrationResult.Change("version", StorageLayout.METADATA_FILE,
                        "Set schema version " + snapshot.version() + " -> " + getTargetVersion())));
    }
}
