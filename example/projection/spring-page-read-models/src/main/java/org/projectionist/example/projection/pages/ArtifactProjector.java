/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.projectionist.example.projection.pages;

import org.projectionist.example.projection.pages.domain.ArtifactCreated;
import org.projectionist.example.projection.pages.domain.ArtifactDeleted;
import org.projectionist.example.projection.pages.domain.ArtifactPagesAdded;
import org.projectionist.example.projection.pages.domain.ArtifactTagsUpdated;
import org.projectionist.projection.EventProjector;
import org.projectionist.readmodel.api.MaterializationResult;
import org.projectionist.readmodel.api.ReadModelMaterializer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maintains the artifact read models
 */
public class ArtifactProjector {
    public static final String CONSUMER_NAME = "artifact-read-models";
    public static final String COLLECTION = "artifact_read_models";
    public static final String ARTIFACT_ID = "artifactId";

    private final ReadModelMaterializer materializer;

    public ArtifactProjector(ReadModelMaterializer materializer) {
        this.materializer = materializer;
    }

    public EventProjector projector() {
        return EventProjector.builder()
                .on(ArtifactCreated.class, this::artifactCreated)
                .on(ArtifactPagesAdded.class, this::pagesAdded)
                .on(ArtifactTagsUpdated.class, this::tagsUpdated)
                .on(ArtifactDeleted.class, this::artifactDeleted)
                .build();
    }

    MaterializationResult artifactCreated(ArtifactCreated event, long position) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("sourceUri", event.sourceUri());
        fields.put("sourceFilename", event.sourceFilename());
        fields.put("mimeType", event.mimeType());
        fields.put("pages", List.of());
        fields.put("tags", List.of());
        return materializer.apply(COLLECTION, ARTIFACT_ID, event.artifactId(), fields, CONSUMER_NAME, position);
    }

    MaterializationResult pagesAdded(ArtifactPagesAdded event, long position) {
        return materializer.apply(COLLECTION, ARTIFACT_ID, event.artifactId(), Map.of("pages", List.copyOf(event.pageIds())), CONSUMER_NAME, position);
    }

    MaterializationResult tagsUpdated(ArtifactTagsUpdated event, long position) {
        return materializer.apply(COLLECTION, ARTIFACT_ID, event.artifactId(), Map.of("tags", List.copyOf(event.tags())), CONSUMER_NAME, position);
    }

    MaterializationResult artifactDeleted(ArtifactDeleted event, long position) {
        return materializer.delete(COLLECTION, ARTIFACT_ID, event.artifactId(), CONSUMER_NAME, position);
    }
}
