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

import org.projectionist.readmodel.api.ReadModelDocument;
import org.projectionist.springboot.mongo.ConsistentReadModelReader;

import java.util.Optional;

/**
 * Reads page and artifact read models
 */
public class PageQueries {
    private final ConsistentReadModelReader reader;

    public PageQueries(ConsistentReadModelReader reader) {
        this.reader = reader;
    }

    public Optional<ReadModelDocument> findPage(String pageId) {
        return reader.find(PageProjector.COLLECTION, PageProjector.PAGE_ID, pageId);
    }

    /**
     * Find a page once the page read models reflect at least {@code position}
     */
    public Optional<ReadModelDocument> findPageAfter(String pageId, long position) {
        return reader.findAfter(PageProjector.CONSUMER_NAME, position, PageProjector.COLLECTION, PageProjector.PAGE_ID, pageId);
    }

    public Optional<ReadModelDocument> findArtifact(String artifactId) {
        return reader.find(ArtifactProjector.COLLECTION, ArtifactProjector.ARTIFACT_ID, artifactId);
    }

    public Optional<ReadModelDocument> findArtifactAfter(String artifactId, long position) {
        return reader.findAfter(ArtifactProjector.CONSUMER_NAME, position, ArtifactProjector.COLLECTION, ArtifactProjector.ARTIFACT_ID, artifactId);
    }
}
