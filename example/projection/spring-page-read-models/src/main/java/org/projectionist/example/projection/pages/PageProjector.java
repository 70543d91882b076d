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

import org.projectionist.example.projection.pages.domain.PageCreated;
import org.projectionist.example.projection.pages.domain.PageDeleted;
import org.projectionist.example.projection.pages.domain.PageSummaryUpdated;
import org.projectionist.example.projection.pages.domain.PageWorkflowStatusUpdated;
import org.projectionist.projection.EventProjector;
import org.projectionist.projection.MalformedEventException;
import org.projectionist.readmodel.api.MaterializationResult;
import org.projectionist.readmodel.api.ReadModelMaterializer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maintains the page read models
 */
public class PageProjector {
    public static final String CONSUMER_NAME = "page-read-models";
    public static final String COLLECTION = "page_read_models";
    public static final String PAGE_ID = "pageId";

    private final ReadModelMaterializer materializer;

    public PageProjector(ReadModelMaterializer materializer) {
        this.materializer = materializer;
    }

    public EventProjector projector() {
        return EventProjector.builder()
                .on(PageCreated.class, this::pageCreated)
                .on(PageWorkflowStatusUpdated.class, this::workflowStatusUpdated)
                .on(PageSummaryUpdated.class, this::summaryUpdated)
                .on(PageDeleted.class, this::pageDeleted)
                .build();
    }

    MaterializationResult pageCreated(PageCreated event, long position) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("name", event.name());
        fields.put("artifactId", event.artifactId());
        fields.put("index", event.index());
        fields.put("summary", null);
        fields.put("workflowStatuses", Map.of());
        fields.put("tagMentions", List.of());
        return materializer.apply(COLLECTION, PAGE_ID, event.pageId(), fields, CONSUMER_NAME, position);
    }

    MaterializationResult workflowStatusUpdated(PageWorkflowStatusUpdated event, long position) {
        if (event.workflow() == null || event.workflow().isBlank()) {
            throw new MalformedEventException("Workflow status update of page " + event.pageId() + " names no workflow");
        }
        return materializer.apply(COLLECTION, PAGE_ID, event.pageId(), Map.of("workflowStatuses." + event.workflow(), event.status()), CONSUMER_NAME, position);
    }

    MaterializationResult summaryUpdated(PageSummaryUpdated event, long position) {
        return materializer.apply(COLLECTION, PAGE_ID, event.pageId(), Map.of("summary", event.summary()), CONSUMER_NAME, position);
    }

    MaterializationResult pageDeleted(PageDeleted event, long position) {
        return materializer.delete(COLLECTION, PAGE_ID, event.pageId(), CONSUMER_NAME, position);
    }
}
