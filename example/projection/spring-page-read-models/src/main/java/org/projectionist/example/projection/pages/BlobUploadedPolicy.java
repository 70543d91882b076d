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

import org.projectionist.example.projection.pages.domain.BlobUploaded;
import org.projectionist.projection.EventProjector;
import org.projectionist.readmodel.api.MaterializationResult;
import org.projectionist.readmodel.api.ReadModelMaterializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts ingestion of uploaded PDF blobs. The position is recorded after the workflow has been started, so a
 * blob may be submitted again if the process crashes in between. Other mime types are recorded without side effect.
 */
public class BlobUploadedPolicy {
    private static final Logger log = LoggerFactory.getLogger(BlobUploadedPolicy.class);

    public static final String CONSUMER_NAME = "blob-policies";

    private final ReadModelMaterializer materializer;
    private final WorkflowStarter workflowStarter;

    public BlobUploadedPolicy(ReadModelMaterializer materializer, WorkflowStarter workflowStarter) {
        this.materializer = materializer;
        this.workflowStarter = workflowStarter;
    }

    public EventProjector projector() {
        return EventProjector.builder().on(BlobUploaded.class, this::blobUploaded).build();
    }

    MaterializationResult blobUploaded(BlobUploaded event, long position) {
        if ("application/pdf".equals(event.mimeType())) {
            workflowStarter.startIngestion(event.blobId(), event.uri());
        } else {
            log.debug("Ignoring blob {} of type {}", event.blobId(), event.mimeType());
        }
        return materializer.recordPosition(CONSUMER_NAME, position);
    }
}
