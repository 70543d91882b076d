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

import org.projectionist.readmodel.api.ReadModelMaterializer;
import org.projectionist.readmodel.mongodb.spring.SpringMongoReadModelMaterializer;
import org.projectionist.springboot.mongo.ConsistentReadModelReader;
import org.projectionist.springboot.mongo.EventSubscriptionLoopFactory;
import org.projectionist.subscription.core.EventSubscriptionLoop;
import org.projectionist.subscription.inmemory.InMemoryEventFeed;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Bootstrap the application. Events are read from an in-memory feed, read models and tracking records are stored in
 * MongoDB.
 */
@SpringBootApplication
public class PageReadModelsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PageReadModelsApplication.class, args);
    }

    @Bean
    public InMemoryEventFeed eventFeed() {
        return new InMemoryEventFeed();
    }

    @Bean
    public WorkflowStarter workflowStarter() {
        return new LoggingWorkflowStarter();
    }

    @Bean
    public PageProjector pageProjector(ReadModelMaterializer materializer, ObjectProvider<SpringMongoReadModelMaterializer> mongoMaterializer) {
        mongoMaterializer.ifAvailable(mongo -> mongo.ensureIdentityIndex(PageProjector.COLLECTION, PageProjector.PAGE_ID));
        return new PageProjector(materializer);
    }

    @Bean
    public ArtifactProjector artifactProjector(ReadModelMaterializer materializer, ObjectProvider<SpringMongoReadModelMaterializer> mongoMaterializer) {
        mongoMaterializer.ifAvailable(mongo -> mongo.ensureIdentityIndex(ArtifactProjector.COLLECTION, ArtifactProjector.ARTIFACT_ID));
        return new ArtifactProjector(materializer);
    }

    @Bean
    public BlobUploadedPolicy blobUploadedPolicy(ReadModelMaterializer materializer, WorkflowStarter workflowStarter) {
        return new BlobUploadedPolicy(materializer, workflowStarter);
    }

    @Bean
    public EventSubscriptionLoop pageReadModelsLoop(EventSubscriptionLoopFactory loops, PageProjector pageProjector) {
        return loops.create(PageProjector.CONSUMER_NAME, pageProjector.projector());
    }

    @Bean
    public EventSubscriptionLoop artifactReadModelsLoop(EventSubscriptionLoopFactory loops, ArtifactProjector artifactProjector) {
        return loops.create(ArtifactProjector.CONSUMER_NAME, artifactProjector.projector());
    }

    @Bean
    public EventSubscriptionLoop blobPoliciesLoop(EventSubscriptionLoopFactory loops, BlobUploadedPolicy blobUploadedPolicy) {
        return loops.create(BlobUploadedPolicy.CONSUMER_NAME, blobUploadedPolicy.projector());
    }

    @Bean
    public PageQueries pageQueries(ConsistentReadModelReader reader) {
        return new PageQueries(reader);
    }
}
