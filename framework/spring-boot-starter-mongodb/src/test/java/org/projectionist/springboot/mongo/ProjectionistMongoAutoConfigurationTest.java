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

package org.projectionist.springboot.mongo;

import org.junit.jupiter.api.Test;
import org.projectionist.consistency.ConsistencyWaiter;
import org.projectionist.readmodel.api.MaterializationResult;
import org.projectionist.readmodel.mongodb.spring.SpringMongoReadModelMaterializer;
import org.projectionist.tracking.mongodb.spring.SpringMongoTrackingStore;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class ProjectionistMongoAutoConfigurationTest {

    @Container
    private static final MongoDBContainer mongoDBContainer = new MongoDBContainer("mongo:4.2.8").withReuse(true);

    private ApplicationContextRunner contextRunner() {
        return new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(MongoAutoConfiguration.class, MongoDataAutoConfiguration.class, ProjectionistMongoAutoConfiguration.class))
                .withPropertyValues("spring.data.mongodb.uri=" + mongoDBContainer.getReplicaSetUrl() + ".starter");
    }

    @Test
    void mongo_tracking_store_materializer_and_transaction_manager_are_created() {
        contextRunner().run(context -> {
            assertThat(context).hasSingleBean(MongoTransactionManager.class);
            assertThat(context).hasSingleBean(SpringMongoTrackingStore.class);
            assertThat(context).hasSingleBean(SpringMongoReadModelMaterializer.class);
            assertThat(context).hasSingleBean(ConsistencyWaiter.class);
            assertThat(context).hasSingleBean(ConsistentReadModelReader.class);
            assertThat(context).doesNotHaveBean(EventSubscriptionLoopFactory.class);
        });
    }

    @Test
    void tracking_collection_is_configurable() {
        contextRunner().withPropertyValues("projectionist.tracking.collection=tracking_records").run(context ->
                assertThat(context.getBean(SpringMongoTrackingStore.class).trackingCollection()).isEqualTo("tracking_records"));
    }

    @Test
    void auto_configured_materializer_applies_documents_transactionally() {
        contextRunner().run(context -> {
            // Given
            SpringMongoReadModelMaterializer materializer = context.getBean(SpringMongoReadModelMaterializer.class);
            String pageId = "page-" + System.nanoTime();

            // When
            MaterializationResult first = materializer.apply("page_read_models", "pageId", pageId, Map.of("title", "A"), pageId, 1);
            MaterializationResult second = materializer.apply("page_read_models", "pageId", pageId, Map.of("title", "B"), pageId, 1);

            // Then
            assertThat(first).isEqualTo(MaterializationResult.APPLIED);
            assertThat(second).isEqualTo(MaterializationResult.ALREADY_APPLIED);
            assertThat(context.getBean(ConsistentReadModelReader.class).findAfter(pageId, 1, "page_read_models", "pageId", pageId).orElseThrow().get("title")).isEqualTo("A");
        });
    }
}
