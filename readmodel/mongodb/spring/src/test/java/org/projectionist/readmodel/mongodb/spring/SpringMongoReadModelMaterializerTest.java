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

package org.projectionist.readmodel.mongodb.spring;

import com.mongodb.ConnectionString;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.projectionist.consistency.ConsistencyWaiter;
import org.projectionist.consistency.WaitResult;
import org.projectionist.readmodel.api.MaterializationResult;
import org.projectionist.readmodel.api.ReadModelDocument;
import org.projectionist.tracking.api.TransientStoreFailureException;
import org.projectionist.tracking.mongodb.spring.SpringMongoTrackingStore;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertAll;

@Testcontainers(disabledWithoutDocker = true)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SpringMongoReadModelMaterializerTest {

    @Container
    private static final MongoDBContainer mongoDBContainer = new MongoDBContainer("mongo:4.2.8").withReuse(true);
    private static final String TRACKING_COLLECTION = "read_model_tracking";
    private static final Instant NOW = Instant.parse("2026-03-04T08:00:00Z");

    private MongoClient mongoClient;
    private MongoTemplate mongoTemplate;
    private SpringMongoTrackingStore trackingStore;
    private ConsistencyWaiter consistencyWaiter;
    private SpringMongoReadModelMaterializer materializer;

    @BeforeEach
    void create_materializer() {
        ConnectionString connectionString = new ConnectionString(mongoDBContainer.getReplicaSetUrl() + ".readmodels");
        mongoClient = MongoClients.create(connectionString);
        String database = requireNonNull(connectionString.getDatabase());
        mongoClient.getDatabase(database).drop();
        SimpleMongoClientDatabaseFactory databaseFactory = new SimpleMongoClientDatabaseFactory(mongoClient, database);
        mongoTemplate = new MongoTemplate(databaseFactory);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        trackingStore = new SpringMongoTrackingStore(mongoTemplate, TRACKING_COLLECTION, clock);
        consistencyWaiter = new ConsistencyWaiter(trackingStore, Duration.ofMinutes(1));
        materializer = new SpringMongoReadModelMaterializer(mongoTemplate, new MongoTransactionManager(databaseFactory), trackingStore, consistencyWaiter, clock);
        materializer.ensureIdentityIndex("page_read_models", "pageId");
    }

    @AfterEach
    void close_mongo_client() {
        consistencyWaiter.shutdown();
        mongoClient.close();
    }

    @Test
    void apply_upserts_the_document_and_records_the_position() {
        // When
        MaterializationResult result = materializer.apply("page_read_models", "pageId", "p1", Map.of("title", "A", "workflowStatuses.summarize", "RUNNING"), "pages", 1);

        // Then
        ReadModelDocument document = materializer.find("page_read_models", "pageId", "p1").orElseThrow();
        assertAll(
                () -> assertThat(result).isEqualTo(MaterializationResult.APPLIED),
                () -> assertThat(document.get("title")).isEqualTo("A"),
                () -> assertThat(document.get("workflowStatuses.summarize")).isEqualTo("RUNNING"),
                () -> assertThat(document.has("_id")).isFalse(),
                () -> assertThat(document.updatedAt()).isEqualTo(NOW),
                () -> assertThat(trackingStore.exists("pages", 1)).isTrue()
        );
    }

    @Test
    void dotted_paths_leave_sibling_entries_of_a_nested_document_intact() {
        // Given
        materializer.apply("page_read_models", "pageId", "p1", Map.of("workflowStatuses.summarize", "RUNNING"), "pages", 1);

        // When
        materializer.apply("page_read_models", "pageId", "p1", Map.of("workflowStatuses.classify", "DONE"), "pages", 2);

        // Then
        ReadModelDocument document = materializer.find("page_read_models", "pageId", "p1").orElseThrow();
        assertAll(
                () -> assertThat(document.get("workflowStatuses.summarize")).isEqualTo("RUNNING"),
                () -> assertThat(document.get("workflowStatuses.classify")).isEqualTo("DONE"),
                () -> assertThat(materializer.maxPosition("pages")).hasValue(2)
        );
    }

    @Test
    void redelivered_position_is_already_applied_and_leaves_the_document_untouched() {
        // Given
        materializer.apply("page_read_models", "pageId", "p1", Map.of("title", "A"), "pages", 1);

        // When
        MaterializationResult result = materializer.apply("page_read_models", "pageId", "p1", Map.of("title", "B"), "pages", 1);

        // Then
        assertAll(
                () -> assertThat(result).isEqualTo(MaterializationResult.ALREADY_APPLIED),
                () -> assertThat(materializer.find("page_read_models", "pageId", "p1").orElseThrow().get("title")).isEqualTo("A"),
                () -> assertThat(mongoTemplate.getCollection(TRACKING_COLLECTION).countDocuments()).isEqualTo(1)
        );
    }

    @Test
    void failing_document_write_rolls_back_the_tracking_record() {
        // Given
        Map<String, Object> conflictingPaths = new LinkedHashMap<>();
        conflictingPaths.put("workflowStatuses", new Document("summarize", "RUNNING"));
        conflictingPaths.put("workflowStatuses.classify", "DONE");

        // When
        Throwable throwable = catchThrowable(() -> materializer.apply("page_read_models", "pageId", "p1", conflictingPaths, "pages", 1));

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(TransientStoreFailureException.class),
                () -> assertThat(trackingStore.exists("pages", 1)).isFalse(),
                () -> assertThat(materializer.find("page_read_models", "pageId", "p1")).isEmpty()
        );
    }

    @Test
    void delete_removes_the_document_and_records_the_position() {
        // Given
        materializer.apply("page_read_models", "pageId", "p1", Map.of("title", "A"), "pages", 1);

        // When
        MaterializationResult result = materializer.delete("page_read_models", "pageId", "p1", "pages", 2);

        // Then
        assertAll(
                () -> assertThat(result).isEqualTo(MaterializationResult.APPLIED),
                () -> assertThat(materializer.find("page_read_models", "pageId", "p1")).isEmpty(),
                () -> assertThat(materializer.maxPosition("pages")).hasValue(2)
        );
    }

    @Test
    void record_position_only_writes_a_tracking_record() {
        // When
        MaterializationResult first = materializer.recordPosition("notifier", 3);
        MaterializationResult second = materializer.recordPosition("notifier", 3);

        // Then
        assertAll(
                () -> assertThat(first).isEqualTo(MaterializationResult.APPLIED),
                () -> assertThat(second).isEqualTo(MaterializationResult.ALREADY_APPLIED),
                () -> assertThat(materializer.maxPosition("notifier")).hasValue(3)
        );
    }

    @Test
    void waiting_caller_is_released_after_the_transaction_commits() {
        // Given
        CompletableFuture<WaitResult> waiting = CompletableFuture.supplyAsync(() -> consistencyWaiter.waitFor("pages", 1, Duration.ofSeconds(10)));
        await().until(consistencyWaiter::pendingRegistrations, is(1));

        // When
        materializer.apply("page_read_models", "pageId", "p1", Map.of("title", "A"), "pages", 1);

        // Then
        assertThat(waiting.join()).isEqualTo(WaitResult.REACHED);
    }
}
