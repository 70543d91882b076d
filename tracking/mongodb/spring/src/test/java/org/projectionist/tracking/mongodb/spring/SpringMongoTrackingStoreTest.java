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

package org.projectionist.tracking.mongodb.spring;

import com.mongodb.ConnectionString;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.projectionist.tracking.api.InsertResult;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;

import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

@Testcontainers(disabledWithoutDocker = true)
class SpringMongoTrackingStoreTest {

    @Container
    private static final MongoDBContainer mongoDBContainer = new MongoDBContainer("mongo:4.2.8").withReuse(true);
    private static final String TRACKING_COLLECTION = "read_model_tracking";
    private static final Instant NOW = Instant.parse("2026-03-04T08:00:00Z");

    private MongoClient mongoClient;
    private MongoTemplate mongoTemplate;
    private MongoTransactionManager transactionManager;
    private SpringMongoTrackingStore trackingStore;

    @BeforeEach
    void create_tracking_store() {
        ConnectionString connectionString = new ConnectionString(mongoDBContainer.getReplicaSetUrl() + ".tracking");
        mongoClient = MongoClients.create(connectionString);
        String database = requireNonNull(connectionString.getDatabase());
        mongoClient.getDatabase(database).drop();
        SimpleMongoClientDatabaseFactory databaseFactory = new SimpleMongoClientDatabaseFactory(mongoClient, database);
        mongoTemplate = new MongoTemplate(databaseFactory);
        transactionManager = new MongoTransactionManager(databaseFactory);
        trackingStore = new SpringMongoTrackingStore(mongoTemplate, TRACKING_COLLECTION, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void close_mongo_client() {
        mongoClient.close();
    }

    @Test
    void max_position_is_empty_when_nothing_is_committed() {
        assertThat(trackingStore.maxPosition("pages")).isEmpty();
    }

    @Test
    void max_position_returns_the_highest_committed_position_of_the_consumer() {
        // Given
        trackingStore.insert("pages", 1);
        trackingStore.insert("pages", 3);
        trackingStore.insert("pages", 2);
        trackingStore.insert("policies", 10);

        // Then
        assertAll(
                () -> assertThat(trackingStore.maxPosition("pages")).hasValue(3),
                () -> assertThat(trackingStore.maxPosition("policies")).hasValue(10)
        );
    }

    @Test
    void duplicate_insert_is_rejected_by_the_unique_index_and_reported_as_already_exists() {
        // Given
        trackingStore.insert("pages", 1);

        // When
        InsertResult result = trackingStore.insert("pages", 1);

        // Then
        assertAll(
                () -> assertThat(result).isEqualTo(InsertResult.ALREADY_EXISTS),
                () -> assertThat(mongoTemplate.findAll(Document.class, TRACKING_COLLECTION)).hasSize(1)
        );
    }

    @Test
    void tracking_record_contains_consumer_position_and_recorded_at() {
        // When
        trackingStore.insert("pages", 5);

        // Then
        List<Document> documents = mongoTemplate.findAll(Document.class, TRACKING_COLLECTION);
        assertThat(documents).singleElement().satisfies(document -> assertAll(
                () -> assertThat(document.getString(SpringMongoTrackingStore.CONSUMER_NAME)).isEqualTo("pages"),
                () -> assertThat(document.get(SpringMongoTrackingStore.POSITION, Number.class).longValue()).isEqualTo(5L),
                () -> assertThat(document.get(SpringMongoTrackingStore.RECORDED_AT, Date.class)).isEqualTo(Date.from(NOW))
        ));
    }

    @Test
    void insert_takes_part_in_an_ongoing_transaction() {
        // Given
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);

        // When
        transactionTemplate.executeWithoutResult(status -> {
            trackingStore.insert("pages", 1);
            status.setRollbackOnly();
        });

        // Then
        assertAll(
                () -> assertThat(trackingStore.exists("pages", 1)).isFalse(),
                () -> assertThat(trackingStore.maxPosition("pages")).isEmpty()
        );
    }

    @Test
    void delete_all_removes_only_the_records_of_the_consumer() {
        // Given
        trackingStore.insert("pages", 1);
        trackingStore.insert("policies", 1);

        // When
        trackingStore.deleteAll("pages");

        // Then
        assertAll(
                () -> assertThat(trackingStore.exists("pages", 1)).isFalse(),
                () -> assertThat(trackingStore.exists("policies", 1)).isTrue()
        );
    }
}
