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

package org.projectionist.tracking.inmemory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.projectionist.tracking.api.InsertResult;
import org.projectionist.tracking.api.TrackingRecord;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemoryTrackingStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-02T10:15:30Z");

    private InMemoryTrackingStore trackingStore;

    @BeforeEach
    void create_tracking_store() {
        trackingStore = new InMemoryTrackingStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    class MaxPosition {

        @Test
        void is_empty_when_nothing_has_been_committed_for_the_consumer() {
            assertThat(trackingStore.maxPosition("pages")).isEmpty();
        }

        @Test
        void is_the_numeric_maximum_of_all_committed_positions() {
            // Given
            trackingStore.insert("pages", 1);
            trackingStore.insert("pages", 5);
            trackingStore.insert("pages", 3);

            // When
            long maxPosition = trackingStore.maxPosition("pages").orElseThrow();

            // Then
            assertThat(maxPosition).isEqualTo(5);
        }

        @Test
        void is_tracked_per_consumer() {
            // Given
            trackingStore.insert("pages", 7);
            trackingStore.insert("policies", 2);

            // Then
            assertAll(
                    () -> assertThat(trackingStore.maxPosition("pages")).hasValue(7),
                    () -> assertThat(trackingStore.maxPosition("policies")).hasValue(2)
            );
        }
    }

    @Nested
    class Insert {

        @Test
        void returns_already_exists_when_the_position_has_been_inserted_before() {
            // Given
            InsertResult first = trackingStore.insert("pages", 1);

            // When
            InsertResult second = trackingStore.insert("pages", 1);

            // Then
            assertAll(
                    () -> assertThat(first).isEqualTo(InsertResult.INSERTED),
                    () -> assertThat(second).isEqualTo(InsertResult.ALREADY_EXISTS),
                    () -> assertThat(trackingStore.records("pages")).containsExactly(new TrackingRecord("pages", 1, NOW))
            );
        }

        @Test
        void the_same_position_can_be_inserted_by_different_consumers() {
            assertAll(
                    () -> assertThat(trackingStore.insert("pages", 1)).isEqualTo(InsertResult.INSERTED),
                    () -> assertThat(trackingStore.insert("policies", 1)).isEqualTo(InsertResult.INSERTED)
            );
        }

        @Test
        void only_one_of_many_concurrent_inserts_of_the_same_position_succeeds() throws Exception {
            // Given
            int numberOfWriters = 16;
            ExecutorService executor = Executors.newFixedThreadPool(numberOfWriters);
            CountDownLatch go = new CountDownLatch(1);
            List<Callable<InsertResult>> writers = IntStream.range(0, numberOfWriters)
                    .mapToObj(__ -> (Callable<InsertResult>) () -> {
                        go.await();
                        return trackingStore.insert("pages", 42);
                    })
                    .collect(Collectors.toList());

            // When
            List<Future<InsertResult>> futures = writers.stream().map(executor::submit).collect(Collectors.toList());
            go.countDown();
            List<InsertResult> results = futures.stream().map(f -> {
                try {
                    return f.get(5, SECONDS);
                } catch (Exception e) {
                    throw new RuntimeException(e);
                }
            }).collect(Collectors.toList());
            executor.shutdownNow();

            // Then
            assertThat(results).filteredOn(InsertResult.INSERTED::equals).hasSize(1);
        }
    }

    @Test
    void delete_all_resets_the_consumer() {
        // Given
        trackingStore.insert("pages", 1);
        trackingStore.insert("policies", 1);

        // When
        trackingStore.deleteAll("pages");

        // Then
        assertAll(
                () -> assertThat(trackingStore.maxPosition("pages")).isEmpty(),
                () -> assertThat(trackingStore.maxPosition("policies")).hasValue(1)
        );
    }
}
