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

package org.projectionist.readmodel.inmemory;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.projectionist.consistency.ConsistencyWaiter;
import org.projectionist.readmodel.api.FieldPaths;
import org.projectionist.readmodel.api.MaterializationResult;
import org.projectionist.readmodel.api.ReadModelDocument;
import org.projectionist.readmodel.api.ReadModelMaterializer;
import org.projectionist.readmodel.api.ReadModelReader;
import org.projectionist.tracking.api.InsertResult;
import org.projectionist.tracking.inmemory.InMemoryTrackingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * An in-memory {@link ReadModelMaterializer}, useful for tests and for applications that rebuild their read models
 * on startup. A single lock serializes all operations. If the document change fails no tracking record is written,
 * so the event can be retried.
 */
@NullMarked
public class InMemoryReadModelMaterializer implements ReadModelMaterializer, ReadModelReader {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReadModelMaterializer.class);

    // collection -> identity value -> document
    private final ConcurrentMap<String, ConcurrentMap<String, ReadModelDocument>> collections = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final InMemoryTrackingStore trackingStore;
    private final ConsistencyWaiter consistencyWaiter;
    private final Clock clock;

    public InMemoryReadModelMaterializer(InMemoryTrackingStore trackingStore, ConsistencyWaiter consistencyWaiter) {
        this(trackingStore, consistencyWaiter, Clock.systemUTC());
    }

    public InMemoryReadModelMaterializer(InMemoryTrackingStore trackingStore, ConsistencyWaiter consistencyWaiter, Clock clock) {
        requireNonNull(trackingStore, InMemoryTrackingStore.class.getSimpleName() + " cannot be null");
        requireNonNull(consistencyWaiter, ConsistencyWaiter.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.trackingStore = trackingStore;
        this.consistencyWaiter = consistencyWaiter;
        this.clock = clock;
    }

    @Override
    public MaterializationResult apply(String collection, String identityKey, String identityValue, Map<String, ?> fieldUpdates, String consumerName, long position) {
        requireNonNull(collection, "collection cannot be null");
        requireNonNull(identityKey, "identityKey cannot be null");
        requireNonNull(identityValue, "identityValue cannot be null");
        requireNonNull(fieldUpdates, "fieldUpdates cannot be null");
        return materialize(consumerName, position, () -> upsert(collection, identityKey, identityValue, fieldUpdates));
    }

    @Override
    public MaterializationResult delete(String collection, String identityKey, String identityValue, String consumerName, long position) {
        requireNonNull(collection, "collection cannot be null");
        requireNonNull(identityKey, "identityKey cannot be null");
        requireNonNull(identityValue, "identityValue cannot be null");
        return materialize(consumerName, position, () -> remove(collection, identityValue));
    }

    @Override
    public MaterializationResult recordPosition(String consumerName, long position) {
        return materialize(consumerName, position, () -> () -> {
        });
    }

    @Override
    public OptionalLong maxPosition(String consumerName) {
        return trackingStore.maxPosition(consumerName);
    }

    @Override
    public Optional<ReadModelDocument> find(String collection, String identityKey, String identityValue) {
        requireNonNull(collection, "collection cannot be null");
        requireNonNull(identityKey, "identityKey cannot be null");
        requireNonNull(identityValue, "identityValue cannot be null");
        ConcurrentMap<String, ReadModelDocument> documents = collections.get(collection);
        if (documents == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(documents.get(identityValue)).filter(document -> document.identityKey().equals(identityKey));
    }

    /**
     * @return The number of documents in {@code collection}
     */
    public int count(String collection) {
        ConcurrentMap<String, ReadModelDocument> documents = collections.get(collection);
        return documents == null ? 0 : documents.size();
    }

    /**
     * Remove all documents in {@code collection} and all tracking records of {@code consumerName}, so that the consumer
     * rebuilds the collection from the start of the feed when it's resumed.
     */
    public void reset(String collection, String consumerName) {
        lock.lock();
        try {
            collections.remove(collection);
            trackingStore.deleteAll(consumerName);
        } finally {
            lock.unlock();
        }
    }

    // Package-private so that tests can simulate a failing document write. Returns an action that restores the previous state.
    Runnable upsert(String collection, String identityKey, String identityValue, Map<String, ?> fieldUpdates) {
        ConcurrentMap<String, ReadModelDocument> documents = collections.computeIfAbsent(collection, __ -> new ConcurrentHashMap<>());
        ReadModelDocument existing = documents.get(identityValue);
        Map<String, Object> fields = existing == null ? new LinkedHashMap<>() : new LinkedHashMap<>(existing.fields());
        fieldUpdates.forEach((path, value) -> FieldPaths.set(fields, path, value));
        fields.put(identityKey, identityValue);
        Instant now = clock.instant();
        fields.put(UPDATED_AT, now);
        documents.put(identityValue, new ReadModelDocument(identityKey, identityValue, fields, now));
        return () -> restore(documents, identityValue, existing);
    }

    Runnable remove(String collection, String identityValue) {
        ConcurrentMap<String, ReadModelDocument> documents = collections.get(collection);
        if (documents == null) {
            return () -> {
            };
        }
        ReadModelDocument existing = documents.remove(identityValue);
        return () -> restore(documents, identityValue, existing);
    }

    private static void restore(ConcurrentMap<String, ReadModelDocument> documents, String identityValue, @Nullable ReadModelDocument previous) {
        if (previous == null) {
            documents.remove(identityValue);
        } else {
            documents.put(identityValue, previous);
        }
    }

    // Document first, tracking record second: a committed position always has its document visible
    private MaterializationResult materialize(String consumerName, long position, Supplier<Runnable> mutation) {
        requireNonNull(consumerName, "consumerName cannot be null");
        lock.lock();
        try {
            if (trackingStore.exists(consumerName, position)) {
                log.debug("Position {} has already been applied by consumer {}", position, consumerName);
                return MaterializationResult.ALREADY_APPLIED;
            }
            Runnable undo = mutation.get();
            if (trackingStore.insert(consumerName, position) == InsertResult.ALREADY_EXISTS) {
                undo.run();
                log.debug("Position {} has already been applied by consumer {}", position, consumerName);
                return MaterializationResult.ALREADY_APPLIED;
            }
        } finally {
            lock.unlock();
        }
        consistencyWaiter.signal(consumerName, position);
        return MaterializationResult.APPLIED;
    }
}
