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

import org.bson.Document;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.projectionist.consistency.ConsistencyWaiter;
import org.projectionist.readmodel.api.MaterializationResult;
import org.projectionist.readmodel.api.ReadModelDocument;
import org.projectionist.readmodel.api.ReadModelMaterializer;
import org.projectionist.readmodel.api.ReadModelReader;
import org.projectionist.tracking.api.InsertResult;
import org.projectionist.tracking.api.TransientStoreFailureException;
import org.projectionist.tracking.mongodb.spring.SpringMongoTrackingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;
import static org.springframework.data.mongodb.SessionSynchronization.ALWAYS;
import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * A {@link ReadModelMaterializer} that stores read model documents in MongoDB. The tracking record and the document
 * change of each operation are written in the same MongoDB transaction, which requires MongoDB to run as a replica set.
 * <p>
 * The {@link SpringMongoTrackingStore} must be created with the same {@link MongoTemplate} instance as this
 * materializer, and the {@link PlatformTransactionManager} must be a {@code MongoTransactionManager} on the same
 * {@code MongoDatabaseFactory}, otherwise the tracking record will not take part in the transaction.
 * </p>
 */
@NullMarked
public class SpringMongoReadModelMaterializer implements ReadModelMaterializer, ReadModelReader {
    private static final Logger log = LoggerFactory.getLogger(SpringMongoReadModelMaterializer.class);

    private static final String ID = "_id";

    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SpringMongoTrackingStore trackingStore;
    private final ConsistencyWaiter consistencyWaiter;
    private final Clock clock;
    private final Set<String> knownCollections = ConcurrentHashMap.newKeySet();

    public SpringMongoReadModelMaterializer(MongoTemplate mongoTemplate, PlatformTransactionManager transactionManager,
                                            SpringMongoTrackingStore trackingStore, ConsistencyWaiter consistencyWaiter) {
        this(mongoTemplate, transactionManager, trackingStore, consistencyWaiter, Clock.systemUTC());
    }

    public SpringMongoReadModelMaterializer(MongoTemplate mongoTemplate, PlatformTransactionManager transactionManager,
                                            SpringMongoTrackingStore trackingStore, ConsistencyWaiter consistencyWaiter, Clock clock) {
        requireNonNull(mongoTemplate, MongoTemplate.class.getSimpleName() + " cannot be null");
        requireNonNull(transactionManager, PlatformTransactionManager.class.getSimpleName() + " cannot be null");
        requireNonNull(trackingStore, SpringMongoTrackingStore.class.getSimpleName() + " cannot be null");
        requireNonNull(consistencyWaiter, ConsistencyWaiter.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.mongoTemplate = mongoTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.trackingStore = trackingStore;
        this.consistencyWaiter = consistencyWaiter;
        this.clock = clock;
        // SessionSynchronization need to be "ALWAYS" in order for TransactionTemplate to work with mongo template
        this.mongoTemplate.setSessionSynchronization(ALWAYS);
        ensureCollectionExists(trackingStore.trackingCollection());
    }

    @Override
    public MaterializationResult apply(String collection, String identityKey, String identityValue, Map<String, ?> fieldUpdates, String consumerName, long position) {
        requireNonNull(collection, "collection cannot be null");
        requireNonNull(identityKey, "identityKey cannot be null");
        requireNonNull(identityValue, "identityValue cannot be null");
        requireNonNull(fieldUpdates, "fieldUpdates cannot be null");
        ensureCollectionExists(collection);
        return materialize(consumerName, position, () -> {
            Update update = new Update();
            fieldUpdates.forEach(update::set);
            update.set(identityKey, identityValue);
            update.set(UPDATED_AT, Date.from(clock.instant()));
            mongoTemplate.upsert(byIdentity(identityKey, identityValue), update, collection);
        });
    }

    @Override
    public MaterializationResult delete(String collection, String identityKey, String identityValue, String consumerName, long position) {
        requireNonNull(collection, "collection cannot be null");
        requireNonNull(identityKey, "identityKey cannot be null");
        requireNonNull(identityValue, "identityValue cannot be null");
        ensureCollectionExists(collection);
        return materialize(consumerName, position, () -> mongoTemplate.remove(byIdentity(identityKey, identityValue), collection));
    }

    @Override
    public MaterializationResult recordPosition(String consumerName, long position) {
        return materialize(consumerName, position, () -> {
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
        final Document document;
        try {
            document = mongoTemplate.findOne(byIdentity(identityKey, identityValue), Document.class, collection);
        } catch (DataAccessException e) {
            throw new TransientStoreFailureException("Failed to find " + identityKey + "=" + identityValue + " in " + collection, e);
        }
        return Optional.ofNullable(document).map(d -> toReadModelDocument(identityKey, identityValue, d));
    }

    /**
     * Create a unique index on {@code identityKey} in {@code collection}. Applications should call this once per
     * read model collection so that lookups by identity are fast and two documents with the same identity can't
     * be created by concurrent upserts.
     */
    public void ensureIdentityIndex(String collection, String identityKey) {
        requireNonNull(collection, "collection cannot be null");
        requireNonNull(identityKey, "identityKey cannot be null");
        ensureCollectionExists(collection);
        try {
            mongoTemplate.indexOps(collection).ensureIndex(new Index().on(identityKey, Sort.Direction.ASC).unique().named(identityKey));
        } catch (DataAccessException e) {
            throw new TransientStoreFailureException("Failed to create identity index " + identityKey + " on " + collection, e);
        }
    }

    private MaterializationResult materialize(String consumerName, long position, Runnable mutation) {
        requireNonNull(consumerName, "consumerName cannot be null");
        MaterializationResult result = inTransaction(() -> transactionTemplate.execute(status -> {
            if (trackingStore.exists(consumerName, position) || trackingStore.insert(consumerName, position) == InsertResult.ALREADY_EXISTS) {
                status.setRollbackOnly();
                return MaterializationResult.ALREADY_APPLIED;
            }
            mutation.run();
            return MaterializationResult.APPLIED;
        }), consumerName, position);

        if (result == MaterializationResult.APPLIED) {
            consistencyWaiter.signal(consumerName, position);
        } else {
            log.debug("Position {} has already been applied by consumer {}", position, consumerName);
        }
        return result;
    }

    private MaterializationResult inTransaction(Supplier<@Nullable MaterializationResult> supplier, String consumerName, long position) {
        final MaterializationResult result;
        try {
            result = supplier.get();
        } catch (DataAccessException | TransactionException e) {
            throw new TransientStoreFailureException("Failed to materialize position " + position + " of consumer " + consumerName, e);
        }
        return requireNonNull(result, "Transaction returned no result");
    }

    // MongoDB 4.2 cannot create collections inside a multi-document transaction
    private void ensureCollectionExists(String collection) {
        if (knownCollections.contains(collection)) {
            return;
        }
        try {
            if (!mongoTemplate.collectionExists(collection)) {
                mongoTemplate.createCollection(collection);
            }
        } catch (DataAccessException e) {
            // Another instance may have created it concurrently
            if (!mongoTemplate.collectionExists(collection)) {
                throw new TransientStoreFailureException("Failed to create collection " + collection, e);
            }
        }
        knownCollections.add(collection);
    }

    private static Query byIdentity(String identityKey, String identityValue) {
        return query(where(identityKey).is(identityValue));
    }

    private static ReadModelDocument toReadModelDocument(String identityKey, String identityValue, Document document) {
        Map<String, Object> fields = new LinkedHashMap<>(document);
        fields.remove(ID);
        Object updatedAt = fields.get(UPDATED_AT);
        Instant instant = updatedAt instanceof Date ? ((Date) updatedAt).toInstant() : Instant.EPOCH;
        if (updatedAt instanceof Date) {
            fields.put(UPDATED_AT, instant);
        }
        return new ReadModelDocument(identityKey, identityValue, fields, instant);
    }
}
