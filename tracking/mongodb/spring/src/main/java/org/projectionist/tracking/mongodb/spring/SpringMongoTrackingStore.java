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

import org.bson.Document;
import org.jspecify.annotations.NullMarked;
import org.projectionist.tracking.api.InsertResult;
import org.projectionist.tracking.api.TrackingStore;
import org.projectionist.tracking.api.TransientStoreFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Clock;
import java.util.Date;
import java.util.OptionalLong;

import static java.util.Objects.requireNonNull;
import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * A Spring implementation of {@link TrackingStore} that stores tracking records in a MongoDB collection. A unique
 * compound index on {@code (consumerName, position)} is created when the store is instantiated, so that duplicate
 * inserts are rejected by MongoDB itself.
 * <p>
 * All operations go through the supplied {@link MongoOperations}, which means that they take part in an ongoing
 * Spring-managed MongoDB transaction (see {@code MongoTransactionManager}) when there is one.
 * </p>
 */
@NullMarked
public class SpringMongoTrackingStore implements TrackingStore {
    private static final Logger log = LoggerFactory.getLogger(SpringMongoTrackingStore.class);

    public static final String CONSUMER_NAME = "consumerName";
    public static final String POSITION = "position";
    public static final String RECORDED_AT = "recordedAt";

    private final MongoOperations mongoOperations;
    private final String trackingCollection;
    private final Clock clock;

    /**
     * Create a {@link TrackingStore} that uses Spring's {@link MongoOperations} to persist tracking records in MongoDB.
     *
     * @param mongoOperations    The {@link MongoOperations} that'll be used to store the tracking records
     * @param trackingCollection The collection into which tracking records will be stored
     */
    public SpringMongoTrackingStore(MongoOperations mongoOperations, String trackingCollection) {
        this(mongoOperations, trackingCollection, Clock.systemUTC());
    }

    /**
     * Create a {@link TrackingStore} that uses Spring's {@link MongoOperations} to persist tracking records in MongoDB.
     *
     * @param mongoOperations    The {@link MongoOperations} that'll be used to store the tracking records
     * @param trackingCollection The collection into which tracking records will be stored
     * @param clock              The clock used to stamp the {@value #RECORDED_AT} field
     */
    public SpringMongoTrackingStore(MongoOperations mongoOperations, String trackingCollection, Clock clock) {
        requireNonNull(mongoOperations, "Mongo operations cannot be null");
        requireNonNull(trackingCollection, "trackingCollection cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.mongoOperations = mongoOperations;
        this.trackingCollection = trackingCollection;
        this.clock = clock;
        createIndexes();
    }

    @Override
    public OptionalLong maxPosition(String consumerName) {
        requireNonNull(consumerName, "consumerName cannot be null");
        Query query = query(where(CONSUMER_NAME).is(consumerName)).with(Sort.by(Sort.Direction.DESC, POSITION)).limit(1);
        query.fields().include(POSITION);
        final Document document;
        try {
            document = mongoOperations.findOne(query, Document.class, trackingCollection);
        } catch (DataAccessException e) {
            throw new TransientStoreFailureException("Failed to read max position of consumer " + consumerName, e);
        }
        if (document == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(document.get(POSITION, Number.class).longValue());
    }

    @Override
    public InsertResult insert(String consumerName, long position) {
        requireNonNull(consumerName, "consumerName cannot be null");
        Document document = new Document()
                .append(CONSUMER_NAME, consumerName)
                .append(POSITION, position)
                .append(RECORDED_AT, Date.from(clock.instant()));
        try {
            mongoOperations.insert(document, trackingCollection);
            return InsertResult.INSERTED;
        } catch (DuplicateKeyException e) {
            log.debug("Tracking record for consumer {} at position {} already exists", consumerName, position);
            return InsertResult.ALREADY_EXISTS;
        } catch (DataAccessException e) {
            throw new TransientStoreFailureException("Failed to insert tracking record for consumer " + consumerName + " at position " + position, e);
        }
    }

    @Override
    public boolean exists(String consumerName, long position) {
        requireNonNull(consumerName, "consumerName cannot be null");
        try {
            return mongoOperations.exists(byConsumerAndPosition(consumerName, position), trackingCollection);
        } catch (DataAccessException e) {
            throw new TransientStoreFailureException("Failed to check tracking record for consumer " + consumerName + " at position " + position, e);
        }
    }

    @Override
    public void deleteAll(String consumerName) {
        requireNonNull(consumerName, "consumerName cannot be null");
        try {
            mongoOperations.remove(query(where(CONSUMER_NAME).is(consumerName)), trackingCollection);
        } catch (DataAccessException e) {
            throw new TransientStoreFailureException("Failed to delete tracking records of consumer " + consumerName, e);
        }
    }

    /**
     * @return The name of the collection where tracking records are stored
     */
    public String trackingCollection() {
        return trackingCollection;
    }

    private static Query byConsumerAndPosition(String consumerName, long position) {
        return query(where(CONSUMER_NAME).is(consumerName).and(POSITION).is(position));
    }

    private void createIndexes() {
        try {
            mongoOperations.indexOps(trackingCollection).ensureIndex(new Index()
                    .on(CONSUMER_NAME, Sort.Direction.ASC)
                    .on(POSITION, Sort.Direction.ASC)
                    .unique()
                    .named(CONSUMER_NAME + "_" + POSITION));
        } catch (DataAccessException e) {
            log.warn("Failed to create unique tracking index on collection {}, duplicate inserts will not be detected until it exists", trackingCollection, e);
        }
    }
}
