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

package org.projectionist.tracking.api;

import org.jspecify.annotations.NullMarked;

import java.util.OptionalLong;

/**
 * A {@code TrackingStore} is the durable ledger of positions that a consumer has processed. Each entry is a
 * {@link TrackingRecord} and the pair {@code (consumerName, position)} is unique. Uniqueness must be enforced by the
 * underlying storage (for example a unique index) and not only by a check before the insert, since two writers may
 * otherwise both pass the check.
 * <p>
 * Implementations are expected to take part in the transaction of the caller when there is one, so that a tracking
 * record and a read model mutation can be committed (or rolled back) together.
 * </p>
 */
@NullMarked
public interface TrackingStore {

    /**
     * Find the highest position that has been committed for the supplied consumer. This is the position that a
     * subscription resumes from after a restart.
     * <p>
     * Note that this is the numeric maximum, not the highest position without any missing predecessor. If a position
     * was skipped because it failed, and a later position was committed, the skipped position will not be redelivered
     * on restart.
     * </p>
     *
     * @param consumerName The name of the consumer
     * @return The highest committed position, or {@link OptionalLong#empty()} if nothing has been committed yet.
     * @throws TransientStoreFailureException If the store cannot be reached
     */
    OptionalLong maxPosition(String consumerName);

    /**
     * Insert a tracking record for the supplied consumer and position.
     *
     * @param consumerName The name of the consumer
     * @param position     The position of the event that has been processed
     * @return {@link InsertResult#INSERTED} if the record was inserted, {@link InsertResult#ALREADY_EXISTS} if a record
     * for the same consumer and position is already present. A unique key violation is never reported as an exception.
     * @throws TransientStoreFailureException If the store cannot be reached
     */
    InsertResult insert(String consumerName, long position);

    /**
     * Check if a tracking record exists for the supplied consumer and position.
     */
    boolean exists(String consumerName, long position);

    /**
     * Remove all tracking records for a consumer, which makes its subscription start from the beginning of the feed
     * the next time it's started. Use this when a projection needs to be rebuilt.
     *
     * @param consumerName The name of the consumer to reset
     */
    void deleteAll(String consumerName);
}
