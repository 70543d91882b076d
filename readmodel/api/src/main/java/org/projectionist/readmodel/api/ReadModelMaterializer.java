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

package org.projectionist.readmodel.api;

import org.jspecify.annotations.NullMarked;

import java.util.Map;
import java.util.OptionalLong;

/**
 * Materializes read model documents from events. Every operation writes a tracking record for
 * {@code (consumerName, position)} and the document change as one atomic unit, so each event is applied exactly once
 * per consumer even if it's delivered several times.
 * <p>
 * After a successful commit, implementations notify the {@code ConsistencyWaiter} they were created with so that
 * callers waiting for the position are released.
 * </p>
 */
@NullMarked
public interface ReadModelMaterializer {

    /**
     * The name of the field that holds the time of the last mutation of a document
     */
    String UPDATED_AT = "updatedAt";

    /**
     * Merge {@code fieldUpdates} into the document in {@code collection} whose {@code identityKey} field equals
     * {@code identityValue}. The document is created if it doesn't exist. Field names may be dotted paths
     * ({@code "workflowStatuses.summarize"}) that address a value inside a nested document.
     *
     * @param collection    The read model collection
     * @param identityKey   The name of the field identifying the document, for example {@code "pageId"}
     * @param identityValue The identity of the document, typically the id of the aggregate it mirrors
     * @param fieldUpdates  The fields to set
     * @param consumerName  The consumer that applies the event
     * @param position      The feed position of the event
     * @return {@link MaterializationResult#APPLIED}, or {@link MaterializationResult#ALREADY_APPLIED} if the consumer
     * has already committed {@code position}, in which case the document is left untouched.
     * @throws org.projectionist.tracking.api.TransientStoreFailureException If the store failed. Neither the tracking record
     *                                                                       nor the document change were committed.
     */
    MaterializationResult apply(String collection, String identityKey, String identityValue, Map<String, ?> fieldUpdates, String consumerName, long position);

    /**
     * Delete the document in {@code collection} whose {@code identityKey} field equals {@code identityValue}, together
     * with recording {@code position} for {@code consumerName}. Deleting a document that doesn't exist still records
     * the position.
     *
     * @return {@link MaterializationResult#APPLIED} or {@link MaterializationResult#ALREADY_APPLIED}
     * @see #apply(String, String, String, Map, String, long)
     */
    MaterializationResult delete(String collection, String identityKey, String identityValue, String consumerName, long position);

    /**
     * Record that {@code consumerName} has processed {@code position} without changing any document. Use this from
     * consumers that react to events with side effects rather than by maintaining a document.
     *
     * @return {@link MaterializationResult#APPLIED} or {@link MaterializationResult#ALREADY_APPLIED}
     */
    MaterializationResult recordPosition(String consumerName, long position);

    /**
     * @return The checkpoint of the consumer, i.e. the highest position it has committed.
     */
    OptionalLong maxPosition(String consumerName);
}
