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

import org.jspecify.annotations.NullMarked;
import org.projectionist.consistency.ConsistencyTimeoutException;
import org.projectionist.consistency.ConsistencyWaiter;
import org.projectionist.readmodel.api.ReadModelDocument;
import org.projectionist.readmodel.api.ReadModelReader;

import java.time.Duration;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A {@link ReadModelReader} that can wait for a consumer to reach a position before it reads, so that a caller that
 * just appended an event reads a document that reflects it.
 */
@NullMarked
public class ConsistentReadModelReader implements ReadModelReader {
    private final ReadModelReader delegate;
    private final ConsistencyWaiter consistencyWaiter;
    private final Duration defaultTimeout;

    public ConsistentReadModelReader(ReadModelReader delegate, ConsistencyWaiter consistencyWaiter, Duration defaultTimeout) {
        requireNonNull(delegate, ReadModelReader.class.getSimpleName() + " cannot be null");
        requireNonNull(consistencyWaiter, ConsistencyWaiter.class.getSimpleName() + " cannot be null");
        requireNonNull(defaultTimeout, "defaultTimeout cannot be null");
        this.delegate = delegate;
        this.consistencyWaiter = consistencyWaiter;
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public Optional<ReadModelDocument> find(String collection, String identityKey, String identityValue) {
        return delegate.find(collection, identityKey, identityValue);
    }

    /**
     * Wait, for at most the configured default timeout, until {@code consumerName} has committed {@code position} and
     * then find the document.
     *
     * @throws ConsistencyTimeoutException If the position wasn't reached in time
     */
    public Optional<ReadModelDocument> findAfter(String consumerName, long position, String collection, String identityKey, String identityValue) {
        consistencyWaiter.awaitPosition(consumerName, position, defaultTimeout);
        return delegate.find(collection, identityKey, identityValue);
    }
}
