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

import org.jspecify.annotations.NullMarked;
import org.projectionist.tracking.api.InsertResult;
import org.projectionist.tracking.api.TrackingRecord;
import org.projectionist.tracking.api.TrackingStore;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

import static java.util.Objects.requireNonNull;

/**
 * An in-memory {@link TrackingStore}. Uniqueness of {@code (consumerName, position)} is enforced by an atomic
 * {@code putIfAbsent} so concurrent inserts of the same position will only succeed once.
 */
@NullMarked
public class InMemoryTrackingStore implements TrackingStore {

    private final ConcurrentMap<String, ConcurrentNavigableMap<Long, TrackingRecord>> state = new ConcurrentHashMap<>();
    private final Clock clock;

    /**
     * Create a new {@link InMemoryTrackingStore} that uses the system UTC clock for {@link TrackingRecord#recordedAt()}.
     */
    public InMemoryTrackingStore() {
        this(Clock.systemUTC());
    }

    /**
     * Create a new {@link InMemoryTrackingStore}
     *
     * @param clock The clock that'll be used to stamp {@link TrackingRecord#recordedAt()}
     */
    public InMemoryTrackingStore(Clock clock) {
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.clock = clock;
    }

    @Override
    public OptionalLong maxPosition(String consumerName) {
        requireNonNull(consumerName, "consumerName cannot be null");
        ConcurrentNavigableMap<Long, TrackingRecord> records = state.get(consumerName);
        if (records == null) {
            return OptionalLong.empty();
        }
        Map.Entry<Long, TrackingRecord> last = records.lastEntry();
        return last == null ? OptionalLong.empty() : OptionalLong.of(last.getKey());
    }

    @Override
    public InsertResult insert(String consumerName, long position) {
        TrackingRecord record = new TrackingRecord(consumerName, position, clock.instant());
        TrackingRecord existing = state.computeIfAbsent(consumerName, __ -> new ConcurrentSkipListMap<>()).putIfAbsent(position, record);
        return existing == null ? InsertResult.INSERTED : InsertResult.ALREADY_EXISTS;
    }

    @Override
    public boolean exists(String consumerName, long position) {
        requireNonNull(consumerName, "consumerName cannot be null");
        ConcurrentNavigableMap<Long, TrackingRecord> records = state.get(consumerName);
        return records != null && records.containsKey(position);
    }

    @Override
    public void deleteAll(String consumerName) {
        requireNonNull(consumerName, "consumerName cannot be null");
        state.remove(consumerName);
    }

    /**
     * @return All tracking records of the supplied consumer in ascending position order
     */
    public List<TrackingRecord> records(String consumerName) {
        requireNonNull(consumerName, "consumerName cannot be null");
        ConcurrentNavigableMap<Long, TrackingRecord> records = state.get(consumerName);
        return records == null ? List.of() : List.copyOf(records.values());
    }
}
