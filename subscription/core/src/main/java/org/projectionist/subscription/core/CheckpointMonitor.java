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

package org.projectionist.subscription.core;

import org.jspecify.annotations.NullMarked;
import org.projectionist.subscription.api.blocking.EventFeed;
import org.projectionist.tracking.api.TrackingStore;

import java.util.OptionalLong;

import static java.util.Objects.requireNonNull;

/**
 * Reports how far consumers are behind the head of the feed.
 */
@NullMarked
public class CheckpointMonitor {
    private final EventFeed eventFeed;
    private final TrackingStore trackingStore;

    public CheckpointMonitor(EventFeed eventFeed, TrackingStore trackingStore) {
        requireNonNull(eventFeed, EventFeed.class.getSimpleName() + " cannot be null");
        requireNonNull(trackingStore, TrackingStore.class.getSimpleName() + " cannot be null");
        this.eventFeed = eventFeed;
        this.trackingStore = trackingStore;
    }

    /**
     * @return The highest position committed by the consumer
     */
    public OptionalLong checkpoint(String consumerName) {
        return trackingStore.maxPosition(consumerName);
    }

    /**
     * @return The number of positions between the consumer's checkpoint and the head of the feed. {@code 0} if the
     * feed is empty, the head position if the consumer hasn't committed anything.
     */
    public long lag(String consumerName) {
        requireNonNull(consumerName, "consumerName cannot be null");
        long head = eventFeed.headPosition().orElse(0);
        long checkpoint = trackingStore.maxPosition(consumerName).orElse(0);
        return Math.max(0, head - checkpoint);
    }
}
