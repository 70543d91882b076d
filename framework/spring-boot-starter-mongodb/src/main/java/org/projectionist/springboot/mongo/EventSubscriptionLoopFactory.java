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
import org.projectionist.projection.EventProjector;
import org.projectionist.subscription.api.blocking.EventFeed;
import org.projectionist.subscription.core.EventSubscriptionLoop;
import org.projectionist.subscription.core.EventSubscriptionLoopConfig;
import org.projectionist.tracking.api.TrackingStore;

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Creates {@link EventSubscriptionLoop}s that read from the application's {@link EventFeed} and resume from the
 * configured {@link TrackingStore}. Declare the created loops as beans to have them started and stopped with the
 * application context.
 */
@NullMarked
public class EventSubscriptionLoopFactory {
    private final EventFeed eventFeed;
    private final TrackingStore trackingStore;
    private final Duration pollTimeout;

    public EventSubscriptionLoopFactory(EventFeed eventFeed, TrackingStore trackingStore, Duration pollTimeout) {
        requireNonNull(eventFeed, EventFeed.class.getSimpleName() + " cannot be null");
        requireNonNull(trackingStore, TrackingStore.class.getSimpleName() + " cannot be null");
        requireNonNull(pollTimeout, "pollTimeout cannot be null");
        this.eventFeed = eventFeed;
        this.trackingStore = trackingStore;
        this.pollTimeout = pollTimeout;
    }

    public EventSubscriptionLoop create(String consumerName, EventProjector projector) {
        return new EventSubscriptionLoop(new EventSubscriptionLoopConfig(consumerName).pollTimeout(pollTimeout), eventFeed, projector, trackingStore);
    }
}
