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

package org.projectionist.subscription.inmemory;

import org.jspecify.annotations.NullMarked;
import org.projectionist.subscription.api.blocking.EventFeed;
import org.projectionist.subscription.api.blocking.EventFeedSubscription;
import org.projectionist.subscription.api.blocking.PositionedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * An in-memory {@link EventFeed}. Appended events are assigned positions 1, 2, 3 and so on. A subscription first
 * receives the events already in the feed after the requested position and then every event appended after it
 * was created.
 */
@NullMarked
public class InMemoryEventFeed implements EventFeed {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventFeed.class);

    private final List<PositionedEvent> events = new ArrayList<>();
    private final List<InMemoryEventFeedSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Append an event to the feed.
     *
     * @return The position assigned to the event
     */
    public long append(Object event) {
        requireNonNull(event, "event cannot be null");
        lock.lock();
        try {
            PositionedEvent positionedEvent = new PositionedEvent(event, events.size() + 1L);
            events.add(positionedEvent);
            subscriptions.forEach(subscription -> subscription.eventAvailable(positionedEvent));
            return positionedEvent.position();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Append several events in order.
     *
     * @return The position of the last appended event
     */
    public long appendAll(Object... events) {
        requireNonNull(events, "events cannot be null");
        long position = 0;
        for (Object event : events) {
            position = append(event);
        }
        return position;
    }

    @Override
    public EventFeedSubscription subscribe(OptionalLong afterPosition, Set<Class<?>> eventTypes) {
        requireNonNull(afterPosition, "afterPosition cannot be null");
        requireNonNull(eventTypes, "eventTypes cannot be null");
        long after = afterPosition.orElse(0);
        lock.lock();
        try {
            InMemoryEventFeedSubscription subscription = new InMemoryEventFeedSubscription(eventTypes, subscriptions::remove);
            int from = (int) Math.min(Math.max(after, 0), events.size());
            events.subList(from, events.size()).forEach(subscription::eventAvailable);
            subscriptions.add(subscription);
            log.debug("Subscribed to {} after position {}", eventTypes, after);
            return subscription;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public OptionalLong headPosition() {
        lock.lock();
        try {
            return events.isEmpty() ? OptionalLong.empty() : OptionalLong.of(events.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The number of open subscriptions
     */
    public int numberOfSubscriptions() {
        return subscriptions.size();
    }
}
