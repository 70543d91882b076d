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
import org.projectionist.subscription.api.blocking.EventFeedSubscription;
import org.projectionist.subscription.api.blocking.PositionedEvent;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * An in-memory subscription
 */
@NullMarked
class InMemoryEventFeedSubscription implements EventFeedSubscription {
    private final BlockingQueue<PositionedEvent> queue = new LinkedBlockingQueue<>();
    private final Set<Class<?>> eventTypes;
    private final Consumer<InMemoryEventFeedSubscription> onClose;

    private volatile boolean closed;

    InMemoryEventFeedSubscription(Set<Class<?>> eventTypes, Consumer<InMemoryEventFeedSubscription> onClose) {
        this.eventTypes = Set.copyOf(eventTypes);
        this.onClose = onClose;
        this.closed = false;
    }

    @Override
    public Optional<PositionedEvent> poll(Duration timeout) throws InterruptedException {
        if (closed) {
            return Optional.empty();
        }
        return Optional.ofNullable(queue.poll(timeout.toMillis(), MILLISECONDS));
    }

    @Override
    public void close() {
        closed = true;
        queue.clear();
        onClose.accept(this);
    }

    void eventAvailable(PositionedEvent positionedEvent) {
        if (!closed && eventTypes.contains(positionedEvent.event().getClass())) {
            queue.offer(positionedEvent);
        }
    }
}
