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

package org.projectionist.subscription.api.blocking;

import org.jspecify.annotations.NullMarked;

import java.time.Duration;
import java.util.Optional;

/**
 * A subscription returned by {@link EventFeed#subscribe(java.util.OptionalLong, java.util.Set)}. Not thread-safe,
 * a subscription is consumed by a single thread.
 */
@NullMarked
public interface EventFeedSubscription extends AutoCloseable {

    /**
     * Wait for the next event.
     *
     * @param timeout The maximum time to wait
     * @return The next event or empty if none arrived within {@code timeout}, or if the subscription is closed
     * @throws InterruptedException If the calling thread is interrupted while waiting
     */
    Optional<PositionedEvent> poll(Duration timeout) throws InterruptedException;

    /**
     * End the subscription. No more events are delivered after this call.
     */
    @Override
    void close();
}
