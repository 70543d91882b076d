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

import java.util.OptionalLong;
import java.util.Set;

/**
 * An ordered, durable source of events, such as a log or a topic, from which consumers may read from any position.
 */
@NullMarked
public interface EventFeed {

    /**
     * Subscribe to events of the given types.
     *
     * @param afterPosition Only events with a position strictly greater than this are delivered. If empty, the
     *                      subscription starts from the beginning of the feed.
     * @param eventTypes    The exact runtime classes of the events to deliver
     * @return An {@link EventFeedSubscription} that yields events in increasing position order
     */
    EventFeedSubscription subscribe(OptionalLong afterPosition, Set<Class<?>> eventTypes);

    /**
     * @return The position of the latest event in the feed, or empty if the feed is empty
     */
    OptionalLong headPosition();
}
