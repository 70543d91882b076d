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

import static java.util.Objects.requireNonNull;

/**
 * An event together with its position in the feed. Positions are positive and strictly increasing within a feed.
 *
 * @param event    The event
 * @param position The position of the event
 */
@NullMarked
public record PositionedEvent(Object event, long position) {

    public PositionedEvent {
        requireNonNull(event, "event cannot be null");
        if (position < 1) {
            throw new IllegalArgumentException("position must be greater than zero but was " + position);
        }
    }
}
