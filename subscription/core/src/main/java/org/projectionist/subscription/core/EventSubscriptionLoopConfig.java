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

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Configuration of an {@link EventSubscriptionLoop}
 */
@NullMarked
public class EventSubscriptionLoopConfig {
    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);

    public final String consumerName;
    public final Duration pollTimeout;

    /**
     * Create a config with the default poll timeout of 500 ms.
     *
     * @param consumerName The name under which the loop commits positions. Also used as thread name.
     */
    public EventSubscriptionLoopConfig(String consumerName) {
        this(consumerName, DEFAULT_POLL_TIMEOUT);
    }

    private EventSubscriptionLoopConfig(String consumerName, Duration pollTimeout) {
        requireNonNull(consumerName, "consumerName cannot be null");
        requireNonNull(pollTimeout, "pollTimeout cannot be null");
        if (consumerName.isBlank()) {
            throw new IllegalArgumentException("consumerName cannot be blank");
        }
        if (pollTimeout.isNegative() || pollTimeout.isZero()) {
            throw new IllegalArgumentException("pollTimeout must be positive");
        }
        this.consumerName = consumerName;
        this.pollTimeout = pollTimeout;
    }

    /**
     * @param pollTimeout How long the loop waits for the next event before checking whether it's been stopped
     * @return A new {@link EventSubscriptionLoopConfig} with the given poll timeout
     */
    public EventSubscriptionLoopConfig pollTimeout(Duration pollTimeout) {
        return new EventSubscriptionLoopConfig(consumerName, pollTimeout);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventSubscriptionLoopConfig)) return false;
        EventSubscriptionLoopConfig that = (EventSubscriptionLoopConfig) o;
        return Objects.equals(consumerName, that.consumerName) && Objects.equals(pollTimeout, that.pollTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(consumerName, pollTimeout);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventSubscriptionLoopConfig.class.getSimpleName() + "[", "]")
                .add("consumerName='" + consumerName + "'")
                .add("pollTimeout=" + pollTimeout)
                .toString();
    }
}
