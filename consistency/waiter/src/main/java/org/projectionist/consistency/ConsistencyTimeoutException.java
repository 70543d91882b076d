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

package org.projectionist.consistency;

import java.time.Duration;

/**
 * Thrown by {@link ConsistencyWaiter#awaitPosition(String, long, Duration)} when a consumer didn't reach the requested
 * position in time. The read model may still catch up later, so callers typically retry or report a temporary error.
 */
public class ConsistencyTimeoutException extends RuntimeException {
    private final String consumerName;
    private final long targetPosition;

    public ConsistencyTimeoutException(String consumerName, long targetPosition, Duration timeout) {
        super("Timeout waiting for " + consumerName + ":" + targetPosition + " after " + timeout.toMillis() + " ms");
        this.consumerName = consumerName;
        this.targetPosition = targetPosition;
    }

    public String getConsumerName() {
        return consumerName;
    }

    public long getTargetPosition() {
        return targetPosition;
    }
}
