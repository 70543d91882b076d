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

package org.projectionist.tracking.api;

import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * A marker stating that the consumer named {@code consumerName} has processed the event at {@code position}.
 *
 * @param consumerName The name of the consumer
 * @param position     The feed position that was processed
 * @param recordedAt   The time when the record was committed
 */
public record TrackingRecord(String consumerName, long position, Instant recordedAt) {

    public TrackingRecord {
        requireNonNull(consumerName, "consumerName cannot be null");
        requireNonNull(recordedAt, "recordedAt cannot be null");
        if (consumerName.isBlank()) {
            throw new IllegalArgumentException("consumerName cannot be blank");
        }
    }
}
