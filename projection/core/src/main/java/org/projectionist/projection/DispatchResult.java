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

package org.projectionist.projection;

import org.jspecify.annotations.NullMarked;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of {@link EventProjector#dispatch(Object, long)}
 */
@NullMarked
public sealed interface DispatchResult {

    /**
     * At least one handler applied the event and no handler failed
     */
    record Handled(int appliedBy) implements DispatchResult {
    }

    /**
     * No handler is registered for the event type. Nothing was written.
     */
    record Unhandled(Class<?> eventType) implements DispatchResult {
        public Unhandled {
            requireNonNull(eventType, "eventType cannot be null");
        }
    }

    /**
     * Every handler had already applied the position
     */
    record Duplicate() implements DispatchResult {
    }

    /**
     * At least one handler threw. The first failure is the cause, later failures are suppressed by it.
     */
    record Failed(FailureKind kind, Throwable cause) implements DispatchResult {
        public Failed {
            requireNonNull(kind, FailureKind.class.getSimpleName() + " cannot be null");
            requireNonNull(cause, "cause cannot be null");
        }
    }
}
