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
import org.jspecify.annotations.Nullable;
import org.projectionist.readmodel.api.MaterializationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Routes events to the {@link ProjectionHandler}s registered for their runtime class. Only the exact class is
 * matched, a handler registered for a supertype or interface is not invoked for subtypes.
 * <p>
 * Example:
 * <pre>
 * EventProjector projector = EventProjector.builder()
 *         .on(PageCreated.class, pageProjector::onPageCreated)
 *         .on(PageDeleted.class, pageProjector::onPageDeleted)
 *         .build();
 * </pre>
 */
@NullMarked
public class EventProjector {
    private static final Logger log = LoggerFactory.getLogger(EventProjector.class);

    private final Map<Class<?>, List<ProjectionHandler<Object>>> handlers;

    private EventProjector(Map<Class<?>, List<ProjectionHandler<Object>>> handlers) {
        Map<Class<?>, List<ProjectionHandler<Object>>> copy = new LinkedHashMap<>();
        handlers.forEach((type, list) -> copy.put(type, List.copyOf(list)));
        this.handlers = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Combine the handler tables of several projectors into one. Handlers registered for the same type in more than one
     * projector are all invoked, in the order the projectors are supplied.
     */
    public static EventProjector combine(EventProjector... projectors) {
        requireNonNull(projectors, "projectors cannot be null");
        Builder builder = builder();
        for (EventProjector projector : projectors) {
            requireNonNull(projector, EventProjector.class.getSimpleName() + " cannot be null");
            projector.handlers.forEach((type, list) -> list.forEach(handler -> builder.register(type, handler)));
        }
        return builder.build();
    }

    /**
     * Dispatch an event to all handlers registered for its runtime class. Every handler is invoked even if an earlier
     * one fails.
     *
     * @param event    The event
     * @param position The feed position of the event
     * @return The aggregated {@link DispatchResult}
     */
    public DispatchResult dispatch(Object event, long position) {
        requireNonNull(event, "event cannot be null");
        Class<?> eventType = event.getClass();
        List<ProjectionHandler<Object>> handlersForType = handlers.get(eventType);
        if (handlersForType == null) {
            log.debug("No handler registered for {} at position {}", eventType.getName(), position);
            return new DispatchResult.Unhandled(eventType);
        }

        int applied = 0;
        Throwable failure = null;
        for (ProjectionHandler<Object> handler : handlersForType) {
            try {
                MaterializationResult result = handler.handle(event, position);
                if (result == MaterializationResult.APPLIED) {
                    applied++;
                }
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                failure = addFailure(failure, e);
            }
        }

        if (failure != null) {
            return new DispatchResult.Failed(FailureKind.classify(failure), failure);
        } else if (applied > 0) {
            return new DispatchResult.Handled(applied);
        }
        return new DispatchResult.Duplicate();
    }

    /**
     * @return The event types that have at least one handler, to be used as subscription filter
     */
    public Set<Class<?>> eventTypes() {
        return handlers.keySet();
    }

    private static Throwable addFailure(@Nullable Throwable first, Throwable e) {
        if (first == null) {
            return e;
        }
        first.addSuppressed(e);
        return first;
    }

    public static final class Builder {
        private final Map<Class<?>, List<ProjectionHandler<Object>>> handlers = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Register a handler for events whose runtime class is exactly {@code type}. Several handlers may be registered
         * for the same type, they're invoked in registration order.
         */
        @SuppressWarnings("unchecked")
        public <T> Builder on(Class<T> type, ProjectionHandler<? super T> handler) {
            requireNonNull(type, "type cannot be null");
            requireNonNull(handler, ProjectionHandler.class.getSimpleName() + " cannot be null");
            return register(type, (ProjectionHandler<Object>) handler);
        }

        private Builder register(Class<?> type, ProjectionHandler<Object> handler) {
            handlers.computeIfAbsent(type, __ -> new ArrayList<>()).add(handler);
            return this;
        }

        public EventProjector build() {
            return new EventProjector(handlers);
        }
    }
}
