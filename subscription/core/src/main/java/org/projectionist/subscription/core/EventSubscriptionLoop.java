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

import jakarta.annotation.PreDestroy;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.projectionist.projection.DispatchResult;
import org.projectionist.projection.EventProjector;
import org.projectionist.projection.FailureKind;
import org.projectionist.subscription.api.blocking.EventFeed;
import org.projectionist.subscription.api.blocking.EventFeedSubscription;
import org.projectionist.subscription.api.blocking.PositionedEvent;
import org.projectionist.tracking.api.TrackingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.projectionist.subscription.core.LoopState.DRAINING;
import static org.projectionist.subscription.core.LoopState.RESUMING;
import static org.projectionist.subscription.core.LoopState.RUNNING;
import static org.projectionist.subscription.core.LoopState.STARTING;
import static org.projectionist.subscription.core.LoopState.STOPPED;
import static org.projectionist.subscription.core.LoopState.SUBSCRIBED;

/**
 * Feeds events from an {@link EventFeed} to an {@link EventProjector}, one at a time, for a single consumer.
 * <p>
 * On start the loop reads the consumer's checkpoint from the {@link TrackingStore} and subscribes to the feed
 * after it, so events committed before a restart are not dispatched again. Every dispatch outcome, including
 * failures, is logged and the loop moves on to the next event.
 * </p>
 * <p>
 * The checkpoint is the highest committed position. If an event fails and a later one commits, the failed position
 * lies below the checkpoint and is not retried after a restart. The loop logs a warning when this happens and reports
 * such positions in {@link #skippedPositions()}.
 * </p>
 * <p>
 * A loop can be started once. Use {@link #start()} to run it on a dedicated thread or {@link #run()} to run it on
 * the calling thread.
 * </p>
 */
@NullMarked
public class EventSubscriptionLoop implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(EventSubscriptionLoop.class);

    private final EventSubscriptionLoopConfig config;
    private final EventFeed eventFeed;
    private final EventProjector projector;
    private final TrackingStore trackingStore;

    private final AtomicReference<LoopState> state = new AtomicReference<>(STARTING);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicLong processedEvents = new AtomicLong();
    private final SortedSet<Long> skippedPositions = new ConcurrentSkipListSet<>();
    // Positions that failed and that no later position has committed past yet. Only accessed by the loop thread.
    private final SortedSet<Long> failedPositions = new TreeSet<>();

    private volatile boolean stopRequested;
    private volatile @Nullable ExecutorService executor;

    public EventSubscriptionLoop(EventSubscriptionLoopConfig config, EventFeed eventFeed, EventProjector projector, TrackingStore trackingStore) {
        requireNonNull(config, EventSubscriptionLoopConfig.class.getSimpleName() + " cannot be null");
        requireNonNull(eventFeed, EventFeed.class.getSimpleName() + " cannot be null");
        requireNonNull(projector, EventProjector.class.getSimpleName() + " cannot be null");
        requireNonNull(trackingStore, TrackingStore.class.getSimpleName() + " cannot be null");
        this.config = config;
        this.eventFeed = eventFeed;
        this.projector = projector;
        this.trackingStore = trackingStore;
        this.stopRequested = false;
    }

    /**
     * Start the loop on a dedicated thread named after the consumer.
     *
     * @throws IllegalStateException If the loop has already been started
     */
    public synchronized void start() {
        if (executor != null || state.get() != STARTING) {
            throw new IllegalStateException("Loop for consumer " + config.consumerName + " has already been started");
        }
        ExecutorService executorService = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "projectionist-" + config.consumerName);
            thread.setDaemon(true);
            return thread;
        });
        executor = executorService;
        executorService.execute(this);
    }

    /**
     * Run the loop on the calling thread until {@link #stop()} is called, the thread is interrupted, or the
     * subscription can't be established.
     *
     * @throws IllegalStateException If the loop has already been started
     */
    @Override
    public void run() {
        if (!state.compareAndSet(STARTING, RESUMING)) {
            if (stopRequested && state.get() == STOPPED) {
                // Stopped before the thread got to run
                return;
            }
            throw new IllegalStateException("Loop for consumer " + config.consumerName + " has already been started");
        }
        String consumerName = config.consumerName;
        EventFeedSubscription subscription = null;
        try {
            OptionalLong checkpoint = trackingStore.maxPosition(consumerName);
            log.info("Resuming consumer {} after position {}", consumerName, checkpoint.isPresent() ? checkpoint.getAsLong() : "<none>");
            subscription = eventFeed.subscribe(checkpoint, projector.eventTypes());
            state.set(SUBSCRIBED);
            log.info("Consumer {} subscribed to {} event types", consumerName, projector.eventTypes().size());
        } catch (RuntimeException e) {
            log.error("Failed to resume consumer {}, the loop will stop", consumerName, e);
        }

        try {
            if (subscription != null) {
                state.set(RUNNING);
                consume(subscription);
            }
        } finally {
            state.set(DRAINING);
            if (subscription != null) {
                closeSubscription(subscription);
            }
            state.set(STOPPED);
            stopped.countDown();
            log.info("Consumer {} stopped after processing {} events", consumerName, processedEvents.get());
        }
    }

    /**
     * Request the loop to stop. The event currently being dispatched, if any, is finished first. Returns immediately,
     * use {@link #awaitStopped(Duration)} to wait for the loop to finish.
     */
    public void stop() {
        stopRequested = true;
        if (state.compareAndSet(STARTING, STOPPED)) {
            stopped.countDown();
        }
    }

    /**
     * Wait for the loop to reach {@link LoopState#STOPPED}.
     *
     * @return {@code true} if the loop stopped within {@code timeout}
     */
    public boolean awaitStopped(Duration timeout) {
        requireNonNull(timeout, "timeout cannot be null");
        try {
            return stopped.await(timeout.toMillis(), MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Stop the loop, wait for it to finish and release its thread.
     */
    @PreDestroy
    public void shutdown() {
        stop();
        ExecutorService executorService = executor;
        if (executorService != null) {
            shutdownSafely(executorService, config.pollTimeout.toMillis() * 2 + 5000, MILLISECONDS);
        }
    }

    public LoopState state() {
        return state.get();
    }

    public String consumerName() {
        return config.consumerName;
    }

    /**
     * @return The number of events dispatched since the loop was started, whatever their outcome
     */
    public long processedEvents() {
        return processedEvents.get();
    }

    /**
     * @return Positions that failed and that the checkpoint has since moved past. They will not be redelivered by
     * resuming from the checkpoint.
     */
    public List<Long> skippedPositions() {
        return List.copyOf(skippedPositions);
    }

    private void consume(EventFeedSubscription subscription) {
        while (!stopRequested) {
            final Optional<PositionedEvent> next;
            try {
                next = subscription.poll(config.pollTimeout);
            } catch (InterruptedException e) {
                log.info("Consumer {} was interrupted, stopping", config.consumerName);
                stopRequested = true;
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Failed to read from the event feed for consumer {}, the loop will stop", config.consumerName, e);
                return;
            }
            next.ifPresent(this::dispatch);
        }
    }

    private void dispatch(PositionedEvent positionedEvent) {
        Object event = positionedEvent.event();
        long position = positionedEvent.position();
        String eventType = event.getClass().getName();
        DispatchResult result;
        try {
            result = projector.dispatch(event, position);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            result = new DispatchResult.Failed(FailureKind.UNEXPECTED, e);
        }
        processedEvents.incrementAndGet();

        if (result instanceof DispatchResult.Handled) {
            log.debug("Consumer {} applied {} at position {}", config.consumerName, eventType, position);
            flagSkippedPositionsBefore(position);
        } else if (result instanceof DispatchResult.Duplicate) {
            log.info("Consumer {} has already applied {} at position {}, skipping", config.consumerName, eventType, position);
        } else if (result instanceof DispatchResult.Failed) {
            DispatchResult.Failed failed = (DispatchResult.Failed) result;
            log.error("Consumer {} failed to apply {} at position {} ({})", config.consumerName, eventType, position, failed.kind(), failed.cause());
            failedPositions.add(position);
        } else {
            log.debug("Consumer {} has no handler for {} at position {}", config.consumerName, eventType, position);
        }
    }

    private void flagSkippedPositionsBefore(long committedPosition) {
        SortedSet<Long> passed = failedPositions.headSet(committedPosition);
        if (passed.isEmpty()) {
            return;
        }
        List<Long> positions = List.copyOf(passed);
        log.warn("Consumer {} committed position {} after positions {} failed. They are below the checkpoint and will not be retried on restart.",
                config.consumerName, committedPosition, positions);
        skippedPositions.addAll(positions);
        passed.clear();
    }

    private void closeSubscription(EventFeedSubscription subscription) {
        try {
            subscription.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close event feed subscription of consumer {}", config.consumerName, e);
        }
    }

    private static void shutdownSafely(ExecutorService executorService, long timeout, TimeUnit unit) {
        if (!executorService.isShutdown() && !executorService.isTerminated()) {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(timeout, unit)) {
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                if (!executorService.isTerminated()) {
                    executorService.shutdownNow();
                }
                Thread.currentThread().interrupt();
            }
        }
    }
}
