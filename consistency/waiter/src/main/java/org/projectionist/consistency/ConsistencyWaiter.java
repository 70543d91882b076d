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

import org.jspecify.annotations.NullMarked;
import org.projectionist.tracking.api.TrackingStore;
import org.projectionist.tracking.api.TransientStoreFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * Lets callers block until the checkpoint of a consumer has reached a given position, which gives
 * read-after-write consistency on top of an asynchronously updated read model. For example, an HTTP handler that
 * has just appended an event at position {@code 17} can call {@code waitFor("pages", 17, Duration.ofSeconds(2))}
 * before reading the page read model.
 * <p>
 * Materializers call {@link #signal(String, long)} after every successful commit. A signal releases every waiter of
 * that consumer whose target is less than or equal to the committed position. Waiters also re-poll the
 * {@link TrackingStore} with a short interval, so a commit made by another process (that cannot signal this
 * instance) is observed as well.
 * </p>
 * <p>
 * The registry of waiters is process local and is never persisted. Create one instance per process and pass it to
 * the materializers and to the callers that need to wait.
 * </p>
 */
@NullMarked
public class ConsistencyWaiter {
    private static final Logger log = LoggerFactory.getLogger(ConsistencyWaiter.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    private final TrackingStore trackingStore;
    private final Duration pollInterval;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<WaitKey, Registration> registrations = new HashMap<>();

    private volatile boolean shutdown = false;

    /**
     * Create a new {@link ConsistencyWaiter} that re-polls the {@link TrackingStore} every {@code 100} milliseconds
     * while waiting.
     *
     * @param trackingStore The tracking store whose checkpoints are awaited
     */
    public ConsistencyWaiter(TrackingStore trackingStore) {
        this(trackingStore, DEFAULT_POLL_INTERVAL);
    }

    /**
     * Create a new {@link ConsistencyWaiter}
     *
     * @param trackingStore The tracking store whose checkpoints are awaited
     * @param pollInterval  How often a blocked caller re-polls the tracking store if it hasn't been signalled
     */
    public ConsistencyWaiter(TrackingStore trackingStore, Duration pollInterval) {
        requireNonNull(trackingStore, TrackingStore.class.getSimpleName() + " cannot be null");
        requireNonNull(pollInterval, "pollInterval cannot be null");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.trackingStore = trackingStore;
        this.pollInterval = pollInterval;
    }

    /**
     * Notify that {@code consumerName} has committed {@code position}. Releases all waiters of this consumer whose
     * target position is less than or equal to {@code position}.
     *
     * @param consumerName The consumer that committed
     * @param position     The committed position
     */
    public void signal(String consumerName, long position) {
        requireNonNull(consumerName, "consumerName cannot be null");
        lock.lock();
        try {
            Iterator<Map.Entry<WaitKey, Registration>> iterator = registrations.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<WaitKey, Registration> entry = iterator.next();
                WaitKey key = entry.getKey();
                if (key.consumerName.equals(consumerName) && key.targetPosition <= position) {
                    entry.getValue().release(true);
                    iterator.remove();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until the checkpoint of {@code consumerName} is greater than or equal to {@code targetPosition}, or until
     * {@code timeout} has elapsed. Returns immediately, without registering anything, if the checkpoint has already
     * been reached.
     *
     * @param consumerName   The consumer to wait for
     * @param targetPosition The position the consumer must reach
     * @param timeout        The max time to wait
     * @return {@link WaitResult#REACHED} or {@link WaitResult#TIMED_OUT}
     */
    public WaitResult waitFor(String consumerName, long targetPosition, Duration timeout) {
        requireNonNull(consumerName, "consumerName cannot be null");
        requireNonNull(timeout, "timeout cannot be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be negative");
        }

        if (isReached(consumerName, targetPosition)) {
            return WaitResult.REACHED;
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        WaitKey key = new WaitKey(consumerName, targetPosition);
        Registration registration = register(key);
        try {
            while (true) {
                // The checkpoint may have moved between the first poll and the registration
                if (registration.signalled || isReached(consumerName, targetPosition)) {
                    return WaitResult.REACHED;
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0 || shutdown) {
                    return WaitResult.TIMED_OUT;
                }
                if (registration.await(Math.min(remaining, pollInterval.toNanos())) && registration.signalled) {
                    return WaitResult.REACHED;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return isReached(consumerName, targetPosition) ? WaitResult.REACHED : WaitResult.TIMED_OUT;
        } finally {
            unregister(key, registration);
        }
    }

    /**
     * Same as {@link #waitFor(String, long, Duration)} but throws {@link ConsistencyTimeoutException} if the position
     * was not reached in time.
     *
     * @throws ConsistencyTimeoutException If {@code targetPosition} was not reached before {@code timeout}
     */
    public void awaitPosition(String consumerName, long targetPosition, Duration timeout) {
        if (waitFor(consumerName, targetPosition, timeout) == WaitResult.TIMED_OUT) {
            throw new ConsistencyTimeoutException(consumerName, targetPosition, timeout);
        }
    }

    /**
     * @return The number of {@code (consumerName, targetPosition)} keys that callers are currently blocked on
     */
    public int pendingRegistrations() {
        lock.lock();
        try {
            return registrations.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release all blocked callers and clear the registry. Callers that are released this way return the outcome of a
     * final poll of the tracking store.
     */
    @PreDestroy
    public void shutdown() {
        shutdown = true;
        lock.lock();
        try {
            registrations.values().forEach(registration -> registration.release(false));
            registrations.clear();
        } finally {
            lock.unlock();
        }
    }

    private boolean isReached(String consumerName, long targetPosition) {
        final OptionalLong maxPosition;
        try {
            maxPosition = trackingStore.maxPosition(consumerName);
        } catch (TransientStoreFailureException e) {
            log.warn("Failed to poll checkpoint of consumer {} while waiting for position {}", consumerName, targetPosition, e);
            return false;
        }
        return maxPosition.isPresent() && maxPosition.getAsLong() >= targetPosition;
    }

    private Registration register(WaitKey key) {
        lock.lock();
        try {
            Registration registration = registrations.computeIfAbsent(key, __ -> new Registration());
            registration.waiters++;
            return registration;
        } finally {
            lock.unlock();
        }
    }

    private void unregister(WaitKey key, Registration registration) {
        lock.lock();
        try {
            registration.waiters--;
            if (registration.waiters == 0 && registrations.get(key) == registration) {
                registrations.remove(key);
            }
        } finally {
            lock.unlock();
        }
    }

    private record WaitKey(String consumerName, long targetPosition) {
    }

    // Shared by all callers waiting for the same key. "waiters" is guarded by the lock.
    private static class Registration {
        private final CountDownLatch latch = new CountDownLatch(1);
        private volatile boolean signalled = false;
        private int waiters = 0;

        void release(boolean signalled) {
            this.signalled = signalled;
            latch.countDown();
        }

        boolean await(long nanos) throws InterruptedException {
            return latch.await(nanos, TimeUnit.NANOSECONDS);
        }
    }
}
