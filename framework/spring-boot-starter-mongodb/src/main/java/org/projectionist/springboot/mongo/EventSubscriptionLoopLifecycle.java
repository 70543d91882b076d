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

package org.projectionist.springboot.mongo;

import org.projectionist.subscription.core.EventSubscriptionLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.List;

/**
 * Starts all {@link EventSubscriptionLoop} beans when the application context is started and stops them, letting
 * in-flight events finish, when it's stopped.
 */
class EventSubscriptionLoopLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(EventSubscriptionLoopLifecycle.class);

    private final List<EventSubscriptionLoop> loops;
    private final boolean autoStart;
    private final Duration stopTimeout;
    private volatile boolean running;

    EventSubscriptionLoopLifecycle(List<EventSubscriptionLoop> loops, boolean autoStart, Duration stopTimeout) {
        this.loops = List.copyOf(loops);
        this.autoStart = autoStart;
        this.stopTimeout = stopTimeout;
    }

    @Override
    public void start() {
        loops.forEach(loop -> {
            log.info("Starting event subscription loop for consumer {}", loop.consumerName());
            loop.start();
        });
        running = true;
    }

    @Override
    public void stop() {
        loops.forEach(EventSubscriptionLoop::stop);
        for (EventSubscriptionLoop loop : loops) {
            if (!loop.awaitStopped(stopTimeout)) {
                log.warn("Event subscription loop for consumer {} did not stop within {}", loop.consumerName(), stopTimeout);
            }
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }
}
