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

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "projectionist")
public class ProjectionistProperties {
    private static final String DEFAULT_TRACKING_COLLECTION = "read_model_tracking";

    /**
     * Tracking record configuration
     */
    private TrackingProperties tracking = new TrackingProperties();

    /**
     * Consistency waiter configuration
     */
    private ConsistencyProperties consistency = new ConsistencyProperties();

    /**
     * Event subscription loop configuration
     */
    private SubscriptionProperties subscription = new SubscriptionProperties();

    public static class TrackingProperties {
        /**
         * The collection into which tracking records will be stored
         */
        private String collection = DEFAULT_TRACKING_COLLECTION;

        /**
         * If the MongoDB tracking store and read model materializer should be created as Spring beans.
         * <p>
         * Disable this if you want to provide your own {@link org.projectionist.tracking.api.TrackingStore} and
         * {@link org.projectionist.readmodel.api.ReadModelMaterializer}, for example in-memory ones in tests.
         * </p>
         */
        private boolean enabled = true;

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class ConsistencyProperties {
        /**
         * How often a waiting caller checks the tracking store, to observe positions committed by other processes
         */
        private Duration pollInterval = Duration.ofMillis(100);

        /**
         * How long {@link ConsistentReadModelReader} waits for a position before giving up
         */
        private Duration defaultTimeout = Duration.ofSeconds(30);

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getDefaultTimeout() {
            return defaultTimeout;
        }

        public void setDefaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
        }
    }

    public static class SubscriptionProperties {
        /**
         * How long a loop waits for the next event before it checks whether it's been stopped
         */
        private Duration pollTimeout = Duration.ofMillis(500);

        /**
         * Toggles whether all {@link org.projectionist.subscription.core.EventSubscriptionLoop} beans are started
         * when the application context starts.
         */
        private boolean autoStart = true;

        public Duration getPollTimeout() {
            return pollTimeout;
        }

        public void setPollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }
    }

    public TrackingProperties getTracking() {
        return tracking;
    }

    public void setTracking(TrackingProperties tracking) {
        this.tracking = tracking;
    }

    public ConsistencyProperties getConsistency() {
        return consistency;
    }

    public void setConsistency(ConsistencyProperties consistency) {
        this.consistency = consistency;
    }

    public SubscriptionProperties getSubscription() {
        return subscription;
    }

    public void setSubscription(SubscriptionProperties subscription) {
        this.subscription = subscription;
    }
}
