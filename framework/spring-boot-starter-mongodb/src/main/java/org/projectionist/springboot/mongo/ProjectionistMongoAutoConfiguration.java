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

import com.mongodb.ReadConcern;
import com.mongodb.TransactionOptions;
import com.mongodb.WriteConcern;
import org.projectionist.consistency.ConsistencyWaiter;
import org.projectionist.readmodel.api.ReadModelReader;
import org.projectionist.readmodel.mongodb.spring.SpringMongoReadModelMaterializer;
import org.projectionist.subscription.api.blocking.EventFeed;
import org.projectionist.subscription.core.CheckpointMonitor;
import org.projectionist.subscription.core.EventSubscriptionLoop;
import org.projectionist.tracking.api.TrackingStore;
import org.projectionist.tracking.mongodb.spring.SpringMongoTrackingStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.stream.Collectors;

/**
 * Projectionist Spring autoconfiguration support for MongoDB read models
 */
@AutoConfiguration(after = {MongoAutoConfiguration.class, MongoDataAutoConfiguration.class})
@ConditionalOnClass({SpringMongoTrackingStore.class, SpringMongoReadModelMaterializer.class})
@EnableConfigurationProperties(ProjectionistProperties.class)
public class ProjectionistMongoAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(MongoTransactionManager.class)
    @ConditionalOnProperty(name = "projectionist.tracking.enabled", havingValue = "true", matchIfMissing = true)
    public MongoTransactionManager mongoTransactionManager(MongoDatabaseFactory dbFactory) {
        return new MongoTransactionManager(dbFactory, TransactionOptions.builder().readConcern(ReadConcern.MAJORITY).writeConcern(WriteConcern.MAJORITY).build());
    }

    @Bean
    @ConditionalOnMissingBean(TrackingStore.class)
    @ConditionalOnProperty(name = "projectionist.tracking.enabled", havingValue = "true", matchIfMissing = true)
    public SpringMongoTrackingStore projectionistTrackingStore(MongoTemplate mongoTemplate, ProjectionistProperties projectionistProperties) {
        return new SpringMongoTrackingStore(mongoTemplate, projectionistProperties.getTracking().getCollection());
    }

    @Bean
    @ConditionalOnMissingBean(ConsistencyWaiter.class)
    @ConditionalOnBean(TrackingStore.class)
    public ConsistencyWaiter projectionistConsistencyWaiter(TrackingStore trackingStore, ProjectionistProperties projectionistProperties) {
        return new ConsistencyWaiter(trackingStore, projectionistProperties.getConsistency().getPollInterval());
    }

    @Bean
    @ConditionalOnMissingBean(SpringMongoReadModelMaterializer.class)
    @ConditionalOnBean(SpringMongoTrackingStore.class)
    @ConditionalOnProperty(name = "projectionist.tracking.enabled", havingValue = "true", matchIfMissing = true)
    public SpringMongoReadModelMaterializer projectionistReadModelMaterializer(MongoTemplate mongoTemplate, MongoTransactionManager transactionManager,
                                                                               SpringMongoTrackingStore trackingStore, ConsistencyWaiter consistencyWaiter) {
        return new SpringMongoReadModelMaterializer(mongoTemplate, transactionManager, trackingStore, consistencyWaiter);
    }

    @Bean
    @ConditionalOnMissingBean(ConsistentReadModelReader.class)
    @ConditionalOnBean({ReadModelReader.class, ConsistencyWaiter.class})
    public ConsistentReadModelReader projectionistConsistentReadModelReader(ReadModelReader readModelReader, ConsistencyWaiter consistencyWaiter,
                                                                            ProjectionistProperties projectionistProperties) {
        return new ConsistentReadModelReader(readModelReader, consistencyWaiter, projectionistProperties.getConsistency().getDefaultTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(EventSubscriptionLoopFactory.class)
    @ConditionalOnBean({EventFeed.class, TrackingStore.class})
    public EventSubscriptionLoopFactory projectionistEventSubscriptionLoopFactory(EventFeed eventFeed, TrackingStore trackingStore, ProjectionistProperties projectionistProperties) {
        return new EventSubscriptionLoopFactory(eventFeed, trackingStore, projectionistProperties.getSubscription().getPollTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(CheckpointMonitor.class)
    @ConditionalOnBean({EventFeed.class, TrackingStore.class})
    public CheckpointMonitor projectionistCheckpointMonitor(EventFeed eventFeed, TrackingStore trackingStore) {
        return new CheckpointMonitor(eventFeed, trackingStore);
    }

    @Bean
    EventSubscriptionLoopLifecycle projectionistEventSubscriptionLoopLifecycle(ObjectProvider<EventSubscriptionLoop> loops, ProjectionistProperties projectionistProperties) {
        ProjectionistProperties.SubscriptionProperties subscription = projectionistProperties.getSubscription();
        return new EventSubscriptionLoopLifecycle(loops.orderedStream().collect(Collectors.toList()), subscription.isAutoStart(), subscription.getPollTimeout().multipliedBy(2).plusSeconds(5));
    }
}
