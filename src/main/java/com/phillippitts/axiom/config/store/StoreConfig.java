package com.phillippitts.axiom.config.store;

import com.phillippitts.axiom.config.properties.StoreProperties;
import com.phillippitts.axiom.service.bus.EventBus;
import com.phillippitts.axiom.service.metrics.TurnMetrics;
import com.phillippitts.axiom.service.store.DurableStore;
import com.phillippitts.axiom.service.store.JdbcDurableStore;
import com.phillippitts.axiom.service.store.PersistenceTracker;
import com.phillippitts.axiom.service.store.RetryPolicy;
import com.phillippitts.axiom.service.store.SystemEventSubscriber;
import com.phillippitts.axiom.service.store.TurnPersistenceSubscriber;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;

/**
 * Durable store and the bus subscribers that feed it. The schema is created by Flyway from
 * {@code db/migration}.
 */
@Configuration
public class StoreConfig {

    @Bean
    public DurableStore durableStore(JdbcTemplate jdbcTemplate) {
        return new JdbcDurableStore(jdbcTemplate);
    }

    @Bean
    public RetryPolicy persistenceRetryPolicy(StoreProperties properties) {
        return new RetryPolicy(properties.getMaxAttempts(),
                Duration.ofMillis(properties.getInitialBackoffMs()),
                properties.getBackoffMultiplier());
    }

    @Bean
    public PersistenceTracker persistenceTracker() {
        return new PersistenceTracker();
    }

    @Bean
    public TurnPersistenceSubscriber turnPersistenceSubscriber(DurableStore store, RetryPolicy retryPolicy,
                                                               PersistenceTracker tracker,
                                                               ApplicationEventPublisher publisher,
                                                               TurnMetrics metrics, EventBus eventBus) {
        TurnPersistenceSubscriber subscriber =
                new TurnPersistenceSubscriber(store, retryPolicy, tracker, publisher, metrics);
        subscriber.attach(eventBus);
        return subscriber;
    }

    @Bean
    public SystemEventSubscriber systemEventSubscriber(DurableStore store, RetryPolicy retryPolicy,
                                                       ApplicationEventPublisher publisher,
                                                       TurnMetrics metrics, EventBus eventBus) {
        SystemEventSubscriber subscriber = new SystemEventSubscriber(store, retryPolicy, publisher, metrics);
        subscriber.attach(eventBus);
        return subscriber;
    }
}
