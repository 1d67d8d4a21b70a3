package com.phillippitts.axiom.service.health;

import com.phillippitts.axiom.config.properties.BusProperties;
import com.phillippitts.axiom.service.bus.DefaultEventBus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the event bus.
 *
 * <ul>
 *   <li>UP: accepting events, backlog below the configured threshold</li>
 *   <li>DEGRADED: accepting events but deliveries are backing up</li>
 *   <li>DOWN: shut down</li>
 * </ul>
 */
@Component
public class EventBusHealthIndicator implements HealthIndicator {

    private final DefaultEventBus eventBus;
    private final BusProperties properties;

    public EventBusHealthIndicator(DefaultEventBus eventBus, BusProperties properties) {
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Health health() {
        long pending = eventBus.pendingDeliveries();
        Health.Builder builder = new Health.Builder();
        if (!eventBus.isRunning()) {
            builder.down().withDetail("status", "Event bus shut down");
        } else if (pending > properties.getDegradedBacklog()) {
            builder.status("DEGRADED").withDetail("status", "Deliveries backing up");
        } else {
            builder.up().withDetail("status", "Accepting events");
        }
        return builder
                .withDetail("subscriptions", eventBus.totalSubscriptions())
                .withDetail("pendingDeliveries", pending)
                .withDetail("published", eventBus.publishedCount())
                .withDetail("delivered", eventBus.deliveredCount())
                .withDetail("handlerFailures", eventBus.handlerFailureCount())
                .build();
    }
}
