package com.phillippitts.axiom.service.health;

import com.phillippitts.axiom.service.store.DurableStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * UP when the durable store answers a trivial query, DOWN otherwise.
 */
@Component
public class DurableStoreHealthIndicator implements HealthIndicator {

    private final DurableStore store;

    public DurableStoreHealthIndicator(DurableStore store) {
        this.store = store;
    }

    @Override
    public Health health() {
        if (store.isAvailable()) {
            return Health.up().withDetail("status", "Store reachable").build();
        }
        return Health.down().withDetail("status", "Store unreachable").build();
    }
}
