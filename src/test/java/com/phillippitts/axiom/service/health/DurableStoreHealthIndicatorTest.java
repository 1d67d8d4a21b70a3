package com.phillippitts.axiom.service.health;

import com.phillippitts.axiom.service.store.DurableStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DurableStoreHealthIndicatorTest {

    @Test
    void shouldReportUpWhenStoreAnswers() {
        DurableStore store = mock(DurableStore.class);
        when(store.isAvailable()).thenReturn(true);

        Health health = new DurableStoreHealthIndicator(store).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "Store reachable");
    }

    @Test
    void shouldReportDownWhenStoreIsUnreachable() {
        DurableStore store = mock(DurableStore.class);
        when(store.isAvailable()).thenReturn(false);

        Health health = new DurableStoreHealthIndicator(store).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "Store unreachable");
    }
}
