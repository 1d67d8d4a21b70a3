package com.phillippitts.axiom.service.store;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class PersistenceTrackerTest {

    private final PersistenceTracker tracker = new PersistenceTracker();

    @Test
    void acknowledgementCompletesExpectedFuture() {
        CompletableFuture<Boolean> future = tracker.expect("t-1");

        tracker.acknowledge("t-1", true);

        assertThat(future).isCompletedWithValue(true);
        assertThat(tracker.pendingCount()).isZero();
    }

    @Test
    void unexpectedAcknowledgementIsIgnored() {
        tracker.acknowledge("t-unknown", true);
        tracker.acknowledge(null, false);

        assertThat(tracker.pendingCount()).isZero();
    }

    @Test
    void forgetDropsWaiter() {
        CompletableFuture<Boolean> future = tracker.expect("t-1");

        tracker.forget("t-1");
        tracker.acknowledge("t-1", true);

        assertThat(future).isNotDone();
    }
}
