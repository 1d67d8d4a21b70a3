package com.phillippitts.axiom.domain;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TurnOutcomeTest {

    @Test
    void completeOutcomeHasNoFailureKind() {
        assertThatThrownBy(() -> new TurnOutcome("t1", TurnStatus.COMPLETE, "hi", null, Map.of(),
                FailureKind.SYSTEM_ERROR, 1L, TurnState.COMPLETE, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonCompleteOutcomeNeedsFailureKind() {
        assertThatThrownBy(() -> new TurnOutcome("t1", TurnStatus.FAILED, "sorry", null, Map.of(),
                null, null, TurnState.FAILED, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void finalStateMustBeTerminal() {
        assertThatThrownBy(() -> new TurnOutcome("t1", TurnStatus.COMPLETE, "hi", null, Map.of(),
                null, 1L, TurnState.PUBLISHED, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cancellableOnlyBeforeContextUpdate() {
        assertThat(TurnState.RECEIVED.isCancellable()).isTrue();
        assertThat(TurnState.INTENT_DETECTED.isCancellable()).isTrue();
        assertThat(TurnState.CONTEXT_UPDATED.isCancellable()).isFalse();
        assertThat(TurnState.PUBLISHED.isCancellable()).isFalse();
    }

    @Test
    void timeoutCountsAsSystemErrorButCancellationDoesNot() {
        assertThat(FailureKind.TIMEOUT.isSystemError()).isTrue();
        assertThat(FailureKind.SYSTEM_ERROR.isSystemError()).isTrue();
        assertThat(FailureKind.CANCELLED.isSystemError()).isFalse();
        assertThat(FailureKind.POLICY_VIOLATION.isSystemError()).isFalse();
    }
}
