package com.phillippitts.axiom.presentation.controller;

import com.phillippitts.axiom.domain.ConversationTurn;
import com.phillippitts.axiom.domain.FailureKind;
import com.phillippitts.axiom.domain.Intent;
import com.phillippitts.axiom.domain.TurnOutcome;
import com.phillippitts.axiom.domain.TurnState;
import com.phillippitts.axiom.domain.TurnStatus;
import com.phillippitts.axiom.service.orchestration.CancellationResult;
import com.phillippitts.axiom.service.orchestration.TurnOrchestrator;
import com.phillippitts.axiom.service.store.DurableStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TurnControllerTest {

    private TurnOrchestrator orchestrator;
    private DurableStore store;
    private TurnController controller;

    @BeforeEach
    void setUp() {
        orchestrator = mock(TurnOrchestrator.class);
        store = mock(DurableStore.class);
        controller = new TurnController(orchestrator, store);
    }

    private static TurnOutcome outcome(TurnStatus status, FailureKind kind) {
        TurnState state = switch (status) {
            case COMPLETE -> TurnState.COMPLETE;
            case DEGRADED -> TurnState.DEGRADED;
            case FAILED -> TurnState.FAILED;
        };
        return new TurnOutcome("t-1", status, "text", Intent.of("greeting", 1.0), Map.of(), kind,
                status == TurnStatus.FAILED ? null : 1L, state, Map.of());
    }

    @Test
    void completedTurnReturns200() {
        when(orchestrator.submitTurn("s1", "hello")).thenReturn(outcome(TurnStatus.COMPLETE, null));

        ResponseEntity<TurnOutcome> response = controller.submitTurn("s1", new TurnController.TurnRequest("hello"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().sequenceNumber()).isEqualTo(1L);
    }

    @Test
    void policyDenialIsAnOrdinaryAnswer() {
        when(orchestrator.submitTurn("s1", "x")).thenReturn(outcome(TurnStatus.FAILED, FailureKind.POLICY_VIOLATION));

        assertThat(controller.submitTurn("s1", new TurnController.TurnRequest("x")).getStatusCode())
                .isEqualTo(HttpStatus.OK);
    }

    @Test
    void degradedTurnIsAnOrdinaryAnswer() {
        when(orchestrator.submitTurn("s1", "x")).thenReturn(outcome(TurnStatus.DEGRADED, FailureKind.SYSTEM_ERROR));

        assertThat(controller.submitTurn("s1", new TurnController.TurnRequest("x")).getStatusCode())
                .isEqualTo(HttpStatus.OK);
    }

    @Test
    void systemFailureAndTimeoutReturn503() {
        when(orchestrator.submitTurn("s1", "a")).thenReturn(outcome(TurnStatus.FAILED, FailureKind.SYSTEM_ERROR));
        when(orchestrator.submitTurn("s1", "b")).thenReturn(outcome(TurnStatus.FAILED, FailureKind.TIMEOUT));

        assertThat(controller.submitTurn("s1", new TurnController.TurnRequest("a")).getStatusCode())
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(controller.submitTurn("s1", new TurnController.TurnRequest("b")).getStatusCode())
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void historyReadsFromDurableStore() {
        List<ConversationTurn> turns = List.of(ConversationTurn.of("s1", 2, "b", null, "B"));
        when(store.query("s1", 20)).thenReturn(turns);

        assertThat(controller.history("s1", 20)).isEqualTo(turns);
    }

    @Test
    void historyLimitIsBounded() {
        assertThatThrownBy(() -> controller.history("s1", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> controller.history("s1", TurnController.MAX_HISTORY_LIMIT + 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void endSessionAndCancelDelegate() {
        when(orchestrator.endSession("s1")).thenReturn(true);
        when(orchestrator.cancel("t-9")).thenReturn(CancellationResult.REJECTED);

        assertThat(controller.endSession("s1")).containsEntry("ended", true);
        assertThat(controller.cancel("t-9")).containsEntry("result", "REJECTED");
        verify(orchestrator).endSession("s1");
    }
}
