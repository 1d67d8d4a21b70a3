package com.phillippitts.axiom.presentation.controller;

import com.phillippitts.axiom.domain.ConversationTurn;
import com.phillippitts.axiom.domain.TurnOutcome;
import com.phillippitts.axiom.service.orchestration.CancellationResult;
import com.phillippitts.axiom.service.orchestration.TurnOrchestrator;
import com.phillippitts.axiom.service.store.DurableStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST boundary for submitting turns and reading session history.
 *
 * <p>Policy denials and cancellations are ordinary answers (HTTP 200); only system failures and
 * timeouts map to HTTP 503.
 */
@RestController
@RequestMapping("/api")
class TurnController {

    static final int MAX_HISTORY_LIMIT = 100;

    private final TurnOrchestrator orchestrator;
    private final DurableStore durableStore;

    TurnController(TurnOrchestrator orchestrator, DurableStore durableStore) {
        this.orchestrator = orchestrator;
        this.durableStore = durableStore;
    }

    @PostMapping("/sessions/{sessionId}/turns")
    ResponseEntity<TurnOutcome> submitTurn(@PathVariable String sessionId, @Valid @RequestBody TurnRequest request) {
        TurnOutcome outcome = orchestrator.submitTurn(sessionId, request.text());
        HttpStatus status = outcome.isFailed() && outcome.failureKind().isSystemError()
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(outcome);
    }

    @GetMapping("/sessions/{sessionId}/turns")
    List<ConversationTurn> history(@PathVariable String sessionId,
                                   @RequestParam(defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        return durableStore.query(sessionId, limit);
    }

    @DeleteMapping("/sessions/{sessionId}")
    Map<String, Object> endSession(@PathVariable String sessionId) {
        return Map.of("sessionId", sessionId, "ended", orchestrator.endSession(sessionId));
    }

    @PostMapping("/turns/{turnId}/cancel")
    Map<String, Object> cancel(@PathVariable String turnId) {
        CancellationResult result = orchestrator.cancel(turnId);
        return Map.of("turnId", turnId, "result", result.name());
    }

    record TurnRequest(@NotNull String text) {}
}
