package com.phillippitts.axiom.service.orchestration;

import com.phillippitts.axiom.config.properties.PipelineProperties;
import com.phillippitts.axiom.domain.ConversationTurn;
import com.phillippitts.axiom.domain.Event;
import com.phillippitts.axiom.domain.FailureKind;
import com.phillippitts.axiom.domain.Intent;
import com.phillippitts.axiom.domain.PolicyResult;
import com.phillippitts.axiom.domain.SessionContext;
import com.phillippitts.axiom.domain.Topics;
import com.phillippitts.axiom.domain.TurnOutcome;
import com.phillippitts.axiom.domain.TurnState;
import com.phillippitts.axiom.domain.TurnStatus;
import com.phillippitts.axiom.exception.AxiomException;
import com.phillippitts.axiom.exception.TurnTimeoutException;
import com.phillippitts.axiom.service.bus.EventBus;
import com.phillippitts.axiom.service.context.ContextSlots;
import com.phillippitts.axiom.service.context.ContextStore;
import com.phillippitts.axiom.service.intent.IntentDetector;
import com.phillippitts.axiom.service.metrics.TurnMetrics;
import com.phillippitts.axiom.service.policy.Direction;
import com.phillippitts.axiom.service.policy.PolicyEngine;
import com.phillippitts.axiom.service.response.GeneratedResponse;
import com.phillippitts.axiom.service.response.ResponseGenerator;
import com.phillippitts.axiom.service.store.PersistenceTracker;
import com.phillippitts.axiom.service.store.TurnEventPayload;
import com.phillippitts.axiom.util.LogSanitizer;
import com.phillippitts.axiom.util.TextNormalizer;
import com.phillippitts.axiom.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link TurnOrchestrator}.
 *
 * <p><b>Commit point:</b> the turn is assigned its sequence number, published on
 * {@code conversation.turn} and appended to the session history only after output validation.
 * Slot writes made at {@code CONTEXT_UPDATED} are rolled back when the turn fails or times out
 * before that point.
 *
 * <p><b>Degradation:</b>
 * <ul>
 *   <li>Generation failure or a saturated generation pool: the apology message is committed,
 *       status DEGRADED, kind SYSTEM_ERROR.</li>
 *   <li>Output violation: the safe fallback is committed, status DEGRADED, kind POLICY_VIOLATION.</li>
 * </ul>
 *
 * <p><b>Timeouts:</b> one deadline covers queueing, the session lock wait and generation. A
 * generation still running at the deadline is interrupted and its result discarded.
 *
 * <p>{@link #endSession} and idle eviction take the same session lock as turns, so a context is
 * never discarded while a turn of that session is between sequence assignment and commit.
 */
public class DefaultTurnOrchestrator implements TurnOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultTurnOrchestrator.class);

    public static final String SOURCE = "turn_orchestrator";
    static final String CANCELLED_MESSAGE = "Your request was cancelled.";
    private static final long WAIT_GRACE_MS = 1_000L;
    static final int MAX_SESSION_ID_LENGTH = 128;

    private final PolicyEngine policyEngine;
    private final IntentDetector intentDetector;
    private final ContextStore contextStore;
    private final ResponseGenerator responseGenerator;
    private final EventBus eventBus;
    private final PersistenceTracker persistenceTracker;
    private final TurnMetrics metrics;
    private final PipelineProperties properties;
    private final Executor turnExecutor;
    private final Executor generationExecutor;

    private final SessionLockRegistry sessionLocks = new SessionLockRegistry();
    private final Map<String, InFlightTurn> inFlight = new ConcurrentHashMap<>();

    public DefaultTurnOrchestrator(PolicyEngine policyEngine,
                                   IntentDetector intentDetector,
                                   ContextStore contextStore,
                                   ResponseGenerator responseGenerator,
                                   EventBus eventBus,
                                   PersistenceTracker persistenceTracker,
                                   TurnMetrics metrics,
                                   PipelineProperties properties,
                                   Executor turnExecutor,
                                   Executor generationExecutor) {
        this.policyEngine = Objects.requireNonNull(policyEngine, "policyEngine must not be null");
        this.intentDetector = Objects.requireNonNull(intentDetector, "intentDetector must not be null");
        this.contextStore = Objects.requireNonNull(contextStore, "contextStore must not be null");
        this.responseGenerator = Objects.requireNonNull(responseGenerator, "responseGenerator must not be null");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.persistenceTracker = Objects.requireNonNull(persistenceTracker, "persistenceTracker must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.turnExecutor = Objects.requireNonNull(turnExecutor, "turnExecutor must not be null");
        this.generationExecutor = Objects.requireNonNull(generationExecutor, "generationExecutor must not be null");
        eventBus.registerPublisher(SOURCE, List.of(Topics.CONVERSATION_TURN, Topics.STATE_UPDATED));
    }

    @Override
    public TurnOutcome submitTurn(String sessionId, String text) {
        return submitTurn(sessionId, text, Duration.ofMillis(properties.getTurnTimeoutMs()));
    }

    @Override
    public TurnOutcome submitTurn(String sessionId, String text, Duration timeout) {
        TurnHandle handle = submitTurnAsync(sessionId, text, timeout);
        long waitMs = timeout.toMillis() + WAIT_GRACE_MS
                + (properties.isAwaitPersistence() ? properties.getPersistenceAckTimeoutMs() : 0L);
        try {
            return handle.outcome().get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return abandon(handle, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(handle.turnId());
            return failed(handle.turnId(), FailureKind.SYSTEM_ERROR, properties.getApologyMessage(),
                    null, Map.of(), Map.of("interrupted", true));
        } catch (ExecutionException e) {
            // runTurn converts every failure into an outcome
            throw new IllegalStateException("Turn future completed exceptionally", e.getCause());
        }
    }

    @Override
    public TurnHandle submitTurnAsync(String sessionId, String text, Duration timeout) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        if (sessionId.length() > MAX_SESSION_ID_LENGTH) {
            throw new IllegalArgumentException("sessionId must be at most " + MAX_SESSION_ID_LENGTH + " characters");
        }
        Objects.requireNonNull(timeout, "timeout must not be null");
        String input = text == null ? "" : text;
        long deadlineNanos = TimeUtils.deadlineNanos(timeout);
        String turnId = UUID.randomUUID().toString();
        InFlightTurn turn = new InFlightTurn(turnId, sessionId);
        inFlight.put(turnId, turn);

        try {
            CompletableFuture<TurnOutcome> outcome = CompletableFuture.supplyAsync(
                    () -> runTurn(turn, input, deadlineNanos, timeout.toMillis()), turnExecutor);
            return new TurnHandle(turnId, outcome);
        } catch (RejectedExecutionException e) {
            inFlight.remove(turnId);
            LOG.error("Turn executor rejected turn {} for session {}", turnId, sessionId, e);
            TurnOutcome rejected = failed(turnId, FailureKind.SYSTEM_ERROR, properties.getApologyMessage(),
                    null, Map.of(), Map.of("rejected", true));
            metrics.recordTurn(rejected.status(), rejected.failureKind(), 0L);
            return new TurnHandle(turnId, CompletableFuture.completedFuture(rejected));
        }
    }

    @Override
    public CancellationResult cancel(String turnId) {
        InFlightTurn turn = turnId == null ? null : inFlight.get(turnId);
        CancellationResult result = turn == null ? CancellationResult.UNKNOWN : turn.requestCancel();
        metrics.incrementCancellation(result.name().toLowerCase(Locale.ROOT));
        if (turn != null) {
            LOG.info("Cancellation of turn {} (session {}) in state {}: {}",
                    turnId, turn.sessionId(), turn.state(), result);
        }
        return result;
    }

    /**
     * Waits for the session's in-flight turn, up to the default turn timeout, before
     * discarding the context.
     *
     * @throws TurnTimeoutException if the session stays busy past the timeout
     */
    @Override
    public boolean endSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return false;
        }
        long timeoutMs = properties.getTurnTimeoutMs();
        boolean ended;
        try {
            if (!sessionLocks.tryLock(sessionId, TimeUnit.MILLISECONDS.toNanos(timeoutMs))) {
                throw new TurnTimeoutException("session_lock", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnTimeoutException("session_lock", timeoutMs);
        }
        try {
            ended = contextStore.endSession(sessionId);
        } finally {
            sessionLocks.unlock(sessionId);
        }
        if (ended) {
            announceEnded(sessionId, "ended");
        }
        return ended;
    }

    /**
     * Sessions with a turn holding or waiting for the lock are skipped; they are not idle.
     */
    @Override
    public int endIdleSessions(Duration idleTimeout) {
        Instant cutoff = Instant.now().minus(idleTimeout);
        int ended = 0;
        for (String sessionId : contextStore.idleSessions(cutoff)) {
            if (endIfIdle(sessionId, cutoff)) {
                announceEnded(sessionId, "idle_timeout");
                ended++;
            }
        }
        return ended;
    }

    @Override
    public int inFlightCount() {
        return inFlight.size();
    }

    private boolean endIfIdle(String sessionId, Instant cutoff) {
        try {
            if (!sessionLocks.tryLock(sessionId, 0L)) {
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        try {
            return contextStore.evictIfIdle(sessionId, cutoff);
        } finally {
            sessionLocks.unlock(sessionId);
        }
    }

    private TurnOutcome runTurn(InFlightTurn turn, String text, long deadlineNanos, long timeoutMs) {
        long startNanos = System.nanoTime();
        ThreadContext.put("sessionId", turn.sessionId());
        ThreadContext.put("turnId", turn.turnId());
        TurnOutcome outcome;
        try {
            if (!sessionLocks.tryLock(turn.sessionId(), deadlineNanos - System.nanoTime())) {
                throw new TurnTimeoutException("session_lock", timeoutMs);
            }
            try {
                outcome = process(turn, text, startNanos, deadlineNanos, timeoutMs);
            } finally {
                sessionLocks.unlock(turn.sessionId());
            }
        } catch (TurnTimeoutException e) {
            LOG.warn("Turn {} timed out in stage {} after {} ms", turn.turnId(), e.getStage(),
                    TimeUtils.elapsedMillis(startNanos));
            outcome = failed(turn.turnId(), FailureKind.TIMEOUT, properties.getApologyMessage(),
                    null, Map.of(), Map.of("stage", e.getStage(), "errorCode", e.getErrorCode().code()));
        } catch (AxiomException e) {
            LOG.error("Turn {} failed [{}]: {}", turn.turnId(), e.getErrorCode(), e.getMessage(), e);
            outcome = failed(turn.turnId(), FailureKind.SYSTEM_ERROR, properties.getApologyMessage(),
                    null, Map.of(), Map.of("errorCode", e.getErrorCode().code()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Turn {} interrupted", turn.turnId());
            outcome = failed(turn.turnId(), FailureKind.SYSTEM_ERROR, properties.getApologyMessage(),
                    null, Map.of(), Map.of("interrupted", true));
        } catch (RuntimeException e) {
            LOG.error("Turn {} failed unexpectedly", turn.turnId(), e);
            outcome = failed(turn.turnId(), FailureKind.SYSTEM_ERROR, properties.getApologyMessage(),
                    null, Map.of(), Map.of());
        } finally {
            inFlight.remove(turn.turnId());
        }
        try {
            metrics.recordTurn(outcome.status(), outcome.failureKind(), System.nanoTime() - startNanos);
            LOG.info("Turn {} finished: status={}, state={}, intent={}, seq={}, durationMs={}",
                    turn.turnId(), outcome.status(), outcome.finalState(),
                    outcome.intent() == null ? null : outcome.intent().name(),
                    outcome.sequenceNumber(), TimeUtils.elapsedMillis(startNanos));
        } finally {
            ThreadContext.remove("sessionId");
            ThreadContext.remove("turnId");
        }
        return outcome;
    }

    private TurnOutcome process(InFlightTurn turn, String text, long startNanos, long deadlineNanos,
                                long timeoutMs) throws InterruptedException {
        LOG.debug("Processing turn {}: {}", turn.turnId(), LogSanitizer.preview(text));

        PolicyResult input = policyEngine.evaluate(text, Direction.INPUT);
        if (!input.passed()) {
            countViolations(input, Direction.INPUT);
            LOG.info("Turn {} denied by input policy: {}", turn.turnId(), input.violations().keySet());
            return failed(turn.turnId(), FailureKind.POLICY_VIOLATION, properties.getDenialMessage(),
                    null, input.violations(), Map.of());
        }
        if (!turn.advance(TurnState.INPUT_VALIDATED)) {
            return cancelled(turn);
        }

        Intent intent = intentDetector.detectBest(TextNormalizer.normalize(text));
        if (!turn.advance(TurnState.INTENT_DETECTED)) {
            return cancelled(turn);
        }

        SessionContext context = contextStore.get(turn.sessionId());
        Map<String, Object> snapshot = context.slots();
        if (!turn.advance(TurnState.CONTEXT_UPDATED)) {
            return cancelled(turn);
        }
        try {
            context.putSlot(ContextSlots.LAST_INTENT, intent.name());
            context.putSlot(ContextSlots.LAST_ENTITIES, intent.entities());
            context.putSlot(ContextSlots.LAST_USER_INPUT, text);
            return respondAndCommit(turn, text, intent, context, startNanos, deadlineNanos, timeoutMs);
        } catch (RuntimeException | InterruptedException e) {
            context.restoreSlots(snapshot);
            throw e;
        }
    }

    private TurnOutcome respondAndCommit(InFlightTurn turn, String text, Intent intent, SessionContext context,
                                         long startNanos, long deadlineNanos, long timeoutMs)
            throws InterruptedException {
        TurnStatus status = TurnStatus.COMPLETE;
        FailureKind degradedBy = null;
        Map<String, String> violations = Map.of();

        GeneratedResponse generated = null;
        boolean generationRejected = false;
        String responseText;
        try {
            generated = generateWithin(intent, context, deadlineNanos, timeoutMs);
            responseText = generated.text();
        } catch (ExecutionException e) {
            LOG.warn("Response generation failed for turn {} (intent {}): {}",
                    turn.turnId(), intent.name(), e.getCause() == null ? e : e.getCause().toString());
            responseText = properties.getApologyMessage();
            status = TurnStatus.DEGRADED;
            degradedBy = FailureKind.SYSTEM_ERROR;
        } catch (RejectedExecutionException e) {
            LOG.warn("Generation pool saturated, turn {} answers with the apology", turn.turnId());
            responseText = properties.getApologyMessage();
            status = TurnStatus.DEGRADED;
            degradedBy = FailureKind.SYSTEM_ERROR;
            generationRejected = true;
        }
        turn.advance(TurnState.RESPONSE_GENERATED);

        PolicyResult output = policyEngine.evaluate(responseText, Direction.OUTPUT);
        if (!output.passed()) {
            countViolations(output, Direction.OUTPUT);
            LOG.warn("Turn {} response replaced by output policy: {}", turn.turnId(), output.violations().keySet());
            responseText = properties.getSafeFallbackMessage();
            violations = output.violations();
            status = TurnStatus.DEGRADED;
            if (degradedBy == null) {
                degradedBy = FailureKind.POLICY_VIOLATION;
            }
            generated = null;
        }
        turn.advance(TurnState.OUTPUT_VALIDATED);

        if (deadlineNanos - System.nanoTime() <= 0) {
            throw new TurnTimeoutException("commit", timeoutMs);
        }

        long sequenceNumber = context.nextSequenceNumber();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("turnId", turn.turnId());
        metadata.put("status", status.name());
        metadata.put("confidence", intent.confidence());
        if (generated != null) {
            metadata.put("strategy", generated.strategy());
        }
        ConversationTurn committed = new ConversationTurn(turn.sessionId(), sequenceNumber, text, intent.name(),
                responseText, Instant.now(), TimeUtils.elapsedMillis(startNanos), metadata);

        CompletableFuture<Boolean> ack = properties.isAwaitPersistence()
                ? persistenceTracker.expect(turn.turnId())
                : null;
        try {
            eventBus.publish(Event.create(Topics.CONVERSATION_TURN,
                    TurnEventPayload.of(committed, intent.confidence(), status.name()), SOURCE, turn.turnId()));
        } catch (RuntimeException e) {
            persistenceTracker.forget(turn.turnId());
            throw e;
        }
        contextStore.appendTurn(turn.sessionId(), committed);
        context.putSlot(ContextSlots.TURN_COUNT, sequenceNumber);
        if (generated != null && generated.hasVariant()) {
            context.putSlot(ContextSlots.lastVariant(generated.intentName()), generated.variantIndex());
        }
        turn.advance(TurnState.PUBLISHED);

        Map<String, Object> details = new LinkedHashMap<>();
        if (generated != null) {
            details.put("strategy", generated.strategy());
        }
        if (generationRejected) {
            details.put("generationRejected", true);
        }
        if (ack != null) {
            details.put("persisted", awaitPersistence(turn.turnId(), ack));
        }
        TurnState finalState = status == TurnStatus.COMPLETE ? TurnState.COMPLETE : TurnState.DEGRADED;
        return new TurnOutcome(turn.turnId(), status, responseText, intent, violations, degradedBy,
                sequenceNumber, finalState, details);
    }

    /**
     * Runs generation on the generation pool and waits until the deadline. On timeout the
     * worker is interrupted so a stuck generator does not keep the thread.
     *
     * @throws RejectedExecutionException if the generation pool is saturated
     */
    private GeneratedResponse generateWithin(Intent intent, SessionContext context, long deadlineNanos,
                                             long timeoutMs) throws ExecutionException, InterruptedException {
        FutureTask<GeneratedResponse> task = new FutureTask<>(() -> responseGenerator.generate(intent, context));
        generationExecutor.execute(task);
        try {
            return task.get(Math.max(0L, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            throw new TurnTimeoutException("response_generation", timeoutMs);
        } catch (InterruptedException e) {
            task.cancel(true);
            throw e;
        }
    }

    private boolean awaitPersistence(String turnId, CompletableFuture<Boolean> ack) throws InterruptedException {
        try {
            boolean stored = ack.get(properties.getPersistenceAckTimeoutMs(), TimeUnit.MILLISECONDS);
            if (!stored) {
                LOG.warn("Turn {} was not persisted", turnId);
            }
            return stored;
        } catch (TimeoutException e) {
            persistenceTracker.forget(turnId);
            LOG.warn("Turn {} not acknowledged by the store within {} ms",
                    turnId, properties.getPersistenceAckTimeoutMs());
            return false;
        } catch (ExecutionException e) {
            LOG.warn("Persistence acknowledgement for turn {} failed", turnId, e.getCause());
            return false;
        }
    }

    private TurnOutcome abandon(TurnHandle handle, Duration timeout) {
        CancellationResult result = cancel(handle.turnId());
        if (result != CancellationResult.CANCELLED) {
            // finished, or past the context update where generation is bounded by the same deadline
            return handle.outcome().join();
        }
        LOG.warn("Turn {} did not finish within {} ms", handle.turnId(), timeout.toMillis());
        return failed(handle.turnId(), FailureKind.TIMEOUT, properties.getApologyMessage(),
                null, Map.of(), Map.of("stage", "queued"));
    }

    private void announceEnded(String sessionId, String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", sessionId);
        payload.put("state", "ended");
        payload.put("reason", reason);
        try {
            eventBus.publish(Event.create(Topics.STATE_UPDATED, payload, SOURCE, null));
        } catch (AxiomException e) {
            LOG.warn("Could not announce end of session {} [{}]: {}", sessionId, e.getErrorCode(), e.getMessage());
        }
        LOG.info("Session {} ended ({})", sessionId, reason);
    }

    private void countViolations(PolicyResult result, Direction direction) {
        String dir = direction.name().toLowerCase(Locale.ROOT);
        result.violations().keySet().forEach(rule -> metrics.incrementPolicyViolation(rule, dir));
    }

    private TurnOutcome cancelled(InFlightTurn turn) {
        LOG.info("Turn {} cancelled in state {}", turn.turnId(), turn.state());
        return failed(turn.turnId(), FailureKind.CANCELLED, CANCELLED_MESSAGE, null, Map.of(),
                Map.of("cancelledAt", turn.state().name()));
    }

    private static TurnOutcome failed(String turnId, FailureKind kind, String message, Intent intent,
                                      Map<String, String> violations, Map<String, Object> details) {
        return new TurnOutcome(turnId, TurnStatus.FAILED, message, intent, violations, kind,
                null, TurnState.FAILED, details);
    }
}
