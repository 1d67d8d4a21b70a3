package com.phillippitts.axiom.service.orchestration;

import com.phillippitts.axiom.config.properties.PipelineProperties;
import com.phillippitts.axiom.domain.ConversationTurn;
import com.phillippitts.axiom.domain.Event;
import com.phillippitts.axiom.domain.FailureKind;
import com.phillippitts.axiom.domain.SessionContext;
import com.phillippitts.axiom.domain.Topics;
import com.phillippitts.axiom.domain.TurnOutcome;
import com.phillippitts.axiom.domain.TurnState;
import com.phillippitts.axiom.domain.TurnStatus;
import com.phillippitts.axiom.exception.EventBusShutdownException;
import com.phillippitts.axiom.service.bus.EventBus;
import com.phillippitts.axiom.service.bus.EventHandler;
import com.phillippitts.axiom.service.context.ContextSlots;
import com.phillippitts.axiom.service.policy.ContentFilterValidator;
import com.phillippitts.axiom.service.policy.SqlInjectionValidator;
import com.phillippitts.axiom.service.response.GeneratedResponse;
import com.phillippitts.axiom.service.response.ResponseGenerator;
import com.phillippitts.axiom.testutil.RecordingHandler;
import com.phillippitts.axiom.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class DefaultTurnOrchestratorTest {

    private TurnPipelineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new TurnPipelineFixture();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void helloCompletesAsGreetingAndIsPersisted() {
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.templates());

        TurnOutcome outcome = orchestrator.submitTurn("s1", "hello");

        assertThat(outcome.status()).isEqualTo(TurnStatus.COMPLETE);
        assertThat(outcome.finalState()).isEqualTo(TurnState.COMPLETE);
        assertThat(outcome.failureKind()).isNull();
        assertThat(outcome.intent().name()).isEqualTo("greeting");
        assertThat(outcome.intent().confidence()).isEqualTo(1.0);
        assertThat(outcome.responseText()).isEqualTo("Good morning!");
        assertThat(outcome.sequenceNumber()).isEqualTo(1L);
        assertThat(outcome.details()).containsEntry("strategy", "template");

        await().atMost(2, TimeUnit.SECONDS).until(() -> fixture.store.turnCount() == 1);
        ConversationTurn stored = fixture.store.query("s1", 1).get(0);
        assertThat(stored.detectedIntent()).isEqualTo("greeting");
        assertThat(stored.metadata()).containsEntry("turnId", outcome.turnId());
        assertThat(orchestrator.inFlightCount()).isZero();
    }

    @Test
    void committedTurnUpdatesContext() {
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.templates());

        orchestrator.submitTurn("s1", "Hello");

        SessionContext context = fixture.contexts.find("s1").orElseThrow();
        assertThat(context.historySize()).isEqualTo(1);
        assertThat(context.slot(ContextSlots.LAST_INTENT)).isEqualTo("greeting");
        assertThat(context.slot(ContextSlots.LAST_USER_INPUT)).isEqualTo("Hello");
        assertThat(context.slot(ContextSlots.TURN_COUNT)).isEqualTo(1L);
        assertThat(context.slot(ContextSlots.lastVariant("greeting"))).isEqualTo(0);
    }

    @Test
    void repeatedIntentDoesNotRepeatVariant() {
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.templates());

        String first = orchestrator.submitTurn("s1", "hello").responseText();
        String second = orchestrator.submitTurn("s1", "hello").responseText();
        String third = orchestrator.submitTurn("s1", "hello").responseText();

        assertThat(first).isEqualTo("Good morning!");
        assertThat(second).isEqualTo("Hello!");
        assertThat(third).isEqualTo("Good morning!");
    }

    @Test
    void sqlInjectionIsDeniedWithoutTouchingContext() {
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.templates());

        TurnOutcome outcome = orchestrator.submitTurn("s1", "'; DROP TABLE users;--");

        assertThat(outcome.status()).isEqualTo(TurnStatus.FAILED);
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.POLICY_VIOLATION);
        assertThat(outcome.violations()).containsKey(SqlInjectionValidator.RULE);
        assertThat(outcome.responseText()).isEqualTo(PipelineProperties.DEFAULT_DENIAL);
        assertThat(outcome.sequenceNumber()).isNull();
        assertThat(fixture.contexts.find("s1")).isEmpty();
        assertThat(fixture.registry.counter("axiom.turn.policy.violation",
                "rule", SqlInjectionValidator.RULE, "direction", "input").count()).isEqualTo(1.0);
    }

    @Test
    void throwingGeneratorDegradesWithApology() {
        ResponseGenerator broken = (intent, context) -> {
            throw new IllegalStateException("generator exploded");
        };
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(broken);

        TurnOutcome outcome = orchestrator.submitTurn("s1", "hello");

        assertThat(outcome.status()).isEqualTo(TurnStatus.DEGRADED);
        assertThat(outcome.finalState()).isEqualTo(TurnState.DEGRADED);
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.SYSTEM_ERROR);
        assertThat(outcome.responseText()).isEqualTo(PipelineProperties.DEFAULT_APOLOGY);
        assertThat(outcome.sequenceNumber()).isEqualTo(1L);
        await().atMost(2, TimeUnit.SECONDS).until(() -> fixture.store.turnCount() == 1);
    }

    @Test
    void outputViolationSubstitutesSafeFallback() {
        ResponseGenerator leaky = (intent, context) ->
                new GeneratedResponse("that is forbidden knowledge", intent.name(), "test", -1);
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(leaky);

        TurnOutcome outcome = orchestrator.submitTurn("s1", "hello");

        assertThat(outcome.status()).isEqualTo(TurnStatus.DEGRADED);
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.POLICY_VIOLATION);
        assertThat(outcome.responseText()).isEqualTo(PipelineProperties.DEFAULT_SAFE_FALLBACK);
        assertThat(outcome.violations()).containsKey(ContentFilterValidator.RULE);
        assertThat(fixture.contexts.get("s1").lastTurn().orElseThrow().assistantResponse())
                .isEqualTo(PipelineProperties.DEFAULT_SAFE_FALLBACK);
    }

    @Test
    void persistenceFailingOnceStillStoresExactlyOneRecord() {
        fixture.store.failNextWrites(1);
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.templates());

        TurnOutcome outcome = orchestrator.submitTurn("s1", "hello");

        assertThat(outcome.status()).isEqualTo(TurnStatus.COMPLETE);
        await().atMost(2, TimeUnit.SECONDS).until(() -> fixture.store.turnCount() == 1);
        assertThat(fixture.store.persistCalls()).isEqualTo(2);
    }

    @Test
    void slowGenerationTimesOutWithoutMutatingContext() throws Exception {
        ExecutorService generation = Executors.newSingleThreadExecutor();
        try {
            ResponseGenerator slow = (intent, context) -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return new GeneratedResponse("too late", intent.name(), "test", -1);
            };
            DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.detector(), slow,
                    new SyncExecutor(), generation, new PipelineProperties(5_000L));

            TurnOutcome outcome = orchestrator.submitTurn("s1", "hello", Duration.ofMillis(200));

            assertThat(outcome.status()).isEqualTo(TurnStatus.FAILED);
            assertThat(outcome.failureKind()).isEqualTo(FailureKind.TIMEOUT);
            assertThat(outcome.details()).containsEntry("stage", "response_generation");
            SessionContext context = fixture.contexts.get("s1");
            assertThat(context.slots()).isEmpty();
            assertThat(context.historySize()).isZero();
            assertThat(context.nextSequenceNumber()).isEqualTo(1L);
            assertThat(fixture.store.turnCount()).isZero();
        } finally {
            generation.shutdownNow();
            generation.awaitTermination(2, TimeUnit.SECONDS);
        }
    }

    @Test
    void timedOutGenerationIsInterruptedAndFreesThePool() throws Exception {
        ExecutorService generation = Executors.newSingleThreadExecutor();
        CountDownLatch interrupted = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        try {
            ResponseGenerator stuckOnce = (intent, context) -> {
                if (calls.getAndIncrement() == 0) {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        Thread.currentThread().interrupt();
                    }
                }
                return new GeneratedResponse("Hello!", intent.name(), "test", -1);
            };
            DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.detector(), stuckOnce,
                    new SyncExecutor(), generation, new PipelineProperties(5_000L));

            TurnOutcome first = orchestrator.submitTurn("s1", "hello", Duration.ofMillis(200));
            assertThat(first.failureKind()).isEqualTo(FailureKind.TIMEOUT);
            assertThat(interrupted.await(1, TimeUnit.SECONDS)).isTrue();

            long start = System.nanoTime();
            TurnOutcome second = orchestrator.submitTurn("s2", "hello", Duration.ofMillis(1_000));

            assertThat(second.status()).isEqualTo(TurnStatus.COMPLETE);
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(1_000));
        } finally {
            generation.shutdownNow();
            generation.awaitTermination(2, TimeUnit.SECONDS);
        }
    }

    @Test
    void saturatedGenerationPoolDegradesWithApology() {
        PipelineProperties properties = new PipelineProperties(5_000L);
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.detector(),
                TurnPipelineFixture.templates(), new SyncExecutor(), SyncExecutor.rejecting(), properties);

        TurnOutcome outcome = orchestrator.submitTurn("s1", "hello");

        assertThat(outcome.status()).isEqualTo(TurnStatus.DEGRADED);
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.SYSTEM_ERROR);
        assertThat(outcome.responseText()).isEqualTo(properties.getApologyMessage());
        assertThat(outcome.details()).containsEntry("generationRejected", true);
        assertThat(outcome.sequenceNumber()).isEqualTo(1L);
    }

    @Test
    void failedPublishFailsTurnAndRollsBackContext() {
        PipelineProperties properties = new PipelineProperties(5_000L, true, 2_000L, null, null, null);
        DefaultTurnOrchestrator orchestrator = new DefaultTurnOrchestrator(fixture.policy,
                TurnPipelineFixture.detector(), fixture.contexts, TurnPipelineFixture.templates(),
                new FirstTurnPublishFails(fixture.bus), fixture.tracker, fixture.metrics, properties,
                new SyncExecutor(), new SyncExecutor());

        TurnOutcome failed = orchestrator.submitTurn("s1", "hello");

        assertThat(failed.status()).isEqualTo(TurnStatus.FAILED);
        assertThat(failed.failureKind()).isEqualTo(FailureKind.SYSTEM_ERROR);
        assertThat(failed.details()).containsEntry("errorCode", "BUS-006");
        SessionContext context = fixture.contexts.get("s1");
        assertThat(context.slot(ContextSlots.LAST_INTENT)).isNull();
        assertThat(context.historySize()).isZero();
        assertThat(fixture.tracker.pendingCount()).isZero();

        TurnOutcome next = orchestrator.submitTurn("s1", "hello");

        assertThat(next.status()).isEqualTo(TurnStatus.COMPLETE);
        assertThat(next.sequenceNumber()).isEqualTo(1L);
        assertThat(next.details()).containsEntry("persisted", true);
        assertThat(fixture.store.turnsOf("s1")).extracting(ConversationTurn::sequenceNumber).containsExactly(1L);
    }

    @Test
    void restartedSessionKeepsNumberingWhilePersistenceLags() {
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.templates());
        fixture.store.holdWrites();
        try {
            TurnOutcome first = orchestrator.submitTurn("s1", "hello");
            assertThat(orchestrator.endSession("s1")).isTrue();
            TurnOutcome second = orchestrator.submitTurn("s1", "what time is it");

            assertThat(first.sequenceNumber()).isEqualTo(1L);
            assertThat(second.sequenceNumber()).isEqualTo(2L);
        } finally {
            fixture.store.releaseWrites();
        }

        await().atMost(2, TimeUnit.SECONDS).until(() -> fixture.store.turnCount() == 2);
        assertThat(fixture.store.turnsOf("s1"))
                .extracting(ConversationTurn::userInput)
                .containsExactly("hello", "what time is it");
        assertThat(fixture.registry.find("axiom.store.failure").counter()).isNull();
    }

    @Test
    void endSessionWaitsForInFlightTurn() throws Exception {
        ExecutorService turns = Executors.newSingleThreadExecutor();
        ExecutorService ender = Executors.newSingleThreadExecutor();
        CountDownLatch generating = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            ResponseGenerator gated = (intent, context) -> {
                generating.countDown();
                try {
                    release.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return new GeneratedResponse("Hello!", intent.name(), "test", -1);
            };
            DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.detector(), gated,
                    turns, new SyncExecutor(), new PipelineProperties(5_000L));

            TurnHandle handle = orchestrator.submitTurnAsync("s1", "hello", Duration.ofSeconds(3));
            assertThat(generating.await(2, TimeUnit.SECONDS)).isTrue();
            Future<Boolean> ended = ender.submit(() -> orchestrator.endSession("s1"));

            Thread.sleep(100);
            assertThat(ended).isNotDone();

            release.countDown();
            assertThat(handle.outcome().get(2, TimeUnit.SECONDS).sequenceNumber()).isEqualTo(1L);
            assertThat(ended.get(2, TimeUnit.SECONDS)).isTrue();
            assertThat(orchestrator.submitTurn("s1", "hello").sequenceNumber()).isEqualTo(2L);
        } finally {
            release.countDown();
            turns.shutdownNow();
            ender.shutdownNow();
        }
    }

    @Test
    void sequenceStaysGapFreeAfterFailures() {
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.templates());

        orchestrator.submitTurn("s1", "hello");
        orchestrator.submitTurn("s1", "<script>alert(1)</script>");
        TurnOutcome third = orchestrator.submitTurn("s1", "what time is it");

        assertThat(third.sequenceNumber()).isEqualTo(2L);
        assertThat(third.responseText()).isEqualTo("It is 08:15 AM.");
    }

    @Test
    void newContextContinuesPersistedSequence() {
        fixture.store.persist(ConversationTurn.of("s1", 1, "hi", "greeting", "Hello!"));
        fixture.store.persist(ConversationTurn.of("s1", 2, "hi", "greeting", "Hello!"));
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.templates());

        assertThat(orchestrator.submitTurn("s1", "hello").sequenceNumber()).isEqualTo(3L);
    }

    @Test
    void awaitingPersistenceReportsAcknowledgement() {
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.detector(),
                TurnPipelineFixture.templates(), new SyncExecutor(), new SyncExecutor(),
                new PipelineProperties(5_000L, true, 2_000L, null, null, null));

        TurnOutcome outcome = orchestrator.submitTurn("s1", "hello");

        assertThat(outcome.details()).containsEntry("persisted", true);
        assertThat(fixture.store.turnCount()).isEqualTo(1);
        assertThat(fixture.tracker.pendingCount()).isZero();
    }

    @Test
    void rejectedTurnFailsAsSystemError() {
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.detector(),
                TurnPipelineFixture.templates(),
                SyncExecutor.rejecting(), new SyncExecutor(), new PipelineProperties(5_000L));

        TurnOutcome outcome = orchestrator.submitTurn("s1", "hello");

        assertThat(outcome.status()).isEqualTo(TurnStatus.FAILED);
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.SYSTEM_ERROR);
        assertThat(outcome.details()).containsEntry("rejected", true);
        assertThat(orchestrator.inFlightCount()).isZero();
    }

    @Test
    void blankSessionIdIsRejected() {
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.templates());

        assertThatThrownBy(() -> orchestrator.submitTurn(" ", "hello"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void oversizedSessionIdIsRejected() {
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.templates());
        String longest = "s".repeat(DefaultTurnOrchestrator.MAX_SESSION_ID_LENGTH);

        assertThatThrownBy(() -> orchestrator.submitTurn(longest + "s", "hello"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at most 128");
        assertThat(orchestrator.submitTurn(longest, "hello").status()).isEqualTo(TurnStatus.COMPLETE);
        assertThat(fixture.contexts.activeSessionCount()).isEqualTo(1);
    }

    @Test
    void outcomesAreCountedByStatus() {
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.templates());

        orchestrator.submitTurn("s1", "hello");
        orchestrator.submitTurn("s1", "../../etc/passwd");

        assertThat(fixture.registry.counter("axiom.turn.outcome", "status", "complete", "failure", "none").count())
                .isEqualTo(1.0);
        assertThat(fixture.registry.counter("axiom.turn.outcome",
                "status", "failed", "failure", "policy_violation").count()).isEqualTo(1.0);
    }

    @Test
    void endSessionAnnouncesStateChange() {
        RecordingHandler stateEvents = new RecordingHandler();
        fixture.bus.subscribe(Topics.STATE_UPDATED, stateEvents);
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.templates());
        orchestrator.submitTurn("s1", "hello");

        assertThat(orchestrator.endSession("s1")).isTrue();
        assertThat(orchestrator.endSession("s1")).isFalse();

        await().atMost(2, TimeUnit.SECONDS).until(() -> stateEvents.count() == 1);
        assertThat(stateEvents.events().get(0).payload())
                .containsEntry("sessionId", "s1")
                .containsEntry("state", "ended")
                .containsEntry("reason", "ended");
    }

    @Test
    void idleSessionsAreEnded() {
        DefaultTurnOrchestrator orchestrator = fixture.orchestrator(TurnPipelineFixture.templates());
        orchestrator.submitTurn("idle", "hello");
        orchestrator.submitTurn("active", "hello");
        fixture.contexts.get("idle").touch(Instant.now().minus(Duration.ofHours(1)));

        assertThat(orchestrator.endIdleSessions(Duration.ofMinutes(30))).isEqualTo(1);
        assertThat(fixture.contexts.find("idle")).isEmpty();
        assertThat(fixture.contexts.find("active")).isPresent();
    }

    /**
     * Delegating bus whose first {@code conversation.turn} publish fails as if the bus were stopping.
     */
    private static final class FirstTurnPublishFails implements EventBus {

        private final EventBus delegate;
        private final AtomicBoolean failed = new AtomicBoolean();

        FirstTurnPublishFails(EventBus delegate) {
            this.delegate = delegate;
        }

        @Override
        public void registerPublisher(String publisherName, Collection<String> topics) {
            delegate.registerPublisher(publisherName, topics);
        }

        @Override
        public void subscribe(String topic, EventHandler handler) {
            delegate.subscribe(topic, handler);
        }

        @Override
        public boolean unsubscribe(String topic, EventHandler handler) {
            return delegate.unsubscribe(topic, handler);
        }

        @Override
        public Event publish(Event event) {
            if (Topics.CONVERSATION_TURN.equals(event.topic()) && failed.compareAndSet(false, true)) {
                throw new EventBusShutdownException("Event bus is shutting down");
            }
            return delegate.publish(event);
        }

        @Override
        public void shutdown(Duration grace) {
            delegate.shutdown(grace);
        }

        @Override
        public boolean isRunning() {
            return delegate.isRunning();
        }
    }
}
