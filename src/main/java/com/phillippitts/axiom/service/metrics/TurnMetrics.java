package com.phillippitts.axiom.service.metrics;

import com.phillippitts.axiom.domain.FailureKind;
import com.phillippitts.axiom.domain.TurnStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for turn processing and persistence.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Turn latency and outcome counts per status and failure kind</li>
 *   <li>Policy violations per rule and direction</li>
 *   <li>Persistence retries and exhausted writes</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class TurnMetrics {

    private static final String METRIC_PREFIX = "axiom.turn";
    private static final String NONE = "none";

    private final MeterRegistry registry;

    public TurnMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a finished turn's latency and outcome.
     *
     * @param status        terminal status
     * @param failureKind   failure kind, {@code null} for COMPLETE
     * @param durationNanos pipeline duration in nanoseconds
     */
    public void recordTurn(TurnStatus status, FailureKind failureKind, long durationNanos) {
        String kind = failureKind == null ? NONE : failureKind.name().toLowerCase(Locale.ROOT);
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to process a conversational turn")
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".outcome")
                .description("Number of turns by terminal status and failure kind")
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .tag("failure", kind)
                .register(registry)
                .increment();
    }

    /**
     * Counts one policy violation.
     *
     * @param rule      violated rule name (sql_injection, length_exceeded, ...)
     * @param direction input or output
     */
    public void incrementPolicyViolation(String rule, String direction) {
        Counter.builder(METRIC_PREFIX + ".policy.violation")
                .description("Number of policy violations by rule")
                .tag("rule", rule)
                .tag("direction", direction)
                .register(registry)
                .increment();
    }

    public void incrementCancellation(String result) {
        Counter.builder(METRIC_PREFIX + ".cancellation")
                .description("Cancellation requests by result")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    /**
     * Counts a persistence retry for the given record kind (turn, event).
     */
    public void incrementPersistenceRetry(String kind) {
        Counter.builder("axiom.store.retry")
                .description("Number of durable store write retries")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * Counts a write abandoned after all retries.
     */
    public void incrementPersistenceFailure(String kind) {
        Counter.builder("axiom.store.failure")
                .description("Number of durable store writes abandoned after retries")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
