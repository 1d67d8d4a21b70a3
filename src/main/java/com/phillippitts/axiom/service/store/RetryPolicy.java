package com.phillippitts.axiom.service.store;

import com.phillippitts.axiom.exception.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * Exponential-backoff retry for durable store writes.
 *
 * <p>Only {@link StorageException} is retried; any other exception propagates immediately.
 * The delay before attempt {@code n + 1} is {@code initialBackoff * multiplier^(n - 1)}.
 */
public final class RetryPolicy {

    private static final Logger LOG = LogManager.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay after the given failed attempt (1-based).
     */
    public Duration backoffAfter(int attempt) {
        double factor = Math.pow(multiplier, Math.max(0, attempt - 1));
        return Duration.ofMillis(Math.round(initialBackoff.toMillis() * factor));
    }

    /**
     * Runs the operation until it succeeds or attempts are exhausted.
     *
     * @param description what is being written, for logs
     * @param operation   the write
     * @param onRetry     called with the failed attempt number before each retry
     * @return the operation's result
     * @throws StorageException the last failure when every attempt failed
     */
    public <T> T execute(String description, Supplier<T> operation, IntConsumer onRetry) {
        StorageException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.get();
            } catch (StorageException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = backoffAfter(attempt);
                LOG.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                        description, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                onRetry.accept(attempt);
                sleep(delay, e);
            }
        }
        throw last;
    }

    private static void sleep(Duration delay, StorageException pending) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw pending;
        }
    }
}
