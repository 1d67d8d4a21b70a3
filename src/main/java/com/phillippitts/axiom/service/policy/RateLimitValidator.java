package com.phillippitts.axiom.service.policy;

import java.time.Duration;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Token-bucket limit on accepted user inputs across all sessions ({@code rate_limited}).
 *
 * <p>The bucket starts full with {@code capacity} tokens and refills continuously so that
 * {@code capacity} tokens return every {@code refillPeriod}. This is the only validator whose
 * verdict depends on time.
 */
public class RateLimitValidator implements Validator {

    public static final String RULE = "rate_limited";

    private final long capacity;
    private final long refillPeriodNanos;
    private final LongSupplier nanoClock;
    private long tokens;
    private long lastRefillNanos;

    public RateLimitValidator(long capacity, Duration refillPeriod) {
        this(capacity, refillPeriod, System::nanoTime);
    }

    RateLimitValidator(long capacity, Duration refillPeriod, LongSupplier nanoClock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        if (refillPeriod.isZero() || refillPeriod.isNegative()) {
            throw new IllegalArgumentException("refillPeriod must be positive");
        }
        this.capacity = capacity;
        this.refillPeriodNanos = refillPeriod.toNanos();
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    @Override
    public synchronized Map<String, String> validate(String text, Direction direction) {
        if (direction != Direction.INPUT) {
            return Map.of();
        }
        refill();
        if (tokens > 0) {
            tokens--;
            return Map.of();
        }
        long waitMs = refillPeriodNanos / capacity / 1_000_000L;
        return Map.of(RULE, "Too many requests, retry in " + Math.max(waitMs, 1) + "ms");
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        long toAdd = (elapsed * capacity) / refillPeriodNanos;
        if (toAdd > 0) {
            tokens = Math.min(capacity, tokens + toAdd);
            lastRefillNanos = now;
        }
    }
}
