package com.phillippitts.axiom.util;

import java.time.Duration;

/**
 * Helpers for monotonic deadlines measured with {@link System#nanoTime()}.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Elapsed milliseconds since a {@link System#nanoTime()} reading.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Converts a relative timeout into an absolute nanoTime deadline.
     */
    public static long deadlineNanos(Duration timeout) {
        return System.nanoTime() + timeout.toNanos();
    }

    /**
     * Milliseconds left until the deadline; zero or negative once it has passed.
     */
    public static long remainingMillis(long deadlineNanos) {
        return (deadlineNanos - System.nanoTime()) / NANOS_PER_MILLI;
    }
}
