package com.phillippitts.feedercontrol.util;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Utility methods for elapsed time and interruptible waits.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Waits on a stop signal for at most {@code timeout}.
     *
     * <p>An interrupt is treated as a stop request: the interrupt flag is restored and
     * {@code true} is returned.
     *
     * @return {@code true} if the signal fired (or the thread was interrupted), {@code false} on timeout
     */
    public static boolean awaitStop(CountDownLatch stopSignal, Duration timeout) {
        try {
            return stopSignal.await(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
