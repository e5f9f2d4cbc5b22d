package com.questrail.mdoc.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for scanning and transaction durations.
 *
 * <h2>Binding invariant</h2>
 * Durations reported by transports and the test harness MUST be measured with a
 * monotonic time source. Wall-clock time (e.g. {@code Instant.now()}) is
 * permitted only for observability event timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>
     * Values are only meaningful for elapsed time computations.
     * </p>
     */
    long nowNanos();

    /** Milliseconds elapsed since {@code startNanos}, never negative. */
    default long elapsedMillisSince(long startNanos) {
        return Math.max(0L, (nowNanos() - startNanos) / 1_000_000L);
    }
}
