package com.questrail.shepherd.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for restart backoff, reset windows and connection timeouts.
 *
 * <h2>Binding invariant</h2>
 * Supervision timing MUST use a monotonic source. Wall-clock time is used only
 * for event timestamps and for comparing process start times.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two values are meaningful.
     */
    long nowNanos();
}
