package com.questrail.shepherd.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled restart, reset or probe timeout.
 *
 * <p>
 * Session bookkeeping keeps one of these per owned timer so that removing a
 * session can cancel everything it scheduled before the entry disappears.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
