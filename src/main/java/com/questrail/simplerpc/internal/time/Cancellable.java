package com.questrail.simplerpc.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle returned by a {@link MonotonicScheduler} for a pending task.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if the task will not run; {@code false} if it already
     *         ran or was cancelled before
     */
    boolean cancel();
}
