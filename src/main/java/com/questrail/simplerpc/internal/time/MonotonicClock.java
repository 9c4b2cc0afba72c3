package com.questrail.simplerpc.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for registry expiry.
 *
 * <p>Expiry deadlines are compared against this clock only. Wall-clock time
 * ({@code Instant.now()}) may jump under NTP or manual adjustment and is used
 * for event timestamps, never for deciding whether a pending reply timed out.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick in nanoseconds. Only differences
     * between two readings are meaningful.
     */
    long nowNanos();
}
