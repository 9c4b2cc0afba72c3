package com.questrail.simplerpc.config;

import java.time.Duration;
import java.util.Objects;

/**
 * PendingReplyPolicy
 * -----------------------------------------------------------------------------
 * Timing for the pending-reply registry.
 *
 * <ul>
 *   <li><b>ttl</b>: how long a callback registered for an outbound request waits
 *       for its reply. Shared by every pending request of a client; there is no
 *       per-request deadline.</li>
 *   <li><b>sweepInterval</b>: how often expired callbacks are collected and
 *       handed a synthetic timeout envelope. Independent of the TTL, so a timeout
 *       is delivered between {@code ttl} and {@code ttl + sweepInterval} after
 *       registration.</li>
 * </ul>
 */
public record PendingReplyPolicy(Duration ttl, Duration sweepInterval) {

    public static final Duration DEFAULT_TTL = Duration.ofMillis(120_000);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMillis(60_000);

    public PendingReplyPolicy {
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(sweepInterval, "sweepInterval");

        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
    }

    /**
     * 120 s TTL, swept every 60 s.
     */
    public static PendingReplyPolicy defaults() {
        return new PendingReplyPolicy(DEFAULT_TTL, DEFAULT_SWEEP_INTERVAL);
    }
}
