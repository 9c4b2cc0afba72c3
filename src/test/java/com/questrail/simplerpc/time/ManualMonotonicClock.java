package com.questrail.simplerpc.time;

import com.questrail.simplerpc.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic clock for tests that only moves when told to.
 *
 * <p>Like {@link System#nanoTime()}, the origin is arbitrary: a test may start
 * the clock near {@link Long#MAX_VALUE} to check that deadline comparisons are
 * written as differences and survive numeric overflow.</p>
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nowNanos;

    public ManualMonotonicClock() {
        this(0L);
    }

    public ManualMonotonicClock(long originNanos) {
        this.nowNanos = new AtomicLong(originNanos);
    }

    @Override
    public long nowNanos() {
        return nowNanos.get();
    }

    public void advance(Duration delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("Monotonic time cannot move backwards");
        }
        // plain addition: overflow wraps exactly as nanoTime does
        nowNanos.addAndGet(delta.toNanos());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}
