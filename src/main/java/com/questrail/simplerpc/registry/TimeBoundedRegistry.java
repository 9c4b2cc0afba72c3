package com.questrail.simplerpc.registry;

import com.questrail.simplerpc.internal.time.Cancellable;
import com.questrail.simplerpc.internal.time.MonotonicClock;
import com.questrail.simplerpc.internal.time.MonotonicScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * TimeBoundedRegistry
 * =============================================================================
 * Keyed store whose entries expire a fixed TTL after they were last set.
 *
 * <h2>Expiry</h2>
 * Expiry is observed in two independent ways:
 * <ul>
 *   <li><b>Lazily</b>, by {@link #get(Object)}: an expired entry is evicted
 *       silently and reported as absent.</li>
 *   <li><b>Periodically</b>, by a sweep every {@code sweepInterval}: each expired
 *       entry is claimed (deleted) and then handed to the {@link ExpiryListener}.
 *       An entry removed or taken before its claim is never notified, even when
 *       it expired in the same sweep.</li>
 * </ul>
 * An entry expires when {@code now >= expiry}; {@code get} returns it only while
 * {@code expiry > now}.
 *
 * <h2>Lifecycle</h2>
 * The sweep is armed on construction and re-armed after every run until
 * {@link #shutdown()}, which also drops all entries without notifying the
 * listener.
 *
 * <h2>Thread Safety</h2>
 * The sweep runs on the scheduler's thread while get/set/remove arrive from the
 * transport's event loop. All access to the entry map is serialized on this
 * registry's monitor. The listener runs outside it, so a slow listener never
 * blocks {@link #take(Object)}.
 */
public final class TimeBoundedRegistry<K, V> {

    private static final Logger log = LoggerFactory.getLogger(TimeBoundedRegistry.class);

    private final Map<K, Entry<V>> entries = new HashMap<>();

    private final long ttlNanos;
    private final Duration sweepInterval;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final ExpiryListener<K, V> listener;

    private Cancellable pendingSweep;
    private boolean shutdown;

    public TimeBoundedRegistry(Duration ttl,
                               Duration sweepInterval,
                               MonotonicClock clock,
                               MonotonicScheduler scheduler,
                               ExpiryListener<K, V> listener) {
        Objects.requireNonNull(ttl, "ttl");
        this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.listener = Objects.requireNonNull(listener, "listener");

        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
        this.ttlNanos = ttl.toNanos();

        synchronized (this) {
            armSweep();
        }
    }

    /**
     * Store {@code value} under {@code key} with expiry {@code now + ttl},
     * replacing any existing entry for the key.
     */
    public synchronized void set(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        entries.put(key, new Entry<>(value, clock.nowNanos() + ttlNanos));
    }

    /**
     * Returns the value for {@code key} if it has not expired. An expired entry
     * is evicted as a side effect, without notifying the listener.
     */
    public synchronized Optional<V> get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiryNanos() - clock.nowNanos() > 0) {
            return Optional.of(entry.value());
        }
        entries.remove(key);
        return Optional.empty();
    }

    /**
     * Atomically return and delete the live entry for {@code key}. An expired
     * entry is evicted and reported as absent, exactly as {@link #get(Object)}.
     * A sweep can never notify the listener for an entry taken here.
     */
    public synchronized Optional<V> take(K key) {
        Optional<V> live = get(key);
        live.ifPresent(v -> entries.remove(key));
        return live;
    }

    /**
     * Delete the entry for {@code key}, if any, without notifying the listener.
     *
     * @return the removed value, regardless of whether it had expired
     */
    public synchronized Optional<V> remove(K key) {
        Entry<V> removed = entries.remove(key);
        return removed == null ? Optional.empty() : Optional.of(removed.value());
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isShutdown() {
        return shutdown;
    }

    /**
     * Stop the periodic sweep and drop every entry without notifying the listener.
     * Further calls are no-ops.
     */
    public synchronized void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        if (pendingSweep != null) {
            pendingSweep.cancel();
            pendingSweep = null;
        }
        entries.clear();
    }

    /**
     * Run one sweep now: claim and notify every entry with {@code expiry <= now}.
     * Normally driven by the scheduler; exposed for callers that drive time
     * explicitly.
     *
     * @return number of entries notified
     */
    public int sweep() {
        List<Map.Entry<K, Entry<V>>> expired = new ArrayList<>();
        synchronized (this) {
            long now = clock.nowNanos();
            for (Map.Entry<K, Entry<V>> e : entries.entrySet()) {
                if (e.getValue().expiryNanos() - now <= 0) {
                    expired.add(Map.entry(e.getKey(), e.getValue()));
                }
            }
        }

        int notified = 0;
        for (Map.Entry<K, Entry<V>> e : expired) {
            // An earlier listener in this sweep may have removed or replaced it.
            if (!claim(e.getKey(), e.getValue())) {
                continue;
            }
            notified++;
            try {
                listener.onExpire(e.getKey(), e.getValue().value());
            } catch (RuntimeException ex) {
                log.warn("Expiry listener failed for key {}", e.getKey(), ex);
            }
        }
        return notified;
    }

    private synchronized boolean claim(K key, Entry<V> expected) {
        if (entries.get(key) != expected) {
            return false;
        }
        entries.remove(key);
        return true;
    }

    private void runScheduledSweep() {
        synchronized (this) {
            if (shutdown) {
                return;
            }
        }
        try {
            sweep();
        } finally {
            synchronized (this) {
                if (!shutdown) {
                    armSweep();
                }
            }
        }
    }

    private void armSweep() {
        pendingSweep = scheduler.scheduleAfter(sweepInterval, clock, this::runScheduledSweep);
    }

    private record Entry<V>(V value, long expiryNanos) {
    }
}
