package com.questrail.simplerpc.registry;

/**
 * Callback invoked by a {@link TimeBoundedRegistry} sweep for each entry whose
 * expiry has passed. The sweep has already claimed the entry, so it is no longer
 * in the registry when the callback runs; a callback may set the same key again.
 *
 * <p>Not invoked for entries evicted lazily by {@code get}, removed or taken
 * before the sweep claims them, or dropped by {@code shutdown()}.</p>
 */
@FunctionalInterface
public interface ExpiryListener<K, V>
{
    void onExpire(K key, V value);
}
