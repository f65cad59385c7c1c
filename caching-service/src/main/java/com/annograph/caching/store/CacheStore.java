package com.annograph.caching.store;

import java.time.Duration;
import java.util.Collection;
import java.util.Set;

/**
 * Key-value cache with TTL, add-if-absent and set membership.
 *
 * <p>Implementations throw {@link CacheBackendException} when the backend cannot serve a call.
 * Callers on the read path are expected to catch it and compute the result directly.</p>
 */
public interface CacheStore {

    String get(String key);

    void put(String key, String value, Duration ttl);

    /**
     * Stores {@code value} only when {@code key} is absent.
     *
     * @return true when this call created the entry
     */
    boolean putIfAbsent(String key, String value, Duration ttl);

    long delete(Collection<String> keys);

    /**
     * Deletes {@code key} only while it still holds {@code expected}, as one atomic step.
     *
     * @return true when this call removed the entry
     */
    boolean deleteIfValue(String key, String expected);

    /**
     * Atomically increments a counter that never expires and is never evicted.
     *
     * @return the value after the increment
     */
    long increment(String counterKey);

    /**
     * @return the counter value, 0 when it was never incremented
     */
    long counter(String counterKey);

    void addToSet(String setKey, String member, Duration ttl);

    Set<String> members(String setKey);

    /**
     * Whether {@link #deleteByPattern(String)} is available on this backend.
     */
    boolean supportsPatternDelete();

    /**
     * Deletes every key matching a glob pattern.
     *
     * @throws UnsupportedOperationException when {@link #supportsPatternDelete()} is false
     */
    long deleteByPattern(String pattern);
}
