package com.annograph.caching.store;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-process cache used when no Redis is configured, and by tests that need to drive TTL
 * expiry through a {@link Clock}. Pattern delete is not offered, so invalidation goes through
 * the registry.
 *
 * <p>Entries created through {@link #putIfAbsent} are leases: overflow eviction only drops
 * result entries and never a live lease.</p>
 */
public class InMemoryCacheStore implements CacheStore {

    private final Clock clock;
    private final int maxEntries;
    private final ConcurrentHashMap<String, CacheEntry> values = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SetEntry> sets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public InMemoryCacheStore(Clock clock, int maxEntries) {
        this.clock = clock;
        this.maxEntries = Math.max(100, maxEntries);
    }

    @Override
    public String get(String key) {
        CacheEntry entry = values.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.expiresAtMillis <= clock.millis()) {
            values.remove(key, entry);
            return null;
        }
        return entry.value;
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        if (values.size() >= maxEntries) {
            evictResults();
        }
        values.put(key, new CacheEntry(value, expiresAt(ttl), false));
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        long now = clock.millis();
        CacheEntry fresh = new CacheEntry(value, expiresAt(ttl), true);
        CacheEntry winner = values.compute(key, (k, existing) ->
                existing == null || existing.expiresAtMillis <= now ? fresh : existing);
        return winner == fresh;
    }

    @Override
    public long delete(Collection<String> keys) {
        long deleted = 0L;
        for (String key : keys) {
            if (values.remove(key) != null) {
                deleted++;
            }
            if (sets.remove(key) != null) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public boolean deleteIfValue(String key, String expected) {
        boolean[] removed = {false};
        values.computeIfPresent(key, (k, existing) -> {
            if (existing.value.equals(expected)) {
                removed[0] = true;
                return null;
            }
            return existing;
        });
        return removed[0];
    }

    @Override
    public long increment(String counterKey) {
        return counters.computeIfAbsent(counterKey, k -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public long counter(String counterKey) {
        AtomicLong value = counters.get(counterKey);
        return value == null ? 0L : value.get();
    }

    @Override
    public void addToSet(String setKey, String member, Duration ttl) {
        long expiresAt = expiresAt(ttl);
        sets.compute(setKey, (k, existing) -> {
            SetEntry entry = existing == null || existing.expiresAtMillis <= clock.millis()
                    ? new SetEntry(expiresAt)
                    : existing;
            entry.members.add(member);
            entry.expiresAtMillis = expiresAt;
            return entry;
        });
    }

    @Override
    public Set<String> members(String setKey) {
        SetEntry entry = sets.get(setKey);
        if (entry == null) {
            return Set.of();
        }
        if (entry.expiresAtMillis <= clock.millis()) {
            sets.remove(setKey, entry);
            return Set.of();
        }
        return Set.copyOf(entry.members);
    }

    @Override
    public boolean supportsPatternDelete() {
        return false;
    }

    @Override
    public long deleteByPattern(String pattern) {
        throw new UnsupportedOperationException("in-memory cache has no pattern delete");
    }

    private void evictResults() {
        long now = clock.millis();
        values.entrySet().removeIf(entry -> !entry.getValue().lease || entry.getValue().expiresAtMillis <= now);
    }

    private long expiresAt(Duration ttl) {
        return clock.millis() + Math.max(1L, ttl.toMillis());
    }

    private record CacheEntry(String value, long expiresAtMillis, boolean lease) {
    }

    private static class SetEntry {
        private final Set<String> members = ConcurrentHashMap.newKeySet();
        private volatile long expiresAtMillis;

        private SetEntry(long expiresAtMillis) {
            this.expiresAtMillis = expiresAtMillis;
        }
    }
}
