package com.annograph.caching.lease;

import com.annograph.caching.store.CacheBackendException;
import com.annograph.caching.store.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cooperative mutex built on add-if-absent with a TTL.
 *
 * <p>A lease is never owned in the locking sense: if the holder dies the entry expires and the
 * next caller acquires it. Every acquisition carries its own token and only that token can
 * release it. When the cache backend is unreachable the lease falls back to a process-local
 * table with the same expiry rules.</p>
 */
public class LeaseMutex {

    private static final Logger log = LoggerFactory.getLogger(LeaseMutex.class);

    private final CacheStore cacheStore;
    private final Clock clock;
    private final ConcurrentHashMap<String, LocalLease> localLeases = new ConcurrentHashMap<>();

    public LeaseMutex(CacheStore cacheStore) {
        this(cacheStore, Clock.systemUTC());
    }

    public LeaseMutex(CacheStore cacheStore, Clock clock) {
        this.cacheStore = cacheStore;
        this.clock = clock;
    }

    /**
     * @return the acquired lease, empty while another holder's lease is live
     */
    public Optional<Lease> tryAcquireLease(String key, Duration ttl) {
        String token = UUID.randomUUID().toString();
        boolean acquired;
        try {
            acquired = cacheStore.putIfAbsent(key, token, ttl);
        } catch (CacheBackendException ex) {
            log.warn("event=lease_backend_unavailable key={} cause={}", key, ex.getMessage());
            acquired = tryAcquireLocal(key, token, ttl);
        }
        return acquired ? Optional.of(new Lease(key, token)) : Optional.empty();
    }

    /**
     * Releases {@code lease}. A lease that already expired and was taken by someone else is
     * left alone.
     */
    public void release(Lease lease) {
        localLeases.computeIfPresent(lease.key(), (k, existing) ->
                existing.token().equals(lease.token()) ? null : existing);
        try {
            if (!cacheStore.deleteIfValue(lease.key(), lease.token())) {
                log.debug("event=lease_release_skipped key={} cause=not_holder", lease.key());
            }
        } catch (CacheBackendException ex) {
            log.debug("event=lease_release_skipped key={} cause={}", lease.key(), ex.getMessage());
        }
    }

    /**
     * Whether any holder, in this process or another, has a live lease on {@code key}.
     */
    public boolean isLeased(String key) {
        LocalLease local = localLeases.get(key);
        if (local != null && local.expiresAtMillis() > clock.millis()) {
            return true;
        }
        try {
            return cacheStore.get(key) != null;
        } catch (CacheBackendException ex) {
            return false;
        }
    }

    private boolean tryAcquireLocal(String key, String token, Duration ttl) {
        long now = clock.millis();
        LocalLease fresh = new LocalLease(token, now + Math.max(1L, ttl.toMillis()));
        LocalLease winner = localLeases.compute(key, (k, existing) ->
                existing != null && existing.expiresAtMillis() > now ? existing : fresh);
        return winner == fresh;
    }

    public record Lease(String key, String token) {
    }

    private record LocalLease(String token, long expiresAtMillis) {
    }
}
