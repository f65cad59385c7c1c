package com.annograph.caching.registry;

import com.annograph.caching.key.CacheKeyBuilder;
import com.annograph.caching.store.CacheBackendException;
import com.annograph.caching.store.CacheStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Records which result keys exist under each {@link RegistryScope} so a domain event can drop
 * every affected entry without enumerating filter combinations or relying on wildcard deletes.
 *
 * <p>Each scope also carries a generation counter that every invalidation bumps before it
 * deletes anything. A writer that read the generations before computing can tell whether its
 * result was invalidated while it was being computed.</p>
 */
@Component
public class CacheRegistry {

    private static final Logger log = LoggerFactory.getLogger(CacheRegistry.class);

    private final CacheStore cacheStore;
    private final MeterRegistry meterRegistry;
    private final Duration registryTtl;

    public CacheRegistry(CacheStore cacheStore) {
        this(cacheStore, null, 300L);
    }

    @Autowired
    public CacheRegistry(
            CacheStore cacheStore,
            MeterRegistry meterRegistry,
            @Value("${annograph.cache.ttl-seconds:300}") long cacheTtlSeconds
    ) {
        this.cacheStore = cacheStore;
        this.meterRegistry = meterRegistry;
        // registry sets outlive the entries they point to
        this.registryTtl = Duration.ofSeconds(Math.max(1L, cacheTtlSeconds) * 2);
    }

    public void register(String cacheKey, Collection<String> scopes) {
        for (String scope : scopes) {
            cacheStore.addToSet(scope, cacheKey, registryTtl);
        }
    }

    public Set<String> keysFor(String scope) {
        return cacheStore.members(scope);
    }

    /**
     * Current generation of every scope, in iteration order.
     *
     * @throws CacheBackendException when the backend cannot serve the read
     */
    public Map<String, Long> generations(Collection<String> scopes) {
        Map<String, Long> generations = new LinkedHashMap<>();
        for (String scope : scopes) {
            generations.put(scope, cacheStore.counter(RegistryScope.generation(scope)));
        }
        return generations;
    }

    /**
     * @throws CacheBackendException when the backend cannot serve the read
     */
    public boolean isCurrent(Map<String, Long> generations) {
        return generations(generations.keySet()).equals(generations);
    }

    /**
     * Deletes every result key recorded under {@code scope}, then the scope itself.
     */
    public long invalidate(String scope) {
        try {
            cacheStore.increment(RegistryScope.generation(scope));
            Set<String> keys = cacheStore.members(scope);
            List<String> doomed = new ArrayList<>(keys.size() + 1);
            doomed.addAll(keys);
            doomed.add(scope);
            cacheStore.delete(doomed);
            incrementCounter("cache_invalidated_keys_total", keys.size());
            log.info("event=cache_invalidate scope={} keys={}", scope, keys.size());
            return keys.size();
        } catch (CacheBackendException ex) {
            incrementCounter("retrieval_cache_error_total", 1);
            log.warn("event=cache_invalidate_failed scope={} cause={}", scope, ex.getMessage());
            return 0L;
        }
    }

    /**
     * Drops every cached result of a document. Uses a pattern delete when the backend offers
     * one, and always walks the document scope so keys are reached either way.
     */
    public long invalidateDocument(long documentId) {
        long patternDeleted = 0L;
        if (cacheStore.supportsPatternDelete()) {
            try {
                patternDeleted = cacheStore.deleteByPattern(CacheKeyBuilder.documentPattern(documentId));
            } catch (CacheBackendException | UnsupportedOperationException ex) {
                log.warn("event=cache_pattern_delete_failed document_id={} cause={}", documentId, ex.getMessage());
            }
        }
        long registryDeleted = invalidate(RegistryScope.document(documentId));
        return Math.max(patternDeleted, registryDeleted);
    }

    public long invalidateExtract(long documentId, long extractId) {
        return invalidate(RegistryScope.documentExtract(documentId, extractId));
    }

    private void incrementCounter(String metricName, long amount) {
        if (meterRegistry == null || amount <= 0) {
            return;
        }
        meterRegistry.counter(metricName).increment(amount);
    }
}
