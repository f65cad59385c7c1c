package com.annograph.query.retrieval;

import com.annograph.caching.key.CacheKeyBuilder;
import com.annograph.caching.registry.CacheRegistry;
import com.annograph.caching.store.CacheBackendException;
import com.annograph.caching.store.CacheStore;
import com.annograph.query.filter.FilterSet;
import com.annograph.query.model.UserIdentity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Id-list cache in front of the retrievers. Entries hold ids only, never records, and every
 * write is recorded in the {@link CacheRegistry} before the entry itself is stored so that an
 * entry cannot exist without a registry trail. Writes are fenced by registry generations so a
 * result computed across an invalidation is never kept.
 *
 * <p>Backend failures never escape: reads degrade to a miss and writes are dropped.</p>
 */
@Component
public class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);
    private static final TypeReference<List<Long>> ID_LIST = new TypeReference<>() {
    };

    private final CacheStore cacheStore;
    private final CacheRegistry cacheRegistry;
    private final CacheKeyBuilder keyBuilder;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Duration ttl;
    private final boolean enabled;

    public ResultCache(CacheStore cacheStore, CacheRegistry cacheRegistry, CacheKeyBuilder keyBuilder) {
        this(cacheStore, cacheRegistry, keyBuilder, new ObjectMapper(), null, 300L, true);
    }

    @Autowired
    public ResultCache(
            CacheStore cacheStore,
            CacheRegistry cacheRegistry,
            CacheKeyBuilder keyBuilder,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            @Value("${annograph.cache.ttl-seconds:300}") long ttlSeconds,
            @Value("${annograph.cache.enabled:true}") boolean enabled
    ) {
        this.cacheStore = cacheStore;
        this.cacheRegistry = cacheRegistry;
        this.keyBuilder = keyBuilder;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.ttl = Duration.ofSeconds(Math.max(1L, ttlSeconds));
        this.enabled = enabled;
    }

    public String keyFor(String namespace, long documentId, FilterSet filters, UserIdentity user) {
        return keyBuilder.scopeKey(namespace, documentId, filters.cacheDimensions(), user.cacheKey());
    }

    /**
     * @return the cached ids, or null on a miss, a disabled cache or a backend failure
     */
    public List<Long> read(String cacheKey) {
        if (!enabled) {
            return null;
        }
        String payload;
        try {
            payload = cacheStore.get(cacheKey);
        } catch (CacheBackendException ex) {
            incrementCounter("retrieval_cache_error_total");
            log.warn("event=result_cache_read_failed key={} cause={}", cacheKey, ex.getMessage());
            return null;
        }
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.readValue(payload, ID_LIST);
        } catch (JsonProcessingException ex) {
            log.warn("event=result_cache_payload_invalid key={} cause={}", cacheKey, ex.getOriginalMessage());
            return null;
        }
    }

    /**
     * Registry generations of the scopes an entry will be written under. Read before computing
     * and hand the result to {@link #write}.
     *
     * @return the generations, or null when the cache is disabled or the backend fails
     */
    public Map<String, Long> generations(Collection<String> registryScopes) {
        if (!enabled) {
            return null;
        }
        try {
            return cacheRegistry.generations(registryScopes);
        } catch (CacheBackendException ex) {
            incrementCounter("retrieval_cache_error_total");
            log.warn("event=result_cache_generation_read_failed scopes={} cause={}", registryScopes, ex.getMessage());
            return null;
        }
    }

    /**
     * Stores {@code ids} under every scope of {@code generations}, unless one of those scopes
     * was invalidated since the generations were read. An invalidation that lands during the
     * write removes the entry again.
     */
    public void write(String cacheKey, List<Long> ids, Map<String, Long> generations) {
        if (!enabled || generations == null) {
            return;
        }
        try {
            if (!cacheRegistry.isCurrent(generations)) {
                skipStaleWrite(cacheKey);
                return;
            }
            cacheRegistry.register(cacheKey, generations.keySet());
            cacheStore.put(cacheKey, objectMapper.writeValueAsString(ids), ttl);
            if (!cacheRegistry.isCurrent(generations)) {
                cacheStore.delete(List.of(cacheKey));
                skipStaleWrite(cacheKey);
            }
        } catch (CacheBackendException ex) {
            incrementCounter("retrieval_cache_error_total");
            log.warn("event=result_cache_write_failed key={} cause={}", cacheKey, ex.getMessage());
        } catch (JsonProcessingException ex) {
            log.warn("event=result_cache_encode_failed key={} cause={}", cacheKey, ex.getOriginalMessage());
        }
    }

    public Duration ttl() {
        return ttl;
    }

    private void skipStaleWrite(String cacheKey) {
        incrementCounter("retrieval_cache_stale_write_total");
        log.debug("event=result_cache_write_skipped key={} cause=invalidated_during_compute", cacheKey);
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment();
    }
}
