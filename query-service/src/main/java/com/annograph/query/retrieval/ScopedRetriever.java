package com.annograph.query.retrieval;

import com.annograph.caching.registry.RegistryScope;
import com.annograph.query.filter.AnalysisScope;
import com.annograph.query.filter.FilterSet;
import com.annograph.query.model.UserIdentity;
import com.annograph.query.permission.PermissionGate;
import com.annograph.query.store.EntityStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Permission check, per-user cache lookup and single-flight computation shared by the
 * annotation and relationship retrievers.
 *
 * @param <R> record type resolved by {@link #fetch}
 */
public abstract class ScopedRetriever<R> {

    private static final Logger log = LoggerFactory.getLogger(ScopedRetriever.class);

    protected final EntityStore entityStore;
    protected final PermissionGate permissionGate;
    private final ResultCache resultCache;
    private final MeterRegistry meterRegistry;
    private final String namespace;
    private final String metricPrefix;
    private final ConcurrentHashMap<String, Object> inFlightLocks = new ConcurrentHashMap<>();

    protected ScopedRetriever(
            String namespace,
            String metricPrefix,
            EntityStore entityStore,
            PermissionGate permissionGate,
            ResultCache resultCache,
            MeterRegistry meterRegistry
    ) {
        this.namespace = namespace;
        this.metricPrefix = metricPrefix;
        this.entityStore = entityStore;
        this.permissionGate = permissionGate;
        this.resultCache = resultCache;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Ordered ids visible to {@code user}. Empty when the user may not read the document, the
     * corpus or the requested analysis.
     *
     * @throws com.annograph.query.store.RetrievalException when the entity store fails
     */
    public List<Long> get(long documentId, UserIdentity user, FilterSet filters) {
        long start = System.nanoTime();
        if (!isPermitted(documentId, user, filters)) {
            incrementCounter("retrieval_permission_denied_total");
            log.debug("event={}_retrieval_denied document_id={} user={}", metricPrefix, documentId, user.cacheKey());
            return List.of();
        }

        String cacheKey = resultCache.keyFor(namespace, documentId, filters, user);
        List<Long> cached = resultCache.read(cacheKey);
        if (cached != null) {
            incrementCounter(metricPrefix + "_cache_hit_total");
            recordTimer(start);
            return cached;
        }
        incrementCounter(metricPrefix + "_cache_miss_total");

        Object lock = inFlightLocks.computeIfAbsent(cacheKey, ignored -> new Object());
        try {
            synchronized (lock) {
                cached = resultCache.read(cacheKey);
                if (cached != null) {
                    recordTimer(start);
                    return cached;
                }
                Map<String, Long> generations = resultCache.generations(registryScopes(documentId, filters));
                List<Long> ids = List.copyOf(compute(documentId, user, filters));
                resultCache.write(cacheKey, ids, generations);
                recordTimer(start);
                log.info(
                        "event={}_retrieval_computed document_id={} user={} ids={} total_ms={}",
                        metricPrefix,
                        documentId,
                        user.cacheKey(),
                        ids.size(),
                        elapsedMillis(start)
                );
                return ids;
            }
        } finally {
            inFlightLocks.remove(cacheKey, lock);
        }
    }

    /**
     * Resolves {@link #get} to records with one batch store call, cache hit or not. Ids whose
     * rows disappeared since they were cached are skipped.
     */
    public List<R> fetch(long documentId, UserIdentity user, FilterSet filters) {
        List<Long> ids = get(documentId, user, filters);
        if (ids.isEmpty()) {
            return List.of();
        }
        Map<Long, R> byId = new HashMap<>();
        for (R record : loadByIds(ids)) {
            byId.put(idOf(record), record);
        }
        List<R> ordered = new ArrayList<>(ids.size());
        for (Long id : ids) {
            R record = byId.get(id);
            if (record != null) {
                ordered.add(record);
            }
        }
        return ordered;
    }

    protected abstract List<Long> compute(long documentId, UserIdentity user, FilterSet filters);

    protected abstract List<R> loadByIds(Collection<Long> ids);

    protected abstract long idOf(R record);

    protected boolean isPermitted(long documentId, UserIdentity user, FilterSet filters) {
        if (!permissionGate.canRead(user, documentId, filters.corpusId())) {
            return false;
        }
        AnalysisScope analysis = filters.analysis();
        return analysis.kind() != AnalysisScope.Kind.SPECIFIC
                || permissionGate.canViewAnalysis(user, analysis.analysisId());
    }

    static List<String> registryScopes(long documentId, FilterSet filters) {
        List<String> scopes = new ArrayList<>(3);
        scopes.add(RegistryScope.document(documentId));
        if (filters.corpusId() != null) {
            scopes.add(RegistryScope.documentCorpus(documentId, filters.corpusId()));
        }
        if (filters.extractId() != null) {
            scopes.add(RegistryScope.documentExtract(documentId, filters.extractId()));
        }
        return scopes;
    }

    private void recordTimer(long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer(metricPrefix + "_retrieval_ms").record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment();
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
