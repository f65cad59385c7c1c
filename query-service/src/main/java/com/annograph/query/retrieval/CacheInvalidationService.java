package com.annograph.query.retrieval;

import com.annograph.caching.registry.CacheRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drops cached retrievals after a review action. With an extract, only entries filtered by
 * that extract are affected; without one, every entry of the document goes.
 */
@Service
public class CacheInvalidationService {

    private static final Logger log = LoggerFactory.getLogger(CacheInvalidationService.class);

    private final CacheRegistry cacheRegistry;

    public CacheInvalidationService(CacheRegistry cacheRegistry) {
        this.cacheRegistry = cacheRegistry;
    }

    public long invalidate(long documentId, Long extractId) {
        long removed = extractId == null
                ? cacheRegistry.invalidateDocument(documentId)
                : cacheRegistry.invalidateExtract(documentId, extractId);
        log.info("event=retrieval_cache_invalidated document_id={} extract_id={} keys={}", documentId, extractId, removed);
        return removed;
    }
}
