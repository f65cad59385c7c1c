package com.annograph.query.retrieval;

import com.annograph.caching.key.CacheKeyBuilder;
import com.annograph.caching.registry.CacheRegistry;
import com.annograph.caching.registry.RegistryScope;
import com.annograph.caching.store.CacheStore;
import com.annograph.caching.store.InMemoryCacheStore;
import com.annograph.query.filter.FilterSet;
import com.annograph.query.filter.Tristate;
import com.annograph.query.model.AnnotationRecord;
import com.annograph.query.model.UserIdentity;
import com.annograph.query.permission.PermissionGate;
import com.annograph.query.permission.PermissionedType;
import com.annograph.query.store.RetrievalException;
import com.annograph.query.support.FailingCacheStore;
import com.annograph.query.support.InMemoryEntityStore;
import com.annograph.query.support.InMemoryPermissionStore;
import com.annograph.query.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnnotationRetrieverTest {

    private static final long DOCUMENT = 1L;
    private static final long CORPUS = 10L;
    private static final UserIdentity OWNER = UserIdentity.of(5L);
    private static final UserIdentity READER = UserIdentity.of(6L);

    private MutableClock clock;
    private InMemoryEntityStore entityStore;
    private InMemoryPermissionStore permissionStore;
    private InMemoryCacheStore cacheStore;
    private CacheRegistry cacheRegistry;
    private SimpleMeterRegistry meterRegistry;
    private AnnotationRetriever retriever;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        entityStore = new InMemoryEntityStore()
                .annotation(1L, DOCUMENT, null, null, true, 2, "Header")
                .annotation(2L, DOCUMENT, CORPUS, null, false, 2, "Party")
                .annotation(3L, DOCUMENT, CORPUS, null, false, 2, "Party");
        permissionStore = new InMemoryPermissionStore()
                .privateObject(PermissionedType.DOCUMENT, DOCUMENT, 5L)
                .grantRead(PermissionedType.DOCUMENT, DOCUMENT, 6L)
                .publicObject(PermissionedType.CORPUS, CORPUS);
        cacheStore = new InMemoryCacheStore(clock, 1000);
        cacheRegistry = new CacheRegistry(cacheStore);
        meterRegistry = new SimpleMeterRegistry();
        retriever = retrieverOver(cacheStore);
    }

    @Test
    void structuralCarveOutFollowsCorpusAndStructuralFilters() {
        FilterSet inCorpus = FilterSet.none().withCorpus(CORPUS);

        assertThat(retriever.get(DOCUMENT, OWNER, inCorpus)).containsExactly(1L, 2L, 3L);
        assertThat(retriever.get(DOCUMENT, OWNER, inCorpus.withStructural(Tristate.FALSE))).containsExactly(2L, 3L);
        assertThat(retriever.get(DOCUMENT, OWNER, FilterSet.none())).containsExactly(1L);
    }

    @Test
    void repeatedCallsReturnTheSameIdsFromCache() {
        FilterSet filters = FilterSet.none().withCorpus(CORPUS);

        List<Long> first = retriever.get(DOCUMENT, OWNER, filters);
        List<Long> second = retriever.get(DOCUMENT, OWNER, filters);

        assertThat(second).isEqualTo(first);
        assertThat(entityStore.documentScans.get()).isEqualTo(1);
        assertThat(meterRegistry.counter("annotation_cache_hit_total").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("annotation_cache_miss_total").count()).isEqualTo(1.0);
    }

    @Test
    void usersNeverShareCacheEntries() {
        FilterSet filters = FilterSet.none().withCorpus(CORPUS);

        retriever.get(DOCUMENT, OWNER, filters);
        retriever.get(DOCUMENT, READER, filters);

        assertThat(entityStore.documentScans.get()).isEqualTo(2);
        assertThat(cacheRegistry.keysFor(RegistryScope.document(DOCUMENT))).hasSize(2);
    }

    @Test
    void entriesAreRegisteredUnderEveryCoarserScope() {
        entityStore.extractSources(7L, DOCUMENT, 2L);

        retriever.get(DOCUMENT, OWNER, FilterSet.none().withCorpus(CORPUS).withExtract(7L));

        assertThat(cacheRegistry.keysFor(RegistryScope.document(DOCUMENT))).hasSize(1);
        assertThat(cacheRegistry.keysFor(RegistryScope.documentCorpus(DOCUMENT, CORPUS))).hasSize(1);
        assertThat(cacheRegistry.keysFor(RegistryScope.documentExtract(DOCUMENT, 7L))).hasSize(1);
    }

    @Test
    void usersWithoutDocumentAccessGetAnEmptyList() {
        FilterSet filters = FilterSet.none().withCorpus(CORPUS);

        assertThat(retriever.get(DOCUMENT, UserIdentity.of(99L), filters)).isEmpty();
        assertThat(retriever.get(DOCUMENT, UserIdentity.anonymous(), filters)).isEmpty();
        assertThat(entityStore.documentScans.get()).isZero();
        assertThat(meterRegistry.counter("retrieval_permission_denied_total").count()).isEqualTo(2.0);
    }

    @Test
    void unreadableCorpusHidesEverything() {
        permissionStore.privateObject(PermissionedType.CORPUS, 11L, 42L);

        assertThat(retriever.get(DOCUMENT, OWNER, FilterSet.none().withCorpus(11L))).isEmpty();
    }

    @Test
    void superusersSeeDocumentsTheyDoNotOwn() {
        assertThat(retriever.get(DOCUMENT, UserIdentity.superuser(1L), FilterSet.none().withCorpus(CORPUS)))
                .containsExactly(1L, 2L, 3L);
    }

    @Test
    void analysisAndExtractFiltersIntersect() {
        entityStore
                .annotation(4L, DOCUMENT, CORPUS, 5L, false, 3, "Party")
                .annotation(5L, DOCUMENT, CORPUS, 5L, false, 1, "Party")
                .extractSources(7L, DOCUMENT, 2L, 4L);
        permissionStore.publicObject(PermissionedType.ANALYSIS, 5L);

        List<Long> ids = retriever.get(DOCUMENT, OWNER, FilterSet.of(CORPUS, null, null, 5L, 7L));

        assertThat(ids).containsExactly(4L);
    }

    @Test
    void hiddenAnalysisYieldsNothing() {
        entityStore.annotation(4L, DOCUMENT, CORPUS, 8L, false, 3, "Party");
        permissionStore.privateObject(PermissionedType.ANALYSIS, 8L, 77L);

        assertThat(retriever.get(DOCUMENT, OWNER, FilterSet.of(CORPUS, null, null, 8L, null))).isEmpty();
        assertThat(retriever.get(DOCUMENT, UserIdentity.superuser(1L), FilterSet.of(CORPUS, null, null, 8L, null)))
                .containsExactly(4L);
    }

    @Test
    void annotationsDerivedFromHiddenAnalysesAreExcluded() {
        entityStore.add(new AnnotationRecord(6L, DOCUMENT, CORPUS, 8L, false, 1, "Party", 77L, 8L, null));
        entityStore.add(new AnnotationRecord(7L, DOCUMENT, CORPUS, 8L, true, 1, "Header", 77L, 8L, null));
        permissionStore.privateObject(PermissionedType.ANALYSIS, 8L, 77L);

        List<Long> ids = retriever.get(DOCUMENT, OWNER, FilterSet.none().withCorpus(CORPUS));

        assertThat(ids).containsExactly(7L, 1L, 2L, 3L);
    }

    @Test
    void resultsAreOrderedByPageThenId() {
        entityStore
                .annotation(9L, DOCUMENT, CORPUS, null, false, 1, "Party")
                .annotation(8L, DOCUMENT, CORPUS, null, false, 3, "Party")
                .annotation(4L, DOCUMENT, CORPUS, null, false, 3, "Party");

        assertThat(retriever.get(DOCUMENT, OWNER, FilterSet.none().withCorpus(CORPUS)))
                .containsExactly(9L, 1L, 2L, 3L, 4L, 8L);
    }

    @Test
    void emptyPageFilterIsTreatedAsNoRestriction() {
        FilterSet filters = FilterSet.of(CORPUS, List.of(), null, null, null);

        assertThat(retriever.get(DOCUMENT, OWNER, filters)).containsExactly(1L, 2L, 3L);
    }

    @Test
    void storeFailureIsRaisedAndNothingIsCached() {
        entityStore.failing = true;
        FilterSet filters = FilterSet.none().withCorpus(CORPUS);

        assertThatThrownBy(() -> retriever.get(DOCUMENT, OWNER, filters)).isInstanceOf(RetrievalException.class);

        entityStore.failing = false;
        assertThat(retriever.get(DOCUMENT, OWNER, filters)).containsExactly(1L, 2L, 3L);
    }

    @Test
    void cacheBackendFailureFallsBackToDirectComputation() {
        FailingCacheStore failing = new FailingCacheStore();
        AnnotationRetriever degraded = retrieverOver(failing);

        List<Long> ids = degraded.get(DOCUMENT, OWNER, FilterSet.none().withCorpus(CORPUS));

        assertThat(ids).containsExactly(1L, 2L, 3L);
        assertThat(failing.calls.get()).isPositive();
        assertThat(meterRegistry.counter("retrieval_cache_error_total").count()).isPositive();
    }

    @Test
    void entriesExpireAfterTheirTtl() {
        FilterSet filters = FilterSet.none().withCorpus(CORPUS);
        retriever.get(DOCUMENT, OWNER, filters);

        clock.advance(Duration.ofSeconds(301));
        retriever.get(DOCUMENT, OWNER, filters);

        assertThat(entityStore.documentScans.get()).isEqualTo(2);
    }

    @Test
    void invalidatingAnExtractDropsOnlyItsEntries() {
        entityStore.extractSources(7L, DOCUMENT, 2L);
        FilterSet byExtract = FilterSet.none().withCorpus(CORPUS).withExtract(7L);
        FilterSet unfiltered = FilterSet.none().withCorpus(CORPUS);
        assertThat(retriever.get(DOCUMENT, OWNER, byExtract)).containsExactly(2L);
        retriever.get(DOCUMENT, OWNER, unfiltered);

        entityStore.extractSources(7L, DOCUMENT, 3L);
        new CacheInvalidationService(cacheRegistry).invalidate(DOCUMENT, 7L);

        assertThat(retriever.get(DOCUMENT, OWNER, byExtract)).containsExactly(2L, 3L);
        retriever.get(DOCUMENT, OWNER, unfiltered);
        assertThat(entityStore.documentScans.get()).isEqualTo(3);
    }

    @Test
    void invalidationDuringComputeIsNotUndoneByTheInFlightResult() {
        FilterSet filters = FilterSet.none().withCorpus(CORPUS);
        entityStore.afterNextDocumentScan = () -> {
            entityStore.annotation(4L, DOCUMENT, CORPUS, null, false, 3, "Party");
            new CacheInvalidationService(cacheRegistry).invalidate(DOCUMENT, null);
        };

        assertThat(retriever.get(DOCUMENT, OWNER, filters)).containsExactly(1L, 2L, 3L);

        assertThat(retriever.get(DOCUMENT, OWNER, filters)).containsExactly(1L, 2L, 3L, 4L);
        assertThat(entityStore.documentScans.get()).isEqualTo(2);
        assertThat(meterRegistry.counter("retrieval_cache_stale_write_total").count()).isEqualTo(1.0);
    }

    @Test
    void fetchResolvesRecordsInOneBatchEvenOnCacheHit() {
        FilterSet filters = FilterSet.none().withCorpus(CORPUS);

        List<AnnotationRecord> first = retriever.fetch(DOCUMENT, OWNER, filters);
        List<AnnotationRecord> second = retriever.fetch(DOCUMENT, OWNER, filters);

        assertThat(second).extracting(AnnotationRecord::id).containsExactly(1L, 2L, 3L);
        assertThat(second).isEqualTo(first);
        assertThat(entityStore.documentScans.get()).isEqualTo(1);
        assertThat(entityStore.batchLoads.get()).isEqualTo(2);
    }

    @Test
    void fetchSkipsRowsDeletedSinceTheyWereCached() {
        FilterSet filters = FilterSet.none().withCorpus(CORPUS);
        retriever.get(DOCUMENT, OWNER, filters);

        entityStore.removeAnnotation(2L);

        assertThat(retriever.fetch(DOCUMENT, OWNER, filters)).extracting(AnnotationRecord::id).containsExactly(1L, 3L);
    }

    private AnnotationRetriever retrieverOver(CacheStore store) {
        ResultCache resultCache = new ResultCache(
                store,
                new CacheRegistry(store),
                new CacheKeyBuilder(200),
                new ObjectMapper(),
                meterRegistry,
                300L,
                true
        );
        return new AnnotationRetriever(entityStore, new PermissionGate(permissionStore), resultCache, meterRegistry);
    }
}
