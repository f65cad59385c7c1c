package com.annograph.query.retrieval;

import com.annograph.caching.key.CacheKeyBuilder;
import com.annograph.caching.registry.CacheRegistry;
import com.annograph.caching.registry.RegistryScope;
import com.annograph.caching.store.InMemoryCacheStore;
import com.annograph.query.filter.AnalysisScope;
import com.annograph.query.filter.FilterSet;
import com.annograph.query.model.RelationshipRecord;
import com.annograph.query.model.RelationshipSummary;
import com.annograph.query.model.UserIdentity;
import com.annograph.query.permission.PermissionGate;
import com.annograph.query.permission.PermissionedType;
import com.annograph.query.support.InMemoryEntityStore;
import com.annograph.query.support.InMemoryPermissionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class RelationshipRetrieverTest {

    private static final long DOCUMENT = 1L;
    private static final long CORPUS = 10L;
    private static final UserIdentity OWNER = UserIdentity.of(5L);

    private InMemoryEntityStore entityStore;
    private InMemoryPermissionStore permissionStore;
    private CacheRegistry cacheRegistry;
    private SimpleMeterRegistry meterRegistry;
    private RelationshipRetriever retriever;

    @BeforeEach
    void setUp() {
        entityStore = new InMemoryEntityStore()
                .annotation(1L, DOCUMENT, CORPUS, null, false, 1, "Party")
                .annotation(3L, DOCUMENT, CORPUS, null, false, 2, "Term")
                .annotation(9L, DOCUMENT, CORPUS, null, false, 3, "Party")
                .add(new RelationshipRecord(100L, DOCUMENT, CORPUS, null, false, "refers_to", List.of(1L), List.of(9L)))
                .add(new RelationshipRecord(101L, DOCUMENT, null, 5L, true, "section_of", List.of(3L), List.of(1L)))
                .add(new RelationshipRecord(102L, DOCUMENT, CORPUS, 5L, false, "defines", List.of(9L), List.of(3L)))
                .extractSources(7L, DOCUMENT, 1L, 3L);
        permissionStore = new InMemoryPermissionStore()
                .privateObject(PermissionedType.DOCUMENT, DOCUMENT, 5L)
                .publicObject(PermissionedType.CORPUS, CORPUS)
                .publicObject(PermissionedType.ANALYSIS, 5L);
        InMemoryCacheStore cacheStore = new InMemoryCacheStore(Clock.systemUTC(), 1000);
        cacheRegistry = new CacheRegistry(cacheStore);
        meterRegistry = new SimpleMeterRegistry();
        ResultCache resultCache = new ResultCache(
                cacheStore, cacheRegistry, new CacheKeyBuilder(200), new ObjectMapper(), meterRegistry, 300L, true);
        retriever = new RelationshipRetriever(entityStore, new PermissionGate(permissionStore), resultCache, meterRegistry);
    }

    @Test
    void strictExtractModeDropsRelationshipsWithAnEndpointOutsideTheExtract() {
        FilterSet lenient = FilterSet.none().withCorpus(CORPUS).withExtract(7L);

        assertThat(retriever.get(DOCUMENT, OWNER, lenient)).containsExactly(100L, 101L, 102L);
        assertThat(retriever.get(DOCUMENT, OWNER, lenient.withStrictExtractMode(true))).containsExactly(101L);
        assertThat(cacheRegistry.keysFor(RegistryScope.documentExtract(DOCUMENT, 7L))).hasSize(2);
    }

    @Test
    void humanOnlyFilterStillReturnsStructuralRelationships() {
        FilterSet filters = FilterSet.none().withCorpus(CORPUS).withAnalysis(AnalysisScope.humanOnly());

        assertThat(retriever.get(DOCUMENT, OWNER, filters)).containsExactly(100L, 101L);
    }

    @Test
    void specificAnalysisHasNoStructuralCarveOut() {
        FilterSet filters = FilterSet.none().withCorpus(CORPUS).withAnalysis(AnalysisScope.specific(5L));

        assertThat(retriever.get(DOCUMENT, OWNER, filters)).containsExactly(101L, 102L);
    }

    @Test
    void pageFilterMatchesOnEndpointPages() {
        FilterSet filters = FilterSet.none().withCorpus(CORPUS).withPages(List.of(3));

        assertThat(retriever.get(DOCUMENT, OWNER, filters)).containsExactly(100L, 102L);
    }

    @Test
    void withoutCorpusOnlyStructuralRelationshipsRemain() {
        assertThat(retriever.get(DOCUMENT, OWNER, FilterSet.none())).containsExactly(101L);
    }

    @Test
    void fetchReturnsEndpointsWithoutPerRelationshipLookups() {
        FilterSet filters = FilterSet.none().withCorpus(CORPUS);
        retriever.fetch(DOCUMENT, OWNER, filters);

        List<RelationshipRecord> cached = retriever.fetch(DOCUMENT, OWNER, filters);

        assertThat(cached).extracting(RelationshipRecord::id).containsExactly(100L, 101L, 102L);
        assertThat(cached.get(0).sourceIds()).containsExactly(1L);
        assertThat(cached.get(0).targetIds()).containsExactly(9L);
        assertThat(entityStore.batchLoads.get()).isEqualTo(2);
        assertThat(meterRegistry.counter("relationship_cache_hit_total").count()).isEqualTo(1.0);
    }

    @Test
    void summaryCountsCorpusRelationshipsByLabel() {
        RelationshipSummary summary = retriever.summarize(DOCUMENT, CORPUS, OWNER);

        assertThat(summary.getTotal()).isEqualTo(2L);
        assertThat(summary.getByType()).containsExactly(entry("defines", 1L), entry("refers_to", 1L));
    }

    @Test
    void unlabeledRelationshipsCountTowardTotalButNotByType() {
        entityStore
                .add(new RelationshipRecord(103L, DOCUMENT, CORPUS, null, false, "", List.of(1L), List.of(3L)))
                .add(new RelationshipRecord(104L, DOCUMENT, CORPUS, null, false, null, List.of(3L), List.of(9L)));

        RelationshipSummary summary = retriever.summarize(DOCUMENT, CORPUS, OWNER);

        assertThat(summary.getTotal()).isEqualTo(4L);
        assertThat(summary.getByType()).containsOnlyKeys("defines", "refers_to");
        assertThat(entityStore.documentScans.get()).isZero();
    }

    @Test
    void summaryIsEmptyForUsersWhoCannotReadTheDocument() {
        RelationshipSummary summary = retriever.summarize(DOCUMENT, CORPUS, UserIdentity.of(99L));

        assertThat(summary.getTotal()).isZero();
        assertThat(summary.getByType()).isEmpty();
    }
}
