package com.annograph.query.controller;

import com.annograph.aggregate.AggregateViewManager;
import com.annograph.aggregate.source.DatacellSourceLink;
import com.annograph.aggregate.source.DatacellSourceReader;
import com.annograph.aggregate.staleness.StalenessMonitor;
import com.annograph.aggregate.view.InMemoryAggregateViewStore;
import com.annograph.caching.key.CacheKeyBuilder;
import com.annograph.caching.lease.LeaseMutex;
import com.annograph.caching.registry.CacheRegistry;
import com.annograph.caching.store.InMemoryCacheStore;
import com.annograph.query.model.RelationshipRecord;
import com.annograph.query.model.UserIdentity;
import com.annograph.query.permission.PermissionGate;
import com.annograph.query.permission.PermissionedType;
import com.annograph.query.permission.UserResolver;
import com.annograph.query.retrieval.AnnotationRetriever;
import com.annograph.query.retrieval.CacheInvalidationService;
import com.annograph.query.retrieval.ExtractSummaryService;
import com.annograph.query.retrieval.RelationshipRetriever;
import com.annograph.query.retrieval.ResultCache;
import com.annograph.query.service.DocumentQueryService;
import com.annograph.query.service.ExtractQueryService;
import com.annograph.query.support.InMemoryEntityStore;
import com.annograph.query.support.InMemoryPermissionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DocumentControllerTest {

    private InMemoryEntityStore entityStore;
    private AggregateViewManager viewManager;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        entityStore = new InMemoryEntityStore()
                .annotation(1L, 1L, null, null, true, 2, "Header")
                .annotation(2L, 1L, 10L, null, false, 2, "Party")
                .annotation(3L, 1L, 10L, null, false, 2, "Party")
                .add(new RelationshipRecord(100L, 1L, 10L, null, false, "refers_to", List.of(2L), List.of(3L)))
                .extract(7L, 10L)
                .datacell(70L, 7L, 1L, 2L, 3L);
        InMemoryPermissionStore permissionStore = new InMemoryPermissionStore()
                .user(UserIdentity.of(5L))
                .privateObject(PermissionedType.DOCUMENT, 1L, 5L)
                .publicObject(PermissionedType.CORPUS, 10L)
                .corpusScopedObject(PermissionedType.EXTRACT, 7L, 5L, 10L);
        InMemoryCacheStore cacheStore = new InMemoryCacheStore(Clock.systemUTC(), 1000);
        CacheRegistry cacheRegistry = new CacheRegistry(cacheStore);
        PermissionGate gate = new PermissionGate(permissionStore);
        ResultCache resultCache = new ResultCache(cacheStore, cacheRegistry, new CacheKeyBuilder(200));
        viewManager = new AggregateViewManager(
                new StaticSourceReader(List.of(
                        new DatacellSourceLink(7L, 1L, 2L, 2, "Party"),
                        new DatacellSourceLink(7L, 1L, 3L, 2, "Party")
                )),
                new InMemoryAggregateViewStore(),
                new LeaseMutex(cacheStore),
                cacheRegistry,
                Runnable::run,
                Clock.systemUTC()
        );
        DocumentQueryService queryService = new DocumentQueryService(
                new AnnotationRetriever(entityStore, gate, resultCache),
                new RelationshipRetriever(entityStore, gate, resultCache),
                new ExtractSummaryService(entityStore, gate, viewManager),
                new CacheInvalidationService(cacheRegistry)
        );
        mockMvc = MockMvcBuilders.standaloneSetup(
                        new DocumentController(queryService, new UserResolver(permissionStore)),
                        new CacheAdminController(queryService),
                        new ExtractController(new ExtractQueryService(entityStore, gate), new UserResolver(permissionStore)),
                        new AggregateController(viewManager, new StalenessMonitor(viewManager, Clock.systemUTC(), 300L))
                )
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @Test
    void annotationsEndpointAppliesFiltersForTheHeaderUser() throws Exception {
        mockMvc.perform(get("/api/documents/1/annotations")
                        .param("corpusId", "10")
                        .param("structural", "false")
                        .header(UserResolver.USER_HEADER, "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[*].id", contains(2, 3)))
                .andExpect(jsonPath("$[0].label").value("Party"));
    }

    @Test
    void anonymousCallersSeeAnEmptyList() throws Exception {
        mockMvc.perform(get("/api/documents/1/annotations").param("corpusId", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void relationshipsEndpointReturnsEndpoints() throws Exception {
        mockMvc.perform(get("/api/documents/1/relationships")
                        .param("corpusId", "10")
                        .header(UserResolver.USER_HEADER, "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(100))
                .andExpect(jsonPath("$[0].sourceIds[0]").value(2))
                .andExpect(jsonPath("$[0].targetIds[0]").value(3));
    }

    @Test
    void extractSummaryReportsItsSource() throws Exception {
        viewManager.refresh("startup");

        mockMvc.perform(get("/api/documents/1/extracts/7/summary").header(UserResolver.USER_HEADER, "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.pages[0]").value(2))
                .andExpect(jsonPath("$.source").value("aggregate"));
    }

    @Test
    void relationshipSummaryCountsByType() throws Exception {
        mockMvc.perform(get("/api/documents/1/corpuses/10/relationship-summary").header(UserResolver.USER_HEADER, "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.byType.refers_to").value(1));
    }

    @Test
    void extractDatacellsEndpointListsCellsWithSources() throws Exception {
        mockMvc.perform(get("/api/extracts").param("corpusId", "10").header(UserResolver.USER_HEADER, "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].id", contains(7)));

        mockMvc.perform(get("/api/extracts/7/datacells").header(UserResolver.USER_HEADER, "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(70))
                .andExpect(jsonPath("$[0].sourceAnnotationIds", contains(2, 3)));

        mockMvc.perform(get("/api/extracts/7/datacells"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void storeFailureMapsToServiceUnavailable() throws Exception {
        entityStore.failing = true;

        mockMvc.perform(get("/api/documents/1/annotations").param("corpusId", "10").header(UserResolver.USER_HEADER, "5"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("retrieval_unavailable"));
    }

    @Test
    void badParametersMapToBadRequest() throws Exception {
        mockMvc.perform(get("/api/documents/1/annotations").param("analysisId", "-3").header(UserResolver.USER_HEADER, "5"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/documents/1/annotations").header(UserResolver.USER_HEADER, "abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void invalidateEndpointReportsRemovedKeys() throws Exception {
        mockMvc.perform(get("/api/documents/1/annotations").param("corpusId", "10").header(UserResolver.USER_HEADER, "5"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/cache/invalidate").param("documentId", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentId").value(1))
                .andExpect(jsonPath("$.invalidatedKeys").value(1));
    }

    @Test
    void aggregateEndpointsRefreshAndReportStaleness() throws Exception {
        mockMvc.perform(get("/api/aggregates/staleness"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].stale").value(true));

        mockMvc.perform(post("/api/aggregates/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scheduled").value(true));

        mockMvc.perform(get("/api/aggregates/staleness"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].stale").value(false))
                .andExpect(jsonPath("$[0].rowCount").value(2));
    }

    private record StaticSourceReader(List<DatacellSourceLink> links) implements DatacellSourceReader {

        @Override
        public List<DatacellSourceLink> loadAllSourceLinks() {
            return links;
        }

        @Override
        public List<DatacellSourceLink> loadSourceLinks(long extractId, long documentId) {
            return links.stream()
                    .filter(link -> link.extractId() == extractId && link.documentId() == documentId)
                    .toList();
        }
    }
}
