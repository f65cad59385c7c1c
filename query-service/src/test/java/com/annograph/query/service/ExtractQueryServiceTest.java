package com.annograph.query.service;

import com.annograph.query.model.DatacellRecord;
import com.annograph.query.model.ExtractRecord;
import com.annograph.query.model.UserIdentity;
import com.annograph.query.permission.PermissionGate;
import com.annograph.query.permission.PermissionedType;
import com.annograph.query.support.InMemoryEntityStore;
import com.annograph.query.support.InMemoryPermissionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractQueryServiceTest {

    private static final UserIdentity USER = UserIdentity.of(5L);

    private InMemoryPermissionStore permissionStore;
    private ExtractQueryService service;

    @BeforeEach
    void setUp() {
        InMemoryEntityStore entityStore = new InMemoryEntityStore()
                .extract(30L, 10L)
                .extract(31L, 11L)
                .datacell(300L, 30L, 2L, 7L)
                .datacell(301L, 30L, 1L, 4L, 5L)
                .datacell(302L, 30L, 1L);
        permissionStore = new InMemoryPermissionStore()
                .publicObject(PermissionedType.CORPUS, 10L)
                .privateObject(PermissionedType.CORPUS, 11L, 6L)
                .corpusScopedObject(PermissionedType.EXTRACT, 30L, 5L, 10L)
                .corpusScopedObject(PermissionedType.EXTRACT, 31L, 5L, 11L)
                .privateObject(PermissionedType.DOCUMENT, 1L, 5L)
                .privateObject(PermissionedType.DOCUMENT, 2L, 6L);
        service = new ExtractQueryService(entityStore, new PermissionGate(permissionStore));
    }

    @Test
    void extractOnUnreadableCorpusIsHidden() {
        assertThat(service.visibleExtracts(USER, null)).extracting(ExtractRecord::id).containsExactly(30L);
        assertThat(service.visibleExtracts(USER, 11L)).isEmpty();

        permissionStore.grantRead(PermissionedType.CORPUS, 11L, 5L);

        assertThat(service.visibleExtracts(USER, null)).extracting(ExtractRecord::id).containsExactly(30L, 31L);
    }

    @Test
    void datacellsAreLimitedToReadableDocuments() {
        assertThat(service.extractDatacells(USER, 30L, null))
                .extracting(DatacellRecord::id)
                .containsExactly(301L, 302L);
        assertThat(service.extractDatacells(USER, 30L, 2L)).isEmpty();
        assertThat(service.extractDatacells(USER, 30L, 1L).get(0).sourceAnnotationIds()).containsExactly(4L, 5L);
    }

    @Test
    void hiddenExtractReturnsNothing() {
        assertThat(service.extractDatacells(USER, 31L, null)).isEmpty();
        assertThat(service.extractDatacells(UserIdentity.anonymous(), 30L, null)).isEmpty();
    }
}
