package com.annograph.query.service;

import com.annograph.query.model.DatacellRecord;
import com.annograph.query.model.ExtractRecord;
import com.annograph.query.model.UserIdentity;
import com.annograph.query.permission.PermissionGate;
import com.annograph.query.store.EntityStore;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts a user may see and their datacells.
 */
@Service
public class ExtractQueryService {

    private final EntityStore entityStore;
    private final PermissionGate permissionGate;

    public ExtractQueryService(EntityStore entityStore, PermissionGate permissionGate) {
        this.entityStore = entityStore;
        this.permissionGate = permissionGate;
    }

    public List<ExtractRecord> visibleExtracts(UserIdentity user, Long corpusId) {
        if (corpusId != null && !permissionGate.canViewCorpus(user, corpusId)) {
            return List.of();
        }
        return entityStore.findExtracts(corpusId).stream()
                .filter(extract -> permissionGate.canViewExtract(user, extract.id()))
                .toList();
    }

    /**
     * Datacells of a visible extract, limited to documents the user can read.
     */
    public List<DatacellRecord> extractDatacells(UserIdentity user, long extractId, Long documentId) {
        if (!permissionGate.canViewExtract(user, extractId)) {
            return List.of();
        }
        Map<Long, Boolean> documents = new HashMap<>();
        return entityStore.findExtractDatacells(extractId, documentId).stream()
                .filter(datacell -> documents.computeIfAbsent(
                        datacell.documentId(), id -> permissionGate.canViewDocument(user, id)))
                .toList();
    }
}
