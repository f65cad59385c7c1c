package com.annograph.query.service;

import com.annograph.query.model.AnalysisRecord;
import com.annograph.query.model.AnnotationRecord;
import com.annograph.query.model.UserIdentity;
import com.annograph.query.permission.PermissionGate;
import com.annograph.query.store.EntityStore;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Analyses a user may see and the annotations they produced.
 */
@Service
public class AnalysisQueryService {

    private final EntityStore entityStore;
    private final PermissionGate permissionGate;

    public AnalysisQueryService(EntityStore entityStore, PermissionGate permissionGate) {
        this.entityStore = entityStore;
        this.permissionGate = permissionGate;
    }

    public List<AnalysisRecord> visibleAnalyses(UserIdentity user, Long corpusId) {
        if (corpusId != null && !permissionGate.canViewCorpus(user, corpusId)) {
            return List.of();
        }
        return entityStore.findAnalyses(corpusId).stream()
                .filter(analysis -> permissionGate.canViewAnalysis(user, analysis.id()))
                .toList();
    }

    /**
     * Annotations of a visible analysis, limited to documents the user can read.
     */
    public List<AnnotationRecord> analysisAnnotations(UserIdentity user, long analysisId, Long documentId) {
        if (!permissionGate.canViewAnalysis(user, analysisId)) {
            return List.of();
        }
        Map<Long, Boolean> documents = new HashMap<>();
        return entityStore.findAnalysisAnnotations(analysisId, documentId).stream()
                .filter(annotation -> documents.computeIfAbsent(
                        annotation.documentId(), id -> permissionGate.canViewDocument(user, id)))
                .toList();
    }
}
