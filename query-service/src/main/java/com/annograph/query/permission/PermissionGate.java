package com.annograph.query.permission;

import com.annograph.query.model.AnnotationRecord;
import com.annograph.query.model.ObjectAccess;
import com.annograph.query.model.UserIdentity;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Object-level visibility. Annotations and relationships have no ACL of their own; they are
 * visible when their document (and corpus, when one is named) is. Analyses and extracts carry
 * their own ACL and are visible only when their corpus is readable as well.
 */
@Service
public class PermissionGate {

    private final PermissionStore permissionStore;

    public PermissionGate(PermissionStore permissionStore) {
        this.permissionStore = permissionStore;
    }

    public boolean canViewDocument(UserIdentity user, long documentId) {
        return canView(user, PermissionedType.DOCUMENT, documentId);
    }

    public boolean canViewCorpus(UserIdentity user, long corpusId) {
        return canView(user, PermissionedType.CORPUS, corpusId);
    }

    public boolean canViewAnalysis(UserIdentity user, long analysisId) {
        return canViewCorpusScoped(user, PermissionedType.ANALYSIS, analysisId);
    }

    public boolean canViewExtract(UserIdentity user, long extractId) {
        return canViewCorpusScoped(user, PermissionedType.EXTRACT, extractId);
    }

    /**
     * Document read, and corpus read as well when a corpus is given.
     */
    public boolean canRead(UserIdentity user, long documentId, Long corpusId) {
        if (!canViewDocument(user, documentId)) {
            return false;
        }
        return corpusId == null || canViewCorpus(user, corpusId);
    }

    /**
     * Hides non-structural annotations produced by an analysis or extract the user cannot see.
     * Lookups are memoized for the lifetime of the returned predicate, so build one per request.
     */
    public Predicate<AnnotationRecord> derivedAnnotationVisibility(UserIdentity user) {
        if (user.superuser()) {
            return annotation -> true;
        }
        Map<Long, Boolean> analyses = new HashMap<>();
        Map<Long, Boolean> extracts = new HashMap<>();
        return annotation -> {
            if (annotation.structural()) {
                return true;
            }
            Long analysisId = annotation.createdByAnalysisId();
            if (analysisId != null && !analyses.computeIfAbsent(analysisId, id -> canViewAnalysis(user, id))) {
                return false;
            }
            Long extractId = annotation.createdByExtractId();
            return extractId == null || extracts.computeIfAbsent(extractId, id -> canViewExtract(user, id));
        };
    }

    private boolean canViewCorpusScoped(UserIdentity user, PermissionedType type, long objectId) {
        if (user.superuser()) {
            return true;
        }
        Optional<ObjectAccess> access = permissionStore.findAccess(type, objectId);
        if (access.isEmpty() || !access.get().visibleTo(user)) {
            return false;
        }
        Long corpusId = access.get().scopeCorpusId();
        return corpusId == null || canViewCorpus(user, corpusId);
    }

    private boolean canView(UserIdentity user, PermissionedType type, long objectId) {
        if (user.superuser()) {
            return true;
        }
        return permissionStore.findAccess(type, objectId)
                .map(access -> access.visibleTo(user))
                .orElse(false);
    }
}
