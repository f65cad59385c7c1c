package com.annograph.query.retrieval;

import com.annograph.aggregate.AggregateViewManager;
import com.annograph.aggregate.view.AnnotationSummary;
import com.annograph.query.model.ExtractRecord;
import com.annograph.query.model.UserIdentity;
import com.annograph.query.permission.PermissionGate;
import com.annograph.query.store.EntityStore;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class ExtractSummaryService {

    private final EntityStore entityStore;
    private final PermissionGate permissionGate;
    private final AggregateViewManager aggregateViewManager;

    public ExtractSummaryService(
            EntityStore entityStore,
            PermissionGate permissionGate,
            AggregateViewManager aggregateViewManager
    ) {
        this.entityStore = entityStore;
        this.permissionGate = permissionGate;
        this.aggregateViewManager = aggregateViewManager;
    }

    /**
     * Annotation counts and pages cited by an extract within a document. Empty when the user
     * cannot read the document or the extract's corpus, or the extract does not exist.
     */
    public AnnotationSummary summarize(long documentId, long extractId, UserIdentity user) {
        if (!permissionGate.canViewDocument(user, documentId)) {
            return AnnotationSummary.empty();
        }
        Optional<ExtractRecord> extract = entityStore.findExtract(extractId);
        if (extract.isEmpty()) {
            return AnnotationSummary.empty();
        }
        Long corpusId = extract.get().corpusId();
        if (corpusId != null && !permissionGate.canViewCorpus(user, corpusId)) {
            return AnnotationSummary.empty();
        }
        return aggregateViewManager.summarize(documentId, extractId);
    }
}
