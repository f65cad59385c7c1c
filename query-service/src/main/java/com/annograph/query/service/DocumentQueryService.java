package com.annograph.query.service;

import com.annograph.aggregate.view.AnnotationSummary;
import com.annograph.query.filter.FilterSet;
import com.annograph.query.model.AnnotationRecord;
import com.annograph.query.model.RelationshipRecord;
import com.annograph.query.model.RelationshipSummary;
import com.annograph.query.model.UserIdentity;
import com.annograph.query.retrieval.AnnotationRetriever;
import com.annograph.query.retrieval.CacheInvalidationService;
import com.annograph.query.retrieval.ExtractSummaryService;
import com.annograph.query.retrieval.RelationshipRetriever;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Entry points used by the web layer and the event consumer.
 */
@Service
public class DocumentQueryService {

    private final AnnotationRetriever annotationRetriever;
    private final RelationshipRetriever relationshipRetriever;
    private final ExtractSummaryService extractSummaryService;
    private final CacheInvalidationService cacheInvalidationService;

    public DocumentQueryService(
            AnnotationRetriever annotationRetriever,
            RelationshipRetriever relationshipRetriever,
            ExtractSummaryService extractSummaryService,
            CacheInvalidationService cacheInvalidationService
    ) {
        this.annotationRetriever = annotationRetriever;
        this.relationshipRetriever = relationshipRetriever;
        this.extractSummaryService = extractSummaryService;
        this.cacheInvalidationService = cacheInvalidationService;
    }

    public List<Long> getDocumentAnnotations(
            long documentId,
            UserIdentity user,
            Long corpusId,
            Collection<Integer> pages,
            Boolean structural,
            Long analysisId,
            Long extractId
    ) {
        return annotationRetriever.get(documentId, user, FilterSet.of(corpusId, pages, structural, analysisId, extractId));
    }

    public List<AnnotationRecord> fetchDocumentAnnotations(long documentId, UserIdentity user, FilterSet filters) {
        return annotationRetriever.fetch(documentId, user, filters);
    }

    public List<Long> getDocumentRelationships(
            long documentId,
            UserIdentity user,
            Long corpusId,
            Collection<Integer> pages,
            Boolean structural,
            Long analysisId,
            Long extractId,
            boolean strictExtractMode
    ) {
        FilterSet filters = FilterSet.of(corpusId, pages, structural, analysisId, extractId, strictExtractMode);
        return relationshipRetriever.get(documentId, user, filters);
    }

    public List<RelationshipRecord> fetchDocumentRelationships(long documentId, UserIdentity user, FilterSet filters) {
        return relationshipRetriever.fetch(documentId, user, filters);
    }

    public AnnotationSummary getExtractAnnotationSummary(long documentId, long extractId, UserIdentity user) {
        return extractSummaryService.summarize(documentId, extractId, user);
    }

    public RelationshipSummary getRelationshipSummary(long documentId, long corpusId, UserIdentity user) {
        return relationshipRetriever.summarize(documentId, corpusId, user);
    }

    public long invalidate(long documentId, Long extractId) {
        return cacheInvalidationService.invalidate(documentId, extractId);
    }
}
