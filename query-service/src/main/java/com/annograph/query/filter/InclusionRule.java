package com.annograph.query.filter;

import com.annograph.query.model.AnnotationRecord;
import com.annograph.query.model.RelationshipRecord;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Row predicate produced by {@link FilterPolicy}. Extract membership and endpoint pages are
 * store lookups, so callers pass them in rather than the rule reaching for them.
 */
public record InclusionRule(
        CorpusClause corpusClause,
        Long corpusId,
        AnalysisClause analysisClause,
        Long analysisId,
        Set<Integer> pages,
        ExtractClause extractClause,
        Long extractId
) {

    public enum CorpusClause {
        /** No corpus and non-structural rows requested: nothing can match. */
        NOTHING,
        STRUCTURAL_ONLY,
        CORPUS_OR_STRUCTURAL,
        CORPUS_NON_STRUCTURAL
    }

    public enum AnalysisClause {
        ANY,
        HUMAN_ONLY,
        HUMAN_OR_STRUCTURAL,
        SPECIFIC
    }

    public enum ExtractClause {
        NONE,
        MEMBER,
        ANY_ENDPOINT,
        BOTH_ENDPOINTS
    }

    public boolean matchesNothing() {
        return corpusClause == CorpusClause.NOTHING;
    }

    public boolean needsExtractMembership() {
        return extractClause != ExtractClause.NONE;
    }

    public boolean includes(AnnotationRecord annotation, Set<Long> extractAnnotationIds) {
        return corpusMatches(annotation.corpusId(), annotation.structural())
                && analysisMatches(annotation.analysisId(), annotation.structural())
                && (pages == null || pages.contains(annotation.page()))
                && (extractClause == ExtractClause.NONE || extractAnnotationIds.contains(annotation.id()));
    }

    public boolean includes(
            RelationshipRecord relationship,
            Map<Long, Integer> endpointPages,
            Set<Long> extractAnnotationIds
    ) {
        return corpusMatches(relationship.corpusId(), relationship.structural())
                && analysisMatches(relationship.analysisId(), relationship.structural())
                && pagesMatch(relationship, endpointPages)
                && extractMatches(relationship, extractAnnotationIds);
    }

    private boolean corpusMatches(Long rowCorpus, boolean structural) {
        switch (corpusClause) {
            case STRUCTURAL_ONLY:
                return structural;
            case CORPUS_OR_STRUCTURAL:
                return structural || Objects.equals(corpusId, rowCorpus);
            case CORPUS_NON_STRUCTURAL:
                return !structural && Objects.equals(corpusId, rowCorpus);
            default:
                return false;
        }
    }

    private boolean analysisMatches(Long rowAnalysis, boolean structural) {
        switch (analysisClause) {
            case HUMAN_ONLY:
                return rowAnalysis == null;
            case HUMAN_OR_STRUCTURAL:
                return rowAnalysis == null || structural;
            case SPECIFIC:
                return Objects.equals(analysisId, rowAnalysis);
            default:
                return true;
        }
    }

    private boolean pagesMatch(RelationshipRecord relationship, Map<Long, Integer> endpointPages) {
        if (pages == null) {
            return true;
        }
        return anyOnPage(relationship.sourceIds(), endpointPages) || anyOnPage(relationship.targetIds(), endpointPages);
    }

    private boolean anyOnPage(List<Long> annotationIds, Map<Long, Integer> endpointPages) {
        for (Long annotationId : annotationIds) {
            Integer page = endpointPages.get(annotationId);
            if (page != null && pages.contains(page)) {
                return true;
            }
        }
        return false;
    }

    private boolean extractMatches(RelationshipRecord relationship, Set<Long> extractAnnotationIds) {
        switch (extractClause) {
            case MEMBER:
            case ANY_ENDPOINT:
                return anyMember(relationship.sourceIds(), extractAnnotationIds)
                        || anyMember(relationship.targetIds(), extractAnnotationIds);
            case BOTH_ENDPOINTS:
                return anyMember(relationship.sourceIds(), extractAnnotationIds)
                        && anyMember(relationship.targetIds(), extractAnnotationIds);
            default:
                return true;
        }
    }

    private static boolean anyMember(List<Long> annotationIds, Set<Long> extractAnnotationIds) {
        for (Long annotationId : annotationIds) {
            if (extractAnnotationIds.contains(annotationId)) {
                return true;
            }
        }
        return false;
    }
}
