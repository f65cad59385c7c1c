package com.annograph.query.model;

public record AnnotationRecord(
        long id,
        long documentId,
        Long corpusId,
        Long analysisId,
        boolean structural,
        int page,
        String label,
        Long creatorId,
        Long createdByAnalysisId,
        Long createdByExtractId
) {
}
