package com.annograph.query.model;

import java.util.List;

public record RelationshipRecord(
        long id,
        long documentId,
        Long corpusId,
        Long analysisId,
        boolean structural,
        String label,
        List<Long> sourceIds,
        List<Long> targetIds
) {

    public RelationshipRecord {
        sourceIds = sourceIds == null ? List.of() : List.copyOf(sourceIds);
        targetIds = targetIds == null ? List.of() : List.copyOf(targetIds);
    }
}
