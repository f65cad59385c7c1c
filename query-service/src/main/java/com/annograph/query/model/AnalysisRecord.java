package com.annograph.query.model;

import java.time.Instant;

public record AnalysisRecord(
        long id,
        String analyzerId,
        Long corpusId,
        Long creatorId,
        Instant startedAt,
        Instant completedAt
) {
}
