package com.annograph.query.model;

import java.time.Instant;

public record ExtractRecord(
        long id,
        String name,
        Long corpusId,
        Instant startedAt,
        Instant finishedAt,
        String error
) {
}
