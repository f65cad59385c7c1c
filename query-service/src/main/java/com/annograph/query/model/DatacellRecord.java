package com.annograph.query.model;

import java.util.List;

/**
 * One extracted value. {@code data} is the raw JSON payload; {@code sourceAnnotationIds} are the
 * annotations it cites, in id order.
 */
public record DatacellRecord(
        long id,
        long extractId,
        long documentId,
        Long columnId,
        String data,
        Long approvedById,
        Long rejectedById,
        List<Long> sourceAnnotationIds
) {

    public DatacellRecord {
        sourceAnnotationIds = sourceAnnotationIds == null ? List.of() : List.copyOf(sourceAnnotationIds);
    }
}
