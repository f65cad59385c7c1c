package com.annograph.aggregate.view;

public record AggregateRow(long extractId, long documentId, long annotationId, int page, String label) {
}
