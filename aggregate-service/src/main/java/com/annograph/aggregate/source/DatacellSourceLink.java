package com.annograph.aggregate.source;

/**
 * One provenance edge: a datacell of {@code extractId} on {@code documentId} cites
 * {@code annotationId}.
 */
public record DatacellSourceLink(long extractId, long documentId, long annotationId, int page, String label) {
}
