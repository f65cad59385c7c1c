package com.annograph.aggregate.view;

import com.annograph.aggregate.source.DatacellSourceLink;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Summary row of the extract view: distinct source annotations of one extract on one document.
 */
public record ExtractDocumentSummary(
        long extractId,
        long documentId,
        int count,
        List<Integer> pages,
        Map<String, Integer> byLabel
) {

    public ExtractDocumentSummary {
        pages = List.copyOf(pages);
        byLabel = Map.copyOf(byLabel);
    }

    public static ExtractDocumentSummary empty(long extractId, long documentId) {
        return new ExtractDocumentSummary(extractId, documentId, 0, List.of(), Map.of());
    }

    /**
     * Folds provenance links into a summary. Links citing the same annotation more than once
     * count a single time.
     */
    public static ExtractDocumentSummary fromLinks(long extractId, long documentId, Collection<DatacellSourceLink> links) {
        Set<Long> seen = new HashSet<>();
        TreeSet<Integer> pages = new TreeSet<>();
        Map<String, Integer> byLabel = new TreeMap<>();
        for (DatacellSourceLink link : links) {
            if (link.extractId() != extractId || link.documentId() != documentId) {
                continue;
            }
            if (!seen.add(link.annotationId())) {
                continue;
            }
            pages.add(link.page());
            if (link.label() != null && !link.label().isBlank()) {
                byLabel.merge(link.label(), 1, Integer::sum);
            }
        }
        return new ExtractDocumentSummary(extractId, documentId, seen.size(), List.copyOf(pages), byLabel);
    }
}
