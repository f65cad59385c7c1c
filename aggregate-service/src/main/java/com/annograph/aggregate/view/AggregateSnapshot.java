package com.annograph.aggregate.view;

import com.annograph.aggregate.source.DatacellSourceLink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable extract/annotation view: row-level mapping plus per (extract, document) summaries.
 * A rebuild produces a new snapshot; readers holding the previous one keep a consistent view.
 */
public final class AggregateSnapshot {

    private static final Comparator<AggregateRow> ROW_ORDER = Comparator
            .comparingLong(AggregateRow::extractId)
            .thenComparingLong(AggregateRow::documentId)
            .thenComparingInt(AggregateRow::page)
            .thenComparingLong(AggregateRow::annotationId);

    private final List<AggregateRow> rows;
    private final Map<ViewScope, ExtractDocumentSummary> summaries;
    private final Instant refreshedAt;

    private AggregateSnapshot(List<AggregateRow> rows, Map<ViewScope, ExtractDocumentSummary> summaries, Instant refreshedAt) {
        this.rows = rows;
        this.summaries = summaries;
        this.refreshedAt = refreshedAt;
    }

    public static AggregateSnapshot build(List<DatacellSourceLink> links, Instant refreshedAt) {
        Map<ViewScope, List<DatacellSourceLink>> grouped = new LinkedHashMap<>();
        for (DatacellSourceLink link : links) {
            grouped.computeIfAbsent(new ViewScope(link.extractId(), link.documentId()), scope -> new ArrayList<>())
                    .add(link);
        }

        List<AggregateRow> rows = new ArrayList<>();
        Map<ViewScope, ExtractDocumentSummary> summaries = new LinkedHashMap<>();
        for (Map.Entry<ViewScope, List<DatacellSourceLink>> entry : grouped.entrySet()) {
            ViewScope scope = entry.getKey();
            Set<Long> seen = new HashSet<>();
            for (DatacellSourceLink link : entry.getValue()) {
                if (seen.add(link.annotationId())) {
                    rows.add(new AggregateRow(scope.extractId(), scope.documentId(), link.annotationId(), link.page(), link.label()));
                }
            }
            summaries.put(scope, ExtractDocumentSummary.fromLinks(scope.extractId(), scope.documentId(), entry.getValue()));
        }
        rows.sort(ROW_ORDER);
        return new AggregateSnapshot(
                Collections.unmodifiableList(rows),
                Collections.unmodifiableMap(summaries),
                refreshedAt
        );
    }

    public Optional<ExtractDocumentSummary> summaryFor(long extractId, long documentId) {
        return Optional.ofNullable(summaries.get(new ViewScope(extractId, documentId)));
    }

    public List<AggregateRow> rowsFor(long extractId, long documentId) {
        return rows.stream()
                .filter(row -> row.extractId() == extractId && row.documentId() == documentId)
                .toList();
    }

    /**
     * Scopes whose summary differs between {@code previous} and this snapshot, including scopes
     * that appeared or disappeared.
     */
    public Set<ViewScope> changedScopes(AggregateSnapshot previous) {
        Set<ViewScope> changed = new HashSet<>();
        Map<ViewScope, ExtractDocumentSummary> before = previous == null ? Map.of() : previous.summaries;
        for (Map.Entry<ViewScope, ExtractDocumentSummary> entry : summaries.entrySet()) {
            if (!Objects.equals(before.get(entry.getKey()), entry.getValue())) {
                changed.add(entry.getKey());
            }
        }
        for (ViewScope scope : before.keySet()) {
            if (!summaries.containsKey(scope)) {
                changed.add(scope);
            }
        }
        return changed;
    }

    public List<AggregateRow> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int summaryCount() {
        return summaries.size();
    }

    public Instant refreshedAt() {
        return refreshedAt;
    }
}
