package com.annograph.aggregate.view;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class AnnotationSummary {
    private final int count;
    private final List<Integer> pages;
    private final Map<String, Integer> byLabel;
    private final SummarySource source;
    private final Instant refreshedAt;

    public AnnotationSummary(ExtractDocumentSummary summary, SummarySource source, Instant refreshedAt) {
        this.count = summary.count();
        this.pages = summary.pages();
        this.byLabel = summary.byLabel();
        this.source = source;
        this.refreshedAt = refreshedAt;
    }

    public static AnnotationSummary empty() {
        return new AnnotationSummary(ExtractDocumentSummary.empty(0L, 0L), SummarySource.DIRECT, null);
    }

    public int getCount() {
        return count;
    }

    public int getPageCount() {
        return pages.size();
    }

    public List<Integer> getPages() {
        return pages;
    }

    public Integer getFirstPage() {
        return pages.isEmpty() ? null : pages.get(0);
    }

    public Integer getLastPage() {
        return pages.isEmpty() ? null : pages.get(pages.size() - 1);
    }

    public Map<String, Integer> getByLabel() {
        return byLabel;
    }

    public String getSource() {
        return source.label();
    }

    public Instant getRefreshedAt() {
        return refreshedAt;
    }
}
