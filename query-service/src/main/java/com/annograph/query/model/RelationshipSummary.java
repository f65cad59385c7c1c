package com.annograph.query.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public class RelationshipSummary {
    private final long total;
    private final Map<String, Long> byType;

    public RelationshipSummary(long total, Map<String, Long> byType) {
        this.total = total;
        this.byType = byType == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byType));
    }

    public static RelationshipSummary empty() {
        return new RelationshipSummary(0L, Map.of());
    }

    public long getTotal() {
        return total;
    }

    public Map<String, Long> getByType() {
        return byType;
    }
}
