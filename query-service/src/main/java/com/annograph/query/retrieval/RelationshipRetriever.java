package com.annograph.query.retrieval;

import com.annograph.query.filter.FilterPolicy;
import com.annograph.query.filter.FilterSet;
import com.annograph.query.filter.InclusionRule;
import com.annograph.query.filter.RetrievalTarget;
import com.annograph.query.model.RelationshipRecord;
import com.annograph.query.model.RelationshipSummary;
import com.annograph.query.model.UserIdentity;
import com.annograph.query.permission.PermissionGate;
import com.annograph.query.store.EntityStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Service
public class RelationshipRetriever extends ScopedRetriever<RelationshipRecord> {

    static final String NAMESPACE = "relationships";

    public RelationshipRetriever(EntityStore entityStore, PermissionGate permissionGate, ResultCache resultCache) {
        this(entityStore, permissionGate, resultCache, null);
    }

    @Autowired
    public RelationshipRetriever(
            EntityStore entityStore,
            PermissionGate permissionGate,
            ResultCache resultCache,
            MeterRegistry meterRegistry
    ) {
        super(NAMESPACE, "relationship", entityStore, permissionGate, resultCache, meterRegistry);
    }

    /**
     * Relationship counts by label within a document and corpus. Unlabeled relationships count
     * toward the total only.
     */
    public RelationshipSummary summarize(long documentId, long corpusId, UserIdentity user) {
        if (!permissionGate.canRead(user, documentId, corpusId)) {
            return RelationshipSummary.empty();
        }
        Map<String, Long> byType = new TreeMap<>();
        long total = 0L;
        for (Map.Entry<String, Long> count : entityStore.countRelationshipsByLabel(documentId, corpusId).entrySet()) {
            total += count.getValue();
            String label = count.getKey();
            if (label != null && !label.isBlank()) {
                byType.merge(label, count.getValue(), Long::sum);
            }
        }
        return new RelationshipSummary(total, byType);
    }

    @Override
    protected List<Long> compute(long documentId, UserIdentity user, FilterSet filters) {
        InclusionRule rule = FilterPolicy.resolve(filters, RetrievalTarget.RELATIONSHIP);
        if (rule.matchesNothing()) {
            return List.of();
        }
        Set<Long> extractAnnotationIds = Set.of();
        if (rule.needsExtractMembership()) {
            extractAnnotationIds = entityStore.findExtractSourceAnnotationIds(rule.extractId(), documentId);
            if (extractAnnotationIds.isEmpty()) {
                return List.of();
            }
        }
        List<RelationshipRecord> relationships = entityStore.findDocumentRelationships(documentId);
        if (relationships.isEmpty()) {
            return List.of();
        }
        Set<Long> endpointIds = new LinkedHashSet<>();
        for (RelationshipRecord relationship : relationships) {
            endpointIds.addAll(relationship.sourceIds());
            endpointIds.addAll(relationship.targetIds());
        }
        Map<Long, Integer> endpointPages = entityStore.findAnnotationPages(endpointIds);

        Set<Long> members = extractAnnotationIds;
        Comparator<RelationshipRecord> pageOrder = Comparator
                .comparingInt((RelationshipRecord relationship) -> firstPage(relationship, endpointPages))
                .thenComparingLong(RelationshipRecord::id);
        return relationships.stream()
                .filter(relationship -> rule.includes(relationship, endpointPages, members))
                .sorted(pageOrder)
                .map(RelationshipRecord::id)
                .distinct()
                .toList();
    }

    @Override
    protected List<RelationshipRecord> loadByIds(Collection<Long> ids) {
        return entityStore.findRelationshipsByIds(ids);
    }

    @Override
    protected long idOf(RelationshipRecord record) {
        return record.id();
    }

    /**
     * Lowest page among the endpoints; relationships without resolvable endpoints sort last.
     */
    private static int firstPage(RelationshipRecord relationship, Map<Long, Integer> endpointPages) {
        int first = Integer.MAX_VALUE;
        for (Long id : relationship.sourceIds()) {
            first = Math.min(first, endpointPages.getOrDefault(id, Integer.MAX_VALUE));
        }
        for (Long id : relationship.targetIds()) {
            first = Math.min(first, endpointPages.getOrDefault(id, Integer.MAX_VALUE));
        }
        return first;
    }
}
