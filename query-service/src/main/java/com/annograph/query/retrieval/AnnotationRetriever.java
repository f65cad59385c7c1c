package com.annograph.query.retrieval;

import com.annograph.query.filter.FilterPolicy;
import com.annograph.query.filter.FilterSet;
import com.annograph.query.filter.InclusionRule;
import com.annograph.query.filter.RetrievalTarget;
import com.annograph.query.model.AnnotationRecord;
import com.annograph.query.model.UserIdentity;
import com.annograph.query.permission.PermissionGate;
import com.annograph.query.store.EntityStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

@Service
public class AnnotationRetriever extends ScopedRetriever<AnnotationRecord> {

    static final String NAMESPACE = "annotations";

    private static final Comparator<AnnotationRecord> PAGE_ORDER =
            Comparator.comparingInt(AnnotationRecord::page).thenComparingLong(AnnotationRecord::id);

    public AnnotationRetriever(EntityStore entityStore, PermissionGate permissionGate, ResultCache resultCache) {
        this(entityStore, permissionGate, resultCache, null);
    }

    @Autowired
    public AnnotationRetriever(
            EntityStore entityStore,
            PermissionGate permissionGate,
            ResultCache resultCache,
            MeterRegistry meterRegistry
    ) {
        super(NAMESPACE, "annotation", entityStore, permissionGate, resultCache, meterRegistry);
    }

    @Override
    protected List<Long> compute(long documentId, UserIdentity user, FilterSet filters) {
        InclusionRule rule = FilterPolicy.resolve(filters, RetrievalTarget.ANNOTATION);
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
        Set<Long> members = extractAnnotationIds;
        Predicate<AnnotationRecord> visible = permissionGate.derivedAnnotationVisibility(user);
        return entityStore.findDocumentAnnotations(documentId).stream()
                .filter(annotation -> rule.includes(annotation, members))
                .filter(visible)
                .sorted(PAGE_ORDER)
                .map(AnnotationRecord::id)
                .distinct()
                .toList();
    }

    @Override
    protected List<AnnotationRecord> loadByIds(Collection<Long> ids) {
        return entityStore.findAnnotationsByIds(ids);
    }

    @Override
    protected long idOf(AnnotationRecord record) {
        return record.id();
    }
}
