package com.annograph.aggregate.view;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local view store for a single instance deployment and for tests.
 */
public class InMemoryAggregateViewStore implements AggregateViewStore {

    private final AtomicReference<AggregateSnapshot> published = new AtomicReference<>();

    @Override
    public boolean publish(AggregateSnapshot next) {
        AggregateSnapshot result = published.accumulateAndGet(next, (current, candidate) ->
                current != null && !candidate.refreshedAt().isAfter(current.refreshedAt()) ? current : candidate);
        return result == next;
    }

    @Override
    public Optional<AggregateSnapshot> load() {
        return Optional.ofNullable(published.get());
    }

    @Override
    public Optional<ViewState> state() {
        return load().map(snapshot -> new ViewState(snapshot.refreshedAt(), snapshot.rowCount(), snapshot.summaryCount()));
    }

    @Override
    public Optional<ViewedSummary> summaryFor(long extractId, long documentId) {
        return load().map(snapshot -> new ViewedSummary(
                snapshot.summaryFor(extractId, documentId).orElseGet(() -> ExtractDocumentSummary.empty(extractId, documentId)),
                snapshot.refreshedAt()
        ));
    }
}
