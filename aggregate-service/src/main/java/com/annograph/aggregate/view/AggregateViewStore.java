package com.annograph.aggregate.view;

import java.util.Optional;

/**
 * Where the published aggregate view lives. Every instance reads the same view, so a rebuild
 * completed by one instance is what all of them serve.
 *
 * <p>Read methods throw when the backing store fails; callers fall back to a direct join.</p>
 */
public interface AggregateViewStore {

    /**
     * Swaps {@code next} in atomically, unless the published view is already as new or newer.
     *
     * @return true when {@code next} became the published view
     */
    boolean publish(AggregateSnapshot next);

    /**
     * @return the whole published view, empty when none was published yet
     */
    Optional<AggregateSnapshot> load();

    /**
     * @return freshness and size of the published view, empty when none was published yet
     */
    Optional<ViewState> state();

    /**
     * Summary of one extract on one document as of the published view. A published view without
     * rows for the scope yields an empty summary.
     *
     * @return empty when no view was published yet
     */
    Optional<ViewedSummary> summaryFor(long extractId, long documentId);
}
