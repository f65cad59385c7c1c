package com.annograph.aggregate;

import com.annograph.aggregate.log.RefreshLogService;
import com.annograph.aggregate.source.DatacellSourceLink;
import com.annograph.aggregate.source.DatacellSourceReader;
import com.annograph.aggregate.view.AggregateSnapshot;
import com.annograph.aggregate.view.AggregateViewStore;
import com.annograph.aggregate.view.AnnotationSummary;
import com.annograph.aggregate.view.ExtractDocumentSummary;
import com.annograph.aggregate.view.SummarySource;
import com.annograph.aggregate.view.ViewScope;
import com.annograph.aggregate.view.ViewState;
import com.annograph.aggregate.view.ViewedSummary;
import com.annograph.caching.lease.LeaseMutex;
import com.annograph.caching.registry.CacheRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the extract/annotation aggregate view.
 *
 * <p>Rebuilds are whole-view and run on {@code aggregateRefreshExecutor}. Concurrent refresh
 * requests collapse onto one rebuild through a {@link LeaseMutex}: a caller that cannot take the
 * lease returns without doing anything, since the running rebuild will read the latest sources.
 * The view is published to an {@link AggregateViewStore} shared by every instance, so a rebuild
 * run anywhere is served everywhere. Readers see either the previous view or the new one, never
 * a partial build, and an older rebuild never replaces a newer view.</p>
 */
@Service
public class AggregateViewManager {

    public static final String VIEW_NAME = "extract_annotation_view";
    static final String LEASE_KEY = "annograph:lease:aggregate-refresh:" + VIEW_NAME;

    private static final Logger log = LoggerFactory.getLogger(AggregateViewManager.class);

    private final DatacellSourceReader sourceReader;
    private final AggregateViewStore viewStore;
    private final LeaseMutex leaseMutex;
    private final CacheRegistry cacheRegistry;
    private final Executor refreshExecutor;
    private final RefreshLogService refreshLogService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration leaseDuration;
    private final AtomicLong completedRebuilds = new AtomicLong();

    public AggregateViewManager(
            DatacellSourceReader sourceReader,
            AggregateViewStore viewStore,
            LeaseMutex leaseMutex,
            CacheRegistry cacheRegistry,
            Executor refreshExecutor,
            Clock clock
    ) {
        this(sourceReader, viewStore, leaseMutex, cacheRegistry, refreshExecutor, null, null, clock, 300L);
    }

    @Autowired
    public AggregateViewManager(
            DatacellSourceReader sourceReader,
            AggregateViewStore viewStore,
            LeaseMutex leaseMutex,
            CacheRegistry cacheRegistry,
            @Qualifier("aggregateRefreshExecutor") Executor refreshExecutor,
            RefreshLogService refreshLogService,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${annograph.aggregate.lease-seconds:300}") long leaseSeconds
    ) {
        this.sourceReader = sourceReader;
        this.viewStore = viewStore;
        this.leaseMutex = leaseMutex;
        this.cacheRegistry = cacheRegistry;
        this.refreshExecutor = refreshExecutor;
        this.refreshLogService = refreshLogService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.leaseDuration = Duration.ofSeconds(Math.max(1L, leaseSeconds));
    }

    public boolean refresh(String reason) {
        return refresh(reason, null, null);
    }

    /**
     * Schedules a whole-view rebuild. The optional document and extract name the scope whose
     * cached retrievals must be dropped even if its summary did not change.
     *
     * @return true when a rebuild was scheduled, false when one is already in flight
     */
    public boolean refresh(String reason, Long documentId, Long extractId) {
        Optional<LeaseMutex.Lease> lease = leaseMutex.tryAcquireLease(LEASE_KEY, leaseDuration);
        if (lease.isEmpty()) {
            incrementCounter("aggregate_refresh_total", "status", "skipped_locked");
            log.debug("event=aggregate_refresh_skipped view={} reason={} cause=lease_held", VIEW_NAME, reason);
            return false;
        }
        try {
            refreshExecutor.execute(() -> rebuild(reason, documentId, extractId, lease.get()));
            return true;
        } catch (RejectedExecutionException ex) {
            leaseMutex.release(lease.get());
            incrementCounter("aggregate_refresh_total", "status", "rejected");
            log.warn("event=aggregate_refresh_rejected view={} reason={} cause={}", VIEW_NAME, reason, ex.getMessage());
            return false;
        }
    }

    /**
     * Returns the extract summary for a document from the published view, or computes it with a
     * direct join when the view is not built or cannot be read. Direct-join failures propagate.
     */
    public AnnotationSummary summarize(long documentId, long extractId) {
        try {
            Optional<ViewedSummary> viewed = viewStore.summaryFor(extractId, documentId);
            if (viewed.isPresent()) {
                incrementCounter("aggregate_summary_total", "source", SummarySource.AGGREGATE.label());
                return new AnnotationSummary(viewed.get().summary(), SummarySource.AGGREGATE, viewed.get().refreshedAt());
            }
            log.warn("event=aggregate_summary_degraded view={} document_id={} extract_id={} cause=view_not_built",
                    VIEW_NAME, documentId, extractId);
        } catch (RuntimeException ex) {
            log.warn("event=aggregate_summary_degraded view={} document_id={} extract_id={} cause={}",
                    VIEW_NAME, documentId, extractId, ex.toString());
        }
        List<DatacellSourceLink> links = sourceReader.loadSourceLinks(extractId, documentId);
        incrementCounter("aggregate_summary_total", "source", SummarySource.DIRECT.label());
        return new AnnotationSummary(
                ExtractDocumentSummary.fromLinks(extractId, documentId, links),
                SummarySource.DIRECT,
                null
        );
    }

    /**
     * @return freshness of the published view, empty when none exists or it cannot be read
     */
    public Optional<ViewState> viewState() {
        try {
            return viewStore.state();
        } catch (RuntimeException ex) {
            log.warn("event=aggregate_state_unavailable view={} cause={}", VIEW_NAME, ex.toString());
            return Optional.empty();
        }
    }

    public boolean isRefreshInFlight() {
        return leaseMutex.isLeased(LEASE_KEY);
    }

    public long completedRebuildCount() {
        return completedRebuilds.get();
    }

    void rebuild(String reason, Long documentId, Long extractId, LeaseMutex.Lease lease) {
        long start = System.nanoTime();
        try {
            Instant readAt = clock.instant();
            AggregateSnapshot next = AggregateSnapshot.build(sourceReader.loadAllSourceLinks(), readAt);
            Optional<AggregateSnapshot> previous = viewStore.load();
            if (!viewStore.publish(next)) {
                incrementCounter("aggregate_refresh_total", "status", "superseded");
                log.info("event=aggregate_refresh_superseded view={} reason={} read_at={}", VIEW_NAME, reason, readAt);
                writeRefreshLog(reason, next.rowCount(), elapsedMillis(start), "SUPERSEDED");
                return;
            }
            completedRebuilds.incrementAndGet();

            Set<ViewScope> affected = new LinkedHashSet<>();
            previous.ifPresent(before -> affected.addAll(next.changedScopes(before)));
            if (documentId != null && extractId != null) {
                affected.add(new ViewScope(extractId, documentId));
            }
            long invalidated = 0L;
            for (ViewScope scope : affected) {
                invalidated += cacheRegistry.invalidateExtract(scope.documentId(), scope.extractId());
            }

            double durationMs = elapsedMillis(start);
            recordTimer(start);
            incrementCounter("aggregate_refresh_total", "status", "completed");
            log.info("event=aggregate_refresh_complete view={} reason={} rows={} summaries={} scopes_invalidated={} keys_invalidated={} duration_ms={}",
                    VIEW_NAME, reason, next.rowCount(), next.summaryCount(), affected.size(), invalidated, durationMs);
            writeRefreshLog(reason, next.rowCount(), durationMs, "COMPLETED");
        } catch (RuntimeException ex) {
            incrementCounter("aggregate_refresh_total", "status", "failed");
            log.warn("event=aggregate_refresh_failed view={} reason={} cause={}", VIEW_NAME, reason, ex.toString());
            writeRefreshLog(reason, 0, elapsedMillis(start), "FAILED");
        } finally {
            leaseMutex.release(lease);
        }
    }

    private void writeRefreshLog(String reason, int rowCount, double durationMs, String status) {
        if (refreshLogService == null) {
            return;
        }
        refreshLogService.write(VIEW_NAME, reason, rowCount, durationMs, status);
    }

    private void recordTimer(long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer("aggregate_rebuild_ms").record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String metricName, String tagKey, String tagValue) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName, tagKey, tagValue).increment();
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
