package com.annograph.aggregate.staleness;

import com.annograph.aggregate.AggregateViewManager;
import com.annograph.aggregate.view.ViewState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Forces a rebuild when the aggregate view has gone longer than the configured bound without one.
 */
@Component
public class StalenessMonitor {

    static final String STALENESS_REASON = "staleness";

    private static final Logger log = LoggerFactory.getLogger(StalenessMonitor.class);

    private final AggregateViewManager viewManager;
    private final Clock clock;
    private final Duration maxAge;

    public StalenessMonitor(
            AggregateViewManager viewManager,
            Clock clock,
            @Value("${annograph.aggregate.staleness.max-age-seconds:300}") long maxAgeSeconds
    ) {
        this.viewManager = viewManager;
        this.clock = clock;
        this.maxAge = Duration.ofSeconds(Math.max(1L, maxAgeSeconds));
    }

    @Scheduled(
            fixedDelayString = "${annograph.aggregate.staleness.check-interval-ms:60000}",
            initialDelayString = "${annograph.aggregate.staleness.initial-delay-ms:60000}"
    )
    public void check() {
        StalenessReport report = viewReport();
        if (!report.stale()) {
            return;
        }
        boolean scheduled = viewManager.refresh(STALENESS_REASON);
        log.info("event=aggregate_stale view={} age_seconds={} max_age_seconds={} refresh_scheduled={}",
                report.view(), report.ageSeconds(), report.maxAgeSeconds(), scheduled);
    }

    public List<StalenessReport> report() {
        return List.of(viewReport());
    }

    private StalenessReport viewReport() {
        Optional<ViewState> current = viewManager.viewState();
        Instant refreshedAt = current.map(ViewState::refreshedAt).orElse(null);
        Long ageSeconds = refreshedAt == null ? null : Duration.between(refreshedAt, clock.instant()).getSeconds();
        boolean stale = ageSeconds == null || ageSeconds > maxAge.getSeconds();
        return new StalenessReport(
                AggregateViewManager.VIEW_NAME,
                refreshedAt,
                ageSeconds,
                current.map(ViewState::rowCount).orElse(0),
                current.map(ViewState::summaryCount).orElse(0),
                maxAge.getSeconds(),
                stale,
                viewManager.isRefreshInFlight()
        );
    }
}
