package com.annograph.aggregate.staleness;

import java.time.Instant;

public record StalenessReport(
        String view,
        Instant refreshedAt,
        Long ageSeconds,
        int rowCount,
        int summaryCount,
        long maxAgeSeconds,
        boolean stale,
        boolean refreshInFlight
) {
}
