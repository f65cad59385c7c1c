package com.annograph.aggregate.view;

import java.time.Instant;

public record ViewState(Instant refreshedAt, int rowCount, int summaryCount) {
}
