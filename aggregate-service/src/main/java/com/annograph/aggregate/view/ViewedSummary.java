package com.annograph.aggregate.view;

import java.time.Instant;

public record ViewedSummary(ExtractDocumentSummary summary, Instant refreshedAt) {
}
