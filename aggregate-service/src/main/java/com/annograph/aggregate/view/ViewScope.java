package com.annograph.aggregate.view;

public record ViewScope(long extractId, long documentId) {
}
