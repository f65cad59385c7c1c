package com.annograph.query.model;

public record InvalidationResult(long documentId, Long extractId, long invalidatedKeys) {
}
