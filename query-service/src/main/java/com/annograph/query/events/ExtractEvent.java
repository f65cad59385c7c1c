package com.annograph.query.events;

public record ExtractEvent(ExtractEventType type, Long extractId, Long documentId, Long datacellId) {
}
