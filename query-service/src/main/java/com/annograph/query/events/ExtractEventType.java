package com.annograph.query.events;

import java.util.Locale;
import java.util.Optional;

/**
 * Extraction workflow events. Only terminal or review-facing events refresh the aggregate view;
 * writes made while an extract is still running do not.
 */
public enum ExtractEventType {
    EXTRACT_COMPLETED(true),
    DATACELL_CREATED(false),
    DATACELL_UPDATED(false),
    DATACELL_APPROVED(true),
    DATACELL_REJECTED(true),
    DATACELL_EDITED(true),
    DATACELL_DELETED(true);

    private final boolean triggersRefresh;

    ExtractEventType(boolean triggersRefresh) {
        this.triggersRefresh = triggersRefresh;
    }

    public boolean triggersRefresh() {
        return triggersRefresh;
    }

    public String reason() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ExtractEventType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
