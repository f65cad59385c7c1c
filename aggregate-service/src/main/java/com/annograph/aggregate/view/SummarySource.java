package com.annograph.aggregate.view;

import java.util.Locale;

public enum SummarySource {
    AGGREGATE,
    DIRECT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
