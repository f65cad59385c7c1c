package com.annograph.query.filter;

public enum Tristate {
    UNSET,
    TRUE,
    FALSE;

    public static Tristate of(Boolean value) {
        if (value == null) {
            return UNSET;
        }
        return value ? TRUE : FALSE;
    }

    public String label() {
        return name().toLowerCase();
    }
}
