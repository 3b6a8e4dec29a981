package com.pharma.signal.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
