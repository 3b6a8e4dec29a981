package com.pharma.signal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How quarters missing between the first and last observation are handled.
 */
public enum GapPolicy {
    /** Fill the missing quarter with a count of zero. */
    ZERO("zero"),
    /** Repeat the previous quarter's count. */
    CARRY_FORWARD("carry-forward"),
    /** Leave the quarter out and mark the series discontinuous. */
    DROP("drop");

    private final String value;

    GapPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static GapPolicy fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Gap policy must not be null");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (GapPolicy policy : values()) {
            if (policy.value.equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown gap policy: " + raw
                + " (expected zero, carry-forward or drop)");
    }
}
