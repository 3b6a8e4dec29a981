package com.pharma.signal.model;

/**
 * Ordered by escalation: a later constant is more severe.
 */
public enum SignalSeverity {
    NONE,
    WATCH,
    ALERT;

    public boolean isFlagged() {
        return this != NONE;
    }
}
