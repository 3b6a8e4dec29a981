package com.pharma.signal.model;

/**
 * Classification rules in precedence order. The first matching rule decides
 * the period's severity.
 */
public enum SignalRule {
    /** Quarter-over-quarter surge coinciding with a statistical anomaly. */
    QOQ_SURGE_WITH_ANOMALY(SignalSeverity.ALERT),
    /** Percentage and absolute increase both above threshold, no anomaly flag. */
    QOQ_SURGE(SignalSeverity.WATCH),
    /** Statistical anomaly on its own. */
    STATISTICAL_ANOMALY(SignalSeverity.WATCH);

    private final SignalSeverity tier;

    SignalRule(SignalSeverity tier) {
        this.tier = tier;
    }

    public SignalSeverity getTier() {
        return tier;
    }
}
