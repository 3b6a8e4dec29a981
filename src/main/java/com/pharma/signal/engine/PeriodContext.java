package com.pharma.signal.engine;

import com.pharma.signal.model.AnomalyFlag;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Quarter-over-quarter facts for one period, shared by all signal rule
 * evaluators.
 */
@Value
@Builder
public class PeriodContext {

    LocalDate periodStart;

    long previousCount;

    long currentCount;

    // null when the increase is unbounded (previous quarter was zero)
    Double pctChange;

    // reports emerged from a zero previous quarter
    boolean unboundedIncrease;

    long absChange;

    // null for quarters without a full baseline window
    AnomalyFlag anomalyFlag;

    public static PeriodContext of(LocalDate periodStart, long previousCount, long currentCount, AnomalyFlag flag) {
        long abs = currentCount - previousCount;
        Double pct;
        boolean unbounded = false;
        if (previousCount == 0) {
            if (currentCount > 0) {
                pct = null;
                unbounded = true;
            } else {
                pct = 0.0;
            }
        } else {
            pct = (double) abs / previousCount;
        }
        return PeriodContext.builder()
                .periodStart(periodStart)
                .previousCount(previousCount)
                .currentCount(currentCount)
                .pctChange(pct)
                .unboundedIncrease(unbounded)
                .absChange(abs)
                .anomalyFlag(flag)
                .build();
    }

    public boolean exceedsPctThreshold(double threshold) {
        return unboundedIncrease || (pctChange != null && pctChange > threshold);
    }

    public boolean exceedsAbsThreshold(long minAbsoluteIncrease) {
        return absChange > minAbsoluteIncrease;
    }

    public boolean isAnomalous() {
        return anomalyFlag != null && anomalyFlag.isAnomaly();
    }

    public String describePctChange() {
        if (unboundedIncrease) return "unbounded (from zero)";
        return String.format("%.1f%%", pctChange * 100.0);
    }
}
