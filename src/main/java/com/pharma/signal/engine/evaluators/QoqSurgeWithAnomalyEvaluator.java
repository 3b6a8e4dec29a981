package com.pharma.signal.engine.evaluators;

import com.pharma.signal.engine.PeriodContext;
import com.pharma.signal.engine.RuleOutcome;
import com.pharma.signal.engine.SignalRuleEvaluator;
import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.SignalRule;
import org.springframework.stereotype.Component;

/**
 * ALERT tier: a quarter-over-quarter surge (relative AND absolute increase above
 * threshold) that is also a statistical anomaly against the rolling baseline.
 *
 * Example: 60 -> 145 reports is +141.7% and +85, over a baseline of mean 55 and
 * sd 5 (z = 18). With defaults (50%, 10, z > 2) all three conditions hold.
 */
@Component
public class QoqSurgeWithAnomalyEvaluator implements SignalRuleEvaluator {

    @Override
    public SignalRule getSupportedRule() {
        return SignalRule.QOQ_SURGE_WITH_ANOMALY;
    }

    @Override
    public RuleOutcome evaluate(PeriodContext context, MonitoringParameters params) {
        if (!context.isAnomalous()
                || !context.exceedsPctThreshold(params.getPctIncreaseThreshold())
                || !context.exceedsAbsThreshold(params.getMinAbsoluteIncrease())) {
            return RuleOutcome.notMatched(getSupportedRule());
        }

        return RuleOutcome.matched(getSupportedRule(), String.format(
                "Surge with anomaly: %d -> %d reports (%s, +%d) and z=%.2f beyond %.2f",
                context.getPreviousCount(), context.getCurrentCount(), context.describePctChange(),
                context.getAbsChange(), context.getAnomalyFlag().getScore(), params.getAnomalyThreshold()));
    }
}
