package com.pharma.signal.engine.evaluators;

import com.pharma.signal.engine.PeriodContext;
import com.pharma.signal.engine.RuleOutcome;
import com.pharma.signal.engine.SignalRuleEvaluator;
import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.SignalRule;
import org.springframework.stereotype.Component;

/**
 * WATCH tier: relative and absolute quarter-over-quarter increase both above
 * threshold, without a statistical anomaly (or before a baseline exists).
 *
 * Requiring both conditions suppresses small counts moving by a large
 * percentage, e.g. 2 -> 5 is +150% but only +3 reports.
 */
@Component
public class QoqSurgeEvaluator implements SignalRuleEvaluator {

    @Override
    public SignalRule getSupportedRule() {
        return SignalRule.QOQ_SURGE;
    }

    @Override
    public RuleOutcome evaluate(PeriodContext context, MonitoringParameters params) {
        if (context.isAnomalous()
                || !context.exceedsPctThreshold(params.getPctIncreaseThreshold())
                || !context.exceedsAbsThreshold(params.getMinAbsoluteIncrease())) {
            return RuleOutcome.notMatched(getSupportedRule());
        }

        return RuleOutcome.matched(getSupportedRule(), String.format(
                "Quarter-over-quarter surge: %d -> %d reports (%s > %.0f%%, +%d > %d)",
                context.getPreviousCount(), context.getCurrentCount(), context.describePctChange(),
                params.getPctIncreaseThreshold() * 100.0, context.getAbsChange(), params.getMinAbsoluteIncrease()));
    }
}
