package com.pharma.signal.engine.evaluators;

import com.pharma.signal.engine.PeriodContext;
import com.pharma.signal.engine.RuleOutcome;
import com.pharma.signal.engine.SignalRuleEvaluator;
import com.pharma.signal.model.AnomalyFlag;
import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.SignalRule;
import org.springframework.stereotype.Component;

@Component
public class StatisticalAnomalyEvaluator implements SignalRuleEvaluator {

    @Override
    public SignalRule getSupportedRule() {
        return SignalRule.STATISTICAL_ANOMALY;
    }

    @Override
    public RuleOutcome evaluate(PeriodContext context, MonitoringParameters params) {
        if (!context.isAnomalous()) {
            return RuleOutcome.notMatched(getSupportedRule());
        }

        AnomalyFlag flag = context.getAnomalyFlag();
        return RuleOutcome.matched(getSupportedRule(), String.format(
                "Statistical anomaly: %d reports vs rolling mean %.1f (sd %.1f), z=%.2f beyond %.2f",
                context.getCurrentCount(), flag.getRollingMean(), flag.getRollingStdDev(),
                flag.getScore(), params.getAnomalyThreshold()));
    }
}
