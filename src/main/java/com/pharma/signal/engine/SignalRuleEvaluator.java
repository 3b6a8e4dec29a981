package com.pharma.signal.engine;

import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.SignalRule;

/**
 * Interface for all signal rule evaluators.
 * Each implementation handles a specific SignalRule.
 */
public interface SignalRuleEvaluator {

    /**
     * The rule this evaluator handles.
     */
    SignalRule getSupportedRule();

    /**
     * Evaluate one quarter against the rule.
     *
     * @param context quarter-over-quarter facts and the quarter's anomaly flag, if any
     * @param params  thresholds of the current run
     * @return whether the rule matched, with an explanation when it did
     */
    RuleOutcome evaluate(PeriodContext context, MonitoringParameters params);
}
