package com.pharma.signal.engine;

import com.pharma.signal.exception.MalformedSeriesException;
import com.pharma.signal.model.AnomalyFlag;
import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.NormalizedSeries;
import com.pharma.signal.model.ObservationPoint;
import com.pharma.signal.model.SafetySignal;
import com.pharma.signal.model.SignalRule;
import com.pharma.signal.model.SignalSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies every observed quarter as NONE, WATCH or ALERT.
 * Uses the Strategy pattern: each SignalRule is handled by a registered SignalRuleEvaluator.
 *
 * Rules are evaluated in {@link SignalRule} declaration order, which is the
 * precedence order; the first matching rule decides the severity. The reasons
 * keep every matching rule at or below that severity's tier.
 */
@Component
public class SignalClassifier {

    private static final Logger log = LoggerFactory.getLogger(SignalClassifier.class);

    private final Map<SignalRule, SignalRuleEvaluator> evaluatorMap;

    public SignalClassifier(List<SignalRuleEvaluator> evaluators) {
        this.evaluatorMap = new EnumMap<>(SignalRule.class);

        // Auto-register all evaluator implementations
        for (SignalRuleEvaluator evaluator : evaluators) {
            evaluatorMap.put(evaluator.getSupportedRule(), evaluator);
            log.info("Registered signal evaluator: {} -> {}",
                    evaluator.getSupportedRule(), evaluator.getClass().getSimpleName());
        }
    }

    /**
     * @param series normalized series of the run
     * @param flags  anomaly flags for the same series; quarters without a flag were not scored
     * @param params thresholds of the run
     * @return one signal per quarter of the series, in period order
     */
    public List<SafetySignal> classify(NormalizedSeries series, List<AnomalyFlag> flags, MonitoringParameters params) {
        Map<LocalDate, AnomalyFlag> flagsByPeriod = indexFlags(series, flags);

        List<SafetySignal> signals = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            ObservationPoint current = series.get(i);
            if (i == 0) {
                // no previous quarter to compare against
                signals.add(SafetySignal.builder()
                        .periodStart(current.getPeriodStart())
                        .severity(SignalSeverity.NONE)
                        .reasons(EnumSet.noneOf(SignalRule.class))
                        .explanations(List.of())
                        .build());
                continue;
            }

            PeriodContext context = PeriodContext.of(current.getPeriodStart(),
                    series.get(i - 1).getCount(), current.getCount(),
                    flagsByPeriod.get(current.getPeriodStart()));
            signals.add(classifyPeriod(context, params));
        }
        return signals;
    }

    SafetySignal classifyPeriod(PeriodContext context, MonitoringParameters params) {
        List<RuleOutcome> matched = new ArrayList<>();
        for (SignalRule rule : SignalRule.values()) {
            SignalRuleEvaluator evaluator = evaluatorMap.get(rule);
            if (evaluator == null) {
                log.warn("No evaluator registered for signal rule: {}", rule);
                continue;
            }
            RuleOutcome outcome = evaluator.evaluate(context, params);
            if (outcome.isMatched()) {
                matched.add(outcome);
            }
        }

        SignalSeverity severity = matched.isEmpty() ? SignalSeverity.NONE : matched.get(0).getRule().getTier();

        Set<SignalRule> reasons = EnumSet.noneOf(SignalRule.class);
        List<String> explanations = new ArrayList<>();
        for (RuleOutcome outcome : matched) {
            if (outcome.getRule().getTier().compareTo(severity) <= 0) {
                reasons.add(outcome.getRule());
                explanations.add(outcome.getExplanation());
            }
        }

        if (severity.isFlagged()) {
            log.debug("Signal {} at {}: reasons={}", severity, context.getPeriodStart(), reasons);
        }

        return SafetySignal.builder()
                .periodStart(context.getPeriodStart())
                .severity(severity)
                .reasons(reasons)
                .pctChange(context.getPctChange())
                .unboundedIncrease(context.isUnboundedIncrease())
                .absChange(context.getAbsChange())
                .explanations(explanations)
                .build();
    }

    private Map<LocalDate, AnomalyFlag> indexFlags(NormalizedSeries series, List<AnomalyFlag> flags) {
        Map<LocalDate, AnomalyFlag> byPeriod = new HashMap<>();
        if (flags == null) {
            return byPeriod;
        }
        Set<LocalDate> periods = new HashSet<>();
        for (ObservationPoint point : series.getPoints()) {
            periods.add(point.getPeriodStart());
        }
        for (AnomalyFlag flag : flags) {
            if (!periods.contains(flag.getPeriodStart())) {
                throw new MalformedSeriesException(String.format(
                        "Anomaly flag for %s does not match any quarter of series %s",
                        flag.getPeriodStart(), series.getDrug()));
            }
            if (byPeriod.put(flag.getPeriodStart(), flag) != null) {
                throw new MalformedSeriesException("Duplicate anomaly flag for " + flag.getPeriodStart());
            }
        }
        return byPeriod;
    }
}
