package com.pharma.signal.engine;

import com.pharma.signal.model.SignalRule;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RuleOutcome {

    SignalRule rule;

    boolean matched;

    String explanation;

    public static RuleOutcome notMatched(SignalRule rule) {
        return RuleOutcome.builder().rule(rule).matched(false).build();
    }

    public static RuleOutcome matched(SignalRule rule, String explanation) {
        return RuleOutcome.builder().rule(rule).matched(true).explanation(explanation).build();
    }
}
