package com.pharma.signal.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

@Value
@Builder
@Schema(description = "Signal classification of one observed quarter")
public class SafetySignal {

    @Schema(example = "2023-10-01")
    LocalDate periodStart;

    @Schema(description = "NONE, WATCH or ALERT", example = "ALERT")
    SignalSeverity severity;

    @Schema(description = "Every rule that matched at or below the selected severity")
    Set<SignalRule> reasons;

    @Schema(description = "Quarter-over-quarter relative change. Null for the first quarter or an unbounded increase.",
            example = "1.4167")
    Double pctChange;

    @Schema(description = "True when reports emerged from a zero previous quarter", example = "false")
    boolean unboundedIncrease;

    @Schema(description = "Quarter-over-quarter absolute change", example = "85")
    long absChange;

    @Schema(description = "Human-readable explanation per matched rule")
    List<String> explanations;
}
