package com.pharma.signal.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * Recoverable condition attached to a forecast built on a short history. The
 * forecast is still produced; its intervals are widened by {@link #widenFactor}.
 */
@Value
@Builder
@Schema(description = "Forecast produced from fewer historical periods than recommended")
public class LowConfidenceWarning {

    public static final String CODE = "LOW_CONFIDENCE";

    @Schema(example = "LOW_CONFIDENCE")
    @Builder.Default
    String code = CODE;

    @Schema(description = "Observed periods the model was fitted on", example = "6")
    int historyPeriods;

    @Schema(description = "Periods needed for full confidence", example = "8")
    int recommendedPeriods;

    @Schema(description = "Multiplier applied to the interval half-width", example = "1.155")
    double widenFactor;

    @Schema(example = "Only 6 of 8 recommended quarters available; intervals widened by 1.155x")
    String message;
}
