package com.pharma.signal.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
@Schema(description = "Forecast for one future quarter. lowerBound <= pointEstimate <= upperBound.")
public class ForecastResult {

    @Schema(description = "First day of the forecast quarter", example = "2024-01-01")
    LocalDate periodStart;

    @Schema(description = "Expected report count (never negative)", example = "152.3")
    double pointEstimate;

    @Schema(description = "Lower bound of the confidence interval", example = "121.8")
    double lowerBound;

    @Schema(description = "Upper bound of the confidence interval", example = "182.9")
    double upperBound;
}
