package com.pharma.signal.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@Schema(description = "Forecast for the requested horizon plus model diagnostics")
public class Forecast {

    @Schema(description = "Forecast model that produced the results", example = "piecewise-seasonal")
    String model;

    @Schema(description = "Confidence level of the bounds", example = "0.95")
    double confidenceLevel;

    @Schema(description = "One entry per future quarter")
    List<ForecastResult> results;

    @Schema(description = "Residual standard deviation of the fit", example = "7.4")
    double residualStdDev;

    @Schema(description = "Quarters where the fitted trend changes slope")
    List<LocalDate> changepoints;

    @Schema(description = "Recoverable warnings about forecast reliability")
    List<LowConfidenceWarning> warnings;

    public boolean isLowConfidence() {
        return warnings != null && !warnings.isEmpty();
    }
}
