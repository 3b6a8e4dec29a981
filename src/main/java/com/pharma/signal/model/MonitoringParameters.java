package com.pharma.signal.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable configuration snapshot for one pipeline run. Every stage receives
 * it explicitly, so concurrent runs never share thresholds through global state.
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "Effective configuration of a monitoring run")
public class MonitoringParameters {

    @Builder.Default
    @Schema(example = "zero")
    GapPolicy gapPolicy = GapPolicy.ZERO;

    @Builder.Default
    @Schema(description = "Minimum quarters required after normalization and for forecasting", example = "4")
    int minPeriods = 4;

    @Builder.Default
    @Schema(description = "Largest first-to-last span, in quarters, a series may cover", example = "400")
    int maxSpanQuarters = 400;

    @Builder.Default
    @Schema(description = "Rolling baseline window W", example = "4")
    int rollingWindow = 4;

    @Builder.Default
    @Schema(description = "Z-score threshold T", example = "2.0")
    double anomalyThreshold = 2.0;

    @Builder.Default
    @Schema(description = "Quarter-over-quarter relative increase threshold", example = "0.5")
    double pctIncreaseThreshold = 0.50;

    @Builder.Default
    @Schema(description = "Quarter-over-quarter absolute increase threshold", example = "10")
    long minAbsoluteIncrease = 10;

    @Builder.Default
    @Schema(description = "Number of future quarters to forecast", example = "4")
    int forecastHorizon = 4;

    @Builder.Default
    @Schema(description = "Confidence level of forecast bounds", example = "0.95")
    double confidenceLevel = 0.95;

    @Builder.Default
    @Schema(description = "Changepoint sensitivity; higher allows more trend breaks and wider bounds", example = "0.05")
    double changepointSensitivity = 0.05;

    @Builder.Default
    @Schema(description = "Forecast model name", example = "piecewise-seasonal")
    String forecastModel = "piecewise-seasonal";

    @Builder.Default
    @Schema(description = "Observed quarters below which forecasts carry a low-confidence warning", example = "8")
    int lowConfidencePeriods = 8;

    @Builder.Default
    @Schema(description = "Trailing quarters averaged for the trend direction", example = "4")
    int trendWindow = 4;

    @Builder.Default
    @Schema(description = "Relative band around the trailing average considered stable", example = "0.05")
    double trendTolerance = 0.05;

    public static MonitoringParameters defaults() {
        return MonitoringParameters.builder().build();
    }

    /**
     * @throws IllegalArgumentException naming the first invalid setting
     */
    public MonitoringParameters validate() {
        if (gapPolicy == null) throw new IllegalArgumentException("gapPolicy is required");
        if (minPeriods < 2) throw new IllegalArgumentException("minPeriods must be >= 2");
        if (maxSpanQuarters < minPeriods) throw new IllegalArgumentException("maxSpanQuarters must be >= minPeriods");
        if (rollingWindow < 2) throw new IllegalArgumentException("rollingWindow must be >= 2");
        if (!(anomalyThreshold > 0)) throw new IllegalArgumentException("anomalyThreshold must be > 0");
        if (pctIncreaseThreshold < 0) throw new IllegalArgumentException("pctIncreaseThreshold must be >= 0");
        if (minAbsoluteIncrease < 0) throw new IllegalArgumentException("minAbsoluteIncrease must be >= 0");
        if (forecastHorizon < 1) throw new IllegalArgumentException("forecastHorizon must be >= 1");
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new IllegalArgumentException("confidenceLevel must be in (0, 1)");
        }
        if (!(changepointSensitivity > 0)) throw new IllegalArgumentException("changepointSensitivity must be > 0");
        if (forecastModel == null || forecastModel.isBlank()) {
            throw new IllegalArgumentException("forecastModel is required");
        }
        if (lowConfidencePeriods < minPeriods) {
            throw new IllegalArgumentException("lowConfidencePeriods must be >= minPeriods");
        }
        if (trendWindow < 1) throw new IllegalArgumentException("trendWindow must be >= 1");
        if (trendTolerance < 0) throw new IllegalArgumentException("trendTolerance must be >= 0");
        return this;
    }

    /**
     * Identifies the settings that influence a model fit. Two runs with the same
     * fingerprint over the same data produce the same fitted model.
     */
    public String forecastFingerprint() {
        return String.format("%s;gap=%s;cps=%s;cl=%s;lcp=%d;min=%d", forecastModel, gapPolicy.getValue(),
                changepointSensitivity, confidenceLevel, lowConfidencePeriods, minPeriods);
    }
}
