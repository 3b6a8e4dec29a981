package com.pharma.signal.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-request overrides of the configured defaults. Null fields keep the
 * configured value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Optional per-run overrides of the configured thresholds")
public class ParameterOverrides {

    @Schema(example = "carry-forward")
    private GapPolicy gapPolicy;
    private Integer minPeriods;
    @Schema(example = "3")
    private Integer rollingWindow;
    private Double anomalyThreshold;
    private Double pctIncreaseThreshold;
    private Long minAbsoluteIncrease;
    @Schema(example = "8")
    private Integer forecastHorizon;
    private Double confidenceLevel;
    private Double changepointSensitivity;
    @Schema(example = "holt-linear")
    private String forecastModel;

    public MonitoringParameters applyTo(MonitoringParameters base) {
        MonitoringParameters.MonitoringParametersBuilder builder = base.toBuilder();
        if (gapPolicy != null) builder.gapPolicy(gapPolicy);
        if (minPeriods != null) builder.minPeriods(minPeriods);
        if (rollingWindow != null) builder.rollingWindow(rollingWindow);
        if (anomalyThreshold != null) builder.anomalyThreshold(anomalyThreshold);
        if (pctIncreaseThreshold != null) builder.pctIncreaseThreshold(pctIncreaseThreshold);
        if (minAbsoluteIncrease != null) builder.minAbsoluteIncrease(minAbsoluteIncrease);
        if (forecastHorizon != null) builder.forecastHorizon(forecastHorizon);
        if (confidenceLevel != null) builder.confidenceLevel(confidenceLevel);
        if (changepointSensitivity != null) builder.changepointSensitivity(changepointSensitivity);
        if (forecastModel != null) builder.forecastModel(forecastModel);
        return builder.build();
    }
}
