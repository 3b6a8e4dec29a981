package com.pharma.signal.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Result of one variant's independent pipeline run")
public class VariantRunOutcome {

    @Schema(example = "wegovy")
    String variant;

    @Schema(example = "COMPLETED", allowableValues = {"COMPLETED", "FAILED"})
    String status;

    @Schema(description = "Summary of the run; absent when the run failed")
    MonitoringSummary summary;

    @Schema(example = "INSUFFICIENT_DATA")
    String errorCode;

    @Schema(example = "Forecasting requires at least 4 observed periods, got 3")
    String error;

    public boolean isCompleted() {
        return "COMPLETED".equals(status);
    }
}
