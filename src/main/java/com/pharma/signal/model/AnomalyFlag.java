package com.pharma.signal.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
@Schema(description = "Z-score of one quarter against the rolling baseline of the quarters before it")
public class AnomalyFlag {

    @Schema(example = "2023-10-01")
    LocalDate periodStart;

    @Schema(description = "Z-score: standardized deviation from the rolling baseline", example = "18.0")
    double score;

    @Schema(description = "Whether |score| exceeds the configured threshold", example = "true")
    boolean anomaly;

    @Schema(description = "Mean of the baseline window", example = "55.0")
    double rollingMean;

    @Schema(description = "Sample standard deviation of the baseline window", example = "5.0")
    double rollingStdDev;
}
