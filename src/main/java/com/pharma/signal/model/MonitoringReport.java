package com.pharma.signal.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Full output of one monitoring run for a drug variant")
public class MonitoringReport {

    @Schema(example = "ozempic")
    String drug;

    @Schema(example = "wegovy")
    String variant;

    @Schema(description = "Data snapshot the run was computed from")
    String snapshotVersion;

    @Schema(description = "Effective configuration of the run")
    MonitoringParameters parameters;

    NormalizedSeries series;

    Forecast forecast;

    @Schema(description = "Anomaly flags for quarters with a full baseline window")
    List<AnomalyFlag> anomalies;

    @Schema(description = "One signal per observed quarter")
    List<SafetySignal> signals;

    MonitoringSummary summary;

    @Schema(description = "Run completion time in epoch milliseconds", example = "1739886764000")
    long generatedAt;
}
