package com.pharma.signal.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Observations and options for one monitoring run")
public class MonitoringRunRequest {

    @Schema(description = "Variant name; defaults to the drug name", example = "wegovy")
    private String variant;

    @Schema(description = "Version of the source data snapshot. Derived from the data when absent.",
            example = "faers-2024-01-15")
    private String snapshotVersion;

    @NotNull
    @Schema(description = "Quarterly report counts, in any order")
    private List<ObservationPoint> observations;

    @Schema(description = "Optional threshold overrides for this run")
    private ParameterOverrides overrides;
}
