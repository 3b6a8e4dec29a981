package com.pharma.signal.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Observations for several variants of one drug, monitored independently")
public class VariantRunRequest {

    @NotBlank
    @Schema(example = "ozempic")
    private String drug;

    @NotEmpty
    @Schema(description = "Observations keyed by variant name")
    private Map<String, List<ObservationPoint>> variants;

    @Schema(description = "Optional threshold overrides applied to every variant")
    private ParameterOverrides overrides;
}
