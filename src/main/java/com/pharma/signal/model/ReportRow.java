package com.pharma.signal.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * Flat record used for the tabular export: one row per observed quarter,
 * followed by one row per forecast quarter.
 */
@Value
@Builder
@JsonPropertyOrder({"quarter", "periodStart", "kind", "count", "provisional", "imputed", "score",
        "anomaly", "severity", "reasons", "pctChange", "unboundedIncrease", "absChange",
        "forecast", "forecastLower", "forecastUpper"})
public class ReportRow {

    public static final String OBSERVED = "observed";
    public static final String FORECAST = "forecast";

    String quarter;
    String periodStart;
    String kind;
    Long count;
    Boolean provisional;
    Boolean imputed;
    Double score;
    Boolean anomaly;
    String severity;
    String reasons;
    Double pctChange;
    Boolean unboundedIncrease;
    Long absChange;
    Double forecast;
    Double forecastLower;
    Double forecastUpper;
}
