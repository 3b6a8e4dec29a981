package com.pharma.signal.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Aggregate view of one monitoring run, the shape consumed by dashboards and
 * API clients. Serialized with snake_case keys.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"drug", "total_reports", "avg_quarterly_reports", "trend", "recent_quarter_reports",
        "forecast_next_quarter", "forecast_upper_bound", "forecast_lower_bound"})
@Schema(description = "Headline numbers of a monitoring run")
public class MonitoringSummary {

    @Schema(example = "ozempic")
    String drug;

    @Schema(description = "Sum of reports over all observed quarters", example = "310")
    long totalReports;

    @Schema(description = "Mean reports per quarter", example = "77.5")
    double avgQuarterlyReports;

    @Schema(description = "Sample standard deviation of quarterly reports", example = "45.18")
    double stdQuarterlyReports;

    @Schema(description = "increasing, decreasing or stable", example = "increasing")
    TrendDirection trend;

    @Schema(description = "Reports in the most recent quarter", example = "145")
    long recentQuarterReports;

    @Schema(description = "Point forecast for the next quarter", example = "160.2")
    Double forecastNextQuarter;

    @Schema(example = "201.7")
    Double forecastUpperBound;

    @Schema(example = "118.6")
    Double forecastLowerBound;

    @Schema(example = "2023-01-01")
    LocalDate dataStart;

    @Schema(example = "2023-10-01")
    LocalDate dataEnd;

    @Schema(description = "Quarters flagged as statistical anomalies", example = "1")
    int anomaliesDetected;

    @Schema(description = "Quarters classified WATCH or ALERT", example = "1")
    int signalsDetected;

    @Schema(description = "Quarters classified ALERT", example = "1")
    int alertsDetected;

    @Schema(description = "Quarters classified WATCH or ALERT, in period order")
    List<LocalDate> flaggedPeriods;

    @Schema(description = "True when the forecast was built on a short history", example = "true")
    boolean lowConfidence;

    @Schema(description = "Degraded-confidence notes a reviewer should consider")
    List<String> warnings;
}
