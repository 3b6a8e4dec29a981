package com.pharma.signal.service;

import com.pharma.signal.exception.EmptySeriesException;
import com.pharma.signal.model.AnomalyFlag;
import com.pharma.signal.model.Forecast;
import com.pharma.signal.model.ForecastResult;
import com.pharma.signal.model.LowConfidenceWarning;
import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.MonitoringSummary;
import com.pharma.signal.model.NormalizedSeries;
import com.pharma.signal.model.SafetySignal;
import com.pharma.signal.model.SignalSeverity;
import com.pharma.signal.model.TrendDirection;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregates one run into a {@link MonitoringSummary}.
 * Pure function of its inputs: the same inputs always give an equal summary.
 */
@Component
public class SummaryBuilder {

    public MonitoringSummary build(String drug, NormalizedSeries series, Forecast forecast,
                                   List<AnomalyFlag> flags, List<SafetySignal> signals) {
        return build(drug, series, forecast, flags, signals, MonitoringParameters.defaults());
    }

    public MonitoringSummary build(String drug, NormalizedSeries series, Forecast forecast,
                                   List<AnomalyFlag> flags, List<SafetySignal> signals,
                                   MonitoringParameters params) {
        if (series == null || series.isEmpty()) {
            throw new EmptySeriesException(drug);
        }

        long[] counts = series.getCounts();
        long total = 0;
        for (long c : counts) {
            total += c;
        }
        double mean = (double) total / counts.length;

        double std = 0.0;
        if (counts.length > 1) {
            double sumSq = 0.0;
            for (long c : counts) {
                sumSq += (c - mean) * (c - mean);
            }
            std = Math.sqrt(sumSq / (counts.length - 1));
        }

        long recent = counts[counts.length - 1];

        MonitoringSummary.MonitoringSummaryBuilder builder = MonitoringSummary.builder()
                .drug(drug)
                .totalReports(total)
                .avgQuarterlyReports(round(mean, 2))
                .stdQuarterlyReports(round(std, 2))
                .trend(trendDirection(counts, params.getTrendWindow(), params.getTrendTolerance()))
                .recentQuarterReports(recent)
                .dataStart(series.getFirstPeriod())
                .dataEnd(series.getLastPeriod());

        List<String> warnings = new ArrayList<>();
        if (forecast != null) {
            if (forecast.getResults() != null && !forecast.getResults().isEmpty()) {
                ForecastResult next = forecast.getResults().get(0);
                builder.forecastNextQuarter(round(next.getPointEstimate(), 1))
                        .forecastUpperBound(round(next.getUpperBound(), 1))
                        .forecastLowerBound(round(next.getLowerBound(), 1));
            }
            if (forecast.getWarnings() != null) {
                for (LowConfidenceWarning warning : forecast.getWarnings()) {
                    warnings.add(warning.getMessage());
                }
            }
            builder.lowConfidence(forecast.isLowConfidence());
        }
        if (series.isDiscontinuous()) {
            warnings.add(String.format("%d missing quarter(s) were dropped; the series is discontinuous",
                    series.getGapPeriods().size()));
        }

        int anomalies = 0;
        if (flags != null) {
            for (AnomalyFlag flag : flags) {
                if (flag.isAnomaly()) anomalies++;
            }
        }

        int flagged = 0;
        int alerts = 0;
        List<LocalDate> flaggedPeriods = new ArrayList<>();
        if (signals != null) {
            for (SafetySignal signal : signals) {
                if (signal.getSeverity().isFlagged()) {
                    flagged++;
                    flaggedPeriods.add(signal.getPeriodStart());
                }
                if (signal.getSeverity() == SignalSeverity.ALERT) alerts++;
            }
        }

        return builder
                .anomaliesDetected(anomalies)
                .signalsDetected(flagged)
                .alertsDetected(alerts)
                .flaggedPeriods(flaggedPeriods)
                .warnings(warnings)
                .build();
    }

    /**
     * Compares the most recent count with the average of the trailing window,
     * the window including the most recent quarter itself.
     */
    static TrendDirection trendDirection(long[] counts, int window, double tolerance) {
        long recent = counts[counts.length - 1];
        int size = Math.min(window, counts.length);
        double sum = 0.0;
        for (int i = counts.length - size; i < counts.length; i++) {
            sum += counts[i];
        }
        double average = sum / size;

        // an all-zero window includes the recent quarter, so nothing moved
        if (average == 0.0) {
            return TrendDirection.STABLE;
        }
        if (recent > average * (1 + tolerance)) return TrendDirection.INCREASING;
        if (recent < average * (1 - tolerance)) return TrendDirection.DECREASING;
        return TrendDirection.STABLE;
    }

    static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
