package com.pharma.signal.engine.forecast;

import com.pharma.signal.model.ForecastResult;
import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.NormalizedSeries;
import com.pharma.signal.model.Quarters;

import java.util.ArrayList;
import java.util.List;

/**
 * Fitting strategy behind the forecast stage. Implementations are registered
 * by name and selected per run, so the trend model can be swapped without
 * touching anomaly detection or signal classification.
 */
public interface ForecastModel {

    /**
     * The name runs select this model by, e.g. {@code piecewise-seasonal}.
     */
    String getName();

    /**
     * Fit the model to a series that already satisfies the minimum-length check.
     */
    FittedForecast fit(NormalizedSeries series, MonitoringParameters params);

    /**
     * Two-sided normal intervals: {@code expected ± z · se · inflation}. Estimates
     * and bounds are clamped at zero together, which keeps
     * {@code lower <= point <= upper}.
     */
    default List<ForecastResult> predict(FittedForecast fitted, int horizon) {
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be >= 1, got " + horizon);
        }
        List<ForecastResult> results = new ArrayList<>(horizon);
        for (int step = 1; step <= horizon; step++) {
            double raw = fitted.expected(step);
            double halfWidth = fitted.getCriticalValue() * fitted.standardError(step) * fitted.getInflation();
            results.add(ForecastResult.builder()
                    .periodStart(Quarters.plus(fitted.getLastPeriod(), step))
                    .pointEstimate(Math.max(0.0, raw))
                    .lowerBound(Math.max(0.0, raw - halfWidth))
                    .upperBound(Math.max(0.0, raw + halfWidth))
                    .build());
        }
        return results;
    }
}
