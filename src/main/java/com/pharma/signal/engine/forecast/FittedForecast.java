package com.pharma.signal.engine.forecast;

import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.NormalizedSeries;
import lombok.Getter;

import java.time.LocalDate;
import java.util.List;

/**
 * Immutable result of fitting a {@link ForecastModel} to one series. Holds what
 * prediction needs: the model's expected value and standard error per step,
 * the critical value for the requested confidence level, and the uncertainty
 * inflation applied to short histories.
 */
@Getter
public abstract class FittedForecast {

    private final String modelName;
    private final LocalDate lastPeriod;
    private final int historySize;
    private final double residualStdDev;
    private final double confidenceLevel;
    private final double criticalValue;
    private final int recommendedPeriods;
    private final double inflation;

    protected FittedForecast(String modelName, NormalizedSeries series, MonitoringParameters params,
                             double residualStdDev) {
        this.modelName = modelName;
        this.lastPeriod = series.getLastPeriod();
        this.historySize = series.size();
        this.residualStdDev = residualStdDev;
        this.confidenceLevel = params.getConfidenceLevel();
        this.criticalValue = NormalDistribution.twoSidedCriticalValue(params.getConfidenceLevel());
        this.recommendedPeriods = params.getLowConfidencePeriods();
        // widen proportionally to the shortfall in history
        this.inflation = historySize < recommendedPeriods
                ? Math.sqrt((double) recommendedPeriods / historySize)
                : 1.0;
    }

    /** Model's expected count {@code step} quarters after the last observed one. */
    public abstract double expected(int step);

    /** Standard error of the prediction {@code step} quarters ahead, before inflation. */
    public abstract double standardError(int step);

    public abstract List<LocalDate> getChangepoints();

    public boolean isLowConfidence() {
        return inflation > 1.0;
    }
}
