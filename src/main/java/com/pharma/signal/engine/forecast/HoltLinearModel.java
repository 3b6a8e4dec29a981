package com.pharma.signal.engine.forecast;

import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.NormalizedSeries;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Holt's linear (double exponential) smoothing without seasonality.
 *
 * Level and trend are initialised from the first two quarters; sigma is the
 * RMS of one-step-ahead errors from the third quarter on. The standard error at
 * step h follows the Holt prediction variance
 * {@code sigma^2 * (1 + sum_{j=1}^{h-1} (alpha * (1 + j * beta))^2)}.
 *
 * Changepoint sensitivity does not apply to this model.
 */
@Component
public class HoltLinearModel implements ForecastModel {

    public static final String NAME = "holt-linear";

    static final double ALPHA = 0.5;
    static final double BETA = 0.3;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public FittedForecast fit(NormalizedSeries series, MonitoringParameters params) {
        long[] y = series.getCounts();
        double level = y[0];
        double trend = y[1] - y[0];

        double sumSq = 0.0;
        int errors = 0;
        for (int i = 1; i < y.length; i++) {
            double forecast = level + trend;
            if (i >= 2) {
                double error = y[i] - forecast;
                sumSq += error * error;
                errors++;
            }
            double newLevel = ALPHA * y[i] + (1 - ALPHA) * forecast;
            trend = BETA * (newLevel - level) + (1 - BETA) * trend;
            level = newLevel;
        }
        double sigma = errors > 0 ? Math.sqrt(sumSq / errors) : 0.0;

        return new Fitted(series, params, sigma, level, trend);
    }

    static final class Fitted extends FittedForecast {

        private final double level;
        private final double trend;

        Fitted(NormalizedSeries series, MonitoringParameters params, double sigma, double level, double trend) {
            super(NAME, series, params, sigma);
            this.level = level;
            this.trend = trend;
        }

        @Override
        public double expected(int step) {
            return level + step * trend;
        }

        @Override
        public double standardError(int step) {
            double variance = 1.0;
            for (int j = 1; j < step; j++) {
                double c = ALPHA * (1 + j * BETA);
                variance += c * c;
            }
            return getResidualStdDev() * Math.sqrt(variance);
        }

        @Override
        public List<LocalDate> getChangepoints() {
            return List.of();
        }
    }
}
