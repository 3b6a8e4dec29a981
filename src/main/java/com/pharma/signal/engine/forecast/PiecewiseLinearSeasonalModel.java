package com.pharma.signal.engine.forecast;

import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.NormalizedSeries;
import com.pharma.signal.model.Quarters;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Additive model {@code y(t) = trend(t) + seasonal(quarter) + noise}.
 *
 * Trend: piecewise-linear with a hinge term {@code max(0, t - k)} per
 * changepoint k. Changepoints are added greedily from the first 80% of history
 * while {@code n * ln(SSE_before / SSE_after)} exceeds
 * {@code ln(n) * 0.05 / sensitivity}. At the default sensitivity of 0.05 this is
 * the BIC penalty; larger sensitivities admit more changepoints. At most n/4
 * changepoints are kept.
 *
 * Seasonal: one additive offset per calendar quarter, the mean detrended
 * residual of that quarter, centred to sum to zero. Only estimated when every
 * quarter of the year was observed at least twice; the trend is then refitted
 * once on the deseasonalized series.
 *
 * Prediction standard error at step h is {@code sigma * sqrt(1 + h/n + sensitivity * h^2)}:
 * residual noise, growth from parameter uncertainty, and a random slope-shift
 * allowance scaled by the changepoint sensitivity.
 */
@Component
public class PiecewiseLinearSeasonalModel implements ForecastModel {

    public static final String NAME = "piecewise-seasonal";

    static final double REFERENCE_SENSITIVITY = 0.05;
    static final double CHANGEPOINT_RANGE = 0.8;
    static final int SEASON_LENGTH = 4;
    static final int SEASONAL_MIN_POINTS = 8;

    private static final double SSE_TOLERANCE = 1e-12;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public FittedForecast fit(NormalizedSeries series, MonitoringParameters params) {
        int n = series.size();
        LocalDate first = series.getFirstPeriod();
        double[] t = new double[n];
        double[] y = new double[n];
        int[] quarter = new int[n];
        for (int i = 0; i < n; i++) {
            LocalDate period = series.get(i).getPeriodStart();
            t[i] = Quarters.between(first, period);
            y[i] = series.get(i).getCount();
            quarter[i] = Quarters.quarterOfYear(period);
        }

        List<Double> knots = selectChangepoints(t, y, params.getChangepointSensitivity());
        double[] beta = LeastSquares.solve(design(t, knots), y);
        if (beta == null) {
            throw new IllegalStateException("Trend design is rank deficient for " + series.getDrug());
        }

        double[] seasonal = new double[SEASON_LENGTH];
        boolean seasonalFitted = hasSeasonalSupport(quarter);
        if (seasonalFitted) {
            seasonal = seasonalOffsets(t, y, quarter, knots, beta);
            double[] adjusted = new double[n];
            for (int i = 0; i < n; i++) {
                adjusted[i] = y[i] - seasonal[quarter[i]];
            }
            double[] refit = LeastSquares.solve(design(t, knots), adjusted);
            if (refit != null) {
                beta = refit;
                seasonal = seasonalOffsets(t, y, quarter, knots, beta);
            }
        }

        double sse = 0.0;
        for (int i = 0; i < n; i++) {
            double residual = y[i] - trend(t[i], beta, knots) - seasonal[quarter[i]];
            sse += residual * residual;
        }
        int parameters = 2 + knots.size() + (seasonalFitted ? SEASON_LENGTH - 1 : 0);
        int dof = n > parameters ? n - parameters : n;
        double sigma = Math.sqrt(sse / dof);

        return new Fitted(series, params, sigma, beta, knots, seasonal, t[n - 1], first);
    }

    List<Double> selectChangepoints(double[] t, double[] y, double sensitivity) {
        int n = t.length;
        List<Double> candidates = new ArrayList<>();
        double limit = t[0] + CHANGEPOINT_RANGE * (t[n - 1] - t[0]);
        // a hinge needs at least two points after it
        for (int i = 1; i <= n - 3; i++) {
            if (t[i] <= limit) {
                candidates.add(t[i]);
            }
        }

        List<Double> knots = new ArrayList<>();
        double[] beta = LeastSquares.solve(design(t, knots), y);
        if (beta == null) {
            return knots;
        }
        double sse = LeastSquares.sumOfSquaredResiduals(design(t, knots), y, beta);
        double scale = 1.0;
        for (double v : y) {
            scale += v * v;
        }
        double tolerance = SSE_TOLERANCE * scale;

        int maxKnots = n / 4;
        double penalty = Math.log(n) * (REFERENCE_SENSITIVITY / sensitivity);

        while (knots.size() < maxKnots && sse > tolerance) {
            Double best = null;
            double bestSse = sse;
            for (Double candidate : candidates) {
                if (knots.contains(candidate)) continue;
                List<Double> trial = new ArrayList<>(knots);
                trial.add(candidate);
                Collections.sort(trial);
                double[][] x = design(t, trial);
                double[] b = LeastSquares.solve(x, y);
                if (b == null) continue;
                double trialSse = LeastSquares.sumOfSquaredResiduals(x, y, b);
                if (trialSse < bestSse) {
                    best = candidate;
                    bestSse = trialSse;
                }
            }
            if (best == null) break;

            double gain = n * Math.log(sse / Math.max(bestSse, tolerance));
            if (gain <= penalty) break;

            knots.add(best);
            Collections.sort(knots);
            sse = bestSse;
        }
        return knots;
    }

    private boolean hasSeasonalSupport(int[] quarter) {
        if (quarter.length < SEASONAL_MIN_POINTS) return false;
        int[] seen = new int[SEASON_LENGTH];
        for (int q : quarter) {
            seen[q]++;
        }
        for (int count : seen) {
            if (count < 2) return false;
        }
        return true;
    }

    private double[] seasonalOffsets(double[] t, double[] y, int[] quarter, List<Double> knots, double[] beta) {
        double[] sums = new double[SEASON_LENGTH];
        int[] counts = new int[SEASON_LENGTH];
        for (int i = 0; i < t.length; i++) {
            sums[quarter[i]] += y[i] - trend(t[i], beta, knots);
            counts[quarter[i]]++;
        }
        double[] offsets = new double[SEASON_LENGTH];
        double centre = 0.0;
        for (int q = 0; q < SEASON_LENGTH; q++) {
            offsets[q] = sums[q] / counts[q];
            centre += offsets[q];
        }
        centre /= SEASON_LENGTH;
        for (int q = 0; q < SEASON_LENGTH; q++) {
            offsets[q] -= centre;
        }
        return offsets;
    }

    static double[][] design(double[] t, List<Double> knots) {
        double[][] x = new double[t.length][2 + knots.size()];
        for (int i = 0; i < t.length; i++) {
            x[i][0] = 1.0;
            x[i][1] = t[i];
            for (int k = 0; k < knots.size(); k++) {
                x[i][2 + k] = Math.max(0.0, t[i] - knots.get(k));
            }
        }
        return x;
    }

    static double trend(double t, double[] beta, List<Double> knots) {
        double value = beta[0] + beta[1] * t;
        for (int k = 0; k < knots.size(); k++) {
            value += beta[2 + k] * Math.max(0.0, t - knots.get(k));
        }
        return value;
    }

    static final class Fitted extends FittedForecast {

        private final double[] beta;
        private final List<Double> knots;
        private final double[] seasonal;
        private final double lastT;
        private final LocalDate firstPeriod;
        private final double sensitivity;

        Fitted(NormalizedSeries series, MonitoringParameters params, double sigma, double[] beta,
               List<Double> knots, double[] seasonal, double lastT, LocalDate firstPeriod) {
            super(NAME, series, params, sigma);
            this.beta = beta.clone();
            this.knots = List.copyOf(knots);
            this.seasonal = seasonal.clone();
            this.lastT = lastT;
            this.firstPeriod = firstPeriod;
            this.sensitivity = params.getChangepointSensitivity();
        }

        @Override
        public double expected(int step) {
            LocalDate period = Quarters.plus(getLastPeriod(), step);
            return trend(lastT + step, beta, knots) + seasonal[Quarters.quarterOfYear(period)];
        }

        @Override
        public double standardError(int step) {
            return getResidualStdDev()
                    * Math.sqrt(1.0 + (double) step / getHistorySize() + sensitivity * step * step);
        }

        @Override
        public List<LocalDate> getChangepoints() {
            List<LocalDate> dates = new ArrayList<>(knots.size());
            for (Double knot : knots) {
                dates.add(Quarters.plus(firstPeriod, knot.longValue()));
            }
            return dates;
        }

        double seasonalOffset(int quarterOfYear) {
            return seasonal[quarterOfYear];
        }
    }
}
