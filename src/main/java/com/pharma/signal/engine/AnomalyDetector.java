package com.pharma.signal.engine;

import com.pharma.signal.model.AnomalyFlag;
import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.NormalizedSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores each quarter against a rolling baseline of the W quarters before it.
 *
 * The baseline never includes the quarter being scored. Quarters with index
 * below W have no complete baseline and receive no flag at all; absence of a
 * flag means "not scored", not "normal".
 *
 * A zero-variance baseline is handled explicitly: z is 0 when the count equals
 * the baseline mean, otherwise the signed {@link #Z_SCORE_SENTINEL}.
 *
 * Under the DROP gap policy the window runs over the observed points, so a
 * baseline may span a dropped quarter.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    /** Stand-in for an infinite z-score over a flat baseline. */
    public static final double Z_SCORE_SENTINEL = 1.0e6;

    public List<AnomalyFlag> detect(NormalizedSeries series, MonitoringParameters params) {
        int window = params.getRollingWindow();
        double threshold = params.getAnomalyThreshold();
        long[] counts = series.getCounts();

        List<AnomalyFlag> flags = new ArrayList<>(Math.max(0, counts.length - window));
        for (int i = window; i < counts.length; i++) {
            double mean = 0.0;
            for (int j = i - window; j < i; j++) {
                mean += counts[j];
            }
            mean /= window;

            double sumSq = 0.0;
            for (int j = i - window; j < i; j++) {
                double d = counts[j] - mean;
                sumSq += d * d;
            }
            double stdDev = Math.sqrt(sumSq / (window - 1));

            double deviation = counts[i] - mean;
            double z;
            if (stdDev > 0) {
                z = deviation / stdDev;
            } else if (deviation == 0) {
                z = 0.0;
            } else {
                z = Math.copySign(Z_SCORE_SENTINEL, deviation);
            }

            boolean anomaly = Math.abs(z) > threshold;
            flags.add(AnomalyFlag.builder()
                    .periodStart(series.get(i).getPeriodStart())
                    .score(z)
                    .anomaly(anomaly)
                    .rollingMean(mean)
                    .rollingStdDev(stdDev)
                    .build());

            if (anomaly) {
                log.debug("Anomaly in {} at {}: count={}, baseline mean={}, sd={}, z={}",
                        series.getDrug(), series.get(i).getPeriodStart(), counts[i],
                        String.format("%.2f", mean), String.format("%.2f", stdDev), String.format("%.2f", z));
            }
        }
        return flags;
    }
}
