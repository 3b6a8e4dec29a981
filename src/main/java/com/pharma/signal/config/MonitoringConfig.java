package com.pharma.signal.config;

import com.pharma.signal.model.GapPolicy;
import com.pharma.signal.model.MonitoringParameters;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "monitoring")
public class MonitoringConfig {

    // Drug monitored when no variant is named
    private String targetDrug = "ozempic";

    // Brand and molecule names monitored alongside the target drug
    private List<String> drugVariants = List.of("semaglutide", "wegovy", "rybelsus");

    private GapPolicy gapPolicy = GapPolicy.ZERO;

    // Quarters required after normalization, and observed points required to forecast
    private int minPeriods = 4;

    // Upper bound on the first-to-last span of a series; 400 quarters is a century
    private int maxSpanQuarters = 400;

    // Baseline window W for the rolling z-score
    private int rollingWindow = 4;

    // |z| strictly above this flags a statistical anomaly
    private double anomalyThreshold = 2.0;

    // Relative quarter-over-quarter increase (0.5 = +50%)
    private double pctIncreaseThreshold = 0.50;

    // Absolute quarter-over-quarter increase in reports
    private long minAbsoluteIncrease = 10;

    // Variant pipelines run concurrently on a pool of this size
    private int variantParallelism = 4;

    private Forecast forecast = new Forecast();

    @Data
    public static class Forecast {
        private String model = "piecewise-seasonal";
        private int horizon = 4;
        private double confidenceLevel = 0.95;
        private double changepointSensitivity = 0.05;
        // Histories shorter than this produce widened, low-confidence intervals
        private int lowConfidencePeriods = 8;
    }

    /**
     * Snapshot of the current settings. Later updates through the config API
     * do not affect a snapshot already taken.
     */
    public MonitoringParameters toParameters() {
        return MonitoringParameters.builder()
                .gapPolicy(gapPolicy)
                .minPeriods(minPeriods)
                .maxSpanQuarters(maxSpanQuarters)
                .rollingWindow(rollingWindow)
                .anomalyThreshold(anomalyThreshold)
                .pctIncreaseThreshold(pctIncreaseThreshold)
                .minAbsoluteIncrease(minAbsoluteIncrease)
                .forecastHorizon(forecast.getHorizon())
                .confidenceLevel(forecast.getConfidenceLevel())
                .changepointSensitivity(forecast.getChangepointSensitivity())
                .forecastModel(forecast.getModel())
                .lowConfidencePeriods(forecast.getLowConfidencePeriods())
                .build();
    }
}
