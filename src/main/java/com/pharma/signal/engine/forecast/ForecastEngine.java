package com.pharma.signal.engine.forecast;

import com.pharma.signal.exception.InsufficientDataException;
import com.pharma.signal.model.Forecast;
import com.pharma.signal.model.ForecastResult;
import com.pharma.signal.model.LowConfidenceWarning;
import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.NormalizedSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Forecast stage. Enforces the minimum history, dispatches to the configured
 * {@link ForecastModel} and turns short histories into a
 * {@link LowConfidenceWarning} rather than a failure.
 */
@Component
public class ForecastEngine {

    private static final Logger log = LoggerFactory.getLogger(ForecastEngine.class);

    private final Map<String, ForecastModel> models;

    public ForecastEngine(List<ForecastModel> models) {
        this.models = new LinkedHashMap<>();
        for (ForecastModel model : models) {
            this.models.put(model.getName(), model);
            log.info("Registered forecast model: {} -> {}", model.getName(), model.getClass().getSimpleName());
        }
    }

    public Set<String> getModelNames() {
        return models.keySet();
    }

    /**
     * @throws InsufficientDataException when the series has fewer observed points than {@code minPeriods}
     * @throws IllegalArgumentException  when the requested model is not registered
     */
    public FittedForecast fit(NormalizedSeries series, MonitoringParameters params) {
        if (series.size() < params.getMinPeriods()) {
            throw new InsufficientDataException(series.size(), params.getMinPeriods());
        }
        ForecastModel model = resolve(params.getForecastModel());
        FittedForecast fitted = model.fit(series, params);
        log.debug("Fitted {} for {}: n={}, sigma={}, changepoints={}",
                model.getName(), series.getDrug(), fitted.getHistorySize(),
                String.format("%.3f", fitted.getResidualStdDev()), fitted.getChangepoints());
        return fitted;
    }

    public Forecast forecast(NormalizedSeries series, MonitoringParameters params) {
        return forecast(fit(series, params), params);
    }

    public Forecast forecast(FittedForecast fitted, MonitoringParameters params) {
        ForecastModel model = resolve(fitted.getModelName());
        List<ForecastResult> results = model.predict(fitted, params.getForecastHorizon());

        List<LowConfidenceWarning> warnings = new ArrayList<>();
        if (fitted.isLowConfidence()) {
            LowConfidenceWarning warning = LowConfidenceWarning.builder()
                    .historyPeriods(fitted.getHistorySize())
                    .recommendedPeriods(fitted.getRecommendedPeriods())
                    .widenFactor(fitted.getInflation())
                    .message(String.format(
                            "Only %d of %d recommended quarters available; intervals widened by %.3fx",
                            fitted.getHistorySize(), fitted.getRecommendedPeriods(), fitted.getInflation()))
                    .build();
            warnings.add(warning);
            log.warn("Low-confidence forecast: {}", warning.getMessage());
        }

        return Forecast.builder()
                .model(fitted.getModelName())
                .confidenceLevel(fitted.getConfidenceLevel())
                .results(results)
                .residualStdDev(fitted.getResidualStdDev())
                .changepoints(fitted.getChangepoints())
                .warnings(warnings)
                .build();
    }

    private ForecastModel resolve(String name) {
        ForecastModel model = models.get(name);
        if (model == null) {
            throw new IllegalArgumentException("Unknown forecast model: " + name + " (available: " + models.keySet() + ")");
        }
        return model;
    }
}
