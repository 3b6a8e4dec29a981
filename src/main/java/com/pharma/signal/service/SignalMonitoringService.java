package com.pharma.signal.service;

import com.pharma.signal.config.MetricsConfig;
import com.pharma.signal.config.MonitoringConfig;
import com.pharma.signal.engine.AnomalyDetector;
import com.pharma.signal.engine.SignalClassifier;
import com.pharma.signal.engine.TimeSeriesNormalizer;
import com.pharma.signal.engine.forecast.FittedForecast;
import com.pharma.signal.engine.forecast.ForecastEngine;
import com.pharma.signal.exception.MonitoringException;
import com.pharma.signal.model.AnomalyFlag;
import com.pharma.signal.model.Forecast;
import com.pharma.signal.model.ForecastResult;
import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.MonitoringReport;
import com.pharma.signal.model.MonitoringRunRequest;
import com.pharma.signal.model.MonitoringSummary;
import com.pharma.signal.model.NormalizedSeries;
import com.pharma.signal.model.ObservationPoint;
import com.pharma.signal.model.ParameterOverrides;
import com.pharma.signal.model.SafetySignal;
import com.pharma.signal.model.SignalSeverity;
import com.pharma.signal.repository.FittedModelRepository;
import com.pharma.signal.repository.ModelCacheKey;
import com.pharma.signal.repository.MonitoringReportRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Main orchestrator for a monitoring run.
 *
 * Flow:
 * 1. Resolve the effective parameters (configured defaults plus request overrides)
 * 2. Normalize the raw observations into a quarterly series
 * 3. Fit (or reuse) the forecast model for this data snapshot and forecast
 * 4. Score each quarter against its rolling baseline
 * 5. Classify each quarter as NONE / WATCH / ALERT
 * 6. Summarize, cache the report and record metrics
 *
 * Any stage failure aborts the run and propagates unchanged; no partial report is stored.
 */
@Service
public class SignalMonitoringService {

    private static final Logger log = LoggerFactory.getLogger(SignalMonitoringService.class);

    private final TimeSeriesNormalizer normalizer;
    private final ForecastEngine forecastEngine;
    private final AnomalyDetector anomalyDetector;
    private final SignalClassifier signalClassifier;
    private final SummaryBuilder summaryBuilder;
    private final FittedModelRepository fittedModelRepository;
    private final MonitoringReportRepository reportRepository;
    private final MonitoringConfig monitoringConfig;
    private final MetricsConfig metricsConfig;

    public SignalMonitoringService(TimeSeriesNormalizer normalizer,
                                   ForecastEngine forecastEngine,
                                   AnomalyDetector anomalyDetector,
                                   SignalClassifier signalClassifier,
                                   SummaryBuilder summaryBuilder,
                                   FittedModelRepository fittedModelRepository,
                                   MonitoringReportRepository reportRepository,
                                   MonitoringConfig monitoringConfig,
                                   MetricsConfig metricsConfig) {
        this.normalizer = normalizer;
        this.forecastEngine = forecastEngine;
        this.anomalyDetector = anomalyDetector;
        this.signalClassifier = signalClassifier;
        this.summaryBuilder = summaryBuilder;
        this.fittedModelRepository = fittedModelRepository;
        this.reportRepository = reportRepository;
        this.monitoringConfig = monitoringConfig;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Run the pipeline for a REST request. The variant defaults to the drug name.
     */
    @Observed(name = "monitoring.run_request", contextualName = "run-monitoring-request")
    public MonitoringReport run(String drug, MonitoringRunRequest request) {
        String variant = request.getVariant() == null || request.getVariant().isBlank()
                ? drug : request.getVariant();
        MonitoringParameters params = resolveParameters(request.getOverrides());
        return run(drug, variant, request.getSnapshotVersion(), request.getObservations(), params);
    }

    /**
     * Run the pipeline with already resolved parameters. Not observed on its own:
     * REST runs are observed by {@link #run(String, MonitoringRunRequest)} and
     * variant runs by {@link VariantMonitoringService#runVariants}.
     */
    public MonitoringReport run(String drug, String variant, String snapshotVersion,
                                Collection<ObservationPoint> observations, MonitoringParameters params) {
        try {
            MonitoringReport report = execute(drug, variant, snapshotVersion, observations, params);
            metricsConfig.recordRun("completed");
            return report;
        } catch (MonitoringException e) {
            metricsConfig.recordRun("failed");
            log.info("Monitoring run for {}/{} failed [{}]: {}", drug, variant, e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    private MonitoringReport execute(String drug, String variant, String snapshotVersion,
                                     Collection<ObservationPoint> observations, MonitoringParameters params) {
        // 1. Normalize
        NormalizedSeries series = normalizer.normalize(variant, observations, params);
        String snapshot = snapshotVersion == null || snapshotVersion.isBlank()
                ? series.getSnapshotDigest() : snapshotVersion;

        // 2. Forecast, reusing a model fitted on the same snapshot and series with the same settings
        ModelCacheKey cacheKey = new ModelCacheKey(drug, variant, snapshot,
                series.getSnapshotDigest(), params.forecastFingerprint());
        FittedForecast fitted = fittedModelRepository.getOrFit(cacheKey, () -> forecastEngine.fit(series, params));
        Forecast forecast = forecastEngine.forecast(fitted, params);

        // 3. Anomaly detection
        List<AnomalyFlag> flags = anomalyDetector.detect(series, params);

        // 4. Signal classification
        List<SafetySignal> signals = signalClassifier.classify(series, flags, params);

        // 5. Summary
        MonitoringSummary summary = summaryBuilder.build(variant, series, forecast, flags, signals, params);

        MonitoringReport report = MonitoringReport.builder()
                .drug(drug)
                .variant(variant)
                .snapshotVersion(snapshot)
                .parameters(params)
                .series(series)
                .forecast(forecast)
                .anomalies(flags)
                .signals(signals)
                .summary(summary)
                .generatedAt(System.currentTimeMillis())
                .build();

        // 6. Cache and metrics
        reportRepository.save(report);
        recordMetrics(report);

        // signals are aligned with the series points
        for (int i = 0; i < signals.size(); i++) {
            SafetySignal signal = signals.get(i);
            if (signal.getSeverity() == SignalSeverity.ALERT) {
                log.warn("ALERT for {}/{} at {}: reasons={}, reports {} (+{})",
                        drug, variant, signal.getPeriodStart(), signal.getReasons(),
                        series.get(i).getCount(), signal.getAbsChange());
            }
        }
        log.info("Monitoring run for {}/{} complete: {} quarters, {} anomalies, {} signals, snapshot={}",
                drug, variant, series.size(), summary.getAnomaliesDetected(), summary.getSignalsDetected(), snapshot);

        return report;
    }

    /**
     * Configured defaults with the request overrides applied, validated.
     *
     * @throws IllegalArgumentException when the effective parameters are invalid
     */
    public MonitoringParameters resolveParameters(ParameterOverrides overrides) {
        MonitoringParameters base = monitoringConfig.toParameters();
        MonitoringParameters effective = overrides == null ? base : overrides.applyTo(base);
        return effective.validate();
    }

    public MonitoringReport getLatestReport(String drug, String variant) {
        String resolved = variant == null || variant.isBlank() ? drug : variant;
        return reportRepository.findLatest(drug, resolved)
                .orElseThrow(() -> new NoSuchElementException(
                        "No monitoring report for " + drug + "/" + resolved));
    }

    public List<SafetySignal> getSignals(String drug, String variant, boolean flaggedOnly) {
        List<SafetySignal> signals = getLatestReport(drug, variant).getSignals();
        if (!flaggedOnly) {
            return signals;
        }
        return signals.stream()
                .filter(s -> s.getSeverity().isFlagged())
                .toList();
    }

    public List<MonitoringReport> getCachedReports() {
        return reportRepository.findAll();
    }

    private void recordMetrics(MonitoringReport report) {
        for (SafetySignal signal : report.getSignals()) {
            if (signal.getSeverity().isFlagged()) {
                metricsConfig.recordSignal(signal.getSeverity().name());
            }
        }
        metricsConfig.recordAnomalies(report.getSummary().getAnomaliesDetected());

        Forecast forecast = report.getForecast();
        if (!forecast.getResults().isEmpty()) {
            ForecastResult next = forecast.getResults().get(0);
            metricsConfig.recordForecast(forecast.getModel(),
                    next.getUpperBound() - next.getLowerBound(), forecast.isLowConfidence());
        }
        metricsConfig.updateCachedReportCount(reportRepository.count());
    }
}
