package com.pharma.signal.service;

import com.pharma.signal.config.MonitoringConfig;
import com.pharma.signal.exception.InsufficientDataException;
import com.pharma.signal.model.GapPolicy;
import com.pharma.signal.model.MonitoringReport;
import com.pharma.signal.model.MonitoringRunRequest;
import com.pharma.signal.model.ObservationPoint;
import com.pharma.signal.model.ParameterOverrides;
import com.pharma.signal.model.SafetySignal;
import com.pharma.signal.model.SignalRule;
import com.pharma.signal.model.SignalSeverity;
import com.pharma.signal.repository.FittedModelRepository;
import com.pharma.signal.repository.MonitoringReportRepository;
import com.pharma.signal.testutil.TestDataFactory;
import io.micrometer.core.instrument.observation.DefaultMeterObservationHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import java.util.List;
import java.util.NoSuchElementException;

import static com.pharma.signal.testutil.TestDataFactory.point;
import static com.pharma.signal.testutil.TestDataFactory.quarter;
import static com.pharma.signal.testutil.TestDataFactory.quarterly;
import static com.pharma.signal.testutil.TestDataFactory.surgeObservations;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignalMonitoringServiceTest {

    private MonitoringConfig config;
    private FittedModelRepository modelRepository;
    private MonitoringReportRepository reportRepository;
    private SimpleMeterRegistry registry;
    private SignalMonitoringService service;

    @BeforeEach
    void setUp() {
        config = new MonitoringConfig();
        modelRepository = new FittedModelRepository();
        reportRepository = new MonitoringReportRepository();
        registry = new SimpleMeterRegistry();
        service = TestDataFactory.monitoringService(config, modelRepository, reportRepository, registry);
    }

    private static MonitoringRunRequest surgeRequest() {
        return MonitoringRunRequest.builder()
                .observations(surgeObservations())
                .overrides(ParameterOverrides.builder().rollingWindow(3).build())
                .build();
    }

    @Test
    void run_surgeScenario_raisesAlertInFinalQuarter() {
        MonitoringReport report = service.run("ozempic", surgeRequest());

        assertThat(report.getDrug()).isEqualTo("ozempic");
        assertThat(report.getVariant()).isEqualTo("ozempic");
        assertThat(report.getParameters().getRollingWindow()).isEqualTo(3);
        assertThat(report.getSignals()).hasSize(4);

        SafetySignal last = report.getSignals().get(3);
        assertThat(last.getPeriodStart()).isEqualTo(quarter("2023Q4"));
        assertThat(last.getSeverity()).isEqualTo(SignalSeverity.ALERT);
        assertThat(last.getReasons())
                .containsExactlyInAnyOrder(SignalRule.QOQ_SURGE_WITH_ANOMALY, SignalRule.STATISTICAL_ANOMALY);
        assertThat(report.getSignals().subList(0, 3))
                .extracting(SafetySignal::getSeverity)
                .containsOnly(SignalSeverity.NONE);

        assertThat(report.getSummary().getTotalReports()).isEqualTo(310);
        assertThat(report.getSummary().getAlertsDetected()).isEqualTo(1);
        assertThat(report.getSummary().getFlaggedPeriods()).containsExactly(quarter("2023Q4"));
        assertThat(report.getForecast().getResults()).hasSize(4);
        assertThat(report.getForecast().getResults().get(0).getPeriodStart()).isEqualTo(quarter("2024Q1"));
        // four quarters is below the recommended eight
        assertThat(report.getSummary().isLowConfidence()).isTrue();
    }

    @Test
    void run_sameInputsTwice_reusesFittedModelAndGivesEqualSummary() {
        MonitoringReport first = service.run("ozempic", surgeRequest());
        MonitoringReport second = service.run("ozempic", surgeRequest());

        assertThat(second.getSummary()).isEqualTo(first.getSummary());
        assertThat(second.getSnapshotVersion()).isEqualTo(first.getSnapshotVersion());
        assertThat(modelRepository.size()).isEqualTo(1);
        assertThat(reportRepository.count()).isEqualTo(1);
    }

    @Test
    void run_differentForecastSettings_fitsSeparateModel() {
        service.run("ozempic", surgeRequest());
        MonitoringRunRequest holt = surgeRequest();
        holt.getOverrides().setForecastModel("holt-linear");

        MonitoringReport report = service.run("ozempic", holt);

        assertThat(report.getForecast().getModel()).isEqualTo("holt-linear");
        assertThat(modelRepository.size()).isEqualTo(2);
    }

    @Test
    void run_snapshotVersion_suppliedOrDerived() {
        MonitoringRunRequest supplied = surgeRequest();
        supplied.setSnapshotVersion("faers-2024-01-15");

        assertThat(service.run("ozempic", supplied).getSnapshotVersion()).isEqualTo("faers-2024-01-15");
        assertThat(service.run("ozempic", surgeRequest()).getSnapshotVersion()).matches("[0-9a-f]{64}");
    }

    @Test
    void run_droppedGapLeavesTooFewPoints_failsWithoutCachingReport() {
        MonitoringRunRequest request = MonitoringRunRequest.builder()
                .observations(List.of(point("2023Q1", 10), point("2023Q2", 12), point("2023Q4", 15)))
                .overrides(ParameterOverrides.builder().gapPolicy(GapPolicy.DROP).build())
                .build();

        assertThatThrownBy(() -> service.run("ozempic", request))
                .isInstanceOfSatisfying(InsufficientDataException.class, e -> {
                    assertThat(e.getAvailablePoints()).isEqualTo(3);
                    assertThat(e.getRequiredPoints()).isEqualTo(4);
                });

        assertThat(reportRepository.count()).isZero();
        assertThat(modelRepository.size()).isZero();
        assertThatThrownBy(() -> service.getLatestReport("ozempic", null))
                .isInstanceOf(NoSuchElementException.class);
        assertThat(registry.get("monitoring.run.count").tag("status", "failed").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void run_sameSnapshotVersionDifferentGapPolicy_refitsAndEnforcesMinimum() {
        List<ObservationPoint> observations = List.of(point("2023Q1", 10), point("2023Q2", 12), point("2023Q4", 15));
        MonitoringRunRequest zero = MonitoringRunRequest.builder()
                .snapshotVersion("faers-2024-01-15")
                .observations(observations)
                .build();
        MonitoringRunRequest drop = MonitoringRunRequest.builder()
                .snapshotVersion("faers-2024-01-15")
                .observations(observations)
                .overrides(ParameterOverrides.builder().gapPolicy(GapPolicy.DROP).build())
                .build();

        MonitoringReport zeroReport = service.run("ozempic", zero);
        assertThat(zeroReport.getSeries().size()).isEqualTo(4);

        assertThatThrownBy(() -> service.run("ozempic", drop))
                .isInstanceOf(InsufficientDataException.class);
        assertThat(modelRepository.size()).isEqualTo(1);
        assertThat(service.getLatestReport("ozempic", null)).isSameAs(zeroReport);
    }

    @Test
    void run_sameSnapshotVersionDifferentCounts_fitsEachSeries() {
        MonitoringRunRequest first = surgeRequest();
        first.setSnapshotVersion("faers-2024-01-15");
        MonitoringRunRequest corrected = MonitoringRunRequest.builder()
                .snapshotVersion("faers-2024-01-15")
                .observations(quarterly("2023Q1", 50, 55, 60, 70))
                .overrides(ParameterOverrides.builder().rollingWindow(3).build())
                .build();

        MonitoringReport before = service.run("ozempic", first);
        MonitoringReport after = service.run("ozempic", corrected);

        assertThat(modelRepository.size()).isEqualTo(2);
        assertThat(after.getForecast().getResults().get(0).getPointEstimate())
                .isNotEqualTo(before.getForecast().getResults().get(0).getPointEstimate());
    }

    @Test
    void run_reportsEmergingFromZero_classifiedWatch() {
        MonitoringRunRequest request = MonitoringRunRequest.builder()
                .observations(quarterly("2023Q1", 0, 0, 0, 0, 5))
                .build();

        MonitoringReport report = service.run("ozempic", request);

        SafetySignal last = report.getSignals().get(4);
        assertThat(last.getSeverity()).isEqualTo(SignalSeverity.WATCH);
        assertThat(last.isUnboundedIncrease()).isTrue();
        assertThat(last.getPctChange()).isNull();
        assertThat(last.getReasons()).containsExactly(SignalRule.STATISTICAL_ANOMALY);
    }

    @Test
    void run_invalidOverride_rejectedBeforePipeline() {
        MonitoringRunRequest request = MonitoringRunRequest.builder()
                .observations(surgeObservations())
                .overrides(ParameterOverrides.builder().rollingWindow(1).build())
                .build();

        assertThatThrownBy(() -> service.run("ozempic", request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rollingWindow");
        assertThat(reportRepository.count()).isZero();
    }

    @Test
    void run_recordsMetrics() {
        service.run("ozempic", surgeRequest());

        assertThat(registry.get("monitoring.run.count").tag("status", "completed").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("signal.detected.count").tag("severity", "ALERT").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("anomaly.detected.count").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("forecast.low_confidence.count").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("monitoring.cached.reports").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void run_throughObservedProxy_recordsOneObservationPerRequest() {
        ObservationRegistry observationRegistry = ObservationRegistry.create();
        observationRegistry.observationConfig().observationHandler(new DefaultMeterObservationHandler(registry));
        AspectJProxyFactory factory = new AspectJProxyFactory(service);
        factory.setProxyTargetClass(true);
        factory.addAspect(new ObservedAspect(observationRegistry));
        SignalMonitoringService observed = factory.getProxy();

        observed.run("ozempic", surgeRequest());

        assertThat(registry.get("monitoring.run_request").timer().count()).isEqualTo(1);
        assertThat(registry.find("monitoring.run").timer()).isNull();
    }

    @Test
    void run_variantsCachedIndependently() {
        MonitoringRunRequest wegovy = surgeRequest();
        wegovy.setVariant("wegovy");

        service.run("ozempic", surgeRequest());
        service.run("ozempic", wegovy);

        assertThat(service.getCachedReports())
                .extracting(MonitoringReport::getVariant)
                .containsExactly("ozempic", "wegovy");
        assertThat(service.getLatestReport("ozempic", "wegovy").getSummary().getDrug()).isEqualTo("wegovy");
    }

    @Test
    void getSignals_flaggedOnly_filtersNone() {
        service.run("ozempic", surgeRequest());

        assertThat(service.getSignals("ozempic", null, false)).hasSize(4);
        assertThat(service.getSignals("ozempic", null, true))
                .singleElement()
                .extracting(SafetySignal::getSeverity)
                .isEqualTo(SignalSeverity.ALERT);
    }

    @Test
    void resolveParameters_usesConfiguredDefaults() {
        config.setAnomalyThreshold(3.0);

        assertThat(service.resolveParameters(null).getAnomalyThreshold()).isEqualTo(3.0);
        assertThat(service.resolveParameters(ParameterOverrides.builder().anomalyThreshold(2.5).build())
                .getAnomalyThreshold()).isEqualTo(2.5);
    }
}
