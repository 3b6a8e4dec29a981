package com.pharma.signal.service;

import com.pharma.signal.config.MonitoringConfig;
import com.pharma.signal.exception.InsufficientDataException;
import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.MonitoringReport;
import com.pharma.signal.model.MonitoringSummary;
import com.pharma.signal.model.ObservationPoint;
import com.pharma.signal.model.ParameterOverrides;
import com.pharma.signal.model.VariantRunOutcome;
import com.pharma.signal.model.VariantRunRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.pharma.signal.testutil.TestDataFactory.quarterly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VariantMonitoringServiceTest {

    private SignalMonitoringService monitoringService;
    private VariantMonitoringService variantService;

    @BeforeEach
    void setUp() {
        monitoringService = mock(SignalMonitoringService.class);
        MonitoringConfig config = new MonitoringConfig();
        config.setVariantParallelism(2);
        variantService = new VariantMonitoringService(monitoringService, config);
        when(monitoringService.resolveParameters(any())).thenReturn(MonitoringParameters.defaults());
    }

    private static MonitoringReport report(String variant) {
        return MonitoringReport.builder()
                .drug("ozempic")
                .variant(variant)
                .summary(MonitoringSummary.builder().drug(variant).totalReports(310).build())
                .build();
    }

    private static VariantRunRequest request() {
        Map<String, List<ObservationPoint>> variants = new LinkedHashMap<>();
        variants.put("semaglutide", quarterly("2023Q1", 50, 55, 60, 145));
        variants.put("wegovy", quarterly("2023Q1", 10, 12, 15));
        variants.put("rybelsus", quarterly("2023Q1", 20, 22, 21, 23));
        return VariantRunRequest.builder().drug("ozempic").variants(variants).build();
    }

    @Test
    void runVariants_oneVariantFails_othersComplete() {
        when(monitoringService.run(eq("ozempic"), eq("semaglutide"), isNull(), anyCollection(), any()))
                .thenReturn(report("semaglutide"));
        when(monitoringService.run(eq("ozempic"), eq("wegovy"), isNull(), anyCollection(), any()))
                .thenThrow(new InsufficientDataException(3, 4));
        when(monitoringService.run(eq("ozempic"), eq("rybelsus"), isNull(), anyCollection(), any()))
                .thenReturn(report("rybelsus"));

        List<VariantRunOutcome> outcomes = variantService.runVariants(request());

        assertThat(outcomes).extracting(VariantRunOutcome::getVariant)
                .containsExactly("semaglutide", "wegovy", "rybelsus");
        assertThat(outcomes).extracting(VariantRunOutcome::getStatus)
                .containsExactly("COMPLETED", "FAILED", "COMPLETED");

        VariantRunOutcome failed = outcomes.get(1);
        assertThat(failed.getErrorCode()).isEqualTo("INSUFFICIENT_DATA");
        assertThat(failed.getError()).contains("at least 4");
        assertThat(failed.getSummary()).isNull();
        assertThat(outcomes.get(0).getSummary().getDrug()).isEqualTo("semaglutide");
    }

    @Test
    void runVariants_unexpectedFailure_reportedAsInternalError() {
        when(monitoringService.run(anyString(), anyString(), isNull(), anyCollection(), any()))
                .thenThrow(new IllegalStateException("boom"));

        List<VariantRunOutcome> outcomes = variantService.runVariants(request());

        assertThat(outcomes).allSatisfy(outcome -> {
            assertThat(outcome.isCompleted()).isFalse();
            assertThat(outcome.getErrorCode()).isEqualTo("INTERNAL_ERROR");
        });
    }

    @Test
    void runVariants_invalidOverrides_noVariantRuns() {
        VariantRunRequest request = request();
        request.setOverrides(ParameterOverrides.builder().rollingWindow(1).build());
        when(monitoringService.resolveParameters(request.getOverrides()))
                .thenThrow(new IllegalArgumentException("rollingWindow must be >= 2"));

        assertThatThrownBy(() -> variantService.runVariants(request))
                .isInstanceOf(IllegalArgumentException.class);
        verify(monitoringService, never()).run(anyString(), anyString(), any(), anyCollection(), any());
    }
}
