package com.pharma.signal.service;

import com.pharma.signal.config.MonitoringConfig;
import com.pharma.signal.exception.MonitoringException;
import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.MonitoringReport;
import com.pharma.signal.model.ObservationPoint;
import com.pharma.signal.model.VariantRunOutcome;
import com.pharma.signal.model.VariantRunRequest;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the monitoring pipeline for several variants of one drug in parallel.
 * Each variant is an independent run on its own series; one variant failing
 * does not affect the others.
 */
@Service
public class VariantMonitoringService {

    private static final Logger log = LoggerFactory.getLogger(VariantMonitoringService.class);

    static final String COMPLETED = "COMPLETED";
    static final String FAILED = "FAILED";

    private final SignalMonitoringService monitoringService;
    private final MonitoringConfig monitoringConfig;

    public VariantMonitoringService(SignalMonitoringService monitoringService,
                                    MonitoringConfig monitoringConfig) {
        this.monitoringService = monitoringService;
        this.monitoringConfig = monitoringConfig;
    }

    /**
     * @return one outcome per variant, in request order
     * @throws IllegalArgumentException when the overrides are invalid; no variant is run
     */
    @Observed(name = "monitoring.run_variants", contextualName = "run-variant-monitoring")
    public List<VariantRunOutcome> runVariants(VariantRunRequest request) {
        MonitoringParameters params = monitoringService.resolveParameters(request.getOverrides());
        String drug = request.getDrug();
        Map<String, List<ObservationPoint>> variants = request.getVariants();

        int parallelism = Math.max(1, Math.min(monitoringConfig.getVariantParallelism(), variants.size()));
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "variant-monitor-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            Map<String, Future<MonitoringReport>> futures = new LinkedHashMap<>();
            for (Map.Entry<String, List<ObservationPoint>> entry : variants.entrySet()) {
                String variant = entry.getKey();
                List<ObservationPoint> observations = entry.getValue();
                futures.put(variant, executor.submit(
                        () -> monitoringService.run(drug, variant, null, observations, params)));
            }

            List<VariantRunOutcome> outcomes = new ArrayList<>(futures.size());
            for (Map.Entry<String, Future<MonitoringReport>> entry : futures.entrySet()) {
                outcomes.add(await(entry.getKey(), entry.getValue()));
            }

            long failed = outcomes.stream().filter(o -> !o.isCompleted()).count();
            log.info("Variant monitoring for {} complete: {} variants, {} failed", drug, outcomes.size(), failed);
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private VariantRunOutcome await(String variant, Future<MonitoringReport> future) {
        try {
            MonitoringReport report = future.get();
            return VariantRunOutcome.builder()
                    .variant(variant)
                    .status(COMPLETED)
                    .summary(report.getSummary())
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while monitoring variant " + variant, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            String errorCode;
            if (cause instanceof MonitoringException me) {
                errorCode = me.getErrorCode();
            } else if (cause instanceof IllegalArgumentException) {
                errorCode = "INVALID_PARAMETERS";
            } else {
                errorCode = "INTERNAL_ERROR";
                log.error("Unexpected failure monitoring variant {}", variant, cause);
            }
            return VariantRunOutcome.builder()
                    .variant(variant)
                    .status(FAILED)
                    .errorCode(errorCode)
                    .error(cause.getMessage())
                    .build();
        }
    }
}
