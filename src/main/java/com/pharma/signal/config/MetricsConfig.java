package com.pharma.signal.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger cachedReportCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.cachedReportCount = registry.gauge("monitoring.cached.reports", new AtomicInteger(0));
    }

    public void recordRun(String status) {
        Counter.builder("monitoring.run.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordSignal(String severity) {
        Counter.builder("signal.detected.count")
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordAnomalies(int count) {
        Counter.builder("anomaly.detected.count")
                .register(registry)
                .increment(count);
    }

    public void recordForecast(String model, double intervalWidth, boolean lowConfidence) {
        DistributionSummary.builder("forecast.interval_width")
                .tag("model", model)
                .register(registry)
                .record(intervalWidth);

        if (lowConfidence) {
            Counter.builder("forecast.low_confidence.count")
                    .tag("model", model)
                    .register(registry)
                    .increment();
        }
    }

    public void updateCachedReportCount(int count) {
        cachedReportCount.set(count);
    }
}
