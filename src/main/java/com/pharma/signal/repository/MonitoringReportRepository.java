package com.pharma.signal.repository;

import com.pharma.signal.model.MonitoringReport;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the latest report per drug variant in memory. Lost on restart.
 */
@Repository
public class MonitoringReportRepository {

    private final Map<String, MonitoringReport> latest = new ConcurrentHashMap<>();

    public void save(MonitoringReport report) {
        latest.put(key(report.getDrug(), report.getVariant()), report);
    }

    public Optional<MonitoringReport> findLatest(String drug, String variant) {
        return Optional.ofNullable(latest.get(key(drug, variant)));
    }

    public List<MonitoringReport> findAll() {
        return latest.values().stream()
                .sorted(Comparator.comparing(MonitoringReport::getDrug)
                        .thenComparing(MonitoringReport::getVariant))
                .toList();
    }

    public int count() {
        return latest.size();
    }

    private static String key(String drug, String variant) {
        return drug.toLowerCase(Locale.ROOT) + "|" + (variant == null ? drug : variant).toLowerCase(Locale.ROOT);
    }
}
