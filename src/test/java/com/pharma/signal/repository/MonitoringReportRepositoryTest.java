package com.pharma.signal.repository;

import com.pharma.signal.model.MonitoringReport;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class MonitoringReportRepositoryTest {

    private final MonitoringReportRepository repository = new MonitoringReportRepository();

    private static MonitoringReport report(String drug, String variant, long generatedAt) {
        return MonitoringReport.builder().drug(drug).variant(variant).generatedAt(generatedAt).build();
    }

    @Test
    void save_replacesLatestPerVariant() {
        repository.save(report("ozempic", "wegovy", 1L));
        repository.save(report("ozempic", "wegovy", 2L));

        assertThat(repository.count()).isEqualTo(1);
        assertThat(repository.findLatest("ozempic", "wegovy"))
                .get()
                .extracting(MonitoringReport::getGeneratedAt)
                .isEqualTo(2L);
    }

    @Test
    void findLatest_caseInsensitiveAndDefaultsVariantToDrug() {
        repository.save(report("Ozempic", "Ozempic", 1L));

        assertThat(repository.findLatest("ozempic", null)).isPresent();
        assertThat(repository.findLatest("OZEMPIC", "ozempic")).isPresent();
        assertThat(repository.findLatest("ozempic", "wegovy")).isEmpty();
    }

    @Test
    void findAll_sortedByDrugThenVariant() {
        repository.save(report("ozempic", "wegovy", 1L));
        repository.save(report("mounjaro", "zepbound", 1L));
        repository.save(report("ozempic", "rybelsus", 1L));

        assertThat(repository.findAll())
                .extracting(MonitoringReport::getVariant)
                .containsExactly("zepbound", "rybelsus", "wegovy");
    }

    @Test
    void findLatest_turkishDefaultLocale_keysStillMatch() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            repository.save(report("IMBRUVICA", "IMBRUVICA", 1L));

            assertThat(repository.findLatest("imbruvica", null)).isPresent();
            assertThat(repository.findLatest("Imbruvica", "imbruvica")).isPresent();
        } finally {
            Locale.setDefault(original);
        }
    }
}
