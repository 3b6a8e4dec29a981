package com.pharma.signal.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.pharma.signal.model.AnomalyFlag;
import com.pharma.signal.model.ForecastResult;
import com.pharma.signal.model.MonitoringReport;
import com.pharma.signal.model.NormalizedSeries;
import com.pharma.signal.model.ObservationPoint;
import com.pharma.signal.model.Quarters;
import com.pharma.signal.model.ReportRow;
import com.pharma.signal.model.SafetySignal;
import com.pharma.signal.model.SignalRule;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Flattens a report into one row per observed quarter followed by one row per
 * forecast quarter, and writes those rows as CSV with a header line.
 */
@Service
public class ReportExportService {

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = csvMapper.schemaFor(ReportRow.class).withHeader();

    public List<ReportRow> toRows(MonitoringReport report) {
        NormalizedSeries series = report.getSeries();
        Set<LocalDate> imputed = new HashSet<>(series.getGapPeriods());
        Map<LocalDate, AnomalyFlag> flags = new HashMap<>();
        for (AnomalyFlag flag : report.getAnomalies()) {
            flags.put(flag.getPeriodStart(), flag);
        }

        List<ReportRow> rows = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            ObservationPoint point = series.get(i);
            LocalDate period = point.getPeriodStart();
            AnomalyFlag flag = flags.get(period);
            SafetySignal signal = report.getSignals().get(i);

            rows.add(ReportRow.builder()
                    .quarter(Quarters.label(period))
                    .periodStart(period.toString())
                    .kind(ReportRow.OBSERVED)
                    .count(point.getCount())
                    .provisional(point.isProvisional())
                    .imputed(imputed.contains(period))
                    .score(flag == null ? null : flag.getScore())
                    .anomaly(flag == null ? null : flag.isAnomaly())
                    .severity(signal.getSeverity().name())
                    .reasons(joinReasons(signal.getReasons()))
                    .pctChange(signal.getPctChange())
                    .unboundedIncrease(signal.isUnboundedIncrease())
                    .absChange(i == 0 ? null : signal.getAbsChange())
                    .build());
        }

        for (ForecastResult result : report.getForecast().getResults()) {
            rows.add(ReportRow.builder()
                    .quarter(Quarters.label(result.getPeriodStart()))
                    .periodStart(result.getPeriodStart().toString())
                    .kind(ReportRow.FORECAST)
                    .forecast(result.getPointEstimate())
                    .forecastLower(result.getLowerBound())
                    .forecastUpper(result.getUpperBound())
                    .build());
        }
        return rows;
    }

    public String toCsv(MonitoringReport report) {
        try {
            return csvMapper.writer(schema).writeValueAsString(toRows(report));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write CSV for " + report.getDrug() + "/" + report.getVariant(), e);
        }
    }

    private static String joinReasons(Set<SignalRule> reasons) {
        if (reasons == null || reasons.isEmpty()) {
            return "";
        }
        return Stream.of(SignalRule.values())
                .filter(reasons::contains)
                .map(Enum::name)
                .collect(Collectors.joining(";"));
    }
}
