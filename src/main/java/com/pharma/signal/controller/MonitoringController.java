package com.pharma.signal.controller;

import com.pharma.signal.model.MonitoringReport;
import com.pharma.signal.model.MonitoringRunRequest;
import com.pharma.signal.model.MonitoringSummary;
import com.pharma.signal.model.SafetySignal;
import com.pharma.signal.model.VariantRunOutcome;
import com.pharma.signal.model.VariantRunRequest;
import com.pharma.signal.service.ReportExportService;
import com.pharma.signal.service.SignalMonitoringService;
import com.pharma.signal.service.VariantMonitoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/monitoring")
@Tag(name = "Monitoring", description = "Run the signal-detection pipeline and query the latest results per drug variant")
public class MonitoringController {

    private final SignalMonitoringService monitoringService;
    private final VariantMonitoringService variantMonitoringService;
    private final ReportExportService exportService;

    public MonitoringController(SignalMonitoringService monitoringService,
                                VariantMonitoringService variantMonitoringService,
                                ReportExportService exportService) {
        this.monitoringService = monitoringService;
        this.variantMonitoringService = variantMonitoringService;
        this.exportService = exportService;
    }

    @Operation(summary = "Run the monitoring pipeline for a drug",
            description = "Normalizes the posted quarterly counts, forecasts the next quarters, scores each quarter " +
                    "against its rolling baseline and classifies it as NONE, WATCH or ALERT. The report replaces " +
                    "the cached report for the drug variant.")
    @PostMapping("/{drug}/run")
    public ResponseEntity<MonitoringReport> run(
            @Parameter(description = "Drug name", example = "ozempic") @PathVariable String drug,
            @Valid @RequestBody MonitoringRunRequest request) {
        return ResponseEntity.ok(monitoringService.run(drug, request));
    }

    @Operation(summary = "Get the latest summary",
            description = "Headline numbers of the latest run, with snake_case keys.")
    @GetMapping("/{drug}/summary")
    public ResponseEntity<MonitoringSummary> getSummary(
            @PathVariable String drug,
            @Parameter(description = "Variant name; defaults to the drug name") @RequestParam(required = false) String variant) {
        return ResponseEntity.ok(monitoringService.getLatestReport(drug, variant).getSummary());
    }

    @Operation(summary = "Get the latest full report")
    @GetMapping("/{drug}/report")
    public ResponseEntity<MonitoringReport> getReport(
            @PathVariable String drug,
            @RequestParam(required = false) String variant) {
        return ResponseEntity.ok(monitoringService.getLatestReport(drug, variant));
    }

    @Operation(summary = "Get the latest signals",
            description = "One signal per observed quarter, or only WATCH and ALERT quarters when flaggedOnly is set.")
    @GetMapping("/{drug}/signals")
    public ResponseEntity<List<SafetySignal>> getSignals(
            @PathVariable String drug,
            @RequestParam(required = false) String variant,
            @RequestParam(defaultValue = "false") boolean flaggedOnly) {
        return ResponseEntity.ok(monitoringService.getSignals(drug, variant, flaggedOnly));
    }

    @Operation(summary = "Export the latest report as CSV",
            description = "One row per observed quarter followed by one row per forecast quarter.")
    @GetMapping(value = "/{drug}/report.csv", produces = "text/csv")
    public ResponseEntity<String> exportCsv(
            @PathVariable String drug,
            @RequestParam(required = false) String variant) {
        MonitoringReport report = monitoringService.getLatestReport(drug, variant);
        return ResponseEntity.ok()
                .contentType(MediaType.valueOf("text/csv"))
                .header("Content-Disposition",
                        "attachment; filename=\"" + report.getVariant() + "-signals.csv\"")
                .body(exportService.toCsv(report));
    }

    @Operation(summary = "Run the pipeline for several variants in parallel",
            description = "Each variant is monitored independently. A failing variant is reported with its error " +
                    "code and does not block the others.")
    @PostMapping("/variants/run")
    public ResponseEntity<List<VariantRunOutcome>> runVariants(@Valid @RequestBody VariantRunRequest request) {
        return ResponseEntity.ok(variantMonitoringService.runVariants(request));
    }

    @Operation(summary = "Get the status of cached runs",
            description = "Lists the latest run per drug variant with its snapshot and signal counts.")
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        List<Map<String, Object>> runs = new ArrayList<>();
        for (MonitoringReport report : monitoringService.getCachedReports()) {
            Map<String, Object> run = new LinkedHashMap<>();
            run.put("drug", report.getDrug());
            run.put("variant", report.getVariant());
            run.put("snapshotVersion", report.getSnapshotVersion());
            run.put("quarters", report.getSeries().size());
            run.put("dataEnd", report.getSummary().getDataEnd().toString());
            run.put("signalsDetected", report.getSummary().getSignalsDetected());
            run.put("alertsDetected", report.getSummary().getAlertsDetected());
            run.put("lowConfidence", report.getSummary().isLowConfidence());
            run.put("generatedAt", report.getGeneratedAt());
            runs.add(run);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("cachedRuns", runs.size());
        response.put("runs", runs);
        return ResponseEntity.ok(response);
    }
}
