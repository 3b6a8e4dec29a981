package com.pharma.signal.controller;

import com.pharma.signal.config.MonitoringConfig;
import com.pharma.signal.engine.forecast.ForecastEngine;
import com.pharma.signal.model.GapPolicy;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime configuration (signal thresholds, forecast settings)")
public class ConfigController {

    private final MonitoringConfig monitoringConfig;
    private final ForecastEngine forecastEngine;

    public ConfigController(MonitoringConfig monitoringConfig, ForecastEngine forecastEngine) {
        this.monitoringConfig = monitoringConfig;
        this.forecastEngine = forecastEngine;
    }

    // ── Thresholds ──

    @Operation(summary = "Get signal thresholds")
    @GetMapping("/thresholds")
    public ResponseEntity<Map<String, Object>> getThresholds() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("gapPolicy", monitoringConfig.getGapPolicy().getValue());
        response.put("minPeriods", monitoringConfig.getMinPeriods());
        response.put("rollingWindow", monitoringConfig.getRollingWindow());
        response.put("anomalyThreshold", monitoringConfig.getAnomalyThreshold());
        response.put("pctIncreaseThreshold", monitoringConfig.getPctIncreaseThreshold());
        response.put("minAbsoluteIncrease", monitoringConfig.getMinAbsoluteIncrease());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Update signal thresholds",
            description = "Changes apply to runs started afterwards and reset on restart.")
    @PutMapping("/thresholds")
    public ResponseEntity<?> updateThresholds(@RequestBody Map<String, Object> body) {
        GapPolicy gapPolicy;
        try {
            gapPolicy = body.get("gapPolicy") == null
                    ? monitoringConfig.getGapPolicy() : GapPolicy.fromValue(body.get("gapPolicy").toString());
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage(), "gapPolicy");
        }
        int minPeriods = toInt(body, "minPeriods", monitoringConfig.getMinPeriods());
        int window = toInt(body, "rollingWindow", monitoringConfig.getRollingWindow());
        double threshold = toDouble(body, "anomalyThreshold", monitoringConfig.getAnomalyThreshold());
        double pct = toDouble(body, "pctIncreaseThreshold", monitoringConfig.getPctIncreaseThreshold());
        long minAbs = toLong(body, "minAbsoluteIncrease", monitoringConfig.getMinAbsoluteIncrease());

        if (minPeriods < 2) return badRequest("minPeriods must be >= 2", "minPeriods");
        if (minPeriods > monitoringConfig.getForecast().getLowConfidencePeriods()) {
            return badRequest("minPeriods must not exceed forecast.lowConfidencePeriods", "minPeriods");
        }
        if (window < 2) return badRequest("rollingWindow must be >= 2", "rollingWindow");
        if (threshold <= 0) return badRequest("anomalyThreshold must be > 0", "anomalyThreshold");
        if (pct < 0) return badRequest("pctIncreaseThreshold must be >= 0", "pctIncreaseThreshold");
        if (minAbs < 0) return badRequest("minAbsoluteIncrease must be >= 0", "minAbsoluteIncrease");

        monitoringConfig.setGapPolicy(gapPolicy);
        monitoringConfig.setMinPeriods(minPeriods);
        monitoringConfig.setRollingWindow(window);
        monitoringConfig.setAnomalyThreshold(threshold);
        monitoringConfig.setPctIncreaseThreshold(pct);
        monitoringConfig.setMinAbsoluteIncrease(minAbs);

        return getThresholds();
    }

    // ── Forecast ──

    @Operation(summary = "Get forecast settings")
    @GetMapping("/forecast")
    public ResponseEntity<Map<String, Object>> getForecastConfig() {
        MonitoringConfig.Forecast forecast = monitoringConfig.getForecast();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("model", forecast.getModel());
        response.put("availableModels", forecastEngine.getModelNames());
        response.put("horizon", forecast.getHorizon());
        response.put("confidenceLevel", forecast.getConfidenceLevel());
        response.put("changepointSensitivity", forecast.getChangepointSensitivity());
        response.put("lowConfidencePeriods", forecast.getLowConfidencePeriods());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Update forecast settings",
            description = "Changes apply to runs started afterwards and reset on restart.")
    @PutMapping("/forecast")
    public ResponseEntity<?> updateForecastConfig(@RequestBody Map<String, Object> body) {
        MonitoringConfig.Forecast forecast = monitoringConfig.getForecast();
        String model = body.get("model") == null ? forecast.getModel() : body.get("model").toString();
        int horizon = toInt(body, "horizon", forecast.getHorizon());
        double confidence = toDouble(body, "confidenceLevel", forecast.getConfidenceLevel());
        double sensitivity = toDouble(body, "changepointSensitivity", forecast.getChangepointSensitivity());
        int lowConfidence = toInt(body, "lowConfidencePeriods", forecast.getLowConfidencePeriods());

        if (!forecastEngine.getModelNames().contains(model)) {
            return badRequest("model must be one of " + forecastEngine.getModelNames(), "model");
        }
        if (horizon < 1) return badRequest("horizon must be >= 1", "horizon");
        if (confidence <= 0 || confidence >= 1) return badRequest("confidenceLevel must be in (0, 1)", "confidenceLevel");
        if (sensitivity <= 0) return badRequest("changepointSensitivity must be > 0", "changepointSensitivity");
        if (lowConfidence < monitoringConfig.getMinPeriods()) {
            return badRequest("lowConfidencePeriods must be >= minPeriods", "lowConfidencePeriods");
        }

        forecast.setModel(model);
        forecast.setHorizon(horizon);
        forecast.setConfidenceLevel(confidence);
        forecast.setChangepointSensitivity(sensitivity);
        forecast.setLowConfidencePeriods(lowConfidence);

        return getForecastConfig();
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private long toLong(Map<String, Object> body, String key, long defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.longValue();
        try { return Long.parseLong(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }
}
