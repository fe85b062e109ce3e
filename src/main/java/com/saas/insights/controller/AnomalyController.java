package com.saas.insights.controller;

import com.saas.insights.engine.AnomalyDetector;
import com.saas.insights.model.AnomalyReport;
import com.saas.insights.model.MetricConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Daily metric anomaly detection against a trailing 7-day baseline")
public class AnomalyController {

    private final AnomalyDetector anomalyDetector;
    private final Clock clock;

    public AnomalyController(AnomalyDetector anomalyDetector, Clock clock) {
        this.anomalyDetector = anomalyDetector;
        this.clock = clock;
    }

    @Operation(summary = "Detect anomalies for a day",
            description = "Checks every configured metric on the given UTC day and records one alert per anomalous metric. "
                    + "Repeating the call for the same day returns the same alerts.")
    @GetMapping
    public ResponseEntity<?> detect(
            @Parameter(description = "UTC day in ISO format, defaults to today", example = "2026-10-17")
            @RequestParam(required = false) String date) {
        LocalDate referenceDate;
        try {
            referenceDate = date == null || date.isBlank() ? LocalDate.now(clock) : LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "date must be an ISO day (yyyy-MM-dd)"));
        }
        AnomalyReport report = anomalyDetector.detectAnomalies(referenceDate);
        return ResponseEntity.ok(report);
    }

    @Operation(summary = "List monitored metrics and their thresholds")
    @GetMapping("/configs")
    public ResponseEntity<List<MetricConfig>> configs() {
        return ResponseEntity.ok(anomalyDetector.getMetricConfigs());
    }
}
