package com.saas.insights.controller;

import com.saas.insights.model.MetricSample;
import com.saas.insights.model.MetricSampleRequest;
import com.saas.insights.service.MetricSampleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/metrics/{metric}/samples")
@Tag(name = "Metric Samples", description = "Store and read the daily values anomaly detection and forecasts run on")
public class MetricSampleController {

    private final MetricSampleService sampleService;

    public MetricSampleController(MetricSampleService sampleService) {
        this.sampleService = sampleService;
    }

    @Operation(summary = "List daily values", description = "Days in [from, to], both inclusive. Defaults to the last 7 days.")
    @GetMapping
    public ResponseEntity<?> list(
            @Parameter(description = "Metric name", example = "daily_token_cost")
            @PathVariable String metric,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        try {
            List<MetricSample> samples = sampleService.list(metric, from, to);
            return ResponseEntity.ok(samples);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Record a daily value", description = "Replaces the day's value, or adds to it when increment is true.")
    @PostMapping
    public ResponseEntity<?> record(
            @Parameter(description = "Metric name", example = "daily_token_cost")
            @PathVariable String metric,
            @RequestBody MetricSampleRequest request) {
        if (request.getValue() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "value is required"));
        }
        try {
            MetricSample stored = sampleService.record(metric, request.getDay(), request.getValue(), request.isIncrement());
            return ResponseEntity.ok(stored);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
