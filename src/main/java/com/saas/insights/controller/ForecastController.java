package com.saas.insights.controller;

import com.saas.insights.engine.ForecastingEngine;
import com.saas.insights.model.ForecastPeriod;
import com.saas.insights.model.UsageMetric;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/forecasts")
@Tag(name = "Forecasts", description = "Heuristic usage and revenue forecasts")
public class ForecastController {

    private final ForecastingEngine forecastingEngine;

    public ForecastController(ForecastingEngine forecastingEngine) {
        this.forecastingEngine = forecastingEngine;
    }

    @Operation(summary = "Forecast a usage metric",
            description = "Smooths 12 weeks of history and extrapolates a line through the last 4 weeks. "
                    + "The band is a fixed ±15%.")
    @GetMapping("/usage")
    public ResponseEntity<?> usage(
            @Parameter(description = "tokens, content-units or new-accounts", example = "tokens")
            @RequestParam(defaultValue = "tokens") String metric,
            @Parameter(description = "30d, 60d or 90d", example = "30d")
            @RequestParam(defaultValue = "30d") String period) {
        try {
            return ResponseEntity.ok(forecastingEngine.forecastUsage(
                    UsageMetric.fromKey(metric), ForecastPeriod.fromKey(period)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Forecast recurring revenue",
            description = "Current MRR from active subscriptions compounded at an assumed monthly growth rate.")
    @GetMapping("/revenue")
    public ResponseEntity<?> revenue(
            @Parameter(description = "30d, 60d or 90d", example = "90d")
            @RequestParam(defaultValue = "30d") String period) {
        try {
            return ResponseEntity.ok(forecastingEngine.forecastRevenue(ForecastPeriod.fromKey(period)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
