package com.saas.insights.controller;

import com.saas.insights.engine.ForecastingEngine;
import com.saas.insights.model.ConfidenceInterval;
import com.saas.insights.model.ForecastPeriod;
import com.saas.insights.model.ForecastResult;
import com.saas.insights.model.Trend;
import com.saas.insights.model.UsageMetric;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ForecastController.class)
class ForecastControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ForecastingEngine forecastingEngine;

    @Test
    void usage_defaultsToTokensOver30Days() throws Exception {
        when(forecastingEngine.forecastUsage(UsageMetric.TOKENS, ForecastPeriod.DAYS_30))
                .thenReturn(ForecastResult.builder()
                        .metric("tokens")
                        .period(ForecastPeriod.DAYS_30)
                        .currentValue(700.0)
                        .forecastedValue(1000.0)
                        .confidenceInterval(new ConfidenceInterval(850.0, 1150.0))
                        .trend(Trend.INCREASING)
                        .growthRate(12.5)
                        .build());

        mockMvc.perform(get("/api/v1/forecasts/usage"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.period").value("30d"))
                .andExpect(jsonPath("$.trend").value("increasing"))
                .andExpect(jsonPath("$.confidenceInterval.upper").value(1150.0));
    }

    @Test
    void usage_unknownPeriod() throws Exception {
        mockMvc.perform(get("/api/v1/forecasts/usage").param("period", "45d"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verify(forecastingEngine, never()).forecastUsage(any(), any());
    }

    @Test
    void usage_unknownMetric() throws Exception {
        mockMvc.perform(get("/api/v1/forecasts/usage").param("metric", "storage"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void revenue_forPeriod() throws Exception {
        when(forecastingEngine.forecastRevenue(ForecastPeriod.DAYS_90))
                .thenReturn(ForecastResult.builder()
                        .metric("mrr")
                        .period(ForecastPeriod.DAYS_90)
                        .currentValue(1000.0)
                        .forecastedValue(1157.63)
                        .confidenceInterval(ConfidenceInterval.around(1157.63, 0.10))
                        .trend(Trend.INCREASING)
                        .growthRate(5.0)
                        .build());

        mockMvc.perform(get("/api/v1/forecasts/revenue").param("period", "90d"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metric").value("mrr"))
                .andExpect(jsonPath("$.growthRate").value(5.0));
    }
}
