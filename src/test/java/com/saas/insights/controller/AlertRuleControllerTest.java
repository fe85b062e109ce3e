package com.saas.insights.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.saas.insights.model.AlertRule;
import com.saas.insights.model.ComparisonOperator;
import com.saas.insights.model.MetricKind;
import com.saas.insights.service.AlertRuleService;
import com.saas.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AlertRuleController.class)
class AlertRuleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AlertRuleService ruleService;

    @Test
    void listRules_success() throws Exception {
        when(ruleService.getAllRules()).thenReturn(List.of(
                TestDataFactory.createAlertRule("R1", MetricKind.ERROR_RATE, ComparisonOperator.GT, 5.0)));

        mockMvc.perform(get("/api/v1/alert-rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].ruleId").value("R1"))
                .andExpect(jsonPath("$[0].metric").value("error_rate"))
                .andExpect(jsonPath("$[0].operator").value("gt"));
    }

    @Test
    void getRule_notFound() throws Exception {
        when(ruleService.getRule("MISSING")).thenReturn(null);

        mockMvc.perform(get("/api/v1/alert-rules/MISSING"))
                .andExpect(status().isNotFound());
    }

    @Test
    void createRule_success() throws Exception {
        AlertRule rule = TestDataFactory.createAlertRule("R-NEW", MetricKind.TOKEN_USAGE, ComparisonOperator.GTE, 1000.0);
        when(ruleService.createRule(any(AlertRule.class))).thenReturn(rule);

        mockMvc.perform(post("/api/v1/alert-rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(rule)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ruleId").value("R-NEW"))
                .andExpect(jsonPath("$.channels[0]").value("in_app"));
    }

    @Test
    void createRule_invalid() throws Exception {
        when(ruleService.createRule(any(AlertRule.class)))
                .thenThrow(new IllegalArgumentException("name is required"));

        mockMvc.perform(post("/api/v1/alert-rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"metric\":\"error_rate\",\"operator\":\"gt\",\"threshold\":5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("name is required"));
    }

    @Test
    void updateRule_notFound() throws Exception {
        when(ruleService.updateRule(eq("MISSING"), any(AlertRule.class))).thenReturn(null);

        mockMvc.perform(put("/api/v1/alert-rules/MISSING")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"threshold\":9}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void deleteRule_success() throws Exception {
        when(ruleService.deleteRule("R1")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/alert-rules/R1"))
                .andExpect(status().isNoContent());
    }

    @Test
    void deleteRule_notFound() throws Exception {
        when(ruleService.deleteRule("MISSING")).thenReturn(false);

        mockMvc.perform(delete("/api/v1/alert-rules/MISSING"))
                .andExpect(status().isNotFound());
    }
}
