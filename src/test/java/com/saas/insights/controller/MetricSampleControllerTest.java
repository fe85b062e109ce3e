package com.saas.insights.controller;

import com.saas.insights.model.MetricSample;
import com.saas.insights.service.MetricSampleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MetricSampleController.class)
class MetricSampleControllerTest {

    private static final LocalDate DAY = LocalDate.of(2026, 10, 16);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MetricSampleService sampleService;

    @Test
    void list_withRange() throws Exception {
        when(sampleService.list("mau", DAY, DAY.plusDays(1))).thenReturn(List.of(
                MetricSample.builder().metric("mau").day(DAY).value(120.0).build()));

        mockMvc.perform(get("/api/v1/metrics/mau/samples")
                        .param("from", "2026-10-16")
                        .param("to", "2026-10-17"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].day").value("2026-10-16"))
                .andExpect(jsonPath("$[0].value").value(120.0));
    }

    @Test
    void list_invalidRange() throws Exception {
        when(sampleService.list(eq("mau"), any(), any()))
                .thenThrow(new IllegalArgumentException("from must not be after to"));

        mockMvc.perform(get("/api/v1/metrics/mau/samples")
                        .param("from", "2026-10-17")
                        .param("to", "2026-10-16"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("from must not be after to"));
    }

    @Test
    void record_incrementWithoutDay() throws Exception {
        when(sampleService.record(eq("tokens_used"), isNull(), eq(250.0), eq(true)))
                .thenReturn(MetricSample.builder().metric("tokens_used").day(DAY).value(1250.0).build());

        mockMvc.perform(post("/api/v1/metrics/tokens_used/samples")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":250,\"increment\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value(1250.0));
    }

    @Test
    void record_missingValue() throws Exception {
        mockMvc.perform(post("/api/v1/metrics/mau/samples")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"day\":\"2026-10-16\"}"))
                .andExpect(status().isBadRequest());

        verify(sampleService, never()).record(anyString(), any(), anyDouble(), anyBoolean());
    }

    @Test
    void record_invalidMetricName() throws Exception {
        when(sampleService.record(eq("BAD"), any(), anyDouble(), anyBoolean()))
                .thenThrow(new IllegalArgumentException("invalid metric name"));

        mockMvc.perform(post("/api/v1/metrics/BAD/samples")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":1}"))
                .andExpect(status().isBadRequest());
    }
}
