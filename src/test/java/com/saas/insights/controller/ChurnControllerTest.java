package com.saas.insights.controller;

import com.saas.insights.engine.ChurnRiskScorer;
import com.saas.insights.engine.SubjectNotFoundException;
import com.saas.insights.model.ChurnPrediction;
import com.saas.insights.model.RiskLevel;
import com.saas.insights.repository.DataUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChurnController.class)
class ChurnControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ChurnRiskScorer churnRiskScorer;

    private static ChurnPrediction prediction(String subjectId, double risk) {
        return ChurnPrediction.builder()
                .subjectId(subjectId)
                .riskScore(risk)
                .riskLevel(RiskLevel.fromScore(risk))
                .recommendations(List.of())
                .build();
    }

    @Test
    void predict_found() throws Exception {
        when(churnRiskScorer.predictChurn("user-1")).thenReturn(prediction("user-1", 72.5));

        mockMvc.perform(get("/api/v1/churn/user-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subjectId").value("user-1"))
                .andExpect(jsonPath("$.riskLevel").value("HIGH"));
    }

    @Test
    void predict_unknownSubject() throws Exception {
        when(churnRiskScorer.predictChurn("ghost")).thenThrow(new SubjectNotFoundException("ghost"));

        mockMvc.perform(get("/api/v1/churn/ghost"))
                .andExpect(status().isNotFound());
    }

    @Test
    void predict_storageUnavailable() throws Exception {
        when(churnRiskScorer.predictChurn("user-1"))
                .thenThrow(new DataUnavailableException("subject-activity", new IllegalStateException("timeout")));

        mockMvc.perform(get("/api/v1/churn/user-1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void rank_highestRiskFirst() throws Exception {
        when(churnRiskScorer.predictChurnForSubjects(2)).thenReturn(List.of(
                prediction("user-2", 90.0), prediction("user-1", 20.0)));

        mockMvc.perform(get("/api/v1/churn").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].subjectId").value("user-2"))
                .andExpect(jsonPath("$[1].riskLevel").value("LOW"));
    }

    @Test
    void rank_limitTooLarge() throws Exception {
        mockMvc.perform(get("/api/v1/churn").param("limit", "101"))
                .andExpect(status().isBadRequest());

        verify(churnRiskScorer, never()).predictChurnForSubjects(anyInt());
    }
}
