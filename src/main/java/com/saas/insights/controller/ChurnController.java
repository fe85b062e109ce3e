package com.saas.insights.controller;

import com.saas.insights.engine.ChurnRiskScorer;
import com.saas.insights.engine.SubjectNotFoundException;
import com.saas.insights.repository.DataUnavailableException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/churn")
@Tag(name = "Churn", description = "Churn risk scoring per subject")
public class ChurnController {

    private static final Logger log = LoggerFactory.getLogger(ChurnController.class);

    private static final int MAX_LIMIT = 100;

    private final ChurnRiskScorer churnRiskScorer;

    public ChurnController(ChurnRiskScorer churnRiskScorer) {
        this.churnRiskScorer = churnRiskScorer;
    }

    @Operation(summary = "Predict churn risk for a subject")
    @GetMapping("/{subjectId}")
    public ResponseEntity<?> predict(
            @Parameter(description = "Subject (user or account) ID", example = "user-1042")
            @PathVariable String subjectId) {
        try {
            return ResponseEntity.ok(churnRiskScorer.predictChurn(subjectId));
        } catch (SubjectNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (DataUnavailableException e) {
            log.warn("Churn prediction for {} unavailable: {}", subjectId, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "subject activity is temporarily unavailable"));
        }
    }

    @Operation(summary = "Rank subjects by churn risk", description = "Highest risk first.")
    @GetMapping
    public ResponseEntity<?> rank(
            @Parameter(description = "Maximum subjects to return (1-100)", example = "10")
            @RequestParam(defaultValue = "10") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be between 1 and " + MAX_LIMIT));
        }
        return ResponseEntity.ok(churnRiskScorer.predictChurnForSubjects(limit));
    }
}
