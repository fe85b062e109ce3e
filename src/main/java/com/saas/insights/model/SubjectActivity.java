package com.saas.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Engagement signals of one subject, as maintained by the product's event pipeline.
 * Dates are UTC days in ISO format.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Engagement signals used for churn scoring")
public class SubjectActivity {

    @Schema(description = "Subject (user) identifier", example = "user-1842")
    private String subjectId;

    @Schema(description = "Billing plan", example = "pro")
    @Builder.Default
    private String plan = "free";

    @Schema(description = "Activity count (logins, views, creations) keyed by week start date")
    @Builder.Default
    private Map<String, Long> weeklyActivity = new HashMap<>();

    @Schema(description = "Product event count keyed by day")
    @Builder.Default
    private Map<String, Long> dailyEventCounts = new HashMap<>();

    @Schema(description = "Sentiment of content the subject produced, -1 to 1")
    @Builder.Default
    private List<SentimentSample> sentimentSamples = new ArrayList<>();

    @Schema(description = "Support errors the subject ran into")
    @Builder.Default
    private List<SupportErrorEvent> supportErrors = new ArrayList<>();

    public boolean isPayingPlan() {
        return plan != null && !"free".equalsIgnoreCase(plan);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SentimentSample {
        private LocalDate day;
        private double score;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SupportErrorEvent {
        private String errorId;
        private LocalDate day;
    }
}
