package com.saas.insights.engine;

import com.saas.insights.config.ChurnConfig;
import com.saas.insights.config.MetricsConfig;
import com.saas.insights.model.ChurnFactors;
import com.saas.insights.model.ChurnPrediction;
import com.saas.insights.model.RiskLevel;
import com.saas.insights.model.SubjectActivity;
import com.saas.insights.model.SubjectActivity.SentimentSample;
import com.saas.insights.model.SubjectActivity.SupportErrorEvent;
import com.saas.insights.repository.SubjectActivitySource;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Scores churn risk from five capped factors:
 * <ul>
 *   <li>activity drop (0-30): recent 30-day activity against the 30 days before</li>
 *   <li>payment issues (0-25): flat score for paying plans</li>
 *   <li>feature usage (0-20): fewer events in the last 30 days scores higher</li>
 *   <li>sentiment trend (0-15): negative average sentiment scores higher, 7.5 when unknown</li>
 *   <li>error frequency (0-10): 2 per distinct support error in the last 30 days</li>
 * </ul>
 */
@Component
public class ChurnRiskScorer {

    private static final Logger log = LoggerFactory.getLogger(ChurnRiskScorer.class);

    static final String RECOMMEND_REENGAGE = "Activity has dropped significantly - send a re-engagement campaign";
    static final String RECOMMEND_ONBOARDING = "Key features are unused - offer onboarding support";
    static final String RECOMMEND_FEEDBACK = "Recent sentiment is negative - review the subject's feedback";
    static final String RECOMMEND_SUPPORT = "Frequent errors - reach out with proactive support";
    static final String RECOMMEND_RETENTION = "High churn risk - consider a discount or upgrade incentive";

    private static final double NEUTRAL_SENTIMENT_SCORE = 7.5;

    private final SubjectActivitySource activitySource;
    private final ChurnConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ChurnRiskScorer(SubjectActivitySource activitySource, ChurnConfig config,
                           MetricsConfig metricsConfig, Clock clock) {
        this.activitySource = activitySource;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * @throws SubjectNotFoundException when no activity record exists for the subject
     * @throws com.saas.insights.repository.DataUnavailableException when activity storage cannot be read
     */
    public ChurnPrediction predictChurn(String subjectId) {
        SubjectActivity activity = activitySource.findBySubjectId(subjectId)
                .orElseThrow(() -> new SubjectNotFoundException(subjectId));
        return score(activity);
    }

    /**
     * Score up to {@code 2 * limit} known subjects and return the {@code limit} riskiest.
     * A subject that fails to score is logged and skipped.
     */
    @Observed(name = "churn.rank", contextualName = "rank-churn-risk")
    public List<ChurnPrediction> predictChurnForSubjects(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<ChurnPrediction> predictions = new ArrayList<>();
        for (String subjectId : activitySource.listSubjectIds(limit * 2)) {
            try {
                predictions.add(predictChurn(subjectId));
            } catch (Exception e) {
                log.warn("Skipping churn score for subject {}: {}", subjectId, e.getMessage());
            }
        }
        return predictions.stream()
                .sorted(Comparator.comparingDouble(ChurnPrediction::getRiskScore).reversed())
                .limit(limit)
                .toList();
    }

    ChurnPrediction score(SubjectActivity activity) {
        LocalDate today = LocalDate.now(clock);
        LocalDate windowStart = today.minusDays(config.getActivityWindowDays());
        LocalDate previousStart = windowStart.minusDays(config.getActivityWindowDays());

        ChurnFactors factors = ChurnFactors.builder()
                .activityDrop(activityDrop(activity.getWeeklyActivity(), windowStart, previousStart))
                .paymentIssues(activity.isPayingPlan() ? clamp(config.getPaidPlanPaymentScore(), 25) : 0.0)
                .featureUsage(featureUsage(activity.getDailyEventCounts(), windowStart))
                .sentimentTrend(sentimentTrend(activity.getSentimentSamples(), windowStart))
                .errorFrequency(errorFrequency(activity.getSupportErrors(), windowStart))
                .build();

        double riskScore = Math.round(Math.min(100.0, factors.total()) * 100.0) / 100.0;

        Instant now = clock.instant();
        Instant predictedChurnDate = null;
        if (riskScore > config.getChurnDateThreshold()) {
            long millisUntilChurn = Math.round((100.0 - riskScore) * Duration.ofDays(1).toMillis());
            predictedChurnDate = now.plusMillis(millisUntilChurn);
        }

        metricsConfig.recordChurnScore(riskScore);

        return ChurnPrediction.builder()
                .subjectId(activity.getSubjectId())
                .riskScore(riskScore)
                .riskLevel(RiskLevel.fromScore(riskScore))
                .factors(factors)
                .predictedChurnDate(predictedChurnDate)
                .recommendations(recommend(factors, riskScore))
                .computedAt(now.toEpochMilli())
                .build();
    }

    private double activityDrop(Map<String, Long> weeklyActivity, LocalDate windowStart, LocalDate previousStart) {
        long recent = 0;
        long previous = 0;
        for (Map.Entry<String, Long> week : weeklyActivity.entrySet()) {
            LocalDate weekStart = parseDay(week.getKey());
            if (weekStart == null || week.getValue() == null) continue;
            if (!weekStart.isBefore(windowStart)) {
                recent += week.getValue();
            } else if (!weekStart.isBefore(previousStart)) {
                previous += week.getValue();
            }
        }
        if (previous <= 0) {
            return 0.0;
        }
        return clamp((double) (previous - recent) / previous * 30.0, 30);
    }

    private double featureUsage(Map<String, Long> dailyEventCounts, LocalDate windowStart) {
        long events = 0;
        for (Map.Entry<String, Long> day : dailyEventCounts.entrySet()) {
            LocalDate date = parseDay(day.getKey());
            if (date != null && day.getValue() != null && !date.isBefore(windowStart)) {
                events += day.getValue();
            }
        }
        return clamp(20.0 - events / 10.0, 20);
    }

    private double sentimentTrend(List<SentimentSample> samples, LocalDate windowStart) {
        OptionalDouble average = samples.stream()
                .filter(Objects::nonNull)
                .filter(s -> s.getDay() != null && !s.getDay().isBefore(windowStart))
                .mapToDouble(SentimentSample::getScore)
                .average();
        if (average.isEmpty()) {
            return NEUTRAL_SENTIMENT_SCORE;
        }
        return clamp((1.0 - average.getAsDouble()) / 2.0 * 15.0, 15);
    }

    private double errorFrequency(List<SupportErrorEvent> errors, LocalDate windowStart) {
        long distinct = errors.stream()
                .filter(Objects::nonNull)
                .filter(e -> e.getDay() != null && !e.getDay().isBefore(windowStart))
                .map(SupportErrorEvent::getErrorId)
                .distinct()
                .count();
        return Math.min(10.0, 2.0 * distinct);
    }

    private List<String> recommend(ChurnFactors factors, double riskScore) {
        List<String> recommendations = new ArrayList<>();
        if (factors.getActivityDrop() > config.getActivityDropRecommendation()) {
            recommendations.add(RECOMMEND_REENGAGE);
        }
        if (factors.getFeatureUsage() > config.getFeatureUsageRecommendation()) {
            recommendations.add(RECOMMEND_ONBOARDING);
        }
        if (factors.getSentimentTrend() > config.getSentimentRecommendation()) {
            recommendations.add(RECOMMEND_FEEDBACK);
        }
        if (factors.getErrorFrequency() > config.getErrorFrequencyRecommendation()) {
            recommendations.add(RECOMMEND_SUPPORT);
        }
        if (riskScore > config.getRetentionOfferRecommendation()) {
            recommendations.add(RECOMMEND_RETENTION);
        }
        return recommendations;
    }

    private static LocalDate parseDay(String isoDay) {
        try {
            return LocalDate.parse(isoDay);
        } catch (DateTimeParseException | NullPointerException e) {
            log.debug("Ignoring unparseable day key '{}'", isoDay);
            return null;
        }
    }

    private static double clamp(double value, double max) {
        return Math.max(0.0, Math.min(max, value));
    }
}
