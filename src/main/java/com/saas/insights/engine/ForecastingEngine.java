package com.saas.insights.engine;

import com.saas.insights.config.ForecastConfig;
import com.saas.insights.config.MetricsConfig;
import com.saas.insights.model.ConfidenceInterval;
import com.saas.insights.model.ForecastPeriod;
import com.saas.insights.model.ForecastResult;
import com.saas.insights.model.RevenueFactors;
import com.saas.insights.model.Subscription;
import com.saas.insights.model.Trend;
import com.saas.insights.model.UsageMetric;
import com.saas.insights.repository.MetricSampleProvider;
import com.saas.insights.repository.SubscriptionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Usage and revenue forecasts. Both are heuristics: the usage forecast fits a line through the
 * last few smoothed weeks, the revenue forecast compounds an assumed monthly growth rate.
 */
@Component
public class ForecastingEngine {

    private static final Logger log = LoggerFactory.getLogger(ForecastingEngine.class);

    private final MetricSampleProvider provider;
    private final SubscriptionSource subscriptionSource;
    private final ForecastConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ForecastingEngine(MetricSampleProvider provider, SubscriptionSource subscriptionSource,
                             ForecastConfig config, MetricsConfig metricsConfig, Clock clock) {
        this.provider = provider;
        this.subscriptionSource = subscriptionSource;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public record RegressionLine(double slope, double intercept) {
        public double at(double x) {
            return slope * x + intercept;
        }
    }

    /**
     * Ordinary least squares fit. Empty input gives (0, 0); when every x is equal the slope is 0
     * and the intercept is the mean of y.
     */
    public static RegressionLine linearRegression(List<Double> xs, List<Double> ys) {
        if (xs.size() != ys.size()) {
            throw new IllegalArgumentException("xs and ys differ in length: " + xs.size() + " vs " + ys.size());
        }
        int n = xs.size();
        if (n == 0) {
            return new RegressionLine(0.0, 0.0);
        }

        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        for (int i = 0; i < n; i++) {
            double x = xs.get(i);
            double y = ys.get(i);
            sumX += x;
            sumY += y;
            sumXY += x * y;
            sumXX += x * x;
        }

        double denominator = n * sumXX - sumX * sumX;
        if (denominator == 0.0) {
            return new RegressionLine(0.0, sumY / n);
        }
        double slope = (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;
        return new RegressionLine(slope, intercept);
    }

    /**
     * s0 = v0, si = alpha * vi + (1 - alpha) * s(i-1).
     */
    public static List<Double> exponentialSmoothing(List<Double> values, double alpha) {
        if (alpha <= 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("alpha must be in (0, 1], got " + alpha);
        }
        List<Double> smoothed = new ArrayList<>(values.size());
        if (values.isEmpty()) {
            return smoothed;
        }
        double previous = values.get(0);
        smoothed.add(previous);
        for (int i = 1; i < values.size(); i++) {
            previous = alpha * values.get(i) + (1.0 - alpha) * previous;
            smoothed.add(previous);
        }
        return smoothed;
    }

    public ForecastResult forecastUsage(UsageMetric metric, ForecastPeriod period) {
        List<Double> weekly = weeklyHistory(metric.getSampleMetric());
        List<Double> smoothed = exponentialSmoothing(weekly, config.getSmoothingAlpha());

        int span = Math.min(config.getRegressionWeeks(), smoothed.size());
        List<Double> recent = smoothed.subList(smoothed.size() - span, smoothed.size());
        double avgRecent = average(recent);
        double avgEarlier = average(smoothed.subList(0, span));
        double growthRate = avgEarlier > 0 ? (avgRecent - avgEarlier) / avgEarlier * 100.0 : 0.0;

        List<Double> xs = new ArrayList<>(span);
        for (int i = 0; i < span; i++) {
            xs.add((double) i);
        }
        RegressionLine line = linearRegression(xs, recent);
        // Usage cannot go negative, however steep the decline.
        double forecast = Math.max(0.0, line.at(span + period.getDays() / 7.0));

        ConfidenceInterval band = ConfidenceInterval.around(forecast, config.getUsageBandFraction());
        metricsConfig.recordForecast("usage", period.getKey());
        log.debug("Usage forecast {} {}: slope={}, intercept={}, growth={}%",
                metric.getKey(), period.getKey(), line.slope(), line.intercept(), growthRate);

        return ForecastResult.builder()
                .metric(metric.getKey())
                .period(period)
                .currentValue(weekly.isEmpty() ? 0.0 : weekly.get(weekly.size() - 1))
                .forecastedValue(Math.round(forecast))
                .confidenceInterval(new ConfidenceInterval(Math.round(band.lower()), Math.round(band.upper())))
                .trend(Trend.fromGrowth(growthRate, config.getUsageTrendBandPct()))
                .growthRate(round2(growthRate))
                .build();
    }

    /**
     * MRR of active subscriptions compounded at the configured monthly growth over the period.
     * The growth rate is an assumption, not derived from history.
     */
    public ForecastResult forecastRevenue(ForecastPeriod period) {
        List<Subscription> active = subscriptionSource.findActive();
        double currentMrr = active.stream()
                .mapToDouble(s -> config.priceOf(s.getPlan()))
                .sum();

        long since = clock.millis() - Duration.ofDays(30).toMillis();
        long canceled = subscriptionSource.countCanceledSince(since);
        double churnRate = active.isEmpty() ? 0.0 : (double) canceled / active.size() * 100.0;

        LocalDate today = LocalDate.now(clock);
        long newCustomers = Math.round(provider.getValue(config.getNewCustomerMetric(), today.minusDays(30), today));

        double monthlyGrowth = config.getMonthlyRevenueGrowth();
        double forecastedMrr = currentMrr * Math.pow(1.0 + monthlyGrowth, period.getDays() / 30.0);
        ConfidenceInterval band = ConfidenceInterval.around(forecastedMrr, config.getRevenueBandFraction());

        metricsConfig.recordForecast("revenue", period.getKey());

        return ForecastResult.builder()
                .metric("mrr")
                .period(period)
                .currentValue(currentMrr)
                .forecastedValue(Math.round(forecastedMrr))
                .confidenceInterval(new ConfidenceInterval(Math.round(band.lower()), Math.round(band.upper())))
                .trend(Trend.fromGrowth(monthlyGrowth, config.getRevenueTrendBand()))
                .growthRate(round2(monthlyGrowth * 100.0))
                .revenueFactors(RevenueFactors.builder()
                        .currentMrr(currentMrr)
                        .forecastedArr(Math.round(forecastedMrr * 12))
                        .newCustomers(newCustomers)
                        .churnRate(round2(churnRate))
                        .expansionRate(0.0)
                        .build())
                .build();
    }

    // Oldest week first; the last bucket ends today (exclusive).
    private List<Double> weeklyHistory(String sampleMetric) {
        int weeks = config.getHistoryWeeks();
        LocalDate start = LocalDate.now(clock).minusDays(7L * weeks);
        List<Double> values = new ArrayList<>(weeks);
        for (int i = 0; i < weeks; i++) {
            LocalDate weekStart = start.plusDays(7L * i);
            values.add(provider.getValue(sampleMetric, weekStart, weekStart.plusDays(7)));
        }
        return values;
    }

    private static double average(List<Double> values) {
        if (values.isEmpty()) return 0.0;
        return values.stream().mapToDouble(Double::doubleValue).sum() / values.size();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
