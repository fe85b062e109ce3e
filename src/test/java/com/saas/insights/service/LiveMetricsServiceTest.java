package com.saas.insights.service;

import com.saas.insights.config.AlertingConfig;
import com.saas.insights.model.MetricKind;
import com.saas.insights.model.MetricsSnapshot;
import com.saas.insights.testutil.InMemoryMetricSampleProvider;
import com.saas.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LiveMetricsServiceTest {

    @Test
    void currentSnapshot_readsTodaysMappedSamples() {
        InMemoryMetricSampleProvider provider = new InMemoryMetricSampleProvider()
                .put("tokens_used", TestDataFactory.TODAY, 5_000.0)
                .put("tokens_used", TestDataFactory.TODAY.minusDays(1), 9_999.0)
                .put("support_errors", TestDataFactory.TODAY, 3.0);
        LiveMetricsService service = new LiveMetricsService(provider, new AlertingConfig(), TestDataFactory.fixedClock());

        MetricsSnapshot snapshot = service.currentSnapshot();

        assertThat(snapshot.valueOf(MetricKind.TOKEN_USAGE)).isEqualTo(5_000.0);
        assertThat(snapshot.valueOf(MetricKind.ERROR_RATE)).isEqualTo(3.0);
        assertThat(snapshot.valueOf(MetricKind.ACTIVE_USERS)).isZero();
        // Unmapped kinds read as zero.
        assertThat(snapshot.valueOf(MetricKind.CHURN_RISK)).isZero();
    }
}
