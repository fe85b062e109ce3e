package com.saas.insights.service;

import com.saas.insights.config.AlertingConfig;
import com.saas.insights.model.AlertRule;
import com.saas.insights.model.AlertSeverity;
import com.saas.insights.model.ComparisonOperator;
import com.saas.insights.model.MetricKind;
import com.saas.insights.repository.AlertRuleRepository;
import com.saas.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertRuleServiceTest {

    @Mock
    private AlertRuleRepository ruleRepository;

    private AlertRuleService service;

    @BeforeEach
    void setUp() {
        service = new AlertRuleService(ruleRepository, new AlertingConfig(), TestDataFactory.fixedClock());
    }

    @Test
    void init_startsCacheRefresh() {
        service.init();

        verify(ruleRepository).startCacheRefresh(60);
    }

    @Test
    void createRule_assignsIdAndTimestamps() {
        AlertRule rule = AlertRule.builder()
                .name("High error rate")
                .metric(MetricKind.ERROR_RATE)
                .operator(ComparisonOperator.GT)
                .threshold(5.0)
                .build();

        AlertRule created = service.createRule(rule);

        assertThat(created.getRuleId()).isNotBlank();
        assertThat(created.getCreatedAt()).isEqualTo(TestDataFactory.NOW.toEpochMilli());
        assertThat(created.getUpdatedAt()).isEqualTo(created.getCreatedAt());
        verify(ruleRepository).save(created);
    }

    @Test
    void createRule_missingOperator_rejected() {
        AlertRule rule = AlertRule.builder().name("No operator").metric(MetricKind.CUSTOM).build();

        assertThatThrownBy(() -> service.createRule(rule))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("operator");
        verify(ruleRepository, never()).save(any());
    }

    @Test
    void createRule_blankName_rejected() {
        AlertRule rule = AlertRule.builder().name(" ").metric(MetricKind.CUSTOM)
                .operator(ComparisonOperator.EQ).build();

        assertThatThrownBy(() -> service.createRule(rule)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void updateRule_mergesNonNullFields() {
        AlertRule existing = TestDataFactory.createAlertRule("R1", MetricKind.ERROR_RATE, ComparisonOperator.GT, 5.0);
        when(ruleRepository.findById("R1")).thenReturn(existing);

        AlertRule patch = AlertRule.builder()
                .threshold(8.0)
                .severity(AlertSeverity.CRITICAL)
                .enabled(false)
                .build();

        AlertRule result = service.updateRule("R1", patch);

        assertThat(result.getName()).isEqualTo(existing.getName());
        assertThat(result.getOperator()).isEqualTo(ComparisonOperator.GT);
        assertThat(result.getThreshold()).isEqualTo(8.0);
        assertThat(result.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(result.isEnabled()).isFalse();
        assertThat(result.getUpdatedAt()).isEqualTo(TestDataFactory.NOW.toEpochMilli());
        verify(ruleRepository).save(existing);
    }

    @Test
    void updateRule_unknown_returnsNull() {
        when(ruleRepository.findById("MISSING")).thenReturn(null);

        assertThat(service.updateRule("MISSING", new AlertRule())).isNull();
        verify(ruleRepository, never()).save(any());
    }
}
