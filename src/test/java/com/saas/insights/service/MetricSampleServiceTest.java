package com.saas.insights.service;

import com.saas.insights.model.MetricSample;
import com.saas.insights.repository.MetricSampleRepository;
import com.saas.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetricSampleServiceTest {

    private static final LocalDate TODAY = TestDataFactory.TODAY;

    @Mock
    private MetricSampleRepository sampleRepository;

    private MetricSampleService service;

    @BeforeEach
    void setUp() {
        service = new MetricSampleService(sampleRepository, TestDataFactory.fixedClock());
    }

    @Test
    void record_overwrite_defaultsToToday() {
        MetricSample stored = service.record("mau", null, 42.0, false);

        assertThat(stored.getDay()).isEqualTo(TODAY);
        verify(sampleRepository).save(new MetricSample("mau", TODAY, 42.0));
    }

    @Test
    void record_increment_returnsAccumulatedValue() {
        when(sampleRepository.findOne("tokens_used", TODAY))
                .thenReturn(new MetricSample("tokens_used", TODAY, 1250.0));

        MetricSample stored = service.record("tokens_used", TODAY, 250.0, true);

        verify(sampleRepository).increment("tokens_used", TODAY, 250.0);
        assertThat(stored.getValue()).isEqualTo(1250.0);
    }

    @Test
    void record_rejectsSeparatorInName() {
        assertThatThrownBy(() -> service.record("mau|x", TODAY, 1.0, false))
                .isInstanceOf(IllegalArgumentException.class);
        verify(sampleRepository, never()).save(any());
    }

    @Test
    void record_rejectsNonFiniteValue() {
        assertThatThrownBy(() -> service.record("mau", TODAY, Double.NaN, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void list_defaultsToLastSevenDaysInclusive() {
        when(sampleRepository.findRange("mau", TODAY.minusDays(6), TODAY.plusDays(1))).thenReturn(List.of());

        assertThat(service.list("mau", null, null)).isEmpty();
        verify(sampleRepository).findRange("mau", TODAY.minusDays(6), TODAY.plusDays(1));
    }

    @Test
    void list_rejectsInvertedRange() {
        assertThatThrownBy(() -> service.list("mau", TODAY, TODAY.minusDays(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void list_rejectsOverlongRange() {
        assertThatThrownBy(() -> service.list("mau", TODAY.minusDays(400), TODAY))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
