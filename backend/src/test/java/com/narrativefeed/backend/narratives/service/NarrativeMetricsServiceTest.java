package com.narrativefeed.backend.narratives.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.narrativefeed.backend.common.dto.BatchFailure;
import com.narrativefeed.backend.common.exception.ConfigurationException;
import com.narrativefeed.backend.content.ContentItemRepository;
import com.narrativefeed.backend.narratives.DetectionProperties;
import com.narrativefeed.backend.narratives.MetricsProperties;
import com.narrativefeed.backend.narratives.dto.MetricsUpdateResult;
import com.narrativefeed.backend.narratives.entity.MetricPeriod;
import com.narrativefeed.backend.narratives.entity.Narrative;
import com.narrativefeed.backend.narratives.entity.NarrativeMetric;
import com.narrativefeed.backend.narratives.repository.NarrativeLinkRepository;
import com.narrativefeed.backend.narratives.repository.NarrativeMetricRepository;
import com.narrativefeed.backend.narratives.repository.NarrativeRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class NarrativeMetricsServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    private static final LocalDateTime NOW_UTC = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    NarrativeRepository narrativeRepository;

    @Mock
    NarrativeLinkRepository linkRepository;

    @Mock
    NarrativeMetricRepository metricRepository;

    @Mock
    ContentItemRepository contentItemRepository;

    NarrativeMetricsService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        MetricsProperties metricsProperties = new MetricsProperties();
        service = new NarrativeMetricsService(new MetricsCalculator(clock, metricsProperties),
                narrativeRepository, linkRepository, metricRepository, contentItemRepository,
                metricsProperties, new DetectionProperties(), clock);
    }

    private static Narrative narrative(long id) {
        return Narrative.builder().id(id).title("Narrative " + id).build();
    }

    @Test
    @DisplayName("a missing or failing narrative is reported and the others are still stored")
    void failuresAreCollected() {
        when(narrativeRepository.findById(1L)).thenReturn(Optional.of(narrative(1L)));
        when(narrativeRepository.findById(2L)).thenReturn(Optional.empty());
        when(narrativeRepository.findById(3L)).thenReturn(Optional.of(narrative(3L)));
        when(linkRepository.findItemIdsByNarrativeId(1L)).thenReturn(List.of("a", "b"));
        when(contentItemRepository.findPublishedAtByIdIn(List.of("a", "b")))
                .thenReturn(List.of(NOW_UTC.minusHours(1), NOW_UTC.minusHours(30)));
        when(metricRepository.save(any(NarrativeMetric.class))).thenAnswer(inv -> {
            NarrativeMetric metric = inv.getArgument(0);
            if (metric.getNarrative().getId() == 3L) {
                throw new DataAccessResourceFailureException("connection reset");
            }
            return metric;
        });

        MetricsUpdateResult result = service.updateAll(List.of(1L, 2L, 1L, 3L),
                List.of(MetricPeriod.LONG, MetricPeriod.SHORT));

        assertThat(result.getCalculated()).isEqualTo(2);
        assertThat(result.getStored()).isEqualTo(2);
        assertThat(result.getFailures()).extracting(BatchFailure::getId)
                .containsExactly("2:24h", "2:1h", "3:24h", "3:1h");
        assertThat(result.getFailures().get(0).getReason()).contains("2");
        assertThat(result.getFailures().get(2).getReason()).contains("connection reset");

        ArgumentCaptor<NarrativeMetric> saved = ArgumentCaptor.forClass(NarrativeMetric.class);
        verify(metricRepository, atLeastOnce()).save(saved.capture());
        assertThat(saved.getAllValues())
                .filteredOn(metric -> metric.getNarrative().getId() == 1L)
                .extracting(NarrativeMetric::getPeriod, NarrativeMetric::getMentionCount, NarrativeMetric::getCalculatedAt)
                .containsExactly(
                        tuple(MetricPeriod.LONG, 1, NOW_UTC),
                        tuple(MetricPeriod.SHORT, 1, NOW_UTC));
    }

    @Test
    @DisplayName("no periods is a configuration error before any work")
    void periodsRequired() {
        assertThatThrownBy(() -> service.updateAll(List.of(1L), List.of()))
                .isInstanceOf(ConfigurationException.class);
        verify(metricRepository, never()).save(any());
    }
}
