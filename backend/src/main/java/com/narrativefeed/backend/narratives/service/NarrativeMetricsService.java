package com.narrativefeed.backend.narratives.service;

import com.narrativefeed.backend.common.exception.ConfigurationException;
import com.narrativefeed.backend.common.exception.NarrativeNotFoundException;
import com.narrativefeed.backend.content.ContentItemRepository;
import com.narrativefeed.backend.narratives.DetectionProperties;
import com.narrativefeed.backend.narratives.MetricsProperties;
import com.narrativefeed.backend.narratives.dto.MetricResult;
import com.narrativefeed.backend.narratives.dto.MetricSnapshotDto;
import com.narrativefeed.backend.narratives.dto.MetricsUpdateResult;
import com.narrativefeed.backend.narratives.entity.MetricPeriod;
import com.narrativefeed.backend.narratives.entity.Narrative;
import com.narrativefeed.backend.narratives.entity.NarrativeMetric;
import com.narrativefeed.backend.narratives.repository.NarrativeLinkRepository;
import com.narrativefeed.backend.narratives.repository.NarrativeMetricRepository;
import com.narrativefeed.backend.narratives.repository.NarrativeRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class NarrativeMetricsService {

    private final MetricsCalculator metricsCalculator;
    private final NarrativeRepository narrativeRepository;
    private final NarrativeLinkRepository linkRepository;
    private final NarrativeMetricRepository metricRepository;
    private final ContentItemRepository contentItemRepository;
    private final MetricsProperties metricsProperties;
    private final DetectionProperties detectionProperties;
    private final Clock clock;

    public MetricResult calculate(Long narrativeId, MetricPeriod period) {
        return metricsCalculator.calculate(narrativeId, period, this::publishedTimesOf);
    }

    /**
     * Calculate and append one snapshot row
     */
    public NarrativeMetric calculateAndStore(Long narrativeId, MetricPeriod period) {
        Narrative narrative = narrativeRepository.findById(narrativeId)
                .orElseThrow(() -> new NarrativeNotFoundException(narrativeId));
        MetricResult result = calculate(narrativeId, period);
        NarrativeMetric metric = metricRepository.save(NarrativeMetric.builder()
                .narrative(narrative)
                .period(period)
                .mentionCount(result.getMentionCount())
                .velocity(result.getVelocity())
                .calculatedAt(LocalDateTime.now(clock))
                .build());
        log.debug("Narrative {} {}: {} mentions, velocity {}", narrativeId, period.getCode(),
                result.getMentionCount(), result.getVelocity());
        return metric;
    }

    /**
     * One row per distinct (narrative, period). A failing narrative is reported and the rest continue.
     */
    public MetricsUpdateResult updateAll(Collection<Long> narrativeIds, Collection<MetricPeriod> periods) {
        if (periods == null || periods.isEmpty()) {
            throw new ConfigurationException("At least one metric period is required");
        }
        periods.forEach(metricsProperties::lengthOf);

        Set<Long> uniqueIds = new LinkedHashSet<>(narrativeIds);
        Set<MetricPeriod> uniquePeriods = new LinkedHashSet<>(periods);
        MetricsUpdateResult result = new MetricsUpdateResult();
        log.info("📊 Calculating metrics for {} narratives over {} periods", uniqueIds.size(), uniquePeriods.size());

        for (Long narrativeId : uniqueIds) {
            for (MetricPeriod period : uniquePeriods) {
                try {
                    calculateAndStore(narrativeId, period);
                    result.setCalculated(result.getCalculated() + 1);
                    result.setStored(result.getStored() + 1);
                } catch (Exception e) {
                    log.error("❌ Metrics failed for narrative {} ({}): {}", narrativeId, period.getCode(), e.getMessage());
                    result.recordFailure(narrativeId + ":" + period.getCode(), e.getMessage());
                }
            }
        }

        log.info("✅ Metrics stored: {}, failures: {}", result.getStored(), result.getFailures().size());
        return result;
    }

    /**
     * Every narrative still open for extension, both periods
     */
    public MetricsUpdateResult updateAllActive() {
        return updateAllActive(List.of(MetricPeriod.values()));
    }

    public MetricsUpdateResult updateAllActive(Collection<MetricPeriod> periods) {
        LocalDateTime openSince = LocalDateTime.now(clock).minusDays(detectionProperties.getActiveDays());
        return updateAll(narrativeRepository.findIdsCreatedSince(openSince), periods);
    }

    @Transactional(readOnly = true)
    public Map<String, MetricSnapshotDto> getLatestMetrics(Long narrativeId) {
        Narrative narrative = narrativeRepository.findById(narrativeId)
                .orElseThrow(() -> new NarrativeNotFoundException(narrativeId));
        Map<String, MetricSnapshotDto> latest = new LinkedHashMap<>();
        for (MetricPeriod period : MetricPeriod.values()) {
            metricRepository.findFirstByNarrativeIdAndPeriodOrderByCalculatedAtDescIdDesc(narrativeId, period)
                    .ifPresent(metric -> latest.put(period.getCode(), MetricSnapshotDto.from(metric, narrative.getTitle())));
        }
        return latest;
    }

    @Transactional(readOnly = true)
    public List<MetricSnapshotDto> getHistory(Long narrativeId) {
        Narrative narrative = narrativeRepository.findById(narrativeId)
                .orElseThrow(() -> new NarrativeNotFoundException(narrativeId));
        return metricRepository.findTop20ByNarrativeIdOrderByCalculatedAtDescIdDesc(narrativeId).stream()
                .map(metric -> MetricSnapshotDto.from(metric, narrative.getTitle()))
                .toList();
    }

    /**
     * Fastest-growing narratives among recently calculated metrics, one entry per narrative
     */
    @Transactional(readOnly = true)
    public List<MetricSnapshotDto> getTrending(MetricPeriod period, int limit) {
        ConfigurationException.requirePositive("limit", limit);
        LocalDateTime since = LocalDateTime.now(clock).minus(metricsProperties.getTrendingLookback());
        return firstPerNarrative(metricRepository.findRecentByVelocity(period, since), limit);
    }

    @Transactional(readOnly = true)
    public List<MetricSnapshotDto> getMostMentioned(MetricPeriod period, int limit) {
        ConfigurationException.requirePositive("limit", limit);
        LocalDateTime since = LocalDateTime.now(clock).minus(metricsProperties.getTrendingLookback());
        return firstPerNarrative(metricRepository.findRecentByMentionCount(period, since), limit);
    }

    /**
     * Delete snapshots calculated more than {@code daysOld} days ago
     */
    @Transactional
    public int cleanupOldMetrics(int daysOld) {
        ConfigurationException.requirePositive("daysOld", daysOld);
        int deleted = metricRepository.deleteCalculatedBefore(LocalDateTime.now(clock).minusDays(daysOld));
        log.info("🧹 Deleted {} metric snapshots older than {} days", deleted, daysOld);
        return deleted;
    }

    private List<LocalDateTime> publishedTimesOf(Long narrativeId) {
        List<String> itemIds = linkRepository.findItemIdsByNarrativeId(narrativeId);
        return itemIds.isEmpty() ? List.of() : contentItemRepository.findPublishedAtByIdIn(itemIds);
    }

    private static List<MetricSnapshotDto> firstPerNarrative(List<NarrativeMetric> ordered, int limit) {
        Set<Long> seen = new LinkedHashSet<>();
        List<MetricSnapshotDto> result = new ArrayList<>();
        for (NarrativeMetric metric : ordered) {
            if (result.size() >= limit) {
                break;
            }
            if (seen.add(metric.getNarrative().getId())) {
                result.add(MetricSnapshotDto.from(metric, metric.getNarrative().getTitle()));
            }
        }
        return result;
    }
}
