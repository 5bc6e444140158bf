package com.narrativefeed.backend.narratives.service;

import com.narrativefeed.backend.common.exception.ConfigurationException;
import com.narrativefeed.backend.common.exception.NarrativeNotFoundException;
import com.narrativefeed.backend.content.ContentItemRepository;
import com.narrativefeed.backend.content.entity.ContentItem;
import com.narrativefeed.backend.narratives.dto.LinkedItemDto;
import com.narrativefeed.backend.narratives.dto.MetricSnapshotDto;
import com.narrativefeed.backend.narratives.dto.NarrativeDisplayDto;
import com.narrativefeed.backend.narratives.entity.MetricPeriod;
import com.narrativefeed.backend.narratives.entity.Narrative;
import com.narrativefeed.backend.narratives.repository.NarrativeLinkRepository;
import com.narrativefeed.backend.narratives.repository.NarrativeRepository;
import com.narrativefeed.backend.sentiment.Sentiment;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side for feed consumers: narrative pages, details and summary counts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class NarrativeQueryService {

    public static final String SORT_RECENT = "recent";
    public static final String SORT_VELOCITY = "velocity";

    private final NarrativeRepository narrativeRepository;
    private final NarrativeLinkRepository linkRepository;
    private final ContentItemRepository contentItemRepository;
    private final NarrativeMetricsService metricsService;
    private final Clock clock;

    public Map<String, Object> list(int page, int size, Sentiment sentiment, String sort) {
        if (page < 0) {
            throw new ConfigurationException("page must not be negative, got " + page);
        }
        ConfigurationException.requirePositive("size", size);
        String sortKey = sort == null ? SORT_RECENT : sort.toLowerCase();
        if (!SORT_RECENT.equals(sortKey) && !SORT_VELOCITY.equals(sortKey)) {
            throw new ConfigurationException("sort must be 'recent' or 'velocity', got " + sort);
        }

        List<NarrativeDisplayDto> narratives;
        long totalElements;
        if (SORT_RECENT.equals(sortKey)) {
            Pageable pageable = PageRequest.of(page, size, Sort.by(Sort.Order.desc("updatedAt"), Sort.Order.desc("id")));
            Page<Narrative> narrativePage = sentiment == null
                    ? narrativeRepository.findAll(pageable)
                    : narrativeRepository.findByEffectiveSentiment(sentiment, pageable);
            narratives = toDisplay(narrativePage.getContent());
            totalElements = narrativePage.getTotalElements();
        } else {
            // Velocity lives in the metric snapshots, so this ordering is done in memory
            Pageable all = PageRequest.of(0, Integer.MAX_VALUE, Sort.by("id"));
            List<Narrative> filtered = sentiment == null
                    ? narrativeRepository.findAll(Sort.by("id"))
                    : narrativeRepository.findByEffectiveSentiment(sentiment, all).getContent();
            List<NarrativeDisplayDto> sorted = toDisplay(filtered).stream()
                    .sorted(Comparator.comparingDouble(NarrativeQueryService::longVelocity).reversed()
                            .thenComparing(NarrativeDisplayDto::getId))
                    .toList();
            totalElements = sorted.size();
            narratives = sorted.stream().skip((long) page * size).limit(size).toList();
        }

        return Map.of(
                "narratives", narratives,
                "currentPage", page,
                "totalPages", (totalElements + size - 1) / size,
                "totalElements", totalElements,
                "pageSize", size
        );
    }

    public NarrativeDisplayDto get(Long narrativeId) {
        Narrative narrative = narrativeRepository.findById(narrativeId)
                .orElseThrow(() -> new NarrativeNotFoundException(narrativeId));
        List<String> itemIds = linkRepository.findItemIdsByNarrativeId(narrativeId);
        List<LinkedItemDto> items = itemIds.isEmpty() ? List.of() : contentItemRepository.findByIdIn(itemIds).stream()
                .sorted(Comparator.comparing(ContentItem::getPublishedAt).reversed().thenComparing(ContentItem::getId))
                .map(NarrativeQueryService::toLinkedItem)
                .toList();

        NarrativeDisplayDto dto = toDisplay(narrative, (long) itemIds.size());
        dto.setItems(items);
        return dto;
    }

    public Map<String, Object> stats() {
        LocalDateTime now = LocalDateTime.now(clock);
        Map<String, Long> bySentiment = new LinkedHashMap<>();
        for (Sentiment sentiment : Sentiment.values()) {
            bySentiment.put(sentiment.getCode(),
                    narrativeRepository.findByEffectiveSentiment(sentiment, PageRequest.of(0, 1)).getTotalElements());
        }
        return Map.of(
                "totalNarratives", narrativeRepository.count(),
                "createdLast24Hours", narrativeRepository.countByCreatedAtGreaterThanEqual(now.minusHours(24)),
                "createdLast7Days", narrativeRepository.countByCreatedAtGreaterThanEqual(now.minusDays(7)),
                "totalLinks", linkRepository.count(),
                "bySentiment", bySentiment
        );
    }

    private List<NarrativeDisplayDto> toDisplay(List<Narrative> narratives) {
        if (narratives.isEmpty()) {
            return List.of();
        }
        Map<Long, Long> counts = new HashMap<>();
        for (Object[] row : linkRepository.countByNarrativeIds(narratives.stream().map(Narrative::getId).toList())) {
            counts.put((Long) row[0], ((Number) row[1]).longValue());
        }
        return narratives.stream()
                .map(narrative -> toDisplay(narrative, counts.getOrDefault(narrative.getId(), 0L)))
                .toList();
    }

    private NarrativeDisplayDto toDisplay(Narrative narrative, Long itemCount) {
        return NarrativeDisplayDto.builder()
                .id(narrative.getId())
                .title(narrative.getTitle())
                .summary(narrative.getSummary())
                .sentiment(narrative.getEffectiveSentiment())
                .computedSentiment(narrative.getSentiment())
                .sentimentOverridden(narrative.getSentimentOverride() != null)
                .itemCount(itemCount)
                .createdAt(narrative.getCreatedAt())
                .updatedAt(narrative.getUpdatedAt())
                .lastContentAt(narrative.getLastContentAt())
                .latestMetrics(metricsService.getLatestMetrics(narrative.getId()))
                .build();
    }

    private static double longVelocity(NarrativeDisplayDto dto) {
        MetricSnapshotDto metric = dto.getLatestMetrics().get(MetricPeriod.LONG.getCode());
        return metric != null ? metric.getVelocity() : Double.NEGATIVE_INFINITY;
    }

    private static LinkedItemDto toLinkedItem(ContentItem item) {
        return new LinkedItemDto(item.getId(), item.getTitle(), item.getSourceKind().getCode(),
                item.getSourceName(), item.getAuthor(), item.getUrl(), item.getPublishedAt());
    }
}
