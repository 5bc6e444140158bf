package com.narrativefeed.backend.narratives.dto;

import com.narrativefeed.backend.sentiment.Sentiment;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NarrativeDisplayDto {
    private Long id;
    private String title;
    private String summary;
    private Sentiment sentiment;
    private Sentiment computedSentiment;
    private Boolean sentimentOverridden;
    private Long itemCount;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime lastContentAt;
    private Map<String, MetricSnapshotDto> latestMetrics; // keyed by period code
    private List<LinkedItemDto> items; // detail view only
}
