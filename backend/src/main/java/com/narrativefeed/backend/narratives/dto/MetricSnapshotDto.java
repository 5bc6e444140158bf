package com.narrativefeed.backend.narratives.dto;

import com.narrativefeed.backend.narratives.entity.MetricPeriod;
import com.narrativefeed.backend.narratives.entity.NarrativeMetric;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetricSnapshotDto {
    private Long narrativeId;
    private String narrativeTitle;
    private MetricPeriod period;
    private Integer mentionCount;
    private Double velocity;
    private LocalDateTime calculatedAt;

    public static MetricSnapshotDto from(NarrativeMetric metric, String narrativeTitle) {
        return new MetricSnapshotDto(metric.getNarrative().getId(), narrativeTitle, metric.getPeriod(),
                metric.getMentionCount(), metric.getVelocity(), metric.getCalculatedAt());
    }
}
