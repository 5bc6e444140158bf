package com.narrativefeed.backend.narratives.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Append-only snapshot of one narrative's activity over one period.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "narrative")
@Entity
@Table(name = "narrative_metrics", indexes = {
        @Index(name = "idx_narrative_metrics_narrative_period", columnList = "narrative_id, period, calculatedAt"),
        @Index(name = "idx_narrative_metrics_calculated_at", columnList = "calculatedAt")
})
public class NarrativeMetric {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "narrative_id", nullable = false)
    private Narrative narrative;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private MetricPeriod period;

    @Column(nullable = false)
    private Integer mentionCount;

    // Percent change against the previous equal-length window
    @Column(nullable = false)
    private Double velocity;

    @Column(nullable = false)
    private LocalDateTime calculatedAt;
}
