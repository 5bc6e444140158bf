package com.narrativefeed.backend.narratives.entity;

import com.narrativefeed.backend.sentiment.Sentiment;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "narratives", indexes = {
        @Index(name = "idx_narratives_created_at", columnList = "createdAt"),
        @Index(name = "idx_narratives_title", columnList = "title")
})
public class Narrative {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String summary;

    // Recomputed from linked content whenever the link set changes
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private Sentiment sentiment = Sentiment.NEUTRAL;

    // Manual label; wins over the computed one while set
    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private Sentiment sentimentOverride;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    // Latest publishedAt among linked items
    private LocalDateTime lastContentAt;

    public Sentiment getEffectiveSentiment() {
        return sentimentOverride != null ? sentimentOverride : sentiment;
    }
}
