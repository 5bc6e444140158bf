package com.narrativefeed.backend.narratives.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "narrative")
@Entity
@Table(name = "narrative_links",
        uniqueConstraints = @UniqueConstraint(name = "uk_narrative_links_narrative_item", columnNames = {"narrative_id", "item_id"}),
        indexes = @Index(name = "idx_narrative_links_item_id", columnList = "item_id"))
public class NarrativeLink {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "narrative_id", nullable = false)
    private Narrative narrative;

    @Column(name = "item_id", nullable = false, length = 191)
    private String itemId;

    @Column(nullable = false)
    private LocalDateTime linkedAt;
}
