package com.narrativefeed.backend.content.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.LocalDateTime;
import java.util.Objects;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.springframework.data.domain.Persistable;

/**
 * One article or post to analyze. Written once by ingestion and read-only afterwards,
 * so no setters are exposed. Saving a freshly built item always inserts; an existing row is never overwritten.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"body", "fresh"})
@Entity
@Table(name = "content_items", indexes = {
        @Index(name = "idx_content_items_published_at", columnList = "publishedAt")
})
public class ContentItem implements Persistable<String> {
    @Id
    @Column(length = 191)
    private String id;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    @Builder.Default
    private String body = "";

    // UTC wall-clock time; authoritative for window membership
    @Column(nullable = false)
    private LocalDateTime publishedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SourceKind sourceKind;

    @Column(columnDefinition = "TEXT")
    private String author;

    @Column(columnDefinition = "TEXT")
    private String sourceName;

    @Column(columnDefinition = "TEXT")
    private String url;

    @CreationTimestamp
    private LocalDateTime ingestedAt;

    @Transient
    @Builder.Default
    @Getter(AccessLevel.NONE)
    private boolean fresh = true;

    @Override
    @JsonIgnore
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        fresh = false;
    }

    /**
     * True when both items carry the same analyzable content, ignoring bookkeeping columns.
     */
    public boolean sameContentAs(ContentItem other) {
        return other != null
                && Objects.equals(id, other.id)
                && Objects.equals(title, other.title)
                && Objects.equals(body, other.body)
                && Objects.equals(publishedAt, other.publishedAt)
                && sourceKind == other.sourceKind
                && Objects.equals(author, other.author);
    }
}
