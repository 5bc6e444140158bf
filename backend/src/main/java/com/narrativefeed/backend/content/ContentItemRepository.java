package com.narrativefeed.backend.content;

import com.narrativefeed.backend.content.entity.ContentItem;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ContentItemRepository extends JpaRepository<ContentItem, String> {

    // Items inside a lookback window, newest first
    List<ContentItem> findByPublishedAtGreaterThanEqualOrderByPublishedAtDesc(LocalDateTime cutoff);

    List<ContentItem> findByIdIn(Collection<String> ids);

    @Query("SELECT c.publishedAt FROM ContentItem c WHERE c.id IN :ids")
    List<LocalDateTime> findPublishedAtByIdIn(@Param("ids") Collection<String> ids);

    @Query("SELECT MAX(c.publishedAt) FROM ContentItem c WHERE c.id IN :ids")
    LocalDateTime findLatestPublishedAt(@Param("ids") Collection<String> ids);

    Long countByPublishedAtGreaterThanEqual(LocalDateTime cutoff);
}
