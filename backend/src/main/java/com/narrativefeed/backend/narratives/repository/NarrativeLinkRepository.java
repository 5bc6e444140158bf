package com.narrativefeed.backend.narratives.repository;

import com.narrativefeed.backend.narratives.entity.NarrativeLink;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface NarrativeLinkRepository extends JpaRepository<NarrativeLink, Long> {

    boolean existsByNarrativeIdAndItemId(Long narrativeId, String itemId);

    // Links touching any of the given items, with their narrative loaded
    @Query("SELECT l FROM NarrativeLink l JOIN FETCH l.narrative WHERE l.itemId IN :itemIds")
    List<NarrativeLink> findByItemIdIn(@Param("itemIds") Collection<String> itemIds);

    @Query("SELECT l.itemId FROM NarrativeLink l WHERE l.narrative.id = :narrativeId ORDER BY l.itemId ASC")
    List<String> findItemIdsByNarrativeId(@Param("narrativeId") Long narrativeId);

    long countByNarrativeId(Long narrativeId);

    @Query("SELECT l.narrative.id, COUNT(l) FROM NarrativeLink l WHERE l.narrative.id IN :narrativeIds GROUP BY l.narrative.id")
    List<Object[]> countByNarrativeIds(@Param("narrativeIds") Collection<Long> narrativeIds);
}
