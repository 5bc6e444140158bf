package com.narrativefeed.backend.extraction;

import com.narrativefeed.backend.extraction.entity.EntityType;
import com.narrativefeed.backend.extraction.entity.ItemEntity;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ItemEntityRepository extends JpaRepository<ItemEntity, Long> {

    List<ItemEntity> findByItemIdOrderByTypeAscTextAsc(String itemId);

    List<ItemEntity> findByItemIdIn(Collection<String> itemIds);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ItemEntity e WHERE e.itemId = :itemId")
    int deleteAllForItem(@Param("itemId") String itemId);

    // Items mentioning an entity text, regardless of type
    @Query("SELECT DISTINCT e.itemId FROM ItemEntity e WHERE e.text = :text")
    List<String> findItemIdsByText(@Param("text") String text);

    // Most mentioned entity texts of one type, as [text, count] rows
    @Query("SELECT e.text, COUNT(e) FROM ItemEntity e WHERE e.type = :type GROUP BY e.text ORDER BY COUNT(e) DESC, e.text ASC")
    List<Object[]> countByTextForType(@Param("type") EntityType type, Pageable pageable);

    // Entity totals per type, as [type, count] rows
    @Query("SELECT e.type, COUNT(e) FROM ItemEntity e GROUP BY e.type")
    List<Object[]> countByType();
}
