package com.narrativefeed.backend.narratives.repository;

import com.narrativefeed.backend.narratives.entity.Narrative;
import com.narrativefeed.backend.sentiment.Sentiment;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface NarrativeRepository extends JpaRepository<Narrative, Long> {

    // Narratives still open for extension
    List<Narrative> findByCreatedAtGreaterThanEqualOrderByIdAsc(LocalDateTime since);

    // Exact-title fallback when no open narrative shares items
    Optional<Narrative> findFirstByTitleAndCreatedAtGreaterThanEqualOrderByIdAsc(String title, LocalDateTime since);

    @Query("SELECT n.id FROM Narrative n WHERE n.createdAt >= :since ORDER BY n.id ASC")
    List<Long> findIdsCreatedSince(@Param("since") LocalDateTime since);

    @Query("SELECT n.id FROM Narrative n ORDER BY n.id ASC")
    List<Long> findAllIds();

    // Filter on the effective label: override first, computed otherwise
    @Query("SELECT n FROM Narrative n WHERE n.sentimentOverride = :sentiment " +
            "OR (n.sentimentOverride IS NULL AND n.sentiment = :sentiment)")
    Page<Narrative> findByEffectiveSentiment(@Param("sentiment") Sentiment sentiment, Pageable pageable);

    List<Narrative> findByCreatedAtGreaterThanEqual(LocalDateTime since);

    long countByCreatedAtGreaterThanEqual(LocalDateTime since);
}
