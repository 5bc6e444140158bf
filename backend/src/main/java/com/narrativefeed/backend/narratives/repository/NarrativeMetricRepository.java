package com.narrativefeed.backend.narratives.repository;

import com.narrativefeed.backend.narratives.entity.MetricPeriod;
import com.narrativefeed.backend.narratives.entity.NarrativeMetric;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface NarrativeMetricRepository extends JpaRepository<NarrativeMetric, Long> {

    // Latest snapshot per period
    Optional<NarrativeMetric> findFirstByNarrativeIdAndPeriodOrderByCalculatedAtDescIdDesc(Long narrativeId, MetricPeriod period);

    // Recent history for the detail view
    List<NarrativeMetric> findTop20ByNarrativeIdOrderByCalculatedAtDescIdDesc(Long narrativeId);

    // Trending: fastest growing first
    @Query("SELECT m FROM NarrativeMetric m JOIN FETCH m.narrative WHERE m.period = :period AND m.calculatedAt >= :since " +
            "ORDER BY m.velocity DESC, m.mentionCount DESC, m.calculatedAt DESC, m.id DESC")
    List<NarrativeMetric> findRecentByVelocity(@Param("period") MetricPeriod period, @Param("since") LocalDateTime since);

    // Most mentioned: highest volume first
    @Query("SELECT m FROM NarrativeMetric m JOIN FETCH m.narrative WHERE m.period = :period AND m.calculatedAt >= :since " +
            "ORDER BY m.mentionCount DESC, m.velocity DESC, m.calculatedAt DESC, m.id DESC")
    List<NarrativeMetric> findRecentByMentionCount(@Param("period") MetricPeriod period, @Param("since") LocalDateTime since);

    @Modifying
    @Query("DELETE FROM NarrativeMetric m WHERE m.calculatedAt < :cutoff")
    int deleteCalculatedBefore(@Param("cutoff") LocalDateTime cutoff);

    long countByNarrativeId(Long narrativeId);
}
