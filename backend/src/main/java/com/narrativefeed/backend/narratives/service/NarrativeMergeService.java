package com.narrativefeed.backend.narratives.service;

import com.narrativefeed.backend.common.exception.PersistenceConflictException;
import com.narrativefeed.backend.narratives.DetectionProperties;
import com.narrativefeed.backend.narratives.dto.MergeOutcome;
import com.narrativefeed.backend.narratives.dto.NarrativeCandidate;
import com.narrativefeed.backend.narratives.entity.Narrative;
import com.narrativefeed.backend.narratives.entity.NarrativeLink;
import com.narrativefeed.backend.narratives.repository.NarrativeLinkRepository;
import com.narrativefeed.backend.narratives.repository.NarrativeRepository;
import com.narrativefeed.backend.sentiment.Sentiment;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists detection candidates. A candidate extends the open narrative it shares the most items with,
 * falls back to an open narrative with the same title, and otherwise becomes a new narrative.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NarrativeMergeService {

    private final NarrativeRepository narrativeRepository;
    private final NarrativeLinkRepository linkRepository;
    private final DetectionProperties detectionProperties;
    private final Clock clock;

    /**
     * Merge one candidate in its own transaction
     */
    @Transactional
    public MergeOutcome merge(NarrativeCandidate candidate) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime openSince = now.minusDays(detectionProperties.getActiveDays());

        Optional<Narrative> existing = findTarget(candidate, openSince);
        boolean created = existing.isEmpty();
        Narrative narrative = existing.orElseGet(() -> narrativeRepository.save(Narrative.builder()
                .title(candidate.getTitle())
                .summary(candidate.getSummary())
                .sentiment(Sentiment.NEUTRAL)
                .createdAt(now)
                .updatedAt(now)
                .lastContentAt(candidate.getLatestPublishedAt())
                .build()));

        int linksAdded = 0;
        for (String itemId : candidate.getLinkedItemIds()) {
            if (addLink(narrative, itemId, now)) {
                linksAdded++;
            }
        }

        if (!created && linksAdded > 0) {
            narrative.setSummary(candidate.getSummary());
            narrative.setUpdatedAt(now);
            if (narrative.getLastContentAt() == null
                    || candidate.getLatestPublishedAt().isAfter(narrative.getLastContentAt())) {
                narrative.setLastContentAt(candidate.getLatestPublishedAt());
            }
            narrativeRepository.save(narrative);
        }

        if (created) {
            log.info("📰 Created narrative {} \"{}\" with {} items", narrative.getId(), narrative.getTitle(), linksAdded);
        } else if (linksAdded > 0) {
            log.info("🔗 Extended narrative {} \"{}\" with {} new items", narrative.getId(), narrative.getTitle(), linksAdded);
        } else {
            log.debug("Narrative {} already holds every item of \"{}\"", narrative.getId(), candidate.getTitle());
        }
        return new MergeOutcome(narrative.getId(), created, linksAdded);
    }

    private Optional<Narrative> findTarget(NarrativeCandidate candidate, LocalDateTime openSince) {
        // Overlap counts keyed by narrative id so ties resolve to the lowest id
        Map<Long, Integer> overlap = new TreeMap<>();
        Map<Long, Narrative> narratives = new TreeMap<>();
        for (NarrativeLink link : linkRepository.findByItemIdIn(candidate.getLinkedItemIds())) {
            Narrative narrative = link.getNarrative();
            if (narrative.getCreatedAt().isBefore(openSince)) {
                continue;
            }
            overlap.merge(narrative.getId(), 1, Integer::sum);
            narratives.putIfAbsent(narrative.getId(), narrative);
        }

        Long bestId = null;
        int bestCount = 0;
        for (Map.Entry<Long, Integer> entry : overlap.entrySet()) {
            if (entry.getValue() > bestCount) {
                bestId = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        if (bestId != null) {
            return Optional.of(narratives.get(bestId));
        }
        return narrativeRepository.findFirstByTitleAndCreatedAtGreaterThanEqualOrderByIdAsc(candidate.getTitle(), openSince);
    }

    private boolean addLink(Narrative narrative, String itemId, LocalDateTime now) {
        if (narrative.getId() != null && linkRepository.existsByNarrativeIdAndItemId(narrative.getId(), itemId)) {
            return false;
        }
        try {
            linkRepository.saveAndFlush(NarrativeLink.builder()
                    .narrative(narrative)
                    .itemId(itemId)
                    .linkedAt(now)
                    .build());
            return true;
        } catch (DataIntegrityViolationException e) {
            throw new PersistenceConflictException(
                    "Link between narrative " + narrative.getId() + " and item " + itemId + " conflicts with a concurrent write", e);
        }
    }
}
