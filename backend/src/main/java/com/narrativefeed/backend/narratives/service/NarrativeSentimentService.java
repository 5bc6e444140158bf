package com.narrativefeed.backend.narratives.service;

import com.narrativefeed.backend.common.dto.BatchResult;
import com.narrativefeed.backend.common.exception.ConfigurationException;
import com.narrativefeed.backend.common.exception.NarrativeNotFoundException;
import com.narrativefeed.backend.content.ContentItemRepository;
import com.narrativefeed.backend.content.entity.ContentItem;
import com.narrativefeed.backend.narratives.entity.Narrative;
import com.narrativefeed.backend.narratives.repository.NarrativeLinkRepository;
import com.narrativefeed.backend.narratives.repository.NarrativeRepository;
import com.narrativefeed.backend.sentiment.Sentiment;
import com.narrativefeed.backend.sentiment.SentimentClassifier;
import com.narrativefeed.backend.sentiment.dto.SentimentStats;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps each narrative's computed sentiment in line with its linked content and manages manual overrides.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NarrativeSentimentService {

    private final NarrativeRepository narrativeRepository;
    private final NarrativeLinkRepository linkRepository;
    private final ContentItemRepository contentItemRepository;
    private final SentimentClassifier sentimentClassifier;
    private final Clock clock;

    /**
     * Recompute from title (twice), summary and every linked item's title and body
     */
    @Transactional
    public Sentiment recompute(Long narrativeId) {
        Narrative narrative = narrativeRepository.findById(narrativeId)
                .orElseThrow(() -> new NarrativeNotFoundException(narrativeId));

        List<ContentItem> items = contentItemRepository.findByIdIn(linkRepository.findItemIdsByNarrativeId(narrativeId));
        StringBuilder text = new StringBuilder(narrative.getSummary() != null ? narrative.getSummary() : "");
        items.stream()
                .sorted(Comparator.comparing(ContentItem::getId))
                .forEach(item -> text.append(' ').append(item.getTitle()).append(' ').append(item.getBody()));

        Sentiment sentiment = sentimentClassifier.classifyNarrative(narrative.getTitle(), text.toString());
        if (sentiment != narrative.getSentiment()) {
            log.debug("Narrative {} sentiment {} -> {}", narrativeId, narrative.getSentiment(), sentiment);
            narrative.setSentiment(sentiment);
            narrative.setUpdatedAt(LocalDateTime.now(clock));
            narrativeRepository.save(narrative);
        }
        return sentiment;
    }

    public BatchResult recomputeAll(Collection<Long> narrativeIds) {
        BatchResult result = BatchResult.empty();
        for (Long narrativeId : narrativeIds) {
            try {
                recompute(narrativeId);
                result.success(String.valueOf(narrativeId));
            } catch (Exception e) {
                log.error("❌ Sentiment recompute failed for narrative {}: {}", narrativeId, e.getMessage());
                result.failure(String.valueOf(narrativeId), e.getMessage());
            }
        }
        return result;
    }

    public BatchResult recalculateAll() {
        List<Long> ids = narrativeRepository.findAllIds();
        log.info("🎭 Recalculating sentiment for {} narratives", ids.size());
        BatchResult result = recomputeAll(ids);
        log.info("✅ Sentiment recalculated: {} succeeded, {} failed", result.getSucceededCount(), result.getFailedCount());
        return result;
    }

    /**
     * Set or clear (null) the manual label. The computed label is kept either way.
     */
    @Transactional
    public Narrative setOverride(Long narrativeId, Sentiment override) {
        Narrative narrative = narrativeRepository.findById(narrativeId)
                .orElseThrow(() -> new NarrativeNotFoundException(narrativeId));
        narrative.setSentimentOverride(override);
        narrative.setUpdatedAt(LocalDateTime.now(clock));
        log.info("✍️ Narrative {} sentiment override set to {}", narrativeId, override);
        return narrativeRepository.save(narrative);
    }

    /**
     * Distribution of effective sentiment, over narratives created in the last {@code hours} or over all when null
     */
    @Transactional(readOnly = true)
    public SentimentStats stats(Integer hours) {
        if (hours != null) {
            ConfigurationException.requirePositive("hours", hours);
        }
        List<Narrative> narratives = hours == null
                ? narrativeRepository.findAll()
                : narrativeRepository.findByCreatedAtGreaterThanEqual(LocalDateTime.now(clock).minusHours(hours));
        return sentimentClassifier.stats(narratives.stream().map(Narrative::getEffectiveSentiment).toList());
    }
}
