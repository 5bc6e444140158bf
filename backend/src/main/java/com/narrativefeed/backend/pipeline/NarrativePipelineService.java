package com.narrativefeed.backend.pipeline;

import com.narrativefeed.backend.common.dto.BatchResult;
import com.narrativefeed.backend.common.exception.PersistenceConflictException;
import com.narrativefeed.backend.content.ContentIngestionService;
import com.narrativefeed.backend.content.ContentItemRepository;
import com.narrativefeed.backend.content.dto.ContentItemDTO;
import com.narrativefeed.backend.content.dto.IngestionResult;
import com.narrativefeed.backend.content.entity.ContentItem;
import com.narrativefeed.backend.extraction.EntityExtractionService;
import com.narrativefeed.backend.extraction.dto.ExtractedEntity;
import com.narrativefeed.backend.narratives.DetectionProperties;
import com.narrativefeed.backend.narratives.MetricsProperties;
import com.narrativefeed.backend.narratives.dto.ContentSnapshot;
import com.narrativefeed.backend.narratives.dto.DetectionConfig;
import com.narrativefeed.backend.narratives.dto.MergeOutcome;
import com.narrativefeed.backend.narratives.dto.NarrativeCandidate;
import com.narrativefeed.backend.narratives.service.NarrativeClusterer;
import com.narrativefeed.backend.narratives.service.NarrativeMergeService;
import com.narrativefeed.backend.narratives.service.NarrativeMetricsService;
import com.narrativefeed.backend.narratives.service.NarrativeSentimentService;
import com.narrativefeed.backend.pipeline.dto.PipelineRunResult;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives one pass from new content to narratives: extract, detect, merge, re-score sentiment, refresh metrics.
 * <p>
 * Detection through sentiment is single-writer. A run that finds another one in progress skips those
 * steps and says so in its result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NarrativePipelineService {

    private final ContentIngestionService ingestionService;
    private final ContentItemRepository contentItemRepository;
    private final EntityExtractionService extractionService;
    private final NarrativeClusterer clusterer;
    private final NarrativeMergeService mergeService;
    private final NarrativeSentimentService sentimentService;
    private final NarrativeMetricsService metricsService;
    private final DetectionProperties detectionProperties;
    private final MetricsProperties metricsProperties;
    private final PipelineProperties pipelineProperties;
    private final Clock clock;

    private final ReentrantLock detectionLock = new ReentrantLock();

    /**
     * Ingest raw items, then run the pipeline over the ones accepted
     */
    public PipelineRunResult ingestAndProcess(List<ContentItemDTO> items) {
        IngestionResult ingestion = ingestionService.ingest(items);
        PipelineRunResult result = process(ingestion.getAcceptedItems());
        result.setIngestion(ingestion.getResult());
        return result;
    }

    public PipelineRunResult process(List<ContentItem> newItems) {
        if (newItems == null) {
            throw new IllegalArgumentException("newItems cannot be null");
        }
        long start = System.currentTimeMillis();
        DetectionConfig config = detectionProperties.toConfig().validate();
        PipelineRunResult result = new PipelineRunResult();

        log.info("🚀 Pipeline run started with {} new items", newItems.size());
        log.info("📍 Step 1: Entity extraction");
        result.setExtraction(extractionService.extractBatch(newItems));

        runDetection(config, result);
        runMetrics(result);

        result.setDurationMs(System.currentTimeMillis() - start);
        log.info("🎉 Pipeline run finished in {} ms: {} candidates, {} created, {} extended",
                result.getDurationMs(), result.getCandidatesDetected(),
                result.getNarrativesCreated(), result.getNarrativesExtended());
        return result;
    }

    /**
     * Detection, merge and metrics over the current window without new content
     */
    public PipelineRunResult rebuild() {
        return process(List.of());
    }

    public BatchResult recalculateAllSentiment() {
        detectionLock.lock();
        try {
            return sentimentService.recalculateAll();
        } finally {
            detectionLock.unlock();
        }
    }

    /**
     * Candidates for the current window without persisting anything
     */
    public List<NarrativeCandidate> detectCandidates() {
        return clusterer.detect(loadWindowSnapshots(detectionProperties.getWindowHours()),
                detectionProperties.toConfig());
    }

    private void runDetection(DetectionConfig config, PipelineRunResult result) {
        if (!detectionLock.tryLock()) {
            log.warn("⏳ Another pipeline run holds the detection lock, skipping detection");
            result.setDetectionSkipped(true);
            return;
        }
        try {
            log.info("📍 Step 2: Narrative detection over the last {} hours", config.getWindowHours());
            List<NarrativeCandidate> candidates = clusterer.detect(loadWindowSnapshots(config.getWindowHours()), config);
            result.setCandidatesDetected(candidates.size());

            log.info("📍 Step 3: Merging {} candidates", candidates.size());
            Set<Long> changed = new LinkedHashSet<>();
            BatchResult merge = result.getMerge();
            for (NarrativeCandidate candidate : candidates) {
                try {
                    MergeOutcome outcome = mergeWithRetry(candidate);
                    merge.success(candidate.getTitle());
                    if (outcome.isCreated()) {
                        result.setNarrativesCreated(result.getNarrativesCreated() + 1);
                    } else if (outcome.getLinksAdded() > 0) {
                        result.setNarrativesExtended(result.getNarrativesExtended() + 1);
                    }
                    if (outcome.isLinkSetChanged()) {
                        changed.add(outcome.getNarrativeId());
                    }
                } catch (Exception e) {
                    log.error("❌ Merging \"{}\" failed: {}", candidate.getTitle(), e.getMessage());
                    merge.failure(candidate.getTitle(), e.getMessage());
                }
            }
            result.getChangedNarrativeIds().addAll(changed);

            log.info("📍 Step 4: Sentiment for {} changed narratives", changed.size());
            result.setSentiment(sentimentService.recomputeAll(changed));
        } finally {
            detectionLock.unlock();
        }
    }

    /**
     * A link written concurrently by another instance rolls the merge back; the second attempt
     * sees that link as already present.
     */
    private MergeOutcome mergeWithRetry(NarrativeCandidate candidate) {
        try {
            return mergeService.merge(candidate);
        } catch (PersistenceConflictException e) {
            log.warn("🔁 Merging \"{}\" hit a concurrent write, retrying once: {}", candidate.getTitle(), e.getMessage());
            return mergeService.merge(candidate);
        }
    }

    private void runMetrics(PipelineRunResult result) {
        if (!metricsProperties.isEnabled() || !pipelineProperties.isMetricsOnProcess()) {
            log.debug("Metrics step disabled");
            return;
        }
        log.info("📍 Step 5: Metrics");
        result.setMetrics(metricsService.updateAllActive());
    }

    private List<ContentSnapshot> loadWindowSnapshots(int windowHours) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<ContentItem> items = contentItemRepository
                .findByPublishedAtGreaterThanEqualOrderByPublishedAtDesc(now.minusHours(windowHours)).stream()
                .filter(item -> !item.getPublishedAt().isAfter(now))
                .toList();
        if (items.isEmpty()) {
            return List.of();
        }
        Map<String, Set<ExtractedEntity>> entities = extractionService.loadEntitiesByItem(
                items.stream().map(ContentItem::getId).toList());
        log.debug("Window holds {} items", items.size());
        return items.stream()
                .map(item -> new ContentSnapshot(item.getId(), item.getPublishedAt(), entities.get(item.getId())))
                .toList();
    }
}
