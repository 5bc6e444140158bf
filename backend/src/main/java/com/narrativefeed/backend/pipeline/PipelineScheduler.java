package com.narrativefeed.backend.pipeline;

import com.narrativefeed.backend.narratives.MetricsProperties;
import com.narrativefeed.backend.narratives.service.NarrativeMetricsService;
import com.narrativefeed.backend.pipeline.dto.PipelineRunResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic narrative rebuild and metric retention.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineScheduler {

    private final NarrativePipelineService pipelineService;
    private final NarrativeMetricsService metricsService;
    private final MetricsProperties metricsProperties;

    @Value("${narrative.pipeline.scheduled-rebuild:true}")
    private boolean scheduledRebuild;

    @Value("${narrative.pipeline.scheduled-cleanup:true}")
    private boolean scheduledCleanup;

    @Scheduled(fixedRateString = "${narrative.pipeline.rebuild-interval-ms:900000}",
            initialDelayString = "${narrative.pipeline.rebuild-initial-delay-ms:60000}")
    public void scheduledRebuild() {
        if (!scheduledRebuild) {
            return;
        }
        log.info("⏰ Scheduled narrative rebuild starting");
        try {
            PipelineRunResult result = pipelineService.rebuild();
            log.info("✅ Scheduled rebuild done: {} candidates, {} created, {} extended",
                    result.getCandidatesDetected(), result.getNarrativesCreated(), result.getNarrativesExtended());
        } catch (Exception e) {
            log.error("❌ Scheduled rebuild failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${narrative.pipeline.cleanup-cron:0 30 3 * * *}", zone = "UTC")
    public void scheduledCleanup() {
        if (!scheduledCleanup) {
            return;
        }
        try {
            metricsService.cleanupOldMetrics(metricsProperties.getRetentionDays());
        } catch (Exception e) {
            log.error("❌ Metric retention cleanup failed: {}", e.getMessage(), e);
        }
    }
}
