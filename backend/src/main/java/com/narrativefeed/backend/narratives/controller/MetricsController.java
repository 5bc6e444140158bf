package com.narrativefeed.backend.narratives.controller;

import com.narrativefeed.backend.narratives.dto.MetricSnapshotDto;
import com.narrativefeed.backend.narratives.dto.MetricsUpdateResult;
import com.narrativefeed.backend.narratives.entity.MetricPeriod;
import com.narrativefeed.backend.narratives.service.NarrativeMetricsService;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final NarrativeMetricsService metricsService;

    @PostMapping("/calculate")
    public ResponseEntity<MetricsUpdateResult> calculate(@RequestBody(required = false) MetricsCalculationRequest request) {
        boolean allNarratives = request == null || request.getNarrativeIds() == null || request.getNarrativeIds().isEmpty();
        List<MetricPeriod> periods = request == null || request.getPeriods() == null || request.getPeriods().isEmpty()
                ? List.of(MetricPeriod.values())
                : request.getPeriods().stream().map(MetricPeriod::fromCode).toList();

        log.info("🚀 Metrics calculation requested for {}", allNarratives ? "all open narratives" : request.getNarrativeIds());
        MetricsUpdateResult result = allNarratives
                ? metricsService.updateAllActive(periods)
                : metricsService.updateAll(request.getNarrativeIds(), periods);
        return ResponseEntity.ok(result);
    }

    /**
     * Latest snapshot per period plus recent history
     */
    @GetMapping("/{narrativeId}")
    public ResponseEntity<Map<String, Object>> getMetrics(@PathVariable Long narrativeId) {
        return ResponseEntity.ok(Map.of(
                "narrativeId", narrativeId,
                "latest", metricsService.getLatestMetrics(narrativeId),
                "history", metricsService.getHistory(narrativeId)
        ));
    }

    @GetMapping("/trending")
    public ResponseEntity<List<MetricSnapshotDto>> getTrending(
            @RequestParam(defaultValue = "24h") String period,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(metricsService.getTrending(MetricPeriod.fromCode(period), limit));
    }

    @GetMapping("/most-mentioned")
    public ResponseEntity<List<MetricSnapshotDto>> getMostMentioned(
            @RequestParam(defaultValue = "24h") String period,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(metricsService.getMostMentioned(MetricPeriod.fromCode(period), limit));
    }

    @DeleteMapping("/cleanup")
    public ResponseEntity<Map<String, Object>> cleanup(@RequestParam(defaultValue = "7") int daysOld) {
        int deleted = metricsService.cleanupOldMetrics(daysOld);
        return ResponseEntity.ok(Map.of(
                "deleted", deleted,
                "daysOld", daysOld,
                "timestamp", System.currentTimeMillis()
        ));
    }
}
