package com.narrativefeed.backend.narratives.controller;

import com.narrativefeed.backend.narratives.dto.NarrativeDisplayDto;
import com.narrativefeed.backend.narratives.service.NarrativeQueryService;
import com.narrativefeed.backend.pipeline.NarrativePipelineService;
import com.narrativefeed.backend.pipeline.dto.PipelineRunResult;
import com.narrativefeed.backend.sentiment.Sentiment;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/narratives")
@RequiredArgsConstructor
public class NarrativeController {

    private final NarrativeQueryService queryService;
    private final NarrativePipelineService pipelineService;

    /**
     * Narratives with pagination, optional sentiment filter, sorted by recent activity or velocity
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> getNarratives(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @RequestParam(required = false) String sentiment,
            @RequestParam(defaultValue = "recent") String sort) {
        Sentiment filter = sentiment != null ? Sentiment.fromCode(sentiment) : null;
        return ResponseEntity.ok(queryService.list(page, size, filter, sort));
    }

    @GetMapping("/{id}")
    public ResponseEntity<NarrativeDisplayDto> getNarrative(@PathVariable Long id) {
        return ResponseEntity.ok(queryService.get(id));
    }

    /**
     * Run detection, merge and metrics over the current window
     */
    @PostMapping("/detect")
    public ResponseEntity<Map<String, Object>> detect() {
        log.info("🚀 Manual narrative detection requested");
        PipelineRunResult result = pipelineService.rebuild();
        return ResponseEntity.ok(Map.of(
                "result", result,
                "status", result.isDetectionSkipped() ? "SKIPPED" : "COMPLETED",
                "timestamp", System.currentTimeMillis()
        ));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(queryService.stats());
    }
}
