package com.narrativefeed.backend.sentiment.controller;

import com.narrativefeed.backend.common.dto.BatchResult;
import com.narrativefeed.backend.narratives.entity.Narrative;
import com.narrativefeed.backend.narratives.service.NarrativeSentimentService;
import com.narrativefeed.backend.pipeline.NarrativePipelineService;
import com.narrativefeed.backend.sentiment.SentimentClassifier;
import com.narrativefeed.backend.sentiment.dto.SentimentExplanation;
import com.narrativefeed.backend.sentiment.dto.SentimentStats;
import jakarta.validation.Valid;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/sentiment")
@RequiredArgsConstructor
public class SentimentController {

    private final SentimentClassifier sentimentClassifier;
    private final NarrativeSentimentService narrativeSentimentService;
    private final NarrativePipelineService pipelineService;

    @PostMapping("/classify")
    public ResponseEntity<Map<String, Object>> classify(@Valid @RequestBody TextRequest request) {
        return ResponseEntity.ok(Map.of("sentiment", sentimentClassifier.classify(request.getText())));
    }

    @PostMapping("/explain")
    public ResponseEntity<SentimentExplanation> explain(@Valid @RequestBody TextRequest request) {
        return ResponseEntity.ok(sentimentClassifier.explain(request.getText()));
    }

    /**
     * Effective sentiment distribution, optionally limited to narratives from the last {@code hours}
     */
    @GetMapping("/stats")
    public ResponseEntity<SentimentStats> getStats(@RequestParam(required = false) Integer hours) {
        return ResponseEntity.ok(narrativeSentimentService.stats(hours));
    }

    @PatchMapping("/narratives/{id}")
    public ResponseEntity<Map<String, Object>> overrideSentiment(@PathVariable Long id,
                                                                 @RequestBody SentimentOverrideRequest request) {
        Narrative narrative = narrativeSentimentService.setOverride(id, request.getSentiment());

        // HashMap because the override may be null
        Map<String, Object> body = new HashMap<>();
        body.put("narrativeId", narrative.getId());
        body.put("sentiment", narrative.getEffectiveSentiment());
        body.put("computedSentiment", narrative.getSentiment());
        body.put("sentimentOverride", narrative.getSentimentOverride());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/narratives/recalculate")
    public ResponseEntity<Map<String, Object>> recalculateAll() {
        log.info("🚀 Recalculating sentiment for all narratives");
        BatchResult result = pipelineService.recalculateAllSentiment();
        return ResponseEntity.ok(Map.of(
                "updated", result.getSucceededCount(),
                "failed", result.getFailed(),
                "status", "COMPLETED",
                "timestamp", System.currentTimeMillis()
        ));
    }
}
