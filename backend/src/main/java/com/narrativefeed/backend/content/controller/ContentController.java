package com.narrativefeed.backend.content.controller;

import com.narrativefeed.backend.content.ContentIngestionService;
import com.narrativefeed.backend.content.dto.ContentItemDTO;
import com.narrativefeed.backend.pipeline.NarrativePipelineService;
import com.narrativefeed.backend.pipeline.dto.PipelineRunResult;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/content")
@RequiredArgsConstructor
public class ContentController {

    private final ContentIngestionService ingestionService;
    private final NarrativePipelineService pipelineService;

    /**
     * Ingest a batch and run the pipeline over the accepted items
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> ingest(@RequestBody List<ContentItemDTO> items) {
        log.info("📥 Received {} content items", items.size());
        PipelineRunResult result = pipelineService.ingestAndProcess(items);

        return ResponseEntity.ok(Map.of(
                "accepted", result.getIngestion().getSucceededCount(),
                "rejected", result.getIngestion().getFailed(),
                "pipeline", result,
                "timestamp", System.currentTimeMillis()
        ));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getItem(@PathVariable String id) {
        return ingestionService.findById(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                        "error", "Content item not found",
                        "message", "No content item with id " + id,
                        "timestamp", System.currentTimeMillis()
                )));
    }
}
