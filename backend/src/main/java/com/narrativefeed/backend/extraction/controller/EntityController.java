package com.narrativefeed.backend.extraction.controller;

import com.narrativefeed.backend.extraction.EntityExtractionService;
import com.narrativefeed.backend.extraction.dto.ExtractedEntity;
import com.narrativefeed.backend.extraction.entity.EntityType;
import com.narrativefeed.backend.extraction.entity.ItemEntity;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/entities")
@RequiredArgsConstructor
public class EntityController {

    private final EntityExtractionService extractionService;

    @GetMapping("/{itemId}")
    public ResponseEntity<Map<String, Object>> getEntitiesForItem(@PathVariable String itemId) {
        List<ItemEntity> entities = extractionService.getEntitiesForItem(itemId);
        return ResponseEntity.ok(Map.of(
                "itemId", itemId,
                "entities", entities.stream().map(e -> ExtractedEntity.of(e.getText(), e.getType())).toList(),
                "count", entities.size()
        ));
    }

    /**
     * Ad-hoc extraction, nothing is stored
     */
    @PostMapping("/extract")
    public ResponseEntity<Map<String, Object>> extract(@Valid @RequestBody ExtractionRequest request) {
        List<ExtractedEntity> entities = extractionService.preview(
                request.getTitle(), request.getBody(), request.getMaxKeywords());
        return ResponseEntity.ok(Map.of(
                "entities", entities,
                "count", entities.size()
        ));
    }

    @GetMapping("/tickers")
    public ResponseEntity<List<Map<String, Object>>> getTopTickers(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(extractionService.getTopEntities(EntityType.TICKER, limit));
    }

    @GetMapping("/keywords")
    public ResponseEntity<List<Map<String, Object>>> getTopKeywords(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(extractionService.getTopEntities(EntityType.KEYWORD, limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(extractionService.getEntityStats());
    }

    @GetMapping("/search")
    public ResponseEntity<Map<String, Object>> search(@RequestParam String text) {
        List<String> itemIds = extractionService.findItemIdsByEntity(text);
        return ResponseEntity.ok(Map.of(
                "text", text,
                "itemIds", itemIds,
                "count", itemIds.size()
        ));
    }
}
