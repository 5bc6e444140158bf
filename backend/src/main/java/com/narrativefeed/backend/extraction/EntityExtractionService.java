package com.narrativefeed.backend.extraction;

import com.narrativefeed.backend.common.dto.BatchResult;
import com.narrativefeed.backend.common.exception.ConfigurationException;
import com.narrativefeed.backend.content.entity.ContentItem;
import com.narrativefeed.backend.extraction.dto.ExtractedEntity;
import com.narrativefeed.backend.extraction.entity.EntityType;
import com.narrativefeed.backend.extraction.entity.ItemEntity;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Runs the extractor over stored content items and persists the results.
 * Extraction of different items runs in parallel; writes for the same item id are serialized.
 */
@Slf4j
@Service
public class EntityExtractionService {

    private static final int LOCK_STRIPES = 64;

    private final EntityExtractor entityExtractor;
    private final ItemEntityWriter itemEntityWriter;
    private final ItemEntityRepository itemEntityRepository;
    private final ExtractionProperties properties;
    private final Executor extractionTaskExecutor;
    private final Object[] itemLocks = new Object[LOCK_STRIPES];

    public EntityExtractionService(EntityExtractor entityExtractor,
                                   ItemEntityWriter itemEntityWriter,
                                   ItemEntityRepository itemEntityRepository,
                                   ExtractionProperties properties,
                                   @Qualifier("extractionTaskExecutor") Executor extractionTaskExecutor) {
        this.entityExtractor = entityExtractor;
        this.itemEntityWriter = itemEntityWriter;
        this.itemEntityRepository = itemEntityRepository;
        this.properties = properties;
        this.extractionTaskExecutor = extractionTaskExecutor;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            itemLocks[i] = new Object();
        }
    }

    /**
     * Extract and store the entities of one item, replacing whatever was stored for it before
     */
    public List<ExtractedEntity> extractAndStore(ContentItem item) {
        List<ExtractedEntity> entities = entityExtractor.extract(
                item.getTitle(), item.getBody(), properties.getMaxKeywords());
        synchronized (lockFor(item.getId())) {
            itemEntityWriter.replaceEntities(item.getId(), entities);
        }
        return entities;
    }

    /**
     * Extract a batch in parallel. A failing item is reported and does not stop the others.
     */
    public BatchResult extractBatch(List<ContentItem> items) {
        BatchResult result = BatchResult.empty();
        if (items == null || items.isEmpty()) {
            return result;
        }
        log.info("🔍 Extracting entities for {} items", items.size());

        List<CompletableFuture<Void>> futures = items.stream()
                .map(item -> CompletableFuture.runAsync(() -> {
                    try {
                        List<ExtractedEntity> entities = extractAndStore(item);
                        result.success(item.getId());
                        log.debug("Item {} -> {} entities", item.getId(), entities.size());
                    } catch (Exception e) {
                        log.error("❌ Entity extraction failed for item {}: {}", item.getId(), e.getMessage());
                        result.failure(item.getId(), e.getMessage());
                    }
                }, extractionTaskExecutor))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        log.info("✅ Entity extraction complete: {} succeeded, {} failed",
                result.getSucceededCount(), result.getFailedCount());
        return result;
    }

    /**
     * Extract without storing anything
     */
    public List<ExtractedEntity> preview(String title, String body, Integer maxKeywords) {
        return entityExtractor.extract(title, body, maxKeywords != null ? maxKeywords : properties.getMaxKeywords());
    }

    public List<ItemEntity> getEntitiesForItem(String itemId) {
        return itemEntityRepository.findByItemIdOrderByTypeAscTextAsc(itemId);
    }

    /**
     * Stored entities grouped per item id, for every id given (items without entities map to an empty set)
     */
    public Map<String, Set<ExtractedEntity>> loadEntitiesByItem(Collection<String> itemIds) {
        Map<String, Set<ExtractedEntity>> byItem = new LinkedHashMap<>();
        itemIds.forEach(id -> byItem.put(id, new LinkedHashSet<>()));
        if (itemIds.isEmpty()) {
            return byItem;
        }
        for (ItemEntity entity : itemEntityRepository.findByItemIdIn(itemIds)) {
            byItem.computeIfAbsent(entity.getItemId(), k -> new LinkedHashSet<>())
                    .add(ExtractedEntity.of(entity.getText(), entity.getType()));
        }
        return byItem;
    }

    public List<Map<String, Object>> getTopEntities(EntityType type, int limit) {
        ConfigurationException.requirePositive("limit", limit);
        return itemEntityRepository.countByTextForType(type, PageRequest.of(0, limit)).stream()
                .map(row -> Map.<String, Object>of(
                        type.getCode(), row[0],
                        "count", row[1]))
                .toList();
    }

    public Map<String, Object> getEntityStats() {
        Map<String, Long> byType = new LinkedHashMap<>();
        for (EntityType type : EntityType.values()) {
            byType.put(type.getCode(), 0L);
        }
        long total = 0;
        for (Object[] row : itemEntityRepository.countByType()) {
            long count = ((Number) row[1]).longValue();
            byType.put(((EntityType) row[0]).getCode(), count);
            total += count;
        }
        return Map.of("total", total, "byType", byType);
    }

    public List<String> findItemIdsByEntity(String text) {
        return itemEntityRepository.findItemIdsByText(text);
    }

    private Object lockFor(String itemId) {
        return itemLocks[Math.floorMod(itemId.hashCode(), LOCK_STRIPES)];
    }
}
