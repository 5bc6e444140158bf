package com.narrativefeed.backend.extraction;

import com.narrativefeed.backend.extraction.dto.ExtractedEntity;
import com.narrativefeed.backend.extraction.entity.ItemEntity;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores the entity set of one item as a full replacement: the previous rows for the item are deleted
 * and the new ones inserted in the same transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ItemEntityWriter {

    private final ItemEntityRepository itemEntityRepository;

    @Transactional
    public int replaceEntities(String itemId, List<ExtractedEntity> entities) {
        int removed = itemEntityRepository.deleteAllForItem(itemId);
        if (!entities.isEmpty()) {
            itemEntityRepository.saveAll(entities.stream()
                    .map(e -> ItemEntity.builder()
                            .itemId(itemId)
                            .text(e.getText())
                            .type(e.getType())
                            .build())
                    .toList());
        }
        log.debug("Replaced entities for item {}: {} removed, {} stored", itemId, removed, entities.size());
        return entities.size();
    }
}
