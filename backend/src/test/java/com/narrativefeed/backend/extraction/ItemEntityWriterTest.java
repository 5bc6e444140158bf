package com.narrativefeed.backend.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.narrativefeed.backend.extraction.dto.ExtractedEntity;
import com.narrativefeed.backend.extraction.entity.EntityType;
import com.narrativefeed.backend.extraction.entity.ItemEntity;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import(ItemEntityWriter.class)
class ItemEntityWriterTest {

    private final EntityExtractor extractor = new EntityExtractor(ExtractionVocabulary.defaults());

    @Autowired
    ItemEntityWriter writer;

    @Autowired
    ItemEntityRepository repository;

    @Test
    @DisplayName("extracting the same item twice leaves one copy of its entities")
    void reExtractionIsIdempotent() {
        List<ExtractedEntity> entities = extractor.extract("$NVDA climbs as Jensen Huang speaks", "accelerator orders", 10);

        writer.replaceEntities("item-1", entities);
        List<ItemEntity> first = repository.findByItemIdOrderByTypeAscTextAsc("item-1");
        writer.replaceEntities("item-1", extractor.extract("$NVDA climbs as Jensen Huang speaks", "accelerator orders", 10));
        List<ItemEntity> second = repository.findByItemIdOrderByTypeAscTextAsc("item-1");

        assertThat(second).hasSameSizeAs(entities);
        assertThat(second).extracting(ItemEntity::getText, ItemEntity::getType)
                .containsExactlyElementsOf(first.stream()
                        .map(e -> tuple(e.getText(), e.getType()))
                        .toList());
    }

    @Test
    @DisplayName("a new extraction replaces the previous set")
    void replacesPreviousSet() {
        writer.replaceEntities("item-2", List.of(ExtractedEntity.of("$TSLA", EntityType.TICKER)));
        writer.replaceEntities("item-2", List.of(ExtractedEntity.of("$AAPL", EntityType.TICKER),
                ExtractedEntity.of("orders", EntityType.KEYWORD)));

        assertThat(repository.findByItemIdOrderByTypeAscTextAsc("item-2"))
                .extracting(ItemEntity::getText)
                .containsExactlyInAnyOrder("$AAPL", "orders");
    }

    @Test
    @DisplayName("other items are untouched")
    void otherItemsUntouched() {
        writer.replaceEntities("item-3", List.of(ExtractedEntity.of("$AMD", EntityType.TICKER)));
        writer.replaceEntities("item-4", List.of(ExtractedEntity.of("$AMD", EntityType.TICKER)));
        writer.replaceEntities("item-3", List.of());

        assertThat(repository.findByItemIdOrderByTypeAscTextAsc("item-3")).isEmpty();
        assertThat(repository.findItemIdsByText("$AMD")).containsExactly("item-4");
    }
}
