package com.narrativefeed.backend.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.narrativefeed.backend.common.dto.BatchFailure;
import com.narrativefeed.backend.common.dto.BatchResult;
import com.narrativefeed.backend.content.entity.ContentItem;
import com.narrativefeed.backend.content.entity.SourceKind;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class EntityExtractionServiceTest {

    @Mock
    ItemEntityWriter writer;

    @Mock
    ItemEntityRepository repository;

    ExecutorService executor;

    EntityExtractionService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        service = new EntityExtractionService(new EntityExtractor(ExtractionVocabulary.defaults()),
                writer, repository, new ExtractionProperties(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ContentItem item(String id, String title) {
        return ContentItem.builder()
                .id(id)
                .title(title)
                .body("")
                .publishedAt(LocalDateTime.of(2026, 3, 10, 9, 0))
                .sourceKind(SourceKind.ARTICLE)
                .build();
    }

    @Test
    @DisplayName("a failing item is reported and the rest of the batch is still stored")
    void failingItemIsolated() {
        when(writer.replaceEntities(eq("nvda-2"), anyList()))
                .thenThrow(new DataIntegrityViolationException("value too long"));

        BatchResult result = service.extractBatch(List.of(
                item("nvda-1", "$NVDA rallies as Jensen Huang speaks"),
                item("nvda-2", "$NVDA slips"),
                item("nvda-3", "Jensen Huang lifts $NVDA outlook")));

        assertThat(result.getSucceeded()).containsExactlyInAnyOrder("nvda-1", "nvda-3");
        assertThat(result.getFailed()).extracting(BatchFailure::getId).containsExactly("nvda-2");
        assertThat(result.getFailed().get(0).getReason()).contains("value too long");
        verify(writer).replaceEntities(eq("nvda-1"), anyList());
        verify(writer).replaceEntities(eq("nvda-3"), anyList());
    }

    @Test
    @DisplayName("an empty batch does no work")
    void emptyBatch() {
        BatchResult result = service.extractBatch(List.of());

        assertThat(result.getSucceededCount()).isZero();
        assertThat(result.hasFailures()).isFalse();
    }
}
