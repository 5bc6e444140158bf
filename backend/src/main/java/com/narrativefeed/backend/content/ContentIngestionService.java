package com.narrativefeed.backend.content;

import com.narrativefeed.backend.common.dto.BatchResult;
import com.narrativefeed.backend.common.exception.ItemProcessingException;
import com.narrativefeed.backend.common.exception.PersistenceConflictException;
import com.narrativefeed.backend.content.dto.ContentItemDTO;
import com.narrativefeed.backend.content.dto.IngestionResult;
import com.narrativefeed.backend.content.entity.ContentItem;
import com.narrativefeed.backend.content.entity.SourceKind;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Validates and stores content items handed over by upstream providers.
 * Each item is handled on its own: a bad item is reported and the rest of the batch continues.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentIngestionService {

    private static final List<DateTimeFormatter> OFFSET_FORMATTERS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_ZONED_DATE_TIME,
            DateTimeFormatter.RFC_1123_DATE_TIME
    );
    private static final List<DateTimeFormatter> LOCAL_FORMATTERS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
    );

    private final ContentItemRepository contentItemRepository;
    private final ContentTextSanitizer sanitizer;

    public IngestionResult ingest(List<ContentItemDTO> items) {
        BatchResult result = BatchResult.empty();
        List<ContentItem> accepted = new ArrayList<>();
        if (items == null || items.isEmpty()) {
            return new IngestionResult(result, accepted);
        }

        log.info("📥 Ingesting batch of {} content items", items.size());
        Set<String> seenInBatch = new LinkedHashSet<>();

        for (ContentItemDTO dto : items) {
            String itemId = dto != null ? dto.getId() : null;
            try {
                ContentItem candidate = toContentItem(dto);
                if (!seenInBatch.add(candidate.getId())) {
                    log.debug("Skipping repeated id {} within the same batch", candidate.getId());
                    continue;
                }
                accepted.add(store(candidate));
                result.success(candidate.getId());
            } catch (ItemProcessingException | PersistenceConflictException e) {
                log.warn("⚠️ Content item {} rejected: {}", itemId, e.getMessage());
                result.failure(itemId, e.getMessage());
            } catch (Exception e) {
                log.error("❌ Error storing content item {}: {}", itemId, e.getMessage());
                result.failure(itemId, e.getMessage());
            }
        }

        log.info("📊 Ingestion complete: {} accepted, {} rejected", result.getSucceededCount(), result.getFailedCount());
        return new IngestionResult(result, accepted);
    }

    public Optional<ContentItem> findById(String id) {
        return contentItemRepository.findById(id);
    }

    /**
     * Items are immutable: an identical re-submission is accepted as-is, a different one is a conflict.
     * The insert never overwrites, so a concurrent writer of the same id is caught by the primary key.
     */
    private ContentItem store(ContentItem candidate) {
        Optional<ContentItem> existing = contentItemRepository.findById(candidate.getId());
        if (existing.isPresent()) {
            return resolveExisting(existing.get(), candidate);
        }
        try {
            return contentItemRepository.save(candidate);
        } catch (DataIntegrityViolationException e) {
            log.debug("Content item {} was inserted concurrently", candidate.getId());
            return contentItemRepository.findById(candidate.getId())
                    .map(stored -> resolveExisting(stored, candidate))
                    .orElseThrow(() -> new PersistenceConflictException(
                            "Content item " + candidate.getId() + " could not be stored", e));
        }
    }

    private ContentItem resolveExisting(ContentItem stored, ContentItem candidate) {
        if (stored.sameContentAs(candidate)) {
            log.debug("Content item {} already stored with identical content", candidate.getId());
            return stored;
        }
        throw new PersistenceConflictException(
                "Content item " + candidate.getId() + " already exists with different content");
    }

    ContentItem toContentItem(ContentItemDTO dto) {
        if (dto == null) {
            throw new ItemProcessingException(null, "Content item cannot be null");
        }
        String id = dto.getId() != null ? dto.getId().trim() : "";
        if (id.isEmpty()) {
            throw new ItemProcessingException(null, "Content item id cannot be null or empty");
        }
        String title = sanitizer.toPlainText(dto.getTitle());
        String body = sanitizer.toPlainText(dto.getBody());
        if (title.isEmpty() && body.isEmpty()) {
            throw new ItemProcessingException(id, "Content item has neither title nor body");
        }

        SourceKind kind;
        try {
            kind = dto.getSourceKind() == null || dto.getSourceKind().isBlank()
                    ? SourceKind.ARTICLE
                    : SourceKind.fromCode(dto.getSourceKind());
        } catch (IllegalArgumentException e) {
            throw new ItemProcessingException(id, e.getMessage(), e);
        }

        return ContentItem.builder()
                .id(id)
                .title(title)
                .body(body)
                .publishedAt(parsePublishedAt(id, dto.getPublishedAt()))
                .sourceKind(kind)
                .author(blankToNull(dto.getAuthor()))
                .sourceName(blankToNull(dto.getSourceName()))
                .url(blankToNull(dto.getUrl()))
                .build();
    }

    /**
     * Parses provider timestamps into UTC wall-clock time. Offsets are honored; bare local times are taken as UTC.
     */
    static LocalDateTime parsePublishedAt(String itemId, String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new ItemProcessingException(itemId, "publishedAt is required");
        }
        String value = raw.trim();

        for (DateTimeFormatter formatter : OFFSET_FORMATTERS) {
            try {
                return ZonedDateTime.parse(value, formatter)
                        .withZoneSameInstant(ZoneOffset.UTC)
                        .toLocalDateTime();
            } catch (DateTimeParseException e) {
                log.trace("publishedAt '{}' is not {}", value, formatter);
            }
        }
        for (DateTimeFormatter formatter : LOCAL_FORMATTERS) {
            try {
                return LocalDateTime.parse(value, formatter);
            } catch (DateTimeParseException e) {
                log.trace("publishedAt '{}' is not {}", value, formatter);
            }
        }
        try {
            return LocalDate.parse(value).atStartOfDay();
        } catch (DateTimeParseException e) {
            log.trace("publishedAt '{}' is not a plain date", value);
        }
        try {
            return OffsetDateTime.ofInstant(Instant.ofEpochMilli(Long.parseLong(value)), ZoneOffset.UTC)
                    .toLocalDateTime();
        } catch (NumberFormatException e) {
            throw new ItemProcessingException(itemId, "Unparseable publishedAt: " + value, e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }
}
