package com.narrativefeed.backend.narratives.dto;

import com.narrativefeed.backend.extraction.dto.ExtractedEntity;
import java.time.LocalDateTime;
import java.util.Set;
import lombok.Value;

/**
 * An item as the clusterer sees it: id, timing and its stored entities.
 */
@Value
public class ContentSnapshot {
    String itemId;
    LocalDateTime publishedAt;
    Set<ExtractedEntity> entities;
}
