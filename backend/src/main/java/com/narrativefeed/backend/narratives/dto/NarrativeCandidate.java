package com.narrativefeed.backend.narratives.dto;

import com.narrativefeed.backend.extraction.dto.ExtractedEntity;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Value;

/**
 * A proposed narrative from one detection run, before it is merged into storage.
 */
@Value
public class NarrativeCandidate {
    String title;
    String summary;
    List<String> linkedItemIds; // newest first
    List<ExtractedEntity> sharedEntities;
    List<String> sharedKeywords;
    LocalDateTime earliestPublishedAt;
    LocalDateTime latestPublishedAt;
}
