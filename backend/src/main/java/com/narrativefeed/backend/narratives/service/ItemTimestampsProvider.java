package com.narrativefeed.backend.narratives.service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Publication times of the items linked to a narrative.
 */
@FunctionalInterface
public interface ItemTimestampsProvider {
    List<LocalDateTime> publishedTimesFor(Long narrativeId);
}
