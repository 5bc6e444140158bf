package com.narrativefeed.backend.content.dto;

import com.narrativefeed.backend.common.dto.BatchResult;
import com.narrativefeed.backend.content.entity.ContentItem;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class IngestionResult {
    private BatchResult result;
    // Newly stored items plus identical re-submissions, in request order
    private List<ContentItem> acceptedItems;
}
