package com.narrativefeed.backend.content.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw provider payload. Checked item by item during ingestion so one bad item does not reject the batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentItemDTO {
    private String id;
    private String title;
    private String body;
    private String publishedAt;
    private String sourceKind;
    private String author;
    private String sourceName;
    private String url;
}
