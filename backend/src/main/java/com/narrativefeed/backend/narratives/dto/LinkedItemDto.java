package com.narrativefeed.backend.narratives.dto;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LinkedItemDto {
    private String id;
    private String title;
    private String sourceKind;
    private String sourceName;
    private String author;
    private String url;
    private LocalDateTime publishedAt;
}
