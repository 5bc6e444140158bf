package com.narrativefeed.backend.extraction.controller;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionRequest {
    private String title;
    private String body;
    @PositiveOrZero
    private Integer maxKeywords;
}
