package com.narrativefeed.backend.narratives.controller;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetricsCalculationRequest {
    private List<Long> narrativeIds; // null or empty means every open narrative
    private List<String> periods; // null or empty means both
}
