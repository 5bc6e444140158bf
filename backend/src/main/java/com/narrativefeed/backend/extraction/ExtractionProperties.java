package com.narrativefeed.backend.extraction;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "narrative.extraction")
public class ExtractionProperties {

    private int maxKeywords = 10;

    // Parallel workers for per-item extraction
    private int workerThreads = 4;

    // Added on top of the built-in lists
    private List<String> additionalStopWords = new ArrayList<>();
    private List<String> additionalGenericTerms = new ArrayList<>();
    private List<String> additionalOrganizationIndicators = new ArrayList<>();
}
