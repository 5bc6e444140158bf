package com.narrativefeed.backend.extraction;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExtractionConfig {

    @Bean
    public ExtractionVocabulary extractionVocabulary(ExtractionProperties properties) {
        return ExtractionVocabulary.defaultsWith(
                properties.getAdditionalStopWords(),
                properties.getAdditionalGenericTerms(),
                properties.getAdditionalOrganizationIndicators());
    }

    @Bean
    public EntityExtractor entityExtractor(ExtractionVocabulary extractionVocabulary) {
        return new EntityExtractor(extractionVocabulary);
    }
}
