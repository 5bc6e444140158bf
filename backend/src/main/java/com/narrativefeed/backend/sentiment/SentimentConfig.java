package com.narrativefeed.backend.sentiment;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SentimentConfig {

    @Bean
    public SentimentLexicon sentimentLexicon() {
        return SentimentLexicon.defaults();
    }

    @Bean
    public SentimentClassifier sentimentClassifier(SentimentLexicon sentimentLexicon) {
        return new SentimentClassifier(sentimentLexicon);
    }
}
