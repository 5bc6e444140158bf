package com.narrativefeed.backend.sentiment.dto;

import com.narrativefeed.backend.sentiment.Sentiment;
import java.util.List;
import lombok.Value;

@Value
public class SentimentExplanation {
    Sentiment sentiment;
    // One entry per occurrence, in text order
    List<String> bullishMatches;
    List<String> bearishMatches;
}
