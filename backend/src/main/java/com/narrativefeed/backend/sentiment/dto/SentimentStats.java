package com.narrativefeed.backend.sentiment.dto;

import lombok.Value;

@Value
public class SentimentStats {
    int bullish;
    int bearish;
    int neutral;
    int total;
    int bullishPercent;
    int bearishPercent;
    int neutralPercent;
}
