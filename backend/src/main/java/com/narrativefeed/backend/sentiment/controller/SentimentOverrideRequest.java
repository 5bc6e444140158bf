package com.narrativefeed.backend.sentiment.controller;

import com.narrativefeed.backend.sentiment.Sentiment;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SentimentOverrideRequest {
    private Sentiment sentiment; // null clears the override
}
