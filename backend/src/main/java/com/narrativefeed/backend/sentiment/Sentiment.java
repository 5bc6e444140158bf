package com.narrativefeed.backend.sentiment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum Sentiment {
    BULLISH("bullish"),
    BEARISH("bearish"),
    NEUTRAL("neutral");

    @JsonValue
    private final String code;

    @JsonCreator
    public static Sentiment fromCode(String code) {
        if (code == null) throw new IllegalArgumentException("code cannot be null");
        for (Sentiment sentiment : values()) {
            if (sentiment.code.equalsIgnoreCase(code.trim())) {
                return sentiment;
            }
        }
        throw new IllegalArgumentException("Code " + code + " is not a valid Sentiment");
    }
}
