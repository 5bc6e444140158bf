package com.narrativefeed.backend.narratives.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The two comparable window sizes. Their lengths come from configuration; the codes are labels.
 */
@Getter
@AllArgsConstructor
public enum MetricPeriod {
    SHORT("1h"),
    LONG("24h");

    @JsonValue
    private final String code;

    @JsonCreator
    public static MetricPeriod fromCode(String code) {
        if (code == null) throw new IllegalArgumentException("code cannot be null");
        for (MetricPeriod period : values()) {
            if (period.code.equalsIgnoreCase(code.trim()) || period.name().equalsIgnoreCase(code.trim())) {
                return period;
            }
        }
        throw new IllegalArgumentException("Code " + code + " is not a valid MetricPeriod");
    }
}
