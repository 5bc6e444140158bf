package com.narrativefeed.backend.extraction.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Entity kinds in clustering seed order. Keywords never seed a cluster.
 */
@Getter
@AllArgsConstructor
public enum EntityType {
    TICKER("ticker", 0),
    PERSON("person", 1),
    ORGANIZATION("org", 2),
    KEYWORD("keyword", 3);

    private final String code;
    private final int priority;

    public boolean isSignificant() {
        return this != KEYWORD;
    }

    public static EntityType fromCode(String code) {
        if (code == null) throw new IllegalArgumentException("code cannot be null");
        for (EntityType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Code " + code + " is not a valid EntityType");
    }
}
